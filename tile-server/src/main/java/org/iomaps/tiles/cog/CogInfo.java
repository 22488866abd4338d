/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.iomaps.tiles.cog;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A summary of a GeoTIFF as served by the info endpoint.  Extents are in WGS84 degrees.
 */
@Data
@AllArgsConstructor
public class CogInfo {
  private double[] bbox;
  private double[] center;
  private Extent bounds;
  private Size size;
  private Size tileSize;
  private double[] resolution;
  private int imageCount;
  private int compression;
  private int photometric;

  @Data
  @AllArgsConstructor
  public static class Extent {
    private double west;
    private double south;
    private double east;
    private double north;
  }

  @Data
  @AllArgsConstructor
  public static class Size {
    private int width;
    private int height;
  }
}
