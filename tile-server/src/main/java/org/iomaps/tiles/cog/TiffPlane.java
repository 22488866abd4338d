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

import org.iomaps.common.projection.Bounds;

import lombok.Builder;
import lombok.Value;

/**
 * One image inside a GeoTIFF: the full resolution image, an overview, or a mask of either.
 * Resolutions are in projected units per pixel and the origin is the north west corner.
 */
@Value
@Builder(toBuilder = true)
public class TiffPlane {
  int index;
  PlaneKind kind;
  int width;
  int height;
  int tileWidth;
  int tileHeight;
  int bitsPerSample;
  int samplesPerPixel;
  int compression;
  int photometric;
  double resolutionX;
  double resolutionY;
  double originX;
  double originY;

  public Bounds bounds() {
    return new Bounds(originX, originY - height * resolutionY, originX + width * resolutionX, originY);
  }

  /**
   * Places this plane on the grid of the full resolution plane, scaling its resolution by the size ratio.
   */
  public TiffPlane alignedTo(TiffPlane base) {
    return toBuilder()
      .originX(base.originX)
      .originY(base.originY)
      .resolutionX(base.resolutionX * base.width / width)
      .resolutionY(base.resolutionY * base.height / height)
      .build();
  }
}
