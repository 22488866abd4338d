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
package org.iomaps.common.projection;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An axis aligned box in unscaled units, either degrees (WGS84) or metres (Web Mercator) depending on its source.
 */
@Data
@AllArgsConstructor
public class Bounds implements Serializable {
  private static final long serialVersionUID = -2236130402734410725L;

  private final double minX;
  private final double minY;
  private final double maxX;
  private final double maxY;

  public double getWidth() {
    return maxX - minX;
  }

  public double getHeight() {
    return maxY - minY;
  }

  public boolean intersects(Bounds other) {
    return other.minX <= maxX && other.maxX >= minX && other.minY <= maxY && other.maxY >= minY;
  }

  /**
   * @return the west, south, east, north values in that order
   */
  public double[] toArray() {
    return new double[] {minX, minY, maxX, maxY};
  }
}
