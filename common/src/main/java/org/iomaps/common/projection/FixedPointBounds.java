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

import lombok.Value;

/**
 * An extent in fixed point degrees.  Kept distinct from {@link Bounds} so that scaled and unscaled values cannot be
 * compared with each other.
 */
@Value
public class FixedPointBounds {
  int minLon;
  int minLat;
  int maxLon;
  int maxLat;

  /**
   * @return true if every edge of other lies on or inside this box
   */
  public boolean contains(FixedPointBounds other) {
    return other.minLon >= minLon
           && other.minLat >= minLat
           && other.maxLon <= maxLon
           && other.maxLat <= maxLat;
  }

  public FixedPointBounds union(FixedPointBounds other) {
    return new FixedPointBounds(
      Math.min(minLon, other.minLon),
      Math.min(minLat, other.minLat),
      Math.max(maxLon, other.maxLon),
      Math.max(maxLat, other.maxLat));
  }

  public Bounds toDegrees() {
    return new Bounds(
      FixedPoint.toDegrees(minLon), FixedPoint.toDegrees(minLat),
      FixedPoint.toDegrees(maxLon), FixedPoint.toDegrees(maxLat));
  }
}
