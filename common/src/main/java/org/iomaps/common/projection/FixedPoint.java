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

/**
 * Degrees held as integers scaled by 10⁷, as stored in PMTiles headers and mosaic descriptors.
 * Comparisons between extents are only made in this scale, so repeated comparisons never drift.
 */
public final class FixedPoint {
  public static final int SCALE = 10_000_000;

  private FixedPoint() {}

  public static int toFixed(double degrees) {
    return (int) Math.round(degrees * SCALE);
  }

  public static double toDegrees(int fixed) {
    return fixed / (double) SCALE;
  }

  public static FixedPointBounds toFixed(Bounds degrees) {
    return new FixedPointBounds(
      toFixed(degrees.getMinX()), toFixed(degrees.getMinY()), toFixed(degrees.getMaxX()), toFixed(degrees.getMaxY()));
  }
}
