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

import org.iomaps.common.error.MapsException;

import lombok.Value;

/**
 * The address of a slippy map tile.  The origin is the north west corner and y increases southwards.
 */
@Value
public class TileCoordinate {
  // Hilbert tile ids overflow beyond this
  public static final int MAX_ZOOM = 26;

  int z;
  long x;
  long y;

  /**
   * @throws MapsException of kind BAD_REQUEST when the address does not exist in the pyramid
   */
  public static TileCoordinate of(int z, long x, long y) {
    if (z < 0 || z > MAX_ZOOM) {
      throw MapsException.badRequest("Zoom must be between 0 and " + MAX_ZOOM + ", supplied: " + z);
    }
    long n = 1L << z;
    if (x < 0 || x >= n || y < 0 || y >= n) {
      throw MapsException.badRequest("Tile " + z + "/" + x + "/" + y + " is outside the tile pyramid");
    }
    return new TileCoordinate(z, x, y);
  }

  public Bounds wgs84Bounds() {
    Double2D[] corners = SphericalMercator.tileBoundary(z, x, y);
    return new Bounds(corners[0].getX(), corners[0].getY(), corners[1].getX(), corners[1].getY());
  }

  public Bounds mercatorBounds() {
    return SphericalMercator.tileBoundaryMetres(z, x, y);
  }

  @Override
  public String toString() {
    return z + "/" + x + "/" + y;
  }
}
