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
package org.iomaps.common.pmtiles;

import org.iomaps.common.projection.TileCoordinate;

/**
 * Converts tile addresses to and from PMTiles tile ids, which number every tile of the pyramid along a Hilbert curve
 * within each zoom level, lower zooms first.
 */
public final class TileIds {

  // number of tiles in all zoom levels below the index
  private static final long[] ZOOM_OFFSETS = new long[TileCoordinate.MAX_ZOOM + 1];

  static {
    long acc = 0;
    for (int z = 0; z <= TileCoordinate.MAX_ZOOM; z++) {
      ZOOM_OFFSETS[z] = acc;
      acc += 1L << (2 * z);
    }
  }

  private TileIds() {
  }

  public static long toTileId(int z, long x, long y) {
    if (z < 0 || z > TileCoordinate.MAX_ZOOM) {
      throw new IllegalArgumentException("Zoom level " + z + " exceeds limit (" + TileCoordinate.MAX_ZOOM + ")");
    }
    long n = 1L << z;
    if (x < 0 || y < 0 || x >= n || y >= n) {
      throw new IllegalArgumentException("x/y out of bounds for zoom level " + z);
    }

    long d = 0;
    for (long s = n >> 1; s > 0; s >>= 1) {
      long rx = (x & s) > 0 ? 1 : 0;
      long ry = (y & s) > 0 ? 1 : 0;
      d += s * s * ((3 * rx) ^ ry);
      if (ry == 0) {
        if (rx == 1) {
          x = s - 1 - x;
          y = s - 1 - y;
        }
        long tmp = x;
        x = y;
        y = tmp;
      }
    }
    return ZOOM_OFFSETS[z] + d;
  }

  public static TileCoordinate fromTileId(long tileId) {
    if (tileId < 0) {
      throw new IllegalArgumentException("Tile id cannot be negative: " + tileId);
    }
    int z = 0;
    while (z < TileCoordinate.MAX_ZOOM && ZOOM_OFFSETS[z + 1] <= tileId) {
      z++;
    }
    long t = tileId - ZOOM_OFFSETS[z];
    if (t >= 1L << (2 * z)) {
      throw new IllegalArgumentException("Tile id " + tileId + " exceeds the supported zoom levels");
    }

    long x = 0;
    long y = 0;
    long n = 1L << z;
    for (long s = 1; s < n; s <<= 1) {
      long rx = 1 & (t >> 1);
      long ry = 1 & (t ^ rx);
      if (ry == 0) {
        if (rx == 1) {
          x = s - 1 - x;
          y = s - 1 - y;
        }
        long tmp = x;
        x = y;
        y = tmp;
      }
      x += s * rx;
      y += s * ry;
      t >>= 2;
    }
    return TileCoordinate.of(z, x, y);
  }
}
