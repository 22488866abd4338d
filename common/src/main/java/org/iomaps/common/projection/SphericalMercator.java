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

import static java.lang.Math.PI;
import static java.lang.Math.atan;
import static java.lang.Math.exp;
import static java.lang.Math.pow;
import static java.lang.Math.sinh;
import static java.lang.Math.toDegrees;

/**
 * Spherical Mercator (EPSG:3857) utilities for the standard slippy map tile pyramid.
 * This class is threadsafe.
 */
public final class SphericalMercator {
  public static final String EPSG_CODE = "EPSG:3857";

  // The limit of the projection to get a square, about 85.05113°.
  public static final double MAX_LATITUDE = 180/PI * (2*atan(exp(PI)) - PI/2);

  // Radius of the sphere used by the projection, in metres.
  public static final double EARTH_RADIUS = 6378137;

  // Half the width of the projected world, in metres.
  public static final double ORIGIN_SHIFT = PI * EARTH_RADIUS;

  private SphericalMercator() {}

  /**
   * Returns the WGS84 extent of a tile as the south west and north east corners.
   */
  public static Double2D[] tileBoundary(int z, long x, long y) {
    double north = tileLatitude(z, y);
    double south = tileLatitude(z, y + 1);
    double west = tileLongitude(z, x);
    double east = tileLongitude(z, x + 1);
    return new Double2D[] {new Double2D(west, south), new Double2D(east, north)};
  }

  /**
   * Returns the extent of a tile in projected metres.
   */
  public static Bounds tileBoundaryMetres(int z, long x, long y) {
    double size = tileSizeMetres(z);
    double minX = -ORIGIN_SHIFT + x * size;
    double maxY = ORIGIN_SHIFT - y * size;
    return new Bounds(minX, maxY - size, minX + size, maxY);
  }

  /**
   * The width (and height) of a tile at the given zoom in projected metres.
   */
  public static double tileSizeMetres(int z) {
    return 2 * ORIGIN_SHIFT / pow(2.0, z);
  }

  /**
   * Inverts the spherical projection.
   * @return the longitude as X and latitude as Y
   */
  public static Double2D toLngLat(double x, double y) {
    double lng = toDegrees(x / EARTH_RADIUS);
    double lat = toDegrees(atan(exp(y / EARTH_RADIUS)) * 2 - PI / 2);
    return new Double2D(lng, lat);
  }

  /**
   * Converts a box in projected metres to WGS84 degrees.
   */
  public static Bounds toLngLat(Bounds metres) {
    Double2D sw = toLngLat(metres.getMinX(), metres.getMinY());
    Double2D ne = toLngLat(metres.getMaxX(), metres.getMaxY());
    return new Bounds(sw.getX(), sw.getY(), ne.getX(), ne.getY());
  }

  private static double tileLongitude(int z, double x) {
    return x / pow(2.0, z) * 360.0 - 180;
  }

  private static double tileLatitude(int z, double y) {
    double n = PI - (2.0 * PI * y) / pow(2.0, z);
    return toDegrees(atan(sinh(n)));
  }
}
