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

import org.junit.Test;

import static org.iomaps.common.projection.SphericalMercator.MAX_LATITUDE;
import static org.iomaps.common.projection.SphericalMercator.ORIGIN_SHIFT;
import static org.junit.Assert.assertEquals;

public class SphericalMercatorTest {

  static final double ε = 1e-6;

  @Test
  public void testTileBoundary() {
    // Tile 0/0/0
    // ■
    Double2D[] result = SphericalMercator.tileBoundary(0, 0, 0);
    assertEquals(-180, result[0].getX(), ε);
    assertEquals(-MAX_LATITUDE, result[0].getY(), ε);
    assertEquals(180, result[1].getX(), ε);
    assertEquals(MAX_LATITUDE, result[1].getY(), ε);

    // □□
    // □■
    result = SphericalMercator.tileBoundary(1, 1, 1);
    assertEquals(0, result[0].getX(), ε);
    assertEquals(-MAX_LATITUDE, result[0].getY(), ε);
    assertEquals(180, result[1].getX(), ε);
    assertEquals(0, result[1].getY(), ε);

    // Bangalore at zoom 10
    result = SphericalMercator.tileBoundary(10, 732, 474);
    assertEquals(77.34375, result[0].getX(), ε);
    assertEquals(77.6953125, result[1].getX(), ε);
  }

  @Test
  public void testTileBoundaryMetres() {
    Bounds b = SphericalMercator.tileBoundaryMetres(0, 0, 0);
    assertEquals(-ORIGIN_SHIFT, b.getMinX(), ε);
    assertEquals(-ORIGIN_SHIFT, b.getMinY(), ε);
    assertEquals(ORIGIN_SHIFT, b.getMaxX(), ε);
    assertEquals(ORIGIN_SHIFT, b.getMaxY(), ε);

    b = SphericalMercator.tileBoundaryMetres(1, 0, 0);
    assertEquals(-ORIGIN_SHIFT, b.getMinX(), ε);
    assertEquals(0, b.getMinY(), ε);
    assertEquals(0, b.getMaxX(), ε);
    assertEquals(ORIGIN_SHIFT, b.getMaxY(), ε);
    assertEquals(ORIGIN_SHIFT, SphericalMercator.tileSizeMetres(1), ε);
  }

  @Test
  public void testToLngLat() {
    Double2D p = SphericalMercator.toLngLat(0, 0);
    assertEquals(0, p.getX(), ε);
    assertEquals(0, p.getY(), ε);

    p = SphericalMercator.toLngLat(ORIGIN_SHIFT, ORIGIN_SHIFT);
    assertEquals(180, p.getX(), ε);
    assertEquals(MAX_LATITUDE, p.getY(), ε);
  }
}
