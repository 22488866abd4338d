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
package org.iomaps.tiles.stac;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;
import org.locationtech.jts.geom.Envelope;

import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FeatureRowsTest {
  private final FeatureRows rows = new FeatureRows(new ObjectMapper());

  @Test
  public void testDefaults() {
    FeatureRecord record = rows.toRecord(new HashMap<String, Object>(), 7);
    assertEquals("item-7", record.getId());
    assertNull(record.getGeometry());
    assertNull(record.getBbox());
    assertEquals(0, record.getProperties().size());
    assertEquals(0, record.getAssets().size());
    assertNull(record.getCollection());
    assertEquals("1.0.0", record.getStacVersion());
    assertFalse(record.intersects(new Envelope(-180, 180, -90, 90)));
  }

  @Test
  public void testBboxForms() {
    double[] expected = new double[] {77.0, 12.0, 78.0, 13.0};
    assertArrayEquals(expected, rows.bbox("[77, 12, 78, 13]", 0), 0);
    assertArrayEquals(expected, rows.bbox(Arrays.asList(77.0, 12.0, 78.0, 13.0), 0), 0);

    Map<String, Object> struct = new LinkedHashMap<>();
    struct.put("xmin", 77.0);
    struct.put("ymin", 12.0);
    struct.put("xmax", 78.0);
    struct.put("ymax", 13.0);
    assertArrayEquals(expected, rows.bbox(struct, 0), 0);

    assertNull(rows.bbox("[77, 12", 0));
    assertNull(rows.bbox(null, 0));
  }

  @Test
  public void testNestedGroupsBecomeJson() {
    Map<String, Object> href = new LinkedHashMap<>();
    href.put("href", "https://example.org/village.tif");
    Map<String, Object> assets = new LinkedHashMap<>();
    assets.put("image", href);

    Map<String, Object> row = new HashMap<>();
    row.put("id", 42L);
    row.put("assets", assets);
    row.put("properties", "{\"population\": 1200}");
    row.put("collection", "villages");
    row.put("stac_version", "1.1.0");
    row.put("geometry", "{\"type\":\"LineString\",\"coordinates\":[[77,12],[78,13]]}");

    FeatureRecord record = rows.toRecord(row, 0);
    assertEquals("42", record.getId());
    assertEquals("https://example.org/village.tif", record.getAssets().get("image").get("href").asText());
    assertEquals(1200, record.getProperties().get("population").asInt());
    assertEquals("villages", record.getCollection());
    assertEquals("1.1.0", record.getStacVersion());
    assertTrue(record.intersects(new Envelope(77.9, 79, 12.9, 14)));
    assertFalse(record.intersects(new Envelope(78.1, 79, 12.9, 14)));
  }

  @Test
  public void testJsonArraysAreNotObjects() {
    assertEquals(0, rows.object("[1, 2]").size());
    assertTrue(rows.object("[1, 2]").isObject());
  }

  @Test
  public void testUnreadableGeometry() {
    assertNull(rows.geometry(new byte[] {1, 2, 3}, 0));
    assertNull(rows.geometry("{\"type\":", 0));
  }
}
