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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Maps decoded GeoParquet rows onto feature records.  Columns may hold JSON text or nested groups, and geometries
 * may be WKB or GeoJSON text.
 */
public final class FeatureRows {
  private static final Logger LOG = LoggerFactory.getLogger(FeatureRows.class);
  static final String DEFAULT_STAC_VERSION = "1.0.0";

  private final ObjectMapper mapper;

  public FeatureRows(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * @param rowNumber the position of the row in its file, used to name rows without an id
   */
  public FeatureRecord toRecord(Map<String, Object> row, int rowNumber) {
    Object id = row.get("id");
    Object collection = row.get("collection");
    Object version = row.get("stac_version");
    return new FeatureRecord(
      id != null ? String.valueOf(id) : "item-" + rowNumber,
      geometry(row.get("geometry"), rowNumber),
      bbox(row.get("bbox"), rowNumber),
      object(row.get("properties")),
      object(row.get("assets")),
      collection != null ? String.valueOf(collection) : null,
      version != null ? String.valueOf(version) : DEFAULT_STAC_VERSION);
  }

  Geometry geometry(Object value, int rowNumber) {
    try {
      if (value instanceof byte[]) {
        return new WKBReader().read((byte[]) value);
      }
      if (value instanceof String) {
        return new GeoJsonReader().read((String) value);
      }
    } catch (ParseException | RuntimeException e) {
      LOG.warn("Unreadable geometry in row {}: {}", rowNumber, e.getMessage());
    }
    return null;
  }

  /**
   * JSON text or a nested group as a JSON object, and an empty object for anything missing or unreadable.
   */
  JsonNode object(Object value) {
    JsonNode node = null;
    if (value instanceof String) {
      node = parse((String) value);
    } else if (value instanceof byte[]) {
      node = parse(new String((byte[]) value, StandardCharsets.UTF_8));
    } else if (value instanceof Map) {
      node = mapper.valueToTree(value);
    }
    return node != null && node.isObject() ? node : mapper.createObjectNode();
  }

  /**
   * Reads a box written as JSON text, a list of numbers or a struct of xmin, ymin, xmax and ymax.
   */
  double[] bbox(Object value, int rowNumber) {
    if (value instanceof String) {
      JsonNode node = parse((String) value);
      if (node != null && node.isArray() && node.size() >= 4) {
        return new double[] {node.get(0).asDouble(), node.get(1).asDouble(), node.get(2).asDouble(),
          node.get(3).asDouble()};
      }
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      if (list.size() >= 4 && list.get(0) instanceof Number) {
        double[] box = new double[4];
        for (int i = 0; i < 4; i++) {
          box[i] = ((Number) list.get(i)).doubleValue();
        }
        return box;
      }
    } else if (value instanceof Map) {
      Map<?, ?> struct = (Map<?, ?>) value;
      if (struct.get("xmin") instanceof Number && struct.get("ymin") instanceof Number
          && struct.get("xmax") instanceof Number && struct.get("ymax") instanceof Number) {
        return new double[] {((Number) struct.get("xmin")).doubleValue(), ((Number) struct.get("ymin")).doubleValue(),
          ((Number) struct.get("xmax")).doubleValue(), ((Number) struct.get("ymax")).doubleValue()};
      }
    }
    if (value != null) {
      LOG.warn("Ignoring unreadable bbox in row {}", rowNumber);
    }
    return null;
  }

  private JsonNode parse(String json) {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      return null;
    }
  }
}
