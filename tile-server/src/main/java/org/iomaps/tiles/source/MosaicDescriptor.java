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
package org.iomaps.tiles.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.pmtiles.Compression;
import org.iomaps.common.pmtiles.PMTilesHeader;
import org.iomaps.common.pmtiles.TileType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The parsed content of a mosaic JSON file.
 *
 * Generation 0 files are a flat object mapping each shard key to its header and metadata; the logical header is
 * merged from the shards and the first shard's metadata stands for the whole mosaic.  Later generations carry a
 * version, a pre-merged header and metadata, and the shards under {@code slices}.
 */
public class MosaicDescriptor {
  private static final String LEGACY_PREFIX = "../";

  private final int generation;
  private final PMTilesHeader header;
  private final JsonNode metadata;
  private final List<ShardEntry> shards;

  private MosaicDescriptor(int generation, PMTilesHeader header, JsonNode metadata, List<ShardEntry> shards) {
    this.generation = generation;
    this.header = header;
    this.metadata = metadata;
    this.shards = Collections.unmodifiableList(shards);
  }

  /**
   * @param json the descriptor, with fields in file order
   * @param locator where the descriptor was read from, shard keys resolve against it
   * @throws MapsException of kind MALFORMED_INPUT for descriptors that cannot be interpreted
   */
  public static MosaicDescriptor parse(JsonNode json, String locator, ArchiveOpener opener) {
    if (json == null || !json.isObject()) {
      throw MapsException.malformed("Mosaic descriptor " + locator + " is not a JSON object");
    }
    int generation = generation(json.get("version"));
    return generation == 0 ? parseLegacy(json, locator, opener) : parseVersioned(generation, json, locator, opener);
  }

  private static MosaicDescriptor parseLegacy(JsonNode json, String locator, ArchiveOpener opener) {
    List<ShardEntry> shards = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isObject()) {
        // the version marker of a descriptor written as version "0"
        continue;
      }
      String key = field.getKey();
      String relative = key.startsWith(LEGACY_PREFIX) ? key.substring(LEGACY_PREFIX.length()) : key;
      shards.add(shard(key, RangeReaderFactory.resolve(locator, relative), shards.size(), field.getValue(), null,
                       opener));
    }
    if (shards.isEmpty()) {
      throw MapsException.malformed("Mosaic descriptor " + locator + " lists no archives");
    }
    return new MosaicDescriptor(0, merge(shards), shards.get(0).getMetadata(), shards);
  }

  private static MosaicDescriptor parseVersioned(int generation, JsonNode json, String locator,
                                                 ArchiveOpener opener) {
    PMTilesHeader header = header(json.get("header"), null, locator);
    JsonNode metadata = objectOrEmpty(json.get("metadata"));
    JsonNode slices = json.get("slices");
    if (slices == null || !slices.isObject()) {
      throw MapsException.malformed("Mosaic descriptor " + locator + " has no slices");
    }
    List<ShardEntry> shards = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = slices.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      shards.add(shard(field.getKey(), RangeReaderFactory.resolve(locator, field.getKey()), shards.size(),
                       field.getValue(), header, opener));
    }
    return new MosaicDescriptor(generation, header, metadata, shards);
  }

  private static ShardEntry shard(String key, String resolved, int ordinal, JsonNode entry, PMTilesHeader fallback,
                                  ArchiveOpener opener) {
    PMTilesHeader header = header(entry.get("header"), fallback, key);
    return new ShardEntry(key, resolved, ordinal, header, objectOrEmpty(entry.get("metadata")), opener);
  }

  /**
   * Merges shard headers: the smallest minimums, the largest maximums and center zoom, and the remaining fields
   * from the first shard.
   */
  static PMTilesHeader merge(List<ShardEntry> shards) {
    PMTilesHeader first = shards.get(0).getHeader();
    PMTilesHeader.PMTilesHeaderBuilder merged = first.toBuilder();
    int minLon = first.getMinLonE7();
    int minLat = first.getMinLatE7();
    int maxLon = first.getMaxLonE7();
    int maxLat = first.getMaxLatE7();
    int minZoom = first.getMinZoom();
    int maxZoom = first.getMaxZoom();
    int centerZoom = first.getCenterZoom();
    for (ShardEntry shard : shards) {
      PMTilesHeader h = shard.getHeader();
      minLon = Math.min(minLon, h.getMinLonE7());
      minLat = Math.min(minLat, h.getMinLatE7());
      maxLon = Math.max(maxLon, h.getMaxLonE7());
      maxLat = Math.max(maxLat, h.getMaxLatE7());
      minZoom = Math.min(minZoom, h.getMinZoom());
      maxZoom = Math.max(maxZoom, h.getMaxZoom());
      centerZoom = Math.max(centerZoom, h.getCenterZoom());
    }
    return merged.minLonE7(minLon).minLatE7(minLat).maxLonE7(maxLon).maxLatE7(maxLat)
      .minZoom(minZoom).maxZoom(maxZoom).centerZoom(centerZoom).build();
  }

  /**
   * Reads a header in its JSON form.  Fields missing from the JSON take the fallback's values when there is one.
   */
  static PMTilesHeader header(JsonNode json, PMTilesHeader fallback, String context) {
    if (json == null || !json.isObject()) {
      if (fallback != null) {
        return fallback;
      }
      throw MapsException.malformed("Missing header for " + context);
    }
    PMTilesHeader.PMTilesHeaderBuilder b = fallback == null
      ? PMTilesHeader.builder().internalCompression(Compression.NONE).tileCompression(Compression.NONE)
        .tileType(TileType.UNKNOWN)
      : fallback.toBuilder();
    try {
      if (json.has("min_lon_e7")) {
        b.minLonE7(intField(json, "min_lon_e7"));
      }
      if (json.has("min_lat_e7")) {
        b.minLatE7(intField(json, "min_lat_e7"));
      }
      if (json.has("max_lon_e7")) {
        b.maxLonE7(intField(json, "max_lon_e7"));
      }
      if (json.has("max_lat_e7")) {
        b.maxLatE7(intField(json, "max_lat_e7"));
      }
      if (json.has("min_zoom")) {
        b.minZoom(intField(json, "min_zoom"));
      }
      if (json.has("max_zoom")) {
        b.maxZoom(intField(json, "max_zoom"));
      }
      if (json.has("center_zoom")) {
        b.centerZoom(intField(json, "center_zoom"));
      }
      if (json.has("center_lon_e7")) {
        b.centerLonE7(intField(json, "center_lon_e7"));
      }
      if (json.has("center_lat_e7")) {
        b.centerLatE7(intField(json, "center_lat_e7"));
      }
      if (json.has("tile_type")) {
        b.tileType(TileType.fromCode(intField(json, "tile_type")));
      }
      if (json.has("tile_compression")) {
        b.tileCompression(Compression.fromCode(intField(json, "tile_compression")));
      }
    } catch (NumberFormatException e) {
      throw MapsException.malformed("Invalid header for " + context, e);
    }
    if (fallback == null) {
      for (String required : new String[] {"min_lon_e7", "min_lat_e7", "max_lon_e7", "max_lat_e7", "min_zoom",
                                           "max_zoom"}) {
        if (!json.has(required)) {
          throw MapsException.malformed("Header for " + context + " lacks " + required);
        }
      }
    }
    return b.build();
  }

  private static int intField(JsonNode json, String field) {
    JsonNode node = json.get(field);
    return node.isNumber() ? node.intValue() : Integer.parseInt(node.asText().trim());
  }

  private static int generation(JsonNode version) {
    if (version == null || version.isNull()) {
      return 0;
    }
    try {
      return version.isNumber() ? version.intValue() : Integer.parseInt(version.asText().trim());
    } catch (NumberFormatException e) {
      throw MapsException.malformed("Unrecognised mosaic version " + version, e);
    }
  }

  private static JsonNode objectOrEmpty(JsonNode node) {
    if (node == null || !node.isObject()) {
      return new ObjectNode(JsonNodeFactory.instance);
    }
    return node;
  }

  public int getGeneration() {
    return generation;
  }

  public PMTilesHeader getHeader() {
    return header;
  }

  public JsonNode getMetadata() {
    return metadata;
  }

  public List<ShardEntry> getShards() {
    return shards;
  }
}
