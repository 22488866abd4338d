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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.ByteArrayRangeReader;
import org.iomaps.common.io.HttpRangeReader;
import org.iomaps.common.io.RangeReader;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.pmtiles.Compression;
import org.iomaps.common.pmtiles.PMTilesHeader;
import org.iomaps.common.pmtiles.TileArchive;
import org.iomaps.common.pmtiles.TileType;
import org.iomaps.common.projection.FixedPoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * In-memory stand-ins for remote descriptors and archives.
 */
class Fakes {
  static final ObjectMapper MAPPER = new ObjectMapper();

  /**
   * Serves registered documents and counts how often each is opened.
   */
  static class Readers implements RangeReaderFactory {
    final Map<String, byte[]> documents = new ConcurrentHashMap<>();
    final Map<String, AtomicInteger> opens = new ConcurrentHashMap<>();
    final AtomicInteger failuresRemaining = new AtomicInteger();
    volatile long delayMs = 0;

    Readers put(String locator, String content) {
      documents.put(locator, content.getBytes(StandardCharsets.UTF_8));
      return this;
    }

    int opens(String locator) {
      AtomicInteger count = opens.get(locator);
      return count == null ? 0 : count.get();
    }

    @Override
    public RangeReader open(String locator) throws IOException {
      opens.computeIfAbsent(locator, k -> new AtomicInteger()).incrementAndGet();
      if (delayMs > 0) {
        try {
          Thread.sleep(delayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      if (failuresRemaining.getAndDecrement() > 0) {
        throw new HttpRangeReader.HttpStatusException(locator, 503);
      }
      byte[] data = documents.get(locator);
      if (data == null) {
        throw new HttpRangeReader.HttpStatusException(locator, 404);
      }
      return new ByteArrayRangeReader(locator, data);
    }
  }

  /**
   * Every tile of the archive exists and its bytes name the archive and the tile.
   */
  static class Archive implements TileArchive {
    final String locator;
    final PMTilesHeader header;

    Archive(String locator, PMTilesHeader header) {
      this.locator = locator;
      this.header = header;
    }

    @Override
    public PMTilesHeader getHeader() {
      return header;
    }

    @Override
    public JsonNode getMetadata() {
      return MAPPER.createObjectNode().put("name", locator);
    }

    @Override
    public Optional<byte[]> getTile(int z, long x, long y) {
      return Optional.of((locator + "@" + z + "/" + x + "/" + y).getBytes(StandardCharsets.UTF_8));
    }
  }

  /**
   * Opens fake archives, failing for locators containing "broken".
   */
  static class Opener implements ArchiveOpener {
    final Map<String, AtomicInteger> opens = new ConcurrentHashMap<>();

    @Override
    public TileArchive open(String locator) {
      opens.computeIfAbsent(locator, k -> new AtomicInteger()).incrementAndGet();
      if (locator.contains("broken")) {
        throw MapsException.unavailable("Unable to read " + locator, null);
      }
      return new Archive(locator, header(-180, -85, 180, 85, 0, 14));
    }
  }

  static PMTilesHeader header(double w, double s, double e, double n, int minZoom, int maxZoom) {
    return PMTilesHeader.builder()
      .internalCompression(Compression.NONE)
      .tileCompression(Compression.NONE)
      .tileType(TileType.PNG)
      .minLonE7(FixedPoint.toFixed(w))
      .minLatE7(FixedPoint.toFixed(s))
      .maxLonE7(FixedPoint.toFixed(e))
      .maxLatE7(FixedPoint.toFixed(n))
      .minZoom(minZoom)
      .maxZoom(maxZoom)
      .centerZoom(minZoom)
      .centerLonE7(FixedPoint.toFixed((w + e) / 2))
      .centerLatE7(FixedPoint.toFixed((s + n) / 2))
      .build();
  }

  /**
   * The JSON form of a header as found in mosaic descriptors.
   */
  static ObjectNode headerJson(double w, double s, double e, double n, int minZoom, int maxZoom) {
    ObjectNode h = MAPPER.createObjectNode();
    h.put("min_lon_e7", FixedPoint.toFixed(w));
    h.put("min_lat_e7", FixedPoint.toFixed(s));
    h.put("max_lon_e7", FixedPoint.toFixed(e));
    h.put("max_lat_e7", FixedPoint.toFixed(n));
    h.put("min_zoom", minZoom);
    h.put("max_zoom", maxZoom);
    h.put("center_zoom", minZoom);
    h.put("center_lon_e7", FixedPoint.toFixed((w + e) / 2));
    h.put("center_lat_e7", FixedPoint.toFixed((s + n) / 2));
    h.put("tile_type", 2);
    h.put("tile_compression", 1);
    return h;
  }

  static ObjectNode shardJson(ObjectNode header, String name) {
    ObjectNode entry = MAPPER.createObjectNode();
    entry.set("header", header);
    entry.putObject("metadata").put("name", name).put("attribution", "Survey of " + name);
    return entry;
  }
}
