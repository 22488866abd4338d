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
import java.util.Optional;

import org.iomaps.common.concurrent.SingleFlight;
import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.RangeReader;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.io.ReadFailures;
import org.iomaps.common.projection.FixedPoint;
import org.iomaps.common.projection.FixedPointBounds;
import org.iomaps.common.projection.TileCoordinate;
import org.iomaps.tiles.TileServerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serves one logical tile layer split across many archives, described by a mosaic JSON file.
 *
 * The descriptor is fetched once, on first use, and every request is then routed to the single shard whose extent
 * contains the tile.  Shard archives open lazily and independently, so one unreachable shard only fails its own
 * tiles.
 */
public class MosaicTileSource implements TileSource {
  private static final Logger LOG = LoggerFactory.getLogger(MosaicTileSource.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String name;
  private final String title;
  private final String tileSuffix;
  private final TileServerConfiguration.SourceType type;
  private final String attributionSuffix;
  private final SingleFlight<Mosaic> mosaic;

  public MosaicTileSource(TileServerConfiguration.SourceConfiguration source, String attributionSuffix,
                          RangeReaderFactory readers, ArchiveOpener opener, int spatialIndexThreshold) {
    this.name = source.getName();
    this.title = source.getTitle();
    this.tileSuffix = source.effectiveTileSuffix();
    this.type = source.getType();
    this.attributionSuffix = attributionSuffix;
    String locator = source.getUrl();
    this.mosaic = new SingleFlight<>("mosaic " + locator, () -> {
      MosaicDescriptor descriptor = MosaicDescriptor.parse(fetch(readers, locator), locator, opener);
      LOG.info("Loaded generation {} mosaic {} for source {} with {} shards", descriptor.getGeneration(), locator,
               name, descriptor.getShards().size());
      return new Mosaic(descriptor, new ShardIndex(descriptor.getShards(), spatialIndexThreshold));
    });
  }

  @Override
  public Optional<Tile> getTile(int z, long x, long y) {
    ShardEntry shard = findShard(z, x, y);
    if (shard == null) {
      return Optional.empty();
    }
    LOG.debug("Tile {}/{}/{} of {} served by {}", z, x, y, name, shard);
    String mediaType = shard.getHeader().getTileType().getMediaType();
    return shard.archive().getTile(z, x, y).map(bytes -> new Tile(bytes, mediaType));
  }

  /**
   * @return the shard serving the tile, null if the tile lies outside every shard
   */
  public ShardEntry findShard(int z, long x, long y) {
    Mosaic m = mosaic.get();
    if (z < 0 || z > TileCoordinate.MAX_ZOOM) {
      return null;
    }
    FixedPointBounds tile = FixedPoint.toFixed(TileCoordinate.of(z, x, y).wgs84Bounds());
    return m.index.find(z, tile);
  }

  @Override
  public TileJson getTileJson() {
    Mosaic m = mosaic.get();
    return TileJson.describe(m.descriptor.getHeader(), m.descriptor.getMetadata(), attributionSuffix);
  }

  public MosaicDescriptor getDescriptor() {
    return mosaic.get().descriptor;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getTitle() {
    return title;
  }

  @Override
  public String getTileSuffix() {
    return tileSuffix;
  }

  @Override
  public TileServerConfiguration.SourceType getType() {
    return type;
  }

  private static JsonNode fetch(RangeReaderFactory readers, String locator) {
    try (RangeReader reader = readers.open(locator)) {
      return MAPPER.readTree(reader.readAll());
    } catch (JsonProcessingException e) {
      throw MapsException.malformed("Unparsable mosaic descriptor " + locator, e);
    } catch (IOException e) {
      throw ReadFailures.translate(locator, e);
    }
  }

  private static class Mosaic {
    private final MosaicDescriptor descriptor;
    private final ShardIndex index;

    Mosaic(MosaicDescriptor descriptor, ShardIndex index) {
      this.descriptor = descriptor;
      this.index = index;
    }
  }
}
