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

import org.iomaps.common.concurrent.SingleFlight;
import org.iomaps.common.pmtiles.PMTilesHeader;
import org.iomaps.common.pmtiles.TileArchive;
import org.iomaps.common.projection.FixedPointBounds;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One archive of a mosaic.  The header comes from the mosaic descriptor so the archive itself is only opened when
 * a tile is first served from it.
 */
public class ShardEntry {
  private final String key;
  private final String locator;
  private final int ordinal;
  private final PMTilesHeader header;
  private final JsonNode metadata;
  private final SingleFlight<TileArchive> archive;

  public ShardEntry(String key, String locator, int ordinal, PMTilesHeader header, JsonNode metadata,
                    ArchiveOpener opener) {
    this.key = key;
    this.locator = locator;
    this.ordinal = ordinal;
    this.header = header;
    this.metadata = metadata;
    this.archive = new SingleFlight<>("shard " + locator, () -> opener.open(locator));
  }

  public String getKey() {
    return key;
  }

  public String getLocator() {
    return locator;
  }

  /**
   * @return the position of the shard in the descriptor, lower ordinals win when shards overlap
   */
  public int getOrdinal() {
    return ordinal;
  }

  public PMTilesHeader getHeader() {
    return header;
  }

  public FixedPointBounds getBounds() {
    return header.getBounds();
  }

  public JsonNode getMetadata() {
    return metadata;
  }

  public boolean coversZoom(int z) {
    return z >= header.getMinZoom() && z <= header.getMaxZoom();
  }

  /**
   * Opens the archive if this is the first use.  A failure affects this shard only and is retried on a later call.
   */
  public TileArchive archive() {
    return archive.get();
  }

  @Override
  public String toString() {
    return key + "#" + ordinal;
  }
}
