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

import java.util.Optional;

import org.iomaps.common.concurrent.SingleFlight;
import org.iomaps.common.pmtiles.PMTilesHeader;
import org.iomaps.common.pmtiles.TileArchive;
import org.iomaps.tiles.TileServerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the tiles of a single archive.  The header and metadata are read once, on first use.
 */
public class ArchiveTileSource implements TileSource {
  private static final Logger LOG = LoggerFactory.getLogger(ArchiveTileSource.class);

  private final String name;
  private final String title;
  private final String tileSuffix;
  private final TileServerConfiguration.SourceType type;
  private final String attributionSuffix;
  private final SingleFlight<TileArchive> archive;

  /**
   * @param attributionSuffix appended to the archive attribution, null for none
   */
  public ArchiveTileSource(TileServerConfiguration.SourceConfiguration source, String attributionSuffix,
                           ArchiveOpener opener) {
    this.name = source.getName();
    this.title = source.getTitle();
    this.tileSuffix = source.effectiveTileSuffix();
    this.type = source.getType();
    this.attributionSuffix = attributionSuffix;
    String locator = source.getUrl();
    this.archive = new SingleFlight<>("archive " + locator, () -> {
      LOG.info("Opening archive {} for source {}", locator, name);
      return opener.open(locator);
    });
  }

  @Override
  public Optional<Tile> getTile(int z, long x, long y) {
    TileArchive a = archive.get();
    PMTilesHeader header = a.getHeader();
    if (z < header.getMinZoom() || z > header.getMaxZoom()) {
      return Optional.empty();
    }
    String mediaType = header.getTileType().getMediaType();
    return a.getTile(z, x, y).map(bytes -> new Tile(bytes, mediaType));
  }

  @Override
  public TileJson getTileJson() {
    TileArchive a = archive.get();
    return TileJson.describe(a.getHeader(), a.getMetadata(), attributionSuffix);
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
}
