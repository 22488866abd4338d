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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.tiles.TileServerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * The named tile sources, in configuration order.
 */
public class SourceRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(SourceRegistry.class);

  private final Map<String, TileSource> sources = new LinkedHashMap<>();

  public SourceRegistry(Collection<TileSource> sources) {
    for (TileSource source : sources) {
      Preconditions.checkArgument(!this.sources.containsKey(source.getName()), "Duplicate source name %s",
                                  source.getName());
      this.sources.put(source.getName(), source);
    }
  }

  /**
   * Creates the sources described in the configuration.  Nothing is fetched until a source is first used.
   */
  public static SourceRegistry fromConfiguration(TileServerConfiguration configuration, RangeReaderFactory readers) {
    ArchiveOpener opener = ArchiveOpener.pmtiles(readers);
    String communitySuffix = configuration.getAttribution().getCommunitySuffix();
    int threshold = configuration.getMosaic().getSpatialIndexThreshold();

    List<TileSource> created = new ArrayList<>();
    for (TileServerConfiguration.SourceConfiguration source : configuration.getSources()) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(source.getName()), "Source without a name");
      Preconditions.checkArgument(!Strings.isNullOrEmpty(source.getUrl()), "Source %s has no url", source.getName());
      if (Strings.isNullOrEmpty(source.getTitle())) {
        source.setTitle(source.getName());
      }
      String suffix = source.isCommunityAttribution() ? communitySuffix : null;
      TileSource tileSource = source.getHandlerType() == TileServerConfiguration.HandlerType.MOSAIC
        ? new MosaicTileSource(source, suffix, readers, opener, threshold)
        : new ArchiveTileSource(source, suffix, opener);
      created.add(tileSource);
      LOG.info("Registered {} source {} from {}", source.getHandlerType(), source.getName(), source.getUrl());
    }
    return new SourceRegistry(created);
  }

  public Optional<TileSource> get(String name) {
    return Optional.ofNullable(sources.get(name));
  }

  public Collection<TileSource> all() {
    return Collections.unmodifiableCollection(sources.values());
  }
}
