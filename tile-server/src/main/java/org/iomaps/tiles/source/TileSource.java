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

import org.iomaps.tiles.TileServerConfiguration;

/**
 * A named source of pre-rendered tiles.
 *
 * Implementations initialize lazily on first use.  An uncovered coordinate is an empty result, while failures to
 * read the underlying archives raise {@link org.iomaps.common.error.MapsException}.
 */
public interface TileSource {

  String getName();

  String getTitle();

  /**
   * @return the file extension tiles are served under
   */
  String getTileSuffix();

  TileServerConfiguration.SourceType getType();

  Optional<Tile> getTile(int z, long x, long y);

  /**
   * @return the TileJSON description, without the tiles URL template which depends on the server
   */
  TileJson getTileJson();
}
