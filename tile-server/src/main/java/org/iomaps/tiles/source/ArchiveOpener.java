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

import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.io.ReadFailures;
import org.iomaps.common.pmtiles.PMTilesReader;
import org.iomaps.common.pmtiles.TileArchive;

/**
 * Opens the tile archive found at a locator.
 */
@FunctionalInterface
public interface ArchiveOpener {

  /**
   * @throws org.iomaps.common.error.MapsException if the archive cannot be fetched or parsed
   */
  TileArchive open(String locator);

  /**
   * Opens PMTiles archives through range readers.
   */
  static ArchiveOpener pmtiles(RangeReaderFactory readers) {
    return locator -> {
      try {
        return new PMTilesReader(readers.open(locator));
      } catch (IOException e) {
        throw ReadFailures.translate(locator, e);
      }
    };
  }
}
