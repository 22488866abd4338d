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
package org.iomaps.common.pmtiles;

import java.io.Closeable;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An opened tile archive.
 */
public interface TileArchive extends Closeable {

  PMTilesHeader getHeader();

  /**
   * @return the archive's JSON metadata, an empty object if it has none
   */
  JsonNode getMetadata();

  /**
   * Returns the decompressed tile bytes, or empty if the archive holds no tile at this address.
   *
   * @throws org.iomaps.common.error.MapsException when the archive cannot be read
   */
  Optional<byte[]> getTile(int z, long x, long y);

  @Override
  default void close() {
  }
}
