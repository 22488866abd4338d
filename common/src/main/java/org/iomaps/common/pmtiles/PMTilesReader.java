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

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.RangeReader;
import org.iomaps.common.io.ReadFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Reads tiles from a version 3 PMTiles archive through range requests.
 *
 * Opening the reader fetches the header, root directory and metadata.  Leaf directories are fetched on demand and
 * kept in a small cache.  Readers are thread safe.
 */
public class PMTilesReader implements TileArchive {
  private static final Logger LOG = LoggerFactory.getLogger(PMTilesReader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  // root plus at most three levels of leaves
  private static final int MAX_DEPTH = 4;
  // the initial fetch covers the header and, for archives written by the reference tools, the root directory
  private static final int INITIAL_FETCH = 16384;

  private final RangeReader reader;
  private final PMTilesHeader header;
  private final Directory root;
  private final JsonNode metadata;
  private final Cache<Long, Directory> leaves = CacheBuilder.newBuilder().maximumSize(256).build();

  /**
   * @throws MapsException of kind RESOURCE_UNAVAILABLE if the archive cannot be fetched or MALFORMED_INPUT if it
   * cannot be parsed
   */
  public PMTilesReader(RangeReader reader) {
    this.reader = reader;
    byte[] head = read(0, INITIAL_FETCH);
    this.header = PMTilesHeader.parse(head);

    if (header.getRootDirOffset() + header.getRootDirBytes() <= head.length) {
      byte[] rootBytes = new byte[(int) header.getRootDirBytes()];
      System.arraycopy(head, (int) header.getRootDirOffset(), rootBytes, 0, rootBytes.length);
      this.root = Directory.decode(header.getInternalCompression().decompress(rootBytes));
    } else {
      this.root = readDirectory(header.getRootDirOffset(), (int) header.getRootDirBytes());
    }

    if (header.getJsonMetadataBytes() > 0) {
      byte[] raw = read(header.getJsonMetadataOffset(), (int) header.getJsonMetadataBytes());
      try {
        this.metadata = MAPPER.readTree(header.getInternalCompression().decompress(raw));
      } catch (IOException e) {
        throw MapsException.malformed("Unparsable metadata in " + reader.getLocator(), e);
      }
    } else {
      this.metadata = MAPPER.createObjectNode();
    }
    LOG.info("Opened PMTiles archive {} with zooms {}-{} of {}", reader.getLocator(), header.getMinZoom(),
             header.getMaxZoom(), header.getTileType());
  }

  @Override
  public PMTilesHeader getHeader() {
    return header;
  }

  @Override
  public JsonNode getMetadata() {
    return metadata;
  }

  @Override
  public Optional<byte[]> getTile(int z, long x, long y) {
    long tileId = TileIds.toTileId(z, x, y);
    Directory dir = root;
    for (int depth = 0; depth < MAX_DEPTH; depth++) {
      DirectoryEntry entry = dir.find(tileId);
      if (entry == null) {
        return Optional.empty();
      }
      if (!entry.isLeaf()) {
        byte[] data = read(header.getTileDataOffset() + entry.getOffset(), entry.getLength());
        return Optional.of(header.getTileCompression().decompress(data));
      }
      dir = leaf(header.getLeafDirsOffset() + entry.getOffset(), entry.getLength());
    }
    LOG.warn("Directory nesting in {} exceeds {} levels looking for {}/{}/{}", reader.getLocator(), MAX_DEPTH, z, x,
             y);
    return Optional.empty();
  }

  @Override
  public void close() {
    try {
      reader.close();
    } catch (IOException e) {
      LOG.warn("Failed closing {}", reader.getLocator(), e);
    }
  }

  private Directory leaf(long offset, int length) {
    try {
      return leaves.get(offset, () -> readDirectory(offset, length));
    } catch (ExecutionException | UncheckedExecutionException e) {
      if (e.getCause() instanceof MapsException) {
        throw (MapsException) e.getCause();
      }
      throw MapsException.wrap("Failed reading leaf directory of " + reader.getLocator(), e.getCause());
    }
  }

  private Directory readDirectory(long offset, int length) {
    return Directory.decode(header.getInternalCompression().decompress(read(offset, length)));
  }

  private byte[] read(long offset, int length) {
    try {
      return reader.read(offset, length);
    } catch (IOException e) {
      throw ReadFailures.translate(reader.getLocator(), e);
    }
  }
}
