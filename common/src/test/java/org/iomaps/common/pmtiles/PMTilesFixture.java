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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.GZIPOutputStream;

/**
 * Builds small PMTiles archives in memory.
 */
public class PMTilesFixture {
  private final TreeMap<Long, byte[]> tiles = new TreeMap<>();
  private TileType tileType = TileType.PNG;
  private Compression internalCompression = Compression.NONE;
  private Compression tileCompression = Compression.NONE;
  private int leafSize = 0;
  private String metadata = "{}";
  private int[] bounds = {-1800000000, -850000000, 1800000000, 850000000};

  public PMTilesFixture tile(int z, long x, long y, byte[] data) {
    tiles.put(TileIds.toTileId(z, x, y), data);
    return this;
  }

  public PMTilesFixture tileType(TileType tileType) {
    this.tileType = tileType;
    return this;
  }

  public PMTilesFixture gzip() {
    this.internalCompression = Compression.GZIP;
    this.tileCompression = Compression.GZIP;
    return this;
  }

  /**
   * Splits the directory into leaves holding this many entries each.
   */
  public PMTilesFixture leafSize(int leafSize) {
    this.leafSize = leafSize;
    return this;
  }

  public PMTilesFixture metadata(String json) {
    this.metadata = json;
    return this;
  }

  public PMTilesFixture bounds(int minLonE7, int minLatE7, int maxLonE7, int maxLatE7) {
    this.bounds = new int[] {minLonE7, minLatE7, maxLonE7, maxLatE7};
    return this;
  }

  public byte[] build() throws IOException {
    ByteArrayOutputStream data = new ByteArrayOutputStream();
    List<DirectoryEntry> entries = new ArrayList<>();
    for (Map.Entry<Long, byte[]> t : tiles.entrySet()) {
      byte[] stored = compress(tileCompression, t.getValue());
      entries.add(new DirectoryEntry(t.getKey(), data.size(), stored.length, 1));
      data.write(stored);
    }

    byte[] rootDir;
    ByteArrayOutputStream leaves = new ByteArrayOutputStream();
    if (leafSize > 0) {
      List<DirectoryEntry> rootEntries = new ArrayList<>();
      for (int i = 0; i < entries.size(); i += leafSize) {
        List<DirectoryEntry> chunk = entries.subList(i, Math.min(entries.size(), i + leafSize));
        byte[] leaf = compress(internalCompression, new Directory(chunk).encode());
        rootEntries.add(new DirectoryEntry(chunk.get(0).getTileId(), leaves.size(), leaf.length, 0));
        leaves.write(leaf);
      }
      rootDir = compress(internalCompression, new Directory(rootEntries).encode());
    } else {
      rootDir = compress(internalCompression, new Directory(entries).encode());
    }
    byte[] meta = compress(internalCompression, metadata.getBytes(StandardCharsets.UTF_8));

    long rootOffset = PMTilesHeader.HEADER_SIZE;
    long metaOffset = rootOffset + rootDir.length;
    long leafOffset = metaOffset + meta.length;
    long dataOffset = leafOffset + leaves.size();

    int minZoom = tiles.isEmpty() ? 0 : TileIds.fromTileId(tiles.firstKey()).getZ();
    int maxZoom = tiles.isEmpty() ? 0 : TileIds.fromTileId(tiles.lastKey()).getZ();
    PMTilesHeader header = PMTilesHeader.builder()
      .rootDirOffset(rootOffset)
      .rootDirBytes(rootDir.length)
      .jsonMetadataOffset(metaOffset)
      .jsonMetadataBytes(meta.length)
      .leafDirsOffset(leafOffset)
      .leafDirsBytes(leaves.size())
      .tileDataOffset(dataOffset)
      .tileDataBytes(data.size())
      .addressedTilesCount(tiles.size())
      .tileEntriesCount(tiles.size())
      .tileContentsCount(tiles.size())
      .clustered(true)
      .internalCompression(internalCompression)
      .tileCompression(tileCompression)
      .tileType(tileType)
      .minZoom(minZoom)
      .maxZoom(maxZoom)
      .minLonE7(bounds[0])
      .minLatE7(bounds[1])
      .maxLonE7(bounds[2])
      .maxLatE7(bounds[3])
      .centerZoom(minZoom)
      .centerLonE7((bounds[0] + bounds[2]) / 2)
      .centerLatE7((bounds[1] + bounds[3]) / 2)
      .build();

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(header.toBytes());
    out.write(rootDir);
    out.write(meta);
    out.write(leaves.toByteArray());
    out.write(data.toByteArray());
    return out.toByteArray();
  }

  private static byte[] compress(Compression compression, byte[] bytes) throws IOException {
    if (compression == Compression.NONE) {
      return bytes;
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
      gz.write(bytes);
    }
    return out.toByteArray();
  }
}
