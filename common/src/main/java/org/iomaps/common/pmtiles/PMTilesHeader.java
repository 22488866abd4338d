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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.projection.FixedPointBounds;

import lombok.Builder;
import lombok.Value;

/**
 * The fixed 127 byte header of a version 3 PMTiles archive.  Coordinates are WGS84 degrees scaled by 10^7.
 */
@Value
@Builder(toBuilder = true)
public class PMTilesHeader {
  public static final int HEADER_SIZE = 127;
  private static final byte[] MAGIC = "PMTiles".getBytes(StandardCharsets.US_ASCII);
  private static final int VERSION = 3;

  long rootDirOffset;
  long rootDirBytes;
  long jsonMetadataOffset;
  long jsonMetadataBytes;
  long leafDirsOffset;
  long leafDirsBytes;
  long tileDataOffset;
  long tileDataBytes;
  long addressedTilesCount;
  long tileEntriesCount;
  long tileContentsCount;
  boolean clustered;
  Compression internalCompression;
  Compression tileCompression;
  TileType tileType;
  int minZoom;
  int maxZoom;
  int minLonE7;
  int minLatE7;
  int maxLonE7;
  int maxLatE7;
  int centerZoom;
  int centerLonE7;
  int centerLatE7;

  public FixedPointBounds getBounds() {
    return new FixedPointBounds(minLonE7, minLatE7, maxLonE7, maxLatE7);
  }

  /**
   * Parses the header from the first bytes of an archive.
   *
   * @throws MapsException of kind MALFORMED_INPUT if the bytes are not a version 3 header
   */
  public static PMTilesHeader parse(byte[] bytes) {
    if (bytes.length < HEADER_SIZE) {
      throw MapsException.malformed("PMTiles header truncated to " + bytes.length + " bytes");
    }
    for (int i = 0; i < MAGIC.length; i++) {
      if (bytes[i] != MAGIC[i]) {
        throw MapsException.malformed("Not a PMTiles archive");
      }
    }
    if (bytes[7] != VERSION) {
      throw MapsException.malformed("Unsupported PMTiles version " + bytes[7]);
    }

    ByteBuffer b = ByteBuffer.wrap(bytes, 8, HEADER_SIZE - 8).order(ByteOrder.LITTLE_ENDIAN);
    return PMTilesHeader.builder()
      .rootDirOffset(b.getLong())
      .rootDirBytes(b.getLong())
      .jsonMetadataOffset(b.getLong())
      .jsonMetadataBytes(b.getLong())
      .leafDirsOffset(b.getLong())
      .leafDirsBytes(b.getLong())
      .tileDataOffset(b.getLong())
      .tileDataBytes(b.getLong())
      .addressedTilesCount(b.getLong())
      .tileEntriesCount(b.getLong())
      .tileContentsCount(b.getLong())
      .clustered(b.get() == 1)
      .internalCompression(Compression.fromCode(b.get() & 0xff))
      .tileCompression(Compression.fromCode(b.get() & 0xff))
      .tileType(TileType.fromCode(b.get() & 0xff))
      .minZoom(b.get() & 0xff)
      .maxZoom(b.get() & 0xff)
      .minLonE7(b.getInt())
      .minLatE7(b.getInt())
      .maxLonE7(b.getInt())
      .maxLatE7(b.getInt())
      .centerZoom(b.get() & 0xff)
      .centerLonE7(b.getInt())
      .centerLatE7(b.getInt())
      .build();
  }

  /**
   * Writes the header in its binary form.
   */
  public byte[] toBytes() {
    ByteBuffer b = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    b.put(MAGIC);
    b.put((byte) VERSION);
    b.putLong(rootDirOffset);
    b.putLong(rootDirBytes);
    b.putLong(jsonMetadataOffset);
    b.putLong(jsonMetadataBytes);
    b.putLong(leafDirsOffset);
    b.putLong(leafDirsBytes);
    b.putLong(tileDataOffset);
    b.putLong(tileDataBytes);
    b.putLong(addressedTilesCount);
    b.putLong(tileEntriesCount);
    b.putLong(tileContentsCount);
    b.put((byte) (clustered ? 1 : 0));
    b.put((byte) internalCompression.getCode());
    b.put((byte) tileCompression.getCode());
    b.put((byte) tileType.getCode());
    b.put((byte) minZoom);
    b.put((byte) maxZoom);
    b.putInt(minLonE7);
    b.putInt(minLatE7);
    b.putInt(maxLonE7);
    b.putInt(maxLatE7);
    b.put((byte) centerZoom);
    b.putInt(centerLonE7);
    b.putInt(centerLatE7);
    return b.array();
  }
}
