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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.IOUtils;
import org.iomaps.common.error.MapsException;

/**
 * Compression codes used for PMTiles directories, metadata and tiles.
 */
public enum Compression {
  UNKNOWN(0),
  NONE(1),
  GZIP(2),
  BROTLI(3),
  ZSTD(4);

  private final int code;

  Compression(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static Compression fromCode(int code) {
    for (Compression c : values()) {
      if (c.code == code) {
        return c;
      }
    }
    return UNKNOWN;
  }

  /**
   * Decompresses the bytes.  Only uncompressed and gzip content can be read.
   *
   * @throws MapsException of kind MALFORMED_INPUT for other codecs or corrupt data
   */
  public byte[] decompress(byte[] data) {
    switch (this) {
      case NONE:
        return data;
      case GZIP:
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
          return IOUtils.toByteArray(in);
        } catch (IOException e) {
          throw MapsException.malformed("Corrupt gzip content", e);
        }
      default:
        throw MapsException.malformed("Unsupported compression: " + name());
    }
  }
}
