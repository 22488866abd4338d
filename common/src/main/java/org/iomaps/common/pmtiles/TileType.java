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

/**
 * The tile formats a PMTiles archive declares in its header.
 */
public enum TileType {
  UNKNOWN(0, "application/octet-stream", "bin"),
  MVT(1, "application/vnd.mapbox-vector-tile", "pbf"),
  PNG(2, "image/png", "png"),
  JPEG(3, "image/jpeg", "jpg"),
  WEBP(4, "image/webp", "webp"),
  AVIF(5, "image/avif", "avif");

  private final int code;
  private final String mediaType;
  private final String extension;

  TileType(int code, String mediaType, String extension) {
    this.code = code;
    this.mediaType = mediaType;
    this.extension = extension;
  }

  public int getCode() {
    return code;
  }

  public String getMediaType() {
    return mediaType;
  }

  public String getExtension() {
    return extension;
  }

  public boolean isRaster() {
    return this != MVT && this != UNKNOWN;
  }

  public static TileType fromCode(int code) {
    for (TileType t : values()) {
      if (t.code == code) {
        return t;
      }
    }
    return UNKNOWN;
  }
}
