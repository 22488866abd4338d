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
package org.iomaps.tiles.cog;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import org.iomaps.common.error.MapsException;

/**
 * Turns the stored bytes of a transparency mask tile into one opacity byte per pixel.
 */
public final class MaskDecoder {
  static final int COMPRESSION_NONE = 1;
  static final int COMPRESSION_DEFLATE = 8;
  static final int COMPRESSION_ADOBE_DEFLATE = 32946;

  private MaskDecoder() {
  }

  public static byte[] decode(byte[] stored, int compression, int bitsPerSample, int samplesPerPixel, int width,
                              int height) {
    return unpack(decompress(stored, compression), bitsPerSample, samplesPerPixel, width, height);
  }

  static byte[] decompress(byte[] stored, int compression) {
    switch (compression) {
      case COMPRESSION_NONE:
        return stored;
      case COMPRESSION_DEFLATE:
      case COMPRESSION_ADOBE_DEFLATE:
        return inflate(stored);
      default:
        throw MapsException.malformed("Unsupported mask compression: " + compression);
    }
  }

  /**
   * Expands packed samples.  1 bit masks are most significant bit first with each row padded to a whole byte, and a
   * set bit is fully opaque.  8 bit masks pass through.
   */
  static byte[] unpack(byte[] data, int bitsPerSample, int samplesPerPixel, int width, int height) {
    if (samplesPerPixel > 1) {
      throw MapsException.malformed("Unsupported mask layout: " + samplesPerPixel + " samples per pixel");
    }
    int pixels = width * height;
    if (bitsPerSample == 8) {
      if (data.length < pixels) {
        throw MapsException.malformed("Mask tile truncated: " + data.length + " of " + pixels + " bytes");
      }
      byte[] out = new byte[pixels];
      System.arraycopy(data, 0, out, 0, pixels);
      return out;
    }
    if (bitsPerSample != 1) {
      throw MapsException.malformed("Unsupported mask depth: " + bitsPerSample + " bits per sample");
    }

    int rowStride = (width + 7) / 8;
    if (data.length < rowStride * height) {
      throw MapsException.malformed("Mask tile truncated: " + data.length + " of " + rowStride * height + " bytes");
    }
    byte[] out = new byte[pixels];
    for (int y = 0; y < height; y++) {
      int row = y * rowStride;
      for (int x = 0; x < width; x++) {
        int bit = (data[row + (x >> 3)] >> (7 - (x & 7))) & 1;
        out[y * width + x] = bit == 1 ? (byte) 0xFF : 0;
      }
    }
    return out;
  }

  private static byte[] inflate(byte[] stored) {
    Inflater inflater = new Inflater();
    try {
      inflater.setInput(stored);
      ByteArrayOutputStream out = new ByteArrayOutputStream(stored.length * 4);
      byte[] buffer = new byte[8192];
      while (!inflater.finished()) {
        int n = inflater.inflate(buffer);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          break;
        }
        out.write(buffer, 0, n);
      }
      return out.toByteArray();
    } catch (DataFormatException e) {
      throw MapsException.malformed("Corrupt deflate stream in mask tile", e);
    } finally {
      inflater.end();
    }
  }
}
