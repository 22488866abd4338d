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
package org.iomaps.tiles.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.iomaps.common.error.MapsException;

/**
 * Encoding of rendered tiles.  WebP support comes from the webp-imageio plugin on the classpath.
 */
public final class TileImages {
  public static final String PNG = "png";
  public static final String WEBP = "webp";

  private TileImages() {
  }

  /**
   * @return webp when asked for it, png for anything else
   */
  public static String outputFormat(String requested) {
    return WEBP.equalsIgnoreCase(requested) ? WEBP : PNG;
  }

  public static String mediaType(String format) {
    return "image/" + outputFormat(format);
  }

  public static byte[] encode(BufferedImage image, String format) {
    String output = outputFormat(format);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      if (!ImageIO.write(image, output, out)) {
        throw new MapsException(MapsException.Kind.UNKNOWN, "No image writer available for " + output);
      }
    } catch (IOException e) {
      throw MapsException.wrap("Unable to encode " + output + " tile", e);
    }
    return out.toByteArray();
  }

  /**
   * Re-encodes an image in any readable format as PNG.
   */
  public static byte[] toPng(byte[] encoded) {
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(encoded));
    } catch (IOException e) {
      throw MapsException.malformed("Unable to decode tile image", e);
    }
    if (image == null) {
      throw MapsException.malformed("Tile is not in a readable image format");
    }
    return encode(image, PNG);
  }
}
