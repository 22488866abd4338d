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

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.RangeReader;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.io.ReadFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads GeoTIFF planes through the JDK TIFF plugin.  Color planes are decoded by the plugin, mask planes are decoded
 * from their stored tiles so that packed 1 bit masks keep their meaning as opacity.
 */
public class ImageIOPlaneReader implements PlaneReader {
  private static final Logger LOG = LoggerFactory.getLogger(ImageIOPlaneReader.class);

  static final int TAG_MODEL_PIXEL_SCALE = 33550;
  static final int TAG_MODEL_TIEPOINT = 33922;
  static final int TAG_MODEL_TRANSFORMATION = 34264;

  private final String locator;
  private final RangeReader range;
  private final RangeImageInputStream stream;
  private final ImageReader reader;
  private final List<TiffPlane> planes;
  private final Map<Integer, BlockLayout> maskLayouts;
  private final double[] geotransform;

  /**
   * Where the stored blocks of a plane are, either tiles or strips.
   */
  static class BlockLayout {
    final long[] offsets;
    final long[] byteCounts;
    final int blockWidth;
    final int blockHeight;
    final boolean tiled;

    BlockLayout(long[] offsets, long[] byteCounts, int blockWidth, int blockHeight, boolean tiled) {
      this.offsets = offsets;
      this.byteCounts = byteCounts;
      this.blockWidth = blockWidth;
      this.blockHeight = blockHeight;
      this.tiled = tiled;
    }
  }

  private ImageIOPlaneReader(String locator, RangeReader range, RangeImageInputStream stream, ImageReader reader,
                             List<TiffPlane> planes, Map<Integer, BlockLayout> maskLayouts, double[] geotransform) {
    this.locator = locator;
    this.range = range;
    this.stream = stream;
    this.reader = reader;
    this.planes = Collections.unmodifiableList(planes);
    this.maskLayouts = maskLayouts;
    this.geotransform = geotransform;
  }

  /**
   * Opens the file and classifies all of its images.
   *
   * @param blockSize the size of the ranges fetched while parsing and decoding
   */
  public static ImageIOPlaneReader open(RangeReaderFactory readers, String locator, int blockSize) {
    RangeReader range;
    try {
      range = readers.open(locator);
    } catch (IOException e) {
      throw ReadFailures.translate(locator, e);
    }

    RangeImageInputStream stream = new RangeImageInputStream(range, blockSize);
    ImageReader reader = tiffReader();
    try {
      reader.setInput(stream, false, false);
      int count = reader.getNumImages(true);
      List<TiffPlane> stored = new ArrayList<>();
      Map<Integer, BlockLayout> maskLayouts = new HashMap<>();
      double[] geotransform = null;

      for (int i = 0; i < count; i++) {
        TIFFDirectory dir = TIFFDirectory.createFromMetadata(reader.getImageMetadata(i));
        PlaneKind kind = PlaneKind.fromSubfileType(longField(dir, BaselineTIFFTagSet.TAG_NEW_SUBFILE_TYPE, 0));
        int width = reader.getWidth(i);
        int height = reader.getHeight(i);
        boolean tiled = reader.isImageTiled(i);
        TiffPlane plane = TiffPlane.builder()
          .index(i)
          .kind(kind)
          .width(width)
          .height(height)
          .tileWidth(tiled ? reader.getTileWidth(i) : width)
          .tileHeight(tiled ? reader.getTileHeight(i) : height)
          .bitsPerSample((int) longField(dir, BaselineTIFFTagSet.TAG_BITS_PER_SAMPLE, 1))
          .samplesPerPixel((int) longField(dir, BaselineTIFFTagSet.TAG_SAMPLES_PER_PIXEL, 1))
          .compression((int) longField(dir, BaselineTIFFTagSet.TAG_COMPRESSION, MaskDecoder.COMPRESSION_NONE))
          .photometric((int) longField(dir, BaselineTIFFTagSet.TAG_PHOTOMETRIC_INTERPRETATION, -1))
          .build();

        if (geotransform == null && kind == PlaneKind.COLOR) {
          geotransform = geotransform(dir);
        }
        if (kind == PlaneKind.MASK) {
          maskLayouts.put(i, layout(dir, plane, tiled));
        }
        stored.add(plane);
      }

      if (geotransform == null) {
        throw MapsException.malformed("No geotransform available in COG");
      }
      List<TiffPlane> planes = georeference(stored, geotransform);
      LOG.debug("Read {} planes from {}", planes.size(), locator);
      return new ImageIOPlaneReader(locator, range, stream, reader, planes, maskLayouts, geotransform);

    } catch (IOException e) {
      dispose(reader, stream, range);
      throw failure(locator, e);
    } catch (RuntimeException e) {
      dispose(reader, stream, range);
      throw e;
    }
  }

  /**
   * Places every plane on the grid of the first color plane.
   */
  static List<TiffPlane> georeference(List<TiffPlane> stored, double[] geotransform) {
    TiffPlane base = null;
    for (TiffPlane plane : stored) {
      if (plane.getKind() == PlaneKind.COLOR) {
        base = plane.toBuilder()
          .originX(geotransform[0])
          .originY(geotransform[3])
          .resolutionX(Math.abs(geotransform[1]))
          .resolutionY(Math.abs(geotransform[5]))
          .build();
        break;
      }
    }
    if (base == null) {
      throw MapsException.malformed("No color image in COG");
    }
    List<TiffPlane> planes = new ArrayList<>(stored.size());
    for (TiffPlane plane : stored) {
      planes.add(plane.getIndex() == base.getIndex() ? base : plane.alignedTo(base));
    }
    return planes;
  }

  /**
   * @return origin x, pixel width, 0, origin y, 0, negative pixel height; or null without geo tags
   */
  static double[] geotransform(TIFFDirectory dir) {
    TIFFField scale = dir.getTIFFField(TAG_MODEL_PIXEL_SCALE);
    TIFFField tiepoint = dir.getTIFFField(TAG_MODEL_TIEPOINT);
    if (scale != null && tiepoint != null && scale.getCount() >= 2 && tiepoint.getCount() >= 6) {
      double scaleX = scale.getAsDouble(0);
      double scaleY = Math.abs(scale.getAsDouble(1));
      double rasterX = tiepoint.getAsDouble(0);
      double rasterY = tiepoint.getAsDouble(1);
      return new double[] {
        tiepoint.getAsDouble(3) - rasterX * scaleX, scaleX, 0,
        tiepoint.getAsDouble(4) + rasterY * scaleY, 0, -scaleY};
    }
    TIFFField transformation = dir.getTIFFField(TAG_MODEL_TRANSFORMATION);
    if (transformation != null && transformation.getCount() >= 16) {
      return new double[] {
        transformation.getAsDouble(3), transformation.getAsDouble(0), transformation.getAsDouble(1),
        transformation.getAsDouble(7), transformation.getAsDouble(4), transformation.getAsDouble(5)};
    }
    return null;
  }

  @Override
  public List<TiffPlane> getPlanes() {
    return planes;
  }

  @Override
  public double[] getGeotransform() {
    return geotransform.clone();
  }

  @Override
  public synchronized BufferedImage readColor(TiffPlane plane, Rectangle window, int subsampling) {
    ImageReadParam param = reader.getDefaultReadParam();
    param.setSourceRegion(window);
    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
    try {
      return reader.read(plane.getIndex(), param);
    } catch (IOException e) {
      throw failure(locator, e);
    }
  }

  @Override
  public byte[] readMask(TiffPlane plane, Rectangle window) {
    BlockLayout layout = maskLayouts.get(plane.getIndex());
    if (layout == null) {
      throw new IllegalArgumentException("Image " + plane.getIndex() + " is not a mask");
    }
    byte[] out = new byte[window.width * window.height];
    int across = (plane.getWidth() + layout.blockWidth - 1) / layout.blockWidth;
    int firstRow = window.y / layout.blockHeight;
    int lastRow = (window.y + window.height - 1) / layout.blockHeight;
    int firstColumn = window.x / layout.blockWidth;
    int lastColumn = (window.x + window.width - 1) / layout.blockWidth;

    for (int row = firstRow; row <= lastRow; row++) {
      for (int column = firstColumn; column <= lastColumn; column++) {
        int index = row * across + column;
        int top = row * layout.blockHeight;
        int left = column * layout.blockWidth;
        // strips at the bottom are short, tiles are always padded to full size
        int rows = layout.tiled ? layout.blockHeight : Math.min(layout.blockHeight, plane.getHeight() - top);
        byte[] opacity = readMaskBlock(plane, layout, index, rows);
        copyWindow(opacity, layout.blockWidth, left, top, rows, out, window);
      }
    }
    return out;
  }

  private byte[] readMaskBlock(TiffPlane plane, BlockLayout layout, int index, int rows) {
    if (index >= layout.offsets.length || layout.byteCounts[index] == 0) {
      // sparse block
      return new byte[layout.blockWidth * rows];
    }
    byte[] stored;
    try {
      stored = range.read(layout.offsets[index], (int) layout.byteCounts[index]);
    } catch (IOException e) {
      throw ReadFailures.translate(locator, e);
    }
    return MaskDecoder.decode(stored, plane.getCompression(), plane.getBitsPerSample(), plane.getSamplesPerPixel(),
                              layout.blockWidth, rows);
  }

  /**
   * Copies the part of a decoded block that falls inside the window.
   */
  static void copyWindow(byte[] block, int blockWidth, int left, int top, int rows, byte[] out, Rectangle window) {
    int x0 = Math.max(left, window.x);
    int x1 = Math.min(left + blockWidth, window.x + window.width);
    int y0 = Math.max(top, window.y);
    int y1 = Math.min(top + rows, window.y + window.height);
    for (int y = y0; y < y1; y++) {
      System.arraycopy(block, (y - top) * blockWidth + (x0 - left), out, (y - window.y) * window.width + (x0 - window.x),
                       x1 - x0);
    }
  }

  @Override
  public void close() throws IOException {
    synchronized (this) {
      reader.dispose();
    }
    stream.close();
    range.close();
  }

  private static BlockLayout layout(TIFFDirectory dir, TiffPlane plane, boolean tiled) {
    if (tiled) {
      return new BlockLayout(longs(dir.getTIFFField(BaselineTIFFTagSet.TAG_TILE_OFFSETS)),
                             longs(dir.getTIFFField(BaselineTIFFTagSet.TAG_TILE_BYTE_COUNTS)),
                             plane.getTileWidth(), plane.getTileHeight(), true);
    }
    int rowsPerStrip = (int) Math.min(plane.getHeight(),
                                      longField(dir, BaselineTIFFTagSet.TAG_ROWS_PER_STRIP, plane.getHeight()));
    return new BlockLayout(longs(dir.getTIFFField(BaselineTIFFTagSet.TAG_STRIP_OFFSETS)),
                           longs(dir.getTIFFField(BaselineTIFFTagSet.TAG_STRIP_BYTE_COUNTS)),
                           plane.getWidth(), rowsPerStrip, false);
  }

  private static long[] longs(TIFFField field) {
    if (field == null) {
      throw MapsException.malformed("Mask image has no block offsets");
    }
    long[] values = new long[field.getCount()];
    for (int i = 0; i < values.length; i++) {
      values[i] = field.getAsLong(i);
    }
    return values;
  }

  private static long longField(TIFFDirectory dir, int tag, long fallback) {
    TIFFField field = dir.getTIFFField(tag);
    return field == null || field.getCount() == 0 ? fallback : field.getAsLong(0);
  }

  private static ImageReader tiffReader() {
    Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
    if (!readers.hasNext()) {
      throw new IllegalStateException("No TIFF image reader available");
    }
    return readers.next();
  }

  /**
   * Failures fetching bytes keep their transport meaning, anything else the plugin raises means the file is unusable.
   */
  private static MapsException failure(String locator, IOException e) {
    Throwable cause = e;
    while (cause != null) {
      if (cause instanceof RangeImageInputStream.FetchException) {
        return ReadFailures.translate(locator, ((RangeImageInputStream.FetchException) cause).getFailure());
      }
      cause = cause.getCause();
    }
    return MapsException.malformed("Unreadable TIFF " + locator + ": " + e.getMessage(), e);
  }

  private static void dispose(ImageReader reader, RangeImageInputStream stream, RangeReader range) {
    reader.dispose();
    try {
      stream.close();
      range.close();
    } catch (IOException e) {
      LOG.warn("Unable to close {}", range.getLocator(), e);
    }
  }
}
