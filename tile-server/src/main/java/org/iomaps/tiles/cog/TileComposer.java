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

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.iomaps.common.projection.Bounds;
import org.iomaps.common.projection.TileCoordinate;

import lombok.Value;

/**
 * Renders a Web Mercator tile from the planes of a GeoTIFF, using the mask planes for opacity when there are any.
 */
public final class TileComposer {
  public static final int TILE_SIZE = 256;
  // tolerance for pixel edges and resolutions that differ only by rounding
  private static final double EPSILON = 1e-6;

  private TileComposer() {
  }

  /**
   * The part of a plane that lands on a tile and where it is drawn.
   */
  @Value
  static class Fragment {
    TiffPlane plane;
    Rectangle window;
    // tile pixels per plane pixel
    double scaleX;
    double scaleY;
    // tile pixel position of the window's north west corner
    double offsetX;
    double offsetY;

    int subsampling() {
      double shrink = 1 / Math.max(scaleX, scaleY);
      return Math.max(1, (int) Math.floor(shrink));
    }

    /**
     * @param pixelSize the number of plane pixels each image pixel covers
     */
    AffineTransform transform(int pixelSize) {
      return new AffineTransform(scaleX * pixelSize, 0, 0, scaleY * pixelSize, offsetX, offsetY);
    }
  }

  /**
   * @return the rendered tile, or null when no color plane reaches the tile
   */
  public static BufferedImage compose(PlaneReader reader, TileCoordinate tile) {
    Bounds tileMetres = tile.mercatorBounds();
    double target = tileMetres.getWidth() / TILE_SIZE;

    List<TiffPlane> color = planesOf(reader.getPlanes(), PlaneKind.COLOR);
    if (color.isEmpty()) {
      return null;
    }
    Fragment colorFragment = fragment(selectPlane(color, target), tileMetres);
    if (colorFragment == null) {
      return null;
    }

    BufferedImage canvas = new BufferedImage(TILE_SIZE, TILE_SIZE, BufferedImage.TYPE_INT_ARGB);
    int subsampling = colorFragment.subsampling();
    BufferedImage pixels = reader.readColor(colorFragment.getPlane(), colorFragment.getWindow(), subsampling);
    draw(canvas, pixels, colorFragment.transform(subsampling));

    List<TiffPlane> masks = planesOf(reader.getPlanes(), PlaneKind.MASK);
    if (!masks.isEmpty()) {
      Fragment maskFragment = fragment(selectPlane(masks, target), tileMetres);
      if (maskFragment != null) {
        Rectangle window = maskFragment.getWindow();
        byte[] opacity = reader.readMask(maskFragment.getPlane(), window);
        BufferedImage maskCanvas = new BufferedImage(TILE_SIZE, TILE_SIZE, BufferedImage.TYPE_INT_ARGB);
        draw(maskCanvas, opacityImage(opacity, window.width, window.height), maskFragment.transform(1));
        applyAlpha(canvas, maskCanvas);
      }
    }
    return canvas;
  }

  /**
   * Picks the coarsest plane that is still at least as detailed as the target resolution, falling back to the most
   * detailed plane when the target is finer than all of them.
   */
  static TiffPlane selectPlane(List<TiffPlane> planes, double targetResolution) {
    List<TiffPlane> finestFirst = new ArrayList<>(planes);
    finestFirst.sort(Comparator.comparingDouble(TiffPlane::getResolutionX));
    TiffPlane selected = finestFirst.get(0);
    for (TiffPlane plane : finestFirst) {
      if (plane.getResolutionX() <= targetResolution * (1 + EPSILON)) {
        selected = plane;
      }
    }
    return selected;
  }

  /**
   * @return the pixel window of the plane covering the tile, or null when they do not overlap
   */
  static Fragment fragment(TiffPlane plane, Bounds tile) {
    Bounds extent = plane.bounds();
    double minX = Math.max(tile.getMinX(), extent.getMinX());
    double maxX = Math.min(tile.getMaxX(), extent.getMaxX());
    double minY = Math.max(tile.getMinY(), extent.getMinY());
    double maxY = Math.min(tile.getMaxY(), extent.getMaxY());
    if (minX >= maxX || minY >= maxY) {
      return null;
    }

    double resX = plane.getResolutionX();
    double resY = plane.getResolutionY();
    int x0 = clamp((int) Math.floor((minX - plane.getOriginX()) / resX + EPSILON), plane.getWidth());
    int x1 = clamp((int) Math.ceil((maxX - plane.getOriginX()) / resX - EPSILON), plane.getWidth());
    int y0 = clamp((int) Math.floor((plane.getOriginY() - maxY) / resY + EPSILON), plane.getHeight());
    int y1 = clamp((int) Math.ceil((plane.getOriginY() - minY) / resY - EPSILON), plane.getHeight());
    if (x1 <= x0 || y1 <= y0) {
      return null;
    }

    double pixelsPerMetre = TILE_SIZE / tile.getWidth();
    double offsetX = (plane.getOriginX() + x0 * resX - tile.getMinX()) * pixelsPerMetre;
    double offsetY = (tile.getMaxY() - (plane.getOriginY() - y0 * resY)) * pixelsPerMetre;
    return new Fragment(plane, new Rectangle(x0, y0, x1 - x0, y1 - y0), resX * pixelsPerMetre,
                        resY * pixelsPerMetre, offsetX, offsetY);
  }

  static List<TiffPlane> planesOf(List<TiffPlane> planes, PlaneKind kind) {
    List<TiffPlane> matching = new ArrayList<>();
    for (TiffPlane plane : planes) {
      if (plane.getKind() == kind) {
        matching.add(plane);
      }
    }
    return matching;
  }

  /**
   * A black image whose alpha is the given opacity.
   */
  static BufferedImage opacityImage(byte[] opacity, int width, int height) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    int[] argb = new int[width * height];
    for (int i = 0; i < argb.length; i++) {
      argb[i] = (opacity[i] & 0xFF) << 24;
    }
    image.setRGB(0, 0, width, height, argb, 0, width);
    return image;
  }

  /**
   * Replaces the alpha of the tile with the alpha of the rendered mask.
   */
  static void applyAlpha(BufferedImage tile, BufferedImage mask) {
    WritableRaster alpha = tile.getAlphaRaster();
    alpha.setRect(mask.getAlphaRaster());
  }

  private static void draw(BufferedImage canvas, BufferedImage image, AffineTransform transform) {
    Graphics2D g = canvas.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, transform, null);
    } finally {
      g.dispose();
    }
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(max, value));
  }
}
