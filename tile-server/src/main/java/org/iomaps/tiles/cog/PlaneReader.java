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
import java.io.Closeable;
import java.util.List;

/**
 * Reads pixels from the planes of one GeoTIFF.
 */
public interface PlaneReader extends Closeable {

  /**
   * @return every plane in file order with the geotransform of the full resolution image applied
   */
  List<TiffPlane> getPlanes();

  /**
   * @return the geotransform of the full resolution image as origin x, pixel width, 0, origin y, 0, pixel height
   */
  double[] getGeotransform();

  /**
   * Decodes a window of a color plane.
   *
   * @param subsampling read every nth pixel of the window in each direction
   */
  BufferedImage readColor(TiffPlane plane, Rectangle window, int subsampling);

  /**
   * Decodes a window of a mask plane into one opacity byte per pixel, rows top to bottom.
   */
  byte[] readMask(TiffPlane plane, Rectangle window);
}
