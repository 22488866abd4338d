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

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

import org.cache2k.Cache;
import org.cache2k.Cache2kBuilder;
import org.cache2k.CacheEntry;
import org.cache2k.event.CacheEntryEvictedListener;
import org.cache2k.io.CacheLoaderException;
import org.iomaps.common.error.MapsException;
import org.iomaps.common.projection.Bounds;
import org.iomaps.common.projection.SphericalMercator;
import org.iomaps.common.projection.TileCoordinate;
import org.iomaps.tiles.image.TileImages;
import org.iomaps.tiles.source.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

/**
 * Serves Web Mercator tiles and summaries of Cloud Optimized GeoTIFFs found at allowed URLs.  Open files are held in
 * a cache keyed by locator, and an evicted file is closed once no request is reading it.
 */
public class CogTiler {
  private static final Logger LOG = LoggerFactory.getLogger(CogTiler.class);

  private final OriginPolicy policy;
  private final Cache<String, CogHandle> files;

  /**
   * @param files a cache configured through {@link #withLoader(Cache2kBuilder, CogOpener)}
   */
  public CogTiler(OriginPolicy policy, Cache<String, CogHandle> files) {
    this.policy = policy;
    this.files = files;
  }

  /**
   * Adds the loading and closing of files to a cache builder.
   */
  public static Cache2kBuilder<String, CogHandle> withLoader(Cache2kBuilder<String, CogHandle> builder,
                                                               CogOpener opener) {
    return builder
      .loader(locator -> {
        Stopwatch timer = Stopwatch.createStarted();
        PlaneReader reader = opener.open(locator);
        LOG.info("Opened {} with {} planes in {}", locator, reader.getPlanes().size(), timer);
        return new CogHandle(locator, reader);
      })
      .addListener(new CacheEntryEvictedListener<String, CogHandle>() {
        @Override
        public void onEntryEvicted(Cache<String, CogHandle> cache, CacheEntry<String, CogHandle> entry) {
          LOG.debug("Evicted {}", entry.getKey());
          entry.getValue().release();
        }
      });
  }

  /**
   * @return the rendered tile, or empty when the file does not reach the tile
   */
  public Optional<Tile> getTile(String locator, int z, long x, long y, String format) {
    TileCoordinate tile = TileCoordinate.of(z, x, y);
    CogHandle handle = acquire(locator);
    BufferedImage image;
    try {
      image = TileComposer.compose(handle.getReader(), tile);
    } finally {
      handle.release();
    }
    if (image == null) {
      return Optional.empty();
    }
    String output = TileImages.outputFormat(format);
    return Optional.of(new Tile(TileImages.encode(image, output), TileImages.mediaType(output)));
  }

  public CogInfo getInfo(String locator) {
    CogHandle handle = acquire(locator);
    try {
      return describe(handle.getReader());
    } finally {
      handle.release();
    }
  }

  private static CogInfo describe(PlaneReader reader) {
    List<TiffPlane> color = TileComposer.planesOf(reader.getPlanes(), PlaneKind.COLOR);
    if (color.isEmpty()) {
      throw MapsException.malformed("No color image in COG");
    }
    TiffPlane base = color.get(0);
    double[] gt = reader.getGeotransform();

    Bounds metres = new Bounds(gt[0], gt[3] + base.getHeight() * gt[5], gt[0] + base.getWidth() * gt[1], gt[3]);
    Bounds degrees = SphericalMercator.toLngLat(metres);
    double[] bbox = degrees.toArray();
    double[] center = new double[] {(bbox[0] + bbox[2]) / 2, (bbox[1] + bbox[3]) / 2};

    return new CogInfo(
      bbox,
      center,
      new CogInfo.Extent(bbox[0], bbox[1], bbox[2], bbox[3]),
      new CogInfo.Size(base.getWidth(), base.getHeight()),
      new CogInfo.Size(base.getTileWidth(), base.getTileHeight()),
      new double[] {Math.abs(gt[1]), Math.abs(gt[5])},
      reader.getPlanes().size(),
      base.getCompression(),
      base.getPhotometric());
  }

  /**
   * Releases every cached file, closing those no request is reading.
   */
  public void close() {
    for (CacheEntry<String, CogHandle> entry : files.entries()) {
      entry.getValue().release();
    }
    files.removeAll();
  }

  /**
   * The cached file for the locator, held for the caller until released.
   */
  private CogHandle acquire(String locator) {
    policy.check(locator);
    while (true) {
      CogHandle handle;
      try {
        handle = files.get(locator);
      } catch (CacheLoaderException e) {
        throw MapsException.wrap("Unable to open " + locator, e.getCause() != null ? e.getCause() : e);
      }
      if (handle.acquire()) {
        return handle;
      }
      // closed after eviction between the lookup and the acquire, the next lookup opens it again
    }
  }
}
