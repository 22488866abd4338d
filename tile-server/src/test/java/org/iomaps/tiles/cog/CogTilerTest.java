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

import java.awt.Color;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.cache2k.Cache;
import org.cache2k.Cache2kBuilder;
import org.iomaps.common.error.MapsException;
import org.iomaps.common.projection.SphericalMercator;
import org.iomaps.tiles.source.Tile;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CogTilerTest {
  private static final String ALLOWED = "https://github.com/ramSeraph/";
  private static final String WORLD = ALLOWED + "world.tif";
  private static final byte[] PNG_SIGNATURE = new byte[] {(byte) 0x89, 'P', 'N', 'G'};

  private final Map<String, FakePlaneReader> files = new HashMap<>();
  private final AtomicInteger opens = new AtomicInteger();
  private final AtomicInteger failuresRemaining = new AtomicInteger();
  private Cache<String, CogHandle> cache;
  private CogTiler tiler;

  @Before
  public void setUp() {
    files.put(WORLD, FakePlaneReader.world(256, Color.GREEN).withOverview(128, 128));
    CogOpener opener = locator -> {
      opens.incrementAndGet();
      if (failuresRemaining.getAndDecrement() > 0) {
        throw MapsException.unavailable("Unable to read " + locator, null);
      }
      FakePlaneReader file = files.get(locator);
      if (file == null) {
        throw MapsException.notFound("No such file " + locator);
      }
      return file;
    };
    cache = CogTiler.withLoader(Cache2kBuilder.of(String.class, CogHandle.class).entryCapacity(10), opener).build();
    tiler = new CogTiler(new OriginPolicy(Arrays.asList(ALLOWED, "http://127.0.0.1:8080/")), cache);
  }

  @After
  public void tearDown() {
    cache.close();
  }

  @Test
  public void testTileIsPng() {
    Optional<Tile> tile = tiler.getTile(WORLD, 0, 0, 0, null);
    assertTrue(tile.isPresent());
    assertEquals("image/png", tile.get().getMediaType());
    assertArrayEquals(PNG_SIGNATURE, Arrays.copyOf(tile.get().getData(), 4));
  }

  @Test
  public void testUnknownFormatFallsBackToPng() {
    Optional<Tile> tile = tiler.getTile(WORLD, 1, 1, 0, "gif");
    assertEquals("image/png", tile.get().getMediaType());
    assertArrayEquals(PNG_SIGNATURE, Arrays.copyOf(tile.get().getData(), 4));
  }

  @Test
  public void testOriginCheckedBeforeAnyRead() {
    try {
      tiler.getTile("https://example.com/world.tif", 0, 0, 0, "png");
      fail("Expected the origin to be refused");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.FORBIDDEN, e.getKind());
    }
    try {
      tiler.getInfo("file:///etc/passwd");
      fail("Expected the origin to be refused");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.FORBIDDEN, e.getKind());
    }
    assertEquals(0, opens.get());
  }

  @Test
  public void testInvalidTileIsBadRequest() {
    try {
      tiler.getTile(WORLD, 1, 2, 0, "png");
      fail("Expected a bad request");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.BAD_REQUEST, e.getKind());
    }
  }

  @Test
  public void testFilesAreOpenedOnce() {
    tiler.getTile(WORLD, 0, 0, 0, "png");
    tiler.getTile(WORLD, 1, 0, 0, "png");
    tiler.getInfo(WORLD);
    assertEquals(1, opens.get());
  }

  @Test
  public void testFailuresAreNotCached() {
    failuresRemaining.set(1);
    try {
      tiler.getTile(WORLD, 0, 0, 0, "png");
      fail("Expected the first open to fail");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.RESOURCE_UNAVAILABLE, e.getKind());
    }
    assertTrue(tiler.getTile(WORLD, 0, 0, 0, "png").isPresent());
    assertEquals(2, opens.get());
  }

  @Test
  public void testMissingFileKeepsItsKind() {
    try {
      tiler.getInfo(ALLOWED + "missing.tif");
      fail("Expected not found");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.NOT_FOUND, e.getKind());
    }
  }

  @Test
  public void testInfo() {
    CogInfo info = tiler.getInfo(WORLD);
    assertEquals(-180, info.getBbox()[0], 1e-9);
    assertEquals(-85.0511, info.getBbox()[1], 1e-4);
    assertEquals(180, info.getBbox()[2], 1e-9);
    assertEquals(85.0511, info.getBbox()[3], 1e-4);
    assertEquals(0, info.getCenter()[0], 1e-9);
    assertEquals(0, info.getCenter()[1], 1e-9);
    assertEquals(info.getBbox()[3], info.getBounds().getNorth(), 0);
    assertEquals(256, info.getSize().getWidth());
    assertEquals(256, info.getTileSize().getHeight());
    assertEquals(FakePlaneReader.WORLD / 256, info.getResolution()[0], 1e-6);
    assertEquals(FakePlaneReader.WORLD / 256, info.getResolution()[1], 1e-6);
    assertEquals(2, info.getImageCount());
    assertEquals(8, info.getCompression());
    assertEquals(2, info.getPhotometric());
  }

  @Test
  public void testTileOutsideFileIsEmpty() {
    files.put(ALLOWED + "east.tif", new FakePlaneReader(0, 2e7, 1e5, 100, 100, Color.RED));
    assertFalse(tiler.getTile(ALLOWED + "east.tif", 1, 0, 0, "png").isPresent());
  }

  @Test
  public void testCloseClosesOpenFiles() {
    tiler.getInfo(WORLD);
    tiler.close();
    assertTrue(files.get(WORLD).closed);
  }

  @Test
  public void testEvictedFileStaysOpenWhileRead() throws Exception {
    CountDownLatch reading = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    FakePlaneReader busy = new FakePlaneReader(-SphericalMercator.ORIGIN_SHIFT, SphericalMercator.ORIGIN_SHIFT,
                                               FakePlaneReader.WORLD / 256, 256, 256, Color.BLUE) {
      @Override
      public BufferedImage readColor(TiffPlane plane, Rectangle window, int subsampling) {
        reading.countDown();
        try {
          proceed.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return super.readColor(plane, window, subsampling);
      }
    };
    Map<String, FakePlaneReader> small = new HashMap<>();
    small.put(ALLOWED + "a.tif", busy);
    for (int i = 0; i < 5; i++) {
      small.put(ALLOWED + "b" + i + ".tif", FakePlaneReader.world(256, Color.GREEN));
    }
    Cache<String, CogHandle> one = CogTiler.withLoader(
      Cache2kBuilder.of(String.class, CogHandle.class).entryCapacity(1), small::get).build();
    CogTiler single = new CogTiler(new OriginPolicy(Arrays.asList(ALLOWED)), one);

    AtomicReference<Optional<Tile>> result = new AtomicReference<>();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread reader = new Thread(() -> {
      try {
        result.set(single.getTile(ALLOWED + "a.tif", 0, 0, 0, "png"));
      } catch (Throwable t) {
        failure.set(t);
      }
    });
    reader.start();
    try {
      assertTrue(reading.await(10, TimeUnit.SECONDS));
      for (int i = 0; i < 5; i++) {
        single.getInfo(ALLOWED + "b" + i + ".tif");
      }
      assertFalse(one.containsKey(ALLOWED + "a.tif"));
      assertFalse(busy.closed);
    } finally {
      proceed.countDown();
      reader.join(10000);
    }

    assertEquals(null, failure.get());
    assertTrue(result.get().isPresent());
    assertTrue(busy.closed);
    single.close();
    one.close();
  }
}
