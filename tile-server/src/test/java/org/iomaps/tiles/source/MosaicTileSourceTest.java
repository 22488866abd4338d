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
package org.iomaps.tiles.source;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.iomaps.common.error.MapsException;
import org.iomaps.common.projection.FixedPoint;
import org.iomaps.common.projection.FixedPointBounds;
import org.iomaps.common.projection.TileCoordinate;
import org.iomaps.tiles.TileServerConfiguration;
import org.junit.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.iomaps.tiles.source.Fakes.MAPPER;
import static org.iomaps.tiles.source.Fakes.headerJson;
import static org.iomaps.tiles.source.Fakes.shardJson;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MosaicTileSourceTest {
  private static final String DESCRIPTOR = "https://example.org/data/india/mosaic.json";

  private final Fakes.Readers readers = new Fakes.Readers();
  private final Fakes.Opener opener = new Fakes.Opener();

  private MosaicTileSource source(int threshold) {
    TileServerConfiguration.SourceConfiguration config = new TileServerConfiguration.SourceConfiguration();
    config.setName("cadastrals");
    config.setUrl(DESCRIPTOR);
    config.setType(TileServerConfiguration.SourceType.RASTER);
    config.setHandlerType(TileServerConfiguration.HandlerType.MOSAIC);
    return new MosaicTileSource(config, " - Collected by DataMeet", readers, opener, threshold);
  }

  private static String served(Optional<Tile> tile) {
    return new String(tile.get().getData(), StandardCharsets.UTF_8);
  }

  /**
   * Three overlapping shards, all zooms 0-14.
   */
  private void legacyMosaic() {
    ObjectNode d = MAPPER.createObjectNode();
    d.set("../a.pmtiles", shardJson(headerJson(0, 0, 10, 10, 0, 14), "a"));
    d.set("../b.pmtiles", shardJson(headerJson(5, 5, 15, 15, 0, 14), "b"));
    d.set("../c.pmtiles", shardJson(headerJson(-5, -5, 5, 5, 0, 14), "c"));
    readers.put(DESCRIPTOR, d.toString());
  }

  @Test
  public void testLegacyHeadersAreMerged() {
    legacyMosaic();
    TileJson json = source(8).getTileJson();
    assertArrayEquals(new double[] {-5, -5, 15, 15}, json.getBounds(), 1e-9);
    assertEquals(0, json.getMinzoom());
    assertEquals(14, json.getMaxzoom());
    // the first shard stands for the mosaic
    assertEquals("a", json.getName());
    assertEquals("Survey of a - Collected by DataMeet", json.getAttribution());
    // center zoom is not scaled
    assertEquals(0, json.getCenter()[2], 0);
    assertEquals(5, json.getCenter()[0], 1e-9);
  }

  @Test
  public void testLegacyKeysDropParentPrefix() {
    legacyMosaic();
    MosaicDescriptor descriptor = source(8).getDescriptor();
    assertEquals(0, descriptor.getGeneration());
    assertEquals("https://example.org/data/india/a.pmtiles", descriptor.getShards().get(0).getLocator());
    assertEquals("../a.pmtiles", descriptor.getShards().get(0).getKey());
  }

  @Test
  public void testOutsideCoverageIsEmpty() {
    legacyMosaic();
    MosaicTileSource mosaic = source(8);
    // 1/0/0 covers the whole north west quarter of the world
    assertFalse(mosaic.getTile(1, 0, 0).isPresent());
    // far away at zoom 10
    assertFalse(mosaic.getTile(10, 100, 100).isPresent());
    // inside the extent but beyond the zoom range
    TileCoordinate deep = tileAt(2, 2, 15);
    assertFalse(mosaic.getTile(deep.getZ(), deep.getX(), deep.getY()).isPresent());
    assertNull(mosaic.findShard(30, 0, 0));
  }

  @Test
  public void testOverlapResolvesToFirstShard() {
    legacyMosaic();
    MosaicTileSource mosaic = source(8);
    // the zoom 7 tile at 7,7 is inside a and b
    TileCoordinate both = tileAt(7, 7, 7);
    String first = served(mosaic.getTile(both.getZ(), both.getX(), both.getY()));
    assertTrue(first, first.endsWith("/a.pmtiles@7/" + both.getX() + "/" + both.getY()));
    for (int i = 0; i < 5; i++) {
      assertEquals(first, served(mosaic.getTile(both.getZ(), both.getX(), both.getY())));
    }
    // only inside b
    TileCoordinate onlyB = tileAt(12, 12, 7);
    assertEquals("b", lastPathElement(mosaic.findShard(onlyB.getZ(), onlyB.getX(), onlyB.getY())));
    assertEquals("image/png", mosaic.getTile(onlyB.getZ(), onlyB.getX(), onlyB.getY()).get().getMediaType());
  }

  @Test
  public void testOverlapOrderDecides() {
    // tile 5/10/12 spans about -67.5,31.95 to -56.25,40.98
    ObjectNode d = MAPPER.createObjectNode();
    d.set("wide.pmtiles", shardJson(headerJson(-80, 20, -40, 50, 0, 12), "wide"));
    d.set("narrow.pmtiles", shardJson(headerJson(-70, 30, -50, 45, 0, 12), "narrow"));
    readers.put(DESCRIPTOR, d.toString());
    for (int threshold : new int[] {1, 8}) {
      MosaicTileSource mosaic = source(threshold);
      for (int i = 0; i < 3; i++) {
        assertEquals("wide", lastPathElement(mosaic.findShard(5, 10, 12)));
      }
    }

    d = MAPPER.createObjectNode();
    d.set("narrow.pmtiles", shardJson(headerJson(-70, 30, -50, 45, 0, 12), "narrow"));
    d.set("wide.pmtiles", shardJson(headerJson(-80, 20, -40, 50, 0, 12), "wide"));
    readers.put(DESCRIPTOR, d.toString());
    assertEquals("narrow", lastPathElement(source(8).findShard(5, 10, 12)));
  }

  @Test
  public void testExactlyOneShardForDisjointShards() {
    ObjectNode d = MAPPER.createObjectNode();
    d.set("west.pmtiles", shardJson(headerJson(70, 10, 80, 20, 0, 14), "west"));
    d.set("east.pmtiles", shardJson(headerJson(80, 10, 90, 20, 0, 14), "east"));
    readers.put(DESCRIPTOR, d.toString());
    MosaicTileSource mosaic = source(8);
    TileCoordinate w = tileAt(75, 15, 10);
    TileCoordinate e = tileAt(85, 15, 10);
    assertEquals("west", lastPathElement(mosaic.findShard(w.getZ(), w.getX(), w.getY())));
    assertEquals("east", lastPathElement(mosaic.findShard(e.getZ(), e.getX(), e.getY())));
    // a tile straddling the two is contained by neither
    assertNull(mosaic.findShard(3, 5, 3));
  }

  @Test
  public void testVersionedDescriptor() {
    ObjectNode d = MAPPER.createObjectNode();
    d.put("version", "1");
    d.set("header", headerJson(60, 0, 100, 40, 2, 16));
    d.putObject("metadata").put("name", "All India").put("description", "Village boundaries");
    ObjectNode slices = d.putObject("slices");
    slices.set("part-1.pmtiles", shardJson(headerJson(60, 0, 80, 40, 2, 16), "part 1"));
    slices.set("../shared/part-2.pmtiles", shardJson(headerJson(80, 0, 100, 40, 2, 16), "part 2"));
    readers.put(DESCRIPTOR, d.toString());

    MosaicTileSource mosaic = source(8);
    MosaicDescriptor descriptor = mosaic.getDescriptor();
    assertEquals(1, descriptor.getGeneration());
    assertEquals("https://example.org/data/india/part-1.pmtiles", descriptor.getShards().get(0).getLocator());
    assertEquals("https://example.org/data/shared/part-2.pmtiles", descriptor.getShards().get(1).getLocator());

    TileJson json = mosaic.getTileJson();
    assertEquals("All India", json.getName());
    assertEquals("Village boundaries", json.getDescription());
    assertArrayEquals(new double[] {60, 0, 100, 40}, json.getBounds(), 1e-9);
    assertEquals(2, json.getMinzoom());
    assertEquals(16, json.getMaxzoom());

    TileCoordinate t = tileAt(90, 20, 12);
    assertTrue(served(mosaic.getTile(t.getZ(), t.getX(), t.getY())).contains("/shared/part-2.pmtiles@12/"));
  }

  @Test
  public void testConcurrentFirstCallsFetchDescriptorOnce() throws Exception {
    legacyMosaic();
    readers.delayMs = 200;
    MosaicTileSource mosaic = source(8);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<TileJson>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(pool.submit(mosaic::getTileJson));
      }
      for (Future<TileJson> f : results) {
        assertEquals("a", f.get(10, TimeUnit.SECONDS).getName());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, readers.opens(DESCRIPTOR));
  }

  @Test
  public void testInitializedOnlyOnce() {
    legacyMosaic();
    MosaicTileSource mosaic = source(8);
    MosaicDescriptor first = mosaic.getDescriptor();
    mosaic.getTileJson();
    mosaic.getTile(7, 64, 63);
    assertSame(first, mosaic.getDescriptor());
    assertEquals(1, readers.opens(DESCRIPTOR));
  }

  @Test
  public void testFailedInitializationIsRetried() {
    legacyMosaic();
    readers.failuresRemaining.set(1);
    MosaicTileSource mosaic = source(8);
    try {
      mosaic.getTileJson();
      fail("Descriptor fetch should fail");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.RESOURCE_UNAVAILABLE, e.getKind());
    }
    assertEquals("a", mosaic.getTileJson().getName());
    assertEquals(2, readers.opens(DESCRIPTOR));
  }

  @Test
  public void testBrokenShardOnlyFailsItsTiles() {
    ObjectNode d = MAPPER.createObjectNode();
    d.set("broken.pmtiles", shardJson(headerJson(70, 10, 80, 20, 0, 14), "broken"));
    d.set("fine.pmtiles", shardJson(headerJson(80, 10, 90, 20, 0, 14), "fine"));
    readers.put(DESCRIPTOR, d.toString());
    MosaicTileSource mosaic = source(8);

    TileCoordinate b = tileAt(75, 15, 10);
    try {
      mosaic.getTile(b.getZ(), b.getX(), b.getY());
      fail("Broken shard should fail");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.RESOURCE_UNAVAILABLE, e.getKind());
    }
    TileCoordinate f = tileAt(85, 15, 10);
    assertTrue(mosaic.getTile(f.getZ(), f.getX(), f.getY()).isPresent());
    // shards open once, lazily
    mosaic.getTile(f.getZ(), f.getX(), f.getY());
    assertEquals(1, opener.opens.get("https://example.org/data/india/fine.pmtiles").get());
  }

  @Test
  public void testIndexedAndScannedBucketsAgree() {
    Random random = new Random(42);
    List<ShardEntry> shards = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      double w = 60 + random.nextInt(30);
      double s = 5 + random.nextInt(25);
      double size = 1 + random.nextInt(8);
      shards.add(new ShardEntry("s" + i, "s" + i, i, Fakes.header(w, s, w + size, s + size, 4, 12), null, opener));
    }
    ShardIndex indexed = new ShardIndex(shards, 1);
    ShardIndex scanned = new ShardIndex(shards, 1000);
    assertTrue(indexed.isIndexed(8));
    assertFalse(scanned.isIndexed(8));

    int matches = 0;
    for (int z : new int[] {4, 6, 8, 10}) {
      for (int i = 0; i < 400; i++) {
        TileCoordinate t = tileAt(60 + random.nextDouble() * 40, 5 + random.nextDouble() * 35, z);
        FixedPointBounds bounds = FixedPoint.toFixed(t.wgs84Bounds());
        ShardEntry a = indexed.find(z, bounds);
        ShardEntry b = scanned.find(z, bounds);
        assertSame(t.toString(), b, a);
        if (a != null) {
          matches++;
        }
      }
    }
    assertTrue(matches > 0);
  }

  private static String lastPathElement(ShardEntry shard) {
    String locator = shard.getLocator();
    String file = locator.substring(locator.lastIndexOf('/') + 1);
    return file.substring(0, file.indexOf('.'));
  }

  /**
   * The tile containing a point.
   */
  static TileCoordinate tileAt(double lon, double lat, int z) {
    int n = 1 << z;
    long x = (long) Math.floor((lon + 180) / 360 * n);
    double latRad = Math.toRadians(lat);
    long y = (long) Math.floor((1 - Math.log(Math.tan(latRad) + 1 / Math.cos(latRad)) / Math.PI) / 2 * n);
    return TileCoordinate.of(z, x, y);
  }
}
