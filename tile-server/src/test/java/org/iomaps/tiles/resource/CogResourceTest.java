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
package org.iomaps.tiles.resource;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import org.cache2k.Cache;
import org.cache2k.Cache2kBuilder;
import org.iomaps.common.error.MapsException;
import org.iomaps.tiles.cog.CogInfo;
import org.iomaps.tiles.cog.CogOpener;
import org.iomaps.tiles.cog.CogTiler;
import org.iomaps.tiles.cog.OriginPolicy;
import org.iomaps.tiles.cog.CogHandle;
import org.iomaps.tiles.image.TileImages;
import org.iomaps.tiles.source.Tile;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.Assert.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CogResourceTest {
  private static final String ALLOWED = "https://github.com/ramSeraph/";

  private Cache<String, CogHandle> cache;
  private CogResource resource;
  private MockHttpServletResponse response;

  /**
   * Answers allowed requests for the world file at zoom 0 with fixed bytes in the requested format, and otherwise
   * goes through the opener, which refuses everything.
   */
  private static class FixedTiler extends CogTiler {
    FixedTiler(Cache<String, CogHandle> cache) {
      super(new OriginPolicy(Arrays.asList(ALLOWED)), cache);
    }

    @Override
    public Optional<Tile> getTile(String locator, int z, long x, long y, String format) {
      if (locator.equals(ALLOWED + "world.tif") && z == 0) {
        return Optional.of(new Tile(new byte[] {1, 2, 3}, TileImages.mediaType(format)));
      }
      return super.getTile(locator, z, x, y, format);
    }
  }

  @Before
  public void setUp() {
    CogOpener opener = locator -> {
      if (locator.contains("missing")) {
        throw MapsException.notFound("No such file " + locator);
      }
      throw MapsException.unavailable("Unable to read " + locator, null);
    };
    cache = CogTiler.withLoader(Cache2kBuilder.of(String.class, CogHandle.class).entryCapacity(10), opener).build();
    resource = new CogResource(new FixedTiler(cache));
    response = new MockHttpServletResponse();
  }

  @After
  public void tearDown() {
    cache.close();
  }

  @Test
  public void testMissingUrl() {
    ResponseEntity<?> tile = resource.tile(0, 0, 0, null, "webp", response);
    assertEquals(HttpStatus.BAD_REQUEST, tile.getStatusCode());
    assertEquals(CogResource.URL_REQUIRED, ((Map<?, ?>) tile.getBody()).get("error"));

    ResponseEntity<?> info = resource.info("", response);
    assertEquals(HttpStatus.BAD_REQUEST, info.getStatusCode());
    assertEquals("*", response.getHeader("Access-Control-Allow-Origin"));
  }

  @Test
  public void testTile() {
    ResponseEntity<?> tile = resource.tile(0, 0, 0, ALLOWED + "world.tif", "webp", response);
    assertEquals(HttpStatus.OK, tile.getStatusCode());
    assertEquals("image/webp", tile.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
    assertEquals("max-age=86400000", tile.getHeaders().getFirst(HttpHeaders.CACHE_CONTROL));
  }

  @Test
  public void testFailureStatusesHaveEmptyBodies() {
    ResponseEntity<?> forbidden = resource.tile(0, 0, 0, "https://example.com/world.tif", "png", response);
    assertEquals(HttpStatus.FORBIDDEN, forbidden.getStatusCode());
    assertEquals(0, ((byte[]) forbidden.getBody()).length);

    ResponseEntity<?> missing = resource.tile(1, 0, 0, ALLOWED + "missing.tif", "png", response);
    assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());

    ResponseEntity<?> unavailable = resource.tile(1, 0, 0, ALLOWED + "flaky.tif", "png", response);
    assertEquals(HttpStatus.FAILED_DEPENDENCY, unavailable.getStatusCode());
  }

  @Test
  public void testInfoFailuresPropagateToTheAdvice() {
    try {
      resource.info("https://example.com/world.tif", response);
      fail("Expected the origin to be refused");
    } catch (MapsException e) {
      assertEquals(MapsException.Kind.FORBIDDEN, e.getKind());
      ResponseEntity<Map<String, String>> body = new ErrorHandler().handle(e, response);
      assertEquals(HttpStatus.FORBIDDEN, body.getStatusCode());
      assertTrue(body.getBody().get("error").contains("whitelist"));
    }
  }

  @Test
  public void testInfoCacheControl() {
    CogTiler tiler = new CogTiler(new OriginPolicy(Arrays.asList(ALLOWED)), cache) {
      @Override
      public CogInfo getInfo(String locator) {
        return new CogInfo(new double[] {0, 0, 1, 1}, new double[] {0.5, 0.5}, new CogInfo.Extent(0, 0, 1, 1),
                           new CogInfo.Size(256, 256), new CogInfo.Size(256, 256), new double[] {1, 1}, 1, 1, 2);
      }
    };
    ResponseEntity<?> info = new CogResource(tiler).info(ALLOWED + "world.tif", response);
    assertEquals(HttpStatus.OK, info.getStatusCode());
    assertEquals("max-age=86400", info.getHeaders().getFirst(HttpHeaders.CACHE_CONTROL));
  }

  @Test
  public void testTileDefaultsToPng() throws Exception {
    MockMvc mvc = MockMvcBuilders.standaloneSetup(resource).build();
    mvc.perform(get("/cog-tiles/0/0/0").param("url", ALLOWED + "world.tif"))
      .andExpect(status().isOk())
      .andExpect(header().string("Content-Type", "image/png"));
    mvc.perform(get("/cog-tiles/0/0/0").param("url", ALLOWED + "world.tif").param("format", "webp"))
      .andExpect(status().isOk())
      .andExpect(header().string("Content-Type", "image/webp"));
  }

  @Test
  public void testDisallowedOriginIsForbidden() throws Exception {
    MockMvc mvc = MockMvcBuilders.standaloneSetup(resource).build();
    mvc.perform(get("/cog-tiles/0/0/0").param("url", "https://example.com/world.tif"))
      .andExpect(status().isForbidden())
      .andExpect(content().bytes(new byte[0]));
  }
}
