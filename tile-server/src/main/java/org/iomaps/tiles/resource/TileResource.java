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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import javax.servlet.http.HttpServletResponse;

import org.iomaps.common.error.MapsException;
import org.iomaps.tiles.TileServerConfiguration;
import org.iomaps.tiles.image.TileImages;
import org.iomaps.tiles.source.SourceRegistry;
import org.iomaps.tiles.source.Tile;
import org.iomaps.tiles.source.TileJson;
import org.iomaps.tiles.source.TileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.extensions.Extension;
import io.swagger.v3.oas.annotations.extensions.ExtensionProperty;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Serves the tiles, TileJSON and titles of the configured PMTiles and mosaic sources.
 */
@Tag(name = "Tiles",
  description = "Pre-rendered vector and raster tiles from PMTiles archives and sharded mosaics.",
  extensions = @Extension(name = "Order", properties = @ExtensionProperty(name = "Order", value = "0100"))
)
@RestController
public class TileResource {
  private static final Logger LOG = LoggerFactory.getLogger(TileResource.class);

  private final SourceRegistry registry;
  private final TileServerConfiguration configuration;

  /**
   * A configured source as listed by the routes endpoint.
   */
  @Data
  @AllArgsConstructor
  public static class Route {
    private String name;
    private String title;
    private String type;
    private String handlerType;
    private String tileSuffix;
    private String tiles;
  }

  @Autowired
  public TileResource(SourceRegistry registry, TileServerConfiguration configuration) {
    this.registry = registry;
    this.configuration = configuration;
  }

  @Operation(
    operationId = "getTile",
    summary = "Tile of a source",
    description = "The stored tile at the address, with the media type of the archive it came from. Sources " +
      "storing WebP rasters also answer the png extension by converting the tile. A tile that does not exist, " +
      "or cannot be read, is an empty 404 response."
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/{source}/{z}/{x}/{y}.{ext}"
  )
  @Timed
  public ResponseEntity<byte[]> tile(
    @PathVariable("source") String name,
    @PathVariable("z") int z,
    @PathVariable("x") long x,
    @PathVariable("y") long y,
    @PathVariable("ext") String ext,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    Optional<TileSource> source = registry.get(name);
    if (!source.isPresent()) {
      return notFound();
    }
    String suffix = source.get().getTileSuffix();
    boolean transcode = TileImages.PNG.equals(ext) && TileImages.WEBP.equals(suffix);
    if (!ext.equals(suffix) && !transcode) {
      return notFound();
    }

    try {
      Optional<Tile> tile = source.get().getTile(z, x, y);
      if (!tile.isPresent()) {
        return notFound();
      }
      byte[] data = transcode ? TileImages.toPng(tile.get().getData()) : tile.get().getData();
      String mediaType = transcode ? MediaType.IMAGE_PNG_VALUE : tile.get().getMediaType();
      return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, mediaType)
        .header(HttpHeaders.CACHE_CONTROL, Params.CACHE_TILES)
        .body(data);
    } catch (MapsException e) {
      LOG.warn("Unable to serve tile {}/{}/{}/{}: {}", name, z, x, y, e.getMessage());
      return notFound();
    }
  }

  @Operation(
    operationId = "getTileJson",
    summary = "TileJSON of a source",
    description = "A TileJSON 3.0.0 document describing the source, with its tile URL template."
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/{source}/tiles.json",
    produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Timed
  public ResponseEntity<TileJson> tileJson(@PathVariable("source") String name, HttpServletResponse response) {
    Params.enableCORS(response);
    TileSource source = source(name);
    TileJson tileJson = source.getTileJson();
    tileJson.setTiles(new String[] {tileTemplate(source)});
    return ResponseEntity.ok().header(HttpHeaders.CACHE_CONTROL, Params.CACHE_TILES).body(tileJson);
  }

  @Operation(
    operationId = "getTitle",
    summary = "Title of a source"
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/{source}/title",
    produces = MediaType.APPLICATION_JSON_VALUE
  )
  public ResponseEntity<Map<String, String>> title(@PathVariable("source") String name, HttpServletResponse response) {
    Params.enableCORS(response);
    return ResponseEntity.ok()
      .header(HttpHeaders.CACHE_CONTROL, Params.CACHE_TILES)
      .body(Collections.singletonMap("title", source(name).getTitle()));
  }

  @Operation(
    operationId = "getRoutes",
    summary = "Configured sources",
    description = "Every configured source keyed by name."
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/api/routes",
    produces = MediaType.APPLICATION_JSON_VALUE
  )
  public Map<String, Route> routes(HttpServletResponse response) {
    Params.enableCORS(response);
    Map<String, Route> routes = new LinkedHashMap<>();
    for (TileSource source : registry.all()) {
      String handlerType = configuration.getSources().stream()
        .filter(s -> source.getName().equals(s.getName()))
        .map(s -> s.getHandlerType().name().toLowerCase())
        .findFirst()
        .orElse(null);
      routes.put(source.getName(), new Route(source.getName(), source.getTitle(),
                                             source.getType().name().toLowerCase(), handlerType,
                                             source.getTileSuffix(), tileJsonUrl(source)));
    }
    return routes;
  }

  private TileSource source(String name) {
    return registry.get(name).orElseThrow(() -> MapsException.notFound("Unknown source " + name));
  }

  private String tileTemplate(TileSource source) {
    return configuration.getServerUrl() + "/" + source.getName() + "/{z}/{x}/{y}." + source.getTileSuffix();
  }

  private String tileJsonUrl(TileSource source) {
    return configuration.getServerUrl() + "/" + source.getName() + "/tiles.json";
  }

  private static ResponseEntity<byte[]> notFound() {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new byte[0]);
  }
}
