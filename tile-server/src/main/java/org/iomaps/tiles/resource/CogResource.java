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

import java.util.Optional;

import javax.servlet.http.HttpServletResponse;

import org.iomaps.common.error.MapsException;
import org.iomaps.tiles.cog.CogInfo;
import org.iomaps.tiles.cog.CogTiler;
import org.iomaps.tiles.source.Tile;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.google.common.base.Strings;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.extensions.Extension;
import io.swagger.v3.oas.annotations.extensions.ExtensionProperty;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Dynamic tiles cut from Cloud Optimized GeoTIFFs at allowed locations.
 */
@Tag(name = "COG tiles",
  description = "Web Mercator tiles rendered on request from Cloud Optimized GeoTIFFs.",
  extensions = @Extension(name = "Order", properties = @ExtensionProperty(name = "Order", value = "0200"))
)
@RestController
public class CogResource {
  private static final Logger LOG = LoggerFactory.getLogger(CogResource.class);
  static final String URL_REQUIRED = "URL parameter is required";

  private final CogTiler tiler;

  @Autowired
  public CogResource(CogTiler tiler) {
    this.tiler = tiler;
  }

  @Operation(
    operationId = "getCogTile",
    summary = "Tile rendered from a COG",
    description = "Renders the tile from the best fitting overview of the COG, with its transparency mask applied. " +
      "A tile the image does not reach is an empty 404 response.",
    parameters = {
      @Parameter(name = "url", in = ParameterIn.QUERY, required = true,
        description = "Location of the COG, which must start with an allowed prefix."),
      @Parameter(name = "format", in = ParameterIn.QUERY,
        description = "Either png (the default) or webp.")
    }
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/cog-tiles/{z}/{x}/{y}"
  )
  @Timed
  public ResponseEntity<?> tile(
    @PathVariable("z") int z,
    @PathVariable("x") long x,
    @PathVariable("y") long y,
    @RequestParam(value = "url", required = false) String url,
    @RequestParam(value = "format", required = false, defaultValue = "png") String format,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    if (Strings.isNullOrEmpty(url)) {
      return ErrorHandler.error(HttpStatus.BAD_REQUEST, URL_REQUIRED);
    }

    try {
      Optional<Tile> tile = tiler.getTile(url, z, x, y, format);
      if (!tile.isPresent()) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new byte[0]);
      }
      return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, tile.get().getMediaType())
        .header(HttpHeaders.CACHE_CONTROL, Params.CACHE_TILES)
        .body(tile.get().getData());
    } catch (MapsException e) {
      HttpStatus status = ErrorHandler.status(e.getKind());
      if (status.is5xxServerError()) {
        LOG.error("Unable to render tile {}/{}/{} of {}", z, x, y, url, e);
      } else {
        LOG.info("Refused tile {}/{}/{} of {}: {}", z, x, y, url, e.getMessage());
      }
      return ResponseEntity.status(status).body(new byte[0]);
    }
  }

  @Operation(
    operationId = "getCogInfo",
    summary = "Description of a COG",
    description = "Bounds, center, size, tiling and resolution of the full resolution image of the COG.",
    parameters = @Parameter(name = "url", in = ParameterIn.QUERY, required = true,
      description = "Location of the COG, which must start with an allowed prefix.")
  )
  @RequestMapping(
    method = RequestMethod.GET,
    value = "/cog-info",
    produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Timed
  public ResponseEntity<?> info(
    @RequestParam(value = "url", required = false) String url,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    if (Strings.isNullOrEmpty(url)) {
      return ErrorHandler.error(HttpStatus.BAD_REQUEST, URL_REQUIRED);
    }
    CogInfo info = tiler.getInfo(url);
    return ResponseEntity.ok().header(HttpHeaders.CACHE_CONTROL, Params.CACHE_INFO).body(info);
  }
}
