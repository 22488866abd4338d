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
import org.iomaps.tiles.stac.CollectionCatalog;
import org.iomaps.tiles.stac.SearchRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.extensions.Extension;
import io.swagger.v3.oas.annotations.extensions.ExtensionProperty;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * A read-only STAC API over the collections of the configured catalog.
 *
 * Without a configured catalog every route answers 404.
 */
@Tag(name = "STAC",
  description = "Collections and items of the STAC catalog, read from GeoParquet files.",
  extensions = @Extension(name = "Order", properties = @ExtensionProperty(name = "Order", value = "0300"))
)
@RestController
@RequestMapping(value = "/stac", produces = MediaType.APPLICATION_JSON_VALUE)
public class StacResource {
  static final String GEOJSON = "application/geo+json";
  private static final String JSON = MediaType.APPLICATION_JSON_VALUE;

  private final Optional<CollectionCatalog> catalog;

  @Autowired
  public StacResource(Optional<CollectionCatalog> catalog) {
    this.catalog = catalog;
  }

  @Operation(operationId = "getStacLanding", summary = "Landing page of the STAC API")
  @RequestMapping(method = RequestMethod.GET, value = "")
  public ObjectNode landing(HttpServletResponse response) {
    Params.enableCORS(response);
    return catalog().getLandingPage();
  }

  @Operation(operationId = "getStacConformance", summary = "Conformance classes of the STAC API")
  @RequestMapping(method = RequestMethod.GET, value = "/conformance")
  public ObjectNode conformance(HttpServletResponse response) {
    Params.enableCORS(response);
    return catalog().getConformance();
  }

  @Operation(operationId = "listStacCollections", summary = "Collections of the catalog")
  @RequestMapping(method = RequestMethod.GET, value = "/collections")
  @Timed
  public ObjectNode collections(
    @RequestParam(value = "limit", defaultValue = "100") int limit,
    @RequestParam(value = "offset", defaultValue = "0") int offset,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    return catalog().listCollections(limit, offset);
  }

  @Operation(operationId = "getStacCollection", summary = "A collection of the catalog")
  @RequestMapping(method = RequestMethod.GET, value = "/collections/{collectionId}")
  public ObjectNode collection(@PathVariable("collectionId") String collectionId, HttpServletResponse response) {
    Params.enableCORS(response);
    return catalog().getCollection(collectionId);
  }

  @Operation(
    operationId = "getStacItems",
    summary = "Items of a collection",
    description = "A page of the items of the collection, optionally only those whose point geometry lies within " +
      "the bounding box minLon,minLat,maxLon,maxLat."
  )
  @RequestMapping(method = RequestMethod.GET, value = "/collections/{collectionId}/items", produces = {GEOJSON, JSON})
  @Timed
  public ObjectNode items(
    @PathVariable("collectionId") String collectionId,
    @RequestParam(value = "limit", defaultValue = "10") int limit,
    @RequestParam(value = "offset", defaultValue = "0") int offset,
    @RequestParam(value = "bbox", required = false) String bbox,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    return catalog().getItems(collectionId, limit, offset, SearchRequest.parseBbox(bbox));
  }

  @Operation(operationId = "getStacItem", summary = "An item of a collection")
  @RequestMapping(method = RequestMethod.GET, value = "/collections/{collectionId}/items/{itemId}",
    produces = {GEOJSON, JSON})
  public ObjectNode item(
    @PathVariable("collectionId") String collectionId,
    @PathVariable("itemId") String itemId,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    return catalog().getItem(collectionId, itemId);
  }

  @Operation(
    operationId = "searchStac",
    summary = "Search items across collections",
    description = "Items of the listed collections (all when none are listed) in catalog order, up to the limit."
  )
  @RequestMapping(method = RequestMethod.GET, value = "/search", produces = {GEOJSON, JSON})
  @Timed
  public ObjectNode search(
    @RequestParam(value = "collections", required = false) String collections,
    @RequestParam(value = "limit", required = false) Integer limit,
    @RequestParam(value = "bbox", required = false) String bbox,
    HttpServletResponse response
  ) {
    Params.enableCORS(response);
    return catalog().search(SearchRequest.fromQuery(collections, limit, bbox));
  }

  @Operation(operationId = "searchStacPost", summary = "Search items across collections with a JSON body")
  @RequestMapping(method = RequestMethod.POST, value = "/search", produces = {GEOJSON, JSON},
    consumes = MediaType.APPLICATION_JSON_VALUE)
  @Timed
  public ObjectNode searchPost(@RequestBody(required = false) JsonNode body, HttpServletResponse response) {
    Params.enableCORS(response);
    return catalog().search(SearchRequest.fromJson(body));
  }

  private CollectionCatalog catalog() {
    return catalog.orElseThrow(() -> MapsException.notFound("No STAC catalog configured"));
  }
}
