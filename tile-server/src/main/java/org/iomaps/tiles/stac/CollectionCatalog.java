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
package org.iomaps.tiles.stac;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.iomaps.common.concurrent.SingleFlight;
import org.iomaps.common.error.MapsException;
import org.iomaps.common.io.RangeReader;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.common.io.ReadFailures;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Stopwatch;

/**
 * A STAC API over collections of features stored as GeoParquet files.
 *
 * The catalog description is read on first use.  Each collection's file is decoded in full the first time it is
 * needed and kept for the life of the process, and filtering by box is a scan over the decoded features.
 */
public class CollectionCatalog {
  private static final Logger LOG = LoggerFactory.getLogger(CollectionCatalog.class);

  public static final int DEFAULT_COLLECTION_LIMIT = 100;
  public static final int DEFAULT_ITEM_LIMIT = 10;

  static final String STAC_VERSION = "1.0.0";
  static final String ROOT = "/stac";
  static final String JSON = "application/json";
  static final String GEOJSON = "application/geo+json";
  static final List<String> CONFORMANCE = Collections.unmodifiableList(Arrays.asList(
    "https://api.stacspec.org/v1.0.0/core",
    "https://api.stacspec.org/v1.0.0/collections",
    "https://api.stacspec.org/v1.0.0/item-search",
    "http://www.opengis.net/spec/ogcapi-features-1/1.0/conf/core",
    "http://www.opengis.net/spec/ogcapi-features-1/1.0/conf/geojson"));

  private final String catalogLocator;
  private final RangeReaderFactory readers;
  private final RowReader rowReader;
  private final FeatureRows featureRows;
  private final ObjectMapper mapper;
  private final SingleFlight<Catalog> catalog;
  private final ConcurrentMap<String, SingleFlight<List<FeatureRecord>>> records = new ConcurrentHashMap<>();

  /**
   * The parsed catalog description.
   */
  private static class Catalog {
    private final JsonNode description;
    private final Map<String, CollectionDescriptor> collections;

    Catalog(JsonNode description, Map<String, CollectionDescriptor> collections) {
      this.description = description;
      this.collections = collections;
    }
  }

  public CollectionCatalog(String catalogLocator, RangeReaderFactory readers) {
    this(catalogLocator, readers, new GeoParquetReader(), new ObjectMapper());
  }

  CollectionCatalog(String catalogLocator, RangeReaderFactory readers, RowReader rowReader, ObjectMapper mapper) {
    this.catalogLocator = catalogLocator;
    this.readers = readers;
    this.rowReader = rowReader;
    this.mapper = mapper;
    this.featureRows = new FeatureRows(mapper);
    this.catalog = new SingleFlight<>("catalog " + catalogLocator, this::loadCatalog);
  }

  public ObjectNode getLandingPage() {
    Catalog loaded = catalog.get();
    ObjectNode landing = mapper.createObjectNode();
    landing.put("stac_version", STAC_VERSION);
    landing.put("type", "Catalog");
    landing.put("id", loaded.description.path("id").asText("stac-api"));
    landing.put("title", loaded.description.path("title").asText("STAC API"));
    landing.put("description", loaded.description.path("description")
      .asText("A STAC API serving collections from geoparquet files"));
    landing.set("conformsTo", mapper.valueToTree(CONFORMANCE));

    ArrayNode links = landing.putArray("links");
    link(links, "self", JSON, ROOT);
    link(links, "root", JSON, ROOT);
    link(links, "data", JSON, ROOT + "/collections");
    link(links, "conformance", JSON, ROOT + "/conformance");
    link(links, "search", JSON, ROOT + "/search").put("method", "GET");
    link(links, "search", JSON, ROOT + "/search").put("method", "POST");
    for (String id : loaded.collections.keySet()) {
      link(links, "child", JSON, collectionPath(id));
    }
    return landing;
  }

  public ObjectNode getConformance() {
    ObjectNode conformance = mapper.createObjectNode();
    conformance.set("conformsTo", mapper.valueToTree(CONFORMANCE));
    return conformance;
  }

  public ObjectNode listCollections(int limit, int offset) {
    checkPage(limit, offset);
    List<CollectionDescriptor> all = new ArrayList<>(catalog.get().collections.values());
    ObjectNode response = mapper.createObjectNode();
    ArrayNode collections = response.putArray("collections");
    for (CollectionDescriptor descriptor : page(all, limit, offset)) {
      collections.add(collectionJson(descriptor));
    }
    ArrayNode links = response.putArray("links");
    link(links, "self", JSON, ROOT + "/collections");
    link(links, "root", JSON, ROOT);
    return response;
  }

  /**
   * @throws MapsException of kind NOT_FOUND for an unknown collection
   */
  public ObjectNode getCollection(String id) {
    return collectionJson(descriptor(id));
  }

  /**
   * A page of a collection's features, optionally only those touching a box.
   */
  public ObjectNode getItems(String id, int limit, int offset, Envelope bbox) {
    checkPage(limit, offset);
    CollectionDescriptor descriptor = descriptor(id);
    List<FeatureRecord> matching = page(filter(records(descriptor), bbox), limit, offset);

    ObjectNode response = featureCollection(matching, limit);
    ArrayNode links = response.putArray("links");
    link(links, "self", GEOJSON, collectionPath(id) + "/items");
    link(links, "root", JSON, ROOT);
    link(links, "collection", JSON, collectionPath(id));
    return response;
  }

  /**
   * @throws MapsException of kind NOT_FOUND for an unknown collection or item
   */
  public ObjectNode getItem(String id, String itemId) {
    CollectionDescriptor descriptor = descriptor(id);
    for (FeatureRecord record : records(descriptor)) {
      if (record.getId().equals(itemId)) {
        ObjectNode feature = featureJson(record);
        ArrayNode links = feature.putArray("links");
        link(links, "self", GEOJSON, collectionPath(id) + "/items/" + itemId);
        link(links, "root", JSON, ROOT);
        link(links, "collection", JSON, collectionPath(id));
        link(links, "parent", JSON, collectionPath(id));
        return feature;
      }
    }
    throw MapsException.notFound("Item not found");
  }

  /**
   * Searches the named collections in order, or all of them, stopping once the limit is reached.  Unknown names are
   * ignored and a collection that cannot be loaded is skipped.
   */
  public ObjectNode search(SearchRequest request) {
    Catalog loaded = catalog.get();
    List<String> names = request.getCollections() != null
                         ? request.getCollections()
                         : new ArrayList<>(loaded.collections.keySet());
    int limit = request.getLimit();

    List<FeatureRecord> found = new ArrayList<>();
    for (String name : names) {
      CollectionDescriptor descriptor = loaded.collections.get(name);
      if (descriptor == null || found.size() >= limit) {
        continue;
      }
      try {
        found.addAll(filter(records(descriptor), request.getBbox()));
      } catch (MapsException e) {
        LOG.warn("Skipping collection {} in search: {}", name, e.getMessage());
      }
    }
    if (found.size() > limit) {
      found = found.subList(0, limit);
    }

    ObjectNode response = featureCollection(found, limit);
    ArrayNode links = response.putArray("links");
    link(links, "self", GEOJSON, ROOT + "/search");
    link(links, "root", JSON, ROOT);
    return response;
  }

  /**
   * @return the ids of the collections in catalog order
   */
  public List<String> getCollectionIds() {
    return new ArrayList<>(catalog.get().collections.keySet());
  }

  private CollectionDescriptor descriptor(String id) {
    CollectionDescriptor descriptor = catalog.get().collections.get(id);
    if (descriptor == null) {
      throw MapsException.notFound("Collection not found");
    }
    return descriptor;
  }

  List<FeatureRecord> records(CollectionDescriptor descriptor) {
    return records
      .computeIfAbsent(descriptor.getLocator(),
                       locator -> new SingleFlight<>("features " + locator, () -> loadRecords(descriptor)))
      .get();
  }

  private Catalog loadCatalog() {
    JsonNode description;
    try {
      description = mapper.readTree(fetch(catalogLocator));
    } catch (IOException e) {
      throw MapsException.malformed("Unable to parse catalog " + catalogLocator, e);
    }

    Map<String, CollectionDescriptor> collections = new LinkedHashMap<>();
    for (JsonNode link : description.path("links")) {
      if ("child".equals(link.path("rel").asText()) && link.hasNonNull("geoparquet")) {
        String id = link.path("href").asText().replaceFirst("^\\./", "").replaceFirst("/$", "");
        String title = link.hasNonNull("title") ? link.get("title").asText() : id;
        String locator = RangeReaderFactory.resolve(catalogLocator, link.get("geoparquet").asText());
        collections.put(id, new CollectionDescriptor(id, title, locator));
      }
    }
    LOG.info("Loaded catalog {} with {} collections", catalogLocator, collections.size());
    return new Catalog(description, Collections.unmodifiableMap(collections));
  }

  private List<FeatureRecord> loadRecords(CollectionDescriptor descriptor) {
    Stopwatch timer = Stopwatch.createStarted();
    byte[] file = fetch(descriptor.getLocator());
    List<Map<String, Object>> rows = rowReader.read(descriptor.getLocator(), file);
    List<FeatureRecord> decoded = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      decoded.add(featureRows.toRecord(rows.get(i), i));
    }
    LOG.info("Loaded {} features for collection {} in {}", decoded.size(), descriptor.getId(), timer);
    return Collections.unmodifiableList(decoded);
  }

  private byte[] fetch(String locator) {
    try (RangeReader reader = readers.open(locator)) {
      return reader.readAll();
    } catch (IOException e) {
      throw ReadFailures.translate(locator, e);
    }
  }

  private static List<FeatureRecord> filter(List<FeatureRecord> records, Envelope bbox) {
    if (bbox == null) {
      return records;
    }
    List<FeatureRecord> matching = new ArrayList<>();
    for (FeatureRecord record : records) {
      if (record.intersects(bbox)) {
        matching.add(record);
      }
    }
    return matching;
  }

  private static <T> List<T> page(List<T> all, int limit, int offset) {
    int from = Math.min(offset, all.size());
    int to = (int) Math.min((long) from + limit, all.size());
    return all.subList(from, to);
  }

  private static void checkPage(int limit, int offset) {
    if (limit < 0 || offset < 0) {
      throw MapsException.badRequest("Limit and offset must not be negative");
    }
  }

  private ObjectNode collectionJson(CollectionDescriptor descriptor) {
    ObjectNode collection = mapper.createObjectNode();
    collection.put("stac_version", STAC_VERSION);
    collection.put("type", "Collection");
    collection.put("id", descriptor.getId());
    collection.put("title", descriptor.getTitle());
    collection.put("description", "Collection " + descriptor.getId());
    collection.put("license", "proprietary");

    ObjectNode extent = collection.putObject("extent");
    ArrayNode world = extent.putObject("spatial").putArray("bbox").addArray();
    world.add(-180).add(-90).add(180).add(90);
    ArrayNode interval = extent.putObject("temporal").putArray("interval").addArray();
    interval.addNull().addNull();

    ArrayNode links = collection.putArray("links");
    link(links, "self", JSON, collectionPath(descriptor.getId()));
    link(links, "root", JSON, ROOT);
    link(links, "items", GEOJSON, collectionPath(descriptor.getId()) + "/items");
    return collection;
  }

  private ObjectNode featureCollection(List<FeatureRecord> features, int limit) {
    ObjectNode response = mapper.createObjectNode();
    response.put("type", "FeatureCollection");
    ArrayNode array = response.putArray("features");
    for (FeatureRecord record : features) {
      ObjectNode feature = featureJson(record);
      feature.putArray("links");
      array.add(feature);
    }
    ObjectNode context = response.putObject("context");
    context.put("returned", features.size());
    context.put("limit", limit);
    return response;
  }

  ObjectNode featureJson(FeatureRecord record) {
    ObjectNode feature = mapper.createObjectNode();
    feature.put("type", "Feature");
    feature.put("stac_version", record.getStacVersion());
    feature.put("id", record.getId());
    if (record.getGeometry() != null) {
      GeoJsonWriter writer = new GeoJsonWriter();
      writer.setEncodeCRS(false);
      try {
        feature.set("geometry", mapper.readTree(writer.write(record.getGeometry())));
      } catch (JsonProcessingException e) {
        throw MapsException.wrap("Unable to write geometry of " + record.getId(), e);
      }
    } else {
      feature.putNull("geometry");
    }
    if (record.getBbox() != null) {
      ArrayNode bbox = feature.putArray("bbox");
      for (double value : record.getBbox()) {
        bbox.add(value);
      }
    }
    feature.set("properties", record.getProperties());
    feature.set("assets", record.getAssets());
    if (record.getCollection() != null) {
      feature.put("collection", record.getCollection());
    } else {
      feature.putNull("collection");
    }
    return feature;
  }

  private static String collectionPath(String id) {
    return ROOT + "/collections/" + id;
  }

  private static ObjectNode link(ArrayNode links, String rel, String type, String href) {
    ObjectNode link = links.addObject();
    link.put("rel", rel);
    link.put("type", type);
    link.put("href", href);
    return link;
  }
}
