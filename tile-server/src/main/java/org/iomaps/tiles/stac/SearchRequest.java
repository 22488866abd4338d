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

import java.util.ArrayList;
import java.util.List;

import org.iomaps.common.error.MapsException;
import org.locationtech.jts.geom.Envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;

import lombok.Value;

/**
 * An item search across collections.  A null collection list searches every collection.
 */
@Value
public class SearchRequest {
  public static final int DEFAULT_LIMIT = 10;

  List<String> collections;
  int limit;
  Envelope bbox;

  /**
   * From query parameters, where collections are comma separated and the box is west,south,east,north.
   */
  public static SearchRequest fromQuery(String collections, Integer limit, String bbox) {
    List<String> names = null;
    if (collections != null) {
      names = new ArrayList<>(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(collections));
    }
    return new SearchRequest(names, checkLimit(limit), parseBbox(bbox));
  }

  /**
   * From a JSON body, accepting collections and bbox either as arrays or as comma separated strings.
   */
  public static SearchRequest fromJson(JsonNode body) {
    if (body == null || body.isNull() || body.isMissingNode()) {
      return new SearchRequest(null, DEFAULT_LIMIT, null);
    }
    if (!body.isObject()) {
      throw MapsException.badRequest("Search body must be a JSON object");
    }

    List<String> names = null;
    JsonNode collections = body.get("collections");
    if (collections != null && collections.isArray()) {
      names = new ArrayList<>();
      for (JsonNode name : collections) {
        names.add(name.asText());
      }
    } else if (collections != null && collections.isTextual()) {
      names = fromQuery(collections.asText(), null, null).getCollections();
    }

    JsonNode limit = body.get("limit");
    if (limit != null && !limit.isNull() && !limit.canConvertToInt()) {
      throw MapsException.badRequest("Invalid limit: " + limit);
    }

    JsonNode bbox = body.get("bbox");
    Envelope box = null;
    if (bbox != null && bbox.isArray()) {
      if (bbox.size() != 4) {
        throw MapsException.badRequest("Invalid bbox: " + bbox);
      }
      box = envelope(bbox.get(0).asDouble(), bbox.get(1).asDouble(), bbox.get(2).asDouble(), bbox.get(3).asDouble());
    } else if (bbox != null && bbox.isTextual()) {
      box = parseBbox(bbox.asText());
    }
    return new SearchRequest(names, checkLimit(limit == null || limit.isNull() ? null : limit.asInt()), box);
  }

  /**
   * Parses west,south,east,north into an envelope, returning null for a missing box.
   *
   * @throws MapsException of kind BAD_REQUEST for anything else
   */
  public static Envelope parseBbox(String bbox) {
    if (bbox == null || bbox.trim().isEmpty()) {
      return null;
    }
    List<String> parts = Splitter.on(',').trimResults().splitToList(bbox);
    if (parts.size() != 4) {
      throw MapsException.badRequest("Invalid bbox: " + bbox);
    }
    try {
      return envelope(Double.parseDouble(parts.get(0)), Double.parseDouble(parts.get(1)),
                      Double.parseDouble(parts.get(2)), Double.parseDouble(parts.get(3)));
    } catch (NumberFormatException e) {
      throw MapsException.badRequest("Invalid bbox: " + bbox);
    }
  }

  static int checkLimit(Integer limit) {
    if (limit == null) {
      return DEFAULT_LIMIT;
    }
    if (limit < 0) {
      throw MapsException.badRequest("Invalid limit: " + limit);
    }
    return limit;
  }

  private static Envelope envelope(double west, double south, double east, double north) {
    if (Double.isNaN(west) || Double.isNaN(south) || Double.isNaN(east) || Double.isNaN(north)) {
      throw MapsException.badRequest("Invalid bbox");
    }
    // boxes crossing the antimeridian are not supported
    if (west > east || south > north) {
      throw MapsException.badRequest("Invalid bbox, west must not exceed east nor south exceed north");
    }
    return new Envelope(west, east, south, north);
  }
}
