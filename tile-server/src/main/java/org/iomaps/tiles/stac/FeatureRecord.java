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

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Value;

/**
 * One feature of a collection, decoded from a GeoParquet row.
 */
@Value
public class FeatureRecord {
  String id;
  Geometry geometry;
  // west, south, east, north when the row carries one
  double[] bbox;
  JsonNode properties;
  JsonNode assets;
  String collection;
  String stacVersion;

  /**
   * @return true if the feature has a geometry touching the box, edges included
   */
  public boolean intersects(Envelope box) {
    return geometry != null && !geometry.isEmpty() && box.intersects(geometry.getEnvelopeInternal());
  }
}
