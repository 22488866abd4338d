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

import org.iomaps.common.pmtiles.PMTilesHeader;
import org.iomaps.common.projection.FixedPoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;

/**
 * A container object to produce JSON in TileJSON format.
 * @see <a href="https://github.com/mapbox/tilejson-spec">TileJSON</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TileJson {
  private String tilejson = "3.0.0";
  private String scheme = "xyz";
  @JsonProperty("vector_layers")
  private JsonNode vectorLayers;
  private String attribution;
  private String description;
  private String name;
  private String version;
  private double[] bounds;
  private double[] center;
  private int minzoom;
  private int maxzoom;
  private String[] tiles;

  /**
   * Describes an archive, or the merged view of a mosaic, from its header and metadata.
   *
   * @param attributionSuffix appended to the metadata attribution, null to leave it untouched
   */
  public static TileJson describe(PMTilesHeader header, JsonNode metadata, String attributionSuffix) {
    TileJson json = new TileJson();
    json.setVectorLayers(metadata.get("vector_layers"));
    json.setAttribution(extendAttribution(text(metadata, "attribution"), attributionSuffix));
    json.setDescription(text(metadata, "description"));
    json.setName(text(metadata, "name"));
    json.setVersion(text(metadata, "version"));
    json.setBounds(new double[] {
      FixedPoint.toDegrees(header.getMinLonE7()),
      FixedPoint.toDegrees(header.getMinLatE7()),
      FixedPoint.toDegrees(header.getMaxLonE7()),
      FixedPoint.toDegrees(header.getMaxLatE7())
    });
    // the zoom is not a scaled value
    json.setCenter(new double[] {
      FixedPoint.toDegrees(header.getCenterLonE7()),
      FixedPoint.toDegrees(header.getCenterLatE7()),
      header.getCenterZoom()
    });
    json.setMinzoom(header.getMinZoom());
    json.setMaxzoom(header.getMaxZoom());
    return json;
  }

  static String extendAttribution(String attribution, String suffix) {
    if (suffix == null) {
      return attribution;
    }
    if (Strings.isNullOrEmpty(attribution)) {
      return suffix.replaceFirst("^\\s*-\\s*", "");
    }
    return attribution + suffix;
  }

  private static String text(JsonNode metadata, String field) {
    JsonNode node = metadata.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  public String getTilejson() {
    return tilejson;
  }

  public void setTilejson(String tilejson) {
    this.tilejson = tilejson;
  }

  public String getScheme() {
    return scheme;
  }

  public void setScheme(String scheme) {
    this.scheme = scheme;
  }

  public JsonNode getVectorLayers() {
    return vectorLayers;
  }

  public void setVectorLayers(JsonNode vectorLayers) {
    this.vectorLayers = vectorLayers;
  }

  public String getAttribution() {
    return attribution;
  }

  public void setAttribution(String attribution) {
    this.attribution = attribution;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public double[] getBounds() {
    return bounds;
  }

  public void setBounds(double[] bounds) {
    this.bounds = bounds;
  }

  public double[] getCenter() {
    return center;
  }

  public void setCenter(double[] center) {
    this.center = center;
  }

  public int getMinzoom() {
    return minzoom;
  }

  public void setMinzoom(int minzoom) {
    this.minzoom = minzoom;
  }

  public int getMaxzoom() {
    return maxzoom;
  }

  public void setMaxzoom(int maxzoom) {
    this.maxzoom = maxzoom;
  }

  public String[] getTiles() {
    return tiles;
  }

  public void setTiles(String[] tiles) {
    this.tiles = tiles;
  }
}
