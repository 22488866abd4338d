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
package org.iomaps.tiles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Data;

/**
 * Application configuration with sensible defaults if applicable.
 */
@Data
public class TileServerConfiguration {
  // prefix for the tile URLs advertised in TileJSON documents
  private String serverUrl = "http://localhost:3000";
  private HttpConfiguration http = new HttpConfiguration();
  private List<SourceConfiguration> sources = new ArrayList<>();
  private AttributionConfiguration attribution = new AttributionConfiguration();
  private MosaicConfiguration mosaic = new MosaicConfiguration();
  private CogConfiguration cog = new CogConfiguration();
  private StacConfiguration stac = new StacConfiguration();

  @Data
  public static class HttpConfiguration {
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
    private int maxConnections = 64;
  }

  /**
   * A named tile source, served under /{name}/.
   */
  @Data
  public static class SourceConfiguration {
    private String name;
    private String title;
    private String url;
    private HandlerType handlerType = HandlerType.PMTILES;
    private SourceType type = SourceType.VECTOR;
    // defaults to pbf for vector sources and webp for raster sources
    private String tileSuffix;
    private boolean communityAttribution = true;

    public String effectiveTileSuffix() {
      if (tileSuffix != null && !tileSuffix.isEmpty()) {
        return tileSuffix;
      }
      return type == SourceType.RASTER ? "webp" : "pbf";
    }
  }

  public enum HandlerType {
    PMTILES,
    MOSAIC
  }

  public enum SourceType {
    VECTOR,
    RASTER
  }

  @Data
  public static class AttributionConfiguration {
    private String communitySuffix =
      " - Collected by <a href=\"https://datameet.org\" target=\"_blank\">DataMeet Community</a>";
  }

  @Data
  public static class MosaicConfiguration {
    // zoom buckets with at least this many shards use an R-tree
    private int spatialIndexThreshold = 8;
  }

  @Data
  public static class CogConfiguration {
    private List<String> allowedPrefixes = new ArrayList<>(Arrays.asList(
      "https://github.com/ramSeraph/", "http://127.0.0.1:8080/"));
    // blocks of the TIFF read per range request
    private int blockSize = 65536;
  }

  @Data
  public static class StacConfiguration {
    // path or URL of the STAC catalog JSON, STAC routes are disabled when unset
    private String catalog;
  }
}
