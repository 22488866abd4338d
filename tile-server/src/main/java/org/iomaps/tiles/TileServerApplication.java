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

import org.iomaps.common.io.DefaultRangeReaderFactory;
import org.iomaps.common.io.RangeReaderFactory;
import org.iomaps.tiles.cog.CogOpener;
import org.iomaps.tiles.cog.ImageIOPlaneReader;
import org.iomaps.tiles.cog.OriginPolicy;
import org.iomaps.tiles.source.SourceRegistry;
import org.iomaps.tiles.stac.CollectionCatalog;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * The main entry point for running the tile server.
 */
@SpringBootApplication(scanBasePackages = "org.iomaps.tiles")
@EnableConfigurationProperties
public class TileServerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TileServerApplication.class, args);
  }

  @org.springframework.context.annotation.Configuration
  public static class WebConfiguration implements WebMvcConfigurer {
    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
      configurer.setUseTrailingSlashMatch(true);
    }
  }

  @org.springframework.context.annotation.Configuration
  public static class TileServerSpringConfiguration {

    @ConfigurationProperties
    @Bean
    TileServerConfiguration tileServerConfiguration() {
      return new TileServerConfiguration();
    }

    @Bean(destroyMethod = "close")
    DefaultRangeReaderFactory rangeReaderFactory(TileServerConfiguration configuration) {
      TileServerConfiguration.HttpConfiguration http = configuration.getHttp();
      return new DefaultRangeReaderFactory(http.getConnectTimeoutMs(), http.getReadTimeoutMs(), http.getMaxConnections());
    }

    @Bean
    SourceRegistry sourceRegistry(TileServerConfiguration configuration, RangeReaderFactory readers) {
      return SourceRegistry.fromConfiguration(configuration, readers);
    }

    @Bean
    OriginPolicy originPolicy(TileServerConfiguration configuration) {
      return new OriginPolicy(configuration.getCog().getAllowedPrefixes());
    }

    @Bean
    CogOpener cogOpener(TileServerConfiguration configuration, RangeReaderFactory readers) {
      int blockSize = configuration.getCog().getBlockSize();
      return locator -> ImageIOPlaneReader.open(readers, locator, blockSize);
    }

    /**
     * The catalog bean only exists when a catalog is configured.
     */
    @Bean
    @ConditionalOnProperty(prefix = "stac", name = "catalog")
    CollectionCatalog collectionCatalog(TileServerConfiguration configuration, RangeReaderFactory readers) {
      return new CollectionCatalog(configuration.getStac().getCatalog(), readers);
    }
  }
}
