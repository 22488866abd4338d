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

import org.cache2k.Cache;
import org.cache2k.config.Cache2kConfig;
import org.cache2k.extra.spring.SpringCache2kCacheManager;
import org.iomaps.tiles.cog.CogOpener;
import org.iomaps.tiles.cog.CogTiler;
import org.iomaps.tiles.cog.OriginPolicy;
import org.iomaps.tiles.cog.CogHandle;
import org.iomaps.tiles.config.ConfigUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.core.instrument.MeterRegistry;

@Configuration
@EnableCaching
public class CacheConfiguration {
  static final String COG_CACHE = "cogCache";

  @ConfigurationProperties(prefix = "cache.cog")
  @Bean
  public Cache2kConfig<String, CogHandle> cogCache2kConfig() {
    Cache2kConfig<String, CogHandle> config = new Cache2kConfig<>();
    config.setEntryCapacity(100);
    return config;
  }

  @Bean
  public SpringCache2kCacheManager cacheManager() {
    return new SpringCache2kCacheManager();
  }

  @Bean(destroyMethod = "close")
  public CogTiler cogTiler(OriginPolicy policy, CogOpener opener, Cache2kConfig<String, CogHandle> cogCache2kConfig,
                           SpringCache2kCacheManager cacheManager, MeterRegistry meterRegistry) {
    cacheManager.addCaches(b -> CogTiler.withLoader(
      cogCache2kConfig.builder().manager(cacheManager.getNativeCacheManager()).name(COG_CACHE), opener));
    Cache<String, CogHandle> cache = cacheManager.getNativeCacheManager().getCache(COG_CACHE);
    ConfigUtils.registerCacheMetrics(cache, meterRegistry);
    return new CogTiler(policy, cache);
  }
}
