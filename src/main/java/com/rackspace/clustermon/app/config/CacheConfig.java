/*
 * Copyright 2022 Rackspace US, Inc.
 *
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

package com.rackspace.clustermon.app.config;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.clustermon.app.model.DatasetCacheKey;
import com.rackspace.clustermon.app.model.WindowDataset;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final AppProperties appProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry, AppProperties appProperties) {
    this.meterRegistry = meterRegistry;
    this.appProperties = appProperties;
  }

  @Bean
  public AsyncCache<DatasetCacheKey, WindowDataset> windowDatasetCache() {
    // keys include the generation, so a regeneration never needs to invalidate entries
    final AsyncCache<DatasetCacheKey, WindowDataset> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getDatasetCacheSize())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "windowDatasetCache");
    return cache;
  }
}
