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

package com.rackspace.clustermon.app.repos;

import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.model.WindowDataset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
@Slf4j
@ConditionalOnProperty(prefix = "clustermon", name = "storage-type", havingValue = "memory")
public class InMemoryWindowDatasetRepository implements WindowDatasetRepository {

  private final ConcurrentMap<String, Map<TimeRange, WindowDataset>> datasetsByEntity =
      new ConcurrentHashMap<>();

  @Override
  public Mono<WindowDataset> load(String entityId, TimeRange timeRange) {
    return Mono.fromSupplier(() -> {
      final Map<TimeRange, WindowDataset> datasets = datasetsByEntity.get(entityId);
      return datasets != null ? datasets.get(timeRange) : null;
    });
  }

  @Override
  public Mono<Void> replaceAll(String entityId, Map<TimeRange, WindowDataset> datasets) {
    return Mono.fromRunnable(() -> {
      datasetsByEntity.put(entityId, Map.copyOf(datasets));
      log.debug("Replaced {} datasets of {}", datasets.size(), entityId);
    });
  }
}
