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
import reactor.core.publisher.Mono;

/**
 * Store of the window datasets of each cluster. A regeneration pass is the only writer and always
 * replaces a cluster's whole set; request handling only reads.
 */
public interface WindowDatasetRepository {

  /**
   * @return the dataset or an empty result when none has been published for the pair
   */
  Mono<WindowDataset> load(String entityId, TimeRange timeRange);

  /**
   * Publishes the given datasets as the cluster's complete set. Readers observe either the
   * previous set or the new one, never a mix of both.
   */
  Mono<Void> replaceAll(String entityId, Map<TimeRange, WindowDataset> datasets);
}
