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

package com.rackspace.clustermon.app.services;

import com.rackspace.clustermon.app.config.RegenerationProperties;
import com.rackspace.clustermon.app.config.RegenerationProperties.Cluster;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Runs regeneration passes over the configured clusters, once after startup or repeatedly when
 * a period is configured.
 */
@Service
@Slf4j
@Profile("regenerate")
public class RegenerationJobProcessor {

  private final RegenerationProperties properties;
  private final WindowStoreService windowStoreService;
  private final ScheduledExecutorService executor;
  private final Set<String> inProgress = ConcurrentHashMap.newKeySet();

  @Autowired
  public RegenerationJobProcessor(RegenerationProperties properties,
                                  WindowStoreService windowStoreService,
                                  ScheduledExecutorService executor) {
    this.properties = properties;
    this.windowStoreService = windowStoreService;
    this.executor = executor;
  }

  @PostConstruct
  public void setupSchedulers() {
    if (properties.getClusters().isEmpty()) {
      log.warn("No clusters configured for regeneration");
      return;
    }
    final long initialDelay = properties.getInitialDelay().toMillis();
    if (properties.getPeriod() != null) {
      log.info("Regenerating {} clusters every {}", properties.getClusters().size(),
          properties.getPeriod());
      executor.scheduleWithFixedDelay(this::regenerateAll, initialDelay,
          properties.getPeriod().toMillis(), TimeUnit.MILLISECONDS);
    } else {
      executor.schedule(this::regenerateAll, initialDelay, TimeUnit.MILLISECONDS);
    }
  }

  @PreDestroy
  public void stop() {
    executor.shutdown();
  }

  void regenerateAll() {
    log.info("Start regeneration of {} clusters", properties.getClusters().size());
    int succeeded = 0;
    for (Cluster cluster : properties.getClusters()) {
      if (regenerate(cluster)) {
        succeeded++;
      }
    }
    log.info("Regeneration pass complete, {} of {} clusters succeeded",
        succeeded, properties.getClusters().size());
  }

  /**
   * Regenerates one cluster. A failure is logged and leaves the cluster's previous datasets in
   * place, so the remaining clusters of the pass still run.
   *
   * @return true if the cluster's datasets were replaced
   */
  boolean regenerate(Cluster cluster) {
    if (!inProgress.add(cluster.getId())) {
      log.warn("Skipping {}, its previous regeneration is still running", cluster.getId());
      return false;
    }
    try {
      windowStoreService.regenerate(cluster.getId()).block();
      log.info("Regenerated datasets of {} ({})", cluster.getName(), cluster.getId());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to regenerate datasets of {} ({})", cluster.getName(), cluster.getId(), e);
      return false;
    } finally {
      inProgress.remove(cluster.getId());
    }
  }
}
