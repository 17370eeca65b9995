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

package com.rackspace.clustermon.app.web;

import com.rackspace.clustermon.app.model.MetricsQuery;
import com.rackspace.clustermon.app.model.MetricsSeries;
import com.rackspace.clustermon.app.model.Resolution;
import com.rackspace.clustermon.app.services.MetricsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Chart data endpoint of the cluster dashboards.
 */
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

  private final MetricsService metricsService;

  @Autowired
  public MetricsController(MetricsService metricsService) {
    this.metricsService = metricsService;
  }

  @GetMapping
  public Mono<MetricsSeries> getMetrics(
      @RequestParam(required = false) String entityId,
      @RequestParam(required = false) String timeRange,
      @RequestParam(required = false) Resolution resolution) {
    return metricsService.getMetrics(MetricsQuery.of(entityId, timeRange, resolution));
  }
}
