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

import com.rackspace.clustermon.app.config.AppProperties;
import com.rackspace.clustermon.app.downsample.ResolutionPolicy;
import com.rackspace.clustermon.app.exceptions.InvalidQueryException;
import com.rackspace.clustermon.app.model.Metadata;
import com.rackspace.clustermon.app.model.MetricsQuery;
import com.rackspace.clustermon.app.model.MetricsSeries;
import com.rackspace.clustermon.app.model.Resolution;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.SeriesData;
import com.rackspace.clustermon.app.model.TimeRange;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Answers chart queries from the pre-materialized window datasets.
 */
@Service
@Slf4j
public class MetricsService {

  private final SeriesReader seriesReader;
  private final AppProperties appProperties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public MetricsService(SeriesReader seriesReader, AppProperties appProperties,
                        MeterRegistry meterRegistry) {
    this.seriesReader = seriesReader;
    this.appProperties = appProperties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Resolves the query against the resolution policy and loads the matching series.
   *
   * @return the series, or an {@link InvalidQueryException} error when no entity is given, or a
   * {@link com.rackspace.clustermon.app.exceptions.DataUnavailableException} error when the entity
   * has no dataset for the time range
   */
  public Mono<MetricsSeries> getMetrics(MetricsQuery query) {
    return Mono.defer(() -> {
      if (!StringUtils.hasText(query.getEntityId())) {
        return Mono.error(new InvalidQueryException("entityId is required"));
      }

      final TimeRange timeRange = query.getTimeRange() != null ?
          query.getTimeRange() : ResolutionPolicy.DEFAULT_TIME_RANGE;
      final Resolution resolution = query.getResolutionOverride() != null ?
          query.getResolutionOverride() : ResolutionPolicy.forTimeRange(timeRange).getResolution();
      meterRegistry.counter("clustermon.query", "timeRange", timeRange.getLabel()).increment();
      log.debug("Querying {} of {} at {}", timeRange, query.getEntityId(), resolution);

      return seriesReader.load(query.getEntityId(), timeRange)
          .map(samples -> new MetricsSeries()
              .setEntityId(query.getEntityId())
              .setTimeRange(timeRange)
              .setResolution(resolution)
              .setData(SeriesData.fromSamples(samples))
              .setMetadata(buildMetadata(samples)));
    });
  }

  private Metadata buildMetadata(List<Sample> samples) {
    final Metadata metadata = new Metadata()
        .setTotalPoints(samples.size())
        .setAggregationMethod(appProperties.getAggregationMethod());
    if (!samples.isEmpty()) {
      metadata
          .setStartTime(samples.get(0).getTimestamp())
          .setEndTime(samples.get(samples.size() - 1).getTimestamp());
    }
    return metadata;
  }
}
