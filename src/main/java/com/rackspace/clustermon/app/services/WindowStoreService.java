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

import com.rackspace.clustermon.app.downsample.ResolutionPolicy;
import com.rackspace.clustermon.app.downsample.ResolutionPolicy.Target;
import com.rackspace.clustermon.app.model.AggregationLevel;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.SeriesData;
import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.model.WindowDataset;
import com.rackspace.clustermon.app.repos.WindowDatasetRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Rebuilds the complete set of window datasets of a cluster from one freshly generated raw
 * series, so every window of the cluster is derived from the same samples.
 */
@Service
@Slf4j
public class WindowStoreService {

  private final SampleGenerator sampleGenerator;
  private final Aggregator aggregator;
  private final WindowDatasetRepository windowDatasetRepository;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Autowired
  public WindowStoreService(SampleGenerator sampleGenerator,
                            Aggregator aggregator,
                            WindowDatasetRepository windowDatasetRepository,
                            Clock clock,
                            MeterRegistry meterRegistry) {
    this.sampleGenerator = sampleGenerator;
    this.aggregator = aggregator;
    this.windowDatasetRepository = windowDatasetRepository;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates, aggregates and publishes all datasets of the cluster. Nothing is published when
   * any step fails.
   *
   * @return the published datasets
   */
  public Mono<Map<TimeRange, WindowDataset>> regenerate(String entityId) {
    return Mono.defer(() -> {
      final Instant now = clock.instant().truncatedTo(ChronoUnit.MINUTES);
      final Timer.Sample timing = Timer.start(meterRegistry);
      log.info("Regenerating datasets of {} ending at {}", entityId, now);

      return sampleGenerator.generate(now).collectList()
          .flatMap(raw -> aggregator.toHourly(Flux.fromIterable(raw)).collectList()
              .flatMap(hourly -> aggregator.toDaily(Flux.fromIterable(hourly)).collectList()
                  .map(daily -> {
                    log.info("Derived {} hourly samples from {} raw and {} daily samples from {} hourly",
                        hourly.size(), raw.size(), daily.size(), hourly.size());
                    return buildDatasets(entityId, now,
                        Map.of(
                            AggregationLevel.raw, raw,
                            AggregationLevel.hourly, hourly,
                            AggregationLevel.daily, daily
                        ));
                  })))
          .flatMap(datasets -> windowDatasetRepository.replaceAll(entityId, datasets)
              .thenReturn(datasets))
          .doOnSuccess(datasets -> {
            timing.stop(meterRegistry.timer("clustermon.regeneration", "result", "success"));
            log.info("Published datasets of {}: {}", entityId, describe(datasets));
          })
          .doOnError(throwable -> {
            timing.stop(meterRegistry.timer("clustermon.regeneration", "result", "failure"));
            log.error("Regeneration of {} failed, previous datasets left in place", entityId,
                throwable);
          });
    });
  }

  Map<TimeRange, WindowDataset> buildDatasets(String entityId, Instant now,
                                              Map<AggregationLevel, List<Sample>> sources) {
    final Map<TimeRange, WindowDataset> datasets = new EnumMap<>(TimeRange.class);
    for (TimeRange timeRange : TimeRange.values()) {
      final Target target = ResolutionPolicy.forTimeRange(timeRange);
      final List<Sample> source = sources.get(target.getSourceLevel());
      // the daily dataset carries the whole history
      final List<Sample> windowed = target.getSourceLevel() == AggregationLevel.daily ?
          source : window(source, now.minus(timeRange.getSpan()), now);

      datasets.put(timeRange, new WindowDataset()
          .setEntityId(entityId)
          .setTimeRange(timeRange)
          .setResolution(target.getResolution())
          .setGeneratedAt(now)
          .setData(SeriesData.fromSamples(windowed)));
    }
    return datasets;
  }

  /**
   * @return the samples within <code>[from, to]</code>, both inclusive
   */
  static List<Sample> window(List<Sample> samples, Instant from, Instant to) {
    return samples.stream()
        .filter(sample -> !sample.getTimestamp().isBefore(from) && !sample.getTimestamp().isAfter(to))
        .collect(Collectors.toList());
  }

  private static String describe(Map<TimeRange, WindowDataset> datasets) {
    return datasets.entrySet().stream()
        .map(entry -> entry.getKey() + "=" + entry.getValue().getData().size())
        .collect(Collectors.joining(", "));
  }
}
