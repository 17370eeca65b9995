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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rackspace.clustermon.app.config.GeneratorProperties;
import com.rackspace.clustermon.app.downsample.SampleCollectors;
import com.rackspace.clustermon.app.model.Resolution;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.model.WindowDataset;
import com.rackspace.clustermon.app.repos.InMemoryWindowDatasetRepository;
import com.rackspace.clustermon.app.repos.WindowDatasetRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class WindowStoreServiceTest {

  private static final String ENTITY_ID = "f2398d2e-f92d-482a-ab2d-4b9a9f79186c";
  private static final Instant NOW = Instant.parse("2022-03-01T14:37:00Z");

  private final Clock clock = Clock.fixed(Instant.parse("2022-03-01T14:37:25Z"), ZoneOffset.UTC);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  void publishesEveryWindow() {
    final InMemoryWindowDatasetRepository repository = new InMemoryWindowDatasetRepository();
    final WindowStoreService service = service(8, repository);

    final Map<TimeRange, WindowDataset> datasets = service.regenerate(ENTITY_ID).block();

    assertThat(datasets).containsOnlyKeys(TimeRange.values());
    assertThat(datasets.get(TimeRange.ONE_HOUR).getData().size()).isEqualTo(60);
    assertThat(datasets.get(TimeRange.SIX_HOURS).getData().size()).isEqualTo(360);
    assertThat(datasets.get(TimeRange.ONE_DAY).getData().size()).isEqualTo(1440);
    assertThat(datasets.get(TimeRange.SEVEN_DAYS).getData().size()).isEqualTo(168);
    // the generated history is shorter than 30 days, so the window holds all of it
    assertThat(datasets.get(TimeRange.THIRTY_DAYS).getData().size()).isEqualTo(8 * 24 + 1);
    assertThat(datasets.get(TimeRange.NINETY_DAYS).getData().size()).isEqualTo(9);

    final WindowDataset lastHour = datasets.get(TimeRange.ONE_HOUR);
    assertThat(lastHour.getEntityId()).isEqualTo(ENTITY_ID);
    assertThat(lastHour.getResolution()).isEqualTo(Resolution.ONE_MINUTE);
    assertThat(lastHour.getGeneratedAt()).isEqualTo(NOW);
    assertThat(lastHour.getData().getTimestamps().get(0))
        .isEqualTo(Instant.parse("2022-03-01T13:37:00Z"));
    assertThat(lastHour.getData().getTimestamps().get(59))
        .isEqualTo(Instant.parse("2022-03-01T14:36:00Z"));
    assertThat(datasets.get(TimeRange.NINETY_DAYS).getResolution()).isEqualTo(Resolution.ONE_DAY);
    assertThat(datasets.get(TimeRange.NINETY_DAYS).getData().getTimestamps())
        .allSatisfy(timestamp -> assertThat(timestamp.toString()).endsWith("T14:37:00Z"));

    StepVerifier.create(repository.load(ENTITY_ID, TimeRange.SEVEN_DAYS))
        .expectNext(datasets.get(TimeRange.SEVEN_DAYS))
        .verifyComplete();
    assertThat(meterRegistry.get("clustermon.regeneration").tag("result", "success").timer()
        .count()).isEqualTo(1);
  }

  @Test
  void windowsShareTheSameRawSamples() {
    final WindowStoreService service = service(1, new InMemoryWindowDatasetRepository());

    final Map<TimeRange, WindowDataset> datasets = service.regenerate(ENTITY_ID).block();

    final List<Sample> lastDay = datasets.get(TimeRange.ONE_DAY).getData().toSamples();
    final List<Sample> lastHour = datasets.get(TimeRange.ONE_HOUR).getData().toSamples();
    final List<Sample> lastSixHours = datasets.get(TimeRange.SIX_HOURS).getData().toSamples();
    assertThat(lastDay.subList(1440 - 60, 1440)).isEqualTo(lastHour);
    assertThat(lastDay.subList(1440 - 360, 1440)).isEqualTo(lastSixHours);
  }

  @Test
  void ninetyDaysIsBuiltFromHourlyAverages() {
    final InMemoryWindowDatasetRepository repository = new InMemoryWindowDatasetRepository();
    final WindowStoreService service = service(90, repository);

    final Map<TimeRange, WindowDataset> datasets = service.regenerate(ENTITY_ID).block();

    // 90 days ending mid-day touch 91 calendar days
    final List<Sample> daily = datasets.get(TimeRange.NINETY_DAYS).getData().toSamples();
    assertThat(daily).hasSize(91);
    StepVerifier.create(new SeriesReader(repository).load(ENTITY_ID, TimeRange.NINETY_DAYS))
        .assertNext(samples -> assertThat(samples).hasSize(90))
        .verifyComplete();

    final Instant yesterday = Instant.parse("2022-02-28T00:00:00Z");
    final List<Sample> yesterdayHourly = datasets.get(TimeRange.THIRTY_DAYS).getData().toSamples()
        .stream()
        .filter(sample -> !sample.getTimestamp().isBefore(yesterday)
            && sample.getTimestamp().isBefore(yesterday.plus(Duration.ofDays(1))))
        .collect(Collectors.toList());
    assertThat(yesterdayHourly).hasSize(24);
    final double expectedIopsRead = SampleCollectors.roundToTenth(yesterdayHourly.stream()
        .map(sample -> sample.getIops().getRead()).reduce(0.0, Double::sum) / 24);
    assertThat(daily)
        .filteredOn(sample -> sample.getTimestamp().equals(Instant.parse("2022-02-28T14:37:00Z")))
        .singleElement()
        .satisfies(sample -> assertThat(sample.getIops().getRead()).isEqualTo(expectedIopsRead));
  }

  @Test
  void failedPublishIsReported() {
    final WindowDatasetRepository repository = mock(WindowDatasetRepository.class);
    when(repository.replaceAll(anyString(), anyMap()))
        .thenReturn(Mono.error(new UncheckedIOException(new IOException("disk full"))));
    final WindowStoreService service = service(1, repository);

    StepVerifier.create(service.regenerate(ENTITY_ID))
        .verifyError(UncheckedIOException.class);

    assertThat(meterRegistry.get("clustermon.regeneration").tag("result", "failure").timer()
        .count()).isEqualTo(1);
  }

  @Test
  void windowBoundsAreInclusive() {
    final Sample atStart = sample("2022-03-01T13:37:00Z");
    final Sample before = sample("2022-03-01T13:36:00Z");
    final Sample atEnd = sample("2022-03-01T14:37:00Z");

    assertThat(WindowStoreService.window(List.of(before, atStart, atEnd),
        Instant.parse("2022-03-01T13:37:00Z"), NOW))
        .containsExactly(atStart, atEnd);
  }

  private WindowStoreService service(int spanDays, WindowDatasetRepository repository) {
    return new WindowStoreService(
        new SampleGenerator(new GeneratorProperties().setSpanDays(spanDays), new Random(3)),
        new Aggregator(clock),
        repository,
        clock,
        meterRegistry);
  }

  private static Sample sample(String timestamp) {
    return new Sample(Instant.parse(timestamp), new Sample.ReadWrite(1, 1),
        new Sample.ReadWrite(1, 1));
  }
}
