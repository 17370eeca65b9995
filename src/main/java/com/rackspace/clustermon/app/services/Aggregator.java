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

import com.rackspace.clustermon.app.downsample.AggregatedSample;
import com.rackspace.clustermon.app.downsample.BucketNormalizer;
import com.rackspace.clustermon.app.downsample.SampleCollectors;
import com.rackspace.clustermon.app.exceptions.AggregationInvariantException;
import com.rackspace.clustermon.app.model.Sample;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjuster;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Derives hourly samples from raw ones and daily samples from hourly ones by averaging each
 * channel per bucket. Daily data is only ever derived from hourly data.
 */
@Service
@Slf4j
public class Aggregator {

  static final Duration HOUR = Duration.ofHours(1);
  static final Duration DAY = Duration.ofDays(1);

  private final Clock clock;

  @Autowired
  public Aggregator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Averages raw samples into one sample per UTC hour, stamped at the start of the hour.
   */
  public Flux<Sample> toHourly(Flux<Sample> raw) {
    final BucketNormalizer hourNormalizer = new BucketNormalizer(HOUR);
    return aggregate(raw, hourNormalizer, hourNormalizer);
  }

  /**
   * Averages hourly samples into one sample per UTC day. Each daily sample is stamped with its
   * day plus the current wall-clock hour and minute, so every point of a 90 day chart carries the
   * same time of day.
   */
  public Flux<Sample> toDaily(Flux<Sample> hourly) {
    final long secondOfDay = LocalTime.now(clock).truncatedTo(ChronoUnit.MINUTES).toSecondOfDay();
    final BucketNormalizer dayNormalizer = new BucketNormalizer(DAY);
    return aggregate(hourly, dayNormalizer,
        temporal -> temporal.with(dayNormalizer).plus(secondOfDay, ChronoUnit.SECONDS));
  }

  private Flux<Sample> aggregate(Flux<Sample> source, BucketNormalizer bucket,
                                 TemporalAdjuster bucketStamp) {
    return requireChronological(source)
        .windowUntilChanged(sample -> sample.getTimestamp().with(bucket), Instant::equals)
        .concatMap(window -> window.collect(SampleCollectors.averaging(bucketStamp)))
        .filter(aggregated -> aggregated.getCount() > 0)
        .map(AggregatedSample::toSample);
  }

  private static Flux<Sample> requireChronological(Flux<Sample> source) {
    return Flux.defer(() -> {
      final AtomicReference<Instant> previous = new AtomicReference<>();
      return source.<Sample>handle((sample, sink) -> {
        final Instant last = previous.getAndSet(sample.getTimestamp());
        if (last != null && !sample.getTimestamp().isAfter(last)) {
          sink.error(new AggregationInvariantException(
              String.format("Samples out of order: %s follows %s", sample.getTimestamp(), last)));
        } else {
          sink.next(sample);
        }
      });
    });
  }
}
