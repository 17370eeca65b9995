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

import static com.rackspace.clustermon.app.downsample.SampleCollectors.roundToTenth;

import com.rackspace.clustermon.app.config.GeneratorProperties;
import com.rackspace.clustermon.app.config.GeneratorProperties.ChannelRange;
import com.rackspace.clustermon.app.config.GeneratorProperties.Channels;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.Sample.ReadWrite;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Produces synthetic per-minute samples shaped like a storage cluster's load: busiest mid
 * afternoon, quietest before dawn and lighter on weekends. Stands in for a telemetry ingester.
 */
@Component
@Slf4j
public class SampleGenerator {

  static final double WEEKEND_MULTIPLIER = 0.8;
  private static final Duration SAMPLE_INTERVAL = Duration.ofMinutes(1);

  private final GeneratorProperties properties;
  private final Random random;

  @Autowired
  public SampleGenerator(GeneratorProperties properties, Random random) {
    this.properties = properties;
    this.random = random;
  }

  /**
   * Generates one sample per minute covering the configured number of days before
   * <code>end</code>, which must fall on a minute boundary and is itself excluded.
   */
  public Flux<Sample> generate(Instant end) {
    final long count = properties.getSpanDays() * Duration.ofDays(1).toMinutes();
    final Instant start = end.minus(SAMPLE_INTERVAL.multipliedBy(count));
    log.debug("Generating {} raw samples from {} to {}", count, start, end);

    return Flux.range(0, Math.toIntExact(count))
        .map(i -> sample(start.plus(SAMPLE_INTERVAL.multipliedBy(i))));
  }

  Sample sample(Instant timestamp) {
    final double activity = activity(timestamp.atZone(ZoneOffset.UTC));
    final Channels channels = properties.getChannels();
    return new Sample(timestamp,
        new ReadWrite(
            value(channels.getIopsRead(), activity),
            value(channels.getIopsWrite(), activity)),
        new ReadWrite(
            value(channels.getThroughputRead(), activity),
            value(channels.getThroughputWrite(), activity)));
  }

  private double activity(ZonedDateTime time) {
    final double minuteNoise = 0.8 + random.nextDouble() * 0.4;
    final DayOfWeek dayOfWeek = time.getDayOfWeek();
    final double weekendMultiplier =
        dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY ? WEEKEND_MULTIPLIER : 1.0;
    return hourActivity(time.getHour()) * minuteNoise * weekendMultiplier;
  }

  static double hourActivity(int hour) {
    final double activity = 0.3 + 0.7 * Math.sin((hour - 6) * Math.PI / 12);
    return Math.max(0.1, Math.min(1.0, activity));
  }

  private double value(ChannelRange range, double activity) {
    final double min = range.getMin() * activity;
    final double max = range.getMax() * activity;
    return roundToTenth(min + random.nextDouble() * (max - min));
  }
}
