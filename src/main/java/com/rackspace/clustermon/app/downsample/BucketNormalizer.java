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

package com.rackspace.clustermon.app.downsample;

import java.time.Duration;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjuster;
import lombok.Getter;

/**
 * Truncates an instant to the start of its bucket, where buckets are multiples of the given width
 * counted from the epoch. Hour and day buckets therefore line up with UTC hours and days.
 */
public class BucketNormalizer implements TemporalAdjuster {

  @Getter
  final Duration width;

  public BucketNormalizer(Duration width) {
    if (width.getSeconds() < 1 || width.getNano() != 0) {
      throw new IllegalArgumentException("Bucket width must be a whole number of seconds: " + width);
    }
    this.width = width;
  }

  @Override
  public Temporal adjustInto(Temporal temporal) {
    final long seconds = temporal.getLong(ChronoField.INSTANT_SECONDS);
    return temporal
        .with(ChronoField.NANO_OF_SECOND, 0)
        .with(ChronoField.INSTANT_SECONDS, seconds - Math.floorMod(seconds, width.getSeconds()));
  }
}
