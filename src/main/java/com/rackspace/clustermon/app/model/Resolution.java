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

package com.rackspace.clustermon.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Nominal distance between consecutive points of a returned series.
 */
public enum Resolution {
  ONE_MINUTE("1min", Duration.ofMinutes(1)),
  FIVE_MINUTES("5min", Duration.ofMinutes(5)),
  FIFTEEN_MINUTES("15min", Duration.ofMinutes(15)),
  ONE_HOUR("1h", Duration.ofHours(1)),
  SIX_HOURS("6h", Duration.ofHours(6)),
  ONE_DAY("1d", Duration.ofDays(1));

  private final String label;
  private final Duration interval;

  Resolution(String label, Duration interval) {
    this.label = label;
    this.interval = interval;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public Duration getInterval() {
    return interval;
  }

  public static Optional<Resolution> lookup(String label) {
    if (label == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(resolution -> resolution.label.equals(label.trim()))
        .findFirst();
  }

  @JsonCreator
  public static Resolution fromLabel(String label) {
    return lookup(label)
        .orElseThrow(() -> new IllegalArgumentException("Unknown resolution: " + label));
  }

  @Override
  public String toString() {
    return label;
  }
}
