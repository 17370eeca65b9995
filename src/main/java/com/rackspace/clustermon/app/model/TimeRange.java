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
 * The historical windows a chart can request, declared in order of increasing span.
 */
public enum TimeRange {
  ONE_HOUR("1h", Duration.ofHours(1)),
  SIX_HOURS("6h", Duration.ofHours(6)),
  ONE_DAY("24h", Duration.ofHours(24)),
  SEVEN_DAYS("7d", Duration.ofDays(7)),
  THIRTY_DAYS("30d", Duration.ofDays(30)),
  NINETY_DAYS("90d", Duration.ofDays(90));

  private final String label;
  private final Duration span;

  TimeRange(String label, Duration span) {
    this.label = label;
    this.span = span;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public Duration getSpan() {
    return span;
  }

  public static Optional<TimeRange> lookup(String label) {
    if (label == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(range -> range.label.equals(label.trim()))
        .findFirst();
  }

  @JsonCreator
  public static TimeRange fromLabel(String label) {
    return lookup(label)
        .orElseThrow(() -> new IllegalArgumentException("Unknown time range: " + label));
  }

  @Override
  public String toString() {
    return label;
  }
}
