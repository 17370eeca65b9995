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

import com.rackspace.clustermon.app.model.AggregationLevel;
import com.rackspace.clustermon.app.model.Resolution;
import com.rackspace.clustermon.app.model.TimeRange;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/**
 * Maps each time range to the resolution, point budget and source aggregation level used to
 * serve it. The budgets keep charts between 60 and 168 points. Every other component consults
 * this table rather than deriving any of these values itself.
 */
public final class ResolutionPolicy {

  public static final TimeRange DEFAULT_TIME_RANGE = TimeRange.ONE_DAY;

  private static final Map<TimeRange, Target> TARGETS;

  static {
    final Map<TimeRange, Target> targets = new EnumMap<>(TimeRange.class);
    put(targets, TimeRange.ONE_HOUR, Resolution.ONE_MINUTE, 60, AggregationLevel.raw);
    put(targets, TimeRange.SIX_HOURS, Resolution.FIVE_MINUTES, 72, AggregationLevel.raw);
    put(targets, TimeRange.ONE_DAY, Resolution.FIFTEEN_MINUTES, 96, AggregationLevel.raw);
    put(targets, TimeRange.SEVEN_DAYS, Resolution.ONE_HOUR, 168, AggregationLevel.hourly);
    put(targets, TimeRange.THIRTY_DAYS, Resolution.SIX_HOURS, 120, AggregationLevel.hourly);
    put(targets, TimeRange.NINETY_DAYS, Resolution.ONE_DAY, 90, AggregationLevel.daily);
    TARGETS = Collections.unmodifiableMap(targets);
  }

  private ResolutionPolicy() {
  }

  @Value
  public static class Target {
    TimeRange timeRange;
    Resolution resolution;
    int targetPoints;
    AggregationLevel sourceLevel;
  }

  public static Target forTimeRange(TimeRange timeRange) {
    return TARGETS.get(timeRange != null ? timeRange : DEFAULT_TIME_RANGE);
  }

  /**
   * Looks up by the external label, such as <code>7d</code>. Absent or unrecognized labels get the
   * default time range instead of an error.
   */
  public static Target forLabel(String timeRangeLabel) {
    return forTimeRange(resolveTimeRange(timeRangeLabel));
  }

  public static TimeRange resolveTimeRange(String timeRangeLabel) {
    return TimeRange.lookup(timeRangeLabel).orElse(DEFAULT_TIME_RANGE);
  }

  private static void put(Map<TimeRange, Target> targets, TimeRange timeRange,
                          Resolution resolution, int targetPoints, AggregationLevel sourceLevel) {
    targets.put(timeRange, new Target(timeRange, resolution, targetPoints, sourceLevel));
  }
}
