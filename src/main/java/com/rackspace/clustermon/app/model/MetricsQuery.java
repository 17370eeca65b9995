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

import com.rackspace.clustermon.app.downsample.ResolutionPolicy;
import lombok.Data;

/**
 * Options of a metrics request with their defaults already applied.
 */
@Data
public class MetricsQuery {
  /**
   * Cluster to query. Required.
   */
  String entityId;

  /**
   * Window to return. Defaults to <code>24h</code> when absent or unrecognized.
   */
  TimeRange timeRange = ResolutionPolicy.DEFAULT_TIME_RANGE;

  /**
   * When present, reported as the resolution of the response. It only relabels the response;
   * the dataset and point budget are always chosen from the time range.
   */
  Resolution resolutionOverride;

  public static MetricsQuery of(String entityId, String timeRange, Resolution resolutionOverride) {
    return new MetricsQuery()
        .setEntityId(entityId)
        .setTimeRange(ResolutionPolicy.resolveTimeRange(timeRange))
        .setResolutionOverride(resolutionOverride);
  }
}
