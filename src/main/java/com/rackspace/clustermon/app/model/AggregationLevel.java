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

/**
 * Granularity of a stored series. Hourly is only ever derived from raw and daily only from hourly.
 */
public enum AggregationLevel {
  raw("raw-metrics"),
  hourly("hourly-aggregated"),
  daily("daily-aggregated");

  private final String filePrefix;

  AggregationLevel(String filePrefix) {
    this.filePrefix = filePrefix;
  }

  public String getFilePrefix() {
    return filePrefix;
  }
}
