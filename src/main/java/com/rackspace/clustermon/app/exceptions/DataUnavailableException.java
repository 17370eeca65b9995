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

package com.rackspace.clustermon.app.exceptions;

import com.rackspace.clustermon.app.model.TimeRange;
import lombok.Getter;

/**
 * The query was well-formed but no dataset has been generated for the entity and time range.
 */
@Getter
public class DataUnavailableException extends RuntimeException {

  private final String entityId;
  private final TimeRange timeRange;

  public DataUnavailableException(String entityId, TimeRange timeRange) {
    super(String.format("No %s metrics are available for %s", timeRange, entityId));
    this.entityId = entityId;
    this.timeRange = timeRange;
  }
}
