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

/**
 * Raised when a series reaching the aggregation pipeline is out of order or its columns are
 * misaligned. It indicates a defect in the batch pipeline rather than a bad request.
 */
public class AggregationInvariantException extends IllegalStateException {

  public AggregationInvariantException(String message) {
    super(message);
  }
}
