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

import java.util.ArrayList;
import java.util.List;

/**
 * Uniform-stride decimation used to keep a series within a chart's point budget.
 */
public final class SeriesDecimator {

  private SeriesDecimator() {
  }

  /**
   * Selects <code>targetPoints</code> entries at evenly spaced indices. A series already within
   * the budget is returned as is, so decimating twice with the same budget changes nothing.
   * Selected indices strictly increase, which keeps the original order without duplicates.
   */
  public static <T> List<T> decimate(List<T> series, int targetPoints) {
    if (targetPoints < 1) {
      throw new IllegalArgumentException("targetPoints must be positive: " + targetPoints);
    }
    final int currentPoints = series.size();
    if (currentPoints <= targetPoints) {
      return series;
    }

    final double step = (double) currentPoints / targetPoints;
    final List<T> decimated = new ArrayList<>(targetPoints);
    for (int i = 0; i < targetPoints; i++) {
      final int index = Math.min((int) Math.floor(i * step), currentPoints - 1);
      decimated.add(series.get(index));
    }
    return decimated;
  }
}
