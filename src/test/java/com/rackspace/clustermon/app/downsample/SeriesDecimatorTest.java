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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeriesDecimatorTest {

  @ParameterizedTest
  @CsvSource({
      "1440,96",
      "360,72",
      "720,120",
      "91,90",
      "100,7",
      "169,168"
  })
  void selectsExactlyTargetPointsInOrder(int size, int targetPoints) {
    final List<Integer> series = series(size);

    final List<Integer> decimated = SeriesDecimator.decimate(series, targetPoints);

    assertThat(decimated).hasSize(targetPoints);
    assertThat(decimated).isSortedAccordingTo(Integer::compare);
    assertThat(decimated).doesNotHaveDuplicates();
    assertThat(series).containsAll(decimated);
    assertThat(decimated.get(0)).isEqualTo(0);
  }

  @Test
  void picksEvenlySpacedIndices() {
    assertThat(SeriesDecimator.decimate(series(1440), 96))
        .startsWith(0, 15, 30, 45)
        .endsWith(1425);
    assertThat(SeriesDecimator.decimate(series(10), 4))
        .containsExactly(0, 2, 5, 7);
  }

  @Test
  void withinBudgetIsUnchanged() {
    final List<Integer> series = series(60);

    assertThat(SeriesDecimator.decimate(series, 60)).isSameAs(series);
    assertThat(SeriesDecimator.decimate(series, 168)).isSameAs(series);
    assertThat(SeriesDecimator.decimate(Collections.emptyList(), 96)).isEmpty();
  }

  @Test
  void idempotent() {
    final List<Integer> once = SeriesDecimator.decimate(series(1440), 96);

    assertThat(SeriesDecimator.decimate(once, 96)).isEqualTo(once);
  }

  @Test
  void rejectsNonPositiveTarget() {
    assertThatThrownBy(() -> SeriesDecimator.decimate(series(10), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<Integer> series(int size) {
    return IntStream.range(0, size).boxed().collect(Collectors.toList());
  }
}
