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

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BucketNormalizerTest {

  @Nested
  class roundTo1h {
    @Test
    void withinTheHour() {
      final Instant result = Instant.parse("2022-03-01T10:15:32.08Z")
          .with(new BucketNormalizer(Duration.ofHours(1)));

      assertThat(result).isEqualTo(Instant.parse("2022-03-01T10:00:00.00Z"));
    }

    @Test
    void lastMinuteOfTheHour() {
      final Instant result = Instant.parse("2022-03-01T10:59:00Z")
          .with(new BucketNormalizer(Duration.ofHours(1)));

      assertThat(result).isEqualTo(Instant.parse("2022-03-01T10:00:00Z"));
    }

    @Test
    void alreadyAligned() {
      final Instant result = Instant.parse("2022-03-01T10:00:00Z")
          .with(new BucketNormalizer(Duration.ofHours(1)));

      assertThat(result).isEqualTo(Instant.parse("2022-03-01T10:00:00Z"));
    }
  }

  @Nested
  class roundTo1d {
    @Test
    void normal() {
      final Instant result = Instant.parse("2022-03-01T23:59:59Z")
          .with(new BucketNormalizer(Duration.ofDays(1)));

      assertThat(result).isEqualTo(Instant.parse("2022-03-01T00:00:00Z"));
    }

    @Test
    void beforeEpoch() {
      final Instant result = Instant.parse("1969-12-31T06:00:00Z")
          .with(new BucketNormalizer(Duration.ofDays(1)));

      assertThat(result).isEqualTo(Instant.parse("1969-12-31T00:00:00Z"));
    }
  }

  @Test
  void rejectsFractionalWidth() {
    assertThatThrownBy(() -> new BucketNormalizer(Duration.ofMillis(1500)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BucketNormalizer(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
