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

import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.Sample.ReadWrite;
import java.time.Instant;
import lombok.Data;

/**
 * Running sums of the four channels of every sample that fell into one bucket.
 */
@Data
public class AggregatedSample {
  Instant timestamp;
  double iopsReadSum;
  double iopsWriteSum;
  double throughputReadSum;
  double throughputWriteSum;
  int count;

  /**
   * @return the bucket's averages, each rounded to one decimal place
   */
  public Sample toSample() {
    return new Sample(timestamp,
        new ReadWrite(average(iopsReadSum), average(iopsWriteSum)),
        new ReadWrite(average(throughputReadSum), average(throughputWriteSum)));
  }

  private double average(double sum) {
    return SampleCollectors.roundToTenth(sum / count);
  }
}
