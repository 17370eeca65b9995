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
import java.time.Instant;
import java.time.temporal.TemporalAdjuster;
import java.util.stream.Collector;

public class SampleCollectors {

  /**
   * Sums the channels of the collected samples. The finished aggregate is stamped by applying
   * <code>bucketStamp</code> to the earliest collected timestamp.
   */
  public static Collector<Sample, AggregatedSample, AggregatedSample> averaging(
      TemporalAdjuster bucketStamp) {
    return Collector.of(
        AggregatedSample::new,
        (agg, in) -> {
          agg.setTimestamp(minTimestamp(agg.getTimestamp(), in.getTimestamp()));
          agg.setIopsReadSum(agg.getIopsReadSum() + in.getIops().getRead());
          agg.setIopsWriteSum(agg.getIopsWriteSum() + in.getIops().getWrite());
          agg.setThroughputReadSum(agg.getThroughputReadSum() + in.getThroughput().getRead());
          agg.setThroughputWriteSum(agg.getThroughputWriteSum() + in.getThroughput().getWrite());
          agg.setCount(agg.getCount() + 1);
        },
        SampleCollectors::combine,
        agg -> {
          if (agg.getTimestamp() != null) {
            agg.setTimestamp(agg.getTimestamp().with(bucketStamp));
          }
          return agg;
        }
    );
  }

  public static double roundToTenth(double value) {
    return Math.round(value * 10.0) / 10.0;
  }

  private static AggregatedSample combine(AggregatedSample agg, AggregatedSample in) {
    agg.setTimestamp(minTimestamp(agg.getTimestamp(), in.getTimestamp()));
    agg.setIopsReadSum(agg.getIopsReadSum() + in.getIopsReadSum());
    agg.setIopsWriteSum(agg.getIopsWriteSum() + in.getIopsWriteSum());
    agg.setThroughputReadSum(agg.getThroughputReadSum() + in.getThroughputReadSum());
    agg.setThroughputWriteSum(agg.getThroughputWriteSum() + in.getThroughputWriteSum());
    agg.setCount(agg.getCount() + in.getCount());
    return agg;
  }

  private static Instant minTimestamp(Instant lhs, Instant rhs) {
    if (lhs == null) {
      return rhs;
    } else if (rhs == null) {
      return lhs;
    } else {
      return lhs.compareTo(rhs) < 0 ? lhs : rhs;
    }
  }
}
