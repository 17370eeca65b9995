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

import com.rackspace.clustermon.app.exceptions.AggregationInvariantException;
import com.rackspace.clustermon.app.model.Sample.ReadWrite;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Columnar form of a series as it is stored in dataset files and returned to charts.
 * Every column shares the index of {@link #timestamps}.
 */
@Data
public class SeriesData {
  List<Instant> timestamps = new ArrayList<>();
  ReadWriteColumns iops = new ReadWriteColumns();
  ReadWriteColumns throughput = new ReadWriteColumns();

  @Data
  public static class ReadWriteColumns {
    List<Double> read = new ArrayList<>();
    List<Double> write = new ArrayList<>();
  }

  public static SeriesData fromSamples(List<Sample> samples) {
    final SeriesData data = new SeriesData();
    for (Sample sample : samples) {
      data.timestamps.add(sample.getTimestamp());
      data.iops.read.add(sample.getIops().getRead());
      data.iops.write.add(sample.getIops().getWrite());
      data.throughput.read.add(sample.getThroughput().getRead());
      data.throughput.write.add(sample.getThroughput().getWrite());
    }
    return data;
  }

  /**
   * Converts back to samples, verifying that all columns are aligned and the timestamps strictly
   * increase.
   *
   * @throws AggregationInvariantException if either condition does not hold
   */
  public List<Sample> toSamples() {
    final int size = timestamps.size();
    if (iops.read.size() != size || iops.write.size() != size
        || throughput.read.size() != size || throughput.write.size() != size) {
      throw new AggregationInvariantException(String.format(
          "Misaligned series columns: timestamps=%d iops.read=%d iops.write=%d "
              + "throughput.read=%d throughput.write=%d",
          size, iops.read.size(), iops.write.size(),
          throughput.read.size(), throughput.write.size()));
    }

    final List<Sample> samples = new ArrayList<>(size);
    Instant previous = null;
    for (int i = 0; i < size; i++) {
      final Instant timestamp = timestamps.get(i);
      if (previous != null && !timestamp.isAfter(previous)) {
        throw new AggregationInvariantException(
            "Series timestamps are not strictly increasing at index " + i + ": " + timestamp);
      }
      previous = timestamp;
      samples.add(new Sample(timestamp,
          new ReadWrite(iops.read.get(i), iops.write.get(i)),
          new ReadWrite(throughput.read.get(i), throughput.write.get(i))));
    }
    return samples;
  }

  public int size() {
    return timestamps.size();
  }
}
