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

package com.rackspace.clustermon.app.services;

import com.rackspace.clustermon.app.downsample.ResolutionPolicy;
import com.rackspace.clustermon.app.downsample.SeriesDecimator;
import com.rackspace.clustermon.app.exceptions.DataUnavailableException;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.repos.WindowDatasetRepository;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class SeriesReader {

  private final WindowDatasetRepository windowDatasetRepository;

  @Autowired
  public SeriesReader(WindowDatasetRepository windowDatasetRepository) {
    this.windowDatasetRepository = windowDatasetRepository;
  }

  /**
   * Loads the cluster's dataset for the time range, decimated to at most the range's point budget.
   * Datasets are sized for their budget when generated, so decimation normally leaves them as is.
   *
   * @return the series or a {@link DataUnavailableException} error when no dataset exists
   */
  public Mono<List<Sample>> load(String entityId, TimeRange timeRange) {
    final int targetPoints = ResolutionPolicy.forTimeRange(timeRange).getTargetPoints();
    return windowDatasetRepository.load(entityId, timeRange)
        .switchIfEmpty(Mono.error(() -> new DataUnavailableException(entityId, timeRange)))
        .map(dataset -> {
          final List<Sample> samples = dataset.getData().toSamples();
          final List<Sample> decimated = SeriesDecimator.decimate(samples, targetPoints);
          log.trace("Loaded {} {} points of {}, returning {}",
              samples.size(), timeRange, entityId, decimated.size());
          return decimated;
        });
  }
}
