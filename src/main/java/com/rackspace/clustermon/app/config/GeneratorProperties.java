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

package com.rackspace.clustermon.app.config;

import com.rackspace.clustermon.app.config.configValidator.ChannelRangeValidator;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("clustermon.generator")
@Component
@Data
@Validated
public class GeneratorProperties {

  /**
   * Number of days of per-minute samples produced for each regeneration, ending at the current
   * minute.
   */
  @Min(1)
  int spanDays = 90;

  @NotNull
  @Valid
  Channels channels = new Channels();

  @Data
  public static class Channels {
    @NotNull
    @ChannelRangeValidator
    ChannelRange iopsRead = new ChannelRange().setMin(5000).setMax(70000);

    @NotNull
    @ChannelRangeValidator
    ChannelRange iopsWrite = new ChannelRange().setMin(100).setMax(2000);

    /**
     * In KB/s.
     */
    @NotNull
    @ChannelRangeValidator
    ChannelRange throughputRead = new ChannelRange().setMin(10).setMax(200);

    /**
     * In KB/s.
     */
    @NotNull
    @ChannelRangeValidator
    ChannelRange throughputWrite = new ChannelRange().setMin(100).setMax(2000);
  }

  /**
   * Bounds of a channel at full activity. Both are scaled by the activity of the sample's minute.
   */
  @Data
  public static class ChannelRange {
    double min;
    double max;
  }
}
