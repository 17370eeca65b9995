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

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("clustermon.regeneration")
@Component
@Data
@Validated
public class RegenerationProperties {

  /**
   * Clusters whose datasets are regenerated by the <code>regenerate</code> profile.
   */
  @Valid
  List<Cluster> clusters = new ArrayList<>();

  /**
   * The amount of time to wait after startup before the first regeneration pass.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration initialDelay = Duration.ofSeconds(5);

  /**
   * How often the regeneration pass repeats. When not set, the pass runs once.
   */
  @DurationUnit(ChronoUnit.MINUTES)
  Duration period;

  @Data
  public static class Cluster {
    /**
     * The cluster's UUID, also used as its dataset folder name.
     */
    @NotBlank
    String id;

    String name;
  }
}
