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

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("clustermon")
@Component
@Data
@Validated
public class AppProperties {

  public enum StorageType {
    file,
    memory
  }

  /**
   * Selects where window datasets are kept. The in-memory store does not survive a restart and is
   * meant for local runs and tests.
   */
  @NotNull
  StorageType storageType = StorageType.file;

  /**
   * Root directory of the per-cluster dataset folders.
   */
  @NotBlank
  String dataDir = "data";

  /**
   * Maximum number of parsed datasets kept in memory.
   */
  @Min(0)
  long datasetCacheSize = 500;

  /**
   * Reported in the metadata of every response. Aggregates are always arithmetic means.
   */
  @NotBlank
  String aggregationMethod = "avg";
}
