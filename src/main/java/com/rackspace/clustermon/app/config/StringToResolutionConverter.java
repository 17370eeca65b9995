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

import com.rackspace.clustermon.app.model.Resolution;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Binds request parameters such as <code>resolution=15min</code>.
 */
@Component
public class StringToResolutionConverter implements Converter<String, Resolution> {

  @Override
  public Resolution convert(String input) {
    if (!StringUtils.hasText(input)) {
      return null;
    }
    return Resolution.fromLabel(input);
  }
}
