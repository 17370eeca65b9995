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

package com.rackspace.clustermon.app.web;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class MDCFilter implements WebFilter {

  static final String X_B3_TRACE_ID = "X-B3-TraceId";
  static final String ENTITY_ID = "entityId";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    MDC.put(X_B3_TRACE_ID, exchange.getRequest().getHeaders().getFirst(X_B3_TRACE_ID));
    MDC.put(ENTITY_ID, exchange.getRequest().getQueryParams().getFirst(ENTITY_ID));
    return chain.filter(exchange)
        .doFinally(signalType -> {
          MDC.remove(X_B3_TRACE_ID);
          MDC.remove(ENTITY_ID);
        });
  }
}
