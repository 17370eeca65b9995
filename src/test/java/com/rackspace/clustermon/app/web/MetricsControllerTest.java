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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.clustermon.app.config.StringToResolutionConverter;
import com.rackspace.clustermon.app.exceptions.DataUnavailableException;
import com.rackspace.clustermon.app.exceptions.InvalidQueryException;
import com.rackspace.clustermon.app.model.Metadata;
import com.rackspace.clustermon.app.model.MetricsQuery;
import com.rackspace.clustermon.app.model.MetricsSeries;
import com.rackspace.clustermon.app.model.Resolution;
import com.rackspace.clustermon.app.model.Sample;
import com.rackspace.clustermon.app.model.Sample.ReadWrite;
import com.rackspace.clustermon.app.model.SeriesData;
import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.services.MetricsService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.AutoConfigureJson;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles(profiles = {"test"})
@SpringBootTest(classes = {MetricsController.class, RestWebExceptionHandler.class,
    StringToResolutionConverter.class, MDCFilter.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
@AutoConfigureJson
@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class MetricsControllerTest {

  private static final String ENTITY_ID = "f2398d2e-f92d-482a-ab2d-4b9a9f79186c";

  @MockBean
  MetricsService metricsService;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testGetMetrics() {
    final Instant start = Instant.parse("2022-03-01T13:00:00Z");
    final Instant end = Instant.parse("2022-03-01T14:00:00Z");
    final MetricsSeries series = new MetricsSeries()
        .setEntityId(ENTITY_ID)
        .setTimeRange(TimeRange.SEVEN_DAYS)
        .setResolution(Resolution.ONE_HOUR)
        .setData(SeriesData.fromSamples(List.of(
            new Sample(start, new ReadWrite(42000.5, 800), new ReadWrite(120, 950.1)),
            new Sample(end, new ReadWrite(39000, 750.3), new ReadWrite(110.4, 900)))))
        .setMetadata(new Metadata()
            .setTotalPoints(2)
            .setStartTime(start)
            .setEndTime(end)
            .setAggregationMethod("avg"));
    when(metricsService.getMetrics(any())).thenReturn(Mono.just(series));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/metrics")
            .queryParam("entityId", ENTITY_ID)
            .queryParam("timeRange", "7d")
            .build())
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.entityId").isEqualTo(ENTITY_ID)
        .jsonPath("$.timeRange").isEqualTo("7d")
        .jsonPath("$.resolution").isEqualTo("1h")
        .jsonPath("$.data.timestamps.length()").isEqualTo(2)
        .jsonPath("$.data.iops.read[0]").isEqualTo(42000.5)
        .jsonPath("$.data.throughput.write[1]").isEqualTo(900.0)
        .jsonPath("$.metadata.totalPoints").isEqualTo(2)
        .jsonPath("$.metadata.aggregationMethod").isEqualTo("avg");

    final MetricsQuery query = captureQuery();
    assertThat(query.getEntityId()).isEqualTo(ENTITY_ID);
    assertThat(query.getTimeRange()).isEqualTo(TimeRange.SEVEN_DAYS);
    assertThat(query.getResolutionOverride()).isNull();
  }

  @Test
  public void testGetMetricsWithDefaults() {
    when(metricsService.getMetrics(any())).thenReturn(Mono.just(new MetricsSeries()));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/metrics")
            .queryParam("entityId", ENTITY_ID)
            .queryParam("timeRange", "2w")
            .queryParam("resolution", "5min")
            .build())
        .exchange()
        .expectStatus().isOk();

    final MetricsQuery query = captureQuery();
    assertThat(query.getTimeRange()).isEqualTo(TimeRange.ONE_DAY);
    assertThat(query.getResolutionOverride()).isEqualTo(Resolution.FIVE_MINUTES);
  }

  @Test
  public void testMissingEntityId() {
    when(metricsService.getMetrics(any()))
        .thenReturn(Mono.error(new InvalidQueryException("entityId is required")));

    webTestClient.get()
        .uri("/api/metrics?timeRange=1h")
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.message").isEqualTo("entityId is required");
  }

  @Test
  public void testUnknownResolution() {
    webTestClient.get()
        .uri("/api/metrics?entityId=" + ENTITY_ID + "&resolution=2min")
        .exchange()
        .expectStatus().isBadRequest();

    verifyNoInteractions(metricsService);
  }

  @Test
  public void testDataUnavailable() {
    when(metricsService.getMetrics(any()))
        .thenReturn(Mono.error(new DataUnavailableException(ENTITY_ID, TimeRange.NINETY_DAYS)));

    webTestClient.get()
        .uri("/api/metrics?entityId=" + ENTITY_ID + "&timeRange=90d")
        .exchange()
        .expectStatus().isNotFound()
        .expectBody()
        .jsonPath("$.status").isEqualTo(404)
        .jsonPath("$.entityId").isEqualTo(ENTITY_ID)
        .jsonPath("$.timeRange").isEqualTo("90d");
  }

  @Test
  public void testUnexpectedFailure() {
    when(metricsService.getMetrics(any()))
        .thenReturn(Mono.error(new IllegalStateException("disk on fire")));

    webTestClient.get()
        .uri("/api/metrics?entityId=" + ENTITY_ID)
        .exchange()
        .expectStatus().is5xxServerError()
        .expectBody()
        .jsonPath("$.status").isEqualTo(500)
        .jsonPath("$.message").value(message ->
            assertThat((String) message).doesNotContain("disk on fire"));
  }

  private MetricsQuery captureQuery() {
    final ArgumentCaptor<MetricsQuery> captor = ArgumentCaptor.forClass(MetricsQuery.class);
    verify(metricsService).getMetrics(captor.capture());
    return captor.getValue();
  }
}
