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

package com.rackspace.clustermon.app.repos;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.clustermon.app.config.AppProperties;
import com.rackspace.clustermon.app.downsample.ResolutionPolicy;
import com.rackspace.clustermon.app.exceptions.InvalidQueryException;
import com.rackspace.clustermon.app.model.DatasetCacheKey;
import com.rackspace.clustermon.app.model.TimeRange;
import com.rackspace.clustermon.app.model.WindowDataset;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.util.FileSystemUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Keeps each cluster's datasets as JSON files, one per time range:
 * <pre>
 * &lt;data-dir&gt;/&lt;entity&gt;/CURRENT
 * &lt;data-dir&gt;/&lt;entity&gt;/&lt;generation&gt;/raw-metrics-1h.json
 * &lt;data-dir&gt;/&lt;entity&gt;/&lt;generation&gt;/hourly-aggregated-7d.json
 * &lt;data-dir&gt;/&lt;entity&gt;/&lt;generation&gt;/daily-aggregated-90d.json
 * </pre>
 * A replacement writes a complete new generation directory and then atomically swaps the
 * <code>CURRENT</code> pointer to it. The previous generation is kept for readers that resolved
 * the pointer just before the swap; older ones are deleted.
 */
@Repository
@Slf4j
@ConditionalOnProperty(prefix = "clustermon", name = "storage-type", havingValue = "file",
    matchIfMissing = true)
public class FileWindowDatasetRepository implements WindowDatasetRepository {

  static final String CURRENT_POINTER = "CURRENT";
  private static final String STAGING_SUFFIX = ".staging";
  private static final Pattern ENTITY_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  private final Path dataDir;
  private final ObjectMapper objectMapper;
  private final AsyncCache<DatasetCacheKey, WindowDataset> windowDatasetCache;
  private final Clock clock;

  @Autowired
  public FileWindowDatasetRepository(AppProperties appProperties,
                                     ObjectMapper objectMapper,
                                     AsyncCache<DatasetCacheKey, WindowDataset> windowDatasetCache,
                                     Clock clock) {
    this.dataDir = Paths.get(appProperties.getDataDir());
    this.objectMapper = objectMapper;
    this.windowDatasetCache = windowDatasetCache;
    this.clock = clock;
  }

  @Override
  public Mono<WindowDataset> load(String entityId, TimeRange timeRange) {
    return Mono.fromCallable(() -> readCurrentGeneration(entityDir(entityId)))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(generation -> Mono.fromFuture(
            windowDatasetCache.get(
                new DatasetCacheKey(entityId, generation, timeRange),
                (key, executor) -> CompletableFuture.supplyAsync(
                    () -> readDataset(entityDir(entityId).resolve(generation), timeRange),
                    executor)
            )
        ));
  }

  @Override
  public Mono<Void> replaceAll(String entityId, Map<TimeRange, WindowDataset> datasets) {
    return Mono.fromRunnable(() -> publish(entityId, datasets))
        .subscribeOn(Schedulers.boundedElastic())
        .then();
  }

  static String fileName(TimeRange timeRange) {
    return String.format("%s-%s.json",
        ResolutionPolicy.forTimeRange(timeRange).getSourceLevel().getFilePrefix(),
        timeRange.getLabel());
  }

  private void publish(String entityId, Map<TimeRange, WindowDataset> datasets) {
    final Path entityDir = entityDir(entityId);
    final String generation = String.format("%d-%s",
        clock.millis(), RandomStringUtils.randomAlphanumeric(6).toLowerCase());
    final Path staging = entityDir.resolve(generation + STAGING_SUFFIX);

    try {
      Files.createDirectories(staging);
      for (Map.Entry<TimeRange, WindowDataset> entry : datasets.entrySet()) {
        objectMapper.writeValue(staging.resolve(fileName(entry.getKey())).toFile(), entry.getValue());
      }
      Files.move(staging, entityDir.resolve(generation), StandardCopyOption.ATOMIC_MOVE);

      final String previous = readCurrentGeneration(entityDir);
      final Path pointerTemp = entityDir.resolve(CURRENT_POINTER + ".tmp");
      Files.writeString(pointerTemp, generation, StandardCharsets.UTF_8);
      Files.move(pointerTemp, entityDir.resolve(CURRENT_POINTER),
          StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Published generation {} of {} with {} datasets", generation, entityId, datasets.size());

      pruneGenerations(entityDir, generation, previous);
    } catch (IOException e) {
      deleteQuietly(staging);
      throw new UncheckedIOException("Failed to publish datasets of " + entityId, e);
    }
  }

  private void pruneGenerations(Path entityDir, String current, String previous) throws IOException {
    final List<Path> stale;
    try (Stream<Path> children = Files.list(entityDir)) {
      stale = children
          .filter(Files::isDirectory)
          .filter(dir -> {
            final String name = dir.getFileName().toString();
            return !name.equals(current) && !name.equals(previous);
          })
          .collect(Collectors.toList());
    }
    for (Path dir : stale) {
      log.trace("Removing stale generation {}", dir);
      FileSystemUtils.deleteRecursively(dir);
    }
  }

  private WindowDataset readDataset(Path generationDir, TimeRange timeRange) {
    final Path file = generationDir.resolve(fileName(timeRange));
    if (!Files.exists(file)) {
      return null;
    }
    try {
      return objectMapper.readValue(file.toFile(), WindowDataset.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read dataset " + file, e);
    }
  }

  private String readCurrentGeneration(Path entityDir) throws IOException {
    final Path pointer = entityDir.resolve(CURRENT_POINTER);
    if (!Files.exists(pointer)) {
      return null;
    }
    final String generation = Files.readString(pointer, StandardCharsets.UTF_8).trim();
    return generation.isEmpty() ? null : generation;
  }

  private Path entityDir(String entityId) {
    if (entityId == null || !ENTITY_ID_PATTERN.matcher(entityId).matches()) {
      throw new InvalidQueryException("Invalid entity id: " + entityId);
    }
    return dataDir.resolve(entityId);
  }

  private void deleteQuietly(Path dir) {
    try {
      FileSystemUtils.deleteRecursively(dir);
    } catch (IOException e) {
      log.warn("Unable to remove staging directory {}", dir, e);
    }
  }
}
