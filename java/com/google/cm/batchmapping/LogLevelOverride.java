/*
 * Copyright 2025 Google LLC
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

package com.google.cm.batchmapping;

import com.google.cm.batchmapping.Annotations.LoggingLevel;
import com.google.cm.batchmapping.Constants.CustomLogLevel;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overrides the root log level from the {@code --logging_level} argument, taking precedence over
 * log4j2.properties. Accepts the standard levels from TRACE to ERROR and the levels in {@link
 * CustomLogLevel}, case-insensitively.
 */
public final class LogLevelOverride {

  private static final Logger logger = LoggerFactory.getLogger(LogLevelOverride.class);

  // Most verbose first; custom levels are registered with log4j as the map is built
  private static final ImmutableMap<String, Level> KNOWN_LEVELS =
      Stream.concat(
              Stream.of(Level.TRACE, Level.DEBUG, Level.INFO, Level.WARN, Level.ERROR),
              Arrays.stream(CustomLogLevel.values())
                  .map(custom -> Level.forName(custom.name(), custom.value)))
          .sorted(Comparator.comparingInt(Level::intLevel).reversed())
          .collect(ImmutableMap.toImmutableMap(Level::name, level -> level));

  private final Optional<String> requestedLevel;

  @Inject
  LogLevelOverride(@LoggingLevel Optional<String> requestedLevel) {
    this.requestedLevel = requestedLevel;
  }

  /**
   * Applies the requested level to every logger of the application.
   *
   * @return the level now in force, or empty if none was requested or the name is unknown
   */
  public Optional<Level> apply() {
    Optional<Level> level = requestedLevel.flatMap(LogLevelOverride::resolve);
    if (requestedLevel.isPresent() && level.isEmpty()) {
      logger.warn(
          "Ignoring unknown logging level '{}'. Known levels, most verbose first: {}",
          requestedLevel.get(),
          KNOWN_LEVELS.keySet());
    }
    level.ifPresent(
        value -> {
          logger.info("Root log level set to {} by --logging_level.", value);
          Configurator.setAllLevels(LogManager.getRootLogger().getName(), value);
        });
    return level;
  }

  private static Optional<Level> resolve(String name) {
    return Optional.ofNullable(KNOWN_LEVELS.get(name.trim().toUpperCase(Locale.ROOT)));
  }
}
