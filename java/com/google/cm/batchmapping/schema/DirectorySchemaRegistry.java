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

package com.google.cm.batchmapping.schema;

import static com.google.cm.batchmapping.ErrorCode.INVALID_SCHEMA;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.models.TargetSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Provides schemas stored as {@code <target id>.json} files in a directory. */
public final class DirectorySchemaRegistry implements SchemaRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DirectorySchemaRegistry.class);

  private final Path directory;

  public DirectorySchemaRegistry(Path directory) {
    this.directory = directory;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<TargetSchema> fetch(String targetId) {
    if (!SchemaIds.isValid(targetId)) {
      logger.info("Ignoring malformed target id {}", targetId);
      return Optional.empty();
    }
    Path file = directory.resolve(targetId + ".json");
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(TargetSchemaParser.parse(Files.readString(file, UTF_8), targetId));
    } catch (IOException ex) {
      String message = String.format("Failed to read schema file %s", file);
      logger.error(message);
      throw new BatchMappingException(message, ex, INVALID_SCHEMA);
    }
  }
}
