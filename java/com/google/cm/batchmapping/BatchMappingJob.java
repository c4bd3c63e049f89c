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

import static com.google.cm.batchmapping.ErrorCode.INPUT_FILE_READ_ERROR;

import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.BatchSummary;
import com.google.cm.batchmapping.models.RowMappingError;
import com.google.cm.batchmapping.models.StructureProfile;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.cm.batchmapping.readers.RowReader;
import com.google.cm.batchmapping.readers.StructuralException;
import com.google.cm.batchmapping.readers.StructureAnalyzer;
import com.google.cm.batchmapping.readers.StructureProfiler;
import com.google.cm.batchmapping.runner.BatchRunner;
import com.google.cm.batchmapping.schema.SchemaResolver;
import com.google.common.io.ByteSource;
import com.google.inject.Inject;
import com.google.inject.Provider;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs one batch: resolves the target schema, reads the input file and maps every row. */
public final class BatchMappingJob {

  private static final Logger logger = LoggerFactory.getLogger(BatchMappingJob.class);

  private final Provider<SchemaResolver> schemaResolverProvider;
  private final StructureAnalyzer structureAnalyzer;
  private final StructureProfiler structureProfiler;
  private final BatchRunner batchRunner;

  @Inject
  public BatchMappingJob(
      Provider<SchemaResolver> schemaResolverProvider,
      StructureAnalyzer structureAnalyzer,
      StructureProfiler structureProfiler,
      BatchRunner batchRunner) {
    this.schemaResolverProvider = schemaResolverProvider;
    this.structureAnalyzer = structureAnalyzer;
    this.structureProfiler = structureProfiler;
    this.batchRunner = batchRunner;
  }

  /**
   * Maps every row of {@code input} to the schema registered under {@code targetId}.
   *
   * @throws BatchMappingException for any failure that prevents the batch from running
   */
  public BatchResult process(
      ByteSource input, String name, MappingSpecification spec, String targetId) {
    // A new resolver per run, so schema changes are visible to the next run
    SchemaResolver schemaResolver = schemaResolverProvider.get();
    return process(input, name, spec, schemaResolver.resolve(targetId));
  }

  /** Maps every row of {@code input} to {@code schema}. */
  public BatchResult process(
      ByteSource input, String name, MappingSpecification spec, TargetSchema schema) {
    logger.info("Starting batch {} for target {}", name, schema.targetId());
    BatchResult result;
    try (RowReader reader = structureAnalyzer.analyze(input.openStream(), name)) {
      result = batchRunner.run(spec, reader.getColumns(), reader, schema);
    } catch (IOException ex) {
      String message = String.format("Could not read input file %s.", name);
      logger.error(message, ex);
      throw new StructuralException(message, ex, INPUT_FILE_READ_ERROR);
    }
    logSummary(name, result.summary());
    return result;
  }

  /** Reads all of {@code input} and reports its structure without mapping it. */
  public StructureProfile profile(ByteSource input, String name, int sampleRows) {
    try (RowReader reader = structureAnalyzer.analyze(input.openStream(), name)) {
      return structureProfiler.profile(reader, sampleRows);
    } catch (IOException ex) {
      String message = String.format("Could not read input file %s.", name);
      logger.error(message, ex);
      throw new StructuralException(message, ex, INPUT_FILE_READ_ERROR);
    }
  }

  private static void logSummary(String name, BatchSummary summary) {
    logger.info(
        "Finished batch {}: {} rows, {} mapped, {} failed, success rate {}",
        name,
        summary.totalRows(),
        summary.mappedRows(),
        summary.failedRows(),
        summary.successRate());
    for (RowMappingError failure : summary.failures()) {
      logger.info(
          "  row {} {}{}: {}",
          failure.rowNumber(),
          failure.errorCode(),
          failure.field().map(field -> " (" + field + ")").orElse(""),
          failure.reason());
    }
  }
}
