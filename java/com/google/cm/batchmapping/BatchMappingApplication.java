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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.mapping.MappingSpecificationParser;
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.StructureProfile;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.cm.batchmapping.schema.SchemaResolver;
import com.google.cm.batchmapping.writers.CsvResultWriter;
import com.google.cm.batchmapping.writers.JsonLinesResultWriter;
import com.google.cm.batchmapping.writers.ResultWriter;
import com.google.cm.batchmapping.writers.StructureProfileWriter;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrypoint for the batch mapping application. Parses command line arguments, maps the input file
 * and writes the results.
 */
public final class BatchMappingApplication {

  private static final Logger logger = LoggerFactory.getLogger(BatchMappingApplication.class);

  /** Exit status of a run that failed before producing results. */
  static final int EXIT_FAILURE = 1;

  private BatchMappingApplication() {}

  public static void main(String[] args) {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the application and returns its exit status. */
  static int run(String[] args) {
    try {
      // Read args from command line
      BatchMappingArgs cliArgs = new BatchMappingArgs();
      JCommander.newBuilder().addObject(cliArgs).build().parse(args);

      Injector injector = Guice.createInjector(new BatchMappingModule(cliArgs));
      injector.getInstance(LogLevelOverride.class).apply();
      BatchMappingJob job = injector.getInstance(BatchMappingJob.class);

      if (cliArgs.getProfileOnly()) {
        profile(job, cliArgs);
      } else {
        map(injector, job, cliArgs);
      }
      return 0;
    } catch (ParameterException e) {
      logger.error("Invalid arguments: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (BatchMappingException e) {
      logger.error("Batch failed with {}: {}", e.getErrorCode(), e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException e) {
      logger.error("Batch failed with an I/O error.", e);
      return EXIT_FAILURE;
    }
  }

  private static void profile(BatchMappingJob job, BatchMappingArgs cliArgs) throws IOException {
    Path input = cliArgs.getInput();
    StructureProfile profile =
        job.profile(inputSource(input), input.getFileName().toString(), cliArgs.getSampleRows());
    var writer = new StructureProfileWriter();
    if (cliArgs.getOutputRecords().isPresent()) {
      try (Writer out = Files.newBufferedWriter(cliArgs.getOutputRecords().get(), UTF_8)) {
        writer.write(profile, out);
      }
    } else {
      writer.write(profile, new OutputStreamWriter(System.out, UTF_8));
    }
  }

  private static void map(Injector injector, BatchMappingJob job, BatchMappingArgs cliArgs)
      throws IOException {
    Path mappingPath =
        cliArgs
            .getMapping()
            .orElseThrow(() -> new ParameterException("--mapping is required for mapping"));
    String target =
        cliArgs
            .getTarget()
            .orElseThrow(() -> new ParameterException("--target is required for mapping"));
    MappingSpecification spec =
        MappingSpecificationParser.parse(Files.readString(mappingPath, UTF_8));
    TargetSchema schema = injector.getInstance(SchemaResolver.class).resolve(target);

    Path input = cliArgs.getInput();
    BatchResult result =
        job.process(inputSource(input), input.getFileName().toString(), spec, schema);

    if (cliArgs.getOutputCsv().isPresent()) {
      write(new CsvResultWriter(), result, schema, cliArgs.getOutputCsv().get());
    }
    if (cliArgs.getOutputRecords().isPresent()) {
      write(new JsonLinesResultWriter(), result, schema, cliArgs.getOutputRecords().get());
    }
  }

  private static ByteSource inputSource(Path input) {
    if (!Files.isRegularFile(input)) {
      throw new ParameterException("Input file does not exist: " + input);
    }
    return MoreFiles.asByteSource(input);
  }

  private static void write(ResultWriter writer, BatchResult result, TargetSchema schema, Path path)
      throws IOException {
    try (Writer out = Files.newBufferedWriter(path, UTF_8)) {
      writer.write(result, schema, out);
    }
    logger.info("Wrote results to {}", path);
  }
}
