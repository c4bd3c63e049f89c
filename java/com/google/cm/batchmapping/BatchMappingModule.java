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

import com.google.cm.batchmapping.Annotations.ColumnDelimiter;
import com.google.cm.batchmapping.Annotations.LoggingLevel;
import com.google.cm.batchmapping.Annotations.PadRaggedRows;
import com.google.cm.batchmapping.Annotations.SchemaDirectory;
import com.google.cm.batchmapping.readers.CsvStructureAnalyzer;
import com.google.cm.batchmapping.readers.StructureAnalyzer;
import com.google.cm.batchmapping.runner.BatchRunner;
import com.google.cm.batchmapping.runner.BatchRunnerImpl;
import com.google.cm.batchmapping.runner.RowTransformer;
import com.google.cm.batchmapping.runner.RowTransformerFactory;
import com.google.cm.batchmapping.runner.RowTransformerImpl;
import com.google.cm.batchmapping.schema.CachingSchemaResolver;
import com.google.cm.batchmapping.schema.DirectorySchemaRegistry;
import com.google.cm.batchmapping.schema.ResourceSchemaRegistry;
import com.google.cm.batchmapping.schema.SchemaRegistry;
import com.google.cm.batchmapping.schema.SchemaResolver;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.TypeLiteral;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Configures the batch mapping engine and its dependencies from command line arguments. */
public final class BatchMappingModule extends AbstractModule {

  private static final Logger logger = LoggerFactory.getLogger(BatchMappingModule.class);

  private final BatchMappingArgs args;
  private final char delimiter;

  /**
   * Constructs a new instance.
   *
   * @throws com.beust.jcommander.ParameterException if the delimiter is not a single character
   */
  public BatchMappingModule(BatchMappingArgs args) {
    this.args = args;
    this.delimiter = args.getDelimiter();
  }

  /** Configures the bindings for this module. */
  @Override
  protected void configure() {
    bind(Character.class).annotatedWith(ColumnDelimiter.class).toInstance(delimiter);
    bind(Boolean.class).annotatedWith(PadRaggedRows.class).toInstance(args.getPadRaggedRows());
    bind(new TypeLiteral<Optional<Path>>() {})
        .annotatedWith(SchemaDirectory.class)
        .toInstance(args.getSchemaDirectory());
    bind(new TypeLiteral<Optional<String>>() {})
        .annotatedWith(LoggingLevel.class)
        .toInstance(args.getLoggingLevel());

    bind(StructureAnalyzer.class).to(CsvStructureAnalyzer.class);
    // Unscoped, so every batch run gets a resolver with an empty cache
    bind(SchemaResolver.class).to(CachingSchemaResolver.class);
    bind(BatchRunner.class).to(BatchRunnerImpl.class);
    install(
        new FactoryModuleBuilder()
            .implement(RowTransformer.class, RowTransformerImpl.class)
            .build(RowTransformerFactory.class));
  }

  @Provides
  @Singleton
  SchemaRegistry provideSchemaRegistry(@SchemaDirectory Optional<Path> schemaDirectory) {
    if (schemaDirectory.isPresent()) {
      logger.info("Reading target schemas from {}", schemaDirectory.get());
      return new DirectorySchemaRegistry(schemaDirectory.get());
    }
    logger.info("Reading target schemas from the classpath.");
    return new ResourceSchemaRegistry();
  }
}
