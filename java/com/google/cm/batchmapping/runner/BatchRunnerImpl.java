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

package com.google.cm.batchmapping.runner;

import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.mapping.MappingSpecificationValidator;
import com.google.cm.batchmapping.mapping.ValidationResult;
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.MappingViolation;
import com.google.cm.batchmapping.models.RowMappingError;
import com.google.cm.batchmapping.models.RowOutcome;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.cm.batchmapping.readers.RowStructureException;
import com.google.common.collect.AbstractIterator;
import com.google.inject.Inject;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs a batch on the calling thread, one row at a time. */
public final class BatchRunnerImpl implements BatchRunner {

  private static final Logger logger = LoggerFactory.getLogger(BatchRunnerImpl.class);

  private final MappingSpecificationValidator validator;
  private final RowTransformerFactory rowTransformerFactory;

  @Inject
  public BatchRunnerImpl(
      MappingSpecificationValidator validator, RowTransformerFactory rowTransformerFactory) {
    this.validator = validator;
    this.rowTransformerFactory = rowTransformerFactory;
  }

  /** {@inheritDoc} */
  @Override
  public BatchResult run(
      MappingSpecification spec, ColumnSet columns, Iterator<DataRow> rows, TargetSchema schema) {
    Iterator<RowOutcome> outcomes = outcomes(spec, columns, rows, schema);
    var result = BatchResult.builder();
    outcomes.forEachRemaining(result::addOutcome);
    return result.build();
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<RowOutcome> outcomes(
      MappingSpecification spec, ColumnSet columns, Iterator<DataRow> rows, TargetSchema schema) {
    ValidationResult validation = validator.validate(spec, columns, schema);
    if (!validation.isValid()) {
      logger.error(
          "Mapping specification for target {} has {} violation(s):",
          schema.targetId(),
          validation.violations().size());
      for (MappingViolation violation : validation.violations()) {
        logger.error("  {}: {}", violation.errorCode(), violation.message());
      }
      validation.throwIfInvalid();
    }
    RowTransformer transformer = rowTransformerFactory.create(spec, schema, columns);
    return new AbstractIterator<>() {
      @Override
      protected RowOutcome computeNext() {
        if (!rows.hasNext()) {
          return endOfData();
        }
        try {
          return transformer.apply(rows.next());
        } catch (RowStructureException ex) {
          return RowOutcome.ofFailed(
              RowMappingError.create(ex.getRowNumber(), ex.getErrorCode(), ex.getMessage()));
        }
      }
    };
  }
}
