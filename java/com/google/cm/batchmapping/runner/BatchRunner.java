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
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.RowOutcome;
import com.google.cm.batchmapping.models.TargetSchema;
import java.util.Iterator;

/** Applies a mapping specification to every row of a batch. */
public interface BatchRunner {

  /**
   * Validates {@code spec} and maps all {@code rows}, in order.
   *
   * @throws com.google.cm.batchmapping.mapping.MappingSpecificationException if validation fails,
   *     before any row is read
   */
  BatchResult run(
      MappingSpecification spec, ColumnSet columns, Iterator<DataRow> rows, TargetSchema schema);

  /**
   * Validates {@code spec} immediately and returns the outcomes of {@code rows}, computed one row
   * at a time as the returned iterator is advanced. Rows the reader cannot read become failed
   * outcomes.
   *
   * @throws com.google.cm.batchmapping.mapping.MappingSpecificationException if validation fails
   */
  Iterator<RowOutcome> outcomes(
      MappingSpecification spec, ColumnSet columns, Iterator<DataRow> rows, TargetSchema schema);
}
