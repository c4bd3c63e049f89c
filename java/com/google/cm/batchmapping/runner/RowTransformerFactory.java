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
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.TargetSchema;

/** Factory interface for {@link RowTransformer}. */
public interface RowTransformerFactory {

  /** Creates a transformer for one batch. {@code spec} must already be validated. */
  RowTransformer create(MappingSpecification spec, TargetSchema schema, ColumnSet columns);
}
