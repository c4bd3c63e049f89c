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

import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.RowOutcome;

/** Maps single data rows to records of a target schema. */
public interface RowTransformer {

  /**
   * Maps {@code row}. Never throws for a row that cannot be mapped; the failure is returned as a
   * failed outcome instead.
   */
  RowOutcome apply(DataRow row);
}
