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

/** Result codes for batch mapping failures, both fatal and row-level. */
public enum ErrorCode {
  ERROR_CODE_UNKNOWN(false),

  // Input file errors. Fatal to the whole batch.
  EMPTY_INPUT_FILE(false),
  UNDECODABLE_INPUT(false),
  MALFORMED_INPUT_FILE(false),
  DUPLICATE_COLUMN_NAME(false),
  BLANK_COLUMN_NAME(false),
  INPUT_FILE_READ_ERROR(false),

  // Schema errors. Fatal, raised before any row is read.
  SCHEMA_NOT_FOUND(false),
  INVALID_SCHEMA(false),

  // Mapping specification errors. Fatal, raised before any row is read.
  MALFORMED_MAPPING_SPECIFICATION(false),
  INVALID_MAPPING_SPECIFICATION(false),
  UNKNOWN_TARGET_FIELD(false),
  MISSING_REQUIRED_FIELD(false),
  DANGLING_COLUMN_REFERENCE(false),
  INVALID_PATTERN(false),
  INVALID_FREE_TEXT_FIELD(false),
  INVALID_TEMPLATE(false),
  UNKNOWN_TRANSFORMATION(false),
  CONSTANT_TYPE_MISMATCH(false),

  // Row-level errors. Recorded against a single row, the batch continues.
  RAGGED_ROW(true),
  UNDECODABLE_ROW(true),
  MALFORMED_ROW(true),
  REQUIRED_FIELD_UNRESOLVED(true),
  VALUE_CONVERSION_ERROR(true),
  PATTERN_MISMATCH(true),
  TRANSFORMATION_ERROR(true);

  private final boolean rowLevel;

  ErrorCode(boolean rowLevel) {
    this.rowLevel = rowLevel;
  }

  /** Whether this code describes a failure confined to one row. */
  public boolean isRowLevel() {
    return rowLevel;
  }
}
