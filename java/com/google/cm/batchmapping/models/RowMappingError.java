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

package com.google.cm.batchmapping.models;

import com.google.auto.value.AutoValue;
import com.google.cm.batchmapping.ErrorCode;
import java.util.Optional;

/** Why a single row could not be turned into a {@link MappedRecord}. */
@AutoValue
public abstract class RowMappingError {

  /** Creates an error that is not tied to a particular target field. */
  public static RowMappingError create(long rowNumber, ErrorCode errorCode, String reason) {
    return new AutoValue_RowMappingError(rowNumber, errorCode, Optional.empty(), reason);
  }

  /** Creates an error for one target field. */
  public static RowMappingError forField(
      long rowNumber, ErrorCode errorCode, String field, String reason) {
    return new AutoValue_RowMappingError(rowNumber, errorCode, Optional.of(field), reason);
  }

  public abstract long rowNumber();

  public abstract ErrorCode errorCode();

  /** Target field that failed, if the failure is field-specific. */
  public abstract Optional<String> field();

  /** Human-readable reason. */
  public abstract String reason();
}
