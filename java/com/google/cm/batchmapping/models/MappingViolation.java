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

/** One problem found while validating a mapping specification. */
@AutoValue
public abstract class MappingViolation {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_MappingViolation.Builder();
  }

  public abstract ErrorCode errorCode();

  /** Target field whose rule is at fault, if any. */
  public abstract Optional<String> targetField();

  /** Source column involved, if any. */
  public abstract Optional<String> sourceColumn();

  public abstract String message();

  /** Builder for {@link MappingViolation}. */
  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setErrorCode(ErrorCode errorCode);

    public abstract Builder setTargetField(String targetField);

    public abstract Builder setSourceColumn(String sourceColumn);

    public abstract Builder setMessage(String message);

    public abstract MappingViolation build();
  }
}
