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

package com.google.cm.batchmapping.mapping;

import com.google.auto.value.AutoValue;
import com.google.cm.batchmapping.ErrorCode;
import com.google.cm.batchmapping.models.MappingViolation;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/** Every violation found by one validation of a mapping specification. */
@AutoValue
public abstract class ValidationResult {

  public static ValidationResult create(List<MappingViolation> violations) {
    return new AutoValue_ValidationResult(ImmutableList.copyOf(violations));
  }

  /** Violations in detection order. */
  public abstract ImmutableList<MappingViolation> violations();

  public boolean isValid() {
    return violations().isEmpty();
  }

  /** Distinct error codes of the violations, in detection order. */
  public ImmutableSet<ErrorCode> errorCodes() {
    return violations().stream()
        .map(MappingViolation::errorCode)
        .collect(ImmutableSet.toImmutableSet());
  }

  /** Throws a {@link MappingSpecificationException} carrying every violation, if there is any. */
  public void throwIfInvalid() {
    if (!isValid()) {
      throw new MappingSpecificationException(violations());
    }
  }
}
