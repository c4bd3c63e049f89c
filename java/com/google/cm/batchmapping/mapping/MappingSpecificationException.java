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

import static java.util.stream.Collectors.joining;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.ErrorCode;
import com.google.cm.batchmapping.models.MappingViolation;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown before any row is mapped when a mapping specification cannot be used, either because it
 * could not be parsed or because it failed validation. Carries every violation found.
 */
public class MappingSpecificationException extends BatchMappingException {

  private final ImmutableList<MappingViolation> violations;

  /** Creates an exception for a specification that failed validation. */
  public MappingSpecificationException(List<MappingViolation> violations) {
    super(describe(violations), ErrorCode.INVALID_MAPPING_SPECIFICATION);
    this.violations = ImmutableList.copyOf(violations);
  }

  /** Creates an exception for a specification document that could not be parsed. */
  public MappingSpecificationException(String message, Throwable cause) {
    super(message, cause, ErrorCode.MALFORMED_MAPPING_SPECIFICATION);
    this.violations = ImmutableList.of();
  }

  /** Creates an exception for a specification document that could not be parsed. */
  public MappingSpecificationException(String message) {
    super(message, ErrorCode.MALFORMED_MAPPING_SPECIFICATION);
    this.violations = ImmutableList.of();
  }

  /** Violations in detection order. Empty when the document could not be parsed. */
  public ImmutableList<MappingViolation> getViolations() {
    return violations;
  }

  private static String describe(List<MappingViolation> violations) {
    return String.format(
        "Mapping specification has %d violation(s): %s",
        violations.size(),
        violations.stream()
            .map(violation -> violation.errorCode() + ": " + violation.message())
            .collect(joining("; ")));
  }
}
