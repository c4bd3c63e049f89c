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

package com.google.cm.batchmapping.schema;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.ErrorCode;

/** Thrown when a target id has no registered schema. */
public class SchemaNotFoundException extends BatchMappingException {

  private final String targetId;

  public SchemaNotFoundException(String targetId) {
    super(
        String.format("No schema registered for target %s", targetId),
        ErrorCode.SCHEMA_NOT_FOUND);
    this.targetId = targetId;
  }

  /** The target id that could not be resolved. */
  public String getTargetId() {
    return targetId;
  }
}
