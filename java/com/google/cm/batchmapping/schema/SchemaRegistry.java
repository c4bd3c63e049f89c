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

import com.google.cm.batchmapping.models.TargetSchema;
import java.util.Optional;

/** Source of target schemas, keyed by target id. */
public interface SchemaRegistry {

  /**
   * Returns the schema registered under {@code targetId}, or empty if there is none.
   *
   * @throws com.google.cm.batchmapping.BatchMappingException with {@code INVALID_SCHEMA} if a
   *     schema exists but cannot be parsed
   */
  Optional<TargetSchema> fetch(String targetId);
}
