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

package com.google.cm.batchmapping.writers;

import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.TargetSchema;
import java.io.IOException;
import java.io.Writer;

/** Writes the result of a batch run for consumers outside the engine. */
public interface ResultWriter {

  /** Writes {@code result} to {@code writer}. The writer is flushed but not closed. */
  void write(BatchResult result, TargetSchema schema, Writer writer) throws IOException;
}
