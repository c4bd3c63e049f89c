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

package com.google.cm.batchmapping.readers;

import java.io.InputStream;

/** Determines the column layout of a raw tabular file and opens a reader over its rows. */
public interface StructureAnalyzer {

  /**
   * Reads the header of {@code inputStream} and returns a reader positioned at the first data row.
   * The reader takes ownership of the stream.
   *
   * @throws StructuralException if the file is empty or its header cannot be read
   */
  RowReader analyze(InputStream inputStream, String name);
}
