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

import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import java.io.Closeable;
import java.util.Iterator;

/**
 * Forward-only reader over the data rows of one input file. Allows iteration for reading one
 * {@link DataRow} at a time.
 *
 * <p>{@link #next()} throws {@link RowStructureException} for a row that cannot be read; iteration
 * may continue afterwards.
 */
public interface RowReader extends Iterator<DataRow>, Closeable {

  /** Accessor method for reading the name associated with this reader. */
  String getName();

  /** Canonical columns of the file, read from its header. */
  ColumnSet getColumns();
}
