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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;

/** Simple data object to hold batch statistics. */
@AutoValue
public abstract class BatchSummary {

  /** Creates a new instance. */
  public static BatchSummary create(
      long totalRows, long mappedRows, List<RowMappingError> failures) {
    return new AutoValue_BatchSummary(
        totalRows, mappedRows, totalRows - mappedRows, ImmutableList.copyOf(failures));
  }

  /** Number of data rows read. */
  public abstract long totalRows();

  /** Number of rows mapped to a record. */
  public abstract long mappedRows();

  /** Number of rows that failed. */
  public abstract long failedRows();

  /** Failures in source row order. */
  public abstract ImmutableList<RowMappingError> failures();

  /** Percentage of mapped rows, formatted with one decimal, e.g. {@code 66.7%}. */
  public String successRate() {
    if (totalRows() == 0) {
      return "0%";
    }
    return String.format(Locale.ROOT, "%.1f%%", mappedRows() * 100.0 / totalRows());
  }
}
