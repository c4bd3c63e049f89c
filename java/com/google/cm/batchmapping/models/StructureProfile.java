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
import com.google.common.collect.ImmutableMap;

/**
 * Summary of the structure of an input file: its columns, how many data rows it has, a few sample
 * rows and an inferred type per column. This is what an external mapping generator needs to see.
 */
@AutoValue
public abstract class StructureProfile {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_StructureProfile.Builder().setFailedRowCount(0);
  }

  /** Name of the profiled file. */
  public abstract String name();

  public abstract ColumnSet columns();

  /** Number of data rows, including rows that could not be read. */
  public abstract long rowCount();

  /** Number of data rows that could not be read. */
  public abstract long failedRowCount();

  /** First readable rows of the file. */
  public abstract ImmutableList<DataRow> sampleRows();

  /** Inferred type by canonical column name, in column order. */
  public abstract ImmutableMap<String, FieldType> columnTypes();

  /** Builder for {@link StructureProfile}. */
  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setName(String name);

    public abstract Builder setColumns(ColumnSet columns);

    public abstract Builder setRowCount(long rowCount);

    public abstract Builder setFailedRowCount(long failedRowCount);

    public abstract Builder setSampleRows(ImmutableList<DataRow> sampleRows);

    public abstract Builder setColumnTypes(ImmutableMap<String, FieldType> columnTypes);

    public abstract StructureProfile build();
  }
}
