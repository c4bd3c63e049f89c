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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/** One data row of an input file, keyed by canonical column name. */
@AutoValue
public abstract class DataRow {

  /** Creates a row. {@code rowNumber} is the 1-based position among the data rows. */
  public static DataRow create(long rowNumber, Map<String, String> values) {
    return new AutoValue_DataRow(rowNumber, ImmutableMap.copyOf(values));
  }

  /** 1-based data row number. The header row is not counted. */
  public abstract long rowNumber();

  /** Raw cell text by canonical column name, in column order. */
  public abstract ImmutableMap<String, String> values();

  /** Returns the cell for a canonical column name, or empty if the row has no such cell. */
  public Optional<String> value(String column) {
    return Optional.ofNullable(values().get(column));
  }
}
