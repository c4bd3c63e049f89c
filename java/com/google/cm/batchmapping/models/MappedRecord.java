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
import java.util.Optional;

/**
 * Structured input for the downstream tool, produced from one data row. Fields that resolved to
 * absent are not present in {@link #values()}.
 */
@AutoValue
public abstract class MappedRecord {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_MappedRecord.Builder();
  }

  /** Number of the data row this record was mapped from. */
  public abstract long rowNumber();

  /** Resolved values by target field name. */
  public abstract ImmutableMap<String, FieldValue> values();

  /** Returns the value of a target field, or empty if it resolved to absent. */
  public Optional<FieldValue> value(String field) {
    return Optional.ofNullable(values().get(field));
  }

  /** Builder for {@link MappedRecord}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Sets the source row number. */
    public abstract Builder setRowNumber(long rowNumber);

    /** Builder for the values map. */
    protected abstract ImmutableMap.Builder<String, FieldValue> valuesBuilder();

    /** Adds a resolved value. */
    public Builder putValue(String field, FieldValue value) {
      valuesBuilder().put(field, value);
      return this;
    }

    /** Creates a new {@link MappedRecord} from the builder. */
    public abstract MappedRecord build();
  }
}
