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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Input contract of one downstream tool: its ordered set of fields. */
@AutoValue
public abstract class TargetSchema {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_TargetSchema.Builder();
  }

  /** Identifier the schema is registered under. */
  public abstract String targetId();

  /** Schema version, if the registry tracks one. */
  public abstract Optional<String> version();

  /** Fields in declaration order. */
  public abstract ImmutableList<SchemaField> fields();

  /** Returns the field with the given name. Names are case-sensitive. */
  public Optional<SchemaField> field(String name) {
    return fields().stream().filter(field -> field.name().equals(name)).findFirst();
  }

  /** Fields marked required, in declaration order. */
  public ImmutableList<SchemaField> requiredFields() {
    return fields().stream().filter(SchemaField::required).collect(toImmutableList());
  }

  /** Field names in declaration order. */
  public ImmutableList<String> fieldNames() {
    return fields().stream().map(SchemaField::name).collect(toImmutableList());
  }

  /** Builder for {@link TargetSchema}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Sets the target id. */
    public abstract Builder setTargetId(String targetId);

    /** Sets the version. */
    public abstract Builder setVersion(String version);

    /** Sets the version. */
    public abstract Builder setVersion(Optional<String> version);

    /** Builder for the field list. */
    protected abstract ImmutableList.Builder<SchemaField> fieldsBuilder();

    /** Adds a field. */
    public Builder addField(SchemaField field) {
      fieldsBuilder().add(field);
      return this;
    }

    /** Creates a new {@link TargetSchema} from the builder. */
    public abstract TargetSchema build();
  }
}
