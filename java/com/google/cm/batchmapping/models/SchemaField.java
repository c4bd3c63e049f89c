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
import java.util.Optional;

/** A single input field of a target schema. */
@AutoValue
public abstract class SchemaField {

  /** Returns a new builder. Fields default to optional strings. */
  public static Builder builder() {
    return new AutoValue_SchemaField.Builder().setRequired(false).setType(FieldType.STRING);
  }

  /** Field name, as the downstream tool expects it. */
  public abstract String name();

  /** Whether every mapped record must carry this field. */
  public abstract boolean required();

  /** Primitive type of the field value. */
  public abstract FieldType type();

  /** Human-readable description, if the registry provides one. */
  public abstract Optional<String> description();

  /** Regular expression a string value must fully match, if declared. */
  public abstract Optional<String> pattern();

  /** Builder for {@link SchemaField}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Sets the field name. */
    public abstract Builder setName(String name);

    /** Sets whether the field is required. */
    public abstract Builder setRequired(boolean required);

    /** Sets the field type. */
    public abstract Builder setType(FieldType type);

    /** Sets the description. */
    public abstract Builder setDescription(String description);

    /** Sets the description. */
    public abstract Builder setDescription(Optional<String> description);

    /** Sets the value pattern. */
    public abstract Builder setPattern(String pattern);

    /** Sets the value pattern. */
    public abstract Builder setPattern(Optional<String> pattern);

    /** Creates a new {@link SchemaField} from the builder. */
    public abstract SchemaField build();
  }
}
