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

import com.google.auto.value.AutoOneOf;
import java.math.BigDecimal;

/** A resolved, typed value of a mapped field. */
@AutoOneOf(FieldValue.Kind.class)
public abstract class FieldValue {
  public enum Kind {
    STRING,
    NUMBER,
    BOOL
  }

  public abstract Kind getKind();

  public abstract String string();

  public abstract BigDecimal number();

  public abstract Boolean bool();

  public static FieldValue ofString(String value) {
    return AutoOneOf_FieldValue.string(value);
  }

  public static FieldValue ofNumber(BigDecimal value) {
    return AutoOneOf_FieldValue.number(value);
  }

  public static FieldValue ofBool(boolean value) {
    return AutoOneOf_FieldValue.bool(value);
  }

  /** Text form, as written to CSV output. */
  public String asText() {
    switch (getKind()) {
      case NUMBER:
        return number().toPlainString();
      case BOOL:
        return bool().toString();
      case STRING:
      // fallthrough
      default:
        return string();
    }
  }

  /** Plain Java value, for JSON serialization. */
  public Object asObject() {
    switch (getKind()) {
      case NUMBER:
        return number();
      case BOOL:
        return bool();
      case STRING:
      // fallthrough
      default:
        return string();
    }
  }
}
