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

package com.google.cm.batchmapping.mapping;

import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/** Converts resolved text to the primitive type of a schema field. */
public final class ValueConverter {

  private static final ImmutableSet<String> TRUE_VALUES = ImmutableSet.of("true", "yes", "y", "1");
  private static final ImmutableSet<String> FALSE_VALUES = ImmutableSet.of("false", "no", "n", "0");

  private ValueConverter() {}

  /**
   * Converts {@code text} to a value of {@code type}. Empty text is absent for numbers and
   * booleans and an empty string otherwise.
   *
   * @throws ConversionException if the text is not a valid value of the type
   */
  public static Optional<FieldValue> convert(String text, FieldType type)
      throws ConversionException {
    switch (type) {
      case NUMBER:
        return toNumber(text.trim());
      case BOOLEAN:
        return toBoolean(text.trim());
      case STRING:
      // fallthrough
      default:
        return Optional.of(FieldValue.ofString(text));
    }
  }

  private static Optional<FieldValue> toNumber(String text) throws ConversionException {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(FieldValue.ofNumber(new BigDecimal(text)));
    } catch (NumberFormatException ex) {
      throw new ConversionException(String.format("'%s' is not a number", text));
    }
  }

  private static Optional<FieldValue> toBoolean(String text) throws ConversionException {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    String key = text.toLowerCase(Locale.ROOT);
    if (TRUE_VALUES.contains(key)) {
      return Optional.of(FieldValue.ofBool(true));
    }
    if (FALSE_VALUES.contains(key)) {
      return Optional.of(FieldValue.ofBool(false));
    }
    throw new ConversionException(String.format("'%s' is not a boolean", text));
  }

  /** Thrown when text cannot be converted to the requested type. */
  public static class ConversionException extends Exception {

    public ConversionException(String message) {
      super(message);
    }
  }
}
