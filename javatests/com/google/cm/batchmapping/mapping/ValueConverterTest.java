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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.cm.batchmapping.mapping.ValueConverter.ConversionException;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.FieldValue;
import java.math.BigDecimal;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ValueConverterTest {

  @Test
  public void convert_string_keepsTextAsIs() throws Exception {
    assertThat(ValueConverter.convert(" Flat B ", FieldType.STRING))
        .hasValue(FieldValue.ofString(" Flat B "));
    assertThat(ValueConverter.convert("", FieldType.STRING)).hasValue(FieldValue.ofString(""));
  }

  @Test
  public void convert_number() throws Exception {
    assertThat(ValueConverter.convert(" 42 ", FieldType.NUMBER))
        .hasValue(FieldValue.ofNumber(new BigDecimal("42")));
    assertThat(ValueConverter.convert("-0.5", FieldType.NUMBER).get().asText()).isEqualTo("-0.5");
    assertThat(ValueConverter.convert("  ", FieldType.NUMBER)).isEmpty();
  }

  @Test
  public void convert_invalidNumber_throws() {
    ConversionException ex =
        assertThrows(
            ConversionException.class, () -> ValueConverter.convert("12a", FieldType.NUMBER));

    assertThat(ex).hasMessageThat().contains("12a");
  }

  @Test
  public void convert_boolean() throws Exception {
    for (String text : new String[] {"true", "YES", "y", "1"}) {
      assertThat(ValueConverter.convert(text, FieldType.BOOLEAN)).hasValue(FieldValue.ofBool(true));
    }
    for (String text : new String[] {"False", "no", "N", "0"}) {
      assertThat(ValueConverter.convert(text, FieldType.BOOLEAN))
          .hasValue(FieldValue.ofBool(false));
    }
    assertThat(ValueConverter.convert("", FieldType.BOOLEAN)).isEmpty();
  }

  @Test
  public void convert_invalidBoolean_throws() {
    assertThrows(
        ConversionException.class, () -> ValueConverter.convert("maybe", FieldType.BOOLEAN));
  }
}
