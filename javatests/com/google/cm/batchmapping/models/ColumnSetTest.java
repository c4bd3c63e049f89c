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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ColumnSetTest {

  @Test
  public void lookup_ignoresCaseAndSurroundingWhitespace() {
    ColumnSet columns = ColumnSet.create(ImmutableList.of("Street Name", "Postcode"));

    assertThat(columns.lookup("street name")).hasValue("Street Name");
    assertThat(columns.lookup(" POSTCODE")).hasValue("Postcode");
    assertThat(columns.lookup("streetname")).isEmpty();
    assertThat(columns.contains("postcode")).isTrue();
    assertThat(columns.size()).isEqualTo(2);
  }

  @Test
  public void create_keepsDisplayNamesInOrder() {
    ColumnSet columns = ColumnSet.create(ImmutableList.of("b", "A", "c"));

    assertThat(columns.names()).containsExactly("b", "A", "c").inOrder();
  }

  @Test
  public void create_namesCollidingIgnoringCase_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ColumnSet.create(ImmutableList.of("Postcode", "postcode")));
  }
}
