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

package com.google.cm.batchmapping.schema;

import static com.google.common.truth.Truth.assertThat;

import com.google.cm.batchmapping.models.TargetSchema;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ResourceSchemaRegistryTest {

  private final ResourceSchemaRegistry registry = new ResourceSchemaRegistry();

  @Test
  public void fetch_bundledSchema() {
    Optional<TargetSchema> schema = registry.fetch("broadband_availability_bt_wholesale_v1");

    assertThat(schema).isPresent();
    assertThat(schema.get().targetId()).isEqualTo("broadband_availability_bt_wholesale_v1");
    assertThat(schema.get().requiredFields().stream().map(field -> field.name()))
        .containsExactly("building_number", "street", "postcode")
        .inOrder();
    assertThat(schema.get().field("full_address").get().required()).isFalse();
    assertThat(schema.get().field("postcode").get().pattern()).isPresent();
  }

  @Test
  public void fetch_unknownTarget_returnsEmpty() {
    assertThat(registry.fetch("no_such_target")).isEmpty();
  }

  @Test
  public void fetch_pathLikeTarget_returnsEmpty() {
    assertThat(registry.fetch("../schemas/broadband_availability_bt_wholesale_v1")).isEmpty();
    assertThat(registry.fetch("")).isEmpty();
  }
}
