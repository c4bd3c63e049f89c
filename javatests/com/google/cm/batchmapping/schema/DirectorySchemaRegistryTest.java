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

import static com.google.cm.batchmapping.ErrorCode.INVALID_SCHEMA;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.models.TargetSchema;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DirectorySchemaRegistryTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private DirectorySchemaRegistry registry;

  @Before
  public void setUp() {
    registry = new DirectorySchemaRegistry(folder.getRoot().toPath());
  }

  @Test
  public void fetch_schemaFile() throws Exception {
    write(
        "address_lookup",
        "{\"properties\": {\"postcode\": {\"type\": \"string\"}}, \"required\": [\"postcode\"]}");

    Optional<TargetSchema> schema = registry.fetch("address_lookup");

    assertThat(schema).isPresent();
    assertThat(schema.get().targetId()).isEqualTo("address_lookup");
    assertThat(schema.get().fieldNames()).containsExactly("postcode");
  }

  @Test
  public void fetch_missingFile_returnsEmpty() {
    assertThat(registry.fetch("address_lookup")).isEmpty();
  }

  @Test
  public void fetch_invalidFile_throwsInvalidSchema() throws Exception {
    write("broken", "{\"properties\": ");

    BatchMappingException ex =
        assertThrows(BatchMappingException.class, () -> registry.fetch("broken"));

    assertThat(ex.getErrorCode()).isEqualTo(INVALID_SCHEMA);
  }

  private void write(String targetId, String content) throws Exception {
    Path file = folder.getRoot().toPath().resolve(targetId + ".json");
    Files.writeString(file, content, UTF_8);
  }
}
