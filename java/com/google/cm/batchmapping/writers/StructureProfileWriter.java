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

package com.google.cm.batchmapping.writers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.StructureProfile;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/** Writes a {@link StructureProfile} as a JSON document for mapping generators. */
public final class StructureProfileWriter {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Writes {@code profile} to {@code writer} and flushes it. */
  public void write(StructureProfile profile, Writer writer) throws IOException {
    writer.write(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(profile)));
    writer.write('\n');
    writer.flush();
  }

  static ObjectNode toJson(StructureProfile profile) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("name", profile.name());
    ArrayNode columns = node.putArray("columns");
    profile.columns().names().forEach(columns::add);
    node.put("row_count", profile.rowCount());
    node.put("failed_row_count", profile.failedRowCount());
    ObjectNode types = node.putObject("column_types");
    profile
        .columnTypes()
        .forEach((column, type) -> types.put(column, type.name().toLowerCase(Locale.ROOT)));
    ArrayNode samples = node.putArray("sample_rows");
    for (DataRow row : profile.sampleRows()) {
      ObjectNode sample = samples.addObject();
      row.values().forEach(sample::put);
    }
    return node;
  }
}
