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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.cm.batchmapping.models.MappedRecord;
import com.google.cm.batchmapping.models.TargetSchema;
import java.io.IOException;
import java.io.Writer;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each mapped record as one JSON object per line, with typed values and a {@code
 * _row_number} member. Failed rows are not written.
 */
public final class JsonLinesResultWriter implements ResultWriter {

  private static final Logger logger = LoggerFactory.getLogger(JsonLinesResultWriter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** {@inheritDoc} */
  @Override
  public void write(BatchResult result, TargetSchema schema, Writer writer) throws IOException {
    int written = 0;
    for (MappedRecord record : result.mappedRecords()) {
      writer.write(MAPPER.writeValueAsString(toJson(record, schema)));
      writer.write('\n');
      ++written;
    }
    writer.flush();
    logger.info("Wrote {} mapped records as JSON lines.", written);
  }

  /** Converts one record to a JSON object with members in schema order. */
  static ObjectNode toJson(MappedRecord record, TargetSchema schema) {
    ObjectNode node = MAPPER.createObjectNode();
    for (String field : schema.fieldNames()) {
      Optional<FieldValue> value = record.value(field);
      if (value.isEmpty()) {
        continue;
      }
      switch (value.get().getKind()) {
        case NUMBER:
          node.put(field, value.get().number());
          break;
        case BOOL:
          node.put(field, value.get().bool());
          break;
        case STRING:
        // fallthrough
        default:
          node.put(field, value.get().string());
      }
    }
    node.put("_row_number", record.rowNumber());
    return node;
  }
}
