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

import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.cm.batchmapping.models.MappedRecord;
import com.google.cm.batchmapping.models.RowMappingError;
import com.google.cm.batchmapping.models.RowOutcome;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one CSV line per row outcome. Schema fields come first, in schema order, followed by the
 * metadata columns in sorted order. Absent fields and the fields of failed rows are empty cells.
 */
public final class CsvResultWriter implements ResultWriter {

  private static final Logger logger = LoggerFactory.getLogger(CsvResultWriter.class);

  /** Metadata columns, sorted. */
  public static final ImmutableList<String> METADATA_COLUMNS =
      ImmutableList.of("_error", "_error_code", "_row_number", "_status");

  static final String STATUS_MAPPED = "MAPPED";
  static final String STATUS_FAILED = "FAILED";

  /** {@inheritDoc} */
  @Override
  public void write(BatchResult result, TargetSchema schema, Writer writer) throws IOException {
    ImmutableList<String> fields = schema.fieldNames();
    String[] header =
        ImmutableList.<String>builder()
            .addAll(fields)
            .addAll(METADATA_COLUMNS)
            .build()
            .toArray(new String[0]);
    CSVPrinter printer = CSVFormat.DEFAULT.builder().setHeader(header).build().print(writer);
    for (RowOutcome outcome : result.outcomes()) {
      printer.printRecord(
          outcome.isMapped()
              ? mappedLine(outcome.mapped(), fields)
              : failedLine(outcome.failed(), fields));
    }
    printer.flush();
    logger.info("Wrote {} rows as CSV.", result.outcomes().size());
  }

  private static List<String> mappedLine(MappedRecord record, ImmutableList<String> fields) {
    List<String> line = new ArrayList<>(fields.size() + METADATA_COLUMNS.size());
    for (String field : fields) {
      line.add(record.value(field).map(FieldValue::asText).orElse(""));
    }
    line.add("");
    line.add("");
    line.add(String.valueOf(record.rowNumber()));
    line.add(STATUS_MAPPED);
    return line;
  }

  private static List<String> failedLine(RowMappingError error, ImmutableList<String> fields) {
    List<String> line = new ArrayList<>(fields.size() + METADATA_COLUMNS.size());
    for (int i = 0; i < fields.size(); ++i) {
      line.add("");
    }
    line.add(error.field().map(field -> field + ": " + error.reason()).orElse(error.reason()));
    line.add(error.errorCode().name());
    line.add(String.valueOf(error.rowNumber()));
    line.add(STATUS_FAILED);
    return line;
  }
}
