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

package com.google.cm.batchmapping.readers;

import static com.google.cm.batchmapping.ErrorCode.MALFORMED_ROW;
import static com.google.cm.batchmapping.ErrorCode.RAGGED_ROW;
import static com.google.cm.batchmapping.ErrorCode.UNDECODABLE_ROW;

import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link RowReader} over the records following the header of a CSV file. */
final class CsvRowReader implements RowReader {

  private static final Logger logger = LoggerFactory.getLogger(CsvRowReader.class);

  private final String name;
  private final ColumnSet columns;
  private final CSVParser parser;
  private final RecordLookahead records;
  private final ReplacementTrackingReader input;
  private final boolean padRaggedRows;

  private long rowsRead = 0;
  private boolean exhausted = false;

  CsvRowReader(
      String name,
      ColumnSet columns,
      CSVParser parser,
      RecordLookahead records,
      ReplacementTrackingReader input,
      boolean padRaggedRows) {
    this.name = name;
    this.columns = columns;
    this.parser = parser;
    this.records = records;
    this.input = input;
    this.padRaggedRows = padRaggedRows;
  }

  /** {@inheritDoc} */
  @Override
  public String getName() {
    return name;
  }

  /** {@inheritDoc} */
  @Override
  public ColumnSet getColumns() {
    return columns;
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasNext() {
    if (!exhausted) {
      exhausted = !records.hasNext();
    }
    return !exhausted;
  }

  /** {@inheritDoc} */
  @Override
  public DataRow next() {
    if (!hasNext()) {
      throw new NoSuchElementException("CsvRowReader has no more rows to read.");
    }
    long rowNumber = ++rowsRead;
    CSVRecord record;
    try {
      record = records.next();
    } catch (UncheckedIOException | IllegalStateException ex) {
      throw toMalformedRow(rowNumber, ex);
    }
    if (input.hasReplacementsIn(record, records.nextPosition())) {
      String message = String.format("Row %d of %s is not valid UTF-8.", rowNumber, name);
      logger.info(message);
      throw new RowStructureException(rowNumber, message, UNDECODABLE_ROW);
    }
    return toDataRow(rowNumber, record);
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    parser.close();
  }

  private RowStructureException toMalformedRow(long rowNumber, RuntimeException failure) {
    if (input.hasReadFailed()) {
      // The stream itself broke, nothing after this row can be read
      logger.warn("Stopped reading {} after row {} could not be read.", name, rowNumber);
      exhausted = true;
    }
    String message =
        String.format(
            "Row %d of %s could not be parsed: %s",
            rowNumber, name, ExceptionUtils.getRootCauseMessage(failure));
    logger.info(message);
    return new RowStructureException(rowNumber, message, failure, MALFORMED_ROW);
  }

  private DataRow toDataRow(long rowNumber, CSVRecord record) {
    List<String> cells = record.toList();
    int expected = columns.size();
    if (cells.size() != expected && !canAlign(cells, expected)) {
      String message =
          String.format(
              "Row %d of %s has %d fields, expected %d.", rowNumber, name, cells.size(), expected);
      logger.info(message);
      throw new RowStructureException(rowNumber, message, RAGGED_ROW);
    }
    var values = ImmutableMap.<String, String>builderWithExpectedSize(expected);
    for (int i = 0; i < expected; ++i) {
      values.put(columns.names().get(i), i < cells.size() ? cells.get(i) : "");
    }
    return DataRow.create(rowNumber, values.build());
  }

  /** Whether a row of the wrong width may be padded or trimmed to the header width. */
  private boolean canAlign(List<String> cells, int expected) {
    if (!padRaggedRows) {
      return false;
    }
    return cells.subList(Math.min(expected, cells.size()), cells.size()).stream()
        .allMatch(String::isBlank);
  }
}
