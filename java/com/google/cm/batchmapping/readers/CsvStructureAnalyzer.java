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

import static com.google.cm.batchmapping.ErrorCode.BLANK_COLUMN_NAME;
import static com.google.cm.batchmapping.ErrorCode.DUPLICATE_COLUMN_NAME;
import static com.google.cm.batchmapping.ErrorCode.EMPTY_INPUT_FILE;
import static com.google.cm.batchmapping.ErrorCode.INPUT_FILE_READ_ERROR;
import static com.google.cm.batchmapping.ErrorCode.MALFORMED_INPUT_FILE;
import static com.google.cm.batchmapping.ErrorCode.UNDECODABLE_INPUT;

import com.google.cm.batchmapping.Annotations.ColumnDelimiter;
import com.google.cm.batchmapping.Annotations.PadRaggedRows;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link StructureAnalyzer} for delimited UTF-8 text files, with or without a byte-order mark. */
public final class CsvStructureAnalyzer implements StructureAnalyzer {

  private static final Logger logger = LoggerFactory.getLogger(CsvStructureAnalyzer.class);
  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
  private static final CharMatcher HEADER_NOISE =
      CharMatcher.is('\uFEFF').or(CharMatcher.javaIsoControl());

  private final char delimiter;
  private final boolean padRaggedRows;

  @Inject
  public CsvStructureAnalyzer(
      @ColumnDelimiter Character delimiter, @PadRaggedRows Boolean padRaggedRows) {
    this.delimiter = delimiter;
    this.padRaggedRows = padRaggedRows;
  }

  /** {@inheritDoc} */
  @Override
  public RowReader analyze(InputStream inputStream, String name) {
    ReplacementTrackingReader input = openInput(inputStream, name);
    CSVParser parser = parse(input, name);
    try {
      RecordLookahead records = new RecordLookahead(parser.iterator());
      CSVRecord header = readHeader(records, input, name);
      if (input.hasReplacementsIn(header, records.nextPosition())) {
        String message = String.format("Header of input file %s is not valid UTF-8.", name);
        logger.error(message);
        throw new StructuralException(message, UNDECODABLE_INPUT);
      }
      ColumnSet columns = toColumnSet(header.toList(), name);
      logger.info("Input file {} has {} columns: {}", name, columns.size(), columns.names());
      return new CsvRowReader(name, columns, parser, records, input, padRaggedRows);
    } catch (RuntimeException ex) {
      closeAfterFailure(parser, ex);
      throw ex;
    }
  }

  private ReplacementTrackingReader openInput(InputStream inputStream, String name) {
    try {
      PushbackInputStream stream = skipByteOrderMark(inputStream);
      int first = stream.read();
      if (first == -1) {
        String message = String.format("Input file %s is empty.", name);
        logger.error(message);
        throw new StructuralException(message, EMPTY_INPUT_FILE);
      }
      stream.unread(first);
      return new ReplacementTrackingReader(stream);
    } catch (IOException ex) {
      throw toReadError(name, ex);
    }
  }

  private CSVParser parse(ReplacementTrackingReader input, String name) {
    try {
      return CSVFormat.DEFAULT
          .builder()
          .setDelimiter(delimiter)
          .setIgnoreEmptyLines(true)
          .build()
          .parse(input);
    } catch (IOException ex) {
      throw toReadError(name, ex);
    }
  }

  private static StructuralException toReadError(String name, IOException cause) {
    String message = String.format("Could not read input file %s.", name);
    logger.error(message, cause);
    return new StructuralException(message, cause, INPUT_FILE_READ_ERROR);
  }

  /** Consumes a leading UTF-8 byte-order mark, if there is one. */
  private static PushbackInputStream skipByteOrderMark(InputStream inputStream)
      throws IOException {
    PushbackInputStream stream = new PushbackInputStream(inputStream, UTF8_BOM.length);
    byte[] prefix = new byte[UTF8_BOM.length];
    int length = stream.readNBytes(prefix, 0, prefix.length);
    boolean isBom = length == UTF8_BOM.length;
    for (int i = 0; isBom && i < UTF8_BOM.length; ++i) {
      isBom = prefix[i] == UTF8_BOM[i];
    }
    if (!isBom && length > 0) {
      stream.unread(prefix, 0, length);
    }
    return stream;
  }

  private static CSVRecord readHeader(
      RecordLookahead records, ReplacementTrackingReader input, String name) {
    if (!records.hasNext()) {
      String message = String.format("Input file %s has no header row.", name);
      logger.error(message);
      throw new StructuralException(message, EMPTY_INPUT_FILE);
    }
    try {
      return records.next();
    } catch (UncheckedIOException | IllegalStateException ex) {
      if (input.hasReadFailed()) {
        String message = String.format("Could not read input file %s.", name);
        logger.error(message, ex);
        throw new StructuralException(message, ex, INPUT_FILE_READ_ERROR);
      }
      String message = String.format("Header of input file %s could not be parsed.", name);
      logger.error(message, ex);
      throw new StructuralException(message, ex, MALFORMED_INPUT_FILE);
    }
  }

  private static ColumnSet toColumnSet(List<String> rawNames, String name) {
    var names = ImmutableList.<String>builderWithExpectedSize(rawNames.size());
    Map<String, String> seen = new HashMap<>();
    for (int i = 0; i < rawNames.size(); ++i) {
      String columnName = HEADER_NOISE.removeFrom(rawNames.get(i)).trim();
      if (columnName.isEmpty()) {
        String message =
            String.format("Column %d in the header of input file %s has no name.", i + 1, name);
        logger.error(message);
        throw new StructuralException(message, BLANK_COLUMN_NAME);
      }
      String previous = seen.putIfAbsent(ColumnSet.toLookupKey(columnName), columnName);
      if (previous != null) {
        String message =
            String.format(
                "Input file %s has duplicate columns '%s' and '%s'.", name, previous, columnName);
        logger.error(message);
        throw new StructuralException(message, DUPLICATE_COLUMN_NAME);
      }
      names.add(columnName);
    }
    return ColumnSet.create(names.build());
  }

  private static void closeAfterFailure(CSVParser parser, RuntimeException failure) {
    try {
      parser.close();
    } catch (IOException ex) {
      failure.addSuppressed(ex);
    }
  }
}
