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

import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.StructureProfile;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Consumes a {@link RowReader} and summarizes the structure of the file behind it. */
public final class StructureProfiler {

  private static final Logger logger = LoggerFactory.getLogger(StructureProfiler.class);

  /**
   * Reads every remaining row of {@code reader}. Rows that cannot be read are counted but neither
   * sampled nor used for type inference.
   */
  public StructureProfile profile(RowReader reader, int sampleRows) {
    ColumnSet columns = reader.getColumns();
    var samples = ImmutableList.<DataRow>builder();
    Set<String> nonNumericColumns = new HashSet<>();
    Set<String> populatedColumns = new HashSet<>();
    long rowCount = 0;
    long failedRowCount = 0;
    while (reader.hasNext()) {
      ++rowCount;
      DataRow row;
      try {
        row = reader.next();
      } catch (RowStructureException ex) {
        ++failedRowCount;
        continue;
      }
      if (rowCount - failedRowCount <= sampleRows) {
        samples.add(row);
      }
      row.values()
          .forEach(
              (column, value) -> {
                if (value.isBlank()) {
                  return;
                }
                populatedColumns.add(column);
                if (!isNumber(value)) {
                  nonNumericColumns.add(column);
                }
              });
    }

    var columnTypes = ImmutableMap.<String, FieldType>builderWithExpectedSize(columns.size());
    for (String column : columns.names()) {
      boolean numeric =
          populatedColumns.contains(column) && !nonNumericColumns.contains(column);
      columnTypes.put(column, numeric ? FieldType.NUMBER : FieldType.STRING);
    }
    logger.info(
        "Profiled {}: {} rows, {} unreadable.", reader.getName(), rowCount, failedRowCount);
    return StructureProfile.builder()
        .setName(reader.getName())
        .setColumns(columns)
        .setRowCount(rowCount)
        .setFailedRowCount(failedRowCount)
        .setSampleRows(samples.build())
        .setColumnTypes(columnTypes.build())
        .build();
  }

  private static boolean isNumber(String value) {
    try {
      new BigDecimal(value.trim());
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }
}
