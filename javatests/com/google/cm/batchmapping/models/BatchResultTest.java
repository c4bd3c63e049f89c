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

import static com.google.cm.batchmapping.ErrorCode.RAGGED_ROW;
import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BatchResultTest {

  private static final MappedRecord ROW_1 =
      MappedRecord.builder().setRowNumber(1).putValue("a", FieldValue.ofString("x")).build();
  private static final RowMappingError ROW_2 = RowMappingError.create(2, RAGGED_ROW, "ragged");
  private static final MappedRecord ROW_3 = MappedRecord.builder().setRowNumber(3).build();

  @Test
  public void summary_countsOutcomesInOrder() {
    BatchResult result =
        BatchResult.builder()
            .addOutcome(RowOutcome.ofMapped(ROW_1))
            .addOutcome(RowOutcome.ofFailed(ROW_2))
            .addOutcome(RowOutcome.ofMapped(ROW_3))
            .build();

    BatchSummary summary = result.summary();

    assertThat(result.mappedRecords()).containsExactly(ROW_1, ROW_3).inOrder();
    assertThat(result.failures()).containsExactly(ROW_2);
    assertThat(summary.totalRows()).isEqualTo(3);
    assertThat(summary.mappedRows()).isEqualTo(2);
    assertThat(summary.failedRows()).isEqualTo(1);
    assertThat(summary.successRate()).isEqualTo("66.7%");
  }

  @Test
  public void summary_emptyBatch_hasZeroSuccessRate() {
    BatchSummary summary = BatchResult.builder().build().summary();

    assertThat(summary.totalRows()).isEqualTo(0);
    assertThat(summary.successRate()).isEqualTo("0%");
  }
}
