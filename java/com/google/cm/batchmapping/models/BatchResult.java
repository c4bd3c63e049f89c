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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ordered per-row outcomes of a batch run. Outcomes appear in source row order, one per data row
 * read.
 */
@AutoValue
public abstract class BatchResult {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_BatchResult.Builder();
  }

  /** Creates a result from a list of outcomes that is already in row order. */
  public static BatchResult create(List<RowOutcome> outcomes) {
    return builder().setOutcomes(outcomes).build();
  }

  /** Per-row outcomes in source order. */
  public abstract ImmutableList<RowOutcome> outcomes();

  /** Records of successfully mapped rows, in source order. */
  public ImmutableList<MappedRecord> mappedRecords() {
    return outcomes().stream()
        .filter(RowOutcome::isMapped)
        .map(RowOutcome::mapped)
        .collect(toImmutableList());
  }

  /** Failures, in source order. */
  public ImmutableList<RowMappingError> failures() {
    return outcomes().stream()
        .filter(outcome -> !outcome.isMapped())
        .map(RowOutcome::failed)
        .collect(toImmutableList());
  }

  public long mappedCount() {
    return outcomes().stream().filter(RowOutcome::isMapped).count();
  }

  public long failedCount() {
    return outcomes().size() - mappedCount();
  }

  /** Diagnostics summary for logging or surfacing to an operator. */
  public BatchSummary summary() {
    return BatchSummary.create(outcomes().size(), mappedCount(), failures());
  }

  /** Builder for {@link BatchResult}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Sets all outcomes. */
    public abstract Builder setOutcomes(List<RowOutcome> outcomes);

    /** Builder for the outcome list. */
    protected abstract ImmutableList.Builder<RowOutcome> outcomesBuilder();

    /** Appends the outcome of the next row. */
    public Builder addOutcome(RowOutcome outcome) {
      outcomesBuilder().add(outcome);
      return this;
    }

    /** Creates a new {@link BatchResult} from the builder. */
    public abstract BatchResult build();
  }
}
