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

import com.google.auto.value.AutoOneOf;

/** Final state of one row: either mapped or failed. */
@AutoOneOf(RowOutcome.Kind.class)
public abstract class RowOutcome {
  public enum Kind {
    MAPPED,
    FAILED
  }

  public abstract Kind getKind();

  public abstract MappedRecord mapped();

  public abstract RowMappingError failed();

  public static RowOutcome ofMapped(MappedRecord record) {
    return AutoOneOf_RowOutcome.mapped(record);
  }

  public static RowOutcome ofFailed(RowMappingError error) {
    return AutoOneOf_RowOutcome.failed(error);
  }

  public boolean isMapped() {
    return getKind() == Kind.MAPPED;
  }

  /** Number of the row this outcome belongs to. */
  public long rowNumber() {
    return isMapped() ? mapped().rowNumber() : failed().rowNumber();
  }
}
