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

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.io.UncheckedIOException;
import java.util.Iterator;
import org.apache.commons.csv.CSVRecord;

/**
 * Keeps one parsed record ahead of the caller, so that the start of the following record bounds
 * the one being returned. A record that fails to parse is held and rethrown by {@link #next()}.
 */
final class RecordLookahead {

  private final PeekingIterator<CSVRecord> records;
  private RuntimeException failure;

  RecordLookahead(Iterator<CSVRecord> records) {
    this.records = Iterators.peekingIterator(records);
  }

  /** Whether another record, or a parse failure in its place, is ahead. */
  boolean hasNext() {
    if (failure != null) {
      return true;
    }
    try {
      return records.hasNext();
    } catch (UncheckedIOException | IllegalStateException ex) {
      failure = ex;
      return true;
    }
  }

  /**
   * Character position where the next record starts, or {@link Long#MAX_VALUE} if there is none
   * or it cannot be parsed.
   */
  long nextPosition() {
    if (!hasNext() || failure != null) {
      return Long.MAX_VALUE;
    }
    return records.peek().getCharacterPosition();
  }

  /** Returns the next record, or throws the failure met while parsing it. */
  CSVRecord next() {
    if (failure != null) {
      RuntimeException held = failure;
      failure = null;
      throw held;
    }
    return records.next();
  }
}
