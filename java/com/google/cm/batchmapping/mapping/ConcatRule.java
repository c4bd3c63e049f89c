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

package com.google.cm.batchmapping.mapping;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Joins the non-empty values of several source columns. */
@AutoValue
public abstract class ConcatRule {

  /** Separator used when none is given. */
  public static final String DEFAULT_SEPARATOR = " ";

  public static ConcatRule create(List<String> columns, String separator) {
    return new AutoValue_ConcatRule(ImmutableList.copyOf(columns), separator);
  }

  public abstract ImmutableList<String> columns();

  public abstract String separator();
}
