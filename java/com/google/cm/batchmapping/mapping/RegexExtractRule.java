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
import com.google.common.base.CharMatcher;

/**
 * Extracts a capture group from the first match of a pattern in one source column. The group is
 * either a group number or the name of a named group.
 */
@AutoValue
public abstract class RegexExtractRule {

  /** Group used when none is given. */
  public static final String DEFAULT_GROUP = "1";

  public static RegexExtractRule create(String column, String pattern, String group) {
    return new AutoValue_RegexExtractRule(column, pattern, group);
  }

  public static RegexExtractRule create(String column, String pattern, int group) {
    return create(column, pattern, String.valueOf(group));
  }

  public abstract String column();

  public abstract String pattern();

  public abstract String group();

  /** Whether {@link #group()} is a group number rather than a group name. */
  public boolean isNumberedGroup() {
    return !group().isEmpty() && CharMatcher.inRange('0', '9').matchesAllOf(group());
  }
}
