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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered canonical column names of one input file.
 *
 * <p>Names keep the casing and internal spacing of the header for display. Lookups are
 * case-insensitive and ignore surrounding whitespace, so no two names in a set may share a lookup
 * key.
 */
@AutoValue
public abstract class ColumnSet {

  /** Creates a column set. Fails if two names share a lookup key. */
  public static ColumnSet create(List<String> names) {
    var lookupKeys = ImmutableMap.<String, String>builderWithExpectedSize(names.size());
    for (String name : names) {
      lookupKeys.put(toLookupKey(name), name);
    }
    // buildOrThrow rejects names that collide after case-folding
    return new AutoValue_ColumnSet(ImmutableList.copyOf(names), lookupKeys.buildOrThrow());
  }

  /** Key used for case-insensitive column lookups. */
  public static String toLookupKey(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }

  /** Canonical column names in header order. */
  public abstract ImmutableList<String> names();

  abstract ImmutableMap<String, String> lookupKeys();

  /** Returns the canonical name matching {@code name}, ignoring case. */
  public Optional<String> lookup(String name) {
    return Optional.ofNullable(lookupKeys().get(toLookupKey(name)));
  }

  /** Whether a column matching {@code name} exists, ignoring case. */
  public boolean contains(String name) {
    return lookupKeys().containsKey(toLookupKey(name));
  }

  public int size() {
    return names().size();
  }
}
