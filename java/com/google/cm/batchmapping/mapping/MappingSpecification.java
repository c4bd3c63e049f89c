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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * Declarative description of how the rows of a file become records of a target schema: one {@link
 * MappingRule} per target field, the transformations applied to each field and, optionally, a
 * free-text field that collects every column no rule reads.
 */
@AutoValue
public abstract class MappingSpecification {

  /** Returns a new builder. */
  public static Builder builder() {
    return new AutoValue_MappingSpecification.Builder();
  }

  /** Rules by target field, in specification order. */
  public abstract ImmutableMap<String, MappingRule> rules();

  /** Field that collects unmapped columns, if any. */
  public abstract Optional<String> freeTextField();

  /** Transformation ids by target field, in application order. */
  public abstract ImmutableListMultimap<String, String> transformations();

  /**
   * Rules as applied to rows. A free-text field without its own rule gets a passthrough rule,
   * placed after the other rules.
   */
  public ImmutableMap<String, MappingRule> effectiveRules() {
    if (freeTextField().isEmpty() || rules().containsKey(freeTextField().get())) {
      return rules();
    }
    return ImmutableMap.<String, MappingRule>builder()
        .putAll(rules())
        .put(freeTextField().get(), MappingRule.ofPassthroughUnmapped())
        .build();
  }

  /** Transformation ids for {@code field}, in application order. */
  public ImmutableList<String> transformationsFor(String field) {
    return transformations().get(field);
  }

  /** Builder for {@link MappingSpecification}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Builder for the rules map. */
    protected abstract ImmutableMap.Builder<String, MappingRule> rulesBuilder();

    /** Adds the rule of a target field. */
    public Builder putRule(String field, MappingRule rule) {
      rulesBuilder().put(field, rule);
      return this;
    }

    /** Sets the free-text field. */
    public abstract Builder setFreeTextField(String field);

    /** Sets the free-text field. */
    public abstract Builder setFreeTextField(Optional<String> field);

    /** Builder for the transformations multimap. */
    protected abstract ImmutableListMultimap.Builder<String, String> transformationsBuilder();

    /** Appends a transformation to a target field. */
    public Builder addTransformation(String field, String transformationId) {
      transformationsBuilder().put(field, transformationId);
      return this;
    }

    /** Creates a new {@link MappingSpecification} from the builder. Fails on duplicate fields. */
    public abstract MappingSpecification build();
  }
}
