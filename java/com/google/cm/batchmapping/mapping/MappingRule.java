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

import com.google.auto.value.AutoOneOf;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/** How one target field gets its value from a data row. */
@AutoOneOf(MappingRule.Kind.class)
public abstract class MappingRule {
  public enum Kind {
    DIRECT,
    REGEX_EXTRACT,
    CONCAT,
    CONSTANT,
    TEMPLATE,
    PASSTHROUGH_UNMAPPED
  }

  public abstract Kind getKind();

  public abstract DirectRule direct();

  public abstract RegexExtractRule regexExtract();

  public abstract ConcatRule concat();

  public abstract ConstantRule constant();

  public abstract TemplateRule template();

  /** Collects the values of all columns no other rule reads. */
  public abstract void passthroughUnmapped();

  public static MappingRule ofDirect(String column) {
    return AutoOneOf_MappingRule.direct(DirectRule.create(column));
  }

  public static MappingRule ofRegexExtract(String column, String pattern, String group) {
    return AutoOneOf_MappingRule.regexExtract(RegexExtractRule.create(column, pattern, group));
  }

  public static MappingRule ofConcat(List<String> columns, String separator) {
    return AutoOneOf_MappingRule.concat(ConcatRule.create(columns, separator));
  }

  public static MappingRule ofConstant(String value) {
    return AutoOneOf_MappingRule.constant(ConstantRule.create(value));
  }

  public static MappingRule ofTemplate(String template, Map<String, String> variables) {
    return AutoOneOf_MappingRule.template(TemplateRule.create(template, variables));
  }

  public static MappingRule ofPassthroughUnmapped() {
    return AutoOneOf_MappingRule.passthroughUnmapped();
  }

  /** Source columns read by this rule, as written in the specification. */
  public ImmutableList<String> referencedColumns() {
    switch (getKind()) {
      case DIRECT:
        return ImmutableList.of(direct().column());
      case REGEX_EXTRACT:
        return ImmutableList.of(regexExtract().column());
      case CONCAT:
        return concat().columns();
      case TEMPLATE:
        return template().variables().values().asList();
      case CONSTANT:
      case PASSTHROUGH_UNMAPPED:
      // fallthrough
      default:
        return ImmutableList.of();
    }
  }
}
