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
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Fills {@code {name}} placeholders of a template with the values of source columns. {@link
 * #variables()} maps placeholder names to column names.
 */
@AutoValue
public abstract class TemplateRule {

  public static TemplateRule create(String template, Map<String, String> variables) {
    return new AutoValue_TemplateRule(template, ImmutableMap.copyOf(variables));
  }

  public abstract String template();

  public abstract ImmutableMap<String, String> variables();
}
