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

import static com.google.cm.batchmapping.ErrorCode.CONSTANT_TYPE_MISMATCH;
import static com.google.cm.batchmapping.ErrorCode.DANGLING_COLUMN_REFERENCE;
import static com.google.cm.batchmapping.ErrorCode.INVALID_FREE_TEXT_FIELD;
import static com.google.cm.batchmapping.ErrorCode.INVALID_PATTERN;
import static com.google.cm.batchmapping.ErrorCode.INVALID_TEMPLATE;
import static com.google.cm.batchmapping.ErrorCode.MISSING_REQUIRED_FIELD;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TARGET_FIELD;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TRANSFORMATION;

import com.google.cm.batchmapping.ErrorCode;
import com.google.cm.batchmapping.mapping.MappingRule.Kind;
import com.google.cm.batchmapping.mapping.ValueConverter.ConversionException;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.MappingViolation;
import com.google.cm.batchmapping.models.SchemaField;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.cm.batchmapping.transformations.Transformation.TransformationException;
import com.google.cm.batchmapping.transformations.TransformationProvider;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a {@link MappingSpecification} against the columns of an input file and a target schema
 * before any row is mapped. Every check runs, so the result lists all violations, grouped by check
 * in a fixed order and by rule order within a check.
 */
public final class MappingSpecificationValidator {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");
  private static final Pattern GROUP_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");
  // A trailing comment or an unterminated quote swallows a bare "|"
  private static final ImmutableList<String> EMPTY_ALTERNATIVES =
      ImmutableList.of("|", "\n|", "\\E|");

  /** Validates {@code spec}. Never throws for an invalid specification. */
  public ValidationResult validate(
      MappingSpecification spec, ColumnSet columns, TargetSchema schema) {
    List<MappingViolation> violations = new ArrayList<>();
    checkTargetFields(spec, schema, violations);
    checkRequiredFields(spec, schema, violations);
    checkColumnReferences(spec, columns, violations);
    checkPatterns(spec, violations);
    checkFreeTextField(spec, violations);
    checkTemplates(spec, violations);
    checkTransformations(spec, violations);
    checkConstants(spec, schema, violations);
    return ValidationResult.create(violations);
  }

  private static void checkTargetFields(
      MappingSpecification spec, TargetSchema schema, List<MappingViolation> violations) {
    Set<String> fields = new LinkedHashSet<>(spec.rules().keySet());
    spec.freeTextField().ifPresent(fields::add);
    fields.addAll(spec.transformations().keySet());
    for (String field : fields) {
      if (schema.field(field).isEmpty()) {
        violations.add(
            violation(
                UNKNOWN_TARGET_FIELD,
                field,
                String.format(
                    "Field '%s' is not part of target schema %s", field, schema.targetId())));
      }
    }
  }

  private static void checkRequiredFields(
      MappingSpecification spec, TargetSchema schema, List<MappingViolation> violations) {
    for (SchemaField field : schema.requiredFields()) {
      MappingRule rule = spec.rules().get(field.name());
      if (rule == null || rule.getKind() == Kind.PASSTHROUGH_UNMAPPED) {
        violations.add(
            violation(
                MISSING_REQUIRED_FIELD,
                field.name(),
                String.format("Required field '%s' has no mapping rule", field.name())));
      }
    }
  }

  private static void checkColumnReferences(
      MappingSpecification spec, ColumnSet columns, List<MappingViolation> violations) {
    for (Entry<String, MappingRule> entry : spec.rules().entrySet()) {
      for (String column : entry.getValue().referencedColumns()) {
        if (!columns.contains(column)) {
          violations.add(
              MappingViolation.builder()
                  .setErrorCode(DANGLING_COLUMN_REFERENCE)
                  .setTargetField(entry.getKey())
                  .setSourceColumn(column)
                  .setMessage(
                      String.format(
                          "Field '%s' reads column '%s', which is not in the input file",
                          entry.getKey(), column))
                  .build());
        }
      }
    }
  }

  private static void checkPatterns(MappingSpecification spec, List<MappingViolation> violations) {
    for (Entry<String, MappingRule> entry : spec.rules().entrySet()) {
      if (entry.getValue().getKind() == Kind.REGEX_EXTRACT) {
        checkPattern(entry.getKey(), entry.getValue().regexExtract())
            .ifPresent(
                message -> violations.add(violation(INVALID_PATTERN, entry.getKey(), message)));
      }
    }
  }

  private static Optional<String> checkPattern(String field, RegexExtractRule rule) {
    Matcher matcher;
    try {
      matcher = Pattern.compile(rule.pattern()).matcher("");
    } catch (PatternSyntaxException ex) {
      return Optional.of(
          String.format(
              "Field '%s' has invalid pattern '%s': %s",
              field, rule.pattern(), ex.getDescription()));
    }
    if (rule.isNumberedGroup()) {
      int group;
      try {
        group = Integer.parseInt(rule.group());
      } catch (NumberFormatException ex) {
        group = Integer.MAX_VALUE;
      }
      if (group > matcher.groupCount()) {
        return Optional.of(
            String.format(
                "Field '%s' extracts group %s but pattern '%s' has %d group(s)",
                field, rule.group(), rule.pattern(), matcher.groupCount()));
      }
      return Optional.empty();
    }
    if (!GROUP_NAME.matcher(rule.group()).matches()
        || !definesGroup(rule.pattern(), rule.group())) {
      return Optional.of(
          String.format(
              "Field '%s' extracts group '%s', which pattern '%s' does not define",
              field, rule.group(), rule.pattern()));
    }
    return Optional.empty();
  }

  /**
   * Whether {@code pattern} declares a capturing group called {@code name}. Group names can only be
   * looked up after a match, so the pattern is given an empty alternative that matches "".
   */
  private static boolean definesGroup(String pattern, String name) {
    for (String suffix : EMPTY_ALTERNATIVES) {
      Matcher matcher;
      try {
        matcher = Pattern.compile(pattern + suffix).matcher("");
      } catch (PatternSyntaxException ex) {
        // The suffix was not valid in this pattern's trailing context
        continue;
      }
      if (matcher.matches()) {
        try {
          matcher.group(name);
          return true;
        } catch (IllegalArgumentException ex) {
          return false;
        }
      }
    }
    return false;
  }

  private static void checkFreeTextField(
      MappingSpecification spec, List<MappingViolation> violations) {
    ImmutableList<String> passthroughFields =
        spec.effectiveRules().entrySet().stream()
            .filter(entry -> entry.getValue().getKind() == Kind.PASSTHROUGH_UNMAPPED)
            .map(Entry::getKey)
            .collect(ImmutableList.toImmutableList());
    if (spec.freeTextField().isPresent()) {
      String field = spec.freeTextField().get();
      MappingRule rule = spec.rules().get(field);
      if (rule != null && rule.getKind() != Kind.PASSTHROUGH_UNMAPPED) {
        violations.add(
            violation(
                INVALID_FREE_TEXT_FIELD,
                field,
                String.format(
                    "Free-text field '%s' has a %s rule instead of collecting unmapped columns",
                    field, rule.getKind())));
      }
    }
    if (passthroughFields.size() > 1) {
      violations.add(
          violation(
              INVALID_FREE_TEXT_FIELD,
              passthroughFields.get(1),
              String.format(
                  "Only one field may collect unmapped columns, found %s", passthroughFields)));
    }
  }

  private static void checkTemplates(MappingSpecification spec, List<MappingViolation> violations) {
    for (Entry<String, MappingRule> entry : spec.rules().entrySet()) {
      if (entry.getValue().getKind() != Kind.TEMPLATE) {
        continue;
      }
      TemplateRule rule = entry.getValue().template();
      Matcher placeholders = PLACEHOLDER.matcher(rule.template());
      while (placeholders.find()) {
        String name = placeholders.group(1);
        if (!rule.variables().containsKey(name)) {
          violations.add(
              violation(
                  INVALID_TEMPLATE,
                  entry.getKey(),
                  String.format(
                      "Template of field '%s' uses placeholder {%s} without a variable",
                      entry.getKey(), name)));
        }
      }
    }
  }

  private static void checkTransformations(
      MappingSpecification spec, List<MappingViolation> violations) {
    spec.transformations()
        .forEach(
            (field, id) -> {
              if (!TransformationProvider.isKnown(id)) {
                violations.add(
                    violation(
                        UNKNOWN_TRANSFORMATION,
                        field,
                        String.format(
                            "Field '%s' uses unknown transformation '%s', known: %s",
                            field, id, TransformationProvider.knownIds())));
              }
            });
  }

  private static void checkConstants(
      MappingSpecification spec, TargetSchema schema, List<MappingViolation> violations) {
    for (Entry<String, MappingRule> entry : spec.rules().entrySet()) {
      Optional<SchemaField> field = schema.field(entry.getKey());
      if (entry.getValue().getKind() != Kind.CONSTANT || field.isEmpty()) {
        continue;
      }
      String value = entry.getValue().constant().value();
      try {
        for (String id : spec.transformationsFor(entry.getKey())) {
          if (TransformationProvider.isKnown(id)) {
            value = TransformationProvider.getTransformationFromId(id).transform(value);
          }
        }
        ValueConverter.convert(value, field.get().type());
      } catch (TransformationException | ConversionException ex) {
        violations.add(
            violation(
                CONSTANT_TYPE_MISMATCH,
                entry.getKey(),
                String.format(
                    "Constant of field '%s' is not a valid %s value: %s",
                    entry.getKey(), field.get().type(), ex.getMessage())));
      }
    }
  }

  private static MappingViolation violation(ErrorCode errorCode, String field, String message) {
    return MappingViolation.builder()
        .setErrorCode(errorCode)
        .setTargetField(field)
        .setMessage(message)
        .build();
  }
}
