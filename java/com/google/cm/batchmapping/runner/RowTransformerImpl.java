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

package com.google.cm.batchmapping.runner;

import static com.google.cm.batchmapping.Constants.CustomLogLevel.DETAIL;
import static com.google.cm.batchmapping.ErrorCode.INVALID_SCHEMA;
import static com.google.cm.batchmapping.ErrorCode.PATTERN_MISMATCH;
import static com.google.cm.batchmapping.ErrorCode.REQUIRED_FIELD_UNRESOLVED;
import static com.google.cm.batchmapping.ErrorCode.TRANSFORMATION_ERROR;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TRANSFORMATION;
import static com.google.cm.batchmapping.ErrorCode.VALUE_CONVERSION_ERROR;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.ErrorCode;
import com.google.cm.batchmapping.mapping.ConcatRule;
import com.google.cm.batchmapping.mapping.MappingRule;
import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.mapping.RegexExtractRule;
import com.google.cm.batchmapping.mapping.TemplateRule;
import com.google.cm.batchmapping.mapping.ValueConverter;
import com.google.cm.batchmapping.mapping.ValueConverter.ConversionException;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.cm.batchmapping.models.MappedRecord;
import com.google.cm.batchmapping.models.RowMappingError;
import com.google.cm.batchmapping.models.RowOutcome;
import com.google.cm.batchmapping.models.SchemaField;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.cm.batchmapping.transformations.Transformation;
import com.google.cm.batchmapping.transformations.Transformation.TransformationException;
import com.google.cm.batchmapping.transformations.TransformationProvider;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.inject.assistedinject.Assisted;
import com.google.inject.assistedinject.AssistedInject;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps data rows according to a validated {@link MappingSpecification}. Column names, patterns and
 * transformations are resolved once when the transformer is created; {@link #apply} keeps no state
 * between rows.
 */
public final class RowTransformerImpl implements RowTransformer {

  private static final Logger logger = LogManager.getLogger(RowTransformerImpl.class);
  private static final Level DETAIL_LEVEL = Level.forName(DETAIL.name(), DETAIL.value);
  private static final String PASSTHROUGH_SEPARATOR = "; ";

  private final TargetSchema schema;
  // Resolves the text of a field from a row, in specification order
  private final ImmutableMap<String, Function<DataRow, Optional<String>>> resolvers;
  private final ImmutableListMultimap<String, Transformation> transformations;
  private final ImmutableMap<String, Pattern> fieldPatterns;

  @AssistedInject
  public RowTransformerImpl(
      @Assisted MappingSpecification spec,
      @Assisted TargetSchema schema,
      @Assisted ColumnSet columns) {
    this.schema = schema;
    ImmutableMap<String, MappingRule> rules = spec.effectiveRules();
    ImmutableList<String> unreferencedColumns = getUnreferencedColumns(rules, columns);
    this.resolvers =
        rules.entrySet().stream()
            .collect(
                ImmutableMap.toImmutableMap(
                    Entry::getKey,
                    entry -> toResolver(entry.getValue(), columns, unreferencedColumns)));
    this.transformations = getTransformations(spec);
    this.fieldPatterns = getFieldPatterns(schema);
  }

  /** {@inheritDoc} */
  @Override
  public RowOutcome apply(DataRow row) {
    Map<String, String> resolved = new HashMap<>();
    for (Entry<String, Function<DataRow, Optional<String>>> entry : resolvers.entrySet()) {
      String field = entry.getKey();
      Optional<String> text = entry.getValue().apply(row);
      if (text.isEmpty()) {
        continue;
      }
      String value = text.get();
      try {
        for (Transformation transformation : transformations.get(field)) {
          value = transformation.transform(value);
        }
      } catch (TransformationException ex) {
        return fail(row, TRANSFORMATION_ERROR, field, ex.getMessage());
      }
      resolved.put(field, value);
    }

    var record = MappedRecord.builder().setRowNumber(row.rowNumber());
    for (SchemaField field : schema.fields()) {
      String text = resolved.get(field.name());
      if (text == null) {
        continue;
      }
      Optional<FieldValue> value;
      try {
        value = ValueConverter.convert(text, field.type());
      } catch (ConversionException ex) {
        return fail(row, VALUE_CONVERSION_ERROR, field.name(), ex.getMessage());
      }
      Pattern pattern = fieldPatterns.get(field.name());
      if (pattern != null && !text.isEmpty() && !pattern.matcher(text).matches()) {
        return fail(
            row,
            PATTERN_MISMATCH,
            field.name(),
            String.format("'%s' does not match pattern %s", text, pattern.pattern()));
      }
      value.ifPresent(fieldValue -> record.putValue(field.name(), fieldValue));
    }

    MappedRecord mapped = record.build();
    for (SchemaField field : schema.requiredFields()) {
      if (!mapped.values().containsKey(field.name())) {
        return fail(row, REQUIRED_FIELD_UNRESOLVED, field.name(), "required field unresolved");
      }
    }
    logger.log(DETAIL_LEVEL, "Mapped row {}: {}", row.rowNumber(), mapped.values().keySet());
    return RowOutcome.ofMapped(mapped);
  }

  private static RowOutcome fail(DataRow row, ErrorCode code, String field, String reason) {
    logger.info("Row {} failed on field {}: {}", row.rowNumber(), field, reason);
    return RowOutcome.ofFailed(RowMappingError.forField(row.rowNumber(), code, field, reason));
  }

  private static Function<DataRow, Optional<String>> toResolver(
      MappingRule rule, ColumnSet columns, ImmutableList<String> unreferencedColumns) {
    switch (rule.getKind()) {
      case DIRECT:
        String column = canonical(rule.direct().column(), columns);
        return row -> row.value(column);
      case REGEX_EXTRACT:
        return regexResolver(rule.regexExtract(), columns);
      case CONCAT:
        return concatResolver(rule.concat(), columns);
      case CONSTANT:
        Optional<String> constant = Optional.of(rule.constant().value());
        return row -> constant;
      case TEMPLATE:
        return templateResolver(rule.template(), columns);
      case PASSTHROUGH_UNMAPPED:
        return row -> Optional.of(joinNonEmpty(row, unreferencedColumns, PASSTHROUGH_SEPARATOR));
      default:
        throw new BatchMappingException("Unsupported mapping rule: " + rule.getKind());
    }
  }

  private static Function<DataRow, Optional<String>> regexResolver(
      RegexExtractRule rule, ColumnSet columns) {
    String column = canonical(rule.column(), columns);
    Pattern pattern = Pattern.compile(rule.pattern());
    boolean numbered = rule.isNumberedGroup();
    int groupIndex = numbered ? Integer.parseInt(rule.group()) : -1;
    String groupName = rule.group();
    return row ->
        row.value(column)
            .flatMap(
                value -> {
                  Matcher matcher = pattern.matcher(value);
                  if (!matcher.find()) {
                    return Optional.empty();
                  }
                  // A group that did not take part in the match is null
                  return Optional.ofNullable(
                      numbered ? matcher.group(groupIndex) : matcher.group(groupName));
                });
  }

  private static Function<DataRow, Optional<String>> concatResolver(
      ConcatRule rule, ColumnSet columns) {
    ImmutableList<String> sources =
        rule.columns().stream()
            .map(column -> canonical(column, columns))
            .collect(ImmutableList.toImmutableList());
    return row -> Optional.of(joinNonEmpty(row, sources, rule.separator()));
  }

  private static Function<DataRow, Optional<String>> templateResolver(
      TemplateRule rule, ColumnSet columns) {
    ImmutableMap<String, String> variables =
        rule.variables().entrySet().stream()
            .collect(
                ImmutableMap.toImmutableMap(
                    entry -> "{" + entry.getKey() + "}",
                    entry -> canonical(entry.getValue(), columns)));
    return row -> {
      String result = rule.template();
      for (Entry<String, String> variable : variables.entrySet()) {
        result = result.replace(variable.getKey(), row.value(variable.getValue()).orElse(""));
      }
      return Optional.of(result);
    };
  }

  private static String joinNonEmpty(DataRow row, ImmutableList<String> columns, String separator) {
    return columns.stream()
        .map(row::value)
        .flatMap(Optional::stream)
        .filter(value -> !value.isEmpty())
        .collect(Collectors.joining(separator));
  }

  /** Canonical name of a column referenced by the specification. */
  private static String canonical(String column, ColumnSet columns) {
    return columns.lookup(column).orElse(column);
  }

  private static ImmutableList<String> getUnreferencedColumns(
      ImmutableMap<String, MappingRule> rules, ColumnSet columns) {
    Set<String> referenced = new HashSet<>();
    rules.values().stream()
        .flatMap(rule -> rule.referencedColumns().stream())
        .forEach(column -> referenced.add(ColumnSet.toLookupKey(column)));
    return columns.names().stream()
        .filter(column -> !referenced.contains(ColumnSet.toLookupKey(column)))
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableListMultimap<String, Transformation> getTransformations(
      MappingSpecification spec) {
    var builder = ImmutableListMultimap.<String, Transformation>builder();
    spec.transformations()
        .forEach(
            (field, id) -> {
              try {
                builder.put(field, TransformationProvider.getTransformationFromId(id));
              } catch (TransformationException e) {
                String message = String.format("Invalid transformation %s for field %s", id, field);
                logger.error(message);
                throw new BatchMappingException(message, e, UNKNOWN_TRANSFORMATION);
              }
            });
    return builder.build();
  }

  private static ImmutableMap<String, Pattern> getFieldPatterns(TargetSchema schema) {
    var patterns = ImmutableMap.<String, Pattern>builder();
    for (SchemaField field : schema.fields()) {
      if (field.pattern().isEmpty()) {
        continue;
      }
      try {
        patterns.put(field.name(), Pattern.compile(field.pattern().get()));
      } catch (PatternSyntaxException e) {
        String message =
            String.format(
                "Schema %s has an invalid pattern for field %s", schema.targetId(), field.name());
        logger.error(message);
        throw new BatchMappingException(message, e, INVALID_SCHEMA);
      }
    }
    return patterns.build();
  }
}
