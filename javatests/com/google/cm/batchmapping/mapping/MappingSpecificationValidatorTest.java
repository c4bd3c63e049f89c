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
import static com.google.cm.batchmapping.ErrorCode.INVALID_MAPPING_SPECIFICATION;
import static com.google.cm.batchmapping.ErrorCode.INVALID_PATTERN;
import static com.google.cm.batchmapping.ErrorCode.INVALID_TEMPLATE;
import static com.google.cm.batchmapping.ErrorCode.MISSING_REQUIRED_FIELD;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TARGET_FIELD;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TRANSFORMATION;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.MappingViolation;
import com.google.cm.batchmapping.models.SchemaField;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MappingSpecificationValidatorTest {

  private static final ColumnSet COLUMNS =
      ColumnSet.create(ImmutableList.of("Address", "Postcode", "Notes"));

  private static final TargetSchema SCHEMA =
      TargetSchema.builder()
          .setTargetId("address_lookup")
          .addField(SchemaField.builder().setName("building_number").setRequired(true).build())
          .addField(SchemaField.builder().setName("street").setRequired(true).build())
          .addField(
              SchemaField.builder()
                  .setName("postcode")
                  .setRequired(true)
                  .setPattern("^[A-Z0-9 ]+$")
                  .build())
          .addField(SchemaField.builder().setName("full_address").build())
          .addField(SchemaField.builder().setName("notes").build())
          .addField(SchemaField.builder().setName("floor").setType(FieldType.NUMBER).build())
          .addField(
              SchemaField.builder().setName("ground_floor").setType(FieldType.BOOLEAN).build())
          .build();

  private final MappingSpecificationValidator validator = new MappingSpecificationValidator();

  @Test
  public void validate_validSpecification() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("building_number", MappingRule.ofRegexExtract("Address", "^(\\d+)\\s", "1"))
            .putRule(
                "street",
                MappingRule.ofRegexExtract("address", "^\\d+\\s+(?<street>.+)$", "street"))
            .putRule("postcode", MappingRule.ofDirect(" POSTCODE "))
            .putRule("floor", MappingRule.ofConstant(" 3 "))
            .putRule("ground_floor", MappingRule.ofConstant("Yes"))
            .setFreeTextField("full_address")
            .addTransformation("postcode", "uk_postcode")
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.violations()).isEmpty();
    assertThat(result.isValid()).isTrue();
    result.throwIfInvalid();
  }

  @Test
  public void validate_danglingColumn_namesFieldAndColumn() {
    TargetSchema schema =
        TargetSchema.builder()
            .setTargetId("postcode_only")
            .addField(SchemaField.builder().setName("postcode").setRequired(true).build())
            .build();
    MappingSpecification spec =
        MappingSpecification.builder().putRule("postcode", MappingRule.ofDirect("address")).build();

    ValidationResult result =
        validator.validate(spec, ColumnSet.create(ImmutableList.of("postcode")), schema);

    assertThat(result.violations()).hasSize(1);
    MappingViolation violation = result.violations().get(0);
    assertThat(violation.errorCode()).isEqualTo(DANGLING_COLUMN_REFERENCE);
    assertThat(violation.targetField()).hasValue("postcode");
    assertThat(violation.sourceColumn()).hasValue("address");
  }

  @Test
  public void validate_reportsEveryViolationInCheckOrder() {
    MappingSpecification spec = invalidSpecification();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(
            result.violations().stream()
                .map(MappingViolation::errorCode)
                .collect(toImmutableList()))
        .containsExactly(
            UNKNOWN_TARGET_FIELD,
            MISSING_REQUIRED_FIELD,
            DANGLING_COLUMN_REFERENCE,
            INVALID_PATTERN,
            INVALID_TEMPLATE,
            UNKNOWN_TRANSFORMATION,
            CONSTANT_TYPE_MISMATCH)
        .inOrder();
    assertThat(
            result.violations().stream()
                .map(violation -> violation.targetField().get())
                .collect(toImmutableList()))
        .containsExactly(
            "country",
            "street",
            "full_address",
            "building_number",
            "full_address",
            "postcode",
            "floor")
        .inOrder();
  }

  @Test
  public void validate_isDeterministic() {
    MappingSpecification spec = invalidSpecification();

    ValidationResult first = validator.validate(spec, COLUMNS, SCHEMA);
    ValidationResult second = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(second).isEqualTo(first);
  }

  @Test
  public void throwIfInvalid_carriesAllViolations() {
    ValidationResult result = validator.validate(invalidSpecification(), COLUMNS, SCHEMA);

    MappingSpecificationException ex =
        assertThrows(MappingSpecificationException.class, result::throwIfInvalid);

    assertThat(ex.getErrorCode()).isEqualTo(INVALID_MAPPING_SPECIFICATION);
    assertThat(ex.getViolations()).isEqualTo(result.violations());
    assertThat(ex).hasMessageThat().contains("7 violation(s)");
  }

  @Test
  public void validate_regexGroups() {
    MappingSpecification spec =
        requiredRules()
            .putRule("notes", MappingRule.ofRegexExtract("Notes", "(a)(b)?", "2"))
            .putRule("full_address", MappingRule.ofRegexExtract("Notes", "(a)", "3"))
            .putRule("floor", MappingRule.ofRegexExtract("Notes", "(?<level>\\d+)", "level"))
            .putRule("ground_floor", MappingRule.ofRegexExtract("Notes", "(?<g>y|n)", "other"))
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.errorCodes()).containsExactly(INVALID_PATTERN);
    assertThat(result.violations().stream().map(v -> v.targetField().get()))
        .containsExactly("full_address", "ground_floor")
        .inOrder();
  }

  @Test
  public void validate_namedGroupOnlyInsideClassOrQuote_isInvalidPattern() {
    MappingSpecification spec =
        requiredRules()
            .putRule("notes", MappingRule.ofRegexExtract("Notes", "[(?<n>]", "n"))
            .putRule("full_address", MappingRule.ofRegexExtract("Notes", "\\Q(?<n>x)", "n"))
            .putRule(
                "floor",
                MappingRule.ofRegexExtract("Notes", "(?x) (?<level>\\d+) # floor", "level"))
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.errorCodes()).containsExactly(INVALID_PATTERN);
    assertThat(result.violations().stream().map(v -> v.targetField().get()))
        .containsExactly("notes", "full_address")
        .inOrder();
  }

  @Test
  public void validate_freeTextFieldWithOwnRule() {
    MappingSpecification spec =
        requiredRules()
            .putRule("full_address", MappingRule.ofDirect("Notes"))
            .setFreeTextField("full_address")
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.errorCodes()).containsExactly(INVALID_FREE_TEXT_FIELD);
  }

  @Test
  public void validate_twoPassthroughFields() {
    MappingSpecification spec =
        requiredRules()
            .putRule("full_address", MappingRule.ofPassthroughUnmapped())
            .setFreeTextField("notes")
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.violations()).hasSize(1);
    assertThat(result.violations().get(0).errorCode()).isEqualTo(INVALID_FREE_TEXT_FIELD);
    assertThat(result.violations().get(0).targetField()).hasValue("notes");
  }

  @Test
  public void validate_passthroughForRequiredField() {
    MappingSpecification spec =
        requiredRules().putRule("street", MappingRule.ofPassthroughUnmapped()).build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.errorCodes()).containsExactly(MISSING_REQUIRED_FIELD);
  }

  @Test
  public void validate_constantsAfterTransformations() {
    MappingSpecification spec =
        requiredRules()
            .putRule("floor", MappingRule.ofConstant("three"))
            .putRule("ground_floor", MappingRule.ofConstant("maybe"))
            .putRule("notes", MappingRule.ofConstant("anything"))
            .build();

    ValidationResult result = validator.validate(spec, COLUMNS, SCHEMA);

    assertThat(result.errorCodes()).containsExactly(CONSTANT_TYPE_MISMATCH);
    assertThat(result.violations().stream().map(v -> v.targetField().get()))
        .containsExactly("floor", "ground_floor")
        .inOrder();
  }

  private static MappingSpecification.Builder requiredRules() {
    return MappingSpecification.builder()
        .putRule("building_number", MappingRule.ofRegexExtract("Address", "^(\\d+)", "1"))
        .putRule("street", MappingRule.ofDirect("Address"))
        .putRule("postcode", MappingRule.ofDirect("Postcode"));
  }

  private static MappingSpecification invalidSpecification() {
    return MappingSpecification.builder()
        .putRule("building_number", MappingRule.ofRegexExtract("Address", "^(\\d+", "1"))
        .putRule("postcode", MappingRule.ofDirect("Postcode"))
        .putRule("country", MappingRule.ofConstant("GB"))
        .putRule(
            "full_address",
            MappingRule.ofTemplate("{a} {b}", ImmutableMap.of("a", "Addr")))
        .putRule("floor", MappingRule.ofConstant("ground"))
        .addTransformation("postcode", "titlecase")
        .build();
  }
}
