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

import static com.google.cm.batchmapping.ErrorCode.PATTERN_MISMATCH;
import static com.google.cm.batchmapping.ErrorCode.REQUIRED_FIELD_UNRESOLVED;
import static com.google.cm.batchmapping.ErrorCode.TRANSFORMATION_ERROR;
import static com.google.cm.batchmapping.ErrorCode.UNKNOWN_TRANSFORMATION;
import static com.google.cm.batchmapping.ErrorCode.VALUE_CONVERSION_ERROR;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.mapping.MappingRule;
import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.models.ColumnSet;
import com.google.cm.batchmapping.models.DataRow;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.cm.batchmapping.models.MappedRecord;
import com.google.cm.batchmapping.models.RowMappingError;
import com.google.cm.batchmapping.models.RowOutcome;
import com.google.cm.batchmapping.models.SchemaField;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RowTransformerImplTest {

  private static final ColumnSet COLUMNS =
      ColumnSet.create(ImmutableList.of("Address", "Postcode", "Notes", "Floor"));

  private static final TargetSchema ADDRESS_SCHEMA =
      TargetSchema.builder()
          .setTargetId("broadband_availability")
          .addField(SchemaField.builder().setName("building_number").setRequired(true).build())
          .addField(SchemaField.builder().setName("street").setRequired(true).build())
          .addField(
              SchemaField.builder()
                  .setName("postcode")
                  .setRequired(true)
                  .setPattern("^[A-Z]{1,2}[0-9][A-Z0-9]? [0-9][A-Z]{2}$")
                  .build())
          .addField(SchemaField.builder().setName("full_address").build())
          .build();

  private static final TargetSchema OPTIONAL_SCHEMA =
      TargetSchema.builder()
          .setTargetId("optional_fields")
          .addField(SchemaField.builder().setName("line").build())
          .addField(SchemaField.builder().setName("floor").setType(FieldType.NUMBER).build())
          .addField(SchemaField.builder().setName("listed").setType(FieldType.BOOLEAN).build())
          .addField(SchemaField.builder().setName("rest").build())
          .build();

  private static final MappingSpecification ADDRESS_SPEC =
      MappingSpecification.builder()
          .putRule(
              "building_number",
              MappingRule.ofRegexExtract("address", "^(\\d+[A-Za-z]?)\\s+", "1"))
          .putRule(
              "street",
              MappingRule.ofRegexExtract("Address", "^\\d+[A-Za-z]?\\s+(?<street>.+)$", "street"))
          .putRule("postcode", MappingRule.ofDirect("POSTCODE"))
          .addTransformation("postcode", "uk_postcode")
          .setFreeTextField("full_address")
          .build();

  @Test
  public void apply_mapsAddressRow() {
    RowTransformer transformer = new RowTransformerImpl(ADDRESS_SPEC, ADDRESS_SCHEMA, COLUMNS);

    RowOutcome outcome =
        transformer.apply(
            row(1, "13 Example Street", "dn121rh", "Side door, ring twice", "2"));

    assertThat(outcome.isMapped()).isTrue();
    assertThat(outcome.mapped())
        .isEqualTo(
            MappedRecord.builder()
                .setRowNumber(1)
                .putValue("building_number", FieldValue.ofString("13"))
                .putValue("street", FieldValue.ofString("Example Street"))
                .putValue("postcode", FieldValue.ofString("DN12 1RH"))
                .putValue("full_address", FieldValue.ofString("Side door, ring twice; 2"))
                .build());
  }

  @Test
  public void apply_regexWithoutMatch_requiredFieldUnresolved() {
    RowTransformer transformer = new RowTransformerImpl(ADDRESS_SPEC, ADDRESS_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(2, "Flat B", "SW1A 1AA", "", ""));

    assertThat(outcome.isMapped()).isFalse();
    assertThat(outcome.failed())
        .isEqualTo(
            RowMappingError.forField(
                2, REQUIRED_FIELD_UNRESOLVED, "building_number", "required field unresolved"));
  }

  @Test
  public void apply_concat_skipsEmptyValues() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("line", MappingRule.ofConcat(ImmutableList.of("Address", "Postcode"), ", "))
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome withPostcode = transformer.apply(row(1, "1 Church View", "DN12 1RH", "", ""));
    RowOutcome withoutPostcode = transformer.apply(row(2, "1 Church View", "", "", ""));

    assertThat(withPostcode.mapped().value("line"))
        .hasValue(FieldValue.ofString("1 Church View, DN12 1RH"));
    assertThat(withoutPostcode.mapped().value("line"))
        .hasValue(FieldValue.ofString("1 Church View"));
  }

  @Test
  public void apply_emptyAndAbsentValues() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("line", MappingRule.ofDirect("Notes"))
            .putRule("floor", MappingRule.ofDirect("Floor"))
            .putRule("listed", MappingRule.ofDirect("Listed"))
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(1, "1 Church View", "", "", " "));

    // Empty text stays an empty string, blank numbers and missing columns are absent
    assertThat(outcome.mapped().values())
        .containsExactly("line", FieldValue.ofString(""));
  }

  @Test
  public void apply_convertsTypes() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("floor", MappingRule.ofDirect("Floor"))
            .putRule("listed", MappingRule.ofConstant("yes"))
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(1, "", "", "", "3"));

    assertThat(outcome.mapped().value("floor")).hasValue(FieldValue.ofNumber(new BigDecimal("3")));
    assertThat(outcome.mapped().value("listed")).hasValue(FieldValue.ofBool(true));
  }

  @Test
  public void apply_unconvertibleValue_fails() {
    MappingSpecification spec =
        MappingSpecification.builder().putRule("floor", MappingRule.ofDirect("Floor")).build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(4, "", "", "", "ground"));

    assertThat(outcome.failed().errorCode()).isEqualTo(VALUE_CONVERSION_ERROR);
    assertThat(outcome.failed().field()).hasValue("floor");
    assertThat(outcome.failed().rowNumber()).isEqualTo(4);
  }

  @Test
  public void apply_templateAndConstant() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule(
                "line",
                MappingRule.ofTemplate(
                    "{address} ({postcode})",
                    ImmutableMap.of("address", "Address", "postcode", "Postcode")))
            .putRule("rest", MappingRule.ofConstant("imported"))
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(1, "1 Church View", "DN12 1RH", "", ""));
    RowOutcome partial = transformer.apply(DataRow.create(2, ImmutableMap.of()));

    assertThat(outcome.mapped().value("line"))
        .hasValue(FieldValue.ofString("1 Church View (DN12 1RH)"));
    assertThat(outcome.mapped().value("rest")).hasValue(FieldValue.ofString("imported"));
    assertThat(partial.mapped().value("line")).hasValue(FieldValue.ofString(" ()"));
  }

  @Test
  public void apply_passthroughCollectsUnreferencedColumns() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("line", MappingRule.ofDirect("address"))
            .putRule("rest", MappingRule.ofPassthroughUnmapped())
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(1, "1 Church View", "DN12 1RH", "", "2"));

    assertThat(outcome.mapped().value("rest")).hasValue(FieldValue.ofString("DN12 1RH; 2"));
  }

  @Test
  public void apply_patternMismatch_fails() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("building_number", MappingRule.ofConstant("1"))
            .putRule("street", MappingRule.ofDirect("Address"))
            .putRule("postcode", MappingRule.ofDirect("Postcode"))
            .build();
    RowTransformer transformer = new RowTransformerImpl(spec, ADDRESS_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(7, "Church View", "dn121rh", "", ""));

    assertThat(outcome.failed().errorCode()).isEqualTo(PATTERN_MISMATCH);
    assertThat(outcome.failed().field()).hasValue("postcode");
  }

  @Test
  public void apply_transformationError_fails() {
    RowTransformer transformer = new RowTransformerImpl(ADDRESS_SPEC, ADDRESS_SCHEMA, COLUMNS);

    RowOutcome outcome = transformer.apply(row(3, "13 Example Street", "DN12-1RH", "", ""));

    assertThat(outcome.failed().errorCode()).isEqualTo(TRANSFORMATION_ERROR);
    assertThat(outcome.failed().field()).hasValue("postcode");
  }

  @Test
  public void apply_sameRowTwice_sameOutcome() {
    RowTransformer transformer = new RowTransformerImpl(ADDRESS_SPEC, ADDRESS_SCHEMA, COLUMNS);
    DataRow row = row(1, "13 Example Street", "dn121rh", "", "");

    assertThat(transformer.apply(row)).isEqualTo(transformer.apply(row));
  }

  @Test
  public void create_unknownTransformation_throws() {
    MappingSpecification spec =
        MappingSpecification.builder()
            .putRule("line", MappingRule.ofDirect("Address"))
            .addTransformation("line", "titlecase")
            .build();

    BatchMappingException ex =
        assertThrows(
            BatchMappingException.class,
            () -> new RowTransformerImpl(spec, OPTIONAL_SCHEMA, COLUMNS));

    assertThat(ex.getErrorCode()).isEqualTo(UNKNOWN_TRANSFORMATION);
  }

  private static DataRow row(
      long rowNumber, String address, String postcode, String notes, String floor) {
    return DataRow.create(
        rowNumber,
        ImmutableMap.of("Address", address, "Postcode", postcode, "Notes", notes, "Floor", floor));
  }
}
