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

package com.google.cm.batchmapping;

import static com.google.cm.batchmapping.ErrorCode.EMPTY_INPUT_FILE;
import static com.google.cm.batchmapping.ErrorCode.RAGGED_ROW;
import static com.google.cm.batchmapping.ErrorCode.REQUIRED_FIELD_UNRESOLVED;
import static com.google.cm.batchmapping.ErrorCode.SCHEMA_NOT_FOUND;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.beust.jcommander.JCommander;
import com.google.cm.batchmapping.mapping.MappingSpecification;
import com.google.cm.batchmapping.mapping.MappingSpecificationParser;
import com.google.cm.batchmapping.models.BatchResult;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.FieldValue;
import com.google.cm.batchmapping.models.MappedRecord;
import com.google.cm.batchmapping.models.StructureProfile;
import com.google.cm.batchmapping.readers.StructuralException;
import com.google.cm.batchmapping.schema.SchemaNotFoundException;
import com.google.common.io.ByteSource;
import com.google.common.io.Resources;
import com.google.inject.Guice;
import java.net.URL;
import java.util.Objects;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BatchMappingJobTest {

  private static final String TARGET_ID = "broadband_availability_bt_wholesale_v1";

  private BatchMappingJob job;
  private MappingSpecification spec;

  @Before
  public void setUp() throws Exception {
    BatchMappingArgs args = new BatchMappingArgs();
    JCommander.newBuilder().addObject(args).build().parse("--input", "addresses.csv");
    job = Guice.createInjector(new BatchMappingModule(args)).getInstance(BatchMappingJob.class);
    spec =
        MappingSpecificationParser.parse(
            Resources.toString(getTestData("broadband_mapping.json"), UTF_8));
  }

  @Test
  public void process_mapsFileAgainstBundledSchema() throws Exception {
    BatchResult result = job.process(getTestDataSource(), "addresses.csv", spec, TARGET_ID);

    assertThat(result.outcomes()).hasSize(4);
    assertThat(result.mappedRecords())
        .containsExactly(
            MappedRecord.builder()
                .setRowNumber(1)
                .putValue("building_number", FieldValue.ofString("13"))
                .putValue("street", FieldValue.ofString("Example Street"))
                .putValue("postcode", FieldValue.ofString("DN12 1RH"))
                .putValue("full_address", FieldValue.ofString("Side door"))
                .build(),
            MappedRecord.builder()
                .setRowNumber(2)
                .putValue("building_number", FieldValue.ofString("1"))
                .putValue("street", FieldValue.ofString("Church View"))
                .putValue("postcode", FieldValue.ofString("DN12 1RH"))
                .putValue("full_address", FieldValue.ofString(""))
                .build())
        .inOrder();
    assertThat(result.failures()).hasSize(2);
    assertThat(result.failures().get(0).rowNumber()).isEqualTo(3);
    assertThat(result.failures().get(0).errorCode()).isEqualTo(REQUIRED_FIELD_UNRESOLVED);
    assertThat(result.failures().get(1).rowNumber()).isEqualTo(4);
    assertThat(result.failures().get(1).errorCode()).isEqualTo(RAGGED_ROW);
    assertThat(result.summary().successRate()).isEqualTo("50.0%");
  }

  @Test
  public void process_unknownTarget_throwsSchemaNotFound() throws Exception {
    SchemaNotFoundException ex =
        assertThrows(
            SchemaNotFoundException.class,
            () -> job.process(getTestDataSource(), "addresses.csv", spec, "unknown_target"));

    assertThat(ex.getErrorCode()).isEqualTo(SCHEMA_NOT_FOUND);
  }

  @Test
  public void process_emptyFile_throwsStructuralException() {
    StructuralException ex =
        assertThrows(
            StructuralException.class,
            () -> job.process(ByteSource.empty(), "empty.csv", spec, TARGET_ID));

    assertThat(ex.getErrorCode()).isEqualTo(EMPTY_INPUT_FILE);
  }

  @Test
  public void profile_reportsStructure() throws Exception {
    StructureProfile profile = job.profile(getTestDataSource(), "addresses.csv", 2);

    assertThat(profile.columns().names()).containsExactly("Address", "Postcode", "Notes");
    assertThat(profile.rowCount()).isEqualTo(4);
    assertThat(profile.failedRowCount()).isEqualTo(1);
    assertThat(profile.sampleRows()).hasSize(2);
    assertThat(profile.columnTypes()).containsEntry("Address", FieldType.STRING);
  }

  private ByteSource getTestDataSource() {
    return Resources.asByteSource(getTestData("addresses.csv"));
  }

  private URL getTestData(String name) {
    return Objects.requireNonNull(getClass().getResource("testdata/" + name));
  }
}
