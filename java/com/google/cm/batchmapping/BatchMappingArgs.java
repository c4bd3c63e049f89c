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

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import java.nio.file.Path;
import java.util.Optional;

/** CLI parameter definitions, with fields that should be loaded using JCommander. */
public final class BatchMappingArgs {
  ///////////////////////////////
  // Input Arguments
  ///////////////////////////////

  @Parameter(names = "--input", description = "Path to the input CSV file.", required = true)
  private String input = "";

  @Parameter(
      names = "--mapping",
      description = "Path to the mapping specification JSON. Required unless --profile_only.")
  private String mapping = null;

  @Parameter(
      names = "--target",
      description = "Id of the target schema. Required unless --profile_only.")
  private String target = null;

  @Parameter(
      names = "--schema_dir",
      description =
          "Directory holding <target>.json schema documents. Schemas bundled with the application"
              + " are used if not set.")
  private String schemaDirectory = null;

  @Parameter(names = "--delimiter", description = "Cell delimiter of the input file. Defaults to ,")
  private String delimiter = String.valueOf(Constants.DEFAULT_DELIMITER);

  @Parameter(
      names = "--pad_ragged_rows",
      description = "Pad short rows with empty cells instead of failing them.")
  private boolean padRaggedRows = false;

  ///////////////////////////////
  // Output Arguments
  ///////////////////////////////

  @Parameter(
      names = "--output_csv",
      description = "Path to write every row outcome as CSV, with metadata columns. Optional.")
  private String outputCsv = null;

  @Parameter(
      names = "--output_records",
      description =
          "Path to write mapped records as JSON lines, or the profile with --profile_only."
              + " Optional.")
  private String outputRecords = null;

  @Parameter(
      names = "--profile_only",
      description = "Only report the structure of the input file, without mapping it.")
  private boolean profileOnly = false;

  @Parameter(
      names = "--sample_rows",
      description = "Number of sample rows in a structure profile. Defaults to 5.")
  private int sampleRows = Constants.DEFAULT_SAMPLE_ROWS;

  ///////////////////////////////
  // Logging Arguments
  ///////////////////////////////

  @Parameter(
      names = "--logging_level",
      description = "Root logging level: TRACE, DEBUG, DETAIL, INFO, WARN or ERROR. Optional.")
  private String loggingLevel = null;

  public Path getInput() {
    return Path.of(input);
  }

  public Optional<Path> getMapping() {
    return Optional.ofNullable(mapping).map(Path::of);
  }

  public Optional<String> getTarget() {
    return Optional.ofNullable(target);
  }

  public Optional<Path> getSchemaDirectory() {
    return Optional.ofNullable(schemaDirectory).map(Path::of);
  }

  /** Delimiter as a single character. */
  public char getDelimiter() {
    if (delimiter.equals("\\t")) {
      return '\t';
    }
    if (delimiter.length() != 1) {
      throw new ParameterException("--delimiter must be a single character: " + delimiter);
    }
    return delimiter.charAt(0);
  }

  public boolean getPadRaggedRows() {
    return padRaggedRows;
  }

  public Optional<Path> getOutputCsv() {
    return Optional.ofNullable(outputCsv).map(Path::of);
  }

  public Optional<Path> getOutputRecords() {
    return Optional.ofNullable(outputRecords).map(Path::of);
  }

  public boolean getProfileOnly() {
    return profileOnly;
  }

  public int getSampleRows() {
    return sampleRows;
  }

  public Optional<String> getLoggingLevel() {
    return Optional.ofNullable(loggingLevel);
  }
}
