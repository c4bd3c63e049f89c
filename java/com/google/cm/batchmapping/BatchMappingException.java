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

/** Base exception for batch mapping failures. Carries an {@link ErrorCode}. */
public class BatchMappingException extends RuntimeException {

  private final ErrorCode errorCode;

  public BatchMappingException(String message) {
    super(message);
    errorCode = ErrorCode.ERROR_CODE_UNKNOWN;
  }

  public BatchMappingException(String message, Throwable cause) {
    this(message, cause, ErrorCode.ERROR_CODE_UNKNOWN);
  }

  public BatchMappingException(String message, ErrorCode errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public BatchMappingException(String message, Throwable cause, ErrorCode errorCode) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /** Whether the failure is confined to a single row. */
  public boolean isRowLevel() {
    return errorCode.isRowLevel();
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
