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

package com.google.cm.batchmapping.readers;

import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.ErrorCode;

/** Thrown when an input file as a whole cannot be read. Fatal to the batch. */
public class StructuralException extends BatchMappingException {

  public StructuralException(String message, ErrorCode errorCode) {
    super(message, errorCode);
  }

  public StructuralException(String message, Throwable cause, ErrorCode errorCode) {
    super(message, cause, errorCode);
  }
}
