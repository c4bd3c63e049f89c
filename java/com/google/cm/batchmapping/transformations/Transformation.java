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

package com.google.cm.batchmapping.transformations;

/** Interface representing a transformation of a resolved field value. */
public interface Transformation {

  /**
   * Returns the transformed value.
   *
   * @param value The resolved text of a mapped field.
   * @return The transformed text.
   */
  String transform(String value) throws TransformationException;

  /** Wrapper for exceptions thrown by a {@link Transformation} implementation. */
  class TransformationException extends Exception {

    /** Constructs a new instance. */
    public TransformationException(String message) {
      super(message);
    }
  }
}
