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

import com.google.common.base.CharMatcher;
import java.util.Locale;

/**
 * Transformation to bring a UK postcode into its standard written form: uppercase, with a single
 * space before the inward code (the last three characters), e.g. {@code dn121rh -> DN12 1RH}.
 * Values shorter than five characters are only uppercased.
 */
public class UkPostcodeTransformation implements Transformation {

  private static final int INWARD_CODE_LENGTH = 3;
  private static final CharMatcher ALPHANUMERIC =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('0', '9'));

  /*
   * Normalizes the postcode. Fails if anything other than letters, digits and whitespace remains.
   */
  @Override
  public String transform(String value) throws TransformationException {
    String compact = CharMatcher.whitespace().removeFrom(value).toUpperCase(Locale.US);
    if (!ALPHANUMERIC.matchesAllOf(compact)) {
      throw new TransformationException("Postcode contains characters other than letters/digits");
    }
    if (compact.length() < INWARD_CODE_LENGTH + 2) {
      return compact;
    }
    int split = compact.length() - INWARD_CODE_LENGTH;
    return compact.substring(0, split) + " " + compact.substring(split);
  }
}
