/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.echelon.common;

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, primitives and configuration.
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * Parses a {@code double} from a {@link String} as if by {@link Double#valueOf(String)}, but disallows special
   * values like {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} and {@link Double#NEGATIVE_INFINITY}.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Double#NaN}
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * Reads a non-negative, finite {@code double} from a system property.
   *
   * @param key system property name
   * @param defaultValue value used when the property is not set
   * @return parsed value of the property, or {@code defaultValue}
   * @throws IllegalArgumentException if the property value is negative, infinite or {@link Double#NaN}
   */
  public static double getNonNegativeDoubleProperty(String key, double defaultValue) {
    String value = System.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    double parsed = parseDouble(value);
    Preconditions.checkArgument(parsed >= 0.0, "%s must be non-negative: %s", key, parsed);
    return parsed;
  }

}
