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

package net.echelon.common.math;

import org.apache.commons.math3.util.FastMath;

import net.echelon.common.LangUtils;

/**
 * {@link ScalarField} over {@code double} values, boxed as {@link Double}.
 */
public final class DoubleField implements ScalarField<Double> {

  public static final DoubleField INSTANCE = new DoubleField();

  /**
   * Tolerance used by {@link #defaultDelta()}, overridable with {@code -Dechelon.double.delta}.
   */
  static final double DEFAULT_DELTA = LangUtils.getNonNegativeDoubleProperty("echelon.double.delta", 1.0e-9);

  private static final Double ZERO = 0.0;
  private static final Double ONE = 1.0;

  private DoubleField() {
  }

  @Override
  public Double zero() {
    return ZERO;
  }

  @Override
  public Double one() {
    return ONE;
  }

  @Override
  public Double add(Double a, Double b) {
    return a + b;
  }

  @Override
  public Double subtract(Double a, Double b) {
    return a - b;
  }

  @Override
  public Double multiply(Double a, Double b) {
    return a * b;
  }

  @Override
  public Double divide(Double a, Double b) {
    return a / b;
  }

  @Override
  public Double negate(Double a) {
    return -a;
  }

  @Override
  public boolean equal(Double a, Double b) {
    return a.doubleValue() == b.doubleValue();
  }

  @Override
  public boolean isZero(Double a) {
    return a == 0.0;
  }

  @Override
  public Double absoluteDifference(Double a, Double b) {
    return FastMath.abs(a - b);
  }

  /**
   * @return as {@link FastMath#signum(double)}, except that {@link Double#NaN} counts as positive,
   *  so a NaN difference never falls within a tolerance
   */
  @Override
  public int signum(Double a) {
    double d = a;
    if (Double.isNaN(d)) {
      return 1;
    }
    return (int) FastMath.signum(d);
  }

  @Override
  public int hash(Double a) {
    double d = a;
    // 0.0 and -0.0 are equal here
    return d == 0.0 ? 0 : Double.hashCode(d);
  }

  @Override
  public Double defaultDelta() {
    return DEFAULT_DELTA;
  }

  @Override
  public String toString() {
    return "DoubleField";
  }

}
