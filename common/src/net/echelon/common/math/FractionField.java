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

import org.apache.commons.math3.fraction.Fraction;

/**
 * {@link ScalarField} of exact rationals, backed by Commons Math {@link Fraction}. Numerators and denominators
 * are {@code int}s; an operation whose result does not fit throws
 * {@link org.apache.commons.math3.exception.MathArithmeticException}.
 */
public final class FractionField implements ScalarField<Fraction> {

  public static final FractionField INSTANCE = new FractionField();

  private FractionField() {
  }

  @Override
  public Fraction zero() {
    return Fraction.ZERO;
  }

  @Override
  public Fraction one() {
    return Fraction.ONE;
  }

  @Override
  public Fraction add(Fraction a, Fraction b) {
    return a.add(b);
  }

  @Override
  public Fraction subtract(Fraction a, Fraction b) {
    return a.subtract(b);
  }

  @Override
  public Fraction multiply(Fraction a, Fraction b) {
    return a.multiply(b);
  }

  /**
   * @throws org.apache.commons.math3.exception.MathArithmeticException if {@code b} is zero
   */
  @Override
  public Fraction divide(Fraction a, Fraction b) {
    return a.divide(b);
  }

  @Override
  public Fraction negate(Fraction a) {
    return a.negate();
  }

  @Override
  public boolean equal(Fraction a, Fraction b) {
    return a.equals(b);
  }

  @Override
  public boolean isZero(Fraction a) {
    return a.getNumerator() == 0;
  }

  @Override
  public Fraction absoluteDifference(Fraction a, Fraction b) {
    return a.subtract(b).abs();
  }

  @Override
  public int signum(Fraction a) {
    // Fraction keeps the sign on the numerator
    return Integer.signum(a.getNumerator());
  }

  @Override
  public int hash(Fraction a) {
    return a.hashCode();
  }

  @Override
  public Fraction defaultDelta() {
    return Fraction.ZERO;
  }

  @Override
  public String toString() {
    return "FractionField";
  }

}
