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

/**
 * <p>Supplies the arithmetic of a scalar type {@code T}: its identities, the four field operations, negation,
 * equality and the absolute-difference and sign tests used for tolerance comparison.</p>
 *
 * <p>Matrices hold a reference to their field rather than requiring {@code T} to implement an interface,
 * so that existing types like {@link Double} can serve as scalars. Implementations are stateless and
 * may be shared freely.</p>
 *
 * @param <T> scalar type
 */
public interface ScalarField<T> {

  /**
   * @return additive identity
   */
  T zero();

  /**
   * @return multiplicative identity
   */
  T one();

  T add(T a, T b);

  T subtract(T a, T b);

  T multiply(T a, T b);

  /**
   * @return a / b; behavior when {@code b} is zero is up to the implementation
   */
  T divide(T a, T b);

  T negate(T a);

  /**
   * @return true iff {@code a} and {@code b} are the same element of the field. This need not agree with
   *  {@link Object#equals(Object)}; for example {@code 0.0} and {@code -0.0} are equal here.
   */
  boolean equal(T a, T b);

  boolean isZero(T a);

  /**
   * @return |a - b|
   */
  T absoluteDifference(T a, T b);

  /**
   * @return -1, 0 or 1 as {@code a} is negative, zero or positive
   */
  int signum(T a);

  /**
   * @return hash of {@code a}, consistent with {@link #equal(Object, Object)}
   */
  int hash(T a);

  /**
   * @return tolerance to use when comparing values of this field approximately
   */
  T defaultDelta();

}
