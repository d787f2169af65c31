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

import org.junit.Test;

import net.echelon.common.EchelonTest;

public final class DoubleFieldTest extends EchelonTest {

  private static final DoubleField FIELD = DoubleField.INSTANCE;

  @Test
  public void testIdentities() {
    assertEquals(0.0, FIELD.zero().doubleValue());
    assertEquals(1.0, FIELD.one().doubleValue());
    assertEquals(2.5, FIELD.add(2.5, FIELD.zero()).doubleValue());
    assertEquals(2.5, FIELD.multiply(2.5, FIELD.one()).doubleValue());
  }

  @Test
  public void testArithmetic() {
    assertEquals(1.5, FIELD.subtract(4.0, 2.5).doubleValue());
    assertEquals(-10.0, FIELD.multiply(4.0, -2.5).doubleValue());
    assertEquals(0.5, FIELD.divide(1.0, 2.0).doubleValue());
    assertEquals(-3.0, FIELD.negate(3.0).doubleValue());
  }

  @Test
  public void testSignedZero() {
    assertTrue(FIELD.isZero(-0.0));
    assertTrue(FIELD.equal(0.0, -0.0));
    assertEquals(FIELD.hash(0.0), FIELD.hash(-0.0));
  }

  @Test
  public void testAbsoluteDifference() {
    assertEquals(3.0, FIELD.absoluteDifference(-1.0, 2.0).doubleValue());
    assertEquals(3.0, FIELD.absoluteDifference(2.0, -1.0).doubleValue());
  }

  @Test
  public void testSignum() {
    assertEquals(1, FIELD.signum(0.1));
    assertEquals(-1, FIELD.signum(-7.0));
    assertEquals(0, FIELD.signum(0.0));
    assertEquals(1, FIELD.signum(Double.NaN));
  }

  @Test
  public void testNaNNotEqual() {
    assertFalse(FIELD.equal(Double.NaN, Double.NaN));
  }

  @Test
  public void testDefaultDelta() {
    assertEquals(DoubleField.DEFAULT_DELTA, FIELD.defaultDelta().doubleValue());
    assertTrue(FIELD.defaultDelta() >= 0.0);
  }

}
