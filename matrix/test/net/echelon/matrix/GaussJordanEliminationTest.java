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

package net.echelon.matrix;

import org.apache.commons.math3.fraction.Fraction;
import org.junit.Test;

import net.echelon.common.EchelonTest;
import net.echelon.common.math.DoubleField;
import net.echelon.common.math.FractionField;

import static net.echelon.matrix.MatrixFixtures.doubles;
import static net.echelon.matrix.MatrixFixtures.fractions;

/**
 * Tests {@link GaussJordanElimination}.
 */
public final class GaussJordanEliminationTest extends EchelonTest {

  @Test
  public void testReducedEchelonForm() {
    Matrix<Fraction> augmented = fractions(new int[][] {
        { 1, 2, -1,  -4},
        { 2, 3, -1, -11},
        {-2, 0, -3,  22},
    });
    Matrix<Fraction> expected = fractions(new int[][] {
        {1, 0, 0, -8},
        {0, 1, 0,  1},
        {0, 0, 1, -2},
    });
    assertEquals(expected, augmented.reducedEchelonForm());
  }

  @Test
  public void testInputUnchanged() {
    Matrix<Fraction> matrix = fractions(new int[][] {{0, 2}, {3, 1}});
    Matrix<Fraction> before = matrix.copy();
    GaussJordanElimination.reduce(matrix);
    assertEquals(before, matrix);
  }

  @Test
  public void testRankDeficient() throws Exception {
    Matrix<Fraction> matrix = fractions(new int[][] {{1, 2, 3}, {2, 4, 6}, {1, 0, 1}});
    Reduction<Fraction> reduction = GaussJordanElimination.reduce(matrix);
    assertEquals(fractions(new int[][] {{1, 0, 1}, {0, 1, 1}, {0, 0, 0}}), reduction.getReduced());
    assertEquals(2, reduction.getRank());
    assertArrayEquals(new int[] {0, 1}, reduction.getPivotColumns());
    assertTrue(reduction.hasDeterminant());
    assertEquals(Fraction.ZERO, reduction.getDeterminant());
  }

  @Test
  public void testSkippedPivotColumn() {
    Matrix<Fraction> matrix = fractions(new int[][] {{1, 2, 1, 3}, {2, 4, 0, 2}});
    Reduction<Fraction> reduction = GaussJordanElimination.reduce(matrix);
    assertEquals(fractions(new int[][] {{1, 2, 0, 1}, {0, 0, 1, 2}}), reduction.getReduced());
    assertArrayEquals(new int[] {0, 2}, reduction.getPivotColumns());
    assertFalse(reduction.hasDeterminant());
  }

  @Test
  public void testZeroMatrix() throws Exception {
    Matrix<Double> zero = Matrix.square(DoubleField.INSTANCE, 3);
    Reduction<Double> reduction = GaussJordanElimination.reduce(zero);
    assertEquals(zero, reduction.getReduced());
    assertEquals(0, reduction.getRank());
    assertEquals(0.0, reduction.getDeterminant().doubleValue());
  }

  @Test
  public void testIdempotent() {
    Matrix<Double> matrix = MatrixFixtures.random(getRandom(), 4, 6);
    Matrix<Double> reduced = matrix.reducedEchelonForm();
    assertEquals(reduced, reduced.reducedEchelonForm());
    Matrix<Fraction> exact = fractions(new int[][] {{3, 1, 4}, {1, 5, 9}, {2, 6, 5}, {3, 5, 8}});
    Matrix<Fraction> exactReduced = exact.reducedEchelonForm();
    assertEquals(exactReduced, exactReduced.reducedEchelonForm());
  }

  @Test
  public void testDeterminant() throws Exception {
    assertEquals(4.0, doubles(new double[][] {{2.0, 0.0}, {0.0, 2.0}}).determinant().doubleValue());
    assertEquals(new Fraction(49), fractions(new int[][] {{2, -3, 1}, {2, 0, -1}, {1, 4, 5}}).determinant());
  }

  @Test
  public void testDeterminantWithRowSwaps() throws Exception {
    assertEquals(new Fraction(-5), fractions(new int[][] {{0, 2, 1}, {1, 1, 0}, {3, 0, 1}}).determinant());
  }

  @Test
  public void testDeterminantRowSwapAntisymmetry() throws Exception {
    Matrix<Fraction> matrix = fractions(new int[][] {{2, -3, 1}, {2, 0, -1}, {1, 4, 5}});
    Matrix<Fraction> swapped = fractions(new int[][] {{2, 0, -1}, {2, -3, 1}, {1, 4, 5}});
    assertEquals(matrix.determinant().negate(), swapped.determinant());
  }

  @Test
  public void testDeterminantRowScaling() throws Exception {
    Matrix<Fraction> matrix = fractions(new int[][] {{2, -3, 1}, {2, 0, -1}, {1, 4, 5}});
    Matrix<Fraction> scaled = fractions(new int[][] {{4, -6, 2}, {2, 0, -1}, {1, 4, 5}});
    assertEquals(matrix.determinant().multiply(2), scaled.determinant());
  }

  @Test
  public void testRandomDeterminantRowSwap() throws Exception {
    Matrix<Double> matrix = MatrixFixtures.randomInvertible(getRandom(), 5);
    Matrix<Double> swapped = matrix.copy();
    for (int column = 0; column < 5; column++) {
      swapped.set(1, column, matrix.get(3, column));
      swapped.set(3, column, matrix.get(1, column));
    }
    double determinant = matrix.determinant();
    assertEquals(-determinant, swapped.determinant(), 1.0e-9 * Math.abs(determinant));
  }

  @Test
  public void testSingularDeterminant() throws Exception {
    assertEquals(Fraction.ZERO, fractions(new int[][] {{1, 2}, {2, 4}}).determinant());
  }

  @Test(expected = NotSquareException.class)
  public void testNonSquareDeterminant() throws Exception {
    Matrix.zero(FractionField.INSTANCE, 2, 3).determinant();
  }

  @Test
  public void testNonSquareReduction() {
    Reduction<Fraction> reduction = GaussJordanElimination.reduce(Matrix.zero(FractionField.INSTANCE, 2, 3));
    assertFalse(reduction.hasDeterminant());
    try {
      reduction.getDeterminant();
      fail();
    } catch (NotSquareException nse) {
      assertEquals(2, nse.getRows());
      assertEquals(3, nse.getColumns());
    }
  }

  @Test
  public void testRank() {
    assertEquals(3, Matrix.identity(DoubleField.INSTANCE, 3).rank());
    assertEquals(1, fractions(new int[][] {{1, 2}, {2, 4}, {3, 6}}).rank());
    assertEquals(2, fractions(new int[][] {{1, 0, 1}, {1, 1, 1}, {1, 2, 1}}).rank());
  }

}
