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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.echelon.common.math.ScalarField;

/**
 * Inversion and linear system solving, all by reducing an augmented matrix with
 * {@link GaussJordanElimination}.
 */
public final class LinearSystems {

  private static final Logger log = LoggerFactory.getLogger(LinearSystems.class);

  private LinearSystems() {
  }

  /**
   * Inverts a matrix by reducing {@code [A | I]}; if the left block reduces to the identity, the right
   * block is the inverse. The comparison to the identity is exact.
   *
   * @param matrix square matrix A to invert
   * @return A<sup>-1</sup>
   * @throws NotSquareException if A is not square
   * @throws NotInvertibleException if A is singular
   */
  public static <T> Matrix<T> inverse(Matrix<T> matrix) throws NotSquareException, NotInvertibleException {
    if (!matrix.isSquare()) {
      throw new NotSquareException(matrix.getRowDimension(), matrix.getColumnDimension());
    }
    int size = matrix.getRowDimension();
    Matrix<T> identity = Matrix.identity(matrix.getField(), size);
    Matrix<T> reduced = GaussJordanElimination.reducedEchelonForm(MatrixBlocks.combine(matrix, identity));

    Matrix<T> left = MatrixBlocks.partition(reduced, 0, size, 0, size);
    if (!left.equals(identity)) {
      // Left block is the reduced form of A; its nonzero rows give the rank
      int apparentRank = countNonZeroRows(left);
      log.debug("{} x {} matrix is singular; apparent rank {}", size, size, apparentRank);
      throw new NotInvertibleException(apparentRank, "Matrix is singular; apparent rank: " + apparentRank);
    }
    return MatrixBlocks.partition(reduced, 0, size, size, 2 * size);
  }

  /**
   * Solves Ax = b. When the system has many solutions, free variables are set to zero.
   *
   * @param matrix coefficient matrix A
   * @param b right-hand side, one value per row of A
   * @return a solution x, one value per column of A
   * @throws IllegalArgumentException if {@code b} has the wrong length
   * @throws InconsistentSystemException if Ax = b has no solution
   */
  public static <T> List<T> solve(Matrix<T> matrix, List<T> b) throws InconsistentSystemException {
    Preconditions.checkArgument(b.size() == matrix.getRowDimension(),
                                "b has %s values but matrix has %s rows", b.size(), matrix.getRowDimension());
    Matrix<T> reduced = reduceAugmented(matrix, b);
    int inconsistentRow = findInconsistentRow(reduced);
    if (inconsistentRow >= 0) {
      throw new InconsistentSystemException(inconsistentRow,
                                            "System is inconsistent at row " + inconsistentRow + "; no solution");
    }
    return extractSolution(reduced);
  }

  /**
   * Finds x minimizing |Ax - b| by solving the normal equations A<sup>T</sup>Ax = A<sup>T</sup>b.
   *
   * @param matrix coefficient matrix A
   * @param b right-hand side, one value per row of A
   * @return least-squares solution x, one value per column of A
   * @throws IllegalArgumentException if {@code b} has the wrong length
   * @throws InconsistentSystemException if the normal equations reduce to an inconsistent system, which
   *  indicates an arithmetic problem like floating-point error rather than a missing solution
   */
  public static <T> List<T> leastSquaresSolution(Matrix<T> matrix, List<T> b) throws InconsistentSystemException {
    Preconditions.checkArgument(b.size() == matrix.getRowDimension(),
                                "b has %s values but matrix has %s rows", b.size(), matrix.getRowDimension());
    Matrix<T> transpose = matrix.transpose();
    Matrix<T> ATA = transpose.multiply(matrix);
    Matrix<T> ATb = transpose.multiply(MatrixBlocks.columnVector(matrix.getField(), b));
    Matrix<T> reduced = GaussJordanElimination.reducedEchelonForm(MatrixBlocks.combine(ATA, ATb));
    int inconsistentRow = findInconsistentRow(reduced);
    if (inconsistentRow >= 0) {
      log.warn("Normal equations for {} x {} matrix are inconsistent at row {}; probably floating-point error",
               matrix.getRowDimension(), matrix.getColumnDimension(), inconsistentRow);
      throw new InconsistentSystemException(inconsistentRow,
                                            "Normal equations are inconsistent at row " + inconsistentRow +
                                            "; this indicates an arithmetic problem like floating-point error");
    }
    return extractSolution(reduced);
  }

  /**
   * Reads a solution out of a consistent augmented system {@code [A | b]} in reduced row echelon form.
   * Walking the columns of A, a one in the current row marks a pivot, whose row's last value is that
   * component of the solution; any other column is free and its component is zero.
   *
   * @param reduced reduced, consistent augmented matrix
   * @return one value per column of A
   */
  public static <T> List<T> extractSolution(Matrix<T> reduced) {
    ScalarField<T> field = reduced.getField();
    int rows = reduced.getRowDimension();
    int lastColumn = reduced.getColumnDimension() - 1;
    T one = field.one();
    List<T> x = Lists.newArrayListWithCapacity(lastColumn);
    int row = 0;
    for (int column = 0; column < lastColumn; column++) {
      if (row < rows && field.equal(reduced.at(row, column), one)) {
        x.add(reduced.at(row, lastColumn));
        row++;
      } else {
        x.add(field.zero());
      }
    }
    return x;
  }

  private static <T> Matrix<T> reduceAugmented(Matrix<T> matrix, List<T> b) {
    Matrix<T> augmented = MatrixBlocks.combine(matrix, MatrixBlocks.columnVector(matrix.getField(), b));
    return GaussJordanElimination.reducedEchelonForm(augmented);
  }

  /**
   * @return index of the first row of the reduced augmented matrix reading 0 = c for nonzero c, or -1
   */
  private static <T> int findInconsistentRow(Matrix<T> reduced) {
    ScalarField<T> field = reduced.getField();
    int lastColumn = reduced.getColumnDimension() - 1;
    for (int row = 0; row < reduced.getRowDimension(); row++) {
      if (field.isZero(reduced.at(row, lastColumn))) {
        continue;
      }
      boolean hasCoefficient = false;
      for (int column = 0; column < lastColumn; column++) {
        if (!field.isZero(reduced.at(row, column))) {
          hasCoefficient = true;
          break;
        }
      }
      if (!hasCoefficient) {
        return row;
      }
    }
    return -1;
  }

  private static <T> int countNonZeroRows(Matrix<T> matrix) {
    ScalarField<T> field = matrix.getField();
    int count = 0;
    for (int row = 0; row < matrix.getRowDimension(); row++) {
      for (int column = 0; column < matrix.getColumnDimension(); column++) {
        if (!field.isZero(matrix.at(row, column))) {
          count++;
          break;
        }
      }
    }
    return count;
  }

}
