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

import java.util.Arrays;

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.echelon.common.math.ScalarField;

/**
 * <p>Gauss-Jordan elimination, reducing a matrix to reduced row echelon form and computing its determinant
 * along the way.</p>
 *
 * <p>The pivot for each step is the first nonzero entry found scanning down each column in turn, starting
 * at the current pivot position. No attempt is made to choose large pivots, so this is not numerically
 * stable for floating-point fields with badly conditioned input; with an exact field like
 * {@link net.echelon.common.math.FractionField} the results are exact.</p>
 */
public final class GaussJordanElimination {

  private static final Logger log = LoggerFactory.getLogger(GaussJordanElimination.class);

  private GaussJordanElimination() {
  }

  /**
   * @param matrix matrix to reduce; not modified
   * @return reduced row echelon form of {@code matrix}, its rank, and its determinant if square
   */
  public static <T> Reduction<T> reduce(Matrix<T> matrix) {
    ScalarField<T> field = matrix.getField();
    int rows = matrix.getRowDimension();
    int columns = matrix.getColumnDimension();
    Matrix<T> working = matrix.copy();

    int[] pivotColumns = new int[FastMath.min(rows, columns)];
    T determinant = field.one();
    int pivotRow = 0;
    int pivotColumn = 0;

    while (pivotRow < rows && pivotColumn < columns) {

      // Find the first nonzero entry at or right of the pivot column, at or below the pivot row
      int foundRow = -1;
      for (int column = pivotColumn; column < columns && foundRow < 0; column++) {
        for (int row = pivotRow; row < rows; row++) {
          if (!field.isZero(working.at(row, column))) {
            foundRow = row;
            pivotColumn = column;
            break;
          }
        }
      }
      if (foundRow < 0) {
        // Remaining rows are all zero
        break;
      }
      if (foundRow != pivotRow) {
        working.swapRows(foundRow, pivotRow);
        determinant = field.negate(determinant);
      }

      T factor = working.at(pivotRow, pivotColumn);
      for (int column = pivotColumn; column < columns; column++) {
        working.put(pivotRow, column, field.divide(working.at(pivotRow, column), factor));
      }
      determinant = field.multiply(determinant, factor);

      for (int row = 0; row < rows; row++) {
        if (row == pivotRow) {
          continue;
        }
        T rowFactor = working.at(row, pivotColumn);
        if (field.isZero(rowFactor)) {
          continue;
        }
        for (int column = pivotColumn; column < columns; column++) {
          T subtrahend = field.multiply(working.at(pivotRow, column), rowFactor);
          working.put(row, column, field.subtract(working.at(row, column), subtrahend));
        }
      }

      pivotColumns[pivotRow] = pivotColumn;
      pivotRow++;
      pivotColumn++;
    }

    int rank = pivotRow;
    T reportedDeterminant;
    if (rows == columns) {
      reportedDeterminant = hasUnitDiagonal(working) ? determinant : field.zero();
    } else {
      reportedDeterminant = null;
    }
    log.debug("Reduced {} x {} matrix to rank {}", rows, columns, rank);
    return new Reduction<T>(working, reportedDeterminant, Arrays.copyOf(pivotColumns, rank));
  }

  /**
   * @return reduced row echelon form of {@code matrix}, as a new matrix
   */
  public static <T> Matrix<T> reducedEchelonForm(Matrix<T> matrix) {
    return reduce(matrix).getReduced();
  }

  /**
   * @return determinant of {@code matrix}
   * @throws NotSquareException if {@code matrix} is not square
   */
  public static <T> T determinant(Matrix<T> matrix) throws NotSquareException {
    if (!matrix.isSquare()) {
      throw new NotSquareException(matrix.getRowDimension(), matrix.getColumnDimension());
    }
    return reduce(matrix).getDeterminant();
  }

  /**
   * @return rank of {@code matrix}
   */
  public static <T> int rank(Matrix<T> matrix) {
    return reduce(matrix).getRank();
  }

  /**
   * @return true iff every diagonal element of the square matrix is one, which for a reduced matrix means
   *  it is the identity
   */
  private static <T> boolean hasUnitDiagonal(Matrix<T> reduced) {
    ScalarField<T> field = reduced.getField();
    T one = field.one();
    for (int i = 0; i < reduced.getRowDimension(); i++) {
      if (!field.equal(reduced.at(i, i), one)) {
        return false;
      }
    }
    return true;
  }

}
