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

/**
 * Outcome of {@link GaussJordanElimination#reduce(Matrix)}: the reduced row echelon form of a matrix,
 * and its determinant when it has one.
 *
 * @param <T> scalar type
 */
public final class Reduction<T> {

  private final Matrix<T> reduced;
  private final T determinant;
  private final int[] pivotColumns;

  Reduction(Matrix<T> reduced, T determinant, int[] pivotColumns) {
    this.reduced = reduced;
    this.determinant = determinant;
    this.pivotColumns = pivotColumns;
  }

  /**
   * @return the reduced row echelon form
   */
  public Matrix<T> getReduced() {
    return reduced;
  }

  /**
   * @return true iff the reduced matrix was square, so that {@link #getDeterminant()} succeeds
   */
  public boolean hasDeterminant() {
    return determinant != null;
  }

  /**
   * @return determinant of the original matrix; zero if it is singular
   * @throws NotSquareException if the original matrix is not square
   */
  public T getDeterminant() throws NotSquareException {
    if (determinant == null) {
      throw new NotSquareException(reduced.getRowDimension(), reduced.getColumnDimension());
    }
    return determinant;
  }

  /**
   * @return number of pivots, which is the rank of the matrix
   */
  public int getRank() {
    return pivotColumns.length;
  }

  /**
   * @return columns holding the pivot of each nonzero row, in row order
   */
  public int[] getPivotColumns() {
    return pivotColumns.clone();
  }

}
