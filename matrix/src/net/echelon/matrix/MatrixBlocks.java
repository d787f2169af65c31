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

import net.echelon.common.math.ScalarField;

/**
 * Operations that cut matrices apart and put them side by side, as when building augmented matrices.
 */
public final class MatrixBlocks {

  private MatrixBlocks() {
  }

  /**
   * Copies out a rectangular block of a matrix. Partitioning over the full row and column ranges yields
   * a copy of the matrix.
   *
   * @param matrix matrix to copy from
   * @param rowStart first row of the block
   * @param rowEnd row after the last row of the block
   * @param columnStart first column of the block
   * @param columnEnd column after the last column of the block
   * @return a new matrix holding the block, indexed from zero
   * @throws IndexOutOfBoundsException if the ranges fall outside {@code matrix}
   * @throws IllegalArgumentException if either range is empty
   */
  public static <T> Matrix<T> partition(Matrix<T> matrix, int rowStart, int rowEnd, int columnStart, int columnEnd) {
    Preconditions.checkPositionIndexes(rowStart, rowEnd, matrix.getRowDimension());
    Preconditions.checkPositionIndexes(columnStart, columnEnd, matrix.getColumnDimension());
    Preconditions.checkArgument(rowStart < rowEnd && columnStart < columnEnd,
                                "Empty block [%s,%s) x [%s,%s)", rowStart, rowEnd, columnStart, columnEnd);
    Matrix<T> block = Matrix.zero(matrix.getField(), rowEnd - rowStart, columnEnd - columnStart);
    for (int row = rowStart; row < rowEnd; row++) {
      for (int column = columnStart; column < columnEnd; column++) {
        block.put(row - rowStart, column - columnStart, matrix.at(row, column));
      }
    }
    return block;
  }

  /**
   * @param left matrix whose columns come first
   * @param right matrix whose columns follow those of {@code left}
   * @return a new matrix {@code [left | right]}
   * @throws IllegalArgumentException if the matrices have different numbers of rows, or different fields
   */
  public static <T> Matrix<T> combine(Matrix<T> left, Matrix<T> right) {
    Matrix.checkSameField(left, right);
    int rows = left.getRowDimension();
    Preconditions.checkArgument(rows == right.getRowDimension(),
                                "Row count mismatch: %s vs %s", rows, right.getRowDimension());
    int leftColumns = left.getColumnDimension();
    int rightColumns = right.getColumnDimension();
    Matrix<T> combined = Matrix.zero(left.getField(), rows, leftColumns + rightColumns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < leftColumns; column++) {
        combined.put(row, column, left.at(row, column));
      }
      for (int column = 0; column < rightColumns; column++) {
        combined.put(row, leftColumns + column, right.at(row, column));
      }
    }
    return combined;
  }

  /**
   * @return {@code values} as a single-column matrix
   */
  public static <T> Matrix<T> columnVector(ScalarField<T> field, List<? extends T> values) {
    return Matrix.fromFlatList(field, values, values.size(), 1);
  }

}
