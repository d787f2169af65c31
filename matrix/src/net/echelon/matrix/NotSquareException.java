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
 * Thrown when an operation defined only for square matrices, like a determinant or inverse, is requested
 * of a non-square matrix.
 */
public final class NotSquareException extends MatrixException {

  private final int rows;
  private final int columns;

  public NotSquareException(int rows, int columns) {
    super(rows + " x " + columns + " matrix is not square");
    this.rows = rows;
    this.columns = columns;
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }

}
