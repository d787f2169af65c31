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
 * Thrown when a linear system Ax = b has no solution: reducing {@code [A | b]} produced a row reading
 * {@code 0 = c} for some nonzero {@code c}.
 */
public final class InconsistentSystemException extends MatrixException {

  private final int row;

  public InconsistentSystemException(int row, String message) {
    super(message);
    this.row = row;
  }

  /**
   * @return index of the first contradictory row in the reduced augmented matrix
   */
  public int getRow() {
    return row;
  }

}
