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
 * Thrown when a square matrix is singular and so has no inverse.
 */
public final class NotInvertibleException extends MatrixException {

  private final int apparentRank;

  public NotInvertibleException(int apparentRank, String message) {
    super(message);
    this.apparentRank = apparentRank;
  }

  /**
   * @return number of pivots found when reducing the matrix; less than its dimension
   */
  public int getApparentRank() {
    return apparentRank;
  }

}
