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

import java.math.RoundingMode;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;

import net.echelon.common.math.ScalarField;

/**
 * <p>A dense, rectangular matrix of scalars of type {@code T}, whose arithmetic is supplied by a
 * {@link ScalarField}. Indices are zero-based.</p>
 *
 * <p>Every operation that transforms a matrix returns a newly allocated one and leaves its inputs
 * unchanged; {@link #set(int, int, Object)} is the only mutator. Elements are never {@code null}.
 * Instances are not thread-safe while being mutated.</p>
 *
 * <p>Shape mismatches and bad indices are programming errors and throw {@link IllegalArgumentException}
 * or {@link IndexOutOfBoundsException}. Mathematical failures like inverting a singular matrix are
 * reported with subclasses of {@link MatrixException}.</p>
 *
 * @param <T> scalar type
 */
public final class Matrix<T> {

  private static final int PRINT_COLUMN_WIDTH = 12;

  private final ScalarField<T> field;
  private final Object[][] data;
  private final int rows;
  private final int columns;

  /**
   * Takes ownership of {@code data}, which must be rectangular, non-empty and free of nulls.
   */
  private Matrix(ScalarField<T> field, Object[][] data) {
    this.field = field;
    this.data = data;
    this.rows = data.length;
    this.columns = data[0].length;
  }

  // Construction

  /**
   * @return a new {@code rows} x {@code columns} matrix of zeroes
   */
  public static <T> Matrix<T> zero(ScalarField<T> field, int rows, int columns) {
    Preconditions.checkNotNull(field);
    Preconditions.checkArgument(rows > 0 && columns > 0, "Bad dimensions: %s x %s", rows, columns);
    T zero = field.zero();
    Object[][] data = new Object[rows][columns];
    for (Object[] row : data) {
      for (int column = 0; column < columns; column++) {
        row[column] = zero;
      }
    }
    return new Matrix<T>(field, data);
  }

  /**
   * @return a new {@code size} x {@code size} matrix of zeroes
   */
  public static <T> Matrix<T> square(ScalarField<T> field, int size) {
    return zero(field, size, size);
  }

  /**
   * @return the {@code size} x {@code size} identity matrix
   */
  public static <T> Matrix<T> identity(ScalarField<T> field, int size) {
    Matrix<T> identity = square(field, size);
    T one = field.one();
    for (int i = 0; i < size; i++) {
      identity.data[i][i] = one;
    }
    return identity;
  }

  /**
   * @param field scalar arithmetic
   * @param rows rows of the matrix, which must all have the same, nonzero, length
   * @return a new matrix holding a copy of the values in {@code rows}
   * @throws IllegalArgumentException if {@code rows} is empty or ragged
   */
  public static <T> Matrix<T> fromNestedList(ScalarField<T> field, List<? extends List<? extends T>> rows) {
    Preconditions.checkNotNull(field);
    Preconditions.checkArgument(!rows.isEmpty(), "No rows");
    int columns = rows.get(0).size();
    Preconditions.checkArgument(columns > 0, "No columns");
    Object[][] data = new Object[rows.size()][columns];
    for (int row = 0; row < data.length; row++) {
      List<? extends T> values = rows.get(row);
      Preconditions.checkArgument(values.size() == columns,
                                  "Row %s has %s columns but row 0 has %s", row, values.size(), columns);
      for (int column = 0; column < columns; column++) {
        data[row][column] = Preconditions.checkNotNull(values.get(column));
      }
    }
    return new Matrix<T>(field, data);
  }

  /**
   * @param field scalar arithmetic
   * @param values matrix values listed row by row, left to right
   * @param rows number of rows
   * @param columns number of columns
   * @return a new matrix holding {@code values}
   * @throws IllegalArgumentException if {@code values} does not have {@code rows * columns} elements
   */
  public static <T> Matrix<T> fromFlatList(ScalarField<T> field, List<? extends T> values, int rows, int columns) {
    Preconditions.checkArgument(rows > 0 && columns > 0, "Bad dimensions: %s x %s", rows, columns);
    Preconditions.checkArgument(values.size() == (long) rows * columns,
                                "%s values can't fill a %s x %s matrix", values.size(), rows, columns);
    Matrix<T> matrix = zero(field, rows, columns);
    int index = 0;
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        matrix.data[row][column] = Preconditions.checkNotNull(values.get(index++));
      }
    }
    return matrix;
  }

  /**
   * Like {@link #fromFlatList(ScalarField, List, int, int)}, inferring a square shape.
   *
   * @throws IllegalArgumentException if the number of values is not a (positive) perfect square
   */
  public static <T> Matrix<T> squareFromFlatList(ScalarField<T> field, List<? extends T> values) {
    int count = values.size();
    Preconditions.checkArgument(count > 0, "No values");
    int size = IntMath.sqrt(count, RoundingMode.FLOOR);
    Preconditions.checkArgument(size * size == count, "%s is not a perfect square", count);
    return fromFlatList(field, values, size, size);
  }

  // Access

  public ScalarField<T> getField() {
    return field;
  }

  public int getRowDimension() {
    return rows;
  }

  public int getColumnDimension() {
    return columns;
  }

  public boolean isSquare() {
    return rows == columns;
  }

  /**
   * @throws IndexOutOfBoundsException if {@code row} or {@code column} is out of range
   */
  public T get(int row, int column) {
    Preconditions.checkElementIndex(row, rows, "row");
    Preconditions.checkElementIndex(column, columns, "column");
    return at(row, column);
  }

  /**
   * @throws IndexOutOfBoundsException if {@code row} or {@code column} is out of range
   */
  public void set(int row, int column, T value) {
    Preconditions.checkElementIndex(row, rows, "row");
    Preconditions.checkElementIndex(column, columns, "column");
    data[row][column] = Preconditions.checkNotNull(value);
  }

  /**
   * @return a read-only snapshot of one row
   */
  public List<T> getRow(int row) {
    Preconditions.checkElementIndex(row, rows, "row");
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (int column = 0; column < columns; column++) {
      builder.add(at(row, column));
    }
    return builder.build();
  }

  /**
   * @return a read-only snapshot of one column
   */
  public List<T> getColumn(int column) {
    Preconditions.checkElementIndex(column, columns, "column");
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (int row = 0; row < rows; row++) {
      builder.add(at(row, column));
    }
    return builder.build();
  }

  /**
   * @return a deep copy sharing no storage with this matrix
   */
  public Matrix<T> copy() {
    Object[][] copy = new Object[rows][];
    for (int row = 0; row < rows; row++) {
      copy[row] = data[row].clone();
    }
    return new Matrix<T>(field, copy);
  }

  @SuppressWarnings("unchecked")
  T at(int row, int column) {
    return (T) data[row][column];
  }

  void put(int row, int column, T value) {
    data[row][column] = value;
  }

  void swapRows(int a, int b) {
    Object[] temp = data[a];
    data[a] = data[b];
    data[b] = temp;
  }

  // Arithmetic

  /**
   * @return this + other
   * @throws IllegalArgumentException if the matrices differ in shape or field
   */
  public Matrix<T> add(Matrix<T> other) {
    checkSameShape(other);
    Matrix<T> result = zero(field, rows, columns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        result.data[row][column] = field.add(at(row, column), other.at(row, column));
      }
    }
    return result;
  }

  /**
   * @return this - other
   * @throws IllegalArgumentException if the matrices differ in shape or field
   */
  public Matrix<T> subtract(Matrix<T> other) {
    checkSameShape(other);
    Matrix<T> result = zero(field, rows, columns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        result.data[row][column] = field.subtract(at(row, column), other.at(row, column));
      }
    }
    return result;
  }

  /**
   * @return the matrix product this * other
   * @throws IllegalArgumentException if this matrix's column count differs from {@code other}'s row count
   */
  public Matrix<T> multiply(Matrix<T> other) {
    checkSameField(this, other);
    Preconditions.checkArgument(columns == other.rows,
                                "Can't multiply %s x %s by %s x %s", rows, columns, other.rows, other.columns);
    Matrix<T> result = zero(field, rows, other.columns);
    for (int row = 0; row < rows; row++) {
      Object[] thisRow = data[row];
      for (int column = 0; column < other.columns; column++) {
        T total = field.zero();
        for (int i = 0; i < columns; i++) {
          @SuppressWarnings("unchecked")
          T value = (T) thisRow[i];
          total = field.add(total, field.multiply(value, other.at(i, column)));
        }
        result.data[row][column] = total;
      }
    }
    return result;
  }

  /**
   * @return this matrix with every element multiplied by {@code scalar}
   */
  public Matrix<T> scale(T scalar) {
    Preconditions.checkNotNull(scalar);
    Matrix<T> result = zero(field, rows, columns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        result.data[row][column] = field.multiply(at(row, column), scalar);
      }
    }
    return result;
  }

  public Matrix<T> negate() {
    return scale(field.negate(field.one()));
  }

  public Matrix<T> transpose() {
    Matrix<T> result = zero(field, columns, rows);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        result.data[column][row] = data[row][column];
      }
    }
    return result;
  }

  /**
   * @throws IllegalArgumentException if the matrices use different scalar fields
   */
  static void checkSameField(Matrix<?> a, Matrix<?> b) {
    Preconditions.checkArgument(a.field.equals(b.field), "Field mismatch: %s vs %s", a.field, b.field);
  }

  private void checkSameShape(Matrix<T> other) {
    checkSameField(this, other);
    Preconditions.checkArgument(rows == other.rows && columns == other.columns,
                                "Size mismatch: %s x %s vs %s x %s", rows, columns, other.rows, other.columns);
  }

  // Elimination and solving; see GaussJordanElimination and LinearSystems

  /**
   * @see GaussJordanElimination#reducedEchelonForm(Matrix)
   */
  public Matrix<T> reducedEchelonForm() {
    return GaussJordanElimination.reducedEchelonForm(this);
  }

  /**
   * @see GaussJordanElimination#determinant(Matrix)
   */
  public T determinant() throws NotSquareException {
    return GaussJordanElimination.determinant(this);
  }

  /**
   * @see GaussJordanElimination#rank(Matrix)
   */
  public int rank() {
    return GaussJordanElimination.rank(this);
  }

  /**
   * @see LinearSystems#inverse(Matrix)
   */
  public Matrix<T> inverse() throws NotSquareException, NotInvertibleException {
    return LinearSystems.inverse(this);
  }

  /**
   * @see LinearSystems#solve(Matrix, List)
   */
  public List<T> solve(List<T> b) throws InconsistentSystemException {
    return LinearSystems.solve(this, b);
  }

  /**
   * @see LinearSystems#leastSquaresSolution(Matrix, List)
   */
  public List<T> leastSquaresSolution(List<T> b) throws InconsistentSystemException {
    return LinearSystems.leastSquaresSolution(this, b);
  }

  // Comparison

  /**
   * @param other matrix to compare to
   * @param delta largest allowed absolute difference between corresponding elements
   * @return true iff both matrices have the same shape and all corresponding elements are within {@code delta}
   */
  public boolean equals(Matrix<T> other, T delta) {
    if (rows != other.rows || columns != other.columns) {
      return false;
    }
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        T a = at(row, column);
        T b = other.at(row, column);
        if (field.equal(a, b)) {
          continue;
        }
        T difference = field.absoluteDifference(a, b);
        if (field.signum(field.subtract(difference, delta)) > 0) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return {@link #equals(Matrix, Object)} using the field's {@link ScalarField#defaultDelta()}
   */
  public boolean approximatelyEquals(Matrix<T> other) {
    return equals(other, field.defaultDelta());
  }

  /**
   * Exact element-wise equality, as {@link #equals(Matrix, Object)} with a delta of zero.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Matrix)) {
      return false;
    }
    @SuppressWarnings("unchecked")
    Matrix<T> other = (Matrix<T>) o;
    return field.equals(other.field) && equals(other, field.zero());
  }

  @Override
  public int hashCode() {
    int hash = 31 * rows + columns;
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        hash = 31 * hash + field.hash(at(row, column));
      }
    }
    return hash;
  }

  /**
   * @return a print-friendly rendering, one row per line. Not useful for wide matrices.
   */
  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        if (column > 0) {
          result.append('\t');
        }
        appendWithPadOrTruncate(String.valueOf(data[row][column]), result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  private static void appendWithPadOrTruncate(CharSequence value, StringBuilder to) {
    int length = value.length();
    if (length >= PRINT_COLUMN_WIDTH) {
      to.append(value, 0, PRINT_COLUMN_WIDTH);
    } else {
      for (int i = length; i < PRINT_COLUMN_WIDTH; i++) {
        to.append(' ');
      }
      to.append(value);
    }
  }

}
