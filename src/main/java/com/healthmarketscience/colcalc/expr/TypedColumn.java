/*
Copyright (c) 2026 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.colcalc.expr;

import java.time.LocalDateTime;

/**
 * A length-N sequence of values which all share one {@link Kind}.  A column
 * of length 1 is a scalar and broadcasts against longer columns.  Columns
 * are immutable once built.  Note that all the typed accessors will throw a
 * {@link TypeException} if the column's kind does not support them.
 *
 * @author James Ahlborn
 */
public interface TypedColumn
{
  /** the kinds of values supported within the expression evaluation engine */
  public enum Kind
  {
    FLOAT64, INT32, INT64, STRING, TIMESTAMP;

    public boolean isNumeric() {
      return inRange(FLOAT64, INT64);
    }

    public boolean isIntegral() {
      return inRange(INT32, INT64);
    }

    private boolean inRange(Kind start, Kind end) {
      return ((start.ordinal() <= ordinal()) && (ordinal() <= end.ordinal()));
    }
  }

  /**
   * @return the kind of every value in this column
   */
  public Kind getKind();

  /**
   * @return the number of values in this column (always at least 1)
   */
  public int size();

  /**
   * @return {@code true} if this column has exactly one value
   */
  public boolean isScalar();

  /**
   * @return {@code true} if this column holds one of the numeric kinds
   */
  public boolean isNumeric();

  /**
   * @return the boxed value at the given index
   */
  public Object get(int idx);

  /**
   * @return the value at the given index as a double (numeric kinds only)
   */
  public double getDouble(int idx);

  /**
   * @return the value at the given index (STRING only)
   */
  public String getString(int idx);

  /**
   * @return the value at the given index (TIMESTAMP only)
   */
  public LocalDateTime getTimestamp(int idx);

  /**
   * @return an independent copy of this column
   */
  public TypedColumn copy();
}
