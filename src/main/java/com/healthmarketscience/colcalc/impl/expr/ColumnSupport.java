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

package com.healthmarketscience.colcalc.impl.expr;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;

/**
 *
 * @author James Ahlborn
 */
public class ColumnSupport
{
  /** the result of the functions which are evaluated for side effects */
  public static final TypedColumn SENTINEL_COL = new DoubleColumn(0d);
  public static final TypedColumn ZERO_COL = SENTINEL_COL;
  public static final TypedColumn ONE_COL = new DoubleColumn(1d);

  static final Pattern NUMBER_PAT =
    Pattern.compile("[+-]?(([0-9]+[.]?[0-9]*)|([.][0-9]+))([eE][+-]?[0-9]+)?");

  private ColumnSupport() {}

  public static TypedColumn toColumn(double d) {
    return new DoubleColumn(d);
  }

  public static TypedColumn toColumn(boolean b) {
    return (b ? ONE_COL : ZERO_COL);
  }

  public static TypedColumn toColumn(String s) {
    return new StringColumn(s);
  }

  public static TypedColumn toColumn(LocalDateTime ldt) {
    return new TimestampColumn(ldt);
  }

  /**
   * @return a column of the given kind holding the given boxed values
   */
  public static TypedColumn toColumn(Kind kind, Object[] vals) {
    switch(kind) {
    case FLOAT64:
      double[] dvals = new double[vals.length];
      for(int i = 0; i < vals.length; ++i) {
        dvals[i] = ((Number)vals[i]).doubleValue();
      }
      return new DoubleColumn(dvals);
    case INT32:
      int[] ivals = new int[vals.length];
      for(int i = 0; i < vals.length; ++i) {
        ivals[i] = ((Number)vals[i]).intValue();
      }
      return new IntColumn(ivals);
    case INT64:
      long[] lvals = new long[vals.length];
      for(int i = 0; i < vals.length; ++i) {
        lvals[i] = ((Number)vals[i]).longValue();
      }
      return new LongColumn(lvals);
    case STRING:
      String[] svals = new String[vals.length];
      for(int i = 0; i < vals.length; ++i) {
        svals[i] = (String)vals[i];
      }
      return new StringColumn(svals);
    case TIMESTAMP:
      LocalDateTime[] tvals = new LocalDateTime[vals.length];
      for(int i = 0; i < vals.length; ++i) {
        tvals[i] = (LocalDateTime)vals[i];
      }
      return new TimestampColumn(tvals);
    default:
      throw new IllegalStateException("unknown kind " + kind);
    }
  }

  /**
   * @return the values of the given column as doubles (numeric kinds only)
   */
  public static double[] toDoubles(TypedColumn col) {
    double[] vals = new double[col.size()];
    for(int i = 0; i < vals.length; ++i) {
      vals[i] = col.getDouble(i);
    }
    return vals;
  }

  /**
   * @return a column whose value at row {@code i} is the value of the given
   *         column at {@code idxs[i]}
   * @throws ShapeException if any index is out of range
   */
  public static TypedColumn gather(TypedColumn col, int[] idxs) {
    Object[] vals = new Object[idxs.length];
    for(int i = 0; i < idxs.length; ++i) {
      int idx = idxs[i];
      if((idx < 0) || (idx >= col.size())) {
        throw new ShapeException("Index " + idx +
                                 " out of range for column of length " +
                                 col.size());
      }
      vals[i] = col.get(idx);
    }
    return toColumn(col.getKind(), vals);
  }

  /**
   * @return the given column repeated to the given length if it is a
   *         scalar, the column itself if it already has the given length
   * @throws ShapeException otherwise
   */
  public static TypedColumn broadcast(TypedColumn col, int length) {
    if(col.size() == length) {
      return col;
    }
    if(!col.isScalar()) {
      throw new ShapeException("Cannot broadcast column of length " +
                               col.size() + " to length " + length);
    }
    return gather(col, new int[length]);
  }

  /**
   * @return a negated copy of the given column, or the column itself if it
   *         is not numeric
   */
  public static TypedColumn negate(TypedColumn col) {
    switch(col.getKind()) {
    case FLOAT64:
      double[] dvals = toDoubles(col);
      for(int i = 0; i < dvals.length; ++i) {
        dvals[i] = -dvals[i];
      }
      return new DoubleColumn(dvals);
    case INT32:
      int[] ivals = new int[col.size()];
      for(int i = 0; i < ivals.length; ++i) {
        ivals[i] = -((IntColumn)col).getInt(i);
      }
      return new IntColumn(ivals);
    case INT64:
      long[] lvals = new long[col.size()];
      for(int i = 0; i < lvals.length; ++i) {
        lvals[i] = -((LongColumn)col).getLong(i);
      }
      return new LongColumn(lvals);
    default:
      return col;
    }
  }

  /**
   * Converts the given column to the given kind.  This is the only place
   * values change kind.
   *
   * @throws TypeException if the values cannot be converted
   */
  public static TypedColumn convert(TypedColumn col, Kind kind,
                                    TemporalConfig temporal)
  {
    if(col.getKind() == kind) {
      return col;
    }

    int num = col.size();
    switch(kind) {
    case FLOAT64:
      double[] dvals = new double[num];
      for(int i = 0; i < num; ++i) {
        dvals[i] = getAsDouble(col, i);
      }
      return new DoubleColumn(dvals);
    case INT32:
      int[] ivals = new int[num];
      for(int i = 0; i < num; ++i) {
        ivals[i] = (int)getAsDouble(col, i);
      }
      return new IntColumn(ivals);
    case INT64:
      long[] lvals = new long[num];
      for(int i = 0; i < num; ++i) {
        lvals[i] = (long)getAsDouble(col, i);
      }
      return new LongColumn(lvals);
    case STRING:
      String[] svals = new String[num];
      for(int i = 0; i < num; ++i) {
        svals[i] = getAsString(col, i, temporal);
      }
      return new StringColumn(svals);
    case TIMESTAMP:
      LocalDateTime[] tvals = new LocalDateTime[num];
      for(int i = 0; i < num; ++i) {
        tvals[i] = getAsTimestamp(col, i, temporal);
      }
      return new TimestampColumn(tvals);
    default:
      throw new IllegalStateException("unknown kind " + kind);
    }
  }

  /**
   * @return the value of the given column at the given index as a double,
   *         parsing string values
   */
  public static double getAsDouble(TypedColumn col, int idx) {
    switch(col.getKind()) {
    case STRING:
      String str = col.getString(idx);
      Double d = parseNumber(str);
      if(d == null) {
        throw new TypeException("Cannot convert '" + str + "' to a number");
      }
      return d;
    case TIMESTAMP:
      throw new TypeException("Cannot convert a date to a number");
    default:
      return col.getDouble(idx);
    }
  }

  /**
   * @return the display form of the value of the given column at the given
   *         index
   */
  public static String getAsString(TypedColumn col, int idx,
                                   TemporalConfig temporal) {
    switch(col.getKind()) {
    case FLOAT64:
      return String.format(Locale.US, "%.2f", col.getDouble(idx));
    case INT32:
    case INT64:
      return String.valueOf(col.get(idx));
    case TIMESTAMP:
      return temporal.format(col.getTimestamp(idx));
    default:
      return col.getString(idx);
    }
  }

  /**
   * @return the value of the given column at the given index as a date,
   *         parsing string values
   */
  public static LocalDateTime getAsTimestamp(TypedColumn col, int idx,
                                             TemporalConfig temporal) {
    switch(col.getKind()) {
    case TIMESTAMP:
      return col.getTimestamp(idx);
    case STRING:
      String str = col.getString(idx);
      LocalDateTime ldt = temporal.parseDate(str);
      if(ldt == null) {
        throw new TypeException("Cannot convert '" + str + "' to a date");
      }
      return ldt;
    default:
      throw new TypeException("Cannot convert a number to a date");
    }
  }

  /**
   * @return the given text parsed as a decimal number, or {@code null} if it
   *         is not a number
   */
  public static Double parseNumber(String str) {
    String trimmed = str.trim();
    if(!NUMBER_PAT.matcher(trimmed).matches()) {
      return null;
    }
    return Double.valueOf(trimmed);
  }

  public static boolean isNumber(String str) {
    return NUMBER_PAT.matcher(str).matches();
  }

  /**
   * Compares two values within the given column using the natural ordering
   * of its kind.
   */
  public static int compareValues(TypedColumn col, int idx1, int idx2) {
    switch(col.getKind()) {
    case STRING:
      return col.getString(idx1).compareTo(col.getString(idx2));
    case TIMESTAMP:
      return col.getTimestamp(idx1).compareTo(col.getTimestamp(idx2));
    default:
      return Double.compare(col.getDouble(idx1), col.getDouble(idx2));
    }
  }
}
