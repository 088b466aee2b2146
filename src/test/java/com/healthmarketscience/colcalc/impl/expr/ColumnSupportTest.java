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

import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class ColumnSupportTest
{
  private static final TemporalConfig US = TemporalConfig.US_TEMPORAL_CONFIG;

  @Test
  public void testColumns() throws Exception
  {
    TypedColumn col = new IntColumn(1, 2, 3);
    assertEquals(Kind.INT32, col.getKind());
    assertTrue(col.isNumeric());
    assertFalse(col.isScalar());
    assertEquals(2d, col.getDouble(1), 0d);
    assertThrows(TypeException.class, () -> col.getString(0));
    assertThrows(TypeException.class, () -> col.getTimestamp(0));
    assertThrows(IllegalArgumentException.class, () -> new DoubleColumn());

    TypedColumn str = new StringColumn("a");
    assertTrue(str.isScalar());
    assertFalse(str.isNumeric());
    assertThrows(TypeException.class, () -> str.getDouble(0));

    double[] vals = {1d, 2d};
    DoubleColumn dcol = new DoubleColumn(vals);
    TypedColumn dcopy = dcol.copy();
    assertNotSame(dcol, dcopy);
    assertColumn(dcopy, 1d, 2d);

    assertTrue(Kind.INT64.isNumeric());
    assertTrue(Kind.INT64.isIntegral());
    assertFalse(Kind.FLOAT64.isIntegral());
    assertFalse(Kind.TIMESTAMP.isNumeric());
  }

  @Test
  public void testBroadcast() throws Exception
  {
    TypedColumn scalar = new DoubleColumn(5d);
    TypedColumn col = new DoubleColumn(1d, 2d, 3d);

    Broadcast bc = Broadcast.of(scalar, col);
    assertEquals(3, bc.getLength());
    assertEquals(0, bc.index(0, 2));
    assertEquals(2, bc.index(1, 2));

    assertEquals(1, Broadcast.of(scalar, scalar).getLength());
    assertThrows(ShapeException.class,
                 () -> Broadcast.of(col, new DoubleColumn(1d, 2d)));

    assertColumn(ColumnSupport.broadcast(scalar, 3), 5d, 5d, 5d);
    assertSame(col, ColumnSupport.broadcast(col, 3));
    assertThrows(ShapeException.class, () -> ColumnSupport.broadcast(col, 4));

    assertColumn(ColumnSupport.gather(col, new int[]{2, 0}), 3d, 1d);
  }

  @Test
  public void testConvert() throws Exception
  {
    TypedColumn col = ColumnSupport.convert(new StringColumn("1.5", " 2 "),
                                            Kind.FLOAT64, US);
    assertColumn(col, 1.5d, 2d);

    col = ColumnSupport.convert(new DoubleColumn(1.7d, -2.2d), Kind.INT32, US);
    assertEquals(Kind.INT32, col.getKind());
    assertEquals(1, col.get(0));
    assertEquals(-2, col.get(1));

    assertColumn(ColumnSupport.convert(new DoubleColumn(1d / 3d), Kind.STRING,
                                       US), "0.33");
    assertColumn(ColumnSupport.convert(new LongColumn(7L), Kind.STRING, US),
                 "7");

    col = ColumnSupport.convert(new StringColumn("2/28/2023"), Kind.TIMESTAMP,
                                US);
    assertEquals(LocalDateTime.of(2023, 2, 28, 0, 0), col.getTimestamp(0));

    assertThrows(TypeException.class, () -> ColumnSupport.convert(
                     new StringColumn("x"), Kind.FLOAT64, US));
    assertThrows(TypeException.class, () -> ColumnSupport.convert(
                     new TimestampColumn(LocalDateTime.of(2023, 1, 1, 0, 0)),
                     Kind.FLOAT64, US));
    assertThrows(TypeException.class, () -> ColumnSupport.convert(
                     new DoubleColumn(1d), Kind.TIMESTAMP, US));

    col = new DoubleColumn(1d);
    assertSame(col, ColumnSupport.convert(col, Kind.FLOAT64, US));
  }

  @Test
  public void testNegate() throws Exception
  {
    assertColumn(ColumnSupport.negate(new DoubleColumn(1d, -2d)), -1d, 2d);
    TypedColumn col = ColumnSupport.negate(new IntColumn(3));
    assertEquals(Kind.INT32, col.getKind());
    assertEquals(-3, col.get(0));
    col = ColumnSupport.negate(new LongColumn(3L));
    assertEquals(-3L, col.get(0));

    TypedColumn str = new StringColumn("a");
    assertSame(str, ColumnSupport.negate(str));
  }

  @Test
  public void testNumbers() throws Exception
  {
    assertEquals(Double.valueOf(1.5e-3), ColumnSupport.parseNumber(" 1.5e-3 "));
    assertEquals(Double.valueOf(-2d), ColumnSupport.parseNumber("-2"));
    assertNull(ColumnSupport.parseNumber("1.2.3"));
    assertNull(ColumnSupport.parseNumber("abc"));
    assertNull(ColumnSupport.parseNumber("NaN"));
    assertTrue(ColumnSupport.isNumber("5."));
    assertFalse(ColumnSupport.isNumber("."));
  }
}
