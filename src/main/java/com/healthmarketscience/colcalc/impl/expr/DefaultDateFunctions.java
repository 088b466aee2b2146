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
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjuster;
import java.time.temporal.TemporalAdjusters;

import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultDateFunctions
{

  private DefaultDateFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function DATE_ADD = registerFunc(new Func2(
      rowDesc("dateAdd", Kind.TIMESTAMP, TIMESTAMP, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      LocalDateTime[] vals = new LocalDateTime[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = param1.getTimestamp(bc.index(0, i))
          .plusMonths((long)param2.getDouble(bc.index(1, i)));
      }
      return new TimestampColumn(vals);
    }
  });

  public static final Function DATE_DIFF = registerFunc(new Func2(
      rowDesc("dateDiff", Kind.FLOAT64, TIMESTAMP, TIMESTAMP)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      double[] vals = new double[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = ChronoUnit.MONTHS.between(param2.getTimestamp(bc.index(1, i)),
                                            param1.getTimestamp(bc.index(0, i)));
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function YEAR = registerFunc(new DateFieldFunc("year") {
    @Override
    protected int getField(LocalDateTime ldt) {
      return ldt.getYear();
    }
  });

  public static final Function MONTH = registerFunc(new DateFieldFunc("month") {
    @Override
    protected int getField(LocalDateTime ldt) {
      return ldt.getMonthValue();
    }
  });

  public static final Function DAY = registerFunc(new DateFieldFunc("day") {
    @Override
    protected int getField(LocalDateTime ldt) {
      return ldt.getDayOfMonth();
    }
  });

  public static final Function TO_LAST_DAY_OF_MONTH = registerFunc(
      new AdjustDateFunc("toLastDayOfMonth", TemporalAdjusters.lastDayOfMonth()));

  public static final Function TO_FIRST_DAY_OF_MONTH = registerFunc(
      new AdjustDateFunc("toFirstDayOfMonth",
                         TemporalAdjusters.firstDayOfMonth()));


  private static abstract class DateFieldFunc extends Func1
  {
    private DateFieldFunc(String name) {
      super(rowDesc(name, Kind.FLOAT64, TIMESTAMP));
    }

    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      double[] vals = new double[param1.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = getField(param1.getTimestamp(i));
      }
      return new DoubleColumn(vals);
    }

    protected abstract int getField(LocalDateTime ldt);
  }

  private static final class AdjustDateFunc extends Func1
  {
    private final TemporalAdjuster _adjuster;

    private AdjustDateFunc(String name, TemporalAdjuster adjuster) {
      super(rowDesc(name, Kind.TIMESTAMP, TIMESTAMP));
      _adjuster = adjuster;
    }

    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      LocalDateTime[] vals = new LocalDateTime[param1.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = param1.getTimestamp(i).with(_adjuster);
      }
      return new TimestampColumn(vals);
    }
  }
}
