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

import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import org.apache.commons.lang3.StringUtils;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultTextFunctions
{

  private DefaultTextFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function STR_LEN = registerFunc(new Func1(
      rowDesc("strLen", Kind.FLOAT64, STRING)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      double[] vals = new double[param1.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = param1.getString(i).length();
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function SUBSTR = registerFunc(new Func3(
      rowDesc("substr", Kind.STRING, STRING, NUMERIC, NUMERIC)) {
    @Override
    protected TypedColumn eval3(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2, TypedColumn param3) {
      Broadcast bc = Broadcast.of(param1, param2, param3);
      String[] vals = new String[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        String str = param1.getString(bc.index(0, i));
        int start = Math.max((int)param2.getDouble(bc.index(1, i)), 0);
        int len = Math.max((int)param3.getDouble(bc.index(2, i)), 0);
        start = Math.min(start, str.length());
        int end = (int)Math.min((long)start + len, str.length());
        vals[i] = str.substring(start, end);
      }
      return new StringColumn(vals);
    }
  });

  public static final Function STR_POS = registerFunc(new Func2(
      rowDesc("strPos", Kind.FLOAT64, STRING, STRING)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      double[] vals = new double[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = param1.getString(bc.index(0, i)).indexOf(
            param2.getString(bc.index(1, i)));
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function STR_COUNT = registerFunc(new Func2(
      rowDesc("strCount", Kind.FLOAT64, STRING, STRING)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      double[] vals = new double[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = StringUtils.countMatches(param1.getString(bc.index(0, i)),
                                           param2.getString(bc.index(1, i)));
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function CONCAT = registerFunc(new Func2(
      rowDesc("concat", Kind.STRING, ANY, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      TemporalConfig temporal = ctx.getTemporalConfig();
      Broadcast bc = Broadcast.of(param1, param2);
      String[] vals = new String[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = ColumnSupport.getAsString(param1, bc.index(0, i), temporal) +
          ColumnSupport.getAsString(param2, bc.index(1, i), temporal);
      }
      return new StringColumn(vals);
    }
  });
}
