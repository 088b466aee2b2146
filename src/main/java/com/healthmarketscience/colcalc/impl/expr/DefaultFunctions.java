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

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.LookupException;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultFunctions
{
  private static final Log LOG = LogFactory.getLog(DefaultFunctions.class);

  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  static {
    // load all default functions
    DefaultTextFunctions.init();
    DefaultNumberFunctions.init();
    DefaultDateFunctions.init();
    DefaultFinancialFunctions.init();
    DefaultPlotFunctions.init();
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
  };

  private DefaultFunctions() {}


  public static final Function EXIST = registerFunc(new DelayedFunc2(
      rowDesc("exist", null, ANY, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      try {
        return resolve(param1);
      } catch(LookupException e) {
        if(LOG.isDebugEnabled()) {
          LOG.debug("exist() using fallback: " + e.getMessage());
        }
        return resolve(param2);
      }
    }
  });

  public static final Function IF = registerFunc(new Func3(
      rowDesc("if", null, NUMERIC, ANY, ANY)) {
    @Override
    protected TypedColumn eval3(EvalContext ctx, TypedColumn cond,
                                TypedColumn param1, TypedColumn param2) {
      Broadcast bc = Broadcast.of(cond, param1, param2);
      int num = bc.getLength();
      if(param1.isNumeric() && param2.isNumeric()) {
        double[] vals = new double[num];
        for(int i = 0; i < num; ++i) {
          vals[i] = ((cond.getDouble(bc.index(0, i)) > 0d) ?
                     param1.getDouble(bc.index(1, i)) :
                     param2.getDouble(bc.index(2, i)));
        }
        return new DoubleColumn(vals);
      }
      if(param1.getKind() != param2.getKind()) {
        throw new TypeException("if() branches have different kinds " +
                                param1.getKind() + " and " +
                                param2.getKind());
      }
      Object[] vals = new Object[num];
      for(int i = 0; i < num; ++i) {
        vals[i] = ((cond.getDouble(bc.index(0, i)) > 0d) ?
                   param1.get(bc.index(1, i)) :
                   param2.get(bc.index(2, i)));
      }
      return ColumnSupport.toColumn(param1.getKind(), vals);
    }
  });

  public static final Function LAG = registerFunc(new Func2(
      rowDesc("lag", null, ANY, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn missing) {
      Object[] vals = new Object[param1.size()];
      vals[0] = getMissing(ctx, missing, param1.getKind());
      for(int i = 1; i < vals.length; ++i) {
        vals[i] = param1.get(i - 1);
      }
      return ColumnSupport.toColumn(param1.getKind(), vals);
    }
  });

  public static final Function CUME_BEFORE = registerFunc(new Func2(
      rowDesc("cumeBefore", Kind.FLOAT64, NUMERIC, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn missing) {
      double[] vals = new double[param1.size()];
      vals[0] = getMissingDouble(ctx, missing);
      double sum = 0d;
      for(int i = 1; i < vals.length; ++i) {
        sum += param1.getDouble(i - 1);
        vals[i] = sum;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function CUME_AFTER = registerFunc(new Func2(
      rowDesc("cumeAfter", Kind.FLOAT64, NUMERIC, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn missing) {
      int last = param1.size() - 1;
      double[] vals = new double[param1.size()];
      vals[last] = getMissingDouble(ctx, missing);
      double sum = 0d;
      for(int i = last - 1; i >= 0; --i) {
        sum += param1.getDouble(i + 1);
        vals[i] = sum;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function PROD_BEFORE = registerFunc(new Func2(
      rowDesc("prodBefore", Kind.FLOAT64, NUMERIC, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn missing) {
      double[] vals = new double[param1.size()];
      vals[0] = getMissingDouble(ctx, missing);
      double prod = 1d;
      for(int i = 1; i < vals.length; ++i) {
        prod *= param1.getDouble(i - 1);
        vals[i] = prod;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function PROD_AFTER = registerFunc(new Func2(
      rowDesc("prodAfter", Kind.FLOAT64, NUMERIC, ANY)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn missing) {
      int last = param1.size() - 1;
      double[] vals = new double[param1.size()];
      vals[last] = getMissingDouble(ctx, missing);
      double prod = 1d;
      for(int i = last - 1; i >= 0; --i) {
        prod *= param1.getDouble(i + 1);
        vals[i] = prod;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function COUNT_BEFORE = registerFunc(new Func1(
      rowDesc("countBefore", Kind.FLOAT64, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      double[] vals = new double[param1.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = i;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function COUNT_AFTER = registerFunc(new Func1(
      rowDesc("countAfter", Kind.FLOAT64, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      double[] vals = new double[param1.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = vals.length - 1 - i;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function ROW = registerFunc(new Func1(
      rowDesc("row", Kind.FLOAT64, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      // a scalar argument numbers the rows of the whole pipeline
      int num = param1.size();
      if(param1.isScalar() && (ctx.getRowCount() > 0)) {
        num = ctx.getRowCount();
      }
      double[] vals = new double[num];
      for(int i = 0; i < num; ++i) {
        vals[i] = i;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function INDEX = registerFunc(new Func2(
      rowDesc("index", null, ANY, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn idxs) {
      int[] idxVals = new int[idxs.size()];
      for(int i = 0; i < idxVals.length; ++i) {
        idxVals[i] = (int)idxs.getDouble(i);
      }
      return ColumnSupport.gather(param1, idxVals);
    }
  });

  public static final Function RANGE = registerFunc(new Func2(
      rowDesc("range", Kind.FLOAT64, NUMERIC, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      int start = (int)getScalarDouble(param1);
      int end = (int)getScalarDouble(param2);
      if(end <= start) {
        throw new DomainException("Empty range [" + start + ", " + end + ")");
      }
      double[] vals = new double[end - start];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = start + i;
      }
      return new DoubleColumn(vals);
    }
  });

  public static final Function TO_FLOAT = registerFunc(
      new ConversionFunc("toFloat", Kind.FLOAT64));

  public static final Function TO_INT = registerFunc(
      new ConversionFunc("toInt", Kind.INT64));

  public static final Function TO_STRING = registerFunc(
      new ConversionFunc("toString", Kind.STRING));

  public static final Function TO_DATE = registerFunc(
      new ConversionFunc("toDate", Kind.TIMESTAMP));

  public static final Function CAT = registerFunc(new Func1(
      roleDesc("cat", null, Role.CATEGORICAL, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      if(!param1.isNumeric()) {
        return param1;
      }
      return ColumnSupport.convert(param1, Kind.INT32, ctx.getTemporalConfig());
    }
  });

  public static final Function CTS = registerFunc(new Func1(
      roleDesc("cts", Kind.FLOAT64, Role.CONTINUOUS, NUMERIC)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      return ColumnSupport.convert(param1, Kind.FLOAT64,
                                   ctx.getTemporalConfig());
    }
  });

  public static final Function PRINT = registerFunc(new NodeFunc(
      summaryDesc("print", Kind.FLOAT64, ANY, NUMERIC)) {
    @Override
    protected TypedColumn evalNode(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      TypedColumn param1 = params[0];
      int rows = getRowLimit(params[1], param1.size());
      PrintStream out = ctx.getOutput();
      out.println(getArgExpression(node, 0));
      for(int i = 0; i < rows; ++i) {
        printRow(ctx, out, param1, i);
      }
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function PRINT_IF = registerFunc(new NodeFunc(
      summaryDesc("printIf", Kind.FLOAT64, ANY, NUMERIC)) {
    @Override
    protected TypedColumn evalNode(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      TypedColumn param1 = params[0];
      TypedColumn cond = params[1];
      Broadcast bc = Broadcast.of(param1, cond);
      PrintStream out = ctx.getOutput();
      out.println(getArgExpression(node, 0) + " where " +
                  getArgExpression(node, 1));
      for(int i = 0; i < bc.getLength(); ++i) {
        if(cond.getDouble(bc.index(1, i)) > 0d) {
          printRow(ctx, out, param1, bc.index(0, i));
        }
      }
      return ColumnSupport.SENTINEL_COL;
    }
  });


  private static final class ConversionFunc extends Func1
  {
    private final Kind _kind;

    private ConversionFunc(String name, Kind kind) {
      super(rowDesc(name, kind, ANY));
      _kind = kind;
    }

    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      return ColumnSupport.convert(param1, _kind, ctx.getTemporalConfig());
    }
  }

  private static Object getMissing(EvalContext ctx, TypedColumn missing,
                                   Kind kind) {
    checkScalar(missing, "missing value");
    return ColumnSupport.convert(missing, kind, ctx.getTemporalConfig())
      .get(0);
  }

  private static double getMissingDouble(EvalContext ctx,
                                         TypedColumn missing) {
    return (Double)getMissing(ctx, missing, Kind.FLOAT64);
  }

  static double getScalarDouble(TypedColumn param) {
    checkScalar(param, "parameter");
    return param.getDouble(0);
  }

  static void checkScalar(TypedColumn param, String desc) {
    if(!param.isScalar()) {
      throw new ShapeException("Expected a single " + desc + " but got " +
                               param.size() + " values");
    }
  }

  private static int getRowLimit(TypedColumn param, int size) {
    int rows = (int)getScalarDouble(param);
    return (((rows <= 0) || (rows > size)) ? size : rows);
  }

  private static void printRow(EvalContext ctx, PrintStream out,
                               TypedColumn col, int idx) {
    out.println(String.format("%6d  %s", idx,
                              ColumnSupport.getAsString(
                                  col, idx, ctx.getTemporalConfig())));
  }

  static String toLookupName(String name) {
    return ((name != null) ? name.toLowerCase() : null);
  }

  static Function registerFunc(Function func) {
    registerFunc(func.getName(), func);
    return func;
  }

  private static void registerFunc(String fname, Function func) {
    String lookupFname = toLookupName(fname);
    if(FUNCS.put(lookupFname, func) != null) {
      throw new IllegalStateException("Duplicate function " + fname);
    }
  }
}
