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

import java.util.List;

import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.FunctionDescriptor;
import com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind;
import com.healthmarketscience.colcalc.expr.FunctionDescriptor.Level;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;

/**
 *
 * @author James Ahlborn
 */
public class FunctionSupport
{
  private FunctionSupport() {}

  public static FunctionDescriptor rowDesc(String name, Kind returnKind,
                                           ArgKind... argKinds) {
    return new FunctionDescriptor(name, Level.ROW, returnKind, null, argKinds);
  }

  public static FunctionDescriptor summaryDesc(String name, Kind returnKind,
                                               ArgKind... argKinds) {
    return new FunctionDescriptor(name, Level.REDUCTION, returnKind, null,
                                  argKinds);
  }

  public static FunctionDescriptor roleDesc(String name, Kind returnKind,
                                            Role role, ArgKind... argKinds) {
    return new FunctionDescriptor(name, Level.ROW, returnKind, role, argKinds);
  }

  public static abstract class BaseFunction implements Function
  {
    private final FunctionDescriptor _desc;

    protected BaseFunction(FunctionDescriptor desc)
    {
      _desc = desc;
    }

    @Override
    public String getName() {
      return _desc.getName();
    }

    @Override
    public FunctionDescriptor getDescriptor() {
      return _desc;
    }

    @Override
    public boolean isDelayed() {
      return false;
    }

    @Override
    public final TypedColumn eval(EvalContext ctx, OpNode node,
                                  TypedColumn... params) {
      validateParams(params);
      try {
        return evalImpl(ctx, node, params);
      } catch(EvalException e) {
        throw e;
      } catch(RuntimeException e) {
        throw invalidFunctionCall(e, node);
      }
    }

    protected abstract TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                            TypedColumn[] params);

    protected void validateParams(TypedColumn[] params) {
      List<ArgKind> argKinds = _desc.getArgKinds();
      if(_desc.isVariadic()) {
        return;
      }
      if(params.length != argKinds.size()) {
        throw new EvalException(
            "Invalid number of parameters " + params.length +
            " passed to " + getName() + ", expected " + argKinds.size());
      }
      if(isDelayed()) {
        return;
      }
      for(int i = 0; i < params.length; ++i) {
        ArgKind argKind = argKinds.get(i);
        if(!argKind.accepts(params[i].getKind())) {
          throw new TypeException(
              "Invalid parameter " + (i + 1) + " for " + getName() +
              ", expected " + argKind + " but was " + params[i].getKind());
        }
      }
    }

    protected EvalException invalidFunctionCall(Throwable t, OpNode node)
    {
      String callStr = ((node != null) ? node.getExpression() :
                        getName() + "()");
      String msg = "Invalid function call {" + callStr + "}";
      return new EvalException(msg, t);
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func0 extends BaseFunction
  {
    protected Func0(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    protected final TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                         TypedColumn[] params) {
      return eval0(ctx);
    }

    protected abstract TypedColumn eval0(EvalContext ctx);
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    protected final TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                         TypedColumn[] params) {
      return eval1(ctx, params[0]);
    }

    protected abstract TypedColumn eval1(EvalContext ctx, TypedColumn param);
  }

  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    protected final TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                         TypedColumn[] params) {
      return eval2(ctx, params[0], params[1]);
    }

    protected abstract TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                         TypedColumn param2);
  }

  public static abstract class Func3 extends BaseFunction
  {
    protected Func3(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    protected final TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                         TypedColumn[] params) {
      return eval3(ctx, params[0], params[1], params[2]);
    }

    protected abstract TypedColumn eval3(EvalContext ctx, TypedColumn param1,
                                         TypedColumn param2,
                                         TypedColumn param3);
  }

  /**
   * Base class for functions which need the parsed call (e.g. to report the
   * text of their arguments).
   */
  public static abstract class NodeFunc extends BaseFunction
  {
    protected NodeFunc(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    protected final TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                         TypedColumn[] params) {
      return evalNode(ctx, node, params);
    }

    protected abstract TypedColumn evalNode(EvalContext ctx, OpNode node,
                                            TypedColumn[] params);

    /**
     * @return the text of the given argument of the given call
     */
    protected static String getArgExpression(OpNode node, int idx) {
      OpNode arg = node.getChildren().get(idx);
      return arg.toString();
    }
  }

  /**
   * Row level function applying a unary numeric operation to each value.
   */
  public static abstract class NumericFunc1 extends Func1
  {
    protected NumericFunc1(String name) {
      super(rowDesc(name, Kind.FLOAT64, ArgKind.NUMERIC));
    }

    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param) {
      double[] vals = new double[param.size()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = apply(param.getDouble(i));
      }
      return new DoubleColumn(vals);
    }

    protected abstract double apply(double val);
  }

  /**
   * Row level function applying a binary numeric operation to each pair of
   * (broadcast) values.
   */
  public static abstract class NumericFunc2 extends Func2
  {
    protected NumericFunc2(String name) {
      super(rowDesc(name, Kind.FLOAT64, ArgKind.NUMERIC, ArgKind.NUMERIC));
    }

    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      double[] vals = new double[bc.getLength()];
      for(int i = 0; i < vals.length; ++i) {
        vals[i] = apply(param1.getDouble(bc.index(0, i)),
                        param2.getDouble(bc.index(1, i)));
      }
      return new DoubleColumn(vals);
    }

    protected abstract double apply(double val1, double val2);
  }

  /**
   * Reduction level function summarizing a numeric column as a single
   * value.
   */
  public static abstract class SummaryFunc1 extends Func1
  {
    protected SummaryFunc1(String name) {
      super(summaryDesc(name, Kind.FLOAT64, ArgKind.NUMERIC));
    }

    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param) {
      return ColumnSupport.toColumn(summarize(ColumnSupport.toDoubles(param)));
    }

    protected abstract double summarize(double[] vals);
  }

  /**
   * Reduction level function comparing a column of observed values with a
   * column of fitted values.
   */
  public static abstract class SummaryFunc2 extends Func2
  {
    protected SummaryFunc2(String name) {
      super(summaryDesc(name, Kind.FLOAT64, ArgKind.NUMERIC, ArgKind.NUMERIC));
    }

    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn param1,
                                TypedColumn param2) {
      Broadcast bc = Broadcast.of(param1, param2);
      double[] vals1 = new double[bc.getLength()];
      double[] vals2 = new double[bc.getLength()];
      for(int i = 0; i < vals1.length; ++i) {
        vals1[i] = param1.getDouble(bc.index(0, i));
        vals2[i] = param2.getDouble(bc.index(1, i));
      }
      return ColumnSupport.toColumn(summarize(vals1, vals2));
    }

    protected abstract double summarize(double[] vals1, double[] vals2);
  }

  /**
   * Function which receives its first parameter unevaluated and falls back
   * to its second parameter.
   */
  public static abstract class DelayedFunc2 extends Func2
  {
    protected DelayedFunc2(FunctionDescriptor desc) {
      super(desc);
    }

    @Override
    public boolean isDelayed() {
      return true;
    }
  }

  /**
   * @return the computed column for the given (possibly delayed) parameter
   */
  public static TypedColumn resolve(TypedColumn param) {
    return ((param instanceof BaseDelayedColumn) ?
            ((BaseDelayedColumn)param).getDelegate() : param);
  }
}
