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

import java.util.Arrays;

import com.healthmarketscience.colcalc.expr.DomainException;
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
public class DefaultNumberFunctions
{

  private DefaultNumberFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function LOG = registerFunc(new NumericFunc1("log") {
    @Override
    protected double apply(double val) {
      if(val <= 0d) {
        throw new DomainException("Invalid log input " + val);
      }
      return Math.log(val);
    }
  });

  public static final Function EXP = registerFunc(new NumericFunc1("exp") {
    @Override
    protected double apply(double val) {
      return Math.exp(val);
    }
  });

  public static final Function ABS = registerFunc(new NumericFunc1("abs") {
    @Override
    protected double apply(double val) {
      return Math.abs(val);
    }
  });

  public static final Function POW = registerFunc(new NumericFunc2("pow") {
    @Override
    protected double apply(double val1, double val2) {
      return Math.pow(val1, val2);
    }
  });

  public static final Function SUM = registerFunc(new SummaryFunc1("sum") {
    @Override
    protected double summarize(double[] vals) {
      return sum(vals);
    }
  });

  public static final Function MEAN = registerFunc(new SummaryFunc1("mean") {
    @Override
    protected double summarize(double[] vals) {
      return mean(vals);
    }
  });

  public static final Function STD = registerFunc(new SummaryFunc1("std") {
    @Override
    protected double summarize(double[] vals) {
      if(vals.length < 2) {
        return 0d;
      }
      double mean = mean(vals);
      double ss = 0d;
      for(double val : vals) {
        ss += (val - mean) * (val - mean);
      }
      return Math.sqrt(ss / (vals.length - 1));
    }
  });

  public static final Function COUNT = registerFunc(new Func1(
      summaryDesc("count", Kind.FLOAT64, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      return ColumnSupport.toColumn((double)param1.size());
    }
  });

  public static final Function MEDIAN = registerFunc(new SummaryFunc1("median") {
    @Override
    protected double summarize(double[] vals) {
      double[] sorted = vals.clone();
      Arrays.sort(sorted);
      // lower middle value for an even count
      return sorted[((sorted.length + 1) / 2) - 1];
    }
  });

  public static final Function MAX = registerFunc(new Func1(
      summaryDesc("max", null, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      return findExtreme(param1, true);
    }
  });

  public static final Function MIN = registerFunc(new Func1(
      summaryDesc("min", null, ANY)) {
    @Override
    protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
      return findExtreme(param1, false);
    }
  });

  public static final Function R2 = registerFunc(new SummaryFunc2("r2") {
    @Override
    protected double summarize(double[] obs, double[] fit) {
      double mean = mean(obs);
      double sst = 0d;
      for(double val : obs) {
        sst += (val - mean) * (val - mean);
      }
      if(sst == 0d) {
        throw new DomainException("r2 undefined for constant observations");
      }
      return 1d - (sse(obs, fit) / sst);
    }
  });

  public static final Function SSE = registerFunc(new SummaryFunc2("sse") {
    @Override
    protected double summarize(double[] obs, double[] fit) {
      return sse(obs, fit);
    }
  });

  public static final Function MAD = registerFunc(new SummaryFunc2("mad") {
    @Override
    protected double summarize(double[] obs, double[] fit) {
      double sum = 0d;
      for(int i = 0; i < obs.length; ++i) {
        sum += Math.abs(obs[i] - fit[i]);
      }
      return sum / obs.length;
    }
  });


  static double sum(double[] vals) {
    double sum = 0d;
    for(double val : vals) {
      sum += val;
    }
    return sum;
  }

  static double mean(double[] vals) {
    return sum(vals) / vals.length;
  }

  private static double sse(double[] obs, double[] fit) {
    double sse = 0d;
    for(int i = 0; i < obs.length; ++i) {
      double diff = obs[i] - fit[i];
      sse += diff * diff;
    }
    return sse;
  }

  private static TypedColumn findExtreme(TypedColumn col, boolean max) {
    int best = 0;
    for(int i = 1; i < col.size(); ++i) {
      int cmp = ColumnSupport.compareValues(col, i, best);
      if(max ? (cmp > 0) : (cmp < 0)) {
        best = i;
      }
    }
    return ColumnSupport.gather(col, new int[]{best});
  }
}
