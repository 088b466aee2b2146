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


import com.healthmarketscience.colcalc.Calculator;
import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultFinancialFunctions
{
  private static final Log LOG =
    LogFactory.getLog(DefaultFinancialFunctions.class);

  static final int DEFAULT_MAX_RATE_ITERATIONS = 40;
  static final double DEFAULT_RATE_TOLERANCE = 1e-4;
  static final double DEFAULT_RATE_GUESS = 0.05;
  private static final double RATE_PRECISION = 1e-10;


  private DefaultFinancialFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function NPV = registerFunc(new Func2(
      summaryDesc("npv", Kind.FLOAT64, NUMERIC, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn rate,
                                TypedColumn cashflows) {
      if(rate.isScalar()) {
        return ColumnSupport.toColumn(
            calculateNPV(rate.getDouble(0), ColumnSupport.toDoubles(cashflows)));
      }
      // per period rates
      Broadcast bc = Broadcast.of(rate, cashflows);
      double[] rates = new double[bc.getLength()];
      double[] flows = new double[bc.getLength()];
      for(int i = 0; i < rates.length; ++i) {
        rates[i] = rate.getDouble(bc.index(0, i));
        flows[i] = cashflows.getDouble(bc.index(1, i));
      }
      return ColumnSupport.toColumn(calculateNPV(rates, flows));
    }
  });

  public static final Function IRR = registerFunc(new Func2(
      summaryDesc("irr", Kind.FLOAT64, NUMERIC, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn cost,
                                TypedColumn cashflows) {
      return ColumnSupport.toColumn(
          calculateIRR(getScalarDouble(cost),
                       ColumnSupport.toDoubles(cashflows),
                       getRateGuess(), getMaxRateIterations(),
                       getRateTolerance()));
    }
  });


  /**
   * @return the present value of the given cash flows discounted at the
   *         given rate, the first cash flow is not discounted
   */
  public static double calculateNPV(double rate, double[] cashflows) {
    double discount = 1d / (1d + rate);
    double factor = 1d;
    double pv = 0d;
    for(double cf : cashflows) {
      pv += cf * factor;
      factor *= discount;
    }
    return pv;
  }

  /**
   * @return the present value of the given cash flows where each cash flow
   *         is discounted at its own period rate
   */
  public static double calculateNPV(double[] rates, double[] cashflows) {
    double pv = 0d;
    for(int i = 0; i < cashflows.length; ++i) {
      pv += cashflows[i] * Math.pow(1d + rates[i], -i);
    }
    return pv;
  }

  /**
   * Finds the rate at which the present value of the given cash flows
   * equals the given cost using the secant method, starting from 0 and the
   * given guess.
   *
   * @throws DomainException if the relative residual of the final rate
   *         exceeds the given tolerance
   */
  public static double calculateIRR(double cost, double[] cashflows,
                                    double guess, int maxIterations,
                                    double tolerance)
  {
    double x0 = 0d;
    double y0 = calculateNPV(x0, cashflows) - cost;
    double x1 = guess;
    double y1 = calculateNPV(x1, cashflows) - cost;

    int i = 0;
    while((i < maxIterations) && (y1 != y0) && (y1 != 0d)) {
      double rate = x1 - (y1 * (x1 - x0) / (y1 - y0));
      if(rate <= -1d) {
        // discounting is undefined at or below -100%
        rate = (x1 - 1d) / 2d;
      }
      x0 = x1;
      y0 = y1;
      x1 = rate;
      y1 = calculateNPV(x1, cashflows) - cost;
      ++i;

      if(Math.abs(x1 - x0) < RATE_PRECISION) {
        break;
      }
    }

    double scale = Math.max(Math.abs(cost), 1d);
    if(Double.isNaN(y1) || (Math.abs(y1) > (tolerance * scale))) {
      LOG.warn("irr failed to converge after " + i + " iterations, residual " +
               y1);
      throw new DomainException("irr failed to converge for cost " + cost);
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("irr converged to " + x1 + " after " + i + " iterations");
    }
    return x1;
  }

  static int getMaxRateIterations() {
    String val = System.getProperty(Calculator.IRR_MAX_ITERATIONS_PROPERTY);
    if(val != null) {
      try {
        return Integer.parseInt(val.trim());
      } catch(NumberFormatException e) {
        LOG.warn("Invalid value for " + Calculator.IRR_MAX_ITERATIONS_PROPERTY +
                 " '" + val + "'", e);
      }
    }
    return DEFAULT_MAX_RATE_ITERATIONS;
  }

  static double getRateTolerance() {
    return getDoubleProperty(Calculator.IRR_TOLERANCE_PROPERTY,
                             DEFAULT_RATE_TOLERANCE);
  }

  static double getRateGuess() {
    return getDoubleProperty(Calculator.IRR_GUESS_PROPERTY,
                             DEFAULT_RATE_GUESS);
  }

  private static double getDoubleProperty(String name, double defaultVal) {
    String val = System.getProperty(name);
    if(val != null) {
      try {
        return Double.parseDouble(val.trim());
      } catch(NumberFormatException e) {
        LOG.warn("Invalid value for " + name + " '" + val + "'", e);
      }
    }
    return defaultVal;
  }
}
