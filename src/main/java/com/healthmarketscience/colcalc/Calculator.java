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

package com.healthmarketscience.colcalc;

import java.util.List;

import com.healthmarketscience.colcalc.expr.EvalConfig;
import com.healthmarketscience.colcalc.expr.Figure;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.TypedColumn;

/**
 * A Calculator compiles formula expressions into {@link OpNode} trees and
 * evaluates them against {@link Pipeline} instances.  Instances are built
 * using {@link CalculatorBuilder}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Calculator calc = new CalculatorBuilder().toCalculator();
 *   OpNode root = calc.addField("total", "price * qty", pipeline);
 * </pre>
 * <p/>
 * A Calculator (and any tree it builds) is not thread-safe.  Parse a tree
 * once and {@link #copy} it for each concurrent use.
 *
 * @author James Ahlborn
 */
public interface Calculator
{
  /** system property which can be used to set the maximum number of
      iterations used by the "irr" function (default 40) */
  public static final String IRR_MAX_ITERATIONS_PROPERTY =
    "com.healthmarketscience.colcalc.irrMaxIterations";
  /** system property which can be used to set the relative tolerance of the
      result of the "irr" function (default 1e-4) */
  public static final String IRR_TOLERANCE_PROPERTY =
    "com.healthmarketscience.colcalc.irrTolerance";
  /** system property which can be used to set the initial guess used by the
      "irr" function (default 0.05) */
  public static final String IRR_GUESS_PROPERTY =
    "com.healthmarketscience.colcalc.irrGuess";

  /**
   * @return the configuration used when parsing and evaluating expressions
   */
  public EvalConfig getEvalConfig();

  /**
   * @return the figure built up by the plotting functions
   */
  public Figure getFigure();

  /**
   * Parses the given expression into a new, unevaluated tree.
   *
   * @throws com.healthmarketscience.colcalc.expr.ParseException if the
   *         expression is invalid
   */
  public OpNode parse(String expr);

  /**
   * Evaluates the given tree against the given pipeline.
   *
   * @return the computed value of the root of the tree
   */
  public TypedColumn evaluate(OpNode root, Pipeline pipeline);

  /**
   * Parses and evaluates the given expression against the given pipeline.
   *
   * @return the computed value of the expression
   */
  public TypedColumn compute(String expr, Pipeline pipeline);

  /**
   * Adds the computed value of the given (evaluated) tree to the given
   * pipeline as the given field, replacing any existing field of that name.
   */
  public void appendToPipeline(OpNode root, String name, Pipeline pipeline);

  /**
   * Parses and evaluates the given expression and adds the result to the
   * given pipeline as the given field.
   *
   * @return the evaluated tree
   */
  public OpNode addField(String name, String expr, Pipeline pipeline);

  /**
   * Evaluates the given expressions for each value of the loop variable
   * {@code start <= var < end}, storing the result of each expression in the
   * corresponding target field after it is evaluated.
   */
  public void loop(String var, int start, int end, List<String> exprs,
                   List<String> targets, Pipeline pipeline);

  /**
   * @return a deep copy of the given tree
   */
  public OpNode copy(OpNode root);
}
