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

import java.io.PrintStream;

import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.RenderSink;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.impl.CalculatorImpl;

/**
 * Builder style class for creating a {@link Calculator}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Calculator calc = new CalculatorBuilder().toCalculator();
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   Calculator calc = new CalculatorBuilder()
 *     .setRenderSink(new LoggingRenderSink())
 *     .setOutput(System.err)
 *     .toCalculator();
 * </pre>
 *
 * @author James Ahlborn
 */
public class CalculatorBuilder
{
  /** date formats used for string/date conversions */
  private TemporalConfig _temporal;
  /** optional provider of custom functions */
  private FunctionLookup _funcLookup;
  /** optional backend for the "render" function */
  private RenderSink _renderSink;
  /** optional stream for the printing functions */
  private PrintStream _output;

  public CalculatorBuilder() {}

  /**
   * Sets the date formats used when converting between strings and dates.
   * Defaults to {@link TemporalConfig#US_TEMPORAL_CONFIG}.
   */
  public CalculatorBuilder setTemporalConfig(TemporalConfig temporal) {
    _temporal = temporal;
    return this;
  }

  /**
   * Sets the provider of the functions available to expressions.  Defaults
   * to the built in functions.
   */
  public CalculatorBuilder setFunctionLookup(FunctionLookup funcLookup) {
    _funcLookup = funcLookup;
    return this;
  }

  /**
   * Sets the backend which receives the figures passed to the "render"
   * function.
   */
  public CalculatorBuilder setRenderSink(RenderSink renderSink) {
    _renderSink = renderSink;
    return this;
  }

  /**
   * Sets the stream written to by the "print" and "printIf" functions.
   * Defaults to {@link System#out}.
   */
  public CalculatorBuilder setOutput(PrintStream output) {
    _output = output;
    return this;
  }

  /**
   * Creates a new Calculator using the current configuration.
   */
  public Calculator toCalculator() {
    CalculatorImpl calc = new CalculatorImpl();
    if(_temporal != null) {
      calc.setTemporalConfig(_temporal);
    }
    if(_funcLookup != null) {
      calc.setFunctionLookup(_funcLookup);
    }
    if(_output != null) {
      calc.setOutput(_output);
    }
    calc.setRenderSink(_renderSink);
    return calc;
  }
}
