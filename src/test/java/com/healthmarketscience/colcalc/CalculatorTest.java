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

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Locale;

import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalConfig;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.ParseException;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.impl.expr.DefaultFunctions;
import com.healthmarketscience.colcalc.impl.expr.DoubleColumn;
import com.healthmarketscience.colcalc.impl.expr.FunctionSupport;
import com.healthmarketscience.colcalc.impl.expr.StringColumn;
import com.healthmarketscience.colcalc.util.SimplePipeline;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class CalculatorTest
{

  @Test
  public void testBasics() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = new SimplePipeline()
      .addField("c", new DoubleColumn(1d, 2d), Role.CONTINUOUS)
      .addField("D", new DoubleColumn(3d, -4d), Role.CONTINUOUS);

    assertColumn(calc.compute("c+D", pipeline), 4d, -2d);
    assertColumn(calc.compute("if(c>D,c,D)", pipeline), 3d, 2d);
    assertColumn(calc.compute("lag(c,3)", pipeline), 3d, 1d);

    OpNode root = calc.addField("t", "c*D", pipeline);
    assertColumn(root.getComputedValue(), 3d, -8d);
    assertColumn(pipeline.getColumn("t"), 3d, -8d);
    assertEquals(Role.CONTINUOUS, pipeline.getRole("t"));

    root = calc.parse("t - c");
    calc.evaluate(root, pipeline);
    calc.appendToPipeline(root, "u", pipeline);
    assertColumn(pipeline.getColumn("u"), 2d, -10d);
  }

  @Test
  public void testFinancial() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createWidePipeline();

    assertEquals(8.302778d, calc.compute("npv(.1,c)", pipeline).getDouble(0),
                 1e-4);
    assertEquals(0.3169080d, calc.compute("irr(6,c)", pipeline).getDouble(0),
                 1e-4);
  }

  @Test
  public void testExpand() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = new SimplePipeline()
      .addField("seed", new DoubleColumn(42d), Role.CONTINUOUS);

    calc.addField("i", "range(0,10)", pipeline);
    assertEquals(10, pipeline.getRowCount());
    assertScalar(420d, calc.compute("sum(seed)", pipeline));
  }

  @Test
  public void testFailures() throws Exception
  {
    Calculator calc = createCalculator();
    assertThrows(ParseException.class, () -> calc.parse("(1+2"));
    assertThrows(DomainException.class,
                 () -> calc.compute("c/0", createPipeline()));
  }

  @Test
  public void testStringLag() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = new SimplePipeline()
      .addField("D", new StringColumn("x", "y"), Role.CATEGORICAL);

    assertColumn(calc.compute("lag(D,3)", pipeline), "3.00", "x");
    assertColumn(calc.compute("lag(D,'n/a')", pipeline), "n/a", "x");
  }

  @Test
  public void testConfig() throws Exception
  {
    Calculator calc = createCalculator();
    EvalConfig config = calc.getEvalConfig();
    assertSame(TemporalConfig.US_TEMPORAL_CONFIG, config.getTemporalConfig());
    assertSame(DefaultFunctions.LOOKUP, config.getFunctionLookup());
    assertNull(config.getRenderSink());
    assertSame(System.out, config.getOutput());

    TemporalConfig euro = new TemporalConfig("dd.MM.yyyy", Locale.GERMANY,
                                             "dd.MM.yyyy", "yyyyMMdd");
    calc = new CalculatorBuilder()
      .setTemporalConfig(euro)
      .toCalculator();
    SimplePipeline pipeline = createWidePipeline();

    assertEquals(LocalDateTime.of(2022, 3, 25, 0, 0),
                 calc.compute("toDate('25.03.2022')", pipeline)
                 .getTimestamp(0));
    assertColumn(calc.compute("toString(dt)", pipeline), "31.12.2021",
                 "25.03.2022", "01.06.2022", "28.02.2023");

    calc.getEvalConfig().setTemporalConfig(null);
    assertSame(TemporalConfig.US_TEMPORAL_CONFIG,
               calc.getEvalConfig().getTemporalConfig());
  }

  @Test
  public void testCustomFunctions() throws Exception
  {
    final Function twice = new FunctionSupport.Func1(
        FunctionSupport.rowDesc("twice", TypedColumn.Kind.FLOAT64, NUMERIC)) {
      @Override
      protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
        double[] vals = new double[param1.size()];
        for(int i = 0; i < vals.length; ++i) {
          vals[i] = param1.getDouble(i) * 2d;
        }
        return new DoubleColumn(vals);
      }
    };
    FunctionLookup lookup = new FunctionLookup() {
      public Function getFunction(String name) {
        if("twice".equalsIgnoreCase(name)) {
          return twice;
        }
        return DefaultFunctions.LOOKUP.getFunction(name);
      }
    };

    Calculator calc = new CalculatorBuilder()
      .setFunctionLookup(lookup)
      .toCalculator();
    assertColumn(calc.compute("Twice(c) + sum(c)", createPipeline()), 5d, 7d);

    // default lookup knows nothing about it
    assertThrows(ParseException.class,
                 () -> createCalculator().parse("twice(c)"));
  }

  @Test
  public void testLoopAndCopy() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();
    calc.loop("x", 1, 3, Arrays.asList("D*x", "1-r+x", "c+x"),
              Arrays.asList("r", "y", "c"), pipeline);
    assertColumn(pipeline.getColumn("y"), -3d, -17d);

    OpNode root = calc.parse("c + D");
    OpNode copy = calc.copy(root);
    assertEquals(root.toDebugString(), copy.toDebugString());
    assertColumn(calc.evaluate(copy, pipeline), 7d, 15d);
    assertNull(root.getComputedValue());
  }
}
