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
import com.healthmarketscience.colcalc.CalculatorBuilder;
import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.LookupException;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import com.healthmarketscience.colcalc.util.SimplePipeline;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.ExpressionatorTest.eval;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class EvaluatorTest
{

  @Test
  public void testEvaluate() throws Exception
  {
    assertColumn(evalSimple("c+D"), 4d, 12d);
    assertColumn(evalSimple("c-D-D"), -5d, -18d);
    assertColumn(evalSimple("-D*3 + D"), -6d, -20d);
    assertColumn(evalSimple("c*D/2"), 1.5d, 10d);
    assertColumn(evalSimple("D/c/2"), 1.5d, 2.5d);
    assertColumn(evalSimple("(c+1)*2"), 4d, 6d);
    assertColumn(evalSimple("2^3^2"), 512d);
    assertColumn(evalSimple("-2^2"), -4d);
    assertColumn(evalSimple("--c"), 1d, 2d);
    assertColumn(evalSimple("D*-3"), -9d, -30d);
    assertColumn(evalSimple("+c"), 1d, 2d);
    assertColumn(evalSimple("+c*+2"), 2d, 4d);
    assertColumn(evalSimple("-+c"), -1d, -2d);
    assertColumn(evalSimple("D-+c"), 2d, 8d);
    assertColumn(evalSimple("1.5e1 + c"), 16d, 17d);
    assertColumn(evalSimple("index(D,1-(c-1))"), 10d, 3d);
    assertColumn(evalSimple("if(c==1,log(c),-c)"), 0d, -2d);
    assertColumn(evalSimple("-(c+3)*(D-3)"), 0d, -35d);
    assertColumn(evalSimple("pow(c,2) + abs(-D)"), 4d, 14d);
    assertColumn(evalSimple("exp(c-1)"), 1d, Math.E);
    assertColumn(evalSimple("lag(c,42)"), 42d, 1d);
    assertScalar(-1.5d, evalSimple("mean(-c)"));
    assertScalar(0.7071068d, evalSimple("std(c)"));
    assertScalar(-9.0909091d, evalSimple("sum(c)-npv(.1,D)"));

    assertEquals(Kind.FLOAT64, evalSimple("c+D").getKind());
  }

  @Test
  public void testComparisons() throws Exception
  {
    assertColumn(evalSimple("c >=3 || D==10"), 0d, 1d);
    assertColumn(evalSimple("c>1 && D>3"), 0d, 1d);
    assertColumn(evalSimple("c<=1"), 1d, 0d);
    assertColumn(evalSimple("D<5"), 1d, 0d);
    assertColumn(evalSimple("c!=1"), 0d, 1d);
    assertColumn(evalSimple("c==c"), 1d, 1d);
    assertColumn(evalSimple("-c>-2"), 1d, 0d);
    assertColumn(evalSimple("c-1 || 0"), 0d, 1d);

    // && and || group from the left
    assertColumn(evalSimple("1||0&&0"), 0d);
    assertColumn(evalSimple("(1||0)&&0"), 0d);
    assertColumn(evalSimple("1||(0&&0)"), 1d);
    assertColumn(evalSimple("0&&0||1"), 1d);

    assertColumn(eval("f=='a'"), 0d, 1d, 0d, 0d);
    assertColumn(eval("f>'t'"), 1d, 0d, 1d, 0d);
    assertColumn(eval("'abc'<'abd'"), 1d);

    assertColumn(eval("dt > '3/25/2022'"), 0d, 0d, 1d, 1d);
    assertColumn(eval("dt >= '20220325'"), 0d, 1d, 1d, 1d);
    assertColumn(eval("dt == toDate('20230228')"), 0d, 0d, 0d, 1d);
    assertColumn(eval("'1/1/2022' < dt"), 0d, 1d, 1d, 1d);
  }

  @Test
  public void testErrors() throws Exception
  {
    assertThrows(TypeException.class, () -> eval("c + f"));
    assertThrows(TypeException.class, () -> eval("f * 2"));
    assertThrows(TypeException.class, () -> eval("dt > 5"));
    assertThrows(TypeException.class, () -> eval("f > 5"));
    assertThrows(TypeException.class, () -> eval("dt > 'abc'"));
    assertThrows(TypeException.class, () -> eval("log(f)"));

    DomainException de = assertThrows(DomainException.class,
                                      () -> eval("c/0"));
    assertEquals("/ by zero", de.getMessage());
    assertThrows(DomainException.class, () -> eval("log(c-1)"));

    assertThrows(LookupException.class, () -> eval("zz + 1"));
    assertThrows(ShapeException.class, () -> eval("c + range(0,3)"));
    assertThrows(ShapeException.class, () -> eval("if(range(0,3), c, D)"));

    // all failures share a common base
    assertTrue(EvalException.class.isAssignableFrom(TypeException.class));
    assertTrue(IllegalStateException.class.isAssignableFrom(
                   EvalException.class));
  }

  @Test
  public void testBroadcasting() throws Exception
  {
    TypedColumn scalar = eval("c + 1");
    TypedColumn full = eval("c + (c*0 + 1)");
    assertEquals(full.size(), scalar.size());
    for(int i = 0; i < full.size(); ++i) {
      assertEquals(full.getDouble(i), scalar.getDouble(i), DELTA);
    }

    for(String op : new String[]{"+", "-", "*", "/", "^", ">", ">=", "<",
                                 "<=", "==", "!=", "&&", "||"}) {
      assertSameColumn(eval("c" + op + "(c*0+2)"), eval("c" + op + "2"), op);
      assertSameColumn(eval("(c*0+2)" + op + "c"), eval("2" + op + "c"), op);
    }

    assertColumn(eval("1 + c"), 2d, 3d, 4d, 5d);
    assertColumn(eval("sum(c) - c"), 9d, 8d, 7d, 6d);
    assertColumn(eval("1 + 2"), 3d);
  }

  @Test
  public void testNegatedLeafLeavesPipeline() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();
    TypedColumn stored = pipeline.getColumn("c");

    assertColumn(calc.compute("-c", pipeline), -1d, -2d);
    assertColumn(calc.compute("-c+D", pipeline), 2d, 8d);
    assertSame(stored, pipeline.getColumn("c"));
    assertColumn(pipeline.getColumn("c"), 1d, 2d);
    assertColumn(calc.compute("c", pipeline), 1d, 2d);
  }

  @Test
  public void testReevaluation() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();
    OpNode root = calc.parse("c*D + sum(c)");

    TypedColumn first = calc.evaluate(root, pipeline);
    TypedColumn second = calc.evaluate(root, pipeline);
    assertColumn(first, 6d, 23d);
    assertColumn(second, 6d, 23d);

    // same tree, different data
    SimplePipeline other = new SimplePipeline()
      .addField("c", new DoubleColumn(2d), Role.CONTINUOUS)
      .addField("D", new DoubleColumn(5d), Role.CONTINUOUS);
    assertColumn(calc.evaluate(root, other), 12d);
  }

  @Test
  public void testComputedValues() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();
    OpNode root = calc.parse("c + cat(D)");
    assertNull(root.getComputedValue());

    calc.evaluate(root, pipeline);

    OpNode left = root.getChildren().get(0);
    OpNode right = root.getChildren().get(1);
    assertColumn(left.getComputedValue(), 1d, 2d);
    assertEquals(Role.CONTINUOUS, left.getRole());
    assertEquals(Kind.INT32, right.getComputedValue().getKind());
    assertEquals(Role.CATEGORICAL, right.getRole());
    assertEquals(Role.UNDETERMINED, root.getRole());
    assertColumn(root.getComputedValue(), 4d, 12d);
  }

  @Test
  public void testHoldOverride() throws Exception
  {
    Calculator calc = createCalculator();
    OpNode root = calc.parse("c + x");
    OpNode x = root.getChildren().get(1);
    x.setComputedValue(new DoubleColumn(5d));
    x.setHoldOverride(true);

    // x is not a field, but held
    assertColumn(calc.evaluate(root, createPipeline()), 6d, 7d);

    x.setHoldOverride(false);
    assertThrows(LookupException.class,
                 () -> calc.evaluate(root, createPipeline()));
  }

  @Test
  public void testReductionShape() throws Exception
  {
    final Function badSum = new Func1(summaryDesc("badSum", Kind.FLOAT64,
                                                  NUMERIC)) {
      @Override
      protected TypedColumn eval1(EvalContext ctx, TypedColumn param1) {
        return param1;
      }
    };
    FunctionLookup lookup = new FunctionLookup() {
      public Function getFunction(String name) {
        if("badsum".equalsIgnoreCase(name)) {
          return badSum;
        }
        return DefaultFunctions.LOOKUP.getFunction(name);
      }
    };
    Calculator calc = new CalculatorBuilder()
      .setFunctionLookup(lookup)
      .toCalculator();

    assertScalar(3d, calc.compute("badSum(1+2)", createPipeline()));
    assertThrows(EvalException.class,
                 () -> calc.compute("badSum(c)", createPipeline()));
  }

  private static TypedColumn evalSimple(String expr) {
    return eval(expr, createPipeline());
  }

  private static void assertSameColumn(TypedColumn expected,
                                       TypedColumn actual, String op) {
    assertEquals(expected.size(), actual.size(), op);
    for(int i = 0; i < expected.size(); ++i) {
      assertEquals(expected.getDouble(i), actual.getDouble(i), DELTA, op);
    }
  }
}
