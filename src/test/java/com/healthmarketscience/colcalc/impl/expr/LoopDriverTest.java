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
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.colcalc.Calculator;
import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.impl.CalculatorImpl;
import com.healthmarketscience.colcalc.impl.PipelineEvalContext;
import com.healthmarketscience.colcalc.util.SimplePipeline;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static com.healthmarketscience.colcalc.impl.expr.ExpressionatorTest.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class LoopDriverTest
{

  @Test
  public void testLoop() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();

    calc.loop("x", 1, 3, Arrays.asList("D*x", "1-r+x", "c+x"),
              Arrays.asList("r", "y", "c"), pipeline);

    assertColumn(pipeline.getColumn("r"), 6d, 20d);
    assertColumn(pipeline.getColumn("y"), -3d, -17d);
    assertColumn(pipeline.getColumn("c"), 4d, 5d);
    assertColumn(pipeline.getColumn("D"), 3d, 10d);
    assertNull(pipeline.getColumn("x"));
    assertEquals(Arrays.asList("D", "r", "y", "c"), pipeline.getFieldNames());
    assertEquals(Role.CONTINUOUS, pipeline.getRole("r"));
  }

  @Test
  public void testLoopVariable() throws Exception
  {
    Calculator calc = createCalculator();
    SimplePipeline pipeline = createPipeline();

    // negated references see the negated value
    calc.loop("x", 0, 2, Arrays.asList("-x + c"), Arrays.asList("z"),
              pipeline);
    assertColumn(pipeline.getColumn("z"), 0d, 1d);

    // the loop variable shadows a field of the same name
    calc.loop("c", 2, 3, Arrays.asList("c*10"), Arrays.asList("z"), pipeline);
    assertColumn(pipeline.getColumn("z"), 20d, 20d);
    assertColumn(pipeline.getColumn("c"), 1d, 2d);

    // empty range does nothing
    calc.loop("x", 3, 3, Arrays.asList("x"), Arrays.asList("w"), pipeline);
    assertNull(pipeline.getColumn("w"));

    assertThrows(EvalException.class,
                 () -> calc.loop("x", 0, 1, Arrays.asList("x", "x+1"),
                                 Collections.singletonList("w"), pipeline));
  }

  @Test
  public void testHoldsCleared() throws Exception
  {
    SimplePipeline pipeline = createPipeline();
    PipelineEvalContext ctx = new PipelineEvalContext(new CalculatorImpl(),
                                                      pipeline);

    OpNode body = parse("c + x*2");
    OpNode x = body.getChildren().get(1).getChildren().get(0);
    assertEquals("x", x.getExpression());

    LoopDriver.loop(ctx, "x", 0, 3, Collections.singletonList(body),
                    Collections.singletonList("q"));
    assertColumn(pipeline.getColumn("q"), 5d, 6d);
    assertFalse(x.isHoldOverride());
    assertColumn(x.getComputedValue(), 2d);

    // failures leave the completed iterations and release the holds
    List<OpNode> bodies = Collections.singletonList(parse("x/(x-2)"));
    assertThrows(DomainException.class,
                 () -> LoopDriver.loop(ctx, "x", 1, 4, bodies,
                                       Collections.singletonList("p")));
    assertColumn(pipeline.getColumn("p"), -1d, -1d);
    OpNode root = bodies.get(0);
    assertFalse(root.getChildren().get(0).isHoldOverride());
  }
}
