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
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.util.SimplePipeline;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class TreeCopierTest
{

  @Test
  public void testCopy() throws Exception
  {
    Calculator calc = createCalculator();
    OpNode root = calc.parse("-c*D + sum(c) - lag(c, 0)");

    OpNode copy = TreeCopier.copy(root);
    assertNotSame(root, copy);
    assertEquals(root.toDebugString(), copy.toDebugString());
    assertNull(copy.getComputedValue());

    // a copy evaluates exactly like the original
    assertColumn(calc.evaluate(root, createPipeline()), 0d, -18d);
    assertColumn(calc.evaluate(copy, createPipeline()), 0d, -18d);
    assertSame(root.getChildren().get(1).getChildren().get(0).getFunction(),
               copy.getChildren().get(1).getChildren().get(0).getFunction());
  }

  @Test
  public void testIndependence() throws Exception
  {
    Calculator calc = createCalculator();
    OpNode root = calc.parse("cat(c) + D");
    calc.evaluate(root, createPipeline());
    root.getChildren().get(1).setHoldOverride(true);

    OpNode copy = calc.copy(root);
    assertColumn(copy.getComputedValue(), 4d, 12d);
    assertNotSame(root.getComputedValue(), copy.getComputedValue());
    assertEquals(Role.CATEGORICAL, copy.getChildren().get(0).getRole());
    assertTrue(copy.getChildren().get(1).isHoldOverride());

    // re-evaluating the copy against other data leaves the original alone
    copy.getChildren().get(1).setHoldOverride(false);
    SimplePipeline other = new SimplePipeline()
      .addField("c", new DoubleColumn(7d), Role.CONTINUOUS)
      .addField("D", new DoubleColumn(1d), Role.CONTINUOUS);
    assertColumn(calc.evaluate(copy, other), 8d);
    assertColumn(root.getComputedValue(), 4d, 12d);
    assertColumn(root.getChildren().get(1).getComputedValue(), 3d, 10d);
    assertTrue(root.getChildren().get(1).isHoldOverride());
  }
}
