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
import com.healthmarketscience.colcalc.expr.OpNode;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Repeatedly evaluates a set of trees for each value of a loop variable,
 * appending each result to the pipeline before the next tree is evaluated
 * (so later trees, and later iterations, see the new values).
 *
 * @author James Ahlborn
 */
public class LoopDriver
{
  private static final Log LOG = LogFactory.getLog(LoopDriver.class);

  private LoopDriver() {}

  /**
   * Runs the loop for {@code start <= var < end}.  Leaves naming the loop
   * variable are held at the current value of the variable (shadowing any
   * pipeline field of the same name).  The loop variable itself is never
   * added to the pipeline.
   *
   * @param bodies the trees to evaluate on each iteration, in order
   * @param targets the field receiving the result of the corresponding tree
   */
  public static void loop(EvalContext ctx, String var, int start, int end,
                          List<OpNode> bodies, List<String> targets)
  {
    if(bodies.size() != targets.size()) {
      throw new EvalException("Loop has " + bodies.size() +
                              " expressions but " + targets.size() +
                              " target fields");
    }

    PipelineAdapter adapter = new PipelineAdapter(ctx.getPipeline());
    try {
      for(int i = start; i < end; ++i) {
        if(LOG.isDebugEnabled()) {
          LOG.debug("Loop " + var + " = " + i);
        }
        for(int j = 0; j < bodies.size(); ++j) {
          OpNode body = bodies.get(j);
          pin(body, var, i);
          Evaluator.evaluate(body, ctx);
          adapter.append(body, targets.get(j));
        }
      }
    } finally {
      for(OpNode body : bodies) {
        unpin(body);
      }
    }
  }

  private static void pin(OpNode node, String var, int val) {
    if(node.isLeaf()) {
      if(var.equals(node.getExpression())) {
        node.setComputedValue(ColumnSupport.toColumn(
                                  node.isNegate() ? -val : val));
        node.setHoldOverride(true);
      }
      return;
    }
    for(OpNode child : node.getChildren()) {
      pin(child, var, val);
    }
  }

  private static void unpin(OpNode node) {
    node.setHoldOverride(false);
    for(OpNode child : node.getChildren()) {
      unpin(child);
    }
  }
}
