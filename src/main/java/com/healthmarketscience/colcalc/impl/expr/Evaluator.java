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
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Evaluates {@link OpNode} trees bottom up, storing the computed column (and
 * role) on every node.  Nodes which are held keep their current value.
 *
 * @author James Ahlborn
 */
public class Evaluator
{
  private static final Log LOG = LogFactory.getLog(Evaluator.class);

  private Evaluator() {}

  /**
   * Evaluates the given tree within the given context.  If evaluation
   * fails, the nodes evaluated before the failure keep their new values.
   *
   * @return the computed value of the root node
   */
  public static TypedColumn evaluate(OpNode node, EvalContext ctx) {
    if(node.isHoldOverride()) {
      return node.getComputedValue();
    }

    Role role = Role.UNDETERMINED;
    TypedColumn result = null;
    if(node.isLeaf()) {
      String expr = node.getExpression();
      if(Expressionator.isNumericLiteral(expr)) {
        result = ColumnSupport.toColumn(Double.parseDouble(expr));
      } else if(Expressionator.isStringLiteral(expr)) {
        result = ColumnSupport.toColumn(
            StringUtils.remove(expr, OperatorScanner.QUOTE_CHAR));
      } else {
        result = ctx.getFieldValue(expr);
        role = ctx.getFieldRole(expr);
      }
    } else if(node.getOperator() != null) {
      List<OpNode> children = node.getChildren();
      TypedColumn left = evaluate(children.get(0), ctx);
      TypedColumn right = evaluate(children.get(1), ctx);
      result = BuiltinOperators.evaluate(ctx, node.getOperator(), left, right);
    } else {
      result = evaluateFunction(node, ctx);
      role = node.getFunction().getDescriptor().getRole();
    }

    if(node.isNegate()) {
      result = ColumnSupport.negate(result);
    }

    node.setComputedValue(result);
    node.setRole(role);

    if(LOG.isTraceEnabled()) {
      LOG.trace("Evaluated " + node + " to " + result);
    }
    return result;
  }

  private static TypedColumn evaluateFunction(OpNode node,
                                              final EvalContext ctx) {
    Function func = node.getFunction();
    List<OpNode> children = node.getChildren();
    TypedColumn[] params = new TypedColumn[children.size()];
    for(int i = 0; i < params.length; ++i) {
      final OpNode child = children.get(i);
      if(func.isDelayed()) {
        params[i] = new BaseDelayedColumn() {
          @Override
          protected TypedColumn eval() {
            return evaluate(child, ctx);
          }
        };
      } else {
        params[i] = evaluate(child, ctx);
      }
    }

    TypedColumn result = FunctionSupport.resolve(func.eval(ctx, node, params));

    FunctionDescriptor desc = func.getDescriptor();
    if(desc.isReduction() && !result.isScalar()) {
      throw new EvalException("Summary function " + func.getName() +
                              " produced " + result.size() + " values");
    }
    return result;
  }
}
