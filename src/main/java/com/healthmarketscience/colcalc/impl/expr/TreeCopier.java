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

import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.TypedColumn;

/**
 * Deep copies {@link OpNode} trees so that they can be evaluated
 * independently.
 *
 * @author James Ahlborn
 */
public class TreeCopier
{
  private TreeCopier() {}

  public static OpNode copy(OpNode node) {
    List<OpNode> children = new ArrayList<OpNode>(node.getChildren().size());
    for(OpNode child : node.getChildren()) {
      children.add(copy(child));
    }

    OpNode copy = new OpNode(node.getExpression(), node.getOperator(),
                             node.getFunction(), node.isNegate(), children);
    TypedColumn val = node.getComputedValue();
    copy.setComputedValue((val != null) ? val.copy() : null);
    copy.setRole(node.getRole());
    copy.setHoldOverride(node.isHoldOverride());
    return copy;
  }
}
