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

package com.healthmarketscience.colcalc.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node in a parsed expression tree.  A node is either a leaf (a numeric
 * constant, a quoted string constant or a field reference), a binary
 * operator with two children or a function call with one child per
 * argument.
 * <p/>
 * The structure of a tree is fixed once it is built.  Only the computed
 * value, the role and the hold flag change during evaluation, so a single
 * tree must not be evaluated by more than one caller at a time (copy it
 * first).
 *
 * @author James Ahlborn
 */
public class OpNode
{
  private final String _expression;
  private final Operator _operator;
  private final Function _function;
  private final boolean _negate;
  private final List<OpNode> _children;
  private TypedColumn _computedValue;
  private Role _role = Role.UNDETERMINED;
  private boolean _holdOverride;

  public OpNode(String expression, Operator operator, Function function,
                boolean negate, List<OpNode> children)
  {
    if((operator != null) && (function != null)) {
      throw new IllegalArgumentException(
          "node cannot be both an operator and a function");
    }
    _expression = expression;
    _operator = operator;
    _function = function;
    _negate = negate;
    _children = ((children != null) ?
                 Collections.unmodifiableList(new ArrayList<OpNode>(children)) :
                 Collections.<OpNode>emptyList());
  }

  /**
   * @return the (whitespace free) text this node was built from, without
   *         any leading negation
   */
  public String getExpression() {
    return _expression;
  }

  public Operator getOperator() {
    return _operator;
  }

  public Function getFunction() {
    return _function;
  }

  public boolean isNegate() {
    return _negate;
  }

  public List<OpNode> getChildren() {
    return _children;
  }

  public boolean isLeaf() {
    return ((_operator == null) && (_function == null));
  }

  /**
   * @return the value computed by the last evaluation of this node, or
   *         {@code null} if it has not been evaluated
   */
  public TypedColumn getComputedValue() {
    return _computedValue;
  }

  public void setComputedValue(TypedColumn computedValue) {
    _computedValue = computedValue;
  }

  public Role getRole() {
    return _role;
  }

  public void setRole(Role role) {
    _role = ((role != null) ? role : Role.UNDETERMINED);
  }

  /**
   * @return {@code true} if the computed value of this node is pinned and
   *         must not be recomputed during evaluation
   */
  public boolean isHoldOverride() {
    return _holdOverride;
  }

  public void setHoldOverride(boolean holdOverride) {
    _holdOverride = holdOverride;
  }

  /**
   * @return a compact, fully parenthesized rendering of the structure of
   *         this tree, e.g. {@code (c + (-D * 2))}
   */
  public String toDebugString() {
    StringBuilder sb = new StringBuilder();
    toDebugString(sb);
    return sb.toString();
  }

  private void toDebugString(StringBuilder sb) {
    if(_negate) {
      sb.append("-");
    }
    if(isLeaf()) {
      sb.append(_expression);
      return;
    }
    if(_operator != null) {
      sb.append("(");
      _children.get(0).toDebugString(sb);
      sb.append(" ").append(_operator.getSymbol()).append(" ");
      _children.get(1).toDebugString(sb);
      sb.append(")");
      return;
    }
    sb.append(_function.getName()).append("(");
    for(int i = 0; i < _children.size(); ++i) {
      if(i > 0) {
        sb.append(", ");
      }
      _children.get(i).toDebugString(sb);
    }
    sb.append(")");
  }

  @Override
  public String toString() {
    return (_negate ? "-" : "") + _expression;
  }
}
