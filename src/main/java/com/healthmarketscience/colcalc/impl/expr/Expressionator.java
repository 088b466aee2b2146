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
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.FunctionDescriptor;
import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Operator;
import com.healthmarketscience.colcalc.expr.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import static com.healthmarketscience.colcalc.impl.expr.OperatorScanner.*;

/**
 * Builds {@link OpNode} trees from expression text.  The text is split
 * recursively at its lowest precedence top-level operator, function calls
 * are resolved using the given {@link FunctionLookup} and everything else
 * becomes a leaf.  Building a tree never touches any data.
 *
 * @author James Ahlborn
 */
public class Expressionator
{
  private static final Log LOG = LogFactory.getLog(Expressionator.class);

  private static final char NEG_CHAR = '-';
  private static final char POS_CHAR = '+';
  private static final Pattern FUNC_NAME_PAT =
    Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

  /** the classes which take a leading minus sign onto their first operand */
  private static final List<Operator.Precedence> FIRST_OPERAND_NEG_PRECS =
    Arrays.asList(Operator.Precedence.LOGICAL, Operator.Precedence.COMPARISON,
                  Operator.Precedence.ADDITIVE);

  private Expressionator() {}

  /**
   * Parses the given expression into a new tree.
   *
   * @throws ParseException if the expression is malformed, calls an unknown
   *         function or calls a function with the wrong number of arguments
   */
  public static OpNode parse(String exprStr, FunctionLookup lookup) {
    String expr = stripWhitespace((exprStr != null) ? exprStr : "");
    checkParens(expr);

    OpNode root = buildTree(expr, lookup);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Parsed expression '" + exprStr + "' as " +
                root.toDebugString());
    }
    return root;
  }

  private static OpNode buildTree(String expr, FunctionLookup lookup) {
    expr = stripOuterParens(expr);
    if(expr.length() == 0) {
      throw new ParseException("Empty expression");
    }

    if(expr.charAt(0) == NEG_CHAR) {
      return buildNegated(expr.substring(1), lookup);
    }
    if(expr.charAt(0) == POS_CHAR) {
      if(expr.length() == 1) {
        throw new ParseException("Missing operand for '" + POS_CHAR + "'");
      }
      return buildTree(expr.substring(1), lookup);
    }

    OpNode funcNode = parseFunction(expr, lookup);
    if(funcNode != null) {
      return funcNode;
    }

    for(Operator.Precedence prec : Operator.Precedence.values()) {
      Split split = findOperator(expr, prec);
      if(split != null) {
        return buildOperator(expr, split, lookup);
      }
    }

    return buildLeaf(expr);
  }

  private static OpNode buildNegated(String expr, FunctionLookup lookup) {
    if(expr.length() == 0) {
      throw new ParseException("Missing operand for '" + NEG_CHAR + "'");
    }

    if(!isWrapped(expr)) {
      // "-a+b" is "(-a)+b", not "-(a+b)"
      for(Operator.Precedence prec : Operator.Precedence.values()) {
        Split split = findOperator(expr, prec);
        if(split == null) {
          continue;
        }
        if(FIRST_OPERAND_NEG_PRECS.contains(prec)) {
          return buildOperator(
              NEG_CHAR + expr,
              new Split(split.getOperator(), NEG_CHAR + split.getLeft(),
                        split.getRight()), lookup);
        }
        break;
      }
    }

    return negate(buildTree(expr, lookup));
  }

  private static OpNode buildOperator(String expr, Split split,
                                      FunctionLookup lookup) {
    Operator op = split.getOperator();
    String right = split.getRight();
    if(op == Operator.MINUS) {
      // a-b is handled as a+(-b)
      op = Operator.PLUS;
      right = NEG_CHAR + right;
    }

    List<OpNode> children = Arrays.asList(
        buildTree(split.getLeft(), lookup), buildTree(right, lookup));
    return new OpNode(expr, op, null, false, children);
  }

  private static OpNode parseFunction(String expr, FunctionLookup lookup) {
    int parenIdx = expr.indexOf(OPEN_PAREN);
    if(parenIdx <= 0) {
      return null;
    }

    String name = expr.substring(0, parenIdx);
    if(!FUNC_NAME_PAT.matcher(name).matches() ||
       (findClosingParen(expr, parenIdx) != (expr.length() - 1))) {
      return null;
    }

    Function func = lookup.getFunction(name);
    if(func == null) {
      throw new ParseException("Unknown function '" + name + "'");
    }

    List<String> args = splitArguments(
        expr.substring(parenIdx + 1, expr.length() - 1));
    FunctionDescriptor desc = func.getDescriptor();
    if(!desc.isVariadic() && (desc.getNumArgs() != args.size())) {
      throw new ParseException(
          "Wrong number of arguments for function '" + name + "', expected " +
          desc.getNumArgs() + " but was " + args.size());
    }

    List<OpNode> children = new ArrayList<OpNode>(args.size());
    for(String arg : args) {
      children.add(buildTree(arg, lookup));
    }
    return new OpNode(expr, null, func, false, children);
  }

  private static OpNode buildLeaf(String expr) {
    if((expr.indexOf(QUOTE_CHAR) < 0) &&
       ((expr.indexOf(OPEN_PAREN) >= 0) || (expr.indexOf(CLOSE_PAREN) >= 0) ||
        (expr.indexOf(ARG_DELIM) >= 0))) {
      throw new ParseException("Invalid expression '" + expr + "'");
    }
    return new OpNode(expr, null, null, false, null);
  }

  private static OpNode negate(OpNode node) {
    return new OpNode(node.getExpression(), node.getOperator(),
                      node.getFunction(), !node.isNegate(),
                      node.getChildren());
  }

  /**
   * @return {@code true} if the given leaf text is a numeric constant
   */
  public static boolean isNumericLiteral(String expr) {
    return ColumnSupport.isNumber(expr);
  }

  /**
   * @return {@code true} if the given leaf text is a quoted string constant
   */
  public static boolean isStringLiteral(String expr) {
    return (expr.indexOf(QUOTE_CHAR) >= 0);
  }
}
