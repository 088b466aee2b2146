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

import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Operator;
import com.healthmarketscience.colcalc.expr.ParseException;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.colcalc.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class ExpressionatorTest
{

  @Test
  public void testOrderOfOperations() throws Exception
  {
    assertEquals("(a + (b * c))", parseDebug("a+b*c"));
    assertEquals("((a + b) * c)", parseDebug("(a+b)*c"));
    assertEquals("(a * (b ^ c))", parseDebug("a*b^c"));
    assertEquals("((a < b) && (c >= d))", parseDebug("a<b && c>=d"));
    assertEquals("((a && b) || c)", parseDebug("a&&b||c"));
    assertEquals("((a < b) == c)", parseDebug("a<b==c"));
    assertEquals("((a / b) / c)", parseDebug("a/b/c"));
    assertEquals("((a * b) / c)", parseDebug("a*b/c"));
    assertEquals("(2 ^ (3 ^ 2))", parseDebug("2^3^2"));
    assertEquals("(a + (-b + -c))", parseDebug("a-b-c"));
    assertEquals("(c + (-D + -D))", parseDebug("c-D-D"));
    assertEquals("c", parseDebug("((c))"));
  }

  @Test
  public void testNegation() throws Exception
  {
    assertEquals("-c", parseDebug("-c"));
    assertEquals("-c", parseDebug(" - c "));
    assertEquals("c", parseDebug("--c"));
    assertEquals("(-a + b)", parseDebug("-a+b"));
    assertEquals("-(a * b)", parseDebug("-a*b"));
    assertEquals("(-(D * 3) + D)", parseDebug("-D*3 + D"));
    assertEquals("-(2 ^ 2)", parseDebug("-2^2"));
    assertEquals("(-c > 3)", parseDebug("-c>3"));
    assertEquals("(-(c * 3) > 3)", parseDebug("-c*3>3"));
    assertEquals("(-a && b)", parseDebug("-a&&b"));
    assertEquals("-(a + b)", parseDebug("-(a+b)"));
    assertEquals("-((c + 3) * (D + -3))", parseDebug("-(c+3)*(D-3)"));
    assertEquals("(D * -3)", parseDebug("D*-3"));
    assertEquals("(c >= -3)", parseDebug("c>=-3"));
    assertEquals("(1 + (-r + x))", parseDebug("1-r+x"));

    OpNode node = parse("-c");
    assertTrue(node.isNegate());
    assertTrue(node.isLeaf());
    assertEquals("c", node.getExpression());
    assertEquals("-c", node.toString());
  }

  @Test
  public void testFunctions() throws Exception
  {
    assertEquals("log(c)", parseDebug("log(c)"));
    assertEquals("log(c)", parseDebug("LOG(c)"));
    assertEquals("if((c == 1), log(c), -c)", parseDebug("if(c==1,log(c),-c)"));
    assertEquals("(sum(c) + -npv(.1, D))", parseDebug("sum(c)-npv(.1,D)"));
    assertEquals("index(D, (1 + -(c + -1)))", parseDebug("index(D,1-(c-1))"));
    assertEquals("(max(c) * 2)", parseDebug("max(c)*2"));
    assertEquals("newPlot()", parseDebug("newPlot()"));

    OpNode node = parse("Sum(c)");
    assertSame(DefaultNumberFunctions.SUM, node.getFunction());
    assertNull(node.getOperator());
    assertEquals(1, node.getChildren().size());
    assertEquals("Sum(c)", node.getExpression());

    node = parse("c+D");
    assertSame(Operator.PLUS, node.getOperator());
    assertNull(node.getFunction());
    assertEquals(2, node.getChildren().size());
  }

  @Test
  public void testLiterals() throws Exception
  {
    assertEquals("(1.5e-3 + x)", parseDebug("1.5e-3+x"));
    assertEquals("(2E+2 * x)", parseDebug("2E+2*x"));
    assertEquals("(c + 'x+y')", parseDebug("c + 'x+y'"));
    assertEquals("' a b '", parseDebug("' a b '"));
    assertEquals("c", parseDebug("+c"));
    assertEquals("(c * 2)", parseDebug("c*+2"));
    assertEquals("toDate('3/25/2022')", parseDebug("toDate('3/25/2022')"));
    assertEquals("concat('a,b', c)", parseDebug("concat('a,b',c)"));

    assertTrue(Expressionator.isNumericLiteral("1.5e-3"));
    assertTrue(Expressionator.isNumericLiteral(".1"));
    assertTrue(Expressionator.isNumericLiteral("42"));
    assertFalse(Expressionator.isNumericLiteral("e1"));
    assertFalse(Expressionator.isNumericLiteral("c"));
    assertTrue(Expressionator.isStringLiteral("'c'"));
    assertFalse(Expressionator.isStringLiteral("c"));
  }

  @Test
  public void testParseErrors() throws Exception
  {
    assertParseError("", "Empty expression");
    assertParseError("()", "Empty expression");
    assertParseError("   ", "Empty expression");
    assertParseError("(a+b", "mismatched parentheses");
    assertParseError("a+b)", "mismatched parentheses");
    assertParseError(")a(", "mismatched parentheses");
    assertParseError("'abc", "unterminated quoted string");
    assertParseError("foo(1)", "Unknown function 'foo'");
    assertParseError("log(1,2)", "Wrong number of arguments");
    assertParseError("if(c,1)", "Wrong number of arguments");
    assertParseError("a+", "Missing right operand");
    assertParseError("a*", "Missing right operand");
    assertParseError("-", "Missing operand");
    assertParseError("+", "Missing operand");
    assertParseError("max(,c)", "Empty argument");
    assertParseError("lag(c,)", "Empty argument");
    assertParseError("a(b)c", "Invalid expression");
    assertParseError("a,b", "Invalid expression");
  }

  private static void assertParseError(String expr, String msg) {
    ParseException e = assertThrows(ParseException.class, () -> parse(expr),
                                    expr);
    assertTrue(e.getMessage().contains(msg),
               "expected '" + msg + "' in '" + e.getMessage() + "'");
  }

  static OpNode parse(String expr) {
    return Expressionator.parse(expr, DefaultFunctions.LOOKUP);
  }

  static String parseDebug(String expr) {
    return parse(expr).toDebugString();
  }

  static TypedColumn eval(String expr) {
    return eval(expr, createWidePipeline());
  }

  static TypedColumn eval(String expr, Pipeline pipeline) {
    return createCalculator().compute(expr, pipeline);
  }
}
