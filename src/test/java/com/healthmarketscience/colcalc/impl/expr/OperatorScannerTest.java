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

import com.healthmarketscience.colcalc.expr.Operator;
import com.healthmarketscience.colcalc.expr.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class OperatorScannerTest
{

  @Test
  public void testFindOperator() throws Exception
  {
    assertSplit("a+b-c", Operator.Precedence.ADDITIVE, Operator.PLUS, "a", "b-c");
    assertSplit("a*b/c", Operator.Precedence.MULTIPLICATIVE, Operator.DIVIDE,
                "a*b", "c");
    assertSplit("a^b^c", Operator.Precedence.POWER, Operator.POWER, "a", "b^c");
    assertSplit("a<=b", Operator.Precedence.COMPARISON, Operator.LESS_THAN_EQ,
                "a", "b");
    assertSplit("a!=b", Operator.Precedence.COMPARISON, Operator.NOT_EQUALS,
                "a", "b");
    assertSplit("a||b&&c", Operator.Precedence.LOGICAL, Operator.AND, "a||b",
                "c");
    assertSplit("(a+b)*c", Operator.Precedence.MULTIPLICATIVE,
                Operator.MULTIPLY, "(a+b)", "c");

    // nothing at the top level
    assertNull(OperatorScanner.findOperator("(a+b)", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("'a+b'", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("-a", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("a*-b", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("f(a,-b)", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("1e-5", Operator.Precedence.ADDITIVE));
    assertNull(OperatorScanner.findOperator("a+b", Operator.Precedence.MULTIPLICATIVE));

    // "e" is only an exponent marker after a number
    assertSplit("e-5", Operator.Precedence.ADDITIVE, Operator.MINUS, "e", "5");
    assertSplit("x1e-5", Operator.Precedence.ADDITIVE, Operator.MINUS, "x1e", "5");

    assertThrows(ParseException.class, () -> OperatorScanner.findOperator(
                     "a-", Operator.Precedence.ADDITIVE));
  }

  @Test
  public void testParens() throws Exception
  {
    assertTrue(OperatorScanner.isWrapped("(a+b)"));
    assertTrue(OperatorScanner.isWrapped("((a))"));
    assertFalse(OperatorScanner.isWrapped("(a)+(b)"));
    assertFalse(OperatorScanner.isWrapped("a"));
    assertFalse(OperatorScanner.isWrapped("()a"));

    assertEquals("a+b", OperatorScanner.stripOuterParens("((a+b))"));
    assertEquals("(a)+(b)", OperatorScanner.stripOuterParens("(a)+(b)"));

    assertEquals(3, OperatorScanner.findClosingParen("f(a)", 1));
    assertEquals(5, OperatorScanner.findClosingParen("f(')')) ", 1));
    assertEquals(-1, OperatorScanner.findClosingParen("f(a", 1));

    OperatorScanner.checkParens("f(a,(b))");
    OperatorScanner.checkParens("'('");
    assertThrows(ParseException.class,
                 () -> OperatorScanner.checkParens("f(a"));
    assertThrows(ParseException.class,
                 () -> OperatorScanner.checkParens(")("));
    assertThrows(ParseException.class,
                 () -> OperatorScanner.checkParens("'a"));
  }

  @Test
  public void testArguments() throws Exception
  {
    assertEquals(Collections.emptyList(), OperatorScanner.splitArguments(""));
    assertEquals(Arrays.asList("a"), OperatorScanner.splitArguments("a"));
    assertEquals(Arrays.asList("a", "f(b,c)", "'d,e'"),
                 OperatorScanner.splitArguments("a,f(b,c),'d,e'"));
    assertThrows(ParseException.class,
                 () -> OperatorScanner.splitArguments("a,,b"));
    assertThrows(ParseException.class,
                 () -> OperatorScanner.splitArguments("a,"));
  }

  @Test
  public void testWhitespace() throws Exception
  {
    assertEquals("a+b", OperatorScanner.stripWhitespace(" a +\tb\n"));
    assertEquals("concat(' a ',b)",
                 OperatorScanner.stripWhitespace("concat(' a ', b)"));
  }

  private static void assertSplit(String expr, Operator.Precedence prec,
                                  Operator op, String left, String right)
  {
    OperatorScanner.Split split = OperatorScanner.findOperator(expr, prec);
    assertNotNull(split, expr);
    assertSame(op, split.getOperator());
    assertEquals(left, split.getLeft());
    assertEquals(right, split.getRight());
  }
}
