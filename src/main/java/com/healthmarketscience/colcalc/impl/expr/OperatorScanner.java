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

import com.healthmarketscience.colcalc.expr.Operator;
import com.healthmarketscience.colcalc.expr.ParseException;

/**
 * Paren and quote aware scanning of expression text.  Expressions are split
 * recursively at their lowest precedence top-level operator, so the scanner
 * never builds a token list.
 *
 * @author James Ahlborn
 */
class OperatorScanner
{
  static final char QUOTE_CHAR = '\'';
  static final char OPEN_PAREN = '(';
  static final char CLOSE_PAREN = ')';
  static final char ARG_DELIM = ',';

  private static final byte IS_OP_FLAG =    0x01;
  private static final byte IS_SIGN_FLAG =  0x02;
  private static final byte IS_SPACE_FLAG = 0x04;
  private static final byte IS_DIGIT_FLAG = 0x08;

  private static final byte[] CHAR_FLAGS = new byte[128];

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '^', '&', '|', '>', '<', '=',
                '!');
    setCharFlag(IS_SIGN_FLAG, '+', '-');
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t');
    setCharFlag(IS_DIGIT_FLAG, '0', '1', '2', '3', '4', '5', '6', '7', '8', '9',
                '.');
  }

  /** the result of splitting an expression at a binary operator */
  static final class Split
  {
    private final Operator _op;
    private final String _left;
    private final String _right;

    Split(Operator op, String left, String right) {
      _op = op;
      _left = left;
      _right = right;
    }

    Operator getOperator() {
      return _op;
    }

    String getLeft() {
      return _left;
    }

    String getRight() {
      return _right;
    }

    @Override
    public String toString() {
      return "[" + _left + "] " + _op + " [" + _right + "]";
    }
  }

  private OperatorScanner() {}

  /**
   * Finds the top-level operator of the given precedence class at which the
   * given expression should be split.  Index 0 is never a split point and
   * two character operators are matched before single character ones.
   * Additive and power operators split at their leftmost occurrence (with
   * subtraction rewritten as addition of a negated operand, this gives the
   * usual grouping), the remaining classes at their rightmost occurrence,
   * which keeps them left associative.
   *
   * @return the split, or {@code null} if the class does not occur at the top
   *         level of the expression
   * @throws ParseException if an operator is missing its right operand
   */
  static Split findOperator(String expr, Operator.Precedence prec) {
    boolean leftmost = ((prec == Operator.Precedence.ADDITIVE) ||
                        (prec == Operator.Precedence.POWER));
    List<Operator> ops = prec.getOperators();

    Split found = null;
    int depth = 0;
    boolean inQuote = false;
    for(int i = 0; i < expr.length(); ++i) {
      char c = expr.charAt(i);
      if(c == QUOTE_CHAR) {
        inQuote = !inQuote;
        continue;
      }
      if(inQuote) {
        continue;
      }
      if(c == OPEN_PAREN) {
        ++depth;
        continue;
      }
      if(c == CLOSE_PAREN) {
        --depth;
        continue;
      }
      if((depth != 0) || (i == 0) || !isOpChar(c) || isSign(expr, i)) {
        continue;
      }

      Operator op = matchOperator(expr, i, ops);
      if(op == null) {
        continue;
      }

      int end = i + op.getSymbol().length();
      String left = expr.substring(0, i);
      String right = expr.substring(end);
      if(right.length() == 0) {
        throw new ParseException("Missing right operand for '" + op +
                                 "' in " + expr);
      }
      found = new Split(op, left, right);
      if(leftmost) {
        return found;
      }
      // skip the rest of a two character operator
      i = end - 1;
    }
    return found;
  }

  private static Operator matchOperator(String expr, int idx,
                                        List<Operator> ops) {
    // check 2-character operators first
    if((idx + 2) <= expr.length()) {
      Operator op = Operator.fromSymbol(expr.substring(idx, idx + 2));
      if((op != null) && ops.contains(op)) {
        return op;
      }
    }
    Operator op = Operator.fromSymbol(expr.substring(idx, idx + 1));
    return (((op != null) && ops.contains(op)) ? op : null);
  }

  /**
   * @return {@code true} if the '+' or '-' at the given index is the sign of
   *         an operand rather than a binary operator
   */
  private static boolean isSign(String expr, int idx) {
    if(!hasFlag(expr.charAt(idx), IS_SIGN_FLAG)) {
      return false;
    }
    char prev = expr.charAt(idx - 1);
    if(isOpChar(prev) || (prev == OPEN_PAREN) || (prev == ARG_DELIM)) {
      return true;
    }
    return (((prev == 'e') || (prev == 'E')) && isNumericPrefix(expr, idx - 1));
  }

  /**
   * @return {@code true} if the token ending just before the given exponent
   *         marker is a plain decimal number (e.g. the "1.5" in "1.5e-3")
   */
  private static boolean isNumericPrefix(String expr, int expIdx) {
    int start = expIdx;
    boolean sawDigit = false;
    while((start > 0) && hasFlag(expr.charAt(start - 1), IS_DIGIT_FLAG)) {
      --start;
      sawDigit |= (expr.charAt(start) != '.');
    }
    if(!sawDigit) {
      return false;
    }
    if(start == 0) {
      return true;
    }
    char prev = expr.charAt(start - 1);
    return (isOpChar(prev) || (prev == OPEN_PAREN) || (prev == ARG_DELIM));
  }

  /**
   * @return {@code true} if the given expression is entirely enclosed by a
   *         single pair of parentheses
   */
  static boolean isWrapped(String expr) {
    if((expr.length() < 2) || (expr.charAt(0) != OPEN_PAREN)) {
      return false;
    }
    return (findClosingParen(expr, 0) == (expr.length() - 1));
  }

  /**
   * @return the index of the paren closing the one at the given index, or -1
   *         if it is never closed
   */
  static int findClosingParen(String expr, int openIdx) {
    int depth = 0;
    boolean inQuote = false;
    for(int i = openIdx; i < expr.length(); ++i) {
      char c = expr.charAt(i);
      if(c == QUOTE_CHAR) {
        inQuote = !inQuote;
      } else if(!inQuote) {
        if(c == OPEN_PAREN) {
          ++depth;
        } else if(c == CLOSE_PAREN) {
          if(--depth == 0) {
            return i;
          }
        }
      }
    }
    return -1;
  }

  /**
   * Strips any number of parentheses which wrap the whole expression.
   */
  static String stripOuterParens(String expr) {
    while(isWrapped(expr)) {
      expr = expr.substring(1, expr.length() - 1);
    }
    return expr;
  }

  /**
   * Splits a function argument list on its top-level commas.
   *
   * @return the arguments, empty if the body is empty
   * @throws ParseException if any argument is empty
   */
  static List<String> splitArguments(String body) {
    List<String> args = new ArrayList<String>();
    if(body.length() == 0) {
      return args;
    }

    int depth = 0;
    boolean inQuote = false;
    int start = 0;
    for(int i = 0; i < body.length(); ++i) {
      char c = body.charAt(i);
      if(c == QUOTE_CHAR) {
        inQuote = !inQuote;
      } else if(!inQuote) {
        if(c == OPEN_PAREN) {
          ++depth;
        } else if(c == CLOSE_PAREN) {
          --depth;
        } else if((c == ARG_DELIM) && (depth == 0)) {
          args.add(checkArgument(body, body.substring(start, i)));
          start = i + 1;
        }
      }
    }
    args.add(checkArgument(body, body.substring(start)));
    return args;
  }

  private static String checkArgument(String body, String arg) {
    if(arg.length() == 0) {
      throw new ParseException("Empty argument in (" + body + ")");
    }
    return arg;
  }

  /**
   * @return the given expression with all whitespace outside of quoted
   *         strings removed
   */
  static String stripWhitespace(String expr) {
    StringBuilder sb = new StringBuilder(expr.length());
    boolean inQuote = false;
    for(int i = 0; i < expr.length(); ++i) {
      char c = expr.charAt(i);
      if(c == QUOTE_CHAR) {
        inQuote = !inQuote;
      } else if(!inQuote && hasFlag(c, IS_SPACE_FLAG)) {
        continue;
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * Verifies that the parentheses outside of quoted strings are balanced and
   * that every quoted string is terminated.
   *
   * @throws ParseException if they are not
   */
  static void checkParens(String expr) {
    int depth = 0;
    boolean inQuote = false;
    for(int i = 0; i < expr.length(); ++i) {
      char c = expr.charAt(i);
      if(c == QUOTE_CHAR) {
        inQuote = !inQuote;
      } else if(!inQuote) {
        if(c == OPEN_PAREN) {
          ++depth;
        } else if((c == CLOSE_PAREN) && (--depth < 0)) {
          break;
        }
      }
    }
    if(depth != 0) {
      throw new ParseException("mismatched parentheses in " + expr);
    }
    if(inQuote) {
      throw new ParseException("unterminated quoted string in " + expr);
    }
  }

  static boolean isOpChar(char c) {
    return hasFlag(c, IS_OP_FLAG);
  }

  private static boolean hasFlag(char c, byte flag) {
    return ((c < 128) && ((CHAR_FLAGS[c] & flag) != 0));
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }
}
