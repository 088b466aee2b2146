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

import java.time.LocalDateTime;

import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Operator;
import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;


/**
 * Elementwise implementations of the binary operators.  All operators
 * broadcast scalar operands and produce FLOAT64 columns (comparisons and
 * logicals produce 0/1).
 *
 * @author James Ahlborn
 */
public class BuiltinOperators
{
  private static final String DIV_BY_ZERO = "/ by zero";

  private enum CompareType {
    NUMERIC, STRING, TEMPORAL;
  }

  private interface NumOp {
    double apply(double v1, double v2);
  }

  private BuiltinOperators() {}

  public static TypedColumn evaluate(EvalContext ctx, Operator op,
                                     TypedColumn param1, TypedColumn param2)
  {
    switch(op) {
    case PLUS:
      return add(param1, param2);
    case MINUS:
      return subtract(param1, param2);
    case MULTIPLY:
      return multiply(param1, param2);
    case DIVIDE:
      return divide(param1, param2);
    case POWER:
      return pow(param1, param2);
    case AND:
      return and(param1, param2);
    case OR:
      return or(param1, param2);
    default:
      return compare(ctx, op, param1, param2);
    }
  }

  public static TypedColumn add(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.PLUS, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return v1 + v2;
      }
    });
  }

  public static TypedColumn subtract(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.MINUS, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return v1 - v2;
      }
    });
  }

  public static TypedColumn multiply(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.MULTIPLY, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return v1 * v2;
      }
    });
  }

  public static TypedColumn divide(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.DIVIDE, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        if(v2 == 0d) {
          throw new DomainException(DIV_BY_ZERO);
        }
        return v1 / v2;
      }
    });
  }

  public static TypedColumn pow(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.POWER, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return Math.pow(v1, v2);
      }
    });
  }

  public static TypedColumn and(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.AND, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return toDouble((v1 > 0d) && (v2 > 0d));
      }
    });
  }

  public static TypedColumn or(TypedColumn param1, TypedColumn param2) {
    return arithmetic(Operator.OR, param1, param2, new NumOp() {
      public double apply(double v1, double v2) {
        return toDouble((v1 > 0d) || (v2 > 0d));
      }
    });
  }

  public static TypedColumn compare(EvalContext ctx, Operator op,
                                    TypedColumn param1, TypedColumn param2)
  {
    CompareType cmpType = getCompareType(op, param1, param2);
    Broadcast bc = Broadcast.of(param1, param2);
    double[] vals = new double[bc.getLength()];
    for(int i = 0; i < vals.length; ++i) {
      int idx1 = bc.index(0, i);
      int idx2 = bc.index(1, i);
      switch(cmpType) {
      case NUMERIC:
        vals[i] = toDouble(compareNumbers(op, param1.getDouble(idx1),
                                          param2.getDouble(idx2)));
        break;
      case STRING:
        vals[i] = toDouble(isCompareTrue(
            op, param1.getString(idx1).compareTo(param2.getString(idx2))));
        break;
      case TEMPORAL:
        LocalDateTime ldt1 = ColumnSupport.getAsTimestamp(
            param1, idx1, ctx.getTemporalConfig());
        LocalDateTime ldt2 = ColumnSupport.getAsTimestamp(
            param2, idx2, ctx.getTemporalConfig());
        vals[i] = toDouble(isCompareTrue(op, ldt1.compareTo(ldt2)));
        break;
      default:
        throw new IllegalStateException("unknown compare type " + cmpType);
      }
    }
    return new DoubleColumn(vals);
  }

  private static CompareType getCompareType(
      Operator op, TypedColumn param1, TypedColumn param2)
  {
    Kind kind1 = param1.getKind();
    Kind kind2 = param2.getKind();
    if(kind1.isNumeric() && kind2.isNumeric()) {
      return CompareType.NUMERIC;
    }
    if((kind1 == Kind.STRING) && (kind2 == Kind.STRING)) {
      return CompareType.STRING;
    }
    if(((kind1 == Kind.TIMESTAMP) || (kind2 == Kind.TIMESTAMP)) &&
       !kind1.isNumeric() && !kind2.isNumeric()) {
      // strings compared with dates are parsed as dates
      return CompareType.TEMPORAL;
    }
    throw invalidOperands(op, param1, param2);
  }

  private static boolean compareNumbers(Operator op, double v1, double v2) {
    switch(op) {
    case GREATER_THAN:
      return v1 > v2;
    case GREATER_THAN_EQ:
      return v1 >= v2;
    case LESS_THAN:
      return v1 < v2;
    case LESS_THAN_EQ:
      return v1 <= v2;
    case EQUALS:
      return v1 == v2;
    case NOT_EQUALS:
      return v1 != v2;
    default:
      throw new IllegalStateException("not a comparison " + op);
    }
  }

  private static boolean isCompareTrue(Operator op, int cmp) {
    return compareNumbers(op, cmp, 0);
  }

  private static TypedColumn arithmetic(Operator op, TypedColumn param1,
                                        TypedColumn param2, NumOp numOp)
  {
    if(!param1.isNumeric() || !param2.isNumeric()) {
      throw invalidOperands(op, param1, param2);
    }
    Broadcast bc = Broadcast.of(param1, param2);
    double[] vals = new double[bc.getLength()];
    for(int i = 0; i < vals.length; ++i) {
      vals[i] = numOp.apply(param1.getDouble(bc.index(0, i)),
                            param2.getDouble(bc.index(1, i)));
    }
    return new DoubleColumn(vals);
  }

  private static TypeException invalidOperands(
      Operator op, TypedColumn param1, TypedColumn param2) {
    return new TypeException("Cannot apply '" + op + "' to " +
                             param1.getKind() + " and " + param2.getKind());
  }

  private static double toDouble(boolean b) {
    return (b ? 1d : 0d);
  }
}
