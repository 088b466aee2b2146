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
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The binary operators supported by the expression grammar, grouped into
 * precedence classes.
 *
 * @author James Ahlborn
 */
public enum Operator
{
  AND("&&", Precedence.LOGICAL),
  OR("||", Precedence.LOGICAL),
  GREATER_THAN(">", Precedence.COMPARISON),
  GREATER_THAN_EQ(">=", Precedence.COMPARISON),
  LESS_THAN("<", Precedence.COMPARISON),
  LESS_THAN_EQ("<=", Precedence.COMPARISON),
  EQUALS("==", Precedence.COMPARISON),
  NOT_EQUALS("!=", Precedence.COMPARISON),
  PLUS("+", Precedence.ADDITIVE),
  MINUS("-", Precedence.ADDITIVE),
  MULTIPLY("*", Precedence.MULTIPLICATIVE),
  DIVIDE("/", Precedence.MULTIPLICATIVE),
  POWER("^", Precedence.POWER);

  /** precedence classes, declared from lowest to highest */
  public enum Precedence
  {
    LOGICAL, COMPARISON, ADDITIVE, MULTIPLICATIVE, POWER;

    public List<Operator> getOperators() {
      return PRECEDENCE_OPS.get(this);
    }
  }

  private static final Map<String,Operator> SYMBOLS =
    new HashMap<String,Operator>();
  private static final Map<Precedence,List<Operator>> PRECEDENCE_OPS =
    new EnumMap<Precedence,List<Operator>>(Precedence.class);

  static {
    for(Precedence prec : Precedence.values()) {
      PRECEDENCE_OPS.put(prec, new ArrayList<Operator>());
    }
    for(Operator op : values()) {
      SYMBOLS.put(op._symbol, op);
      PRECEDENCE_OPS.get(op._precedence).add(op);
    }
    for(Precedence prec : Precedence.values()) {
      PRECEDENCE_OPS.put(prec,
                         Collections.unmodifiableList(PRECEDENCE_OPS.get(prec)));
    }
  }

  private final String _symbol;
  private final Precedence _precedence;

  private Operator(String symbol, Precedence precedence) {
    _symbol = symbol;
    _precedence = precedence;
  }

  public String getSymbol() {
    return _symbol;
  }

  public Precedence getPrecedence() {
    return _precedence;
  }

  public boolean isComparison() {
    return (_precedence == Precedence.COMPARISON);
  }

  public boolean isLogical() {
    return (_precedence == Precedence.LOGICAL);
  }

  /**
   * @return the operator with the given symbol, or {@code null} if none
   */
  public static Operator fromSymbol(String symbol) {
    return SYMBOLS.get(symbol);
  }

  @Override
  public String toString() {
    return _symbol;
  }
}
