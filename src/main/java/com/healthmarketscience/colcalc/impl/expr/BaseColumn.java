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

import com.healthmarketscience.colcalc.expr.TypeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;

/**
 *
 * @author James Ahlborn
 */
public abstract class BaseColumn implements TypedColumn
{
  private static final int MAX_DISPLAY_VALUES = 10;

  protected BaseColumn() {}

  protected static int checkSize(int size) {
    if(size < 1) {
      throw new IllegalArgumentException(
          "columns must have at least one value");
    }
    return size;
  }

  @Override
  public boolean isScalar() {
    return (size() == 1);
  }

  @Override
  public boolean isNumeric() {
    return getKind().isNumeric();
  }

  @Override
  public double getDouble(int idx) {
    throw invalidAccess(Kind.FLOAT64);
  }

  @Override
  public String getString(int idx) {
    throw invalidAccess(Kind.STRING);
  }

  @Override
  public LocalDateTime getTimestamp(int idx) {
    throw invalidAccess(Kind.TIMESTAMP);
  }

  protected TypeException invalidAccess(Kind kind) {
    return new TypeException(
        this + " cannot be accessed as " + kind);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder()
      .append("Column[").append(getKind()).append("] [");
    int num = Math.min(size(), MAX_DISPLAY_VALUES);
    for(int i = 0; i < num; ++i) {
      if(i > 0) {
        sb.append(", ");
      }
      sb.append(get(i));
    }
    if(num < size()) {
      sb.append(", ...");
    }
    return sb.append("]").toString();
  }
}
