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

import com.healthmarketscience.colcalc.expr.TypedColumn;

/**
 * A column whose values are computed the first time they are accessed.
 * Used to pass unevaluated parameters to delayed functions.
 *
 * @author James Ahlborn
 */
public abstract class BaseDelayedColumn implements TypedColumn
{
  private TypedColumn _col;

  protected BaseDelayedColumn() {
  }

  /**
   * @return the computed column, computing it if necessary
   */
  public TypedColumn getDelegate() {
    if(_col == null) {
      _col = eval();
    }
    return _col;
  }

  @Override
  public Kind getKind() {
    return getDelegate().getKind();
  }

  @Override
  public int size() {
    return getDelegate().size();
  }

  @Override
  public boolean isScalar() {
    return getDelegate().isScalar();
  }

  @Override
  public boolean isNumeric() {
    return getDelegate().isNumeric();
  }

  @Override
  public Object get(int idx) {
    return getDelegate().get(idx);
  }

  @Override
  public double getDouble(int idx) {
    return getDelegate().getDouble(idx);
  }

  @Override
  public String getString(int idx) {
    return getDelegate().getString(idx);
  }

  @Override
  public LocalDateTime getTimestamp(int idx) {
    return getDelegate().getTimestamp(idx);
  }

  @Override
  public TypedColumn copy() {
    return getDelegate().copy();
  }

  protected abstract TypedColumn eval();
}
