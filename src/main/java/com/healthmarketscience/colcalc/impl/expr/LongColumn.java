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

/**
 *
 * @author James Ahlborn
 */
public class LongColumn extends BaseColumn
{
  private final long[] _vals;

  public LongColumn(long... vals) {
    checkSize(vals.length);
    _vals = vals;
  }

  @Override
  public Kind getKind() {
    return Kind.INT64;
  }

  @Override
  public int size() {
    return _vals.length;
  }

  @Override
  public Object get(int idx) {
    return _vals[idx];
  }

  @Override
  public double getDouble(int idx) {
    return _vals[idx];
  }

  public long getLong(int idx) {
    return _vals[idx];
  }

  @Override
  public LongColumn copy() {
    return new LongColumn(_vals.clone());
  }
}
