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

/**
 *
 * @author James Ahlborn
 */
public class TimestampColumn extends BaseColumn
{
  private final LocalDateTime[] _vals;

  public TimestampColumn(LocalDateTime... vals) {
    checkSize(vals.length);
    _vals = vals;
  }

  @Override
  public Kind getKind() {
    return Kind.TIMESTAMP;
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
  public LocalDateTime getTimestamp(int idx) {
    return _vals[idx];
  }

  @Override
  public TimestampColumn copy() {
    return new TimestampColumn(_vals.clone());
  }
}
