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

import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;

/**
 * Computes the common length and per operand strides for the elementwise
 * combination of columns.  A column of length 1 has stride 0 (it is
 * repeated), every other column must have the common length and has
 * stride 1.
 *
 * @author James Ahlborn
 */
final class Broadcast
{
  private final int _length;
  private final int[] _strides;

  private Broadcast(int length, int[] strides) {
    _length = length;
    _strides = strides;
  }

  /**
   * @throws ShapeException if two of the given columns have different
   *         lengths and neither of them is a scalar
   */
  static Broadcast of(TypedColumn... cols) {
    int length = 1;
    for(TypedColumn col : cols) {
      length = Math.max(length, col.size());
    }
    int[] strides = new int[cols.length];
    for(int i = 0; i < cols.length; ++i) {
      int size = cols[i].size();
      if(size == 1) {
        strides[i] = 0;
      } else if(size == length) {
        strides[i] = 1;
      } else {
        throw new ShapeException("Cannot broadcast columns of length " +
                                 size + " and " + length);
      }
    }
    return new Broadcast(length, strides);
  }

  int getLength() {
    return _length;
  }

  /**
   * @return the index into the given operand for the given output row
   */
  int index(int operand, int row) {
    return row * _strides[operand];
  }
}
