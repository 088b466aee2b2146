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

package com.healthmarketscience.colcalc.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.LookupException;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.impl.expr.DoubleColumn;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Simple in-memory {@link Pipeline} which keeps its fields in append
 * order.  Continuous numeric fields appended with normalization enabled are
 * stored as z-scores (the normalization parameters are kept and available
 * via {@link #getNormalization}).
 *
 * @author James Ahlborn
 */
public class SimplePipeline implements Pipeline
{
  private final Map<String,Field> _fields = new LinkedHashMap<String,Field>();
  private int _rowCount;

  public SimplePipeline() {}

  /**
   * Convenience method for adding a field without normalization.
   *
   * @return this pipeline
   */
  public SimplePipeline addField(String name, TypedColumn column, Role role) {
    appendColumn(name, column, role, false);
    return this;
  }

  @Override
  public int getRowCount() {
    return _rowCount;
  }

  @Override
  public List<String> getFieldNames() {
    return Collections.unmodifiableList(
        new ArrayList<String>(_fields.keySet()));
  }

  @Override
  public TypedColumn getColumn(String name) {
    Field field = _fields.get(name);
    return ((field != null) ? field._column : null);
  }

  @Override
  public Role getRole(String name) {
    Field field = _fields.get(name);
    return ((field != null) ? field._role : null);
  }

  /**
   * @return the mean and (sample) standard deviation used to normalize the
   *         given field, or {@code null} if the field was not normalized
   */
  public double[] getNormalization(String name) {
    Field field = _fields.get(name);
    return (((field != null) && (field._normalization != null)) ?
            field._normalization.clone() : null);
  }

  @Override
  public void appendColumn(String name, TypedColumn column, Role role,
                           boolean normalize) {
    if(_fields.containsKey(name)) {
      throw new EvalException("Field '" + name + "' already exists");
    }
    if(!_fields.isEmpty() && (column.size() != _rowCount)) {
      throw new ShapeException("Field '" + name + "' has " + column.size() +
                               " rows, expected " + _rowCount);
    }

    if(role == null) {
      role = Role.UNDETERMINED;
    }

    Field field = new Field(column, role);
    if(normalize && (role == Role.CONTINUOUS) && column.isNumeric()) {
      field = normalize(column, role);
    }

    _fields.put(name, field);
    _rowCount = column.size();
  }

  @Override
  public void dropColumn(String name) {
    if(_fields.remove(name) == null) {
      throw new LookupException("Field '" + name + "' is not in the pipeline");
    }
    if(_fields.isEmpty()) {
      _rowCount = 0;
    }
  }

  private static Field normalize(TypedColumn column, Role role) {
    int num = column.size();
    double mean = 0d;
    for(int i = 0; i < num; ++i) {
      mean += column.getDouble(i);
    }
    mean /= num;
    double ss = 0d;
    for(int i = 0; i < num; ++i) {
      double diff = column.getDouble(i) - mean;
      ss += diff * diff;
    }
    double std = ((num > 1) ? Math.sqrt(ss / (num - 1)) : 0d);
    // constant columns are only centered
    double scale = ((std > 0d) ? std : 1d);

    double[] vals = new double[num];
    for(int i = 0; i < num; ++i) {
      vals[i] = (column.getDouble(i) - mean) / scale;
    }
    Field field = new Field(new DoubleColumn(vals), role);
    field._normalization = new double[]{mean, std};
    return field;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
      .append("rows", _rowCount)
      .append("fields", _fields.keySet())
      .toString();
  }

  private static final class Field
  {
    private final TypedColumn _column;
    private final Role _role;
    private double[] _normalization;

    private Field(TypedColumn column, Role role) {
      _column = column;
      _role = role;
    }
  }
}
