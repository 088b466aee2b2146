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

import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.LookupException;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.ShapeException;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * The only path between the expression engine and a {@link Pipeline}:
 * fetches field columns for leaves and appends computed columns back as
 * new fields.
 *
 * @author James Ahlborn
 */
public class PipelineAdapter
{
  private static final Log LOG = LogFactory.getLog(PipelineAdapter.class);

  private final Pipeline _pipeline;

  public PipelineAdapter(Pipeline pipeline) {
    _pipeline = pipeline;
  }

  public Pipeline getPipeline() {
    return _pipeline;
  }

  /**
   * @return the column of the given field
   * @throws LookupException if the pipeline has no such field
   */
  public TypedColumn fetch(String name) {
    TypedColumn col = _pipeline.getColumn(name);
    if(col == null) {
      throw new LookupException("Field '" + name + "' is not in the pipeline");
    }
    return col;
  }

  /**
   * @return the role of the given field, {@link Role#UNDETERMINED} if the
   *         pipeline has the field but reports no role for it
   * @throws LookupException if the pipeline has no such field
   */
  public Role fetchRole(String name) {
    Role role = _pipeline.getRole(name);
    if(role == null) {
      fetch(name);
      role = Role.UNDETERMINED;
    }
    return role;
  }

  /**
   * Appends the computed value of the given (evaluated) tree to the
   * pipeline as the given field, replacing any existing field of that name.
   */
  public void append(OpNode root, String name) {
    append(root, name, false);
  }

  /**
   * Appends the computed value of the given (evaluated) tree to the
   * pipeline as the given field, replacing any existing field of that name.
   * A scalar value is repeated for every row.  A longer value appended to a
   * pipeline of a single row expands every existing field to the new
   * length.
   *
   * @param normalize whether the pipeline should store a continuous field
   *                  normalized
   * @throws EvalException if the tree has not been evaluated
   * @throws ShapeException if the value cannot be fit to the pipeline
   */
  public void append(OpNode root, String name, boolean normalize) {
    TypedColumn col = root.getComputedValue();
    if(col == null) {
      throw new EvalException("Expression " + root +
                              " has not been evaluated");
    }

    Role role = getAppendRole(root, col);

    // the replaced field does not constrain the shape
    List<String> others = new ArrayList<String>(_pipeline.getFieldNames());
    others.remove(name);

    boolean expand = false;
    int rows = _pipeline.getRowCount();
    if(!others.isEmpty() && (col.size() != rows)) {
      if(col.isScalar()) {
        col = ColumnSupport.broadcast(col, rows);
      } else if(rows == 1) {
        expand = true;
      } else {
        throw new ShapeException(
            "Cannot append " + col.size() + " values as field '" + name +
            "' to a pipeline of " + rows + " rows");
      }
    }

    if(_pipeline.getColumn(name) != null) {
      _pipeline.dropColumn(name);
    }
    if(expand) {
      expand(col.size());
    }

    _pipeline.appendColumn(name, col, role, normalize);
  }

  private void expand(int rows) {
    if(LOG.isDebugEnabled()) {
      LOG.debug("Expanding pipeline from 1 to " + rows + " rows");
    }

    List<String> names = new ArrayList<String>(_pipeline.getFieldNames());
    List<TypedColumn> cols = new ArrayList<TypedColumn>(names.size());
    List<Role> roles = new ArrayList<Role>(names.size());
    for(String name : names) {
      cols.add(ColumnSupport.broadcast(_pipeline.getColumn(name), rows));
      roles.add(_pipeline.getRole(name));
    }
    for(String name : names) {
      _pipeline.dropColumn(name);
    }
    for(int i = 0; i < names.size(); ++i) {
      _pipeline.appendColumn(names.get(i), cols.get(i), roles.get(i), false);
    }
  }

  private static Role getAppendRole(OpNode root, TypedColumn col) {
    if(root.getRole().isDetermined()) {
      return root.getRole();
    }
    return ((col.getKind() == TypedColumn.Kind.FLOAT64) ? Role.CONTINUOUS :
            Role.CATEGORICAL);
  }
}
