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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Immutable description of a {@link Function}: its name, the kinds of its
 * arguments, the kind of its result and whether it produces one value per
 * row or one value for a whole column.  A descriptor with no declared
 * arguments is variadic and is not arity checked.
 *
 * @author James Ahlborn
 */
public final class FunctionDescriptor
{
  /** whether a function produces one output per row or a single summary */
  public enum Level {
    ROW, REDUCTION;
  }

  /** the kinds of column accepted for a function argument */
  public enum ArgKind {
    ANY, NUMERIC, STRING, TIMESTAMP;

    public boolean accepts(TypedColumn.Kind kind) {
      switch(this) {
      case ANY:
        return true;
      case NUMERIC:
        return kind.isNumeric();
      case STRING:
        return (kind == TypedColumn.Kind.STRING);
      case TIMESTAMP:
        return (kind == TypedColumn.Kind.TIMESTAMP);
      default:
        throw new IllegalStateException("unknown arg kind " + this);
      }
    }
  }

  private final String _name;
  private final List<ArgKind> _argKinds;
  private final TypedColumn.Kind _returnKind;
  private final Level _level;
  private final Role _role;

  public FunctionDescriptor(String name, Level level,
                            TypedColumn.Kind returnKind, Role role,
                            ArgKind... argKinds) {
    _name = name;
    _level = level;
    _returnKind = returnKind;
    _role = ((role != null) ? role : Role.UNDETERMINED);
    _argKinds = Collections.unmodifiableList(Arrays.asList(argKinds.clone()));
  }

  public String getName() {
    return _name;
  }

  public List<ArgKind> getArgKinds() {
    return _argKinds;
  }

  public int getNumArgs() {
    return _argKinds.size();
  }

  public boolean isVariadic() {
    return _argKinds.isEmpty();
  }

  /**
   * @return the kind of the function result, or {@code null} if it depends
   *         on the arguments
   */
  public TypedColumn.Kind getReturnKind() {
    return _returnKind;
  }

  public Level getLevel() {
    return _level;
  }

  public boolean isReduction() {
    return (_level == Level.REDUCTION);
  }

  /**
   * @return the role assigned to the function result,
   *         {@link Role#UNDETERMINED} if the function does not assign one
   */
  public Role getRole() {
    return _role;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
      .append("name", _name)
      .append("argKinds", _argKinds)
      .append("returnKind", _returnKind)
      .append("level", _level)
      .toString();
  }
}
