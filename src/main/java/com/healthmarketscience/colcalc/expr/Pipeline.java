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

import java.util.List;

/**
 * A Pipeline is the columnar data source (and sink) which expressions are
 * evaluated against.  All fields in one Pipeline share the same row count.
 * An empty Pipeline adopts the length of the first column appended to it.
 * <p/>
 * Storage failures are reported by throwing an {@link EvalException}.
 *
 * @author James Ahlborn
 */
public interface Pipeline
{
  /**
   * @return the number of rows shared by all the fields in this pipeline
   */
  public int getRowCount();

  /**
   * @return the names of the fields in this pipeline, in append order
   */
  public List<String> getFieldNames();

  /**
   * @return the column for the given field, or {@code null} if this pipeline
   *         has no such field
   */
  public TypedColumn getColumn(String name);

  /**
   * @return the role of the given field, or {@code null} if this pipeline
   *         has no such field.  An existing field should never report a
   *         {@code null} role (use {@link Role#UNDETERMINED} instead).
   */
  public Role getRole(String name);

  /**
   * Adds a new field to this pipeline.  The column must have the pipeline's
   * row count (unless the pipeline is empty) and the name must not already
   * exist.
   *
   * @param normalize if {@code true}, a continuous field is stored
   *                  normalized
   */
  public void appendColumn(String name, TypedColumn column, Role role,
                           boolean normalize);

  /**
   * Removes the given field from this pipeline.
   */
  public void dropColumn(String name);
}
