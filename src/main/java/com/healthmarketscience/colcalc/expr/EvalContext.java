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

import java.io.PrintStream;

/**
 * EvalContext encapsulates all shared state for expression evaluation.  It
 * provides a bridge between the expression execution engine and the current
 * {@link Pipeline}.
 *
 * @author James Ahlborn
 */
public interface EvalContext
{
  /**
   * @return the currently configured TemporalConfig (from the
   *         {@link EvalConfig})
   */
  public TemporalConfig getTemporalConfig();

  /**
   * @return the pipeline which expressions are evaluated against
   */
  public Pipeline getPipeline();

  /**
   * @return the number of rows in the current pipeline
   */
  public int getRowCount();

  /**
   * @return the column for the given field
   * @throws LookupException if the pipeline has no such field
   */
  public TypedColumn getFieldValue(String name);

  /**
   * @return the role of the given field
   * @throws LookupException if the pipeline has no such field
   */
  public Role getFieldRole(String name);

  /**
   * @return the stream written to by the printing functions
   */
  public PrintStream getOutput();

  /**
   * @return the figure built by the plotting functions
   */
  public Figure getFigure();

  /**
   * @return the currently configured RenderSink (from the
   *         {@link EvalConfig}), may be {@code null}
   */
  public RenderSink getRenderSink();
}
