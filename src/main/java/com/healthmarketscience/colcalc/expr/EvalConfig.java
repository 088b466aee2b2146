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
 * The EvalConfig allows for customization of the expression evaluation
 * context for a given {@link com.healthmarketscience.colcalc.Calculator}
 * instance.
 *
 * @see com.healthmarketscience.colcalc.expr expression package docs
 *
 * @author James Ahlborn
 */
public interface EvalConfig
{
  /**
   * @return the currently configured TemporalConfig
   */
  public TemporalConfig getTemporalConfig();

  /**
   * Sets the TemporalConfig for use when evaluating expressions.  The default
   * date formatting is US based, so this may need to be modified when
   * working with data from other locales.
   */
  public void setTemporalConfig(TemporalConfig temporal);

  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use during expression parsing.
   * The Functions supported by the default FunctionLookup are documented in
   * {@link com.healthmarketscience.colcalc.expr}.  Custom Functions can be
   * implemented and provided to the expression engine by installing a
   * custom FunctionLookup instance (which would presumably wrap and delegate
   * to the default FunctionLookup instance for any default implementations).
   */
  public void setFunctionLookup(FunctionLookup lookup);

  /**
   * @return the currently configured RenderSink, may be {@code null}
   */
  public RenderSink getRenderSink();

  /**
   * Sets the backend which receives figures from the {@code render}
   * function.  If none is configured, {@code render} fails.
   */
  public void setRenderSink(RenderSink sink);

  /**
   * @return the stream written to by the printing functions
   */
  public PrintStream getOutput();

  /**
   * Sets the stream written to by the {@code print} and {@code printIf}
   * functions.  Defaults to {@link System#out}.
   */
  public void setOutput(PrintStream out);
}
