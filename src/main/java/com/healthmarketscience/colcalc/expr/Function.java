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

/**
 * A Function provides an invokable handle to a named operation within an
 * expression.
 *
 * @author James Ahlborn
 */
public interface Function
{

  /**
   * @return the name of this function
   */
  public String getName();

  /**
   * @return the descriptor of this function's signature
   */
  public FunctionDescriptor getDescriptor();

  /**
   * @return {@code true} if this function receives its parameters
   *         unevaluated (each parameter is only evaluated when first
   *         accessed), {@code false} otherwise.
   */
  public boolean isDelayed();

  /**
   * Evaluates this function within the given context with the given
   * parameters.
   *
   * @param node the tree node holding this call
   *
   * @return the result of the function evaluation
   */
  public TypedColumn eval(EvalContext ctx, OpNode node, TypedColumn... params);
}
