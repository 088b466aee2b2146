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

package com.healthmarketscience.colcalc.impl;

import java.io.PrintStream;

import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.Figure;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.RenderSink;
import com.healthmarketscience.colcalc.expr.Role;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.impl.expr.PipelineAdapter;

/**
 * EvalContext for evaluating expressions against a single {@link Pipeline}
 * using the configuration of a {@link CalculatorImpl}.
 *
 * @author James Ahlborn
 */
public class PipelineEvalContext implements EvalContext
{
  private final CalculatorImpl _calc;
  private final PipelineAdapter _adapter;

  public PipelineEvalContext(CalculatorImpl calc, Pipeline pipeline) {
    _calc = calc;
    _adapter = new PipelineAdapter(pipeline);
  }

  @Override
  public TemporalConfig getTemporalConfig() {
    return _calc.getTemporalConfig();
  }

  @Override
  public Pipeline getPipeline() {
    return _adapter.getPipeline();
  }

  @Override
  public int getRowCount() {
    return getPipeline().getRowCount();
  }

  @Override
  public TypedColumn getFieldValue(String name) {
    return _adapter.fetch(name);
  }

  @Override
  public Role getFieldRole(String name) {
    return _adapter.fetchRole(name);
  }

  @Override
  public PrintStream getOutput() {
    return _calc.getOutput();
  }

  @Override
  public Figure getFigure() {
    return _calc.getFigure();
  }

  @Override
  public RenderSink getRenderSink() {
    return _calc.getRenderSink();
  }
}
