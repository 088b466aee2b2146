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
import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.colcalc.Calculator;
import com.healthmarketscience.colcalc.expr.EvalConfig;
import com.healthmarketscience.colcalc.expr.Figure;
import com.healthmarketscience.colcalc.expr.FunctionLookup;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.Pipeline;
import com.healthmarketscience.colcalc.expr.RenderSink;
import com.healthmarketscience.colcalc.expr.TemporalConfig;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.impl.expr.DefaultFunctions;
import com.healthmarketscience.colcalc.impl.expr.Evaluator;
import com.healthmarketscience.colcalc.impl.expr.Expressionator;
import com.healthmarketscience.colcalc.impl.expr.LoopDriver;
import com.healthmarketscience.colcalc.impl.expr.PipelineAdapter;
import com.healthmarketscience.colcalc.impl.expr.TreeCopier;

/**
 *
 * @author James Ahlborn
 */
public class CalculatorImpl implements Calculator, EvalConfig
{
  private TemporalConfig _temporal = TemporalConfig.US_TEMPORAL_CONFIG;
  private FunctionLookup _funcLookup = DefaultFunctions.LOOKUP;
  private RenderSink _renderSink;
  private PrintStream _output = System.out;
  private final Figure _figure = new Figure();

  public CalculatorImpl() {}

  @Override
  public EvalConfig getEvalConfig() {
    return this;
  }

  @Override
  public TemporalConfig getTemporalConfig() {
    return _temporal;
  }

  @Override
  public void setTemporalConfig(TemporalConfig temporal) {
    if(temporal == null) {
      temporal = TemporalConfig.US_TEMPORAL_CONFIG;
    }
    _temporal = temporal;
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcLookup;
  }

  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    if(lookup == null) {
      lookup = DefaultFunctions.LOOKUP;
    }
    _funcLookup = lookup;
  }

  @Override
  public RenderSink getRenderSink() {
    return _renderSink;
  }

  @Override
  public void setRenderSink(RenderSink sink) {
    _renderSink = sink;
  }

  @Override
  public PrintStream getOutput() {
    return _output;
  }

  @Override
  public void setOutput(PrintStream out) {
    if(out == null) {
      out = System.out;
    }
    _output = out;
  }

  @Override
  public Figure getFigure() {
    return _figure;
  }

  @Override
  public OpNode parse(String expr) {
    return Expressionator.parse(expr, _funcLookup);
  }

  @Override
  public TypedColumn evaluate(OpNode root, Pipeline pipeline) {
    return Evaluator.evaluate(root, createContext(pipeline));
  }

  @Override
  public TypedColumn compute(String expr, Pipeline pipeline) {
    return evaluate(parse(expr), pipeline);
  }

  @Override
  public void appendToPipeline(OpNode root, String name, Pipeline pipeline) {
    new PipelineAdapter(pipeline).append(root, name);
  }

  @Override
  public OpNode addField(String name, String expr, Pipeline pipeline) {
    OpNode root = parse(expr);
    evaluate(root, pipeline);
    appendToPipeline(root, name, pipeline);
    return root;
  }

  @Override
  public void loop(String var, int start, int end, List<String> exprs,
                   List<String> targets, Pipeline pipeline) {
    List<OpNode> bodies = new ArrayList<OpNode>(exprs.size());
    for(String expr : exprs) {
      bodies.add(parse(expr));
    }
    LoopDriver.loop(createContext(pipeline), var, start, end, bodies,
                    targets);
  }

  @Override
  public OpNode copy(OpNode root) {
    return TreeCopier.copy(root);
  }

  private PipelineEvalContext createContext(Pipeline pipeline) {
    return new PipelineEvalContext(this, pipeline);
  }
}
