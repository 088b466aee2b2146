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

import java.io.IOException;

import com.healthmarketscience.colcalc.expr.DomainException;
import com.healthmarketscience.colcalc.expr.EvalContext;
import com.healthmarketscience.colcalc.expr.EvalException;
import com.healthmarketscience.colcalc.expr.Figure;
import com.healthmarketscience.colcalc.expr.Function;
import com.healthmarketscience.colcalc.expr.OpNode;
import com.healthmarketscience.colcalc.expr.RenderSink;
import com.healthmarketscience.colcalc.expr.TypedColumn;
import com.healthmarketscience.colcalc.expr.TypedColumn.Kind;
import static com.healthmarketscience.colcalc.expr.FunctionDescriptor.ArgKind.*;
import static com.healthmarketscience.colcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.colcalc.impl.expr.FunctionSupport.*;

/**
 * Functions which build up the current {@link Figure} and hand it to the
 * configured {@link RenderSink}.  All of them return the sentinel column.
 *
 * @author James Ahlborn
 */
public class DefaultPlotFunctions
{
  private static final String LINE_TYPE = "line";
  private static final String MARKERS_TYPE = "markers";

  private DefaultPlotFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function NEW_PLOT = registerFunc(new Func0(
      summaryDesc("newPlot", Kind.FLOAT64)) {
    @Override
    protected TypedColumn eval0(EvalContext ctx) {
      ctx.getFigure().clearTraces();
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function SET_PLOT_DIM = registerFunc(new Func2(
      summaryDesc("setPlotDim", Kind.FLOAT64, NUMERIC, NUMERIC)) {
    @Override
    protected TypedColumn eval2(EvalContext ctx, TypedColumn width,
                                TypedColumn height) {
      ctx.getFigure().setDimensions((int)getScalarDouble(width),
                                    (int)getScalarDouble(height));
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function PLOT_XY = registerFunc(new NodeFunc(
      summaryDesc("plotXY", Kind.FLOAT64, NUMERIC, NUMERIC, STRING, STRING)) {
    @Override
    protected TypedColumn evalNode(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      Broadcast bc = Broadcast.of(params[0], params[1]);
      TypedColumn x = ColumnSupport.broadcast(params[0], bc.getLength());
      TypedColumn y = ColumnSupport.broadcast(params[1], bc.getLength());
      ctx.getFigure().addTrace(new Figure.Trace(
          getTraceType(getScalarString(params[2])), getArgExpression(node, 1),
          x, y, getScalarString(params[3]), null));
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function PLOT_LINE = registerFunc(new NodeFunc(
      summaryDesc("plotLine", Kind.FLOAT64, NUMERIC, STRING, STRING)) {
    @Override
    protected TypedColumn evalNode(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      TypedColumn y = params[0];
      double[] xVals = new double[y.size()];
      for(int i = 0; i < xVals.length; ++i) {
        xVals[i] = i;
      }
      ctx.getFigure().addTrace(new Figure.Trace(
          getTraceType(getScalarString(params[1])), getArgExpression(node, 0),
          new DoubleColumn(xVals), y, getScalarString(params[2]), null));
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function HISTOGRAM = registerFunc(new NodeFunc(
      summaryDesc("histogram", Kind.FLOAT64, ANY, STRING, STRING)) {
    @Override
    protected TypedColumn evalNode(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      ctx.getFigure().addTrace(new Figure.Trace(
          Figure.TraceType.HISTOGRAM, getArgExpression(node, 0), params[0],
          null, getScalarString(params[1]), getScalarString(params[2])));
      return ColumnSupport.SENTINEL_COL;
    }
  });

  public static final Function RENDER = registerFunc(new BaseFunction(
      summaryDesc("render", Kind.FLOAT64, STRING, STRING, STRING, STRING)) {
    @Override
    protected TypedColumn evalImpl(EvalContext ctx, OpNode node,
                                   TypedColumn[] params) {
      RenderSink sink = ctx.getRenderSink();
      if(sink == null) {
        throw new EvalException("No render sink configured");
      }
      Figure figure = ctx.getFigure();
      Figure.Layout layout = new Figure.Layout(
          getScalarString(params[0]), getScalarString(params[1]),
          getScalarString(params[2]), getScalarString(params[3]),
          figure.getWidth(), figure.getHeight());
      try {
        sink.render(figure, layout);
      } catch(IOException e) {
        throw new EvalException("Failed rendering " + layout.getFileName(), e);
      }
      return ColumnSupport.SENTINEL_COL;
    }
  });


  private static Figure.TraceType getTraceType(String type) {
    if(LINE_TYPE.equalsIgnoreCase(type)) {
      return Figure.TraceType.LINE;
    }
    if(MARKERS_TYPE.equalsIgnoreCase(type)) {
      return Figure.TraceType.MARKERS;
    }
    throw new DomainException("Unknown plot type '" + type + "', expected '" +
                              LINE_TYPE + "' or '" + MARKERS_TYPE + "'");
  }

  private static String getScalarString(TypedColumn param) {
    checkScalar(param, "string");
    return param.getString(0);
  }
}
