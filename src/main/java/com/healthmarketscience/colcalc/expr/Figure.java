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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * The figure accumulated by the plotting functions.  Traces are added by
 * {@code plotXY}, {@code plotLine} and {@code histogram}, cleared by
 * {@code newPlot}, and handed to the configured {@link RenderSink} by
 * {@code render}.
 *
 * @author James Ahlborn
 */
public class Figure
{
  public static final int DEFAULT_WIDTH = 800;
  public static final int DEFAULT_HEIGHT = 600;

  public enum TraceType {
    LINE, MARKERS, HISTOGRAM;
  }

  /** a single data series within a figure */
  public static final class Trace
  {
    private final TraceType _type;
    private final String _name;
    private final TypedColumn _x;
    private final TypedColumn _y;
    private final String _color;
    private final String _normalization;

    public Trace(TraceType type, String name, TypedColumn x, TypedColumn y,
                 String color, String normalization) {
      _type = type;
      _name = name;
      _x = x;
      _y = y;
      _color = color;
      _normalization = normalization;
    }

    public TraceType getType() {
      return _type;
    }

    /**
     * @return the expression text of the plotted values
     */
    public String getName() {
      return _name;
    }

    /**
     * @return the x values, the histogram data for {@link TraceType#HISTOGRAM}
     */
    public TypedColumn getX() {
      return _x;
    }

    /**
     * @return the y values, {@code null} for {@link TraceType#HISTOGRAM}
     */
    public TypedColumn getY() {
      return _y;
    }

    public String getColor() {
      return _color;
    }

    /**
     * @return the histogram normalization, {@code null} for other traces
     */
    public String getNormalization() {
      return _normalization;
    }

    @Override
    public String toString() {
      return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
        .append("type", _type)
        .append("name", _name)
        .append("color", _color)
        .append("normalization", _normalization)
        .toString();
    }
  }

  /** the annotations used when rendering a figure */
  public static final class Layout
  {
    private final String _fileName;
    private final String _title;
    private final String _xLabel;
    private final String _yLabel;
    private final int _width;
    private final int _height;

    public Layout(String fileName, String title, String xLabel, String yLabel,
                  int width, int height) {
      _fileName = fileName;
      _title = title;
      _xLabel = xLabel;
      _yLabel = yLabel;
      _width = width;
      _height = height;
    }

    public String getFileName() {
      return _fileName;
    }

    public String getTitle() {
      return _title;
    }

    public String getXLabel() {
      return _xLabel;
    }

    public String getYLabel() {
      return _yLabel;
    }

    public int getWidth() {
      return _width;
    }

    public int getHeight() {
      return _height;
    }

    @Override
    public String toString() {
      return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
        .append("fileName", _fileName)
        .append("title", _title)
        .append("xLabel", _xLabel)
        .append("yLabel", _yLabel)
        .append("width", _width)
        .append("height", _height)
        .toString();
    }
  }

  private final List<Trace> _traces = new ArrayList<Trace>();
  private int _width = DEFAULT_WIDTH;
  private int _height = DEFAULT_HEIGHT;

  public Figure() {}

  public List<Trace> getTraces() {
    return Collections.unmodifiableList(_traces);
  }

  public void addTrace(Trace trace) {
    _traces.add(trace);
  }

  /**
   * Removes all traces.  The dimensions are retained.
   */
  public void clearTraces() {
    _traces.clear();
  }

  public int getWidth() {
    return _width;
  }

  public int getHeight() {
    return _height;
  }

  public void setDimensions(int width, int height) {
    if((width <= 0) || (height <= 0)) {
      throw new DomainException("Invalid plot dimensions " + width + "x" +
                                height);
    }
    _width = width;
    _height = height;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
      .append("traces", _traces)
      .append("width", _width)
      .append("height", _height)
      .toString();
  }
}
