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

package com.healthmarketscience.colcalc.util;

import com.healthmarketscience.colcalc.expr.Figure;
import com.healthmarketscience.colcalc.expr.RenderSink;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * RenderSink which simply logs each rendered figure (useful for debugging
 * and for running scripts without a rendering backend).
 *
 * @author James Ahlborn
 */
public class LoggingRenderSink implements RenderSink
{
  private static final Log LOG = LogFactory.getLog(LoggingRenderSink.class);

  private int _renderCount;

  public LoggingRenderSink() {}

  /**
   * @return the number of figures rendered by this sink
   */
  public int getRenderCount() {
    return _renderCount;
  }

  @Override
  public void render(Figure figure, Figure.Layout layout) {
    ++_renderCount;
    if(LOG.isInfoEnabled()) {
      LOG.info("Rendering " + layout + ": " + figure);
    }
  }
}
