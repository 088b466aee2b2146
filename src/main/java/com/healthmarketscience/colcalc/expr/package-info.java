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

/**
 * colcalc evaluates formula expressions over the columns of a {@link
 * com.healthmarketscience.colcalc.expr.Pipeline}.  An expression is parsed
 * once into a tree of {@link com.healthmarketscience.colcalc.expr.OpNode}s
 * which can then be evaluated against any pipeline, producing a new {@link
 * com.healthmarketscience.colcalc.expr.TypedColumn} (one value per row) or a
 * single summary value.
 * <p/>
 * <h2>Grammar</h2>
 * <p/>
 * <ul>
 *   <li><b>Operators</b> (lowest to highest precedence): {@code && ||},
 *       {@code > >= < <= == !=}, {@code + -}, {@code * /}, {@code ^}.
 *       Comparisons and logicals produce 0/1 values, a value is "true" if it
 *       is greater than 0.  {@code &&} and {@code ||} share one precedence
 *       level and group from the left, so {@code 1||0&&0} is
 *       {@code (1||0)&&0}, which is 0.  Use parentheses to group them any
 *       other way.</li>
 *   <li><b>Unary plus</b>: a leading {@code +} is ignored.</li>
 *   <li><b>Unary minus</b>: {@code -a+b} is {@code (-a)+b}, {@code -a*b}
 *       is {@code -(a*b)}.</li>
 *   <li><b>Functions</b>: {@code name(arg, ...)}, names are case
 *       insensitive.</li>
 *   <li><b>Constants</b>: decimal numbers and single quoted strings (which
 *       are also used for dates, e.g. {@code '3/25/2022'}).</li>
 *   <li><b>Fields</b>: any other name refers to a field of the
 *       pipeline.</li>
 * </ul>
 * <p/>
 * Single values broadcast against columns, any other combination of
 * columns of different lengths fails with a {@link
 * com.healthmarketscience.colcalc.expr.ShapeException}.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.colcalc.expr.EvalConfig} allows for
 *     customization of the evaluation context of a {@link
 *     com.healthmarketscience.colcalc.Calculator}.</li>
 * <li>{@link com.healthmarketscience.colcalc.expr.TemporalConfig}
 *     encapsulates date formatting options.</li>
 * <li>{@link com.healthmarketscience.colcalc.expr.FunctionLookup} provides a
 *     source for {@link com.healthmarketscience.colcalc.expr.Function}
 *     instances.</li>
 * <li>{@link com.healthmarketscience.colcalc.expr.RenderSink} receives the
 *     figures built by the plotting functions.</li>
 * <li>{@link com.healthmarketscience.colcalc.expr.EvalException} is the base
 *     of all failures, with {@link
 *     com.healthmarketscience.colcalc.expr.ParseException}, {@link
 *     com.healthmarketscience.colcalc.expr.TypeException}, {@link
 *     com.healthmarketscience.colcalc.expr.ShapeException}, {@link
 *     com.healthmarketscience.colcalc.expr.DomainException} and {@link
 *     com.healthmarketscience.colcalc.expr.LookupException} for the specific
 *     kinds of failure.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 *
 * <h3>Row</h3>
 *
 * <table border="1" width="60%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Level</th><th>Description</th></tr>
 * <tr class="TableRowColor"><td>exist</td><td>Row</td><td>exist(a, b): a, or b if a refers to a missing field</td></tr>
 * <tr class="TableRowColor"><td>if</td><td>Row</td><td>if(cond, a, b): a where cond &gt; 0, else b</td></tr>
 * <tr class="TableRowColor"><td>log, exp, abs</td><td>Row</td><td>natural log (input must be positive), exponential, absolute value</td></tr>
 * <tr class="TableRowColor"><td>pow</td><td>Row</td><td>pow(a, b): a raised to b</td></tr>
 * <tr class="TableRowColor"><td>lag</td><td>Row</td><td>lag(x, missing): x shifted down one row</td></tr>
 * <tr class="TableRowColor"><td>cumeBefore, cumeAfter</td><td>Row</td><td>sum of the rows strictly before/after, edge row is missing</td></tr>
 * <tr class="TableRowColor"><td>prodBefore, prodAfter</td><td>Row</td><td>product of the rows strictly before/after, edge row is missing</td></tr>
 * <tr class="TableRowColor"><td>countBefore, countAfter</td><td>Row</td><td>number of rows strictly before/after</td></tr>
 * <tr class="TableRowColor"><td>row</td><td>Row</td><td>0-based row number</td></tr>
 * <tr class="TableRowColor"><td>index</td><td>Row</td><td>index(x, idx): x[idx]</td></tr>
 * <tr class="TableRowColor"><td>range</td><td>Row</td><td>range(start, end): start, start+1, ..., end-1</td></tr>
 * <tr class="TableRowColor"><td>toFloat, toInt, toString, toDate</td><td>Row</td><td>conversions</td></tr>
 * <tr class="TableRowColor"><td>cat, cts</td><td>Row</td><td>mark a value categorical/continuous</td></tr>
 * </table>
 *
 * <h3>Date</h3>
 *
 * <table border="1" width="60%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Level</th><th>Description</th></tr>
 * <tr class="TableRowColor"><td>dateAdd</td><td>Row</td><td>dateAdd(d, months)</td></tr>
 * <tr class="TableRowColor"><td>dateDiff</td><td>Row</td><td>dateDiff(a, b): whole months from b to a</td></tr>
 * <tr class="TableRowColor"><td>year, month, day</td><td>Row</td><td>calendar fields</td></tr>
 * <tr class="TableRowColor"><td>toFirstDayOfMonth, toLastDayOfMonth</td><td>Row</td><td>month boundaries</td></tr>
 * </table>
 *
 * <h3>Text</h3>
 *
 * <table border="1" width="60%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Level</th><th>Description</th></tr>
 * <tr class="TableRowColor"><td>strLen</td><td>Row</td><td>length</td></tr>
 * <tr class="TableRowColor"><td>substr</td><td>Row</td><td>substr(s, start, len), 0-based</td></tr>
 * <tr class="TableRowColor"><td>strPos</td><td>Row</td><td>strPos(s, needle): index or -1</td></tr>
 * <tr class="TableRowColor"><td>strCount</td><td>Row</td><td>strCount(s, needle): occurrences</td></tr>
 * <tr class="TableRowColor"><td>concat</td><td>Row</td><td>concat(a, b)</td></tr>
 * </table>
 *
 * <h3>Summary</h3>
 *
 * <table border="1" width="60%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Level</th><th>Description</th></tr>
 * <tr class="TableRowColor"><td>sum, mean, std, count, median, max, min</td><td>Summary</td><td>std is the sample deviation, median the lower middle value</td></tr>
 * <tr class="TableRowColor"><td>r2, sse, mad</td><td>Summary</td><td>fit of (observed, fitted)</td></tr>
 * <tr class="TableRowColor"><td>npv</td><td>Summary</td><td>npv(rate, cashflows), first cash flow undiscounted</td></tr>
 * <tr class="TableRowColor"><td>irr</td><td>Summary</td><td>irr(cost, cashflows)</td></tr>
 * </table>
 *
 * <h3>Output</h3>
 *
 * <table border="1" width="60%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Level</th><th>Description</th></tr>
 * <tr class="TableRowColor"><td>print, printIf</td><td>Summary</td><td>print(x, rows), printIf(x, cond)</td></tr>
 * <tr class="TableRowColor"><td>newPlot, setPlotDim</td><td>Summary</td><td>start a figure, set its size</td></tr>
 * <tr class="TableRowColor"><td>plotXY, plotLine, histogram</td><td>Summary</td><td>add a trace to the figure</td></tr>
 * <tr class="TableRowColor"><td>render</td><td>Summary</td><td>render(file, title, xLabel, yLabel)</td></tr>
 * </table>
 */
package com.healthmarketscience.colcalc.expr;
