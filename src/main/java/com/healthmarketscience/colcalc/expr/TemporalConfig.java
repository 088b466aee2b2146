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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A TemporalConfig encapsulates date formatting options for expression
 * evaluation.  The default {@link #US_TEMPORAL_CONFIG} instance provides US
 * specific locale configuration.  Data sources which have been built for
 * other locales can utilize custom instances of TemporalConfig in order to
 * convert string values to and from dates correctly.
 *
 * @author James Ahlborn
 */
public class TemporalConfig
{
  public static final String COMPACT_DATE_FORMAT = "yyyyMMdd";
  public static final String US_DATE_FORMAT = "M/d/yyyy";
  public static final String US_PADDED_DATE_FORMAT = "MM/dd/yyyy";

  /** default implementation which is configured for the US locale */
  public static final TemporalConfig US_TEMPORAL_CONFIG = new TemporalConfig(
      US_DATE_FORMAT, Locale.US, COMPACT_DATE_FORMAT, US_DATE_FORMAT,
      US_PADDED_DATE_FORMAT);

  private final String _displayFormat;
  private final List<String> _parseFormats;
  private final Locale _locale;
  private final DateTimeFormatter _displayFmt;
  private final List<DateTimeFormatter> _parseFmts =
    new ArrayList<DateTimeFormatter>();

  /**
   * Instantiates a new TemporalConfig with the given configuration.  Note
   * that the date formats must use single-letter pattern symbols compatible
   * with {@link DateTimeFormatter}.
   *
   * @param displayFormat the format used when converting dates to strings
   * @param locale the locale used by the formatters
   * @param parseFormats the formats tried, in order, when converting strings
   *                     to dates
   */
  public TemporalConfig(String displayFormat, Locale locale,
                        String... parseFormats)
  {
    if(parseFormats.length == 0) {
      throw new IllegalArgumentException("at least one parse format required");
    }
    _displayFormat = displayFormat;
    _locale = locale;
    _parseFormats = Collections.unmodifiableList(
        new ArrayList<String>(Arrays.asList(parseFormats)));
    _displayFmt = DateTimeFormatter.ofPattern(displayFormat, locale);
    for(String fmt : parseFormats) {
      _parseFmts.add(DateTimeFormatter.ofPattern(fmt, locale));
    }
  }

  public String getDisplayFormat() {
    return _displayFormat;
  }

  public List<String> getParseFormats() {
    return _parseFormats;
  }

  public Locale getLocale() {
    return _locale;
  }

  /**
   * @return the given date formatted using the display format
   */
  public String format(LocalDateTime ldt) {
    return _displayFmt.format(ldt);
  }

  /**
   * @return the date (at the start of the day) parsed by the first parse
   *         format which accepts the given string, or {@code null} if none
   *         accepts it
   */
  public LocalDateTime parseDate(String str) {
    String trimmed = str.trim();
    for(DateTimeFormatter fmt : _parseFmts) {
      try {
        return LocalDate.parse(trimmed, fmt).atStartOfDay();
      } catch(DateTimeParseException ignored) {
        // try the next format
      }
    }
    return null;
  }
}
