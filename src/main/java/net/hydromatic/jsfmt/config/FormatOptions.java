/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.jsfmt.config;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.jsfmt.printer.IndentStyle;
import net.hydromatic.jsfmt.printer.LineEnding;
import net.hydromatic.jsfmt.printer.PrinterOptions;

/** Immutable set of formatting options.
 *
 * <p>Values are validated when the options are created; invalid values
 * cause a {@link ConfigurationException}, so a formatting run never starts
 * with bad options.
 *
 * <p>Create options from a map of {@link FormatProp properties}, or start
 * from {@link #DEFAULT} and call the {@code withXxx} methods. */
public final class FormatOptions {
  /** Largest allowed indent width. */
  public static final int MAX_INDENT_WIDTH = 16;

  public static final FormatOptions DEFAULT = of(ImmutableMap.of());

  public final int lineWidth;
  public final IndentStyle indentStyle;
  public final int indentWidth;
  public final LineEnding lineEnding;
  public final QuoteStyle quoteStyle;
  public final TrailingComma trailingComma;
  public final boolean preserveEdgeBlankLines;

  private FormatOptions(int lineWidth, IndentStyle indentStyle,
      int indentWidth, LineEnding lineEnding, QuoteStyle quoteStyle,
      TrailingComma trailingComma, boolean preserveEdgeBlankLines) {
    if (lineWidth < 1) {
      throw new ConfigurationException("invalid line width " + lineWidth
          + "; must be at least 1");
    }
    if (indentWidth < 1 || indentWidth > MAX_INDENT_WIDTH) {
      throw new ConfigurationException("invalid indent width " + indentWidth
          + "; must be between 1 and " + MAX_INDENT_WIDTH);
    }
    this.lineWidth = lineWidth;
    this.indentStyle = requireNonNull(indentStyle);
    this.indentWidth = indentWidth;
    this.lineEnding = requireNonNull(lineEnding);
    this.quoteStyle = requireNonNull(quoteStyle);
    this.trailingComma = requireNonNull(trailingComma);
    this.preserveEdgeBlankLines = preserveEdgeBlankLines;
  }

  /** Creates options from a map of property values; properties not in the
   * map have their default values. */
  public static FormatOptions of(Map<FormatProp, Object> map) {
    return new FormatOptions(FormatProp.LINE_WIDTH.intValue(map),
        FormatProp.INDENT_STYLE.enumValue(map, IndentStyle.class),
        FormatProp.INDENT_WIDTH.intValue(map),
        FormatProp.LINE_ENDING.enumValue(map, LineEnding.class),
        FormatProp.QUOTE_STYLE.enumValue(map, QuoteStyle.class),
        FormatProp.TRAILING_COMMA.enumValue(map, TrailingComma.class),
        FormatProp.PRESERVE_EDGE_BLANK_LINES.booleanValue(map));
  }

  /** Creates options from property names and values. Names may be camel
   * case ("lineWidth") or upper case ("LINE_WIDTH"); values may be strings.
   *
   * @throws ConfigurationException if a name or value is invalid */
  public static FormatOptions parse(Map<String, ?> properties) {
    final Map<FormatProp, Object> map = new EnumMap<>(FormatProp.class);
    properties.forEach((name, value) ->
        FormatProp.lookup(name).setLenient(map, value));
    return of(map);
  }

  /** Returns the values of all properties. */
  public ImmutableMap<FormatProp, Object> toMap() {
    return ImmutableMap.<FormatProp, Object>builder()
        .put(FormatProp.LINE_WIDTH, lineWidth)
        .put(FormatProp.INDENT_STYLE, indentStyle)
        .put(FormatProp.INDENT_WIDTH, indentWidth)
        .put(FormatProp.LINE_ENDING, lineEnding)
        .put(FormatProp.QUOTE_STYLE, quoteStyle)
        .put(FormatProp.TRAILING_COMMA, trailingComma)
        .put(FormatProp.PRESERVE_EDGE_BLANK_LINES, preserveEdgeBlankLines)
        .build();
  }

  /** Returns a copy of these options with one property changed. */
  public FormatOptions with(FormatProp prop, Object value) {
    final Map<FormatProp, Object> map = new EnumMap<>(toMap());
    prop.setLenient(map, value);
    return of(map);
  }

  public FormatOptions withLineWidth(int lineWidth) {
    return with(FormatProp.LINE_WIDTH, lineWidth);
  }

  public FormatOptions withIndentStyle(IndentStyle indentStyle) {
    return with(FormatProp.INDENT_STYLE, indentStyle);
  }

  public FormatOptions withIndentWidth(int indentWidth) {
    return with(FormatProp.INDENT_WIDTH, indentWidth);
  }

  public FormatOptions withLineEnding(LineEnding lineEnding) {
    return with(FormatProp.LINE_ENDING, lineEnding);
  }

  public FormatOptions withQuoteStyle(QuoteStyle quoteStyle) {
    return with(FormatProp.QUOTE_STYLE, quoteStyle);
  }

  public FormatOptions withTrailingComma(TrailingComma trailingComma) {
    return with(FormatProp.TRAILING_COMMA, trailingComma);
  }

  public FormatOptions withPreserveEdgeBlankLines(
      boolean preserveEdgeBlankLines) {
    return with(FormatProp.PRESERVE_EDGE_BLANK_LINES, preserveEdgeBlankLines);
  }

  /** Returns the options that the printer needs. */
  public PrinterOptions toPrinterOptions() {
    return new PrinterOptions(lineWidth, indentStyle, indentWidth, lineEnding);
  }

  @Override public int hashCode() {
    return Objects.hash(lineWidth, indentStyle, indentWidth, lineEnding,
        quoteStyle, trailingComma, preserveEdgeBlankLines);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FormatOptions
        && toMap().equals(((FormatOptions) o).toMap());
  }

  @Override public String toString() {
    return toMap().toString();
  }
}

// End FormatOptions.java
