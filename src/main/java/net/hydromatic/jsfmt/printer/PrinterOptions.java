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
package net.hydromatic.jsfmt.printer;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import java.util.Objects;

/** Settings that affect how the printer lays out a document. */
public final class PrinterOptions {
  public static final PrinterOptions DEFAULT =
      new PrinterOptions(80, IndentStyle.SPACE, 2, LineEnding.LF);

  public final int lineWidth;
  public final IndentStyle indentStyle;
  public final int indentWidth;
  public final LineEnding lineEnding;

  public PrinterOptions(int lineWidth, IndentStyle indentStyle,
      int indentWidth, LineEnding lineEnding) {
    checkArgument(lineWidth > 0, "line width must be positive: %s",
        lineWidth);
    checkArgument(indentWidth > 0, "indent width must be positive: %s",
        indentWidth);
    this.lineWidth = lineWidth;
    this.indentStyle = requireNonNull(indentStyle);
    this.indentWidth = indentWidth;
    this.lineEnding = requireNonNull(lineEnding);
  }

  /** Returns the text of one level of indentation. */
  String indentUnit() {
    return indentStyle == IndentStyle.TAB
        ? "\t"
        : Strings.repeat(" ", indentWidth);
  }

  public PrinterOptions withLineWidth(int lineWidth) {
    return new PrinterOptions(lineWidth, indentStyle, indentWidth,
        lineEnding);
  }

  @Override public int hashCode() {
    return Objects.hash(lineWidth, indentStyle, indentWidth, lineEnding);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof PrinterOptions
        && lineWidth == ((PrinterOptions) o).lineWidth
        && indentStyle == ((PrinterOptions) o).indentStyle
        && indentWidth == ((PrinterOptions) o).indentWidth
        && lineEnding == ((PrinterOptions) o).lineEnding;
  }

  @Override public String toString() {
    return "{lineWidth: " + lineWidth
        + ", indentStyle: " + indentStyle
        + ", indentWidth: " + indentWidth
        + ", lineEnding: " + lineEnding + "}";
  }
}

// End PrinterOptions.java
