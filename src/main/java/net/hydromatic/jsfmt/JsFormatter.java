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
package net.hydromatic.jsfmt;

import com.google.common.collect.ImmutableList;
import net.hydromatic.jsfmt.config.Configuration;
import net.hydromatic.jsfmt.config.FormatOptions;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.format.FormatContext;
import net.hydromatic.jsfmt.format.FormatDiagnostic;
import net.hydromatic.jsfmt.format.FormatResult;
import net.hydromatic.jsfmt.format.FormatTracer;
import net.hydromatic.jsfmt.format.FormatTracers;
import net.hydromatic.jsfmt.format.Formatter;
import net.hydromatic.jsfmt.parse.JsParser;
import net.hydromatic.jsfmt.printer.Printer;
import net.hydromatic.jsfmt.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Formats JavaScript source code.
 *
 * <p>Formatting happens in two phases. First, a {@link Formatter} converts
 * the syntax tree into a {@link Doc}, a description of the possible
 * layouts. Then the {@link Printer} chooses, for each group in the doc,
 * whether it fits on the line, and produces text.
 *
 * <p>Each call uses its own state, so it is safe to format several trees
 * at the same time from different threads. */
public abstract class JsFormatter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JsFormatter.class);

  private JsFormatter() {}

  /** Formats a syntax tree. */
  public static FormatResult format(SyntaxTree tree, FormatOptions options) {
    return format(tree, options, FormatTracers.empty());
  }

  /** Formats a syntax tree, calling a tracer with the doc and the
   * result. */
  public static FormatResult format(SyntaxTree tree, FormatOptions options,
      FormatTracer tracer) {
    final Formatter formatter =
        new Formatter(FormatContext.of(tree, options));
    final Doc doc = formatter.formatTree();
    tracer.onDoc(doc);
    final String text = Printer.print(doc, options.toPrinterOptions());
    final FormatResult result =
        new FormatResult(text, formatter.diagnostics());
    for (FormatDiagnostic diagnostic : result.diagnostics) {
      tracer.onDiagnostic(diagnostic);
    }
    tracer.onPrinted(text);
    LOGGER.debug("formatted {}: {} chars in, {} chars out, {} warnings",
        tree.file, tree.source.length(), text.length(),
        result.diagnostics.size());
    return result;
  }

  /** Parses and formats source text. */
  public static FormatResult formatSource(String source,
      FormatOptions options) {
    return format(JsParser.parse(source), options);
  }

  /** Parses and formats source text according to a configuration. If the
   * configuration disables the formatter, returns the source unchanged. */
  public static FormatResult formatSource(String source,
      Configuration configuration) {
    if (configuration.isFormatterDisabled()) {
      LOGGER.debug("formatter is disabled; source unchanged");
      return new FormatResult(source, ImmutableList.of());
    }
    return formatSource(source, configuration.toFormatOptions());
  }

  /** Converts a syntax tree to a doc, without printing it. */
  public static Doc toDoc(SyntaxTree tree, FormatOptions options) {
    return new Formatter(FormatContext.of(tree, options)).formatTree();
  }
}

// End JsFormatter.java
