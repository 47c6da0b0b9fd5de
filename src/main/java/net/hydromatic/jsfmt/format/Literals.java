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
package net.hydromatic.jsfmt.format;

import java.util.Locale;
import net.hydromatic.jsfmt.config.QuoteStyle;

/** Normalizes the text of literals. */
public abstract class Literals {
  private Literals() {}

  /** Normalizes a string literal, including its quotes.
   *
   * <p>Uses the preferred quote unless the content contains more of the
   * preferred quote than of the alternate quote; on a tie, uses the
   * preferred quote. Quotes in the content are escaped or unescaped to suit
   * the chosen quote; other escapes are unchanged. */
  public static String string(String text, QuoteStyle style) {
    if (text.length() < 2) {
      return text;
    }
    final String content = text.substring(1, text.length() - 1);
    final char preferred = style.quote;
    final char alternate = style.alternate();
    int preferredCount = 0;
    int alternateCount = 0;
    for (int i = 0; i < content.length(); i++) {
      final char c = content.charAt(i);
      if (c == preferred) {
        ++preferredCount;
      } else if (c == alternate) {
        ++alternateCount;
      }
    }
    final char quote =
        preferredCount > alternateCount ? alternate : preferred;
    final char other = quote == '"' ? '\'' : '"';
    final StringBuilder b = new StringBuilder(text.length() + 2);
    b.append(quote);
    for (int i = 0; i < content.length(); i++) {
      final char c = content.charAt(i);
      if (c == '\\' && i + 1 < content.length()) {
        final char escaped = content.charAt(++i);
        if (escaped != other) {
          b.append('\\');
        }
        b.append(escaped);
      } else if (c == quote) {
        b.append('\\').append(c);
      } else {
        b.append(c);
      }
    }
    return b.append(quote).toString();
  }

  /** Normalizes a numeric literal.
   *
   * <p>Lower-cases the radix prefix and the exponent marker. Adds "0"
   * before a leading "." and removes a trailing ".", and removes "+" from
   * the exponent. Hexadecimal digits and numeric separators are
   * unchanged. */
  public static String number(String text) {
    if (text.length() > 2
        && text.charAt(0) == '0'
        && "xXoObB".indexOf(text.charAt(1)) >= 0) {
      return text.substring(0, 2).toLowerCase(Locale.ROOT)
          + text.substring(2);
    }
    if (text.endsWith("n")) {
      return text;
    }
    final int e = Math.max(text.indexOf('e'), text.indexOf('E'));
    String mantissa = e < 0 ? text : text.substring(0, e);
    String exponent = e < 0 ? "" : text.substring(e + 1);
    if (mantissa.startsWith(".")) {
      mantissa = "0" + mantissa;
    }
    if (mantissa.endsWith(".")) {
      mantissa = mantissa.substring(0, mantissa.length() - 1);
    }
    if (exponent.startsWith("+")) {
      exponent = exponent.substring(1);
    }
    return e < 0 ? mantissa : mantissa + "e" + exponent;
  }

  /** Returns whether a normalized numeric literal is an integer written
   * in decimal, so that a "." after it would be parsed as a decimal
   * point. */
  public static boolean isDecimalInteger(String text) {
    if (text.isEmpty() || text.endsWith("n")) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (!(c >= '0' && c <= '9') && c != '_') {
        return false;
      }
    }
    return true;
  }
}

// End Literals.java
