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

/** Indentation at a point in the document.
 *
 * <p>Immutable; {@link #indent} returns a new, deeper, indentation. */
final class Indentation {
  /** Text written at the start of an indented line. */
  final String text;
  /** Width of {@link #text} in columns. A tab counts as the indent width. */
  final int width;

  private Indentation(String text, int width) {
    this.text = text;
    this.width = width;
  }

  /** Returns the indentation at the left margin. */
  static Indentation root() {
    return new Indentation("", 0);
  }

  /** Returns an indentation one level deeper than this. */
  Indentation indent(PrinterOptions options) {
    return new Indentation(text + options.indentUnit(),
        width + options.indentWidth);
  }
}

// End Indentation.java
