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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Result of formatting a syntax tree: the formatted text, and the warnings
 * produced along the way. */
public final class FormatResult {
  public final String text;
  public final ImmutableList<FormatDiagnostic> diagnostics;

  public FormatResult(String text, List<FormatDiagnostic> diagnostics) {
    this.text = requireNonNull(text);
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  /** Returns whether any part of the tree was printed verbatim. */
  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }

  @Override public String toString() {
    return text;
  }
}

// End FormatResult.java
