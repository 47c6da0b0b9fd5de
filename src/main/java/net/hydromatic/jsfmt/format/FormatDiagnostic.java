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

import java.util.Objects;
import net.hydromatic.jsfmt.syntax.Pos;

/** Warning produced while formatting.
 *
 * <p>A diagnostic never stops formatting; it explains why part of the
 * output is the original source text rather than formatted text. */
public final class FormatDiagnostic {
  public final FormatException.Kind kind;
  public final String message;
  public final Pos pos;

  public FormatDiagnostic(FormatException.Kind kind, String message,
      Pos pos) {
    this.kind = requireNonNull(kind);
    this.message = requireNonNull(message);
    this.pos = requireNonNull(pos);
  }

  /** Creates a diagnostic from the exception thrown by a rule. */
  static FormatDiagnostic of(FormatException e) {
    return new FormatDiagnostic(e.kind, e.getMessage(), e.pos());
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Warning: ")
        .append(message);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override public int hashCode() {
    return Objects.hash(kind, message, pos);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FormatDiagnostic
        && kind == ((FormatDiagnostic) o).kind
        && message.equals(((FormatDiagnostic) o).message)
        && pos.equals(((FormatDiagnostic) o).pos);
  }
}

// End FormatDiagnostic.java
