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

import net.hydromatic.jsfmt.syntax.Pos;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.util.JsfmtException;

/** Thrown by a formatting rule that cannot format a node.
 *
 * <p>The formatter catches it, prints the node as it appears in the source,
 * and records a {@link FormatDiagnostic warning}. */
public class FormatException extends RuntimeException
    implements JsfmtException {
  public final Kind kind;
  public final SyntaxKind nodeKind;
  private final Pos pos;

  public FormatException(Kind kind, SyntaxKind nodeKind, String message,
      Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.nodeKind = requireNonNull(nodeKind);
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Why a node could not be formatted. */
  public enum Kind {
    /** There is no formatting rule for this kind of node. */
    UNSUPPORTED_NODE,
    /** The node is missing a token that its grammar requires. */
    MISSING_TOKEN,
    /** The node is missing a child node that its grammar requires. */
    MISSING_NODE,
    /** The parser flagged the node as containing a syntax error. */
    SYNTAX_ERROR,
    /** The formatting rules did not print a comment inside the node. */
    LOST_COMMENT
  }
}

// End FormatException.java
