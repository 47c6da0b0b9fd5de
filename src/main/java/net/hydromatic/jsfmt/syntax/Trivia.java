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
package net.hydromatic.jsfmt.syntax;

import static java.util.Objects.requireNonNull;

/** Whitespace or a comment attached to the leading or trailing edge of a
 * {@link SyntaxToken}. */
public final class Trivia {
  public final Kind kind;
  public final String text;
  /** Offset of the first character in the source text. */
  public final int offset;

  public Trivia(Kind kind, String text, int offset) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.offset = offset;
  }

  public TextRange range() {
    return TextRange.at(offset, text.length());
  }

  public boolean isComment() {
    return kind == Kind.SINGLE_LINE_COMMENT
        || kind == Kind.MULTI_LINE_COMMENT;
  }

  public boolean isNewline() {
    return kind == Kind.NEWLINE;
  }

  @Override public String toString() {
    return kind + "(" + text.replace("\n", "\\n") + ")";
  }

  /** Kind of trivia. */
  public enum Kind {
    /** Run of spaces and tabs. */
    WHITESPACE,
    /** One line break, "\n" or "\r\n". */
    NEWLINE,
    /** Comment that starts with "//" and ends before the line break. */
    SINGLE_LINE_COMMENT,
    /** Comment delimited by "/*" and "*&#47;"; may span lines. */
    MULTI_LINE_COMMENT
  }
}

// End Trivia.java
