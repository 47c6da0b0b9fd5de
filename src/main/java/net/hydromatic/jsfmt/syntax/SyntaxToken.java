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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.jsfmt.util.Static;

/** Token: a span of source text with a kind, plus the trivia attached to its
 * leading and trailing edges.
 *
 * <p>Trailing trivia extends up to, but not including, the first line
 * break after the token; everything after that, up to the next token, is
 * the leading trivia of the next token. */
public final class SyntaxToken extends SyntaxElement {
  public final String text;
  /** Offset of the first character of {@link #text} in the source. */
  public final int offset;
  public final ImmutableList<Trivia> leading;
  public final ImmutableList<Trivia> trailing;

  public SyntaxToken(SyntaxKind kind, String text, int offset,
      List<Trivia> leading, List<Trivia> trailing) {
    super(kind);
    checkArgument(kind.isToken(), "not a token kind: %s", kind);
    this.text = requireNonNull(text);
    this.offset = offset;
    this.leading = ImmutableList.copyOf(leading);
    this.trailing = ImmutableList.copyOf(trailing);
  }

  /** Creates a token with no trivia. */
  public static SyntaxToken of(SyntaxKind kind, String text, int offset) {
    return new SyntaxToken(kind, text, offset, ImmutableList.of(),
        ImmutableList.of());
  }

  @Override public TextRange range() {
    return TextRange.at(offset, text.length());
  }

  @Override public SyntaxToken firstToken() {
    return this;
  }

  @Override public SyntaxToken lastToken() {
    return this;
  }

  /** Returns whether any comment is attached to this token. */
  public boolean hasComments() {
    return Static.anyMatch(leading, Trivia::isComment)
        || Static.anyMatch(trailing, Trivia::isComment);
  }

  /** Returns whether there is a line break in the leading trivia. */
  public boolean hasLeadingNewline() {
    return Static.anyMatch(leading, Trivia::isNewline);
  }

  @Override public String toString() {
    return kind + "(" + text + ")@" + offset;
  }
}

// End SyntaxToken.java
