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

import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.Trivia;

/** Comment in the source, and where it is to be printed. */
public final class SourceComment {
  public final Trivia trivia;
  public final CommentPlacement placement;
  /** Token whose trivia contains the comment. */
  public final SyntaxToken token;
  /** Node that contains the token. For a dangling comment, the comment is
   * printed by the rule for this node. */
  public final SyntaxNode owner;
  /** Number of line breaks between the previous token or comment and this
   * comment. */
  public final int linesBefore;
  /** Number of line breaks between this comment and the next comment or
   * token. */
  public final int linesAfter;

  SourceComment(Trivia trivia, CommentPlacement placement, SyntaxToken token,
      SyntaxNode owner, int linesBefore, int linesAfter) {
    this.trivia = requireNonNull(trivia);
    this.placement = requireNonNull(placement);
    this.token = requireNonNull(token);
    this.owner = requireNonNull(owner);
    this.linesBefore = linesBefore;
    this.linesAfter = linesAfter;
  }

  public String text() {
    return trivia.text;
  }

  /** Returns whether this is a "//" comment, which must be followed by a
   * line break. */
  public boolean isLineComment() {
    return trivia.kind == Trivia.Kind.SINGLE_LINE_COMMENT;
  }

  /** Returns whether this comment spans more than one line. */
  public boolean isMultiline() {
    return trivia.text.indexOf('\n') >= 0 || trivia.text.indexOf('\r') >= 0;
  }

  /** Returns whether the comment is followed by a line break in the
   * source. */
  public boolean breaksAfter() {
    return isLineComment() || linesAfter > 0;
  }

  @Override public String toString() {
    return placement + "(" + trivia.text + ")";
  }
}

// End SourceComment.java
