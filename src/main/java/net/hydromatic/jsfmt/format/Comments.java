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
import com.google.common.collect.ImmutableListMultimap;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.Trivia;
import net.hydromatic.jsfmt.util.Static;

/** Index of the comments in a syntax tree, by the token or node that they
 * are attached to.
 *
 * <p>Created by {@link CommentAttacher}. Immutable, and therefore safe to
 * share between threads. */
public final class Comments {
  public final ImmutableList<SourceComment> all;
  private final ImmutableListMultimap<SyntaxToken, SourceComment> leading;
  private final ImmutableListMultimap<SyntaxToken, SourceComment> trailing;
  private final ImmutableListMultimap<SyntaxNode, SourceComment> dangling;

  Comments(ImmutableList<SourceComment> all,
      ImmutableListMultimap<SyntaxToken, SourceComment> leading,
      ImmutableListMultimap<SyntaxToken, SourceComment> trailing,
      ImmutableListMultimap<SyntaxNode, SourceComment> dangling) {
    this.all = requireNonNull(all);
    this.leading = requireNonNull(leading);
    this.trailing = requireNonNull(trailing);
    this.dangling = requireNonNull(dangling);
  }

  /** Comments printed before a token. */
  public ImmutableList<SourceComment> leading(SyntaxToken token) {
    return leading.get(token);
  }

  /** Comments printed after a token. */
  public ImmutableList<SourceComment> trailing(SyntaxToken token) {
    return trailing.get(token);
  }

  /** Comments that the rule for a node must print itself. */
  public ImmutableList<SourceComment> dangling(SyntaxNode node) {
    return dangling.get(node);
  }

  public boolean hasLeading(SyntaxToken token) {
    return leading.containsKey(token);
  }

  public boolean hasDangling(SyntaxNode node) {
    return dangling.containsKey(node);
  }

  /** Returns whether a token has leading or trailing comments. */
  public boolean hasComments(SyntaxToken token) {
    return leading.containsKey(token) || trailing.containsKey(token);
  }

  /** Returns whether a token has a trailing "//" comment. */
  public boolean hasTrailingLineComment(SyntaxToken token) {
    return Static.anyMatch(trailing.get(token), SourceComment::isLineComment);
  }

  /** Returns whether the source has an empty line before a token, or before
   * the first comment that precedes it. */
  public static boolean hasBlankLineBefore(SyntaxToken token) {
    int newlines = 0;
    for (Trivia trivia : token.leading) {
      if (trivia.isComment()) {
        break;
      }
      if (trivia.isNewline()) {
        ++newlines;
      }
    }
    return newlines >= 2;
  }

  /** Returns whether the source has an empty line immediately before a
   * token, after any comments that precede it. */
  public static boolean hasBlankLineImmediatelyBefore(SyntaxToken token) {
    int newlines = 0;
    for (Trivia trivia : token.leading) {
      if (trivia.isComment()) {
        newlines = 0;
      } else if (trivia.isNewline()) {
        ++newlines;
      }
    }
    return newlines >= 2;
  }
}

// End Comments.java
