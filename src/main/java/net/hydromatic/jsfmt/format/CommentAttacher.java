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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.SyntaxTree;
import net.hydromatic.jsfmt.syntax.Trivia;
import net.hydromatic.jsfmt.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Decides where each comment in a syntax tree is printed.
 *
 * <p>A comment in the trailing trivia of a token, that is, on the same line
 * after it, is {@link CommentPlacement#TRAILING trailing}. A comment in the
 * leading trivia of a token is {@link CommentPlacement#LEADING leading}.
 *
 * <p>There are two exceptions, where the comment becomes
 * {@link CommentPlacement#DANGLING dangling} on the node that contains the
 * token. A comment before a closing "}", "]" or ")", or before the end of
 * the file, has no token after it inside its node. A comment after an opening
 * "{", "[" or "(" that is immediately followed by its closing token is inside
 * an empty construct. */
public class CommentAttacher {
  private final ImmutableList.Builder<SourceComment> all =
      ImmutableList.builder();
  private final ImmutableListMultimap.Builder<SyntaxToken, SourceComment>
      leading = ImmutableListMultimap.builder();
  private final ImmutableListMultimap.Builder<SyntaxToken, SourceComment>
      trailing = ImmutableListMultimap.builder();
  private final ImmutableListMultimap.Builder<SyntaxNode, SourceComment>
      dangling = ImmutableListMultimap.builder();

  private CommentAttacher() {
  }

  /** Attaches the comments in a tree. */
  public static Comments attach(SyntaxTree tree) {
    return attach(tree.root);
  }

  /** Attaches the comments in a node and its descendants. */
  public static Comments attach(SyntaxNode root) {
    final List<Entry> entries = new ArrayList<>();
    collect(root, entries);
    final CommentAttacher attacher = new CommentAttacher();
    for (int i = 0; i < entries.size(); i++) {
      final Entry entry = entries.get(i);
      final @Nullable SyntaxToken next =
          i + 1 < entries.size() ? entries.get(i + 1).token : null;
      attacher.attachLeading(entry);
      attacher.attachTrailing(entry, next);
    }
    return new Comments(attacher.all.build(), attacher.leading.build(),
        attacher.trailing.build(), attacher.dangling.build());
  }

  /** Lists the tokens under a node, in source order, each with its parent
   * and its position in the parent. */
  private static void collect(SyntaxNode node, List<Entry> entries) {
    for (int i = 0; i < node.children.size(); i++) {
      final SyntaxElement child = node.children.get(i);
      if (child instanceof SyntaxToken) {
        entries.add(new Entry((SyntaxToken) child, node, i));
      } else {
        collect((SyntaxNode) child, entries);
      }
    }
  }

  private void attachLeading(Entry entry) {
    final SyntaxToken token = entry.token;
    final CommentPlacement placement =
        isCloser(token.kind)
            ? CommentPlacement.DANGLING
            : CommentPlacement.LEADING;
    final List<Trivia> trivia = token.leading;
    int newlines = 0;
    for (int i = 0; i < trivia.size(); i++) {
      final Trivia t = trivia.get(i);
      if (t.isNewline()) {
        ++newlines;
      } else if (t.isComment()) {
        final SourceComment comment =
            new SourceComment(t, placement, token, entry.parent, newlines,
                newlinesAfter(trivia, i + 1));
        add(comment);
        newlines = 0;
      }
    }
  }

  private void attachTrailing(Entry entry, @Nullable SyntaxToken next) {
    final SyntaxToken token = entry.token;
    final CommentPlacement placement =
        isEmptyOpener(entry)
            ? CommentPlacement.DANGLING
            : CommentPlacement.TRAILING;
    final List<Trivia> trivia = token.trailing;
    for (int i = 0; i < trivia.size(); i++) {
      final Trivia t = trivia.get(i);
      if (t.isComment()) {
        // Trailing trivia ends before the line break, so the line breaks
        // after the last trailing comment are in the next token's trivia.
        final int linesAfter =
            hasCommentAfter(trivia, i + 1) || next == null
                ? 0
                : newlinesAfter(next.leading, 0);
        add(
            new SourceComment(t, placement, token, entry.parent, 0,
                linesAfter));
      }
    }
  }

  private void add(SourceComment comment) {
    all.add(comment);
    switch (comment.placement) {
    case LEADING:
      leading.put(comment.token, comment);
      break;
    case TRAILING:
      trailing.put(comment.token, comment);
      break;
    default:
      dangling.put(comment.owner, comment);
      break;
    }
  }

  /** Counts the line breaks from position {@code start} up to the next
   * comment or the end of the list. */
  private static int newlinesAfter(List<Trivia> trivia, int start) {
    int newlines = 0;
    for (int i = start; i < trivia.size(); i++) {
      final Trivia t = trivia.get(i);
      if (t.isComment()) {
        break;
      }
      if (t.isNewline()) {
        ++newlines;
      }
    }
    return newlines;
  }

  private static boolean hasCommentAfter(List<Trivia> trivia, int start) {
    for (int i = start; i < trivia.size(); i++) {
      if (trivia.get(i).isComment()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isCloser(SyntaxKind kind) {
    switch (kind) {
    case R_CURLY:
    case R_BRACK:
    case R_PAREN:
    case EOF:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether a token is an opening bracket that is immediately
   * followed, within the same node, by its closing bracket.
   *
   * <p>Empty statements without comments in between do not count, because
   * they are not printed. */
  private static boolean isEmptyOpener(Entry entry) {
    final @Nullable SyntaxKind closer = closerOf(entry.token.kind);
    if (closer == null) {
      return false;
    }
    final List<SyntaxElement> children = entry.parent.children;
    int i = entry.index + 1;
    while (i < children.size() && isSilentEmptyStatement(children.get(i))) {
      ++i;
    }
    return i < children.size() && children.get(i).kind == closer;
  }

  /** Returns whether an element is an empty statement, ";", that has no
   * comments and will not be printed. */
  private static boolean isSilentEmptyStatement(SyntaxElement element) {
    if (element.kind != SyntaxKind.EMPTY_STATEMENT
        || !(element instanceof SyntaxNode)) {
      return false;
    }
    final SyntaxNode node = (SyntaxNode) element;
    final @Nullable SyntaxToken token = node.firstToken();
    return !node.error
        && token != null
        && !Static.anyMatch(token.leading, Trivia::isComment)
        && !Static.anyMatch(token.trailing, Trivia::isComment);
  }

  private static @Nullable SyntaxKind closerOf(SyntaxKind kind) {
    switch (kind) {
    case L_CURLY:
      return SyntaxKind.R_CURLY;
    case L_BRACK:
      return SyntaxKind.R_BRACK;
    case L_PAREN:
      return SyntaxKind.R_PAREN;
    default:
      return null;
    }
  }

  /** Token, with its parent and position in the parent. */
  private static class Entry {
    final SyntaxToken token;
    final SyntaxNode parent;
    final int index;

    Entry(SyntaxToken token, SyntaxNode parent, int index) {
      this.token = token;
      this.parent = parent;
      this.index = index;
    }
  }
}

// End CommentAttacher.java
