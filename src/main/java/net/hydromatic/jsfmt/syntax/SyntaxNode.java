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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Node of a syntax tree.
 *
 * <p>A node has a kind and an ordered list of children, each of which is a
 * node or a token. Nodes are immutable; the formatter never modifies them.
 *
 * <p>A node whose {@link #error} flag is set is missing a part that the
 * grammar requires; the parser could not recover it. */
public final class SyntaxNode extends SyntaxElement {
  public final ImmutableList<SyntaxElement> children;
  public final boolean error;
  private final TextRange range;

  public SyntaxNode(SyntaxKind kind, List<? extends SyntaxElement> children,
      boolean error) {
    super(kind);
    checkArgument(!kind.isToken(), "not a node kind: %s", kind);
    this.children = ImmutableList.copyOf(children);
    this.error = error;
    final SyntaxToken first = firstToken();
    final SyntaxToken last = lastToken();
    this.range = first == null || last == null
        ? TextRange.EMPTY
        : first.range().cover(last.range());
  }

  /** Creates a well-formed node. */
  public static SyntaxNode of(SyntaxKind kind, SyntaxElement... children) {
    return new SyntaxNode(kind, ImmutableList.copyOf(children), false);
  }

  @Override public TextRange range() {
    return range;
  }

  @Override public @Nullable SyntaxToken firstToken() {
    for (SyntaxElement child : children) {
      final SyntaxToken token = child.firstToken();
      if (token != null) {
        return token;
      }
    }
    return null;
  }

  @Override public @Nullable SyntaxToken lastToken() {
    for (SyntaxElement child : children.reverse()) {
      final SyntaxToken token = child.lastToken();
      if (token != null) {
        return token;
      }
    }
    return null;
  }

  /** Returns whether this node or any node below it has its error flag
   * set. */
  public boolean hasError() {
    if (error) {
      return true;
    }
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxNode && ((SyntaxNode) child).hasError()) {
        return true;
      }
    }
    return false;
  }

  /** Returns the first direct child token of a given kind, or null. */
  public @Nullable SyntaxToken token(SyntaxKind kind) {
    for (SyntaxElement child : children) {
      if (child.kind == kind && child instanceof SyntaxToken) {
        return (SyntaxToken) child;
      }
    }
    return null;
  }

  /** Returns the first direct child token that is one of the given kinds,
   * or null. */
  public @Nullable SyntaxToken tokenOf(SyntaxKind... kinds) {
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxToken) {
        for (SyntaxKind kind : kinds) {
          if (child.kind == kind) {
            return (SyntaxToken) child;
          }
        }
      }
    }
    return null;
  }

  /** Returns the direct child tokens of a given kind. */
  public ImmutableList<SyntaxToken> tokens(SyntaxKind kind) {
    final ImmutableList.Builder<SyntaxToken> b = ImmutableList.builder();
    for (SyntaxElement child : children) {
      if (child.kind == kind && child instanceof SyntaxToken) {
        b.add((SyntaxToken) child);
      }
    }
    return b.build();
  }

  /** Returns the direct child nodes. */
  public ImmutableList<SyntaxNode> nodes() {
    final ImmutableList.Builder<SyntaxNode> b = ImmutableList.builder();
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxNode) {
        b.add((SyntaxNode) child);
      }
    }
    return b.build();
  }

  /** Returns the {@code i}th direct child node, or null if there are not
   * that many. */
  public @Nullable SyntaxNode node(int i) {
    int j = 0;
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxNode) {
        if (j++ == i) {
          return (SyntaxNode) child;
        }
      }
    }
    return null;
  }

  /** Returns the first direct child node of a given kind, or null. */
  public @Nullable SyntaxNode node(SyntaxKind kind) {
    for (SyntaxElement child : children) {
      if (child.kind == kind && child instanceof SyntaxNode) {
        return (SyntaxNode) child;
      }
    }
    return null;
  }

  /** Calls an action for each token in this node, in source order. */
  public void forEachToken(Consumer<SyntaxToken> action) {
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxToken) {
        action.accept((SyntaxToken) child);
      } else {
        ((SyntaxNode) child).forEachToken(action);
      }
    }
  }

  @Override public String toString() {
    return kind + "@" + range;
  }
}

// End SyntaxNode.java
