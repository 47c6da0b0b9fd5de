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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Element of a syntax tree: either a {@link SyntaxNode} or a
 * {@link SyntaxToken}. */
public abstract class SyntaxElement {
  public final SyntaxKind kind;

  SyntaxElement(SyntaxKind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the range of source text covered by this element, not
   * including the leading trivia of its first token and the trailing trivia
   * of its last token. */
  public abstract TextRange range();

  /** Returns the first token in this element, or null if it has none. */
  public abstract @Nullable SyntaxToken firstToken();

  /** Returns the last token in this element, or null if it has none. */
  public abstract @Nullable SyntaxToken lastToken();

  public boolean isToken() {
    return kind.isToken();
  }
}

// End SyntaxElement.java
