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

import net.hydromatic.jsfmt.config.FormatOptions;
import net.hydromatic.jsfmt.syntax.Pos;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxTree;

/** Immutable inputs to formatting one tree: the tree and its source text,
 * the options, and the comment index. Contexts are created per run. */
public final class FormatContext {
  public final SyntaxTree tree;
  public final FormatOptions options;
  public final Comments comments;

  FormatContext(SyntaxTree tree, FormatOptions options,
      Comments comments) {
    this.tree = requireNonNull(tree);
    this.options = requireNonNull(options);
    this.comments = requireNonNull(comments);
  }

  /** Creates a context, attaching the comments of the tree. */
  public static FormatContext of(SyntaxTree tree, FormatOptions options) {
    return new FormatContext(tree, options, CommentAttacher.attach(tree));
  }

  /** Returns the source text. */
  public String source() {
    return tree.source;
  }

  /** Returns the position of an element, for messages. */
  public Pos pos(SyntaxElement element) {
    return tree.pos(element.range());
  }
}

// End FormatContext.java
