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
import net.hydromatic.jsfmt.parse.JsParseException;

/** Syntax tree of one source file, as produced by the parser.
 *
 * <p>Holds the source text, so that unformattable regions can be printed
 * verbatim, and the errors found while parsing. */
public final class SyntaxTree {
  public final String source;
  public final String file;
  public final SyntaxNode root;
  public final ImmutableList<JsParseException> errors;

  public SyntaxTree(String source, String file, SyntaxNode root,
      List<JsParseException> errors) {
    this.source = requireNonNull(source);
    this.file = requireNonNull(file);
    this.root = requireNonNull(root);
    this.errors = ImmutableList.copyOf(errors);
    checkArgument(root.kind == SyntaxKind.PROGRAM,
        "root must be a program: %s", root.kind);
  }

  /** Returns whether the parser reported any errors. */
  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Returns the source text of a range. */
  public String text(TextRange range) {
    return range.substring(source);
  }

  /** Converts a range into a position, for messages. */
  public Pos pos(TextRange range) {
    return Pos.of(source, file, range);
  }
}

// End SyntaxTree.java
