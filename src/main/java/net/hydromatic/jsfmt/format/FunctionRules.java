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

import static net.hydromatic.jsfmt.doc.DocBuilder.doc;

import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formatting rules for functions and their parameters. */
final class FunctionRules {
  private FunctionRules() {}

  /** Formats a function declaration or expression. An anonymous function
   * has a space after "function", as in "function (x) {}". */
  static Doc function(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword =
        f.requiredToken(node, SyntaxKind.FUNCTION_KW);
    final @Nullable SyntaxNode name = node.node(SyntaxKind.IDENTIFIER);
    final SyntaxNode parameters =
        f.requiredNode(node, SyntaxKind.PARAMETER_LIST);
    final SyntaxNode body = f.requiredNode(node, SyntaxKind.BLOCK_STATEMENT);
    return doc.concat(f.token(keyword), doc.space(),
        name == null ? doc.empty() : f.format(name),
        f.format(parameters), doc.space(), f.format(body));
  }

  /** Formats an arrow function. A sole parameter is always
   * parenthesized. */
  static Doc arrow(Formatter f, SyntaxNode node) {
    final SyntaxNode parameters = f.requiredNode(node, 0);
    final SyntaxToken arrow = f.requiredToken(node, SyntaxKind.FAT_ARROW);
    final SyntaxNode body = f.requiredNode(node, 1);
    final Doc head =
        doc.concat(
            parameters.kind == SyntaxKind.PARAMETER
                ? doc.concat(doc.text("("), f.format(parameters),
                    doc.text(")"))
                : f.format(parameters),
            doc.space(), f.token(arrow));
    if (hugsBody(body) && !f.startsWithComment(body)) {
      return doc.concat(head, doc.space(), f.format(body));
    }
    return doc.group(head, doc.group(doc.indent(doc.line(), f.format(body))));
  }

  /** Returns whether the body of an arrow function stays on the same line
   * as the arrow. */
  private static boolean hugsBody(SyntaxNode body) {
    switch (body.kind) {
    case BLOCK_STATEMENT:
    case OBJECT_EXPRESSION:
    case ARRAY_EXPRESSION:
    case PARENTHESIZED_EXPRESSION:
    case ARROW_FUNCTION:
    case FUNCTION_EXPRESSION:
      return true;
    default:
      return false;
    }
  }

  /** Formats a parameter, "x" or "x = default". */
  static Doc parameter(Formatter f, SyntaxNode node) {
    final SyntaxToken name = f.firstChildToken(node);
    final @Nullable SyntaxToken eq = node.token(SyntaxKind.EQ);
    if (eq == null) {
      return f.token(name);
    }
    return doc.concat(f.token(name), doc.space(), f.token(eq), doc.space(),
        f.format(f.requiredNode(node, 0)));
  }
}

// End FunctionRules.java
