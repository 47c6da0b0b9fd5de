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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formatting rules for the program and for statements. */
final class StatementRules {
  private StatementRules() {}

  /** Formats a program: statements, one per line, and a final line
   * break. */
  static Doc program(Formatter f, SyntaxNode node) {
    final SyntaxToken eof = f.requiredToken(node, SyntaxKind.EOF);
    final List<SyntaxNode> statements = printable(f, node.nodes());
    final boolean empty =
        statements.isEmpty() && !f.comments.hasDangling(node);
    return doc.concat(statementList(f, statements),
        f.danglingLines(node, !statements.isEmpty()),
        f.token(eof),
        empty ? doc.empty() : doc.hardline());
  }

  static Doc block(Formatter f, SyntaxNode node) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_CURLY);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_CURLY);
    final List<SyntaxNode> statements = printable(f, node.nodes());
    if (statements.isEmpty() && !f.comments.hasDangling(node)) {
      return doc.concat(f.token(open), f.token(close));
    }
    final boolean preserve = f.options().preserveEdgeBlankLines;
    final boolean blankAtStart;
    if (!statements.isEmpty()) {
      blankAtStart = Comments.hasBlankLineBefore(first(statements.get(0)));
    } else {
      blankAtStart = f.comments.dangling(node).get(0).linesBefore >= 2;
    }
    final boolean blankAtEnd = Comments.hasBlankLineImmediatelyBefore(close);
    return doc.group(f.token(open),
        doc.indent(preserve && blankAtStart ? doc.emptyLine() : doc.hardline(),
            statementList(f, statements),
            f.danglingLines(node, !statements.isEmpty())),
        preserve && blankAtEnd ? doc.emptyLine() : doc.hardline(),
        f.token(close));
  }

  /** Returns the statements that will be printed. An empty statement is
   * omitted unless it has comments. */
  private static List<SyntaxNode> printable(Formatter f,
      List<SyntaxNode> statements) {
    final List<SyntaxNode> list = new ArrayList<>();
    for (SyntaxNode statement : statements) {
      if (statement.kind == SyntaxKind.EMPTY_STATEMENT
          && !statement.error
          && !f.comments.hasComments(first(statement))) {
        continue;
      }
      list.add(statement);
    }
    return list;
  }

  /** Formats statements one per line, keeping one empty line where the
   * source has one or more. */
  private static Doc statementList(Formatter f, List<SyntaxNode> statements) {
    final List<Doc> docs = new ArrayList<>();
    for (SyntaxNode statement : statements) {
      if (!docs.isEmpty()) {
        docs.add(
            Comments.hasBlankLineBefore(first(statement))
                ? doc.emptyLine()
                : doc.hardline());
      }
      docs.add(f.format(statement));
    }
    return doc.concat(docs);
  }

  private static SyntaxToken first(SyntaxNode node) {
    final @Nullable SyntaxToken token = node.firstToken();
    if (token == null) {
      throw new AssertionError("node has no tokens: " + node);
    }
    return token;
  }

  /** Formats an expression statement or variable statement: the child
   * followed by a semicolon, which is inserted if missing. */
  static Doc simpleStatement(Formatter f, SyntaxNode node) {
    return f.formatFollowedBy(f.requiredNode(node, 0),
        f.tokenOrInsert(node.token(SyntaxKind.SEMICOLON), ";"));
  }

  /** Formats "var a = 1, b". */
  static Doc variableDeclaration(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.firstChildToken(node);
    final List<SyntaxNode> declarators = node.nodes();
    final List<SyntaxToken> commas = node.tokens(SyntaxKind.COMMA);
    final SyntaxNode firstDeclarator = f.requiredNode(node, 0);
    if (declarators.size() == 1) {
      return doc.concat(f.token(keyword), doc.space(),
          f.format(firstDeclarator));
    }
    if (commas.size() != declarators.size() - 1) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, "VARIABLE_DECLARATION has a missing comma",
          f.context.pos(node));
    }
    final Doc first =
        doc.concat(f.token(keyword), doc.space(),
            f.formatFollowedBy(firstDeclarator, f.token(commas.get(0))));
    final List<Doc> rest = new ArrayList<>();
    for (int i = 1; i < declarators.size(); i++) {
      rest.add(doc.line());
      rest.add(i < commas.size()
          ? f.formatFollowedBy(declarators.get(i), f.token(commas.get(i)))
          : f.format(declarators.get(i)));
    }
    return doc.group(first, doc.indent(doc.concat(rest)));
  }

  /** Formats "return", "throw", "break" and "continue" statements. */
  static Doc jump(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.firstChildToken(node);
    final @Nullable SyntaxNode argument = node.node(0);
    if (argument == null && node.kind == SyntaxKind.THROW_STATEMENT) {
      f.requiredNode(node, 0);
    }
    final Doc semicolon =
        f.tokenOrInsert(node.token(SyntaxKind.SEMICOLON), ";");
    if (argument == null) {
      return doc.concat(f.token(keyword), semicolon);
    }
    return doc.concat(f.token(keyword), doc.space(),
        f.formatFollowedBy(argument, semicolon));
  }

  static Doc ifStatement(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.IF_KW);
    final SyntaxNode test = f.requiredNode(node, 0);
    final SyntaxNode consequent = f.requiredNode(node, 1);
    final @Nullable SyntaxNode elseClause =
        node.node(SyntaxKind.ELSE_CLAUSE);
    final Doc head =
        doc.concat(f.token(keyword), doc.space(),
            parenthesized(f, node, f.formatUnindented(test)),
            body(f, consequent));
    if (elseClause == null) {
      return head;
    }
    return doc.concat(head,
        separateNext(f, consequent, elseClause)
            ? doc.hardline()
            : doc.space(),
        f.format(elseClause));
  }

  static Doc elseClause(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.ELSE_KW);
    final SyntaxNode body = f.requiredNode(node, 0);
    if (body.kind == SyntaxKind.IF_STATEMENT && !f.startsWithComment(body)) {
      return doc.concat(f.token(keyword), doc.space(), f.format(body));
    }
    return doc.concat(f.token(keyword), body(f, body));
  }

  /** Returns whether the clause that follows a statement, such as "else"
   * or "catch", must start a new line. */
  private static boolean separateNext(Formatter f, SyntaxNode statement,
      SyntaxNode next) {
    return statement.kind != SyntaxKind.BLOCK_STATEMENT
        || f.comments.hasTrailingLineComment(last(statement))
        || f.startsWithComment(next);
  }

  private static SyntaxToken last(SyntaxNode node) {
    final @Nullable SyntaxToken token = node.lastToken();
    if (token == null) {
      throw new AssertionError("node has no tokens: " + node);
    }
    return token;
  }

  static Doc whileStatement(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.WHILE_KW);
    final SyntaxNode test = f.requiredNode(node, 0);
    final SyntaxNode body = f.requiredNode(node, 1);
    return doc.concat(f.token(keyword), doc.space(),
        parenthesized(f, node, f.formatUnindented(test)),
        body(f, body));
  }

  static Doc doWhileStatement(Formatter f, SyntaxNode node) {
    final SyntaxToken doKeyword = f.requiredToken(node, SyntaxKind.DO_KW);
    final SyntaxToken whileKeyword =
        f.requiredToken(node, SyntaxKind.WHILE_KW);
    final SyntaxNode body = f.requiredNode(node, 0);
    final SyntaxNode test = f.requiredNode(node, 1);
    final boolean block = body.kind == SyntaxKind.BLOCK_STATEMENT;
    return doc.concat(f.token(doKeyword),
        block
            ? doc.concat(doc.space(), f.format(body))
            : doc.group(doc.indent(doc.line(), f.format(body))),
        !block
            || f.comments.hasTrailingLineComment(last(body))
            || f.comments.hasLeading(whileKeyword)
            ? doc.hardline()
            : doc.space(),
        f.token(whileKeyword), doc.space(),
        parenthesized(f, node, f.formatUnindented(test)),
        f.tokenOrInsert(node.token(SyntaxKind.SEMICOLON), ";"));
  }

  /** Formats "for (init; test; update) body". Each of the three parts may
   * be missing. */
  static Doc forStatement(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.FOR_KW);
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_PAREN);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_PAREN);
    final List<SyntaxToken> semicolons = node.tokens(SyntaxKind.SEMICOLON);
    if (semicolons.size() != 2) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, "FOR_STATEMENT must have two semicolons",
          f.context.pos(node));
    }
    final @Nullable SyntaxNode[] parts = new SyntaxNode[3];
    @Nullable SyntaxNode body = null;
    int slot = 0;
    boolean inHeader = false;
    for (SyntaxElement child : node.children) {
      if (child.kind == SyntaxKind.L_PAREN) {
        inHeader = true;
      } else if (child.kind == SyntaxKind.SEMICOLON) {
        ++slot;
      } else if (child.kind == SyntaxKind.R_PAREN) {
        inHeader = false;
      } else if (child instanceof SyntaxNode) {
        if (inHeader) {
          parts[slot] = (SyntaxNode) child;
        } else {
          body = (SyntaxNode) child;
        }
      }
    }
    if (body == null) {
      throw new FormatException(FormatException.Kind.MISSING_NODE,
          node.kind, "FOR_STATEMENT has no body", f.context.pos(node));
    }
    final Doc header;
    if (parts[0] == null && parts[1] == null && parts[2] == null
        && !f.comments.hasDangling(node)) {
      header =
          doc.concat(f.token(open), f.token(semicolons.get(0)),
              f.token(semicolons.get(1)), f.token(close));
    } else {
      final List<Doc> docs = new ArrayList<>();
      if (parts[0] != null) {
        docs.add(f.format(parts[0]));
      }
      docs.add(f.token(semicolons.get(0)));
      docs.add(doc.line());
      if (parts[1] != null) {
        docs.add(f.format(parts[1]));
      }
      docs.add(f.token(semicolons.get(1)));
      if (parts[2] != null) {
        docs.add(doc.line());
        docs.add(f.format(parts[2]));
      }
      header =
          doc.group(f.token(open),
              doc.indent(doc.softline(), doc.concat(docs),
                  f.danglingInline(node)),
              doc.softline(), f.token(close));
    }
    return doc.concat(f.token(keyword), doc.space(), header, body(f, body));
  }

  static Doc tryStatement(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.TRY_KW);
    final SyntaxNode block = f.requiredNode(node, SyntaxKind.BLOCK_STATEMENT);
    final List<Doc> docs = new ArrayList<>();
    docs.add(f.token(keyword));
    docs.add(doc.space());
    docs.add(f.format(block));
    SyntaxNode previous = block;
    for (SyntaxNode clause : node.nodes()) {
      if (clause == block) {
        continue;
      }
      docs.add(separateNext(f, previous, clause)
          ? doc.hardline()
          : doc.space());
      docs.add(f.format(clause));
      previous = clause;
    }
    return doc.concat(docs);
  }

  /** Formats "catch (e) {...}" or "catch {...}". */
  static Doc catchClause(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.CATCH_KW);
    final SyntaxNode block = f.requiredNode(node, SyntaxKind.BLOCK_STATEMENT);
    final @Nullable SyntaxNode parameter = node.node(SyntaxKind.IDENTIFIER);
    return doc.concat(f.token(keyword),
        parameter == null
            ? doc.empty()
            : doc.concat(doc.space(),
                parenthesized(f, node, f.format(parameter))),
        doc.space(),
        f.format(block));
  }

  static Doc finallyClause(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword =
        f.requiredToken(node, SyntaxKind.FINALLY_KW);
    final SyntaxNode block = f.requiredNode(node, SyntaxKind.BLOCK_STATEMENT);
    return doc.concat(f.token(keyword), doc.space(), f.format(block));
  }

  /** Formats the parenthesized part of a statement, such as the condition
   * of an "if". Breaks inside the parentheses if the content does not
   * fit. */
  private static Doc parenthesized(Formatter f, SyntaxNode node,
      Doc content) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_PAREN);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_PAREN);
    return doc.group(f.token(open),
        doc.indent(doc.softline(), content, f.danglingInline(node)),
        doc.softline(),
        f.token(close));
  }

  /** Formats the body of an "if", "else", "while", "do" or "for". A block
   * follows on the same line; another statement goes on the next line if it
   * does not fit. */
  private static Doc body(Formatter f, SyntaxNode statement) {
    switch (statement.kind) {
    case BLOCK_STATEMENT:
      return doc.concat(doc.space(), f.format(statement));
    case EMPTY_STATEMENT:
      return f.format(statement);
    default:
      return doc.group(doc.indent(doc.line(), f.format(statement)));
    }
  }
}

// End StatementRules.java
