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
package net.hydromatic.jsfmt.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jsfmt.syntax.Pos;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.SyntaxTree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Error-tolerant recursive-descent parser for a subset of JavaScript.
 *
 * <p>Every token of the source, including the end-of-file token, ends up in
 * the tree exactly once. When a construct is missing a part that the
 * grammar requires, the parser records an error and sets the
 * {@link SyntaxNode#error} flag of the node it was building. Input that
 * cannot start a statement or expression becomes a bogus node.
 *
 * <p>A semicolon may be omitted before a line break, before "}" and at the
 * end of the file. */
public class JsParser {
  private final String source;
  private final String file;
  private final ImmutableList<SyntaxToken> tokens;
  private final List<JsParseException> errors = new ArrayList<>();
  private int i;

  private JsParser(String source, String file) {
    this.source = requireNonNull(source);
    this.file = requireNonNull(file);
    final JsLexer lexer = new JsLexer(source, file);
    this.tokens = lexer.tokenize();
    this.errors.addAll(lexer.errors());
  }

  /** Parses a program. */
  public static SyntaxTree parse(String source) {
    return parse(source, "");
  }

  /** Parses a program, using a file name in error positions. */
  public static SyntaxTree parse(String source, String file) {
    final JsParser parser = new JsParser(source, file);
    final SyntaxNode root = parser.program();
    return new SyntaxTree(source, file, root, parser.errors);
  }

  // ---------------------------------------------------------------------
  // Token stream

  private SyntaxToken current() {
    return tokens.get(i);
  }

  private SyntaxKind kind() {
    return current().kind;
  }

  private SyntaxKind peek(int n) {
    return tokens.get(Math.min(i + n, tokens.size() - 1)).kind;
  }

  private boolean at(SyntaxKind kind) {
    return kind() == kind;
  }

  private SyntaxToken bump() {
    final SyntaxToken token = current();
    if (token.kind != SyntaxKind.EOF) {
      ++i;
    }
    return token;
  }

  /** Adds the current token to a node if it has the expected kind;
   * otherwise records an error and marks the node as erroneous. */
  private void expect(Builder b, SyntaxKind kind) {
    if (at(kind)) {
      b.add(bump());
    } else {
      error("expected '" + kind.text + "'");
      b.error = true;
    }
  }

  /** Adds the current token to a node if it has the given kind. */
  private boolean eat(Builder b, SyntaxKind kind) {
    if (at(kind)) {
      b.add(bump());
      return true;
    }
    return false;
  }

  /** Handles the semicolon that ends a statement. */
  private void semicolon(Builder b) {
    if (eat(b, SyntaxKind.SEMICOLON)
        || at(SyntaxKind.R_CURLY)
        || at(SyntaxKind.EOF)
        || current().hasLeadingNewline()) {
      return;
    }
    error("expected ';'");
    b.error = true;
  }

  private void error(String message) {
    final SyntaxToken token = current();
    final String what = token.kind == SyntaxKind.EOF
        ? "end of file" : "'" + token.text + "'";
    errors.add(
        new JsParseException(message + " but found " + what,
            Pos.of(source, file, token.range())));
  }

  // ---------------------------------------------------------------------
  // Statements

  private SyntaxNode program() {
    final Builder b = new Builder(SyntaxKind.PROGRAM);
    while (!at(SyntaxKind.EOF)) {
      b.add(statement());
    }
    b.add(bump());
    return b.build();
  }

  private SyntaxNode statement() {
    switch (kind()) {
    case L_CURLY:
      return block();
    case VAR_KW:
    case LET_KW:
    case CONST_KW:
      final Builder b = new Builder(SyntaxKind.VARIABLE_STATEMENT);
      b.add(variableDeclaration());
      semicolon(b);
      return b.build();
    case FUNCTION_KW:
      return function(SyntaxKind.FUNCTION_DECLARATION);
    case RETURN_KW:
      return returnStatement();
    case IF_KW:
      return ifStatement();
    case WHILE_KW:
      return whileStatement();
    case DO_KW:
      return doWhileStatement();
    case FOR_KW:
      return forStatement();
    case BREAK_KW:
      return jump(SyntaxKind.BREAK_STATEMENT);
    case CONTINUE_KW:
      return jump(SyntaxKind.CONTINUE_STATEMENT);
    case THROW_KW:
      return throwStatement();
    case TRY_KW:
      return tryStatement();
    case SEMICOLON:
      return SyntaxNode.of(SyntaxKind.EMPTY_STATEMENT, bump());
    default:
      if (canStartExpression(kind())) {
        final Builder b2 = new Builder(SyntaxKind.EXPRESSION_STATEMENT);
        b2.addOrError(expression());
        semicolon(b2);
        return b2.build();
      }
      error("expected a statement");
      return SyntaxNode.of(SyntaxKind.BOGUS_STATEMENT, bump());
    }
  }

  private SyntaxNode block() {
    final Builder b = new Builder(SyntaxKind.BLOCK_STATEMENT);
    expect(b, SyntaxKind.L_CURLY);
    while (!at(SyntaxKind.R_CURLY) && !at(SyntaxKind.EOF)) {
      b.add(statement());
    }
    expect(b, SyntaxKind.R_CURLY);
    return b.build();
  }

  /** Parses "var x = 1, y" (without semicolon). */
  private SyntaxNode variableDeclaration() {
    final Builder b = new Builder(SyntaxKind.VARIABLE_DECLARATION);
    b.add(bump());
    do {
      final Builder d = new Builder(SyntaxKind.VARIABLE_DECLARATOR);
      if (at(SyntaxKind.IDENT)) {
        d.add(SyntaxNode.of(SyntaxKind.IDENTIFIER, bump()));
      } else {
        error("expected an identifier");
        d.error = true;
      }
      if (eat(d, SyntaxKind.EQ)) {
        d.addOrError(assignment());
      }
      b.add(d.build());
    } while (eat(b, SyntaxKind.COMMA));
    return b.build();
  }

  /** Parses a function declaration or expression. */
  private SyntaxNode function(SyntaxKind kind) {
    final Builder b = new Builder(kind);
    b.add(bump());
    if (at(SyntaxKind.IDENT)) {
      b.add(SyntaxNode.of(SyntaxKind.IDENTIFIER, bump()));
    } else if (kind == SyntaxKind.FUNCTION_DECLARATION) {
      error("expected a function name");
      b.error = true;
    }
    if (at(SyntaxKind.L_PAREN)) {
      b.add(parameterList());
    } else {
      error("expected '('");
      b.error = true;
    }
    if (at(SyntaxKind.L_CURLY)) {
      b.add(block());
    } else {
      error("expected '{'");
      b.error = true;
    }
    return b.build();
  }

  private SyntaxNode parameterList() {
    final Builder b = new Builder(SyntaxKind.PARAMETER_LIST);
    expect(b, SyntaxKind.L_PAREN);
    while (!at(SyntaxKind.R_PAREN) && !at(SyntaxKind.EOF)) {
      if (at(SyntaxKind.DOT3)) {
        final Builder r = new Builder(SyntaxKind.REST_PARAMETER);
        r.add(bump());
        expect(r, SyntaxKind.IDENT);
        b.add(r.build());
      } else if (at(SyntaxKind.IDENT)) {
        b.add(parameter());
      } else {
        error("expected a parameter");
        b.error = true;
        break;
      }
      if (!eat(b, SyntaxKind.COMMA)) {
        break;
      }
    }
    expect(b, SyntaxKind.R_PAREN);
    return b.build();
  }

  /** Parses "x" or "x = default". */
  private SyntaxNode parameter() {
    final Builder p = new Builder(SyntaxKind.PARAMETER);
    p.add(bump());
    if (eat(p, SyntaxKind.EQ)) {
      p.addOrError(assignment());
    }
    return p.build();
  }

  private SyntaxNode returnStatement() {
    final Builder b = new Builder(SyntaxKind.RETURN_STATEMENT);
    b.add(bump());
    if (!at(SyntaxKind.SEMICOLON)
        && !at(SyntaxKind.R_CURLY)
        && !at(SyntaxKind.EOF)
        && !current().hasLeadingNewline()) {
      b.addOrError(expression());
    }
    semicolon(b);
    return b.build();
  }

  private SyntaxNode throwStatement() {
    final Builder b = new Builder(SyntaxKind.THROW_STATEMENT);
    b.add(bump());
    b.addOrError(expression());
    semicolon(b);
    return b.build();
  }

  /** Parses "break", "continue", optionally with a label. */
  private SyntaxNode jump(SyntaxKind kind) {
    final Builder b = new Builder(kind);
    b.add(bump());
    if (at(SyntaxKind.IDENT) && !current().hasLeadingNewline()) {
      b.add(SyntaxNode.of(SyntaxKind.IDENTIFIER, bump()));
    }
    semicolon(b);
    return b.build();
  }

  /** Parses "(expression)" into a node, as part of a statement. */
  private void condition(Builder b) {
    expect(b, SyntaxKind.L_PAREN);
    b.addOrError(expression());
    expect(b, SyntaxKind.R_PAREN);
  }

  private SyntaxNode ifStatement() {
    final Builder b = new Builder(SyntaxKind.IF_STATEMENT);
    b.add(bump());
    condition(b);
    body(b);
    if (at(SyntaxKind.ELSE_KW)) {
      final Builder e = new Builder(SyntaxKind.ELSE_CLAUSE);
      e.add(bump());
      body(e);
      b.add(e.build());
    }
    return b.build();
  }

  private SyntaxNode whileStatement() {
    final Builder b = new Builder(SyntaxKind.WHILE_STATEMENT);
    b.add(bump());
    condition(b);
    body(b);
    return b.build();
  }

  private SyntaxNode doWhileStatement() {
    final Builder b = new Builder(SyntaxKind.DO_WHILE_STATEMENT);
    b.add(bump());
    body(b);
    expect(b, SyntaxKind.WHILE_KW);
    condition(b);
    // After "do ... while (x)" the semicolon is always optional.
    eat(b, SyntaxKind.SEMICOLON);
    return b.build();
  }

  private SyntaxNode forStatement() {
    final Builder b = new Builder(SyntaxKind.FOR_STATEMENT);
    b.add(bump());
    expect(b, SyntaxKind.L_PAREN);
    if (at(SyntaxKind.VAR_KW) || at(SyntaxKind.LET_KW)
        || at(SyntaxKind.CONST_KW)) {
      b.add(variableDeclaration());
    } else if (!at(SyntaxKind.SEMICOLON)) {
      b.addOrError(expression());
    }
    expect(b, SyntaxKind.SEMICOLON);
    if (!at(SyntaxKind.SEMICOLON)) {
      b.addOrError(expression());
    }
    expect(b, SyntaxKind.SEMICOLON);
    if (!at(SyntaxKind.R_PAREN)) {
      b.addOrError(expression());
    }
    expect(b, SyntaxKind.R_PAREN);
    body(b);
    return b.build();
  }

  /** Parses the body of a loop or an if-clause. */
  private void body(Builder b) {
    if (at(SyntaxKind.EOF) || at(SyntaxKind.R_CURLY)) {
      error("expected a statement");
      b.error = true;
    } else {
      b.add(statement());
    }
  }

  private SyntaxNode tryStatement() {
    final Builder b = new Builder(SyntaxKind.TRY_STATEMENT);
    b.add(bump());
    tryBlock(b);
    boolean handled = false;
    if (at(SyntaxKind.CATCH_KW)) {
      final Builder c = new Builder(SyntaxKind.CATCH_CLAUSE);
      c.add(bump());
      if (eat(c, SyntaxKind.L_PAREN)) {
        if (at(SyntaxKind.IDENT)) {
          c.add(SyntaxNode.of(SyntaxKind.IDENTIFIER, bump()));
        } else {
          error("expected an identifier");
          c.error = true;
        }
        expect(c, SyntaxKind.R_PAREN);
      }
      tryBlock(c);
      b.add(c.build());
      handled = true;
    }
    if (at(SyntaxKind.FINALLY_KW)) {
      final Builder f = new Builder(SyntaxKind.FINALLY_CLAUSE);
      f.add(bump());
      tryBlock(f);
      b.add(f.build());
      handled = true;
    }
    if (!handled) {
      error("expected 'catch' or 'finally'");
      b.error = true;
    }
    return b.build();
  }

  private void tryBlock(Builder b) {
    if (at(SyntaxKind.L_CURLY)) {
      b.add(block());
    } else {
      error("expected '{'");
      b.error = true;
    }
  }

  // ---------------------------------------------------------------------
  // Expressions

  private static boolean canStartExpression(SyntaxKind kind) {
    switch (kind) {
    case IDENT:
    case NUMBER:
    case STRING:
    case ERROR_TOKEN:
    case THIS_KW:
    case TRUE_KW:
    case FALSE_KW:
    case NULL_KW:
    case FUNCTION_KW:
    case NEW_KW:
    case TYPEOF_KW:
    case VOID_KW:
    case DELETE_KW:
    case L_PAREN:
    case L_BRACK:
    case L_CURLY:
    case BANG:
    case TILDE:
    case PLUS:
    case MINUS:
    case PLUS2:
    case MINUS2:
      return true;
    default:
      return false;
    }
  }

  /** Parses an expression; returns null, having recorded an error, if the
   * current token cannot start one. */
  private @Nullable SyntaxNode expression() {
    return assignment();
  }

  private @Nullable SyntaxNode assignment() {
    if (isArrowAhead()) {
      return arrowFunction();
    }
    final SyntaxNode left = conditional();
    if (left != null && kind().isAssignmentOperator()) {
      final Builder b = new Builder(SyntaxKind.ASSIGNMENT_EXPRESSION);
      b.add(left);
      b.add(bump());
      b.addOrError(assignment());
      return b.build();
    }
    return left;
  }

  /** Returns whether the current token starts an arrow function: "x =>" or
   * "(...) =>". */
  private boolean isArrowAhead() {
    if (at(SyntaxKind.IDENT)) {
      return peek(1) == SyntaxKind.FAT_ARROW;
    }
    if (!at(SyntaxKind.L_PAREN)) {
      return false;
    }
    int depth = 0;
    for (int j = i; j < tokens.size(); j++) {
      switch (tokens.get(j).kind) {
      case L_PAREN:
      case L_BRACK:
      case L_CURLY:
        ++depth;
        break;
      case R_PAREN:
      case R_BRACK:
      case R_CURLY:
        if (--depth == 0) {
          return j + 1 < tokens.size()
              && tokens.get(j + 1).kind == SyntaxKind.FAT_ARROW;
        }
        break;
      case EOF:
        return false;
      default:
        break;
      }
    }
    return false;
  }

  private SyntaxNode arrowFunction() {
    final Builder b = new Builder(SyntaxKind.ARROW_FUNCTION);
    if (at(SyntaxKind.IDENT)) {
      b.add(SyntaxNode.of(SyntaxKind.PARAMETER, bump()));
    } else {
      b.add(parameterList());
    }
    expect(b, SyntaxKind.FAT_ARROW);
    if (at(SyntaxKind.L_CURLY)) {
      b.add(block());
    } else {
      b.addOrError(assignment());
    }
    return b.build();
  }

  private @Nullable SyntaxNode conditional() {
    final SyntaxNode test = binary(0);
    if (test == null || !at(SyntaxKind.QUESTION)) {
      return test;
    }
    final Builder b = new Builder(SyntaxKind.CONDITIONAL_EXPRESSION);
    b.add(test);
    b.add(bump());
    b.addOrError(assignment());
    expect(b, SyntaxKind.COLON);
    b.addOrError(assignment());
    return b.build();
  }

  /** Parses a chain of binary operators whose precedence is greater than
   * {@code minPrecedence}. */
  private @Nullable SyntaxNode binary(int minPrecedence) {
    SyntaxNode left = unary();
    if (left == null) {
      return null;
    }
    for (;;) {
      final SyntaxKind op = kind();
      if (!op.isBinaryOperator() || op.precedence <= minPrecedence) {
        return left;
      }
      final Builder b =
          new Builder(op.isLogicalOperator()
              ? SyntaxKind.LOGICAL_EXPRESSION
              : SyntaxKind.BINARY_EXPRESSION);
      b.add(left);
      b.add(bump());
      b.addOrError(
          binary(op.isRightAssociative() ? op.precedence - 1 : op.precedence));
      left = b.build();
    }
  }

  private @Nullable SyntaxNode unary() {
    switch (kind()) {
    case BANG:
    case TILDE:
    case PLUS:
    case MINUS:
    case TYPEOF_KW:
    case VOID_KW:
    case DELETE_KW:
      final Builder b = new Builder(SyntaxKind.UNARY_EXPRESSION);
      b.add(bump());
      b.addOrError(unary());
      return b.build();
    case PLUS2:
    case MINUS2:
      final Builder p = new Builder(SyntaxKind.PREFIX_UPDATE_EXPRESSION);
      p.add(bump());
      p.addOrError(unary());
      return p.build();
    default:
      final SyntaxNode e = callOrMember(true);
      if (e != null
          && (at(SyntaxKind.PLUS2) || at(SyntaxKind.MINUS2))
          && !current().hasLeadingNewline()) {
        return SyntaxNode.of(SyntaxKind.POSTFIX_UPDATE_EXPRESSION, e, bump());
      }
      return e;
    }
  }

  /** Parses a primary expression followed by member accesses and, if
   * {@code allowCalls}, calls. */
  private @Nullable SyntaxNode callOrMember(boolean allowCalls) {
    SyntaxNode e;
    if (at(SyntaxKind.NEW_KW)) {
      final Builder b = new Builder(SyntaxKind.NEW_EXPRESSION);
      b.add(bump());
      b.addOrError(callOrMember(false));
      if (at(SyntaxKind.L_PAREN)) {
        b.add(arguments());
      }
      e = b.build();
    } else {
      e = primary();
      if (e == null) {
        return null;
      }
    }
    for (;;) {
      switch (kind()) {
      case DOT:
        final Builder m = new Builder(SyntaxKind.MEMBER_EXPRESSION);
        m.add(e);
        m.add(bump());
        if (at(SyntaxKind.IDENT) || kind().isKeyword()) {
          m.add(bump());
        } else {
          error("expected a property name");
          m.error = true;
        }
        e = m.build();
        break;
      case L_BRACK:
        final Builder c = new Builder(SyntaxKind.COMPUTED_MEMBER_EXPRESSION);
        c.add(e);
        c.add(bump());
        c.addOrError(expression());
        expect(c, SyntaxKind.R_BRACK);
        e = c.build();
        break;
      case L_PAREN:
        if (!allowCalls) {
          return e;
        }
        e = SyntaxNode.of(SyntaxKind.CALL_EXPRESSION, e, arguments());
        break;
      default:
        return e;
      }
    }
  }

  private SyntaxNode arguments() {
    final Builder b = new Builder(SyntaxKind.ARGUMENT_LIST);
    expect(b, SyntaxKind.L_PAREN);
    while (!at(SyntaxKind.R_PAREN) && !at(SyntaxKind.EOF)) {
      b.addOrError(spreadOrAssignment());
      if (b.error || !eat(b, SyntaxKind.COMMA)) {
        break;
      }
    }
    expect(b, SyntaxKind.R_PAREN);
    return b.build();
  }

  private @Nullable SyntaxNode spreadOrAssignment() {
    if (at(SyntaxKind.DOT3)) {
      final Builder b = new Builder(SyntaxKind.SPREAD_ELEMENT);
      b.add(bump());
      b.addOrError(assignment());
      return b.build();
    }
    return assignment();
  }

  private @Nullable SyntaxNode primary() {
    switch (kind()) {
    case IDENT:
      return SyntaxNode.of(SyntaxKind.IDENTIFIER, bump());
    case THIS_KW:
      return SyntaxNode.of(SyntaxKind.THIS_EXPRESSION, bump());
    case NUMBER:
      return SyntaxNode.of(SyntaxKind.NUMBER_LITERAL, bump());
    case STRING:
      return SyntaxNode.of(SyntaxKind.STRING_LITERAL, bump());
    case TRUE_KW:
    case FALSE_KW:
      return SyntaxNode.of(SyntaxKind.BOOLEAN_LITERAL, bump());
    case NULL_KW:
      return SyntaxNode.of(SyntaxKind.NULL_LITERAL, bump());
    case FUNCTION_KW:
      return function(SyntaxKind.FUNCTION_EXPRESSION);
    case L_PAREN:
      final Builder b = new Builder(SyntaxKind.PARENTHESIZED_EXPRESSION);
      b.add(bump());
      b.addOrError(expression());
      expect(b, SyntaxKind.R_PAREN);
      return b.build();
    case L_BRACK:
      return array();
    case L_CURLY:
      return object();
    case ERROR_TOKEN:
      return SyntaxNode.of(SyntaxKind.BOGUS_EXPRESSION, bump());
    default:
      error("expected an expression");
      return null;
    }
  }

  private SyntaxNode array() {
    final Builder b = new Builder(SyntaxKind.ARRAY_EXPRESSION);
    b.add(bump());
    while (!at(SyntaxKind.R_BRACK) && !at(SyntaxKind.EOF)) {
      if (eat(b, SyntaxKind.COMMA)) {
        // hole
        continue;
      }
      b.addOrError(spreadOrAssignment());
      if (b.error || !eat(b, SyntaxKind.COMMA)) {
        break;
      }
    }
    expect(b, SyntaxKind.R_BRACK);
    return b.build();
  }

  private SyntaxNode object() {
    final Builder b = new Builder(SyntaxKind.OBJECT_EXPRESSION);
    b.add(bump());
    while (!at(SyntaxKind.R_CURLY) && !at(SyntaxKind.EOF)) {
      final SyntaxNode member = objectMember();
      if (member == null) {
        b.error = true;
        break;
      }
      b.add(member);
      if (!eat(b, SyntaxKind.COMMA)) {
        break;
      }
    }
    expect(b, SyntaxKind.R_CURLY);
    return b.build();
  }

  private @Nullable SyntaxNode objectMember() {
    if (at(SyntaxKind.DOT3)) {
      return spreadOrAssignment();
    }
    if (at(SyntaxKind.IDENT)
        && (peek(1) == SyntaxKind.COMMA || peek(1) == SyntaxKind.R_CURLY)) {
      return SyntaxNode.of(SyntaxKind.SHORTHAND_PROPERTY, bump());
    }
    if (at(SyntaxKind.IDENT) || at(SyntaxKind.STRING) || at(SyntaxKind.NUMBER)
        || kind().isKeyword()) {
      final Builder p = new Builder(SyntaxKind.PROPERTY);
      p.add(bump());
      expect(p, SyntaxKind.COLON);
      if (!p.error) {
        p.addOrError(assignment());
      }
      return p.build();
    }
    error("expected a property");
    return null;
  }

  /** Collects the children of a node under construction. */
  private static class Builder {
    final SyntaxKind kind;
    final List<SyntaxElement> children = new ArrayList<>();
    boolean error;

    Builder(SyntaxKind kind) {
      this.kind = kind;
    }

    void add(SyntaxElement element) {
      children.add(element);
    }

    /** Adds a node, or marks this node as erroneous if the node is
     * missing. */
    void addOrError(@Nullable SyntaxNode node) {
      if (node == null) {
        error = true;
      } else {
        children.add(node);
      }
    }

    SyntaxNode build() {
      return new SyntaxNode(kind, children, error);
    }
  }
}

// End JsParser.java
