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
import net.hydromatic.jsfmt.doc.GroupId;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formatting rules for expressions. */
final class ExpressionRules {
  private ExpressionRules() {}

  /** Returns whether a node is a binary or logical expression. */
  static boolean isBinaryish(SyntaxNode node) {
    return node.kind == SyntaxKind.BINARY_EXPRESSION
        || node.kind == SyntaxKind.LOGICAL_EXPRESSION;
  }

  /** Formats a number or string literal, normalizing its text. */
  static Doc literal(Formatter f, SyntaxNode node) {
    final SyntaxToken token = f.firstChildToken(node);
    switch (token.kind) {
    case NUMBER:
      return f.token(token, Literals.number(token.text));
    case STRING:
      return f.token(token, Literals.string(token.text,
          f.options().quoteStyle));
    default:
      return f.token(token);
    }
  }

  static Doc variableDeclarator(Formatter f, SyntaxNode node) {
    final SyntaxNode name = f.requiredNode(node, 0);
    final @Nullable SyntaxToken eq = node.token(SyntaxKind.EQ);
    if (eq == null) {
      return f.format(name);
    }
    final SyntaxNode init = f.requiredNode(node, 1);
    return assignmentLike(f,
        doc.concat(f.format(name), doc.space(), f.token(eq)), eq, init);
  }

  static Doc assignment(Formatter f, SyntaxNode node) {
    final SyntaxNode left = f.requiredNode(node, 0);
    final SyntaxToken operator = operator(f, node);
    final SyntaxNode right = f.requiredNode(node, 1);
    return assignmentLike(f,
        doc.concat(f.format(left), doc.space(), f.token(operator)),
        operator, right);
  }

  /** Lays out the right-hand side of an assignment, initializer or
   * property.
   *
   * <p>{@code head} is the left-hand side followed by the operator. A value
   * that has its own brackets, such as a call, object or function, stays on
   * the same line as the operator. A chain of binary operators moves to the
   * next line, indented, if it does not fit. Any other value moves to the
   * next line only if it does not fit on the current line up to its first
   * possible line break. */
  static Doc assignmentLike(Formatter f, Doc head, SyntaxToken operator,
      SyntaxNode right) {
    if (f.comments.hasTrailingLineComment(operator)
        || f.startsWithComment(right)) {
      return doc.concat(head,
          doc.indent(doc.hardline(), f.formatUnindented(right)));
    }
    if (isBinaryish(right)) {
      return doc.group(head,
          doc.group(doc.indent(doc.line(), f.formatUnindented(right))));
    }
    switch (right.kind) {
    case CALL_EXPRESSION:
    case NEW_EXPRESSION:
    case OBJECT_EXPRESSION:
    case ARRAY_EXPRESSION:
    case FUNCTION_EXPRESSION:
    case ARROW_FUNCTION:
    case STRING_LITERAL:
      return doc.concat(head, doc.space(), f.format(right));
    default:
      final GroupId id = f.groupId("assignment");
      final Doc rightDoc = f.format(right);
      return doc.group(head,
          doc.group(doc.indent(doc.line()), id),
          doc.ifBreak(doc.indent(rightDoc), rightDoc, id));
    }
  }

  static Doc call(Formatter f, SyntaxNode node) {
    final SyntaxNode callee = f.requiredNode(node, 0);
    final SyntaxNode arguments =
        f.requiredNode(node, SyntaxKind.ARGUMENT_LIST);
    return doc.concat(f.format(callee), f.format(arguments));
  }

  /** Formats "new Foo(args)"; adds "()" if the source has no argument
   * list. */
  static Doc newExpression(Formatter f, SyntaxNode node) {
    final SyntaxToken keyword = f.requiredToken(node, SyntaxKind.NEW_KW);
    final SyntaxNode callee = f.requiredNode(node, 0);
    final @Nullable SyntaxNode arguments =
        node.node(SyntaxKind.ARGUMENT_LIST);
    return doc.concat(f.token(keyword), doc.space(), f.format(callee),
        arguments == null
            ? doc.text("()")
            : f.format(arguments));
  }

  static Doc member(Formatter f, SyntaxNode node) {
    final SyntaxNode object = f.requiredNode(node, 0);
    final SyntaxToken dot = f.requiredToken(node, SyntaxKind.DOT);
    final int i = node.children.indexOf(dot);
    if (i + 1 >= node.children.size()
        || !node.children.get(i + 1).isToken()) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, "MEMBER_EXPRESSION has no property name",
          f.context.pos(node));
    }
    final SyntaxToken name = (SyntaxToken) node.children.get(i + 1);
    Doc objectDoc = f.format(object);
    if (object.kind == SyntaxKind.NUMBER_LITERAL
        && Literals.isDecimalInteger(
            Literals.number(f.firstChildToken(object).text))) {
      // "1.toString()" would not parse
      objectDoc = doc.concat(doc.text("("), objectDoc, doc.text(")"));
    }
    return doc.concat(objectDoc, f.token(dot), f.token(name));
  }

  static Doc computedMember(Formatter f, SyntaxNode node) {
    final SyntaxNode object = f.requiredNode(node, 0);
    final SyntaxNode property = f.requiredNode(node, 1);
    return doc.concat(f.format(object),
        delimited(f, node, SyntaxKind.L_BRACK, property,
            SyntaxKind.R_BRACK));
  }

  static Doc parenthesized(Formatter f, SyntaxNode node) {
    final SyntaxNode expression = f.requiredNode(node, 0);
    return delimited(f, node, SyntaxKind.L_PAREN, expression,
        SyntaxKind.R_PAREN);
  }

  /** Formats an expression in brackets. The brackets hug the expression,
   * unless comments require line breaks inside them. */
  private static Doc delimited(Formatter f, SyntaxNode node,
      SyntaxKind openKind, SyntaxNode inner, SyntaxKind closeKind) {
    final SyntaxToken open = f.requiredToken(node, openKind);
    final SyntaxToken close = f.requiredToken(node, closeKind);
    if (!f.comments.hasDangling(node)
        && !f.comments.hasTrailingLineComment(open)
        && !f.startsWithComment(inner)) {
      return doc.concat(f.token(open), f.format(inner), f.token(close));
    }
    return doc.group(f.token(open),
        doc.indent(doc.softline(), f.format(inner), f.danglingInline(node)),
        doc.softline(),
        f.token(close));
  }

  /** Formats a unary operator or a prefix "++" or "--". */
  static Doc prefix(Formatter f, SyntaxNode node) {
    final SyntaxToken operator = f.firstChildToken(node);
    final SyntaxNode operand = f.requiredNode(node, 0);
    final @Nullable SyntaxToken first = operand.firstToken();
    // "typeof x" needs a space; so do "- -x" and "+ ++x", which would
    // otherwise read as "--x" and "+++x".
    final boolean space = operator.kind.isKeyword()
        || first != null
        && !first.text.isEmpty()
        && (first.kind == SyntaxKind.PLUS || first.kind == SyntaxKind.PLUS2
            || first.kind == SyntaxKind.MINUS
            || first.kind == SyntaxKind.MINUS2)
        && first.text.charAt(0)
            == operator.text.charAt(operator.text.length() - 1);
    return doc.concat(f.token(operator),
        space ? doc.space() : doc.empty(),
        f.format(operand));
  }

  static Doc postfix(Formatter f, SyntaxNode node) {
    final SyntaxNode operand = f.requiredNode(node, 0);
    final @Nullable SyntaxToken operator =
        node.tokenOf(SyntaxKind.PLUS2, SyntaxKind.MINUS2);
    if (operator == null) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, "POSTFIX_UPDATE_EXPRESSION has no operator",
          f.context.pos(node));
    }
    return doc.concat(f.format(operand), f.token(operator));
  }

  /** Formats a chain of binary operators of the same precedence, such as
   * "a + b - c", as one group. If the group breaks, each operator ends a
   * line. If {@code indent}, the lines after the first are indented. */
  static Doc binary(Formatter f, SyntaxNode node, boolean indent) {
    final List<SyntaxNode> operands = new ArrayList<>();
    final List<SyntaxToken> operators = new ArrayList<>();
    flatten(f, node, operands, operators);
    final List<Doc> rest = new ArrayList<>();
    for (int i = 0; i < operators.size(); i++) {
      rest.add(doc.space());
      rest.add(f.token(operators.get(i)));
      rest.add(doc.line());
      rest.add(f.format(operands.get(i + 1)));
    }
    final Doc first = f.format(operands.get(0));
    return indent
        ? doc.group(first, doc.indent(doc.concat(rest)))
        : doc.group(first, doc.concat(rest));
  }

  /** Collects the operands and operators of a chain. A left operand that
   * is itself a binary expression of the same precedence is part of the
   * chain. */
  private static void flatten(Formatter f, SyntaxNode node,
      List<SyntaxNode> operands, List<SyntaxToken> operators) {
    final SyntaxNode left = f.requiredNode(node, 0);
    final SyntaxToken operator = operator(f, node);
    final SyntaxNode right = f.requiredNode(node, 1);
    final @Nullable SyntaxToken leftOperator =
        isBinaryish(left) && !left.error ? binaryOperator(left) : null;
    if (leftOperator != null
        && leftOperator.kind.precedence == operator.kind.precedence
        && !operator.kind.isRightAssociative()) {
      flatten(f, left, operands, operators);
    } else {
      operands.add(left);
    }
    operators.add(operator);
    operands.add(right);
  }

  /** Returns the operator of a binary or assignment expression, the token
   * between its two operands. */
  private static SyntaxToken operator(Formatter f, SyntaxNode node) {
    final @Nullable SyntaxToken operator =
        isBinaryish(node) ? binaryOperator(node) : assignmentOperator(node);
    if (operator == null) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, node.kind + " has no operator", f.context.pos(node));
    }
    return operator;
  }

  private static @Nullable SyntaxToken binaryOperator(SyntaxNode node) {
    for (SyntaxElement child : node.children) {
      if (child instanceof SyntaxToken && child.kind.isBinaryOperator()) {
        return (SyntaxToken) child;
      }
    }
    return null;
  }

  private static @Nullable SyntaxToken assignmentOperator(SyntaxNode node) {
    for (SyntaxElement child : node.children) {
      if (child instanceof SyntaxToken && child.kind.isAssignmentOperator()) {
        return (SyntaxToken) child;
      }
    }
    return null;
  }

  /** Formats "test ? consequent : alternate". If it breaks, "?" and ":"
   * start indented lines. */
  static Doc conditional(Formatter f, SyntaxNode node) {
    final SyntaxNode test = f.requiredNode(node, 0);
    final SyntaxToken question = f.requiredToken(node, SyntaxKind.QUESTION);
    final SyntaxNode consequent = f.requiredNode(node, 1);
    final SyntaxToken colon = f.requiredToken(node, SyntaxKind.COLON);
    final SyntaxNode alternate = f.requiredNode(node, 2);
    return doc.group(f.format(test),
        doc.indent(doc.line(), f.token(question), doc.space(),
            f.format(consequent), doc.line(), f.token(colon), doc.space(),
            f.format(alternate)));
  }
}

// End ExpressionRules.java
