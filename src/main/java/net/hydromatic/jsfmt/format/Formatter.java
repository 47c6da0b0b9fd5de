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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.jsfmt.config.FormatOptions;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.doc.GroupId;
import net.hydromatic.jsfmt.doc.GroupIdGenerator;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Converts a syntax tree into a {@link Doc}.
 *
 * <p>Dispatches on the kind of each node to a rule in
 * {@link StatementRules}, {@link ExpressionRules}, {@link FunctionRules} or
 * {@link ListRules}. If a rule throws {@link FormatException}, or the node
 * has a syntax error, the node is printed as it appears in the source, and
 * a {@link FormatDiagnostic warning} is recorded.
 *
 * <p>Every comment in the tree is printed exactly once. If, after a pass
 * over the tree, some comment has not been printed, the nodes that own such
 * comments are printed verbatim in a further pass.
 *
 * <p>A formatter holds the state of one run, and is not thread-safe. */
public class Formatter {
  private static final Logger LOGGER = LoggerFactory.getLogger(Formatter.class);

  final FormatContext context;
  final Comments comments;
  private final GroupIdGenerator groupIds = new GroupIdGenerator();
  private final List<FormatDiagnostic> diagnostics = new ArrayList<>();
  private final Set<SourceComment> printed = Sets.newIdentityHashSet();
  private final List<SourceComment> printedLog = new ArrayList<>();
  private final Set<SyntaxNode> forcedVerbatim = Sets.newIdentityHashSet();
  /** Tokens whose trailing comments are printed later, after a comma. */
  private final Set<SyntaxToken> deferredTrailing =
      Sets.newIdentityHashSet();

  public Formatter(FormatContext context) {
    this.context = requireNonNull(context);
    this.comments = context.comments;
  }

  /** Formats the whole tree. */
  public Doc formatTree() {
    final SyntaxNode root = context.tree.root;
    Doc doc = format(root);
    final List<SourceComment> lost = unprinted();
    if (!lost.isEmpty()) {
      for (SourceComment comment : lost) {
        forcedVerbatim.add(comment.owner);
      }
      reset();
      doc = format(root);
      if (!unprinted().isEmpty()) {
        // Cannot happen if verbatim printing is correct; print the whole
        // tree as it is.
        forcedVerbatim.add(root);
        reset();
        doc = format(root);
      }
      for (SourceComment comment : lost) {
        diagnostics.add(
            new FormatDiagnostic(FormatException.Kind.LOST_COMMENT,
                "comment " + comment.text() + " in " + comment.owner.kind
                    + " was not placed; printed verbatim",
                context.tree.pos(comment.trivia.range())));
      }
    }
    for (FormatDiagnostic diagnostic : diagnostics) {
      LOGGER.warn("{}", diagnostic);
    }
    return doc;
  }

  /** Returns the warnings produced so far. */
  public ImmutableList<FormatDiagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  private List<SourceComment> unprinted() {
    final List<SourceComment> list = new ArrayList<>();
    for (SourceComment comment : comments.all) {
      if (!printed.contains(comment)) {
        list.add(comment);
      }
    }
    return list;
  }

  private void reset() {
    printed.clear();
    printedLog.clear();
    diagnostics.clear();
  }

  FormatOptions options() {
    return context.options;
  }

  /** Allocates a group id, unique within this run. */
  GroupId groupId(String name) {
    return groupIds.next(name);
  }

  /** Formats a node. */
  public Doc format(SyntaxNode node) {
    return safely(node, this::rule);
  }

  /** Formats an expression whose enclosing layout provides indentation,
   * such as the condition of an "if", so that a chain of binary operators
   * is not indented again. */
  Doc formatUnindented(SyntaxNode node) {
    return ExpressionRules.isBinaryish(node)
        ? safely(node, n -> ExpressionRules.binary(this, n, false))
        : format(node);
  }

  private Doc safely(SyntaxNode node, Function<SyntaxNode, Doc> rule) {
    if (forcedVerbatim.contains(node)) {
      return verbatim(node);
    }
    if (node.error) {
      return fallback(node,
          new FormatException(FormatException.Kind.SYNTAX_ERROR, node.kind,
              "syntax error in " + node.kind + "; printed verbatim",
              context.pos(node)));
    }
    final int printedMark = printedLog.size();
    final int diagnosticMark = diagnostics.size();
    try {
      return rule.apply(node);
    } catch (FormatException e) {
      // Comments printed by the failed rule will be printed again, as part
      // of the verbatim text.
      while (printedLog.size() > printedMark) {
        printed.remove(printedLog.remove(printedLog.size() - 1));
      }
      while (diagnostics.size() > diagnosticMark) {
        diagnostics.remove(diagnostics.size() - 1);
      }
      return fallback(node, e);
    }
  }

  private Doc fallback(SyntaxNode node, FormatException e) {
    diagnostics.add(FormatDiagnostic.of(e));
    return verbatim(node);
  }

  private Doc rule(SyntaxNode node) {
    switch (node.kind) {
    case PROGRAM:
      return StatementRules.program(this, node);
    case BLOCK_STATEMENT:
      return StatementRules.block(this, node);
    case VARIABLE_STATEMENT:
    case EXPRESSION_STATEMENT:
      return StatementRules.simpleStatement(this, node);
    case VARIABLE_DECLARATION:
      return StatementRules.variableDeclaration(this, node);
    case VARIABLE_DECLARATOR:
      return ExpressionRules.variableDeclarator(this, node);
    case RETURN_STATEMENT:
    case THROW_STATEMENT:
    case BREAK_STATEMENT:
    case CONTINUE_STATEMENT:
      return StatementRules.jump(this, node);
    case IF_STATEMENT:
      return StatementRules.ifStatement(this, node);
    case ELSE_CLAUSE:
      return StatementRules.elseClause(this, node);
    case WHILE_STATEMENT:
      return StatementRules.whileStatement(this, node);
    case DO_WHILE_STATEMENT:
      return StatementRules.doWhileStatement(this, node);
    case FOR_STATEMENT:
      return StatementRules.forStatement(this, node);
    case TRY_STATEMENT:
      return StatementRules.tryStatement(this, node);
    case CATCH_CLAUSE:
      return StatementRules.catchClause(this, node);
    case FINALLY_CLAUSE:
      return StatementRules.finallyClause(this, node);
    case EMPTY_STATEMENT:
      return token(requiredToken(node, SyntaxKind.SEMICOLON));

    case FUNCTION_DECLARATION:
    case FUNCTION_EXPRESSION:
      return FunctionRules.function(this, node);
    case ARROW_FUNCTION:
      return FunctionRules.arrow(this, node);
    case PARAMETER:
      return FunctionRules.parameter(this, node);
    case PARAMETER_LIST:
      return ListRules.parameters(this, node);

    case IDENTIFIER:
    case THIS_EXPRESSION:
    case BOOLEAN_LITERAL:
    case NULL_LITERAL:
    case SHORTHAND_PROPERTY:
      return token(onlyToken(node));
    case NUMBER_LITERAL:
    case STRING_LITERAL:
      return ExpressionRules.literal(this, node);
    case ARRAY_EXPRESSION:
      return ListRules.array(this, node);
    case OBJECT_EXPRESSION:
      return ListRules.object(this, node);
    case PROPERTY:
      return ListRules.property(this, node);
    case SPREAD_ELEMENT:
    case REST_PARAMETER:
      return ListRules.spread(this, node);
    case ARGUMENT_LIST:
      return ListRules.arguments(this, node);
    case CALL_EXPRESSION:
      return ExpressionRules.call(this, node);
    case NEW_EXPRESSION:
      return ExpressionRules.newExpression(this, node);
    case MEMBER_EXPRESSION:
      return ExpressionRules.member(this, node);
    case COMPUTED_MEMBER_EXPRESSION:
      return ExpressionRules.computedMember(this, node);
    case UNARY_EXPRESSION:
    case PREFIX_UPDATE_EXPRESSION:
      return ExpressionRules.prefix(this, node);
    case POSTFIX_UPDATE_EXPRESSION:
      return ExpressionRules.postfix(this, node);
    case BINARY_EXPRESSION:
    case LOGICAL_EXPRESSION:
      return ExpressionRules.binary(this, node, true);
    case CONDITIONAL_EXPRESSION:
      return ExpressionRules.conditional(this, node);
    case ASSIGNMENT_EXPRESSION:
      return ExpressionRules.assignment(this, node);
    case PARENTHESIZED_EXPRESSION:
      return ExpressionRules.parenthesized(this, node);

    default:
      throw new FormatException(FormatException.Kind.UNSUPPORTED_NODE,
          node.kind, "unsupported node " + node.kind + "; printed verbatim",
          context.pos(node));
    }
  }

  /** Prints a node as it appears in the source, with the comments before
   * its first token and after its last token. */
  Doc verbatim(SyntaxNode node) {
    final @Nullable SyntaxToken first = node.firstToken();
    final @Nullable SyntaxToken last = node.lastToken();
    if (first == null || last == null) {
      return doc.empty();
    }
    final int start = first.offset;
    final int end = last.offset + last.text.length();
    for (SourceComment comment : comments.all) {
      if (comment.trivia.offset >= start && comment.trivia.offset < end) {
        markPrinted(comment);
      }
    }
    return doc.concat(leadingComments(first),
        doc.verbatim(context.source().substring(start, end)),
        trailingComments(last));
  }

  // Tokens

  /** Formats a token, with its comments. */
  Doc token(SyntaxToken token) {
    return token(token, token.text);
  }

  /** Formats a token, printing {@code text} in place of its text, with its
   * comments. */
  Doc token(SyntaxToken token, String text) {
    final Doc textDoc =
        text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0
            ? doc.verbatim(text)
            : doc.text(text);
    return doc.concat(leadingComments(token), textDoc,
        trailingComments(token));
  }

  /** Prints the comments of a token, but not the token; for example, a
   * trailing comma that the layout omits. */
  Doc tokenComments(SyntaxToken token) {
    return doc.concat(leadingComments(token), trailingComments(token));
  }

  /** Formats a token that may be missing, printing {@code text} if it
   * is. */
  Doc tokenOrInsert(@Nullable SyntaxToken token, String text) {
    return token == null ? doc.text(text) : token(token);
  }

  SyntaxToken requiredToken(SyntaxNode node, SyntaxKind kind) {
    final @Nullable SyntaxToken token = node.token(kind);
    if (token == null) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, node.kind + " has no " + kind, context.pos(node));
    }
    return token;
  }

  /** Returns the {@code i}th child node, failing if there is no such
   * child. */
  SyntaxNode requiredNode(SyntaxNode node, int i) {
    final @Nullable SyntaxNode child = node.node(i);
    if (child == null) {
      throw new FormatException(FormatException.Kind.MISSING_NODE,
          node.kind, node.kind + " has no child " + i, context.pos(node));
    }
    return child;
  }

  /** Returns the first child node of a given kind, failing if there is
   * none. */
  SyntaxNode requiredNode(SyntaxNode node, SyntaxKind kind) {
    final @Nullable SyntaxNode child = node.node(kind);
    if (child == null) {
      throw new FormatException(FormatException.Kind.MISSING_NODE,
          node.kind, node.kind + " has no " + kind, context.pos(node));
    }
    return child;
  }

  /** Returns the first child token, failing if the node does not start
   * with a token. */
  SyntaxToken firstChildToken(SyntaxNode node) {
    if (node.children.isEmpty() || !node.children.get(0).isToken()) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, node.kind + " does not start with a token",
          context.pos(node));
    }
    return (SyntaxToken) node.children.get(0);
  }

  private SyntaxToken onlyToken(SyntaxNode node) {
    if (node.children.size() != 1) {
      throw new FormatException(FormatException.Kind.MISSING_TOKEN,
          node.kind, node.kind + " must have exactly one token",
          context.pos(node));
    }
    return firstChildToken(node);
  }

  // Comments

  /** Returns whether a node starts with a comment on a line of its own. */
  boolean startsWithComment(SyntaxNode node) {
    final @Nullable SyntaxToken first = node.firstToken();
    return first != null && comments.hasLeading(first);
  }

  Doc leadingComments(SyntaxToken token) {
    final List<SourceComment> list = comments.leading(token);
    if (list.isEmpty()) {
      return doc.empty();
    }
    final List<Doc> docs = new ArrayList<>();
    for (SourceComment comment : list) {
      docs.add(comment(comment));
      if (comment.linesAfter >= 2) {
        docs.add(doc.emptyLine());
      } else if (comment.breaksAfter()) {
        docs.add(doc.hardline());
      } else {
        docs.add(doc.space());
      }
    }
    return doc.concat(docs);
  }

  Doc trailingComments(SyntaxToken token) {
    final List<SourceComment> list = comments.trailing(token);
    if (list.isEmpty() || deferredTrailing.contains(token)) {
      return doc.empty();
    }
    final List<Doc> docs = new ArrayList<>();
    for (SourceComment comment : list) {
      if (comment.isLineComment()) {
        docs.add(
            doc.lineSuffix(doc.concat(doc.space(), comment(comment)), true));
      } else {
        docs.add(doc.space());
        docs.add(comment(comment));
      }
    }
    return doc.concat(docs);
  }

  /** Formats a node followed by punctuation, such as the comma after a
   * list element or the semicolon after a statement.
   *
   * <p>If a line comment follows the node in the source, it is printed
   * after the punctuation, so that {@code a // c} on one line and
   * {@code , b} on the next become {@code a, // c}. Printed there, the
   * comment is found after the punctuation when the output is formatted
   * again. */
  Doc formatFollowedBy(SyntaxNode node, Doc punctuation) {
    final @Nullable SyntaxToken last = node.lastToken();
    if (last == null
        || !comments.hasTrailingLineComment(last)
        || !deferredTrailing.add(last)) {
      return doc.concat(format(node), punctuation);
    }
    final Doc nodeDoc;
    try {
      nodeDoc = format(node);
    } finally {
      deferredTrailing.remove(last);
    }
    return doc.concat(nodeDoc, punctuation, trailingComments(last));
  }

  /** Returns whether a node ends with a line comment. */
  boolean endsWithLineComment(SyntaxNode node) {
    final @Nullable SyntaxToken last = node.lastToken();
    return last != null && comments.hasTrailingLineComment(last);
  }

  /** Prints the dangling comments of a node that has statements or
   * properties, one per line.
   *
   * <p>If {@code afterContent}, the comments follow other content, and the
   * first comment is preceded by a line break; otherwise the caller has
   * already started a line. */
  Doc danglingLines(SyntaxNode node, boolean afterContent) {
    final List<Doc> docs = new ArrayList<>();
    boolean first = !afterContent;
    for (SourceComment comment : comments.dangling(node)) {
      if (!first) {
        docs.add(separatorBefore(comment));
      }
      docs.add(comment(comment));
      first = false;
    }
    return doc.concat(docs);
  }

  /** Prints the dangling comments of a node inside brackets, after the
   * content of the brackets. A comment that started a line in the source
   * starts a line. */
  Doc danglingInline(SyntaxNode node) {
    final List<Doc> docs = new ArrayList<>();
    for (SourceComment comment : comments.dangling(node)) {
      docs.add(comment.linesBefore > 0 ? doc.hardline() : doc.space());
      docs.add(comment(comment));
    }
    return doc.concat(docs);
  }

  /** Returns whether the dangling comments of a node must be on lines of
   * their own. */
  boolean danglingBreaks(SyntaxNode node) {
    for (SourceComment comment : comments.dangling(node)) {
      if (comment.linesBefore > 0
          || comment.breaksAfter()
          || comment.isMultiline()) {
        return true;
      }
    }
    return false;
  }

  private static Doc separatorBefore(SourceComment comment) {
    if (comment.linesBefore >= 2) {
      return doc.emptyLine();
    }
    return comment.linesBefore == 1 ? doc.hardline() : doc.space();
  }

  /** Returns the doc for a comment's text, and records that the comment has
   * been printed. */
  private Doc comment(SourceComment comment) {
    markPrinted(comment);
    final String text = comment.text();
    if (!comment.isMultiline()) {
      return doc.text(stripTrailing(text));
    }
    final String[] lines = text.split("\r\n|\r|\n", -1);
    if (!isIndentable(lines)) {
      return doc.verbatim(text);
    }
    // A block comment whose lines start with "*", such as a doc comment, is
    // re-indented with the code.
    final List<Doc> docs = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      if (i == 0) {
        docs.add(doc.text(stripTrailing(lines[i])));
      } else {
        docs.add(doc.hardline());
        docs.add(doc.text(" " + lines[i].trim()));
      }
    }
    return doc.concat(docs);
  }

  private static boolean isIndentable(String[] lines) {
    for (int i = 1; i < lines.length; i++) {
      if (!lines[i].trim().startsWith("*")) {
        return false;
      }
    }
    return true;
  }

  private static String stripTrailing(String s) {
    int n = s.length();
    while (n > 0 && (s.charAt(n - 1) == ' ' || s.charAt(n - 1) == '\t')) {
      --n;
    }
    return s.substring(0, n);
  }

  private void markPrinted(SourceComment comment) {
    if (printed.add(comment)) {
      printedLog.add(comment);
    }
  }
}

// End Formatter.java
