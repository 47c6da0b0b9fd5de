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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kinds of {@link SyntaxToken} and {@link SyntaxNode}. */
public enum SyntaxKind {
  // special tokens
  EOF(Category.TOKEN),
  ERROR_TOKEN(Category.TOKEN),

  // tokens with variable text
  IDENT(Category.TOKEN),
  NUMBER(Category.TOKEN),
  STRING(Category.TOKEN),

  // keywords
  BREAK_KW("break"),
  CATCH_KW("catch"),
  CONST_KW("const"),
  CONTINUE_KW("continue"),
  DELETE_KW("delete"),
  DO_KW("do"),
  ELSE_KW("else"),
  FALSE_KW("false"),
  FINALLY_KW("finally"),
  FOR_KW("for"),
  FUNCTION_KW("function"),
  IF_KW("if"),
  IN_KW("in", 9),
  INSTANCEOF_KW("instanceof", 9),
  LET_KW("let"),
  NEW_KW("new"),
  NULL_KW("null"),
  RETURN_KW("return"),
  THIS_KW("this"),
  THROW_KW("throw"),
  TRUE_KW("true"),
  TRY_KW("try"),
  TYPEOF_KW("typeof"),
  VAR_KW("var"),
  VOID_KW("void"),
  WHILE_KW("while"),

  // punctuation
  L_PAREN("("),
  R_PAREN(")"),
  L_CURLY("{"),
  R_CURLY("}"),
  L_BRACK("["),
  R_BRACK("]"),
  SEMICOLON(";"),
  COMMA(","),
  DOT("."),
  DOT3("..."),
  QUESTION("?"),
  COLON(":"),
  FAT_ARROW("=>"),
  BANG("!"),
  TILDE("~"),
  PLUS2("++"),
  MINUS2("--"),

  // binary operators, with precedence
  QUESTION2("??", 3),
  PIPE2("||", 3),
  AMP2("&&", 4),
  PIPE("|", 5),
  CARET("^", 6),
  AMP("&", 7),
  EQ2("==", 8),
  NEQ("!=", 8),
  EQ3("===", 8),
  NEQ2("!==", 8),
  LT("<", 9),
  GT(">", 9),
  LTEQ("<=", 9),
  GTEQ(">=", 9),
  SHL("<<", 10),
  SHR(">>", 10),
  USHR(">>>", 10),
  PLUS("+", 11),
  MINUS("-", 11),
  STAR("*", 12),
  SLASH("/", 12),
  PERCENT("%", 12),
  STAR2("**", 13),

  // assignment operators
  EQ("=", Category.ASSIGNMENT),
  PLUSEQ("+=", Category.ASSIGNMENT),
  MINUSEQ("-=", Category.ASSIGNMENT),
  STAREQ("*=", Category.ASSIGNMENT),
  STAR2EQ("**=", Category.ASSIGNMENT),
  SLASHEQ("/=", Category.ASSIGNMENT),
  PERCENTEQ("%=", Category.ASSIGNMENT),
  SHLEQ("<<=", Category.ASSIGNMENT),
  SHREQ(">>=", Category.ASSIGNMENT),
  USHREQ(">>>=", Category.ASSIGNMENT),
  AMPEQ("&=", Category.ASSIGNMENT),
  PIPEEQ("|=", Category.ASSIGNMENT),
  CARETEQ("^=", Category.ASSIGNMENT),
  AMP2EQ("&&=", Category.ASSIGNMENT),
  PIPE2EQ("||=", Category.ASSIGNMENT),
  QUESTION2EQ("??=", Category.ASSIGNMENT),

  // nodes: root and statements
  PROGRAM,
  VARIABLE_STATEMENT,
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATOR,
  FUNCTION_DECLARATION,
  RETURN_STATEMENT,
  IF_STATEMENT,
  ELSE_CLAUSE,
  WHILE_STATEMENT,
  DO_WHILE_STATEMENT,
  FOR_STATEMENT,
  BREAK_STATEMENT,
  CONTINUE_STATEMENT,
  THROW_STATEMENT,
  TRY_STATEMENT,
  CATCH_CLAUSE,
  FINALLY_CLAUSE,
  BLOCK_STATEMENT,
  EXPRESSION_STATEMENT,
  EMPTY_STATEMENT,

  // nodes: functions
  PARAMETER_LIST,
  PARAMETER,
  REST_PARAMETER,

  // nodes: expressions
  IDENTIFIER,
  THIS_EXPRESSION,
  NUMBER_LITERAL,
  STRING_LITERAL,
  BOOLEAN_LITERAL,
  NULL_LITERAL,
  ARRAY_EXPRESSION,
  OBJECT_EXPRESSION,
  PROPERTY,
  SHORTHAND_PROPERTY,
  SPREAD_ELEMENT,
  FUNCTION_EXPRESSION,
  ARROW_FUNCTION,
  CALL_EXPRESSION,
  NEW_EXPRESSION,
  ARGUMENT_LIST,
  MEMBER_EXPRESSION,
  COMPUTED_MEMBER_EXPRESSION,
  UNARY_EXPRESSION,
  PREFIX_UPDATE_EXPRESSION,
  POSTFIX_UPDATE_EXPRESSION,
  BINARY_EXPRESSION,
  LOGICAL_EXPRESSION,
  CONDITIONAL_EXPRESSION,
  ASSIGNMENT_EXPRESSION,
  PARENTHESIZED_EXPRESSION,

  // nodes: error recovery; no formatting rule, always printed verbatim
  BOGUS,
  BOGUS_STATEMENT,
  BOGUS_EXPRESSION;

  /** Fixed text of a keyword or punctuation token; null for other kinds. */
  public final @Nullable String text;

  /** Binary precedence; 0 if this is not a binary operator. Higher binds
   * tighter. */
  public final int precedence;

  private final Category category;

  /** Keywords, by their text. */
  public static final ImmutableMap<String, SyntaxKind> KEYWORDS;

  /** Punctuation and operators, by their text. */
  public static final ImmutableMap<String, SyntaxKind> PUNCTUATION;

  static {
    final ImmutableMap.Builder<String, SyntaxKind> keywords =
        ImmutableMap.builder();
    final ImmutableMap.Builder<String, SyntaxKind> punctuation =
        ImmutableMap.builder();
    for (SyntaxKind kind : values()) {
      if (kind.text != null) {
        if (Character.isLetter(kind.text.charAt(0))) {
          keywords.put(kind.text, kind);
        } else {
          punctuation.put(kind.text, kind);
        }
      }
    }
    KEYWORDS = keywords.build();
    PUNCTUATION = punctuation.build();
  }

  SyntaxKind() {
    this(null, 0, Category.NODE);
  }

  SyntaxKind(Category category) {
    this(null, 0, category);
  }

  SyntaxKind(String text) {
    this(text, 0, Category.TOKEN);
  }

  SyntaxKind(String text, int precedence) {
    this(text, precedence, Category.TOKEN);
  }

  SyntaxKind(String text, Category category) {
    this(text, 0, category);
  }

  SyntaxKind(@Nullable String text, int precedence, Category category) {
    this.text = text;
    this.precedence = precedence;
    this.category = category;
  }

  /** Returns whether this kind is a token kind (as opposed to a node
   * kind). */
  public boolean isToken() {
    return category != Category.NODE;
  }

  /** Returns whether this is a keyword token kind. */
  public boolean isKeyword() {
    return text != null && Character.isLetter(text.charAt(0));
  }

  /** Returns whether this is a binary operator token kind. */
  public boolean isBinaryOperator() {
    return precedence > 0;
  }

  /** Returns whether this is a logical operator ({@code &&}, {@code ||},
   * {@code ??}). */
  public boolean isLogicalOperator() {
    return this == AMP2 || this == PIPE2 || this == QUESTION2;
  }

  /** Returns whether this is an assignment operator token kind. */
  public boolean isAssignmentOperator() {
    return category == Category.ASSIGNMENT;
  }

  /** Returns whether this binary operator groups right-to-left. */
  public boolean isRightAssociative() {
    return this == STAR2;
  }

  /** Returns whether this is a node kind produced by error recovery. */
  public boolean isBogus() {
    return this == BOGUS || this == BOGUS_STATEMENT || this == BOGUS_EXPRESSION;
  }

  /** Rough classification of kinds. */
  private enum Category {
    TOKEN,
    ASSIGNMENT,
    NODE
  }
}

// End SyntaxKind.java
