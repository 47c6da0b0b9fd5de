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
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.Trivia;

/** Converts JavaScript source text into a list of tokens with trivia.
 *
 * <p>The lexer is total: a character it does not recognize becomes an
 * {@link SyntaxKind#ERROR_TOKEN} and an error is recorded, and lexing
 * continues. The last token is always {@link SyntaxKind#EOF}.
 *
 * <p>There are no regular expression literals; "/" is always division.
 * Template literals are lexed as a single error token, so that the parser
 * keeps them verbatim. */
public class JsLexer {
  private final String s;
  private final String file;
  private final List<JsParseException> errors = new ArrayList<>();
  private int i;

  public JsLexer(String source, String file) {
    this.s = requireNonNull(source);
    this.file = requireNonNull(file);
  }

  /** Errors found so far. */
  public List<JsParseException> errors() {
    return ImmutableList.copyOf(errors);
  }

  /** Converts the whole source into tokens. */
  public ImmutableList<SyntaxToken> tokenize() {
    final ImmutableList.Builder<SyntaxToken> tokens = ImmutableList.builder();
    i = 0;
    for (;;) {
      final List<Trivia> leading = trivia(false);
      if (i >= s.length()) {
        tokens.add(
            new SyntaxToken(SyntaxKind.EOF, "", i, leading,
                ImmutableList.of()));
        return tokens.build();
      }
      final int start = i;
      final SyntaxKind kind = token();
      final String text = s.substring(start, i);
      final List<Trivia> trailing = trivia(true);
      tokens.add(new SyntaxToken(kind, text, start, leading, trailing));
    }
  }

  /** Reads a run of trivia. Trailing trivia stops before the first line
   * break. */
  private List<Trivia> trivia(boolean trailing) {
    final List<Trivia> list = new ArrayList<>();
    while (i < s.length()) {
      final int start = i;
      final char c = s.charAt(i);
      if (c == '\n' || c == '\r') {
        if (trailing) {
          break;
        }
        i += c == '\r' && i + 1 < s.length() && s.charAt(i + 1) == '\n'
            ? 2 : 1;
        list.add(new Trivia(Trivia.Kind.NEWLINE, s.substring(start, i),
            start));
      } else if (isWhitespace(c)) {
        while (i < s.length() && isWhitespace(s.charAt(i))) {
          ++i;
        }
        list.add(new Trivia(Trivia.Kind.WHITESPACE, s.substring(start, i),
            start));
      } else if (s.startsWith("//", i)) {
        while (i < s.length() && s.charAt(i) != '\n' && s.charAt(i) != '\r') {
          ++i;
        }
        list.add(
            new Trivia(Trivia.Kind.SINGLE_LINE_COMMENT, s.substring(start, i),
                start));
      } else if (s.startsWith("/*", i)) {
        final int end = s.indexOf("*/", i + 2);
        if (end < 0) {
          error("unterminated comment", start, s.length());
          i = s.length();
        } else {
          i = end + 2;
        }
        list.add(
            new Trivia(Trivia.Kind.MULTI_LINE_COMMENT, s.substring(start, i),
                start));
      } else {
        break;
      }
    }
    return list;
  }

  /** Reads one token, advancing past it, and returns its kind. */
  private SyntaxKind token() {
    final int start = i;
    final char c = s.charAt(i);
    if (isIdentifierStart(c)) {
      while (i < s.length() && isIdentifierPart(s.charAt(i))) {
        ++i;
      }
      final SyntaxKind keyword =
          SyntaxKind.KEYWORDS.get(s.substring(start, i));
      return keyword != null ? keyword : SyntaxKind.IDENT;
    }
    if (isDigit(c) || c == '.' && i + 1 < s.length()
        && isDigit(s.charAt(i + 1))) {
      number();
      return SyntaxKind.NUMBER;
    }
    if (c == '"' || c == '\'') {
      return string(c);
    }
    if (c == '`') {
      template();
      return SyntaxKind.ERROR_TOKEN;
    }
    for (int length = 4; length > 0; --length) {
      if (i + length <= s.length()) {
        final SyntaxKind kind =
            SyntaxKind.PUNCTUATION.get(s.substring(i, i + length));
        if (kind != null) {
          i += length;
          return kind;
        }
      }
    }
    i += Character.charCount(s.codePointAt(i));
    error("unexpected character '" + s.substring(start, i) + "'", start, i);
    return SyntaxKind.ERROR_TOKEN;
  }

  private void number() {
    if (s.charAt(i) == '0' && i + 1 < s.length()
        && "xXoObB".indexOf(s.charAt(i + 1)) >= 0) {
      i += 2;
      while (i < s.length()
          && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
        ++i;
      }
      return;
    }
    digits();
    if (i < s.length() && s.charAt(i) == '.') {
      ++i;
      digits();
    }
    if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      int j = i + 1;
      if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) {
        ++j;
      }
      if (j < s.length() && isDigit(s.charAt(j))) {
        i = j;
        digits();
      }
    }
    if (i < s.length() && s.charAt(i) == 'n') {
      ++i;
    }
  }

  private void digits() {
    while (i < s.length() && (isDigit(s.charAt(i)) || s.charAt(i) == '_')) {
      ++i;
    }
  }

  private SyntaxKind string(char quote) {
    final int start = i++;
    while (i < s.length()) {
      final char c = s.charAt(i);
      if (c == quote) {
        ++i;
        return SyntaxKind.STRING;
      }
      if (c == '\\') {
        // An escaped line break continues the string on the next line.
        i += i + 2 < s.length() && s.startsWith("\r\n", i + 1) ? 3 : 2;
        continue;
      }
      if (c == '\n' || c == '\r') {
        break;
      }
      ++i;
    }
    i = Math.min(i, s.length());
    error("unterminated string", start, i);
    return SyntaxKind.ERROR_TOKEN;
  }

  private void template() {
    final int start = i++;
    while (i < s.length()) {
      final char c = s.charAt(i);
      if (c == '`') {
        ++i;
        error("template literals are not supported", start, i);
        return;
      }
      i += c == '\\' ? 2 : 1;
    }
    i = s.length();
    error("unterminated template literal", start, i);
  }

  private void error(String message, int start, int end) {
    errors.add(new JsParseException(message, Pos.of(s, file, start, end)));
  }

  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\f' || c == '\u000B'
        || c == '\u00A0' || c == '\uFEFF';
  }

  static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '$' || c == '_';
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '$' || c == '_';
  }
}

// End JsLexer.java
