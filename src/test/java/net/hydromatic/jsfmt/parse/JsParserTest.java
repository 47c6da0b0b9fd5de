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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.syntax.SyntaxTree;
import net.hydromatic.jsfmt.syntax.Trivia;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link JsParser}. */
public class JsParserTest {
  /** Prints a tree compactly. A node prints as "KIND(children)", followed
   * by "!" if it has its error flag set; a token prints as its text. */
  static String dump(SyntaxElement e) {
    if (e instanceof SyntaxToken) {
      return e.kind == SyntaxKind.EOF ? "EOF" : ((SyntaxToken) e).text;
    }
    final SyntaxNode node = (SyntaxNode) e;
    return node.kind
        + (node.error ? "!" : "")
        + node.children.stream()
            .map(JsParserTest::dump)
            .collect(Collectors.joining(" ", "(", ")"));
  }

  /** Parses a program consisting of one statement, and returns the dump of
   * that statement. */
  private static String statement(String s) {
    final SyntaxTree tree = JsParser.parse(s);
    final List<SyntaxNode> nodes = tree.root.nodes();
    assertThat(nodes.size(), is(1));
    return dump(nodes.get(0));
  }

  /** Parses an expression statement, and returns the dump of the
   * expression. */
  private static String expression(String s) {
    final SyntaxTree tree = JsParser.parse(s);
    assertThat(tree.errors.toString(), tree.hasErrors(), is(false));
    final SyntaxNode statement = tree.root.node(0);
    assertThat(statement.kind, is(SyntaxKind.EXPRESSION_STATEMENT));
    return dump(statement.node(0));
  }

  /** Reconstructs the source from the tokens and their trivia. */
  private static String reconstruct(SyntaxTree tree) {
    final StringBuilder b = new StringBuilder();
    tree.root.forEachToken(token -> {
      token.leading.forEach(t -> b.append(t.text));
      b.append(token.text);
      for (Trivia t : token.trailing) {
        b.append(t.text);
      }
    });
    return b.toString();
  }

  @Test
  void testProgram() {
    final SyntaxTree tree = JsParser.parse("let x = 1;\nf();\n");
    assertThat(tree.hasErrors(), is(false));
    assertThat(dump(tree.root),
        is("PROGRAM(VARIABLE_STATEMENT(VARIABLE_DECLARATION(let "
            + "VARIABLE_DECLARATOR(IDENTIFIER(x) = NUMBER_LITERAL(1))) ;) "
            + "EXPRESSION_STATEMENT(CALL_EXPRESSION(IDENTIFIER(f) "
            + "ARGUMENT_LIST(( ))) ;) EOF)"));
    assertThat(dump(JsParser.parse("").root), is("PROGRAM(EOF)"));
  }

  @Test
  void testVariables() {
    assertThat(statement("var a, b = 2"),
        is("VARIABLE_STATEMENT(VARIABLE_DECLARATION(var "
            + "VARIABLE_DECLARATOR(IDENTIFIER(a)) , "
            + "VARIABLE_DECLARATOR(IDENTIFIER(b) = NUMBER_LITERAL(2))))"));
  }

  @Test
  void testPrecedence() {
    assertThat(expression("a + b * c"),
        is("BINARY_EXPRESSION(IDENTIFIER(a) + "
            + "BINARY_EXPRESSION(IDENTIFIER(b) * IDENTIFIER(c)))"));
    assertThat(expression("a - b - c"),
        is("BINARY_EXPRESSION(BINARY_EXPRESSION(IDENTIFIER(a) - "
            + "IDENTIFIER(b)) - IDENTIFIER(c))"));
    // "**" is right-associative
    assertThat(expression("a ** b ** c"),
        is("BINARY_EXPRESSION(IDENTIFIER(a) ** "
            + "BINARY_EXPRESSION(IDENTIFIER(b) ** IDENTIFIER(c)))"));
    assertThat(expression("a && b || c"),
        is("LOGICAL_EXPRESSION(LOGICAL_EXPRESSION(IDENTIFIER(a) && "
            + "IDENTIFIER(b)) || IDENTIFIER(c))"));
    assertThat(expression("x = y = 1"),
        is("ASSIGNMENT_EXPRESSION(IDENTIFIER(x) = "
            + "ASSIGNMENT_EXPRESSION(IDENTIFIER(y) = NUMBER_LITERAL(1)))"));
    assertThat(expression("a ? b : c ? d : e"),
        is("CONDITIONAL_EXPRESSION(IDENTIFIER(a) ? IDENTIFIER(b) : "
            + "CONDITIONAL_EXPRESSION(IDENTIFIER(c) ? IDENTIFIER(d) : "
            + "IDENTIFIER(e)))"));
    assertThat(expression("-x++"),
        is("UNARY_EXPRESSION(- "
            + "POSTFIX_UPDATE_EXPRESSION(IDENTIFIER(x) ++))"));
  }

  @Test
  void testArrows() {
    assertThat(expression("x => x"),
        is("ARROW_FUNCTION(PARAMETER(x) => IDENTIFIER(x))"));
    assertThat(expression("(a, b) => {}"),
        is("ARROW_FUNCTION(PARAMETER_LIST(( PARAMETER(a) , PARAMETER(b) )) "
            + "=> BLOCK_STATEMENT({ }))"));
    // A parenthesized expression that is not followed by "=>"
    assertThat(expression("(a)"),
        is("PARENTHESIZED_EXPRESSION(( IDENTIFIER(a) ))"));
  }

  @Test
  void testMembersAndCalls() {
    assertThat(expression("a.b[c](d)"),
        is("CALL_EXPRESSION(COMPUTED_MEMBER_EXPRESSION("
            + "MEMBER_EXPRESSION(IDENTIFIER(a) . b) [ IDENTIFIER(c) ]) "
            + "ARGUMENT_LIST(( IDENTIFIER(d) )))"));
    assertThat(expression("new Foo(1).bar"),
        is("MEMBER_EXPRESSION(NEW_EXPRESSION(new IDENTIFIER(Foo) "
            + "ARGUMENT_LIST(( NUMBER_LITERAL(1) ))) . bar)"));
    // A keyword may be a property name
    assertThat(expression("a.default"),
        is("MEMBER_EXPRESSION(IDENTIFIER(a) . default)"));
  }

  @Test
  void testObjectsAndArrays() {
    assertThat(expression("({a, b: 1, ...c})"),
        is("PARENTHESIZED_EXPRESSION(( OBJECT_EXPRESSION({ "
            + "SHORTHAND_PROPERTY(a) , PROPERTY(b : NUMBER_LITERAL(1)) , "
            + "SPREAD_ELEMENT(... IDENTIFIER(c)) }) ))"));
    assertThat(expression("[, a, , b]"),
        is("ARRAY_EXPRESSION([ , IDENTIFIER(a) , , IDENTIFIER(b) ])"));
  }

  @Test
  void testStatements() {
    assertThat(statement("if (a) b; else c"),
        is("IF_STATEMENT(if ( IDENTIFIER(a) ) "
            + "EXPRESSION_STATEMENT(IDENTIFIER(b) ;) "
            + "ELSE_CLAUSE(else EXPRESSION_STATEMENT(IDENTIFIER(c))))"));
    assertThat(statement("for (;;) {}"),
        is("FOR_STATEMENT(for ( ; ; ) BLOCK_STATEMENT({ }))"));
    assertThat(statement("do x(); while (y)"),
        is("DO_WHILE_STATEMENT(do EXPRESSION_STATEMENT(CALL_EXPRESSION("
            + "IDENTIFIER(x) ARGUMENT_LIST(( ))) ;) while ( IDENTIFIER(y) ))"));
    assertThat(statement("try {} finally {}"),
        is("TRY_STATEMENT(try BLOCK_STATEMENT({ }) "
            + "FINALLY_CLAUSE(finally BLOCK_STATEMENT({ })))"));
    assertThat(statement("function f(a = 1, ...r) { return }"),
        is("FUNCTION_DECLARATION(function IDENTIFIER(f) "
            + "PARAMETER_LIST(( PARAMETER(a = NUMBER_LITERAL(1)) , "
            + "REST_PARAMETER(... r) )) "
            + "BLOCK_STATEMENT({ RETURN_STATEMENT(return) }))"));
  }

  /** A line break lets the parser insert a semicolon. */
  @Test
  void testOptionalSemicolon() {
    final SyntaxTree tree = JsParser.parse("a\nb");
    assertThat(tree.hasErrors(), is(false));
    assertThat(dump(tree.root),
        is("PROGRAM(EXPRESSION_STATEMENT(IDENTIFIER(a)) "
            + "EXPRESSION_STATEMENT(IDENTIFIER(b)) EOF)"));

    // "return" followed by a line break returns nothing
    final SyntaxTree tree2 = JsParser.parse("function f() { return\nx }");
    assertThat(tree2.hasErrors(), is(false));
    final SyntaxNode body = tree2.root.node(0).node(SyntaxKind.BLOCK_STATEMENT);
    assertThat(body.nodes().size(), is(2));
  }

  @Test
  void testErrors() {
    final SyntaxTree tree = JsParser.parse("a b", "x.js");
    assertThat(dump(tree.root),
        is("PROGRAM(EXPRESSION_STATEMENT!(IDENTIFIER(a)) "
            + "EXPRESSION_STATEMENT(IDENTIFIER(b)) EOF)"));
    assertThat(tree.errors.size(), is(1));
    assertThat(
        tree.errors.get(0).describeTo(new StringBuilder()).toString(),
        is("x.js:1.3 Error: expected ';' but found 'b'"));

    final SyntaxTree tree2 = JsParser.parse("let = 5;");
    assertThat(dump(tree2.root),
        is("PROGRAM(VARIABLE_STATEMENT(VARIABLE_DECLARATION(let "
            + "VARIABLE_DECLARATOR!(= NUMBER_LITERAL(5))) ;) EOF)"));
    assertThat(tree2.root.hasError(), is(true));
    assertThat(tree2.errors.get(0).getMessage(),
        is("expected an identifier but found '='"));

    final SyntaxTree tree3 = JsParser.parse("a;\n)\nb;");
    assertThat(tree3.root.node(1).kind, is(SyntaxKind.BOGUS_STATEMENT));
    assertThat(tree3.errors.get(0).getMessage(),
        is("expected a statement but found ')'"));

    final SyntaxTree tree4 = JsParser.parse("f(1");
    assertThat(tree4.errors.get(0).getMessage(),
        is("expected ')' but found end of file"));
  }

  /** A template literal becomes a bogus expression. */
  @Test
  void testTemplate() {
    assertThat(statement("x = `a${b}`;"),
        is("EXPRESSION_STATEMENT(ASSIGNMENT_EXPRESSION(IDENTIFIER(x) = "
            + "BOGUS_EXPRESSION(`a${b}`)) ;)"));
  }

  /** Every character of the source belongs to exactly one token or one
   * piece of trivia, even if the source has errors. */
  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "let x = 1; // c\n",
      "/* a */ f(/* b */)\n\n// end\n",
      "a b c ) ] }",
      "if (x {\n  y = `t`\n",
      "x = 'unterminated\ny",
      "\r\n\ta;\r\n"
  })
  void testLossless(String source) {
    assertThat(reconstruct(JsParser.parse(source)), is(source));
  }
}

// End JsParserTest.java
