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
package net.hydromatic.jsfmt;

import static net.hydromatic.jsfmt.Js.js;
import static net.hydromatic.jsfmt.Matchers.hasKinds;
import static net.hydromatic.jsfmt.Matchers.isDoc;
import static net.hydromatic.jsfmt.Matchers.linesAtMost;
import static net.hydromatic.jsfmt.Matchers.noTrailingWhitespace;

import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.hydromatic.jsfmt.config.FormatOptions;
import net.hydromatic.jsfmt.config.FormatProp;
import net.hydromatic.jsfmt.config.QuoteStyle;
import net.hydromatic.jsfmt.config.TrailingComma;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.doc.Docs;
import net.hydromatic.jsfmt.format.FormatDiagnostic;
import net.hydromatic.jsfmt.format.FormatException;
import net.hydromatic.jsfmt.format.FormatResult;
import net.hydromatic.jsfmt.format.FormatTracer;
import net.hydromatic.jsfmt.format.FormatTracers;
import net.hydromatic.jsfmt.parse.JsParser;
import net.hydromatic.jsfmt.printer.IndentStyle;
import net.hydromatic.jsfmt.printer.LineEnding;
import org.junit.jupiter.api.Test;

/** Tests for {@link JsFormatter}. */
public class JsFormatterTest {
  @Test
  void testEmpty() {
    js("").assertFormat("");
    js("\n\n").assertFormat("");
    js("a").assertFormat("a;\n");
    js(";;a;;").assertFormat("a;\n");
  }

  /** Runs of empty lines between statements collapse to one. */
  @Test
  void testBlankLines() {
    js("a;\n\n\n\nb;").assertFormat("a;\n\nb;\n");
    js("a;\nb;\n").assertFormatSame();
  }

  @Test
  void testCallBreaks() {
    js("f(aaaa, bbbb, cccc)")
        .withLineWidth(10)
        .assertFormat("f(\n  aaaa,\n  bbbb,\n  cccc\n);\n")
        .assertFormat(linesAtMost(10));
    js("f(aaaa, bbbb, cccc)")
        .withLineWidth(40)
        .assertFormat("f(aaaa, bbbb, cccc);\n");
  }

  @Test
  void testVariables() {
    js("let x=1,y=2").assertFormat("let x = 1, y = 2;\n");
    js("var aaaaaa = 1, bbbbbb = 2, cccccc = 3;")
        .withLineWidth(20)
        .assertFormat("var aaaaaa = 1,\n  bbbbbb = 2,\n  cccccc = 3;\n");
    js("const f=x=>x*2").assertFormat("const f = (x) => x * 2;\n");
  }

  @Test
  void testEdgeBlankLines() {
    final String source = "function f() {\n\n  a;\n\n}";
    js(source).assertFormat("function f() {\n  a;\n}\n");
    js(source)
        .with(FormatProp.PRESERVE_EDGE_BLANK_LINES, true)
        .assertFormat("function f() {\n\n  a;\n\n}\n");
  }

  @Test
  void testIf() {
    js("if(a){b()}else if(c){d()}else{e()}")
        .assertFormat("if (a) {\n"
            + "  b();\n"
            + "} else if (c) {\n"
            + "  d();\n"
            + "} else {\n"
            + "  e();\n"
            + "}\n");
    js("if (a) b(); else c();").assertFormat("if (a) b();\nelse c();\n");
    // A line comment after "}" moves "else" to the next line
    js("if (a) {\n} // c\nelse {\n}").assertFormat("if (a) {} // c\nelse {}\n");
  }

  @Test
  void testLoops() {
    js("for(var i=0;i<n;i++){}")
        .assertFormat("for (var i = 0; i < n; i++) {}\n");
    js("for(;;){}").assertFormat("for (;;) {}\n");
    js("for (;;);").assertFormatSame();
    js("while(x)y()").assertFormat("while (x) y();\n");
    js("do{x()}while(y)").assertFormat("do {\n  x();\n} while (y);\n");
  }

  @Test
  void testTry() {
    js("try{a()}catch(e){b()}finally{c()}")
        .assertFormat("try {\n"
            + "  a();\n"
            + "} catch (e) {\n"
            + "  b();\n"
            + "} finally {\n"
            + "  c();\n"
            + "}\n");
  }

  @Test
  void testFunctions() {
    js("a => b => a + b").assertFormat("(a) => (b) => a + b;\n");
    js("function f(a, b = 1, ...rest) {}").assertFormatSame();
    js("function foo(aaaaaa, bbbbbb) {}")
        .withLineWidth(20)
        .with(FormatProp.TRAILING_COMMA, TrailingComma.ALL)
        .assertFormat("function foo(\n  aaaaaa,\n  bbbbbb,\n) {}\n");
    // The same, without trailing comma
    js("function foo(aaaaaa, bbbbbb) {}")
        .withLineWidth(20)
        .assertFormat("function foo(\n  aaaaaa,\n  bbbbbb\n) {}\n");
    // A trailing comma is never added after a rest parameter
    js("function foo(aaaaaa, ...bbbbbb) {}")
        .withLineWidth(20)
        .with(FormatProp.TRAILING_COMMA, "all")
        .assertFormat("function foo(\n  aaaaaa,\n  ...bbbbbb\n) {}\n");
  }

  /** A function or object that is the only argument, or a function that is
   * the last argument, hugs the parentheses. */
  @Test
  void testHug() {
    js("promise.then(function(result){log(result)})")
        .assertFormat("promise.then(function (result) {\n"
            + "  log(result);\n"
            + "});\n");
    js("describe('x', () => {it()})")
        .assertFormat("describe(\"x\", () => {\n  it();\n});\n");
    js("f({a, b})").assertFormat("f({ a, b });\n");
    js("foo({a: 1, b: 2})")
        .withLineWidth(10)
        .assertFormat("foo({\n  a: 1,\n  b: 2\n});\n");
  }

  /** If the arguments before a hugged function do not fit on the first
   * line, all of the arguments break. */
  @Test
  void testHugTooLong() {
    js("setTimeout(someVeryLongArgumentName, anotherVeryLongArgumentName, "
        + "yetAnotherArg, () => { x(); });")
        .assertFormat("setTimeout(\n"
            + "  someVeryLongArgumentName, anotherVeryLongArgumentName, "
            + "yetAnotherArg,\n"
            + "  () => {\n"
            + "    x();\n"
            + "  }\n"
            + ");\n");
    js("foo(aaaaaaaaaa, bbbbbbbbbb, cccccccccc, () => {});")
        .withLineWidth(20)
        .assertFormat("foo(\n"
            + "  aaaaaaaaaa,\n"
            + "  bbbbbbbbbb,\n"
            + "  cccccccccc,\n"
            + "  () => {}\n"
            + ");\n");
  }

  @Test
  void testObjects() {
    js("const o={a:1,b:'x'}").assertFormat("const o = { a: 1, b: \"x\" };\n");
    // A line break after "{" keeps the object broken
    js("const o = {\n  a: 1, b: 2 }")
        .assertFormat("const o = {\n  a: 1,\n  b: 2\n};\n");
    js("x = {}").assertFormat("x = {};\n");
  }

  @Test
  void testArrays() {
    js("[1,2,3]").assertFormat("[1, 2, 3];\n");
    js("[, a, , b]").assertFormat("[, a, , b];\n");
    js("x = [1111, 2222, 3333, 4444, 5555];")
        .withLineWidth(20)
        .assertFormat("x = [\n  1111, 2222, 3333,\n  4444, 5555\n];\n");
  }

  @Test
  void testBinary() {
    js("x = aaaaaaa + bbbbbbb + ccccccc;")
        .withLineWidth(20)
        .assertFormat("x =\n  aaaaaaa +\n  bbbbbbb +\n  ccccccc;\n");
    js("if (aaaaaaa && bbbbbbb && ccccccc) {}")
        .withLineWidth(20)
        .assertFormat("if (\n"
            + "  aaaaaaa &&\n"
            + "  bbbbbbb &&\n"
            + "  ccccccc\n"
            + ") {}\n");
    js("x = aaaaaa ? bbbbbb : cccccc;")
        .withLineWidth(20)
        .assertFormat("x = aaaaaa\n  ? bbbbbb\n  : cccccc;\n");
  }

  @Test
  void testComments() {
    js("// header\n\nlet a = 1; // trailing\n/* block */ b();\n")
        .assertFormatSame();
    js("function f() {\n  // todo\n}").assertFormat("function f() {\n"
        + "  // todo\n"
        + "}\n");
    js("a();\n// end\n").assertFormatSame();
    js("f(a, // first\n  b)").assertFormat("f(\n  a, // first\n  b\n);\n");
    js("f(/* nothing */)").assertFormat("f(/* nothing */);\n");
    js("x = [ // c\n];").assertFormat("x = [\n  // c\n];\n");
    js("{ /* c */ }").assertFormat("{\n  /* c */\n}\n");
    js("{\n  a();\n\n  // c\n  b();\n}").assertFormatSame();
  }

  /** A line comment after an element moves after the comma or semicolon
   * that follows the element. */
  @Test
  void testCommentBeforePunctuation() {
    js("f(() => {}, // c\n);").assertFormat("f(\n  () => {} // c\n);\n");
    js("let a = 1 // c\n, b = 2;")
        .assertFormat("let a = 1, // c\n  b = 2;\n");
    js("let a = 1 // c\n;").assertFormat("let a = 1; // c\n");
    js("a = 1 // c\nb = 2").assertFormat("a = 1; // c\nb = 2;\n");
    // A line comment breaks a group only if text follows it
    js("if (a) b; // c\nelse d;").assertFormatSame();
  }

  /** Empty statements are not printed, so a comment before them is
   * dangling in the block. */
  @Test
  void testCommentBeforeEmptyStatement() {
    js("{ /* c */ ; }").assertFormat("{\n  /* c */\n}\n");
    js("if (a) { /* c */ ; }").assertFormat("if (a) {\n  /* c */\n}\n");
  }

  /** A block comment whose lines start with "*" is re-indented. */
  @Test
  void testDocComment() {
    js("  /**\n     * Doc.\n     */\nfunction f() {}")
        .assertFormat("/**\n * Doc.\n */\nfunction f() {}\n");
    js("{\n/**\n * Doc.\n */\nf();\n}")
        .assertFormat("{\n  /**\n   * Doc.\n   */\n  f();\n}\n");
  }

  @Test
  void testLiterals() {
    js("x = 'say \"hi\"'").assertFormat("x = 'say \"hi\"';\n");
    js("x = 'don\\'t'").assertFormat("x = \"don't\";\n");
    js("x = \"a\"")
        .with(FormatProp.QUOTE_STYLE, QuoteStyle.SINGLE)
        .assertFormat("x = 'a';\n");
    js("x = 0XFF + .5 + 5. + 1E+5 + 10n")
        .assertFormat("x = 0xFF + 0.5 + 5 + 1e5 + 10n;\n");
  }

  @Test
  void testUnaryNewMember() {
    js("x = - -a").assertFormat("x = - -a;\n");
    js("x = typeof y").assertFormatSame();
    js("x = !a").assertFormatSame();
    js("new Foo").assertFormat("new Foo();\n");
    js("x = 1..toString()").assertFormat("x = (1).toString();\n");
    js("a.b[c](d)").assertFormat("a.b[c](d);\n");
  }

  /** Constructs that the formatter cannot handle are printed as they are,
   * with a warning. */
  @Test
  void testVerbatim() {
    js("x = `a${b}`;")
        .assertFormatSame()
        .assertDiagnostics(hasKinds(FormatException.Kind.UNSUPPORTED_NODE));
    js("let = 5;")
        .assertParseErrorCount(1)
        .assertFormatSame()
        .assertDiagnostics(hasKinds(FormatException.Kind.SYNTAX_ERROR));
    js("a;\n)\nb;")
        .assertFormatSame()
        .assertDiagnostics(hasKinds(FormatException.Kind.UNSUPPORTED_NODE));
    js("a ;").assertDiagnostics(hasKinds());

    final FormatResult result = js("x = `a${b}`;").format();
    assertThat(result.hasDiagnostics(), is(true));
    assertThat(result.diagnostics.get(0).toString(),
        is("1.5-1.11 Warning: unsupported node BOGUS_EXPRESSION; "
            + "printed verbatim"));
  }

  @Test
  void testOptions() {
    js("a;b;")
        .withOptions(FormatOptions.DEFAULT.withLineEnding(LineEnding.CRLF))
        .assertFormat("a;\r\nb;\r\n");
    js("{a}")
        .withOptions(FormatOptions.DEFAULT.withIndentStyle(IndentStyle.TAB))
        .assertFormat("{\n\ta;\n}\n");
    js("{a}")
        .withOptions(FormatOptions.DEFAULT.withIndentWidth(4))
        .assertFormat("{\n    a;\n}\n");
  }

  @Test
  void testDoc() {
    js("a;").assertDoc(isDoc("[\"a\", \";\", hardline]"));
  }

  /** The tracer sees the doc, every diagnostic, and the output. */
  @Test
  void testTracer() {
    final List<Doc> docs = new ArrayList<>();
    final List<FormatDiagnostic> diagnostics = new ArrayList<>();
    final List<String> outputs = new ArrayList<>();
    FormatTracer tracer = FormatTracers.empty();
    tracer = FormatTracers.withOnDoc(tracer, docs::add);
    tracer = FormatTracers.withOnDiagnostic(tracer, diagnostics::add);
    tracer = FormatTracers.withOnPrinted(tracer, outputs::add);
    final FormatResult result =
        JsFormatter.format(JsParser.parse("f(1);\nx = `t`;\n"),
            FormatOptions.DEFAULT, tracer);
    assertThat(docs.size(), is(1));
    // Group ids are unique within the doc
    assertThat(Docs.validate(docs.get(0)), is(docs.get(0)));
    assertThat(result.diagnostics, is(diagnostics));
    assertThat(diagnostics.size(), is(1));
    assertThat(outputs.size(), is(1));
    assertThat(outputs.get(0), is(result.text));
  }

  /** Formatting a large input stays within the line width and leaves no
   * trailing whitespace. */
  @Test
  void testWideInput() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 50; i++) {
      b.append("const v").append(i).append(" = compute(alpha").append(i)
          .append(", beta, gamma, { key: 'value', other: [1, 2, 3] }, ")
          .append("function (x) { return x * ").append(i).append("; });\n");
    }
    js(b.toString())
        .withLineWidth(60)
        .assertFormat(allOf(linesAtMost(60), noTrailingWhitespace()));
  }

  /** Several threads may format at the same time. */
  @Test
  void testConcurrent() throws Exception {
    final List<String> sources =
        ImmutableList.of("f(aaaa, bbbb, cccc)",
            "if(a){b()}else{c()}",
            "const o={a:1,b:'x'}",
            "x = [1111, 2222, 3333, 4444, 5555];",
            "// c\nfunction f(a, // first\n  b) {}");
    final FormatOptions options = FormatOptions.DEFAULT.withLineWidth(20);
    final List<String> expected = new ArrayList<>();
    for (String source : sources) {
      expected.add(JsFormatter.formatSource(source, options).text);
    }
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 100; i++) {
        final String source = sources.get(i % sources.size());
        futures.add(
            executor.submit(() ->
                JsFormatter.formatSource(source, options).text));
      }
      for (int i = 0; i < futures.size(); i++) {
        assertThat(futures.get(i).get(), is(expected.get(i % sources.size())));
      }
    } finally {
      executor.shutdown();
    }
  }
}

// End JsFormatterTest.java
