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
package net.hydromatic.jsfmt.printer;

import static net.hydromatic.jsfmt.doc.DocBuilder.doc;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.doc.GroupId;
import net.hydromatic.jsfmt.doc.GroupIdGenerator;
import org.junit.jupiter.api.Test;

/** Tests for {@link Printer}. */
public class PrinterTest {
  private static String print(Doc doc, int lineWidth) {
    return Printer.print(doc, PrinterOptions.DEFAULT.withLineWidth(lineWidth));
  }

  /** Returns {@code f(a, b, ...)} as a group that breaks after "(". */
  private static Doc call(String name, String... args) {
    final List<Doc> parts = new ArrayList<>();
    for (String arg : args) {
      if (!parts.isEmpty()) {
        parts.add(doc.concat(doc.text(","), doc.line()));
      }
      parts.add(doc.text(arg));
    }
    return doc.group(
        doc.text(name),
        doc.text("("),
        doc.indent(doc.softline(), doc.concat(parts)),
        doc.softline(),
        doc.text(")"));
  }

  @Test
  void testGroupFits() {
    final Doc d = call("f", "aaaa", "bbbb", "cccc");
    assertThat(print(d, 80), is("f(aaaa, bbbb, cccc)"));
    assertThat(print(d, 19), is("f(aaaa, bbbb, cccc)"));
    assertThat(print(d, 18), is("f(\n  aaaa,\n  bbbb,\n  cccc\n)"));
  }

  /** The text after a group, up to the next line break, counts when deciding
   * whether the group fits. */
  @Test
  void testGroupMeasuresRestOfLine() {
    final Doc d =
        doc.concat(call("f", "a"), doc.text(";;;;"), doc.hardline(),
            doc.text("next line, which is long"));
    assertThat(print(d, 8), is("f(a);;;;\nnext line, which is long"));
    assertThat(print(d, 7), is("f(\n  a\n);;;;\nnext line, which is long"));
  }

  @Test
  void testHardlineBreaksEnclosingGroups() {
    final Doc d =
        doc.group(
            doc.text("{"),
            doc.indent(doc.line(), doc.text("a"), doc.hardline(),
                doc.text("b")),
            doc.line(),
            doc.text("}"));
    assertThat(print(d, 80), is("{\n  a\n  b\n}"));
  }

  @Test
  void testShouldBreak() {
    final Doc d =
        doc.group(
            doc.concat(doc.text("{"), doc.indent(doc.line(), doc.text("a")),
                doc.line(), doc.text("}")),
            null,
            true);
    assertThat(print(d, 80), is("{\n  a\n}"));
  }

  /** An inner group is measured separately from the broken outer group. */
  @Test
  void testNestedGroups() {
    final Doc d =
        doc.group(
            doc.text("["),
            doc.indent(
                doc.softline(),
                call("f", "a", "b"),
                doc.text(","),
                doc.line(),
                call("g", "cccccccc", "dddddddd")),
            doc.softline(),
            doc.text("]"));
    assertThat(
        print(d, 20),
        is("[\n  f(a, b),\n  g(\n    cccccccc,\n    dddddddd\n  )\n]"));
  }

  @Test
  void testFill() {
    final List<Doc> parts = new ArrayList<>();
    for (String word : "aaa bbb ccc ddd eee fff".split(" ")) {
      if (!parts.isEmpty()) {
        parts.add(doc.line());
      }
      parts.add(doc.text(word));
    }
    final Doc d = doc.fill(parts);
    assertThat(print(d, 80), is("aaa bbb ccc ddd eee fff"));
    assertThat(print(d, 11), is("aaa bbb ccc\nddd eee fff"));
    assertThat(print(d, 10), is("aaa bbb\nccc ddd\neee fff"));
    assertThat(print(d, 2), is("aaa\nbbb\nccc\nddd\neee\nfff"));
  }

  /** A fill decides each separator from the content that follows it, not from
   * the whole fill. */
  @Test
  void testFillIndependence() {
    final Doc d =
        doc.fill(
            ImmutableList.of(
                doc.text("a"),
                doc.line(),
                doc.text("bbbbbbbbbb"),
                doc.line(),
                doc.text("c")));
    assertThat(print(d, 12), is("a bbbbbbbbbb\nc"));
    assertThat(print(d, 11), is("a\nbbbbbbbbbb\nc"));
  }

  @Test
  void testLineSuffix() {
    final Doc d =
        doc.concat(
            doc.text("a"),
            doc.lineSuffix(doc.text(" // note")),
            doc.text(";"),
            doc.hardline(),
            doc.text("b"));
    assertThat(print(d, 80), is("a; // note\nb"));

    // Flushed at the end of the document
    final Doc d2 = doc.concat(doc.text("a"), doc.lineSuffix(doc.text(" // z")));
    assertThat(print(d2, 80), is("a // z"));
  }

  /** After a line comment has been queued, a group breaks rather than put
   * text on the same line as the comment. */
  @Test
  void testPendingLineComment() {
    final Doc d =
        doc.concat(
            doc.text("x"),
            doc.lineSuffix(doc.text(" // c"), true),
            doc.group(doc.softline(), doc.text("y")));
    assertThat(print(d, 80), is("x // c\ny"));
  }

  @Test
  void testIfBreak() {
    final GroupId id = new GroupIdGenerator().next("list");
    final Doc d =
        doc.concat(
            doc.group(
                doc.concat(
                    doc.text("["),
                    doc.indent(doc.softline(), doc.text("aaaa"),
                        doc.ifBreak(doc.text(","), doc.empty())),
                    doc.softline(),
                    doc.text("]")),
                id),
            doc.ifBreak(doc.text(" // broken"), doc.text(" // flat"), id));
    assertThat(print(d, 80), is("[aaaa] // flat"));
    assertThat(print(d, 10), is("[\n  aaaa,\n] // broken"));
  }

  @Test
  void testNoTrailingWhitespace() {
    final Doc d =
        doc.concat(
            doc.text("a"),
            doc.text(" "),
            doc.hardline(),
            doc.indent(doc.hardline(), doc.text("b")));
    assertThat(print(d, 80), is("a\n\n  b"));
  }

  @Test
  void testEmptyLine() {
    final Doc d =
        doc.indent(doc.text("x"), doc.emptyLine(), doc.text("y"));
    assertThat(print(d, 80), is("x\n\n  y"));
  }

  @Test
  void testLiteralLine() {
    final Doc d =
        doc.indent(doc.hardline(), doc.verbatim("/* a\n   b */"),
            doc.hardline(), doc.text("c"));
    assertThat(print(d, 80), is("\n  /* a\n   b */\n  c"));
  }

  @Test
  void testTabs() {
    final PrinterOptions options =
        new PrinterOptions(6, IndentStyle.TAB, 4, LineEnding.LF);
    final Doc d = call("f", "a");
    assertThat(Printer.print(d, options), is("f(a)"));
    // A tab counts as 4 columns, so "\tx y" would be 7 wide
    final Doc d2 =
        doc.indent(
            doc.hardline(),
            doc.group(doc.text("x"), doc.line(), doc.text("y")));
    assertThat(Printer.print(d2, options), is("\n\tx\n\ty"));
  }

  @Test
  void testCrlf() {
    final PrinterOptions options =
        new PrinterOptions(80, IndentStyle.SPACE, 2, LineEnding.CRLF);
    final Doc d =
        doc.concat(doc.text("a"), doc.indent(doc.hardline(), doc.text("b")),
            doc.emptyLine(), doc.text("c"));
    assertThat(Printer.print(d, options), is("a\r\n  b\r\n\r\nc"));
  }

  @Test
  void testWidthCountsCodePoints() {
    final Doc d = doc.group(doc.text("😀😀"), doc.line(), doc.text("b"));
    assertThat(print(d, 4), is("😀😀 b"));
    assertThat(print(d, 3), is("😀😀\nb"));
  }
}

// End PrinterTest.java
