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
package net.hydromatic.jsfmt.doc;

import static net.hydromatic.jsfmt.doc.DocBuilder.doc;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link DocBuilder}, {@link DocWriter} and {@link Docs}. */
public class DocBuilderTest {
  @Test
  void testConcatFlattens() {
    final Doc d =
        doc.concat(
            doc.text("a"),
            doc.concat(doc.text("b"), doc.text("")),
            doc.empty(),
            doc.line());
    assertThat(d.toString(), is("[\"a\", \"b\", line]"));
    assertThat(doc.concat(doc.text("x")).toString(), is("\"x\""));
    assertThat(doc.concat().toString(), is("[]"));
  }

  @Test
  void testWriter() {
    final GroupIdGenerator generator = new GroupIdGenerator();
    final GroupId id = generator.next("args");
    final Doc d =
        doc.group(
            doc.concat(
                doc.text("("),
                doc.indent(doc.softline(), doc.text("a")),
                doc.ifBreak(doc.text(","), doc.empty(), id),
                doc.softline(),
                doc.text(")")),
            id);
    assertThat(
        d.toString(),
        is(
            "group<args#0>([\"(\", indent([softline, \"a\"]), "
                + "ifBreak(\",\", [], args#0), softline, \")\"])"));
    assertThat(
        doc.lineSuffix(doc.text(" // c"), true).toString(),
        is("lineSuffix(\" // c\", forcesBreak)"));
    assertThat(
        doc.group(doc.text("a"), null, true).toString(),
        is("group(\"a\", shouldBreak)"));
    assertThat(doc.text("say \"hi\"").toString(), is("\"say \\\"hi\\\"\""));
  }

  @Test
  void testGroupIdsAreDistinct() {
    final GroupIdGenerator generator = new GroupIdGenerator();
    final GroupId a = generator.next("x");
    final GroupId b = generator.next("x");
    assertThat(a.equals(b), is(false));
    assertThat(a.toString(), is("x#0"));
    assertThat(b.toString(), is("x#1"));
  }

  @Test
  void testTextMustNotContainLineBreak() {
    assertThrows(IllegalArgumentException.class, () -> doc.text("a\nb"));
    assertThrows(IllegalArgumentException.class, () -> doc.text("a\rb"));
  }

  @Test
  void testFillMustHaveOddParts() {
    assertThrows(
        IllegalArgumentException.class,
        () -> doc.fill(ImmutableList.of(doc.text("a"), doc.line())));
    assertThat(doc.fill(ImmutableList.of()).toString(), is("fill()"));
    assertThat(
        doc.fill(ImmutableList.of(doc.text("a"), doc.line(), doc.text("b")))
            .toString(),
        is("fill(\"a\", line, \"b\")"));
  }

  @Test
  void testVerbatim() {
    assertThat(
        doc.verbatim("a\nb\r\nc").toString(),
        is("[\"a\", literalLine, \"b\", literalLine, \"c\"]"));
    assertThat(doc.verbatim("abc").toString(), is("\"abc\""));
  }

  /** A forced break propagates to every doc that contains it. */
  @Test
  void testForcedBreak() {
    assertThat(doc.text("a").forcedBreak, is(false));
    assertThat(doc.line().forcedBreak, is(false));
    assertThat(doc.softline().forcedBreak, is(false));
    assertThat(doc.hardline().forcedBreak, is(true));
    assertThat(doc.emptyLine().forcedBreak, is(true));
    assertThat(doc.literalLine().forcedBreak, is(true));
    assertThat(
        doc.group(doc.text("a"), doc.indent(doc.line(), doc.text("b")))
            .forcedBreak,
        is(false));
    assertThat(
        doc.group(doc.text("a"), doc.indent(doc.hardline(), doc.text("b")))
            .forcedBreak,
        is(true));
    assertThat(doc.group(doc.text("a"), null, true).forcedBreak, is(true));
    assertThat(doc.lineSuffix(doc.text("a")).forcedBreak, is(false));
    // A line comment breaks a group only if text follows it
    assertThat(doc.lineSuffix(doc.text("a"), true).forcedBreak, is(false));
    assertThat(
        doc.group(doc.text("a"), doc.lineSuffix(doc.text("// b"), true))
            .forcedBreak,
        is(false));
    assertThat(
        doc.lineSuffix(doc.concat(doc.text("a"), doc.hardline()), true)
            .forcedBreak,
        is(true));
    // Only the flat branch of a conditional counts
    assertThat(
        doc.ifBreak(doc.hardline(), doc.text("a")).forcedBreak, is(false));
  }

  @Test
  void testValidate() {
    final GroupIdGenerator generator = new GroupIdGenerator();
    final GroupId id = generator.next("g");
    final Doc group = doc.group(doc.text("a"), id);
    // The same group twice is fine
    Docs.validate(doc.concat(group, doc.ifBreak(group, group)));
    final Doc other = doc.group(doc.text("b"), id);
    assertThrows(
        IllegalStateException.class,
        () -> Docs.validate(doc.concat(group, other)));
  }

  @Test
  void testFlatWidth() {
    assertThat(
        Docs.flatWidth(
            doc.group(
                doc.text("ab"),
                doc.line(),
                doc.softline(),
                doc.text("c"),
                doc.lineSuffix(doc.text(" // ignored")))),
        is(4));
    assertThat(
        Docs.flatWidth(doc.ifBreak(doc.text("long"), doc.text("s"))), is(1));
    assertThat(
        Docs.flatWidth(doc.concat(doc.text("a"), doc.hardline())), is(-1));
  }

  @Test
  void testJoin() {
    assertThat(
        doc.join(
                doc.text(", "),
                ImmutableList.of(doc.text("a"), doc.text("b"), doc.text("c")))
            .toString(),
        is("[\"a\", \", \", \"b\", \", \", \"c\"]"));
    assertThat(doc.join(doc.line(), ImmutableList.of()).toString(), is("[]"));
  }
}

// End DocBuilderTest.java
