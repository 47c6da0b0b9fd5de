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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds documents. */
public enum DocBuilder {
  /**
   * The singleton instance of the document builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  doc;

  private static final Doc EMPTY = new Doc.Concat(ImmutableList.of());
  private static final Doc SOFTLINE = new Doc.Line(LineMode.SOFT);
  private static final Doc LINE = new Doc.Line(LineMode.SPACE);
  private static final Doc HARDLINE = new Doc.Line(LineMode.HARD);
  private static final Doc EMPTY_LINE = new Doc.Line(LineMode.EMPTY);
  private static final Doc LITERAL_LINE = new Doc.Line(LineMode.LITERAL);
  private static final Doc SPACE = new Doc.Text(" ");

  /** Returns a doc that prints nothing. */
  public Doc empty() {
    return EMPTY;
  }

  /** Creates a text doc. The text must not contain a line break. */
  public Doc text(String text) {
    checkArgument(text.indexOf('\n') < 0 && text.indexOf('\r') < 0,
        "text must not contain a line break: %s", text);
    return text.equals(" ") ? SPACE : new Doc.Text(text);
  }

  /** Returns a doc that prints a space. */
  public Doc space() {
    return SPACE;
  }

  /** Returns a line that prints nothing in flat mode. */
  public Doc softline() {
    return SOFTLINE;
  }

  /** Returns a line that prints a space in flat mode. */
  public Doc line() {
    return LINE;
  }

  /** Returns a line that always breaks. */
  public Doc hardline() {
    return HARDLINE;
  }

  /** Returns a line that always breaks and leaves one empty line. */
  public Doc emptyLine() {
    return EMPTY_LINE;
  }

  /** Returns a line that always breaks, and does not indent the following
   * line. */
  public Doc literalLine() {
    return LITERAL_LINE;
  }

  /** Creates a group. */
  public Doc group(Doc child) {
    return new Doc.Group(child, null, false);
  }

  /** Creates a group of a sequence of docs. */
  public Doc group(Doc... children) {
    return group(concat(children));
  }

  /** Creates a group with an id, by which a {@link #ifBreak conditional}
   * may refer to it. */
  public Doc group(Doc child, @Nullable GroupId id) {
    return new Doc.Group(child, id, false);
  }

  /** Creates a group, with an id, that may be forced to break. */
  public Doc group(Doc child, @Nullable GroupId id, boolean shouldBreak) {
    return new Doc.Group(child, id, shouldBreak);
  }

  /** Creates an indented doc. */
  public Doc indent(Doc child) {
    return new Doc.Indent(child);
  }

  /** Creates an indented sequence of docs. */
  public Doc indent(Doc... children) {
    return indent(concat(children));
  }

  /** Creates a fill.
   *
   * <p>The parts must alternate content and separator, starting and ending
   * with content; that is, there must be an odd number of parts, or none. */
  public Doc fill(List<Doc> parts) {
    checkArgument(parts.isEmpty() || parts.size() % 2 == 1,
        "fill must have an odd number of parts: %s", parts.size());
    return new Doc.Fill(ImmutableList.copyOf(parts));
  }

  /** Creates a doc whose content is printed just before the next line
   * break. */
  public Doc lineSuffix(Doc content) {
    return new Doc.LineSuffix(content, false);
  }

  /** Creates a line suffix that, if {@code forcesBreak}, must be followed
   * by a line break before any more text. */
  public Doc lineSuffix(Doc content, boolean forcesBreak) {
    return new Doc.LineSuffix(content, forcesBreak);
  }

  /** Creates a doc that prints {@code broken} if the enclosing group is
   * broken, {@code flat} otherwise. */
  public Doc ifBreak(Doc broken, Doc flat) {
    return new Doc.Conditional(broken, flat, null);
  }

  /** Creates a doc that prints {@code broken} if the group with a given id
   * is broken, {@code flat} otherwise. */
  public Doc ifBreak(Doc broken, Doc flat, @Nullable GroupId groupId) {
    return new Doc.Conditional(broken, flat, groupId);
  }

  /** Creates a sequence of docs. */
  public Doc concat(Doc... parts) {
    return concat(Arrays.asList(parts));
  }

  /** Creates a sequence of docs. Nested sequences are flattened, and empty
   * texts are removed. */
  public Doc concat(List<Doc> parts) {
    final ImmutableList.Builder<Doc> b = ImmutableList.builder();
    addTo(b, parts);
    final ImmutableList<Doc> list = b.build();
    switch (list.size()) {
    case 0:
      return EMPTY;
    case 1:
      return list.get(0);
    default:
      return new Doc.Concat(list);
    }
  }

  private static void addTo(ImmutableList.Builder<Doc> b, List<Doc> parts) {
    for (Doc part : parts) {
      if (part instanceof Doc.Concat) {
        addTo(b, ((Doc.Concat) part).parts);
      } else if (!(part instanceof Doc.Text)
          || !((Doc.Text) part).text.isEmpty()) {
        b.add(part);
      }
    }
  }

  /** Joins docs with a separator. */
  public Doc join(Doc separator, List<Doc> docs) {
    final ImmutableList.Builder<Doc> b = ImmutableList.builder();
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) {
        b.add(separator);
      }
      b.add(docs.get(i));
    }
    return concat(b.build());
  }

  /** Creates a doc for text that may span several lines, such as a block
   * comment or a region of source code that is printed unchanged.
   *
   * <p>Lines after the first are not indented, so the text is reproduced
   * exactly. */
  public Doc verbatim(String text) {
    final ImmutableList.Builder<Doc> b = ImmutableList.builder();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '\n' || c == '\r') {
        b.add(new Doc.Text(text.substring(start, i)));
        b.add(LITERAL_LINE);
        if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
          ++i;
        }
        start = i + 1;
      }
    }
    b.add(new Doc.Text(text.substring(start)));
    return concat(b.build());
  }
}

// End DocBuilder.java
