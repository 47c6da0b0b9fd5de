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

import java.util.List;

/** Writes a {@link Doc} as a string, for debugging and tests.
 *
 * <p>Texts are quoted; lines are written as {@code softline}, {@code line},
 * {@code hardline}, {@code emptyLine} and {@code literalLine}; sequences as
 * {@code [a, b]}; other docs as function calls, such as {@code indent(a)}. */
public class DocWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a doc. */
  public DocWriter append(Doc doc) {
    switch (doc.kind) {
    case TEXT:
      b.append('"');
      final String text = ((Doc.Text) doc).text;
      for (int i = 0; i < text.length(); i++) {
        final char c = text.charAt(i);
        if (c == '"' || c == '\\') {
          b.append('\\');
        }
        b.append(c);
      }
      b.append('"');
      return this;

    case LINE:
      switch (((Doc.Line) doc).mode) {
      case SOFT:
        b.append("softline");
        break;
      case SPACE:
        b.append("line");
        break;
      case HARD:
        b.append("hardline");
        break;
      case EMPTY:
        b.append("emptyLine");
        break;
      default:
        b.append("literalLine");
        break;
      }
      return this;

    case GROUP:
      final Doc.Group group = (Doc.Group) doc;
      b.append("group");
      if (group.id != null) {
        b.append('<').append(group.id).append('>');
      }
      b.append('(');
      append(group.child);
      if (group.shouldBreak) {
        b.append(", shouldBreak");
      }
      b.append(')');
      return this;

    case INDENT:
      b.append("indent(");
      return append(((Doc.Indent) doc).child).close();

    case FILL:
      b.append("fill");
      return list(((Doc.Fill) doc).parts, '(', ')');

    case LINE_SUFFIX:
      final Doc.LineSuffix suffix = (Doc.LineSuffix) doc;
      b.append("lineSuffix(");
      append(suffix.content);
      if (suffix.forcesBreak) {
        b.append(", forcesBreak");
      }
      return close();

    case CONDITIONAL:
      final Doc.Conditional conditional = (Doc.Conditional) doc;
      b.append("ifBreak(");
      append(conditional.broken);
      b.append(", ");
      append(conditional.flat);
      if (conditional.groupId != null) {
        b.append(", ").append(conditional.groupId);
      }
      return close();

    case CONCAT:
      return list(((Doc.Concat) doc).parts, '[', ']');

    default:
      throw new AssertionError("unknown kind " + doc.kind);
    }
  }

  private DocWriter list(List<Doc> docs, char open, char close) {
    b.append(open);
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(docs.get(i));
    }
    b.append(close);
    return this;
  }

  private DocWriter close() {
    b.append(')');
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End DocWriter.java
