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

import java.util.HashMap;
import java.util.Map;

/** Utilities for {@link Doc}. */
public abstract class Docs {
  private Docs() {}

  /** Checks the structural invariants of a doc, and returns it.
   *
   * <p>Each group id occurs on at most one group; each fill has an odd
   * number of parts, or none; no text contains a line break.
   *
   * @throws IllegalStateException if the doc is invalid */
  public static Doc validate(Doc doc) {
    validate(doc, new HashMap<>());
    return doc;
  }

  private static void validate(Doc doc, Map<GroupId, Doc.Group> ids) {
    switch (doc.kind) {
    case TEXT:
      final String text = ((Doc.Text) doc).text;
      if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
        throw new IllegalStateException("line break in text: " + doc);
      }
      break;
    case LINE:
      break;
    case GROUP:
      final Doc.Group group = (Doc.Group) doc;
      // The same group may be reached twice, via both branches of a
      // conditional; a different group with the same id is an error.
      if (group.id != null && ids.computeIfAbsent(group.id, id -> group)
          != group) {
        throw new IllegalStateException("duplicate group id " + group.id);
      }
      validate(group.child, ids);
      break;
    case INDENT:
      validate(((Doc.Indent) doc).child, ids);
      break;
    case FILL:
      final Doc.Fill fill = (Doc.Fill) doc;
      if (!fill.parts.isEmpty() && fill.parts.size() % 2 == 0) {
        throw new IllegalStateException("fill has an even number of parts");
      }
      fill.parts.forEach(part -> validate(part, ids));
      break;
    case LINE_SUFFIX:
      validate(((Doc.LineSuffix) doc).content, ids);
      break;
    case CONDITIONAL:
      final Doc.Conditional conditional = (Doc.Conditional) doc;
      validate(conditional.broken, ids);
      validate(conditional.flat, ids);
      break;
    case CONCAT:
      ((Doc.Concat) doc).parts.forEach(part -> validate(part, ids));
      break;
    default:
      throw new AssertionError("unknown kind " + doc.kind);
    }
  }

  /** Returns the width of a doc printed flat, ignoring line suffixes; or
   * -1 if it contains a forced break. */
  public static int flatWidth(Doc doc) {
    if (doc.forcedBreak) {
      return -1;
    }
    switch (doc.kind) {
    case TEXT:
      final String text = ((Doc.Text) doc).text;
      return text.codePointCount(0, text.length());
    case LINE:
      return ((Doc.Line) doc).mode == LineMode.SPACE ? 1 : 0;
    case GROUP:
      return flatWidth(((Doc.Group) doc).child);
    case INDENT:
      return flatWidth(((Doc.Indent) doc).child);
    case FILL:
      return sum(((Doc.Fill) doc).parts);
    case CONCAT:
      return sum(((Doc.Concat) doc).parts);
    case CONDITIONAL:
      return flatWidth(((Doc.Conditional) doc).flat);
    case LINE_SUFFIX:
      return 0;
    default:
      throw new AssertionError("unknown kind " + doc.kind);
    }
  }

  private static int sum(Iterable<Doc> docs) {
    int n = 0;
    for (Doc doc : docs) {
      final int w = flatWidth(doc);
      if (w < 0) {
        return -1;
      }
      n += w;
    }
    return n;
  }
}

// End Docs.java
