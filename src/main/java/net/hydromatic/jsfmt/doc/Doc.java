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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.jsfmt.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Document: a layout-only description of text, which the printer resolves
 * into lines.
 *
 * <p>Docs are immutable and contain no reference to syntax nodes. Create them
 * using {@link DocBuilder}, which checks their invariants.
 *
 * <p>Each doc knows whether it contains a forced break: a hard, empty or
 * literal line, or a group created with {@code shouldBreak}. A group that
 * contains a forced break is always printed in break mode, and so is every
 * group that encloses it. A line comment does not force a break; the
 * printer breaks a group only if text would follow the comment. */
public abstract class Doc {
  public final DocKind kind;
  /** Whether this doc contains a forced break. */
  public final boolean forcedBreak;

  Doc(DocKind kind, boolean forcedBreak) {
    this.kind = requireNonNull(kind);
    this.forcedBreak = forcedBreak;
  }

  /** Converts this doc to a string, for debugging. For example,
   * {@code group(["(", indent([softline, "a"]), softline, ")"])}. */
  @Override public final String toString() {
    return new DocWriter().append(this).toString();
  }

  private static boolean anyForced(List<Doc> docs) {
    return Static.anyMatch(docs, doc -> doc.forcedBreak);
  }

  /** Literal text. */
  public static final class Text extends Doc {
    public final String text;

    Text(String text) {
      super(DocKind.TEXT, false);
      this.text = requireNonNull(text);
    }
  }

  /** Line break. */
  public static final class Line extends Doc {
    public final LineMode mode;

    Line(LineMode mode) {
      super(DocKind.LINE, mode.forced);
      this.mode = mode;
    }
  }

  /** Group. */
  public static final class Group extends Doc {
    public final Doc child;
    public final @Nullable GroupId id;
    public final boolean shouldBreak;

    Group(Doc child, @Nullable GroupId id, boolean shouldBreak) {
      super(DocKind.GROUP, shouldBreak || child.forcedBreak);
      this.child = requireNonNull(child);
      this.id = id;
      this.shouldBreak = shouldBreak;
    }
  }

  /** Indented content. */
  public static final class Indent extends Doc {
    public final Doc child;

    Indent(Doc child) {
      super(DocKind.INDENT, child.forcedBreak);
      this.child = child;
    }
  }

  /** Fill. Parts at even positions are content, parts at odd positions are
   * separators. */
  public static final class Fill extends Doc {
    public final ImmutableList<Doc> parts;

    Fill(ImmutableList<Doc> parts) {
      super(DocKind.FILL, anyForced(parts));
      this.parts = parts;
    }
  }

  /** Content that is printed just before the next line break, typically a
   * trailing line comment. */
  public static final class LineSuffix extends Doc {
    public final Doc content;
    /** Whether a line break must follow before any more text; true for a
     * line comment, which would otherwise swallow the rest of the line.
     * The enclosing groups break only if text follows on the same line. */
    public final boolean forcesBreak;

    LineSuffix(Doc content, boolean forcesBreak) {
      super(DocKind.LINE_SUFFIX, content.forcedBreak);
      this.content = requireNonNull(content);
      this.forcesBreak = forcesBreak;
    }
  }

  /** Content that depends on whether a group is flat or broken. If
   * {@link #groupId} is null, the group is the one that encloses this
   * doc. */
  public static final class Conditional extends Doc {
    public final Doc broken;
    public final Doc flat;
    public final @Nullable GroupId groupId;

    Conditional(Doc broken, Doc flat, @Nullable GroupId groupId) {
      super(DocKind.CONDITIONAL, flat.forcedBreak);
      this.broken = requireNonNull(broken);
      this.flat = requireNonNull(flat);
      this.groupId = groupId;
    }
  }

  /** Sequence. */
  public static final class Concat extends Doc {
    public final ImmutableList<Doc> parts;

    Concat(ImmutableList<Doc> parts) {
      super(DocKind.CONCAT, anyForced(parts));
      this.parts = parts;
    }
  }
}

// End Doc.java
