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

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.doc.DocBuilder;
import net.hydromatic.jsfmt.doc.GroupId;
import net.hydromatic.jsfmt.doc.LineMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts a {@link Doc} to text.
 *
 * <p>The printer walks the document with an explicit stack of commands. Each
 * command is a doc, the indentation at which to print it, and a mode: in
 * {@link PrintMode#FLAT flat} mode, soft lines print nothing and lines print a
 * space; in {@link PrintMode#BREAK break} mode, they start a new line.
 *
 * <p>When it reaches a group, the printer decides its mode. If the group
 * contains a forced break, it breaks. Otherwise the group is flat if the
 * group, printed flat, followed by the remaining commands, each in its own
 * mode, up to the first line break that will be emitted, fits in what is
 * left of the line.
 *
 * <p>A fill decides each separator separately: a separator breaks if the
 * content after it does not fit on the current line.
 *
 * <p>Indentation is written when the first text of a line is written, so a
 * line never ends with indentation. Line suffixes are queued and written just
 * before the next line break, or at the end of the document.
 *
 * <p>The printer is a pure function of the document and options, and never
 * fails. It is not thread-safe, but each call to {@link #print} uses a new
 * instance. */
public class Printer {
  private final PrinterOptions options;
  private final StringBuilder out = new StringBuilder();
  private final Deque<Command> commands = new ArrayDeque<>();
  private final List<Command> lineSuffixes = new ArrayList<>();
  private final Map<GroupId, PrintMode> groupModes = new HashMap<>();
  /** Current column. */
  private int column;
  /** Indentation to write before the next text, or null if the current line
   * has started. */
  private @Nullable Indentation pendingIndent;
  /** Set when a forced line break is printed in flat mode; the next group
   * must be measured again, even if its parent is flat. */
  private boolean shouldRemeasure;
  /** Set while a queued line suffix must be followed by a line break, as a
   * line comment must; no text may be written before that break. */
  private boolean pendingLineBreak;

  private Printer(PrinterOptions options) {
    this.options = requireNonNull(options);
  }

  /** Prints a document. */
  public static String print(Doc doc, PrinterOptions options) {
    final Printer printer = new Printer(options);
    printer.run(doc);
    return printer.out.toString();
  }

  private void run(Doc doc) {
    commands.push(new Command(Indentation.root(), PrintMode.BREAK, doc));
    for (;;) {
      if (commands.isEmpty()) {
        if (lineSuffixes.isEmpty()) {
          return;
        }
        flushLineSuffixes();
      }
      process(commands.pop());
    }
  }

  /** Moves the queued line suffixes onto the command stack, so that they are
   * printed next, in the order they were queued. */
  private void flushLineSuffixes() {
    for (int i = lineSuffixes.size() - 1; i >= 0; i--) {
      commands.push(lineSuffixes.get(i));
    }
    lineSuffixes.clear();
    pendingLineBreak = false;
  }

  private void process(Command command) {
    final Doc doc = command.doc;
    switch (doc.kind) {
    case TEXT:
      write(((Doc.Text) doc).text);
      break;

    case CONCAT:
      final List<Doc> parts = ((Doc.Concat) doc).parts;
      for (int i = parts.size() - 1; i >= 0; i--) {
        commands.push(command.with(parts.get(i)));
      }
      break;

    case INDENT:
      commands.push(
          new Command(command.indentation.indent(options), command.mode,
              ((Doc.Indent) doc).child));
      break;

    case GROUP:
      processGroup(command, (Doc.Group) doc);
      break;

    case FILL:
      processFill(command, (Doc.Fill) doc, command.fillStart);
      break;

    case LINE_SUFFIX:
      final Doc.LineSuffix lineSuffix = (Doc.LineSuffix) doc;
      lineSuffixes.add(command.with(lineSuffix.content));
      pendingLineBreak |= lineSuffix.forcesBreak;
      break;

    case CONDITIONAL:
      final Doc.Conditional conditional = (Doc.Conditional) doc;
      final PrintMode mode = modeOf(conditional.groupId, command.mode);
      commands.push(
          command.with(mode == PrintMode.BREAK
              ? conditional.broken
              : conditional.flat));
      break;

    case LINE:
      processLine(command, (Doc.Line) doc);
      break;

    default:
      throw new AssertionError("unknown kind " + doc.kind);
    }
  }

  private void processGroup(Command command, Doc.Group group) {
    final PrintMode mode;
    if (command.mode == PrintMode.FLAT && !shouldRemeasure) {
      mode = group.forcedBreak ? PrintMode.BREAK : PrintMode.FLAT;
    } else {
      shouldRemeasure = false;
      final Command flat =
          new Command(command.indentation, PrintMode.FLAT, group.child);
      mode = !group.forcedBreak
          && fits(flat, commands.iterator(), options.lineWidth - column,
              false)
          ? PrintMode.FLAT
          : PrintMode.BREAK;
    }
    commands.push(new Command(command.indentation, mode, group.child));
    if (group.id != null) {
      groupModes.put(group.id, mode);
    }
  }

  /** Prints the parts of a fill starting at {@code start}.
   *
   * <p>Measures the first content, and the first content followed by its
   * separator and the next content. If both fit, the separator is flat;
   * otherwise it breaks. The rest of the fill is processed after the
   * separator has been printed, so that it measures from the new column. */
  private void processFill(Command command, Doc.Fill fill, int start) {
    final List<Doc> parts = fill.parts;
    final int remaining = parts.size() - start;
    if (remaining <= 0) {
      return;
    }
    final int width = options.lineWidth - column;
    final Doc content = parts.get(start);
    final Command contentFlat =
        new Command(command.indentation, PrintMode.FLAT, content);
    final Command contentBreak =
        new Command(command.indentation, PrintMode.BREAK, content);
    final boolean contentFits =
        fits(contentFlat, Collections.emptyIterator(), width, true);
    if (remaining == 1) {
      commands.push(contentFits ? contentFlat : contentBreak);
      return;
    }
    final Doc separator = parts.get(start + 1);
    final Command separatorFlat =
        new Command(command.indentation, PrintMode.FLAT, separator);
    final Command separatorBreak =
        new Command(command.indentation, PrintMode.BREAK, separator);
    if (remaining == 2) {
      if (contentFits) {
        commands.push(separatorFlat);
        commands.push(contentFlat);
      } else {
        commands.push(separatorBreak);
        commands.push(contentBreak);
      }
      return;
    }
    final Command rest =
        new Command(command.indentation, command.mode, fill, start + 2);
    final Command pairFlat =
        new Command(command.indentation, PrintMode.FLAT,
            DocBuilder.doc.concat(content, separator, parts.get(start + 2)));
    final boolean pairFits =
        fits(pairFlat, Collections.emptyIterator(), width, true);
    commands.push(rest);
    if (pairFits) {
      commands.push(separatorFlat);
      commands.push(contentFlat);
    } else if (contentFits) {
      commands.push(separatorBreak);
      commands.push(contentFlat);
    } else {
      commands.push(separatorBreak);
      commands.push(contentBreak);
    }
  }

  private void processLine(Command command, Doc.Line line) {
    if (command.mode == PrintMode.FLAT) {
      switch (line.mode) {
      case SOFT:
        return;
      case SPACE:
        write(" ");
        return;
      default:
        // A forced break inside a flat group; the groups that follow must
        // be measured again.
        shouldRemeasure = true;
        break;
      }
    }
    if (!lineSuffixes.isEmpty()) {
      commands.push(command);
      flushLineSuffixes();
      return;
    }
    switch (line.mode) {
    case LITERAL:
      out.append(options.lineEnding.separator);
      column = 0;
      pendingIndent = null;
      break;
    case EMPTY:
      trim();
      out.append(options.lineEnding.separator);
      newline(command.indentation);
      break;
    default:
      trim();
      newline(command.indentation);
      break;
    }
  }

  private void newline(Indentation indentation) {
    out.append(options.lineEnding.separator);
    pendingIndent = indentation;
    column = indentation.width;
  }

  private void write(String text) {
    if (text.isEmpty()) {
      return;
    }
    if (pendingIndent != null) {
      out.append(pendingIndent.text);
      pendingIndent = null;
    }
    out.append(text);
    column += width(text);
  }

  /** Removes spaces and tabs from the end of the output. */
  private void trim() {
    int n = out.length();
    while (n > 0 && (out.charAt(n - 1) == ' ' || out.charAt(n - 1) == '\t')) {
      --n;
    }
    out.setLength(n);
  }

  private PrintMode modeOf(@Nullable GroupId groupId, PrintMode mode) {
    if (groupId == null) {
      return mode;
    }
    final PrintMode groupMode = groupModes.get(groupId);
    return groupMode == null ? PrintMode.FLAT : groupMode;
  }

  /** Returns whether a command, followed by the rest of the line, fits in
   * {@code width} columns.
   *
   * <p>The rest of the line is the commands in {@code rest}, each in its own
   * mode, up to the first line that breaks. If {@code mustBeFlat}, a group
   * that contains a forced break does not fit.
   *
   * <p>Text that would follow a line suffix that forces a break, before the
   * next line break, does not fit either; a line comment would otherwise
   * swallow it. */
  private boolean fits(Command next, Iterator<Command> rest, int width,
      boolean mustBeFlat) {
    boolean needLineBreak = pendingLineBreak;
    final Deque<Command> stack = new ArrayDeque<>();
    stack.push(next);
    while (width >= 0) {
      if (stack.isEmpty()) {
        if (!rest.hasNext()) {
          return true;
        }
        stack.push(rest.next());
        continue;
      }
      final Command command = stack.pop();
      final Doc doc = command.doc;
      switch (doc.kind) {
      case TEXT:
        final String text = ((Doc.Text) doc).text;
        if (needLineBreak && !text.isEmpty()) {
          return false;
        }
        width -= width(text);
        break;
      case CONCAT:
        pushAll(stack, command, ((Doc.Concat) doc).parts, 0);
        break;
      case FILL:
        pushAll(stack, command, ((Doc.Fill) doc).parts, command.fillStart);
        break;
      case INDENT:
        stack.push(command.with(((Doc.Indent) doc).child));
        break;
      case GROUP:
        final Doc.Group group = (Doc.Group) doc;
        if (mustBeFlat && group.forcedBreak) {
          return false;
        }
        final PrintMode groupMode =
            group.forcedBreak ? PrintMode.BREAK : command.mode;
        stack.push(
            new Command(command.indentation, groupMode, group.child));
        break;
      case CONDITIONAL:
        final Doc.Conditional conditional = (Doc.Conditional) doc;
        final PrintMode mode = modeOf(conditional.groupId, command.mode);
        stack.push(
            command.with(mode == PrintMode.BREAK
                ? conditional.broken
                : conditional.flat));
        break;
      case LINE:
        final Doc.Line line = (Doc.Line) doc;
        if (command.mode == PrintMode.BREAK || line.mode.forced) {
          return true;
        }
        if (line.mode != LineMode.SOFT) {
          width -= 1;
        }
        break;
      case LINE_SUFFIX:
        needLineBreak |= ((Doc.LineSuffix) doc).forcesBreak;
        break;
      default:
        throw new AssertionError("unknown kind " + doc.kind);
      }
    }
    return false;
  }

  private static void pushAll(Deque<Command> stack, Command command,
      List<Doc> parts, int start) {
    for (int i = parts.size() - 1; i >= start; i--) {
      stack.push(command.with(parts.get(i)));
    }
  }

  /** Returns the number of columns occupied by a string. */
  static int width(String text) {
    return text.codePointCount(0, text.length());
  }

  /** A doc to be printed, with its indentation and mode. */
  private static class Command {
    final Indentation indentation;
    final PrintMode mode;
    final Doc doc;
    /** For a fill, the index of the first part not yet printed. */
    final int fillStart;

    Command(Indentation indentation, PrintMode mode, Doc doc) {
      this(indentation, mode, doc, 0);
    }

    Command(Indentation indentation, PrintMode mode, Doc doc, int fillStart) {
      this.indentation = indentation;
      this.mode = mode;
      this.doc = doc;
      this.fillStart = fillStart;
    }

    /** Returns a command for a child doc, with the same indentation and
     * mode. */
    Command with(Doc child) {
      return new Command(indentation, mode, child);
    }
  }
}

// End Printer.java
