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
package net.hydromatic.jsfmt.format;

import static net.hydromatic.jsfmt.doc.DocBuilder.doc;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jsfmt.config.TrailingComma;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.doc.GroupId;
import net.hydromatic.jsfmt.syntax.SyntaxElement;
import net.hydromatic.jsfmt.syntax.SyntaxKind;
import net.hydromatic.jsfmt.syntax.SyntaxNode;
import net.hydromatic.jsfmt.syntax.SyntaxToken;
import net.hydromatic.jsfmt.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formatting rules for comma-separated lists in brackets: arguments,
 * parameters, array elements and object properties. */
final class ListRules {
  private ListRules() {}

  /** Formats call arguments.
   *
   * <p>Arguments fill the line, and wrap when it is full. A sole object,
   * array, function or arrow function with a block body is "hugged": it is
   * printed directly inside the parentheses, so that only its own brackets
   * break. So is a function that is the last argument after simple
   * arguments, as in {@code setTimeout(() => {...}, 10)}, provided that the
   * arguments before it fit on the line; if they do not, every argument
   * goes on a new line. */
  static Doc arguments(Formatter f, SyntaxNode node) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_PAREN);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_PAREN);
    final List<Entry> entries = entries(f, node, false);
    if (entries.isEmpty()) {
      return empty(f, node, open, close, false);
    }
    final GroupId id = f.groupId("arguments");
    if (canHug(f, node, open, close, entries)) {
      if (entries.size() == 1) {
        return doc.concat(f.token(open), f.format(entries.get(0).element()),
            f.token(close));
      }
      // The group contains the arguments before the last, and is measured
      // up to the first line break of the last argument. If it breaks, the
      // last argument moves to a line of its own.
      final List<Doc> head = new ArrayList<>();
      final List<Entry> headEntries = Static.skipLast(entries);
      for (int i = 0; i < headEntries.size(); i++) {
        final Entry entry = headEntries.get(i);
        if (i > 0) {
          head.add(lineBefore(f, entry.element, false));
        }
        head.add(f.formatFollowedBy(entry.element(), f.token(entry.comma())));
      }
      final Doc last = f.format(Static.last(entries).element());
      final Doc comma =
          f.options().trailingComma == TrailingComma.ALL
              ? doc.text(",")
              : doc.empty();
      return doc.concat(f.token(open),
          doc.group(
              doc.indent(doc.softline(), doc.fill(head), doc.line()),
              id),
          doc.ifBreak(doc.indent(last), last, id),
          doc.ifBreak(doc.concat(comma, doc.hardline()), doc.empty(), id),
          f.token(close));
    }
    return doc.group(
        doc.concat(f.token(open),
            doc.indent(doc.softline(),
                doc.fill(fillParts(f, entries, id, true)),
                f.danglingInline(node)),
            doc.softline(),
            f.token(close)),
        id);
  }

  /** Returns whether the arguments can be hugged. They cannot if there are
   * comments in the way, such as a line comment after the last argument,
   * that would move if the parentheses hugged it. */
  private static boolean canHug(Formatter f, SyntaxNode node,
      SyntaxToken open, SyntaxToken close, List<Entry> entries) {
    if (f.comments.hasDangling(node)
        || f.comments.hasComments(open)
        || f.comments.hasComments(close)
        || Static.anyMatch(entries,
            e -> e.comma != null && f.comments.hasComments(e.comma)
                || f.endsWithLineComment(e.element()))) {
      return false;
    }
    final SyntaxNode last = Static.last(entries).element();
    if (f.startsWithComment(last)) {
      return false;
    }
    if (entries.size() == 1) {
      switch (last.kind) {
      case OBJECT_EXPRESSION:
      case ARRAY_EXPRESSION:
      case FUNCTION_EXPRESSION:
        return true;
      case ARROW_FUNCTION:
        return last.node(1) != null
            && last.node(1).kind == SyntaxKind.BLOCK_STATEMENT;
      default:
        return false;
      }
    }
    return (last.kind == SyntaxKind.FUNCTION_EXPRESSION
            || last.kind == SyntaxKind.ARROW_FUNCTION)
        && Static.allMatch(Static.skipLast(entries),
            e -> isSimple(e.element()));
  }

  /** Returns whether an argument is short and cannot break: an identifier,
   * literal, or a property of one. */
  private static boolean isSimple(SyntaxNode node) {
    switch (node.kind) {
    case IDENTIFIER:
    case THIS_EXPRESSION:
    case NUMBER_LITERAL:
    case STRING_LITERAL:
    case BOOLEAN_LITERAL:
    case NULL_LITERAL:
      return true;
    case MEMBER_EXPRESSION:
      final @Nullable SyntaxNode object = node.node(0);
      return object != null && isSimple(object);
    default:
      return false;
    }
  }

  /** Formats array elements. Like arguments, they fill the line. */
  static Doc array(Formatter f, SyntaxNode node) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_BRACK);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_BRACK);
    final List<Entry> entries = entries(f, node, true);
    if (entries.isEmpty()) {
      return empty(f, node, open, close, false);
    }
    final GroupId id = f.groupId("array");
    return doc.group(
        doc.concat(f.token(open),
            doc.indent(doc.softline(),
                doc.fill(fillParts(f, entries, id, true)),
                f.danglingInline(node)),
            doc.softline(),
            f.token(close)),
        id);
  }

  /** Formats parameters. Either all fit on one line, or each goes on a line
   * of its own. */
  static Doc parameters(Formatter f, SyntaxNode node) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_PAREN);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_PAREN);
    final List<Entry> entries = entries(f, node, false);
    if (entries.isEmpty()) {
      return empty(f, node, open, close, false);
    }
    final GroupId id = f.groupId("parameters");
    // A rest parameter must be last; no comma may follow it.
    final boolean commaAllowed =
        Static.last(entries).element().kind != SyntaxKind.REST_PARAMETER;
    return doc.group(
        doc.concat(f.token(open),
            doc.indent(doc.softline(),
                joined(f, entries, id, commaAllowed, false),
                f.danglingInline(node)),
            doc.softline(),
            f.token(close)),
        id);
  }

  /** Formats an object literal, with a space inside the braces if it is on
   * one line.
   *
   * <p>If the source has a line break between the "{" and the first
   * property, the object stays broken. */
  static Doc object(Formatter f, SyntaxNode node) {
    final SyntaxToken open = f.requiredToken(node, SyntaxKind.L_CURLY);
    final SyntaxToken close = f.requiredToken(node, SyntaxKind.R_CURLY);
    final List<Entry> entries = entries(f, node, false);
    if (entries.isEmpty()) {
      return empty(f, node, open, close, true);
    }
    final @Nullable SyntaxToken first = entries.get(0).element().firstToken();
    final boolean shouldBreak =
        first != null && first.hasLeadingNewline()
            || f.comments.hasTrailingLineComment(open);
    final GroupId id = f.groupId("object");
    return doc.group(
        doc.concat(f.token(open),
            doc.indent(doc.line(), joined(f, entries, id, true, true),
                f.danglingInline(node)),
            doc.line(),
            f.token(close)),
        id, shouldBreak);
  }

  /** Formats "key: value". */
  static Doc property(Formatter f, SyntaxNode node) {
    final SyntaxToken key = f.firstChildToken(node);
    final SyntaxToken colon = f.requiredToken(node, SyntaxKind.COLON);
    final SyntaxNode value = f.requiredNode(node, 0);
    final Doc keyDoc;
    switch (key.kind) {
    case STRING:
      keyDoc = f.token(key, Literals.string(key.text, f.options().quoteStyle));
      break;
    case NUMBER:
      keyDoc = f.token(key, Literals.number(key.text));
      break;
    default:
      keyDoc = f.token(key);
      break;
    }
    return ExpressionRules.assignmentLike(f,
        doc.concat(keyDoc, f.token(colon)), colon, value);
  }

  /** Formats a spread element or rest parameter, "...x". */
  static Doc spread(Formatter f, SyntaxNode node) {
    final SyntaxToken dots = f.requiredToken(node, SyntaxKind.DOT3);
    final @Nullable SyntaxNode argument = node.node(0);
    if (argument != null) {
      return doc.concat(f.token(dots), f.format(argument));
    }
    final SyntaxToken name = f.requiredToken(node, SyntaxKind.IDENT);
    return doc.concat(f.token(dots), f.token(name));
  }

  /** Formats empty brackets, which may contain comments. */
  private static Doc empty(Formatter f, SyntaxNode node, SyntaxToken open,
      SyntaxToken close, boolean block) {
    if (!f.comments.hasDangling(node)) {
      return doc.concat(f.token(open), f.token(close));
    }
    if (block || f.danglingBreaks(node)) {
      return doc.concat(f.token(open),
          doc.indent(doc.hardline(), f.danglingLines(node, false)),
          doc.hardline(),
          f.token(close));
    }
    return doc.concat(f.token(open), f.danglingLines(node, false),
        f.token(close));
  }

  /** Returns the parts of a fill: elements, each with the comma after it,
   * separated by lines.
   *
   * <p>The comma belongs to the element, so that the printer counts it when
   * it decides whether the element fits. */
  private static List<Doc> fillParts(Formatter f, List<Entry> entries,
      GroupId id, boolean commaAllowed) {
    final List<Doc> parts = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        parts.add(lineBefore(f, entries.get(i).element, false));
      }
      parts.add(element(f, entries, i, id, commaAllowed));
    }
    return parts;
  }

  /** Returns the elements, each with the comma after it, separated by
   * lines. */
  private static Doc joined(Formatter f, List<Entry> entries, GroupId id,
      boolean commaAllowed, boolean keepBlankLines) {
    final List<Doc> docs = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        docs.add(lineBefore(f, entries.get(i).element, keepBlankLines));
      }
      docs.add(element(f, entries, i, id, commaAllowed));
    }
    return doc.concat(docs);
  }

  /** Formats the {@code i}th element and the comma after it. After the last
   * element, the comma is printed only if the options ask for one and the
   * list is broken; the comments of a comma in the source are printed
   * regardless. */
  private static Doc element(Formatter f, List<Entry> entries, int i,
      GroupId id, boolean commaAllowed) {
    final Entry entry = entries.get(i);
    final Doc comma;
    if (i < entries.size() - 1 || entry.element == null) {
      // A hole at the end of an array needs its comma.
      comma = f.token(entry.comma());
    } else {
      final Doc optional =
          commaAllowed && f.options().trailingComma == TrailingComma.ALL
              ? doc.ifBreak(doc.text(","), doc.empty(), id)
              : doc.empty();
      if (entry.comma == null) {
        return doc.concat(f.format(entry.element()), optional);
      }
      comma = doc.concat(optional, f.tokenComments(entry.comma));
    }
    return entry.element == null
        ? comma
        : f.formatFollowedBy(entry.element, comma);
  }

  /** Returns the line before an element. It is a hard line if the element
   * starts with a comment, and an empty line if {@code keepBlankLines} and
   * the source has an empty line before the element. */
  private static Doc lineBefore(Formatter f, @Nullable SyntaxNode next,
      boolean keepBlankLines) {
    final @Nullable SyntaxToken first = next == null ? null : next.firstToken();
    if (first != null && keepBlankLines && Comments.hasBlankLineBefore(first)) {
      return doc.emptyLine();
    } else if (first != null && f.comments.hasLeading(first)) {
      return doc.hardline();
    } else {
      return doc.line();
    }
  }

  /** Splits the children of a bracketed list into elements, each with the
   * comma that follows it. An element is null if it is a hole in an
   * array. */
  private static List<Entry> entries(Formatter f, SyntaxNode node,
      boolean allowHoles) {
    final ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    @Nullable SyntaxNode pending = null;
    final List<SyntaxElement> children = node.children;
    for (int i = 1; i < children.size() - 1; i++) {
      final SyntaxElement child = children.get(i);
      if (child instanceof SyntaxNode) {
        if (pending != null) {
          throw new FormatException(FormatException.Kind.MISSING_TOKEN,
              node.kind, node.kind + " has a missing comma",
              f.context.pos(child));
        }
        pending = (SyntaxNode) child;
      } else if (child.kind == SyntaxKind.COMMA) {
        if (pending == null && !allowHoles) {
          throw new FormatException(FormatException.Kind.MISSING_NODE,
              node.kind, node.kind + " has an empty element",
              f.context.pos(child));
        }
        entries.add(new Entry(pending, (SyntaxToken) child));
        pending = null;
      } else {
        throw new FormatException(FormatException.Kind.UNSUPPORTED_NODE,
            node.kind, node.kind + " has unexpected token " + child.kind,
            f.context.pos(child));
      }
    }
    if (pending != null) {
      entries.add(new Entry(pending, null));
    }
    return entries.build();
  }

  /** Element of a list, and the comma after it. */
  private static class Entry {
    final @Nullable SyntaxNode element;
    final @Nullable SyntaxToken comma;

    Entry(@Nullable SyntaxNode element, @Nullable SyntaxToken comma) {
      this.element = element;
      this.comma = comma;
    }

    /** Returns the element, which must not be a hole. */
    SyntaxNode element() {
      if (element == null) {
        throw new AssertionError("hole");
      }
      return element;
    }

    /** Returns the comma, which must be present. */
    SyntaxToken comma() {
      if (comma == null) {
        throw new AssertionError("no comma");
      }
      return comma;
    }
  }
}

// End ListRules.java
