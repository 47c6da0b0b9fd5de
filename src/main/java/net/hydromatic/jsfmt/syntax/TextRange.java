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
package net.hydromatic.jsfmt.syntax;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Range of characters in a source text, by offset. The start is inclusive,
 * the end exclusive. */
public final class TextRange {
  public static final TextRange EMPTY = new TextRange(0, 0);

  public final int start;
  public final int end;

  private TextRange(int start, int end) {
    checkArgument(start >= 0 && end >= start, "invalid range [%s, %s)", start,
        end);
    this.start = start;
    this.end = end;
  }

  /** Creates a TextRange. */
  public static TextRange of(int start, int end) {
    return new TextRange(start, end);
  }

  /** Creates a TextRange of a given length. */
  public static TextRange at(int start, int length) {
    return new TextRange(start, start + length);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /** Returns whether this range contains an offset. */
  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  /** Returns the smallest range that contains this range and another. */
  public TextRange cover(TextRange range) {
    return new TextRange(Math.min(start, range.start),
        Math.max(end, range.end));
  }

  /** Returns the text of this range within a source string. */
  public String substring(String source) {
    return source.substring(start, end);
  }

  @Override public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TextRange
        && start == ((TextRange) o).start
        && end == ((TextRange) o).end;
  }

  @Override public String toString() {
    return start + ".." + end;
  }
}

// End TextRange.java
