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

/** Kind of {@link Doc}. */
public enum DocKind {
  /** Literal text; never contains a line break. */
  TEXT,
  /** Line break, or the text that stands for it in flat mode. */
  LINE,
  /** Content whose line breaks are all flat or all broken. */
  GROUP,
  /** Content printed with one more level of indentation. */
  INDENT,
  /** Alternating content and separators; each separator breaks only if
   * the content after it does not fit. */
  FILL,
  /** Content deferred until just before the next line break. */
  LINE_SUFFIX,
  /** Content that depends on the mode of a group. */
  CONDITIONAL,
  /** Sequence of docs. */
  CONCAT
}

// End DocKind.java
