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

/** Mode of a {@link Doc.Line}: how it renders in flat mode, and whether it
 * breaks regardless of mode. */
public enum LineMode {
  /** Nothing in flat mode; a line break in break mode. */
  SOFT(false),
  /** A space in flat mode; a line break in break mode. */
  SPACE(false),
  /** Always a line break. */
  HARD(true),
  /** Always a line break followed by one empty line. */
  EMPTY(true),
  /** Always a line break; the next line is not indented. */
  LITERAL(true);

  /** Whether this kind of line always breaks, and so forces every enclosing
   * group to break. */
  public final boolean forced;

  LineMode(boolean forced) {
    this.forced = forced;
  }
}

// End LineMode.java
