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

/** Where a comment is printed relative to the token or node it is attached
 * to. */
public enum CommentPlacement {
  /** Before the anchor token; the comment started on an earlier line. */
  LEADING,
  /** After the anchor token, on the same line. */
  TRAILING,
  /** Inside the owner node, which has no token that the comment could be
   * attached to; for example, in an empty block, or after the last statement
   * of a block. */
  DANGLING
}

// End CommentPlacement.java
