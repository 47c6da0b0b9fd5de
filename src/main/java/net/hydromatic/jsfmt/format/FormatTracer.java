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

import net.hydromatic.jsfmt.doc.Doc;

/** Called on various events during formatting. */
public interface FormatTracer {
  /** Called when the document for a whole tree has been built, before it is
   * printed. */
  void onDoc(Doc doc);

  /** Called when a node is printed verbatim, or some other problem is
   * found. */
  void onDiagnostic(FormatDiagnostic diagnostic);

  /** Called with the printed text. */
  void onPrinted(String text);
}

// End FormatTracer.java
