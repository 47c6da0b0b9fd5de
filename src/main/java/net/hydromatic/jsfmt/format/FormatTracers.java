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

import java.util.function.Consumer;
import net.hydromatic.jsfmt.doc.Doc;

/** Utilities for {@link FormatTracer}. */
public abstract class FormatTracers {

  /** Returns a tracer that does nothing. */
  public static FormatTracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a document,
   * then calls the underlying tracer. */
  public static FormatTracer withOnDoc(FormatTracer tracer,
      Consumer<Doc> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDoc(Doc doc) {
        consumer.accept(doc);
        super.onDoc(doc);
      }
    };
  }

  /** Returns a tracer that performs the given action on each diagnostic,
   * then calls the underlying tracer. */
  public static FormatTracer withOnDiagnostic(FormatTracer tracer,
      Consumer<FormatDiagnostic> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDiagnostic(FormatDiagnostic diagnostic) {
        consumer.accept(diagnostic);
        super.onDiagnostic(diagnostic);
      }
    };
  }

  public static FormatTracer withOnPrinted(FormatTracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPrinted(String text) {
        consumer.accept(text);
        super.onPrinted(text);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements FormatTracer {
    static final FormatTracer INSTANCE = new EmptyTracer();

    @Override public void onDoc(Doc doc) {
    }

    @Override public void onDiagnostic(FormatDiagnostic diagnostic) {
    }

    @Override public void onPrinted(String text) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements FormatTracer {
    final FormatTracer tracer;

    DelegatingTracer(FormatTracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onDoc(Doc doc) {
      tracer.onDoc(doc);
    }

    @Override public void onDiagnostic(FormatDiagnostic diagnostic) {
      tracer.onDiagnostic(diagnostic);
    }

    @Override public void onPrinted(String text) {
      tracer.onPrinted(text);
    }
  }
}

// End FormatTracers.java
