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
package net.hydromatic.jsfmt;

import com.google.common.collect.Lists;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.jsfmt.doc.Doc;
import net.hydromatic.jsfmt.format.FormatDiagnostic;
import net.hydromatic.jsfmt.format.FormatException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in jsfmt tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a doc by its string representation. */
  public static Matcher<Doc> isDoc(String expected) {
    return new CustomTypeSafeMatcher<Doc>("doc " + expected) {
      @Override protected boolean matchesSafely(Doc doc) {
        return doc.toString().equals(expected);
      }
    };
  }

  /** Matches a list of diagnostics by their kinds, in order. */
  public static Matcher<List<FormatDiagnostic>> hasKinds(
      FormatException.Kind... kinds) {
    final List<FormatException.Kind> expected = Arrays.asList(kinds);
    return new TypeSafeMatcher<List<FormatDiagnostic>>() {
      @Override protected boolean matchesSafely(
          List<FormatDiagnostic> diagnostics) {
        return Lists.transform(diagnostics, d -> d.kind).equals(expected);
      }

      @Override public void describeTo(Description description) {
        description.appendText("diagnostics of kinds ").appendValue(expected);
      }
    };
  }

  /** Matches text none of whose lines is longer than a given width. */
  public static Matcher<String> linesAtMost(int width) {
    return new CustomTypeSafeMatcher<String>("lines at most " + width
        + " wide") {
      @Override protected boolean matchesSafely(String text) {
        for (String line : text.split("\n", -1)) {
          if (line.codePointCount(0, line.length()) > width) {
            return false;
          }
        }
        return true;
      }
    };
  }

  /** Matches text that has no whitespace at the end of any line. */
  public static Matcher<String> noTrailingWhitespace() {
    return new CustomTypeSafeMatcher<String>("no trailing whitespace") {
      @Override protected boolean matchesSafely(String text) {
        for (String line : text.split("\r?\n", -1)) {
          if (line.endsWith(" ") || line.endsWith("\t")) {
            return false;
          }
        }
        return true;
      }
    };
  }

  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }
}

// End Matchers.java
