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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.jsfmt.config.QuoteStyle;
import org.junit.jupiter.api.Test;

/** Tests for {@link Literals}. */
public class LiteralsTest {
  @Test
  void testString() {
    assertThat(Literals.string("'abc'", QuoteStyle.DOUBLE), is("\"abc\""));
    assertThat(Literals.string("\"abc\"", QuoteStyle.SINGLE), is("'abc'"));
    assertThat(Literals.string("''", QuoteStyle.DOUBLE), is("\"\""));
    // Other escapes are unchanged
    assertThat(Literals.string("\"a\\nb\"", QuoteStyle.SINGLE),
        is("'a\\nb'"));
  }

  /** Uses whichever quote needs fewer escapes. */
  @Test
  void testStringQuoteChoice() {
    assertThat(Literals.string("'say \"hi\"'", QuoteStyle.DOUBLE),
        is("'say \"hi\"'"));
    assertThat(Literals.string("'don\\'t'", QuoteStyle.DOUBLE),
        is("\"don't\""));
    assertThat(Literals.string("\"don't\"", QuoteStyle.SINGLE),
        is("\"don't\""));
    // On a tie, the preferred quote wins
    assertThat(Literals.string("'a\"b\\'c'", QuoteStyle.DOUBLE),
        is("\"a\\\"b'c\""));
    assertThat(Literals.string("'a\"b\\'c'", QuoteStyle.SINGLE),
        is("'a\"b\\'c'"));
  }

  @Test
  void testNumber() {
    assertThat(Literals.number("0XFF"), is("0xFF"));
    assertThat(Literals.number("0B11"), is("0b11"));
    assertThat(Literals.number(".5"), is("0.5"));
    assertThat(Literals.number("5."), is("5"));
    assertThat(Literals.number("1E+5"), is("1e5"));
    assertThat(Literals.number("2E-3"), is("2e-3"));
    assertThat(Literals.number("1.50"), is("1.50"));
    assertThat(Literals.number("10n"), is("10n"));
    assertThat(Literals.number("1_000"), is("1_000"));
  }

  @Test
  void testIsDecimalInteger() {
    assertThat(Literals.isDecimalInteger("1"), is(true));
    assertThat(Literals.isDecimalInteger("1_000"), is(true));
    assertThat(Literals.isDecimalInteger("1.5"), is(false));
    assertThat(Literals.isDecimalInteger("1e5"), is(false));
    assertThat(Literals.isDecimalInteger("0xFF"), is(false));
    assertThat(Literals.isDecimalInteger("10n"), is(false));
    assertThat(Literals.isDecimalInteger(""), is(false));
  }
}

// End LiteralsTest.java
