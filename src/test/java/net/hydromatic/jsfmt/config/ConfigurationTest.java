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
package net.hydromatic.jsfmt.config;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.hydromatic.jsfmt.JsFormatter;
import net.hydromatic.jsfmt.printer.IndentStyle;
import net.hydromatic.jsfmt.printer.LineEnding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Configuration}. */
public class ConfigurationTest {
  private static final String FULL = "{\n"
      + "  \"root\": true,\n"
      + "  \"formatter\": {\n"
      + "    \"enabled\": true,\n"
      + "    \"indentStyle\": \"tab\",\n"
      + "    \"indentSize\": 4,\n"
      + "    \"lineWidth\": 100,\n"
      + "    \"lineEnding\": \"crlf\",\n"
      + "    \"preserveEdgeBlankLines\": true\n"
      + "  },\n"
      + "  \"javascript\": {\n"
      + "    \"formatter\": {\n"
      + "      \"quoteStyle\": \"single\",\n"
      + "      \"trailingComma\": \"all\"\n"
      + "    }\n"
      + "  }\n"
      + "}\n";

  private static void assertFails(String json, String message) {
    final ConfigurationException e =
        assertThrows(ConfigurationException.class,
            () -> Configuration.parse(json));
    assertThat(e.getMessage(), is(message));
  }

  @Test
  void testParse() {
    final Configuration c = Configuration.parse(FULL);
    assertThat(c.root, is(true));
    assertThat(c.isFormatterDisabled(), is(false));
    final FormatOptions o = c.toFormatOptions();
    assertThat(o.indentStyle, is(IndentStyle.TAB));
    assertThat(o.indentWidth, is(4));
    assertThat(o.lineWidth, is(100));
    assertThat(o.lineEnding, is(LineEnding.CRLF));
    assertThat(o.preserveEdgeBlankLines, is(true));
    assertThat(o.quoteStyle, is(QuoteStyle.SINGLE));
    assertThat(o.trailingComma, is(TrailingComma.ALL));
  }

  /** Fields that are not present have default values. */
  @Test
  void testMinimal() {
    final Configuration c = Configuration.parse("{\"root\": true}");
    assertThat(c.toFormatOptions(), is(FormatOptions.DEFAULT));
  }

  @Test
  void testInvalid() {
    assertFails("{}", Configuration.NOT_ROOT_MESSAGE);
    assertFails("{\"root\": false}",
        "the main configuration file, jsfmt.json, must have the field "
            + "'root' set to `true`");
    assertFails("{\"root\": true, \"linter\": {}}",
        "unknown field 'linter' in jsfmt.json");
    assertFails("{\"root\": true, \"formatter\": {\"tabs\": true}}",
        "unknown field 'formatter.tabs' in jsfmt.json");
    assertFails("{\"root\": true, \"javascript\": {\"parser\": {}}}",
        "unknown field 'javascript.parser' in jsfmt.json");
    assertFails("{\"root\": true, \"formatter\": 3}",
        "field 'formatter' must be an object");
    assertFails("{\"root\": \"yes\"}", "field 'root' must be a boolean");
    assertFails("{\"root\": true, \"formatter\": {\"indentSize\": 20}}",
        "invalid indent width 20; must be between 1 and 16");
    assertFails("{\"root\": true, \"formatter\": {\"lineWidth\": 0}}",
        "invalid line width 0; must be at least 1");

    final ConfigurationException e =
        assertThrows(ConfigurationException.class,
            () -> Configuration.parse("{\"root\": tru"));
    assertThat(e.getMessage(), startsWith("invalid JSON in jsfmt.json: "));
  }

  /** If the formatter is disabled, the source is returned unchanged. */
  @Test
  void testDisabled() {
    final Configuration c =
        Configuration.parse("{\"root\": true, "
            + "\"formatter\": {\"enabled\": false}}");
    assertThat(c.isFormatterDisabled(), is(true));
    final String source = "let   x=1";
    assertThat(JsFormatter.formatSource(source, c).text, is(source));

    final Configuration c2 = Configuration.parse("{\"root\": true}");
    assertThat(JsFormatter.formatSource(source, c2).text, is("let x = 1;\n"));
  }

  @Test
  void testRead(@TempDir Path dir) throws IOException {
    final File file = dir.resolve(Configuration.FILE_NAME).toFile();
    Files.write(file.toPath(), FULL.getBytes(StandardCharsets.UTF_8));
    final Configuration c = Configuration.read(file);
    assertThat(c.toFormatOptions().lineWidth, is(100));

    final File missing = dir.resolve("missing.json").toFile();
    final ConfigurationException e =
        assertThrows(ConfigurationException.class,
            () -> Configuration.read(missing));
    assertThat(e.getMessage(), startsWith("cannot read " + missing));
  }
}

// End ConfigurationTest.java
