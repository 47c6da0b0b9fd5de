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

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Contents of the configuration file, {@code jsfmt.json}.
 *
 * <p>The file is a JSON object. Settings are grouped by tool, and then by
 * language:
 *
 * <pre>{@code
 * {
 *   "root": true,
 *   "formatter": {
 *     "enabled": true,
 *     "indentStyle": "space",
 *     "indentSize": 2,
 *     "lineWidth": 80,
 *     "lineEnding": "lf",
 *     "preserveEdgeBlankLines": false
 *   },
 *   "javascript": {
 *     "formatter": {
 *       "quoteStyle": "double",
 *       "trailingComma": "none"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Every field is optional, but the main configuration file must set
 * "root" to true. */
public final class Configuration {
  /** Name of the configuration file. */
  public static final String FILE_NAME = "jsfmt.json";

  static final String NOT_ROOT_MESSAGE =
      "the main configuration file, " + FILE_NAME
          + ", must have the field 'root' set to `true`";

  private static final ObjectReader READER =
      new ObjectMapper().readerForMapOf(Object.class);

  /** Maps keys in the "formatter" section to properties. */
  private static final ImmutableMap<String, FormatProp> FORMATTER_KEYS =
      ImmutableMap.<String, FormatProp>builder()
          .put("indentStyle", FormatProp.INDENT_STYLE)
          .put("indentSize", FormatProp.INDENT_WIDTH)
          .put("lineWidth", FormatProp.LINE_WIDTH)
          .put("lineEnding", FormatProp.LINE_ENDING)
          .put("preserveEdgeBlankLines", FormatProp.PRESERVE_EDGE_BLANK_LINES)
          .build();

  /** Maps keys in the "javascript.formatter" section to properties. */
  private static final ImmutableMap<String, FormatProp> JAVASCRIPT_KEYS =
      ImmutableMap.of("quoteStyle", FormatProp.QUOTE_STYLE,
          "trailingComma", FormatProp.TRAILING_COMMA);

  /** Whether this is the main configuration file. */
  public final boolean root;
  /** Whether the formatter is enabled. */
  public final boolean formatterEnabled;
  private final FormatOptions options;

  private Configuration(boolean root, boolean formatterEnabled,
      FormatOptions options) {
    this.root = root;
    this.formatterEnabled = formatterEnabled;
    this.options = requireNonNull(options);
  }

  /** Parses the contents of a configuration file.
   *
   * @throws ConfigurationException if the JSON is invalid, contains an
   *   unknown field or invalid value, or "root" is not true */
  public static Configuration parse(String json) {
    final Map<String, Object> map;
    try {
      map = READER.readValue(json);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("invalid JSON in " + FILE_NAME + ": "
          + e.getOriginalMessage(), e);
    }
    return of(map == null ? ImmutableMap.of() : map);
  }

  /** Reads a configuration file. */
  public static Configuration read(File file) {
    final Map<String, Object> map;
    try {
      map = READER.readValue(file);
    } catch (IOException e) {
      throw new ConfigurationException("cannot read " + file + ": "
          + e.getMessage(), e);
    }
    return of(map == null ? ImmutableMap.of() : map);
  }

  private static Configuration of(Map<String, Object> map) {
    boolean root = false;
    boolean enabled = true;
    final Map<FormatProp, Object> props = new EnumMap<>(FormatProp.class);
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      switch (entry.getKey()) {
      case "root":
        root = booleanValue("root", entry.getValue());
        break;
      case "formatter":
        for (Map.Entry<String, Object> e
            : section("formatter", entry.getValue()).entrySet()) {
          if (e.getKey().equals("enabled")) {
            enabled = booleanValue("formatter.enabled", e.getValue());
          } else {
            prop(FORMATTER_KEYS, "formatter", e).setLenient(props,
                e.getValue());
          }
        }
        break;
      case "javascript":
        for (Map.Entry<String, Object> e
            : section("javascript", entry.getValue()).entrySet()) {
          if (!e.getKey().equals("formatter")) {
            throw unknown("javascript." + e.getKey());
          }
          for (Map.Entry<String, Object> e2
              : section("javascript.formatter", e.getValue()).entrySet()) {
            prop(JAVASCRIPT_KEYS, "javascript.formatter", e2)
                .setLenient(props, e2.getValue());
          }
        }
        break;
      default:
        throw unknown(entry.getKey());
      }
    }
    if (!root) {
      throw new ConfigurationException(NOT_ROOT_MESSAGE);
    }
    return new Configuration(root, enabled, FormatOptions.of(props));
  }

  private static FormatProp prop(Map<String, FormatProp> keys,
      String section, Map.Entry<String, Object> entry) {
    final FormatProp prop = keys.get(entry.getKey());
    if (prop == null) {
      throw unknown(section + "." + entry.getKey());
    }
    return prop;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> section(String name,
      @Nullable Object value) {
    if (!(value instanceof Map)) {
      throw new ConfigurationException("field '" + name
          + "' must be an object");
    }
    return (Map<String, Object>) value;
  }

  private static boolean booleanValue(String name, @Nullable Object value) {
    if (!(value instanceof Boolean)) {
      throw new ConfigurationException("field '" + name
          + "' must be a boolean");
    }
    return (Boolean) value;
  }

  private static ConfigurationException unknown(String name) {
    return new ConfigurationException("unknown field '" + name + "' in "
        + FILE_NAME);
  }

  /** Returns whether the formatter is disabled. */
  public boolean isFormatterDisabled() {
    return !formatterEnabled;
  }

  /** Returns the formatting options. */
  public FormatOptions toFormatOptions() {
    return options;
  }
}

// End Configuration.java
