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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.jsfmt.printer.IndentStyle;
import net.hydromatic.jsfmt.printer.LineEnding;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Formatting property.
 *
 * @see FormatOptions
 */
public enum FormatProp {
  /**
   * Integer property "lineWidth" is the width at which the printer tries to
   * break lines. Must be positive. Default is 80.
   */
  LINE_WIDTH("lineWidth", Integer.class, 80),

  /**
   * Enum property "indentStyle" is whether to indent using spaces or tabs.
   * Default is "space".
   */
  INDENT_STYLE("indentStyle", IndentStyle.class, IndentStyle.SPACE),

  /**
   * Integer property "indentWidth" is the number of spaces in one level of
   * indentation, and the width of a tab. Between 1 and 16. Default is 2.
   */
  INDENT_WIDTH("indentWidth", Integer.class, 2),

  /** Enum property "lineEnding". Default is "lf". */
  LINE_ENDING("lineEnding", LineEnding.class, LineEnding.LF),

  /**
   * Enum property "quoteStyle" is the preferred quote for string literals.
   * A string keeps the other quote if the preferred quote would need more
   * escapes. Default is "double".
   */
  QUOTE_STYLE("quoteStyle", QuoteStyle.class, QuoteStyle.DOUBLE),

  /**
   * Enum property "trailingComma" is whether to print a comma after the last
   * element of a broken list. Default is "none".
   */
  TRAILING_COMMA("trailingComma", TrailingComma.class, TrailingComma.NONE),

  /**
   * Boolean property "preserveEdgeBlankLines" is whether to keep one blank
   * line at the start and end of a block. If false (the default), such blank
   * lines are removed; blank lines between statements are always collapsed to
   * at most one.
   */
  PRESERVE_EDGE_BLANK_LINES("preserveEdgeBlankLines", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, FormatProp> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<FormatProp> BY_CAMEL_NAME;

  static {
    final List<FormatProp> list = Arrays.asList(values());
    final Ordering<FormatProp> ordering =
        Ordering.from(Comparator.comparing((FormatProp o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, FormatProp> map = new LinkedHashMap<>();
    for (FormatProp value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  FormatProp(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static FormatProp lookup(String propName) {
    final FormatProp prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new ConfigurationException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public Object get(Map<FormatProp, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<FormatProp, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<FormatProp, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<FormatProp, Object> map,
      Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /** Sets the value of a property, allowing strings for enum, integer and
   * boolean types. Enum names are case-insensitive. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<FormatProp, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        final Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type,
                s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          final String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(e -> e.name().toLowerCase(Locale.ROOT))
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new ConfigurationException("invalid value '" + s
              + "' for property " + camelName + "; value must be one of: "
              + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s.trim()));
        } catch (NumberFormatException e) {
          throw new ConfigurationException("invalid value '" + s
              + "' for property " + camelName + "; value must be an integer",
              e);
        }
        return;
      }
      if (type == Boolean.class) {
        final String low = s.trim().toLowerCase(Locale.ROOT);
        if (!low.equals("true") && !low.equals("false")) {
          throw new ConfigurationException("invalid value '" + s
              + "' for property " + camelName + "; value must be a boolean");
        }
        set(map, Boolean.valueOf(low));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value restores the default. */
  public void set(Map<FormatProp, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new ConfigurationException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End FormatProp.java
