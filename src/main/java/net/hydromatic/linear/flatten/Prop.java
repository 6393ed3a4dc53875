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
package net.hydromatic.linear.flatten;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.linear.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how a {@link Flattener} behaves.
 *
 * @see Flattener#of(Map)
 */
public enum Prop {
  /**
   * Boolean property "keepZeros" controls whether a variable whose
   * coefficients cancel out (as in {@code x - x}) remains in the flattened
   * map with coefficient 0. A variable that does not occur in the expression
   * is never in the map.
   *
   * <p>The default is the value of the "linear.keepZeros" system property,
   * or false if it is not set.
   */
  KEEP_ZEROS(
      "keepZeros",
      Boolean.class,
      Static.getBooleanProperty("linear.keepZeros", false)),

  /**
   * Boolean property "trace" controls whether each step of flattening is
   * printed to {@link System#out}. Default is false.
   */
  TRACE("trace", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class, "property %s is not boolean", camelName);
    return (Boolean) get(map);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null
   * value removes the property, so that it reverts to its default value.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      checkArgument(
          type.isInstance(value),
          "value for property %s must have type %s",
          camelName,
          type);
      map.put(this, value);
    }
  }
}

// End Prop.java
