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
package net.hydromatic.linear.util;

import com.google.common.math.LongMath;
import java.util.Locale;
import net.hydromatic.linear.expr.ExpressionException;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns the value of a system property, converted into a boolean value.
   *
   * <p>Values "", "true", "TRUE" and "1" are treated as true; "false", "FALSE"
   * and "0" treated as false; for {@code null} and other values, returns {@code
   * defaultVal}.
   */
  @SuppressWarnings("SimplifiableConditionalExpression")
  public static boolean getBooleanProperty(String prop, boolean defaultVal) {
    final String value = System.getProperty(prop);
    if (value == null) {
      return defaultVal;
    }
    final String low = value.toLowerCase(Locale.ROOT);
    return low.equals("true") || low.equals("1") || low.isEmpty()
        ? true
        : low.equals("false") || low.equals("0") ? false : defaultVal;
  }

  /**
   * Returns the product of two longs.
   *
   * @throws ExpressionException if the product overflows
   */
  public static long multiply(long a, long b) {
    try {
      return LongMath.checkedMultiply(a, b);
    } catch (ArithmeticException e) {
      throw ExpressionException.overflow(a + " * " + b, e);
    }
  }

  /**
   * Returns the sum of two longs.
   *
   * @throws ExpressionException if the sum overflows
   */
  public static long add(long a, long b) {
    try {
      return LongMath.checkedAdd(a, b);
    } catch (ArithmeticException e) {
      throw ExpressionException.overflow(a + " + " + b, e);
    }
  }

  /**
   * Returns the difference of two longs.
   *
   * @throws ExpressionException if the difference overflows
   */
  public static long subtract(long a, long b) {
    try {
      return LongMath.checkedSubtract(a, b);
    } catch (ArithmeticException e) {
      throw ExpressionException.overflow(a + " - " + b, e);
    }
  }

  /**
   * Returns the negation of a long.
   *
   * @throws ExpressionException if the value is {@link Long#MIN_VALUE}
   */
  public static long negate(long a) {
    return subtract(0L, a);
  }
}

// End Static.java
