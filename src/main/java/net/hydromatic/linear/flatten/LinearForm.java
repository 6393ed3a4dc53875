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

import static net.hydromatic.linear.util.Static.add;
import static net.hydromatic.linear.util.Static.multiply;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntToLongFunction;

/**
 * Canonical form of a linear expression: a coefficient for each variable,
 * plus a constant offset.
 *
 * <p>Variables are identified by index, and the map is sorted by index. A
 * variable occurs at most once.
 */
public class LinearForm {
  /** The form of the expression "0". */
  public static final LinearForm ZERO =
      new LinearForm(ImmutableSortedMap.of(), 0L);

  public final ImmutableSortedMap<Integer, Long> coefficients;
  public final long offset;

  private LinearForm(
      ImmutableSortedMap<Integer, Long> coefficients, long offset) {
    this.coefficients = coefficients;
    this.offset = offset;
  }

  /** Creates a LinearForm. */
  public static LinearForm of(Map<Integer, Long> coefficients, long offset) {
    if (coefficients.isEmpty() && offset == 0) {
      return ZERO;
    }
    return new LinearForm(ImmutableSortedMap.copyOf(coefficients), offset);
  }

  /** Returns the coefficient of a variable, or 0 if it is not present. */
  public long coefficient(int index) {
    final Long coeff = coefficients.get(index);
    return coeff == null ? 0L : coeff;
  }

  /** Returns whether this form has no variables. */
  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  /**
   * Computes {@code offset + sum(coeff[i] * value[i])}.
   *
   * @param values Maps a variable's index to its value
   */
  public long evaluate(IntToLongFunction values) {
    long total = offset;
    for (Map.Entry<Integer, Long> entry : coefficients.entrySet()) {
      final long value = values.applyAsLong(entry.getKey());
      total = add(total, multiply(entry.getValue(), value));
    }
    return total;
  }

  @Override
  public int hashCode() {
    return Objects.hash(coefficients, offset);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LinearForm
            && coefficients.equals(((LinearForm) o).coefficients)
            && offset == ((LinearForm) o).offset;
  }

  @Override
  public String toString() {
    return coefficients + " + " + offset;
  }
}

// End LinearForm.java
