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
package net.hydromatic.linear.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.linear.expr.ExpressionException;

/**
 * Serialized linear expression, as stored in a model: a list of variable
 * indices, a parallel list of coefficients, and an offset.
 *
 * <p>Its value is {@code offset + sum(coeffs[i] * vars[i])}.
 */
public class LinearProto {
  public final ImmutableList<Integer> vars;
  public final ImmutableList<Long> coeffs;
  public final long offset;

  private LinearProto(
      ImmutableList<Integer> vars, ImmutableList<Long> coeffs, long offset) {
    this.vars = vars;
    this.coeffs = coeffs;
    this.offset = offset;
  }

  /**
   * Creates a LinearProto.
   *
   * @throws ExpressionException if the lists have different lengths
   */
  public static LinearProto of(
      List<Integer> vars, List<Long> coeffs, long offset) {
    if (vars.size() != coeffs.size()) {
      throw ExpressionException.mismatch(
          "LinearProto", vars.size(), coeffs.size());
    }
    return new LinearProto(
        ImmutableList.copyOf(vars), ImmutableList.copyOf(coeffs), offset);
  }

  /** Creates a LinearProto with no variables. */
  public static LinearProto constant(long offset) {
    return new LinearProto(ImmutableList.of(), ImmutableList.of(), offset);
  }

  /** Returns the number of terms. */
  public int size() {
    return vars.size();
  }

  @Override
  public int hashCode() {
    return Objects.hash(vars, coeffs, offset);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LinearProto
            && vars.equals(((LinearProto) o).vars)
            && coeffs.equals(((LinearProto) o).coeffs)
            && offset == ((LinearProto) o).offset;
  }

  @Override
  public String toString() {
    return "{vars: " + vars + ", coeffs: " + coeffs + ", offset: " + offset
        + "}";
  }
}

// End LinearProto.java
