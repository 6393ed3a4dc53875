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

import static net.hydromatic.linear.expr.LinearBuilder.linear;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.linear.expr.Linear;
import net.hydromatic.linear.flatten.LinearForm;

/** Conversions between {@link LinearProto} and linear expressions. */
public class LinearProtos {
  private LinearProtos() {}

  /**
   * Rebuilds an expression from a serialized linear expression.
   *
   * <p>With no variables, returns a constant; with one variable, an affine
   * expression {@code coeff * var + offset}; otherwise a sum of products
   * plus the offset.
   */
  public static Linear.Exp rebuild(
      LinearProto proto, VariableRegistry registry) {
    switch (proto.size()) {
      case 0:
        return linear.constant(proto.offset);
      case 1:
        return linear.affine(
            linear.var(registry, proto.vars.get(0)),
            proto.coeffs.get(0),
            proto.offset);
      default:
        final List<Linear.Exp> exps = new ArrayList<>(proto.size());
        for (int i = 0; i < proto.size(); i++) {
          final Linear.IntVar var = linear.var(registry, proto.vars.get(i));
          exps.add(linear.times(var, proto.coeffs.get(i)));
        }
        return linear.sum(exps, proto.offset);
    }
  }

  /**
   * Converts a canonical form into a serialized linear expression, with
   * variables in ascending order of index.
   */
  public static LinearProto of(LinearForm form) {
    return LinearProto.of(
        ImmutableList.copyOf(form.coefficients.keySet()),
        ImmutableList.copyOf(form.coefficients.values()),
        form.offset);
  }
}

// End LinearProtos.java
