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
package net.hydromatic.linear.expr;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.linear.util.Static.add;
import static net.hydromatic.linear.util.Static.multiply;
import static net.hydromatic.linear.util.Static.subtract;

import java.util.function.IntToLongFunction;

/**
 * Computes the value of an expression tree, given a value for each variable.
 *
 * <p>Unlike {@link net.hydromatic.linear.flatten.Flattener}, it recurses
 * through the tree and does not combine terms, so it is a useful independent
 * check of the flattened form.
 */
public class Evaluator implements ExpVisitor<Long> {
  private final IntToLongFunction values;

  /**
   * Creates an Evaluator.
   *
   * @param values Maps a variable's index to its value
   */
  public Evaluator(IntToLongFunction values) {
    this.values = requireNonNull(values, "values");
  }

  @Override
  public Long visit(Linear.Constant constant) {
    return constant.value;
  }

  @Override
  public Long visit(Linear.IntVar intVar) {
    return values.applyAsLong(intVar.index());
  }

  @Override
  public Long visit(Linear.NotVar notVar) {
    return subtract(1L, notVar.var.accept(this));
  }

  @Override
  public Long visit(Linear.Product product) {
    return multiply(product.coeff, product.exp.accept(this));
  }

  @Override
  public Long visit(Linear.Sum sum) {
    long total = sum.offset;
    for (Linear.Exp exp : sum.exps) {
      total = add(total, exp.accept(this));
    }
    return total;
  }
}

// End Evaluator.java
