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

/**
 * Visits linear expressions.
 *
 * <p>There is one method for each kind of {@link Linear.Exp}; adding a kind
 * of node means adding a method here, and every visitor fails to compile
 * until it handles the new kind.
 *
 * @param <R> Return type
 */
public interface ExpVisitor<R> {
  R visit(Linear.Constant constant);

  R visit(Linear.IntVar intVar);

  R visit(Linear.NotVar notVar);

  R visit(Linear.Product product);

  R visit(Linear.Sum sum);

  /**
   * Called by a node that does not override {@link Linear.Exp#accept}.
   *
   * @throws ExpressionException always
   */
  default R visitOther(Linear.Exp exp) {
    throw ExpressionException.cannotInterpret(exp);
  }
}

// End ExpVisitor.java
