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

import net.hydromatic.linear.expr.Linear;

/**
 * Called by {@link Flattener} at each step of a flattening; useful for
 * debugging.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called when an expression is taken from the work list. */
  void onExp(Linear.Exp exp, long coeff);

  /** Called when {@code delta} is added to the coefficient of a variable. */
  void onTerm(int index, long delta);

  /** Called when {@code delta} is added to the offset. */
  void onOffset(long delta);
}

// End Tracer.java
