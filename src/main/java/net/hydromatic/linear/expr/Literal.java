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
 * Boolean literal: a 0-1 variable or its negation.
 *
 * <p>The index of a variable is non-negative; the index of a negated variable
 * {@code b} is {@code -b.index() - 1}.
 */
public interface Literal {
  /** Returns the negation of this literal. */
  Literal not();

  /** Returns the index of this literal. */
  int index();
}

// End Literal.java
