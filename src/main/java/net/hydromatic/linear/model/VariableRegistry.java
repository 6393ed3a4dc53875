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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Container in which decision variables are registered.
 *
 * <p>Variables are identified by index, starting at 0.
 */
public interface VariableRegistry {
  /** Returns the number of registered variables. */
  int variableCount();

  /**
   * Returns the admissible values of a variable, as a flattened list of
   * closed intervals {@code [lo0, hi0, lo1, hi1, ...]}.
   */
  ImmutableList<Long> domain(int index);

  /** Returns the name of a variable, or null if it has no name. */
  @Nullable String name(int index);
}

// End VariableRegistry.java
