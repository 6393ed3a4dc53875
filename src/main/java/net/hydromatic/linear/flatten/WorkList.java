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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import net.hydromatic.linear.expr.Linear;

/**
 * Queue of (expression, coefficient) pairs that remain to be flattened.
 *
 * <p>Elements are stored in a pair of circular arrays, so that coefficients
 * are not boxed, and removing the head is O(1).
 */
class WorkList {
  private Linear.Exp[] exps;
  private long[] coeffs;
  private int start;
  private int end;

  /** Creates an empty WorkList. */
  WorkList() {
    exps = new Linear.Exp[16];
    coeffs = new long[16];
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    for (int i = 0, n = size(); i < n; i++) {
      final int k = add(start, i, exps.length);
      if (i > 0) {
        b.append(", ");
      }
      b.append(coeffs[k]).append(" * [").append(exps[k]).append(']');
    }
    return b.append(']').toString();
  }

  /** Returns the number of pairs in this queue. */
  int size() {
    int k = end - start;
    return k < 0 ? k + exps.length : k;
  }

  /** Returns whether this queue is empty. */
  boolean isEmpty() {
    return start == end;
  }

  /** Adds a pair to the tail. */
  void add(Linear.Exp exp, long coeff) {
    exps[end] = requireNonNull(exp);
    coeffs[end] = coeff;
    end = add(end, 1, exps.length);
    if (start == end) {
      grow();
    }
  }

  /** Returns the expression at the head; the queue must not be empty. */
  Linear.Exp headExp() {
    assert !isEmpty();
    return exps[start];
  }

  /** Returns the coefficient at the head; the queue must not be empty. */
  long headCoeff() {
    assert !isEmpty();
    return coeffs[start];
  }

  /** Removes the pair at the head; the queue must not be empty. */
  void removeHead() {
    assert !isEmpty();
    exps[start] = null;
    start = add(start, 1, exps.length);
  }

  /** Doubles the capacity; called when the queue has just become full. */
  private void grow() {
    final int oldCapacity = exps.length;
    final int newCapacity = oldCapacity * 2;
    exps = Arrays.copyOf(exps, newCapacity);
    coeffs = Arrays.copyOf(coeffs, newCapacity);
    // The queue is full, so start == end. Move the elements from start to
    // the old end of the arrays into the new space.
    final int newSpace = newCapacity - oldCapacity;
    System.arraycopy(exps, start, exps, start + newSpace, oldCapacity - start);
    System.arraycopy(
        coeffs, start, coeffs, start + newSpace, oldCapacity - start);
    Arrays.fill(exps, start, start + newSpace, null);
    start += newSpace;
  }

  private static int add(int i, int j, int modulus) {
    int k = i + j;
    if (k >= modulus) {
      k -= modulus;
    }
    return k;
  }
}

// End WorkList.java
