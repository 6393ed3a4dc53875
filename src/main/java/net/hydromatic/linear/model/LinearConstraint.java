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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * Constraint that a linear expression takes a value in a domain.
 *
 * <p>The domain is a flattened list of closed intervals {@code [lo0, hi0,
 * lo1, hi1, ...]}, the same representation as the domain of a variable.
 */
public class LinearConstraint {
  public final LinearProto proto;
  public final ImmutableList<Long> domain;

  LinearConstraint(LinearProto proto, ImmutableList<Long> domain) {
    this.proto = requireNonNull(proto, "proto");
    this.domain = requireNonNull(domain, "domain");
  }

  @Override
  public int hashCode() {
    return Objects.hash(proto, domain);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LinearConstraint
            && proto.equals(((LinearConstraint) o).proto)
            && domain.equals(((LinearConstraint) o).domain);
  }

  @Override
  public String toString() {
    return proto + " in " + domain;
  }
}

// End LinearConstraint.java
