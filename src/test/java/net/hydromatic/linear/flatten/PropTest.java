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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("keepZeros"), is(Prop.KEEP_ZEROS));
    assertThat(Prop.lookup("trace"), is(Prop.TRACE));
    // Each property is registered under its enum name and its camel name
    assertThat(Prop.lookup("KEEP_ZEROS"), is(Prop.KEEP_ZEROS));
    assertThat(Prop.BY_NAME.size(), is(2 * Prop.values().length));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("noSuchProp"));
    assertThat(e.getMessage(), is("property noSuchProp not found"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.TRACE.booleanValue(map), is(false));
    Prop.TRACE.set(map, true);
    assertThat(Prop.TRACE.booleanValue(map), is(true));
    Prop.TRACE.set(map, null);
    assertThat(map.isEmpty(), is(true));
    assertThat(Prop.TRACE.booleanValue(map), is(false));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.KEEP_ZEROS.set(map, "yes"));
  }
}

// End PropTest.java
