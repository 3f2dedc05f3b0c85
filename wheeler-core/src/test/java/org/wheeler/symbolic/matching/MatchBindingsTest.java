/*
 * MatchBindingsTest.java
 *
 * This source file is part of the Wheeler open source project
 *
 * Copyright 2026 the Wheeler project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wheeler.symbolic.matching;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.wheeler.symbolic.expressions.PatternVariable;
import org.wheeler.symbolic.expressions.SimpleSymbol;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.wheeler.symbolic.expressions.Expressions.symbol;
import static org.wheeler.symbolic.expressions.Expressions.variable;

/**
 * Tests for {@link MatchBindings}.
 */
public class MatchBindingsTest {
    private final PatternVariable x = variable("x");
    private final PatternVariable y = variable("y");
    private final SimpleSymbol a = symbol("a");
    private final SimpleSymbol b = symbol("b");

    @Test
    public void empty() {
        final MatchBindings empty = MatchBindings.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertNull(empty.getOrNull(x));
        assertEquals(Optional.empty(), empty.get(x));
    }

    @Test
    public void bindKeepsOlderInstancesIntact() {
        final MatchBindings first = MatchBindings.empty().bind(x, a);
        final MatchBindings second = first.bind(y, b);
        assertSame(a, first.getOrNull(x));
        assertNull(first.getOrNull(y));
        assertEquals(1, first.size());
        assertSame(b, second.getOrNull(y));
        assertSame(a, second.getOrNull(x));
        assertEquals(2, second.size());
    }

    @Test
    public void rebindingShadows() {
        final MatchBindings rebound = MatchBindings.empty().bind(x, a).bind(y, a).bind(x, b);
        assertSame(b, rebound.getOrNull(x));
        assertEquals(2, rebound.size());
        assertEquals(ImmutableList.of(x, y), ImmutableList.copyOf(rebound.asMap().keySet()));
        assertEquals(b, rebound.asMap().get(x));
    }

    @Test
    public void lookupIsByIdentity() {
        final MatchBindings bindings = MatchBindings.empty().bind(x, a);
        assertTrue(bindings.containsBinding(x));
        assertFalse(bindings.containsBinding(variable("x")));
    }

    @Test
    public void equalityIsByContent() {
        final MatchBindings direct = MatchBindings.empty().bind(x, a);
        final MatchBindings viaRebind = MatchBindings.empty().bind(x, b).bind(x, a);
        assertEquals(direct, viaRebind);
        assertEquals(direct.hashCode(), viaRebind.hashCode());
        assertNotEquals(direct, MatchBindings.empty().bind(x, b));
    }
}
