/*
 * MatchBindings.java
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

import com.google.common.collect.ImmutableMap;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.PatternVariable;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable map from {@link PatternVariable}s to the sub-expressions they were matched to.
 *
 * <p>
 * Bindings form a chain: {@link #bind} returns a new instance whose parent is the receiver, so older
 * instances remain valid and a search can return to any earlier state by simply keeping a reference to it.
 * A binding in a child shadows a binding of the same variable in its ancestors.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class MatchBindings {
    @Nonnull
    private static final MatchBindings EMPTY = new MatchBindings(null, null, null, 0);

    @Nullable
    private final PatternVariable variable;
    @Nullable
    private final Expression value;
    @Nullable
    private final MatchBindings parent;
    private final int size;

    private MatchBindings(@Nullable PatternVariable variable, @Nullable Expression value,
                          @Nullable MatchBindings parent, int size) {
        this.variable = variable;
        this.value = value;
        this.parent = parent;
        this.size = size;
    }

    @Nonnull
    public static MatchBindings empty() {
        return EMPTY;
    }

    /**
     * Bind {@code variable} to {@code boundTo}, replacing any earlier binding of that variable.
     * @param variable the pattern variable
     * @param boundTo the sub-expression it matched
     * @return new bindings sharing structure with these
     */
    @Nonnull
    public MatchBindings bind(@Nonnull PatternVariable variable, @Nonnull Expression boundTo) {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(boundTo, "boundTo");
        return new MatchBindings(variable, boundTo, this, containsBinding(variable) ? size : size + 1);
    }

    @Nullable
    public Expression getOrNull(@Nonnull PatternVariable lookup) {
        for (MatchBindings current = this; current.parent != null; current = current.parent) {
            if (current.variable == lookup) {
                return current.value;
            }
        }
        return null;
    }

    @Nonnull
    public Optional<Expression> get(@Nonnull PatternVariable lookup) {
        return Optional.ofNullable(getOrNull(lookup));
    }

    public boolean containsBinding(@Nonnull PatternVariable lookup) {
        return getOrNull(lookup) != null;
    }

    /**
     * Number of distinct variables bound.
     * @return the number of bound variables
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * The current binding of every variable, ordered by when each variable was first bound.
     * @return an immutable map view of these bindings
     */
    @Nonnull
    public Map<PatternVariable, Expression> asMap() {
        final Deque<MatchBindings> chain = new ArrayDeque<>();
        for (MatchBindings current = this; current.parent != null; current = current.parent) {
            chain.push(current);
        }
        final Map<PatternVariable, Expression> result = new LinkedHashMap<>();
        for (MatchBindings link : chain) {
            result.put(link.variable, link.value);
        }
        return ImmutableMap.copyOf(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchBindings)) {
            return false;
        }
        final MatchBindings that = (MatchBindings)o;
        return size == that.size && asMap().equals(that.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "MatchBindings" + asMap();
    }
}
