/*
 * Symbol.java
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

package org.wheeler.symbolic.expressions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of the named leaves: {@link SimpleSymbol}, {@link TensorSymbol} and {@link SpinorSymbol}.
 *
 * <p>
 * A symbol has a name, the representation spaces it lives in, and free-form annotations (for example a
 * TeX rendering or a description). Annotations take part in {@link #equals(Object)} but are ignored by
 * {@link Matchable#leafMatches(Matchable)}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class Symbol extends Expression {
    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableSortedSet<String> representationSpaces;
    @Nonnull
    private final ImmutableMap<String, String> annotations;

    Symbol(@Nonnull String name, @Nonnull Iterable<String> representationSpaces, @Nonnull Map<String, String> annotations) {
        this.name = Objects.requireNonNull(name, "name");
        this.representationSpaces = ImmutableSortedSet.copyOf(representationSpaces);
        this.annotations = ImmutableMap.copyOf(annotations);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<String> getRepresentationSpaces() {
        return representationSpaces;
    }

    @Nonnull
    public ImmutableMap<String, String> getAnnotations() {
        return annotations;
    }

    @Nullable
    public String getAnnotation(@Nonnull String key) {
        return annotations.get(key);
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Override
    public boolean containsPatternVariable() {
        return false;
    }

    /**
     * The part of leaf equality shared by every symbol kind: same name, same representation spaces.
     * @param other the other symbol
     * @return whether name and spaces agree
     */
    boolean sameNameAndSpaces(@Nonnull Symbol other) {
        return name.equals(other.name) && representationSpaces.equals(other.representationSpaces);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Symbol symbol = (Symbol)o;
        return sameNameAndSpaces(symbol) && annotations.equals(symbol.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), name, representationSpaces, annotations);
    }
}
