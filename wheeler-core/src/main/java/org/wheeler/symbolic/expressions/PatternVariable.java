/*
 * PatternVariable.java
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
import com.google.common.collect.ImmutableSortedSet;
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A placeholder that only appears in patterns and matches any sub-expression, recording what it matched.
 *
 * <p>
 * Pattern variables are compared by identity: two variables created separately are different even if
 * they share a name. A variable may be given representation spaces, in which case it takes the place of a
 * non-commuting factor of those spaces inside a product pattern.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class PatternVariable extends Expression {
    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableSortedSet<String> representationSpaces;

    PatternVariable(@Nonnull String name, @Nonnull Iterable<String> representationSpaces) {
        this.name = Objects.requireNonNull(name, "name");
        this.representationSpaces = ImmutableSortedSet.copyOf(representationSpaces);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.PATTERN_VARIABLE;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitPatternVariable(this);
    }

    @Override
    public boolean containsPatternVariable() {
        return true;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<String> getRepresentationSpaces() {
        return representationSpaces;
    }

    // identity equality, inherited from Object

    @Override
    public String toString() {
        return name + "_";
    }
}
