/*
 * NaryExpression.java
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
 * Common base class for expressions with an arbitrary number of children, such as {@link Sum} and
 * {@link Product}. The children list may be empty.
 */
@API(API.Status.EXPERIMENTAL)
public abstract class NaryExpression extends Expression {
    @Nonnull
    private final ImmutableList<Expression> children;
    private final boolean containsPatternVariable;
    @Nonnull
    private final ImmutableSortedSet<String> representationSpaces;
    private final int hashCode;

    NaryExpression(@Nonnull Iterable<? extends Expression> children) {
        this.children = copyChildren(children);
        this.containsPatternVariable = this.children.stream().anyMatch(Expression::containsPatternVariable);
        this.representationSpaces = unionOfSpaces(this.children);
        this.hashCode = Objects.hash(getClass(), this.children);
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return children;
    }

    public int size() {
        return children.size();
    }

    @Nonnull
    public Expression get(int index) {
        return children.get(index);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public boolean containsPatternVariable() {
        return containsPatternVariable;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<String> getRepresentationSpaces() {
        return representationSpaces;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final NaryExpression that = (NaryExpression)o;
        return hashCode == that.hashCode && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Nonnull
    String join(@Nonnull String separator, @Nonnull String whenEmpty) {
        if (children.isEmpty()) {
            return whenEmpty;
        }
        final StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
