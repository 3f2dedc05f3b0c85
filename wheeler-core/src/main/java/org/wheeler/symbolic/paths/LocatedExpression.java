/*
 * LocatedExpression.java
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

package org.wheeler.symbolic.paths;

import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A sub-expression together with the {@link Path} at which it occurs in some enclosing tree.
 */
@API(API.Status.EXPERIMENTAL)
public final class LocatedExpression {
    @Nonnull
    private final Path path;
    @Nonnull
    private final Expression expression;

    public LocatedExpression(@Nonnull Path path, @Nonnull Expression expression) {
        this.path = Objects.requireNonNull(path, "path");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    @Nonnull
    public Path getPath() {
        return path;
    }

    @Nonnull
    public Expression getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocatedExpression)) {
            return false;
        }
        final LocatedExpression that = (LocatedExpression)o;
        return path.equals(that.path) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, expression);
    }

    @Override
    public String toString() {
        return path + " -> " + expression;
    }
}
