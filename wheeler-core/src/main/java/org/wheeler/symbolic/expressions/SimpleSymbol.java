/*
 * SimpleSymbol.java
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

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * A plain scalar symbol such as {@code x} or {@code alpha}.
 */
@API(API.Status.EXPERIMENTAL)
public final class SimpleSymbol extends Symbol implements Matchable<SimpleSymbol> {
    SimpleSymbol(@Nonnull String name, @Nonnull Iterable<String> representationSpaces, @Nonnull Map<String, String> annotations) {
        super(name, representationSpaces, annotations);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.SYMBOL;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public boolean leafMatches(@Nonnull SimpleSymbol other) {
        return sameNameAndSpaces(other);
    }

    @Override
    public String toString() {
        return getName();
    }
}
