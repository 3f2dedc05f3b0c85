/*
 * TensorSymbol.java
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
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named tensor with an ordered list of index slots, e.g. {@code R^a_bcd}.
 */
@API(API.Status.EXPERIMENTAL)
public final class TensorSymbol extends Symbol implements Matchable<TensorSymbol> {
    @Nonnull
    private final ImmutableList<TensorIndex> indices;

    TensorSymbol(@Nonnull String name, @Nonnull List<TensorIndex> indices, @Nonnull Iterable<String> representationSpaces,
                 @Nonnull Map<String, String> annotations) {
        super(name, representationSpaces, annotations);
        this.indices = ImmutableList.copyOf(indices);
    }

    @Nonnull
    public List<TensorIndex> getIndices() {
        return indices;
    }

    public int getRank() {
        return indices.size();
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.TENSOR;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitTensor(this);
    }

    /**
     * Tensors match when name, spaces and every index slot (label and variance, in order) agree.
     */
    @Override
    public boolean leafMatches(@Nonnull TensorSymbol other) {
        return sameNameAndSpaces(other) && indices.equals(other.indices);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && indices.equals(((TensorSymbol)o).indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), indices);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(getName());
        for (TensorIndex index : indices) {
            sb.append(index);
        }
        return sb.toString();
    }
}
