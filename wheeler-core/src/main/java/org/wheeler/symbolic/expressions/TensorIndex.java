/*
 * TensorIndex.java
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
import java.util.Objects;

/**
 * One index slot of a {@link TensorSymbol}: a label and whether the slot is upper (contravariant) or lower
 * (covariant). Dummy-index renaming and contraction are handled elsewhere; here an index is just a value.
 */
@API(API.Status.EXPERIMENTAL)
public final class TensorIndex {

    /**
     * Position of an index slot.
     */
    public enum Variance {
        UPPER,
        LOWER
    }

    @Nonnull
    private final String label;
    @Nonnull
    private final Variance variance;

    private TensorIndex(@Nonnull String label, @Nonnull Variance variance) {
        this.label = Objects.requireNonNull(label, "label");
        this.variance = Objects.requireNonNull(variance, "variance");
    }

    @Nonnull
    public static TensorIndex upper(@Nonnull String label) {
        return new TensorIndex(label, Variance.UPPER);
    }

    @Nonnull
    public static TensorIndex lower(@Nonnull String label) {
        return new TensorIndex(label, Variance.LOWER);
    }

    @Nonnull
    public String getLabel() {
        return label;
    }

    @Nonnull
    public Variance getVariance() {
        return variance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TensorIndex)) {
            return false;
        }
        final TensorIndex that = (TensorIndex)o;
        return label.equals(that.label) && variance == that.variance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, variance);
    }

    @Override
    public String toString() {
        return (variance == Variance.UPPER ? "^" : "_") + label;
    }
}
