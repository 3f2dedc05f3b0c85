/*
 * Path.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.WheelerCoreException;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * The address of a node inside an expression tree: the sequence of child selectors leading from the root to
 * the node, outermost first. The empty path addresses the root.
 *
 * <p>
 * Paths are immutable and share structure: {@link #append(Selector)} returns a new path that points at its
 * parent instead of copying it, so extending a path is O(1) and every prefix handed out earlier stays valid.
 * Equality and hashing are structural.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Path {
    @Nonnull
    private static final Path ROOT = new Path(null, null);

    @Nullable
    private final Path parent;
    @Nullable
    private final Selector last;
    private final int length;
    private final int hashCode;

    private Path(@Nullable Path parent, @Nullable Selector last) {
        this.parent = parent;
        this.last = last;
        this.length = parent == null ? 0 : parent.length + 1;
        this.hashCode = parent == null ? 1 : 31 * parent.hashCode + Objects.requireNonNull(last).hashCode();
    }

    @Nonnull
    public static Path root() {
        return ROOT;
    }

    @Nonnull
    public static Path of(@Nonnull Selector... selectors) {
        Path path = ROOT;
        for (Selector selector : selectors) {
            path = path.append(selector);
        }
        return path;
    }

    @Nonnull
    public Path append(@Nonnull Selector selector) {
        return new Path(this, Objects.requireNonNull(selector, "selector"));
    }

    @Nonnull
    public Path appendSumTerm(int index) {
        return append(Selector.sumTerm(index));
    }

    @Nonnull
    public Path appendProductFactor(int index) {
        return append(Selector.productFactor(index));
    }

    public boolean isRoot() {
        return length == 0;
    }

    public int length() {
        return length;
    }

    /**
     * The path without its last selector.
     * @return the parent path
     * @throws WheelerCoreException if this is the root path
     */
    @Nonnull
    public Path getParent() {
        if (parent == null) {
            throw new WheelerCoreException("root path has no parent");
        }
        return parent;
    }

    /**
     * The innermost selector of this path.
     * @return the last selector
     * @throws WheelerCoreException if this is the root path
     */
    @Nonnull
    public Selector getLast() {
        if (last == null) {
            throw new WheelerCoreException("root path has no selector");
        }
        return last;
    }

    @Nonnull
    public List<Selector> getSelectors() {
        final Selector[] selectors = new Selector[length];
        Path current = this;
        for (int i = length - 1; i >= 0; i--) {
            selectors[i] = current.last;
            current = current.parent;
        }
        return ImmutableList.copyOf(selectors);
    }

    /**
     * The prefix of this path with the given length.
     * @param prefixLength number of selectors to keep
     * @return the prefix, sharing structure with this path
     */
    @Nonnull
    public Path prefix(int prefixLength) {
        Preconditions.checkArgument(prefixLength >= 0 && prefixLength <= length,
                "prefix length %s out of range for path of length %s", prefixLength, length);
        Path current = this;
        while (current.length > prefixLength) {
            current = current.parent;
        }
        return current;
    }

    /**
     * Whether the node addressed by this path is {@code other}'s node or one of its ancestors.
     * @param other another path
     * @return {@code true} if this path is a (not necessarily proper) prefix of {@code other}
     */
    public boolean isPrefixOf(@Nonnull Path other) {
        return length <= other.length && equals(other.prefix(length));
    }

    /**
     * Follow this path from {@code root} to the node it addresses.
     * @param root the tree the path was taken in
     * @return the addressed sub-expression
     * @throws WheelerCoreException if a selector does not fit the tree
     */
    @Nonnull
    public Expression resolve(@Nonnull Expression root) {
        Expression current = root;
        for (Selector selector : getSelectors()) {
            if (!selector.fits(current)) {
                throw new WheelerCoreException("path does not address a node of the expression",
                        LogMessageKeys.PATH, this,
                        LogMessageKeys.SELECTOR, selector,
                        LogMessageKeys.NODE, current,
                        LogMessageKeys.NODE_KIND, current.getKind());
            }
            current = current.getChildren().get(selector.getIndex());
        }
        return current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Path)) {
            return false;
        }
        Path left = this;
        Path right = (Path)o;
        if (left.length != right.length || left.hashCode != right.hashCode) {
            return false;
        }
        while (left != right) {
            if (!Objects.equals(left.last, right.last)) {
                return false;
            }
            left = left.parent;
            right = right.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return getSelectors().toString();
    }

    /**
     * One step of a {@link Path}: the index of a term inside a sum or of a factor inside a product.
     */
    public static final class Selector {

        /**
         * The kind of node a selector steps into.
         */
        public enum Kind {
            SUM_TERM("S"),
            PRODUCT_FACTOR("P");

            @Nonnull
            private final String abbreviation;

            Kind(@Nonnull String abbreviation) {
                this.abbreviation = abbreviation;
            }
        }

        @Nonnull
        private final Kind kind;
        private final int index;

        private Selector(@Nonnull Kind kind, int index) {
            Preconditions.checkArgument(index >= 0, "selector index must not be negative: %s", index);
            this.kind = kind;
            this.index = index;
        }

        @Nonnull
        public static Selector sumTerm(int index) {
            return new Selector(Kind.SUM_TERM, index);
        }

        @Nonnull
        public static Selector productFactor(int index) {
            return new Selector(Kind.PRODUCT_FACTOR, index);
        }

        @Nonnull
        public Kind getKind() {
            return kind;
        }

        public int getIndex() {
            return index;
        }

        boolean fits(@Nonnull Expression expression) {
            final Expression.Kind expected = kind == Kind.SUM_TERM ? Expression.Kind.SUM : Expression.Kind.PRODUCT;
            return expression.getKind() == expected && index < expression.getChildren().size();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Selector)) {
                return false;
            }
            final Selector selector = (Selector)o;
            return kind == selector.kind && index == selector.index;
        }

        @Override
        public int hashCode() {
            return 31 * kind.hashCode() + index;
        }

        @Override
        public String toString() {
            return kind.abbreviation + index;
        }
    }
}
