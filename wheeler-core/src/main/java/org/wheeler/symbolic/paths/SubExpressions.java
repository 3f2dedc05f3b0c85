/*
 * SubExpressions.java
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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates every sub-expression of a tree together with its {@link Path}, in pre-order: the root with the
 * empty path first, then, for sums and products, each child subtree in order. Leaves and powers are not
 * descended into, since paths have no selectors for the base or exponent of a power.
 */
@API(API.Status.EXPERIMENTAL)
public final class SubExpressions {

    private SubExpressions() {
        // prevent instantiation
    }

    /**
     * Materialize all located sub-expressions of {@code subject}.
     * @param subject the tree to walk
     * @return the pre-order list of located sub-expressions
     */
    @Nonnull
    public static List<LocatedExpression> enumerate(@Nonnull Expression subject) {
        return ImmutableList.copyOf(iterate(subject));
    }

    /**
     * Lazily walk the located sub-expressions of {@code subject}. Nothing is visited before it is asked for,
     * which lets callers that stop at the first hit avoid walking the whole tree.
     * @param subject the tree to walk
     * @return a pre-order iterator
     */
    @Nonnull
    public static Iterator<LocatedExpression> iterate(@Nonnull Expression subject) {
        return new PreOrderIterator(new LocatedExpression(Path.root(), subject));
    }

    @Nonnull
    public static Stream<LocatedExpression> stream(@Nonnull Expression subject) {
        return Streams.stream(iterate(subject));
    }

    /**
     * The direct children of a sum or product, each located below {@code parent}. Anything else has none.
     * @param parent the path of {@code expression}
     * @param expression a node
     * @return its located children, in order
     */
    @Nonnull
    public static List<LocatedExpression> children(@Nonnull Path parent, @Nonnull Expression expression) {
        final List<Expression> children = expression.getChildren();
        final ImmutableList.Builder<LocatedExpression> builder = ImmutableList.builderWithExpectedSize(children.size());
        switch (expression.getKind()) {
            case SUM:
                for (int i = 0; i < children.size(); i++) {
                    builder.add(new LocatedExpression(parent.appendSumTerm(i), children.get(i)));
                }
                break;
            case PRODUCT:
                for (int i = 0; i < children.size(); i++) {
                    builder.add(new LocatedExpression(parent.appendProductFactor(i), children.get(i)));
                }
                break;
            default:
                break;
        }
        return builder.build();
    }

    private static final class PreOrderIterator extends AbstractIterator<LocatedExpression> {
        @Nonnull
        private final Deque<LocatedExpression> pending = new ArrayDeque<>();

        private PreOrderIterator(@Nonnull LocatedExpression root) {
            pending.push(root);
        }

        @Nullable
        @Override
        protected LocatedExpression computeNext() {
            final LocatedExpression next = pending.poll();
            if (next == null) {
                return endOfData();
            }
            final List<LocatedExpression> children = children(next.getPath(), next.getExpression());
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return next;
        }
    }
}
