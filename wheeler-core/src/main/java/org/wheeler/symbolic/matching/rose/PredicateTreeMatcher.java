/*
 * PredicateTreeMatcher.java
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

package org.wheeler.symbolic.matching.rose;

import com.google.common.collect.ImmutableList;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.paths.LocatedExpression;
import org.wheeler.symbolic.paths.Path;
import org.wheeler.symbolic.paths.SubExpressions;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Containment matching of {@link PredicateTree}s. There are no pattern variables and no bindings, only a
 * yes or no answer and the paths at which it is yes.
 *
 * <p>
 * Below a sum node, every pattern child must be matched by a distinct subject term, in any order. Below a
 * product node, the pattern children must be matched by subject factors appearing in the same order, but
 * not necessarily next to each other. In both cases each pattern child takes the first subject child it
 * matches; there is no backtracking over that choice.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class PredicateTreeMatcher {

    private PredicateTreeMatcher() {
        // prevent instantiation
    }

    /**
     * Whether {@code tree} matches {@code subject} at its root.
     * @param tree compiled pattern
     * @param subject expression to test
     * @return whether the root predicate holds and the children are contained as described above
     */
    public static boolean matchesAt(@Nonnull PredicateTree tree, @Nonnull Expression subject) {
        if (!tree.test(subject)) {
            return false;
        }
        switch (subject.getKind()) {
            case SUM:
                return unorderedContains(tree.getChildren(), subject.getChildren());
            case PRODUCT:
                return orderedContains(tree.getChildren(), subject.getChildren());
            default:
                return true;
        }
    }

    /**
     * Whether {@code tree} matches at {@code subject} or at any sub-expression reachable through sums and
     * products.
     */
    public static boolean contains(@Nonnull PredicateTree tree, @Nonnull Expression subject) {
        return SubExpressions.stream(subject).anyMatch(located -> matchesAt(tree, located.getExpression()));
    }

    /**
     * The paths of all sub-expressions {@code tree} matches at, in pre-order.
     * @param tree compiled pattern
     * @param subject expression to search
     * @return the matching paths
     */
    @Nonnull
    public static List<Path> findAllPaths(@Nonnull PredicateTree tree, @Nonnull Expression subject) {
        final ImmutableList.Builder<Path> paths = ImmutableList.builder();
        for (LocatedExpression located : SubExpressions.enumerate(subject)) {
            if (matchesAt(tree, located.getExpression())) {
                paths.add(located.getPath());
            }
        }
        return paths.build();
    }

    private static boolean unorderedContains(@Nonnull List<PredicateTree> patterns,
                                             @Nonnull List<Expression> subjects) {
        final List<Expression> remaining = new ArrayList<>(subjects);
        for (PredicateTree pattern : patterns) {
            final int index = indexOfMatch(pattern, remaining, 0);
            if (index < 0) {
                return false;
            }
            remaining.remove(index);
        }
        return true;
    }

    private static boolean orderedContains(@Nonnull List<PredicateTree> patterns,
                                           @Nonnull List<Expression> subjects) {
        int from = 0;
        for (PredicateTree pattern : patterns) {
            final int index = indexOfMatch(pattern, subjects, from);
            if (index < 0) {
                return false;
            }
            from = index + 1;
        }
        return true;
    }

    private static int indexOfMatch(@Nonnull PredicateTree pattern, @Nonnull List<Expression> subjects, int from) {
        for (int i = from; i < subjects.size(); i++) {
            if (matchesAt(pattern, subjects.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
