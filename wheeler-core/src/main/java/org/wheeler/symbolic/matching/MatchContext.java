/*
 * MatchContext.java
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

package org.wheeler.symbolic.matching;

import com.google.common.collect.ImmutableList;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.PatternVariable;
import org.wheeler.symbolic.paths.Path;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The state threaded through one match attempt: the variable bindings made so far and the paths of the
 * subject nodes confirmed to be part of the match.
 *
 * <p>
 * A context is mutable, but both of its parts are persistent, so {@link #snapshot()} and
 * {@link #restore(Snapshot)} are O(1). Any search step that tries alternatives takes a snapshot before each
 * alternative and restores it when the alternative fails, so that bindings and paths made by a failed
 * branch never leak into its siblings.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class MatchContext {
    @Nonnull
    private MatchBindings bindings;
    @Nullable
    private PathNode matchedPaths;

    private MatchContext(@Nonnull MatchBindings bindings, @Nullable PathNode matchedPaths) {
        this.bindings = bindings;
        this.matchedPaths = matchedPaths;
    }

    @Nonnull
    public static MatchContext empty() {
        return new MatchContext(MatchBindings.empty(), null);
    }

    @Nonnull
    public MatchBindings getBindings() {
        return bindings;
    }

    @Nullable
    public Expression getBinding(@Nonnull PatternVariable variable) {
        return bindings.getOrNull(variable);
    }

    public void bind(@Nonnull PatternVariable variable, @Nonnull Expression boundTo) {
        bindings = bindings.bind(variable, boundTo);
    }

    public void recordPath(@Nonnull Path path) {
        matchedPaths = new PathNode(Objects.requireNonNull(path, "path"), matchedPaths);
    }

    /**
     * The recorded paths in the order they were recorded. The same path may appear more than once.
     * @return the recorded paths
     */
    @Nonnull
    public ImmutableList<Path> getMatchedPaths() {
        final int size = matchedPaths == null ? 0 : matchedPaths.size;
        final Path[] paths = new Path[size];
        PathNode current = matchedPaths;
        for (int i = size - 1; i >= 0; i--) {
            paths[i] = Objects.requireNonNull(current).path;
            current = current.next;
        }
        return ImmutableList.copyOf(paths);
    }

    @Nonnull
    public Snapshot snapshot() {
        return new Snapshot(bindings, matchedPaths);
    }

    public void restore(@Nonnull Snapshot snapshot) {
        this.bindings = snapshot.bindings;
        this.matchedPaths = snapshot.matchedPaths;
    }

    @Override
    public String toString() {
        return "MatchContext(" + bindings + ", " + getMatchedPaths() + ")";
    }

    /**
     * A saved state of a {@link MatchContext}. Opaque to callers.
     */
    public static final class Snapshot {
        @Nonnull
        private final MatchBindings bindings;
        @Nullable
        private final PathNode matchedPaths;

        private Snapshot(@Nonnull MatchBindings bindings, @Nullable PathNode matchedPaths) {
            this.bindings = bindings;
            this.matchedPaths = matchedPaths;
        }
    }

    private static final class PathNode {
        @Nonnull
        private final Path path;
        @Nullable
        private final PathNode next;
        private final int size;

        private PathNode(@Nonnull Path path, @Nullable PathNode next) {
            this.path = path;
            this.next = next;
            this.size = next == null ? 1 : next.size + 1;
        }
    }
}
