/*
 * MatchReport.java
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

import com.google.common.collect.ImmutableSet;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.PatternVariable;
import org.wheeler.symbolic.paths.Path;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Objects;

/**
 * One successful match: where it is anchored, which subject nodes took part in it and what the pattern
 * variables were bound to.
 */
@API(API.Status.EXPERIMENTAL)
public final class MatchReport {
    @Nonnull
    private final Path anchorPath;
    @Nonnull
    private final ImmutableSet<Path> matchedPaths;
    @Nonnull
    private final MatchBindings bindings;

    public MatchReport(@Nonnull Path anchorPath, @Nonnull Collection<Path> matchedPaths,
                       @Nonnull MatchBindings bindings) {
        this.anchorPath = anchorPath;
        this.matchedPaths = ImmutableSet.copyOf(matchedPaths);
        this.bindings = bindings;
    }

    @Nonnull
    static MatchReport fromContext(@Nonnull Path anchorPath, @Nonnull MatchContext context) {
        return new MatchReport(anchorPath, context.getMatchedPaths(), context.getBindings());
    }

    @Nonnull
    public Path getAnchorPath() {
        return anchorPath;
    }

    /**
     * Paths of the subject nodes confirmed to be part of the match, in the order they were first
     * confirmed, without duplicates.
     * @return the matched paths
     */
    @Nonnull
    public ImmutableSet<Path> getMatchedPaths() {
        return matchedPaths;
    }

    @Nonnull
    public MatchBindings getBindings() {
        return bindings;
    }

    @Nullable
    public Expression getBinding(@Nonnull PatternVariable variable) {
        return bindings.getOrNull(variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final MatchReport that = (MatchReport)o;
        return anchorPath.equals(that.anchorPath) &&
               matchedPaths.equals(that.matchedPaths) &&
               bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anchorPath, matchedPaths, bindings);
    }

    @Override
    public String toString() {
        return "MatchReport(anchor=" + anchorPath + ", matched=" + matchedPaths + ", bindings=" + bindings + ")";
    }
}
