/*
 * PatternMatcher.java
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.logging.KeyValueLogMessage;
import org.wheeler.symbolic.logging.LogMessageKeys;
import org.wheeler.symbolic.paths.LocatedExpression;
import org.wheeler.symbolic.paths.Path;
import org.wheeler.symbolic.paths.SubExpressions;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds where a pattern occurs in a subject expression.
 *
 * <p>
 * Every sub-expression the {@link SubExpressions enumerator} yields is an anchor candidate. The pattern is
 * matched against each with a fresh {@link MatchContext}, and each success becomes a {@link MatchReport}.
 * Reports come back in pre-order of their anchors, regardless of {@link MatcherConfiguration#isParallelAnchors()}.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class PatternMatcher {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(PatternMatcher.class);

    @Nonnull
    private static final PatternMatcher DEFAULT = new PatternMatcher();

    @Nonnull
    private final MatcherConfiguration configuration;
    @Nonnull
    private final MatchingEngine engine;

    public PatternMatcher() {
        this(MatcherConfiguration.defaultConfiguration());
    }

    public PatternMatcher(@Nonnull MatcherConfiguration configuration) {
        this.configuration = configuration;
        this.engine = new MatchingEngine(configuration);
    }

    @Nonnull
    public static PatternMatcher defaultMatcher() {
        return DEFAULT;
    }

    @Nonnull
    public MatcherConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Match {@code pattern} at every anchor of {@code subject}.
     * @param pattern the pattern, possibly containing pattern variables
     * @param subject the expression to search
     * @return one report per anchor at which the pattern matched, in pre-order of the anchors
     * @throws org.wheeler.symbolic.MalformedExpressionException if either tree is not flattened and structure
     * validation is on, or if the representation space function has no answer for a factor
     */
    @Nonnull
    public List<MatchReport> findAllMatches(@Nonnull Expression pattern, @Nonnull Expression subject) {
        validate(pattern, subject);
        final List<LocatedExpression> anchors = SubExpressions.enumerate(subject);
        final Stream<LocatedExpression> anchorStream = configuration.isParallelAnchors()
                                                       ? anchors.parallelStream()
                                                       : anchors.stream();
        final List<MatchReport> reports = anchorStream
                .map(anchor -> attempt(pattern, anchor))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("pattern search finished",
                    LogMessageKeys.PATTERN, pattern,
                    LogMessageKeys.ANCHOR_COUNT, anchors.size(),
                    LogMessageKeys.MATCH_COUNT, reports.size(),
                    LogMessageKeys.PARALLEL, configuration.isParallelAnchors()));
        }
        return ImmutableList.copyOf(reports);
    }

    /**
     * Whether {@code pattern} matches anywhere in {@code subject}. Stops at the first anchor that matches,
     * after the same structure validation as {@link #firstMatch}.
     * @param pattern the pattern
     * @param subject the expression to search
     * @return whether there is at least one match
     */
    public boolean hasMatch(@Nonnull Expression pattern, @Nonnull Expression subject) {
        return firstMatch(pattern, subject).isPresent();
    }

    /**
     * The match at the first anchor in pre-order, if any. Anchors are visited lazily and the search stops at
     * the first success.
     *
     * <p>
     * When {@link MatcherConfiguration#isValidateStructure()} is on, both trees are validated in full before
     * the search starts, which is linear in the size of the subject even if the root anchor matches. The
     * attempt at the root may descend into any part of the subject, so the whole tree has to satisfy the
     * flattening invariant either way. Callers that already guarantee flattened input and want to pay only
     * for the anchors visited can turn validation off.
     * </p>
     * @param pattern the pattern
     * @param subject the expression to search
     * @return the first report, or empty if the pattern matches nowhere
     */
    @Nonnull
    public Optional<MatchReport> firstMatch(@Nonnull Expression pattern, @Nonnull Expression subject) {
        validate(pattern, subject);
        final Iterator<LocatedExpression> anchors = SubExpressions.iterate(subject);
        while (anchors.hasNext()) {
            final Optional<MatchReport> report = attempt(pattern, anchors.next());
            if (report.isPresent()) {
                return report;
            }
        }
        return Optional.empty();
    }

    /**
     * Match {@code pattern} against {@code subject} as a whole, without looking at its sub-expressions.
     * @param pattern the pattern
     * @param subject the expression to match
     * @return the report anchored at the root, or empty
     */
    @Nonnull
    public Optional<MatchReport> matchAt(@Nonnull Expression pattern, @Nonnull Expression subject) {
        validate(pattern, subject);
        return attempt(pattern, new LocatedExpression(Path.root(), subject));
    }

    @Nonnull
    private Optional<MatchReport> attempt(@Nonnull Expression pattern, @Nonnull LocatedExpression anchor) {
        final MatchContext context = MatchContext.empty();
        if (!engine.tryMatch(pattern, anchor.getExpression(), anchor.getPath(), context)) {
            return Optional.empty();
        }
        final MatchReport report = MatchReport.fromContext(anchor.getPath(), context);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("pattern matched",
                    LogMessageKeys.ANCHOR_PATH, anchor.getPath(),
                    LogMessageKeys.MATCHED_PATH_COUNT, report.getMatchedPaths().size(),
                    LogMessageKeys.BINDING_COUNT, report.getBindings().size()));
        }
        return Optional.of(report);
    }

    private void validate(@Nonnull Expression pattern, @Nonnull Expression subject) {
        if (configuration.isValidateStructure()) {
            StructureValidator.validateFlattened("pattern", pattern);
            StructureValidator.validateFlattened("subject", subject);
        }
    }
}
