/*
 * MatcherConfiguration.java
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

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A set of configuration options for the {@link PatternMatcher} and {@link MatchingEngine}.
 */
@API(API.Status.UNSTABLE)
public class MatcherConfiguration {
    @Nonnull
    private static final MatcherConfiguration DEFAULT_CONFIGURATION = builder().build();

    /**
     * What to do when a pattern variable occurs more than once in a pattern.
     */
    public enum RepeatedVariablePolicy {
        /**
         * Every occurrence must match a sub-expression equivalent to the first one. {@code x_ + x_} then only
         * matches sums with two equal terms.
         */
        REQUIRE_CONSISTENT,
        /**
         * Each occurrence matches anything and the latest binding wins.
         */
        OVERWRITE
    }

    @Nonnull
    private final RepeatedVariablePolicy repeatedVariablePolicy;
    private final boolean validateStructure;
    @Nonnull
    private final RepresentationSpaceFunction representationSpaceFunction;
    private final boolean parallelAnchors;

    private MatcherConfiguration(@Nonnull Builder builder) {
        this.repeatedVariablePolicy = builder.repeatedVariablePolicy;
        this.validateStructure = builder.validateStructure;
        this.representationSpaceFunction = builder.representationSpaceFunction;
        this.parallelAnchors = builder.parallelAnchors;
    }

    @Nonnull
    public static MatcherConfiguration defaultConfiguration() {
        return DEFAULT_CONFIGURATION;
    }

    /**
     * Get how repeated occurrences of one pattern variable are treated.
     * @return the repeated variable policy
     */
    @Nonnull
    public RepeatedVariablePolicy getRepeatedVariablePolicy() {
        return repeatedVariablePolicy;
    }

    /**
     * Get whether pattern and subject are checked for nested sums and nested products before matching.
     * The check walks both trees once per query; it can be turned off for trees that are known to be
     * canonical.
     * @return whether structural validation is on
     */
    public boolean isValidateStructure() {
        return validateStructure;
    }

    @Nonnull
    public RepresentationSpaceFunction getRepresentationSpaceFunction() {
        return representationSpaceFunction;
    }

    /**
     * Get whether {@link PatternMatcher#findAllMatches} attempts anchors on a parallel stream. Results are
     * reported in pre-order either way.
     * @return whether anchors are matched in parallel
     */
    public boolean isParallelAnchors() {
        return parallelAnchors;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final MatcherConfiguration that = (MatcherConfiguration)o;
        return validateStructure == that.validateStructure &&
               parallelAnchors == that.parallelAnchors &&
               repeatedVariablePolicy == that.repeatedVariablePolicy &&
               representationSpaceFunction.equals(that.representationSpaceFunction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repeatedVariablePolicy, validateStructure, representationSpaceFunction, parallelAnchors);
    }

    @Override
    public String toString() {
        return "MatcherConfiguration{" +
               "repeatedVariablePolicy=" + repeatedVariablePolicy +
               ", validateStructure=" + validateStructure +
               ", parallelAnchors=" + parallelAnchors +
               '}';
    }

    /**
     * A builder for {@link MatcherConfiguration}.
     * <pre><code>
     * MatcherConfiguration.builder().setRepeatedVariablePolicy(RepeatedVariablePolicy.OVERWRITE).build()
     * </code></pre>
     */
    public static class Builder {
        @Nonnull
        private RepeatedVariablePolicy repeatedVariablePolicy = RepeatedVariablePolicy.REQUIRE_CONSISTENT;
        private boolean validateStructure = true;
        @Nonnull
        private RepresentationSpaceFunction representationSpaceFunction = RepresentationSpaceFunction.DEFAULT;
        private boolean parallelAnchors = false;

        private Builder() {
        }

        private Builder(@Nonnull MatcherConfiguration configuration) {
            this.repeatedVariablePolicy = configuration.repeatedVariablePolicy;
            this.validateStructure = configuration.validateStructure;
            this.representationSpaceFunction = configuration.representationSpaceFunction;
            this.parallelAnchors = configuration.parallelAnchors;
        }

        @Nonnull
        public Builder setRepeatedVariablePolicy(@Nonnull RepeatedVariablePolicy repeatedVariablePolicy) {
            this.repeatedVariablePolicy = Objects.requireNonNull(repeatedVariablePolicy);
            return this;
        }

        @Nonnull
        public Builder setValidateStructure(boolean validateStructure) {
            this.validateStructure = validateStructure;
            return this;
        }

        @Nonnull
        public Builder setRepresentationSpaceFunction(@Nonnull RepresentationSpaceFunction representationSpaceFunction) {
            this.representationSpaceFunction = Objects.requireNonNull(representationSpaceFunction);
            return this;
        }

        @Nonnull
        public Builder setParallelAnchors(boolean parallelAnchors) {
            this.parallelAnchors = parallelAnchors;
            return this;
        }

        @Nonnull
        public MatcherConfiguration build() {
            return new MatcherConfiguration(this);
        }
    }
}
