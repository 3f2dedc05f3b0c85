/*
 * package-info.java
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

/**
 * Pattern matching over expression trees.
 *
 * <p>
 * {@link org.wheeler.symbolic.matching.PatternMatcher} is the entry point: it enumerates the anchors of a
 * subject and asks the {@link org.wheeler.symbolic.matching.MatchingEngine} to match the pattern at each,
 * producing a {@link org.wheeler.symbolic.matching.MatchReport} per success. The engine threads a
 * {@link org.wheeler.symbolic.matching.MatchContext} through the search and backtracks by restoring
 * snapshots of it. Behavior is tuned through {@link org.wheeler.symbolic.matching.MatcherConfiguration}.
 * </p>
 */
package org.wheeler.symbolic.matching;
