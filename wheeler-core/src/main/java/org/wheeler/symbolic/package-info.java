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
 * Core of the Wheeler symbolic algebra engine.
 *
 * <p>
 * Expressions are immutable trees defined in {@link org.wheeler.symbolic.expressions}. The
 * {@link org.wheeler.symbolic.matching} package locates every occurrence of a pattern inside a subject
 * expression, honoring commutativity of sums and the partial commutativity of products whose factors live
 * in different representation spaces. Rewriting, canonicalization and printing build on its results and
 * live outside this module.
 * </p>
 */
package org.wheeler.symbolic;
