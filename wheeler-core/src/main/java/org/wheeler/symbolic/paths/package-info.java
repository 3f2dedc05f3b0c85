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
 * Addressing of nodes inside expression trees. A {@link org.wheeler.symbolic.paths.Path} names a node by
 * the selectors leading to it, so match results can point into a tree without copying sub-trees;
 * {@link org.wheeler.symbolic.paths.SubExpressions} lists every addressable node of a tree.
 */
package org.wheeler.symbolic.paths;
