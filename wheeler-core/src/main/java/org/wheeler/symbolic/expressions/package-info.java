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
 * The symbolic expression tree model.
 *
 * <p>
 * {@link org.wheeler.symbolic.expressions.Expression} is a closed hierarchy of immutable nodes: sums,
 * products, powers, numeric constants, symbols (plain, tensor and spinor) and pattern variables. Symbols
 * implement {@link org.wheeler.symbolic.expressions.Matchable}, which defines the leaf equality used when
 * matching. Trees are created through {@link org.wheeler.symbolic.expressions.Expressions}.
 * </p>
 */
package org.wheeler.symbolic.expressions;
