/*
 * ExpressionVisitor.java
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

package org.wheeler.symbolic.expressions;

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;

/**
 * Visitor over the closed set of {@link Expression} shapes.
 * @param <T> the result type
 */
@API(API.Status.EXPERIMENTAL)
public interface ExpressionVisitor<T> {
    @Nonnull
    T visitSum(@Nonnull Sum sum);

    @Nonnull
    T visitProduct(@Nonnull Product product);

    @Nonnull
    T visitPower(@Nonnull Power power);

    @Nonnull
    T visitConstant(@Nonnull Const constant);

    @Nonnull
    T visitSymbol(@Nonnull SimpleSymbol symbol);

    @Nonnull
    T visitTensor(@Nonnull TensorSymbol tensor);

    @Nonnull
    T visitSpinor(@Nonnull SpinorSymbol spinor);

    @Nonnull
    T visitPatternVariable(@Nonnull PatternVariable variable);
}
