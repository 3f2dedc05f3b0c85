/*
 * StructureValidator.java
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
import org.wheeler.symbolic.MalformedExpressionException;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.logging.LogMessageKeys;
import org.wheeler.symbolic.paths.LocatedExpression;
import org.wheeler.symbolic.paths.Path;
import org.wheeler.symbolic.paths.SubExpressions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;

/**
 * Checks the flattening invariant the matcher relies on: no sum directly inside a sum and no product
 * directly inside a product. Powers are not descended into by the matcher's path addressing, but their
 * bases and exponents are checked as well since the engine recurses into them. An offending node inside a
 * power is reported at the path of the outermost enclosing power, together with the operand it sits in and
 * its path within that operand.
 */
@API(API.Status.INTERNAL)
public final class StructureValidator {
    @Nonnull
    private static final String BASE = "base";
    @Nonnull
    private static final String EXPONENT = "exponent";

    private StructureValidator() {
        // prevent instantiation
    }

    /**
     * Verify that {@code expression} is flattened.
     * @param role what the expression is used as, for the error message ("pattern" or "subject")
     * @param expression the tree to check
     * @throws MalformedExpressionException naming the path of the first offending node
     */
    public static void validateFlattened(@Nonnull String role, @Nonnull Expression expression) {
        validate(role, expression, null, "");
    }

    /**
     * @param powerPath path of the outermost power enclosing {@code expression}, {@code null} at top level
     * @param operand operand of that power leading to {@code expression}, e.g. {@code base} or
     * {@code base[S1].exponent} for a power nested inside the base
     */
    private static void validate(@Nonnull String role, @Nonnull Expression expression,
                                 @Nullable Path powerPath, @Nonnull String operand) {
        for (Iterator<LocatedExpression> it = SubExpressions.iterate(expression); it.hasNext(); ) {
            final LocatedExpression located = it.next();
            final Expression node = located.getExpression();
            switch (node.getKind()) {
                case SUM:
                case PRODUCT:
                    checkChildren(role, located, powerPath, operand);
                    break;
                case POWER:
                    final Path outermost = powerPath == null ? located.getPath() : powerPath;
                    final String prefix = powerPath == null
                                          ? ""
                                          : operand + (located.getPath().isRoot() ? "" : located.getPath().toString()) + ".";
                    validate(role, node.getChildren().get(0), outermost, prefix + BASE);
                    validate(role, node.getChildren().get(1), outermost, prefix + EXPONENT);
                    break;
                default:
                    break;
            }
        }
    }

    private static void checkChildren(@Nonnull String role, @Nonnull LocatedExpression parent,
                                      @Nullable Path powerPath, @Nonnull String operand) {
        final Expression node = parent.getExpression();
        final Expression.Kind kind = node.getKind();
        for (LocatedExpression child : SubExpressions.children(parent.getPath(), node)) {
            if (child.getExpression().getKind() == kind) {
                final MalformedExpressionException e = new MalformedExpressionException(role + " is not flattened",
                        LogMessageKeys.NODE, child.getExpression(),
                        LogMessageKeys.NODE_KIND, kind,
                        LogMessageKeys.PARENT_KIND, kind);
                if (powerPath == null) {
                    e.addLogInfo(LogMessageKeys.PATH.toString(), child.getPath());
                } else {
                    e.addLogInfo(LogMessageKeys.PATH.toString(), powerPath);
                    e.addLogInfo(LogMessageKeys.POWER_OPERAND.toString(), operand);
                    e.addLogInfo(LogMessageKeys.OPERAND_PATH.toString(), child.getPath());
                }
                throw e;
            }
        }
    }
}
