/*
 * LogMessageKeys.java
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

package org.wheeler.symbolic.logging;

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * {@link KeyValueLogMessage} keys used by the Wheeler core. Keeping them in one place makes collisions and
 * spelling drift easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // expressions
    PATTERN,
    NODE,
    NODE_KIND,
    PARENT_KIND,
    // paths
    PATH,
    ANCHOR_PATH,
    SELECTOR,
    POWER_OPERAND,
    OPERAND_PATH,
    // matching
    ANCHOR_COUNT,
    MATCH_COUNT,
    MATCHED_PATH_COUNT,
    BINDING_COUNT,
    PATTERN_VARIABLE,
    PREVIOUS_BINDING,
    NEW_BINDING,
    WINDOW_OFFSET,
    WINDOW_SIZE,
    // configuration
    REPEATED_VARIABLE_POLICY,
    PARALLEL;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
