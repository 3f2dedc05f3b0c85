/*
 * LoggableKeysAndValues.java
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

package org.wheeler.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured key/value context for log output, typically an exception.
 *
 * <p>
 * Keys and values can be supplied as a flattened array in which even positions hold keys and odd positions
 * hold the value for the preceding key, e.g. <code>["anchor", "[P0]", "node", "a*b"]</code>. The same layout
 * is produced by {@link #exportLogInfo()} so that it can be handed straight to a structured log message.
 * </p>
 *
 * @param <T> the implementing type, returned from the fluent mutators
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information as an unmodifiable map.
     *
     * @return the key/value pairs attached so far
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach a single key/value pair.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach a flattened array of key/value pairs.
     *
     * @param keyValue alternating keys and values
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Flatten the log information into alternating keys and values, in insertion order.
     *
     * @return the flattened key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
