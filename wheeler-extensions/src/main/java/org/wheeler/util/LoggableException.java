/*
 * LoggableException.java
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

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Unchecked exception that carries key/value context alongside its message, so that whoever logs it can
 * emit a structured line instead of parsing the message text.
 *
 * <pre><code>
 * throw new LoggableException("selector does not fit expression", "path", path, "node", node);
 * </code></pre>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException implements LoggableKeysAndValues<LoggableException> {
    @Nonnull
    private final LoggableKeysAndValuesImpl keysAndValues = new LoggableKeysAndValuesImpl();

    /**
     * Create an exception with a message and alternating keys and values.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     */
    public LoggableException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg);
        if (keyValues != null) {
            keysAndValues.addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(Throwable cause) {
        super(cause);
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        return keysAndValues.getLogInfo();
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull String description, Object object) {
        keysAndValues.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object ... keyValue) {
        keysAndValues.addLogInfo(keyValue);
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        return keysAndValues.exportLogInfo();
    }
}
