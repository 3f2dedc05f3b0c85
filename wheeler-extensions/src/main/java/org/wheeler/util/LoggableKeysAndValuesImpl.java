/*
 * LoggableKeysAndValuesImpl.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map-backed {@link LoggableKeysAndValues} that keeps pairs in the order they were attached.
 * The map is only allocated once the first pair arrives.
 */
@API(API.Status.UNSTABLE)
public final class LoggableKeysAndValuesImpl implements LoggableKeysAndValues<LoggableKeysAndValuesImpl> {
    private static final Object[] NO_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    public LoggableKeysAndValuesImpl(@Nullable Object ... keyValues) {
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        return logInfo == null ? Collections.emptyMap() : Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull String description, Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull Object ... keyValue) {
        if (keyValue.length % 2 != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return NO_LOG_INFO;
        }
        final Object[] flattened = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}
