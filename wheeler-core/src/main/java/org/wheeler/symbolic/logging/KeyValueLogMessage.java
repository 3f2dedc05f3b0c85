/*
 * KeyValueLogMessage.java
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
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A formatter for log messages.
 *
 * A {@code KeyValueLogMessage} has a static message followed by its key/value pairs in {@code key="value"}
 * form, sorted by key.
 */
@API(API.Status.MAINTAINED)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull final String staticMessage, @Nonnull final Map<String, String> keyValueMap) {
        this.staticMessage = staticMessage;
        this.keyValueMap = keyValueMap;
    }

    @Nonnull
    public static String of(@Nonnull final String staticMessage, @Nullable final Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    @Nonnull
    public static KeyValueLogMessage build(@Nonnull final String staticMessage, @Nullable final Object... keysAndValues) {
        final KeyValueLogMessage message = new KeyValueLogMessage(staticMessage, new TreeMap<>());
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 == 1) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                message.addKeyAndValue(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return message;
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nullable final Object key, @Nullable final Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(sanitizeKey(key.toString()), sanitizeValue(String.valueOf(value)));
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull final Map<?, ?> map) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            addKeyAndValue(entry.getKey(), entry.getValue());
        }
        return this;
    }

    @Nonnull
    private static String sanitizeKey(@Nonnull final String key) {
        return key.replace("=", "");
    }

    @Nonnull
    private static String sanitizeValue(@Nonnull final String value) {
        return value.replace("\"", "'");
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Nonnull
    public String getMessageWithKeys() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 24);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMessageWithKeys();
    }
}
