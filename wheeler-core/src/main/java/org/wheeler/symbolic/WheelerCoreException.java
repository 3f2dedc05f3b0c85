/*
 * WheelerCoreException.java
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

package org.wheeler.symbolic;

import org.wheeler.annotation.API;
import org.wheeler.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Root of the exceptions thrown by the Wheeler core. Failing to match is never reported this way; these
 * signal programming errors such as malformed trees or paths that do not address a node.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class WheelerCoreException extends LoggableException {

    public WheelerCoreException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg, keyValues);
    }

    public WheelerCoreException(@Nonnull String msg) {
        super(msg);
    }

    public WheelerCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
