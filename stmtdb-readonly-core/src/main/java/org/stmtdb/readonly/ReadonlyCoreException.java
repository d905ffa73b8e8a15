/*
 * ReadonlyCoreException.java
 *
 * This source file is part of the StmtDB open source project
 *
 * Copyright 2026 StmtDB project authors
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

package org.stmtdb.readonly;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the unchecked exceptions thrown by the readonly query layer.
 *
 * Besides a message, an exception carries a set of key/value pairs describing the context in which it was raised.
 * These are kept apart from the message so that log aggregation can search on them, e.g.
 * {@code new ReadonlyCoreException("unknown source", LogMessageKeys.SOURCE, "foo")}.
 */
@API(API.Status.UNSTABLE)
public class ReadonlyCoreException extends RuntimeException {
    private static final long serialVersionUID = 1;

    @Nullable
    private Map<String, Object> logInfo;

    public ReadonlyCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public ReadonlyCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Add a key/value pair to the log information.
     * @param description the key
     * @param object the value
     * @return this exception
     */
    @Nonnull
    public ReadonlyCoreException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add alternating keys and values to the log information.
     * @param keyValues flattened key/value pairs, keys at even positions
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has odd length
     */
    @Nonnull
    public ReadonlyCoreException addLogInfo(@Nonnull Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Export the log information in the flattened form accepted by {@link #addLogInfo(Object...)}, suitable for
     * passing on to {@link org.stmtdb.readonly.logging.KeyValueLogMessage}.
     * @return alternating keys and values
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> info = getLogInfo();
        final Object[] exported = new Object[2 * info.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
