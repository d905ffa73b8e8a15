/*
 * LogMessageKeys.java
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

package org.stmtdb.readonly.logging;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the readonly query layer.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // query construction
    QUERY,
    QUERY_CLASS("class"),
    AGENT_ID,
    NAMESPACE,
    ROLE,
    AGENT_NUM,
    MESH_ID,
    SOURCE,
    ID_TYPE,
    PAPER_ID,
    STATEMENT_TYPE,
    VALUE,
    FAMILY,
    // planning
    PLAN,
    INJECTED,
    // paging and evidence
    LIMIT,
    OFFSET,
    BEST_FIRST,
    EVIDENCE_LIMIT,
    RESULT_COUNT,
    RELATION,
    DROPPED_COUNT,
    DROPPED_HASHES,
    MK_HASH,
    RAW_ID,
    // store access
    SQL,
    PARAMETERS,
    HASH_COUNT,
    ROW_COUNT,
    SCHEMA,
    TIME_MILLIS("time_milliseconds");

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
