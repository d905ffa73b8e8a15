/*
 * ContentRow.java
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

package org.stmtdb.readonly.provider;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One row of statement content: the preassembled statement JSON of a fingerprint, with one of its raw statements
 * and the reference of the paper that raw statement was read from.
 */
@API(API.Status.UNSTABLE)
public class ContentRow {
    private final long mkHash;
    @Nullable
    private final Long rawId;
    @Nullable
    private final String rawJson;
    @Nonnull
    private final String paJson;
    @Nonnull
    private final ReadingRef readingRef;

    public ContentRow(long mkHash, @Nullable Long rawId, @Nullable String rawJson, @Nonnull String paJson,
                      @Nullable ReadingRef readingRef) {
        this.mkHash = mkHash;
        this.rawId = rawId;
        this.rawJson = rawJson;
        this.paJson = paJson;
        this.readingRef = readingRef == null ? ReadingRef.NONE : readingRef;
    }

    public long getMkHash() {
        return mkHash;
    }

    @Nullable
    public Long getRawId() {
        return rawId;
    }

    /**
     * Get the raw statement JSON.
     * @return the JSON, or {@code null} if evidence was not requested
     */
    @Nullable
    public String getRawJson() {
        return rawJson;
    }

    @Nonnull
    public String getPaJson() {
        return paJson;
    }

    @Nonnull
    public ReadingRef getReadingRef() {
        return readingRef;
    }

    @Override
    public String toString() {
        return "ContentRow(" + mkHash + ", raw=" + rawId + ", " + readingRef + ")";
    }
}
