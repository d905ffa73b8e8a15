/*
 * QueryResult.java
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

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * The result of a query, with what is needed to fetch the next page.
 * @param <K> the key of the evidence totals, a fingerprint or an aggregation key
 * @param <T> the type of the results
 */
@API(API.Status.UNSTABLE)
public class QueryResult<K, T> {
    static final Gson GSON = new GsonBuilder().serializeNulls().create();

    @Nonnull
    private final T results;
    @Nullable
    private final Integer limit;
    private final int offset;
    @Nullable
    private final Integer nextOffset;
    @Nonnull
    private final ImmutableMap<K, Integer> evidenceTotals;
    private final long totalEvidence;
    @Nonnull
    private final JsonObject queryJson;

    /**
     * Create a result.
     * @param results the results
     * @param limit the limit that was applied
     * @param offset the offset that was applied
     * @param offsetComp the number of fingerprints this page consumed
     * @param evidenceTotals the evidence count of each result
     * @param queryJson the JSON of the query
     */
    public QueryResult(@Nonnull T results, @Nullable Integer limit, int offset, int offsetComp,
                       @Nonnull Map<K, Integer> evidenceTotals, @Nonnull JsonObject queryJson) {
        this.results = results;
        this.limit = limit;
        this.offset = offset;
        this.nextOffset = limit == null || offsetComp < limit ? null : offset + offsetComp;
        this.evidenceTotals = ImmutableMap.copyOf(evidenceTotals);
        this.totalEvidence = evidenceTotals.values().stream().mapToLong(Integer::longValue).sum();
        this.queryJson = queryJson.deepCopy();
    }

    @Nonnull
    public T getResults() {
        return results;
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Get the offset of the next page.
     * @return the offset, or {@code null} if there was no limit or this page was not full
     */
    @Nullable
    public Integer getNextOffset() {
        return nextOffset;
    }

    @Nonnull
    public Map<K, Integer> getEvidenceTotals() {
        return evidenceTotals;
    }

    public long getTotalEvidence() {
        return totalEvidence;
    }

    @Nonnull
    public JsonObject getQueryJson() {
        return queryJson.deepCopy();
    }

    @Nonnull
    public JsonObject toJson() {
        final JsonObject json = new JsonObject();
        json.add("results", GSON.toJsonTree(results));
        json.add("limit", limit == null ? JsonNull.INSTANCE : new JsonPrimitive(limit));
        json.addProperty("offset", offset);
        json.add("next_offset", nextOffset == null ? JsonNull.INSTANCE : new JsonPrimitive(nextOffset));
        json.add("query", queryJson.deepCopy());
        json.add("evidence_totals", GSON.toJsonTree(evidenceTotals));
        json.addProperty("total_evidence", totalEvidence);
        return json;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + evidenceTotals.size() + " results, next_offset=" + nextOffset + ")";
    }
}
