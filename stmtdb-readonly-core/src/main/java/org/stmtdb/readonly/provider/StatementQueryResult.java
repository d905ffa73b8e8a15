/*
 * StatementQueryResult.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * The statements matching a query, keyed by fingerprint in page order, with their evidence.
 */
@API(API.Status.UNSTABLE)
public class StatementQueryResult extends QueryResult<Long, Map<Long, JsonObject>> {
    private final int returnedEvidence;
    @Nonnull
    private final ImmutableMap<Long, Map<String, Integer>> sourceCounts;
    @Nonnull
    private final ImmutableList<Long> droppedHashes;

    @SuppressWarnings("java:S107")
    public StatementQueryResult(@Nonnull Map<Long, JsonObject> results, @Nullable Integer limit, int offset,
                                int offsetComp, @Nonnull Map<Long, Integer> evidenceTotals, int returnedEvidence,
                                @Nonnull Map<Long, Map<String, Integer>> sourceCounts,
                                @Nonnull List<Long> droppedHashes, @Nonnull JsonObject queryJson) {
        super(results, limit, offset, offsetComp, evidenceTotals, queryJson);
        this.returnedEvidence = returnedEvidence;
        this.sourceCounts = ImmutableMap.copyOf(sourceCounts);
        this.droppedHashes = ImmutableList.copyOf(droppedHashes);
    }

    /**
     * Get the number of evidence objects returned across all statements.
     * @return the returned evidence count
     */
    public int getReturnedEvidence() {
        return returnedEvidence;
    }

    @Nonnull
    public Map<Long, Map<String, Integer>> getSourceCounts() {
        return sourceCounts;
    }

    /**
     * Get the fingerprints of the page that were left out because no content row was found for them, typically
     * because an evidence filter removed all of their evidence.
     * @return the dropped fingerprints, in page order
     */
    @Nonnull
    public List<Long> getDroppedHashes() {
        return droppedHashes;
    }

    @Nonnull
    @Override
    public JsonObject toJson() {
        final JsonObject json = super.toJson();
        json.addProperty("returned_evidence", returnedEvidence);
        json.add("source_counts", GSON.toJsonTree(sourceCounts));
        return json;
    }
}
