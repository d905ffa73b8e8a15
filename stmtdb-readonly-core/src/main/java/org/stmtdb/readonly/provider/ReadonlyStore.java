/*
 * ReadonlyStore.java
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
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.plan.HashQueryPlan;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to the denormalized statement tables. Implementations execute {@link HashQueryPlan}s and fetch the
 * content of the fingerprints they produce; they never write.
 *
 * <p>
 * Every method is blocking and independent of the others. A failure of the underlying storage is reported as a
 * {@link org.stmtdb.readonly.ReadonlyStoreException}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface ReadonlyStore {
    /**
     * Execute a plan and page through its distinct fingerprints. Rows are ordered by descending evidence count and
     * then fingerprint if {@link FetchProperties#isBestFirst()}, else by fingerprint, before the offset and limit of
     * the properties are applied.
     * @param plan the plan to execute
     * @param properties the paging properties; evidence properties are ignored
     * @return a page of fingerprints with their evidence counts
     */
    @Nonnull
    List<HashCount> fetchHashes(@Nonnull HashQueryPlan plan, @Nonnull FetchProperties properties);

    /**
     * Fetch the content rows of the given fingerprints.
     * @param hashes the fingerprints
     * @param evidenceLimit {@code null} for every evidence row, {@code 0} for a single row per fingerprint with no
     * raw statement, or else the maximum number of evidence rows per fingerprint, lowest raw statement id first
     * @param evidenceFilter a filter the evidence rows must pass before the limit is applied, or {@code null}
     * @return the content rows, grouped by fingerprint; fingerprints with no row passing the filter are absent
     */
    @Nonnull
    List<ContentRow> fetchContent(@Nonnull Collection<Long> hashes, @Nullable Integer evidenceLimit,
                                  @Nullable EvidenceFilter evidenceFilter);

    /**
     * Fetch the per-source evidence counts of the given fingerprints.
     * @param hashes the fingerprints
     * @return source name to count, for each fingerprint found
     */
    @Nonnull
    Map<Long, Map<String, Integer>> fetchSourceCounts(@Nonnull Collection<Long> hashes);

    /**
     * Fetch the named-agent mentions of the given fingerprints.
     * @param hashes the fingerprints
     * @return one row per agent position with a {@code NAME} grounding
     */
    @Nonnull
    List<AgentRow> fetchAgentRows(@Nonnull Collection<Long> hashes);
}
