/*
 * StatementQueryRunner.java
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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.logging.KeyValueLogMessage;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.Sources;
import org.stmtdb.readonly.metadata.StatementTypes;
import org.stmtdb.readonly.query.expressions.StatementQuery;
import org.stmtdb.readonly.query.plan.HashQueryPlan;
import org.stmtdb.readonly.query.plan.HashQueryPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Runs {@link StatementQuery} trees against a {@link ReadonlyStore}.
 *
 * <p>
 * Every entry point plans the query, fetches one page of fingerprints, and then fetches whatever else the result
 * needs for exactly those fingerprints. A statically empty query returns an empty result without touching the
 * store.
 * </p>
 *
 * <p>
 * Paging is by fingerprint: the next offset of a result is the offset plus the number of fingerprints in the page,
 * or {@code null} if there was no limit or the page came back short. Results that aggregate fingerprints page the
 * same way.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class StatementQueryRunner {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(StatementQueryRunner.class);

    @Nonnull
    private final ReadonlyStore store;
    @Nonnull
    private final HashQueryPlanner planner;

    public StatementQueryRunner(@Nonnull ReadonlyStore store) {
        this(store, new HashQueryPlanner());
    }

    public StatementQueryRunner(@Nonnull ReadonlyStore store, @Nonnull HashQueryPlanner planner) {
        this.store = store;
        this.planner = planner;
    }

    @Nonnull
    public ReadonlyStore getStore() {
        return store;
    }

    /**
     * Get the fingerprints of the statements matching a query.
     * @param query the query
     * @param properties the paging properties
     * @return the fingerprints in page order, with their evidence counts as evidence totals
     */
    @Nonnull
    public QueryResult<Long, List<Long>> getHashes(@Nonnull StatementQuery query, @Nonnull FetchProperties properties) {
        final List<HashCount> page = fetchPage(query, properties);
        final Map<Long, Integer> totals = new LinkedHashMap<>();
        for (HashCount hashCount : page) {
            totals.put(hashCount.getMkHash(), hashCount.getEvCount());
        }
        return new QueryResult<>(ImmutableList.copyOf(totals.keySet()), properties.getLimit(), properties.getOffset(),
                page.size(), totals, query.toJson());
    }

    /**
     * Get the statements matching a query, with their evidence.
     * @param query the query
     * @param properties the paging and evidence properties
     * @return the statement JSONs keyed by fingerprint, in page order
     */
    @Nonnull
    public StatementQueryResult getStatements(@Nonnull StatementQuery query, @Nonnull FetchProperties properties) {
        final List<HashCount> page = fetchPage(query, properties);
        if (page.isEmpty()) {
            return new StatementQueryResult(Collections.emptyMap(), properties.getLimit(), properties.getOffset(), 0,
                    Collections.emptyMap(), 0, Collections.emptyMap(), Collections.emptyList(), query.toJson());
        }
        final List<Long> hashes = hashesOf(page);
        final Integer evidenceLimit = properties.getEvidenceLimit();
        final List<ContentRow> rows = store.fetchContent(hashes, evidenceLimit, properties.getEvidenceFilter());
        final Map<Long, Map<String, Integer>> storedCounts = store.fetchSourceCounts(hashes);

        final Map<Long, List<ContentRow>> rowsByHash = new LinkedHashMap<>();
        for (ContentRow row : rows) {
            rowsByHash.computeIfAbsent(row.getMkHash(), h -> new ArrayList<>()).add(row);
        }

        final Map<Long, JsonObject> statements = new LinkedHashMap<>();
        final Map<Long, Integer> totals = new LinkedHashMap<>();
        final Map<Long, Map<String, Integer>> sourceCounts = new LinkedHashMap<>();
        final List<Long> dropped = new ArrayList<>();
        int returnedEvidence = 0;
        for (HashCount hashCount : page) {
            final long mkHash = hashCount.getMkHash();
            final List<ContentRow> hashRows = rowsByHash.get(mkHash);
            if (hashRows == null) {
                dropped.add(mkHash);
                continue;
            }
            final JsonObject statement = StatementJsonAssembler.statement(hashRows.get(0));
            if (evidenceLimit == null || evidenceLimit > 0) {
                final JsonArray evidence = statement.getAsJsonArray("evidence");
                for (ContentRow row : hashRows) {
                    if (row.getRawJson() != null) {
                        evidence.add(StatementJsonAssembler.evidence(row));
                        returnedEvidence++;
                    }
                }
            }
            statements.put(mkHash, statement);
            totals.put(mkHash, hashCount.getEvCount());
            sourceCounts.put(mkHash, withAllSources(storedCounts.get(mkHash)));
        }
        if (!dropped.isEmpty()) {
            LOGGER.warn(KeyValueLogMessage.of("statements dropped for lack of content, evidence filter too narrow?",
                    LogMessageKeys.QUERY, query,
                    LogMessageKeys.DROPPED_COUNT, dropped.size(),
                    LogMessageKeys.DROPPED_HASHES, dropped));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("fetched statements",
                    LogMessageKeys.RESULT_COUNT, statements.size(),
                    LogMessageKeys.ROW_COUNT, rows.size(),
                    LogMessageKeys.EVIDENCE_LIMIT, evidenceLimit));
        }
        return new StatementQueryResult(statements, properties.getLimit(), properties.getOffset(), page.size(),
                totals, returnedEvidence, sourceCounts, dropped, query.toJson());
    }

    /**
     * Get one interaction summary per statement matching a query: its named agents, type, activity and source
     * counts. Statements without any named agent are left out.
     * @param query the query
     * @param properties the paging properties
     * @return the interactions keyed by fingerprint
     */
    @Nonnull
    public QueryResult<Long, Map<Long, JsonObject>> getInteractions(@Nonnull StatementQuery query,
                                                                     @Nonnull FetchProperties properties) {
        final List<HashCount> page = fetchPage(query, properties);
        final Map<Long, JsonObject> results = new LinkedHashMap<>();
        final Map<Long, Integer> totals = new LinkedHashMap<>();
        for (Interaction interaction : interactions(page)) {
            final JsonObject json = new JsonObject();
            json.addProperty("hash", interaction.mkHash);
            json.addProperty("id", Long.toString(interaction.mkHash));
            json.add("agents", interaction.agentsJson());
            json.addProperty("type", interaction.getTypeName());
            json.addProperty("activity", interaction.activity);
            json.addProperty("is_active", interaction.isActive);
            json.add("source_counts", QueryResult.GSON.toJsonTree(interaction.sourceCounts));
            results.put(interaction.mkHash, json);
            totals.put(interaction.mkHash, sum(interaction.sourceCounts));
        }
        return new QueryResult<>(results, properties.getLimit(), properties.getOffset(), page.size(), totals,
                query.toJson());
    }

    /**
     * Get the relations among the statements matching a query. A relation groups the statements with the same type,
     * the same named agents in the same positions, and the same activity.
     * @param query the query
     * @param properties the paging properties
     * @param withHashes whether to list the fingerprints grouped into each relation
     * @return the relations keyed like {@code Phosphorylation(MEK, ERK)}
     */
    @Nonnull
    public QueryResult<String, Map<String, JsonObject>> getRelations(@Nonnull StatementQuery query,
                                                                     @Nonnull FetchProperties properties,
                                                                     boolean withHashes) {
        return aggregate(query, properties, withHashes, true);
    }

    /**
     * Get the agent groups among the statements matching a query, regardless of statement type.
     * @param query the query
     * @param properties the paging properties
     * @param withHashes whether to list the fingerprints grouped under each agent group
     * @return the agent groups keyed like {@code Agents(MEK, ERK)}
     */
    @Nonnull
    public QueryResult<String, Map<String, JsonObject>> getAgents(@Nonnull StatementQuery query,
                                                                  @Nonnull FetchProperties properties,
                                                                  boolean withHashes) {
        return aggregate(query, properties, withHashes, false);
    }

    @Nonnull
    private QueryResult<String, Map<String, JsonObject>> aggregate(@Nonnull StatementQuery query,
                                                                   @Nonnull FetchProperties properties,
                                                                   boolean withHashes, boolean byRelation) {
        final List<HashCount> page = fetchPage(query, properties);
        final Map<String, JsonObject> results = new LinkedHashMap<>();
        final Map<String, Map<String, Integer>> groupCounts = new LinkedHashMap<>();
        for (Interaction interaction : interactions(page)) {
            final String key = (byRelation ? interaction.getTypeName() : "Agents") + interaction.getAgentKey();
            JsonObject group = results.get(key);
            if (group == null) {
                group = new JsonObject();
                group.addProperty("id", key);
                group.add("agents", interaction.agentsJson());
                if (byRelation) {
                    group.addProperty("type", interaction.getTypeName());
                    group.addProperty("activity", interaction.activity);
                    group.addProperty("is_active", interaction.isActive);
                }
                group.add("hashes", withHashes ? new JsonArray() : null);
                results.put(key, group);
                groupCounts.put(key, new TreeMap<>());
            } else if (byRelation && !interaction.hasActivity(group)) {
                LOGGER.warn(KeyValueLogMessage.of("relation merges statements of different activity",
                        LogMessageKeys.RELATION, key,
                        LogMessageKeys.MK_HASH, interaction.mkHash));
            }
            if (withHashes) {
                group.getAsJsonArray("hashes").add(interaction.mkHash);
            }
            final Map<String, Integer> counts = groupCounts.get(key);
            interaction.sourceCounts.forEach((source, count) -> counts.merge(source, count, Integer::sum));
        }
        final Map<String, Integer> totals = new LinkedHashMap<>();
        for (Map.Entry<String, JsonObject> entry : results.entrySet()) {
            final Map<String, Integer> counts = groupCounts.get(entry.getKey());
            entry.getValue().add("source_counts", QueryResult.GSON.toJsonTree(counts));
            totals.put(entry.getKey(), sum(counts));
        }
        return new QueryResult<>(results, properties.getLimit(), properties.getOffset(), page.size(), totals,
                query.toJson());
    }

    @Nonnull
    private List<HashCount> fetchPage(@Nonnull StatementQuery query, @Nonnull FetchProperties properties) {
        if (query.isEmpty()) {
            return Collections.emptyList();
        }
        final HashQueryPlan plan = planner.plan(query);
        final List<HashCount> page = store.fetchHashes(plan, properties);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("fetched fingerprints",
                    LogMessageKeys.PLAN, plan,
                    LogMessageKeys.LIMIT, properties.getLimit(),
                    LogMessageKeys.OFFSET, properties.getOffset(),
                    LogMessageKeys.BEST_FIRST, properties.isBestFirst(),
                    LogMessageKeys.HASH_COUNT, page.size()));
        }
        return page;
    }

    @Nonnull
    private List<Interaction> interactions(@Nonnull List<HashCount> page) {
        if (page.isEmpty()) {
            return Collections.emptyList();
        }
        final List<Long> hashes = hashesOf(page);
        final Map<Long, Map<String, Integer>> sourceCounts = store.fetchSourceCounts(hashes);
        final Map<Long, Interaction> byHash = new LinkedHashMap<>();
        for (long mkHash : hashes) {
            byHash.put(mkHash, null);
        }
        for (AgentRow row : store.fetchAgentRows(hashes)) {
            Interaction interaction = byHash.get(row.getMkHash());
            if (interaction == null) {
                final Map<String, Integer> counts = sourceCounts.get(row.getMkHash());
                interaction = new Interaction(row, counts == null ? Collections.emptyMap() : counts);
                byHash.put(row.getMkHash(), interaction);
            }
            interaction.agents.put(row.getAgNum(), row.getDbId());
        }
        return byHash.values().stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    @Nonnull
    private static List<Long> hashesOf(@Nonnull List<HashCount> page) {
        return page.stream().map(HashCount::getMkHash).collect(ImmutableList.toImmutableList());
    }

    @Nonnull
    private static Map<String, Integer> withAllSources(@Nullable Map<String, Integer> counts) {
        final Map<String, Integer> all = new LinkedHashMap<>();
        for (String source : Sources.ALL) {
            all.put(source, 0);
        }
        if (counts != null) {
            all.putAll(counts);
        }
        return all;
    }

    private static int sum(@Nonnull Map<String, Integer> counts) {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * The named agents of one statement with its interaction metadata.
     */
    private static final class Interaction {
        private final long mkHash;
        private final int typeNum;
        private final int agentCount;
        @Nullable
        private final String activity;
        @Nullable
        private final Boolean isActive;
        @Nonnull
        private final Map<String, Integer> sourceCounts;
        @Nonnull
        private final Map<Integer, String> agents = new TreeMap<>();

        Interaction(@Nonnull AgentRow row, @Nonnull Map<String, Integer> sourceCounts) {
            this.mkHash = row.getMkHash();
            this.typeNum = row.getTypeNum();
            this.agentCount = row.getAgentCount();
            this.activity = row.getActivity();
            this.isActive = row.getIsActive();
            this.sourceCounts = sourceCounts;
        }

        @Nonnull
        String getTypeName() {
            return StatementTypes.byTypeNum(typeNum).getName();
        }

        /**
         * The agents in position order, with {@code None} for positions without a named agent.
         */
        @Nonnull
        String getAgentKey() {
            final List<String> ordered = new ArrayList<>(agentCount);
            for (int i = 0; i < agentCount; i++) {
                final String agent = agents.get(i);
                ordered.add(agent == null ? "None" : agent);
            }
            return "(" + String.join(", ", ordered) + ")";
        }

        @Nonnull
        JsonObject agentsJson() {
            final JsonObject json = new JsonObject();
            agents.forEach((agNum, dbId) -> json.addProperty(agNum.toString(), dbId));
            return json;
        }

        boolean hasActivity(@Nonnull JsonObject group) {
            final String groupActivity = group.get("activity").isJsonNull() ? null : group.get("activity").getAsString();
            final Boolean groupActive = group.get("is_active").isJsonNull() ? null : group.get("is_active").getAsBoolean();
            return Objects.equals(activity, groupActivity) && Objects.equals(isActive, groupActive);
        }
    }
}
