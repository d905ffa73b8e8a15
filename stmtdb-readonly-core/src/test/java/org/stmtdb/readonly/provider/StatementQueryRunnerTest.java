/*
 * StatementQueryRunnerTest.java
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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.metadata.StatementTypes;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.expressions.Query;
import org.stmtdb.readonly.query.expressions.StatementQuery;
import org.stmtdb.readonly.query.plan.HashQueryPlan;
import org.stmtdb.readonly.query.plan.HashQueryPlanner;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link StatementQueryRunner} against a mocked store.
 */
public class StatementQueryRunnerTest {
    private static final StatementQuery QUERY = Query.hasAgent("MEK").and(Query.hasType("Phosphorylation"));
    private static final int PHOSPHORYLATION = StatementTypes.byName("Phosphorylation").getTypeNum();

    private ReadonlyStore store;
    private StatementQueryRunner runner;

    @BeforeEach
    public void setUp() {
        store = mock(ReadonlyStore.class);
        runner = new StatementQueryRunner(store);
    }

    private void page(HashCount... hashCounts) {
        when(store.fetchHashes(any(HashQueryPlan.class), any(FetchProperties.class)))
                .thenReturn(ImmutableList.copyOf(hashCounts));
    }

    private static ContentRow row(long mkHash, long rawId) {
        return new ContentRow(mkHash, rawId, StatementJsonAssemblerTest.RAW_JSON, StatementJsonAssemblerTest.PA_JSON,
                ReadingRef.newBuilder().setPmid(Long.toString(rawId)).build());
    }

    @Test
    public void emptyQueryNeverTouchesStore() {
        final StatementQuery empty = Query.hasAgent("MEK").and(Query.hasHash(Collections.emptyList()));
        final StatementQueryResult result = runner.getStatements(empty, FetchProperties.newBuilder().setLimit(10).build());
        assertTrue(result.getResults().isEmpty());
        assertNull(result.getNextOffset());
        assertEquals(0L, result.getTotalEvidence());
        assertTrue(runner.getRelations(empty, FetchProperties.NO_LIMITS, true).getResults().isEmpty());
        verifyNoInteractions(store);
    }

    @Test
    public void plansWithGivenPlanner() {
        final HashQueryPlanner planner = new HashQueryPlanner();
        final StatementQueryRunner planned = new StatementQueryRunner(store, planner);
        page(new HashCount(1L, 3));
        final FetchProperties properties = FetchProperties.newBuilder().setLimit(5).setBestFirst(false).build();
        final QueryResult<Long, List<Long>> result = planned.getHashes(QUERY, properties);
        verify(store).fetchHashes(planner.plan(QUERY), properties);
        assertEquals(ImmutableList.of(1L), result.getResults());
        assertEquals(ImmutableMap.of(1L, 3), result.getEvidenceTotals());
        assertNull(result.getNextOffset());
    }

    @Test
    public void hashesPageForward() {
        page(new HashCount(4L, 9), new HashCount(2L, 5));
        final QueryResult<Long, List<Long>> result = runner.getHashes(QUERY,
                FetchProperties.newBuilder().setLimit(2).setOffset(6).build());
        assertEquals(ImmutableList.of(4L, 2L), result.getResults());
        assertEquals(Integer.valueOf(8), result.getNextOffset());
        assertEquals(14L, result.getTotalEvidence());
        assertEquals(QUERY.toJson(), result.toJson().get("query"));
    }

    @Test
    public void statementsWithEvidence() {
        page(new HashCount(1L, 3), new HashCount(2L, 1), new HashCount(3L, 2));
        when(store.fetchContent(anyCollection(), isNull(), isNull()))
                .thenReturn(ImmutableList.of(row(1L, 10L), row(1L, 11L), row(2L, 20L)));
        when(store.fetchSourceCounts(anyCollection()))
                .thenReturn(ImmutableMap.of(1L, ImmutableMap.of("reach", 2, "signor", 1), 2L, ImmutableMap.of("reach", 1)));

        final StatementQueryResult result = runner.getStatements(QUERY, FetchProperties.newBuilder().setLimit(3).build());
        verify(store).fetchContent(eq(ImmutableList.of(1L, 2L, 3L)), isNull(), isNull());

        assertThat(result.getResults().keySet(), contains(1L, 2L));
        assertEquals(ImmutableList.of(3L), result.getDroppedHashes());
        // Dropped fingerprints still count towards the page.
        assertEquals(Integer.valueOf(3), result.getNextOffset());
        assertEquals(3, result.getReturnedEvidence());
        assertEquals(ImmutableMap.of(1L, 3, 2L, 1), result.getEvidenceTotals());

        final JsonArray evidence = result.getResults().get(1L).getAsJsonArray("evidence");
        assertEquals(2, evidence.size());
        assertEquals("10", evidence.get(0).getAsJsonObject().get("pmid").getAsString());
        assertEquals("11", evidence.get(1).getAsJsonObject().get("pmid").getAsString());

        final Map<String, Integer> counts = result.getSourceCounts().get(1L);
        assertEquals(Integer.valueOf(2), counts.get("reach"));
        assertEquals(Integer.valueOf(1), counts.get("signor"));
        assertEquals(Integer.valueOf(0), counts.get("sparser"));

        final JsonObject json = result.toJson();
        assertEquals(3, json.get("returned_evidence").getAsInt());
        assertEquals(4L, json.get("total_evidence").getAsLong());
        assertTrue(json.getAsJsonObject("results").has("1"));
    }

    @Test
    public void noEvidenceRequested() {
        final FetchProperties properties = FetchProperties.newBuilder().setEvidenceLimit(0).build();
        page(new HashCount(1L, 3));
        when(store.fetchContent(anyCollection(), eq(0), isNull()))
                .thenReturn(ImmutableList.of(new ContentRow(1L, null, null, StatementJsonAssemblerTest.PA_JSON, null)));
        when(store.fetchSourceCounts(anyCollection())).thenReturn(ImmutableMap.of());

        final StatementQueryResult result = runner.getStatements(QUERY, properties);
        assertEquals(0, result.getResults().get(1L).getAsJsonArray("evidence").size());
        assertEquals(0, result.getReturnedEvidence());
        assertNull(result.getNextOffset());
    }

    @Test
    public void evidenceFilterIsPassedThrough() {
        final EvidenceFilter filter = Query.hasSources("reach").getEvidenceFilter();
        final FetchProperties properties = FetchProperties.newBuilder().setEvidenceLimit(2).setEvidenceFilter(filter).build();
        page(new HashCount(5L, 1));
        when(store.fetchContent(anyCollection(), eq(2), eq(filter))).thenReturn(ImmutableList.of());
        when(store.fetchSourceCounts(anyCollection())).thenReturn(ImmutableMap.of());

        final StatementQueryResult result = runner.getStatements(QUERY, properties);
        assertTrue(result.getResults().isEmpty());
        assertEquals(ImmutableList.of(5L), result.getDroppedHashes());
        verify(store, never()).fetchAgentRows(anyCollection());
    }

    private void agents() {
        page(new HashCount(1L, 2), new HashCount(2L, 2), new HashCount(3L, 1), new HashCount(4L, 1));
        when(store.fetchSourceCounts(anyCollection())).thenReturn(ImmutableMap.of(
                1L, ImmutableMap.of("reach", 2),
                2L, ImmutableMap.of("reach", 1, "signor", 1),
                3L, ImmutableMap.of("sparser", 1)));
        when(store.fetchAgentRows(anyCollection())).thenReturn(ImmutableList.of(
                new AgentRow(1L, 0, "MEK", PHOSPHORYLATION, 2, null, null),
                new AgentRow(1L, 1, "ERK", PHOSPHORYLATION, 2, null, null),
                new AgentRow(2L, 1, "ERK", PHOSPHORYLATION, 2, null, null),
                new AgentRow(2L, 0, "MEK", PHOSPHORYLATION, 2, null, null),
                new AgentRow(3L, 0, "MEK", PHOSPHORYLATION, 2, null, null)));
    }

    @Test
    public void interactions() {
        agents();
        final QueryResult<Long, Map<Long, JsonObject>> result = runner.getInteractions(QUERY, FetchProperties.NO_LIMITS);
        // Fingerprint 4 has no named agent.
        assertThat(result.getResults().keySet(), contains(1L, 2L, 3L));
        final JsonObject interaction = result.getResults().get(2L);
        assertEquals("2", interaction.get("id").getAsString());
        assertEquals(JsonParser.parseString("{\"0\": \"MEK\", \"1\": \"ERK\"}"), interaction.get("agents"));
        assertEquals("Phosphorylation", interaction.get("type").getAsString());
        assertTrue(interaction.get("activity").isJsonNull());
        assertEquals(Integer.valueOf(2), result.getEvidenceTotals().get(2L));
    }

    @Test
    public void relations() {
        agents();
        final QueryResult<String, Map<String, JsonObject>> result = runner.getRelations(QUERY,
                FetchProperties.newBuilder().setLimit(4).build(), true);
        assertThat(result.getResults().keySet(), contains("Phosphorylation(MEK, ERK)", "Phosphorylation(MEK, None)"));
        final JsonObject relation = result.getResults().get("Phosphorylation(MEK, ERK)");
        assertEquals(JsonParser.parseString("[1, 2]"), relation.get("hashes"));
        assertEquals(JsonParser.parseString("{\"reach\": 3, \"signor\": 1}"), relation.get("source_counts"));
        assertEquals(Integer.valueOf(4), result.getEvidenceTotals().get("Phosphorylation(MEK, ERK)"));
        // Paging counts fingerprints, not relations.
        assertEquals(Integer.valueOf(4), result.getNextOffset());
    }

    @Test
    public void agentGroupsWithoutHashes() {
        agents();
        final QueryResult<String, Map<String, JsonObject>> result = runner.getAgents(QUERY, FetchProperties.NO_LIMITS, false);
        assertThat(result.getResults().keySet(), contains("Agents(MEK, ERK)", "Agents(MEK, None)"));
        final JsonObject group = result.getResults().get("Agents(MEK, ERK)");
        assertTrue(group.get("hashes").isJsonNull());
        assertFalse(group.has("type"));
        assertEquals(5L, result.getTotalEvidence());
    }

    @Test
    public void relationsMergeDifferentActivity() {
        page(new HashCount(1L, 1), new HashCount(2L, 1));
        final int activation = StatementTypes.byName("Activation").getTypeNum();
        when(store.fetchSourceCounts(anyCollection())).thenReturn(ImmutableMap.of(
                1L, ImmutableMap.of("reach", 1), 2L, ImmutableMap.of("reach", 4)));
        when(store.fetchAgentRows(anyCollection())).thenReturn(ImmutableList.of(
                new AgentRow(1L, 0, "MEK", activation, 2, "kinase", true),
                new AgentRow(1L, 1, "ERK", activation, 2, "kinase", true),
                new AgentRow(2L, 0, "MEK", activation, 2, null, null),
                new AgentRow(2L, 1, "ERK", activation, 2, null, null)));
        final QueryResult<String, Map<String, JsonObject>> result = runner.getRelations(QUERY, FetchProperties.NO_LIMITS, false);
        final JsonObject relation = result.getResults().get("Activation(MEK, ERK)");
        assertEquals("kinase", relation.get("activity").getAsString());
        assertEquals(5, relation.getAsJsonObject("source_counts").get("reach").getAsInt());
    }
}
