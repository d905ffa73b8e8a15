/*
 * JdbcReadonlyStoreTest.java
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

package org.stmtdb.readonly.jdbc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.ReadonlyStoreException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.AgentRole;
import org.stmtdb.readonly.metadata.Sources;
import org.stmtdb.readonly.provider.AgentRow;
import org.stmtdb.readonly.provider.ContentRow;
import org.stmtdb.readonly.provider.HashCount;
import org.stmtdb.readonly.provider.QueryResult;
import org.stmtdb.readonly.provider.StatementQueryResult;
import org.stmtdb.readonly.provider.StatementQueryRunner;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.expressions.Query;
import org.stmtdb.readonly.query.expressions.StatementQuery;
import org.stmtdb.readonly.query.plan.AllHashesPlan;

import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.stmtdb.readonly.jdbc.StatementFixture.ACT_BRAF_MEK;
import static org.stmtdb.readonly.jdbc.StatementFixture.ACT_MEK_ERK;
import static org.stmtdb.readonly.jdbc.StatementFixture.COMPLEX_DOI;
import static org.stmtdb.readonly.jdbc.StatementFixture.COMPLEX_MEK_ERK_RAF;
import static org.stmtdb.readonly.jdbc.StatementFixture.INH_ERK_RAF;
import static org.stmtdb.readonly.jdbc.StatementFixture.INH_MEK_RAF;
import static org.stmtdb.readonly.jdbc.StatementFixture.PHOS_MEK_ERK;
import static org.stmtdb.readonly.jdbc.StatementFixture.PHOS_NONE_ERK;
import static org.stmtdb.readonly.jdbc.StatementFixture.PHOS_RAF_MEK;

/**
 * Tests for {@link JdbcReadonlyStore} and the statement query runner over an in-memory H2 database.
 */
public class JdbcReadonlyStoreTest {
    private static JdbcDataSource dataSource;

    private JdbcReadonlyStore store;
    private StatementQueryRunner runner;

    @BeforeAll
    public static void loadFixture() throws SQLException {
        dataSource = StatementFixture.load(null);
    }

    @BeforeEach
    public void setUp() {
        store = new JdbcReadonlyStore(dataSource);
        runner = new StatementQueryRunner(store);
    }

    private List<Long> hashes(StatementQuery query) {
        return runner.getHashes(query, FetchProperties.NO_LIMITS).getResults();
    }

    private static List<Long> list(Long... hashes) {
        return ImmutableList.copyOf(hashes);
    }

    private static FetchProperties evidence(Integer evidenceLimit, EvidenceFilter filter) {
        return FetchProperties.newBuilder().setEvidenceLimit(evidenceLimit).setEvidenceFilter(filter).build();
    }

    @Test
    public void pagesBestFirst() {
        final FetchProperties firstPage = FetchProperties.newBuilder().setLimit(3).build();
        assertEquals(ImmutableList.of(new HashCount(ACT_BRAF_MEK, 6), new HashCount(PHOS_MEK_ERK, 5),
                new HashCount(PHOS_RAF_MEK, 4)), store.fetchHashes(AllHashesPlan.INSTANCE, firstPage));
        final List<HashCount> secondPage = store.fetchHashes(AllHashesPlan.INSTANCE,
                FetchProperties.newBuilder().setLimit(3).setOffset(3).build());
        assertEquals(ImmutableList.of(new HashCount(ACT_MEK_ERK, 3), new HashCount(INH_MEK_RAF, 2),
                new HashCount(INH_ERK_RAF, 2)), secondPage);
        assertEquals(2, store.fetchHashes(AllHashesPlan.INSTANCE,
                FetchProperties.newBuilder().setLimit(3).setOffset(6).build()).size());
    }

    @Test
    public void pagesByHash() {
        final FetchProperties properties = FetchProperties.newBuilder().setBestFirst(false).build();
        assertEquals(list(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L), runner.getHashes(
                Query.hasHash(Collections.emptyList()).invert(), properties).getResults());
    }

    @Test
    public void runnerReportsNextOffset() {
        final QueryResult<Long, List<Long>> first = runner.getHashes(Query.hasAgent("MEK"),
                FetchProperties.newBuilder().setLimit(4).build());
        assertEquals(list(ACT_BRAF_MEK, PHOS_MEK_ERK, PHOS_RAF_MEK, ACT_MEK_ERK), first.getResults());
        assertEquals(Integer.valueOf(4), first.getNextOffset());
        assertEquals(18L, first.getTotalEvidence());

        final QueryResult<Long, List<Long>> last = runner.getHashes(Query.hasAgent("MEK"),
                FetchProperties.newBuilder().setLimit(4).setOffset(4).build());
        assertEquals(list(INH_MEK_RAF, COMPLEX_MEK_ERK_RAF), last.getResults());
        assertNull(last.getNextOffset());
    }

    @Test
    public void agents() {
        assertEquals(list(ACT_BRAF_MEK, PHOS_MEK_ERK, PHOS_RAF_MEK, ACT_MEK_ERK, INH_MEK_RAF, COMPLEX_MEK_ERK_RAF),
                hashes(Query.hasAgent("MEK")));
        assertEquals(list(INH_ERK_RAF, PHOS_NONE_ERK), hashes(Query.not(Query.hasAgent("MEK"))));
        assertEquals(list(PHOS_MEK_ERK), hashes(Query.hasAgent("mek1", "TEXT")));
        assertEquals(list(INH_MEK_RAF), hashes(Query.hasAgent("6840", "hgnc")));
        assertTrue(hashes(Query.hasAgent("6840", "CHEBI")).isEmpty());
    }

    @Test
    public void agentRolesAndPositions() {
        assertEquals(list(PHOS_MEK_ERK, ACT_MEK_ERK, INH_MEK_RAF),
                hashes(Query.hasAgent("MEK", "NAME", AgentRole.SUBJECT)));
        assertEquals(list(ACT_BRAF_MEK, PHOS_RAF_MEK), hashes(Query.hasAgent("MEK", "NAME", AgentRole.OBJECT)));
        assertEquals(list(COMPLEX_MEK_ERK_RAF), hashes(Query.hasAgentAt("RAF", "NAME", 2)));
        assertEquals(list(PHOS_RAF_MEK), hashes(Query.hasAgentSpec("RAF", AgentRole.SUBJECT)));
    }

    @Test
    public void combinations() {
        assertEquals(list(PHOS_MEK_ERK, ACT_MEK_ERK, COMPLEX_MEK_ERK_RAF),
                hashes(Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK"))));
        assertEquals(list(ACT_BRAF_MEK, PHOS_RAF_MEK, INH_MEK_RAF, INH_ERK_RAF, COMPLEX_MEK_ERK_RAF),
                hashes(Query.or(Query.hasAgent("BRAF"), Query.hasAgent("RAF"))));
        assertEquals(list(ACT_BRAF_MEK, PHOS_RAF_MEK, INH_MEK_RAF, INH_ERK_RAF, PHOS_NONE_ERK),
                hashes(Query.not(Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK")))));
        assertEquals(list(PHOS_RAF_MEK, ACT_MEK_ERK),
                hashes(Query.and(Query.hasAgent("MEK"), Query.hasSources("reach"), Query.not(Query.hasAgent("BRAF")),
                        Query.not(Query.hasHash(PHOS_MEK_ERK)))));
    }

    @Test
    public void types() {
        assertEquals(list(PHOS_MEK_ERK, PHOS_RAF_MEK, PHOS_NONE_ERK), hashes(Query.hasType("Phosphorylation")));
        assertEquals(list(ACT_BRAF_MEK, ACT_MEK_ERK, INH_MEK_RAF, INH_ERK_RAF),
                hashes(Query.hasTypeOrSubtype("RegulateActivity")));
        assertEquals(list(ACT_BRAF_MEK, ACT_MEK_ERK, INH_MEK_RAF, INH_ERK_RAF, COMPLEX_MEK_ERK_RAF),
                hashes(Query.not(Query.hasType("Phosphorylation"))));
        assertEquals(list(ACT_BRAF_MEK, ACT_MEK_ERK),
                hashes(Query.and(Query.hasAgent("MEK"), Query.hasType("Activation"))));
        assertEquals(list(INH_ERK_RAF, PHOS_NONE_ERK),
                hashes(Query.and(Query.not(Query.hasAgent("MEK")), Query.hasType("Inhibition", "Phosphorylation"))));
    }

    @Test
    public void counts() {
        assertEquals(list(INH_MEK_RAF, INH_ERK_RAF), hashes(Query.hasNumEvidence(2)));
        assertEquals(list(COMPLEX_MEK_ERK_RAF), hashes(Query.hasNumAgents(3)));
        assertEquals(list(COMPLEX_MEK_ERK_RAF), hashes(Query.and(Query.hasAgent("ERK"), Query.hasNumAgents(3))));
    }

    @Test
    public void sources() {
        assertEquals(list(ACT_BRAF_MEK, PHOS_MEK_ERK, PHOS_RAF_MEK, ACT_MEK_ERK, PHOS_NONE_ERK),
                hashes(Query.hasSources("reach")));
        assertEquals(list(ACT_MEK_ERK), hashes(Query.hasSources("reach", "signor")));
        assertEquals(list(INH_MEK_RAF, INH_ERK_RAF, COMPLEX_MEK_ERK_RAF), hashes(Query.not(Query.hasSources("reach"))));
        assertEquals(list(PHOS_RAF_MEK, PHOS_NONE_ERK), hashes(Query.hasOnlySource("reach")));
        assertEquals(list(ACT_BRAF_MEK, ACT_MEK_ERK, INH_MEK_RAF), hashes(Query.hasDatabases()));
        assertEquals(list(INH_MEK_RAF), hashes(Query.not(Query.hasReadings())));
    }

    @Test
    public void meshIds() {
        assertEquals(list(PHOS_MEK_ERK, PHOS_RAF_MEK), hashes(Query.fromMeshId("D1000")));
        assertEquals(list(ACT_MEK_ERK), hashes(Query.fromMeshId("C5")));
        assertEquals(list(ACT_BRAF_MEK, ACT_MEK_ERK, INH_MEK_RAF, INH_ERK_RAF, COMPLEX_MEK_ERK_RAF, PHOS_NONE_ERK),
                hashes(Query.not(Query.fromMeshId("D1000"))));
    }

    @Test
    public void papers() {
        assertEquals(list(PHOS_MEK_ERK, PHOS_RAF_MEK), hashes(Query.fromPaper("pmid", "111")));
        assertEquals(list(PHOS_MEK_ERK, INH_ERK_RAF), hashes(Query.fromPaper("trid", "1012")));
        assertEquals(list(COMPLEX_MEK_ERK_RAF), hashes(Query.fromPaper("doi", COMPLEX_DOI)));
        assertEquals(list(PHOS_RAF_MEK), hashes(Query.and(Query.fromPaper("pmid", "111"), Query.hasAgent("RAF"))));
        assertEquals(list(PHOS_MEK_ERK), hashes(Query.and(Query.fromPaper("pmid", "111"), Query.hasNumEvidence(5))));
    }

    @Test
    public void invertedPapersMatchAnyOtherReading() {
        // statements without reading evidence, or whose only reading has no pmid, do not match
        assertEquals(list(ACT_BRAF_MEK, PHOS_MEK_ERK, PHOS_RAF_MEK, ACT_MEK_ERK, INH_ERK_RAF, PHOS_NONE_ERK),
                hashes(Query.not(Query.fromPaper("pmid", "111"))));
    }

    @Test
    public void hashes() {
        assertEquals(list(PHOS_RAF_MEK, INH_MEK_RAF), hashes(Query.hasHash(INH_MEK_RAF, PHOS_RAF_MEK, 99L)));
        assertTrue(hashes(Query.hasHash(99L)).isEmpty());
    }

    @Test
    public void statementsWithAllEvidence() {
        final StatementQueryResult result = runner.getStatements(Query.hasHash(PHOS_MEK_ERK), FetchProperties.NO_LIMITS);
        assertEquals(3, result.getReturnedEvidence());
        final JsonObject statement = result.getResults().get(PHOS_MEK_ERK);
        assertEquals("Phosphorylation", statement.get("type").getAsString());
        assertEquals("pa-1", statement.get("id").getAsString());

        final JsonArray evidence = statement.getAsJsonArray("evidence");
        assertEquals(3, evidence.size());
        final JsonObject first = evidence.get(0).getAsJsonObject();
        assertEquals("reach", first.get("source_api").getAsString());
        assertEquals("111", first.get("pmid").getAsString());
        assertEquals(1011L, first.getAsJsonObject("text_refs").get("TRID").getAsLong());
        final JsonObject annotations = first.getAsJsonObject("annotations");
        assertEquals("pubmed", annotations.get("content_source").getAsString());
        assertEquals("raw-101", annotations.getAsJsonArray("prior_uuids").get(0).getAsString());
        final JsonArray rawText = annotations.getAsJsonObject("agents").getAsJsonArray("raw_text");
        assertEquals("mek", rawText.get(0).getAsString());
        assertEquals("erk", rawText.get(1).getAsString());

        assertEquals("222", evidence.get(1).getAsJsonObject().get("pmid").getAsString());
    }

    @Test
    public void databaseEvidenceHasNoPaper() {
        final StatementQueryResult result = runner.getStatements(Query.hasHash(ACT_MEK_ERK), FetchProperties.NO_LIMITS);
        final JsonArray evidence = result.getResults().get(ACT_MEK_ERK).getAsJsonArray("evidence");
        assertEquals(2, evidence.size());
        final JsonObject signor = evidence.get(1).getAsJsonObject();
        assertEquals("signor", signor.get("source_api").getAsString());
        assertFalse(signor.has("pmid"));
        assertEquals(0, signor.getAsJsonObject("text_refs").size());
    }

    @Test
    public void evidenceLimits() {
        final StatementQueryResult limited = runner.getStatements(Query.hasAgent("ERK"), evidence(1, null));
        assertEquals(5, limited.getResults().size());
        assertEquals(5, limited.getReturnedEvidence());
        assertEquals("raw-101", limited.getResults().get(PHOS_MEK_ERK).getAsJsonArray("evidence").get(0)
                .getAsJsonObject().getAsJsonObject("annotations").getAsJsonArray("prior_uuids").get(0).getAsString());

        final StatementQueryResult none = runner.getStatements(Query.hasAgent("ERK"), evidence(0, null));
        assertThat(none.getResults().keySet(), contains(PHOS_MEK_ERK, ACT_MEK_ERK, INH_ERK_RAF, COMPLEX_MEK_ERK_RAF,
                PHOS_NONE_ERK));
        assertEquals(0, none.getReturnedEvidence());
        assertEquals(0, none.getResults().get(PHOS_MEK_ERK).getAsJsonArray("evidence").size());
        assertEquals(12L, none.getTotalEvidence());
    }

    @Test
    public void storeDropsRawStatementsForZeroLimit() {
        final List<ContentRow> rows = store.fetchContent(ImmutableList.of(PHOS_MEK_ERK, ACT_MEK_ERK), 0, null);
        assertEquals(2, rows.size());
        for (ContentRow row : rows) {
            assertNull(row.getRawId());
            assertNull(row.getRawJson());
        }
    }

    @Test
    public void evidenceFilterAppliesBeforeLimit() {
        final EvidenceFilter fromSecondPaper = Query.fromPaper("pmid", "222").getEvidenceFilter();
        final StatementQueryResult result = runner.getStatements(Query.hasHash(PHOS_MEK_ERK, PHOS_RAF_MEK),
                evidence(1, fromSecondPaper));
        assertThat(result.getResults().keySet(), contains(PHOS_MEK_ERK));
        assertEquals(list(PHOS_RAF_MEK), result.getDroppedHashes());
        final JsonObject only = result.getResults().get(PHOS_MEK_ERK).getAsJsonArray("evidence").get(0)
                .getAsJsonObject();
        assertEquals("222", only.get("pmid").getAsString());
    }

    @Test
    public void droppedHashesStillAdvanceOffset() {
        final FetchProperties properties = FetchProperties.newBuilder().setLimit(2)
                .setEvidenceFilter(Query.fromPaper("pmid", "222").getEvidenceFilter()).build();
        final StatementQueryResult result = runner.getStatements(Query.hasHash(PHOS_MEK_ERK, PHOS_RAF_MEK), properties);
        assertThat(result.getResults().keySet(), contains(PHOS_MEK_ERK));
        assertEquals(list(PHOS_RAF_MEK), result.getDroppedHashes());
        assertEquals(Integer.valueOf(2), result.getNextOffset());
    }

    @Test
    public void evidenceFilters() {
        assertEquals(1, runner.getStatements(Query.hasHash(PHOS_MEK_ERK),
                evidence(null, Query.fromMeshId("D1000").getEvidenceFilter())).getReturnedEvidence());
        assertEquals(2, runner.getStatements(Query.hasHash(PHOS_MEK_ERK),
                evidence(null, Query.hasSources("reach").getEvidenceFilter())).getReturnedEvidence());
        assertEquals(1, runner.getStatements(Query.hasHash(PHOS_MEK_ERK),
                evidence(null, Query.fromPaper("pmid", "111").invert().getEvidenceFilter())).getReturnedEvidence());
        final EvidenceFilter either = Query.fromPaper("pmid", "222").getEvidenceFilter()
                .or(Query.fromMeshId("D1000").getEvidenceFilter());
        assertEquals(2, runner.getStatements(Query.hasHash(PHOS_MEK_ERK), evidence(null, either))
                .getReturnedEvidence());
        final EvidenceFilter both = Query.hasSources("reach").getEvidenceFilter()
                .and(Query.fromMeshId("D1000").invert().getEvidenceFilter());
        assertEquals(1, runner.getStatements(Query.hasHash(PHOS_MEK_ERK), evidence(null, both))
                .getReturnedEvidence());
    }

    @Test
    public void invertedPaperFilterSkipsEvidenceWithoutReading() {
        final StatementQueryResult otherPaper = runner.getStatements(Query.hasHash(ACT_MEK_ERK),
                evidence(null, Query.fromPaper("pmid", "111").invert().getEvidenceFilter()));
        assertEquals(1, otherPaper.getReturnedEvidence());
        final JsonArray evidence = otherPaper.getResults().get(ACT_MEK_ERK).getAsJsonArray("evidence");
        assertEquals("333", evidence.get(0).getAsJsonObject().get("pmid").getAsString());

        final StatementQueryResult samePaper = runner.getStatements(Query.hasHash(ACT_MEK_ERK, COMPLEX_MEK_ERK_RAF),
                evidence(null, Query.fromPaper("pmid", "333").invert().getEvidenceFilter()));
        assertTrue(samePaper.getResults().isEmpty());
        assertThat(samePaper.getDroppedHashes(), containsInAnyOrder(ACT_MEK_ERK, COMPLEX_MEK_ERK_RAF));
    }

    @Test
    public void sourceCounts() {
        final StatementQueryResult result = runner.getStatements(Query.hasHash(ACT_MEK_ERK), evidence(0, null));
        final Map<String, Integer> counts = result.getSourceCounts().get(ACT_MEK_ERK);
        assertEquals(Sources.ALL.size(), counts.size());
        assertThat(counts, hasEntry("reach", 1));
        assertThat(counts, hasEntry("signor", 2));
        assertThat(counts, hasEntry("sparser", 0));
        assertEquals(ImmutableMap.of("biopax", 4, "reach", 2),
                store.fetchSourceCounts(ImmutableList.of(ACT_BRAF_MEK)).get(ACT_BRAF_MEK));
    }

    @Test
    public void agentRows() {
        final List<AgentRow> rows = store.fetchAgentRows(ImmutableList.of(PHOS_NONE_ERK, COMPLEX_MEK_ERK_RAF));
        assertEquals(4, rows.size());
        assertEquals("MEK", rows.get(0).getDbId());
        assertEquals(COMPLEX_MEK_ERK_RAF, rows.get(2).getMkHash());
        final AgentRow erk = rows.get(3);
        assertEquals(PHOS_NONE_ERK, erk.getMkHash());
        assertEquals(1, erk.getAgNum());
        assertEquals(2, erk.getAgentCount());
        assertNull(erk.getIsActive());
    }

    @Test
    public void relations() {
        final QueryResult<String, Map<String, JsonObject>> result =
                runner.getRelations(Query.hasAgent("ERK"), FetchProperties.NO_LIMITS, true);
        assertThat(result.getResults().keySet(), contains("Phosphorylation(MEK, ERK)", "Activation(MEK, ERK)",
                "Inhibition(ERK, RAF)", "Complex(MEK, ERK, RAF)", "Phosphorylation(None, ERK)"));
        final JsonObject activation = result.getResults().get("Activation(MEK, ERK)");
        assertEquals("kinase", activation.get("activity").getAsString());
        assertTrue(activation.get("is_active").getAsBoolean());
        assertEquals(ACT_MEK_ERK, activation.getAsJsonArray("hashes").get(0).getAsLong());
        assertEquals(Integer.valueOf(3), result.getEvidenceTotals().get("Activation(MEK, ERK)"));
        assertEquals(12L, result.getTotalEvidence());
    }

    @Test
    public void agentGroups() {
        final QueryResult<String, Map<String, JsonObject>> result =
                runner.getAgents(Query.hasAgent("MEK"), FetchProperties.NO_LIMITS, true);
        assertThat(result.getResults().keySet(), contains("Agents(BRAF, MEK)", "Agents(MEK, ERK)",
                "Agents(RAF, MEK)", "Agents(MEK, RAF)", "Agents(MEK, ERK, RAF)"));
        final JsonObject mekErk = result.getResults().get("Agents(MEK, ERK)");
        assertEquals(2, mekErk.getAsJsonArray("hashes").size());
        assertEquals(4, mekErk.getAsJsonObject("source_counts").get("reach").getAsInt());
        assertEquals(Integer.valueOf(8), result.getEvidenceTotals().get("Agents(MEK, ERK)"));
    }

    @Test
    public void interactions() {
        final QueryResult<Long, Map<Long, JsonObject>> result =
                runner.getInteractions(Query.hasHash(ACT_BRAF_MEK), FetchProperties.NO_LIMITS);
        final JsonObject interaction = result.getResults().get(ACT_BRAF_MEK);
        assertEquals("Activation", interaction.get("type").getAsString());
        assertEquals("BRAF", interaction.getAsJsonObject("agents").get("0").getAsString());
        assertEquals("MEK", interaction.getAsJsonObject("agents").get("1").getAsString());
        assertEquals(4, interaction.getAsJsonObject("source_counts").get("biopax").getAsInt());
        assertEquals(Integer.valueOf(6), result.getEvidenceTotals().get(ACT_BRAF_MEK));
    }

    @Test
    public void emptyHashCollections() {
        assertThat(store.fetchContent(Collections.emptyList(), null, null), empty());
        assertTrue(store.fetchSourceCounts(Collections.emptyList()).isEmpty());
        assertThat(store.fetchAgentRows(Collections.emptyList()), empty());
    }

    @Test
    public void schemaQualifiedTables() throws SQLException {
        final JdbcReadonlyStore qualified = new JdbcReadonlyStore(StatementFixture.load("ro_store"),
                JdbcStoreConfiguration.builder().setSchema("ro_store").setFetchSize(100).setQueryTimeoutSeconds(5).build());
        final StatementQueryRunner qualifiedRunner = new StatementQueryRunner(qualified);
        assertEquals(list(PHOS_MEK_ERK, ACT_MEK_ERK, COMPLEX_MEK_ERK_RAF),
                qualifiedRunner.getHashes(Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK")),
                        FetchProperties.NO_LIMITS).getResults());
        assertEquals(1, qualifiedRunner.getStatements(Query.fromPaper("pmid", "444"), FetchProperties.NO_LIMITS)
                .getResults().size());
    }

    @Test
    public void missingTablesFailWithContext() {
        final JdbcReadonlyStore missing = new JdbcReadonlyStore(dataSource,
                JdbcStoreConfiguration.builder().setSchema("missing").build());
        final ReadonlyStoreException e = assertThrows(ReadonlyStoreException.class,
                () -> missing.fetchHashes(AllHashesPlan.INSTANCE, FetchProperties.NO_LIMITS));
        assertTrue(e.getCause() instanceof SQLException);
        assertTrue(e.getLogInfo().containsKey(LogMessageKeys.SQL.toString()));
        assertEquals("missing", e.getLogInfo().get(LogMessageKeys.SCHEMA.toString()));
    }
}
