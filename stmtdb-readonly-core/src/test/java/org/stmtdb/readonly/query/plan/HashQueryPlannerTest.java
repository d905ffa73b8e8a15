/*
 * HashQueryPlannerTest.java
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

package org.stmtdb.readonly.query.plan;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.MalformedQueryException;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.expressions.HasType;
import org.stmtdb.readonly.query.expressions.Query;
import org.stmtdb.readonly.query.expressions.QueryJson;
import org.stmtdb.readonly.query.expressions.SourceIntersection;
import org.stmtdb.readonly.query.expressions.StatementQuery;
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link HashQueryPlanner}.
 */
public class HashQueryPlannerTest {
    private static final HasType PHOSPHORYLATION = Query.hasType("Phosphorylation");

    private final HashQueryPlanner planner = new HashQueryPlanner();

    private static FilterPredicate mek(ReadonlyTable table) {
        return ColumnPredicate.like(table, ReadonlyColumns.DB_ID, "MEK");
    }

    private static RelationScanPlan scan(ReadonlyTable table, FilterPredicate predicate) {
        return new RelationScanPlan(table, predicate);
    }

    @Test
    public void staticQueries() {
        assertSame(EmptyHashesPlan.INSTANCE, planner.plan(Query.hasHash(Collections.emptyList())));
        assertSame(AllHashesPlan.INSTANCE, planner.plan(Query.hasHash(Collections.emptyList()).invert()));
        assertEquals(scan(ReadonlyTable.SOURCE_META, PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META)),
                planner.plan(Query.hasHash(Collections.emptyList()).invert(), ImmutableList.of(PHOSPHORYLATION)));
    }

    @Test
    public void rebuiltContradictionIsNotScanned() {
        final StatementQuery both = Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK"));
        final StatementQuery rebuilt = QueryJson.fromJson(both.and(both.invert()).toJsonString());
        assertSame(EmptyHashesPlan.INSTANCE, planner.plan(rebuilt));
    }

    @Test
    public void sourceLeaves() {
        assertEquals(scan(ReadonlyTable.SOURCE_META,
                        ColumnPredicate.equalTo(ReadonlyTable.SOURCE_META, ReadonlyColumns.HAS_RD, true)),
                planner.plan(Query.hasReadings()));
        final StatementQuery sources = Query.hasSources("reach").and(Query.hasDatabases());
        assertEquals(scan(ReadonlyTable.SOURCE_META, ((SourceIntersection)sources).getPredicate()),
                planner.plan(sources));
    }

    @Test
    public void agentScansMentionTable() {
        assertEquals(scan(ReadonlyTable.NAME_META, mek(ReadonlyTable.NAME_META)), planner.plan(Query.hasAgent("MEK")));
        assertEquals(scan(ReadonlyTable.OTHER_META, AndPredicate.of(
                        ColumnPredicate.like(ReadonlyTable.OTHER_META, ReadonlyColumns.DB_ID, "6840"),
                        ColumnPredicate.like(ReadonlyTable.OTHER_META, ReadonlyColumns.DB_NAME, "HGNC"))),
                planner.plan(Query.hasAgent("6840", "HGNC")));
    }

    @Test
    public void invertedAgentSubtractsFromPopulation() {
        assertEquals(new ExceptPlan(AllHashesPlan.INSTANCE, scan(ReadonlyTable.NAME_META, mek(ReadonlyTable.NAME_META))),
                planner.plan(Query.hasAgent("MEK").invert()));

        // The population is restricted by the cross-cutting constraint; the subtracted scan is not.
        final HashQueryPlan plan = planner.plan(Query.hasAgent("MEK").invert().and(PHOSPHORYLATION));
        assertEquals(new ExceptPlan(
                        scan(ReadonlyTable.SOURCE_META, PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META)),
                        scan(ReadonlyTable.NAME_META, mek(ReadonlyTable.NAME_META))),
                plan);
    }

    @Test
    public void meshScans() {
        assertEquals(scan(ReadonlyTable.MESH_TERM_META,
                        ColumnPredicate.equalTo(ReadonlyTable.MESH_TERM_META, ReadonlyColumns.MESH_NUM, 123L)),
                planner.plan(Query.fromMeshId("D000123")));
        final HashQueryPlan inverted = planner.plan(Query.fromMeshId("C5").invert());
        assertThat(inverted, instanceOf(ExceptPlan.class));
        assertEquals(scan(ReadonlyTable.MESH_CONCEPT_META,
                        ColumnPredicate.equalTo(ReadonlyTable.MESH_CONCEPT_META, ReadonlyColumns.MESH_NUM, 5L)),
                ((ExceptPlan)inverted).getSubtracted());
    }

    @Test
    public void crossCuttingConstraintIsInjected() {
        assertEquals(scan(ReadonlyTable.NAME_META, AndPredicate.of(mek(ReadonlyTable.NAME_META),
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.NAME_META))),
                planner.plan(Query.hasAgent("MEK").and(PHOSPHORYLATION)));

        final HashQueryPlan plan = planner.plan(Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK"), PHOSPHORYLATION));
        assertThat(plan, instanceOf(IntersectionPlan.class));
        assertThat(((IntersectionPlan)plan).getChildren(), containsInAnyOrder(
                scan(ReadonlyTable.NAME_META, AndPredicate.of(mek(ReadonlyTable.NAME_META),
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.NAME_META))),
                scan(ReadonlyTable.NAME_META, AndPredicate.of(
                        ColumnPredicate.like(ReadonlyTable.NAME_META, ReadonlyColumns.DB_ID, "ERK"),
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.NAME_META)))));
    }

    @Test
    public void onlyCrossCuttingConstraints() {
        final StatementQuery query = PHOSPHORYLATION.and(Query.hasNumEvidence(1, 2));
        final HashQueryPlan plan = planner.plan(query);
        assertThat(plan, instanceOf(RelationScanPlan.class));
        final RelationScanPlan scan = (RelationScanPlan)plan;
        assertSame(ReadonlyTable.SOURCE_META, scan.getTable());
        assertThat(((AndPredicate)scan.getPredicate()).getChildren(), containsInAnyOrder(
                PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META),
                Query.hasNumEvidence(1, 2).getPredicate(ReadonlyTable.SOURCE_META)));
    }

    @Test
    public void unionPlansEachOption() {
        final HashQueryPlan plan = planner.plan(Query.hasAgent("MEK").or(Query.hasSources("reach")));
        assertThat(plan, instanceOf(UnionPlan.class));
        assertThat(((UnionPlan)plan).getChildren(), containsInAnyOrder(
                scan(ReadonlyTable.NAME_META, mek(ReadonlyTable.NAME_META)),
                scan(ReadonlyTable.SOURCE_META, new ColumnPredicate(ReadonlyTable.SOURCE_META, "reach",
                        ColumnPredicate.Comparison.GREATER_THAN, 0, false))));
    }

    @Test
    public void unionMergesInjectedConstraintOfSameFamily() {
        final HashQueryPlan plan = planner.plan(Query.hasType("Activation").or(Query.hasAgent("MEK")),
                ImmutableList.of(PHOSPHORYLATION));
        // Activation and Phosphorylation exclude each other, leaving only the agent option.
        assertEquals(scan(ReadonlyTable.NAME_META, AndPredicate.of(mek(ReadonlyTable.NAME_META),
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.NAME_META))),
                plan);

        final HasType both = Query.hasType("Activation", "Phosphorylation");
        final HashQueryPlan narrowed = planner.plan(PHOSPHORYLATION.or(Query.hasReadings()), ImmutableList.of(both));
        assertThat(((UnionPlan)narrowed).getChildren(), containsInAnyOrder(
                scan(ReadonlyTable.SOURCE_META, PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META)),
                scan(ReadonlyTable.SOURCE_META, AndPredicate.of(
                        ColumnPredicate.equalTo(ReadonlyTable.SOURCE_META, ReadonlyColumns.HAS_RD, true),
                        both.getPredicate(ReadonlyTable.SOURCE_META)))));
    }

    @Test
    public void contradictoryInjectionIsEmpty() {
        final StatementQuery query = Query.hasAgent("MEK").and(Query.hasType("Activation"));
        assertSame(EmptyHashesPlan.INSTANCE, planner.plan(query, ImmutableList.of(PHOSPHORYLATION)));
    }

    @Test
    public void injectingIntoOwnFamily() {
        assertThrows(MalformedQueryException.class,
                () -> planner.plan(Query.hasType("Activation"), ImmutableList.of(PHOSPHORYLATION)));
        assertEquals(scan(ReadonlyTable.SOURCE_META, AndPredicate.of(
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META),
                        Query.hasNumAgents(2).getPredicate(ReadonlyTable.SOURCE_META))),
                planner.plan(PHOSPHORYLATION, ImmutableList.of(Query.hasNumAgents(2))));
    }

    @Test
    public void papers() {
        assertEquals(new PaperScanPlan(
                        ColumnPredicate.like(ReadonlyTable.READING_REF_LINK, "pmid", "123"), null),
                planner.plan(Query.fromPaper("pmid", "123")));
        final HashQueryPlan restricted = planner.plan(Query.fromPaper("trid", "5").and(PHOSPHORYLATION));
        assertEquals(new PaperScanPlan(
                        ColumnPredicate.equalTo(ReadonlyTable.READING_REF_LINK, "trid", 5L),
                        PHOSPHORYLATION.getPredicate(ReadonlyTable.SOURCE_META)),
                restricted);
    }
}
