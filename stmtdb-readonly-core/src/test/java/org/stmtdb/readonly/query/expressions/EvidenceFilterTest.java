/*
 * EvidenceFilterTest.java
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

package org.stmtdb.readonly.query.expressions;

import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.metadata.Sources;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EvidenceFilter} and the filters of {@link EvidenceFilterable} queries.
 */
public class EvidenceFilterTest {

    @Test
    public void sourceFilter() {
        final EvidenceFilter filter = Query.hasSources("reach").getEvidenceFilter();
        assertEquals(EvidenceFilter.exists(ReadonlyTable.RAW_STMT_SRC,
                ColumnPredicate.equalTo(ReadonlyTable.RAW_STMT_SRC, ReadonlyColumns.SRC, "reach")), filter);

        final EvidenceFilter inverted = Query.hasReadings().invert().getEvidenceFilter();
        final EvidenceFilter.Leaf leaf = (EvidenceFilter.Leaf)inverted.getElements().get(0);
        assertTrue(leaf.isExists());
        final ColumnPredicate predicate = (ColumnPredicate)leaf.getPredicate();
        assertEquals(ColumnPredicate.Comparison.IN, predicate.getComparison());
        assertTrue(predicate.isNegated());
        assertEquals(Sources.READING.asList(), predicate.getComparand());
    }

    @Test
    public void meshFilterNegatesByAbsence() {
        final EvidenceFilter.Leaf mesh = (EvidenceFilter.Leaf)Query.fromMeshId("C0042").invert()
                .getEvidenceFilter().getElements().get(0);
        assertFalse(mesh.isExists());
        assertSame(ReadonlyTable.RAW_STMT_MESH_CONCEPTS, mesh.getTable());
        assertEquals(ColumnPredicate.equalTo(ReadonlyTable.RAW_STMT_MESH_CONCEPTS, ReadonlyColumns.MESH_NUM, 42L),
                mesh.getPredicate());
    }

    @Test
    public void invertedPaperFilterStillNeedsAReading() {
        final FromPapers paper = Query.fromPaper("pmid", "123");
        final EvidenceFilter.Leaf papers = (EvidenceFilter.Leaf)paper.invert()
                .getEvidenceFilter().getElements().get(0);
        assertTrue(papers.isExists());
        assertSame(ReadonlyTable.READING_REF_LINK, papers.getTable());
        assertEquals(paper.getPaperPredicate().negate(), papers.getPredicate());
        assertEquals(paper.invert().getPaperPredicate(), papers.getPredicate());
    }

    @Test
    public void combinesByLevel() {
        final EvidenceFilter a = Query.hasSources("reach").getEvidenceFilter();
        final EvidenceFilter b = Query.fromMeshId("D0001").getEvidenceFilter();
        final EvidenceFilter c = Query.hasDatabases().getEvidenceFilter();

        final EvidenceFilter all = a.and(b).and(c);
        assertEquals(EvidenceFilter.Joiner.AND, all.getJoiner());
        assertThat(all.getElements(), hasSize(3));

        final EvidenceFilter any = a.or(b).or(c);
        assertEquals(EvidenceFilter.Joiner.OR, any.getJoiner());
        assertThat(any.getElements(), hasSize(3));

        final EvidenceFilter mixed = a.or(b).and(c);
        assertEquals(EvidenceFilter.Joiner.AND, mixed.getJoiner());
        assertThat(mixed.getElements(), hasSize(2));
        assertThat(mixed.getElements().get(0), instanceOf(EvidenceFilter.class));
        assertEquals(a.or(b), mixed.getElements().get(0));
    }

    @Test
    public void visitsLeavesAndNestedLevels() {
        final EvidenceFilter filter = Query.hasSources("reach").getEvidenceFilter()
                .or(Query.fromMeshId("D0001").getEvidenceFilter())
                .and(Query.hasDatabases().invert().getEvidenceFilter());
        final String rendered = filter.accept(new EvidenceFilterVisitor<String>() {
            @Override
            public String visitLeaf(EvidenceFilter.Leaf leaf) {
                return leaf.getTable().getTableName();
            }

            @Override
            public String visitFilter(EvidenceFilter level) {
                final StringBuilder str = new StringBuilder("[");
                for (EvidenceFilterElement element : level.getElements()) {
                    str.append(' ').append(element.accept(this));
                }
                return str.append(" ]").toString();
            }
        });
        assertEquals("[ [ raw_stmt_src raw_stmt_mesh_terms ] raw_stmt_src ]", rendered);
    }

    @Test
    public void onlyEvidenceTables() {
        assertThrows(IllegalArgumentException.class, () -> EvidenceFilter.exists(ReadonlyTable.SOURCE_META,
                ColumnPredicate.isNull(ReadonlyTable.SOURCE_META, "reach")));
    }
}
