/*
 * FromPapers.java
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

import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.PaperIdType;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;
import org.stmtdb.readonly.query.predicates.OrPredicate;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Statements with evidence from one of a set of papers.
 *
 * <p>
 * The condition is evaluated on the reading references of each raw statement. Inverted, it matches statements with
 * evidence from a paper outside the set.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class FromPapers extends StatementQuery implements ValueSetQuery<PaperRef>, EvidenceFilterable {
    @Nonnull
    private final ImmutableSortedSet<PaperRef> papers;

    public FromPapers(@Nonnull Collection<PaperRef> papers) {
        this(ImmutableSortedSet.copyOf(papers), false);
    }

    private FromPapers(@Nonnull ImmutableSortedSet<PaperRef> papers, boolean inverted) {
        this(papers, inverted, papers.isEmpty() && !inverted, papers.isEmpty() && inverted);
    }

    private FromPapers(@Nonnull ImmutableSortedSet<PaperRef> papers, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.papers = papers;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<PaperRef> getValues() {
        return papers;
    }

    @Nonnull
    @Override
    public FromPapers withValues(@Nonnull Set<PaperRef> values, boolean inverted) {
        return new FromPapers(ImmutableSortedSet.copyOf(values), inverted);
    }

    /**
     * Get the condition on {@code reading_ref_link} rows: any of the papers, or, inverted, none of them.
     * @return the reading reference predicate
     */
    @Nonnull
    public FilterPredicate getPaperPredicate() {
        final FilterPredicate anyOf = anyOfPredicate();
        return isInverted() ? anyOf.negate() : anyOf;
    }

    @Nonnull
    private FilterPredicate anyOfPredicate() {
        final List<FilterPredicate> conditions = new ArrayList<>();
        for (PaperRef paper : papers) {
            final PaperIdType idType = paper.getIdType();
            final Object value = idType.parseId(paper.getPaperId());
            conditions.add(new ColumnPredicate(ReadonlyTable.READING_REF_LINK, idType.getColumnName(),
                    idType.isNumeric() ? ColumnPredicate.Comparison.EQUALS : ColumnPredicate.Comparison.LIKE,
                    value, false));
        }
        return OrPredicate.of(conditions);
    }

    @Nonnull
    @Override
    public EvidenceFilter getEvidenceFilter() {
        // Inverted, the evidence must still come from a reading, one that has none of the papers' ids.
        return EvidenceFilter.exists(ReadonlyTable.READING_REF_LINK, getPaperPredicate());
    }

    @Nonnull
    @Override
    public FromPapers invert() {
        return (FromPapers)super.invert();
    }

    @Nonnull
    @Override
    FromPapers copy(boolean inverted, boolean empty, boolean full) {
        return new FromPapers(papers, inverted, empty, full);
    }

    @Nonnull
    @Override
    StatementQuery doAnd(@Nonnull StatementQuery other) {
        final StatementQuery merged = ValueSets.merge(this, other, true);
        return merged != null ? merged : super.doAnd(other);
    }

    @Nonnull
    @Override
    StatementQuery doOr(@Nonnull StatementQuery other) {
        final StatementQuery merged = ValueSets.merge(this, other, false);
        return merged != null ? merged : super.doOr(other);
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonArray values = new JsonArray();
        for (PaperRef paper : papers) {
            final JsonArray pair = new JsonArray();
            pair.add(paper.getIdType().getColumnName());
            pair.add(paper.getPaperId());
            values.add(pair);
        }
        final JsonObject json = new JsonObject();
        json.add("paper_list", values);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitFromPapers(this);
    }

    @Override
    public String toString() {
        return (isInverted() ? "not " : "") + "from papers " + papers;
    }
}
