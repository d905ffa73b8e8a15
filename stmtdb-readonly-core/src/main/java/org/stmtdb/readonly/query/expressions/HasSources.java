/*
 * HasSources.java
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
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.metadata.Sources;
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;
import org.stmtdb.readonly.query.predicates.OrPredicate;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Statements with evidence from every one of a set of sources, e.g. both {@code reach} and {@code medscan}.
 * Inverted, statements lacking at least one of them.
 */
@API(API.Status.UNSTABLE)
public class HasSources extends SourceQuery implements EvidenceFilterable {
    @Nonnull
    private final ImmutableSortedSet<String> sources;

    public HasSources(@Nonnull Collection<String> sources) {
        this(validated(sources), false, sources.isEmpty(), false);
    }

    private HasSources(@Nonnull ImmutableSortedSet<String> sources, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.sources = sources;
    }

    @Nonnull
    private static ImmutableSortedSet<String> validated(@Nonnull Collection<String> sources) {
        sources.forEach(Sources::validate);
        return ImmutableSortedSet.copyOf(sources);
    }

    @Nonnull
    public ImmutableSortedSet<String> getSources() {
        return sources;
    }

    @Nonnull
    @Override
    public HasSources invert() {
        return (HasSources)super.invert();
    }

    @Nonnull
    @Override
    HasSources copy(boolean inverted, boolean empty, boolean full) {
        return new HasSources(sources, inverted, empty, full);
    }

    @Nonnull
    @Override
    public FilterPredicate getPredicate() {
        final List<FilterPredicate> clauses = new ArrayList<>();
        for (String source : sources) {
            if (!isInverted()) {
                clauses.add(new ColumnPredicate(ReadonlyTable.SOURCE_META, source,
                        ColumnPredicate.Comparison.GREATER_THAN, 0, false));
            } else {
                // A missing source is a null count, not zero.
                clauses.add(ColumnPredicate.isNull(ReadonlyTable.SOURCE_META, source));
            }
        }
        return isInverted() ? OrPredicate.of(clauses) : AndPredicate.of(clauses);
    }

    @Nonnull
    @Override
    public EvidenceFilter getEvidenceFilter() {
        return EvidenceFilter.exists(ReadonlyTable.RAW_STMT_SRC,
                ColumnPredicate.in(ReadonlyTable.RAW_STMT_SRC, ReadonlyColumns.SRC, sources, isInverted()));
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonArray values = new JsonArray();
        sources.forEach(values::add);
        final JsonObject json = new JsonObject();
        json.add("sources", values);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasSources(this);
    }

    @Override
    public String toString() {
        if (!isInverted()) {
            return "is from all of " + sources;
        }
        return "is not from one of " + sources;
    }
}
