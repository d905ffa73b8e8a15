/*
 * HasOnlySource.java
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

import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.metadata.Sources;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;

/**
 * Statements whose evidence all comes from a single source.
 */
@API(API.Status.UNSTABLE)
public class HasOnlySource extends SourceQuery implements EvidenceFilterable {
    @Nonnull
    private final String onlySource;

    public HasOnlySource(@Nonnull String onlySource) {
        this(Sources.validate(onlySource), false, false, false);
    }

    private HasOnlySource(@Nonnull String onlySource, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.onlySource = onlySource;
    }

    @Nonnull
    public String getOnlySource() {
        return onlySource;
    }

    @Nonnull
    @Override
    public HasOnlySource invert() {
        return (HasOnlySource)super.invert();
    }

    @Nonnull
    @Override
    HasOnlySource copy(boolean inverted, boolean empty, boolean full) {
        return new HasOnlySource(onlySource, inverted, empty, full);
    }

    @Nonnull
    @Override
    public FilterPredicate getPredicate() {
        return new ColumnPredicate(ReadonlyTable.SOURCE_META, ReadonlyColumns.ONLY_SRC,
                ColumnPredicate.Comparison.NOT_DISTINCT_FROM, onlySource, isInverted());
    }

    @Nonnull
    @Override
    public EvidenceFilter getEvidenceFilter() {
        return EvidenceFilter.exists(ReadonlyTable.RAW_STMT_SRC,
                new ColumnPredicate(ReadonlyTable.RAW_STMT_SRC, ReadonlyColumns.SRC,
                        ColumnPredicate.Comparison.EQUALS, onlySource, isInverted()));
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonObject json = new JsonObject();
        json.addProperty("only_source", onlySource);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasOnlySource(this);
    }

    @Override
    public String toString() {
        return "is " + (isInverted() ? "not " : "") + "only from " + onlySource;
    }
}
