/*
 * SourceTypeQuery.java
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

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;

/**
 * Statements with evidence from some source of a group: reading systems ({@link HasReadings}) or curated databases
 * ({@link HasDatabases}). Each group has a boolean column in {@code source_meta}.
 */
@API(API.Status.UNSTABLE)
public abstract class SourceTypeQuery extends SourceQuery implements EvidenceFilterable {
    SourceTypeQuery(boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
    }

    @Nonnull
    abstract String getColumn();

    @Nonnull
    abstract ImmutableSet<String> getSourceGroup();

    /**
     * Get the word used for the group in descriptions.
     * @return e.g. {@code "readings"}
     */
    @Nonnull
    abstract String getGroupName();

    @Nonnull
    @Override
    public FilterPredicate getPredicate() {
        return ColumnPredicate.equalTo(ReadonlyTable.SOURCE_META, getColumn(), !isInverted());
    }

    @Nonnull
    @Override
    public EvidenceFilter getEvidenceFilter() {
        return EvidenceFilter.exists(ReadonlyTable.RAW_STMT_SRC,
                ColumnPredicate.in(ReadonlyTable.RAW_STMT_SRC, ReadonlyColumns.SRC, getSourceGroup(), isInverted()));
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonObject json = new JsonObject();
        json.addProperty(getColumn(), true);
        return json;
    }

    @Override
    public String toString() {
        return "has " + (isInverted() ? "no " : "") + getGroupName();
    }
}
