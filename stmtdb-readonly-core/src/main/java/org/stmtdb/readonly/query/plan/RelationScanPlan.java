/*
 * RelationScanPlan.java
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

import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The fingerprints of the rows of one hash scannable table that match a predicate.
 */
@API(API.Status.UNSTABLE)
public class RelationScanPlan implements HashQueryPlan {
    @Nonnull
    private final ReadonlyTable table;
    @Nullable
    private final FilterPredicate predicate;

    public RelationScanPlan(@Nonnull ReadonlyTable table, @Nullable FilterPredicate predicate) {
        if (!table.isHashScannable()) {
            throw new IllegalArgumentException("table has no fingerprint column: " + table);
        }
        this.table = table;
        this.predicate = predicate;
    }

    @Nonnull
    public ReadonlyTable getTable() {
        return table;
    }

    /**
     * Get the row predicate.
     * @return the predicate, or {@code null} to scan every row
     */
    @Nullable
    public FilterPredicate getPredicate() {
        return predicate;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull HashQueryPlanVisitor<T> visitor) {
        return visitor.visitRelationScan(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RelationScanPlan that = (RelationScanPlan)o;
        return table == that.table && Objects.equals(predicate, that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, predicate);
    }

    @Override
    public String toString() {
        return "Scan(" + table + (predicate == null ? "" : " | " + predicate) + ")";
    }
}
