/*
 * PaperScanPlan.java
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
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The fingerprints having a raw statement read from a paper matching a predicate on {@code reading_ref_link}. The
 * fingerprint rows come from {@code source_meta}, optionally narrowed by a predicate on it.
 */
@API(API.Status.UNSTABLE)
public class PaperScanPlan implements HashQueryPlan {
    @Nonnull
    private final FilterPredicate paperPredicate;
    @Nullable
    private final FilterPredicate metaPredicate;

    public PaperScanPlan(@Nonnull FilterPredicate paperPredicate, @Nullable FilterPredicate metaPredicate) {
        this.paperPredicate = paperPredicate;
        this.metaPredicate = metaPredicate;
    }

    @Nonnull
    public FilterPredicate getPaperPredicate() {
        return paperPredicate;
    }

    @Nullable
    public FilterPredicate getMetaPredicate() {
        return metaPredicate;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull HashQueryPlanVisitor<T> visitor) {
        return visitor.visitPaperScan(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PaperScanPlan that = (PaperScanPlan)o;
        return paperPredicate.equals(that.paperPredicate) && Objects.equals(metaPredicate, that.metaPredicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paperPredicate, metaPredicate);
    }

    @Override
    public String toString() {
        return "Papers(" + paperPredicate + (metaPredicate == null ? "" : " | " + metaPredicate) + ")";
    }
}
