/*
 * SourceQuery.java
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

import com.google.common.collect.ImmutableList;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;

/**
 * Base class for queries answered from {@code source_meta}, which has exactly one row per fingerprint. Such queries
 * negate at the row level, and conjunctions of them are evaluated in a single pass by a
 * {@link SourceIntersection}.
 */
@API(API.Status.UNSTABLE)
public abstract class SourceQuery extends StatementQuery {
    SourceQuery(boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
    }

    /**
     * Get the condition on {@code source_meta} rows, with any inversion applied.
     * @return the row predicate
     */
    @Nonnull
    public abstract FilterPredicate getPredicate();

    @Nonnull
    @Override
    StatementQuery doAnd(@Nonnull StatementQuery other) {
        if (other instanceof SourceQuery || other instanceof SourceIntersection) {
            return SourceIntersection.of(ImmutableList.of(this, other));
        }
        return super.doAnd(other);
    }
}
