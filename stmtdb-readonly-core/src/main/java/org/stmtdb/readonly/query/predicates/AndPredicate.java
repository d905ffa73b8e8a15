/*
 * AndPredicate.java
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

package org.stmtdb.readonly.query.predicates;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;

/**
 * Rows matching every child predicate.
 */
@API(API.Status.UNSTABLE)
public class AndPredicate extends AndOrPredicate {
    public AndPredicate(@Nonnull List<? extends FilterPredicate> children) {
        super(children);
    }

    /**
     * Conjoin predicates, avoiding a wrapper around a single one.
     * @param children the predicates
     * @return their conjunction
     */
    @Nonnull
    public static FilterPredicate of(@Nonnull List<? extends FilterPredicate> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        return new AndPredicate(children);
    }

    @Nonnull
    public static FilterPredicate of(@Nonnull FilterPredicate first, @Nonnull FilterPredicate... rest) {
        final FilterPredicate[] all = new FilterPredicate[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return of(Arrays.asList(all));
    }

    @Nonnull
    @Override
    public FilterPredicate negate() {
        return OrPredicate.of(negatedChildren());
    }

    @Nonnull
    @Override
    protected String getJoiner() {
        return "AND";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull FilterPredicateVisitor<T> visitor) {
        return visitor.visitAnd(this);
    }
}
