/*
 * OrPredicate.java
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
import java.util.List;

/**
 * Rows matching at least one child predicate.
 */
@API(API.Status.UNSTABLE)
public class OrPredicate extends AndOrPredicate {
    public OrPredicate(@Nonnull List<? extends FilterPredicate> children) {
        super(children);
    }

    @Nonnull
    public static FilterPredicate of(@Nonnull List<? extends FilterPredicate> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        return new OrPredicate(children);
    }

    @Nonnull
    @Override
    public FilterPredicate negate() {
        return AndPredicate.of(negatedChildren());
    }

    @Nonnull
    @Override
    protected String getJoiner() {
        return "OR";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull FilterPredicateVisitor<T> visitor) {
        return visitor.visitOr(this);
    }
}
