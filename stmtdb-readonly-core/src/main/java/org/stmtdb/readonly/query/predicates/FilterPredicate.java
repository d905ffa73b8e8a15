/*
 * FilterPredicate.java
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

/**
 * A row-level condition over columns of the readonly store. Predicates only describe the condition; rendering them
 * for a particular store is left to the store.
 */
@API(API.Status.UNSTABLE)
public interface FilterPredicate {
    /**
     * Get the logical negation of this predicate.
     * @return a predicate matching exactly the rows this one does not, treating {@code NULL} as the comparison does
     */
    @Nonnull
    FilterPredicate negate();

    @Nonnull
    <T> T accept(@Nonnull FilterPredicateVisitor<T> visitor);
}
