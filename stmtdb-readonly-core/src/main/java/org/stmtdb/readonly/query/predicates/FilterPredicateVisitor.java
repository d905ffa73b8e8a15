/*
 * FilterPredicateVisitor.java
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
 * Visitor over the {@link FilterPredicate} implementations.
 * @param <T> the result of a visit
 */
@API(API.Status.UNSTABLE)
public interface FilterPredicateVisitor<T> {
    @Nonnull
    T visitColumn(@Nonnull ColumnPredicate predicate);

    @Nonnull
    T visitAnd(@Nonnull AndPredicate predicate);

    @Nonnull
    T visitOr(@Nonnull OrPredicate predicate);
}
