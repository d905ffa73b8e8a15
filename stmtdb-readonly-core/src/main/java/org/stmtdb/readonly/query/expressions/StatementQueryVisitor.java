/*
 * StatementQueryVisitor.java
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

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * Visitor over the closed set of {@link StatementQuery} classes. Adding a query class adds a method here, so that
 * every planner and writer has to handle it.
 * @param <T> the result of a visit
 */
@API(API.Status.UNSTABLE)
public interface StatementQueryVisitor<T> {
    @Nonnull
    T visitHasAgent(@Nonnull HasAgent query);

    @Nonnull
    T visitFromMeshId(@Nonnull FromMeshId query);

    @Nonnull
    T visitHasHash(@Nonnull HasHash query);

    @Nonnull
    T visitHasSources(@Nonnull HasSources query);

    @Nonnull
    T visitHasOnlySource(@Nonnull HasOnlySource query);

    @Nonnull
    T visitHasReadings(@Nonnull HasReadings query);

    @Nonnull
    T visitHasDatabases(@Nonnull HasDatabases query);

    @Nonnull
    T visitFromPapers(@Nonnull FromPapers query);

    @Nonnull
    T visitHasType(@Nonnull HasType query);

    @Nonnull
    T visitHasNumAgents(@Nonnull HasNumAgents query);

    @Nonnull
    T visitHasNumEvidence(@Nonnull HasNumEvidence query);

    @Nonnull
    T visitSourceIntersection(@Nonnull SourceIntersection query);

    @Nonnull
    T visitIntersection(@Nonnull Intersection query);

    @Nonnull
    T visitUnion(@Nonnull Union query);
}
