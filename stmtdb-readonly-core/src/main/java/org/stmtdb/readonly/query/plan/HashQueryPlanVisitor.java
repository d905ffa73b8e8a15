/*
 * HashQueryPlanVisitor.java
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

import javax.annotation.Nonnull;

/**
 * Visitor over the {@link HashQueryPlan} implementations.
 * @param <T> the result of a visit
 */
@API(API.Status.UNSTABLE)
public interface HashQueryPlanVisitor<T> {
    @Nonnull
    T visitAllHashes(@Nonnull AllHashesPlan plan);

    @Nonnull
    T visitEmptyHashes(@Nonnull EmptyHashesPlan plan);

    @Nonnull
    T visitRelationScan(@Nonnull RelationScanPlan plan);

    @Nonnull
    T visitPaperScan(@Nonnull PaperScanPlan plan);

    @Nonnull
    T visitIntersection(@Nonnull IntersectionPlan plan);

    @Nonnull
    T visitUnion(@Nonnull UnionPlan plan);

    @Nonnull
    T visitExcept(@Nonnull ExceptPlan plan);
}
