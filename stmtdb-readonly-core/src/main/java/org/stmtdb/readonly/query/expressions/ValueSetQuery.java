/*
 * ValueSetQuery.java
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

import com.google.common.collect.ImmutableSortedSet;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * A query whose constraint is membership in a finite set of values. Two such queries of the same class merge by
 * set operations instead of building an {@link Intersection} or {@link Union}.
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface ValueSetQuery<V extends Comparable<? super V>> {
    @Nonnull
    ImmutableSortedSet<V> getValues();

    boolean isInverted();

    /**
     * Build a query of the same class over different values. An empty value set makes the result statically empty,
     * or statically full if it is inverted.
     * @param values the values
     * @param inverted the inversion flag of the result
     * @return the new query
     */
    @Nonnull
    StatementQuery withValues(@Nonnull Set<V> values, boolean inverted);
}
