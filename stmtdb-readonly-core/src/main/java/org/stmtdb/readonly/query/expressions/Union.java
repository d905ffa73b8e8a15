/*
 * Union.java
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

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statements matching at least one child query.
 *
 * <p>
 * Construction merges {@link HasHash}, {@link FromPapers} and cross-cutting children per family and polarity,
 * flattens nested unions and drops statically empty children. The union is statically full if any child is full, if
 * two children are exact inverses, or if the inverse of a compound child is made up of its siblings.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class Union extends MergeQuery {
    private Union(@Nonnull List<StatementQuery> children, boolean empty, boolean full) {
        super(children, empty, full);
    }

    @Nonnull
    public static StatementQuery of(@Nonnull StatementQuery first, @Nonnull StatementQuery... rest) {
        return of(Query.toList(first, rest));
    }

    /**
     * Unite queries.
     * @param queries the queries, at least one
     * @return the canonical union, which is the single remaining child if there is only one
     */
    @Nonnull
    public static StatementQuery of(@Nonnull List<? extends StatementQuery> queries) {
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("union needs at least one query");
        }
        boolean full = hasInversePair(queries);

        final Map<String, StatementQuery> mergeable = new LinkedHashMap<>();
        final Set<StatementQuery> others = new LinkedHashSet<>();
        for (StatementQuery query : flatten(queries, Union.class)) {
            if (query instanceof ValueSetQuery) {
                mergeable.merge(Intersection.polarityKey(query), query, StatementQuery::or);
            } else {
                others.add(query);
            }
        }
        final Set<StatementQuery> children = new LinkedHashSet<>(mergeable.values());
        children.addAll(others);

        final List<StatementQuery> childList = ImmutableList.copyOf(children);
        if (childList.stream().allMatch(StatementQuery::isEmpty)) {
            return childList.get(0);
        }
        full |= childList.stream().anyMatch(StatementQuery::isFull);
        full |= hasInversePair(childList);
        full |= hasInvertedSubset(childList, Union.class);

        final List<StatementQuery> kept = canonicalOrder(
                childList.stream().filter(child -> !child.isEmpty()).collect(Collectors.toList()));
        if (kept.size() == 1 && (!full || kept.get(0).isFull())) {
            return kept.get(0);
        }
        return new Union(kept, false, full);
    }

    @Nonnull
    @Override
    StatementQuery buildInverse() {
        return withStaticFlags(Intersection.of(invertAll(getChildren())), isFull(), isEmpty());
    }

    @Nonnull
    @Override
    Union copy(boolean inverted, boolean empty, boolean full) {
        if (inverted) {
            throw new IllegalStateException("union cannot be inverted in place");
        }
        return new Union(getChildren(), empty, full);
    }

    @Nonnull
    @Override
    String getJoinWord() {
        return "or";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitUnion(this);
    }
}
