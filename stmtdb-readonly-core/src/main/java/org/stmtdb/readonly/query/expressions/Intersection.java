/*
 * Intersection.java
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
import com.google.common.collect.ImmutableMap;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statements matching every child query.
 *
 * <p>
 * Construction canonicalizes the children:
 * </p>
 * <ul>
 * <li>all source queries are folded into one {@link SourceIntersection};</li>
 * <li>{@link FromPapers} children and cross-cutting ({@link IntrusiveQuery}) children are merged per family and
 * polarity;</li>
 * <li>nested intersections are flattened and statically full children dropped.</li>
 * </ul>
 * <p>
 * The merged cross-cutting children are kept as children, and are also exposed as the injected constraints that the
 * planner applies inside the scans of the other children. The intersection is statically empty if a child is empty,
 * if two children are exact inverses, if a compound child is contradicted by the
 * siblings that make up its inverse, or if a {@link Union} child made only of cross-cutting queries has every
 * option ruled out by the injected constraints.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class Intersection extends MergeQuery {
    @Nonnull
    private final ImmutableMap<String, IntrusiveQuery<?>> positiveInjected;
    @Nonnull
    private final ImmutableMap<String, IntrusiveQuery<?>> negativeInjected;

    private Intersection(@Nonnull List<StatementQuery> children, boolean empty, boolean full) {
        super(children, empty, full);
        final Map<String, IntrusiveQuery<?>> positive = new LinkedHashMap<>();
        final Map<String, IntrusiveQuery<?>> negative = new LinkedHashMap<>();
        for (StatementQuery child : children) {
            if (child instanceof IntrusiveQuery) {
                (child.isInverted() ? negative : positive).put(child.getFamilyName(), (IntrusiveQuery<?>)child);
            }
        }
        this.positiveInjected = ImmutableMap.copyOf(positive);
        this.negativeInjected = ImmutableMap.copyOf(negative);
    }

    @Nonnull
    public static StatementQuery of(@Nonnull StatementQuery first, @Nonnull StatementQuery... rest) {
        return of(Query.toList(first, rest));
    }

    /**
     * Intersect queries.
     * @param queries the queries, at least one
     * @return the canonical intersection, which is the single remaining child if there is only one
     */
    @Nonnull
    public static StatementQuery of(@Nonnull List<? extends StatementQuery> queries) {
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("intersection needs at least one query");
        }
        // Checked before flattening, so that a merge query and its inverse are caught as a pair.
        boolean empty = hasInversePair(queries);

        final List<StatementQuery> sourceMembers = new ArrayList<>();
        final Map<String, StatementQuery> mergeable = new LinkedHashMap<>();
        final Set<StatementQuery> others = new LinkedHashSet<>();
        for (StatementQuery query : flatten(queries, Intersection.class)) {
            if (query instanceof SourceQuery || query instanceof SourceIntersection) {
                sourceMembers.add(query);
            } else if (query instanceof FromPapers || query instanceof IntrusiveQuery) {
                mergeable.merge(polarityKey(query), query, StatementQuery::and);
            } else {
                others.add(query);
            }
        }
        final Set<StatementQuery> children = new LinkedHashSet<>();
        if (!sourceMembers.isEmpty()) {
            children.add(SourceIntersection.of(sourceMembers));
        }
        children.addAll(mergeable.values());
        children.addAll(others);

        final List<StatementQuery> childList = ImmutableList.copyOf(children);
        if (childList.stream().allMatch(StatementQuery::isFull)) {
            return childList.get(0);
        }
        empty |= childList.stream().anyMatch(StatementQuery::isEmpty);
        empty |= hasInversePair(childList);
        empty |= hasInvertedSubset(childList, Intersection.class);
        empty |= hasExcludedUnion(childList);

        final List<StatementQuery> kept = canonicalOrder(
                childList.stream().filter(child -> !child.isFull()).collect(Collectors.toList()));
        if (kept.size() == 1 && (!empty || kept.get(0).isEmpty())) {
            return kept.get(0);
        }
        return new Intersection(kept, empty, false);
    }

    @Nonnull
    static String polarityKey(@Nonnull StatementQuery query) {
        return (query.isInverted() ? "~" : "") + query.getFamilyName();
    }

    /**
     * Whether some child is a union of only cross-cutting queries, each of which contradicts a cross-cutting
     * sibling of the same family. Other shapes of union are left alone, even if they might be empty.
     */
    private static boolean hasExcludedUnion(@Nonnull List<StatementQuery> children) {
        final List<IntrusiveQuery<?>> injected = children.stream()
                .filter(IntrusiveQuery.class::isInstance)
                .map(child -> (IntrusiveQuery<?>)child)
                .collect(Collectors.toList());
        if (injected.isEmpty()) {
            return false;
        }
        for (StatementQuery child : children) {
            if (child instanceof Union && ((Union)child).getChildren().stream().allMatch(
                    option -> option instanceof IntrusiveQuery && isExcluded(option, injected))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExcluded(@Nonnull StatementQuery option, @Nonnull List<IntrusiveQuery<?>> injected) {
        for (IntrusiveQuery<?> constraint : injected) {
            if (constraint.isSameFamily(option) && constraint.and(option).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the merged cross-cutting constraints that are not inverted, keyed by family name.
     * @return the positive injected constraints
     */
    @Nonnull
    public Map<String, IntrusiveQuery<?>> getPositiveInjected() {
        return positiveInjected;
    }

    /**
     * Get the merged cross-cutting constraints that are inverted, keyed by family name.
     * @return the negative injected constraints
     */
    @Nonnull
    public Map<String, IntrusiveQuery<?>> getNegativeInjected() {
        return negativeInjected;
    }

    /**
     * Get all the injected constraints, positive first.
     * @return the cross-cutting children
     */
    @Nonnull
    public List<IntrusiveQuery<?>> getInjected() {
        return ImmutableList.<IntrusiveQuery<?>>builder()
                .addAll(positiveInjected.values())
                .addAll(negativeInjected.values())
                .build();
    }

    @Nonnull
    @Override
    StatementQuery buildInverse() {
        return withStaticFlags(Union.of(invertAll(getChildren())), isFull(), isEmpty());
    }

    @Nonnull
    @Override
    Intersection copy(boolean inverted, boolean empty, boolean full) {
        if (inverted) {
            throw new IllegalStateException("intersection cannot be inverted in place");
        }
        return new Intersection(getChildren(), empty, full);
    }

    @Nonnull
    @Override
    String getJoinWord() {
        return "and";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitIntersection(this);
    }
}
