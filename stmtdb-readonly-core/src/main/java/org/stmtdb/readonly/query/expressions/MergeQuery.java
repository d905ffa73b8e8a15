/*
 * MergeQuery.java
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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Common base for {@link Intersection} and {@link Union}.
 *
 * <p>
 * Merge queries are only built through their {@code of} factories, which canonicalize the children: nested merges of
 * the same kind are flattened, mergeable children are merged, and the children are sorted by their JSON description
 * so that equal trees are equal regardless of the order they were combined in.
 * </p>
 */
@API(API.Status.UNSTABLE)
public abstract class MergeQuery extends StatementQuery {
    private static final Comparator<StatementQuery> CANONICAL_ORDER = Comparator.comparing(StatementQuery::toJsonString);

    @Nonnull
    private final ImmutableList<StatementQuery> children;
    @Nullable
    private volatile StatementQuery inverse;

    MergeQuery(@Nonnull List<StatementQuery> children, boolean empty, boolean full) {
        super(false, empty, full);
        this.children = ImmutableList.copyOf(children);
    }

    @Nonnull
    public List<StatementQuery> getChildren() {
        return children;
    }

    @Nonnull
    abstract String getJoinWord();

    /**
     * Build the De Morgan inverse of this query.
     * @return the inverse, canonicalized
     */
    @Nonnull
    abstract StatementQuery buildInverse();

    /**
     * Get the inverse of this query. The inverse is built once, and a merge query built as an inverse refers back
     * to this query, so inverting twice gives this query back.
     * @return the inverse
     */
    @Nonnull
    @Override
    public StatementQuery invert() {
        StatementQuery result = inverse;
        if (result == null) {
            result = buildInverse();
            if (result instanceof MergeQuery && ((MergeQuery)result).inverse == null
                    && result.isEmpty() == isFull() && result.isFull() == isEmpty()) {
                ((MergeQuery)result).inverse = this;
            }
            inverse = result;
        }
        return result;
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonArray queries = new JsonArray();
        children.forEach(child -> queries.add(child.canonicalJson()));
        final JsonObject json = new JsonObject();
        json.add("query_list", queries);
        return json;
    }

    @Override
    void addComponentQueries(@Nonnull Set<String> components) {
        children.forEach(child -> child.addComponentQueries(components));
    }

    @Override
    public String toString() {
        return children.stream()
                .map(child -> child instanceof MergeQuery || child instanceof SourceIntersection || child.isInverted()
                              ? "(" + child + ")" : child.toString())
                .collect(Collectors.joining(" " + getJoinWord() + " "));
    }

    @Nonnull
    static List<StatementQuery> canonicalOrder(@Nonnull Collection<StatementQuery> queries) {
        final List<StatementQuery> sorted = new ArrayList<>(queries);
        sorted.sort(CANONICAL_ORDER);
        return sorted;
    }

    /**
     * Replace any child of the given merge class by its own children.
     * @param queries the queries being merged
     * @param mergeClass the class whose instances are spliced in
     * @return the flattened list
     */
    @Nonnull
    static List<StatementQuery> flatten(@Nonnull List<? extends StatementQuery> queries,
                                        @Nonnull Class<? extends StatementQuery> mergeClass) {
        final List<StatementQuery> flat = new ArrayList<>();
        for (StatementQuery query : queries) {
            if (mergeClass.isInstance(query)) {
                flat.addAll(((MergeQuery)query).getChildren());
            } else {
                flat.add(query);
            }
        }
        return flat;
    }

    private static boolean isCompound(@Nonnull StatementQuery query) {
        return query instanceof MergeQuery || query instanceof SourceIntersection;
    }

    /**
     * Whether any two of the queries are exact inverses of each other.
     * @param queries the queries to check
     * @return {@code true} if a pair of inverses is found
     */
    static boolean hasInversePair(@Nonnull List<? extends StatementQuery> queries) {
        for (int i = 0; i < queries.size(); i++) {
            final StatementQuery first = queries.get(i);
            StatementQuery inverse = null;
            for (int j = i + 1; j < queries.size(); j++) {
                final StatementQuery second = queries.get(j);
                if (isCompound(first) != isCompound(second)) {
                    continue;
                }
                if (!isCompound(first) && (first.getClass() != second.getClass() || first.isInverted() == second.isInverted())) {
                    continue;
                }
                if (inverse == null) {
                    inverse = first.invert();
                }
                if (inverse.equals(second)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether the inverse of some compound child is implied by its siblings. The inverse is split into its own
     * children when it is of the given merge class, and each part must be among the siblings. This catches a merge
     * query combined with its inverse after the inverse has been flattened into its siblings.
     * @param children the flattened children of a merge of class {@code mergeClass}
     * @param mergeClass {@link Intersection} or {@link Union}
     * @return {@code true} if a child contradicts (in an intersection) or completes (in a union) its siblings
     */
    static boolean hasInvertedSubset(@Nonnull List<StatementQuery> children,
                                     @Nonnull Class<? extends MergeQuery> mergeClass) {
        if (children.size() < 2) {
            return false;
        }
        for (StatementQuery child : children) {
            if (!isCompound(child) || mergeClass.isInstance(child)) {
                continue;
            }
            final StatementQuery inverse = child.invert();
            final List<StatementQuery> parts = mergeClass.isInstance(inverse)
                                               ? ((MergeQuery)inverse).getChildren()
                                               : ImmutableList.of(inverse);
            final Set<StatementQuery> siblings = new HashSet<>(children);
            siblings.remove(child);
            if (siblings.containsAll(parts)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Make sure the inverse of an empty query is full and vice versa, whatever simplification found.
     * @param result the inverse as built
     * @param empty whether it must be empty
     * @param full whether it must be full
     * @return the inverse with consistent flags
     */
    @Nonnull
    static StatementQuery withStaticFlags(@Nonnull StatementQuery result, boolean empty, boolean full) {
        if ((empty && !result.isEmpty()) || (full && !result.isFull())) {
            return result.copy(result.isInverted(), empty, full);
        }
        return result;
    }

    @Nonnull
    static List<StatementQuery> invertAll(@Nonnull List<? extends StatementQuery> queries) {
        return queries.stream().map(StatementQuery::invert).collect(Collectors.toList());
    }
}
