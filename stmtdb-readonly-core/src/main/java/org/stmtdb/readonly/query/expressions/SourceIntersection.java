/*
 * SourceIntersection.java
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
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A conjunction of {@link SourceQuery} members, all evaluated against {@code source_meta}. Instead of intersecting
 * one scan per member, the member predicates are conjoined into a single scan.
 *
 * <p>
 * Hash constraints among the members are reconciled into at most one {@link HasHash}. A source intersection is never
 * inverted: its inverse is the {@link Union} of its inverted members.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SourceIntersection extends StatementQuery {
    @Nonnull
    private final ImmutableList<SourceQuery> members;

    private SourceIntersection(@Nonnull List<SourceQuery> members, boolean empty, boolean full) {
        super(false, empty, full);
        this.members = ImmutableList.copyOf(members);
    }

    /**
     * Conjoin source queries.
     * @param queries {@link SourceQuery} and {@link SourceIntersection} instances
     * @return the canonical conjunction, which is the single remaining member if there is only one
     */
    @Nonnull
    static StatementQuery of(@Nonnull List<? extends StatementQuery> queries) {
        final List<SourceQuery> flat = new ArrayList<>();
        for (StatementQuery query : queries) {
            if (query instanceof SourceIntersection) {
                flat.addAll(((SourceIntersection)query).members);
            } else if (query instanceof SourceQuery) {
                flat.add((SourceQuery)query);
            } else {
                throw new IllegalArgumentException("not a source query: " + query.getFamilyName());
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("source intersection needs at least one member");
        }
        if (flat.stream().allMatch(StatementQuery::isFull)) {
            return flat.get(0);
        }
        boolean empty = MergeQuery.hasInversePair(flat);

        Set<Long> addHashes = null;
        final Set<Long> removeHashes = new TreeSet<>();
        final Set<SourceQuery> others = new LinkedHashSet<>();
        for (SourceQuery member : flat) {
            empty |= member.isEmpty();
            if (member.isFull()) {
                continue;
            }
            if (member instanceof HasHash) {
                final Set<Long> hashes = ((HasHash)member).getValues();
                if (member.isInverted()) {
                    removeHashes.addAll(hashes);
                } else if (addHashes == null) {
                    addHashes = new TreeSet<>(hashes);
                } else {
                    addHashes.retainAll(hashes);
                }
            } else {
                others.add(member);
            }
        }
        final Set<StatementQuery> reconciled = new LinkedHashSet<>(others);
        if (addHashes != null) {
            addHashes.removeAll(removeHashes);
            reconciled.add(new HasHash(addHashes));
        } else if (!removeHashes.isEmpty()) {
            reconciled.add(new HasHash(removeHashes).invert());
        }
        empty |= reconciled.stream().anyMatch(StatementQuery::isEmpty);
        final List<StatementQuery> sorted = MergeQuery.canonicalOrder(reconciled);
        if (sorted.size() == 1 && (!empty || sorted.get(0).isEmpty())) {
            return sorted.get(0);
        }
        return new SourceIntersection(sorted.stream().map(SourceQuery.class::cast).collect(Collectors.toList()),
                empty, false);
    }

    @Nonnull
    public List<SourceQuery> getMembers() {
        return members;
    }

    /**
     * Get the conjunction of the member predicates on {@code source_meta}.
     * @return the row predicate
     */
    @Nonnull
    public FilterPredicate getPredicate() {
        return AndPredicate.of(members.stream().map(SourceQuery::getPredicate).collect(Collectors.toList()));
    }

    @Nonnull
    @Override
    public StatementQuery invert() {
        return MergeQuery.withStaticFlags(Union.of(MergeQuery.invertAll(members)), isFull(), isEmpty());
    }

    @Nonnull
    @Override
    SourceIntersection copy(boolean inverted, boolean empty, boolean full) {
        if (inverted) {
            throw new IllegalStateException("source intersection cannot be inverted in place");
        }
        return new SourceIntersection(members, empty, full);
    }

    @Nonnull
    @Override
    StatementQuery doAnd(@Nonnull StatementQuery other) {
        if (other instanceof SourceQuery || other instanceof SourceIntersection) {
            return of(ImmutableList.of(this, other));
        }
        return super.doAnd(other);
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonArray queries = new JsonArray();
        members.forEach(member -> queries.add(member.canonicalJson()));
        final JsonObject json = new JsonObject();
        json.add("source_queries", queries);
        return json;
    }

    @Override
    void addComponentQueries(@Nonnull Set<String> components) {
        members.forEach(member -> member.addComponentQueries(components));
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitSourceIntersection(this);
    }

    @Override
    public String toString() {
        return members.stream().map(Object::toString).collect(Collectors.joining(" and "));
    }
}
