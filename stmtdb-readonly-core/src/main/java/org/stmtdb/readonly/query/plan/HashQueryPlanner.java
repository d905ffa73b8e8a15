/*
 * HashQueryPlanner.java
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

import com.google.common.collect.ImmutableList;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.MalformedQueryException;
import org.stmtdb.readonly.logging.KeyValueLogMessage;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.expressions.FromMeshId;
import org.stmtdb.readonly.query.expressions.FromPapers;
import org.stmtdb.readonly.query.expressions.HasAgent;
import org.stmtdb.readonly.query.expressions.HasDatabases;
import org.stmtdb.readonly.query.expressions.HasHash;
import org.stmtdb.readonly.query.expressions.HasNumAgents;
import org.stmtdb.readonly.query.expressions.HasNumEvidence;
import org.stmtdb.readonly.query.expressions.HasOnlySource;
import org.stmtdb.readonly.query.expressions.HasReadings;
import org.stmtdb.readonly.query.expressions.HasSources;
import org.stmtdb.readonly.query.expressions.HasType;
import org.stmtdb.readonly.query.expressions.Intersection;
import org.stmtdb.readonly.query.expressions.IntrusiveQuery;
import org.stmtdb.readonly.query.expressions.SourceIntersection;
import org.stmtdb.readonly.query.expressions.SourceQuery;
import org.stmtdb.readonly.query.expressions.StatementQuery;
import org.stmtdb.readonly.query.expressions.StatementQueryVisitor;
import org.stmtdb.readonly.query.expressions.Union;
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lowers a {@link StatementQuery} tree into a {@link HashQueryPlan}.
 *
 * <p>
 * Leaf queries become scans of the table holding their column: source constraints scan {@code source_meta}, agent
 * and MeSH constraints scan their mention table, paper constraints join {@code source_meta} with
 * {@code reading_ref_link}. Negated agent and MeSH constraints subtract the positive scan from the population, since
 * "some row does not mention X" is not "no row mentions X".
 * </p>
 *
 * <p>
 * Cross-cutting constraints ({@link IntrusiveQuery}) of an {@link Intersection} are not planned as scans of their
 * own. They are injected into the scan predicates of every sibling, which keeps each scan selective. Injected
 * constraints pass down through unions and nested intersections; a union merges an injected constraint of the same
 * family into its matching option before planning it.
 * </p>
 *
 * <p>
 * The planner is stateless. Each call to {@link #plan(StatementQuery, List)} uses a fresh {@link PlanningContext}
 * that shares sub-plans for repeated (query, injected) pairs.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class HashQueryPlanner {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(HashQueryPlanner.class);

    /**
     * Plan a query.
     * @param query the query to plan
     * @return the plan
     */
    @Nonnull
    public HashQueryPlan plan(@Nonnull StatementQuery query) {
        return plan(query, ImmutableList.of());
    }

    /**
     * Plan a query with cross-cutting constraints applied to every scan it produces.
     * @param query the query to plan
     * @param injected cross-cutting constraints, at most one per family and polarity
     * @return the plan
     * @throws MalformedQueryException if a constraint of the same family as {@code query} is injected into it
     */
    @Nonnull
    public HashQueryPlan plan(@Nonnull StatementQuery query, @Nonnull List<? extends IntrusiveQuery<?>> injected) {
        final PlanningContext context = new PlanningContext();
        final HashQueryPlan plan = context.plan(query, ImmutableList.copyOf(injected));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("planned query",
                    LogMessageKeys.QUERY, query,
                    LogMessageKeys.INJECTED, injected,
                    LogMessageKeys.PLAN, plan));
        }
        return plan;
    }

    /**
     * State of a single planning call.
     */
    static class PlanningContext {
        @Nonnull
        private final Map<PlanKey, HashQueryPlan> plans = new HashMap<>();

        @Nonnull
        HashQueryPlan plan(@Nonnull StatementQuery query, @Nonnull List<IntrusiveQuery<?>> injected) {
            final PlanKey key = new PlanKey(query, injected);
            final HashQueryPlan existing = plans.get(key);
            if (existing != null) {
                return existing;
            }
            final HashQueryPlan plan;
            if (query.isEmpty()) {
                plan = EmptyHashesPlan.INSTANCE;
            } else if (query.isFull()) {
                plan = population(injected);
            } else {
                plan = query.accept(new Lowering(this, injected));
            }
            plans.put(key, plan);
            return plan;
        }
    }

    private static final class PlanKey {
        @Nonnull
        private final StatementQuery query;
        @Nonnull
        private final List<IntrusiveQuery<?>> injected;

        PlanKey(@Nonnull StatementQuery query, @Nonnull List<IntrusiveQuery<?>> injected) {
            this.query = query;
            this.injected = injected;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            PlanKey planKey = (PlanKey)o;
            return query.equals(planKey.query) && injected.equals(planKey.injected);
        }

        @Override
        public int hashCode() {
            return Objects.hash(query, injected);
        }
    }

    /**
     * Every fingerprint satisfying the injected constraints.
     */
    @Nonnull
    private static HashQueryPlan population(@Nonnull List<IntrusiveQuery<?>> injected) {
        if (injected.isEmpty()) {
            return AllHashesPlan.INSTANCE;
        }
        return new RelationScanPlan(ReadonlyTable.SOURCE_META, conjoin(null, ReadonlyTable.SOURCE_META, injected));
    }

    @Nullable
    private static FilterPredicate conjoin(@Nullable FilterPredicate predicate, @Nonnull ReadonlyTable table,
                                           @Nonnull List<IntrusiveQuery<?>> injected) {
        final List<FilterPredicate> conjuncts = new ArrayList<>(injected.size() + 1);
        if (predicate != null) {
            conjuncts.add(predicate);
        }
        for (IntrusiveQuery<?> constraint : injected) {
            conjuncts.add(constraint.getPredicate(table));
        }
        return conjuncts.isEmpty() ? null : AndPredicate.of(conjuncts);
    }

    @Nonnull
    private static HashQueryPlan combine(@Nonnull Set<HashQueryPlan> plans, boolean intersect) {
        if (plans.isEmpty()) {
            return EmptyHashesPlan.INSTANCE;
        }
        if (plans.size() == 1) {
            return plans.iterator().next();
        }
        final List<HashQueryPlan> children = ImmutableList.copyOf(plans);
        return intersect ? new IntersectionPlan(children) : new UnionPlan(children);
    }

    private static class Lowering implements StatementQueryVisitor<HashQueryPlan> {
        @Nonnull
        private final PlanningContext context;
        @Nonnull
        private final List<IntrusiveQuery<?>> injected;

        Lowering(@Nonnull PlanningContext context, @Nonnull List<IntrusiveQuery<?>> injected) {
            this.context = context;
            this.injected = injected;
        }

        @Nonnull
        private HashQueryPlan scanSourceMeta(@Nonnull FilterPredicate predicate) {
            return new RelationScanPlan(ReadonlyTable.SOURCE_META, conjoin(predicate, ReadonlyTable.SOURCE_META, injected));
        }

        @Nonnull
        private HashQueryPlan source(@Nonnull SourceQuery query) {
            return scanSourceMeta(query.getPredicate());
        }

        @Nonnull
        private HashQueryPlan mention(@Nonnull ReadonlyTable table, @Nonnull FilterPredicate predicate, boolean inverted) {
            if (!inverted) {
                return new RelationScanPlan(table, conjoin(predicate, table, injected));
            }
            return new ExceptPlan(population(injected), new RelationScanPlan(table, predicate));
        }

        @Nonnull
        private HashQueryPlan intrusive(@Nonnull IntrusiveQuery<?> query) {
            for (IntrusiveQuery<?> constraint : injected) {
                if (constraint.isSameFamily(query)) {
                    throw new MalformedQueryException("cross-cutting constraint injected into its own family",
                            LogMessageKeys.FAMILY, query.getFamilyName(),
                            LogMessageKeys.QUERY, query,
                            LogMessageKeys.INJECTED, constraint);
                }
            }
            return scanSourceMeta(query.getPredicate(ReadonlyTable.SOURCE_META));
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasAgent(@Nonnull HasAgent query) {
            return mention(query.getTable(), query.getMentionPredicate(), query.isInverted());
        }

        @Nonnull
        @Override
        public HashQueryPlan visitFromMeshId(@Nonnull FromMeshId query) {
            return mention(query.getTable(), query.getMentionPredicate(), query.isInverted());
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasHash(@Nonnull HasHash query) {
            return source(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasSources(@Nonnull HasSources query) {
            return source(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasOnlySource(@Nonnull HasOnlySource query) {
            return source(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasReadings(@Nonnull HasReadings query) {
            return source(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasDatabases(@Nonnull HasDatabases query) {
            return source(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitSourceIntersection(@Nonnull SourceIntersection query) {
            return scanSourceMeta(query.getPredicate());
        }

        @Nonnull
        @Override
        public HashQueryPlan visitFromPapers(@Nonnull FromPapers query) {
            return new PaperScanPlan(query.getPaperPredicate(), conjoin(null, ReadonlyTable.SOURCE_META, injected));
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasType(@Nonnull HasType query) {
            return intrusive(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasNumAgents(@Nonnull HasNumAgents query) {
            return intrusive(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitHasNumEvidence(@Nonnull HasNumEvidence query) {
            return intrusive(query);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitIntersection(@Nonnull Intersection query) {
            final Map<String, StatementQuery> merged = new LinkedHashMap<>();
            for (IntrusiveQuery<?> constraint : query.getInjected()) {
                merged.put(polarityKey(constraint), constraint);
            }
            for (IntrusiveQuery<?> constraint : injected) {
                merged.merge(polarityKey(constraint), constraint, StatementQuery::and);
            }
            final List<IntrusiveQuery<?>> combined = new ArrayList<>(merged.size());
            for (StatementQuery constraint : merged.values()) {
                if (constraint.isEmpty()) {
                    return EmptyHashesPlan.INSTANCE;
                }
                if (!constraint.isFull()) {
                    combined.add((IntrusiveQuery<?>)constraint);
                }
            }

            final Set<HashQueryPlan> plans = new LinkedHashSet<>();
            for (StatementQuery child : query.getChildren()) {
                if (!(child instanceof IntrusiveQuery)) {
                    plans.add(context.plan(child, ImmutableList.copyOf(combined)));
                }
            }
            if (plans.isEmpty()) {
                if (combined.isEmpty()) {
                    throw new MalformedQueryException("intersection has nothing to plan", LogMessageKeys.QUERY, query);
                }
                return population(ImmutableList.copyOf(combined));
            }
            return combine(plans, true);
        }

        @Nonnull
        @Override
        public HashQueryPlan visitUnion(@Nonnull Union query) {
            final Set<HashQueryPlan> plans = new LinkedHashSet<>();
            for (StatementQuery child : query.getChildren()) {
                StatementQuery option = child;
                List<IntrusiveQuery<?>> remaining = injected;
                if (child instanceof IntrusiveQuery) {
                    final IntrusiveQuery<?> intrusive = (IntrusiveQuery<?>)child;
                    final ImmutableList.Builder<IntrusiveQuery<?>> others = ImmutableList.builder();
                    for (IntrusiveQuery<?> constraint : injected) {
                        if (intrusive.isSameFamily(constraint)) {
                            option = option.and(constraint);
                        } else {
                            others.add(constraint);
                        }
                    }
                    remaining = others.build();
                }
                if (!option.isEmpty()) {
                    plans.add(context.plan(option, remaining));
                }
            }
            return combine(plans, false);
        }

        @Nonnull
        private static String polarityKey(@Nonnull StatementQuery query) {
            return (query.isInverted() ? "~" : "") + query.getFamilyName();
        }
    }
}
