/*
 * EvidenceFilter.java
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
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A boolean condition on individual evidence rows, used to narrow the evidence fetched for each statement.
 *
 * <p>
 * A filter is a list of elements, each either a {@link Leaf} or a nested filter, joined by a single
 * {@link Joiner}. A leaf requires that a row of an evidence table related to the raw statement does (or does not)
 * exist matching a predicate. Filters are usually obtained from {@link EvidenceFilterable} queries and combined with
 * {@link #and} and {@link #or}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class EvidenceFilter implements EvidenceFilterElement {
    /**
     * How the elements of one level of a filter are combined.
     */
    public enum Joiner {
        AND,
        OR
    }

    @Nonnull
    private final ImmutableList<EvidenceFilterElement> elements;
    @Nonnull
    private final Joiner joiner;

    private EvidenceFilter(@Nonnull List<EvidenceFilterElement> elements, @Nonnull Joiner joiner) {
        this.elements = ImmutableList.copyOf(elements);
        this.joiner = joiner;
    }

    /**
     * Require that a matching row exists in an evidence table.
     * @param table the evidence table
     * @param predicate the condition on its rows
     * @return a single leaf filter
     */
    @Nonnull
    public static EvidenceFilter exists(@Nonnull ReadonlyTable table, @Nonnull FilterPredicate predicate) {
        return new EvidenceFilter(ImmutableList.of(new Leaf(table, predicate, true)), Joiner.AND);
    }

    /**
     * Require that no matching row exists in an evidence table.
     * @param table the evidence table
     * @param predicate the condition on its rows
     * @return a single leaf filter
     */
    @Nonnull
    public static EvidenceFilter notExists(@Nonnull ReadonlyTable table, @Nonnull FilterPredicate predicate) {
        return new EvidenceFilter(ImmutableList.of(new Leaf(table, predicate, false)), Joiner.AND);
    }

    @Nonnull
    public List<EvidenceFilterElement> getElements() {
        return elements;
    }

    @Nonnull
    public Joiner getJoiner() {
        return joiner;
    }

    @Nonnull
    public EvidenceFilter and(@Nonnull EvidenceFilter other) {
        return merge(other, Joiner.AND);
    }

    @Nonnull
    public EvidenceFilter or(@Nonnull EvidenceFilter other) {
        return merge(other, Joiner.OR);
    }

    // A level whose joiner is the operation's (or that has one element) is spliced in; any other is nested.
    @Nonnull
    private EvidenceFilter merge(@Nonnull EvidenceFilter other, @Nonnull Joiner operation) {
        final List<EvidenceFilterElement> merged = new ArrayList<>();
        addElements(merged, this, operation);
        addElements(merged, other, operation);
        return new EvidenceFilter(merged, operation);
    }

    private static void addElements(@Nonnull List<EvidenceFilterElement> merged, @Nonnull EvidenceFilter filter,
                                    @Nonnull Joiner operation) {
        if (filter.joiner == operation || filter.elements.size() == 1) {
            merged.addAll(filter.elements);
        } else {
            merged.add(filter);
        }
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull EvidenceFilterVisitor<T> visitor) {
        return visitor.visitFilter(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EvidenceFilter that = (EvidenceFilter)o;
        return joiner == that.joiner && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, joiner);
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString)
                .collect(Collectors.joining(" " + joiner + " ", "(", ")"));
    }

    /**
     * A single existence test against one evidence table.
     */
    public static class Leaf implements EvidenceFilterElement {
        @Nonnull
        private final ReadonlyTable table;
        @Nonnull
        private final FilterPredicate predicate;
        private final boolean exists;

        Leaf(@Nonnull ReadonlyTable table, @Nonnull FilterPredicate predicate, boolean exists) {
            if (table.getKind() != ReadonlyTable.Kind.EVIDENCE) {
                throw new IllegalArgumentException("evidence filters only apply to evidence tables: " + table);
            }
            this.table = table;
            this.predicate = predicate;
            this.exists = exists;
        }

        @Nonnull
        public ReadonlyTable getTable() {
            return table;
        }

        @Nonnull
        public FilterPredicate getPredicate() {
            return predicate;
        }

        /**
         * Whether a matching row is required to exist, as opposed to required to be absent.
         * @return {@code true} for an existence test
         */
        public boolean isExists() {
            return exists;
        }

        @Nonnull
        @Override
        public <T> T accept(@Nonnull EvidenceFilterVisitor<T> visitor) {
            return visitor.visitLeaf(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Leaf leaf = (Leaf)o;
            return exists == leaf.exists && table == leaf.table && predicate.equals(leaf.predicate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(table, predicate, exists);
        }

        @Override
        public String toString() {
            return (exists ? "exists " : "not exists ") + predicate;
        }
    }
}
