/*
 * IntrusiveQuery.java
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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;

/**
 * Base class for cross-cutting queries: statement type, agent count and evidence count. Their columns are present
 * in every hash scannable table, so inside an {@link Intersection} they are not planned on their own but injected
 * into the scans of their siblings.
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public abstract class IntrusiveQuery<V extends Comparable<? super V>> extends StatementQuery implements ValueSetQuery<V> {
    @Nonnull
    private final ImmutableSortedSet<V> values;

    IntrusiveQuery(@Nonnull ImmutableSortedSet<V> values, boolean inverted) {
        this(values, inverted, values.isEmpty() && !inverted, values.isEmpty() && inverted);
    }

    IntrusiveQuery(@Nonnull ImmutableSortedSet<V> values, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.values = values;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<V> getValues() {
        return values;
    }

    /**
     * Get the column holding this family's values.
     * @return the column name
     */
    @Nonnull
    public abstract String getColumn();

    /**
     * Get the key under which this family's values appear in the constraint JSON.
     * @return the key
     */
    @Nonnull
    abstract String getValuesKey();

    /**
     * Get the values as stored in the column, which may differ from the values held by the query.
     * @return the column values
     */
    @Nonnull
    List<?> getColumnValues() {
        return values.asList();
    }

    /**
     * Get the condition on rows of a hash scannable table, with any inversion applied.
     * @param table the table being scanned
     * @return the row predicate
     */
    @Nonnull
    public FilterPredicate getPredicate(@Nonnull ReadonlyTable table) {
        return ColumnPredicate.in(table, getColumn(), getColumnValues(), isInverted());
    }

    /**
     * Whether {@code other} belongs to the same cross-cutting family as this query.
     * @param other another query
     * @return {@code true} if both are of the same class
     */
    public boolean isSameFamily(@Nonnull StatementQuery other) {
        return other.getClass() == getClass();
    }

    @Nonnull
    @Override
    StatementQuery doAnd(@Nonnull StatementQuery other) {
        final StatementQuery merged = ValueSets.merge(this, other, true);
        return merged != null ? merged : super.doAnd(other);
    }

    @Nonnull
    @Override
    StatementQuery doOr(@Nonnull StatementQuery other) {
        final StatementQuery merged = ValueSets.merge(this, other, false);
        return merged != null ? merged : super.doOr(other);
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonArray array = new JsonArray();
        for (V value : values) {
            if (value instanceof Number) {
                array.add((Number)value);
            } else {
                array.add(value.toString());
            }
        }
        final JsonObject json = new JsonObject();
        json.add(getValuesKey(), array);
        return json;
    }

    @Nonnull
    static <V extends Comparable<? super V>> ImmutableSortedSet<V> copyOf(@Nonnull Collection<V> values) {
        return ImmutableSortedSet.copyOf(values);
    }
}
