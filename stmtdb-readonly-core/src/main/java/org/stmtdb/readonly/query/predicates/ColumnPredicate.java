/*
 * ColumnPredicate.java
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

package org.stmtdb.readonly.query.predicates;

import com.google.common.collect.ImmutableList;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyTable;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Objects;

/**
 * A comparison of one column of one table against a constant.
 */
@API(API.Status.UNSTABLE)
public class ColumnPredicate implements FilterPredicate {
    /**
     * The comparisons a column predicate can make.
     */
    public enum Comparison {
        EQUALS("=", "<>"),
        IN("IN", "NOT IN"),
        LIKE("LIKE", "NOT LIKE"),
        GREATER_THAN(">", "<="),
        IS_NULL("IS NULL", "IS NOT NULL"),
        NOT_DISTINCT_FROM("IS NOT DISTINCT FROM", "IS DISTINCT FROM");

        @Nonnull
        private final String symbol;
        @Nonnull
        private final String negatedSymbol;

        Comparison(@Nonnull String symbol, @Nonnull String negatedSymbol) {
            this.symbol = symbol;
            this.negatedSymbol = negatedSymbol;
        }

        @Nonnull
        public String getSymbol(boolean negated) {
            return negated ? negatedSymbol : symbol;
        }
    }

    @Nonnull
    private final ReadonlyTable table;
    @Nonnull
    private final String column;
    @Nonnull
    private final Comparison comparison;
    @Nullable
    private final Object comparand;
    private final boolean negated;

    public ColumnPredicate(@Nonnull ReadonlyTable table, @Nonnull String column, @Nonnull Comparison comparison,
                           @Nullable Object comparand, boolean negated) {
        if (comparison == Comparison.IN) {
            if (!(comparand instanceof Collection)) {
                throw new IllegalArgumentException("IN requires a collection comparand");
            }
            this.comparand = ImmutableList.copyOf((Collection<?>)comparand);
        } else {
            this.comparand = comparand;
        }
        if (comparison == Comparison.IS_NULL && comparand != null) {
            throw new IllegalArgumentException("IS NULL takes no comparand");
        }
        this.table = table;
        this.column = column;
        this.comparison = comparison;
        this.negated = negated;
    }

    @Nonnull
    public static ColumnPredicate equalTo(@Nonnull ReadonlyTable table, @Nonnull String column, @Nonnull Object value) {
        return new ColumnPredicate(table, column, Comparison.EQUALS, value, false);
    }

    /**
     * Membership in a set of values. A single value is compared with equality instead.
     * @param table the table
     * @param column the column
     * @param values the values
     * @param negated whether to match rows outside the set
     * @return the predicate
     */
    @Nonnull
    public static ColumnPredicate in(@Nonnull ReadonlyTable table, @Nonnull String column,
                                     @Nonnull Collection<?> values, boolean negated) {
        if (values.size() == 1) {
            return new ColumnPredicate(table, column, Comparison.EQUALS, values.iterator().next(), negated);
        }
        return new ColumnPredicate(table, column, Comparison.IN, values, negated);
    }

    @Nonnull
    public static ColumnPredicate like(@Nonnull ReadonlyTable table, @Nonnull String column, @Nonnull String pattern) {
        return new ColumnPredicate(table, column, Comparison.LIKE, pattern, false);
    }

    @Nonnull
    public static ColumnPredicate isNull(@Nonnull ReadonlyTable table, @Nonnull String column) {
        return new ColumnPredicate(table, column, Comparison.IS_NULL, null, false);
    }

    @Nonnull
    public ReadonlyTable getTable() {
        return table;
    }

    @Nonnull
    public String getColumn() {
        return column;
    }

    @Nonnull
    public Comparison getComparison() {
        return comparison;
    }

    @Nullable
    public Object getComparand() {
        return comparand;
    }

    public boolean isNegated() {
        return negated;
    }

    @Nonnull
    @Override
    public ColumnPredicate negate() {
        return new ColumnPredicate(table, column, comparison, comparand, !negated);
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull FilterPredicateVisitor<T> visitor) {
        return visitor.visitColumn(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnPredicate that = (ColumnPredicate)o;
        return negated == that.negated && table == that.table && column.equals(that.column) &&
               comparison == that.comparison && Objects.equals(comparand, that.comparand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column, comparison, comparand, negated);
    }

    @Override
    public String toString() {
        final StringBuilder str = new StringBuilder();
        str.append(table.getTableName()).append('.').append(column).append(' ').append(comparison.getSymbol(negated));
        if (comparison != Comparison.IS_NULL) {
            str.append(' ').append(comparand);
        }
        return str.toString();
    }
}
