/*
 * ValueSets.java
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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;

/**
 * The merge rule shared by {@link ValueSetQuery} implementations.
 */
final class ValueSets {
    private ValueSets() {
    }

    /**
     * Merge two set-valued queries of the same class.
     *
     * <p>
     * With equal polarity, {@code and} intersects the values and {@code or} unions them; both are swapped for
     * inverted queries. Exact inverses give an empty query for {@code and} and a full one for {@code or}.
     * </p>
     * @param self the receiver
     * @param other the other operand
     * @param isAnd whether this is an intersection
     * @param <V> the value type
     * @param <Q> the query class
     * @return the merged query, or {@code null} if the two cannot be merged
     */
    @Nullable
    static <V extends Comparable<? super V>, Q extends StatementQuery & ValueSetQuery<V>> StatementQuery merge(
            @Nonnull Q self, @Nonnull StatementQuery other, boolean isAnd) {
        if (other.getClass() == self.getClass() && other.isInverted() == self.isInverted()) {
            @SuppressWarnings("unchecked")
            final ValueSetQuery<V> that = (ValueSetQuery<V>)other;
            final Set<V> merged;
            if (isAnd ^ self.isInverted()) {
                merged = Sets.intersection(self.getValues(), that.getValues());
            } else {
                merged = Sets.union(self.getValues(), that.getValues());
            }
            return self.withValues(merged, self.isInverted());
        }
        if (self.isInverseOf(other)) {
            return self.withValues(ImmutableSet.of(), !isAnd);
        }
        return null;
    }
}
