/*
 * HasType.java
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
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.StatementTypes;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Statements of one of a set of types, e.g. {@code Phosphorylation} or {@code Activation}.
 */
@API(API.Status.UNSTABLE)
public class HasType extends IntrusiveQuery<String> {
    public HasType(@Nonnull Collection<String> statementTypes) {
        this(statementTypes, false);
    }

    /**
     * Create a type query.
     * @param statementTypes type names, spelled and capitalized as stored
     * @param includeSubclasses whether each type also matches all of the types descending from it
     * @throws org.stmtdb.readonly.ReadonlyCoreArgumentException if a type is unknown
     */
    public HasType(@Nonnull Collection<String> statementTypes, boolean includeSubclasses) {
        this(expand(statementTypes, includeSubclasses), false);
    }

    private HasType(@Nonnull ImmutableSortedSet<String> statementTypes, boolean inverted) {
        super(statementTypes, inverted);
    }

    private HasType(@Nonnull ImmutableSortedSet<String> statementTypes, boolean inverted, boolean empty, boolean full) {
        super(statementTypes, inverted, empty, full);
    }

    @Nonnull
    private static ImmutableSortedSet<String> expand(@Nonnull Collection<String> statementTypes, boolean includeSubclasses) {
        final Set<String> types = new TreeSet<>();
        for (String type : statementTypes) {
            StatementTypes.byName(type);
            types.add(type);
            if (includeSubclasses) {
                types.addAll(StatementTypes.descendantNames(type));
            }
        }
        return ImmutableSortedSet.copyOf(types);
    }

    @Nonnull
    @Override
    public HasType withValues(@Nonnull Set<String> values, boolean inverted) {
        return new HasType(copyOf(values), inverted);
    }

    @Nonnull
    @Override
    public HasType invert() {
        return (HasType)super.invert();
    }

    @Nonnull
    @Override
    HasType copy(boolean inverted, boolean empty, boolean full) {
        return new HasType(getValues(), inverted, empty, full);
    }

    @Nonnull
    @Override
    public String getColumn() {
        return ReadonlyColumns.TYPE_NUM;
    }

    @Nonnull
    @Override
    String getValuesKey() {
        return "stmt_types";
    }

    @Nonnull
    @Override
    List<?> getColumnValues() {
        return getValues().stream()
                .map(type -> StatementTypes.byName(type).getTypeNum())
                .sorted()
                .collect(Collectors.toList());
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasType(this);
    }

    @Override
    public String toString() {
        return "type " + (isInverted() ? "not " : "") + "in " + getValues();
    }
}
