/*
 * HasHash.java
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
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Set;

/**
 * Statements whose fingerprint is one of a set of hashes.
 */
@API(API.Status.UNSTABLE)
public class HasHash extends SourceQuery implements ValueSetQuery<Long> {
    @Nonnull
    private final ImmutableSortedSet<Long> hashes;

    public HasHash(@Nonnull Collection<Long> hashes) {
        this(ImmutableSortedSet.copyOf(hashes), false);
    }

    private HasHash(@Nonnull ImmutableSortedSet<Long> hashes, boolean inverted) {
        this(hashes, inverted, hashes.isEmpty() && !inverted, hashes.isEmpty() && inverted);
    }

    private HasHash(@Nonnull ImmutableSortedSet<Long> hashes, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.hashes = hashes;
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<Long> getValues() {
        return hashes;
    }

    @Nonnull
    @Override
    public HasHash withValues(@Nonnull Set<Long> values, boolean inverted) {
        return new HasHash(ImmutableSortedSet.copyOf(values), inverted);
    }

    @Nonnull
    @Override
    public HasHash invert() {
        return (HasHash)super.invert();
    }

    @Nonnull
    @Override
    HasHash copy(boolean inverted, boolean empty, boolean full) {
        return new HasHash(hashes, inverted, empty, full);
    }

    @Nonnull
    @Override
    public FilterPredicate getPredicate() {
        return ColumnPredicate.in(ReadonlyTable.SOURCE_META, ReadonlyColumns.MK_HASH, hashes, isInverted());
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
        final JsonArray values = new JsonArray();
        hashes.forEach(values::add);
        final JsonObject json = new JsonObject();
        json.add("hashes", values);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasHash(this);
    }

    @Override
    public String toString() {
        return "hash " + (isInverted() ? "not " : "") + "in " + hashes;
    }
}
