/*
 * HasNumEvidence.java
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

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Set;

/**
 * Statements with one of a set of evidence counts.
 */
@API(API.Status.UNSTABLE)
public class HasNumEvidence extends IntrusiveQuery<Integer> {
    public HasNumEvidence(@Nonnull Collection<Integer> evidenceCounts) {
        this(HasNumAgents.positive(evidenceCounts), false);
    }

    private HasNumEvidence(@Nonnull ImmutableSortedSet<Integer> evidenceCounts, boolean inverted) {
        super(evidenceCounts, inverted);
    }

    private HasNumEvidence(@Nonnull ImmutableSortedSet<Integer> evidenceCounts, boolean inverted, boolean empty, boolean full) {
        super(evidenceCounts, inverted, empty, full);
    }

    @Nonnull
    @Override
    public HasNumEvidence withValues(@Nonnull Set<Integer> values, boolean inverted) {
        return new HasNumEvidence(copyOf(values), inverted);
    }

    @Nonnull
    @Override
    public HasNumEvidence invert() {
        return (HasNumEvidence)super.invert();
    }

    @Nonnull
    @Override
    HasNumEvidence copy(boolean inverted, boolean empty, boolean full) {
        return new HasNumEvidence(getValues(), inverted, empty, full);
    }

    @Nonnull
    @Override
    public String getColumn() {
        return ReadonlyColumns.EV_COUNT;
    }

    @Nonnull
    @Override
    String getValuesKey() {
        return "evidence_nums";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasNumEvidence(this);
    }

    @Override
    public String toString() {
        return "number of evidence " + (isInverted() ? "not " : "") + "in " + getValues();
    }
}
