/*
 * HasNumAgents.java
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
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.ReadonlyColumns;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Set;

/**
 * Statements with one of a set of agent counts. For example {@code new HasNumAgents(List.of(1, 2))} matches
 * statements with one or two agents.
 */
@API(API.Status.UNSTABLE)
public class HasNumAgents extends IntrusiveQuery<Integer> {
    public HasNumAgents(@Nonnull Collection<Integer> agentCounts) {
        this(positive(agentCounts), false);
    }

    private HasNumAgents(@Nonnull ImmutableSortedSet<Integer> agentCounts, boolean inverted) {
        super(agentCounts, inverted);
    }

    private HasNumAgents(@Nonnull ImmutableSortedSet<Integer> agentCounts, boolean inverted, boolean empty, boolean full) {
        super(agentCounts, inverted, empty, full);
    }

    @Nonnull
    static ImmutableSortedSet<Integer> positive(@Nonnull Collection<Integer> counts) {
        for (Integer count : counts) {
            if (count == null || count <= 0) {
                throw new ReadonlyCoreArgumentException("counts must be positive", LogMessageKeys.VALUE, count);
            }
        }
        return ImmutableSortedSet.copyOf(counts);
    }

    @Nonnull
    @Override
    public HasNumAgents withValues(@Nonnull Set<Integer> values, boolean inverted) {
        return new HasNumAgents(copyOf(values), inverted);
    }

    @Nonnull
    @Override
    public HasNumAgents invert() {
        return (HasNumAgents)super.invert();
    }

    @Nonnull
    @Override
    HasNumAgents copy(boolean inverted, boolean empty, boolean full) {
        return new HasNumAgents(getValues(), inverted, empty, full);
    }

    @Nonnull
    @Override
    public String getColumn() {
        return ReadonlyColumns.AGENT_COUNT;
    }

    @Nonnull
    @Override
    String getValuesKey() {
        return "agent_nums";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasNumAgents(this);
    }

    @Override
    public String toString() {
        return "number of agents " + (isInverted() ? "not " : "") + "in " + getValues();
    }
}
