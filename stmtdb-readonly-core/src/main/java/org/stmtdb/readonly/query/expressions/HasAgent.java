/*
 * HasAgent.java
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
import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.AgentIds;
import org.stmtdb.readonly.metadata.AgentRole;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Statements with an agent matching an identifier in a namespace, optionally in a given role or position.
 *
 * <p>
 * Agents are stored one row per mention, so a statement may match on several rows. The inverse of this query is
 * therefore not a row-level negation: it is planned as the full population of fingerprints minus those matching.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class HasAgent extends StatementQuery {
    public static final String DEFAULT_NAMESPACE = "NAME";

    @Nonnull
    private final String agentId;
    @Nonnull
    private final String namespace;
    @Nullable
    private final AgentRole role;
    @Nullable
    private final Integer agentNum;
    @Nonnull
    private final String regularizedId;

    public HasAgent(@Nonnull String agentId) {
        this(agentId, DEFAULT_NAMESPACE, null, null);
    }

    public HasAgent(@Nonnull String agentId, @Nonnull String namespace) {
        this(agentId, namespace, null, null);
    }

    /**
     * Create an agent query.
     * @param agentId the identifier, e.g. {@code MEK} or {@code CHEBI:15996}
     * @param namespace the namespace of the identifier, e.g. {@code NAME}, {@code TEXT}, {@code HGNC}
     * @param role the role the agent must play, or {@code null}
     * @param agentNum the position the agent must have, or {@code null}
     * @throws ReadonlyCoreArgumentException if both a role and a position are given, or the position is negative
     */
    public HasAgent(@Nonnull String agentId, @Nonnull String namespace, @Nullable AgentRole role, @Nullable Integer agentNum) {
        this(agentId, namespace.toUpperCase(Locale.ROOT), role, agentNum, false, false, false);
    }

    @SuppressWarnings("java:S107")
    private HasAgent(@Nonnull String agentId, @Nonnull String namespace, @Nullable AgentRole role,
                     @Nullable Integer agentNum, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        if (role != null && agentNum != null) {
            throw new ReadonlyCoreArgumentException("only specify role or agent number, not both",
                    LogMessageKeys.ROLE, role, LogMessageKeys.AGENT_NUM, agentNum);
        }
        if (agentNum != null && agentNum < 0) {
            throw new ReadonlyCoreArgumentException("agent number must not be negative", LogMessageKeys.AGENT_NUM, agentNum);
        }
        this.agentId = agentId;
        this.namespace = namespace;
        this.role = role;
        this.agentNum = agentNum;
        this.regularizedId = AgentIds.regularize(namespace, agentId);
    }

    @Nonnull
    public String getAgentId() {
        return agentId;
    }

    @Nonnull
    public String getNamespace() {
        return namespace;
    }

    @Nullable
    public AgentRole getRole() {
        return role;
    }

    @Nullable
    public Integer getAgentNum() {
        return agentNum;
    }

    @Nonnull
    public String getRegularizedId() {
        return regularizedId;
    }

    /**
     * Get the mention table holding agents of this query's namespace.
     * @return the table
     */
    @Nonnull
    public ReadonlyTable getTable() {
        switch (namespace) {
            case "NAME":
                return ReadonlyTable.NAME_META;
            case "TEXT":
                return ReadonlyTable.TEXT_META;
            default:
                return ReadonlyTable.OTHER_META;
        }
    }

    /**
     * Get the condition on mention rows matching this agent. The inversion flag is not applied.
     * @return the mention predicate
     */
    @Nonnull
    public FilterPredicate getMentionPredicate() {
        final ReadonlyTable table = getTable();
        final List<FilterPredicate> clauses = new ArrayList<>();
        clauses.add(ColumnPredicate.like(table, ReadonlyColumns.DB_ID, regularizedId));
        if (table == ReadonlyTable.OTHER_META) {
            clauses.add(ColumnPredicate.like(table, ReadonlyColumns.DB_NAME, namespace));
        }
        if (role != null) {
            clauses.add(ColumnPredicate.equalTo(table, ReadonlyColumns.ROLE_NUM, role.getRoleNum()));
        } else if (agentNum != null) {
            clauses.add(ColumnPredicate.equalTo(table, ReadonlyColumns.AG_NUM, agentNum));
        }
        return AndPredicate.of(ImmutableList.copyOf(clauses));
    }

    @Nonnull
    @Override
    public HasAgent invert() {
        return (HasAgent)super.invert();
    }

    @Nonnull
    @Override
    HasAgent copy(boolean inverted, boolean empty, boolean full) {
        return new HasAgent(agentId, namespace, role, agentNum, inverted, empty, full);
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonObject json = new JsonObject();
        json.addProperty("agent_id", agentId);
        json.addProperty("namespace", namespace);
        json.addProperty("role", role == null ? null : role.name());
        json.addProperty("agent_num", agentNum);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasAgent(this);
    }

    @Override
    public String toString() {
        final StringBuilder str = new StringBuilder();
        if (isInverted()) {
            str.append("not ");
        }
        str.append("has an agent where ").append(namespace).append(" = ").append(agentId);
        if (role != null) {
            str.append(" with role=").append(role);
        } else if (agentNum != null) {
            str.append(" with agent_num=").append(agentNum);
        }
        return str.toString();
    }
}
