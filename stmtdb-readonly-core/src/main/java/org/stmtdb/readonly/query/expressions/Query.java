/*
 * Query.java
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
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.AgentRole;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Holder class for creating statement queries.
 */
@API(API.Status.UNSTABLE)
public class Query {
    private static final String TEXT_SUFFIX = "@TEXT";

    private Query() {
    }

    /**
     * Statements with an agent named {@code agentId}.
     * @param agentId the canonical name of the agent
     * @return a new agent query
     */
    @Nonnull
    public static HasAgent hasAgent(@Nonnull String agentId) {
        return new HasAgent(agentId);
    }

    @Nonnull
    public static HasAgent hasAgent(@Nonnull String agentId, @Nonnull String namespace) {
        return new HasAgent(agentId, namespace);
    }

    @Nonnull
    public static HasAgent hasAgent(@Nonnull String agentId, @Nonnull String namespace, @Nonnull AgentRole role) {
        return new HasAgent(agentId, namespace, role, null);
    }

    @Nonnull
    public static HasAgent hasAgentAt(@Nonnull String agentId, @Nonnull String namespace, int agentNum) {
        return new HasAgent(agentId, namespace, null, agentNum);
    }

    /**
     * Statements with an agent given in the {@code id@NAMESPACE} form. A bare id is a name, a {@code @TEXT} suffix
     * matches raw text (which may itself contain {@code @}), and {@code HGNC-SYMBOL} is treated as a name.
     * @param agentSpec the agent, e.g. {@code MEK@FPLX}
     * @param role the role the agent must play, or {@code null}
     * @return a new agent query
     * @throws ReadonlyCoreArgumentException if the agent string has more than one {@code @}
     */
    @Nonnull
    public static HasAgent hasAgentSpec(@Nonnull String agentSpec, @Nullable AgentRole role) {
        final String agentId;
        String namespace;
        if (agentSpec.endsWith(TEXT_SUFFIX)) {
            agentId = agentSpec.substring(0, agentSpec.length() - TEXT_SUFFIX.length());
            namespace = "TEXT";
        } else {
            final String[] parts = agentSpec.split("@", -1);
            if (parts.length == 1) {
                agentId = parts[0];
                namespace = HasAgent.DEFAULT_NAMESPACE;
            } else if (parts.length == 2) {
                agentId = parts[0];
                namespace = parts[1];
            } else {
                throw new ReadonlyCoreArgumentException("unrecognized agent spec", LogMessageKeys.AGENT_ID, agentSpec);
            }
        }
        if ("HGNC-SYMBOL".equals(namespace)) {
            namespace = HasAgent.DEFAULT_NAMESPACE;
        }
        return new HasAgent(agentId, namespace, role, null);
    }

    @Nonnull
    public static HasAgent hasAgentSpec(@Nonnull String agentSpec) {
        return hasAgentSpec(agentSpec, null);
    }

    @Nonnull
    public static HasHash hasHash(@Nonnull Long... hashes) {
        return new HasHash(Arrays.asList(hashes));
    }

    @Nonnull
    public static HasHash hasHash(@Nonnull List<Long> hashes) {
        return new HasHash(hashes);
    }

    @Nonnull
    public static HasSources hasSources(@Nonnull String... sources) {
        return new HasSources(Arrays.asList(sources));
    }

    @Nonnull
    public static HasOnlySource hasOnlySource(@Nonnull String source) {
        return new HasOnlySource(source);
    }

    @Nonnull
    public static HasReadings hasReadings() {
        return new HasReadings();
    }

    @Nonnull
    public static HasDatabases hasDatabases() {
        return new HasDatabases();
    }

    @Nonnull
    public static HasType hasType(@Nonnull String... statementTypes) {
        return new HasType(Arrays.asList(statementTypes));
    }

    /**
     * Statements of the given types or any of their subtypes.
     * @param statementTypes the type names
     * @return a new type query
     */
    @Nonnull
    public static HasType hasTypeOrSubtype(@Nonnull String... statementTypes) {
        return new HasType(Arrays.asList(statementTypes), true);
    }

    @Nonnull
    public static HasNumAgents hasNumAgents(@Nonnull Integer... agentCounts) {
        return new HasNumAgents(Arrays.asList(agentCounts));
    }

    @Nonnull
    public static HasNumEvidence hasNumEvidence(@Nonnull Integer... evidenceCounts) {
        return new HasNumEvidence(Arrays.asList(evidenceCounts));
    }

    @Nonnull
    public static FromMeshId fromMeshId(@Nonnull String meshId) {
        return new FromMeshId(meshId);
    }

    /**
     * Statements with evidence from a single paper.
     * @param idType the id type, e.g. {@code pmid}
     * @param paperId the id
     * @return a new paper query
     */
    @Nonnull
    public static FromPapers fromPaper(@Nonnull String idType, @Nonnull String paperId) {
        return new FromPapers(Collections.singletonList(PaperRef.of(idType, paperId)));
    }

    @Nonnull
    public static FromPapers fromPapers(@Nonnull List<PaperRef> papers) {
        return new FromPapers(papers);
    }

    /**
     * Statements matching all of the given queries.
     * @param first the first query
     * @param second the second query
     * @param operands any other queries
     * @return the simplified intersection
     */
    @Nonnull
    public static StatementQuery and(@Nonnull StatementQuery first, @Nonnull StatementQuery second,
                                     @Nonnull StatementQuery... operands) {
        StatementQuery result = first.and(second);
        for (StatementQuery operand : operands) {
            result = result.and(operand);
        }
        return result;
    }

    @Nonnull
    public static StatementQuery and(@Nonnull List<? extends StatementQuery> operands) {
        return Intersection.of(operands);
    }

    /**
     * Statements matching any of the given queries.
     * @param first the first query
     * @param second the second query
     * @param operands any other queries
     * @return the simplified union
     */
    @Nonnull
    public static StatementQuery or(@Nonnull StatementQuery first, @Nonnull StatementQuery second,
                                    @Nonnull StatementQuery... operands) {
        StatementQuery result = first.or(second);
        for (StatementQuery operand : operands) {
            result = result.or(operand);
        }
        return result;
    }

    @Nonnull
    public static StatementQuery or(@Nonnull List<? extends StatementQuery> operands) {
        return Union.of(operands);
    }

    @Nonnull
    public static StatementQuery not(@Nonnull StatementQuery operand) {
        return operand.invert();
    }

    @Nonnull
    static List<StatementQuery> toList(@Nonnull StatementQuery first, @Nonnull StatementQuery... rest) {
        final List<StatementQuery> list = new ArrayList<>(rest.length + 1);
        list.add(first);
        list.addAll(Arrays.asList(rest));
        return ImmutableList.copyOf(list);
    }
}
