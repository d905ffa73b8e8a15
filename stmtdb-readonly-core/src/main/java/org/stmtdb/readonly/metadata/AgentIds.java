/*
 * AgentIds.java
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

package org.stmtdb.readonly.metadata;

import com.google.common.collect.ImmutableSet;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Normalization of agent identifiers before they are matched against the mention tables.
 */
@API(API.Status.UNSTABLE)
public final class AgentIds {
    /**
     * Namespaces whose identifiers are stored without their embedded {@code PREFIX:}.
     */
    public static final ImmutableSet<String> PREFIXED_NAMESPACES =
            ImmutableSet.of("CHEBI", "GO", "CHEMBL", "DOID", "EFO", "HP", "MESH");

    private AgentIds() {
    }

    /**
     * Strip an embedded namespace prefix, so that {@code CHEBI:CHEBI:1234} and {@code CHEBI:1234} both match the
     * stored {@code 1234}. Identifiers of other namespaces are returned unchanged.
     * @param namespace the namespace of the identifier
     * @param agentId the identifier
     * @return the identifier as stored
     */
    @Nonnull
    public static String regularize(@Nonnull String namespace, @Nonnull String agentId) {
        final String ns = namespace.toUpperCase(Locale.ROOT);
        if (!PREFIXED_NAMESPACES.contains(ns)) {
            return agentId;
        }
        String id = agentId;
        final String prefix = ns + ":";
        while (id.toUpperCase(Locale.ROOT).startsWith(prefix)) {
            id = id.substring(prefix.length());
        }
        return id;
    }
}
