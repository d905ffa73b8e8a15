/*
 * QueryJson.java
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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.AgentRole;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Rebuilds statement queries from the JSON written by {@link StatementQuery#toJson()}.
 */
@API(API.Status.UNSTABLE)
public final class QueryJson {
    private QueryJson() {
    }

    @Nonnull
    public static StatementQuery fromJson(@Nonnull String json) {
        try {
            return fromJson(JsonParser.parseString(json).getAsJsonObject());
        } catch (JsonParseException | IllegalStateException e) {
            final ReadonlyCoreArgumentException malformed =
                    new ReadonlyCoreArgumentException("malformed query json", LogMessageKeys.QUERY, json);
            malformed.initCause(e);
            throw malformed;
        }
    }

    /**
     * Rebuild a query from its JSON description.
     * @param json an object with the keys {@code class}, {@code constraint} and {@code inverted}
     * @return a query equal to the one that was written
     * @throws ReadonlyCoreArgumentException if the class is unknown or the constraint is invalid
     */
    @Nonnull
    public static StatementQuery fromJson(@Nonnull JsonObject json) {
        final String queryClass = json.get("class").getAsString();
        final JsonObject constraint = json.getAsJsonObject("constraint");
        final StatementQuery query = build(queryClass, constraint);
        final JsonElement inverted = json.get("inverted");
        if (inverted != null && inverted.getAsBoolean()) {
            return query.invert();
        }
        return query;
    }

    @Nonnull
    @SuppressWarnings("java:S1541")
    private static StatementQuery build(@Nonnull String queryClass, @Nonnull JsonObject constraint) {
        switch (queryClass) {
            case "HasAgent":
                return hasAgent(constraint);
            case "FromMeshId":
                return new FromMeshId(constraint.get("mesh_id").getAsString());
            case "HasHash":
                return new HasHash(values(constraint, "hashes", JsonElement::getAsLong));
            case "HasSources":
                return new HasSources(values(constraint, "sources", JsonElement::getAsString));
            case "HasOnlySource":
                return new HasOnlySource(constraint.get("only_source").getAsString());
            case "HasReadings":
                return new HasReadings();
            case "HasDatabases":
                return new HasDatabases();
            case "FromPapers":
                return new FromPapers(values(constraint, "paper_list", element -> {
                    final JsonArray pair = element.getAsJsonArray();
                    return PaperRef.of(pair.get(0).getAsString(), pair.get(1).getAsString());
                }));
            case "HasType":
                return new HasType(values(constraint, "stmt_types", JsonElement::getAsString));
            case "HasNumAgents":
                return new HasNumAgents(values(constraint, "agent_nums", JsonElement::getAsInt));
            case "HasNumEvidence":
                return new HasNumEvidence(values(constraint, "evidence_nums", JsonElement::getAsInt));
            case "SourceIntersection":
                return SourceIntersection.of(children(constraint, "source_queries"));
            case "Intersection":
                return Intersection.of(children(constraint, "query_list"));
            case "Union":
                return Union.of(children(constraint, "query_list"));
            default:
                throw new ReadonlyCoreArgumentException("unknown query class", LogMessageKeys.QUERY_CLASS, queryClass);
        }
    }

    @Nonnull
    private static HasAgent hasAgent(@Nonnull JsonObject constraint) {
        final String role = optionalString(constraint, "role");
        final JsonElement agentNum = constraint.get("agent_num");
        return new HasAgent(constraint.get("agent_id").getAsString(),
                constraint.get("namespace").getAsString(),
                role == null ? null : AgentRole.fromName(role),
                agentNum == null || agentNum.isJsonNull() ? null : agentNum.getAsInt());
    }

    @Nullable
    private static String optionalString(@Nonnull JsonObject constraint, @Nonnull String key) {
        final JsonElement element = constraint.get(key);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    @Nonnull
    private static <V> List<V> values(@Nonnull JsonObject constraint, @Nonnull String key,
                                      @Nonnull Function<JsonElement, V> converter) {
        final List<V> values = new ArrayList<>();
        for (JsonElement element : constraint.getAsJsonArray(key)) {
            values.add(converter.apply(element));
        }
        return values;
    }

    @Nonnull
    private static List<StatementQuery> children(@Nonnull JsonObject constraint, @Nonnull String key) {
        return values(constraint, key, element -> fromJson(element.getAsJsonObject()));
    }
}
