/*
 * QueryJsonTest.java
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.metadata.AgentRole;

import java.util.Collections;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link QueryJson}.
 */
public class QueryJsonTest {

    static Stream<StatementQuery> trees() {
        return Stream.of(
                Query.hasAgent("MEK", "FPLX", AgentRole.SUBJECT).invert(),
                Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK"), Query.hasType("Phosphorylation"),
                        Query.hasNumEvidence(1, 2, 3).invert()),
                Query.hasSources("reach", "sparser").and(Query.hasHash(4L, 5L)).and(Query.hasReadings().invert()),
                Query.or(Query.fromMeshId("D000123"), Query.fromPapers(ImmutableList.of(
                        PaperRef.of("pmid", "1234"), PaperRef.of("trid", "77"))).invert(), Query.hasNumAgents(3)),
                Query.hasAgent("MEK").and(Query.hasTypeOrSubtype("Modification").or(Query.hasOnlySource("signor"))),
                Query.hasHash(Collections.emptyList()),
                Query.hasHash(Collections.emptyList()).invert(),
                Query.and(Query.hasAgent("MEK"), Query.hasType("Activation")).subtract(
                        Query.and(Query.hasAgent("MEK"), Query.hasType("Activation"))));
    }

    @ParameterizedTest
    @MethodSource("trees")
    public void rebuildsEqualTree(StatementQuery query) {
        final StatementQuery rebuilt = QueryJson.fromJson(query.toJsonString());
        assertEquals(query, rebuilt);
        assertEquals(query.toJson(), rebuilt.toJson());
        assertEquals(query.isEmpty(), rebuilt.isEmpty());
        assertEquals(query.isFull(), rebuilt.isFull());
    }

    @Test
    public void contradictionSurvivesRebuild() {
        final StatementQuery both = Query.and(Query.hasAgent("MEK"), Query.hasAgent("ERK"));
        final StatementQuery contradiction = both.and(both.invert());
        assertTrue(contradiction.isEmpty());
        final StatementQuery rebuilt = QueryJson.fromJson(contradiction.toJsonString());
        assertEquals(contradiction, rebuilt);
        assertTrue(rebuilt.isEmpty());
        assertTrue(rebuilt.invert().isFull());
    }

    @Test
    public void tautologySurvivesRebuild() {
        final StatementQuery either = Query.or(Query.hasAgent("MEK"), Query.hasAgent("ERK"));
        final StatementQuery tautology = either.or(either.invert());
        assertTrue(tautology.isFull());
        final StatementQuery rebuilt = QueryJson.fromJson(tautology.toJsonString());
        assertEquals(tautology, rebuilt);
        assertTrue(rebuilt.isFull());
        assertTrue(rebuilt.invert().isEmpty());

        final StatementQuery sources = Query.hasSources("reach").and(Query.hasHash(4L)).and(Query.hasAgent("MEK"));
        final StatementQuery covered = sources.or(sources.invert());
        assertTrue(covered.isFull());
        assertTrue(QueryJson.fromJson(covered.toJsonString()).isFull());
    }

    @Test
    public void canonicalValueOrder() {
        final JsonObject json = Query.hasHash(3L, 1L, 2L).toJson();
        assertEquals("[1,2,3]", json.getAsJsonObject("constraint").get("hashes").toString());
        assertEquals(Query.hasType("Inhibition", "Activation").toJsonString(),
                Query.hasType("Activation", "Inhibition").toJsonString());
    }

    @Test
    public void expandedTypesRoundTrip() {
        final StatementQuery query = Query.hasTypeOrSubtype("RegulateActivity");
        assertEquals(Query.hasType("Activation", "Inhibition", "RegulateActivity"), query);
        assertEquals(query, QueryJson.fromJson(query.toJsonString()));
    }

    @Test
    public void unknownClass() {
        assertThrows(ReadonlyCoreArgumentException.class,
                () -> QueryJson.fromJson("{\"class\": \"HasNothing\", \"constraint\": {}, \"inverted\": false}"));
    }

    @Test
    public void malformedJson() {
        final ReadonlyCoreArgumentException e = assertThrows(ReadonlyCoreArgumentException.class,
                () -> QueryJson.fromJson("{\"class\": "));
        assertTrue(e.getCause() != null);
    }
}
