/*
 * StatementTypesTest.java
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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;

import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StatementTypes}, {@link Sources} and {@link AgentIds}.
 */
public class StatementTypesTest {

    @Test
    public void typeNumbersAreAlphabeticalPositions() {
        assertEquals(0, StatementTypes.byName("Acetylation").getTypeNum());
        assertEquals(1, StatementTypes.byName("Activation").getTypeNum());
        final Set<Integer> seen = new HashSet<>();
        for (StatementType type : StatementTypes.all()) {
            assertTrue(seen.add(type.getTypeNum()), "duplicate type number for " + type.getName());
            assertSame(type, StatementTypes.byTypeNum(type.getTypeNum()));
        }
    }

    @Test
    public void descendants() {
        assertThat(StatementTypes.descendantNames("RegulateActivity"), containsInAnyOrder("Activation", "Inhibition"));
        assertThat(StatementTypes.descendantNames("Modification"),
                hasItems("AddModification", "RemoveModification", "Phosphorylation", "Dephosphorylation"));
        assertThat(StatementTypes.descendantNames("Modification"), not(hasItem("Autophosphorylation")));
        assertTrue(StatementTypes.descendantNames("Phosphorylation").isEmpty());
    }

    @Test
    public void agentOrder() {
        assertEquals(ImmutableList.of("enz", "sub"), StatementTypes.byName("Dephosphorylation").getAgentOrder());
        assertEquals(ImmutableList.of("subj", "obj_from", "obj_to"), StatementTypes.byName("Conversion").getAgentOrder());
        assertEquals(ImmutableList.of("members"), StatementTypes.byName("Complex").getAgentOrder());
    }

    @Test
    public void unknownTypes() {
        assertFalse(StatementTypes.isKnown("phosphorylation"));
        assertThrows(ReadonlyCoreArgumentException.class, () -> StatementTypes.byName("Nothing"));
        assertThrows(ReadonlyCoreArgumentException.class, () -> StatementTypes.byTypeNum(-3));
    }

    @Test
    public void sources() {
        assertTrue(Sources.isKnown("reach"));
        assertTrue(Sources.isKnown("signor"));
        assertEquals(Sources.READING.size() + Sources.DATABASES.size(), Sources.ALL.size());
        assertThrows(ReadonlyCoreArgumentException.class, () -> Sources.validate("reach; drop table source_meta"));
    }

    @Test
    public void regularizedAgentIds() {
        assertEquals("1234", AgentIds.regularize("CHEBI", "CHEBI:CHEBI:1234"));
        assertEquals("0005737", AgentIds.regularize("go", "GO:0005737"));
        assertEquals("GO:0005737", AgentIds.regularize("NAME", "GO:0005737"));
    }

    @Test
    public void roles() {
        assertSame(AgentRole.SUBJECT, AgentRole.fromName("subject"));
        assertEquals(-1, AgentRole.SUBJECT.getRoleNum());
        assertThrows(ReadonlyCoreArgumentException.class, () -> AgentRole.fromName("catalyst"));
    }
}
