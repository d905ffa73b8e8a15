/*
 * FetchPropertiesTest.java
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

package org.stmtdb.readonly;

import org.junit.jupiter.api.Test;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.expressions.Query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FetchProperties}.
 */
public class FetchPropertiesTest {
    private static final int LIMIT = 50;
    private static final int OFFSET = 100;

    @Test
    public void testNoLimits() {
        assertNull(FetchProperties.NO_LIMITS.getLimit());
        assertEquals(0, FetchProperties.NO_LIMITS.getOffset());
        assertTrue(FetchProperties.NO_LIMITS.isBestFirst());
        assertNull(FetchProperties.NO_LIMITS.getEvidenceLimit());
        assertNull(FetchProperties.NO_LIMITS.getEvidenceFilter());
    }

    @Test
    public void testSetters() {
        final EvidenceFilter filter = Query.hasReadings().getEvidenceFilter();
        final FetchProperties base = FetchProperties.newBuilder()
                .setLimit(LIMIT)
                .setOffset(OFFSET)
                .setBestFirst(false)
                .setEvidenceLimit(5)
                .setEvidenceFilter(filter)
                .build();

        final FetchProperties next = base.setOffset(OFFSET + LIMIT);
        assertEquals(OFFSET + LIMIT, next.getOffset());
        assertEquals(Integer.valueOf(LIMIT), next.getLimit());
        assertEquals(Integer.valueOf(5), next.getEvidenceLimit());
        assertEquals(filter, next.getEvidenceFilter());
        assertNotEquals(base, next);
        assertSame(base, base.setOffset(OFFSET));

        final FetchProperties unlimited = base.clearOffsetAndLimit();
        assertNull(unlimited.getLimit());
        assertEquals(0, unlimited.getOffset());
        assertEquals(base.toBuilder().setLimit(null).setOffset(0).build(), unlimited);
        assertSame(unlimited, unlimited.clearOffsetAndLimit());
    }

    @Test
    public void testNegativeValues() {
        assertThrows(ReadonlyCoreArgumentException.class, () -> FetchProperties.newBuilder().setLimit(-1));
        assertThrows(ReadonlyCoreArgumentException.class, () -> FetchProperties.newBuilder().setOffset(-1));
        assertThrows(ReadonlyCoreArgumentException.class, () -> FetchProperties.newBuilder().setEvidenceLimit(-1));
        // Zero is a valid evidence limit: statements without evidence.
        assertEquals(Integer.valueOf(0), FetchProperties.newBuilder().setEvidenceLimit(0).build().getEvidenceLimit());
    }
}
