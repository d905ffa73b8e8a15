/*
 * HasDatabases.java
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

import com.google.common.collect.ImmutableSet;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.Sources;

import javax.annotation.Nonnull;

/**
 * Statements with evidence from at least one curated database.
 */
@API(API.Status.UNSTABLE)
public class HasDatabases extends SourceTypeQuery {
    public HasDatabases() {
        this(false, false, false);
    }

    private HasDatabases(boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
    }

    @Nonnull
    @Override
    public HasDatabases invert() {
        return (HasDatabases)super.invert();
    }

    @Nonnull
    @Override
    HasDatabases copy(boolean inverted, boolean empty, boolean full) {
        return new HasDatabases(inverted, empty, full);
    }

    @Nonnull
    @Override
    String getColumn() {
        return ReadonlyColumns.HAS_DB;
    }

    @Nonnull
    @Override
    ImmutableSet<String> getSourceGroup() {
        return Sources.DATABASES;
    }

    @Nonnull
    @Override
    String getGroupName() {
        return "databases";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitHasDatabases(this);
    }
}
