/*
 * StatementType.java
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
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A statement type known to the store: its name, the type it specializes and the order in which its agents appear
 * in statement JSON.
 */
@API(API.Status.UNSTABLE)
public class StatementType {
    @Nonnull
    private final String name;
    @Nullable
    private final String parentName;
    @Nonnull
    private final ImmutableList<String> agentOrder;
    private final int typeNum;

    StatementType(@Nonnull String name, @Nullable String parentName, @Nonnull ImmutableList<String> agentOrder, int typeNum) {
        this.name = name;
        this.parentName = parentName;
        this.agentOrder = agentOrder;
        this.typeNum = typeNum;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public String getParentName() {
        return parentName;
    }

    /**
     * Get the JSON fields holding this type's agents, in order. A field may hold a single agent or a list of them.
     * @return the agent fields
     */
    @Nonnull
    public ImmutableList<String> getAgentOrder() {
        return agentOrder;
    }

    /**
     * Get the number of this type in the {@code type_num} column.
     * @return the type number
     */
    public int getTypeNum() {
        return typeNum;
    }

    @Override
    public String toString() {
        return name;
    }
}
