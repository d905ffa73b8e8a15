/*
 * AgentRow.java
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

package org.stmtdb.readonly.provider;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A named agent at one position of a statement, with the statement's interaction metadata.
 */
@API(API.Status.UNSTABLE)
public class AgentRow {
    private final long mkHash;
    private final int agNum;
    @Nonnull
    private final String dbId;
    private final int typeNum;
    private final int agentCount;
    @Nullable
    private final String activity;
    @Nullable
    private final Boolean isActive;

    public AgentRow(long mkHash, int agNum, @Nonnull String dbId, int typeNum, int agentCount,
                    @Nullable String activity, @Nullable Boolean isActive) {
        this.mkHash = mkHash;
        this.agNum = agNum;
        this.dbId = dbId;
        this.typeNum = typeNum;
        this.agentCount = agentCount;
        this.activity = activity;
        this.isActive = isActive;
    }

    public long getMkHash() {
        return mkHash;
    }

    public int getAgNum() {
        return agNum;
    }

    @Nonnull
    public String getDbId() {
        return dbId;
    }

    public int getTypeNum() {
        return typeNum;
    }

    public int getAgentCount() {
        return agentCount;
    }

    @Nullable
    public String getActivity() {
        return activity;
    }

    @Nullable
    public Boolean getIsActive() {
        return isActive;
    }

    @Override
    public String toString() {
        return "AgentRow(" + mkHash + ", " + agNum + "=" + dbId + ")";
    }
}
