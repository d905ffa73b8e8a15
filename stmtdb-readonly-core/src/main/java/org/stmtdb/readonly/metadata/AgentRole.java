/*
 * AgentRole.java
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

import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * The role an agent plays in a statement, as stored in the {@code role_num} column.
 */
@API(API.Status.UNSTABLE)
public enum AgentRole {
    SUBJECT(-1),
    OTHER(0),
    OBJECT(1);

    private final int roleNum;

    AgentRole(int roleNum) {
        this.roleNum = roleNum;
    }

    public int getRoleNum() {
        return roleNum;
    }

    /**
     * Look up a role by name, ignoring case.
     * @param name the role name, e.g. {@code "subject"}
     * @return the role
     * @throws ReadonlyCoreArgumentException if there is no such role
     */
    @Nonnull
    public static AgentRole fromName(@Nonnull String name) {
        for (AgentRole role : values()) {
            if (role.name().equals(name.toUpperCase(Locale.ROOT))) {
                return role;
            }
        }
        throw new ReadonlyCoreArgumentException("unknown agent role", LogMessageKeys.ROLE, name);
    }
}
