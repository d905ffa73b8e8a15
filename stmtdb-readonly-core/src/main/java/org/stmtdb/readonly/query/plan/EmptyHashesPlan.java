/*
 * EmptyHashesPlan.java
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

package org.stmtdb.readonly.query.plan;

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * No fingerprints. The runner never sends this plan to the store on its own, but it may appear inside other plans
 * built by hand.
 */
@API(API.Status.UNSTABLE)
public class EmptyHashesPlan implements HashQueryPlan {
    public static final EmptyHashesPlan INSTANCE = new EmptyHashesPlan();

    private EmptyHashesPlan() {
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull HashQueryPlanVisitor<T> visitor) {
        return visitor.visitEmptyHashes(this);
    }

    @Override
    public String toString() {
        return "Empty";
    }
}
