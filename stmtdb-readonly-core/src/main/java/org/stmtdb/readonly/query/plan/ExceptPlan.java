/*
 * ExceptPlan.java
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

import com.google.common.collect.ImmutableList;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * The fingerprints produced by a base plan but not by a subtracted one. Used to negate constraints on mention
 * tables, where a row-level negation is not the complement at the fingerprint level.
 */
@API(API.Status.UNSTABLE)
public class ExceptPlan extends SetOperationPlan {
    public ExceptPlan(@Nonnull HashQueryPlan base, @Nonnull HashQueryPlan subtracted) {
        super(ImmutableList.of(base, subtracted));
    }

    @Nonnull
    public HashQueryPlan getBase() {
        return getChildren().get(0);
    }

    @Nonnull
    public HashQueryPlan getSubtracted() {
        return getChildren().get(1);
    }

    @Nonnull
    @Override
    protected String getOperationName() {
        return "Except";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull HashQueryPlanVisitor<T> visitor) {
        return visitor.visitExcept(this);
    }
}
