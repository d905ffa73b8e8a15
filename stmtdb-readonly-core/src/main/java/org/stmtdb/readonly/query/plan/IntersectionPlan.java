/*
 * IntersectionPlan.java
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
import java.util.List;

/**
 * The fingerprints produced by every child plan.
 */
@API(API.Status.UNSTABLE)
public class IntersectionPlan extends SetOperationPlan {
    public IntersectionPlan(@Nonnull List<? extends HashQueryPlan> children) {
        super(children);
    }

    @Nonnull
    @Override
    protected String getOperationName() {
        return "Intersect";
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull HashQueryPlanVisitor<T> visitor) {
        return visitor.visitIntersection(this);
    }
}
