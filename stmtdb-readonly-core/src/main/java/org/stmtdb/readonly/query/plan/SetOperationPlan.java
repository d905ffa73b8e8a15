/*
 * SetOperationPlan.java
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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Common base for plans combining the fingerprint sets of several child plans.
 */
@API(API.Status.UNSTABLE)
public abstract class SetOperationPlan implements HashQueryPlan {
    @Nonnull
    private final ImmutableList<HashQueryPlan> children;

    protected SetOperationPlan(@Nonnull List<? extends HashQueryPlan> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " needs at least two children");
        }
        this.children = ImmutableList.copyOf(children);
    }

    @Nonnull
    public List<HashQueryPlan> getChildren() {
        return children;
    }

    @Nonnull
    protected abstract String getOperationName();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((SetOperationPlan)o).children);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + children.hashCode();
    }

    @Override
    public String toString() {
        return children.stream().map(Object::toString)
                .collect(Collectors.joining(", ", getOperationName() + "(", ")"));
    }
}
