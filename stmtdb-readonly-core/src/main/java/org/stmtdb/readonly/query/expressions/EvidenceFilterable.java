/*
 * EvidenceFilterable.java
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

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * A statement query that can also be expressed as a condition on individual evidence rows.
 */
@API(API.Status.UNSTABLE)
public interface EvidenceFilterable {
    /**
     * Get the evidence filter corresponding to this query, taking its inversion into account.
     * @return the evidence filter
     */
    @Nonnull
    EvidenceFilter getEvidenceFilter();
}
