/*
 * MalformedQueryException.java
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

import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * Thrown when a query tree reaches planning in a shape that canonicalization should have ruled out, for example a
 * cross-cutting constraint injected into a query of its own family. Seeing one of these is a bug in the merge logic,
 * not in the caller's input.
 */
@API(API.Status.UNSTABLE)
public class MalformedQueryException extends ReadonlyCoreException {
    private static final long serialVersionUID = 1;

    public MalformedQueryException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }
}
