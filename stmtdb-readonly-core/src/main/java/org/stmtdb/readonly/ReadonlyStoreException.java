/*
 * ReadonlyStoreException.java
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
 * Wraps a failure of the backing store. The original failure is kept as the cause; no retry is attempted.
 */
@API(API.Status.UNSTABLE)
public class ReadonlyStoreException extends ReadonlyCoreException {
    private static final long serialVersionUID = 1;

    public ReadonlyStoreException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}
