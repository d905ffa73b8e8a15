/*
 * HashCount.java
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

/**
 * A statement fingerprint with its total evidence count.
 */
@API(API.Status.UNSTABLE)
public class HashCount {
    private final long mkHash;
    private final int evCount;

    public HashCount(long mkHash, int evCount) {
        this.mkHash = mkHash;
        this.evCount = evCount;
    }

    public long getMkHash() {
        return mkHash;
    }

    public int getEvCount() {
        return evCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HashCount that = (HashCount)o;
        return mkHash == that.mkHash && evCount == that.evCount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(mkHash) * 31 + evCount;
    }

    @Override
    public String toString() {
        return mkHash + ":" + evCount;
    }
}
