/*
 * Sources.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * The knowledge sources that contribute evidence. Each has an evidence count column of the same name in
 * {@code source_meta}, and is either a reading system or a curated database.
 */
@API(API.Status.UNSTABLE)
public final class Sources {
    public static final ImmutableSet<String> READING = ImmutableSet.of(
            "reach", "sparser", "medscan", "trips", "rlimsp", "isi", "geneways", "tees", "eidos", "mti");
    public static final ImmutableSet<String> DATABASES = ImmutableSet.of(
            "biopax", "bel", "signor", "trrust", "phosphosite", "biogrid", "hprd", "ctd", "drugbank", "tas",
            "lincs_drug", "dgi");
    public static final ImmutableList<String> ALL = ImmutableList.<String>builder()
            .addAll(READING).addAll(DATABASES).build();

    private Sources() {
    }

    public static boolean isKnown(@Nonnull String source) {
        return READING.contains(source) || DATABASES.contains(source);
    }

    /**
     * Check that a source is known, so that it can be used as a column name.
     * @param source the source name
     * @return the source name
     * @throws ReadonlyCoreArgumentException if the source is unknown
     */
    @Nonnull
    public static String validate(@Nonnull String source) {
        if (!isKnown(source)) {
            throw new ReadonlyCoreArgumentException("unknown source", LogMessageKeys.SOURCE, source);
        }
        return source;
    }
}
