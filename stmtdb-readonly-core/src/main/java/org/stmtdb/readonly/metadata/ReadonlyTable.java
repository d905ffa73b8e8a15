/*
 * ReadonlyTable.java
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

import javax.annotation.Nonnull;

/**
 * The relations of the readonly store read by the query layer.
 */
@API(API.Status.UNSTABLE)
public enum ReadonlyTable {
    /** One row per fingerprint, with per-source evidence counts and the cross-cutting columns. */
    SOURCE_META("source_meta", Kind.FINGERPRINT),
    /** Agent mentions grounded to a name. */
    NAME_META("name_meta", Kind.MENTION),
    /** Agent mentions by raw text. */
    TEXT_META("text_meta", Kind.MENTION),
    /** Agent mentions grounded to any other namespace. */
    OTHER_META("other_meta", Kind.MENTION),
    MESH_TERM_META("mesh_term_meta", Kind.MENTION),
    MESH_CONCEPT_META("mesh_concept_meta", Kind.MENTION),
    /** Raw statement to fingerprint link, carrying the statement content. */
    FAST_RAW_PA_LINK("fast_raw_pa_link", Kind.EVIDENCE),
    READING_REF_LINK("reading_ref_link", Kind.EVIDENCE),
    RAW_STMT_SRC("raw_stmt_src", Kind.EVIDENCE),
    RAW_STMT_MESH_TERMS("raw_stmt_mesh_terms", Kind.EVIDENCE),
    RAW_STMT_MESH_CONCEPTS("raw_stmt_mesh_concepts", Kind.EVIDENCE);

    /**
     * How rows of a table relate to statement fingerprints.
     */
    public enum Kind {
        FINGERPRINT,
        MENTION,
        EVIDENCE
    }

    @Nonnull
    private final String tableName;
    @Nonnull
    private final Kind kind;

    ReadonlyTable(@Nonnull String tableName, @Nonnull Kind kind) {
        this.tableName = tableName;
        this.kind = kind;
    }

    @Nonnull
    public String getTableName() {
        return tableName;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Whether the table carries the fingerprint, evidence count and cross-cutting columns
     * ({@code type_num}, {@code agent_count}), so that hash scans can run against it.
     * @return {@code true} for fingerprint and mention tables
     */
    public boolean isHashScannable() {
        return kind != Kind.EVIDENCE;
    }

    @Override
    public String toString() {
        return tableName;
    }
}
