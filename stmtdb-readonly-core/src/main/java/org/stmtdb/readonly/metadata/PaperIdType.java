/*
 * PaperIdType.java
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
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Identifier types of a paper, each a column of {@code reading_ref_link}.
 * Database-internal identifiers ({@code trid}, {@code tcid}) are integers and compared by equality; the others are
 * matched with {@code LIKE}.
 */
@API(API.Status.UNSTABLE)
public enum PaperIdType {
    PMID("pmid", false),
    PMCID("pmcid", false),
    DOI("doi", false),
    PII("pii", false),
    URL("url", false),
    MANUSCRIPT_ID("manuscript_id", false),
    TRID("trid", true),
    TCID("tcid", true);

    @Nonnull
    private final String columnName;
    private final boolean numeric;

    PaperIdType(@Nonnull String columnName, boolean numeric) {
        this.columnName = columnName;
        this.numeric = numeric;
    }

    @Nonnull
    public String getColumnName() {
        return columnName;
    }

    public boolean isNumeric() {
        return numeric;
    }

    /**
     * Parse a paper id of this type into the value stored in the database.
     * @param paperId the id as given by the caller
     * @return a {@link Long} for numeric types, the string otherwise
     */
    @Nonnull
    public Object parseId(@Nonnull String paperId) {
        if (!numeric) {
            return paperId;
        }
        try {
            return Long.parseLong(paperId.trim());
        } catch (NumberFormatException e) {
            throw new ReadonlyCoreArgumentException("paper id must be numeric",
                    LogMessageKeys.ID_TYPE, columnName, LogMessageKeys.PAPER_ID, paperId);
        }
    }

    @Nonnull
    public static PaperIdType fromColumnName(@Nonnull String columnName) {
        for (PaperIdType idType : values()) {
            if (idType.columnName.equalsIgnoreCase(columnName)) {
                return idType;
            }
        }
        throw new ReadonlyCoreArgumentException("unknown paper id type", LogMessageKeys.ID_TYPE, columnName);
    }
}
