/*
 * PaperRef.java
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
import org.stmtdb.readonly.metadata.PaperIdType;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * A paper identified by one of its ids.
 */
@API(API.Status.UNSTABLE)
public class PaperRef implements Comparable<PaperRef> {
    private static final Comparator<PaperRef> ORDER =
            Comparator.comparing(PaperRef::getIdType).thenComparing(PaperRef::getPaperId);

    @Nonnull
    private final PaperIdType idType;
    @Nonnull
    private final String paperId;

    public PaperRef(@Nonnull PaperIdType idType, @Nonnull String paperId) {
        idType.parseId(paperId);
        this.idType = idType;
        this.paperId = paperId;
    }

    @Nonnull
    public static PaperRef of(@Nonnull String idType, @Nonnull String paperId) {
        return new PaperRef(PaperIdType.fromColumnName(idType), paperId);
    }

    @Nonnull
    public PaperIdType getIdType() {
        return idType;
    }

    @Nonnull
    public String getPaperId() {
        return paperId;
    }

    @Override
    public int compareTo(@Nonnull PaperRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PaperRef paperRef = (PaperRef)o;
        return idType == paperRef.idType && paperId.equals(paperRef.paperId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(idType, paperId);
    }

    @Override
    public String toString() {
        return "(" + idType.getColumnName() + ", " + paperId + ")";
    }
}
