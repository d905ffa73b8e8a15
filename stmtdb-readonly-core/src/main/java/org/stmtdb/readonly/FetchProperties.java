/*
 * FetchProperties.java
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
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Limits on the execution of a statement query.
 * <ul>
 * <li>number of fingerprints to skip</li>
 * <li>limit on the number of fingerprints returned</li>
 * <li>whether fingerprints are ordered by descending evidence count</li>
 * <li>limit on the number of evidence rows fetched per fingerprint</li>
 * <li>a filter narrowing which evidence rows are fetched</li>
 * </ul>
 */
@API(API.Status.MAINTAINED)
public class FetchProperties {
    /**
     * Properties for an unlimited fetch, best evidence first.
     */
    public static final FetchProperties NO_LIMITS = newBuilder().build();

    @Nullable
    private final Integer limit;
    private final int offset;
    private final boolean bestFirst;
    @Nullable
    private final Integer evidenceLimit;
    @Nullable
    private final EvidenceFilter evidenceFilter;

    private FetchProperties(@Nullable Integer limit, int offset, boolean bestFirst,
                            @Nullable Integer evidenceLimit, @Nullable EvidenceFilter evidenceFilter) {
        this.limit = limit;
        this.offset = offset;
        this.bestFirst = bestFirst;
        this.evidenceLimit = evidenceLimit;
        this.evidenceFilter = evidenceFilter;
    }

    /**
     * Get the maximum number of fingerprints to return.
     * @return the limit, or {@code null} if there is none
     */
    @Nullable
    public Integer getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isBestFirst() {
        return bestFirst;
    }

    /**
     * Get the maximum number of evidence rows fetched for each fingerprint. Zero means that statements are returned
     * with an empty evidence list.
     * @return the evidence limit, or {@code null} if all evidence is fetched
     */
    @Nullable
    public Integer getEvidenceLimit() {
        return evidenceLimit;
    }

    @Nullable
    public EvidenceFilter getEvidenceFilter() {
        return evidenceFilter;
    }

    @Nonnull
    public FetchProperties setLimit(@Nullable Integer limit) {
        return toBuilder().setLimit(limit).build();
    }

    @Nonnull
    public FetchProperties setOffset(int offset) {
        if (offset == this.offset) {
            return this;
        }
        return toBuilder().setOffset(offset).build();
    }

    @Nonnull
    public FetchProperties clearOffsetAndLimit() {
        if (offset == 0 && limit == null) {
            return this;
        }
        return toBuilder().setOffset(0).setLimit(null).build();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FetchProperties that = (FetchProperties)o;
        return offset == that.offset && bestFirst == that.bestFirst &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(evidenceLimit, that.evidenceLimit) &&
               Objects.equals(evidenceFilter, that.evidenceFilter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, offset, bestFirst, evidenceLimit, evidenceFilter);
    }

    @Nonnull
    @Override
    public String toString() {
        final List<String> components = new ArrayList<>();
        if (offset != 0) {
            components.add("offset " + offset);
        }
        if (limit != null) {
            components.add("limit " + limit);
        }
        if (!bestFirst) {
            components.add("by hash");
        }
        if (evidenceLimit != null) {
            components.add("evidenceLimit " + evidenceLimit);
        }
        if (evidenceFilter != null) {
            components.add("evidenceFilter " + evidenceFilter);
        }
        return "FetchProperties(" + String.join(", ", components) + ")";
    }

    /**
     * A builder for {@link FetchProperties}.
     * <pre><code>
     * FetchProperties.newBuilder().setOffset(10).setLimit(10).setEvidenceLimit(5).build()
     * </code></pre>
     */
    public static class Builder {
        private Integer limit = null;
        private int offset = 0;
        private boolean bestFirst = true;
        private Integer evidenceLimit = null;
        private EvidenceFilter evidenceFilter = null;

        private Builder() {
        }

        private Builder(@Nonnull FetchProperties properties) {
            this.limit = properties.limit;
            this.offset = properties.offset;
            this.bestFirst = properties.bestFirst;
            this.evidenceLimit = properties.evidenceLimit;
            this.evidenceFilter = properties.evidenceFilter;
        }

        @Nonnull
        public Builder setLimit(@Nullable Integer limit) {
            if (limit != null && limit < 0) {
                throw new ReadonlyCoreArgumentException("Cannot set negative limit", LogMessageKeys.LIMIT, limit);
            }
            this.limit = limit;
            return this;
        }

        @Nonnull
        public Builder setOffset(int offset) {
            if (offset < 0) {
                throw new ReadonlyCoreArgumentException("Cannot set negative offset", LogMessageKeys.OFFSET, offset);
            }
            this.offset = offset;
            return this;
        }

        @Nonnull
        public Builder setBestFirst(boolean bestFirst) {
            this.bestFirst = bestFirst;
            return this;
        }

        @Nonnull
        public Builder setEvidenceLimit(@Nullable Integer evidenceLimit) {
            if (evidenceLimit != null && evidenceLimit < 0) {
                throw new ReadonlyCoreArgumentException("Cannot set negative evidence limit",
                        LogMessageKeys.EVIDENCE_LIMIT, evidenceLimit);
            }
            this.evidenceLimit = evidenceLimit;
            return this;
        }

        @Nonnull
        public Builder setEvidenceFilter(@Nullable EvidenceFilter evidenceFilter) {
            this.evidenceFilter = evidenceFilter;
            return this;
        }

        @Nonnull
        public FetchProperties build() {
            return new FetchProperties(limit, offset, bestFirst, evidenceLimit, evidenceFilter);
        }
    }
}
