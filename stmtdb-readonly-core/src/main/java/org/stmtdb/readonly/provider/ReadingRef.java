/*
 * ReadingRef.java
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

import com.google.common.collect.ImmutableMap;
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The identifiers of the paper a reading was made from, as found in {@code reading_ref_link}.
 */
@API(API.Status.UNSTABLE)
public class ReadingRef {
    /**
     * A reference with no identifiers, used for evidence that does not come from a reading.
     */
    public static final ReadingRef NONE = newBuilder().build();

    @Nullable
    private final Long trid;
    @Nullable
    private final Long tcid;
    @Nullable
    private final String pmid;
    @Nullable
    private final String pmcid;
    @Nullable
    private final String doi;
    @Nullable
    private final String pii;
    @Nullable
    private final String url;
    @Nullable
    private final String manuscriptId;
    @Nullable
    private final String source;

    private ReadingRef(@Nonnull Builder builder) {
        this.trid = builder.trid;
        this.tcid = builder.tcid;
        this.pmid = builder.pmid;
        this.pmcid = builder.pmcid;
        this.doi = builder.doi;
        this.pii = builder.pii;
        this.url = builder.url;
        this.manuscriptId = builder.manuscriptId;
        this.source = builder.source;
    }

    @Nullable
    public Long getTrid() {
        return trid;
    }

    @Nullable
    public Long getTcid() {
        return tcid;
    }

    @Nullable
    public String getPmid() {
        return pmid;
    }

    @Nullable
    public String getPmcid() {
        return pmcid;
    }

    @Nullable
    public String getDoi() {
        return doi;
    }

    @Nullable
    public String getPii() {
        return pii;
    }

    @Nullable
    public String getUrl() {
        return url;
    }

    @Nullable
    public String getManuscriptId() {
        return manuscriptId;
    }

    /**
     * Get the text content source the reading was made from, e.g. {@code pubmed} or {@code pmc_oa}.
     * @return the content source
     */
    @Nullable
    public String getSource() {
        return source;
    }

    /**
     * Get the paper identifiers that are present, keyed by upper-case identifier type, as they appear in an
     * evidence's {@code text_refs}.
     * @return the present identifiers
     */
    @Nonnull
    public Map<String, Object> getTextRefs() {
        final Map<String, Object> refs = new LinkedHashMap<>();
        putIfPresent(refs, "TRID", trid);
        putIfPresent(refs, "TCID", tcid);
        putIfPresent(refs, "PMID", pmid);
        putIfPresent(refs, "PMCID", pmcid);
        putIfPresent(refs, "DOI", doi);
        putIfPresent(refs, "PII", pii);
        putIfPresent(refs, "URL", url);
        putIfPresent(refs, "MANUSCRIPT_ID", manuscriptId);
        return ImmutableMap.copyOf(refs);
    }

    private static void putIfPresent(@Nonnull Map<String, Object> refs, @Nonnull String key, @Nullable Object value) {
        if (value != null) {
            refs.put(key, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReadingRef that = (ReadingRef)o;
        return Objects.equals(trid, that.trid) && Objects.equals(tcid, that.tcid)
                && Objects.equals(pmid, that.pmid) && Objects.equals(pmcid, that.pmcid)
                && Objects.equals(doi, that.doi) && Objects.equals(pii, that.pii)
                && Objects.equals(url, that.url) && Objects.equals(manuscriptId, that.manuscriptId)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trid, tcid, pmid, pmcid, doi, pii, url, manuscriptId, source);
    }

    @Override
    public String toString() {
        return "ReadingRef(" + getTextRefs() + (source == null ? "" : ", source=" + source) + ")";
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Builder for {@link ReadingRef}.
     */
    public static class Builder {
        @Nullable
        private Long trid;
        @Nullable
        private Long tcid;
        @Nullable
        private String pmid;
        @Nullable
        private String pmcid;
        @Nullable
        private String doi;
        @Nullable
        private String pii;
        @Nullable
        private String url;
        @Nullable
        private String manuscriptId;
        @Nullable
        private String source;

        private Builder() {
        }

        @Nonnull
        public Builder setTrid(@Nullable Long trid) {
            this.trid = trid;
            return this;
        }

        @Nonnull
        public Builder setTcid(@Nullable Long tcid) {
            this.tcid = tcid;
            return this;
        }

        @Nonnull
        public Builder setPmid(@Nullable String pmid) {
            this.pmid = pmid;
            return this;
        }

        @Nonnull
        public Builder setPmcid(@Nullable String pmcid) {
            this.pmcid = pmcid;
            return this;
        }

        @Nonnull
        public Builder setDoi(@Nullable String doi) {
            this.doi = doi;
            return this;
        }

        @Nonnull
        public Builder setPii(@Nullable String pii) {
            this.pii = pii;
            return this;
        }

        @Nonnull
        public Builder setUrl(@Nullable String url) {
            this.url = url;
            return this;
        }

        @Nonnull
        public Builder setManuscriptId(@Nullable String manuscriptId) {
            this.manuscriptId = manuscriptId;
            return this;
        }

        @Nonnull
        public Builder setSource(@Nullable String source) {
            this.source = source;
            return this;
        }

        @Nonnull
        public ReadingRef build() {
            return new ReadingRef(this);
        }
    }
}
