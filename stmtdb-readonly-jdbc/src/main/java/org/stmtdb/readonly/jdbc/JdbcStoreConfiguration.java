/*
 * JdbcStoreConfiguration.java
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

package org.stmtdb.readonly.jdbc;

import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings of a {@link JdbcReadonlyStore}.
 */
@API(API.Status.UNSTABLE)
public class JdbcStoreConfiguration {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    @Nonnull
    private static final JdbcStoreConfiguration DEFAULT_CONFIGURATION = builder().build();

    @Nullable
    private final String schema;
    private final int queryTimeoutSeconds;
    private final int fetchSize;

    private JdbcStoreConfiguration(@Nullable String schema, int queryTimeoutSeconds, int fetchSize) {
        this.schema = schema;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.fetchSize = fetchSize;
    }

    /**
     * Get the schema holding the readonly tables.
     * @return the schema name, or {@code null} to use the connection's default schema
     */
    @Nullable
    public String getSchema() {
        return schema;
    }

    /**
     * Get the timeout applied to every statement.
     * @return the timeout in seconds, with {@code 0} for none
     */
    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    /**
     * Get the fetch size hint given to the driver.
     * @return the fetch size, with {@code 0} for the driver's default
     */
    public int getFetchSize() {
        return fetchSize;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static JdbcStoreConfiguration defaultConfiguration() {
        return DEFAULT_CONFIGURATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JdbcStoreConfiguration that = (JdbcStoreConfiguration)o;
        return queryTimeoutSeconds == that.queryTimeoutSeconds && fetchSize == that.fetchSize &&
               Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, queryTimeoutSeconds, fetchSize);
    }

    @Override
    public String toString() {
        return "JdbcStoreConfiguration(schema=" + schema + ", queryTimeoutSeconds=" + queryTimeoutSeconds +
               ", fetchSize=" + fetchSize + ")";
    }

    /**
     * A builder for {@link JdbcStoreConfiguration}.
     */
    public static class Builder {
        @Nullable
        private String schema = null;
        private int queryTimeoutSeconds = 0;
        private int fetchSize = 0;

        private Builder() {
        }

        private Builder(@Nonnull JdbcStoreConfiguration configuration) {
            this.schema = configuration.schema;
            this.queryTimeoutSeconds = configuration.queryTimeoutSeconds;
            this.fetchSize = configuration.fetchSize;
        }

        /**
         * Set the schema holding the readonly tables. The name is written into SQL text, so it must be a plain
         * identifier.
         * @param schema the schema name, or {@code null} for the connection's default schema
         * @return this builder
         */
        @Nonnull
        public Builder setSchema(@Nullable String schema) {
            if (schema != null && !IDENTIFIER.matcher(schema).matches()) {
                throw new ReadonlyCoreArgumentException("schema must be a plain identifier", LogMessageKeys.SCHEMA, schema);
            }
            this.schema = schema;
            return this;
        }

        @Nonnull
        public Builder setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            if (queryTimeoutSeconds < 0) {
                throw new ReadonlyCoreArgumentException("Cannot set negative query timeout",
                        LogMessageKeys.VALUE, queryTimeoutSeconds);
            }
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        @Nonnull
        public Builder setFetchSize(int fetchSize) {
            if (fetchSize < 0) {
                throw new ReadonlyCoreArgumentException("Cannot set negative fetch size", LogMessageKeys.VALUE, fetchSize);
            }
            this.fetchSize = fetchSize;
            return this;
        }

        @Nonnull
        public JdbcStoreConfiguration build() {
            return new JdbcStoreConfiguration(schema, queryTimeoutSeconds, fetchSize);
        }
    }
}
