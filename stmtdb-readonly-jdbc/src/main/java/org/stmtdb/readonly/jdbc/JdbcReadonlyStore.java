/*
 * JdbcReadonlyStore.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.ReadonlyStoreException;
import org.stmtdb.readonly.logging.KeyValueLogMessage;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.provider.AgentRow;
import org.stmtdb.readonly.provider.ContentRow;
import org.stmtdb.readonly.provider.HashCount;
import org.stmtdb.readonly.provider.ReadingRef;
import org.stmtdb.readonly.provider.ReadonlyStore;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.plan.HashQueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * A {@link ReadonlyStore} over a JDBC {@link DataSource} holding the read-only statement tables.
 *
 * <p>
 * A connection is borrowed from the data source for each call and returned before the call completes, so one store
 * may be shared between threads if the data source can be.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class JdbcReadonlyStore implements ReadonlyStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcReadonlyStore.class);
    private static final Gson GSON = new Gson();
    private static final Type SOURCE_COUNTS_TYPE = new TypeToken<Map<String, Integer>>() { }.getType();

    @Nonnull
    private final DataSource dataSource;
    @Nonnull
    private final JdbcStoreConfiguration configuration;
    @Nonnull
    private final SqlRenderer renderer;

    public JdbcReadonlyStore(@Nonnull DataSource dataSource) {
        this(dataSource, JdbcStoreConfiguration.defaultConfiguration());
    }

    public JdbcReadonlyStore(@Nonnull DataSource dataSource, @Nonnull JdbcStoreConfiguration configuration) {
        this.dataSource = dataSource;
        this.configuration = configuration;
        this.renderer = new SqlRenderer(configuration);
    }

    @Nonnull
    public JdbcStoreConfiguration getConfiguration() {
        return configuration;
    }

    @Nonnull
    @Override
    public List<HashCount> fetchHashes(@Nonnull HashQueryPlan plan, @Nonnull FetchProperties properties) {
        return execute(renderer.hashQuery(plan, properties), resultSet -> {
            final List<HashCount> hashes = new ArrayList<>();
            while (resultSet.next()) {
                hashes.add(new HashCount(resultSet.getLong(ReadonlyColumns.MK_HASH),
                        resultSet.getInt(ReadonlyColumns.EV_COUNT)));
            }
            return hashes;
        });
    }

    @Nonnull
    @Override
    public List<ContentRow> fetchContent(@Nonnull Collection<Long> hashes, @Nullable Integer evidenceLimit,
                                         @Nullable EvidenceFilter evidenceFilter) {
        if (hashes.isEmpty()) {
            return ImmutableList.of();
        }
        final boolean withEvidence = evidenceLimit == null || evidenceLimit > 0;
        return execute(renderer.contentQuery(hashes, evidenceLimit, evidenceFilter), resultSet -> {
            final List<ContentRow> rows = new ArrayList<>();
            while (resultSet.next()) {
                final long mkHash = resultSet.getLong(ReadonlyColumns.MK_HASH);
                final String paJson = resultSet.getString(ReadonlyColumns.PA_JSON);
                if (withEvidence) {
                    rows.add(new ContentRow(mkHash, resultSet.getObject(ReadonlyColumns.ID, Long.class),
                            resultSet.getString(ReadonlyColumns.RAW_JSON), paJson, readReadingRef(resultSet)));
                } else {
                    rows.add(new ContentRow(mkHash, null, null, paJson, null));
                }
            }
            return rows;
        });
    }

    @Nonnull
    @Override
    public Map<Long, Map<String, Integer>> fetchSourceCounts(@Nonnull Collection<Long> hashes) {
        if (hashes.isEmpty()) {
            return ImmutableMap.of();
        }
        final SqlQuery query = renderer.sourceCountsQuery(hashes);
        return execute(query, resultSet -> {
            final Map<Long, Map<String, Integer>> counts = new LinkedHashMap<>();
            while (resultSet.next()) {
                final long mkHash = resultSet.getLong(ReadonlyColumns.MK_HASH);
                final String json = resultSet.getString(ReadonlyColumns.SRC_JSON);
                counts.put(mkHash, parseSourceCounts(query, mkHash, json));
            }
            return counts;
        });
    }

    @Nonnull
    @Override
    public List<AgentRow> fetchAgentRows(@Nonnull Collection<Long> hashes) {
        if (hashes.isEmpty()) {
            return ImmutableList.of();
        }
        return execute(renderer.agentRowsQuery(hashes), resultSet -> {
            final List<AgentRow> rows = new ArrayList<>();
            while (resultSet.next()) {
                rows.add(new AgentRow(resultSet.getLong(ReadonlyColumns.MK_HASH),
                        resultSet.getInt(ReadonlyColumns.AG_NUM),
                        resultSet.getString(ReadonlyColumns.DB_ID),
                        resultSet.getInt(ReadonlyColumns.TYPE_NUM),
                        resultSet.getInt(ReadonlyColumns.AGENT_COUNT),
                        resultSet.getString(ReadonlyColumns.ACTIVITY),
                        resultSet.getObject(ReadonlyColumns.IS_ACTIVE, Boolean.class)));
            }
            return rows;
        });
    }

    @Nullable
    private static ReadingRef readReadingRef(@Nonnull ResultSet resultSet) throws SQLException {
        if (resultSet.getObject(ReadonlyColumns.RID) == null) {
            return null;
        }
        return ReadingRef.newBuilder()
                .setTrid(resultSet.getObject("trid", Long.class))
                .setTcid(resultSet.getObject("tcid", Long.class))
                .setPmid(resultSet.getString("pmid"))
                .setPmcid(resultSet.getString("pmcid"))
                .setDoi(resultSet.getString("doi"))
                .setPii(resultSet.getString("pii"))
                .setUrl(resultSet.getString("url"))
                .setManuscriptId(resultSet.getString("manuscript_id"))
                .setSource(resultSet.getString(ReadonlyColumns.SOURCE))
                .build();
    }

    @Nonnull
    private static Map<String, Integer> parseSourceCounts(@Nonnull SqlQuery query, long mkHash,
                                                          @Nullable String json) {
        if (json == null) {
            return ImmutableMap.of();
        }
        try {
            final Map<String, Integer> counts = GSON.fromJson(json, SOURCE_COUNTS_TYPE);
            return counts == null ? ImmutableMap.of() : ImmutableMap.copyOf(counts);
        } catch (JsonParseException e) {
            throw new ReadonlyStoreException("unreadable source counts", e)
                    .addLogInfo(LogMessageKeys.MK_HASH, mkHash, LogMessageKeys.SQL, query.getSql());
        }
    }

    @Nonnull
    private <T> T execute(@Nonnull SqlQuery query, @Nonnull ResultReader<T> reader) {
        final long startTime = System.nanoTime();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(query.getSql())) {
            if (configuration.getQueryTimeoutSeconds() > 0) {
                statement.setQueryTimeout(configuration.getQueryTimeoutSeconds());
            }
            if (configuration.getFetchSize() > 0) {
                statement.setFetchSize(configuration.getFetchSize());
            }
            final List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            final T result;
            try (ResultSet resultSet = statement.executeQuery()) {
                result = reader.read(resultSet);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("executed query",
                        LogMessageKeys.SQL, query.getSql(),
                        LogMessageKeys.PARAMETERS, parameters,
                        LogMessageKeys.TIME_MILLIS, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime)));
            }
            return result;
        } catch (SQLException e) {
            throw new ReadonlyStoreException("statement store query failed", e)
                    .addLogInfo(LogMessageKeys.SQL, query.getSql(),
                            LogMessageKeys.PARAMETERS, query.getParameters(),
                            LogMessageKeys.SCHEMA, configuration.getSchema());
        }
    }

    @FunctionalInterface
    private interface ResultReader<T> {
        T read(@Nonnull ResultSet resultSet) throws SQLException;
    }
}
