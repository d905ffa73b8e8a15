/*
 * SqlQuery.java
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
import org.stmtdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with the values of its {@code ?} parameters, in order.
 */
@API(API.Status.INTERNAL)
public class SqlQuery {
    @Nonnull
    private final String sql;
    @Nonnull
    private final ImmutableList<Object> parameters;

    public SqlQuery(@Nonnull String sql, @Nonnull List<?> parameters) {
        this.sql = sql;
        this.parameters = ImmutableList.<Object>copyOf(parameters);
    }

    @Nonnull
    public String getSql() {
        return sql;
    }

    @Nonnull
    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SqlQuery sqlQuery = (SqlQuery)o;
        return sql.equals(sqlQuery.sql) && parameters.equals(sqlQuery.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
