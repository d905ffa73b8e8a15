/*
 * SqlRenderer.java
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
import org.stmtdb.readonly.FetchProperties;
import org.stmtdb.readonly.metadata.PaperIdType;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.expressions.EvidenceFilter;
import org.stmtdb.readonly.query.expressions.EvidenceFilterElement;
import org.stmtdb.readonly.query.expressions.EvidenceFilterVisitor;
import org.stmtdb.readonly.query.plan.AllHashesPlan;
import org.stmtdb.readonly.query.plan.EmptyHashesPlan;
import org.stmtdb.readonly.query.plan.ExceptPlan;
import org.stmtdb.readonly.query.plan.HashQueryPlan;
import org.stmtdb.readonly.query.plan.HashQueryPlanVisitor;
import org.stmtdb.readonly.query.plan.IntersectionPlan;
import org.stmtdb.readonly.query.plan.PaperScanPlan;
import org.stmtdb.readonly.query.plan.RelationScanPlan;
import org.stmtdb.readonly.query.plan.UnionPlan;
import org.stmtdb.readonly.query.predicates.AndOrPredicate;
import org.stmtdb.readonly.query.predicates.AndPredicate;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicateVisitor;
import org.stmtdb.readonly.query.predicates.OrPredicate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Renders hash query plans and content lookups as parameterized SQL over the read-only schema.
 *
 * <p>
 * Every table is aliased to its bare name, so columns are qualified the same way whether or not a schema is
 * configured. Values always travel as parameters; only paging bounds are inlined.
 * </p>
 */
@API(API.Status.INTERNAL)
public class SqlRenderer {
    /**
     * Reading reference columns selected with each content row, in selection order.
     */
    public static final List<String> READING_REF_COLUMNS;

    static {
        final ImmutableList.Builder<String> columns = ImmutableList.builder();
        columns.add(ReadonlyColumns.RID);
        for (PaperIdType idType : PaperIdType.values()) {
            columns.add(idType.getColumnName());
        }
        columns.add(ReadonlyColumns.SOURCE);
        READING_REF_COLUMNS = columns.build();
    }

    @Nullable
    private final String schema;

    public SqlRenderer(@Nonnull JdbcStoreConfiguration configuration) {
        this.schema = configuration.getSchema();
    }

    /**
     * Render a plan with paging applied to its distinct fingerprints.
     * @param plan the plan
     * @param properties the ordering, offset and limit
     * @return a query selecting {@code mk_hash} and {@code ev_count}
     */
    @Nonnull
    public SqlQuery hashQuery(@Nonnull HashQueryPlan plan, @Nonnull FetchProperties properties) {
        final List<Object> parameters = new ArrayList<>();
        final StringBuilder sql = new StringBuilder("SELECT DISTINCT h.mk_hash, h.ev_count FROM (")
                .append(plan.accept(new PlanRenderer(parameters)))
                .append(") h ORDER BY ")
                .append(properties.isBestFirst() ? "h.ev_count DESC, h.mk_hash" : "h.mk_hash");
        if (properties.getOffset() > 0) {
            sql.append(" OFFSET ").append(properties.getOffset()).append(" ROWS");
        }
        if (properties.getLimit() != null) {
            sql.append(" FETCH NEXT ").append(properties.getLimit()).append(" ROWS ONLY");
        }
        return new SqlQuery(sql.toString(), parameters);
    }

    /**
     * Render the lookup of content rows for a set of fingerprints. A limit of zero is rendered as a limit of one
     * and the caller discards the raw statement.
     * @param hashes the fingerprints, not empty
     * @param evidenceLimit the per-fingerprint limit or {@code null}
     * @param evidenceFilter the evidence filter or {@code null}
     * @return the query
     */
    @Nonnull
    public SqlQuery contentQuery(@Nonnull Collection<Long> hashes, @Nullable Integer evidenceLimit,
                                 @Nullable EvidenceFilter evidenceFilter) {
        final List<Object> parameters = new ArrayList<>();
        final StringBuilder inner = new StringBuilder("SELECT fast_raw_pa_link.mk_hash, fast_raw_pa_link.id, ")
                .append("fast_raw_pa_link.raw_json, fast_raw_pa_link.pa_json");
        for (String column : READING_REF_COLUMNS) {
            inner.append(", reading_ref_link.").append(column);
        }
        if (evidenceLimit != null) {
            inner.append(", ROW_NUMBER() OVER (PARTITION BY fast_raw_pa_link.mk_hash ORDER BY fast_raw_pa_link.id) rn");
        }
        inner.append(" FROM ").append(from(ReadonlyTable.FAST_RAW_PA_LINK))
                .append(" LEFT JOIN ").append(from(ReadonlyTable.READING_REF_LINK))
                .append(" ON reading_ref_link.rid = fast_raw_pa_link.reading_id WHERE ")
                .append(hashIn(ReadonlyTable.FAST_RAW_PA_LINK, hashes, parameters));
        if (evidenceFilter != null) {
            inner.append(" AND ").append(renderFilter(evidenceFilter, parameters));
        }
        if (evidenceLimit == null) {
            inner.append(" ORDER BY fast_raw_pa_link.mk_hash, fast_raw_pa_link.id");
            return new SqlQuery(inner.toString(), parameters);
        }
        final String sql = "SELECT c.* FROM (" + inner + ") c WHERE c.rn <= " + Math.max(evidenceLimit, 1)
                + " ORDER BY c.mk_hash, c.id";
        return new SqlQuery(sql, parameters);
    }

    @Nonnull
    public SqlQuery sourceCountsQuery(@Nonnull Collection<Long> hashes) {
        final List<Object> parameters = new ArrayList<>();
        final String sql = "SELECT source_meta.mk_hash, source_meta.src_json FROM " + from(ReadonlyTable.SOURCE_META)
                + " WHERE " + hashIn(ReadonlyTable.SOURCE_META, hashes, parameters);
        return new SqlQuery(sql, parameters);
    }

    @Nonnull
    public SqlQuery agentRowsQuery(@Nonnull Collection<Long> hashes) {
        final List<Object> parameters = new ArrayList<>();
        final String sql = "SELECT name_meta.mk_hash, name_meta.ag_num, name_meta.db_id, name_meta.type_num, "
                + "name_meta.agent_count, name_meta.activity, name_meta.is_active FROM " + from(ReadonlyTable.NAME_META)
                + " WHERE " + hashIn(ReadonlyTable.NAME_META, hashes, parameters)
                + " ORDER BY name_meta.mk_hash, name_meta.ag_num";
        return new SqlQuery(sql, parameters);
    }

    @Nonnull
    private String from(@Nonnull ReadonlyTable table) {
        final String name = table.getTableName();
        return schema == null ? name : schema + "." + name + " " + name;
    }

    @Nonnull
    private String hashIn(@Nonnull ReadonlyTable table, @Nonnull Collection<Long> hashes,
                          @Nonnull List<Object> parameters) {
        return renderPredicate(ColumnPredicate.in(table, ReadonlyColumns.MK_HASH, hashes, false), parameters);
    }

    @Nonnull
    private String renderPredicate(@Nonnull FilterPredicate predicate, @Nonnull List<Object> parameters) {
        return predicate.accept(new PredicateRenderer(parameters));
    }

    @Nonnull
    private String renderFilter(@Nonnull EvidenceFilter filter, @Nonnull List<Object> parameters) {
        return filter.accept(new FilterRenderer(parameters));
    }

    private class FilterRenderer implements EvidenceFilterVisitor<String> {
        @Nonnull
        private final List<Object> parameters;

        FilterRenderer(@Nonnull List<Object> parameters) {
            this.parameters = parameters;
        }

        @Nonnull
        @Override
        public String visitFilter(@Nonnull EvidenceFilter filter) {
            final List<String> clauses = new ArrayList<>();
            for (EvidenceFilterElement element : filter.getElements()) {
                clauses.add(element.accept(this));
            }
            return "(" + String.join(filter.getJoiner() == EvidenceFilter.Joiner.AND ? " AND " : " OR ", clauses)
                    + ")";
        }

        @Nonnull
        @Override
        public String visitLeaf(@Nonnull EvidenceFilter.Leaf leaf) {
            final ReadonlyTable table = leaf.getTable();
            if (table == ReadonlyTable.FAST_RAW_PA_LINK) {
                final FilterPredicate predicate = leaf.isExists() ? leaf.getPredicate() : leaf.getPredicate().negate();
                return renderPredicate(predicate, parameters);
            }
            final String link = table == ReadonlyTable.READING_REF_LINK
                                ? "reading_ref_link.rid = fast_raw_pa_link.reading_id"
                                : table.getTableName() + ".sid = fast_raw_pa_link.id";
            return (leaf.isExists() ? "EXISTS" : "NOT EXISTS") + " (SELECT 1 FROM " + from(table) + " WHERE " + link
                    + " AND " + renderPredicate(leaf.getPredicate(), parameters) + ")";
        }
    }

    private class PlanRenderer implements HashQueryPlanVisitor<String> {
        @Nonnull
        private final List<Object> parameters;
        private int aliases;

        PlanRenderer(@Nonnull List<Object> parameters) {
            this.parameters = parameters;
        }

        @Override
        public String visitAllHashes(@Nonnull AllHashesPlan plan) {
            return "SELECT source_meta.mk_hash, source_meta.ev_count FROM " + from(ReadonlyTable.SOURCE_META);
        }

        @Override
        public String visitEmptyHashes(@Nonnull EmptyHashesPlan plan) {
            return "SELECT source_meta.mk_hash, source_meta.ev_count FROM " + from(ReadonlyTable.SOURCE_META)
                    + " WHERE 1 = 0";
        }

        @Override
        public String visitRelationScan(@Nonnull RelationScanPlan plan) {
            final String name = plan.getTable().getTableName();
            final StringBuilder sql = new StringBuilder("SELECT DISTINCT ")
                    .append(name).append(".mk_hash, ").append(name).append(".ev_count FROM ")
                    .append(from(plan.getTable()));
            if (plan.getPredicate() != null) {
                sql.append(" WHERE ").append(renderPredicate(plan.getPredicate(), parameters));
            }
            return sql.toString();
        }

        @Override
        public String visitPaperScan(@Nonnull PaperScanPlan plan) {
            final StringBuilder sql = new StringBuilder("SELECT DISTINCT source_meta.mk_hash, source_meta.ev_count FROM ")
                    .append(from(ReadonlyTable.SOURCE_META))
                    .append(" JOIN ").append(from(ReadonlyTable.FAST_RAW_PA_LINK))
                    .append(" ON fast_raw_pa_link.mk_hash = source_meta.mk_hash")
                    .append(" JOIN ").append(from(ReadonlyTable.READING_REF_LINK))
                    .append(" ON reading_ref_link.rid = fast_raw_pa_link.reading_id WHERE ")
                    .append(renderPredicate(plan.getPaperPredicate(), parameters));
            if (plan.getMetaPredicate() != null) {
                sql.append(" AND ").append(renderPredicate(plan.getMetaPredicate(), parameters));
            }
            return sql.toString();
        }

        @Override
        public String visitIntersection(@Nonnull IntersectionPlan plan) {
            return setOperation(plan.getChildren(), "INTERSECT");
        }

        @Override
        public String visitUnion(@Nonnull UnionPlan plan) {
            return setOperation(plan.getChildren(), "UNION");
        }

        @Override
        public String visitExcept(@Nonnull ExceptPlan plan) {
            return setOperation(ImmutableList.of(plan.getBase(), plan.getSubtracted()), "EXCEPT");
        }

        @Nonnull
        private String setOperation(@Nonnull List<HashQueryPlan> children, @Nonnull String operator) {
            final List<String> parts = new ArrayList<>(children.size());
            for (HashQueryPlan child : children) {
                final String alias = "s" + (++aliases);
                // the child is rendered first so that its parameters precede those of later siblings
                final String childSql = child.accept(this);
                parts.add("SELECT " + alias + ".mk_hash, " + alias + ".ev_count FROM (" + childSql + ") " + alias);
            }
            return String.join(" " + operator + " ", parts);
        }
    }

    private static class PredicateRenderer implements FilterPredicateVisitor<String> {
        @Nonnull
        private final List<Object> parameters;

        PredicateRenderer(@Nonnull List<Object> parameters) {
            this.parameters = parameters;
        }

        @Override
        public String visitColumn(@Nonnull ColumnPredicate predicate) {
            final String column = predicate.getTable().getTableName() + "." + predicate.getColumn();
            final String symbol = predicate.getComparison().getSymbol(predicate.isNegated());
            switch (predicate.getComparison()) {
                case IN:
                    final List<?> values = (List<?>)predicate.getComparand();
                    if (values.isEmpty()) {
                        return predicate.isNegated() ? "1 = 1" : "1 = 0";
                    }
                    parameters.addAll(values);
                    return column + " " + symbol + " (" + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
                case IS_NULL:
                    return column + " " + symbol;
                default:
                    parameters.add(predicate.getComparand());
                    return column + " " + symbol + " ?";
            }
        }

        @Override
        public String visitAnd(@Nonnull AndPredicate predicate) {
            return join(predicate, " AND ");
        }

        @Override
        public String visitOr(@Nonnull OrPredicate predicate) {
            return join(predicate, " OR ");
        }

        @Nonnull
        private String join(@Nonnull AndOrPredicate predicate, @Nonnull String joiner) {
            final List<String> clauses = new ArrayList<>(predicate.getChildren().size());
            for (FilterPredicate child : predicate.getChildren()) {
                clauses.add(child.accept(this));
            }
            return "(" + String.join(joiner, clauses) + ")";
        }
    }
}
