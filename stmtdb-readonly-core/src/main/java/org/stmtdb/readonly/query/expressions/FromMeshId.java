/*
 * FromMeshId.java
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

import com.google.gson.JsonObject;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.ReadonlyColumns;
import org.stmtdb.readonly.metadata.ReadonlyTable;
import org.stmtdb.readonly.query.predicates.ColumnPredicate;
import org.stmtdb.readonly.query.predicates.FilterPredicate;

import javax.annotation.Nonnull;
import java.util.regex.Pattern;

/**
 * Statements with evidence from papers annotated with a MeSH term ({@code D} ids) or concept ({@code C} ids).
 * Like {@link HasAgent}, one statement may have many annotations, and the inverse is planned as a set difference.
 */
@API(API.Status.UNSTABLE)
public class FromMeshId extends StatementQuery implements EvidenceFilterable {
    private static final Pattern MESH_ID = Pattern.compile("[CD][0-9]+");

    @Nonnull
    private final String meshId;
    private final long meshNum;

    public FromMeshId(@Nonnull String meshId) {
        this(validated(meshId), false, false, false);
    }

    private FromMeshId(@Nonnull String meshId, boolean inverted, boolean empty, boolean full) {
        super(inverted, empty, full);
        this.meshId = meshId;
        this.meshNum = Long.parseLong(meshId.substring(1));
    }

    @Nonnull
    private static String validated(@Nonnull String meshId) {
        if (!MESH_ID.matcher(meshId).matches()) {
            throw new ReadonlyCoreArgumentException("invalid MeSH id, must be D or C followed by digits",
                    LogMessageKeys.MESH_ID, meshId);
        }
        return meshId;
    }

    @Nonnull
    public String getMeshId() {
        return meshId;
    }

    public long getMeshNum() {
        return meshNum;
    }

    public boolean isConcept() {
        return meshId.charAt(0) == 'C';
    }

    @Nonnull
    public ReadonlyTable getTable() {
        return isConcept() ? ReadonlyTable.MESH_CONCEPT_META : ReadonlyTable.MESH_TERM_META;
    }

    @Nonnull
    public FilterPredicate getMentionPredicate() {
        return ColumnPredicate.equalTo(getTable(), ReadonlyColumns.MESH_NUM, meshNum);
    }

    @Nonnull
    @Override
    public EvidenceFilter getEvidenceFilter() {
        final ReadonlyTable table = isConcept() ? ReadonlyTable.RAW_STMT_MESH_CONCEPTS : ReadonlyTable.RAW_STMT_MESH_TERMS;
        final FilterPredicate predicate = ColumnPredicate.equalTo(table, ReadonlyColumns.MESH_NUM, meshNum);
        return isInverted() ? EvidenceFilter.notExists(table, predicate) : EvidenceFilter.exists(table, predicate);
    }

    @Nonnull
    @Override
    public FromMeshId invert() {
        return (FromMeshId)super.invert();
    }

    @Nonnull
    @Override
    FromMeshId copy(boolean inverted, boolean empty, boolean full) {
        return new FromMeshId(meshId, inverted, empty, full);
    }

    @Nonnull
    @Override
    JsonObject getConstraintJson() {
        final JsonObject json = new JsonObject();
        json.addProperty("mesh_id", meshId);
        return json;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull StatementQueryVisitor<T> visitor) {
        return visitor.visitFromMeshId(this);
    }

    @Override
    public String toString() {
        return "MeSH ID " + (isInverted() ? "!" : "") + "= " + meshId;
    }
}
