/*
 * StatementJsonAssembler.java
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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.stmtdb.readonly.ReadonlyCoreException;
import org.stmtdb.readonly.logging.LogMessageKeys;
import org.stmtdb.readonly.metadata.StatementTypes;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Builds statement and evidence JSON from content rows.
 */
class StatementJsonAssembler {
    private StatementJsonAssembler() {
    }

    /**
     * Parse the preassembled statement JSON of a row and give it an empty evidence list.
     */
    @Nonnull
    static JsonObject statement(@Nonnull ContentRow row) {
        final JsonObject statement = parse(row.getPaJson(), row).getAsJsonObject();
        statement.add("evidence", new JsonArray());
        return statement;
    }

    /**
     * Build the evidence JSON of a row: the first evidence of its raw statement, annotated with the raw text of the
     * agents, the raw statement's id as a prior uuid, the content source, and the reading's paper identifiers.
     * @param row a row with raw JSON
     * @return the evidence
     */
    @Nonnull
    static JsonObject evidence(@Nonnull ContentRow row) {
        final String rawJson = row.getRawJson();
        if (rawJson == null) {
            throw new IllegalArgumentException("row has no raw statement: " + row);
        }
        final JsonObject raw = parse(rawJson, row).getAsJsonObject();
        final JsonElement evidenceList = raw.get("evidence");
        if (evidenceList == null || !evidenceList.isJsonArray() || evidenceList.getAsJsonArray().size() == 0) {
            throw new ReadonlyCoreException("raw statement has no evidence",
                    LogMessageKeys.MK_HASH, row.getMkHash(),
                    LogMessageKeys.RAW_ID, row.getRawId());
        }
        final JsonObject evidence = evidenceList.getAsJsonArray().get(0).getAsJsonObject().deepCopy();
        final JsonObject annotations = childObject(evidence, "annotations");

        final JsonObject agents = new JsonObject();
        agents.add("raw_text", rawTexts(raw));
        annotations.add("agents", agents);

        final JsonArray priorUuids = annotations.has("prior_uuids")
                                     ? annotations.getAsJsonArray("prior_uuids")
                                     : new JsonArray();
        priorUuids.add(raw.get("id"));
        annotations.add("prior_uuids", priorUuids);

        final ReadingRef ref = row.getReadingRef();
        final JsonObject textRefs = childObject(evidence, "text_refs");
        if (ref.getPmid() != null) {
            evidence.addProperty("pmid", ref.getPmid());
        } else {
            textRefs.remove("PMID");
        }
        for (Map.Entry<String, Object> entry : ref.getTextRefs().entrySet()) {
            final Object value = entry.getValue();
            textRefs.add(entry.getKey(), value instanceof Number ? new JsonPrimitive((Number)value)
                                                                 : new JsonPrimitive(value.toString()));
        }
        if (ref.getSource() != null) {
            annotations.addProperty("content_source", ref.getSource());
        }
        return evidence;
    }

    /**
     * Get the {@code TEXT} grounding of each agent of a raw statement, in the agent order of its type. Absent agents
     * give {@code null}, list-valued agent fields give one entry per member.
     */
    @Nonnull
    static JsonArray rawTexts(@Nonnull JsonObject raw) {
        final JsonArray texts = new JsonArray();
        final JsonElement type = raw.get("type");
        if (type == null || !StatementTypes.isKnown(type.getAsString())) {
            return texts;
        }
        for (String field : StatementTypes.byName(type.getAsString()).getAgentOrder()) {
            final JsonElement value = raw.get(field);
            if (value == null || value.isJsonNull()) {
                texts.add(JsonNull.INSTANCE);
            } else if (value.isJsonArray()) {
                for (JsonElement member : value.getAsJsonArray()) {
                    texts.add(agentText(member));
                }
            } else {
                texts.add(agentText(value));
            }
        }
        return texts;
    }

    @Nonnull
    private static JsonElement agentText(@Nonnull JsonElement agent) {
        if (!agent.isJsonObject()) {
            return JsonNull.INSTANCE;
        }
        final JsonElement dbRefs = agent.getAsJsonObject().get("db_refs");
        if (dbRefs == null || !dbRefs.isJsonObject()) {
            return JsonNull.INSTANCE;
        }
        final JsonElement text = dbRefs.getAsJsonObject().get("TEXT");
        return text == null ? JsonNull.INSTANCE : text;
    }

    @Nonnull
    private static JsonObject childObject(@Nonnull JsonObject parent, @Nonnull String key) {
        final JsonElement child = parent.get(key);
        if (child != null && child.isJsonObject()) {
            return child.getAsJsonObject();
        }
        final JsonObject created = new JsonObject();
        parent.add(key, created);
        return created;
    }

    @Nonnull
    private static JsonElement parse(@Nonnull String json, @Nonnull ContentRow row) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ReadonlyCoreException("unreadable statement JSON", e)
                    .addLogInfo(LogMessageKeys.MK_HASH, row.getMkHash(), LogMessageKeys.RAW_ID, row.getRawId());
        }
    }
}
