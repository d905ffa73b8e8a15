/*
 * ReadonlyColumns.java
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

/**
 * Column names of the readonly store.
 */
@API(API.Status.UNSTABLE)
public final class ReadonlyColumns {
    // shared by every hash scannable table
    public static final String MK_HASH = "mk_hash";
    public static final String EV_COUNT = "ev_count";
    public static final String TYPE_NUM = "type_num";
    public static final String AGENT_COUNT = "agent_count";
    public static final String ACTIVITY = "activity";
    public static final String IS_ACTIVE = "is_active";

    // source_meta
    public static final String ONLY_SRC = "only_src";
    public static final String HAS_RD = "has_rd";
    public static final String HAS_DB = "has_db";
    public static final String SRC_JSON = "src_json";

    // agent mention tables
    public static final String DB_ID = "db_id";
    public static final String DB_NAME = "db_name";
    public static final String ROLE_NUM = "role_num";
    public static final String AG_NUM = "ag_num";

    // mesh tables
    public static final String MESH_NUM = "mesh_num";

    // fast_raw_pa_link
    public static final String ID = "id";
    public static final String RAW_JSON = "raw_json";
    public static final String PA_JSON = "pa_json";
    public static final String READING_ID = "reading_id";

    // raw statement evidence tables
    public static final String SID = "sid";
    public static final String SRC = "src";

    // reading_ref_link
    public static final String RID = "rid";
    public static final String SOURCE = "source";

    private ReadonlyColumns() {
    }
}
