/*
 * package-info.java
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

/**
 * The statement query algebra.
 *
 * <p>
 * Leaf queries constrain a single aspect of a statement: its agents ({@link org.stmtdb.readonly.query.expressions.HasAgent}),
 * its sources ({@link org.stmtdb.readonly.query.expressions.SourceQuery} and subclasses), the papers and MeSH
 * annotations of its evidence, and the cross-cutting type, agent count and evidence count constraints
 * ({@link org.stmtdb.readonly.query.expressions.IntrusiveQuery}). They are combined into
 * {@link org.stmtdb.readonly.query.expressions.Intersection} and {@link org.stmtdb.readonly.query.expressions.Union}
 * nodes, which simplify as they are built. {@link org.stmtdb.readonly.query.expressions.Query} holds static factories
 * for all of them.
 * </p>
 */
package org.stmtdb.readonly.query.expressions;
