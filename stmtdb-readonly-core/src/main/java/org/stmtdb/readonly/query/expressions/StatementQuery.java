/*
 * StatementQuery.java
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
import com.google.gson.JsonPrimitive;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base class for all statement queries.
 *
 * <p>
 * A statement query is an immutable boolean condition over statement fingerprints. Queries are combined with
 * {@link #and}, {@link #or}, {@link #invert} and {@link #subtract}, and simplify themselves as they are combined:
 * constraints of the same family are merged, and contradictions and tautologies are detected so that a query can be
 * known to match nothing ({@link #isEmpty()}) or everything ({@link #isFull()}) without touching the store.
 * </p>
 *
 * <p>
 * The set of query classes is closed: the constructor is package private and every class is handled by
 * {@link StatementQueryVisitor}.
 * </p>
 *
 * <p>
 * Two queries are equal when they are of the same class and have the same canonical JSON description, which
 * includes the inversion flag.
 * </p>
 */
@API(API.Status.UNSTABLE)
public abstract class StatementQuery {
    private final boolean inverted;
    private final boolean empty;
    private final boolean full;
    @Nullable
    private volatile JsonObject canonicalJson;
    @Nullable
    private volatile String canonicalJsonString;

    StatementQuery(boolean inverted, boolean empty, boolean full) {
        if (empty && full) {
            throw new ReadonlyCoreArgumentException("query cannot be both empty and full");
        }
        this.inverted = inverted;
        this.empty = empty;
        this.full = full;
    }

    public boolean isInverted() {
        return inverted;
    }

    /**
     * Whether this query is known to match no statements.
     * @return {@code true} if the query is statically empty
     */
    public boolean isEmpty() {
        return empty;
    }

    /**
     * Whether this query is known to match every statement.
     * @return {@code true} if the query is statically full
     */
    public boolean isFull() {
        return full;
    }

    /**
     * Get the logical negation of this query. An empty query inverts to a full one and vice versa.
     * @return the inverse
     */
    @Nonnull
    public StatementQuery invert() {
        return copy(!inverted, full, empty);
    }

    /**
     * Build a copy of this query with the given flags.
     * @param inverted the inversion flag of the copy
     * @param empty whether the copy is statically empty
     * @param full whether the copy is statically full
     * @return a copy
     */
    @Nonnull
    abstract StatementQuery copy(boolean inverted, boolean empty, boolean full);

    /**
     * Get the query matching statements that match both this and {@code other}.
     * @param other the other query
     * @return the intersection, simplified
     */
    @Nonnull
    public StatementQuery and(@Nonnull StatementQuery other) {
        if (equals(other) || other.isFull()) {
            return this;
        }
        if (isFull()) {
            return other;
        }
        return doAnd(other);
    }

    /**
     * Get the query matching statements that match either this or {@code other}.
     * @param other the other query
     * @return the union, simplified
     */
    @Nonnull
    public StatementQuery or(@Nonnull StatementQuery other) {
        if (equals(other) || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return doOr(other);
    }

    /**
     * Get the query matching statements that match this but not {@code other}.
     * @param other the query to exclude
     * @return {@code this.and(other.invert())}
     */
    @Nonnull
    public StatementQuery subtract(@Nonnull StatementQuery other) {
        return and(other.invert());
    }

    @Nonnull
    StatementQuery doAnd(@Nonnull StatementQuery other) {
        return Intersection.of(this, other);
    }

    @Nonnull
    StatementQuery doOr(@Nonnull StatementQuery other) {
        return Union.of(this, other);
    }

    /**
     * Whether {@code other} is exactly the logical negation of this query.
     * @param other the other query
     * @return {@code true} if {@code other} equals {@code this.invert()}
     */
    public boolean isInverseOf(@Nonnull StatementQuery other) {
        return invert().equals(other);
    }

    /**
     * Get the name of this query's family, used as {@code class} in its JSON description.
     * @return the family name
     */
    @Nonnull
    public String getFamilyName() {
        return getClass().getSimpleName();
    }

    /**
     * Get the family specific part of the JSON description. Collections in it must be in canonical order.
     * @return the constraint description
     */
    @Nonnull
    abstract JsonObject getConstraintJson();

    /**
     * Get the canonical JSON description of this query.
     * @return an object with the keys {@code class}, {@code constraint} and {@code inverted}
     */
    @Nonnull
    public JsonObject toJson() {
        return canonicalJson().deepCopy();
    }

    @Nonnull
    public String toJsonString() {
        String result = canonicalJsonString;
        if (result == null) {
            result = canonicalJson().toString();
            canonicalJsonString = result;
        }
        return result;
    }

    /**
     * Get the canonical JSON description, computed once per query. The returned object is shared and must not be
     * modified; {@link #toJson()} hands out copies.
     * @return the cached description
     */
    @Nonnull
    JsonObject canonicalJson() {
        JsonObject result = canonicalJson;
        if (result == null) {
            result = new JsonObject();
            result.add("class", new JsonPrimitive(getFamilyName()));
            result.add("constraint", getConstraintJson());
            result.add("inverted", new JsonPrimitive(inverted));
            canonicalJson = result;
        }
        return result;
    }

    /**
     * Get the names of the leaf families used anywhere in this query.
     * @return the family names, sorted
     */
    @Nonnull
    public Set<String> getComponentQueries() {
        final Set<String> components = new TreeSet<>();
        addComponentQueries(components);
        return components;
    }

    void addComponentQueries(@Nonnull Set<String> components) {
        components.add(getFamilyName());
    }

    @Nonnull
    public abstract <T> T accept(@Nonnull StatementQueryVisitor<T> visitor);

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StatementQuery that = (StatementQuery)o;
        return toJsonString().equals(that.toJsonString());
    }

    @Override
    public int hashCode() {
        return toJsonString().hashCode();
    }
}
