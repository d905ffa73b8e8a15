/*
 * StatementTypes.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.stmtdb.annotation.API;
import org.stmtdb.readonly.ReadonlyCoreArgumentException;
import org.stmtdb.readonly.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registry of the statement types stored in the readonly store.
 *
 * <p>
 * Type numbers are the positions of the type names in alphabetical order, which is how the store assigns
 * {@code type_num}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class StatementTypes {
    private static final List<String> ENZ_SUB = ImmutableList.of("enz", "sub");
    private static final List<String> SUBJ_OBJ = ImmutableList.of("subj", "obj");
    private static final List<String> AGENT = ImmutableList.of("agent");

    private static final ImmutableMap<String, StatementType> TYPES = buildTypes();
    private static final ImmutableMap<Integer, StatementType> BY_NUM = buildByNum();

    private StatementTypes() {
    }

    private static ImmutableMap<String, StatementType> buildTypes() {
        final Map<String, String> parents = new LinkedHashMap<>();
        final Map<String, List<String>> agents = new LinkedHashMap<>();
        declare(parents, agents, "Statement", null, ImmutableList.of());
        declare(parents, agents, "Modification", "Statement", ENZ_SUB);
        declare(parents, agents, "AddModification", "Modification", ENZ_SUB);
        declare(parents, agents, "RemoveModification", "Modification", ENZ_SUB);
        for (String mod : ImmutableList.of("Phosphorylation", "Ubiquitination", "Sumoylation", "Hydroxylation",
                "Acetylation", "Glycosylation", "Ribosylation", "Farnesylation", "Geranylgeranylation",
                "Palmitoylation", "Myristoylation", "Methylation")) {
            declare(parents, agents, mod, "AddModification", ENZ_SUB);
            declare(parents, agents, "De" + mod.substring(0, 1).toLowerCase(Locale.ROOT) + mod.substring(1), "RemoveModification", ENZ_SUB);
        }
        declare(parents, agents, "SelfModification", "Statement", ImmutableList.of("enz"));
        declare(parents, agents, "Autophosphorylation", "SelfModification", ImmutableList.of("enz"));
        declare(parents, agents, "Transphosphorylation", "SelfModification", ImmutableList.of("enz"));
        declare(parents, agents, "RegulateActivity", "Statement", SUBJ_OBJ);
        declare(parents, agents, "Activation", "RegulateActivity", SUBJ_OBJ);
        declare(parents, agents, "Inhibition", "RegulateActivity", SUBJ_OBJ);
        declare(parents, agents, "ActiveForm", "Statement", AGENT);
        declare(parents, agents, "HasActivity", "Statement", AGENT);
        declare(parents, agents, "Gef", "Statement", ImmutableList.of("gef", "ras"));
        declare(parents, agents, "Gap", "Statement", ImmutableList.of("gap", "ras"));
        declare(parents, agents, "Complex", "Statement", ImmutableList.of("members"));
        declare(parents, agents, "Association", "Complex", ImmutableList.of("members"));
        declare(parents, agents, "Translocation", "Statement", AGENT);
        declare(parents, agents, "RegulateAmount", "Statement", SUBJ_OBJ);
        declare(parents, agents, "IncreaseAmount", "RegulateAmount", SUBJ_OBJ);
        declare(parents, agents, "DecreaseAmount", "RegulateAmount", SUBJ_OBJ);
        declare(parents, agents, "Influence", "Statement", SUBJ_OBJ);
        declare(parents, agents, "Conversion", "Statement", ImmutableList.of("subj", "obj_from", "obj_to"));
        declare(parents, agents, "Event", "Statement", ImmutableList.of("concept"));

        final List<String> sortedNames = new ArrayList<>(new TreeSet<>(parents.keySet()));
        final ImmutableMap.Builder<String, StatementType> builder = ImmutableMap.builder();
        for (Map.Entry<String, String> entry : parents.entrySet()) {
            final String name = entry.getKey();
            builder.put(name, new StatementType(name, entry.getValue(), ImmutableList.copyOf(agents.get(name)),
                    sortedNames.indexOf(name)));
        }
        return builder.build();
    }

    private static void declare(@Nonnull Map<String, String> parents, @Nonnull Map<String, List<String>> agents,
                                @Nonnull String name, @Nullable String parent, @Nonnull List<String> agentOrder) {
        parents.put(name, parent);
        agents.put(name, agentOrder);
    }

    private static ImmutableMap<Integer, StatementType> buildByNum() {
        final ImmutableMap.Builder<Integer, StatementType> builder = ImmutableMap.builder();
        for (StatementType type : TYPES.values()) {
            builder.put(type.getTypeNum(), type);
        }
        return builder.build();
    }

    /**
     * Look up a type by its exact name.
     * @param name the type name, spelled and capitalized as stored, e.g. {@code Phosphorylation}
     * @return the type
     * @throws ReadonlyCoreArgumentException if no type has that name
     */
    @Nonnull
    public static StatementType byName(@Nonnull String name) {
        final StatementType type = TYPES.get(name);
        if (type == null) {
            throw new ReadonlyCoreArgumentException("unknown statement type", LogMessageKeys.STATEMENT_TYPE, name);
        }
        return type;
    }

    @Nonnull
    public static StatementType byTypeNum(int typeNum) {
        final StatementType type = BY_NUM.get(typeNum);
        if (type == null) {
            throw new ReadonlyCoreArgumentException("unknown statement type number", LogMessageKeys.STATEMENT_TYPE, typeNum);
        }
        return type;
    }

    public static boolean isKnown(@Nonnull String name) {
        return TYPES.containsKey(name);
    }

    @Nonnull
    public static Collection<StatementType> all() {
        return TYPES.values();
    }

    /**
     * Get the names of all types descending from the given one, not including itself.
     * @param name the ancestor type name
     * @return the names of its descendants
     */
    @Nonnull
    public static ImmutableSet<String> descendantNames(@Nonnull String name) {
        byName(name);
        final Set<String> result = new TreeSet<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (StatementType type : TYPES.values()) {
                final String parent = type.getParentName();
                if (parent != null && (Objects.equals(parent, name) || result.contains(parent))
                        && result.add(type.getName())) {
                    grew = true;
                }
            }
        }
        return ImmutableSet.copyOf(result);
    }
}
