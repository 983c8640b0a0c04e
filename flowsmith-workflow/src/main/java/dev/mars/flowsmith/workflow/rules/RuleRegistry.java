/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowsmith.workflow.rules;

import dev.mars.flowsmith.workflow.rules.categories.FlowRules;
import dev.mars.flowsmith.workflow.rules.categories.InputRules;
import dev.mars.flowsmith.workflow.rules.categories.NodeRules;
import dev.mars.flowsmith.workflow.rules.categories.OutputRules;
import dev.mars.flowsmith.workflow.rules.categories.StructuralRules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Holds rules by id and by category. Registration is expected to happen during setup,
 * before the owning engine executes; the registry performs no locking.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RuleRegistry {

    private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

    private final Map<String, Rule> rulesById = new LinkedHashMap<>();
    private final Map<RuleCategory, List<Rule>> rulesByCategory = new EnumMap<>(RuleCategory.class);

    /**
     * Creates a registry holding the built-in rules of every category.
     */
    public static RuleRegistry withDefaultRules(EngineConfig config) {
        Objects.requireNonNull(config, "Engine config cannot be null");
        RuleRegistry registry = new RuleRegistry();
        registry.registerRules(InputRules.create());
        registry.registerRules(StructuralRules.create());
        registry.registerRules(NodeRules.create());
        registry.registerRules(FlowRules.create(config.getMaxNodes()));
        registry.registerRules(OutputRules.create());
        return registry;
    }

    /**
     * @throws IllegalArgumentException if a rule with the same id is already registered
     */
    public void register(Rule rule) {
        Objects.requireNonNull(rule, "Rule cannot be null");
        if (rulesById.containsKey(rule.getId())) {
            throw new IllegalArgumentException("Rule with id '" + rule.getId() + "' is already registered");
        }
        rulesById.put(rule.getId(), rule);
        rulesByCategory.computeIfAbsent(rule.getCategory(), key -> new ArrayList<>()).add(rule);
        logger.fine("Registered rule " + rule.getId() + " in category " + rule.getCategory().getLabel());
    }

    public void registerRules(Collection<? extends Rule> rules) {
        Objects.requireNonNull(rules, "Rules cannot be null");
        rules.forEach(this::register);
    }

    /**
     * @return true if a rule was removed
     */
    public boolean unregister(String ruleId) {
        Rule removed = rulesById.remove(ruleId);
        if (removed == null) {
            return false;
        }
        List<Rule> categoryRules = rulesByCategory.get(removed.getCategory());
        if (categoryRules != null) {
            categoryRules.remove(removed);
        }
        logger.fine("Unregistered rule " + ruleId);
        return true;
    }

    public Optional<Rule> getRule(String ruleId) {
        return Optional.ofNullable(rulesById.get(ruleId));
    }

    public List<Rule> listRules() {
        return List.copyOf(rulesById.values());
    }

    public List<Rule> rulesFor(RuleCategory category) {
        List<Rule> rules = rulesByCategory.get(category);
        return rules != null ? List.copyOf(rules) : List.of();
    }

    /**
     * @return every rule in category execution order, registration order within a category
     */
    public List<Rule> orderedRules() {
        List<Rule> ordered = new ArrayList<>();
        for (RuleCategory category : RuleCategory.values()) {
            ordered.addAll(rulesFor(category));
        }
        return ordered;
    }

    public RegistryStats stats() {
        Map<RuleCategory, Integer> byCategory = new EnumMap<>(RuleCategory.class);
        for (RuleCategory category : RuleCategory.values()) {
            byCategory.put(category, rulesFor(category).size());
        }
        int enabled = (int) rulesById.values().stream().filter(Rule::isEnabled).count();
        return new RegistryStats(rulesById.size(), enabled, Collections.unmodifiableMap(byCategory));
    }

    /**
     * Rule counts, overall and per category.
     */
    public record RegistryStats(int totalRules, int enabledRules, Map<RuleCategory, Integer> byCategory) {
    }

    @Override
    public String toString() {
        return "RuleRegistry{" +
               "rules=" + rulesById.keySet() +
               '}';
    }
}
