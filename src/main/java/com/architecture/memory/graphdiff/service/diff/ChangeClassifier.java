package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeCategory;
import com.architecture.memory.graphdiff.dto.diff.ChangeImpact;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.dto.diff.Migration;
import com.architecture.memory.graphdiff.dto.diff.SemanticChange;
import com.architecture.memory.graphdiff.model.graph.EntityKind;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.diff.filter.ClassificationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assigns semantic category and impact to detected changes.
 *
 * The data-impact rule is always applied by the comparator. The semantic pass
 * only runs when {@link DiffOptions#isSemanticDiff()} is set: every edge change
 * is rated by connectivity (breaking only for a removal that lowers it), then
 * type and behavior paths escalate, then breaking changes get migration hints.
 * Registered {@link ClassificationRule}s run last.
 */
@Service
@Slf4j
public class ChangeClassifier {

    private static final String TYPE_SEGMENT = "type";
    private static final String BEHAVIOR_SEGMENT = "behavior";

    private final List<ClassificationRule> rules = new CopyOnWriteArrayList<>();
    private final AtomicLong ruleFailures = new AtomicLong();

    /**
     * Impact of a single data difference: additions enhance, removals and
     * type changes break, same-typed value changes are compatible.
     */
    public ChangeImpact dataImpact(PropertyDiff diff) {
        return switch (diff.getValueChange()) {
            case ADDED -> ChangeImpact.ENHANCEMENT;
            case REMOVED -> ChangeImpact.BREAKING;
            case CHANGED -> JsonValues.typeOf(diff.getOldValue()).equals(JsonValues.typeOf(diff.getNewValue()))
                    ? ChangeImpact.COMPATIBLE
                    : ChangeImpact.BREAKING;
        };
    }

    /**
     * Returns reclassified copies of the changes; the input list is left untouched.
     */
    public List<Change> classify(List<Change> changes, GraphSnapshot source, GraphSnapshot target,
                                 DiffOptions options) {
        List<Change> result = changes;

        if (options.isSemanticDiff()) {
            result = applySemanticAnalysis(result, source, target);
        }
        if (!rules.isEmpty()) {
            result = applyRules(result, options.isSemanticDiff());
        }
        return result;
    }

    public void registerRule(ClassificationRule rule) {
        rules.add(rule);
        log.info("Registered classification rule '{}'", rule.getName());
    }

    public boolean removeRule(String name) {
        return rules.removeIf(rule -> rule.getName().equals(name));
    }

    public List<ClassificationRule> getRules() {
        return List.copyOf(rules);
    }

    public long getRuleFailureCount() {
        return ruleFailures.get();
    }

    // ========================= SEMANTIC ANALYSIS =========================

    private List<Change> applySemanticAnalysis(List<Change> changes, GraphSnapshot source, GraphSnapshot target) {
        double sourceConnectivity = connectivity(source);
        double targetConnectivity = connectivity(target);
        boolean connectivityDropped = targetConnectivity < sourceConnectivity;

        List<Change> result = new ArrayList<>(changes.size());
        for (Change change : changes) {
            SemanticChange.SemanticChangeBuilder semantic = change.getSemantic().toBuilder();
            ChangeImpact impact = change.getImpact();
            ChangeCategory category = change.getCategory();

            if (change.getEntity() == EntityKind.EDGE) {
                impact = change.getType() == ChangeType.EDGE_REMOVED && connectivityDropped
                        ? ChangeImpact.BREAKING
                        : ChangeImpact.COMPATIBLE;
            }

            if (change.pathContains(TYPE_SEGMENT) || change.pathContains(BEHAVIOR_SEGMENT)) {
                category = ChangeCategory.BEHAVIORAL;
                impact = ChangeImpact.BREAKING;
            }

            semantic.category(category).impact(impact);
            if (impact == ChangeImpact.BREAKING) {
                semantic.clearMigrations().migrations(migrationsFor(change));
            }
            result.add(change.toBuilder().semantic(semantic.build()).build());
        }

        log.debug("Semantic analysis done: connectivity {} -> {}", sourceConnectivity, targetConnectivity);
        return result;
    }

    /**
     * Edges per node; a crude measure of how connected the graph is.
     */
    static double connectivity(GraphSnapshot snapshot) {
        return (double) snapshot.getEdges().size() / Math.max(1, snapshot.getNodes().size());
    }

    List<Migration> migrationsFor(Change change) {
        List<Migration> migrations = new ArrayList<>();

        switch (change.getType()) {
            case NODE_REMOVED -> migrations.add(Migration.builder()
                    .type(Migration.Type.MANUAL)
                    .description("Manually handle removal of node " + change.getEntityId())
                    .instructions("Review and update all references to node " + change.getEntityId()
                            + " before removal")
                    .build());
            case EDGE_REMOVED -> migrations.add(Migration.builder()
                    .type(Migration.Type.AUTOMATIC)
                    .description("Update references to removed edge " + change.getEntityId())
                    .code("// Remove edge references\n// Update graph structure")
                    .build());
            case NODE_MODIFIED, EDGE_MODIFIED -> {
                if (change.pathContains(TYPE_SEGMENT)) {
                    String kind = change.getEntity() == EntityKind.NODE ? "node" : "edge";
                    migrations.add(Migration.builder()
                            .type(Migration.Type.DATA_TRANSFORM)
                            .description("Transform " + kind + " data for type change from "
                                    + change.getOldValue() + " to " + change.getNewValue())
                            .code(kind + ".data = transformData(" + kind + ".data, '"
                                    + change.getOldValue() + "', '" + change.getNewValue() + "');")
                            .build());
                }
            }
            case NODE_ADDED, EDGE_ADDED -> {
                // additions never need a migration
            }
        }
        return migrations;
    }

    // ========================= CUSTOM RULES =========================

    private List<Change> applyRules(List<Change> changes, boolean withMigrations) {
        List<Change> result = new ArrayList<>(changes.size());
        for (Change change : changes) {
            Change current = change;
            for (ClassificationRule rule : rules) {
                if (matches(rule, current)) {
                    current = override(current, rule, withMigrations);
                }
            }
            result.add(current);
        }
        return result;
    }

    private boolean matches(ClassificationRule rule, Change change) {
        try {
            return rule.getWhen().test(change);
        } catch (RuntimeException e) {
            ruleFailures.incrementAndGet();
            log.warn("Classification rule '{}' failed on change {}, skipping: {}",
                    rule.getName(), change.getId(), e.getMessage());
            return false;
        }
    }

    private Change override(Change change, ClassificationRule rule, boolean withMigrations) {
        SemanticChange.SemanticChangeBuilder semantic = change.getSemantic().toBuilder();
        if (rule.getCategory() != null) {
            semantic.category(rule.getCategory());
        }
        if (rule.getImpact() != null) {
            semantic.impact(rule.getImpact());
            if (rule.getImpact() != ChangeImpact.BREAKING) {
                // migrations only accompany breaking changes
                semantic.clearMigrations();
            } else if (withMigrations && change.getSemantic().getMigrations().isEmpty()) {
                semantic.migrations(migrationsFor(change));
            }
        }
        return change.toBuilder().semantic(semantic.build()).build();
    }
}
