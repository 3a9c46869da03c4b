package dev.py2flow.engine;

import dev.py2flow.model.ColumnLineage;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.EffectKind;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldRef;
import dev.py2flow.model.Flow;
import dev.py2flow.model.LineageHop;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Backward field tracing through sub-step field effects.
 *
 * <p>Fields that no effect mentions pass through a step unchanged. Opaque
 * effects, pivots (whose output columns depend on the data) and custom-code
 * recipes stop the walk with an unresolved result; the other branches are
 * still followed. A field that leads back to itself through a cycle is
 * unresolved as well.</p>
 */
public final class ColumnLineageTracer {

    private ColumnLineageTracer() {}

    /**
     * Trace a field of the last output dataset that has it in its schema, or
     * of the last output dataset when none does.
     *
     * @throws IllegalArgumentException when the flow has no output dataset
     */
    public static ColumnLineage trace(Flow flow, String field) {
        List<Dataset> outputs = flow.datasetsWithRole(DatasetRole.OUTPUT);
        if (outputs.isEmpty()) {
            throw new IllegalArgumentException("Flow '%s' has no output dataset".formatted(flow.name()));
        }
        Dataset target = outputs.get(outputs.size() - 1);
        for (Dataset dataset : outputs) {
            if (dataset.hasField(field)) {
                target = dataset;
            }
        }
        return trace(flow, target.name(), field);
    }

    /**
     * @throws IllegalArgumentException when the dataset does not exist
     */
    public static ColumnLineage trace(Flow flow, String dataset, String field) {
        if (flow.dataset(dataset).isEmpty()) {
            throw new IllegalArgumentException("Unknown dataset: " + dataset);
        }
        var walk = new Walk(flow);
        walk.visit(new FieldRef(dataset, field));
        return new ColumnLineage(new FieldRef(dataset, field), walk.chain, List.copyOf(walk.origins),
            walk.unresolvedReason == null, walk.unresolvedReason);
    }

    private static final class Walk {

        private final Flow flow;
        private final FlowGraph graph;
        private final List<LineageHop> chain = new ArrayList<>();
        private final Set<FieldRef> origins = new LinkedHashSet<>();
        private final Set<FieldRef> visited = new HashSet<>();
        private final Set<FieldRef> onPath = new HashSet<>();
        private String unresolvedReason;

        Walk(Flow flow) {
            this.flow = flow;
            this.graph = flow.graph();
        }

        void visit(FieldRef ref) {
            if (onPath.contains(ref)) {
                unresolved("'%s' depends on itself through a cycle".formatted(ref));
                return;
            }
            if (!visited.add(ref)) {
                return;
            }
            onPath.add(ref);
            try {
                visitProducer(ref);
            } finally {
                onPath.remove(ref);
            }
        }

        private void visitProducer(FieldRef ref) {
            Recipe recipe = graph.producer(ref.dataset()).orElse(null);
            if (recipe == null) {
                origins.add(ref);
                return;
            }
            if (recipe.kind() == RecipeKind.CUSTOM_CODE) {
                unresolved("'%s' is produced by Python recipe '%s'".formatted(ref, recipe.name()));
                return;
            }
            List<LineageHop> hops = new ArrayList<>();
            Set<String> fields = new LinkedHashSet<>(List.of(ref.field()));
            List<SubStep> steps = recipe.steps();
            for (int i = steps.size() - 1; i >= 0 && !fields.isEmpty(); i--) {
                fields = throughStep(recipe, steps.get(i), ref.dataset(), fields, hops);
                if (fields == null) {
                    break;
                }
            }
            if (fields != null) {
                for (String source : fields) {
                    for (String input : route(recipe, source)) {
                        visit(new FieldRef(input, source));
                    }
                }
            }
            // upstream hops first; this recipe's hops were collected backwards
            for (int i = hops.size() - 1; i >= 0; i--) {
                chain.add(hops.get(i));
            }
        }

        /** Maps fields of the step output to fields of its input; null when the walk must stop. */
        private Set<String> throughStep(Recipe recipe, SubStep step, String dataset, Set<String> fields,
                                        List<LineageHop> hops) {
            Set<String> sources = new LinkedHashSet<>();
            String input = recipe.inputs().isEmpty() ? null : recipe.inputs().get(0);
            for (String field : fields) {
                FieldEffect effect = step.effectFor(field);
                if (effect == null) {
                    if (step.type() == StepType.PIVOT) {
                        unresolved("'%s.%s' is not traceable through %s recipe '%s'"
                            .formatted(dataset, field, recipe.kind().value(), recipe.name()));
                        return null;
                    }
                    if (step.type() == StepType.COLUMN_DELETER && step.columns().contains(field)) {
                        continue;
                    }
                    sources.add(field);
                    continue;
                }
                if (effect.kind() == EffectKind.IDENTITY) {
                    sources.add(field);
                    continue;
                }
                if (effect.kind() == EffectKind.OPAQUE) {
                    unresolved("'%s.%s' is set by an opaque step in recipe '%s' (%s)"
                        .formatted(dataset, field, recipe.name(), step.description()));
                    return null;
                }
                List<FieldRef> from = input == null ? List.of()
                    : effect.sources().stream().map(s -> new FieldRef(input, s)).toList();
                hops.add(new LineageHop(recipe.name(), step.description(), from, new FieldRef(dataset, field)));
                sources.addAll(effect.sources());
            }
            return sources;
        }

        /** Inputs that carry a source field of {@code recipe}. */
        private List<String> route(Recipe recipe, String field) {
            List<String> inputs = recipe.inputs();
            if (inputs.isEmpty()) {
                return List.of();
            }
            return switch (recipe.kind()) {
                case STACK -> inputs;
                case JOIN -> recipe.steps().stream()
                    .anyMatch(s -> s.type() == StepType.JOIN && s.columns().contains(field))
                    ? List.of(inputs.get(0)) : List.of(firstWithField(inputs, field));
                case SPLIT -> List.of(firstWithField(inputs, field));
                default -> List.of(inputs.get(0));
            };
        }

        private String firstWithField(List<String> inputs, String field) {
            for (String input : inputs) {
                if (flow.dataset(input).map(d -> d.hasField(field)).orElse(false)) {
                    return input;
                }
            }
            return inputs.get(0);
        }

        private void unresolved(String reason) {
            if (unresolvedReason == null) {
                unresolvedReason = reason;
            }
        }
    }
}
