package dev.py2flow.model;

import java.util.List;
import java.util.Objects;

/**
 * A named transformation step with ordered inputs and outputs.
 *
 * @param name        unique name within the owning flow
 * @param kind        recipe kind
 * @param inputs      input dataset names, in order
 * @param outputs     output dataset names, in order
 * @param steps       ordered sub-steps
 * @param code        source of a custom-code recipe, otherwise null
 * @param sourceLines script lines the recipe was recognized from
 */
public record Recipe(
    String name,
    RecipeKind kind,
    List<String> inputs,
    List<String> outputs,
    List<SubStep> steps,
    String code,
    List<Integer> sourceLines
) {

    public Recipe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Recipe name must not be blank");
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        steps = steps == null ? List.of() : List.copyOf(steps);
        sourceLines = sourceLines == null ? List.of() : List.copyOf(sourceLines);
    }

    public boolean hasInput(String dataset) {
        return inputs.contains(dataset);
    }

    public boolean hasOutput(String dataset) {
        return outputs.contains(dataset);
    }

    /** Short summary of the steps, e.g. for diagram labels. */
    public String description() {
        if (steps.isEmpty()) {
            return kind.value();
        }
        return String.join("; ", steps.stream().map(SubStep::description).toList());
    }
}
