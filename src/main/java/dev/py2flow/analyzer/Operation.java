package dev.py2flow.analyzer;

import dev.py2flow.model.JoinType;
import dev.py2flow.model.SubStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A recognized data-processing operation.
 *
 * <p>Operations refer to script variables, not datasets: {@link #inputs()} are
 * the variables read and {@link #outputs()} the variables (re)bound. The flow
 * builder resolves them against its own binding table. Literal data values are
 * never carried, only the parameters needed to describe the recipe.</p>
 */
public sealed interface Operation {

    OperationTag tag();

    Origin origin();

    List<String> inputs();

    List<String> outputs();

    /** Load a dataset from a path or connection. */
    record Read(Origin origin, String output, String path, String format, List<String> columns) implements Operation {

        public Read {
            Objects.requireNonNull(output, "output");
            columns = columns == null ? List.of() : List.copyOf(columns);
        }

        public OperationTag tag() { return OperationTag.READ; }
        public List<String> inputs() { return List.of(); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Persist a dataset. */
    record Write(Origin origin, String input, String path, String format) implements Operation {

        public Write {
            Objects.requireNonNull(input, "input");
        }

        public OperationTag tag() { return OperationTag.WRITE; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(); }
    }

    /** Drop rows; {@code step} is a row-filter processor. */
    record Filter(Origin origin, String input, String output, SubStep step) implements Operation {

        public Filter {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(step, "step");
        }

        public OperationTag tag() { return OperationTag.FILTER; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Add, change, rename or remove columns. */
    record DeriveColumn(Origin origin, String input, String output, SubStep step) implements Operation {

        public DeriveColumn {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(step, "step");
        }

        public OperationTag tag() { return OperationTag.DERIVE_COLUMN; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    record Join(Origin origin, String left, String right, String output, JoinType joinType,
                List<String> leftKeys, List<String> rightKeys) implements Operation {

        public Join {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(output, "output");
            joinType = joinType == null ? JoinType.INNER : joinType;
            leftKeys = leftKeys == null ? List.of() : List.copyOf(leftKeys);
            rightKeys = rightKeys == null ? List.of() : List.copyOf(rightKeys);
        }

        public OperationTag tag() { return OperationTag.JOIN; }
        public List<String> inputs() { return List.of(left, right); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Row-wise concatenation of several datasets. */
    record Stack(Origin origin, List<String> sources, String output) implements Operation {

        public Stack {
            sources = List.copyOf(sources);
            Objects.requireNonNull(output, "output");
        }

        public OperationTag tag() { return OperationTag.STACK; }
        public List<String> inputs() { return sources; }
        public List<String> outputs() { return List.of(output); }
    }

    record Aggregate(Origin origin, String input, String output, List<String> keys,
                     List<Aggregation> aggregations) implements Operation {

        public Aggregate {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            keys = List.copyOf(keys);
            aggregations = List.copyOf(aggregations);
        }

        public OperationTag tag() { return OperationTag.AGGREGATE; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    record Sort(Origin origin, String input, String output, List<String> columns,
                List<Boolean> ascending) implements Operation {

        public Sort {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            columns = List.copyOf(columns);
            ascending = List.copyOf(ascending);
        }

        public OperationTag tag() { return OperationTag.SORT; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Remove duplicate rows, optionally on a column subset. */
    record Dedupe(Origin origin, String input, String output, List<String> subset, String keep) implements Operation {

        public Dedupe {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            subset = subset == null ? List.of() : List.copyOf(subset);
        }

        public OperationTag tag() { return OperationTag.DEDUPE; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    /**
     * Row sampling. {@code size} is a row count or a fraction as written in the
     * script; {@code rankingColumns} is set for largest/smallest.
     */
    record Sample(Origin origin, String input, String output, SampleMode mode, String size,
                  List<String> rankingColumns) implements Operation {

        public Sample {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(mode, "mode");
            rankingColumns = rankingColumns == null ? List.of() : List.copyOf(rankingColumns);
        }

        public OperationTag tag() { return OperationTag.SAMPLE; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Pivot, unpivot or window computation described by {@code step}. */
    record Reshape(Origin origin, String input, String output, ReshapeMode mode, SubStep step) implements Operation {

        public Reshape {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(step, "step");
        }

        public OperationTag tag() { return OperationTag.RESHAPE; }
        public List<String> inputs() { return List.of(input); }
        public List<String> outputs() { return List.of(output); }
    }

    /** Train/test style row split with one output per partition. */
    record Split(Origin origin, List<String> sources, List<String> outputs, String testSize) implements Operation {

        public Split {
            sources = List.copyOf(sources);
            outputs = List.copyOf(outputs);
        }

        public OperationTag tag() { return OperationTag.SPLIT; }
        public List<String> inputs() { return sources; }
    }

    /** Fit an estimator; {@code model} is the estimator variable, rebound to the trained model. */
    record ModelFit(Origin origin, List<String> sources, String model, String algorithm) implements Operation {

        public ModelFit {
            sources = List.copyOf(sources);
            Objects.requireNonNull(model, "model");
        }

        public OperationTag tag() { return OperationTag.MODEL_FIT; }
        public List<String> inputs() { return sources; }
        public List<String> outputs() { return List.of(model); }
    }

    /**
     * Score data with a trained model, or evaluate predictions. {@code model}
     * is null for metric functions that need no model.
     */
    record ModelApply(Origin origin, ApplyMode mode, String model, List<String> sources, String output,
                      String method) implements Operation {

        public ModelApply {
            Objects.requireNonNull(mode, "mode");
            sources = List.copyOf(sources);
            Objects.requireNonNull(output, "output");
        }

        public OperationTag tag() { return OperationTag.MODEL_APPLY; }

        public List<String> inputs() {
            if (model == null) {
                return sources;
            }
            var all = new ArrayList<>(sources);
            all.add(model);
            return List.copyOf(all);
        }

        public List<String> outputs() { return List.of(output); }
    }

    /** Code that has no visual-recipe equivalent; becomes a Python recipe. */
    record Custom(Origin origin, List<String> sources, List<String> outputs, String function,
                  String code) implements Operation {

        public Custom {
            sources = List.copyOf(sources);
            outputs = List.copyOf(outputs);
        }

        public OperationTag tag() { return OperationTag.CUSTOM; }
        public List<String> inputs() { return sources; }
    }

    /** Makes {@code target} denote whatever {@code source} denotes; creates no recipe. */
    record Bind(Origin origin, String source, String target) implements Operation {

        public Bind {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
        }

        public OperationTag tag() { return OperationTag.BIND; }
        public List<String> inputs() { return List.of(source); }
        public List<String> outputs() { return List.of(target); }
    }

    enum SampleMode {
        HEAD,
        TAIL,
        LARGEST,
        SMALLEST,
        RANDOM;

        public boolean isTopN() {
            return this != RANDOM;
        }
    }

    enum ReshapeMode {
        PIVOT,
        UNPIVOT,
        WINDOW
    }

    enum ApplyMode {
        SCORE,
        EVALUATE
    }
}
