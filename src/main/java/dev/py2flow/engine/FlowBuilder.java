package dev.py2flow.engine;

import dev.py2flow.analyzer.Aggregation;
import dev.py2flow.analyzer.AnalysisResult;
import dev.py2flow.analyzer.Operation;
import dev.py2flow.analyzer.RecognitionGap;
import dev.py2flow.analyzer.Temporaries;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.FieldSchema;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.Recommendation;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns an operation sequence into a wired flow.
 *
 * <p>The builder owns the variable-to-dataset table. Every operation that
 * rebinds a variable creates a fresh dataset, so {@code df = df.a();
 * df = df.b()} gives two chained datasets and never a cycle. Filter and
 * derive-column operations of one statement that chain through temporaries
 * are batched into a single prepare recipe.</p>
 *
 * <p>A builder is single use: create one per flow.</p>
 */
public final class FlowBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FlowBuilder.class);

    private final Flow flow;
    private final NameAllocator datasetNames;
    private final NameAllocator recipeNames = new NameAllocator();
    private final Map<String, String> bindings = new HashMap<>();
    private final Map<String, Integer> uses = new HashMap<>();
    /** Input dataset per source path, so a file read twice is one dataset. */
    private final Map<String, String> inputsByPath = new HashMap<>();
    private boolean built;

    public FlowBuilder(Py2FlowConfig config) {
        this.flow = new Flow(config.flowName());
        this.datasetNames = new NameAllocator(config.datasetPrefix(), config.datasetSuffix());
    }

    /** Builds a flow from analyzer output; recognition gaps become flow warnings. */
    public static Flow build(AnalysisResult result, Py2FlowConfig config) {
        var builder = new FlowBuilder(config);
        for (RecognitionGap gap : result.gaps()) {
            builder.flow.addWarning("Line %d: could not convert '%s' (%s)"
                .formatted(gap.line(), gap.construct(), gap.reason()));
        }
        return builder.build(result.operations());
    }

    /**
     * Build the flow.
     *
     * @throws DanglingReferenceException if an operation reads a variable never bound to a dataset
     */
    public Flow build(List<Operation> operations) {
        if (built) {
            throw new IllegalStateException("FlowBuilder instances are single use");
        }
        built = true;
        for (Operation op : operations) {
            op.inputs().forEach(v -> uses.merge(v, 1, Integer::sum));
        }
        int index = 0;
        while (index < operations.size()) {
            Operation op = operations.get(index);
            if (isPrepare(op)) {
                int end = batchEnd(operations, index);
                prepare(operations.subList(index, end + 1));
                index = end + 1;
            } else {
                apply(op);
                index++;
            }
        }
        promoteDanglingIntermediates();
        LOG.debug("Built flow '{}': {} dataset(s), {} recipe(s)",
            flow.name(), flow.datasets().size(), flow.recipes().size());
        return flow;
    }

    // ---- batching ----

    private static boolean isPrepare(Operation op) {
        return op instanceof Operation.Filter || op instanceof Operation.DeriveColumn;
    }

    private int batchEnd(List<Operation> operations, int start) {
        int end = start;
        while (end + 1 < operations.size()) {
            Operation current = operations.get(end);
            Operation next = operations.get(end + 1);
            String link = current.outputs().get(0);
            boolean chained = isPrepare(next)
                && next.origin().statement() == current.origin().statement()
                && Temporaries.isTemporary(link)
                && next.inputs().get(0).equals(link)
                && uses.getOrDefault(link, 0) == 1;
            if (!chained) {
                break;
            }
            end++;
        }
        return end;
    }

    private void prepare(List<Operation> batch) {
        Operation first = batch.get(0);
        Operation last = batch.get(batch.size() - 1);
        String input = lookup(first.inputs().get(0), first);
        List<SubStep> steps = new ArrayList<>();
        for (Operation op : batch) {
            steps.add(op instanceof Operation.Filter filter ? filter.step() : ((Operation.DeriveColumn) op).step());
        }
        List<FieldSchema> schema = PrepareSchemas.apply(schemaOf(input), steps);
        String output = createDataset(last.outputs().get(0), RecipeKind.PREPARE, schema, null, last);
        addRecipe(RecipeKind.PREPARE, List.of(input), List.of(output), steps, null, batch);
    }

    // ---- single operations ----

    private void apply(Operation op) {
        if (op instanceof Operation.Read read) {
            read(read);
        } else if (op instanceof Operation.Write write) {
            write(write);
        } else if (op instanceof Operation.Bind bind) {
            bindings.put(bind.target(), lookup(bind.source(), bind));
        } else if (op instanceof Operation.Join join) {
            join(join);
        } else if (op instanceof Operation.Stack stack) {
            List<String> inputs = lookupAll(stack.sources(), stack);
            String output = createDataset(stack.output(), RecipeKind.STACK, schemaOf(inputs.get(0)), null, stack);
            addRecipe(RecipeKind.STACK, inputs, List.of(output),
                List.of(new SubStep(StepType.STACK, List.of(), Map.of("mode", "union"), List.of())), null, List.of(stack));
        } else if (op instanceof Operation.Aggregate aggregate) {
            aggregate(aggregate);
        } else if (op instanceof Operation.Sort sort) {
            sort(sort);
        } else if (op instanceof Operation.Dedupe dedupe) {
            var params = new LinkedHashMap<String, String>();
            if (dedupe.keep() != null) {
                params.put("keep", dedupe.keep());
            }
            sameSchema(dedupe, dedupe.input(), dedupe.output(), RecipeKind.DISTINCT,
                new SubStep(StepType.DISTINCT, dedupe.subset(), params, List.of()));
        } else if (op instanceof Operation.Sample sample) {
            sample(sample);
        } else if (op instanceof Operation.Reshape reshape) {
            reshape(reshape);
        } else if (op instanceof Operation.Split split) {
            split(split);
        } else if (op instanceof Operation.ModelFit fit) {
            modelFit(fit);
        } else if (op instanceof Operation.ModelApply apply) {
            modelApply(apply);
        } else if (op instanceof Operation.Custom custom) {
            custom(custom);
        } else {
            throw new IllegalArgumentException("Unsupported operation: " + op.tag().value());
        }
    }

    private void read(Operation.Read read) {
        boolean named = read.path() != null && !read.path().isBlank();
        String base = named ? NameAllocator.stem(read.path()) : Temporaries.baseName(read.output()) + "_source";
        List<FieldSchema> schema = read.columns().stream().map(c -> new FieldSchema(c, null)).toList();
        String source = named ? inputsByPath.get(read.path()) : null;
        if (source == null) {
            source = datasetNames.allocate(base);
            flow.addDataset(new Dataset(source, DatasetRole.INPUT, schema, read.format(), read.path(),
                Temporaries.isTemporary(read.output()) ? null : read.output(), read.origin().line()));
            if (named) {
                inputsByPath.put(read.path(), source);
            }
        } else {
            LOG.debug("Line {}: '{}' is already read as '{}'", read.origin().line(), read.path(), source);
            if (schema.isEmpty()) {
                schema = schemaOf(source);
            }
        }
        if (Temporaries.isTemporary(read.output())) {
            bindings.put(read.output(), source);
            return;
        }
        String output = createDataset(read.output(), RecipeKind.SYNC, schema, read.format(), read);
        var params = new LinkedHashMap<String, String>();
        if (read.path() != null) {
            params.put("path", read.path());
        }
        params.put("format", read.format());
        addRecipe(RecipeKind.SYNC, List.of(source), List.of(output),
            List.of(new SubStep(StepType.SYNC, List.of(), params, List.of())), null, List.of(read));
    }

    private void write(Operation.Write write) {
        String input = lookup(write.input(), write);
        String base = write.path() != null && !write.path().isBlank()
            ? NameAllocator.stem(write.path()) : input + "_output";
        String output = datasetNames.allocate(base);
        flow.addDataset(new Dataset(output, DatasetRole.OUTPUT, schemaOf(input), write.format(), write.path(),
            Temporaries.isTemporary(write.input()) ? null : write.input(), write.origin().line()));
        var params = new LinkedHashMap<String, String>();
        if (write.path() != null) {
            params.put("path", write.path());
        }
        params.put("format", write.format());
        addRecipe(RecipeKind.SYNC, List.of(input), List.of(output),
            List.of(new SubStep(StepType.SYNC, List.of(), params, List.of())), null, List.of(write));
    }

    private void join(Operation.Join join) {
        String left = lookup(join.left(), join);
        String right = lookup(join.right(), join);
        List<FieldSchema> schema = List.of();
        if (flowDataset(left).hasSchema() && flowDataset(right).hasSchema()) {
            var fields = new LinkedHashMap<String, FieldSchema>();
            schemaOf(left).forEach(f -> fields.put(f.name(), f));
            schemaOf(right).forEach(f -> fields.putIfAbsent(f.name(), f));
            schema = List.copyOf(fields.values());
        }
        String output = createDataset(join.output(), RecipeKind.JOIN, schema, null, join);
        var params = new LinkedHashMap<String, String>();
        params.put("type", join.joinType().name());
        if (!join.rightKeys().equals(join.leftKeys())) {
            params.put("right_keys", String.join(",", join.rightKeys()));
        }
        var step = new SubStep(StepType.JOIN, join.leftKeys(), params, List.of());
        addRecipe(RecipeKind.JOIN, List.of(left, right), List.of(output), List.of(step), null, List.of(join));
    }

    private void aggregate(Operation.Aggregate aggregate) {
        String input = lookup(aggregate.input(), aggregate);
        List<SubStep> steps = new ArrayList<>();
        steps.add(new SubStep(StepType.GROUP_KEYS, aggregate.keys(), Map.of(),
            aggregate.keys().stream().map(FieldEffect::identity).toList()));
        var schema = new ArrayList<FieldSchema>();
        for (String key : aggregate.keys()) {
            schema.add(new FieldSchema(key, typeOf(input, key)));
        }
        for (Aggregation aggregation : aggregate.aggregations()) {
            List<String> sources = aggregation.column().equals("*") ? List.of() : List.of(aggregation.column());
            steps.add(new SubStep(StepType.AGGREGATE, sources, Map.of("function", aggregation.function()),
                List.of(FieldEffect.aggregated(aggregation.output(), sources))));
            schema.add(new FieldSchema(aggregation.output(), aggregateType(input, aggregation)));
        }
        String output = createDataset(aggregate.output(), RecipeKind.GROUP, schema, null, aggregate);
        addRecipe(RecipeKind.GROUP, List.of(input), List.of(output), steps, null, List.of(aggregate));
    }

    private void sort(Operation.Sort sort) {
        List<String> order = sort.ascending().stream().map(a -> a ? "asc" : "desc").toList();
        sameSchema(sort, sort.input(), sort.output(), RecipeKind.SORT,
            new SubStep(StepType.SORT, sort.columns(), Map.of("order", String.join(",", order)), List.of()));
    }

    private void sample(Operation.Sample sample) {
        String mode = sample.mode().name().toLowerCase(Locale.ROOT);
        if (sample.mode().isTopN()) {
            var params = new LinkedHashMap<String, String>();
            params.put("n", sample.size());
            params.put("mode", mode);
            sameSchema(sample, sample.input(), sample.output(), RecipeKind.TOP_N,
                new SubStep(StepType.TOP_N, sample.rankingColumns(), params, List.of()));
        } else {
            var params = new LinkedHashMap<String, String>();
            params.put("size", sample.size());
            params.put("mode", mode);
            sameSchema(sample, sample.input(), sample.output(), RecipeKind.SAMPLE,
                new SubStep(StepType.SAMPLE, List.of(), params, List.of()));
        }
    }

    private void reshape(Operation.Reshape reshape) {
        String input = lookup(reshape.input(), reshape);
        RecipeKind kind = reshape.mode() == Operation.ReshapeMode.WINDOW ? RecipeKind.WINDOW : RecipeKind.PIVOT;
        List<FieldSchema> schema = kind == RecipeKind.WINDOW
            ? PrepareSchemas.apply(schemaOf(input), List.of(reshape.step())) : List.of();
        String output = createDataset(reshape.output(), kind, schema, null, reshape);
        addRecipe(kind, List.of(input), List.of(output), List.of(reshape.step()), null, List.of(reshape));
    }

    private void split(Operation.Split split) {
        List<String> inputs = lookupAll(split.sources(), split);
        List<String> outputs = new ArrayList<>();
        for (int i = 0; i < split.outputs().size(); i++) {
            // train_test_split returns one train/test pair per input, in input order
            String source = inputs.get(Math.min(i / 2, inputs.size() - 1));
            outputs.add(createDataset(split.outputs().get(i), RecipeKind.SPLIT, schemaOf(source), null, split));
        }
        var params = new LinkedHashMap<String, String>();
        if (split.testSize() != null) {
            params.put("test_size", split.testSize());
        }
        addRecipe(RecipeKind.SPLIT, inputs, outputs, List.of(new SubStep(StepType.SPLIT, List.of(), params, List.of())),
            null, List.of(split));
    }

    private void modelFit(Operation.ModelFit fit) {
        List<String> inputs = lookupAll(fit.sources(), fit);
        String model = createDataset(fit.model(), RecipeKind.TRAIN, List.of(), "model", fit);
        var params = new LinkedHashMap<String, String>();
        if (fit.algorithm() != null) {
            params.put("algorithm", fit.algorithm());
        }
        addRecipe(RecipeKind.TRAIN, inputs, List.of(model),
            List.of(new SubStep(StepType.TRAIN, List.of(), params, List.of())), null, List.of(fit));
    }

    private void modelApply(Operation.ModelApply apply) {
        List<String> inputs = new ArrayList<>(lookupAll(apply.sources(), apply));
        if (apply.model() != null) {
            inputs.add(lookup(apply.model(), apply));
        }
        boolean score = apply.mode() == Operation.ApplyMode.SCORE;
        RecipeKind kind = score ? RecipeKind.SCORE : RecipeKind.EVALUATE;
        var params = new LinkedHashMap<String, String>();
        if (apply.method() != null) {
            params.put(score ? "method" : "metric", apply.method());
        }
        String output = createDataset(apply.output(), kind, List.of(), score ? null : "metrics", apply);
        addRecipe(kind, inputs, List.of(output),
            List.of(new SubStep(score ? StepType.SCORE : StepType.EVALUATE, List.of(), params, List.of())),
            null, List.of(apply));
    }

    private void custom(Operation.Custom custom) {
        List<String> inputs = lookupAll(custom.sources(), custom);
        List<String> outputs = new ArrayList<>();
        for (String variable : custom.outputs()) {
            outputs.add(createDataset(variable, RecipeKind.CUSTOM_CODE, List.of(), null, custom));
        }
        var params = new LinkedHashMap<String, String>();
        if (custom.function() != null) {
            params.put("function", custom.function());
        }
        Recipe recipe = addRecipe(RecipeKind.CUSTOM_CODE, inputs, outputs,
            List.of(new SubStep(StepType.PYTHON_CODE, List.of(), params, List.of())),
            custom.code() != null ? custom.code() : custom.origin().text(), List.of(custom));
        flow.addRecommendation(new Recommendation("PYTHON_FALLBACK", "MEDIUM",
            "Recipe '%s' runs Python code (%s); consider rewriting it with visual recipes"
                .formatted(recipe.name(), custom.function() != null ? custom.function() : "custom"),
            recipe.name()));
    }

    private void sameSchema(Operation op, String inputVariable, String outputVariable, RecipeKind kind, SubStep step) {
        String input = lookup(inputVariable, op);
        String output = createDataset(outputVariable, kind, schemaOf(input), null, op);
        addRecipe(kind, List.of(input), List.of(output), List.of(step), null, List.of(op));
    }

    // ---- datasets and recipes ----

    private String lookup(String variable, Operation op) {
        String dataset = bindings.get(variable);
        if (dataset == null) {
            throw new DanglingReferenceException(variable, op.origin().line());
        }
        return dataset;
    }

    private List<String> lookupAll(List<String> variables, Operation op) {
        return variables.stream().map(v -> lookup(v, op)).toList();
    }

    private Dataset flowDataset(String name) {
        return flow.dataset(name).orElseThrow();
    }

    private List<FieldSchema> schemaOf(String dataset) {
        return flowDataset(dataset).schema();
    }

    private String typeOf(String dataset, String field) {
        return schemaOf(dataset).stream().filter(f -> f.name().equals(field)).map(FieldSchema::type)
            .findFirst().orElse(FieldSchema.DEFAULT_TYPE);
    }

    private String aggregateType(String input, Aggregation aggregation) {
        return switch (aggregation.function()) {
            case "COUNT", "COUNT_DISTINCT" -> "bigint";
            case "AVG", "STDDEV", "VAR", "MEDIAN" -> "double";
            case "ANY", "ALL" -> "boolean";
            default -> aggregation.column().equals("*") ? "bigint" : typeOf(input, aggregation.column());
        };
    }

    /** Creates the dataset a variable is rebound to and updates the binding. */
    private String createDataset(String variable, RecipeKind producer, List<FieldSchema> schema, String formatHint,
                                 Operation op) {
        boolean temporary = Temporaries.isTemporary(variable);
        String base = temporary ? Temporaries.baseName(variable) + temporarySuffix(producer) : variable;
        String name = datasetNames.allocate(base);
        flow.addDataset(new Dataset(name, DatasetRole.INTERMEDIATE, schema, formatHint, null,
            temporary ? null : variable, op.origin().line()));
        bindings.put(variable, name);
        return name;
    }

    private static String temporarySuffix(RecipeKind kind) {
        return switch (kind) {
            case SYNC -> "_copy";
            case PREPARE -> "_prepared";
            case JOIN -> "_joined";
            case STACK -> "_stacked";
            case GROUP -> "_grouped";
            case SPLIT -> "_split";
            case SORT -> "_sorted";
            case DISTINCT -> "_distinct";
            case TOP_N -> "_top";
            case SAMPLE -> "_sampled";
            case PIVOT -> "_pivoted";
            case WINDOW -> "_windowed";
            case CUSTOM_CODE -> "_processed";
            case TRAIN -> "_model";
            case SCORE -> "_scored";
            case EVALUATE -> "_metrics";
        };
    }

    private Recipe addRecipe(RecipeKind kind, List<String> inputs, List<String> outputs, List<SubStep> steps,
                             String code, List<Operation> origins) {
        Set<Integer> lines = new LinkedHashSet<>();
        origins.forEach(op -> lines.add(op.origin().line()));
        String name = recipeNames.allocate(kind.namePrefix() + "_" + outputs.get(0));
        var recipe = new Recipe(name, kind, inputs, outputs, steps, code, List.copyOf(lines));
        LOG.debug("Line {}: {} recipe '{}' {} -> {}", origins.get(0).origin().line(), kind.value(), name,
            inputs, outputs);
        return flow.addRecipe(recipe);
    }

    /** Intermediate datasets nothing consumes are the flow's results. */
    private void promoteDanglingIntermediates() {
        Set<String> consumed = new HashSet<>();
        flow.recipes().forEach(r -> consumed.addAll(r.inputs()));
        for (Dataset dataset : List.copyOf(flow.datasets())) {
            if (dataset.role() == DatasetRole.INTERMEDIATE && !consumed.contains(dataset.name())) {
                flow.replaceDataset(dataset.withRole(DatasetRole.OUTPUT));
            }
        }
    }
}
