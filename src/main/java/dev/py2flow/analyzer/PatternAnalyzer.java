package dev.py2flow.analyzer;

import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.model.FieldEffect;
import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import dev.py2flow.python.PyExpr;
import dev.py2flow.python.PyExpr.*;
import dev.py2flow.python.PyModule;
import dev.py2flow.python.PyStmt;
import dev.py2flow.python.PythonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rule-based analyzer: parses the script and walks its statements in
 * execution order, matching expressions against the idiom table.
 *
 * <p>Statements that touch no dataframe and call no data library are skipped
 * silently. Statements that do but match nothing become recognition gaps.
 * When such a statement assigns the result of a call on a dataframe, the
 * target is kept as the output of a Python recipe holding the statement;
 * other names it assigns are marked unresolved so that later uses are gaps
 * too.</p>
 */
public final class PatternAnalyzer implements AnalyzerProvider {

    public static final String NAME = "rule-based";

    private static final Logger LOG = LoggerFactory.getLogger(PatternAnalyzer.class);

    private final IdiomTable idioms;

    public PatternAnalyzer() {
        this(IdiomTable.standard());
    }

    /** An analyzer over a custom table, e.g. {@link IdiomTable#standardWith}. */
    public PatternAnalyzer(IdiomTable idioms) {
        this.idioms = Objects.requireNonNull(idioms, "idioms");
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * @throws dev.py2flow.python.PythonSyntaxException when the source cannot be tokenized
     */
    @Override
    public AnalysisResult analyze(String source, Py2FlowConfig config) {
        PyModule module = PythonParser.parse(source);
        var session = new AnalysisSession(module, idioms);
        visitBlock(session, module.body());
        LOG.debug("Analyzed {} statement(s): {} operation(s), {} gap(s)",
            module.body().size(), session.operations().size(), session.gaps().size());
        return new AnalysisResult(session.operations(), session.gaps());
    }

    private void visitBlock(AnalysisSession session, List<PyStmt> body) {
        for (PyStmt stmt : body) {
            visit(session, stmt);
        }
    }

    private void visit(AnalysisSession session, PyStmt stmt) {
        session.begin(stmt);
        if (stmt instanceof PyStmt.Import imports) {
            importNames(session, imports);
        } else if (stmt instanceof PyStmt.FunctionDef function) {
            session.defineFunction(function.name(), session.text(stmt));
        } else if (stmt instanceof PyStmt.ClassDef classDef) {
            session.symbols().bind(classDef.name(), SymbolTable.Kind.OTHER, null);
        } else if (stmt instanceof PyStmt.Assign assign) {
            assign(session, assign);
        } else if (stmt instanceof PyStmt.AugAssign augAssign) {
            augmentedAssign(session, augAssign);
        } else if (stmt instanceof PyStmt.ExprStmt expression) {
            expression(session, expression.value());
        } else if (stmt instanceof PyStmt.Delete delete) {
            delete(session, delete);
        } else if (stmt instanceof PyStmt.If branch) {
            visitBlock(session, branch.body());
            visitBlock(session, branch.orElse());
        } else if (stmt instanceof PyStmt.For loop) {
            bindLoopTarget(session, loop);
            visitBlock(session, loop.body());
            visitBlock(session, loop.orElse());
        } else if (stmt instanceof PyStmt.While loop) {
            visitBlock(session, loop.body());
            visitBlock(session, loop.orElse());
        } else if (stmt instanceof PyStmt.With with) {
            for (PyStmt.WithItem item : with.items()) {
                if (item.target() instanceof Name name) {
                    session.symbols().bind(name.id(), SymbolTable.Kind.OTHER, null);
                }
            }
            visitBlock(session, with.body());
        } else if (stmt instanceof PyStmt.Try attempt) {
            visitBlock(session, attempt.body());
            for (PyStmt.ExceptHandler handler : attempt.handlers()) {
                visitBlock(session, handler.body());
            }
            visitBlock(session, attempt.orElse());
            visitBlock(session, attempt.finalBody());
        } else if (stmt instanceof PyStmt.Invalid invalid) {
            gap(session, session.text(stmt), "syntax error: " + invalid.message());
        }
    }

    private void gap(AnalysisSession session, String construct, String reason) {
        LOG.warn("Line {}: not recognized: {} ({})", session.origin().line(), construct.strip(), reason);
        session.gap(construct.strip(), reason);
    }

    // ---- imports and bindings ----

    private void importNames(AnalysisSession session, PyStmt.Import imports) {
        for (PyStmt.Alias alias : imports.names()) {
            if (alias.name().equals("*")) {
                continue;
            }
            if (imports.module() == null) {
                String qualified = alias.asName() != null ? alias.name() : alias.boundName();
                session.symbols().bind(alias.boundName(), SymbolTable.Kind.MODULE, qualified);
            } else {
                String bound = alias.asName() != null ? alias.asName() : alias.name();
                session.symbols().bind(bound, SymbolTable.Kind.IMPORTED, imports.module() + "." + alias.name());
            }
        }
    }

    private void bindLoopTarget(AnalysisSession session, PyStmt.For loop) {
        if (!(loop.target() instanceof Name name)) {
            return;
        }
        List<String> values = Expressions.stringList(loop.iter(), session.symbols());
        if (values != null) {
            session.symbols().bindConstant(name.id(), null, values);
        } else {
            session.symbols().bind(name.id(), SymbolTable.Kind.OTHER, null);
        }
    }

    // ---- assignment ----

    private void assign(AnalysisSession session, PyStmt.Assign assign) {
        PyExpr first = assign.targets().get(0);
        PyExpr value = assign.value();
        if (first instanceof TupleExpr tuple) {
            tupleAssign(session, tuple.elements(), value);
        } else if (first instanceof ListExpr list) {
            tupleAssign(session, list.elements(), value);
        } else if (first instanceof Name name) {
            nameAssign(session, name.id(), value);
            for (PyExpr other : assign.targets().subList(1, assign.targets().size())) {
                if (other instanceof Name alias) {
                    aliasName(session, name.id(), alias.id());
                }
            }
        } else if (first instanceof Subscript subscript) {
            subscriptAssign(session, subscript, value);
        } else if (first instanceof Attribute attribute) {
            attributeAssign(session, attribute, value);
        }
    }

    private void aliasName(AnalysisSession session, String source, String target) {
        SymbolTable.Binding binding = session.symbols().get(source);
        if (binding == null) {
            session.symbols().unbind(target);
            return;
        }
        if (binding.kind() == SymbolTable.Kind.DATAFRAME || binding.kind() == SymbolTable.Kind.MODEL) {
            session.emit(new Operation.Bind(session.origin(), source, target));
        }
        session.symbols().bind(target, binding.kind(), binding.detail());
    }

    private void nameAssign(AnalysisSession session, String target, PyExpr value) {
        SymbolTable symbols = session.symbols();
        if (!session.involvesData(value)) {
            bindPlainValue(session, target, value);
            return;
        }
        if (PandasIdioms.isMask(value, symbols) && (!(value instanceof Call) || isColumnMask(value))) {
            String frame = firstFrame(session, value);
            List<String> columns = frame == null ? List.of()
                : List.copyOf(Expressions.referencedColumns(value, frame, symbols));
            symbols.bindMask(target, session.text(value), columns);
            return;
        }
        if (isScalar(session, value)) {
            symbols.bind(target, SymbolTable.Kind.OTHER, null);
            return;
        }
        List<Operation> buffer = new ArrayList<>();
        AnalysisSession.Resolution resolution = session.resolve(value, target, buffer);
        if (!resolution.succeeded()) {
            gap(session, session.text(value), resolution.failure());
            String source = Chain.of(value).root();
            if (source != null && symbols.isDataFrame(source)) {
                // the statement itself becomes the Python recipe
                session.emit(new Operation.Custom(session.origin(), List.of(source), List.of(target), null, null));
                symbols.bind(target, SymbolTable.Kind.DATAFRAME, null);
            } else {
                symbols.markUnresolved(target);
            }
            return;
        }
        session.emit(buffer);
        updateModels(session, buffer);
        Idiom.Value result = resolution.value();
        switch (result.kind()) {
            case DATAFRAME, MODEL -> {
                if (result.variable() != null && !result.variable().equals(target)) {
                    session.emit(new Operation.Bind(session.origin(), result.variable(), target));
                }
                symbols.bind(target, result.kind(), result.detail());
            }
            case ESTIMATOR -> symbols.bind(target, SymbolTable.Kind.ESTIMATOR, result.detail());
            default -> symbols.bind(target, SymbolTable.Kind.OTHER, null);
        }
    }

    private void bindPlainValue(AnalysisSession session, String target, PyExpr value) {
        SymbolTable symbols = session.symbols();
        String string = Expressions.stringValue(value, symbols);
        List<String> strings = Expressions.stringList(value, symbols);
        if (string != null || strings != null) {
            symbols.bindConstant(target, string, strings);
        } else if (value instanceof Name name && symbols.get(name.id()) != null) {
            SymbolTable.Binding binding = symbols.get(name.id());
            symbols.bind(target, binding.kind(), binding.detail());
        } else {
            symbols.bind(target, SymbolTable.Kind.OTHER, null);
        }
    }

    /** {@code df["a"].isin(...)} or {@code df.duplicated()}, as opposed to a frame-wide {@code df.isnull()}. */
    private static boolean isColumnMask(PyExpr value) {
        Chain chain = Chain.of(value);
        if (chain.size() < 2) {
            return chain.size() == 1 && chain.link(0) instanceof Chain.Link.MethodCall call
                && call.name().equals("duplicated");
        }
        return chain.link(0) instanceof Chain.Link.Index || chain.link(0) instanceof Chain.Link.AttributeAccess;
    }

    private static String firstFrame(AnalysisSession session, PyExpr value) {
        String[] frame = {null};
        Expressions.anyNode(value, node -> {
            if (node instanceof Name name && session.symbols().isDataFrame(name.id())) {
                frame[0] = name.id();
                return true;
            }
            return false;
        });
        return frame[0];
    }

    /** Reductions and metadata reads that yield scalars rather than datasets. */
    private static boolean isScalar(AnalysisSession session, PyExpr value) {
        Chain chain = Chain.of(value);
        if (chain.root() == null || !session.symbols().isDataFrame(chain.root()) || chain.isEmpty()) {
            return false;
        }
        for (Chain.Link link : chain.links()) {
            if (link instanceof Chain.Link.MethodCall call
                    && (call.name().equals("groupby") || call.name().equals("rolling")
                        || call.name().equals("expanding") || call.name().equals("resample"))) {
                return false;
            }
            if (link instanceof Chain.Link.AttributeAccess access
                    && DataFrameMethods.METADATA_ATTRIBUTES.contains(access.name())) {
                return true;
            }
        }
        Chain.Link last = chain.link(chain.size() - 1);
        return last instanceof Chain.Link.MethodCall call && DataFrameMethods.SCALAR_METHODS.contains(call.name());
    }

    /** Fitted estimators denote model datasets from here on. */
    private static void updateModels(AnalysisSession session, List<Operation> ops) {
        for (Operation op : ops) {
            if (op instanceof Operation.ModelFit fit && !Temporaries.isTemporary(fit.model())) {
                session.symbols().bind(fit.model(), SymbolTable.Kind.MODEL, fit.algorithm());
            }
        }
    }

    private void tupleAssign(AnalysisSession session, List<PyExpr> elements, PyExpr value) {
        List<String> names = new ArrayList<>();
        for (PyExpr element : elements) {
            if (!(element instanceof Name name)) {
                if (session.involvesData(value)) {
                    gap(session, session.text(value), "unsupported assignment target");
                }
                return;
            }
            names.add(name.id());
        }
        if (value instanceof TupleExpr tuple && tuple.elements().size() == names.size()) {
            for (int i = 0; i < names.size(); i++) {
                nameAssign(session, names.get(i), tuple.elements().get(i));
            }
            return;
        }
        Chain chain = Chain.of(value);
        if (chain.root() == null && chain.size() == 1 && chain.link(0) instanceof Chain.Link.FunctionCall call
                && SklearnCatalog.isSplit(session.symbols().qualify(call.name()))) {
            split(session, names, call.node());
            return;
        }
        if (session.involvesData(value)) {
            gap(session, session.text(value), "unsupported tuple assignment");
            names.forEach(session.symbols()::markUnresolved);
        } else {
            names.forEach(session.symbols()::unbind);
        }
    }

    private void split(AnalysisSession session, List<String> names, Call call) {
        List<Operation> buffer = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (PyExpr arg : call.args()) {
            String frame = arg instanceof Name name
                ? (session.symbols().isDataFrame(name.id()) ? name.id() : null)
                : session.resolveNested(arg, buffer);
            if (frame == null) {
                gap(session, session.text(arg), "split input is not a dataframe");
                names.forEach(session.symbols()::markUnresolved);
                return;
            }
            sources.add(frame);
        }
        if (sources.isEmpty()) {
            gap(session, session.text(call), "split without inputs");
            names.forEach(session.symbols()::markUnresolved);
            return;
        }
        PyExpr testSize = call.keyword("test_size");
        buffer.add(new Operation.Split(session.origin(), sources, names,
            testSize == null ? null : session.text(testSize)));
        session.emit(buffer);
        names.forEach(session.symbols()::bindDataFrame);
    }

    // ---- column-level statements ----

    private void subscriptAssign(AnalysisSession session, Subscript subscript, PyExpr value) {
        if (subscript.value() instanceof Name frame && session.symbols().isDataFrame(frame.id())) {
            List<String> targets = Expressions.columnNames(subscript.index(), session.symbols(),
                session.text(subscript.index()));
            columnAssign(session, frame.id(), targets, value);
            return;
        }
        if (subscript.value() instanceof Attribute attribute && attribute.attr().equals("loc")
                && attribute.value() instanceof Name frame && session.symbols().isDataFrame(frame.id())) {
            locAssign(session, frame.id(), subscript.index(), value);
            return;
        }
        if (session.involvesData(subscript.value())) {
            gap(session, session.text(subscript) + " = " + session.text(value), "unsupported assignment target");
        } else if (session.involvesData(value)) {
            expression(session, value);
        }
    }

    private void columnAssign(AnalysisSession session, String frame, List<String> targets, PyExpr value) {
        ColumnExpressions.ColumnStep column = ColumnExpressions.classify(value, targets, frame, session);
        Operation op = column.window()
            ? new Operation.Reshape(session.origin(), frame, frame, Operation.ReshapeMode.WINDOW, column.step())
            : new Operation.DeriveColumn(session.origin(), frame, frame, column.step());
        LOG.debug("Line {}: column assignment to {} as {}", session.origin().line(), targets, column.step().type());
        session.emit(op);
    }

    private void locAssign(AnalysisSession session, String frame, PyExpr index, PyExpr value) {
        if (!(index instanceof TupleExpr tuple) || tuple.elements().size() != 2) {
            gap(session, session.text(index), "unsupported .loc assignment");
            return;
        }
        PyExpr mask = tuple.elements().get(0);
        List<String> targets = Expressions.columnNames(tuple.elements().get(1), session.symbols(),
            session.text(tuple.elements().get(1)));
        SymbolTable symbols = session.symbols();
        Set<String> sources = new LinkedHashSet<>(Expressions.referencedColumns(mask, frame, symbols));
        sources.addAll(Expressions.referencedColumns(value, frame, symbols));
        String maskText = mask instanceof Name name && symbols.is(name.id(), SymbolTable.Kind.MASK)
            ? symbols.get(name.id()).detail() : session.text(mask);
        if (mask instanceof Name name && symbols.is(name.id(), SymbolTable.Kind.MASK)) {
            sources.addAll(symbols.get(name.id()).values());
        }
        List<FieldEffect> effects = new ArrayList<>();
        for (String target : targets) {
            Set<String> fieldSources = new LinkedHashSet<>(sources);
            fieldSources.add(target);
            effects.add(FieldEffect.computed(target, List.copyOf(fieldSources)));
        }
        String expression = "if(%s, %s, %s)".formatted(maskText, session.text(value), String.join(", ", targets));
        var step = new SubStep(StepType.FORMULA, targets, Map.of("expression", expression), effects);
        session.emit(new Operation.DeriveColumn(session.origin(), frame, frame, step));
    }

    private void attributeAssign(AnalysisSession session, Attribute attribute, PyExpr value) {
        if (!(attribute.value() instanceof Name frame) || !session.symbols().isDataFrame(frame.id())) {
            return;
        }
        List<String> names = Expressions.stringList(value, session.symbols());
        if (!attribute.attr().equals("columns") || names == null) {
            gap(session, session.text(attribute) + " = " + session.text(value), "unsupported attribute assignment");
            return;
        }
        var effects = names.stream().map(FieldEffect::opaque).toList();
        var step = new SubStep(StepType.COLUMN_RENAMER, names, Map.of("mode", "positional"), effects);
        session.emit(new Operation.DeriveColumn(session.origin(), frame.id(), frame.id(), step));
    }

    private void augmentedAssign(AnalysisSession session, PyStmt.AugAssign augAssign) {
        PyExpr target = augAssign.target();
        if (target instanceof Subscript subscript && subscript.value() instanceof Name frame
                && session.symbols().isDataFrame(frame.id())) {
            List<String> targets = Expressions.columnNames(subscript.index(), session.symbols(),
                session.text(subscript.index()));
            String op = augAssign.op().substring(0, augAssign.op().length() - 1);
            List<FieldEffect> effects = new ArrayList<>();
            for (String column : targets) {
                Set<String> sources = new LinkedHashSet<>();
                sources.add(column);
                sources.addAll(Expressions.referencedColumns(augAssign.value(), frame.id(), session.symbols()));
                effects.add(FieldEffect.computed(column, List.copyOf(sources)));
            }
            String expression = "%s %s %s".formatted(String.join(", ", targets), op, session.text(augAssign.value()));
            var step = new SubStep(StepType.FORMULA, targets, Map.of("expression", expression), effects);
            session.emit(new Operation.DeriveColumn(session.origin(), frame.id(), frame.id(), step));
            return;
        }
        if (target instanceof Name name && session.symbols().isDataFrame(name.id())) {
            gap(session, session.text(augAssign), "in-place arithmetic on a dataframe");
        }
    }

    private void delete(AnalysisSession session, PyStmt.Delete delete) {
        for (PyExpr target : delete.targets()) {
            if (target instanceof Subscript subscript && subscript.value() instanceof Name frame
                    && session.symbols().isDataFrame(frame.id())) {
                List<String> columns = Expressions.columnNames(subscript.index(), session.symbols(),
                    session.text(subscript.index()));
                session.emit(new Operation.DeriveColumn(session.origin(), frame.id(), frame.id(),
                    SubStep.of(StepType.COLUMN_DELETER, columns)));
            } else if (target instanceof Name name) {
                session.symbols().unbind(name.id());
            }
        }
    }

    // ---- expression statements ----

    private void expression(AnalysisSession session, PyExpr value) {
        if (value instanceof Call call && call.func() instanceof Name function
                && DataFrameMethods.INSPECTION_FUNCTIONS.contains(function.id())
                && session.symbols().get(function.id()) == null) {
            for (PyExpr arg : call.args()) {
                if (arg instanceof Call && session.involvesData(arg)) {
                    discarded(session, arg, false);
                }
            }
            return;
        }
        if (!session.involvesData(value)) {
            return;
        }
        Chain chain = Chain.of(value);
        if (isInspection(session, chain) || isScalar(session, value)) {
            return;
        }
        if (chain.root() != null && session.symbols().isDataFrame(chain.root()) && isInPlace(chain)) {
            inPlace(session, chain, value);
            return;
        }
        discarded(session, value, true);
    }

    private static boolean isInspection(AnalysisSession session, Chain chain) {
        if (chain.root() == null || !session.symbols().isDataFrame(chain.root()) || chain.isEmpty()) {
            return false;
        }
        Chain.Link last = chain.link(chain.size() - 1);
        if (last instanceof Chain.Link.MethodCall call) {
            return DataFrameMethods.INSPECTION.contains(call.name()) && call.node().keyword("inplace") == null;
        }
        return last instanceof Chain.Link.AttributeAccess || chain.size() == 1 && last instanceof Chain.Link.Index;
    }

    private static boolean isInPlace(Chain chain) {
        Chain.Link last = chain.link(chain.size() - 1);
        return last instanceof Chain.Link.MethodCall call && Expressions.isTrue(call.node().keyword("inplace"));
    }

    /** {@code df.op(..., inplace=True)} rebinds df; {@code df[col].op(..., inplace=True)} rewrites a column. */
    private void inPlace(AnalysisSession session, Chain chain, PyExpr value) {
        String frame = chain.root();
        if (chain.size() == 2 && chain.link(0) instanceof Chain.Link.Index index) {
            List<String> targets = Expressions.stringList(index.index(), session.symbols());
            if (targets != null) {
                columnAssign(session, frame, targets, value);
                return;
            }
        }
        nameAssign(session, frame, value);
    }

    /**
     * Resolves an expression whose value is thrown away. Only operations with
     * effects outside the expression survive: writes, model fits and
     * evaluations, plus whatever they depend on.
     */
    private void discarded(AnalysisSession session, PyExpr value, boolean reportGaps) {
        List<Operation> buffer = new ArrayList<>();
        AnalysisSession.Resolution resolution = session.resolve(value, null, buffer);
        if (!resolution.succeeded()) {
            if (reportGaps) {
                gap(session, session.text(value), resolution.failure());
            }
            return;
        }
        Set<String> needed = new HashSet<>();
        List<Operation> kept = new ArrayList<>();
        for (int i = buffer.size() - 1; i >= 0; i--) {
            Operation op = buffer.get(i);
            boolean effect = op instanceof Operation.Write || op instanceof Operation.ModelFit
                || op instanceof Operation.ModelApply apply && apply.mode() == Operation.ApplyMode.EVALUATE;
            if (effect || op.outputs().stream().anyMatch(needed::contains)) {
                kept.add(0, op);
                needed.addAll(op.inputs());
            }
        }
        session.emit(kept);
        updateModels(session, kept);
    }
}
