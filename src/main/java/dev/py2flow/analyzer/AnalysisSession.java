package dev.py2flow.analyzer;

import dev.py2flow.python.PyExpr;
import dev.py2flow.python.PyModule;
import dev.py2flow.python.PyStmt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one analysis run: the symbol table, the recorded script
 * functions, the operations and gaps collected so far, and the chain
 * resolver that drives the idiom table.
 */
final class AnalysisSession {

    /** Outcome of resolving one expression; {@code failure} is null on success. */
    record Resolution(Idiom.Value value, String failure) {

        static Resolution success(Idiom.Value value) {
            return new Resolution(value, null);
        }

        static Resolution failed(String reason) {
            return new Resolution(null, reason);
        }

        boolean succeeded() {
            return failure == null;
        }
    }

    private final PyModule module;
    private final IdiomTable idioms;
    private final SymbolTable symbols = new SymbolTable();
    private final Map<String, String> functions = new HashMap<>();
    private final List<Operation> operations = new ArrayList<>();
    private final List<RecognitionGap> gaps = new ArrayList<>();

    private int statement;
    private Origin origin = Origin.unknown();
    private String temporaryBase = "tmp";
    private int temporaryIndex;

    AnalysisSession(PyModule module, IdiomTable idioms) {
        this.module = module;
        this.idioms = idioms;
    }

    // ---- statement bookkeeping ----

    /** Starts a new statement: numbers it and resets temporary naming. */
    void begin(PyStmt stmt) {
        statement++;
        origin = new Origin(statement, stmt.span().line(), firstLine(module.text(stmt)));
        temporaryBase = "tmp";
        temporaryIndex = 0;
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return (newline < 0 ? text : text.substring(0, newline)).strip();
    }

    Origin origin() {
        return origin;
    }

    SymbolTable symbols() {
        return symbols;
    }

    String text(PyExpr expr) {
        return module.text(expr);
    }

    String text(PyStmt stmt) {
        return module.text(stmt);
    }

    void defineFunction(String name, String source) {
        functions.put(name, source);
        symbols.bind(name, SymbolTable.Kind.FUNCTION, name);
    }

    String functionSource(String name) {
        return functions.get(name);
    }

    String temporary() {
        temporaryIndex++;
        return Temporaries.name(temporaryBase, statement, temporaryIndex);
    }

    void emit(List<Operation> ops) {
        operations.addAll(ops);
    }

    void emit(Operation op) {
        operations.add(op);
    }

    void gap(String construct, String reason) {
        gaps.add(new RecognitionGap(origin.statement(), origin.line(), construct, reason));
    }

    List<Operation> operations() {
        return operations;
    }

    List<RecognitionGap> gaps() {
        return gaps;
    }

    // ---- data detection ----

    /** True for variables bound to a dataframe or a fitted model. */
    boolean involvesData(String name) {
        SymbolTable.Binding binding = symbols.get(name);
        return binding != null
            && (binding.kind() == SymbolTable.Kind.DATAFRAME || binding.kind() == SymbolTable.Kind.MODEL);
    }

    /**
     * True when the expression reads a dataframe, model, estimator or mask, or
     * calls into pandas or scikit-learn.
     */
    boolean involvesData(PyExpr expr) {
        return Expressions.anyNode(expr, node -> {
            if (node instanceof PyExpr.Name name) {
                SymbolTable.Binding binding = symbols.get(name.id());
                return binding != null && switch (binding.kind()) {
                    case DATAFRAME, MODEL, ESTIMATOR, MASK, UNRESOLVED -> true;
                    default -> false;
                };
            }
            if (node instanceof PyExpr.Call call) {
                String dotted = Expressions.dottedName(call.func());
                return dotted != null && isLibraryName(symbols.qualify(dotted));
            }
            return false;
        });
    }

    private static boolean isLibraryName(String qualified) {
        return qualified.startsWith("pandas.") || qualified.startsWith("sklearn.")
            || qualified.startsWith("xgboost.") || qualified.startsWith("lightgbm.");
    }

    // ---- chain resolution ----

    /**
     * Resolves a top-level expression whose value is assigned to {@code target}
     * (null when the value is discarded). Operations are appended to {@code buffer}
     * only when the whole expression resolves.
     */
    Resolution resolve(PyExpr expr, String target, List<Operation> buffer) {
        Chain chain = Chain.of(expr);
        if (target != null) {
            temporaryBase = target;
        } else if (chain.root() != null) {
            temporaryBase = chain.root();
        } else if (!chain.isEmpty() && chain.link(0) instanceof Chain.Link.FunctionCall call) {
            temporaryBase = call.name();
        }
        return resolve(chain, target, buffer);
    }

    /**
     * Resolves a dataframe-valued argument into a temporary. Returns the
     * variable holding it, or null when it is not a recognizable dataframe.
     */
    String resolveNested(PyExpr expr, List<Operation> buffer) {
        Resolution resolution = resolve(Chain.of(expr), null, buffer);
        return resolution.succeeded() && resolution.value().isFrame() ? resolution.value().variable() : null;
    }

    private Resolution resolve(Chain chain, String target, List<Operation> buffer) {
        Idiom.Value current = null;
        if (chain.root() != null) {
            SymbolTable.Binding binding = symbols.get(chain.root());
            if (binding == null) {
                return Resolution.failed("unknown variable '%s'".formatted(chain.root()));
            }
            switch (binding.kind()) {
                case DATAFRAME -> current = Idiom.Value.frame(chain.root());
                case ESTIMATOR, MODEL -> current = new Idiom.Value(chain.root(), binding.kind(), binding.detail());
                case MODULE, IMPORTED -> current = null;
                case UNRESOLVED -> {
                    return Resolution.failed("'%s' comes from a statement that was not converted".formatted(chain.root()));
                }
                default -> {
                    return Resolution.failed("'%s' is not a dataframe".formatted(chain.root()));
                }
            }
        } else if (chain.isEmpty() || !(chain.link(0) instanceof Chain.Link.FunctionCall)) {
            return Resolution.failed("unsupported expression");
        }

        int mark = buffer.size();
        int position = 0;
        while (position < chain.size()) {
            var site = new IdiomSite(this, chain, position, current, target, buffer);
            Idiom.Match match = idioms.match(site);
            if (match == null) {
                buffer.subList(mark, buffer.size()).clear();
                return Resolution.failed("no idiom for '%s'".formatted(describe(chain.link(position))));
            }
            buffer.addAll(match.operations());
            current = match.result();
            position += match.consumed();
        }
        if (current == null) {
            return Resolution.failed("no value");
        }
        return Resolution.success(current);
    }

    private String describe(Chain.Link link) {
        if (link instanceof Chain.Link.MethodCall call) {
            return "." + call.name() + "()";
        }
        if (link instanceof Chain.Link.FunctionCall call) {
            return call.name() + "()";
        }
        if (link instanceof Chain.Link.AttributeAccess access) {
            return "." + access.name();
        }
        return "[" + text(((Chain.Link.Index) link).index()) + "]";
    }
}
