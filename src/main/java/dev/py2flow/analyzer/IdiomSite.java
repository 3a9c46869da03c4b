package dev.py2flow.analyzer;

import dev.py2flow.python.PyExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A chain position offered to the idiom matchers, with helpers for reading
 * call arguments and for naming the outputs of the operations an idiom emits.
 *
 * <p>The public methods are what custom idioms registered through
 * {@link IdiomTable#standardWith} may rely on.</p>
 */
public final class IdiomSite {

    private final AnalysisSession session;
    private final Chain chain;
    private final int position;
    private final Idiom.Value receiver;
    private final String target;
    private final List<Operation> buffer;

    IdiomSite(AnalysisSession session, Chain chain, int position, Idiom.Value receiver, String target,
              List<Operation> buffer) {
        this.session = session;
        this.chain = chain;
        this.position = position;
        this.receiver = receiver;
        this.target = target;
        this.buffer = buffer;
    }

    // ---- receiver ----

    /** What the links before this position evaluate to; null at a module or function root. */
    public Idiom.Value receiver() {
        return receiver;
    }

    public String receiverVariable() {
        return receiver == null ? null : receiver.variable();
    }

    public boolean onFrame() {
        return receiver != null && receiver.isFrame();
    }

    boolean onKind(SymbolTable.Kind kind) {
        return receiver != null && receiver.kind() == kind;
    }

    /** True at the first link of a chain rooted at a module alias or a plain function. */
    boolean atFunctionRoot() {
        return receiver == null && position == 0;
    }

    /** The chain root variable, used to resolve {@code df["col"]} references in arguments. */
    String rootName() {
        return chain.root();
    }

    // ---- links ----

    Chain.Link link() {
        return link(0);
    }

    /** The link {@code offset} positions ahead, or null past the end. */
    Chain.Link link(int offset) {
        int index = position + offset;
        return index < chain.size() ? chain.link(index) : null;
    }

    /** Method name at {@code offset}, or null when that link is not a method call. */
    public String method(int offset) {
        return link(offset) instanceof Chain.Link.MethodCall call ? call.name() : null;
    }

    public String method() {
        return method(0);
    }

    public boolean isMethod(String... names) {
        String method = method();
        if (method == null) {
            return false;
        }
        for (String name : names) {
            if (name.equals(method)) {
                return true;
            }
        }
        return false;
    }

    public boolean isMethodIn(Set<String> names) {
        String method = method();
        return method != null && names.contains(method);
    }

    public PyExpr.Call call() {
        return call(0);
    }

    public PyExpr.Call call(int offset) {
        Chain.Link link = link(offset);
        if (link instanceof Chain.Link.MethodCall call) {
            return call.node();
        }
        if (link instanceof Chain.Link.FunctionCall call) {
            return call.node();
        }
        return null;
    }

    /** Subscript index at {@code offset}, or null when that link is not an index. */
    PyExpr index(int offset) {
        return link(offset) instanceof Chain.Link.Index index ? index.index() : null;
    }

    /** Attribute name at {@code offset}, or null when that link is not a plain attribute. */
    public String attribute(int offset) {
        return link(offset) instanceof Chain.Link.AttributeAccess access ? access.name() : null;
    }

    /**
     * Qualified name of the function called at a chain root, e.g.
     * {@code pandas.read_csv} for {@code pd.read_csv(...)}; null elsewhere.
     */
    String function() {
        if (!atFunctionRoot()) {
            return null;
        }
        Chain.Link first = link();
        if (first instanceof Chain.Link.FunctionCall call) {
            return session.symbols().qualify(call.name());
        }
        if (first instanceof Chain.Link.MethodCall call && chain.root() != null) {
            return session.symbols().qualify(chain.root() + "." + call.name());
        }
        return null;
    }

    /** The unqualified name of {@link #function()}. */
    String functionName() {
        String function = function();
        return function == null ? null : SklearnCatalog.simpleName(function);
    }

    boolean isPandasFunction(String... names) {
        String function = function();
        if (function == null || !function.startsWith("pandas.")) {
            return false;
        }
        String simple = SklearnCatalog.simpleName(function);
        for (String name : names) {
            if (name.equals(simple)) {
                return true;
            }
        }
        return false;
    }

    // ---- outputs ----

    /** True when consuming {@code consumed} links finishes the chain. */
    public boolean isLast(int consumed) {
        return position + consumed >= chain.size();
    }

    /**
     * Output variable of an operation that ends after {@code consumed} links:
     * the assignment target when the chain ends there, otherwise a fresh temporary.
     */
    public String output(int consumed) {
        return isLast(consumed) && target != null ? target : session.temporary();
    }

    public String temporary() {
        return session.temporary();
    }

    /** The assignment target of the statement, or null. */
    public String target() {
        return target;
    }

    // ---- arguments ----

    SymbolTable symbols() {
        return session.symbols();
    }

    public Origin origin() {
        return session.origin();
    }

    public String text(PyExpr expr) {
        return session.text(expr);
    }

    /**
     * The variable holding a dataframe argument. Plain names must be bound to
     * a dataframe; nested chains such as {@code b.dropna()} are resolved into
     * temporaries whose operations run first. Returns null for anything else.
     */
    public String frame(PyExpr expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof PyExpr.Name name) {
            return session.symbols().isDataFrame(name.id()) ? name.id() : null;
        }
        if (!(expr instanceof PyExpr.Call) && !(expr instanceof PyExpr.Subscript)
                && !(expr instanceof PyExpr.Attribute)) {
            return null;
        }
        return session.resolveNested(expr, buffer);
    }

    /** Dataframe variables for all expressions, or null if any is not a dataframe. */
    List<String> frames(List<PyExpr> exprs) {
        List<String> frames = new ArrayList<>();
        for (PyExpr expr : exprs) {
            String frame = frame(expr);
            if (frame == null) {
                return null;
            }
            frames.add(frame);
        }
        return frames;
    }

    /** Dataframe variables among the positional arguments, skipping the rest. */
    List<String> frameArguments(PyExpr.Call call) {
        List<String> frames = new ArrayList<>();
        for (PyExpr arg : call.args()) {
            if (Expressions.referencesName(arg, session::involvesData)) {
                String frame = frame(arg);
                if (frame != null) {
                    frames.add(frame);
                }
            }
        }
        return frames;
    }

    public String string(PyExpr expr) {
        return expr == null ? null : Expressions.stringValue(expr, session.symbols());
    }

    /** Known string items, or null. */
    public List<String> strings(PyExpr expr) {
        return Expressions.stringList(expr, session.symbols());
    }

    /** Column names, with a placeholder for anything not statically known. */
    public List<String> columns(PyExpr expr) {
        return expr == null ? List.of() : Expressions.columnNames(expr, session.symbols(), text(expr));
    }

    /** Source of a function defined in the script, or null. */
    String functionSource(String name) {
        return session.functionSource(name);
    }
}
