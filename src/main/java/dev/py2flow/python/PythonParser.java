package dev.py2flow.python;

import dev.py2flow.python.PyExpr.*;
import dev.py2flow.python.PyStmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the statement and expression subset used by
 * data-processing scripts.
 *
 * <p>A statement that cannot be parsed becomes a {@link PyStmt.Invalid} node
 * and parsing resumes at the next logical line of the same block, so a single
 * odd construct never hides the rest of the script.</p>
 */
public final class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break",
        "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
        "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
        "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final List<Token> tokens;
    private int index;

    private PythonParser(String source) {
        this.tokens = PythonLexer.tokenize(source);
    }

    /**
     * Parse a complete module.
     *
     * @throws PythonSyntaxException when the source cannot be tokenized
     */
    public static PyModule parse(String source) {
        PythonParser parser = new PythonParser(source);
        List<PyStmt> body = new ArrayList<>();
        while (parser.peek().type() != TokenType.EOF) {
            if (parser.peek().type() == TokenType.NEWLINE || parser.peek().type() == TokenType.DEDENT) {
                parser.index++;
                continue;
            }
            body.addAll(parser.statementRecovering());
        }
        return new PyModule(source, body);
    }

    // ---- statements ----

    private List<PyStmt> statementRecovering() {
        Token start = peek();
        try {
            return statement();
        } catch (ParseError e) {
            skipLogicalLine();
            Span span = new Span(start.line(), start.start(), Math.max(start.end(), previous().end()));
            return List.of(new Invalid(span, e.getMessage()));
        }
    }

    private void skipLogicalLine() {
        while (peek().type() != TokenType.NEWLINE && peek().type() != TokenType.EOF) {
            index++;
        }
        if (peek().type() == TokenType.NEWLINE) {
            index++;
        }
        // A broken compound header leaves its body behind; drop it too.
        if (peek().type() == TokenType.INDENT) {
            int level = 0;
            do {
                if (peek().type() == TokenType.INDENT) {
                    level++;
                } else if (peek().type() == TokenType.DEDENT) {
                    level--;
                }
                index++;
            } while (level > 0 && peek().type() != TokenType.EOF);
        }
    }

    private List<PyStmt> statement() {
        Token token = peek();
        if (token.type() == TokenType.OP && token.text().equals("@")) {
            return List.of(decorated());
        }
        if (token.type() == TokenType.NAME) {
            switch (token.text()) {
                case "if":
                    return List.of(ifStatement());
                case "for":
                    return List.of(forStatement());
                case "while":
                    return List.of(whileStatement());
                case "with":
                    return List.of(withStatement());
                case "try":
                    return List.of(tryStatement());
                case "def":
                    return List.of(functionDef());
                case "class":
                    return List.of(classDef());
                case "async":
                    index++;
                    return statement();
                default:
                    break;
            }
        }
        return simpleStatements();
    }

    private List<PyStmt> simpleStatements() {
        List<PyStmt> result = new ArrayList<>();
        result.add(smallStatement());
        while (acceptOp(";")) {
            if (peek().type() == TokenType.NEWLINE || peek().type() == TokenType.EOF) {
                break;
            }
            result.add(smallStatement());
        }
        expectLineEnd();
        return result;
    }

    private PyStmt smallStatement() {
        Token start = peek();
        if (start.type() == TokenType.NAME) {
            switch (start.text()) {
                case "import":
                    return importStatement();
                case "from":
                    return fromImport();
                case "pass", "break", "continue":
                    index++;
                    return new Simple(start.span(), start.text());
                case "return": {
                    index++;
                    PyExpr value = atSmallStatementEnd() ? null : starExpressions();
                    return new Return(spanFrom(start), value);
                }
                case "del": {
                    index++;
                    PyExpr targets = exprList();
                    List<PyExpr> list = targets instanceof TupleExpr tuple ? tuple.elements() : List.of(targets);
                    return new Delete(spanFrom(start), list);
                }
                case "global", "nonlocal", "raise", "assert", "yield": {
                    index++;
                    skipToSmallStatementEnd();
                    return new Simple(spanFrom(start), start.text());
                }
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private PyStmt expressionStatement() {
        Token start = peek();
        PyExpr first = starExpressions();

        if (peek().isOp("=")) {
            List<PyExpr> targets = new ArrayList<>();
            targets.add(first);
            PyExpr value;
            while (true) {
                expectOp("=");
                value = starExpressions();
                if (peek().isOp("=")) {
                    targets.add(value);
                } else {
                    break;
                }
            }
            return new Assign(spanFrom(start), targets, value);
        }
        if (peek().type() == TokenType.OP && AUGMENTED.contains(peek().text())) {
            String op = next().text();
            PyExpr value = starExpressions();
            return new AugAssign(spanFrom(start), first, op, value);
        }
        if (acceptOp(":")) {
            test();
            if (acceptOp("=")) {
                PyExpr value = starExpressions();
                return new Assign(spanFrom(start), List.of(first), value);
            }
            return new Simple(spanFrom(start), "annotation");
        }
        return new ExprStmt(spanFrom(start), first);
    }

    private PyStmt importStatement() {
        Token start = next();
        List<Alias> names = new ArrayList<>();
        do {
            String name = dottedName();
            String asName = acceptKeyword("as") ? expectName() : null;
            names.add(new Alias(name, asName));
        } while (acceptOp(","));
        return new Import(spanFrom(start), null, names);
    }

    private PyStmt fromImport() {
        Token start = next();
        StringBuilder module = new StringBuilder();
        while (peek().isOp(".") || peek().isOp("...")) {
            module.append(next().text());
        }
        if (!peek().isKeyword("import")) {
            module.append(dottedName());
        }
        expectKeyword("import");
        List<Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
        } else {
            boolean parenthesized = acceptOp("(");
            do {
                if (parenthesized && peek().isOp(")")) {
                    break;
                }
                String name = expectName();
                String asName = acceptKeyword("as") ? expectName() : null;
                names.add(new Alias(name, asName));
            } while (acceptOp(","));
            if (parenthesized) {
                expectOp(")");
            }
        }
        return new Import(spanFrom(start), module.toString(), names);
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(expectName());
        while (acceptOp(".")) {
            name.append('.').append(expectName());
        }
        return name.toString();
    }

    private PyStmt ifStatement() {
        Token start = next();
        PyExpr test = namedTest();
        List<PyStmt> body = block();
        List<PyStmt> orElse = List.of();
        if (peek().isKeyword("elif")) {
            orElse = List.of(ifStatement());
        } else if (acceptKeyword("else")) {
            orElse = block();
        }
        return new If(spanFrom(start), test, body, orElse);
    }

    private PyStmt forStatement() {
        Token start = next();
        PyExpr target = exprList();
        expectKeyword("in");
        PyExpr iter = starExpressions();
        List<PyStmt> body = block();
        List<PyStmt> orElse = acceptKeyword("else") ? block() : List.of();
        return new For(spanFrom(start), target, iter, body, orElse);
    }

    private PyStmt whileStatement() {
        Token start = next();
        PyExpr test = namedTest();
        List<PyStmt> body = block();
        List<PyStmt> orElse = acceptKeyword("else") ? block() : List.of();
        return new While(spanFrom(start), test, body, orElse);
    }

    private PyStmt withStatement() {
        Token start = next();
        boolean parenthesized = peek().isOp("(") && looksLikeParenthesizedWithItems();
        if (parenthesized) {
            index++;
        }
        List<WithItem> items = new ArrayList<>();
        do {
            if (parenthesized && peek().isOp(")")) {
                break;
            }
            PyExpr context = test();
            PyExpr target = acceptKeyword("as") ? exprList() : null;
            items.add(new WithItem(context, target));
        } while (acceptOp(","));
        if (parenthesized) {
            expectOp(")");
        }
        List<PyStmt> body = block();
        return new With(spanFrom(start), items, body);
    }

    private boolean looksLikeParenthesizedWithItems() {
        int depth = 0;
        for (int i = index; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                depth--;
                if (depth == 0) {
                    return tokens.get(i + 1).isOp(":");
                }
            } else if (depth == 1 && t.isKeyword("as")) {
                return true;
            }
        }
        return false;
    }

    private PyStmt tryStatement() {
        Token start = next();
        List<PyStmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek().isKeyword("except")) {
            index++;
            acceptOp("*");
            PyExpr type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = test();
                if (acceptOp(",")) {
                    test();
                }
                if (acceptKeyword("as")) {
                    name = expectName();
                }
            }
            handlers.add(new ExceptHandler(type, name, block()));
        }
        List<PyStmt> orElse = acceptKeyword("else") ? block() : List.of();
        List<PyStmt> finalBody = acceptKeyword("finally") ? block() : List.of();
        return new Try(spanFrom(start), body, handlers, orElse, finalBody);
    }

    private PyStmt decorated() {
        while (acceptOp("@")) {
            namedTest();
            expectLineEnd();
        }
        acceptKeyword("async");
        if (peek().isKeyword("def")) {
            return functionDef();
        }
        if (peek().isKeyword("class")) {
            return classDef();
        }
        throw error("expected def or class after decorator");
    }

    private PyStmt functionDef() {
        Token start = next();
        String name = expectName();
        expectOp("(");
        List<String> params = new ArrayList<>();
        int depth = 0;
        boolean expectParamName = true;
        while (!(depth == 0 && peek().isOp(")"))) {
            Token token = next();
            if (token.type() == TokenType.EOF) {
                throw error("unterminated parameter list");
            }
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            } else if (depth == 0 && token.isOp(",")) {
                expectParamName = true;
            } else if (depth == 0 && expectParamName && token.type() == TokenType.NAME) {
                params.add(token.text());
                expectParamName = false;
            }
        }
        expectOp(")");
        if (acceptOp("->")) {
            test();
        }
        List<PyStmt> body = block();
        return new FunctionDef(spanFrom(start), name, params, body);
    }

    private PyStmt classDef() {
        Token start = next();
        String name = expectName();
        if (acceptOp("(")) {
            if (!peek().isOp(")")) {
                arguments(new ArrayList<>(), new ArrayList<>());
            }
            expectOp(")");
        }
        List<PyStmt> body = block();
        return new ClassDef(spanFrom(start), name, body);
    }

    private List<PyStmt> block() {
        expectOp(":");
        if (peek().type() != TokenType.NEWLINE) {
            return simpleStatements();
        }
        index++;
        if (peek().type() != TokenType.INDENT) {
            throw error("expected an indented block");
        }
        index++;
        List<PyStmt> body = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                index++;
                continue;
            }
            body.addAll(statementRecovering());
        }
        if (peek().type() == TokenType.DEDENT) {
            index++;
        }
        return body;
    }

    // ---- expressions ----

    private PyExpr starExpressions() {
        Token start = peek();
        PyExpr first = starOrTest();
        if (!peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!startsExpression()) {
                break;
            }
            elements.add(starOrTest());
        }
        return new TupleExpr(spanFrom(start), elements);
    }

    private PyExpr exprList() {
        Token start = peek();
        PyExpr first = starOrBitOr();
        if (!peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!startsExpression() || peek().isKeyword("in")) {
                break;
            }
            elements.add(starOrBitOr());
        }
        return new TupleExpr(spanFrom(start), elements);
    }

    private PyExpr starOrTest() {
        Token start = peek();
        if (acceptOp("*")) {
            return new Starred(spanFrom(start), bitOr());
        }
        return namedTest();
    }

    private PyExpr starOrBitOr() {
        Token start = peek();
        if (acceptOp("*")) {
            return new Starred(spanFrom(start), bitOr());
        }
        return bitOr();
    }

    private PyExpr namedTest() {
        PyExpr value = test();
        if (acceptOp(":=")) {
            return test();
        }
        return value;
    }

    private PyExpr test() {
        Token start = peek();
        if (peek().isKeyword("lambda")) {
            return lambda();
        }
        PyExpr body = orTest();
        if (peek().isKeyword("if") && isConditionalExpression()) {
            index++;
            PyExpr condition = orTest();
            expectKeyword("else");
            PyExpr orElse = test();
            return new IfExp(spanFrom(start), condition, body, orElse);
        }
        return body;
    }

    /** Distinguishes {@code a if b else c} from a comprehension's trailing {@code if}. */
    private boolean isConditionalExpression() {
        int depth = 0;
        for (int i = index + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.NEWLINE || t.type() == TokenType.EOF) {
                return false;
            }
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                if (depth == 0) {
                    return false;
                }
                depth--;
            } else if (depth == 0 && (t.isKeyword("for") || t.isOp(",") || t.isOp(":"))) {
                return false;
            } else if (depth == 0 && t.isKeyword("else")) {
                return true;
            }
        }
        return false;
    }

    private PyExpr lambda() {
        Token start = next();
        int depth = 0;
        while (!(depth == 0 && peek().isOp(":"))) {
            Token token = next();
            if (token.type() == TokenType.EOF || token.type() == TokenType.NEWLINE) {
                throw error("unterminated lambda");
            }
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            }
        }
        expectOp(":");
        PyExpr body = test();
        return new Lambda(spanFrom(start), body);
    }

    private PyExpr orTest() {
        Token start = peek();
        PyExpr first = andTest();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<PyExpr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) {
            values.add(andTest());
        }
        return new BoolOp(spanFrom(start), "or", values);
    }

    private PyExpr andTest() {
        Token start = peek();
        PyExpr first = notTest();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<PyExpr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) {
            values.add(notTest());
        }
        return new BoolOp(spanFrom(start), "and", values);
    }

    private PyExpr notTest() {
        Token start = peek();
        if (acceptKeyword("not")) {
            return new UnaryOp(spanFrom(start), "not", notTest());
        }
        return comparison();
    }

    private PyExpr comparison() {
        Token start = peek();
        PyExpr left = bitOr();
        List<String> ops = new ArrayList<>();
        List<PyExpr> comparators = new ArrayList<>();
        while (true) {
            Token token = peek();
            String op;
            if (token.type() == TokenType.OP && COMPARISONS.contains(token.text())) {
                op = next().text();
            } else if (token.isKeyword("in")) {
                index++;
                op = "in";
            } else if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
                index += 2;
                op = "not in";
            } else if (token.isKeyword("is")) {
                index++;
                op = acceptKeyword("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            comparators.add(bitOr());
        }
        return ops.isEmpty() ? left : new Compare(spanFrom(start), left, ops, comparators);
    }

    private PyExpr bitOr() {
        return binary(0);
    }

    private static final String[][] BINARY_LEVELS = {
        {"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"}, {"*", "/", "//", "%", "@"}
    };

    private PyExpr binary(int level) {
        if (level == BINARY_LEVELS.length) {
            return factor();
        }
        Token start = peek();
        PyExpr left = binary(level + 1);
        while (peek().type() == TokenType.OP && contains(BINARY_LEVELS[level], peek().text())) {
            String op = next().text();
            PyExpr right = binary(level + 1);
            left = new BinOp(spanFrom(start), left, op, right);
        }
        return left;
    }

    private PyExpr factor() {
        Token start = peek();
        if (peek().isOp("-") || peek().isOp("+") || peek().isOp("~")) {
            String op = next().text();
            return new UnaryOp(spanFrom(start), op, factor());
        }
        return power();
    }

    private PyExpr power() {
        Token start = peek();
        acceptKeyword("await");
        PyExpr base = primary();
        if (acceptOp("**")) {
            return new BinOp(spanFrom(start), base, "**", factor());
        }
        return base;
    }

    private PyExpr primary() {
        Token start = peek();
        PyExpr expr = atom();
        while (true) {
            if (acceptOp("(")) {
                List<PyExpr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                if (!peek().isOp(")")) {
                    arguments(args, keywords);
                }
                expectOp(")");
                expr = new Call(spanFrom(start), expr, args, keywords);
            } else if (acceptOp("[")) {
                PyExpr subscript = subscriptList();
                expectOp("]");
                expr = new Subscript(spanFrom(start), expr, subscript);
            } else if (peek().isOp(".") && peekAt(1).type() == TokenType.NAME) {
                index++;
                String attr = next().text();
                expr = new Attribute(spanFrom(start), expr, attr);
            } else {
                return expr;
            }
        }
    }

    private void arguments(List<PyExpr> args, List<Keyword> keywords) {
        do {
            if (peek().isOp(")")) {
                break;
            }
            Token start = peek();
            if (acceptOp("**")) {
                keywords.add(new Keyword(null, test()));
            } else if (acceptOp("*")) {
                args.add(new Starred(spanFrom(start), test()));
            } else if (peek().type() == TokenType.NAME && peekAt(1).isOp("=")) {
                String name = next().text();
                index++;
                keywords.add(new Keyword(name, test()));
            } else {
                PyExpr value = namedTest();
                if (peek().isKeyword("for") || peek().isKeyword("async")) {
                    value = comprehension(start, "generator", value);
                }
                args.add(value);
            }
        } while (acceptOp(","));
    }

    private PyExpr subscriptList() {
        Token start = peek();
        PyExpr first = subscript();
        if (!peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]")) {
                break;
            }
            elements.add(subscript());
        }
        return new TupleExpr(spanFrom(start), elements);
    }

    private PyExpr subscript() {
        Token start = peek();
        PyExpr lower = null;
        if (!peek().isOp(":")) {
            lower = starOrTest();
            if (!peek().isOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        PyExpr upper = startsExpression() ? test() : null;
        PyExpr step = null;
        if (acceptOp(":")) {
            step = startsExpression() ? test() : null;
        }
        return new Slice(spanFrom(start), lower, upper, step);
    }

    private PyExpr atom() {
        Token start = peek();
        Token token = next();
        switch (token.type()) {
            case NAME:
                return switch (token.text()) {
                    case "True", "False" -> new Constant(token.span(), ConstantKind.BOOLEAN, token.text());
                    case "None" -> new Constant(token.span(), ConstantKind.NONE, "None");
                    case "yield" -> yieldExpression(start);
                    default -> {
                        if (KEYWORDS.contains(token.text())) {
                            throw error("unexpected keyword '%s'".formatted(token.text()), token);
                        }
                        yield new Name(token.span(), token.text());
                    }
                };
            case NUMBER:
                return new Constant(token.span(), ConstantKind.NUMBER, token.text());
            case STRING:
                return strings(token);
            case OP:
                return switch (token.text()) {
                    case "(" -> parenthesized(start);
                    case "[" -> listDisplay(start);
                    case "{" -> dictOrSetDisplay(start);
                    case "..." -> new Constant(token.span(), ConstantKind.ELLIPSIS, "...");
                    default -> throw error("unexpected '%s'".formatted(token.text()), token);
                };
            default:
                throw error("unexpected end of statement", token);
        }
    }

    private PyExpr yieldExpression(Token start) {
        acceptKeyword("from");
        if (startsExpression()) {
            starExpressions();
        }
        return new Constant(spanFrom(start), ConstantKind.NONE, "None");
    }

    private PyExpr strings(Token first) {
        ConstantKind kind = kindOf(first.text());
        StringBuilder value = new StringBuilder(decodeString(first.text()));
        while (peek().type() == TokenType.STRING) {
            Token token = next();
            if (kindOf(token.text()) == ConstantKind.FSTRING) {
                kind = ConstantKind.FSTRING;
            }
            value.append(decodeString(token.text()));
        }
        return new Constant(spanFrom(first), kind, value.toString());
    }

    private PyExpr parenthesized(Token start) {
        if (acceptOp(")")) {
            return new TupleExpr(spanFrom(start), List.of());
        }
        if (peek().isKeyword("yield")) {
            index++;
            PyExpr value = yieldExpression(start);
            expectOp(")");
            return value;
        }
        PyExpr first = starOrTest();
        if (peek().isKeyword("for") || peek().isKeyword("async")) {
            PyExpr generator = comprehension(start, "generator", first);
            expectOp(")");
            return generator;
        }
        if (acceptOp(")")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (peek().isOp(")")) {
                break;
            }
            elements.add(starOrTest());
        }
        expectOp(")");
        return new TupleExpr(spanFrom(start), elements);
    }

    private PyExpr listDisplay(Token start) {
        if (acceptOp("]")) {
            return new ListExpr(spanFrom(start), List.of());
        }
        PyExpr first = starOrTest();
        if (peek().isKeyword("for") || peek().isKeyword("async")) {
            PyExpr comprehension = comprehension(start, "list", first);
            expectOp("]");
            return comprehension;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]")) {
                break;
            }
            elements.add(starOrTest());
        }
        expectOp("]");
        return new ListExpr(spanFrom(start), elements);
    }

    private PyExpr dictOrSetDisplay(Token start) {
        if (acceptOp("}")) {
            return new DictExpr(spanFrom(start), List.of(), List.of());
        }
        List<PyExpr> keys = new ArrayList<>();
        List<PyExpr> values = new ArrayList<>();
        if (acceptOp("**")) {
            keys.add(null);
            values.add(bitOr());
        } else {
            PyExpr first = starOrTest();
            if (!acceptOp(":")) {
                return setDisplay(start, first);
            }
            PyExpr value = test();
            if (peek().isKeyword("for") || peek().isKeyword("async")) {
                PyExpr comprehension = comprehension(start, "dict", value);
                expectOp("}");
                return comprehension;
            }
            keys.add(first);
            values.add(value);
        }
        while (acceptOp(",")) {
            if (peek().isOp("}")) {
                break;
            }
            if (acceptOp("**")) {
                keys.add(null);
                values.add(bitOr());
            } else {
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
        }
        expectOp("}");
        return new DictExpr(spanFrom(start), keys, values);
    }

    private PyExpr setDisplay(Token start, PyExpr first) {
        if (peek().isKeyword("for") || peek().isKeyword("async")) {
            PyExpr comprehension = comprehension(start, "set", first);
            expectOp("}");
            return comprehension;
        }
        List<PyExpr> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("}")) {
                break;
            }
            elements.add(starOrTest());
        }
        expectOp("}");
        return new SetExpr(spanFrom(start), elements);
    }

    private PyExpr comprehension(Token start, String kind, PyExpr element) {
        List<PyExpr> parts = new ArrayList<>();
        while (peek().isKeyword("for") || peek().isKeyword("async")) {
            acceptKeyword("async");
            expectKeyword("for");
            exprList();
            expectKeyword("in");
            parts.add(orTest());
            while (peek().isKeyword("if")) {
                index++;
                parts.add(orTest());
            }
        }
        return new Comprehension(spanFrom(start), kind, element, parts);
    }

    // ---- string literals ----

    private static ConstantKind kindOf(String literal) {
        String prefix = prefixOf(literal).toLowerCase();
        if (prefix.contains("f")) {
            return ConstantKind.FSTRING;
        }
        return prefix.contains("b") ? ConstantKind.BYTES : ConstantKind.STRING;
    }

    private static String prefixOf(String literal) {
        int i = 0;
        while (i < literal.length() && literal.charAt(i) != '\'' && literal.charAt(i) != '"') {
            i++;
        }
        return literal.substring(0, i);
    }

    static String decodeString(String literal) {
        String prefix = prefixOf(literal);
        String body = literal.substring(prefix.length());
        int quoteLength = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
        body = body.substring(quoteLength, body.length() - quoteLength);
        if (prefix.toLowerCase().contains("r")) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case '0' -> out.append('\0');
                case '\\', '\'', '"' -> out.append(escaped);
                case '\n' -> { }
                default -> out.append('\\').append(escaped);
            }
        }
        return out.toString();
    }

    // ---- token helpers ----

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private Token previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    private Span spanFrom(Token start) {
        int end = Math.max(start.end(), previous().end());
        return new Span(start.line(), start.start(), end);
    }

    private boolean acceptOp(String op) {
        if (peek().isOp(op)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!acceptOp(op)) {
            throw error("expected '%s'".formatted(op));
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("expected '%s'".formatted(keyword));
        }
    }

    private String expectName() {
        Token token = peek();
        if (token.type() != TokenType.NAME) {
            throw error("expected a name");
        }
        index++;
        return token.text();
    }

    private void expectLineEnd() {
        if (peek().type() == TokenType.NEWLINE) {
            index++;
        } else if (peek().type() != TokenType.EOF && peek().type() != TokenType.DEDENT) {
            throw error("unexpected '%s'".formatted(peek().text()));
        }
    }

    private boolean atSmallStatementEnd() {
        return peek().type() == TokenType.NEWLINE || peek().type() == TokenType.EOF || peek().isOp(";");
    }

    private void skipToSmallStatementEnd() {
        while (!atSmallStatementEnd()) {
            index++;
        }
    }

    private boolean startsExpression() {
        Token token = peek();
        return switch (token.type()) {
            case NAME -> !KEYWORDS.contains(token.text())
                || Set.of("True", "False", "None", "not", "lambda", "await").contains(token.text());
            case NUMBER, STRING -> true;
            case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.text());
            default -> false;
        };
    }

    private static boolean contains(String[] values, String value) {
        for (String candidate : values) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private ParseError error(String message) {
        return error(message, peek());
    }

    private ParseError error(String message, Token at) {
        return new ParseError("line %d: %s".formatted(at.line(), message));
    }

    /** Statement-level failure; converted into an {@link PyStmt.Invalid} node. */
    private static final class ParseError extends RuntimeException {

        private static final long serialVersionUID = 1L;

        ParseError(String message) {
            super(message);
        }
    }
}
