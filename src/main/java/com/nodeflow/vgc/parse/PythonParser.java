package com.nodeflow.vgc.parse;

import com.nodeflow.vgc.ast.Alias;
import com.nodeflow.vgc.ast.AnnAssign;
import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assert;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.AugAssign;
import com.nodeflow.vgc.ast.Await;
import com.nodeflow.vgc.ast.BinOp;
import com.nodeflow.vgc.ast.BoolOp;
import com.nodeflow.vgc.ast.Break;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Compare;
import com.nodeflow.vgc.ast.Comprehension;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.Continue;
import com.nodeflow.vgc.ast.Delete;
import com.nodeflow.vgc.ast.DictExpr;
import com.nodeflow.vgc.ast.ExceptHandler;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.ExprStmt;
import com.nodeflow.vgc.ast.For;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.GeneratorExp;
import com.nodeflow.vgc.ast.Global;
import com.nodeflow.vgc.ast.If;
import com.nodeflow.vgc.ast.IfExp;
import com.nodeflow.vgc.ast.Import;
import com.nodeflow.vgc.ast.ImportFrom;
import com.nodeflow.vgc.ast.Keyword;
import com.nodeflow.vgc.ast.Lambda;
import com.nodeflow.vgc.ast.ListComp;
import com.nodeflow.vgc.ast.ListExpr;
import com.nodeflow.vgc.ast.Module;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Raise;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.ast.SetExpr;
import com.nodeflow.vgc.ast.Slice;
import com.nodeflow.vgc.ast.Starred;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.ast.Subscript;
import com.nodeflow.vgc.ast.Try;
import com.nodeflow.vgc.ast.TupleExpr;
import com.nodeflow.vgc.ast.UnaryOp;
import com.nodeflow.vgc.ast.While;
import com.nodeflow.vgc.ast.With;
import com.nodeflow.vgc.ast.WithItem;
import com.nodeflow.vgc.ast.Yield;
import com.nodeflow.vgc.ast.YieldFrom;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Python subset the compiler emits, plus the
 * common statement and expression forms found in hand-written modules.
 *
 * <p>
 * Comments are discarded by the lexer, so the resulting tree never contains
 * {@link com.nodeflow.vgc.ast.Comment} statements. Unsupported syntax raises
 * {@link SourceParseException}.
 */
public final class PythonParser {
    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private static final Set<String> AUG_ASSIGN = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private static final Set<String> COMPARE = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> EXPRESSION_OPENERS = Set.of("(", "[", "{", "-", "+", "~", "*", "...");

    private final List<Token> tokens;
    private int pos;

    private PythonParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Parses a whole module. */
    public static Module parse(String source) {
        PythonParser p = new PythonParser(PythonLexer.tokenize(source));
        return p.module();
    }

    /** Parses a single expression, e.g. a type annotation. */
    public static Expr parseExpression(String source) {
        PythonParser p = new PythonParser(PythonLexer.tokenize(source));
        Expr e = p.testList();
        p.skipNewlines();
        p.expect(Token.Type.EOF, "end of input");
        return e;
    }

    private Module module() {
        List<Stmt> body = new ArrayList<>();
        skipNewlines();
        while (peek().type() != Token.Type.EOF) {
            statement(body);
            skipNewlines();
        }
        return new Module(body);
    }

    // ── Statements ─────────────────────────────────────────────────

    private void statement(List<Stmt> out) {
        Token t = peek();
        if (t.type() == Token.Type.INDENT)
            throw error("unexpected indent", t);
        if (t.type() == Token.Type.NAME) {
            switch (t.text()) {
                case "if":
                    out.add(ifStatement());
                    return;
                case "while":
                    out.add(whileStatement());
                    return;
                case "for":
                    out.add(forStatement(false));
                    return;
                case "try":
                    out.add(tryStatement());
                    return;
                case "with":
                    out.add(withStatement(false));
                    return;
                case "def":
                    out.add(functionDef(List.of(), false));
                    return;
                case "class":
                    out.add(classDef(List.of()));
                    return;
                case "async":
                    out.add(asyncStatement(List.of()));
                    return;
                default:
                    break;
            }
        }
        if (t.isOp("@")) {
            out.add(decorated());
            return;
        }
        simpleStatements(out);
    }

    private void simpleStatements(List<Stmt> out) {
        out.add(simpleStatement());
        while (acceptOp(";")) {
            if (peek().type() == Token.Type.NEWLINE)
                break;
            out.add(simpleStatement());
        }
        expect(Token.Type.NEWLINE, "newline");
    }

    private Stmt simpleStatement() {
        Token t = peek();
        if (t.type() == Token.Type.NAME) {
            switch (t.text()) {
                case "pass":
                    next();
                    return Pass.INSTANCE;
                case "break":
                    next();
                    return new Break();
                case "continue":
                    next();
                    return new Continue();
                case "return":
                    next();
                    return new Return(atStatementEnd() ? null : starTestList());
                case "raise":
                    return raiseStatement();
                case "global":
                case "nonlocal":
                    return globalStatement();
                case "del":
                    next();
                    return new Delete(flatten(exprList()));
                case "assert":
                    next();
                    Expr test = test();
                    return new Assert(test, acceptOp(",") ? test() : null);
                case "import":
                    return importStatement();
                case "from":
                    return fromImport();
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private Stmt expressionStatement() {
        Token start = peek();
        Expr first = peek().isKeyword("yield") ? yieldExpr() : starTestList();

        if (peek().isOp(":")) {
            next();
            checkTarget(first, start);
            Expr annotation = test();
            Expr value = null;
            if (acceptOp("="))
                value = peek().isKeyword("yield") ? yieldExpr() : starTestList();
            return new AnnAssign(first, annotation, value);
        }
        if (peek().type() == Token.Type.OP && AUG_ASSIGN.contains(peek().text())) {
            String op = next().text();
            checkTarget(first, start);
            Expr value = peek().isKeyword("yield") ? yieldExpr() : testList();
            return new AugAssign(first, op.substring(0, op.length() - 1), value);
        }
        if (peek().isOp("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (acceptOp("=")) {
                checkTarget(value, start);
                targets.add(value);
                value = peek().isKeyword("yield") ? yieldExpr() : starTestList();
            }
            return new Assign(targets, value);
        }
        return new ExprStmt(first);
    }

    private Stmt raiseStatement() {
        next();
        if (atStatementEnd())
            return new Raise(null, null);
        Expr exc = test();
        Expr cause = null;
        if (acceptKeyword("from"))
            cause = test();
        return new Raise(exc, cause);
    }

    private Stmt globalStatement() {
        boolean nonlocal = next().text().equals("nonlocal");
        List<String> names = new ArrayList<>();
        do {
            names.add(identifier());
        } while (acceptOp(","));
        return new Global(names, nonlocal);
    }

    private Stmt importStatement() {
        next();
        List<Alias> names = new ArrayList<>();
        do {
            String name = dottedName();
            names.add(new Alias(name, acceptKeyword("as") ? identifier() : null));
        } while (acceptOp(","));
        return new Import(names);
    }

    private Stmt fromImport() {
        next();
        int level = 0;
        while (peek().isOp(".") || peek().isOp("...")) {
            level += next().text().length();
        }
        String module = peek().isKeyword("import") ? "" : dottedName();
        if (module.isEmpty() && level == 0)
            throw error("expected module name", peek());
        expectKeyword("import");

        List<Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
            return new ImportFrom(module, names, level);
        }
        boolean parens = acceptOp("(");
        do {
            if (parens && peek().isOp(")"))
                break;
            String name = identifier();
            names.add(new Alias(name, acceptKeyword("as") ? identifier() : null));
        } while (acceptOp(","));
        if (parens)
            expectOp(")");
        return new ImportFrom(module, names, level);
    }

    private Stmt ifStatement() {
        next();
        Expr test = namedTest();
        List<Stmt> body = block();
        List<Stmt> orelse = List.of();
        if (peek().isKeyword("elif")) {
            orelse = List.of(ifStatement());
        } else if (acceptKeyword("else")) {
            orelse = block();
        }
        return new If(test, body, orelse);
    }

    private Stmt whileStatement() {
        next();
        Expr test = namedTest();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : List.of();
        return new While(test, body, orelse);
    }

    private Stmt forStatement(boolean isAsync) {
        next();
        Token start = peek();
        Expr target = exprList();
        checkTarget(target, start);
        expectKeyword("in");
        Expr iter = testList();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : List.of();
        return new For(target, iter, body, orelse, isAsync);
    }

    private Stmt tryStatement() {
        Token tryToken = next();
        List<Stmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek().isKeyword("except")) {
            next();
            Expr type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = test();
                if (acceptKeyword("as"))
                    name = identifier();
            }
            handlers.add(new ExceptHandler(type, name, block()));
        }
        List<Stmt> orelse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else"))
            orelse = block();
        List<Stmt> finalbody = acceptKeyword("finally") ? block() : List.of();
        if (handlers.isEmpty() && finalbody.isEmpty())
            throw error("expected 'except' or 'finally' block", tryToken);
        return new Try(body, handlers, orelse, finalbody);
    }

    private Stmt withStatement(boolean isAsync) {
        next();
        List<WithItem> items = new ArrayList<>();
        do {
            Expr context = test();
            Expr vars = null;
            if (acceptKeyword("as")) {
                Token start = peek();
                vars = expr();
                checkTarget(vars, start);
            }
            items.add(new WithItem(context, vars));
        } while (acceptOp(","));
        return new With(items, block(), isAsync);
    }

    private Stmt asyncStatement(List<Expr> decorators) {
        Token asyncToken = next();
        Token t = peek();
        if (t.isKeyword("def"))
            return functionDef(decorators, true);
        if (!decorators.isEmpty())
            throw error("expected 'def' after decorator", t);
        if (t.isKeyword("for"))
            return forStatement(true);
        if (t.isKeyword("with"))
            return withStatement(true);
        throw error("expected 'def', 'for' or 'with' after 'async'", asyncToken);
    }

    private Stmt decorated() {
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(namedTest());
            expect(Token.Type.NEWLINE, "newline");
        }
        Token t = peek();
        if (t.isKeyword("def"))
            return functionDef(decorators, false);
        if (t.isKeyword("class"))
            return classDef(decorators);
        if (t.isKeyword("async"))
            return asyncStatement(decorators);
        throw error("expected function or class definition after decorator", t);
    }

    private Stmt functionDef(List<Expr> decorators, boolean isAsync) {
        next();
        String name = identifier();
        expectOp("(");
        Arguments args = parameters(")", true);
        expectOp(")");
        Expr returns = acceptOp("->") ? test() : null;
        return new FunctionDef(name, args, block(), decorators, returns, isAsync);
    }

    private Stmt classDef(List<Expr> decorators) {
        next();
        String name = identifier();
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (acceptOp("(")) {
            callArguments(bases, keywords);
            expectOp(")");
        }
        return new ClassDef(name, bases, keywords, block(), decorators);
    }

    /**
     * Parameter list up to (not including) {@code closer}. Annotations are
     * only allowed in {@code def} signatures.
     */
    private Arguments parameters(String closer, boolean annotations) {
        List<Arg> args = new ArrayList<>();
        List<Arg> kwonly = new ArrayList<>();
        Arg vararg = null;
        Arg kwarg = null;
        boolean seenStar = false;
        boolean seenDefault = false;

        while (!peek().isOp(closer)) {
            if (acceptOp("**")) {
                kwarg = parameter(annotations, false);
                acceptOp(",");
                break;
            }
            if (acceptOp("*")) {
                if (seenStar)
                    throw error("* argument may appear only once", peek());
                seenStar = true;
                if (!peek().isOp(",") && !peek().isOp(closer))
                    vararg = parameter(annotations, false);
            } else if (acceptOp("/")) {
                if (seenStar || args.isEmpty())
                    throw error("invalid use of '/'", peek());
            } else {
                Arg a = parameter(annotations, true);
                if (seenStar) {
                    kwonly.add(a);
                } else {
                    if (a.defaultValue() != null)
                        seenDefault = true;
                    else if (seenDefault)
                        throw error("non-default argument follows default argument", peek());
                    args.add(a);
                }
            }
            if (!acceptOp(","))
                break;
        }
        if (seenStar && vararg == null && kwonly.isEmpty())
            throw error("named arguments must follow bare *", peek());
        return new Arguments(args, vararg, kwonly, kwarg);
    }

    private Arg parameter(boolean annotations, boolean allowDefault) {
        String name = identifier();
        Expr annotation = null;
        if (annotations && acceptOp(":"))
            annotation = test();
        Expr defaultValue = null;
        if (allowDefault && acceptOp("="))
            defaultValue = test();
        return new Arg(name, annotation, defaultValue);
    }

    /** {@code ':'} followed by a simple-statement line or an indented suite. */
    private List<Stmt> block() {
        expectOp(":");
        List<Stmt> body = new ArrayList<>();
        if (peek().type() != Token.Type.NEWLINE) {
            simpleStatements(body);
            return body;
        }
        next();
        skipNewlines();
        expect(Token.Type.INDENT, "an indented block");
        while (peek().type() != Token.Type.DEDENT && peek().type() != Token.Type.EOF) {
            statement(body);
            skipNewlines();
        }
        expect(Token.Type.DEDENT, "dedent");
        return body;
    }

    // ── Expressions ────────────────────────────────────────────────

    private Expr yieldExpr() {
        next();
        if (acceptKeyword("from"))
            return new YieldFrom(test());
        if (atStatementEnd() || peek().isOp(")") || peek().isOp("="))
            return new Yield(null);
        return new Yield(starTestList());
    }

    /** Comma-separated tests (with starred items); several make a tuple. */
    private Expr starTestList() {
        return sequence(true, false);
    }

    private Expr testList() {
        return sequence(false, false);
    }

    /** Assignment target list: {@code expr} level, so {@code in} is not consumed. */
    private Expr exprList() {
        return sequence(true, true);
    }

    private Expr sequence(boolean allowStar, boolean exprLevel) {
        Expr first = sequenceItem(allowStar, exprLevel);
        if (!peek().isOp(","))
            return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (!startsExpression())
                break;
            elts.add(sequenceItem(allowStar, exprLevel));
        }
        return new TupleExpr(elts);
    }

    private Expr sequenceItem(boolean allowStar, boolean exprLevel) {
        if (allowStar && acceptOp("*"))
            return new Starred(expr());
        return exprLevel ? expr() : test();
    }

    private Expr namedTest() {
        Token start = peek();
        Expr e = test();
        if (peek().isOp(":="))
            throw error("assignment expressions are not supported", start);
        return e;
    }

    private Expr test() {
        if (peek().isKeyword("lambda"))
            return lambda();
        Expr body = orTest();
        if (peek().isKeyword("if")) {
            next();
            Expr condition = orTest();
            expectKeyword("else");
            return new IfExp(condition, body, test());
        }
        return body;
    }

    private Expr lambda() {
        next();
        Arguments args = parameters(":", false);
        expectOp(":");
        return new Lambda(args, test());
    }

    private Expr orTest() {
        Expr left = andTest();
        if (!peek().isKeyword("or"))
            return left;
        List<Expr> values = new ArrayList<>();
        values.add(left);
        while (acceptKeyword("or"))
            values.add(andTest());
        return new BoolOp("or", values);
    }

    private Expr andTest() {
        Expr left = notTest();
        if (!peek().isKeyword("and"))
            return left;
        List<Expr> values = new ArrayList<>();
        values.add(left);
        while (acceptKeyword("and"))
            values.add(notTest());
        return new BoolOp("and", values);
    }

    private Expr notTest() {
        if (acceptKeyword("not"))
            return UnaryOp.not(notTest());
        return comparison();
    }

    private Expr comparison() {
        Expr left = expr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op;
            if (t.type() == Token.Type.OP && COMPARE.contains(t.text())) {
                next();
                op = t.text();
            } else if (t.isKeyword("in")) {
                next();
                op = "in";
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isKeyword("is")) {
                next();
                op = acceptKeyword("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            comparators.add(expr());
        }
        return ops.isEmpty() ? left : new Compare(left, ops, comparators);
    }

    private Expr expr() {
        return binary(0);
    }

    private static final String[][] BINARY_LEVELS = {
            { "|" }, { "^" }, { "&" }, { "<<", ">>" }, { "+", "-" }, { "*", "/", "//", "%", "@" } };

    private Expr binary(int level) {
        if (level == BINARY_LEVELS.length)
            return factor();
        Expr left = binary(level + 1);
        while (true) {
            Token t = peek();
            if (t.type() != Token.Type.OP || !contains(BINARY_LEVELS[level], t.text()))
                return left;
            next();
            left = new BinOp(left, t.text(), binary(level + 1));
        }
    }

    private Expr factor() {
        Token t = peek();
        if (t.isOp("-") || t.isOp("+") || t.isOp("~")) {
            next();
            Expr operand = factor();
            if (t.isOp("-") && operand instanceof Constant c && c.value() instanceof Number n)
                return Constant.of(n instanceof Long l ? (Object) (-l) : (Object) (-n.doubleValue()));
            return new UnaryOp(t.text(), operand);
        }
        return power();
    }

    private Expr power() {
        Expr base = awaitExpr();
        if (acceptOp("**"))
            return new BinOp(base, "**", factor());
        return base;
    }

    private Expr awaitExpr() {
        if (acceptKeyword("await"))
            return new Await(primary());
        return primary();
    }

    private Expr primary() {
        Expr e = atom();
        while (true) {
            if (acceptOp("(")) {
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                callArguments(args, keywords);
                expectOp(")");
                e = new Call(e, args, keywords);
            } else if (acceptOp("[")) {
                e = new Subscript(e, subscriptList());
                expectOp("]");
            } else if (acceptOp(".")) {
                e = new Attribute(e, identifier());
            } else {
                return e;
            }
        }
    }

    private void callArguments(List<Expr> args, List<Keyword> keywords) {
        while (!peek().isOp(")")) {
            if (acceptOp("**")) {
                keywords.add(new Keyword(null, test()));
            } else if (acceptOp("*")) {
                args.add(new Starred(test()));
            } else if (peek().type() == Token.Type.NAME && peekAt(1).isOp("=") && !isKeyword(peek().text())) {
                String name = next().text();
                next();
                keywords.add(new Keyword(name, test()));
            } else {
                Expr value = test();
                if (peek().isKeyword("for") || peek().isKeyword("async"))
                    value = new GeneratorExp(value, comprehensions());
                args.add(value);
            }
            if (!acceptOp(","))
                break;
        }
    }

    private Expr subscriptList() {
        Expr first = subscript();
        if (!peek().isOp(","))
            return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]"))
                break;
            elts.add(subscript());
        }
        return new TupleExpr(elts);
    }

    private Expr subscript() {
        Expr lower = null;
        if (!peek().isOp(":"))
            lower = test();
        if (!acceptOp(":"))
            return lower;
        Expr upper = null;
        Expr step = null;
        if (!peek().isOp(":") && !peek().isOp("]") && !peek().isOp(","))
            upper = test();
        if (acceptOp(":") && !peek().isOp("]") && !peek().isOp(","))
            step = test();
        return new Slice(lower, upper, step);
    }

    private Expr atom() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER:
                next();
                return Constant.of(t.value());
            case STRING: {
                StringBuilder sb = new StringBuilder();
                while (peek().type() == Token.Type.STRING)
                    sb.append((String) next().value());
                return Constant.of(sb.toString());
            }
            case NAME:
                switch (t.text()) {
                    case "True":
                        next();
                        return Constant.TRUE;
                    case "False":
                        next();
                        return Constant.FALSE;
                    case "None":
                        next();
                        return Constant.NONE;
                    default:
                        return new Name(identifier());
                }
            case OP:
                switch (t.text()) {
                    case "(":
                        return parenthesized();
                    case "[":
                        return listDisplay();
                    case "{":
                        return braceDisplay();
                    case "...":
                        next();
                        return new Name("...");
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw error("invalid syntax", t);
    }

    private Expr parenthesized() {
        next();
        if (acceptOp(")"))
            return new TupleExpr(List.of());
        if (peek().isKeyword("yield")) {
            Expr y = yieldExpr();
            expectOp(")");
            return y;
        }
        Expr first = sequenceItem(true, false);
        if (peek().isKeyword("for") || peek().isKeyword("async")) {
            Expr gen = new GeneratorExp(first, comprehensions());
            expectOp(")");
            return gen;
        }
        if (acceptOp(")"))
            return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp(")"))
                break;
            elts.add(sequenceItem(true, false));
        }
        expectOp(")");
        return new TupleExpr(elts);
    }

    private Expr listDisplay() {
        next();
        List<Expr> elts = new ArrayList<>();
        if (acceptOp("]"))
            return new ListExpr(elts);
        Expr first = sequenceItem(true, false);
        if (peek().isKeyword("for") || peek().isKeyword("async")) {
            Expr comp = new ListComp(first, comprehensions());
            expectOp("]");
            return comp;
        }
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]"))
                break;
            elts.add(sequenceItem(true, false));
        }
        expectOp("]");
        return new ListExpr(elts);
    }

    private Expr braceDisplay() {
        Token open = next();
        if (acceptOp("}"))
            return new DictExpr(List.of(), List.of());
        Expr first = test();
        if (acceptOp(":")) {
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            keys.add(first);
            values.add(test());
            if (peek().isKeyword("for"))
                throw error("dict comprehensions are not supported", open);
            while (acceptOp(",")) {
                if (peek().isOp("}"))
                    break;
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
            expectOp("}");
            return new DictExpr(keys, values);
        }
        if (peek().isKeyword("for"))
            throw error("set comprehensions are not supported", open);
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("}"))
                break;
            elts.add(test());
        }
        expectOp("}");
        return new SetExpr(elts);
    }

    private List<Comprehension> comprehensions() {
        List<Comprehension> generators = new ArrayList<>();
        while (peek().isKeyword("for") || peek().isKeyword("async")) {
            boolean isAsync = acceptKeyword("async");
            expectKeyword("for");
            Token start = peek();
            Expr target = exprList();
            checkTarget(target, start);
            expectKeyword("in");
            Expr iter = orTest();
            List<Expr> ifs = new ArrayList<>();
            while (acceptKeyword("if"))
                ifs.add(orTest());
            generators.add(new Comprehension(target, iter, ifs, isAsync));
        }
        return generators;
    }

    private void checkTarget(Expr target, Token at) {
        if (target instanceof Name n) {
            if (n.id().equals("..."))
                throw error("cannot assign to ellipsis", at);
            return;
        }
        if (target instanceof Attribute || target instanceof Subscript)
            return;
        if (target instanceof Starred s) {
            checkTarget(s.value(), at);
            return;
        }
        if (target instanceof TupleExpr t) {
            for (Expr e : t.elts())
                checkTarget(e, at);
            return;
        }
        if (target instanceof ListExpr l) {
            for (Expr e : l.elts())
                checkTarget(e, at);
            return;
        }
        throw error("cannot assign to " + target.kind().toLowerCase(), at);
    }

    private static List<Expr> flatten(Expr e) {
        return e instanceof TupleExpr t ? t.elts() : List.of(e);
    }

    // ── Token helpers ──────────────────────────────────────────────

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != Token.Type.EOF)
            pos++;
        return t;
    }

    private boolean acceptOp(String op) {
        if (peek().isOp(op)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!acceptOp(op))
            throw error("expected '" + op + "'", peek());
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword))
            throw error("expected '" + keyword + "'", peek());
    }

    private Token expect(Token.Type type, String what) {
        Token t = peek();
        if (t.type() != type)
            throw error("expected " + what, t);
        return next();
    }

    private String identifier() {
        Token t = peek();
        if (t.type() != Token.Type.NAME || isKeyword(t.text()))
            throw error("expected identifier", t);
        next();
        return t.text();
    }

    private String dottedName() {
        StringBuilder sb = new StringBuilder(identifier());
        while (acceptOp("."))
            sb.append('.').append(identifier());
        return sb.toString();
    }

    private void skipNewlines() {
        while (peek().type() == Token.Type.NEWLINE)
            pos++;
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.type() == Token.Type.NEWLINE || t.type() == Token.Type.EOF || t.isOp(";");
    }

    private boolean startsExpression() {
        Token t = peek();
        switch (t.type()) {
            case NAME:
                return !isKeyword(t.text()) || t.text().equals("True") || t.text().equals("False")
                        || t.text().equals("None") || t.text().equals("not") || t.text().equals("lambda")
                        || t.text().equals("await");
            case NUMBER:
            case STRING:
                return true;
            case OP:
                return EXPRESSION_OPENERS.contains(t.text());
            default:
                return false;
        }
    }

    private static boolean isKeyword(String s) {
        return KEYWORDS.contains(s);
    }

    private static boolean contains(String[] ops, String op) {
        for (String o : ops)
            if (o.equals(op))
                return true;
        return false;
    }

    private static SourceParseException error(String message, Token at) {
        String near = at.type() == Token.Type.EOF ? "end of input"
                : at.type() == Token.Type.NEWLINE ? "end of line"
                        : at.type() == Token.Type.INDENT ? "indent" : "'" + at.text() + "'";
        return new SourceParseException(message + " near " + near, at.line(), at.column());
    }
}
