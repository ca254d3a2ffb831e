package com.nodeflow.vgc.codegen;

import com.nodeflow.vgc.ast.Alias;
import com.nodeflow.vgc.ast.AnnAssign;
import com.nodeflow.vgc.ast.Arg;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assert;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.AugAssign;
import com.nodeflow.vgc.ast.Await;
import com.nodeflow.vgc.ast.BinOp;
import com.nodeflow.vgc.ast.BoolOp;
import com.nodeflow.vgc.ast.Break;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Comment;
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
import java.util.Map;
import java.util.StringJoiner;

/**
 * Canonical renderer from syntax tree to Python source.
 *
 * <p>
 * Output uses four-space indentation, one blank line before every nested or
 * top-level {@code def}/{@code class} that is not the first statement of its
 * block, and the minimal parentheses operator precedence requires. A docstring
 * (a leading string statement of a module, class or function) is written
 * triple-quoted.
 *
 * <p>
 * Throws {@link IllegalStateException} on a node it cannot render, including
 * null children; the code generator then falls back to
 * {@link FallbackRenderer}.
 */
public final class PythonUnparser {
    private static final String INDENT = "    ";

    // Operator precedence, loosest first.
    private static final int TUPLE = 0;
    private static final int YIELD = 1;
    private static final int TEST = 2;
    private static final int OR = 3;
    private static final int AND = 4;
    private static final int NOT = 5;
    private static final int CMP = 6;
    private static final int BOR = 7;
    private static final int BXOR = 8;
    private static final int BAND = 9;
    private static final int SHIFT = 10;
    private static final int ARITH = 11;
    private static final int TERM = 12;
    private static final int FACTOR = 13;
    private static final int POWER = 14;
    private static final int AWAIT = 15;
    private static final int ATOM = 16;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("|", BOR), Map.entry("^", BXOR), Map.entry("&", BAND),
            Map.entry("<<", SHIFT), Map.entry(">>", SHIFT),
            Map.entry("+", ARITH), Map.entry("-", ARITH),
            Map.entry("*", TERM), Map.entry("/", TERM), Map.entry("//", TERM), Map.entry("%", TERM),
            Map.entry("@", TERM), Map.entry("**", POWER));

    public String unparse(Module module) {
        if (module == null)
            throw new IllegalStateException("null module");
        List<String> lines = new ArrayList<>();
        block(module.body(), 0, lines, true);
        while (!lines.isEmpty() && lines.get(0).isEmpty())
            lines.remove(0);
        return String.join("\n", lines);
    }

    // ── Statements ─────────────────────────────────────────────────

    private void block(List<Stmt> body, int level, List<String> out, boolean allowEmpty) {
        boolean hasCode = false;
        for (int i = 0; i < body.size(); i++) {
            Stmt s = body.get(i);
            if (s == null)
                throw new IllegalStateException("null statement");
            if (i == 0 && s instanceof ExprStmt e && e.isStringLiteral()) {
                String text = (String) ((Constant) e.value()).value();
                out.add(pad(level) + PythonLiterals.docstring(text, pad(level)));
                hasCode = true;
                continue;
            }
            if (i > 0 && (s instanceof FunctionDef || s instanceof ClassDef))
                out.add("");
            statement(s, level, out);
            if (!(s instanceof Comment))
                hasCode = true;
        }
        if (!hasCode && !allowEmpty)
            out.add(pad(level) + "pass");
    }

    private void suite(List<Stmt> body, int level, List<String> out) {
        block(body, level, out, false);
    }

    private void statement(Stmt s, int level, List<String> out) {
        String p = pad(level);
        if (s instanceof Assign a) {
            StringBuilder sb = new StringBuilder(p);
            for (Expr t : a.targets())
                sb.append(expr(t, TUPLE)).append(" = ");
            out.add(sb.append(expr(a.value(), YIELD)).toString());
        } else if (s instanceof AugAssign a) {
            out.add(p + expr(a.target(), TUPLE) + " " + a.op() + "= " + expr(a.value(), YIELD));
        } else if (s instanceof AnnAssign a) {
            String line = p + expr(a.target(), TUPLE) + ": " + expr(a.annotation(), TEST);
            out.add(a.value() != null ? line + " = " + expr(a.value(), YIELD) : line);
        } else if (s instanceof ExprStmt e) {
            out.add(p + expr(e.value(), YIELD));
        } else if (s instanceof Comment c) {
            for (String line : c.text().split("\n", -1))
                out.add(line.isEmpty() ? p + "#" : p + "# " + line);
        } else if (s instanceof FunctionDef f) {
            decorators(f.decorators(), p, out);
            StringBuilder sb = new StringBuilder(p);
            if (f.isAsync())
                sb.append("async ");
            sb.append("def ").append(f.name()).append('(').append(arguments(f.args(), true)).append(')');
            if (f.returns() != null)
                sb.append(" -> ").append(expr(f.returns(), TEST));
            out.add(sb.append(':').toString());
            suite(f.body(), level + 1, out);
        } else if (s instanceof ClassDef c) {
            decorators(c.decorators(), p, out);
            StringJoiner bases = new StringJoiner(", ");
            for (Expr b : c.bases())
                bases.add(expr(b, TEST));
            for (Keyword k : c.keywords())
                bases.add(keyword(k));
            out.add(p + "class " + c.name() + (bases.length() > 0 ? "(" + bases + ")" : "") + ":");
            suite(c.body(), level + 1, out);
        } else if (s instanceof If i) {
            ifChain(i, level, out, "if ");
        } else if (s instanceof For f) {
            out.add(p + (f.isAsync() ? "async " : "") + "for " + expr(f.target(), TUPLE) + " in "
                    + expr(f.iter(), TUPLE) + ":");
            suite(f.body(), level + 1, out);
            orElse(f.orelse(), level, out);
        } else if (s instanceof While w) {
            out.add(p + "while " + expr(w.test(), TEST) + ":");
            suite(w.body(), level + 1, out);
            orElse(w.orelse(), level, out);
        } else if (s instanceof Try t) {
            out.add(p + "try:");
            suite(t.body(), level + 1, out);
            for (ExceptHandler h : t.handlers()) {
                StringBuilder sb = new StringBuilder(p).append("except");
                if (h.type() != null) {
                    sb.append(' ').append(expr(h.type(), TEST));
                    if (h.name() != null)
                        sb.append(" as ").append(h.name());
                }
                out.add(sb.append(':').toString());
                suite(h.body(), level + 1, out);
            }
            orElse(t.orelse(), level, out);
            if (!t.finalbody().isEmpty()) {
                out.add(p + "finally:");
                suite(t.finalbody(), level + 1, out);
            }
        } else if (s instanceof With w) {
            StringJoiner items = new StringJoiner(", ");
            for (WithItem item : w.items())
                items.add(expr(item.contextExpr(), TEST)
                        + (item.optionalVars() != null ? " as " + expr(item.optionalVars(), BOR) : ""));
            out.add(p + (w.isAsync() ? "async " : "") + "with " + items + ":");
            suite(w.body(), level + 1, out);
        } else if (s instanceof Return r) {
            out.add(r.value() != null ? p + "return " + expr(r.value(), TUPLE) : p + "return");
        } else if (s instanceof Raise r) {
            StringBuilder sb = new StringBuilder(p).append("raise");
            if (r.exc() != null) {
                sb.append(' ').append(expr(r.exc(), TEST));
                if (r.cause() != null)
                    sb.append(" from ").append(expr(r.cause(), TEST));
            }
            out.add(sb.toString());
        } else if (s instanceof Pass) {
            out.add(p + "pass");
        } else if (s instanceof Break) {
            out.add(p + "break");
        } else if (s instanceof Continue) {
            out.add(p + "continue");
        } else if (s instanceof Import im) {
            out.add(p + "import " + aliases(im.names()));
        } else if (s instanceof ImportFrom im) {
            out.add(p + "from " + ".".repeat(im.level()) + im.module() + " import " + aliases(im.names()));
        } else if (s instanceof Assert a) {
            out.add(p + "assert " + expr(a.test(), TEST) + (a.msg() != null ? ", " + expr(a.msg(), TEST) : ""));
        } else if (s instanceof Delete d) {
            StringJoiner targets = new StringJoiner(", ");
            for (Expr t : d.targets())
                targets.add(expr(t, BOR));
            out.add(p + "del " + targets);
        } else if (s instanceof Global g) {
            out.add(p + (g.nonlocal() ? "nonlocal " : "global ") + String.join(", ", g.names()));
        } else {
            throw new IllegalStateException("Cannot render statement " + s.kind());
        }
    }

    private void ifChain(If i, int level, List<String> out, String keyword) {
        out.add(pad(level) + keyword + expr(i.test(), TEST) + ":");
        suite(i.body(), level + 1, out);
        if (i.orelse().size() == 1 && i.orelse().get(0) instanceof If elif)
            ifChain(elif, level, out, "elif ");
        else
            orElse(i.orelse(), level, out);
    }

    private void orElse(List<Stmt> orelse, int level, List<String> out) {
        if (orelse.isEmpty())
            return;
        out.add(pad(level) + "else:");
        suite(orelse, level + 1, out);
    }

    private void decorators(List<Expr> decorators, String p, List<String> out) {
        for (Expr d : decorators)
            out.add(p + "@" + expr(d, TEST));
    }

    private static String aliases(List<Alias> names) {
        StringJoiner j = new StringJoiner(", ");
        for (Alias a : names)
            j.add(a.asName() != null ? a.name() + " as " + a.asName() : a.name());
        return j.toString();
    }

    private String arguments(Arguments args, boolean annotations) {
        StringJoiner j = new StringJoiner(", ");
        for (Arg a : args.args())
            j.add(arg(a, annotations));
        if (args.vararg() != null)
            j.add("*" + arg(args.vararg(), annotations));
        else if (!args.kwonlyargs().isEmpty())
            j.add("*");
        for (Arg a : args.kwonlyargs())
            j.add(arg(a, annotations));
        if (args.kwarg() != null)
            j.add("**" + arg(args.kwarg(), annotations));
        return j.toString();
    }

    private String arg(Arg a, boolean annotations) {
        StringBuilder sb = new StringBuilder(a.name());
        boolean annotated = annotations && a.annotation() != null;
        if (annotated)
            sb.append(": ").append(expr(a.annotation(), TEST));
        if (a.defaultValue() != null)
            sb.append(annotated ? " = " : "=").append(expr(a.defaultValue(), TEST));
        return sb.toString();
    }

    // ── Expressions ────────────────────────────────────────────────

    private String expr(Expr e, int context) {
        if (e == null)
            throw new IllegalStateException("null expression");
        int own = precedence(e);
        String text = render(e);
        return own < context ? "(" + text + ")" : text;
    }

    private int precedence(Expr e) {
        if (e instanceof TupleExpr t)
            return t.elts().isEmpty() ? ATOM : TUPLE;
        if (e instanceof Yield || e instanceof YieldFrom)
            return YIELD;
        if (e instanceof IfExp || e instanceof Lambda)
            return TEST;
        if (e instanceof BoolOp b)
            return b.op().equals("or") ? OR : AND;
        if (e instanceof UnaryOp u)
            return u.op().equals("not") ? NOT : FACTOR;
        if (e instanceof Compare)
            return CMP;
        if (e instanceof BinOp b)
            return binaryPrecedence(b.op());
        if (e instanceof Await)
            return AWAIT;
        if (e instanceof Constant c && c.value() instanceof Number n && n.doubleValue() < 0)
            return FACTOR;
        if (e instanceof Starred)
            return BOR;
        return ATOM;
    }

    private static int binaryPrecedence(String op) {
        Integer p = BINARY_PRECEDENCE.get(op);
        if (p == null)
            throw new IllegalStateException("Unknown binary operator " + op);
        return p;
    }

    private String render(Expr e) {
        if (e instanceof Name n)
            return n.id();
        if (e instanceof Constant c)
            return PythonLiterals.repr(c.value());
        if (e instanceof Attribute a) {
            String base = expr(a.value(), ATOM);
            if (a.value() instanceof Constant c && c.value() instanceof Long)
                base = "(" + base + ")";
            return base + "." + a.attr();
        }
        if (e instanceof Call c) {
            StringJoiner j = new StringJoiner(", ");
            if (c.args().size() == 1 && c.keywords().isEmpty() && c.args().get(0) instanceof GeneratorExp g)
                return expr(c.func(), ATOM) + "(" + comprehension(g.elt(), g.generators()) + ")";
            for (Expr a : c.args())
                j.add(expr(a, TEST));
            for (Keyword k : c.keywords())
                j.add(keyword(k));
            return expr(c.func(), ATOM) + "(" + j + ")";
        }
        if (e instanceof Starred s)
            return "*" + expr(s.value(), BOR);
        if (e instanceof UnaryOp u) {
            if (u.op().equals("not"))
                return "not " + expr(u.operand(), NOT);
            return u.op() + expr(u.operand(), FACTOR);
        }
        if (e instanceof BinOp b) {
            int p = binaryPrecedence(b.op());
            boolean rightAssoc = b.op().equals("**");
            return expr(b.left(), rightAssoc ? p + 1 : p) + " " + b.op() + " "
                    + expr(b.right(), rightAssoc ? FACTOR : p + 1);
        }
        if (e instanceof BoolOp b) {
            int p = b.op().equals("or") ? OR : AND;
            StringJoiner j = new StringJoiner(" " + b.op() + " ");
            for (Expr v : b.values())
                j.add(expr(v, p + 1));
            return j.toString();
        }
        if (e instanceof Compare c) {
            StringBuilder sb = new StringBuilder(expr(c.left(), CMP + 1));
            for (int i = 0; i < c.ops().size(); i++)
                sb.append(' ').append(c.ops().get(i)).append(' ').append(expr(c.comparators().get(i), CMP + 1));
            return sb.toString();
        }
        if (e instanceof IfExp i)
            return expr(i.body(), OR) + " if " + expr(i.test(), OR) + " else " + expr(i.orelse(), TEST);
        if (e instanceof Lambda l) {
            String params = arguments(l.args(), false);
            return "lambda" + (params.isEmpty() ? "" : " " + params) + ": " + expr(l.body(), TEST);
        }
        if (e instanceof ListExpr l)
            return "[" + elements(l.elts()) + "]";
        if (e instanceof SetExpr s)
            return "{" + elements(s.elts()) + "}";
        if (e instanceof TupleExpr t) {
            if (t.elts().isEmpty())
                return "()";
            String inner = elements(t.elts());
            return t.elts().size() == 1 ? inner + "," : inner;
        }
        if (e instanceof DictExpr d) {
            StringJoiner j = new StringJoiner(", ");
            for (int i = 0; i < d.keys().size(); i++)
                j.add(expr(d.keys().get(i), TEST) + ": " + expr(d.values().get(i), TEST));
            return "{" + j + "}";
        }
        if (e instanceof Subscript s)
            return expr(s.value(), ATOM) + "[" + slice(s.slice()) + "]";
        if (e instanceof Slice s)
            return slice(s);
        if (e instanceof ListComp l)
            return "[" + comprehension(l.elt(), l.generators()) + "]";
        if (e instanceof GeneratorExp g)
            return "(" + comprehension(g.elt(), g.generators()) + ")";
        if (e instanceof Await a)
            return "await " + expr(a.value(), ATOM);
        if (e instanceof Yield y)
            return y.value() != null ? "yield " + expr(y.value(), TUPLE) : "yield";
        if (e instanceof YieldFrom y)
            return "yield from " + expr(y.value(), TEST);
        throw new IllegalStateException("Cannot render expression " + e.kind());
    }

    private String elements(List<Expr> elts) {
        StringJoiner j = new StringJoiner(", ");
        for (Expr x : elts)
            j.add(expr(x, TEST));
        return j.toString();
    }

    private String keyword(Keyword k) {
        return k.arg() == null ? "**" + expr(k.value(), TEST) : k.arg() + "=" + expr(k.value(), TEST);
    }

    private String slice(Expr e) {
        if (e instanceof Slice s) {
            StringBuilder sb = new StringBuilder();
            if (s.lower() != null)
                sb.append(expr(s.lower(), TEST));
            sb.append(':');
            if (s.upper() != null)
                sb.append(expr(s.upper(), TEST));
            if (s.step() != null)
                sb.append(':').append(expr(s.step(), TEST));
            return sb.toString();
        }
        if (e instanceof TupleExpr t && !t.elts().isEmpty()) {
            StringJoiner j = new StringJoiner(", ");
            for (Expr x : t.elts())
                j.add(slice(x));
            return t.elts().size() == 1 ? j + "," : j.toString();
        }
        return expr(e, TUPLE);
    }

    private String comprehension(Expr elt, List<Comprehension> generators) {
        StringBuilder sb = new StringBuilder(expr(elt, TEST));
        for (Comprehension c : generators) {
            sb.append(c.isAsync() ? " async for " : " for ").append(expr(c.target(), TUPLE))
                    .append(" in ").append(expr(c.iter(), OR));
            for (Expr cond : c.ifs())
                sb.append(" if ").append(expr(cond, OR));
        }
        return sb.toString();
    }

    private static String pad(int level) {
        return INDENT.repeat(level);
    }

    /** Renders one expression on its own, as it would appear in a statement. */
    public String expression(Expr e) {
        return expr(e, YIELD);
    }

    /** Renders one node: a module, statement or expression. */
    public String render(AstNode node) {
        if (node instanceof Module m)
            return unparse(m);
        if (node instanceof Stmt s) {
            List<String> lines = new ArrayList<>();
            statement(s, 0, lines);
            return String.join("\n", lines);
        }
        if (node instanceof Expr e)
            return expression(e);
        throw new IllegalStateException("Cannot render " + (node == null ? "null" : node.kind()));
    }
}
