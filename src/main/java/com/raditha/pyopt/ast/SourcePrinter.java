package com.raditha.pyopt.ast;

import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Await;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.BoolOp;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Compare;
import com.raditha.pyopt.ast.expr.Comprehension;
import com.raditha.pyopt.ast.expr.ComprehensionClause;
import com.raditha.pyopt.ast.expr.ComprehensionKind;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.ConstantKind;
import com.raditha.pyopt.ast.expr.DictExpr;
import com.raditha.pyopt.ast.expr.IfExp;
import com.raditha.pyopt.ast.expr.Keyword;
import com.raditha.pyopt.ast.expr.Lambda;
import com.raditha.pyopt.ast.expr.ListExpr;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.NamedExpr;
import com.raditha.pyopt.ast.expr.Precedence;
import com.raditha.pyopt.ast.expr.SetExpr;
import com.raditha.pyopt.ast.expr.Slice;
import com.raditha.pyopt.ast.expr.Starred;
import com.raditha.pyopt.ast.expr.Subscript;
import com.raditha.pyopt.ast.expr.TupleExpr;
import com.raditha.pyopt.ast.expr.UnaryOp;
import com.raditha.pyopt.ast.expr.UnaryOperator;
import com.raditha.pyopt.ast.expr.Yield;
import com.raditha.pyopt.ast.pattern.MatchAs;
import com.raditha.pyopt.ast.pattern.MatchClass;
import com.raditha.pyopt.ast.pattern.MatchMapping;
import com.raditha.pyopt.ast.pattern.MatchOr;
import com.raditha.pyopt.ast.pattern.MatchSequence;
import com.raditha.pyopt.ast.pattern.MatchSingleton;
import com.raditha.pyopt.ast.pattern.MatchStar;
import com.raditha.pyopt.ast.pattern.MatchValue;
import com.raditha.pyopt.ast.stmt.Alias;
import com.raditha.pyopt.ast.stmt.AnnAssign;
import com.raditha.pyopt.ast.stmt.Assert;
import com.raditha.pyopt.ast.stmt.Assign;
import com.raditha.pyopt.ast.stmt.AugAssign;
import com.raditha.pyopt.ast.stmt.Break;
import com.raditha.pyopt.ast.stmt.ClassDef;
import com.raditha.pyopt.ast.stmt.Continue;
import com.raditha.pyopt.ast.stmt.Delete;
import com.raditha.pyopt.ast.stmt.ExceptHandler;
import com.raditha.pyopt.ast.stmt.ExprStmt;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.FunctionDef;
import com.raditha.pyopt.ast.stmt.Global;
import com.raditha.pyopt.ast.stmt.If;
import com.raditha.pyopt.ast.stmt.Import;
import com.raditha.pyopt.ast.stmt.ImportFrom;
import com.raditha.pyopt.ast.stmt.Match;
import com.raditha.pyopt.ast.stmt.MatchCase;
import com.raditha.pyopt.ast.stmt.Pass;
import com.raditha.pyopt.ast.stmt.Raise;
import com.raditha.pyopt.ast.stmt.Return;
import com.raditha.pyopt.ast.stmt.Try;
import com.raditha.pyopt.ast.stmt.While;
import com.raditha.pyopt.ast.stmt.With;
import com.raditha.pyopt.ast.stmt.WithItem;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Regenerates Python source from a syntax tree.
 * <p>
 * Layout is rebuilt from scratch: four-space indentation, two blank lines
 * around top-level definitions and one around nested ones. Parentheses are
 * inserted only where operator precedence requires them. Comments and the
 * original formatting are not preserved.
 * <p>
 * The visitor argument means different things for each node family: for
 * statements and {@code case} clauses it is the indentation level, for
 * expressions it is the weakest {@link Precedence} the surrounding context
 * accepts without parentheses, and for patterns it is {@link #ALTERNATIVE}
 * when the pattern is an operand of {@code |} or {@code as}.
 */
public class SourcePrinter implements NodeVisitor<String, Integer> {

    private static final String INDENT = "    ";

    private static final int STANDALONE = 0;
    private static final int ALTERNATIVE = 1;

    /**
     * Print a whole module or statement as source lines.
     */
    public static String print(Node node) {
        if (node instanceof Expr expr) {
            return printExpression(expr);
        }
        return node.accept(new SourcePrinter(), 0);
    }

    /**
     * Print an expression the way it would appear as a statement on its own.
     */
    public static String printExpression(Expr expr) {
        return expr.accept(new SourcePrinter(), Precedence.YIELD);
    }

    // ---------------------------------------------------------------- blocks

    @Override
    public String visit(Module n, Integer indent) {
        return n.body().isEmpty() ? "" : block(n.body(), 0);
    }

    private String block(List<Stmt> body, int indent) {
        if (body.isEmpty()) {
            return INDENT.repeat(indent) + "pass\n";
        }
        StringBuilder sb = new StringBuilder();
        String blankLines = indent == 0 ? "\n\n" : "\n";
        Stmt previous = null;
        for (Stmt stmt : body) {
            if (previous != null && (isDefinition(stmt) || isDefinition(previous))) {
                sb.append(blankLines);
            }
            sb.append(stmt.accept(this, indent));
            previous = stmt;
        }
        return sb.toString();
    }

    private static boolean isDefinition(Stmt stmt) {
        return stmt instanceof FunctionDef || stmt instanceof ClassDef;
    }

    private static String line(int indent, String text) {
        return INDENT.repeat(indent) + text + "\n";
    }

    private String header(int indent, String text, List<Stmt> body) {
        return line(indent, text + ":") + block(body, indent + 1);
    }

    // ---------------------------------------------------------------- statements

    @Override
    public String visit(FunctionDef n, Integer indent) {
        StringBuilder sb = new StringBuilder();
        for (Expr decorator : n.decorators()) {
            sb.append(line(indent, "@" + expr(decorator, Precedence.LAMBDA)));
        }
        String signature = (n.isAsync() ? "async def " : "def ") + n.name() + "(" + parameters(n.parameters()) + ")";
        if (n.returns() != null) {
            signature += " -> " + expr(n.returns(), Precedence.LAMBDA);
        }
        return sb.append(header(indent, signature, n.body())).toString();
    }

    @Override
    public String visit(ClassDef n, Integer indent) {
        StringBuilder sb = new StringBuilder();
        for (Expr decorator : n.decorators()) {
            sb.append(line(indent, "@" + expr(decorator, Precedence.LAMBDA)));
        }
        String heading = "class " + n.name();
        if (!n.bases().isEmpty() || !n.keywords().isEmpty()) {
            heading += "(" + arguments(n.bases(), n.keywords()) + ")";
        }
        return sb.append(header(indent, heading, n.body())).toString();
    }

    @Override
    public String visit(For n, Integer indent) {
        String text = header(indent, (n.isAsync() ? "async for " : "for ") + expr(n.target(), Precedence.TUPLE) + " in "
                + expr(n.iter(), Precedence.TUPLE), n.body());
        return n.orelse().isEmpty() ? text : text + header(indent, "else", n.orelse());
    }

    @Override
    public String visit(While n, Integer indent) {
        String text = header(indent, "while " + expr(n.test(), Precedence.LAMBDA), n.body());
        return n.orelse().isEmpty() ? text : text + header(indent, "else", n.orelse());
    }

    @Override
    public String visit(If n, Integer indent) {
        return ifChain(n, indent, "if");
    }

    private String ifChain(If n, int indent, String keyword) {
        StringBuilder sb = new StringBuilder(header(indent, keyword + " " + expr(n.test(), Precedence.LAMBDA), n.body()));
        if (n.hasElif()) {
            sb.append(ifChain((If) n.orelse().get(0), indent, "elif"));
        } else if (!n.orelse().isEmpty()) {
            sb.append(header(indent, "else", n.orelse()));
        }
        return sb.toString();
    }

    @Override
    public String visit(Try n, Integer indent) {
        StringBuilder sb = new StringBuilder(header(indent, "try", n.body()));
        for (ExceptHandler handler : n.handlers()) {
            sb.append(handler(handler, indent, n.isStar() ? "except*" : "except"));
        }
        if (!n.orelse().isEmpty()) {
            sb.append(header(indent, "else", n.orelse()));
        }
        if (!n.finalbody().isEmpty()) {
            sb.append(header(indent, "finally", n.finalbody()));
        }
        return sb.toString();
    }

    @Override
    public String visit(ExceptHandler n, Integer indent) {
        return handler(n, indent, "except");
    }

    private String handler(ExceptHandler n, int indent, String keyword) {
        String text = keyword;
        if (n.type() != null) {
            text += " " + expr(n.type(), Precedence.LAMBDA);
            if (n.name() != null) {
                text += " as " + n.name();
            }
        }
        return header(indent, text, n.body());
    }

    @Override
    public String visit(With n, Integer indent) {
        List<String> items = new ArrayList<>();
        for (WithItem item : n.items()) {
            String text = expr(item.context(), Precedence.LAMBDA);
            if (item.optionalVars() != null) {
                text += " as " + expr(item.optionalVars(), Precedence.ATOM);
            }
            items.add(text);
        }
        return header(indent, (n.isAsync() ? "async with " : "with ") + String.join(", ", items), n.body());
    }

    @Override
    public String visit(Match n, Integer indent) {
        StringBuilder sb = new StringBuilder(line(indent, "match " + expr(n.subject(), Precedence.TUPLE) + ":"));
        for (MatchCase matchCase : n.cases()) {
            sb.append(matchCase.accept(this, indent + 1));
        }
        return sb.toString();
    }

    @Override
    public String visit(MatchCase n, Integer indent) {
        String text = "case " + pattern(n.pattern(), STANDALONE);
        if (n.guard() != null) {
            text += " if " + expr(n.guard(), Precedence.LAMBDA);
        }
        return header(indent, text, n.body());
    }

    @Override
    public String visit(Assign n, Integer indent) {
        StringBuilder sb = new StringBuilder();
        for (Expr target : n.targets()) {
            sb.append(expr(target, Precedence.TUPLE)).append(" = ");
        }
        sb.append(expr(n.value(), Precedence.YIELD));
        return line(indent, sb.toString());
    }

    @Override
    public String visit(AugAssign n, Integer indent) {
        return line(indent, expr(n.target(), Precedence.TUPLE) + " " + n.op().symbol() + "= "
                + expr(n.value(), Precedence.YIELD));
    }

    @Override
    public String visit(AnnAssign n, Integer indent) {
        String text = expr(n.target(), Precedence.ATOM) + ": " + expr(n.annotation(), Precedence.LAMBDA);
        if (n.value() != null) {
            text += " = " + expr(n.value(), Precedence.YIELD);
        }
        return line(indent, text);
    }

    @Override
    public String visit(ExprStmt n, Integer indent) {
        return line(indent, expr(n.value(), Precedence.YIELD));
    }

    @Override
    public String visit(Return n, Integer indent) {
        return line(indent, n.value() == null ? "return" : "return " + expr(n.value(), Precedence.TUPLE));
    }

    @Override
    public String visit(Pass n, Integer indent) {
        return line(indent, "pass");
    }

    @Override
    public String visit(Break n, Integer indent) {
        return line(indent, "break");
    }

    @Override
    public String visit(Continue n, Integer indent) {
        return line(indent, "continue");
    }

    @Override
    public String visit(Import n, Integer indent) {
        return line(indent, "import " + aliases(n.names()));
    }

    @Override
    public String visit(ImportFrom n, Integer indent) {
        String module = ".".repeat(n.level()) + (n.module() == null ? "" : n.module());
        return line(indent, "from " + module + " import " + aliases(n.names()));
    }

    private static String aliases(List<Alias> names) {
        return names.stream()
                .map(a -> a.asname() == null ? a.name() : a.name() + " as " + a.asname())
                .collect(Collectors.joining(", "));
    }

    @Override
    public String visit(Raise n, Integer indent) {
        String text = "raise";
        if (n.exception() != null) {
            text += " " + expr(n.exception(), Precedence.LAMBDA);
            if (n.cause() != null) {
                text += " from " + expr(n.cause(), Precedence.LAMBDA);
            }
        }
        return line(indent, text);
    }

    @Override
    public String visit(Global n, Integer indent) {
        return line(indent, (n.nonlocal() ? "nonlocal " : "global ") + String.join(", ", n.names()));
    }

    @Override
    public String visit(Delete n, Integer indent) {
        return line(indent, "del " + exprs(n.targets(), Precedence.BIT_OR));
    }

    @Override
    public String visit(Assert n, Integer indent) {
        String text = "assert " + expr(n.test(), Precedence.LAMBDA);
        if (n.message() != null) {
            text += ", " + expr(n.message(), Precedence.LAMBDA);
        }
        return line(indent, text);
    }

    // ---------------------------------------------------------------- expressions

    private String expr(Expr e, int context) {
        return e.accept(this, context);
    }

    private String exprs(List<Expr> list, int context) {
        return list.stream().map(e -> expr(e, context)).collect(Collectors.joining(", "));
    }

    private static String wrap(String text, int own, int context) {
        return own < context ? "(" + text + ")" : text;
    }

    @Override
    public String visit(Name n, Integer context) {
        return n.id();
    }

    @Override
    public String visit(Constant n, Integer context) {
        return n.literal();
    }

    @Override
    public String visit(BinOp n, Integer context) {
        int own = n.op().precedence();
        String left;
        String right;
        if (n.op() == BinaryOperator.POW) {
            left = expr(n.left(), Precedence.POWER + 1);
            right = expr(n.right(), Precedence.UNARY);
        } else {
            left = expr(n.left(), own);
            right = expr(n.right(), own + 1);
        }
        return wrap(left + " " + n.op().symbol() + " " + right, own, context);
    }

    @Override
    public String visit(UnaryOp n, Integer context) {
        int own = n.op().precedence();
        String operand = expr(n.operand(), own);
        if (n.op() == UnaryOperator.NOT) {
            return wrap("not " + operand, own, context);
        }
        return wrap(n.op().symbol() + operand, own, context);
    }

    @Override
    public String visit(BoolOp n, Integer context) {
        int own = n.op().precedence();
        String text = n.values().stream()
                .map(v -> expr(v, own + 1))
                .collect(Collectors.joining(" " + n.op().keyword() + " "));
        return wrap(text, own, context);
    }

    @Override
    public String visit(Compare n, Integer context) {
        StringBuilder sb = new StringBuilder(expr(n.left(), Precedence.COMPARE + 1));
        for (int i = 0; i < n.ops().size(); i++) {
            sb.append(' ').append(n.ops().get(i).symbol()).append(' ')
                    .append(expr(n.comparators().get(i), Precedence.COMPARE + 1));
        }
        return wrap(sb.toString(), Precedence.COMPARE, context);
    }

    @Override
    public String visit(Call n, Integer context) {
        String func = expr(n.func(), Precedence.ATOM);
        if (n.args().size() == 1 && n.keywords().isEmpty()
                && n.args().get(0) instanceof Comprehension c
                && c.comprehensionKind() == ComprehensionKind.GENERATOR) {
            return func + expr(c, Precedence.ATOM);
        }
        return func + "(" + arguments(n.args(), n.keywords()) + ")";
    }

    private String arguments(List<Expr> args, List<Keyword> keywords) {
        List<String> parts = new ArrayList<>();
        for (Expr arg : args) {
            parts.add(expr(arg, Precedence.LAMBDA));
        }
        for (Keyword keyword : keywords) {
            String value = expr(keyword.value(), Precedence.LAMBDA);
            parts.add(keyword.arg() == null ? "**" + value : keyword.arg() + "=" + value);
        }
        return String.join(", ", parts);
    }

    private String parameters(List<Parameter> parameters) {
        List<String> parts = new ArrayList<>();
        for (Parameter p : parameters) {
            String text = switch (p.kind()) {
                case NORMAL -> p.name();
                case VAR_POSITIONAL -> "*" + p.name();
                case VAR_KEYWORD -> "**" + p.name();
                case KEYWORD_ONLY_MARKER -> "*";
                case POSITIONAL_ONLY_MARKER -> "/";
            };
            if (p.annotation() != null) {
                text += ": " + expr(p.annotation(), Precedence.LAMBDA);
            }
            if (p.defaultValue() != null) {
                String separator = p.annotation() != null ? " = " : "=";
                text += separator + expr(p.defaultValue(), Precedence.LAMBDA);
            }
            parts.add(text);
        }
        return String.join(", ", parts);
    }

    @Override
    public String visit(Attribute n, Integer context) {
        String value = expr(n.value(), Precedence.ATOM);
        if (n.value() instanceof Constant c && c.constantKind() == ConstantKind.INTEGER) {
            // 1.real would lex as a float
            value = "(" + value + ")";
        }
        return value + "." + n.attr();
    }

    @Override
    public String visit(Subscript n, Integer context) {
        String slice;
        if (n.slice() instanceof TupleExpr tuple && !tuple.elements().isEmpty()) {
            slice = exprs(tuple.elements(), Precedence.LAMBDA);
            if (tuple.elements().size() == 1) {
                slice += ",";
            }
        } else {
            slice = expr(n.slice(), Precedence.TUPLE);
        }
        return expr(n.value(), Precedence.ATOM) + "[" + slice + "]";
    }

    @Override
    public String visit(Slice n, Integer context) {
        StringBuilder sb = new StringBuilder();
        if (n.lower() != null) {
            sb.append(expr(n.lower(), Precedence.IF_EXP));
        }
        sb.append(':');
        if (n.upper() != null) {
            sb.append(expr(n.upper(), Precedence.IF_EXP));
        }
        if (n.step() != null) {
            sb.append(':').append(expr(n.step(), Precedence.IF_EXP));
        }
        return sb.toString();
    }

    @Override
    public String visit(TupleExpr n, Integer context) {
        if (n.elements().isEmpty()) {
            return "()";
        }
        if (n.elements().size() == 1) {
            return "(" + expr(n.elements().get(0), Precedence.LAMBDA) + ",)";
        }
        return wrap(exprs(n.elements(), Precedence.LAMBDA), Precedence.TUPLE, context);
    }

    @Override
    public String visit(ListExpr n, Integer context) {
        return "[" + exprs(n.elements(), Precedence.LAMBDA) + "]";
    }

    @Override
    public String visit(SetExpr n, Integer context) {
        if (n.elements().isEmpty()) {
            return "set()";
        }
        return "{" + exprs(n.elements(), Precedence.LAMBDA) + "}";
    }

    @Override
    public String visit(DictExpr n, Integer context) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < n.keys().size(); i++) {
            Expr key = n.keys().get(i);
            if (key == null) {
                entries.add("**" + expr(n.values().get(i), Precedence.BIT_OR));
            } else {
                entries.add(expr(key, Precedence.LAMBDA) + ": " + expr(n.values().get(i), Precedence.LAMBDA));
            }
        }
        return "{" + String.join(", ", entries) + "}";
    }

    @Override
    public String visit(Comprehension n, Integer context) {
        StringBuilder sb = new StringBuilder(n.comprehensionKind().open());
        sb.append(expr(n.element(), Precedence.LAMBDA));
        if (n.value() != null) {
            sb.append(": ").append(expr(n.value(), Precedence.LAMBDA));
        }
        for (ComprehensionClause clause : n.generators()) {
            sb.append(clause.isAsync() ? " async for " : " for ").append(expr(clause.target(), Precedence.TUPLE))
                    .append(" in ").append(expr(clause.iter(), Precedence.OR));
            for (Expr condition : clause.conditions()) {
                sb.append(" if ").append(expr(condition, Precedence.OR));
            }
        }
        return sb.append(n.comprehensionKind().close()).toString();
    }

    @Override
    public String visit(IfExp n, Integer context) {
        String text = expr(n.body(), Precedence.OR) + " if " + expr(n.test(), Precedence.OR)
                + " else " + expr(n.orelse(), Precedence.IF_EXP);
        return wrap(text, Precedence.IF_EXP, context);
    }

    @Override
    public String visit(Lambda n, Integer context) {
        String params = parameters(n.parameters());
        String text = "lambda" + (params.isEmpty() ? "" : " " + params) + ": " + expr(n.body(), Precedence.LAMBDA);
        return wrap(text, Precedence.LAMBDA, context);
    }

    @Override
    public String visit(Starred n, Integer context) {
        return "*" + expr(n.value(), Precedence.BIT_OR);
    }

    @Override
    public String visit(Yield n, Integer context) {
        String text;
        if (n.delegating()) {
            text = "yield from " + expr(n.value(), Precedence.LAMBDA);
        } else if (n.value() == null) {
            text = "yield";
        } else {
            text = "yield " + expr(n.value(), Precedence.TUPLE);
        }
        return wrap(text, Precedence.YIELD, context);
    }

    /**
     * Always parenthesized: a bare {@code :=} is only legal in a few
     * positions, and the parentheses are legal in all of them.
     */
    @Override
    public String visit(NamedExpr n, Integer context) {
        return "(" + n.target().id() + " := " + expr(n.value(), Precedence.LAMBDA) + ")";
    }

    @Override
    public String visit(Await n, Integer context) {
        return wrap("await " + expr(n.value(), Precedence.ATOM), Precedence.AWAIT, context);
    }

    // ---------------------------------------------------------------- patterns

    private String pattern(Pattern p, int context) {
        return p.accept(this, context);
    }

    private String patterns(List<Pattern> list) {
        return list.stream().map(p -> pattern(p, STANDALONE)).collect(Collectors.joining(", "));
    }

    @Override
    public String visit(MatchValue n, Integer context) {
        return expr(n.value(), Precedence.BIT_OR);
    }

    @Override
    public String visit(MatchSingleton n, Integer context) {
        return n.value().literal();
    }

    @Override
    public String visit(MatchSequence n, Integer context) {
        return "[" + patterns(n.patterns()) + "]";
    }

    @Override
    public String visit(MatchMapping n, Integer context) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < n.keys().size(); i++) {
            entries.add(expr(n.keys().get(i), Precedence.BIT_OR) + ": " + pattern(n.patterns().get(i), STANDALONE));
        }
        if (n.rest() != null) {
            entries.add("**" + n.rest());
        }
        return "{" + String.join(", ", entries) + "}";
    }

    @Override
    public String visit(MatchClass n, Integer context) {
        List<String> parts = new ArrayList<>();
        for (Pattern p : n.patterns()) {
            parts.add(pattern(p, STANDALONE));
        }
        for (int i = 0; i < n.kwdAttrs().size(); i++) {
            parts.add(n.kwdAttrs().get(i) + "=" + pattern(n.kwdPatterns().get(i), STANDALONE));
        }
        return expr(n.cls(), Precedence.ATOM) + "(" + String.join(", ", parts) + ")";
    }

    @Override
    public String visit(MatchStar n, Integer context) {
        return "*" + (n.name() == null ? "_" : n.name());
    }

    @Override
    public String visit(MatchAs n, Integer context) {
        if (n.pattern() == null) {
            return n.name() == null ? "_" : n.name();
        }
        String text = pattern(n.pattern(), ALTERNATIVE) + " as " + n.name();
        return context == ALTERNATIVE ? "(" + text + ")" : text;
    }

    @Override
    public String visit(MatchOr n, Integer context) {
        String text = n.patterns().stream()
                .map(p -> pattern(p, ALTERNATIVE))
                .collect(Collectors.joining(" | "));
        return context == ALTERNATIVE ? "(" + text + ")" : text;
    }
}
