package com.raditha.pyopt.ast;

import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Await;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BoolOp;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Compare;
import com.raditha.pyopt.ast.expr.CompareOperator;
import com.raditha.pyopt.ast.expr.Comprehension;
import com.raditha.pyopt.ast.expr.ComprehensionClause;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.DictExpr;
import com.raditha.pyopt.ast.expr.IfExp;
import com.raditha.pyopt.ast.expr.Keyword;
import com.raditha.pyopt.ast.expr.Lambda;
import com.raditha.pyopt.ast.expr.ListExpr;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.NamedExpr;
import com.raditha.pyopt.ast.expr.SetExpr;
import com.raditha.pyopt.ast.expr.Slice;
import com.raditha.pyopt.ast.expr.Starred;
import com.raditha.pyopt.ast.expr.Subscript;
import com.raditha.pyopt.ast.expr.TupleExpr;
import com.raditha.pyopt.ast.expr.UnaryOp;
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
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural dump of a node using Python's {@code ast} class and field names,
 * e.g. {@code BinOp(left=Name(id='i'), op=Add(), right=Constant(value=1))}.
 * Positions and expression contexts are left out so that equal shapes dump
 * to equal strings.
 */
public class AstDumper implements NodeVisitor<String, Void> {

    private static final AstDumper INSTANCE = new AstDumper();

    public static String dump(Node node) {
        return node.accept(INSTANCE, null);
    }

    private String node(String type, String... fields) {
        return type + "(" + String.join(", ", fields) + ")";
    }

    private static String field(String name, String value) {
        return name + "=" + value;
    }

    private String d(@Nullable Node node) {
        return node == null ? "None" : node.accept(this, null);
    }

    private String list(List<? extends Node> nodes) {
        return nodes.stream().map(this::d).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String quote(@Nullable String text) {
        return text == null ? "None" : "'" + text + "'";
    }

    private static String quoted(List<String> names) {
        return names.stream().map(AstDumper::quote).collect(Collectors.joining(", ", "[", "]"));
    }

    private String aliases(List<Alias> names) {
        return names.stream()
                .map(a -> node("alias", field("name", quote(a.name())), field("asname", quote(a.asname()))))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String keywords(List<Keyword> keywords) {
        return keywords.stream()
                .map(k -> node("keyword", field("arg", quote(k.arg())), field("value", d(k.value()))))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String arguments(List<Parameter> parameters) {
        String args = parameters.stream()
                .map(p -> node("arg", field("arg", quote(p.name())), field("kind", p.kind().name()),
                        field("annotation", d(p.annotation())), field("default", d(p.defaultValue()))))
                .collect(Collectors.joining(", ", "[", "]"));
        return node("arguments", field("args", args));
    }

    @Override
    public String visit(Module n, Void arg) {
        return node("Module", field("body", list(n.body())));
    }

    @Override
    public String visit(FunctionDef n, Void arg) {
        return node(n.isAsync() ? "AsyncFunctionDef" : "FunctionDef", field("name", quote(n.name())),
                field("args", arguments(n.parameters())), field("body", list(n.body())), field("decorator_list", list(n.decorators())),
                field("returns", d(n.returns())));
    }

    @Override
    public String visit(ClassDef n, Void arg) {
        return node("ClassDef", field("name", quote(n.name())), field("bases", list(n.bases())),
                field("keywords", keywords(n.keywords())), field("body", list(n.body())),
                field("decorator_list", list(n.decorators())));
    }

    @Override
    public String visit(For n, Void arg) {
        return node(n.isAsync() ? "AsyncFor" : "For", field("target", d(n.target())), field("iter", d(n.iter())),
                field("body", list(n.body())), field("orelse", list(n.orelse())));
    }

    @Override
    public String visit(While n, Void arg) {
        return node("While", field("test", d(n.test())), field("body", list(n.body())),
                field("orelse", list(n.orelse())));
    }

    @Override
    public String visit(If n, Void arg) {
        return node("If", field("test", d(n.test())), field("body", list(n.body())),
                field("orelse", list(n.orelse())));
    }

    @Override
    public String visit(Try n, Void arg) {
        return node(n.isStar() ? "TryStar" : "Try", field("body", list(n.body())), field("handlers", list(n.handlers())),
                field("orelse", list(n.orelse())), field("finalbody", list(n.finalbody())));
    }

    @Override
    public String visit(ExceptHandler n, Void arg) {
        return node("ExceptHandler", field("type", d(n.type())), field("name", quote(n.name())),
                field("body", list(n.body())));
    }

    @Override
    public String visit(With n, Void arg) {
        String items = n.items().stream()
                .map((WithItem i) -> node("withitem", field("context_expr", d(i.context())),
                        field("optional_vars", d(i.optionalVars()))))
                .collect(Collectors.joining(", ", "[", "]"));
        return node(n.isAsync() ? "AsyncWith" : "With", field("items", items), field("body", list(n.body())));
    }

    @Override
    public String visit(Match n, Void arg) {
        return node("Match", field("subject", d(n.subject())), field("cases", list(n.cases())));
    }

    @Override
    public String visit(MatchCase n, Void arg) {
        return node("match_case", field("pattern", d(n.pattern())), field("guard", d(n.guard())),
                field("body", list(n.body())));
    }

    @Override
    public String visit(Assign n, Void arg) {
        return node("Assign", field("targets", list(n.targets())), field("value", d(n.value())));
    }

    @Override
    public String visit(AugAssign n, Void arg) {
        return node("AugAssign", field("target", d(n.target())), field("op", n.op().astName() + "()"),
                field("value", d(n.value())));
    }

    @Override
    public String visit(AnnAssign n, Void arg) {
        return node("AnnAssign", field("target", d(n.target())), field("annotation", d(n.annotation())),
                field("value", d(n.value())), field("simple", n.target() instanceof Name ? "1" : "0"));
    }

    @Override
    public String visit(ExprStmt n, Void arg) {
        return node("Expr", field("value", d(n.value())));
    }

    @Override
    public String visit(Return n, Void arg) {
        return node("Return", field("value", d(n.value())));
    }

    @Override
    public String visit(Pass n, Void arg) {
        return "Pass()";
    }

    @Override
    public String visit(Break n, Void arg) {
        return "Break()";
    }

    @Override
    public String visit(Continue n, Void arg) {
        return "Continue()";
    }

    @Override
    public String visit(Import n, Void arg) {
        return node("Import", field("names", aliases(n.names())));
    }

    @Override
    public String visit(ImportFrom n, Void arg) {
        return node("ImportFrom", field("module", quote(n.module())), field("names", aliases(n.names())),
                field("level", Integer.toString(n.level())));
    }

    @Override
    public String visit(Raise n, Void arg) {
        return node("Raise", field("exc", d(n.exception())), field("cause", d(n.cause())));
    }

    @Override
    public String visit(Global n, Void arg) {
        return node(n.nonlocal() ? "Nonlocal" : "Global", field("names", quoted(n.names())));
    }

    @Override
    public String visit(Delete n, Void arg) {
        return node("Delete", field("targets", list(n.targets())));
    }

    @Override
    public String visit(Assert n, Void arg) {
        return node("Assert", field("test", d(n.test())), field("msg", d(n.message())));
    }

    @Override
    public String visit(Name n, Void arg) {
        return node("Name", field("id", quote(n.id())));
    }

    @Override
    public String visit(Constant n, Void arg) {
        return node("Constant", field("value", n.literal()));
    }

    @Override
    public String visit(BinOp n, Void arg) {
        return node("BinOp", field("left", d(n.left())), field("op", n.op().astName() + "()"),
                field("right", d(n.right())));
    }

    @Override
    public String visit(UnaryOp n, Void arg) {
        return node("UnaryOp", field("op", n.op().astName() + "()"), field("operand", d(n.operand())));
    }

    @Override
    public String visit(BoolOp n, Void arg) {
        return node("BoolOp", field("op", n.op().astName() + "()"), field("values", list(n.values())));
    }

    @Override
    public String visit(Compare n, Void arg) {
        String ops = n.ops().stream()
                .map(CompareOperator::astName)
                .map(name -> name + "()")
                .collect(Collectors.joining(", ", "[", "]"));
        return node("Compare", field("left", d(n.left())), field("ops", ops),
                field("comparators", list(n.comparators())));
    }

    @Override
    public String visit(Call n, Void arg) {
        return node("Call", field("func", d(n.func())), field("args", list(n.args())),
                field("keywords", keywords(n.keywords())));
    }

    @Override
    public String visit(Attribute n, Void arg) {
        return node("Attribute", field("value", d(n.value())), field("attr", quote(n.attr())));
    }

    @Override
    public String visit(Subscript n, Void arg) {
        return node("Subscript", field("value", d(n.value())), field("slice", d(n.slice())));
    }

    @Override
    public String visit(Slice n, Void arg) {
        return node("Slice", field("lower", d(n.lower())), field("upper", d(n.upper())),
                field("step", d(n.step())));
    }

    @Override
    public String visit(TupleExpr n, Void arg) {
        return node("Tuple", field("elts", list(n.elements())));
    }

    @Override
    public String visit(ListExpr n, Void arg) {
        return node("List", field("elts", list(n.elements())));
    }

    @Override
    public String visit(SetExpr n, Void arg) {
        return node("Set", field("elts", list(n.elements())));
    }

    @Override
    public String visit(DictExpr n, Void arg) {
        String keys = n.keys().stream().map(this::d).collect(Collectors.joining(", ", "[", "]"));
        return node("Dict", field("keys", keys), field("values", list(n.values())));
    }

    @Override
    public String visit(Comprehension n, Void arg) {
        String generators = n.generators().stream()
                .map((ComprehensionClause c) -> node("comprehension", field("target", d(c.target())),
                        field("iter", d(c.iter())), field("ifs", list(c.conditions())),
                        field("is_async", c.isAsync() ? "1" : "0")))
                .collect(Collectors.joining(", ", "[", "]"));
        return switch (n.comprehensionKind()) {
            case LIST -> node("ListComp", field("elt", d(n.element())), field("generators", generators));
            case SET -> node("SetComp", field("elt", d(n.element())), field("generators", generators));
            case GENERATOR -> node("GeneratorExp", field("elt", d(n.element())), field("generators", generators));
            case DICT -> node("DictComp", field("key", d(n.element())), field("value", d(n.value())),
                    field("generators", generators));
        };
    }

    @Override
    public String visit(IfExp n, Void arg) {
        return node("IfExp", field("test", d(n.test())), field("body", d(n.body())),
                field("orelse", d(n.orelse())));
    }

    @Override
    public String visit(Lambda n, Void arg) {
        return node("Lambda", field("args", arguments(n.parameters())), field("body", d(n.body())));
    }

    @Override
    public String visit(Starred n, Void arg) {
        return node("Starred", field("value", d(n.value())));
    }

    @Override
    public String visit(Yield n, Void arg) {
        return node(n.delegating() ? "YieldFrom" : "Yield", field("value", d(n.value())));
    }

    @Override
    public String visit(NamedExpr n, Void arg) {
        return node("NamedExpr", field("target", d(n.target())), field("value", d(n.value())));
    }

    @Override
    public String visit(Await n, Void arg) {
        return node("Await", field("value", d(n.value())));
    }

    @Override
    public String visit(MatchValue n, Void arg) {
        return node("MatchValue", field("value", d(n.value())));
    }

    @Override
    public String visit(MatchSingleton n, Void arg) {
        return node("MatchSingleton", field("value", n.value().literal()));
    }

    @Override
    public String visit(MatchSequence n, Void arg) {
        return node("MatchSequence", field("patterns", list(n.patterns())));
    }

    @Override
    public String visit(MatchMapping n, Void arg) {
        return node("MatchMapping", field("keys", list(n.keys())), field("patterns", list(n.patterns())),
                field("rest", quote(n.rest())));
    }

    @Override
    public String visit(MatchClass n, Void arg) {
        return node("MatchClass", field("cls", d(n.cls())), field("patterns", list(n.patterns())),
                field("kwd_attrs", quoted(n.kwdAttrs())), field("kwd_patterns", list(n.kwdPatterns())));
    }

    @Override
    public String visit(MatchStar n, Void arg) {
        return node("MatchStar", field("name", quote(n.name())));
    }

    @Override
    public String visit(MatchAs n, Void arg) {
        return node("MatchAs", field("pattern", d(n.pattern())), field("name", quote(n.name())));
    }

    @Override
    public String visit(MatchOr n, Void arg) {
        return node("MatchOr", field("patterns", list(n.patterns())));
    }
}
