package com.raditha.pyopt.ast;

import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Await;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BoolOp;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Compare;
import com.raditha.pyopt.ast.expr.Comprehension;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.DictExpr;
import com.raditha.pyopt.ast.expr.IfExp;
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

/**
 * Visitor that walks the whole tree in source order and returns nothing.
 * Subclasses override the node types they care about and call
 * {@link #visitChildren} to keep descending.
 *
 * @param <A> argument type
 */
public abstract class VoidNodeVisitor<A> implements NodeVisitor<Void, A> {

    protected void visitChildren(Node n, A arg) {
        for (Node child : n.children()) {
            child.accept(this, arg);
        }
    }

    @Override
    public Void visit(Module n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(FunctionDef n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(ClassDef n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(For n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(While n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(If n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Try n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(ExceptHandler n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(With n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Match n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchCase n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Assign n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(AugAssign n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(AnnAssign n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(ExprStmt n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Return n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Pass n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Break n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Continue n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Import n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(ImportFrom n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Raise n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Global n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Delete n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Assert n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Name n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Constant n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(BinOp n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(UnaryOp n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(BoolOp n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Compare n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Call n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Attribute n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Subscript n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Slice n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(TupleExpr n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(ListExpr n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(SetExpr n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(DictExpr n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Comprehension n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(IfExp n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Lambda n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Starred n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Yield n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(NamedExpr n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(Await n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchValue n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchSingleton n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchSequence n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchMapping n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchClass n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchStar n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchAs n, A arg) {
        visitChildren(n, arg);
        return null;
    }

    @Override
    public Void visit(MatchOr n, A arg) {
        visitChildren(n, arg);
        return null;
    }
}
