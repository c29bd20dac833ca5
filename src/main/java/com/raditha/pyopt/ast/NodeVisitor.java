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
 * Visitor with one method per node type. Implementations that must handle
 * every kind implement this interface directly and the compiler reports any
 * kind they miss.
 *
 * @param <R> result type
 * @param <A> argument type
 */
public interface NodeVisitor<R, A> {

    R visit(Module n, A arg);

    // statements

    R visit(FunctionDef n, A arg);

    R visit(ClassDef n, A arg);

    R visit(For n, A arg);

    R visit(While n, A arg);

    R visit(If n, A arg);

    R visit(Try n, A arg);

    R visit(ExceptHandler n, A arg);

    R visit(With n, A arg);

    R visit(Match n, A arg);

    R visit(MatchCase n, A arg);

    R visit(Assign n, A arg);

    R visit(AugAssign n, A arg);

    R visit(AnnAssign n, A arg);

    R visit(ExprStmt n, A arg);

    R visit(Return n, A arg);

    R visit(Pass n, A arg);

    R visit(Break n, A arg);

    R visit(Continue n, A arg);

    R visit(Import n, A arg);

    R visit(ImportFrom n, A arg);

    R visit(Raise n, A arg);

    R visit(Global n, A arg);

    R visit(Delete n, A arg);

    R visit(Assert n, A arg);

    // expressions

    R visit(Name n, A arg);

    R visit(Constant n, A arg);

    R visit(BinOp n, A arg);

    R visit(UnaryOp n, A arg);

    R visit(BoolOp n, A arg);

    R visit(Compare n, A arg);

    R visit(Call n, A arg);

    R visit(Attribute n, A arg);

    R visit(Subscript n, A arg);

    R visit(Slice n, A arg);

    R visit(TupleExpr n, A arg);

    R visit(ListExpr n, A arg);

    R visit(SetExpr n, A arg);

    R visit(DictExpr n, A arg);

    R visit(Comprehension n, A arg);

    R visit(IfExp n, A arg);

    R visit(Lambda n, A arg);

    R visit(Starred n, A arg);

    R visit(Yield n, A arg);

    R visit(NamedExpr n, A arg);

    R visit(Await n, A arg);

    // patterns

    R visit(MatchValue n, A arg);

    R visit(MatchSingleton n, A arg);

    R visit(MatchSequence n, A arg);

    R visit(MatchMapping n, A arg);

    R visit(MatchClass n, A arg);

    R visit(MatchStar n, A arg);

    R visit(MatchAs n, A arg);

    R visit(MatchOr n, A arg);
}
