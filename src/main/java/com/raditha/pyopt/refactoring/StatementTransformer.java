package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.stmt.ClassDef;
import com.raditha.pyopt.ast.stmt.ExceptHandler;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.FunctionDef;
import com.raditha.pyopt.ast.stmt.If;
import com.raditha.pyopt.ast.stmt.Match;
import com.raditha.pyopt.ast.stmt.MatchCase;
import com.raditha.pyopt.ast.stmt.Try;
import com.raditha.pyopt.ast.stmt.While;
import com.raditha.pyopt.ast.stmt.With;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-down rebuild of statement blocks.
 * <p>
 * Every statement maps to a splice of zero or more statements. Compound
 * statements are rebuilt only when one of their blocks changed, so an
 * untouched subtree comes back as the very same instance. Subclasses
 * override {@link #transformLoop} to replace {@code for} loops.
 */
public abstract class StatementTransformer {

    public Module transformModule(Module module) {
        List<Stmt> body = transformBlock(module.body());
        return body == module.body() ? module : module.withBody(body);
    }

    /**
     * @return the original list if no statement changed
     */
    protected List<Stmt> transformBlock(List<Stmt> block) {
        List<Stmt> result = new ArrayList<>(block.size());
        boolean changed = false;
        for (Stmt stmt : block) {
            List<Stmt> replacement = transformStatement(stmt);
            if (replacement.size() != 1 || replacement.get(0) != stmt) {
                changed = true;
            }
            result.addAll(replacement);
        }
        return changed ? result : block;
    }

    protected List<Stmt> transformStatement(Stmt stmt) {
        return switch (stmt.kind()) {
            case FOR -> transformLoop((For) stmt);
            case FUNCTION_DEF -> {
                FunctionDef f = (FunctionDef) stmt;
                List<Stmt> body = transformBlock(f.body());
                yield List.of(body == f.body() ? f : f.withBody(body));
            }
            case CLASS_DEF -> {
                ClassDef c = (ClassDef) stmt;
                List<Stmt> body = transformBlock(c.body());
                yield List.of(body == c.body() ? c : c.withBody(body));
            }
            case WHILE -> {
                While w = (While) stmt;
                List<Stmt> body = transformBlock(w.body());
                List<Stmt> orelse = transformBlock(w.orelse());
                yield List.of(body == w.body() && orelse == w.orelse() ? w : w.withBlocks(body, orelse));
            }
            case IF -> {
                If i = (If) stmt;
                List<Stmt> body = transformBlock(i.body());
                List<Stmt> orelse = transformBlock(i.orelse());
                yield List.of(body == i.body() && orelse == i.orelse() ? i : i.withBlocks(body, orelse));
            }
            case WITH -> {
                With w = (With) stmt;
                List<Stmt> body = transformBlock(w.body());
                yield List.of(body == w.body() ? w : w.withBody(body));
            }
            case TRY -> List.of(transformTry((Try) stmt));
            case MATCH -> List.of(transformMatch((Match) stmt));
            case ASSIGN, AUG_ASSIGN, ANN_ASSIGN, EXPR_STMT, RETURN, PASS, BREAK, CONTINUE, IMPORT,
                    IMPORT_FROM, RAISE, GLOBAL, DELETE, ASSERT -> List.of(stmt);
            case MODULE, EXCEPT_HANDLER, MATCH_CASE, MATCH_VALUE, MATCH_SINGLETON, MATCH_SEQUENCE,
                    MATCH_MAPPING, MATCH_CLASS, MATCH_STAR, MATCH_AS, MATCH_OR, NAME, CONSTANT, BIN_OP,
                    UNARY_OP, BOOL_OP, COMPARE, CALL, ATTRIBUTE, SUBSCRIPT, SLICE, TUPLE, LIST, SET, DICT,
                    COMPREHENSION, IF_EXP, LAMBDA, STARRED, YIELD, NAMED_EXPR, AWAIT ->
                    throw new IllegalStateException(stmt.kind() + " is not a statement");
        };
    }

    private Try transformTry(Try t) {
        boolean changed = false;
        List<ExceptHandler> handlers = new ArrayList<>();
        for (ExceptHandler handler : t.handlers()) {
            List<Stmt> body = transformBlock(handler.body());
            if (body != handler.body()) {
                changed = true;
                handlers.add(handler.withBody(body));
            } else {
                handlers.add(handler);
            }
        }
        List<Stmt> body = transformBlock(t.body());
        List<Stmt> orelse = transformBlock(t.orelse());
        List<Stmt> finalbody = transformBlock(t.finalbody());
        changed |= body != t.body() || orelse != t.orelse() || finalbody != t.finalbody();
        return changed ? t.withBlocks(body, handlers, orelse, finalbody) : t;
    }

    private Match transformMatch(Match m) {
        boolean changed = false;
        List<MatchCase> cases = new ArrayList<>();
        for (MatchCase matchCase : m.cases()) {
            List<Stmt> body = transformBlock(matchCase.body());
            if (body != matchCase.body()) {
                changed = true;
                cases.add(matchCase.withBody(body));
            } else {
                cases.add(matchCase);
            }
        }
        return changed ? m.withCases(cases) : m;
    }

    /**
     * Replace a loop. The default keeps the loop and descends into its blocks.
     */
    protected List<Stmt> transformLoop(For loop) {
        return List.of(descendInto(loop));
    }

    protected For descendInto(For loop) {
        List<Stmt> body = transformBlock(loop.body());
        List<Stmt> orelse = transformBlock(loop.orelse());
        return body == loop.body() && orelse == loop.orelse() ? loop : loop.withBlocks(body, orelse);
    }
}
