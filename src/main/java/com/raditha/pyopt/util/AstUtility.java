package com.raditha.pyopt.util;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.Parameter;
import com.raditha.pyopt.ast.ParentIndex;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.VoidNodeVisitor;
import com.raditha.pyopt.ast.expr.Comprehension;
import com.raditha.pyopt.ast.expr.ComprehensionClause;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.ConstantKind;
import com.raditha.pyopt.ast.expr.Lambda;
import com.raditha.pyopt.ast.expr.ListExpr;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.NamedExpr;
import com.raditha.pyopt.ast.expr.Starred;
import com.raditha.pyopt.ast.expr.TupleExpr;
import com.raditha.pyopt.ast.pattern.MatchAs;
import com.raditha.pyopt.ast.pattern.MatchMapping;
import com.raditha.pyopt.ast.pattern.MatchStar;
import com.raditha.pyopt.ast.stmt.Alias;
import com.raditha.pyopt.ast.stmt.AnnAssign;
import com.raditha.pyopt.ast.stmt.Assign;
import com.raditha.pyopt.ast.stmt.AugAssign;
import com.raditha.pyopt.ast.stmt.ClassDef;
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
import com.raditha.pyopt.ast.stmt.Try;
import com.raditha.pyopt.ast.stmt.While;
import com.raditha.pyopt.ast.stmt.With;
import com.raditha.pyopt.ast.stmt.WithItem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utility class for common syntax tree queries.
 */
public class AstUtility {

    public static final String MODULE_SCOPE = "<module>";

    /**
     * A name bound by a statement, parameter list or pattern.
     *
     * @param name   the bound identifier
     * @param binder the node that binds it
     */
    public record Binding(String name, Node binder) {
    }

    private AstUtility() {
        /* this is only a utility class */
    }

    /**
     * Whether any {@link Name} in the subtree has the given identifier.
     */
    public static boolean referencesName(Node root, String id) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node instanceof Name name && name.id().equals(id)) {
                return true;
            }
            node.children().forEach(pending::push);
        }
        return false;
    }

    /**
     * Whether the block holds a {@code break} that would leave the loop owning
     * the block. Breaks inside nested loop bodies and nested definitions belong
     * elsewhere and are ignored; the else blocks of nested loops are searched
     * because a break there targets the outer loop.
     */
    public static boolean containsLoopBreak(List<Stmt> block) {
        for (Stmt stmt : block) {
            boolean found = switch (stmt.kind()) {
                case BREAK -> true;
                case IF -> containsLoopBreak(((If) stmt).body()) || containsLoopBreak(((If) stmt).orelse());
                case FOR -> containsLoopBreak(((For) stmt).orelse());
                case WHILE -> containsLoopBreak(((While) stmt).orelse());
                case WITH -> containsLoopBreak(((With) stmt).body());
                case MATCH -> {
                    boolean inCases = false;
                    for (MatchCase matchCase : ((Match) stmt).cases()) {
                        inCases |= containsLoopBreak(matchCase.body());
                    }
                    yield inCases;
                }
                case TRY -> {
                    Try t = (Try) stmt;
                    boolean inHandlers = false;
                    for (ExceptHandler handler : t.handlers()) {
                        inHandlers |= containsLoopBreak(handler.body());
                    }
                    yield inHandlers || containsLoopBreak(t.body()) || containsLoopBreak(t.orelse())
                            || containsLoopBreak(t.finalbody());
                }
                default -> false;
            };
            if (found) {
                return true;
            }
        }
        return false;
    }

    /**
     * Dotted name of the functions and classes enclosing a node, such as
     * {@code Matrix.scale}, or {@value #MODULE_SCOPE} at module level.
     */
    public static String scopeName(ParentIndex parents, Node node) {
        List<String> names = new ArrayList<>();
        for (Node ancestor : parents.ancestors(node)) {
            if (ancestor instanceof FunctionDef f) {
                names.add(f.name());
            } else if (ancestor instanceof ClassDef c) {
                names.add(c.name());
            }
        }
        if (names.isEmpty()) {
            return MODULE_SCOPE;
        }
        Collections.reverse(names);
        return String.join(".", names);
    }

    /**
     * A string literal statement, as found at the top of a module or function.
     */
    public static boolean isDocstring(Stmt stmt) {
        return stmt instanceof ExprStmt e
                && e.value() instanceof Constant c
                && c.constantKind() == ConstantKind.STRING;
    }

    /**
     * Identifiers of every {@link Name} in the subtree.
     */
    public static Set<String> namesIn(Node root) {
        Set<String> names = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node instanceof Name name) {
                names.add(name.id());
            }
            node.children().forEach(pending::push);
        }
        return names;
    }

    /**
     * Names that running the block may rebind in the scope the block belongs
     * to. Nested functions, classes and lambdas have scopes of their own, so
     * only their names and their {@code global} or {@code nonlocal}
     * declarations count. An assignment expression inside a comprehension
     * binds in the enclosing scope and counts as well.
     */
    public static Set<String> boundNames(List<Stmt> block) {
        BindingCollector collector = new BindingCollector(false);
        block.forEach(stmt -> stmt.accept(collector, null));
        Set<String> names = new LinkedHashSet<>();
        collector.bindings.forEach(b -> names.add(b.name()));
        return names;
    }

    /**
     * Every binding anywhere in the tree, in source order, including
     * parameters and comprehension targets of nested scopes.
     */
    public static List<Binding> allBindings(Node root) {
        BindingCollector collector = new BindingCollector(true);
        root.accept(collector, null);
        return List.copyOf(collector.bindings);
    }

    private static final class BindingCollector extends VoidNodeVisitor<Void> {

        private final boolean allScopes;
        private final List<Binding> bindings = new ArrayList<>();
        private int nested;

        BindingCollector(boolean allScopes) {
            this.allScopes = allScopes;
        }

        private void bind(String name, Node binder) {
            if (allScopes || nested == 0) {
                bindings.add(new Binding(name, binder));
            }
        }

        /**
         * Names in an assignment target; attributes and subscripts bind nothing.
         */
        private void bindTarget(Expr target, Node binder) {
            if (target instanceof Name name) {
                bind(name.id(), binder);
            } else if (target instanceof TupleExpr tuple) {
                tuple.elements().forEach(e -> bindTarget(e, binder));
            } else if (target instanceof ListExpr list) {
                list.elements().forEach(e -> bindTarget(e, binder));
            } else if (target instanceof Starred starred) {
                bindTarget(starred.value(), binder);
            }
        }

        private void bindParameters(List<Parameter> parameters, Node binder) {
            for (Parameter parameter : parameters) {
                if (!parameter.name().isEmpty()) {
                    bind(parameter.name(), binder);
                }
            }
        }

        private void visitNested(Node n) {
            nested++;
            visitChildren(n, null);
            nested--;
        }

        @Override
        public Void visit(FunctionDef n, Void arg) {
            bind(n.name(), n);
            if (allScopes) {
                bindParameters(n.parameters(), n);
            }
            visitNested(n);
            return null;
        }

        @Override
        public Void visit(ClassDef n, Void arg) {
            bind(n.name(), n);
            visitNested(n);
            return null;
        }

        @Override
        public Void visit(Lambda n, Void arg) {
            if (allScopes) {
                bindParameters(n.parameters(), n);
            }
            visitNested(n);
            return null;
        }

        @Override
        public Void visit(Comprehension n, Void arg) {
            if (allScopes) {
                for (ComprehensionClause clause : n.generators()) {
                    bindTarget(clause.target(), n);
                }
            }
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(Global n, Void arg) {
            if (!allScopes && nested > 0) {
                n.names().forEach(name -> bindings.add(new Binding(name, n)));
            }
            return null;
        }

        @Override
        public Void visit(Assign n, Void arg) {
            n.targets().forEach(t -> bindTarget(t, n));
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(AugAssign n, Void arg) {
            bindTarget(n.target(), n);
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(AnnAssign n, Void arg) {
            bindTarget(n.target(), n);
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(For n, Void arg) {
            bindTarget(n.target(), n);
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(With n, Void arg) {
            for (WithItem item : n.items()) {
                if (item.optionalVars() != null) {
                    bindTarget(item.optionalVars(), n);
                }
            }
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(ExceptHandler n, Void arg) {
            if (n.name() != null) {
                bind(n.name(), n);
            }
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(Delete n, Void arg) {
            n.targets().forEach(t -> bindTarget(t, n));
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(Import n, Void arg) {
            n.names().forEach(alias -> bind(alias.boundName(), n));
            return null;
        }

        @Override
        public Void visit(ImportFrom n, Void arg) {
            for (Alias alias : n.names()) {
                if (!"*".equals(alias.name())) {
                    bind(alias.boundName(), n);
                }
            }
            return null;
        }

        @Override
        public Void visit(NamedExpr n, Void arg) {
            bind(n.target().id(), n);
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(MatchAs n, Void arg) {
            if (n.name() != null) {
                bind(n.name(), n);
            }
            visitChildren(n, arg);
            return null;
        }

        @Override
        public Void visit(MatchStar n, Void arg) {
            if (n.name() != null) {
                bind(n.name(), n);
            }
            return null;
        }

        @Override
        public Void visit(MatchMapping n, Void arg) {
            if (n.rest() != null) {
                bind(n.rest(), n);
            }
            visitChildren(n, arg);
            return null;
        }
    }
}
