package com.raditha.pyopt.parser;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.Parameter;
import com.raditha.pyopt.ast.ParameterKind;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Await;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.BoolOp;
import com.raditha.pyopt.ast.expr.BoolOperator;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Compare;
import com.raditha.pyopt.ast.expr.CompareOperator;
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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for Python 3 source, up to the 3.11 grammar.
 * <p>
 * Each grammar production has its own method; the expression methods follow
 * Python's precedence ladder from {@code lambda} down to atoms. {@code match}
 * and {@code case} are soft keywords: a line is a {@code match} statement only
 * when it has that shape, so they stay usable as names. Every method reports a
 * syntax error through a checked {@link SourceParseException} that carries the
 * offending line and column.
 */
public class PythonParser {

    private static final Logger logger = LoggerFactory.getLogger(PythonParser.class);

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED_OPERATORS = Set.of(
            "+=", "-=", "*=", "@=", "/=", "//=", "%=", "**=", "<<=", ">>=", "&=", "|=", "^=");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    /** Binary operator tiers from loosest ({@code |}) to tightest ({@code * / // % @}). */
    private static final List<Set<String>> BINARY_TIERS = List.of(
            Set.of("|"),
            Set.of("^"),
            Set.of("&"),
            Set.of("<<", ">>"),
            Set.of("+", "-"),
            Set.of("*", "/", "//", "%", "@"));

    private final List<Token> tokens;
    private int index;

    public PythonParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a complete source file.
     *
     * @param source Python source text
     * @return the module node
     * @throws SourceParseException if the text is not valid Python
     */
    public static Module parse(String source) throws SourceParseException {
        Module module = new PythonParser(Tokenizer.tokenize(source)).parseModule();
        logger.debug("Parsed module with {} top-level statements", module.body().size());
        return module;
    }

    public Module parseModule() throws SourceParseException {
        List<Stmt> body = new ArrayList<>();
        while (!peek().type().equals(TokenType.END_MARKER)) {
            if (peek().type() == TokenType.NEWLINE) {
                next();
                continue;
            }
            if (peek().type() == TokenType.INDENT) {
                throw error("unexpected indent", peek());
            }
            body.addAll(parseStatement());
        }
        return new Module(new Position(1, 0), body);
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> parseStatement() throws SourceParseException {
        Token token = peek();
        if (token.type() == TokenType.NAME) {
            switch (token.text()) {
                case "if" -> {
                    return List.of(parseIf());
                }
                case "while" -> {
                    return List.of(parseWhile());
                }
                case "for" -> {
                    return List.of(parseFor(next()));
                }
                case "try" -> {
                    return List.of(parseTry());
                }
                case "with" -> {
                    return List.of(parseWith(next()));
                }
                case "def" -> {
                    return List.of(parseFunctionDef(List.of(), next()));
                }
                case "class" -> {
                    return List.of(parseClassDef(List.of()));
                }
                case "async" -> {
                    return List.of(parseAsync(List.of()));
                }
                case "match" -> {
                    if (isMatchStatement()) {
                        return List.of(parseMatch());
                    }
                }
                default -> {
                    // simple statement
                }
            }
        } else if (token.isOperator("@")) {
            return List.of(parseDecorated());
        }
        return parseSimpleStatements();
    }

    /**
     * One logical line of {@code ;}-separated simple statements.
     */
    private List<Stmt> parseSimpleStatements() throws SourceParseException {
        List<Stmt> statements = new ArrayList<>();
        statements.add(parseSmallStatement());
        while (accept(TokenType.OPERATOR, ";")) {
            if (peek().type() == TokenType.NEWLINE) {
                break;
            }
            statements.add(parseSmallStatement());
        }
        expect(TokenType.NEWLINE, "end of line");
        return statements;
    }

    /**
     * The body after a colon: an indented block or simple statements on the same line.
     */
    private List<Stmt> parseBlock() throws SourceParseException {
        expectOperator(":");
        if (peek().type() != TokenType.NEWLINE) {
            return parseSimpleStatements();
        }
        next();
        if (peek().type() != TokenType.INDENT) {
            throw error("expected an indented block", peek());
        }
        next();
        List<Stmt> body = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.END_MARKER) {
            if (peek().type() == TokenType.INDENT) {
                throw error("unexpected indent", peek());
            }
            body.addAll(parseStatement());
        }
        expect(TokenType.DEDENT, "dedent");
        return body;
    }

    private If parseIf() throws SourceParseException {
        // the current token is "if" or "elif"
        Token keyword = next();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = List.of();
        if (peek().isKeyword("elif")) {
            orelse = List.of(parseIf());
        } else if (acceptKeyword("else")) {
            orelse = parseBlock();
        }
        return new If(positionOf(keyword), test, body, orelse);
    }

    private While parseWhile() throws SourceParseException {
        Token keyword = next();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = acceptKeyword("else") ? parseBlock() : List.of();
        return new While(positionOf(keyword), test, body, orelse);
    }

    /**
     * {@code async def}, {@code async for} or {@code async with}; the
     * statement's position is that of {@code async}.
     */
    private Stmt parseAsync(List<Expr> decorators) throws SourceParseException {
        Token async = next();
        Token keyword = peek();
        if (keyword.isKeyword("def")) {
            next();
            return parseFunctionDef(decorators, async);
        }
        if (decorators.isEmpty() && keyword.isKeyword("for")) {
            next();
            return parseFor(async);
        }
        if (decorators.isEmpty() && keyword.isKeyword("with")) {
            next();
            return parseWith(async);
        }
        throw error("expected 'def', 'for' or 'with' after 'async' but found " + keyword.describe(), keyword);
    }

    /**
     * @param keyword the consumed {@code for}, or the {@code async} before it
     */
    private For parseFor(Token keyword) throws SourceParseException {
        Expr target = parseTargetList();
        checkAssignable(target, keyword);
        expectKeyword("in");
        Expr iter = parseExpressionList();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = acceptKeyword("else") ? parseBlock() : List.of();
        return new For(positionOf(keyword), target, iter, body, orelse, keyword.isKeyword("async"));
    }

    private Try parseTry() throws SourceParseException {
        Token keyword = next();
        List<Stmt> body = parseBlock();
        List<ExceptHandler> handlers = new ArrayList<>();
        Boolean star = null;
        while (peek().isKeyword("except")) {
            Token except = next();
            boolean starred = accept(TokenType.OPERATOR, "*");
            if (star == null) {
                star = starred;
            } else if (star != starred) {
                throw error("cannot have both 'except' and 'except*' on the same 'try'", except);
            }
            if (starred && peek().isOperator(":")) {
                throw error("expected one or more exception types", peek());
            }
            Expr type = null;
            String name = null;
            if (!peek().isOperator(":")) {
                type = parseExpression();
                if (acceptKeyword("as")) {
                    name = expectName().text();
                }
            }
            handlers.add(new ExceptHandler(positionOf(except), type, name, parseBlock()));
        }
        List<Stmt> orelse = List.of();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orelse = parseBlock();
        }
        List<Stmt> finalbody = acceptKeyword("finally") ? parseBlock() : List.of();
        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw error("expected 'except' or 'finally' block", peek());
        }
        return new Try(positionOf(keyword), body, handlers, orelse, finalbody, Boolean.TRUE.equals(star));
    }

    private With parseWith(Token keyword) throws SourceParseException {
        List<WithItem> items = new ArrayList<>();
        do {
            Expr context = parseExpression();
            Expr vars = null;
            if (acceptKeyword("as")) {
                vars = parseTarget();
                checkAssignable(vars, keyword);
            }
            items.add(new WithItem(context, vars));
        } while (accept(TokenType.OPERATOR, ","));
        return new With(positionOf(keyword), items, parseBlock(), keyword.isKeyword("async"));
    }

    private Stmt parseDecorated() throws SourceParseException {
        List<Expr> decorators = new ArrayList<>();
        while (accept(TokenType.OPERATOR, "@")) {
            decorators.add(parseNamedExpression());
            expect(TokenType.NEWLINE, "end of line");
        }
        Token token = peek();
        if (token.isKeyword("def")) {
            return parseFunctionDef(decorators, next());
        }
        if (token.isKeyword("class")) {
            return parseClassDef(decorators);
        }
        if (token.isKeyword("async")) {
            return parseAsync(decorators);
        }
        throw error("expected 'def' or 'class' after decorator", token);
    }

    /**
     * @param keyword the consumed {@code def}, or the {@code async} before it
     */
    private FunctionDef parseFunctionDef(List<Expr> decorators, Token keyword) throws SourceParseException {
        String name = expectName().text();
        expectOperator("(");
        List<Parameter> parameters = parseParameters(")", true);
        expectOperator(")");
        Expr returns = null;
        if (accept(TokenType.OPERATOR, "->")) {
            returns = parseExpression();
        }
        return new FunctionDef(positionOf(keyword), name, parameters, returns, decorators, parseBlock(),
                keyword.isKeyword("async"));
    }

    private ClassDef parseClassDef(List<Expr> decorators) throws SourceParseException {
        Token keyword = next();
        String name = expectName().text();
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (accept(TokenType.OPERATOR, "(")) {
            parseArguments(bases, keywords);
            expectOperator(")");
        }
        return new ClassDef(positionOf(keyword), name, bases, keywords, decorators, parseBlock());
    }

    /**
     * Parameter list of a {@code def} (annotations allowed) or a {@code lambda}.
     */
    private List<Parameter> parseParameters(String closer, boolean annotations) throws SourceParseException {
        List<Parameter> parameters = new ArrayList<>();
        while (!peek().isOperator(closer)) {
            Token token = peek();
            if (accept(TokenType.OPERATOR, "/")) {
                parameters.add(new Parameter("", ParameterKind.POSITIONAL_ONLY_MARKER, null, null));
            } else if (accept(TokenType.OPERATOR, "*")) {
                if (peek().isOperator(",") || peek().isOperator(closer)) {
                    parameters.add(new Parameter("", ParameterKind.KEYWORD_ONLY_MARKER, null, null));
                } else {
                    String name = expectName().text();
                    parameters.add(new Parameter(name, ParameterKind.VAR_POSITIONAL, parseAnnotation(annotations), null));
                }
            } else if (accept(TokenType.OPERATOR, "**")) {
                String name = expectName().text();
                parameters.add(new Parameter(name, ParameterKind.VAR_KEYWORD, parseAnnotation(annotations), null));
            } else if (token.type() == TokenType.NAME) {
                String name = expectName().text();
                Expr annotation = parseAnnotation(annotations);
                Expr defaultValue = accept(TokenType.OPERATOR, "=") ? parseExpression() : null;
                parameters.add(new Parameter(name, ParameterKind.NORMAL, annotation, defaultValue));
            } else {
                throw error("invalid parameter " + token.describe(), token);
            }
            if (!accept(TokenType.OPERATOR, ",")) {
                break;
            }
        }
        return parameters;
    }

    private @Nullable Expr parseAnnotation(boolean allowed) throws SourceParseException {
        if (allowed && accept(TokenType.OPERATOR, ":")) {
            return parseExpression();
        }
        return null;
    }

    private Stmt parseSmallStatement() throws SourceParseException {
        Token token = peek();
        Position position = positionOf(token);
        if (token.type() == TokenType.NAME) {
            switch (token.text()) {
                case "pass" -> {
                    next();
                    return new Pass(position);
                }
                case "break" -> {
                    next();
                    return new Break(position);
                }
                case "continue" -> {
                    next();
                    return new Continue(position);
                }
                case "return" -> {
                    next();
                    Expr value = startsExpression(peek()) ? parseStarExpressionList() : null;
                    return new Return(position, value);
                }
                case "raise" -> {
                    next();
                    Expr exception = null;
                    Expr cause = null;
                    if (startsExpression(peek())) {
                        exception = parseExpression();
                        if (acceptKeyword("from")) {
                            cause = parseExpression();
                        }
                    }
                    return new Raise(position, exception, cause);
                }
                case "global", "nonlocal" -> {
                    next();
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(expectName().text());
                    } while (accept(TokenType.OPERATOR, ","));
                    return new Global(position, names, token.text().equals("nonlocal"));
                }
                case "del" -> {
                    next();
                    List<Expr> targets = new ArrayList<>();
                    do {
                        Expr target = parseBitOr();
                        checkAssignable(target, token);
                        targets.add(target);
                    } while (accept(TokenType.OPERATOR, ",") && startsExpression(peek()));
                    return new Delete(position, targets);
                }
                case "assert" -> {
                    next();
                    Expr test = parseExpression();
                    Expr message = accept(TokenType.OPERATOR, ",") ? parseExpression() : null;
                    return new Assert(position, test, message);
                }
                case "import" -> {
                    return parseImport();
                }
                case "from" -> {
                    return parseImportFrom();
                }
                default -> {
                    // expression statement
                }
            }
        }
        return parseExpressionStatement();
    }

    private Import parseImport() throws SourceParseException {
        Token keyword = next();
        List<Alias> names = new ArrayList<>();
        do {
            String name = parseDottedName();
            String asname = acceptKeyword("as") ? expectName().text() : null;
            names.add(new Alias(name, asname));
        } while (accept(TokenType.OPERATOR, ","));
        return new Import(positionOf(keyword), names);
    }

    private ImportFrom parseImportFrom() throws SourceParseException {
        Token keyword = next();
        int level = 0;
        while (peek().isOperator(".") || peek().isOperator("...")) {
            level += next().text().length();
        }
        String module = null;
        if (!peek().isKeyword("import")) {
            module = parseDottedName();
        } else if (level == 0) {
            throw error("expected module name", peek());
        }
        expectKeyword("import");

        List<Alias> names = new ArrayList<>();
        if (accept(TokenType.OPERATOR, "*")) {
            names.add(new Alias("*", null));
        } else {
            boolean parenthesized = accept(TokenType.OPERATOR, "(");
            do {
                if (parenthesized && peek().isOperator(")")) {
                    break;
                }
                String name = expectName().text();
                String asname = acceptKeyword("as") ? expectName().text() : null;
                names.add(new Alias(name, asname));
            } while (accept(TokenType.OPERATOR, ","));
            if (parenthesized) {
                expectOperator(")");
            }
        }
        return new ImportFrom(positionOf(keyword), module, names, level);
    }

    private String parseDottedName() throws SourceParseException {
        StringBuilder name = new StringBuilder(expectName().text());
        while (accept(TokenType.OPERATOR, ".")) {
            name.append('.').append(expectName().text());
        }
        return name.toString();
    }

    /**
     * Expression statement, plain, chained, augmented or annotated assignment.
     */
    private Stmt parseExpressionStatement() throws SourceParseException {
        Token start = peek();
        Position position = positionOf(start);
        Expr first = parseStarExpressionList();

        if (accept(TokenType.OPERATOR, ":")) {
            checkAssignable(first, start);
            Expr annotation = parseExpression();
            Expr value = null;
            if (accept(TokenType.OPERATOR, "=")) {
                value = parseAssignedValue();
            }
            return new AnnAssign(position, first, annotation, value);
        }

        Token operator = peek();
        if (operator.type() == TokenType.OPERATOR && AUGMENTED_OPERATORS.contains(operator.text())) {
            next();
            if (!(first instanceof Name || first instanceof Attribute || first instanceof Subscript)) {
                throw error("illegal expression for augmented assignment", start);
            }
            BinaryOperator op = BinaryOperator.fromAugmented(operator.text())
                    .orElseThrow(() -> error("unknown operator " + operator.describe(), operator));
            return new AugAssign(position, first, op, parseAssignedValue());
        }

        if (peek().isOperator("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr current = first;
            while (accept(TokenType.OPERATOR, "=")) {
                checkAssignable(current, start);
                targets.add(current);
                current = parseAssignedValue();
            }
            return new Assign(position, targets, current);
        }
        return new ExprStmt(position, first);
    }

    private Expr parseAssignedValue() throws SourceParseException {
        if (peek().isKeyword("yield")) {
            return parseYield();
        }
        return parseStarExpressionList();
    }

    // ---------------------------------------------------------------- match statements

    /**
     * Whether the {@code match} at the cursor opens a match statement: the
     * logical line ends in a colon and the next line is an indented {@code case}.
     */
    private boolean isMatchStatement() {
        int offset = 1;
        Token token = peekAhead(offset);
        if (token.isOperator(":") || token.isOperator("=") || token.type() == TokenType.NEWLINE) {
            return false;
        }
        while (token.type() != TokenType.NEWLINE && token.type() != TokenType.END_MARKER) {
            token = peekAhead(++offset);
        }
        return peekAhead(offset - 1).isOperator(":")
                && peekAhead(offset + 1).type() == TokenType.INDENT
                && peekAhead(offset + 2).isKeyword("case");
    }

    private Match parseMatch() throws SourceParseException {
        Token keyword = next();
        Token start = peek();
        Expr subject = parseStarOrNamed();
        if (peek().isOperator(",")) {
            List<Expr> elements = new ArrayList<>();
            elements.add(subject);
            while (accept(TokenType.OPERATOR, ",")) {
                if (peek().isOperator(":")) {
                    break;
                }
                elements.add(parseStarOrNamed());
            }
            subject = new TupleExpr(positionOf(start), elements);
        } else if (subject instanceof Starred) {
            throw error("cannot use starred expression here", start);
        }
        expectOperator(":");
        expect(TokenType.NEWLINE, "end of line");
        expect(TokenType.INDENT, "an indented block");
        List<MatchCase> cases = new ArrayList<>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.END_MARKER) {
            Token token = peek();
            if (!token.isKeyword("case")) {
                throw error("expected 'case' but found " + token.describe(), token);
            }
            cases.add(parseCase());
        }
        expect(TokenType.DEDENT, "dedent");
        return new Match(positionOf(keyword), subject, cases);
    }

    private MatchCase parseCase() throws SourceParseException {
        Token keyword = next();
        Pattern pattern = parseOpenSequencePattern();
        Expr guard = acceptKeyword("if") ? parseNamedExpression() : null;
        return new MatchCase(positionOf(keyword), pattern, guard, parseBlock());
    }

    /**
     * The pattern after {@code case}, where a bare comma list is a sequence.
     */
    private Pattern parseOpenSequencePattern() throws SourceParseException {
        Token start = peek();
        Pattern first = parseMaybeStarPattern();
        if (!peek().isOperator(",")) {
            if (first instanceof MatchStar) {
                throw error("cannot use starred pattern here", start);
            }
            return first;
        }
        List<Pattern> patterns = new ArrayList<>();
        patterns.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator(":") || peek().isKeyword("if")) {
                break;
            }
            patterns.add(parseMaybeStarPattern());
        }
        return new MatchSequence(positionOf(start), patterns);
    }

    private Pattern parseMaybeStarPattern() throws SourceParseException {
        Token token = peek();
        if (!accept(TokenType.OPERATOR, "*")) {
            return parsePattern();
        }
        String name = expectName().text();
        return new MatchStar(positionOf(token), "_".equals(name) ? null : name);
    }

    private Pattern parsePattern() throws SourceParseException {
        Pattern pattern = parseOrPattern();
        if (!acceptKeyword("as")) {
            return pattern;
        }
        Token name = expectName();
        if ("_".equals(name.text())) {
            throw error("cannot use '_' as a target", name);
        }
        return new MatchAs(pattern.position(), pattern, name.text());
    }

    private Pattern parseOrPattern() throws SourceParseException {
        Token start = peek();
        Pattern first = parseClosedPattern();
        if (!peek().isOperator("|")) {
            return first;
        }
        List<Pattern> alternatives = new ArrayList<>();
        alternatives.add(first);
        while (accept(TokenType.OPERATOR, "|")) {
            alternatives.add(parseClosedPattern());
        }
        return new MatchOr(positionOf(start), alternatives);
    }

    private Pattern parseClosedPattern() throws SourceParseException {
        Token token = peek();
        Position position = positionOf(token);
        if (token.type() == TokenType.NUMBER || token.isOperator("-")) {
            return new MatchValue(position, parseSignedNumber());
        }
        if (token.type() == TokenType.STRING) {
            return new MatchValue(position, parseLiteralString());
        }
        if (token.isOperator("(")) {
            return parseGroupOrSequencePattern();
        }
        if (token.isOperator("[")) {
            next();
            return new MatchSequence(position, parsePatternElements("]"));
        }
        if (token.isOperator("{")) {
            return parseMappingPattern();
        }
        if (token.isKeyword("None") || token.isKeyword("True") || token.isKeyword("False")) {
            return new MatchSingleton(position, (Constant) parseNameAtom(token));
        }
        if (token.type() != TokenType.NAME || KEYWORDS.contains(token.text())) {
            throw error("invalid pattern: unexpected " + token.describe(), token);
        }
        Expr target = parseDottedNameExpr();
        if (peek().isOperator("(")) {
            return parseClassPattern(position, target);
        }
        if (target instanceof Attribute) {
            return new MatchValue(position, target);
        }
        String name = token.text();
        return "_".equals(name) ? new MatchAs(position, null, null) : new MatchAs(position, null, name);
    }

    private Expr parseDottedNameExpr() throws SourceParseException {
        Token first = expectName();
        Expr expr = new Name(positionOf(first), first.text());
        while (accept(TokenType.OPERATOR, ".")) {
            expr = new Attribute(positionOf(first), expr, expectName().text());
        }
        return expr;
    }

    /**
     * A literal number, optionally negated, or a complex literal
     * {@code real +/- imaginary}.
     */
    private Expr parseSignedNumber() throws SourceParseException {
        Token start = peek();
        boolean negative = accept(TokenType.OPERATOR, "-");
        Token number = expect(TokenType.NUMBER, "a number");
        Expr value = new Constant(positionOf(number), numberKind(number.text()), number.text());
        if (negative) {
            value = new UnaryOp(positionOf(start), UnaryOperator.U_SUB, value);
        }
        if (!peek().isOperator("+") && !peek().isOperator("-")) {
            return value;
        }
        BinaryOperator op = next().isOperator("+") ? BinaryOperator.ADD : BinaryOperator.SUB;
        Token imaginary = expect(TokenType.NUMBER, "an imaginary number");
        if (numberKind(imaginary.text()) != ConstantKind.IMAGINARY) {
            throw error("imaginary number required in complex literal", imaginary);
        }
        return new BinOp(positionOf(start), value, op,
                new Constant(positionOf(imaginary), ConstantKind.IMAGINARY, imaginary.text()));
    }

    private Constant parseLiteralString() throws SourceParseException {
        Token token = peek();
        Constant literal = parseStrings();
        if (literal.constantKind() == ConstantKind.FORMATTED_STRING) {
            throw error("patterns may only match literals and attribute lookups", token);
        }
        return literal;
    }

    private Pattern parseGroupOrSequencePattern() throws SourceParseException {
        Token open = next();
        if (accept(TokenType.OPERATOR, ")")) {
            return new MatchSequence(positionOf(open), List.of());
        }
        Token start = peek();
        Pattern first = parseMaybeStarPattern();
        if (accept(TokenType.OPERATOR, ")")) {
            if (first instanceof MatchStar) {
                throw error("cannot use starred pattern here", start);
            }
            return first;
        }
        expectOperator(",");
        List<Pattern> patterns = new ArrayList<>();
        patterns.add(first);
        patterns.addAll(parsePatternElements(")"));
        return new MatchSequence(positionOf(open), patterns);
    }

    /**
     * Comma-separated patterns up to and including the closing bracket.
     */
    private List<Pattern> parsePatternElements(String close) throws SourceParseException {
        List<Pattern> patterns = new ArrayList<>();
        while (!peek().isOperator(close)) {
            patterns.add(parseMaybeStarPattern());
            if (!accept(TokenType.OPERATOR, ",")) {
                break;
            }
        }
        expectOperator(close);
        return patterns;
    }

    private Pattern parseMappingPattern() throws SourceParseException {
        Token open = next();
        List<Expr> keys = new ArrayList<>();
        List<Pattern> patterns = new ArrayList<>();
        String rest = null;
        while (!peek().isOperator("}")) {
            if (accept(TokenType.OPERATOR, "**")) {
                Token name = expectName();
                if ("_".equals(name.text())) {
                    throw error("cannot use '_' as a target", name);
                }
                rest = name.text();
                accept(TokenType.OPERATOR, ",");
                break;
            }
            keys.add(parseMappingKey());
            expectOperator(":");
            patterns.add(parsePattern());
            if (!accept(TokenType.OPERATOR, ",")) {
                break;
            }
        }
        expectOperator("}");
        return new MatchMapping(positionOf(open), keys, patterns, rest);
    }

    private Expr parseMappingKey() throws SourceParseException {
        Token token = peek();
        if (token.type() == TokenType.NUMBER || token.isOperator("-")) {
            return parseSignedNumber();
        }
        if (token.type() == TokenType.STRING) {
            return parseLiteralString();
        }
        if (token.isKeyword("None") || token.isKeyword("True") || token.isKeyword("False")) {
            return parseNameAtom(token);
        }
        if (token.type() == TokenType.NAME && !KEYWORDS.contains(token.text())) {
            Expr key = parseDottedNameExpr();
            if (key instanceof Attribute) {
                return key;
            }
        }
        throw error("mapping pattern keys may only match literals and attribute lookups", token);
    }

    private Pattern parseClassPattern(Position position, Expr cls) throws SourceParseException {
        expectOperator("(");
        List<Pattern> patterns = new ArrayList<>();
        List<String> kwdAttrs = new ArrayList<>();
        List<Pattern> kwdPatterns = new ArrayList<>();
        while (!peek().isOperator(")")) {
            Token token = peek();
            if (token.type() == TokenType.NAME && peekAhead(1).isOperator("=")) {
                next();
                next();
                kwdAttrs.add(token.text());
                kwdPatterns.add(parsePattern());
            } else if (!kwdAttrs.isEmpty()) {
                throw error("positional patterns follow keyword patterns", token);
            } else {
                patterns.add(parsePattern());
            }
            if (!accept(TokenType.OPERATOR, ",")) {
                break;
            }
        }
        expectOperator(")");
        return new MatchClass(position, cls, patterns, kwdAttrs, kwdPatterns);
    }

    // ---------------------------------------------------------------- expressions

    /**
     * Comma-separated expressions that may be starred. A single element
     * without a trailing comma is returned as is; otherwise a tuple is built.
     */
    private Expr parseStarExpressionList() throws SourceParseException {
        if (peek().isKeyword("yield")) {
            return parseYield();
        }
        Token start = peek();
        Expr first = parseStarOrExpression();
        if (!peek().isOperator(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (!startsExpression(peek())) {
                break;
            }
            elements.add(parseStarOrExpression());
        }
        return new TupleExpr(positionOf(start), elements);
    }

    /**
     * The iteration source of a {@code for} statement.
     */
    private Expr parseExpressionList() throws SourceParseException {
        return parseStarExpressionList();
    }

    /**
     * Loop and comprehension targets; stops before {@code in}.
     */
    private Expr parseTargetList() throws SourceParseException {
        Token start = peek();
        Expr first = parseTarget();
        if (!peek().isOperator(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isKeyword("in") || !startsExpression(peek())) {
                break;
            }
            elements.add(parseTarget());
        }
        return new TupleExpr(positionOf(start), elements);
    }

    private Expr parseTarget() throws SourceParseException {
        Token token = peek();
        if (accept(TokenType.OPERATOR, "*")) {
            return new Starred(positionOf(token), parseBitOr());
        }
        return parseBitOr();
    }

    private Expr parseStarOrNamed() throws SourceParseException {
        Token token = peek();
        if (accept(TokenType.OPERATOR, "*")) {
            return new Starred(positionOf(token), parseBitOr());
        }
        return parseNamedExpression();
    }

    /**
     * Statement-level elements, where a bare {@code :=} is not allowed.
     */
    private Expr parseStarOrExpression() throws SourceParseException {
        Token token = peek();
        if (accept(TokenType.OPERATOR, "*")) {
            return new Starred(positionOf(token), parseBitOr());
        }
        return parseExpression();
    }

    /**
     * An expression, or an assignment expression {@code name := value} in the
     * positions that accept one.
     */
    private Expr parseNamedExpression() throws SourceParseException {
        Expr expr = parseExpression();
        if (!peek().isOperator(":=")) {
            return expr;
        }
        Token operator = next();
        if (!(expr instanceof Name target)) {
            String what = expr instanceof Constant ? "literal" : expr.kind().name().toLowerCase(Locale.ROOT);
            throw error("cannot use assignment expressions with " + what, operator);
        }
        return new NamedExpr(target.position(), target, parseExpression());
    }

    /**
     * {@code test}: a lambda, a conditional expression or a disjunction.
     */
    public Expr parseExpression() throws SourceParseException {
        Token start = peek();
        if (start.isKeyword("lambda")) {
            return parseLambda();
        }
        Expr body = parseOr();
        if (acceptKeyword("if")) {
            Expr test = parseOr();
            expectKeyword("else");
            Expr orelse = parseExpression();
            return new IfExp(body.position(), body, test, orelse);
        }
        return body;
    }

    private Lambda parseLambda() throws SourceParseException {
        Token keyword = next();
        List<Parameter> parameters = parseParameters(":", false);
        expectOperator(":");
        return new Lambda(positionOf(keyword), parameters, parseExpression());
    }

    private Yield parseYield() throws SourceParseException {
        Token keyword = next();
        if (acceptKeyword("from")) {
            return new Yield(positionOf(keyword), parseExpression(), true);
        }
        Expr value = startsExpression(peek()) ? parseStarExpressionList() : null;
        return new Yield(positionOf(keyword), value, false);
    }

    private Expr parseOr() throws SourceParseException {
        Expr first = parseAnd();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) {
            values.add(parseAnd());
        }
        return new BoolOp(first.position(), BoolOperator.OR, values);
    }

    private Expr parseAnd() throws SourceParseException {
        Expr first = parseNot();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) {
            values.add(parseNot());
        }
        return new BoolOp(first.position(), BoolOperator.AND, values);
    }

    private Expr parseNot() throws SourceParseException {
        Token token = peek();
        if (acceptKeyword("not")) {
            return new UnaryOp(positionOf(token), UnaryOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() throws SourceParseException {
        Expr left = parseBitOr();
        List<CompareOperator> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            CompareOperator op = parseCompareOperator();
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(parseBitOr());
        }
        return ops.isEmpty() ? left : new Compare(left.position(), left, ops, comparators);
    }

    private @Nullable CompareOperator parseCompareOperator() throws SourceParseException {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && COMPARISON_OPERATORS.contains(token.text())) {
            next();
            return switch (token.text()) {
                case "<" -> CompareOperator.LT;
                case ">" -> CompareOperator.GT;
                case "==" -> CompareOperator.EQ;
                case ">=" -> CompareOperator.GT_E;
                case "<=" -> CompareOperator.LT_E;
                default -> CompareOperator.NOT_EQ;
            };
        }
        if (acceptKeyword("in")) {
            return CompareOperator.IN;
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            next();
            next();
            return CompareOperator.NOT_IN;
        }
        if (acceptKeyword("is")) {
            return acceptKeyword("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    private Expr parseBitOr() throws SourceParseException {
        return parseBinaryTier(0);
    }

    private Expr parseBinaryTier(int tier) throws SourceParseException {
        if (tier == BINARY_TIERS.size()) {
            return parseFactor();
        }
        Expr left = parseBinaryTier(tier + 1);
        while (peek().type() == TokenType.OPERATOR && BINARY_TIERS.get(tier).contains(peek().text())) {
            Token operator = next();
            Expr right = parseBinaryTier(tier + 1);
            BinaryOperator op = BinaryOperator.fromSymbol(operator.text())
                    .orElseThrow(() -> error("unknown operator " + operator.describe(), operator));
            left = new BinOp(left.position(), left, op, right);
        }
        return left;
    }

    private Expr parseFactor() throws SourceParseException {
        Token token = peek();
        UnaryOperator op = null;
        if (token.isOperator("-")) {
            op = UnaryOperator.U_SUB;
        } else if (token.isOperator("+")) {
            op = UnaryOperator.U_ADD;
        } else if (token.isOperator("~")) {
            op = UnaryOperator.INVERT;
        }
        if (op != null) {
            next();
            return new UnaryOp(positionOf(token), op, parseFactor());
        }
        return parsePower();
    }

    private Expr parsePower() throws SourceParseException {
        Token token = peek();
        Expr base = acceptKeyword("await")
                ? new Await(positionOf(token), parsePrimary())
                : parsePrimary();
        if (accept(TokenType.OPERATOR, "**")) {
            // right associative, and binds tighter than a unary minus on its left only
            return new BinOp(base.position(), base, BinaryOperator.POW, parseFactor());
        }
        return base;
    }

    private Expr parsePrimary() throws SourceParseException {
        Expr expr = parseAtom();
        while (true) {
            if (accept(TokenType.OPERATOR, "(")) {
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                parseArguments(args, keywords);
                expectOperator(")");
                expr = new Call(expr.position(), expr, args, keywords);
            } else if (accept(TokenType.OPERATOR, "[")) {
                Expr slice = parseSubscriptList();
                expectOperator("]");
                expr = new Subscript(expr.position(), expr, slice);
            } else if (accept(TokenType.OPERATOR, ".")) {
                expr = new Attribute(expr.position(), expr, expectName().text());
            } else {
                return expr;
            }
        }
    }

    /**
     * Call arguments up to (not including) the closing parenthesis. A sole
     * argument followed by {@code for} is a generator expression.
     */
    private void parseArguments(List<Expr> args, List<Keyword> keywords) throws SourceParseException {
        while (!peek().isOperator(")")) {
            Token token = peek();
            if (accept(TokenType.OPERATOR, "*")) {
                args.add(new Starred(positionOf(token), parseExpression()));
            } else if (accept(TokenType.OPERATOR, "**")) {
                keywords.add(new Keyword(null, parseExpression()));
            } else if (token.type() == TokenType.NAME && peekAhead(1).isOperator("=")) {
                next();
                next();
                keywords.add(new Keyword(token.text(), parseExpression()));
            } else {
                Expr arg = parseNamedExpression();
                if (startsComprehension()) {
                    arg = new Comprehension(arg.position(), ComprehensionKind.GENERATOR, arg, null,
                            parseComprehensionClauses());
                }
                args.add(arg);
            }
            if (!accept(TokenType.OPERATOR, ",")) {
                break;
            }
        }
    }

    private Expr parseSubscriptList() throws SourceParseException {
        Token start = peek();
        Expr first = parseSubscriptItem();
        if (!peek().isOperator(",")) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator("]")) {
                break;
            }
            elements.add(parseSubscriptItem());
        }
        return new TupleExpr(positionOf(start), elements);
    }

    private Expr parseSubscriptItem() throws SourceParseException {
        Token start = peek();
        Expr lower = null;
        if (!start.isOperator(":")) {
            lower = parseStarOrNamed();
            if (!peek().isOperator(":")) {
                return lower;
            }
        }
        expectOperator(":");
        Expr upper = null;
        Expr step = null;
        if (!peek().isOperator(":") && !peek().isOperator("]") && !peek().isOperator(",")) {
            upper = parseExpression();
        }
        if (accept(TokenType.OPERATOR, ":") && !peek().isOperator("]") && !peek().isOperator(",")) {
            step = parseExpression();
        }
        return new Slice(positionOf(start), lower, upper, step);
    }

    private Expr parseAtom() throws SourceParseException {
        Token token = peek();
        Position position = positionOf(token);
        switch (token.type()) {
            case NAME -> {
                return parseNameAtom(token);
            }
            case NUMBER -> {
                next();
                return new Constant(position, numberKind(token.text()), token.text());
            }
            case STRING -> {
                return parseStrings();
            }
            case OPERATOR -> {
                switch (token.text()) {
                    case "(" -> {
                        return parseParenthesized();
                    }
                    case "[" -> {
                        return parseListDisplay();
                    }
                    case "{" -> {
                        return parseBraceDisplay();
                    }
                    case "..." -> {
                        next();
                        return new Constant(position, ConstantKind.ELLIPSIS, "...");
                    }
                    default -> throw error("invalid syntax: unexpected " + token.describe(), token);
                }
            }
            default -> throw error("invalid syntax: unexpected " + token.describe(), token);
        }
    }

    private Expr parseNameAtom(Token token) throws SourceParseException {
        Position position = positionOf(token);
        switch (token.text()) {
            case "True", "False" -> {
                next();
                return new Constant(position, ConstantKind.BOOLEAN, token.text());
            }
            case "None" -> {
                next();
                return new Constant(position, ConstantKind.NONE, "None");
            }
            default -> {
                if (KEYWORDS.contains(token.text())) {
                    throw error("invalid syntax: unexpected keyword '" + token.text() + "'", token);
                }
                next();
                return new Name(position, token.text());
            }
        }
    }

    /**
     * Adjacent string literals concatenate into one constant; the literal text
     * keeps each piece as written, separated by a space.
     */
    private Constant parseStrings() {
        Token first = peek();
        List<String> pieces = new ArrayList<>();
        ConstantKind kind = ConstantKind.STRING;
        while (peek().type() == TokenType.STRING) {
            Token token = next();
            pieces.add(token.text());
            String prefix = stringPrefix(token.text());
            if (prefix.contains("f")) {
                kind = ConstantKind.FORMATTED_STRING;
            } else if (prefix.contains("b") && kind == ConstantKind.STRING) {
                kind = ConstantKind.BYTES;
            }
        }
        return new Constant(positionOf(first), kind, String.join(" ", pieces));
    }

    private static String stringPrefix(String literal) {
        int end = 0;
        while (end < literal.length() && literal.charAt(end) != '\'' && literal.charAt(end) != '"') {
            end++;
        }
        return literal.substring(0, end).toLowerCase(Locale.ROOT);
    }

    static ConstantKind numberKind(String literal) {
        String lower = literal.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return ConstantKind.IMAGINARY;
        }
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return ConstantKind.INTEGER;
        }
        if (lower.contains(".") || lower.contains("e")) {
            return ConstantKind.FLOAT;
        }
        return ConstantKind.INTEGER;
    }

    private Expr parseParenthesized() throws SourceParseException {
        Token open = next();
        Position position = positionOf(open);
        if (accept(TokenType.OPERATOR, ")")) {
            return new TupleExpr(position, List.of());
        }
        if (peek().isKeyword("yield")) {
            Expr yield = parseYield();
            expectOperator(")");
            return yield;
        }
        Expr first = parseStarOrNamed();
        if (startsComprehension()) {
            Comprehension generator = new Comprehension(position, ComprehensionKind.GENERATOR, first, null,
                    parseComprehensionClauses());
            expectOperator(")");
            return generator;
        }
        if (!peek().isOperator(",")) {
            expectOperator(")");
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator(")")) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        expectOperator(")");
        return new TupleExpr(position, elements);
    }

    private Expr parseListDisplay() throws SourceParseException {
        Token open = next();
        Position position = positionOf(open);
        if (accept(TokenType.OPERATOR, "]")) {
            return new ListExpr(position, List.of());
        }
        Expr first = parseStarOrNamed();
        if (startsComprehension()) {
            Comprehension comprehension = new Comprehension(position, ComprehensionKind.LIST, first, null,
                    parseComprehensionClauses());
            expectOperator("]");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator("]")) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        expectOperator("]");
        return new ListExpr(position, elements);
    }

    private Expr parseBraceDisplay() throws SourceParseException {
        Token open = next();
        Position position = positionOf(open);
        if (accept(TokenType.OPERATOR, "}")) {
            return new DictExpr(position, List.of(), List.of());
        }

        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (accept(TokenType.OPERATOR, "**")) {
            keys.add(null);
            values.add(parseBitOr());
            return parseDictRest(position, keys, values);
        }

        Expr first = parseStarOrNamed();
        if (accept(TokenType.OPERATOR, ":")) {
            Expr value = parseExpression();
            if (startsComprehension()) {
                Comprehension comprehension = new Comprehension(position, ComprehensionKind.DICT, first, value,
                        parseComprehensionClauses());
                expectOperator("}");
                return comprehension;
            }
            keys.add(first);
            values.add(value);
            return parseDictRest(position, keys, values);
        }

        if (startsComprehension()) {
            Comprehension comprehension = new Comprehension(position, ComprehensionKind.SET, first, null,
                    parseComprehensionClauses());
            expectOperator("}");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator("}")) {
                break;
            }
            elements.add(parseStarOrNamed());
        }
        expectOperator("}");
        return new SetExpr(position, elements);
    }

    private DictExpr parseDictRest(Position position, List<Expr> keys, List<Expr> values) throws SourceParseException {
        while (accept(TokenType.OPERATOR, ",")) {
            if (peek().isOperator("}")) {
                break;
            }
            if (accept(TokenType.OPERATOR, "**")) {
                keys.add(null);
                values.add(parseBitOr());
            } else {
                keys.add(parseExpression());
                expectOperator(":");
                values.add(parseExpression());
            }
        }
        expectOperator("}");
        return new DictExpr(position, keys, values);
    }

    private List<ComprehensionClause> parseComprehensionClauses() throws SourceParseException {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (startsComprehension()) {
            boolean async = acceptKeyword("async");
            Token keyword = next();
            Expr target = parseTargetList();
            checkAssignable(target, keyword);
            expectKeyword("in");
            Expr iter = parseOr();
            List<Expr> conditions = new ArrayList<>();
            while (acceptKeyword("if")) {
                conditions.add(parseOr());
            }
            clauses.add(new ComprehensionClause(target, iter, conditions, async));
        }
        return clauses;
    }

    // ---------------------------------------------------------------- helpers

    private void checkAssignable(Expr target, Token at) throws SourceParseException {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return;
        }
        if (target instanceof Starred starred) {
            checkAssignable(starred.value(), at);
            return;
        }
        if (target instanceof TupleExpr tuple) {
            for (Expr element : tuple.elements()) {
                checkAssignable(element, at);
            }
            return;
        }
        if (target instanceof ListExpr list) {
            for (Expr element : list.elements()) {
                checkAssignable(element, at);
            }
            return;
        }
        String what = target instanceof Constant ? "literal" : target.kind().name().toLowerCase(Locale.ROOT);
        throw new SourceParseException("cannot assign to " + what, target.line() > 0 ? target.line() : at.line(),
                target.line() > 0 ? target.position().column() : at.column());
    }

    /**
     * Whether the token can begin an expression. Used to decide if a trailing
     * comma ends a list and if {@code return}/{@code yield} carry a value.
     */
    private static boolean startsExpression(Token token) {
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case NAME -> !KEYWORDS.contains(token.text())
                    || Set.of("True", "False", "None", "not", "lambda", "await", "yield").contains(token.text());
            case OPERATOR -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.text());
            default -> false;
        };
    }

    private boolean startsComprehension() {
        return peek().isKeyword("for") || peek().isKeyword("async") && peekAhead(1).isKeyword("for");
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        int target = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(target);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private boolean accept(TokenType type, String text) {
        if (peek().is(type, text)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        return accept(TokenType.NAME, keyword);
    }

    private Token expect(TokenType type, String description) throws SourceParseException {
        Token token = peek();
        if (token.type() != type) {
            throw error("expected " + description + " but found " + token.describe(), token);
        }
        return next();
    }

    private void expectOperator(String op) throws SourceParseException {
        if (!accept(TokenType.OPERATOR, op)) {
            throw error("expected '" + op + "' but found " + peek().describe(), peek());
        }
    }

    private void expectKeyword(String keyword) throws SourceParseException {
        if (!acceptKeyword(keyword)) {
            throw error("expected '" + keyword + "' but found " + peek().describe(), peek());
        }
    }

    private Token expectName() throws SourceParseException {
        Token token = peek();
        if (token.type() != TokenType.NAME || KEYWORDS.contains(token.text())) {
            throw error("expected a name but found " + token.describe(), token);
        }
        return next();
    }

    private static Position positionOf(Token token) {
        return new Position(token.line(), token.column());
    }

    private static SourceParseException error(String message, Token token) {
        return new SourceParseException(message, token.line(), token.column());
    }
}
