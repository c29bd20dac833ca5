package com.raditha.pyopt.parser;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.ParameterKind;
import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Await;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Compare;
import com.raditha.pyopt.ast.expr.CompareOperator;
import com.raditha.pyopt.ast.expr.Comprehension;
import com.raditha.pyopt.ast.expr.ComprehensionKind;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.ConstantKind;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.NamedExpr;
import com.raditha.pyopt.ast.expr.Subscript;
import com.raditha.pyopt.ast.expr.TupleExpr;
import com.raditha.pyopt.ast.expr.UnaryOp;
import com.raditha.pyopt.ast.pattern.MatchAs;
import com.raditha.pyopt.ast.pattern.MatchClass;
import com.raditha.pyopt.ast.pattern.MatchMapping;
import com.raditha.pyopt.ast.pattern.MatchOr;
import com.raditha.pyopt.ast.pattern.MatchSequence;
import com.raditha.pyopt.ast.pattern.MatchSingleton;
import com.raditha.pyopt.ast.pattern.MatchStar;
import com.raditha.pyopt.ast.pattern.MatchValue;
import com.raditha.pyopt.ast.stmt.Assign;
import com.raditha.pyopt.ast.stmt.AugAssign;
import com.raditha.pyopt.ast.stmt.ExprStmt;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.FunctionDef;
import com.raditha.pyopt.ast.stmt.If;
import com.raditha.pyopt.ast.stmt.ImportFrom;
import com.raditha.pyopt.ast.stmt.Match;
import com.raditha.pyopt.ast.stmt.MatchCase;
import com.raditha.pyopt.ast.stmt.Return;
import com.raditha.pyopt.ast.stmt.Try;
import com.raditha.pyopt.ast.stmt.While;
import com.raditha.pyopt.ast.stmt.With;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PythonParserTest {

    private static ExprStmt expressionStatement(String source) throws SourceParseException {
        return (ExprStmt) PythonParser.parse(source).body().get(0);
    }

    @Test
    void testParseForLoop() throws SourceParseException {
        Module module = PythonParser.parse("for i in range(10):\n    total += i\n");

        assertEquals(1, module.body().size());
        For loop = assertInstanceOf(For.class, module.body().get(0));
        assertEquals(1, loop.line());
        assertEquals("i", assertInstanceOf(Name.class, loop.target()).id());

        Call iter = assertInstanceOf(Call.class, loop.iter());
        assertTrue(iter.callsName("range"));
        assertEquals(1, iter.args().size());

        AugAssign body = assertInstanceOf(AugAssign.class, loop.body().get(0));
        assertEquals(BinaryOperator.ADD, body.op());
        assertEquals(2, body.line());
        assertTrue(loop.orelse().isEmpty());
    }

    @Test
    void testForWithTupleTargetAndElse() throws SourceParseException {
        For loop = (For) PythonParser.parse("for k, v in items:\n    pass\nelse:\n    done = True\n")
                .body().get(0);
        assertEquals(2, assertInstanceOf(TupleExpr.class, loop.target()).elements().size());
        assertEquals(1, loop.orelse().size());
    }

    @Test
    void testElifBecomesNestedIf() throws SourceParseException {
        If statement = (If) PythonParser.parse("""
                if a:
                    x = 1
                elif b:
                    x = 2
                else:
                    x = 3
                """).body().get(0);

        assertTrue(statement.hasElif());
        If nested = (If) statement.orelse().get(0);
        assertEquals(3, nested.line());
        assertEquals(1, nested.orelse().size());
    }

    @Test
    void testFunctionParameters() throws SourceParseException {
        FunctionDef def = (FunctionDef) PythonParser.parse(
                "def f(a, b: int = 2, *args, c, **kwargs) -> int:\n    return a\n").body().get(0);

        assertEquals("f", def.name());
        assertEquals(List.of(ParameterKind.NORMAL, ParameterKind.NORMAL, ParameterKind.VAR_POSITIONAL,
                        ParameterKind.NORMAL, ParameterKind.VAR_KEYWORD),
                def.parameters().stream().map(p -> p.kind()).toList());
        assertNotNull(def.parameters().get(1).annotation());
        assertNotNull(def.parameters().get(1).defaultValue());
        assertNotNull(def.returns());
    }

    @Test
    void testTryExceptElseFinally() throws SourceParseException {
        Try statement = (Try) PythonParser.parse("""
                try:
                    risky()
                except ValueError as e:
                    handle(e)
                except:
                    pass
                else:
                    ok()
                finally:
                    cleanup()
                """).body().get(0);

        assertEquals(2, statement.handlers().size());
        assertEquals("e", statement.handlers().get(0).name());
        assertNull(statement.handlers().get(1).type());
        assertEquals(1, statement.orelse().size());
        assertEquals(1, statement.finalbody().size());
    }

    @Test
    void testRelativeImportFrom() throws SourceParseException {
        ImportFrom from = (ImportFrom) PythonParser.parse("from ..pkg import (a, b as c)\n").body().get(0);
        assertEquals(2, from.level());
        assertEquals("pkg", from.module());
        assertEquals("c", from.names().get(1).asname());
    }

    @Test
    void testSemicolonSeparatedStatements() throws SourceParseException {
        assertEquals(3, PythonParser.parse("a = 1; b = 2; c = 3\n").body().size());
    }

    @Test
    void testChainedAssignment() throws SourceParseException {
        Assign assign = (Assign) PythonParser.parse("a = b = 0\n").body().get(0);
        assertEquals(2, assign.targets().size());
    }

    @Test
    void testOperatorPrecedence() throws SourceParseException {
        BinOp sum = assertInstanceOf(BinOp.class, expressionStatement("a + b * c\n").value());
        assertEquals(BinaryOperator.ADD, sum.op());
        assertEquals(BinaryOperator.MULT, assertInstanceOf(BinOp.class, sum.right()).op());
    }

    @Test
    void testPowerBindsTighterThanUnaryMinus() throws SourceParseException {
        UnaryOp negation = assertInstanceOf(UnaryOp.class, expressionStatement("-x ** 2\n").value());
        assertEquals(BinaryOperator.POW, assertInstanceOf(BinOp.class, negation.operand()).op());
    }

    @Test
    void testPowerIsRightAssociative() throws SourceParseException {
        BinOp power = assertInstanceOf(BinOp.class, expressionStatement("a ** b ** c\n").value());
        assertInstanceOf(Name.class, power.left());
        assertInstanceOf(BinOp.class, power.right());
    }

    @Test
    void testComparisonChain() throws SourceParseException {
        Compare compare = assertInstanceOf(Compare.class,
                expressionStatement("a < b not in c is not d\n").value());
        assertEquals(List.of(CompareOperator.LT, CompareOperator.NOT_IN, CompareOperator.IS_NOT), compare.ops());
    }

    @Test
    void testGeneratorArgumentAndComprehensions() throws SourceParseException {
        Call call = assertInstanceOf(Call.class, expressionStatement("sum(x * x for x in data if x)\n").value());
        Comprehension generator = assertInstanceOf(Comprehension.class, call.args().get(0));
        assertEquals(ComprehensionKind.GENERATOR, generator.comprehensionKind());
        assertEquals(1, generator.generators().get(0).conditions().size());

        Comprehension dict = assertInstanceOf(Comprehension.class, expressionStatement("{k: v for k, v in p}\n").value());
        assertEquals(ComprehensionKind.DICT, dict.comprehensionKind());
    }

    @Test
    void testSubscriptAndSlice() throws SourceParseException {
        Subscript subscript = assertInstanceOf(Subscript.class, expressionStatement("matrix[i][j]\n").value());
        assertInstanceOf(Subscript.class, subscript.value());
        assertEquals("j", assertInstanceOf(Name.class, subscript.slice()).id());
    }

    @Test
    void testIntegerLiterals() throws SourceParseException {
        Constant hex = assertInstanceOf(Constant.class, expressionStatement("0x10000\n").value());
        assertEquals(Optional.of(BigInteger.valueOf(65536)), hex.integerValue());

        Constant big = assertInstanceOf(Constant.class, expressionStatement("1_000_000_000_000_000_000_000\n").value());
        assertEquals(Optional.of(new BigInteger("1000000000000000000000")), big.integerValue());

        Constant real = assertInstanceOf(Constant.class, expressionStatement("2.5\n").value());
        assertEquals(ConstantKind.FLOAT, real.constantKind());
        assertTrue(real.integerValue().isEmpty());
    }

    @Test
    void testAdjacentStringsConcatenate() throws SourceParseException {
        Constant text = assertInstanceOf(Constant.class, expressionStatement("'a' f'{b}'\n").value());
        assertEquals(ConstantKind.FORMATTED_STRING, text.constantKind());
        assertEquals("'a' f'{b}'", text.literal());
    }

    @Test
    void testMissingColonReportsPosition() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonParser.parse("x = 1\nfor i in range(10)\n    x += i\n"));
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("expected ':'"), e.getMessage());
    }

    @Test
    void testMissingIndentedBlock() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonParser.parse("def f():\nreturn 1\n"));
        assertEquals("expected an indented block", e.getSyntaxError().message());
        assertEquals(2, e.getLine());
        assertEquals(0, e.getColumn());
    }

    @Test
    void testUnexpectedIndent() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonParser.parse("x = 1\n    y = 2\n"));
        assertEquals("unexpected indent", e.getSyntaxError().message());
    }

    @Test
    void testAssignToLiteralRejected() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> PythonParser.parse("1 = x\n"));
        assertTrue(e.getMessage().contains("cannot assign to"), e.getMessage());
    }

    @Test
    void testAssignmentExpressions() throws SourceParseException {
        Module module = PythonParser.parse("""
                if (n := 10) > 5:
                    pass
                while chunk := read():
                    print(size := len(chunk))
                """);
        If test = (If) module.body().get(0);
        Compare compare = assertInstanceOf(Compare.class, test.test());
        NamedExpr named = assertInstanceOf(NamedExpr.class, compare.left());
        assertEquals("n", named.target().id());
        assertEquals("10", ((Constant) named.value()).literal());

        While loop = (While) module.body().get(1);
        assertEquals("chunk", assertInstanceOf(NamedExpr.class, loop.test()).target().id());
        Call print = (Call) ((ExprStmt) loop.body().get(0)).value();
        assertInstanceOf(NamedExpr.class, print.args().get(0));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x := 1\n",
            "y = x := 1\n",
            "(a.b := 1)\n",
            "(f() := 1)\n"
    })
    void testMisplacedAssignmentExpressionRejected(String source) {
        assertThrows(SourceParseException.class, () -> PythonParser.parse(source));
    }

    @Test
    void testAssignmentExpressionTargetMustBeName() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> PythonParser.parse("(a.b := 1)\n"));
        assertEquals("cannot use assignment expressions with attribute", e.getSyntaxError().message());
    }

    @Test
    void testAsyncConstructs() throws SourceParseException {
        Module module = PythonParser.parse("""
                @cached
                async def fetch(urls):
                    async with session() as s:
                        async for url in urls:
                            data = await s.get(url)
                    return [x async for x in stream()]
                """);
        FunctionDef fetch = (FunctionDef) module.body().get(0);
        assertTrue(fetch.isAsync());
        assertEquals(1, fetch.decorators().size());
        assertEquals(2, fetch.line());

        With with = (With) fetch.body().get(0);
        assertTrue(with.isAsync());
        For loop = (For) with.body().get(0);
        assertTrue(loop.isAsync());
        Assign assign = (Assign) loop.body().get(0);
        Await await = assertInstanceOf(Await.class, assign.value());
        assertInstanceOf(Call.class, await.value());

        Return ret = (Return) fetch.body().get(1);
        Comprehension comprehension = assertInstanceOf(Comprehension.class, ret.value());
        assertTrue(comprehension.generators().get(0).isAsync());
    }

    @Test
    void testAwaitBindsTighterThanPower() throws SourceParseException {
        BinOp power = assertInstanceOf(BinOp.class, expressionStatement("await a ** 2\n").value());
        assertEquals(BinaryOperator.POW, power.op());
        assertInstanceOf(Await.class, power.left());
    }

    @Test
    void testPlainLoopsAreNotAsync() throws SourceParseException {
        Module module = PythonParser.parse("def f():\n    for i in x:\n        pass\n");
        FunctionDef f = (FunctionDef) module.body().get(0);
        assertFalse(f.isAsync());
        assertFalse(((For) f.body().get(0)).isAsync());
    }

    @Test
    void testAsyncMustPrecedeDefForOrWith() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> PythonParser.parse("async while x:\n    pass\n"));
        assertTrue(e.getMessage().contains("after 'async'"), e.getMessage());
    }

    @Test
    void testExceptStar() throws SourceParseException {
        Try t = (Try) PythonParser.parse("""
                try:
                    run()
                except* ValueError as group:
                    pass
                except* (TypeError, KeyError):
                    pass
                """).body().get(0);
        assertTrue(t.isStar());
        assertEquals(2, t.handlers().size());
        assertEquals("group", t.handlers().get(0).name());
        assertFalse(((Try) PythonParser.parse("try:\n    pass\nexcept E:\n    pass\n").body().get(0)).isStar());
    }

    @Test
    void testMixedExceptAndExceptStarRejected() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> PythonParser.parse("""
                try:
                    pass
                except ValueError:
                    pass
                except* TypeError:
                    pass
                """));
        assertEquals(5, e.getLine());
    }

    @Test
    void testMatchStatement() throws SourceParseException {
        Module module = PythonParser.parse("""
                match command.split():
                    case [action]:
                        pass
                    case ["go", direction] if direction in exits:
                        pass
                    case Point(0, y=0) | None:
                        pass
                    case {"x": -1 + 2j, **rest}:
                        pass
                    case (1 | 2) as n:
                        pass
                    case Color.RED:
                        pass
                    case first, *others:
                        pass
                    case _:
                        pass
                """);
        Match match = (Match) module.body().get(0);
        assertInstanceOf(Call.class, match.subject());
        List<MatchCase> cases = match.cases();
        assertEquals(8, cases.size());

        MatchSequence single = assertInstanceOf(MatchSequence.class, cases.get(0).pattern());
        assertEquals("action", ((MatchAs) single.patterns().get(0)).name());
        assertNull(cases.get(0).guard());

        assertInstanceOf(MatchValue.class, ((MatchSequence) cases.get(1).pattern()).patterns().get(0));
        assertInstanceOf(Compare.class, cases.get(1).guard());

        MatchOr alternatives = assertInstanceOf(MatchOr.class, cases.get(2).pattern());
        MatchClass point = assertInstanceOf(MatchClass.class, alternatives.patterns().get(0));
        assertEquals(1, point.patterns().size());
        assertEquals(List.of("y"), point.kwdAttrs());
        assertInstanceOf(MatchSingleton.class, alternatives.patterns().get(1));

        MatchMapping mapping = assertInstanceOf(MatchMapping.class, cases.get(3).pattern());
        assertEquals("rest", mapping.rest());
        MatchValue complex = assertInstanceOf(MatchValue.class, mapping.patterns().get(0));
        assertInstanceOf(BinOp.class, complex.value());

        MatchAs capture = assertInstanceOf(MatchAs.class, cases.get(4).pattern());
        assertEquals("n", capture.name());
        assertInstanceOf(MatchOr.class, capture.pattern());

        assertInstanceOf(Attribute.class, assertInstanceOf(MatchValue.class, cases.get(5).pattern()).value());

        MatchSequence open = assertInstanceOf(MatchSequence.class, cases.get(6).pattern());
        assertEquals("others", assertInstanceOf(MatchStar.class, open.patterns().get(1)).name());

        assertTrue(assertInstanceOf(MatchAs.class, cases.get(7).pattern()).isWildcard());
    }

    @Test
    void testMatchAndCaseStayUsableAsNames() throws SourceParseException {
        Module module = PythonParser.parse("""
                match = pattern.match(line)
                match.group(0)
                case = match
                print(match, case)
                """);
        assertEquals(4, module.body().size());
        assertInstanceOf(Assign.class, module.body().get(0));
        assertInstanceOf(ExprStmt.class, module.body().get(1));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "match x:\n    case *rest:\n        pass\n",
            "match x:\n    case a as _:\n        pass\n",
            "match x:\n    case {**_}:\n        pass\n",
            "match x:\n    case f'{y}':\n        pass\n",
            "match x:\n    case 1 + 2:\n        pass\n",
            "match x:\n    case Point(x=1, 2):\n        pass\n",
            "match x:\n    case {name: 1}:\n        pass\n",
            "match x:\n    case 1:\n        pass\n    y = 2\n"
    })
    void testInvalidMatchRejected(String source) {
        assertThrows(SourceParseException.class, () -> PythonParser.parse(source));
    }
}
