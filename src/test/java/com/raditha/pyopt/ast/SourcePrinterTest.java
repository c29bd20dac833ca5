package com.raditha.pyopt.ast;

import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.stmt.ExprStmt;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourcePrinterTest {

    private static String reprint(String source) throws SourceParseException {
        return SourcePrinter.print(PythonParser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "a + b * c",
            "(a + b) * c",
            "a - b - c",
            "a - (b - c)",
            "-x ** 2",
            "(-x) ** 2",
            "a ** b ** c",
            "(a ** b) ** c",
            "not a and b",
            "not (a and b)",
            "a or b and c",
            "(a or b) and c",
            "a < b <= c",
            "a not in b",
            "a is not None",
            "x if y else z",
            "lambda x, y=1: x + y",
            "[i * j for j in range(5) if j]",
            "{'a': 1, **rest}",
            "{k: v for k, v in pairs}",
            "{1, 2}",
            "f(*args, key=1, **kw)",
            "sum(x for x in data)",
            "a[1:2]",
            "a[::-1]",
            "a[i, j]",
            "x.y.z(1)",
            "(1).real",
            "(1,)",
            "()",
            "'a' 'b'",
            "f'{x!r}'",
            "...",
            "(n := 10)",
            "await x",
            "await f() ** 2",
            "[x async for x in stream()]"
    })
    void testExpressionRoundTrip(String expression) throws SourceParseException {
        assertEquals(expression + "\n", reprint(expression + "\n"));
    }

    @Test
    void testModuleLayout() throws SourceParseException {
        String source = """
                import itertools
                from os import path as p


                def f(a, b=2, *args, c, **kwargs):
                    return a + b * c


                @decorator
                class Point(Base):
                    x: int = 0

                    def norm(self) -> float:
                        return (self.x ** 2 + 1) ** 0.5
                """;
        assertEquals(source, reprint(source));
    }

    @Test
    void testControlFlowLayout() throws SourceParseException {
        String source = """
                for i in range(10):
                    if i % 2 == 0:
                        continue
                    elif i > 7:
                        break
                    else:
                        total += i
                else:
                    done = True
                while not done:
                    pass
                try:
                    risky()
                except (ValueError, KeyError) as e:
                    raise RuntimeError('bad') from e
                finally:
                    cleanup()
                with open(name) as handle, lock:
                    data = handle.read()
                """;
        assertEquals(source, reprint(source));
    }

    @Test
    void testAsyncLayout() throws SourceParseException {
        String source = """
                @cached
                async def fetch(urls):
                    async with session() as s:
                        async for url in urls:
                            data = await s.get(url)
                    return [x async for x in stream()]
                """;
        assertEquals(source, reprint(source));
    }

    @Test
    void testExceptStarLayout() throws SourceParseException {
        String source = """
                try:
                    run()
                except* ValueError as group:
                    pass
                except* TypeError:
                    pass
                """;
        assertEquals(source, reprint(source));
    }

    @Test
    void testMatchLayout() throws SourceParseException {
        String source = """
                match command:
                    case [action, *rest] if rest:
                        pass
                    case {'x': 0, **others}:
                        pass
                    case Point(1, y=-2) | None:
                        pass
                    case (1 | 2) as n:
                        pass
                    case Color.RED:
                        pass
                    case 1 + 2j:
                        pass
                    case _:
                        pass
                """;
        assertEquals(source, reprint(source));
    }

    @Test
    void testOpenSequencePatternGetsBrackets() throws SourceParseException {
        assertEquals("match p:\n    case [a, *_]:\n        pass\n", reprint("match p:\n    case a, *_:\n        pass\n"));
    }

    @Test
    void testLayoutIsRegenerated() throws SourceParseException {
        String source = "x=( 1+2 )  # comment\nif x :  y = 1\n";
        assertEquals("x = 1 + 2\nif x:\n    y = 1\n", reprint(source));
    }

    @Test
    void testReprintIsStable() throws SourceParseException {
        String source = "def g(n):\n  for i in range(n):\n        yield i*i\n";
        String once = reprint(source);
        assertEquals(once, reprint(once));
        assertEquals("def g(n):\n    for i in range(n):\n        yield i * i\n", once);
    }

    @Test
    void testEmptyModule() {
        assertEquals("", SourcePrinter.print(new Module(List.of())));
    }

    @Test
    void testConstructedTreeGetsParentheses() {
        Position p = new Position(1, 0);
        BinOp sum = new BinOp(p, new Name(p, "a"), BinaryOperator.ADD, new Name(p, "b"));
        BinOp product = new BinOp(p, sum, BinaryOperator.MULT, new Name(p, "c"));
        assertEquals("(a + b) * c", SourcePrinter.printExpression(product));
        assertEquals("(a + b) * c\n", SourcePrinter.print(new ExprStmt(p, product)));
    }
}
