package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.SourcePrinter;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.FunctionDef;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoopFlatteningRuleTest {

    private final LoopFlatteningRule rule = new LoopFlatteningRule();

    private static RewriteResult applyToFirstLoop(LoopRewriteRule rule, String source) throws SourceParseException {
        Module module = PythonParser.parse(source);
        For loop = (For) module.body().get(0);
        return rule.apply(loop, RewriteContext.forModule(module));
    }

    @Test
    void testFlattensPerfectNest() throws SourceParseException {
        RewriteResult result = applyToFirstLoop(rule, """
                for i in range(5):
                    for j in range(5):
                        total += matrix[i][j]
                """);
        RewriteResult.Replaced replaced = assertInstanceOf(RewriteResult.Replaced.class, result);
        assertEquals(1, replaced.statements().size());
        assertEquals(Set.of(ImportRequirement.CROSS_PRODUCT), replaced.requiredImports());
        assertEquals("for i, j in itertools.product(range(5), range(5)):\n    total += matrix[i][j]\n",
                SourcePrinter.print(replaced.statements().get(0)));
    }

    @Test
    void testReplacementKeepsOuterLine() throws SourceParseException {
        Module module = PythonParser.parse("\n\nfor i in range(2):\n    for j in range(3):\n        f(i, j)\n");
        For loop = (For) module.body().get(0);
        RewriteResult.Replaced replaced = (RewriteResult.Replaced) rule.apply(loop, RewriteContext.forModule(module));
        assertEquals(3, replaced.statements().get(0).line());
    }

    @Test
    void testUsesExistingItertoolsAlias() throws SourceParseException {
        RewriteResult result = applyToFirstLoop(rule, """
                for a in xs():
                    for b in ys():
                        g(a, b)
                """);
        assertTrue(result.isReplaced());

        Module module = PythonParser.parse("""
                import itertools as it
                for a in xs():
                    for b in ys():
                        g(a, b)
                """);
        RewriteResult.Replaced replaced = (RewriteResult.Replaced) rule.apply((For) module.body().get(1),
                RewriteContext.forModule(module));
        assertTrue(SourcePrinter.print(replaced.statements().get(0)).startsWith("for a, b in it.product(xs(), ys()):"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            // extra statement in the outer body
            "for i in range(3):\n    x = i\n    for j in range(3):\n        f(i, j)\n",
            // inner source depends on the outer variable
            "for i in range(3):\n    for j in range(i):\n        f(i, j)\n",
            // break in the inner body
            "for i in range(3):\n    for j in range(3):\n        if j:\n            break\n",
            // else on the inner loop
            "for i in range(3):\n    for j in range(3):\n        f(i, j)\n    else:\n        g()\n",
            // else on the outer loop
            "for i in range(3):\n    for j in range(3):\n        f(i, j)\nelse:\n    g()\n",
            // tuple target
            "for i, k in pairs():\n    for j in range(3):\n        f(i, j)\n",
            // non-call sources
            "for i in rows:\n    for j in cols:\n        f(i, j)\n",
            // no nested loop at all
            "for i in range(3):\n    f(i)\n",
            // inner body reassigns the outer variable
            "for i in range(2):\n    for j in range(2):\n        print(i)\n        i = 99\n",
            // inner body changes a name the inner source reads
            "for i in range(2):\n    for j in range(n):\n        n += 1\n",
            // inner body deletes the outer variable
            "for i in range(2):\n    for j in range(2):\n        f(i, j)\n        del i\n",
            // a deeper loop reuses the outer variable
            "for i in range(2):\n    for j in range(2):\n        for i in range(3):\n            f(i, j)\n",
            // assignment expression binds the outer variable
            "for i in range(2):\n    for j in range(2):\n        if (i := j):\n            f(i)\n",
            // with statement binds the outer variable
            "for i in range(2):\n    for j in range(2):\n        with open(j) as i:\n            f(i)\n",
            // nested function rebinds the outer variable through global
            "for i in range(2):\n    for j in range(2):\n        def bump():\n            global i\n            i = 0\n",
            // nested function rebinds the inner source's bound through global
            "for i in range(2):\n    for j in range(n):\n        def grow():\n            global n\n            n = 9\n",
            // async inner loop
            "for i in range(2):\n    async for j in ticks():\n        f(i, j)\n"
    })
    void testDeclines(String source) throws SourceParseException {
        Module module = PythonParser.parse(source);
        For loop = (For) module.body().get(0);
        RewriteResult result = rule.apply(loop, RewriteContext.forModule(module));
        assertFalse(result.isReplaced());
        assertSame(loop, ((RewriteResult.Unchanged) result).original());
    }

    @Test
    void testBreakInDeeperLoopDoesNotBlock() throws SourceParseException {
        RewriteResult result = applyToFirstLoop(rule, """
                for i in range(3):
                    for j in range(3):
                        for k in range(3):
                            break
                """);
        assertTrue(result.isReplaced());
    }

    @Test
    void testSameTargetNameStillFlattens() throws SourceParseException {
        RewriteResult result = applyToFirstLoop(rule, """
                for i in range(3):
                    for i in range(4):
                        f(i)
                """);
        RewriteResult.Replaced replaced = assertInstanceOf(RewriteResult.Replaced.class, result);
        assertEquals("for i, i in itertools.product(range(3), range(4)):\n    f(i)\n",
                SourcePrinter.print(replaced.statements().get(0)));
    }

    @Test
    void testNestedFunctionLocalDoesNotBlock() throws SourceParseException {
        RewriteResult result = applyToFirstLoop(rule, """
                for i in range(3):
                    for j in range(n):
                        def helper(n):
                            i = n * 2
                            return i
                        f(helper(j))
                """);
        assertTrue(result.isReplaced());
    }

    @Test
    void testDeclinesNonlocalRebindInsideFunction() throws SourceParseException {
        Module module = PythonParser.parse("""
                def run(n):
                    for i in range(n):
                        for j in range(n):
                            def shrink():
                                nonlocal n
                                n -= 1
                            shrink()
                """);
        For loop = (For) ((FunctionDef) module.body().get(0)).body().get(0);
        assertFalse(rule.apply(loop, RewriteContext.forModule(module)).isReplaced());
    }

    @Test
    void testDeclinesAsyncOuterLoop() throws SourceParseException {
        Module module = PythonParser.parse("""
                async def run():
                    async for i in ticks():
                        for j in range(2):
                            f(i, j)
                """);
        For loop = (For) ((FunctionDef) module.body().get(0)).body().get(0);
        assertTrue(loop.isAsync());
        assertFalse(rule.apply(loop, RewriteContext.forModule(module)).isReplaced());
    }

    @Test
    void testName() {
        assertEquals("flatten", rule.name());
    }
}
