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

class VectorizationRuleTest {

    private final VectorizationRule rule = new VectorizationRule();

    private RewriteResult apply(String source) throws SourceParseException {
        Module module = PythonParser.parse(source);
        For loop = (For) module.body().get(module.body().size() - 1);
        return rule.apply(loop, RewriteContext.forModule(module));
    }

    private static String printed(RewriteResult result) {
        RewriteResult.Replaced replaced = assertInstanceOf(RewriteResult.Replaced.class, result);
        StringBuilder sb = new StringBuilder();
        replaced.statements().forEach(s -> sb.append(SourcePrinter.print(s)));
        return sb.toString();
    }

    @Test
    void testVectorizesElementUpdate() throws SourceParseException {
        RewriteResult result = apply("for i in range(len(arr)):\n    arr[i] = arr[i] + 10\n");
        assertEquals("arr = np.array(arr)\narr = arr + 10\n", printed(result));
        assertEquals(Set.of(ImportRequirement.VECTOR_ARRAY), ((RewriteResult.Replaced) result).requiredImports());
    }

    @Test
    void testSupportedOperators() throws SourceParseException {
        assertEquals("a = np.array(a)\na = a - 1.5\n",
                printed(apply("for k in range(len(a)):\n    a[k] = a[k] - 1.5\n")));
        assertEquals("a = np.array(a)\na = a * 3\n",
                printed(apply("for k in range(len(a)):\n    a[k] = a[k] * 3\n")));
    }

    @Test
    void testAugmentedAssignment() throws SourceParseException {
        assertEquals("values = np.array(values)\nvalues = values * 2\n",
                printed(apply("for i in range(len(values)):\n    values[i] *= 2\n")));
    }

    @Test
    void testReusesNumpyAlias() throws SourceParseException {
        RewriteResult result = apply("import numpy as npy\nfor i in range(len(arr)):\n    arr[i] += 1\n");
        assertEquals("arr = npy.array(arr)\narr = arr + 1\n", printed(result));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            // non-constant operand
            "for i in range(len(arr)):\n    arr[i] = arr[i] + c\n",
            // string literal operand
            "for i in range(len(arr)):\n    arr[i] = arr[i] + 'x'\n",
            // unsupported operator
            "for i in range(len(arr)):\n    arr[i] = arr[i] / 2\n",
            // reads another array
            "for i in range(len(arr)):\n    arr[i] = other[i] + 1\n",
            // writes another array
            "for i in range(len(arr)):\n    out[i] = arr[i] + 1\n",
            // different index
            "for i in range(len(arr)):\n    arr[j] = arr[j] + 1\n",
            // constant on the left
            "for i in range(len(arr)):\n    arr[i] = 1 + arr[i]\n",
            // two statements
            "for i in range(len(arr)):\n    arr[i] = arr[i] + 1\n    n += 1\n",
            // not range(len(name))
            "for i in range(10):\n    arr[i] = arr[i] + 1\n",
            "for i in range(len(self.arr)):\n    arr[i] = arr[i] + 1\n",
            // else block
            "for i in range(len(arr)):\n    arr[i] = arr[i] + 1\nelse:\n    done()\n",
            // loop variable named like the array
            "for arr in range(len(arr)):\n    arr[arr] = arr[arr] + 1\n"
    })
    void testDeclines(String source) throws SourceParseException {
        RewriteResult result = apply(source);
        assertFalse(result.isReplaced());
    }

    @Test
    void testDeclinesAsyncLoop() throws SourceParseException {
        Module module = PythonParser.parse("async def f(arr):\n    async for i in range(len(arr)):\n        arr[i] += 1\n");
        For loop = (For) ((FunctionDef) module.body().get(0)).body().get(0);
        assertTrue(loop.isAsync());
        assertFalse(rule.apply(loop, RewriteContext.forModule(module)).isReplaced());
    }

    @Test
    void testIdempotentOnRewrittenCode() throws SourceParseException {
        String once = SourcePrinter.print(new RewriteEngine().rewrite(
                "for i in range(len(arr)):\n    arr[i] = arr[i] + 10\n").tree());
        RewriteOutcome again = new RewriteEngine().rewrite(once);
        assertFalse(again.isChanged());
        assertEquals(once, SourcePrinter.print(again.tree()));
    }
}
