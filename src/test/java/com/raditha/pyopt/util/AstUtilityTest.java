package com.raditha.pyopt.util;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.ParentIndex;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.stmt.ClassDef;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.FunctionDef;
import com.raditha.pyopt.ast.stmt.Import;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AstUtilityTest {

    private static List<Stmt> loopBody(String source) throws SourceParseException {
        return ((For) PythonParser.parse(source).body().get(0)).body();
    }

    @Test
    void testReferencesName() throws SourceParseException {
        Module module = PythonParser.parse("y = f(a.b, [c + d])\n");
        assertTrue(AstUtility.referencesName(module, "d"));
        assertTrue(AstUtility.referencesName(module, "a"));
        assertFalse(AstUtility.referencesName(module, "b"));
        assertFalse(AstUtility.referencesName(module, "z"));
    }

    @Test
    void testDirectBreak() throws SourceParseException {
        assertTrue(AstUtility.containsLoopBreak(loopBody("for i in x:\n    break\n")));
        assertTrue(AstUtility.containsLoopBreak(loopBody("""
                for i in x:
                    try:
                        pass
                    except E:
                        with m:
                            if i:
                                pass
                            else:
                                break
                """)));
    }

    @Test
    void testBreakOwnedByNestedLoop() throws SourceParseException {
        assertFalse(AstUtility.containsLoopBreak(loopBody("""
                for i in x:
                    for j in y:
                        break
                    while j:
                        break
                """)));
    }

    @Test
    void testBreakInNestedElseTargetsOuterLoop() throws SourceParseException {
        assertTrue(AstUtility.containsLoopBreak(loopBody("""
                for i in x:
                    for j in y:
                        pass
                    else:
                        break
                """)));
    }

    @Test
    void testNoBreak() throws SourceParseException {
        assertFalse(AstUtility.containsLoopBreak(loopBody("for i in x:\n    continue\n")));
        assertFalse(AstUtility.containsLoopBreak(List.of()));
    }

    @Test
    void testScopeName() throws SourceParseException {
        Module module = PythonParser.parse("""
                for a in x:
                    pass


                class Outer:
                    def method(self):
                        for b in y:
                            pass
                """);
        ParentIndex parents = ParentIndex.build(module);
        For top = (For) module.body().get(0);
        ClassDef outer = (ClassDef) module.body().get(1);
        FunctionDef method = (FunctionDef) outer.body().get(0);
        For inner = (For) method.body().get(0);

        assertEquals(AstUtility.MODULE_SCOPE, AstUtility.scopeName(parents, top));
        assertEquals("Outer.method", AstUtility.scopeName(parents, inner));
        assertEquals("Outer", AstUtility.scopeName(parents, method));
    }

    @Test
    void testIsDocstring() throws SourceParseException {
        Module module = PythonParser.parse("\"\"\"Docs.\"\"\"\nb'raw'\nx = 'not a docstring'\n42\n");
        assertTrue(AstUtility.isDocstring(module.body().get(0)));
        assertFalse(AstUtility.isDocstring(module.body().get(1)));
        assertFalse(AstUtility.isDocstring(module.body().get(2)));
        assertFalse(AstUtility.isDocstring(module.body().get(3)));
    }

    @Test
    void testBreakInsideMatchCase() throws SourceParseException {
        assertTrue(AstUtility.containsLoopBreak(loopBody("""
                for i in x:
                    match i:
                        case 0:
                            break
                        case _:
                            pass
                """)));
    }

    @Test
    void testNamesIn() throws SourceParseException {
        Module module = PythonParser.parse("y = f(a.b, [c + d])\n");
        assertEquals(Set.of("y", "f", "a", "c", "d"), AstUtility.namesIn(module));
    }

    @Test
    void testBoundNamesOfBlock() throws SourceParseException {
        List<Stmt> body = loopBody("""
                for i in x:
                    a = 1
                    b, [c, *d] = pair
                    e.attr = 2
                    f[0] = 3
                    g += 1
                    h: int = 4
                    del k
                    for m in y:
                        pass
                    with ctx() as n:
                        pass
                    try:
                        pass
                    except E as o:
                        pass
                    import p.q, r as s
                    from t import u, v as w
                    if (z := 5):
                        pass
                """);
        assertEquals(Set.of("a", "b", "c", "d", "g", "h", "k", "m", "n", "o", "p", "s", "u", "w", "z"),
                AstUtility.boundNames(body));
    }

    @Test
    void testBoundNamesStopAtNestedScopes() throws SourceParseException {
        List<Stmt> body = loopBody("""
                for i in x:
                    def helper(a):
                        b = a
                        global c
                        c = b
                    class Box:
                        d = 1
                    key = lambda e: e
                    squares = [f * f for f in range(3)]
                    flags = [g for g in x if (h := g)]
                """);
        assertEquals(Set.of("helper", "c", "Box", "key", "squares", "flags", "h"), AstUtility.boundNames(body));
    }

    @Test
    void testBoundNamesFromMatchPatterns() throws SourceParseException {
        List<Stmt> body = loopBody("""
                for i in x:
                    match i:
                        case [a, *rest]:
                            pass
                        case {"k": b, **others}:
                            pass
                        case Point(x=c) | Point(y=c) as point:
                            pass
                        case _:
                            pass
                """);
        assertEquals(Set.of("a", "rest", "b", "others", "c", "point"), AstUtility.boundNames(body));
    }

    @Test
    void testAllBindingsCoversNestedScopes() throws SourceParseException {
        Module module = PythonParser.parse("""
                import numpy as np
                def f(a, *args, k=1, **kw):
                    return [b for b in a]
                g = lambda c: c
                """);
        List<AstUtility.Binding> bindings = AstUtility.allBindings(module);
        assertEquals(List.of("np", "f", "a", "args", "k", "kw", "b", "g", "c"),
                bindings.stream().map(AstUtility.Binding::name).toList());
        assertInstanceOf(Import.class, bindings.get(0).binder());
    }
}
