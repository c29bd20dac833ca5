package com.raditha.pyopt.ast;

import com.raditha.pyopt.ast.stmt.Assign;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.Pass;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParentIndexTest {

    private Module module;
    private For outer;
    private For inner;
    private Assign assign;
    private ParentIndex index;

    @BeforeEach
    void setUp() throws SourceParseException {
        module = PythonParser.parse("""
                for i in range(3):
                    for j in range(3):
                        x = i + j
                """);
        outer = (For) module.body().get(0);
        inner = (For) outer.body().get(0);
        assign = (Assign) inner.body().get(0);
        index = ParentIndex.build(module);
    }

    @Test
    void testPreOrderIndices() {
        assertEquals(0, index.indexOf(module));
        assertEquals(1, index.indexOf(outer));
        assertSame(outer.target(), index.node(2));
        assertEquals(16, index.size());
    }

    @Test
    void testParentOf() {
        assertEquals(Optional.empty(), index.parentOf(module));
        assertSame(inner, index.parentOf(assign).orElseThrow());
        assertSame(assign, index.parentOf(assign.value()).orElseThrow());
    }

    @Test
    void testAncestorsNearestFirst() {
        List<Node> ancestors = index.ancestors(assign);
        assertEquals(3, ancestors.size());
        assertSame(inner, ancestors.get(0));
        assertSame(outer, ancestors.get(1));
        assertSame(module, ancestors.get(2));
    }

    @Test
    void testCountAndNearestAncestor() {
        assertEquals(2, index.countAncestors(assign, n -> n.kind() == NodeKind.FOR));
        assertEquals(1, index.countAncestors(inner, n -> n.kind() == NodeKind.FOR));
        assertSame(inner, index.nearestAncestor(assign, n -> n.kind() == NodeKind.FOR).orElseThrow());
        assertTrue(index.nearestAncestor(outer, n -> n.kind() == NodeKind.FOR).isEmpty());
    }

    @Test
    void testForeignNodeRejected() throws SourceParseException {
        Module other = PythonParser.parse("x = i + j\n");
        Node foreign = other.body().get(0);
        assertFalse(index.contains(foreign));
        assertThrows(IllegalArgumentException.class, () -> index.indexOf(foreign));
    }

    @Test
    void testSharedNodeRejected() {
        Pass pass = new Pass(new Position(1, 0));
        Module shared = new Module(List.of(pass, pass));
        assertThrows(IllegalArgumentException.class, () -> ParentIndex.build(shared));
    }
}
