package com.raditha.pyopt.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator();

    @Test
    void testIdenticalTextsGiveEmptyDiff() {
        assertEquals("", generator.generateUnifiedDiff("a.py", "x = 1\n", "x = 1\n", 3));
    }

    @Test
    void testTrailingNewlineIsNotAChange() {
        assertEquals("", generator.generateUnifiedDiff("a.py", "x = 1", "x = 1\n", 3));
    }

    @Test
    void testUnifiedDiffFormat() {
        String diff = generator.generateUnifiedDiff("loops.py",
                "total = 0\nfor i in range(5):\n    for j in range(5):\n        total += m[i][j]\n",
                "import itertools\ntotal = 0\nfor i, j in itertools.product(range(5), range(5)):\n    total += m[i][j]\n",
                3);
        List<String> lines = diff.lines().toList();
        assertEquals("--- a/loops.py", lines.get(0));
        assertEquals("+++ b/loops.py", lines.get(1));
        assertTrue(lines.get(2).startsWith("@@ "));
        assertTrue(lines.contains("+import itertools"));
        assertTrue(lines.contains("-    for j in range(5):"));
        assertTrue(lines.contains("+    total += m[i][j]"));
        assertTrue(lines.contains(" total = 0"));
    }

    @Test
    void testContextLinesLimitUnchangedLines() {
        String original = "a\nb\nc\nd\ne\nf\ng\n";
        String revised = "a\nb\nc\nD\ne\nf\ng\n";
        String narrow = generator.generateUnifiedDiff("x.py", original, revised, 1);
        assertFalse(narrow.contains("\n a"));
        assertTrue(narrow.contains("\n c"));
        assertTrue(generator.generateUnifiedDiff("x.py", original, revised, 3).contains("\n a"));
    }
}
