package com.raditha.pyopt.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class OptimizeModeTest {

    @Test
    void testFromString() {
        assertEquals(OptimizeMode.WRITE, OptimizeMode.fromString("write"));
        assertEquals(OptimizeMode.DRY_RUN, OptimizeMode.fromString("dry-run"));
        assertEquals(OptimizeMode.DRY_RUN, OptimizeMode.fromString("DRY-RUN"));
    }

    @Test
    void testFromStringRejectsUnknownValues() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> OptimizeMode.fromString("dry_run"));
        assertEquals("Invalid mode: dry_run. Must be: write or dry-run", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> OptimizeMode.fromString(null));
    }

    @ParameterizedTest
    @EnumSource(OptimizeMode.class)
    void testCliStringRoundTrip(OptimizeMode mode) throws Exception {
        assertEquals(mode, OptimizeMode.fromString(mode.toCliString()));
        assertEquals(mode, new PyOptCLI.OptimizeModeConverter().convert(mode.toCliString()));
    }
}
