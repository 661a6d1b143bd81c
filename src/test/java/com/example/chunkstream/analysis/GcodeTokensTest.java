package com.example.chunkstream.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GcodeTokensTest {
    @Test
    void recognizesOperationWords() {
        assertTrue(GcodeTokens.isLinearMove("G01 X1"));
        assertTrue(GcodeTokens.isRapidMove("g0 z5"));
        assertTrue(GcodeTokens.isArcMove("G3 X1 Y1 I0.5"));
        assertTrue(GcodeTokens.isToolChange("T12"));
        assertTrue(GcodeTokens.isToolChange("M06"));
        assertTrue(GcodeTokens.isCoordinateSystemChange("G55"));
        assertTrue(GcodeTokens.isSubProgramCall("M98 P100"));

        assertFalse(GcodeTokens.isLinearMove("G10 L2"));
        assertFalse(GcodeTokens.isRapidMove("G00.5"));
        assertFalse(GcodeTokens.isCoordinateSystemChange("G53"));
    }

    @Test
    void stripsComments() {
        assertEquals("G1 X1", GcodeTokens.stripComments("G1 X1 ; feed move"));
        assertEquals("G0   Z5", GcodeTokens.stripComments("G0 (retract) Z5"));
        assertEquals("", GcodeTokens.stripComments("; only a comment"));
        assertEquals(0, GcodeTokens.lineWeight("(T1 M6)"));
    }

    @Test
    void complexityIsTheRoundedAverageWeight() {
        List<String> lines = List.of("G1 X1", "G0 X0", "G2 X1 I1", "T1 M6");

        assertEquals(2.4, GcodeTokens.complexity(lines));
        assertEquals(GcodeTokens.complexity(lines), GcodeTokens.complexity(List.copyOf(lines)));
        assertEquals(0, GcodeTokens.complexity(List.of()));
        assertEquals(7.0, GcodeTokens.lineWeight("G54 T2 M6"));
    }
}
