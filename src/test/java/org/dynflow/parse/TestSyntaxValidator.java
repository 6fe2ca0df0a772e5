package org.dynflow.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestSyntaxValidator {

    @Test
    public void testValidateSyntax() {
        assertTrue(SyntaxValidator.validateSyntax("x = 1\nprint(x)\n"));
        assertTrue(SyntaxValidator.validateSyntax(""));
        assertFalse(SyntaxValidator.validateSyntax("x = = 1\n"));
        assertFalse(SyntaxValidator.validateSyntax(null));
    }

    @Test
    public void testFindProblem() {
        ParseError e = SyntaxValidator.findProblem("a = 1\nwhile a\n    a -= 1\n").orElseThrow();
        assertEquals(2, e.getLine());
        assertTrue(SyntaxValidator.findProblem("a = 1\n").isEmpty());
    }
}
