package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourcePosition;
import com.moosivp.analyzer.lexer.SourceRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    private static final SourceRange RANGE = SourceRange.at(SourcePosition.START);

    @Test
    public void scalarKinds() {
        assertEquals(ValueKind.INTEGER, Value.of("0x10", RANGE).kind());
        assertEquals(16, Value.of("0x10", RANGE).asLong().getAsLong());
        assertEquals(ValueKind.FLOAT, Value.of(" 2.5 ", RANGE).kind());
        assertEquals("2.5", Value.of(" 2.5 ", RANGE).text());
        assertEquals(ValueKind.BOOLEAN, Value.of("TRUE", RANGE).kind());
        assertTrue(Value.of("TRUE", RANGE).asBoolean().orElseThrow());
        assertEquals(ValueKind.STRING, Value.of("localhost", RANGE).kind());
    }

    @Test
    public void integerHasDoubleView() {
        assertEquals(4.0, Value.of("4", RANGE).asDouble().getAsDouble());
    }

    @Test
    public void quotedValue() {
        Value value = Value.of("\"hello world\"", RANGE);
        assertEquals(ValueKind.QUOTED, value.kind());
        assertEquals("hello world", value.unquoted());
    }

    @Test
    public void vectorValue() {
        Value value = Value.of("[2x3]{1, 2, 3, 4, 5, 6}", RANGE);
        assertEquals(ValueKind.VECTOR, value.kind());
        VectorLiteral vector = value.asVector().orElseThrow();
        assertEquals(2, vector.rows());
        assertEquals(3, vector.columns());
        assertEquals(List.of("1", "2", "3", "4", "5", "6"), vector.elements());
        assertTrue(vector.matchesDimensions());
    }

    @Test
    public void vectorSizeMismatch() {
        VectorLiteral vector = VectorLiteral.parse("[3]{1,2}").orElseThrow();
        assertEquals(3, vector.expectedSize());
        assertFalse(vector.matchesDimensions());
        assertEquals(0, VectorLiteral.parse("[0]{}").orElseThrow().elements().size());
        assertTrue(VectorLiteral.parse("{1,2}").isEmpty());
    }
}
