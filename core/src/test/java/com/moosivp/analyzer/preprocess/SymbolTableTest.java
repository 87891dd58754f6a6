package com.moosivp.analyzer.preprocess;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    @Test
    public void defineReturnsPreviousLocalValue() {
        SymbolTable table = SymbolTable.empty();
        assertEquals(Optional.empty(), table.define("A", "1"));
        assertEquals(Optional.of("1"), table.define("A", "2"));
    }

    @Test
    public void environmentIsNotAPreviousBinding() {
        SymbolTable table = new SymbolTable(Map.of("A", "env"));
        assertEquals(Optional.empty(), table.define("A", "local"));
        assertEquals("local", table.lookup("A").orElseThrow());
    }

    @Test
    public void copyIsIndependentUntilMerged() {
        SymbolTable table = SymbolTable.empty();
        table.define("A", "1");
        SymbolTable copy = table.copy();
        copy.define("B", "2");
        assertTrue(table.lookup("B").isEmpty());

        table.mergeFrom(copy);
        assertEquals("2", table.lookup("B").orElseThrow());
        assertEquals(Map.of("A", "1", "B", "2"), table.snapshot());
    }

    @Test
    public void snapshotHoldsLocalsOnly() {
        SymbolTable table = new SymbolTable(Map.of("ENV", "x"));
        table.define("LOCAL", "y");
        assertEquals(Map.of("LOCAL", "y"), table.snapshot());
        assertTrue(table.isDefined("ENV"));
    }
}
