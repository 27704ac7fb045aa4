package com.ogt.exposure.model;

import com.ogt.exposure.exception.MalformedTableException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataTableTest {

    @Test
    void plainAndDecimalCommaCells() {
        assertEquals(1064.0, DataTable.parseDouble("t", "c", " 1064 "));
        assertEquals(0.5, DataTable.parseDouble("t", "c", "0,5"));
        assertEquals(-12.75, DataTable.parseDouble("t", "c", "-12,75"));
        assertNull(DataTable.parseDouble("t", "c", "  "));
    }

    @Test
    void lastSeparatorIsTheDecimalMark() {
        assertEquals(1064.5, DataTable.parseDouble("t", "c", "1,064.5"));
        assertEquals(1064.5, DataTable.parseDouble("t", "c", "1.064,5"));
        assertEquals(2500000.0, DataTable.parseDouble("t", "c", "2,500,000.00"));
    }

    @Test
    void thousandsGroupedCellIsRejectedRatherThanShrunk() {
        MalformedTableException e = assertThrows(MalformedTableException.class,
                () -> DataTable.parseDouble("jrc.csv", "cost", "1,064"));

        assertTrue(e.getMessage().contains("ambiguous"));
        assertThrows(MalformedTableException.class, () -> DataTable.parseDouble("t", "c", "12,345,678"));
    }

    @Test
    void missingColumnNamesTheAvailableOnes() {
        DataTable table = new DataTable("lanes.csv", List.of("lanes", "cost"), List.of(Map.of("lanes", "1", "cost", "10")));

        MalformedTableException e = assertThrows(MalformedTableException.class, () -> table.requireColumns("width"));

        assertTrue(e.getMessage().contains("[lanes, cost]"));
    }
}
