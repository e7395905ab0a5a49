package com.gillianbc.taxestimator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandTableTest {

    @Test
    @DisplayName("Well-formed table keeps its bands in order and ends unbounded")
    void bandTable_valid_keepsOrder() {
        BandTable table = new BandTable("test", "Test", List.of(
                TaxBand.upTo("1000", "0.10", "Low"),
                TaxBand.upTo("5000", "0.20", "Mid"),
                TaxBand.above("0.30", "High")));

        assertEquals(3, table.getBands().size());
        assertEquals("Low", table.getBands().get(0).getName());
        assertTrue(table.topBand().isUnbounded());
    }

    @Test
    @DisplayName("Empty table is rejected")
    void bandTable_empty_throws() {
        assertThrows(IllegalArgumentException.class, () -> new BandTable("test", "Test", List.of()));
    }

    @Test
    @DisplayName("Table without an unbounded top band is rejected")
    void bandTable_noUnboundedTop_throws() {
        assertThrows(IllegalArgumentException.class, () -> new BandTable("test", "Test", List.of(
                TaxBand.upTo("1000", "0.10", "Low"),
                TaxBand.upTo("5000", "0.20", "Mid"))));
    }

    @Test
    @DisplayName("Unbounded band before the end is rejected")
    void bandTable_unboundedInMiddle_throws() {
        assertThrows(IllegalArgumentException.class, () -> new BandTable("test", "Test", List.of(
                TaxBand.above("0.10", "Low"),
                TaxBand.above("0.20", "High"))));
    }

    @Test
    @DisplayName("Limits that do not strictly increase are rejected")
    void bandTable_nonIncreasingLimits_throws() {
        assertThrows(IllegalArgumentException.class, () -> new BandTable("test", "Test", List.of(
                TaxBand.upTo("5000", "0.10", "Low"),
                TaxBand.upTo("5000", "0.20", "Mid"),
                TaxBand.above("0.30", "High"))));
    }

    @Test
    @DisplayName("Negative rate is rejected")
    void taxBand_negativeRate_throws() {
        assertThrows(IllegalArgumentException.class, () -> TaxBand.upTo("1000", "-0.10", "Low"));
    }
}
