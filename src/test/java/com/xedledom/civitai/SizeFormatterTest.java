package com.xedledom.civitai;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SizeFormatterTest {

    @Test
    void picksLargestUnitAndDropsTrailingZeros() {
        assertEquals("500 KB", SizeFormatter.fromKilobytes(500));
        assertEquals("2 MB", SizeFormatter.fromKilobytes(2048));
        assertEquals("1.5 MB", SizeFormatter.fromKilobytes(1536));
        assertEquals("3 GB", SizeFormatter.fromKilobytes(3145728));
    }

    @Test
    void roundsToTwoDecimals() {
        assertEquals("144.98 MB", SizeFormatter.fromKilobytes(148459.5));
        assertEquals("1.99 GB", SizeFormatter.fromKilobytes(2088960));
    }

    @Test
    void truncatesKilobytes() {
        assertEquals("1023 KB", SizeFormatter.fromKilobytes(1023.9));
    }

    @Test
    void zeroOrNegativeIsEmpty() {
        assertEquals("", SizeFormatter.fromKilobytes(0));
        assertEquals("", SizeFormatter.fromKilobytes(-5));
        assertEquals("", SizeFormatter.fromKilobytes(Double.NaN));
    }
}
