package com.avocado.bonus_ledger.bonus;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MinorUnitsTest {

    @Test
    void convertsMajorToMinor() {
        assertEquals(1000L, MinorUnits.fromMajor(new BigDecimal("10.00")));
        assertEquals(1L, MinorUnits.fromMajor(new BigDecimal("0.005")));
        assertEquals(-1050L, MinorUnits.fromMajor(new BigDecimal("-10.5")));
        assertEquals(0L, MinorUnits.fromMajor(null));
    }

    @Test
    void convertsMinorToMajorWithTwoDecimals() {
        assertEquals(new BigDecimal("-5.00"), MinorUnits.toMajor(-500L));
        assertEquals(new BigDecimal("0.01"), MinorUnits.toMajor(1L));
    }

    @Test
    void readsStoredColumnValues() {
        assertEquals(-500L, MinorUnits.fromColumn(new BigDecimal("-500.00")));
        assertEquals(0L, MinorUnits.fromColumn(null));
    }
}
