package com.chicu.papertradebot.trading.position;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void missingQty_shouldBeDerivedFromSizeUsdAndEntry() {
        Position p = Position.builder()
                .id("p1")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .sizeUsd(new BigDecimal("500"))
                .entryPrice(new BigDecimal("50"))
                .tpPrice(new BigDecimal("60"))
                .build();

        assertEquals(0, p.getEffectiveQty().orElseThrow().compareTo(BigDecimal.TEN));
        assertTrue(p.getStoredQty().isEmpty(), "выведенный qty не подменяет сохранённый");
    }

    @Test
    void storedQty_shouldWinOverDerived() {
        Position p = Position.builder()
                .id("p1").symbol("BTCUSDT").side(PositionSide.LONG)
                .qty(new BigDecimal("2"))
                .sizeUsd(new BigDecimal("500"))
                .entryPrice(new BigDecimal("50"))
                .build();

        assertEquals(new BigDecimal("2"), p.getEffectiveQty().orElseThrow());
    }

    @Test
    void zeroQty_shouldFallBackToDerived() {
        Position p = Position.builder()
                .id("p1").symbol("BTCUSDT").side(PositionSide.SHORT)
                .qty(BigDecimal.ZERO)
                .sizeUsd(new BigDecimal("100"))
                .entryPrice(new BigDecimal("3"))
                .build();

        assertEquals(new BigDecimal("33.33333333"), p.getEffectiveQty().orElseThrow());
    }

    @Test
    void noUsableQty_shouldBeEmpty() {
        Position noEntry = Position.builder()
                .id("p1").symbol("BTCUSDT").side(PositionSide.LONG)
                .sizeUsd(new BigDecimal("100"))
                .build();
        Position negative = Position.builder()
                .id("p2").symbol("BTCUSDT").side(PositionSide.LONG)
                .qty(new BigDecimal("-1"))
                .sizeUsd(new BigDecimal("-100"))
                .entryPrice(new BigDecimal("10"))
                .build();

        assertTrue(noEntry.getEffectiveQty().isEmpty());
        assertTrue(negative.getEffectiveQty().isEmpty());
    }

    @Test
    void nonPositiveTargets_shouldCountAsAbsent() {
        Position p = Position.builder()
                .id("p1").symbol("BTCUSDT").side(PositionSide.LONG)
                .qty(BigDecimal.ONE)
                .tpPrice(BigDecimal.ZERO)
                .slPrice(new BigDecimal("-5"))
                .build();

        assertTrue(p.getTpPrice().isEmpty());
        assertTrue(p.getSlPrice().isEmpty());
        assertFalse(p.hasTargets());
    }

    @Test
    void requiredFields_shouldBeChecked() {
        assertThrows(NullPointerException.class, () -> Position.builder()
                .symbol("BTCUSDT").side(PositionSide.LONG).build());
        assertThrows(NullPointerException.class, () -> Position.builder()
                .id("x").side(PositionSide.LONG).build());
        assertThrows(NullPointerException.class, () -> Position.builder()
                .id("x").symbol("BTCUSDT").build());
    }

    @Test
    void sideParse_shouldAcceptAliases() {
        assertEquals(PositionSide.LONG, PositionSide.parse("long").orElseThrow());
        assertEquals(PositionSide.LONG, PositionSide.parse(" BUY ").orElseThrow());
        assertEquals(PositionSide.SHORT, PositionSide.parse("Sell").orElseThrow());
        assertTrue(PositionSide.parse("flat").isEmpty());
        assertTrue(PositionSide.parse(null).isEmpty());
    }
}
