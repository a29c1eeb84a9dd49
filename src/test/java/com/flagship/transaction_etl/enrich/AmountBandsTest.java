package com.flagship.transaction_etl.enrich;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AmountBandsTest {

    private final AmountBands bands = AmountBands.standard();

    private String bandOf(String amount) {
        return bands.locate(new BigDecimal(amount)).getName();
    }

    @Nested
    @DisplayName("Standard bands")
    class StandardBands {

        @Test
        @DisplayName("Boundaries fall into the expected band")
        void boundaries() {
            assertEquals(AmountBands.LOW, bandOf("0"));
            assertEquals(AmountBands.LOW, bandOf("49.99"));
            assertEquals(AmountBands.MEDIUM, bandOf("50.00"));
            assertEquals(AmountBands.MEDIUM, bandOf("75"));
            assertEquals(AmountBands.MEDIUM, bandOf("200"));
            assertEquals(AmountBands.HIGH, bandOf("200.01"));
            assertEquals(AmountBands.HIGH, bandOf("99999999.99"));
        }

        @Test
        @DisplayName("Sub-cent amounts are rounded before lookup")
        void subCentAmounts() {
            assertEquals(AmountBands.MEDIUM, bandOf("49.995"));
            assertEquals(AmountBands.MEDIUM, bandOf("200.004"));
            assertEquals(AmountBands.HIGH, bandOf("200.005"));
        }

        @Test
        @DisplayName("Negative amounts have no band")
        void negativeRejected() {
            assertThrows(IllegalArgumentException.class, () -> bands.locate(new BigDecimal("-0.01")));
        }

        @Test
        @DisplayName("Every non-negative cent amount is in exactly one band")
        void partitionProperty() {
            Random random = new Random(42);
            for (int i = 0; i < 5_000; i++) {
                BigDecimal amount = BigDecimal.valueOf(random.nextInt(100_000), 2);
                long matching = bands.getBands().stream().filter(band -> band.contains(amount)).count();
                assertEquals(1, matching, "amount " + amount);
            }
            for (long cents = 0; cents <= 25_000; cents++) {
                BigDecimal amount = BigDecimal.valueOf(cents, 2);
                assertEquals(1, bands.getBands().stream().filter(band -> band.contains(amount)).count(),
                        "amount " + amount);
            }
        }
    }

    @Nested
    @DisplayName("Partition validation")
    class PartitionValidation {

        @Test
        @DisplayName("Gap between bands is refused")
        void gapRefused() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AmountBands.of(List.of(
                    AmountBand.closed("low", "0", "49.99"),
                    AmountBand.openEnded("high", "60"))));
            assertTrue(e.getMessage().contains("high"));
        }

        @Test
        @DisplayName("Overlap between bands is refused")
        void overlapRefused() {
            assertThrows(IllegalArgumentException.class, () -> AmountBands.of(List.of(
                    AmountBand.closed("low", "0", "50"),
                    AmountBand.openEnded("high", "50"))));
        }

        @Test
        @DisplayName("Bands must start at zero and end open")
        void mustCoverFromZeroToInfinity() {
            assertThrows(IllegalArgumentException.class, () -> AmountBands.of(List.of(
                    AmountBand.openEnded("all", "1"))));
            assertThrows(IllegalArgumentException.class, () -> AmountBands.of(List.of(
                    AmountBand.closed("low", "0", "10"))));
            assertThrows(IllegalArgumentException.class, () -> AmountBands.of(List.of()));
        }

        @Test
        @DisplayName("Custom contiguous bands are accepted")
        void customBands() {
            AmountBands custom = AmountBands.of(List.of(
                    AmountBand.closed("tiny", "0", "0.99"),
                    AmountBand.openEnded("rest", "1.00")));

            assertEquals("tiny", custom.locate(new BigDecimal("0.99")).getName());
            assertEquals("rest", custom.locate(new BigDecimal("1")).getName());
        }
    }
}
