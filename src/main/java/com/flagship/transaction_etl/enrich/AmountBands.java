package com.flagship.transaction_etl.enrich;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Ordered set of amount bands partitioning [0, +inf) at cent granularity.
 *
 * Construction checks the partition:
 * - the first band starts at 0
 * - each band starts exactly one cent above the previous band's max
 * - only the last band is open-ended, and it must be
 *
 * With amounts held at two fractional digits, every non-negative amount
 * therefore falls into exactly one band.
 */
public final class AmountBands {

    public static final String LOW = "low";
    public static final String MEDIUM = "medium";
    public static final String HIGH = "high";

    private static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    private final List<AmountBand> bands;

    private AmountBands(List<AmountBand> bands) {
        this.bands = bands;
    }

    /**
     * The three bands seeded into amount_categories: low [0, 49.99], medium [50, 200], high [200.01, +inf).
     */
    public static AmountBands standard() {
        return of(List.of(
            AmountBand.closed(LOW, "0", "49.99"),
            AmountBand.closed(MEDIUM, "50", "200"),
            AmountBand.openEnded(HIGH, "200.01")
        ));
    }

    public static AmountBands of(List<AmountBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("At least one amount band is required");
        }
        if (bands.get(0).getMinAmount().compareTo(BigDecimal.ZERO) != 0) {
            throw new IllegalArgumentException("First band must start at 0, was " + bands.get(0).getMinAmount());
        }
        for (int i = 0; i < bands.size(); i++) {
            AmountBand band = bands.get(i);
            boolean last = i == bands.size() - 1;
            if (band.isOpenEnded() != last) {
                throw new IllegalArgumentException(last
                    ? "Last band '" + band.getName() + "' must be open-ended"
                    : "Only the last band may be open-ended, found '" + band.getName() + "'");
            }
            if (i > 0) {
                BigDecimal expectedMin = bands.get(i - 1).getMaxAmount().add(ONE_CENT);
                if (band.getMinAmount().compareTo(expectedMin) != 0) {
                    throw new IllegalArgumentException(String.format(
                        "Band '%s' starts at %s but must start at %s to leave no gap or overlap",
                        band.getName(), band.getMinAmount(), expectedMin));
                }
            }
        }
        return new AmountBands(List.copyOf(bands));
    }

    /**
     * Locates the band containing the amount, after rounding it to cents.
     *
     * @throws IllegalArgumentException if the amount is negative
     */
    public AmountBand locate(BigDecimal amount) {
        BigDecimal cents = amount.setScale(2, RoundingMode.HALF_UP);
        if (cents.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        for (AmountBand band : bands) {
            if (band.contains(cents)) {
                return band;
            }
        }
        // Unreachable for a validated partition
        throw new IllegalStateException("No band contains amount " + cents);
    }

    public List<AmountBand> getBands() {
        return bands;
    }
}
