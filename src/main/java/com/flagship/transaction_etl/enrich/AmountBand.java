package com.flagship.transaction_etl.enrich;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A named, closed amount interval [min, max]. A null max means the band is open at the top.
 */
@Value
public class AmountBand {
    String name;
    BigDecimal minAmount;
    BigDecimal maxAmount;

    public AmountBand(String name, BigDecimal minAmount, BigDecimal maxAmount) {
        this.name = Objects.requireNonNull(name);
        this.minAmount = Objects.requireNonNull(minAmount);
        if (maxAmount != null && maxAmount.compareTo(minAmount) < 0) {
            throw new IllegalArgumentException(
                String.format("Band '%s' has max %s below min %s", name, maxAmount, minAmount));
        }
        this.maxAmount = maxAmount;
    }

    public static AmountBand closed(String name, String min, String max) {
        return new AmountBand(name, new BigDecimal(min), new BigDecimal(max));
    }

    public static AmountBand openEnded(String name, String min) {
        return new AmountBand(name, new BigDecimal(min), null);
    }

    public boolean isOpenEnded() {
        return maxAmount == null;
    }

    public boolean contains(BigDecimal amount) {
        return amount.compareTo(minAmount) >= 0
            && (isOpenEnded() || amount.compareTo(maxAmount) <= 0);
    }
}
