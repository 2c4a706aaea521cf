package com.nosota.roundup.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Round-up arithmetic: the distance from a purchase amount to the next whole currency unit.
 *
 * <p>Examples:
 * <pre>
 * 4.60  → 0.40
 * 20.00 → 0.00 (no round-up)
 * 0.01  → 0.99
 * </pre>
 *
 * <p>Every path that computes round-ups (webhook ingestion, scheduled sync, reprocessing) goes through this class.
 */
@Component
public class RoundUpCalculator {

    /**
     * Minor-unit precision of the supported currencies.
     */
    public static final int SCALE = 2;

    /**
     * Computes {@code ceil(|amount|) - |amount|} rounded to two decimals.
     *
     * @param amount Transaction amount, sign ignored
     * @return Round-up amount, zero when the amount is already a whole unit
     */
    public BigDecimal roundUp(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal magnitude = amount.abs().setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal nextWholeUnit = magnitude.setScale(0, RoundingMode.CEILING);
        return nextWholeUnit.subtract(magnitude).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public boolean isRoundable(BigDecimal amount) {
        return roundUp(amount).signum() > 0;
    }
}
