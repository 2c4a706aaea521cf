package com.nosota.roundup.service;

import com.nosota.roundup.dto.FeeBreakdown;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Processor fee and tax split of a settlement.
 *
 * <pre>
 * processorFee = round2(base × processorPercent + processorFixed)
 * tax          = round2(processorFee × taxRate)
 * totalFee     = processorFee + tax
 *
 * coverFees:  totalCharged = base + totalFee, net = base
 * otherwise:  totalCharged = base,            net = base - totalFee
 * </pre>
 */
@Component
public class FeeCalculator {

    private final BigDecimal processorPercent;
    private final BigDecimal processorFixed;
    private final BigDecimal taxRate;

    public FeeCalculator(@Value("${roundup.fees.processor-percent}") BigDecimal processorPercent,
                         @Value("${roundup.fees.processor-fixed}") BigDecimal processorFixed,
                         @Value("${roundup.fees.tax-rate}") BigDecimal taxRate) {
        this.processorPercent = processorPercent;
        this.processorFixed = processorFixed;
        this.taxRate = taxRate;
    }

    public FeeBreakdown calculate(BigDecimal baseAmount, boolean coverFees) {
        BigDecimal base = baseAmount.setScale(RoundUpCalculator.SCALE, RoundingMode.HALF_UP);
        BigDecimal processorFee = round(base.multiply(processorPercent).add(processorFixed));
        BigDecimal tax = round(processorFee.multiply(taxRate));
        BigDecimal totalFee = processorFee.add(tax);

        BigDecimal totalCharged = coverFees ? base.add(totalFee) : base;
        BigDecimal net = coverFees ? base : base.subtract(totalFee);

        return FeeBreakdown.builder()
                .baseAmount(base)
                .processorFee(processorFee)
                .taxAmount(tax)
                .totalFee(totalFee)
                .netAmount(net)
                .totalCharged(totalCharged)
                .coverFees(coverFees)
                .build();
    }

    private BigDecimal round(BigDecimal value) {
        return value.setScale(RoundUpCalculator.SCALE, RoundingMode.HALF_UP);
    }
}
