package com.nosota.roundup.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Exclusion lists of the eligibility filter.
 *
 * <pre>
 * roundup:
 *   eligibility:
 *     excluded-categories: [TRANSFER, ATM, ...]
 *     excluded-keywords: [ATM, WITHDRAWAL, ...]
 * </pre>
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "roundup.eligibility")
public class EligibilityProperties {

    /**
     * Upper-case category tags. A tag also excludes its sub-categories ({@code TRANSFER} excludes {@code TRANSFER_OUT}).
     */
    private List<String> excludedCategories = new ArrayList<>(List.of(
            "TRANSFER", "LOAN_PAYMENTS", "LOAN_REPAYMENT", "CREDIT_CARD", "BANK_FEES", "BANK_FEE",
            "CASH_WITHDRAWAL", "ATM", "INCOME", "INTEREST", "REFUND", "DEPOSIT", "DIRECT_CREDIT"));

    /**
     * Whole words that exclude a transaction when they appear in its name or description.
     */
    private List<String> excludedKeywords = new ArrayList<>(List.of(
            "ATM", "WITHDRAWAL", "TRANSFER", "REFUND", "BPAY", "REVERSAL"));
}
