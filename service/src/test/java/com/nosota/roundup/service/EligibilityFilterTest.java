package com.nosota.roundup.service;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.config.EligibilityProperties;
import com.nosota.roundup.dto.EligibilityDecision;
import com.nosota.roundup.dto.NormalizedTransaction;
import com.nosota.roundup.dto.TransactionDirection;
import com.nosota.roundup.dto.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Eligibility filter")
class EligibilityFilterTest {

    private final EligibilityFilter filter = new EligibilityFilter(new EligibilityProperties());

    @Test
    void postedPurchaseIsEligible() {
        EligibilityDecision decision = filter.evaluate(transaction().build());

        assertThat(decision.eligible()).isTrue();
        assertThat(decision.reason()).isNull();
        assertThat(decision).isEqualTo(EligibilityDecision.allow());
    }

    @Test
    void pendingIsRejectedFirst() {
        EligibilityDecision decision = filter.evaluate(transaction()
                .pending(true)
                .direction(TransactionDirection.CREDIT)
                .build());

        assertThat(decision.reason()).isEqualTo(SkipReason.PENDING);
    }

    @Test
    void creditIsRejected() {
        EligibilityDecision decision = filter.evaluate(transaction().direction(TransactionDirection.CREDIT).build());

        assertThat(decision.reason()).isEqualTo(SkipReason.CREDIT);
    }

    @Test
    @DisplayName("Excluded category also excludes its sub-categories")
    void excludedSubCategory() {
        EligibilityDecision decision = filter.evaluate(transaction()
                .categories(List.of("TRANSFER_OUT", "TRANSFER_OUT_ACCOUNT_TRANSFER"))
                .build());

        assertThat(decision.reason()).isEqualTo(SkipReason.EXCLUDED_CATEGORY);
    }

    @Test
    @DisplayName("Keyword must match a whole word of the description")
    void keywordWholeWord() {
        assertThat(filter.evaluate(transaction().name("ATM WITHDRAWAL GEORGE ST").build()).reason())
                .isEqualTo(SkipReason.EXCLUDED_CATEGORY);
        assertThat(filter.evaluate(transaction().name("BPAY ENERGYAUSTRALIA").build()).reason())
                .isEqualTo(SkipReason.EXCLUDED_CATEGORY);
        assertThat(filter.evaluate(transaction().name("Batman Comics").build()).eligible()).isTrue();
    }

    @Test
    void nonPurchaseTypeIsRejected() {
        EligibilityDecision decision = filter.evaluate(transaction().kind(TransactionKind.FEE).build());

        assertThat(decision.reason()).isEqualTo(SkipReason.INELIGIBLE_TYPE);
    }

    private NormalizedTransaction.NormalizedTransactionBuilder transaction() {
        return NormalizedTransaction.builder()
                .provider(BankProvider.PLAID)
                .providerTransactionId("tx-1")
                .providerAccountId("acc-1")
                .amount(new BigDecimal("4.60"))
                .currency("USD")
                .date(LocalDate.of(2026, 5, 4))
                .name("Blue Bottle Coffee")
                .categories(List.of("FOOD_AND_DRINK"))
                .direction(TransactionDirection.DEBIT)
                .kind(TransactionKind.PURCHASE)
                .pending(false);
    }
}
