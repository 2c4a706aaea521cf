package com.nosota.roundup.service;

import com.nosota.roundup.api.provider.BasiqTransaction;
import com.nosota.roundup.api.provider.PlaidTransaction;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.dto.NormalizedTransaction;
import com.nosota.roundup.dto.TransactionDirection;
import com.nosota.roundup.dto.TransactionKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts aggregator payloads into {@link NormalizedTransaction}.
 *
 * <p>Provider sign conventions differ:
 * <ul>
 *   <li>Plaid: positive amount = money out (debit)</li>
 *   <li>Basiq: negative amount = money out; {@code direction} wins when present</li>
 * </ul>
 * The normalized amount is always the positive magnitude.
 *
 * <p>Category tags are upper-cased with separators replaced by {@code _}
 * ({@code "Food and Drink"} → {@code FOOD_AND_DRINK}, {@code cash-withdrawal} → {@code CASH_WITHDRAWAL}).
 */
@Component
public class TransactionNormalizer {

    private static final String BASIQ_DEFAULT_CURRENCY = "AUD";

    /**
     * @throws IllegalArgumentException if the payload lacks an id or a parseable amount
     */
    public NormalizedTransaction normalize(ProviderTransaction transaction) {
        if (transaction instanceof PlaidTransaction plaid) {
            return normalizePlaid(plaid);
        }
        if (transaction instanceof BasiqTransaction basiq) {
            return normalizeBasiq(basiq);
        }
        throw new IllegalArgumentException("Unsupported provider transaction: " + transaction);
    }

    // ==================== Private Helper Methods ====================

    private NormalizedTransaction normalizePlaid(PlaidTransaction transaction) {
        requireId(transaction.transactionId());
        if (transaction.amount() == null) {
            throw new IllegalArgumentException("Plaid transaction " + transaction.transactionId() + " has no amount");
        }

        List<String> categories = new ArrayList<>();
        if (transaction.personalFinanceCategory() != null) {
            addTag(categories, transaction.personalFinanceCategory().primary());
            addTag(categories, transaction.personalFinanceCategory().detailed());
        }
        if (transaction.category() != null) {
            transaction.category().forEach(category -> addTag(categories, category));
        }

        String currency = transaction.isoCurrencyCode() != null
                ? transaction.isoCurrencyCode()
                : transaction.unofficialCurrencyCode();

        String name = transaction.merchantName() != null && !transaction.merchantName().isBlank()
                ? transaction.merchantName()
                : transaction.name();

        return NormalizedTransaction.builder()
                .provider(transaction.provider())
                .providerTransactionId(transaction.transactionId())
                .providerAccountId(transaction.accountId())
                .amount(transaction.amount().abs())
                .currency(upper(currency))
                .date(transaction.date())
                .name(name)
                .categories(categories)
                .direction(transaction.amount().signum() > 0 ? TransactionDirection.DEBIT : TransactionDirection.CREDIT)
                .kind(plaidKind(transaction.transactionType()))
                .pending(transaction.pending())
                .build();
    }

    private NormalizedTransaction normalizeBasiq(BasiqTransaction transaction) {
        requireId(transaction.transactionId());

        BigDecimal amount;
        try {
            amount = new BigDecimal(transaction.amount().trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(
                    "Basiq transaction " + transaction.transactionId() + " has an invalid amount: " + transaction.amount());
        }

        TransactionDirection direction;
        if ("credit".equalsIgnoreCase(transaction.direction())) {
            direction = TransactionDirection.CREDIT;
        } else if ("debit".equalsIgnoreCase(transaction.direction())) {
            direction = TransactionDirection.DEBIT;
        } else {
            direction = amount.signum() < 0 ? TransactionDirection.DEBIT : TransactionDirection.CREDIT;
        }

        List<String> categories = new ArrayList<>();
        addTag(categories, transaction.transactionClass());
        if (transaction.subClass() != null) {
            addTag(categories, transaction.subClass().title());
        }

        String date = transaction.postDate() != null ? transaction.postDate() : transaction.transactionDate();

        return NormalizedTransaction.builder()
                .provider(transaction.provider())
                .providerTransactionId(transaction.transactionId())
                .providerAccountId(transaction.accountId())
                .amount(amount.abs())
                .currency(transaction.currency() != null ? upper(transaction.currency()) : BASIQ_DEFAULT_CURRENCY)
                .date(parseDate(date))
                .name(transaction.description())
                .categories(categories)
                .direction(direction)
                .kind(basiqKind(transaction.transactionClass()))
                .pending("pending".equalsIgnoreCase(transaction.status()))
                .build();
    }

    private TransactionKind plaidKind(String transactionType) {
        if (transactionType == null) {
            return TransactionKind.DEBIT;
        }
        return switch (transactionType.toLowerCase(Locale.ROOT)) {
            case "place", "digital" -> TransactionKind.PURCHASE;
            case "unresolved" -> TransactionKind.DEBIT;
            default -> TransactionKind.OTHER;
        };
    }

    private TransactionKind basiqKind(String transactionClass) {
        if (transactionClass == null) {
            return TransactionKind.DEBIT;
        }
        return switch (transactionClass.toLowerCase(Locale.ROOT)) {
            case "payment" -> TransactionKind.PURCHASE;
            case "transfer" -> TransactionKind.TRANSFER;
            case "cash-withdrawal" -> TransactionKind.CASH_WITHDRAWAL;
            case "bank-fee" -> TransactionKind.FEE;
            case "interest" -> TransactionKind.INTEREST;
            default -> TransactionKind.OTHER;
        };
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void addTag(List<String> tags, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String tag = value.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
        if (!tags.contains(tag)) {
            tags.add(tag);
        }
    }

    private void requireId(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Provider transaction id is required");
        }
    }

    private String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
