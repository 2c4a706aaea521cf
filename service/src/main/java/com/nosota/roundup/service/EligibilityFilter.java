package com.nosota.roundup.service;

import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.config.EligibilityProperties;
import com.nosota.roundup.dto.EligibilityDecision;
import com.nosota.roundup.dto.NormalizedTransaction;
import com.nosota.roundup.dto.TransactionDirection;
import com.nosota.roundup.dto.TransactionKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a normalized transaction may produce a round-up.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>pending at the provider → {@link SkipReason#PENDING}</li>
 *   <li>credit → {@link SkipReason#CREDIT}</li>
 *   <li>excluded category or keyword → {@link SkipReason#EXCLUDED_CATEGORY}</li>
 *   <li>type other than purchase/debit → {@link SkipReason#INELIGIBLE_TYPE}</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class EligibilityFilter {

    private static final Set<TransactionKind> ELIGIBLE_KINDS = EnumSet.of(TransactionKind.PURCHASE, TransactionKind.DEBIT);
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^A-Z0-9]+");

    private final EligibilityProperties properties;

    public EligibilityDecision evaluate(NormalizedTransaction transaction) {
        if (transaction.pending()) {
            return EligibilityDecision.rejected(SkipReason.PENDING);
        }
        if (transaction.direction() == TransactionDirection.CREDIT) {
            return EligibilityDecision.rejected(SkipReason.CREDIT);
        }
        if (hasExcludedCategory(transaction.categories()) || hasExcludedKeyword(transaction.name())) {
            return EligibilityDecision.rejected(SkipReason.EXCLUDED_CATEGORY);
        }
        if (!ELIGIBLE_KINDS.contains(transaction.kind())) {
            return EligibilityDecision.rejected(SkipReason.INELIGIBLE_TYPE);
        }
        return EligibilityDecision.allow();
    }

    private boolean hasExcludedCategory(List<String> categories) {
        if (categories == null) {
            return false;
        }
        for (String category : categories) {
            for (String excluded : properties.getExcludedCategories()) {
                if (category.equals(excluded) || category.startsWith(excluded + "_")) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean hasExcludedKeyword(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        List<String> words = List.of(WORD_SEPARATOR.split(name.toUpperCase(Locale.ROOT)));
        for (String keyword : properties.getExcludedKeywords()) {
            if (words.contains(keyword.toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
