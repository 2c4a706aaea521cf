package com.nosota.roundup.service;

import com.nosota.roundup.api.model.DonationStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating Donation status transitions.
 *
 * <pre>
 *   PENDING ──→ PROCESSING ──→ COMPLETED
 *      │             │
 *      │             └──────→ FAILED
 *      ├──────────────────→ FAILED
 *      └──────────────────→ COMPLETED   (confirmation or recovery before the accept was recorded)
 * </pre>
 */
@Component
public class DonationStatusStateMachine {

    private static final Map<DonationStatus, Set<DonationStatus>> ALLOWED_TRANSITIONS = Map.of(
            DonationStatus.PENDING, EnumSet.of(
                    DonationStatus.PROCESSING,
                    DonationStatus.COMPLETED,
                    DonationStatus.FAILED
            ),
            DonationStatus.PROCESSING, EnumSet.of(
                    DonationStatus.COMPLETED,
                    DonationStatus.FAILED
            )
    );

    public boolean isTransitionAllowed(DonationStatus fromStatus, DonationStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        if (fromStatus == toStatus) {
            return true;
        }
        Set<DonationStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(DonationStatus fromStatus, DonationStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid donation status transition: %s -> %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    public boolean isFinalState(DonationStatus status) {
        return status == DonationStatus.COMPLETED || status == DonationStatus.FAILED;
    }

    public boolean isInFlight(DonationStatus status) {
        return status == DonationStatus.PENDING || status == DonationStatus.PROCESSING;
    }
}
