package com.nosota.roundup.service;

import com.nosota.roundup.error.CooldownActiveException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Cooldown between destination changes of a round-up config.
 *
 * <p>Remaining days = {@code cooldownDays - floor((now - lastSwitch) / 1 day)}, never negative.
 * A switch is allowed once that reaches zero, or when the config was never switched.
 */
@Component
public class CharitySwitchGuard {

    private final long cooldownDays;

    public CharitySwitchGuard(@Value("${roundup.charity-switch.cooldown-days:30}") long cooldownDays) {
        this.cooldownDays = cooldownDays;
    }

    public long remainingDays(LocalDateTime lastSwitch, LocalDateTime now) {
        if (lastSwitch == null) {
            return 0;
        }
        long elapsedDays = Duration.between(lastSwitch, now).toDays();
        return Math.max(0, cooldownDays - elapsedDays);
    }

    /**
     * @throws CooldownActiveException while the cooldown runs, with the whole days left
     */
    public void check(LocalDateTime lastSwitch, LocalDateTime now) throws CooldownActiveException {
        long remaining = remainingDays(lastSwitch, now);
        if (remaining > 0) {
            throw new CooldownActiveException(remaining);
        }
    }

    /**
     * Earliest moment the next switch is allowed, null if allowed now.
     */
    public LocalDateTime nextSwitchAllowedAt(LocalDateTime lastSwitch, LocalDateTime now) {
        if (remainingDays(lastSwitch, now) == 0) {
            return null;
        }
        return lastSwitch.plusDays(cooldownDays);
    }
}
