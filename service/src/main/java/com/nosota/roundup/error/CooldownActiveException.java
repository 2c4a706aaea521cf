package com.nosota.roundup.error;

import lombok.Getter;

/**
 * A charity switch was attempted before the cooldown elapsed.
 */
@Getter
public class CooldownActiveException extends Exception {

    private final long daysRemaining;

    public CooldownActiveException(long daysRemaining) {
        super(String.format("Charity can be switched again in %d day(s)", daysRemaining));
        this.daysRemaining = daysRemaining;
    }
}
