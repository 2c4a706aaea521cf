package com.nosota.roundup.service;

import com.nosota.roundup.error.CooldownActiveException;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Changes the donation destination of a round-up config, subject to {@link CharitySwitchGuard}.
 *
 * <p>Round-ups already accumulated go to the new destination at the next settlement; a donation
 * already in flight keeps the destination it was opened with.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CharitySwitchService {

    private final RoundUpConfigRepository roundUpConfigRepository;
    private final DestinationValidator destinationValidator;
    private final CharitySwitchGuard charitySwitchGuard;
    private final Clock clock;

    /**
     * @param configId          Config to update
     * @param newOrganizationId New destination organization
     * @param newCauseId        New destination cause, must belong to the organization
     * @return The updated config
     * @throws NotFoundException         if the config, cause or organization does not exist
     * @throws InvalidStateException     if the config is cancelled
     * @throws ValidationFailedException if the cause is foreign or unverified, or the organization cannot receive funds
     * @throws CooldownActiveException   if the previous switch was too recent
     */
    @Transactional(rollbackOn = Exception.class)
    public RoundUpConfig switchCharity(@NotNull UUID configId, @NotNull Long newOrganizationId, @NotNull Long newCauseId)
            throws NotFoundException, InvalidStateException, ValidationFailedException, CooldownActiveException {
        destinationValidator.validate(newOrganizationId, newCauseId);

        RoundUpConfig config = roundUpConfigRepository.getOneForUpdate(configId);
        if (config == null) {
            throw new NotFoundException("Round-up config not found: " + configId);
        }
        if (config.isCancelled()) {
            throw new InvalidStateException("Round-up config " + configId + " is cancelled");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        charitySwitchGuard.check(config.getLastCharitySwitch(), now);

        Long previousOrganization = config.getOrganizationId();
        Long previousCause = config.getCauseId();
        config.setOrganizationId(newOrganizationId);
        config.setCauseId(newCauseId);
        // whole seconds, so storage rounding cannot shorten the elapsed cooldown
        config.setLastCharitySwitch(now.truncatedTo(ChronoUnit.SECONDS));
        config.setUpdatedAt(now);
        roundUpConfigRepository.save(config);

        log.info("Config {} switched charity: org {} -> {}, cause {} -> {}",
                configId, previousOrganization, newOrganizationId, previousCause, newCauseId);
        return config;
    }
}
