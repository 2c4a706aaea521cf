package com.nosota.roundup.client.directory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Cause as published by the cause directory.
 *
 * @param id             Cause id
 * @param organizationId Owning organization
 * @param status         Directory status, VERIFIED when it may receive donations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CauseInfo(Long id, Long organizationId, String status) {

    public static final String VERIFIED = "VERIFIED";

    public boolean isVerified() {
        return VERIFIED.equalsIgnoreCase(status);
    }
}
