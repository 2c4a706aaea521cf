package com.nosota.roundup.client.directory;

import java.util.Optional;

/**
 * Read access to the cause and organization directory.
 */
public interface CauseDirectoryClient {

    Optional<CauseInfo> getCause(Long causeId);

    Optional<OrganizationPayoutStatus> getOrganizationPayoutStatus(Long organizationId);
}
