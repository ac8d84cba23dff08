package com.postpilot.scheduler.collaborator;

import java.util.Optional;
import java.util.UUID;

public interface DestinationAccountSource {

    Optional<DestinationAccount> getAccount(UUID destinationAccountId);
}
