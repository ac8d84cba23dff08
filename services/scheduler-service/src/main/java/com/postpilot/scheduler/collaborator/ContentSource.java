package com.postpilot.scheduler.collaborator;

import java.util.Optional;
import java.util.UUID;

public interface ContentSource {

    /**
     * @throws com.postpilot.scheduler.exception.CollaboratorUnavailableException when the
     *         content service cannot answer
     */
    Optional<ContentPiece> getContent(UUID contentPieceId);
}
