package com.federation.application.port.in;

import com.federation.domain.model.SessionSnapshot;

import java.util.Optional;
import java.util.UUID;

public interface GetSessionStatusUseCase {
    Optional<SessionSnapshot> getSession(UUID edgeId);
}
