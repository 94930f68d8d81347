package com.federation.application.port.in;

import com.federation.domain.error.FollowError;
import com.federation.domain.model.Result;

import java.util.UUID;

public interface RemoveFollowEdgeUseCase {
    Result<Void, FollowError> removeFollowEdge(UUID edgeId);
}
