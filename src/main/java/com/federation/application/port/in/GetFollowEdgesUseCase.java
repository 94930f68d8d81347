package com.federation.application.port.in;

import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.Page;

public interface GetFollowEdgesUseCase {
    Page<FollowEdge> getFollowEdges(String cursor, int limit);
}
