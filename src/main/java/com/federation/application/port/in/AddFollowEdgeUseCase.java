package com.federation.application.port.in;

import com.federation.domain.error.FollowError;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.Result;
import com.federation.domain.model.SiteAddress;

import java.util.List;

public interface AddFollowEdgeUseCase {
    Result<FollowEdge, FollowError> addFollowEdge(SiteAddress targetAddress, String displayName,
                                                  boolean recursive, List<SiteAddress> followChain);
}
