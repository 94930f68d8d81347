package com.federation.application.service;

import com.federation.application.port.out.AccessControl;
import com.federation.application.port.out.FollowEdgeRepository;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.SiteAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Who may write to this node's federation index: the owner always; a followed site if access control
 * also agrees; nobody else. A write without an acting identity is the owner's own.
 */
@Component
public class IndexWritePolicy {

    private static final Logger log = LoggerFactory.getLogger(IndexWritePolicy.class);

    private final NodeIdentity owner;
    private final FollowEdgeRepository followEdgeRepository;
    private final AccessControl accessControl;

    public IndexWritePolicy(NodeIdentity owner, FollowEdgeRepository followEdgeRepository, AccessControl accessControl) {
        this.owner = owner;
        this.followEdgeRepository = followEdgeRepository;
        this.accessControl = accessControl;
    }

    public boolean permits(String actorKey) {
        if (actorKey == null || actorKey.isBlank() || actorKey.equals(owner.publicKey())) {
            return true;
        }
        var address = SiteAddress.parse(actorKey);
        if (address.isFailure() || !followEdgeRepository.existsByTarget(address.getOrThrow())) {
            log.debug("Index write by {} denied: not a followed site", actorKey);
            return false;
        }
        boolean allowed = accessControl.canWrite(actorKey);
        if (!allowed) {
            log.debug("Index write by {} denied by access control", actorKey);
        }
        return allowed;
    }
}
