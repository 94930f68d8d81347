package com.federation.application.federation.transport;

import com.federation.domain.model.SiteAddress;

import java.util.UUID;

/**
 * Naming of per-site update topics and the consumer groups that read them.
 */
public record UpdateTopics(String topicPrefix, String consumerGroupPrefix) {

    public String updatesTopic(SiteAddress site) {
        return topicPrefix + site.value() + ".updates";
    }

    public String updatesTopic(String siteId) {
        return topicPrefix + siteId + ".updates";
    }

    /**
     * One group per (follower, followed) pair so every following site sees every update.
     */
    public String consumerGroup(SiteAddress follower, SiteAddress followed) {
        return consumerGroupPrefix + follower.value() + "." + followed.value();
    }

    /**
     * Fresh group for a one-off read of a site's update log. A new group starts at the earliest offset.
     */
    public String replayGroup(SiteAddress follower, SiteAddress followed, UUID readerId) {
        return consumerGroup(follower, followed) + ".replay." + readerId;
    }
}
