package com.federation.adapter.out.access;

import com.federation.application.port.out.AccessControl;
import com.federation.domain.model.NodeIdentity;
import com.federation.infrastructure.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Access control backed by configuration: every key may write except those listed in
 * {@code app.access.denied-keys}.
 */
@Component
public class ConfiguredAccessControl implements AccessControl {

    private final String publicKey;
    private final Set<String> deniedKeys;

    public ConfiguredAccessControl(NodeIdentity localNode, AppProperties appProperties) {
        this.publicKey = localNode.publicKey();
        this.deniedKeys = Set.copyOf(appProperties.getAccess().getDeniedKeys());
    }

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public boolean canWrite(String actorKey) {
        return actorKey != null && !deniedKeys.contains(actorKey);
    }
}
