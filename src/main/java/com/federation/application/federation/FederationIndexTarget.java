package com.federation.application.federation;

import com.federation.application.port.in.WriteFederationIndexUseCase;
import com.federation.application.port.out.FederationIndexRepository;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Pointer import into the federation index. Writes act as the followed site, so the index write
 * policy decides whether they land.
 */
public class FederationIndexTarget implements ImportTarget {

    private static final Logger log = LoggerFactory.getLogger(FederationIndexTarget.class);

    private final WriteFederationIndexUseCase index;
    private final FederationIndexRepository repository;
    private final IndexEntryMapper mapper;
    private final Clock clock;

    public FederationIndexTarget(
            WriteFederationIndexUseCase index,
            FederationIndexRepository repository,
            IndexEntryMapper mapper,
            Clock clock) {
        this.index = index;
        this.repository = repository;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public boolean contains(ContentItem incoming, FollowEdge edge) {
        return repository.exists(mapper.entryIdFor(incoming, edge));
    }

    @Override
    public boolean write(ContentItem federated, FollowEdge edge) {
        FederationIndexEntry entry = mapper.toEntry(federated, edge, clock.instant());
        var result = index.insert(entry, edge.targetAddress().value());
        if (result.isFailure()) {
            log.warn("Index entry {} refused: {}", entry.id(), result.errorOrNull().message());
            return false;
        }
        return true;
    }

    @Override
    public boolean evict(ContentItem removed, FollowEdge edge) {
        String id = mapper.entryIdFor(removed, edge);
        Optional<FederationIndexEntry> local = repository.findById(id);
        if (local.isEmpty() || !edge.targetAddress().matches(local.get().sourceSiteId())) {
            return false;
        }
        return index.remove(id, edge.targetAddress().value()).isSuccess();
    }
}
