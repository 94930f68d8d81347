package com.federation.application.service;

import com.federation.application.port.in.PublishContentUseCase;
import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.ContentStore.ContentQuery;
import com.federation.domain.error.ValidationError.ContentError;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Local authoring of original content. Federated copies are written only by reconciliation.
 */
@Service
public class ContentService implements PublishContentUseCase {

    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    private final ContentStore localStore;

    public ContentService(ContentStore localStore) {
        this.localStore = localStore;
    }

    @Override
    @Transactional
    public Result<ContentItem, ContentError> publish(String id, String name, String categoryId, String contentLocator,
                                                     String thumbnailLocator, String metadata) {
        var itemResult = ContentItem.create(id, name, categoryId, contentLocator, thumbnailLocator, metadata);
        if (itemResult.isFailure()) {
            log.warn("Content validation failed: {}", itemResult.errorOrNull().message());
            return itemResult;
        }
        ContentItem item = itemResult.getOrThrow();
        var put = localStore.put(item);
        log.info("Published {} ({})", item.id(), put.hash());
        return Result.success(item);
    }

    @Override
    @Transactional
    public Optional<ContentItem> delete(String id) {
        Optional<ContentItem> removed = localStore.del(id);
        removed.ifPresent(item -> log.info("Deleted {}", item.id()));
        return removed;
    }

    @Override
    public List<ContentItem> listContent(boolean originalsOnly) {
        return localStore.search(originalsOnly ? ContentQuery.originals() : ContentQuery.all());
    }
}
