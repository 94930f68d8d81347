package com.federation.application.port.in;

import com.federation.domain.error.ValidationError.ContentError;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.Result;

import java.util.List;
import java.util.Optional;

public interface PublishContentUseCase {
    Result<ContentItem, ContentError> publish(String id, String name, String categoryId, String contentLocator,
                                              String thumbnailLocator, String metadata);

    Optional<ContentItem> delete(String id);

    List<ContentItem> listContent(boolean originalsOnly);
}
