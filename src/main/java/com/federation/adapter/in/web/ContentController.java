package com.federation.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.federation.application.port.in.PublishContentUseCase;
import com.federation.domain.error.ValidationError.ContentError;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.Result;
import com.federation.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Content", description = "This site's own content collection")
public class ContentController {

    private final PublishContentUseCase publishContentUseCase;
    private final NodeIdentity localNode;

    public ContentController(PublishContentUseCase publishContentUseCase, NodeIdentity localNode) {
        this.publishContentUseCase = publishContentUseCase;
        this.localNode = localNode;
    }

    @PostMapping("/content")
    @Operation(summary = "Publish content", description = "Creates or replaces a local original; followers receive it as an update")
    public ResponseEntity<?> publish(@RequestBody PublishContentRequest request) {
        if (!localNode.publicKey().equals(RequestContext.getActorKey())) {
            return ErrorResponse.forbidden();
        }

        Result<ContentItem, ContentError> result = publishContentUseCase.publish(
            request.id(),
            request.name(),
            request.categoryId(),
            request.contentLocator(),
            request.thumbnailLocator(),
            request.metadata() != null ? request.metadata().toString() : null
        );

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(ContentResponse.from(result.getOrThrow()))
            : ErrorResponse.of(HttpStatus.BAD_REQUEST, result.errorOrNull().code(), result.errorOrNull().message());
    }

    @DeleteMapping("/content/{id}")
    @Operation(summary = "Delete content", description = "Removes an item from the local collection")
    public ResponseEntity<?> delete(
            @Parameter(description = "Content item ID", example = "clip-42")
            @PathVariable String id) {
        if (!localNode.publicKey().equals(RequestContext.getActorKey())) {
            return ErrorResponse.forbidden();
        }

        return publishContentUseCase.delete(id)
            .<ResponseEntity<?>>map(item -> ResponseEntity.ok(ContentResponse.from(item)))
            .orElseGet(() -> ErrorResponse.of(HttpStatus.NOT_FOUND, "CONTENT_NOT_FOUND", "No content item with id " + id));
    }

    @GetMapping("/content")
    @Operation(summary = "List content", description = "Lists the local collection, optionally only items authored here")
    public ResponseEntity<List<ContentResponse>> list(
            @Parameter(description = "Only items without federation provenance")
            @RequestParam(defaultValue = "false") boolean originalsOnly) {
        List<ContentResponse> items = publishContentUseCase.listContent(originalsOnly).stream()
            .map(ContentResponse::from)
            .toList();
        return ResponseEntity.ok(items);
    }

    public record PublishContentRequest(
        String id,
        String name,
        String categoryId,
        String contentLocator,
        String thumbnailLocator,
        JsonNode metadata
    ) {}

    public record ContentResponse(
        String id,
        String name,
        String categoryId,
        String contentLocator,
        String thumbnailLocator,
        String metadata,
        String federatedFrom,
        Instant federatedAt,
        Boolean federatedRealtime
    ) {
        public static ContentResponse from(ContentItem item) {
            return new ContentResponse(
                item.id(),
                item.name(),
                item.categoryId(),
                item.contentLocator(),
                item.thumbnailLocator(),
                item.metadata(),
                item.federatedFrom(),
                item.federatedAt(),
                item.federatedRealtime()
            );
        }
    }
}
