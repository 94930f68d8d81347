package com.federation.adapter.in.web;

import com.federation.application.port.in.QueryFederationIndexUseCase;
import com.federation.application.port.in.WriteFederationIndexUseCase;
import com.federation.domain.error.IndexWriteError;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.IndexQuery;
import com.federation.domain.model.IndexStats;
import com.federation.domain.model.Result;
import com.federation.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/federation-index")
@Tag(name = "Federation Index", description = "Discovery over pointers to content held by other sites")
public class FederationIndexController {

    private final QueryFederationIndexUseCase queryUseCase;
    private final WriteFederationIndexUseCase writeUseCase;
    private final Clock clock;

    public FederationIndexController(
            QueryFederationIndexUseCase queryUseCase,
            WriteFederationIndexUseCase writeUseCase,
            Clock clock) {
        this.queryUseCase = queryUseCase;
        this.writeUseCase = writeUseCase;
        this.clock = clock;
    }

    @GetMapping("/recent")
    @Operation(summary = "Recent entries", description = "Entries ordered newest first")
    public List<FederationIndexEntry> getRecent(
            @Parameter(description = "Number of entries to return (max 500)")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Number of entries to skip")
            @RequestParam(defaultValue = "0") int offset) {
        return queryUseCase.getRecent(limit, offset);
    }

    @GetMapping("/categories/{categoryId}")
    @Operation(summary = "Entries by category")
    public List<FederationIndexEntry> getByCategory(@PathVariable String categoryId) {
        return queryUseCase.getByCategory(categoryId);
    }

    @GetMapping("/tags")
    @Operation(summary = "Entries by tag", description = "Entries carrying any of the given tags")
    public List<FederationIndexEntry> getByTags(
            @Parameter(description = "Tag to match, repeatable")
            @RequestParam(name = "tag", required = false) List<String> tags) {
        return queryUseCase.getByTags(tags != null ? tags : List.of());
    }

    @GetMapping("/sites/{siteId}")
    @Operation(summary = "Entries by source site")
    public List<FederationIndexEntry> getBySourceSite(@PathVariable String siteId) {
        return queryUseCase.getBySourceSite(siteId);
    }

    @GetMapping("/search")
    @Operation(summary = "Text search", description = "Case-insensitive match on title or description")
    public List<FederationIndexEntry> search(@RequestParam(name = "q", defaultValue = "") String text) {
        return queryUseCase.search(text);
    }

    @GetMapping("/range")
    @Operation(summary = "Entries in a time range", description = "Both bounds are exclusive and optional")
    public List<FederationIndexEntry> getByTimeRange(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant after,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before) {
        return queryUseCase.getByTimeRange(after, before);
    }

    @GetMapping("/featured")
    @Operation(summary = "Featured entries", description = "Entries currently featured")
    public List<FederationIndexEntry> getFeatured() {
        return queryUseCase.getFeatured();
    }

    @GetMapping("/promoted")
    @Operation(summary = "Promoted entries", description = "Entries currently promoted")
    public List<FederationIndexEntry> getPromoted() {
        return queryUseCase.getPromoted();
    }

    @PostMapping("/query")
    @Operation(summary = "Composite query", description = "Conjunction of the supplied predicates")
    public List<FederationIndexEntry> query(@RequestBody IndexQueryRequest request) {
        return queryUseCase.query(request.toQuery());
    }

    @GetMapping("/stats")
    @Operation(summary = "Index statistics")
    public IndexStats getStats() {
        return queryUseCase.getStats();
    }

    @PostMapping("/entries")
    @Operation(summary = "Insert an entry", description = "Accepted only from identities the write policy allows")
    public ResponseEntity<?> insert(@RequestBody IndexEntryRequest request) {
        Result<FederationIndexEntry, IndexWriteError> result =
            writeUseCase.insert(request.toEntry(clock.instant()), RequestContext.getActorKey());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(result.getOrThrow())
            : toErrorResponse(result.errorOrNull());
    }

    @DeleteMapping("/entries/{entryId}")
    @Operation(summary = "Remove an entry", description = "Accepted only from identities the write policy allows")
    public ResponseEntity<?> remove(@PathVariable String entryId) {
        Result<Void, IndexWriteError> result = writeUseCase.remove(entryId, RequestContext.getActorKey());

        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(IndexWriteError error) {
        HttpStatus status;
        if (error instanceof IndexWriteError.Denied) {
            status = HttpStatus.FORBIDDEN;
        } else if (error instanceof IndexWriteError.NotFound) {
            status = HttpStatus.NOT_FOUND;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ErrorResponse.of(status, error.code(), error.message());
    }

    public record IndexQueryRequest(
        String text,
        String contentType,
        String sourceSiteId,
        String categoryId,
        List<String> tags,
        Instant after,
        Instant before,
        Integer limit,
        Integer offset
    ) {
        IndexQuery toQuery() {
            return IndexQuery.builder()
                .text(text)
                .contentType(contentType)
                .sourceSiteId(sourceSiteId)
                .categoryId(categoryId)
                .tags(tags)
                .after(after)
                .before(before)
                .limit(limit != null ? limit : IndexQuery.DEFAULT_LIMIT)
                .offset(offset != null ? offset : 0)
                .build();
        }
    }

    public record IndexEntryRequest(
        String contentLocator,
        String title,
        String thumbnailLocator,
        String categoryId,
        String sourceSiteId,
        String sourceSiteName,
        String contentType,
        String description,
        Instant timestamp,
        List<String> tags,
        boolean featured,
        boolean promoted,
        Instant featuredUntil,
        Instant promotedUntil
    ) {
        FederationIndexEntry toEntry(Instant now) {
            return new FederationIndexEntry(
                null,
                contentLocator,
                title != null ? title : FederationIndexEntry.DEFAULT_TITLE,
                thumbnailLocator,
                categoryId != null ? categoryId : FederationIndexEntry.DEFAULT_CATEGORY,
                sourceSiteId,
                sourceSiteName != null ? sourceSiteName : sourceSiteId,
                contentType != null ? contentType : FederationIndexEntry.DEFAULT_CONTENT_TYPE,
                description,
                timestamp != null ? timestamp : now,
                tags,
                featured,
                promoted,
                featuredUntil,
                promotedUntil
            );
        }
    }
}
