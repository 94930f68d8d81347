package com.federation.adapter.in.web;

import com.federation.application.port.in.AddFollowEdgeUseCase;
import com.federation.application.port.in.GetFollowEdgesUseCase;
import com.federation.application.port.in.GetSessionStatusUseCase;
import com.federation.application.port.in.RemoveFollowEdgeUseCase;
import com.federation.domain.error.FollowError;
import com.federation.domain.error.ValidationError;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.Page;
import com.federation.domain.model.Result;
import com.federation.domain.model.SessionSnapshot;
import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.context.RequestContext;
import com.federation.infrastructure.exception.EdgeNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Follows", description = "Follow edges to other sites and their sync sessions")
public class FollowController {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final AddFollowEdgeUseCase addFollowEdgeUseCase;
    private final RemoveFollowEdgeUseCase removeFollowEdgeUseCase;
    private final GetFollowEdgesUseCase getFollowEdgesUseCase;
    private final GetSessionStatusUseCase getSessionStatusUseCase;
    private final NodeIdentity localNode;

    public FollowController(
            AddFollowEdgeUseCase addFollowEdgeUseCase,
            RemoveFollowEdgeUseCase removeFollowEdgeUseCase,
            GetFollowEdgesUseCase getFollowEdgesUseCase,
            GetSessionStatusUseCase getSessionStatusUseCase,
            NodeIdentity localNode) {
        this.addFollowEdgeUseCase = addFollowEdgeUseCase;
        this.removeFollowEdgeUseCase = removeFollowEdgeUseCase;
        this.getFollowEdgesUseCase = getFollowEdgesUseCase;
        this.getSessionStatusUseCase = getSessionStatusUseCase;
        this.localNode = localNode;
    }

    @PostMapping("/follows")
    @Operation(summary = "Follow a site", description = "Adds a follow edge and opens its sync session")
    public ResponseEntity<?> addFollowEdge(@Valid @RequestBody AddFollowRequest request) {
        if (!isOwner()) {
            return ErrorResponse.forbidden();
        }

        var targetResult = SiteAddress.parse(request.targetAddress());
        if (targetResult.isFailure()) {
            return toValidationErrorResponse(targetResult.errorOrNull());
        }

        List<SiteAddress> chain = new ArrayList<>();
        if (request.followChain() != null) {
            for (String hop : request.followChain()) {
                var hopResult = SiteAddress.parse(hop);
                if (hopResult.isFailure()) {
                    return toValidationErrorResponse(hopResult.errorOrNull());
                }
                chain.add(hopResult.getOrThrow());
            }
        }

        Result<FollowEdge, FollowError> result = addFollowEdgeUseCase.addFollowEdge(
            targetResult.getOrThrow(),
            request.name(),
            Boolean.TRUE.equals(request.recursive()),
            chain
        );

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(FollowEdgeResponse.from(result.getOrThrow()))
            : toFollowErrorResponse(result.errorOrNull());
    }

    @DeleteMapping("/follows/{edgeId}")
    @Operation(summary = "Unfollow a site", description = "Closes the edge's session, removes the edge and purges its imports")
    public ResponseEntity<?> removeFollowEdge(
            @Parameter(description = "Follow edge ID", example = "01890a5d-ac96-774b-bcce-b302099a8057")
            @PathVariable UUID edgeId) {
        if (!isOwner()) {
            return ErrorResponse.forbidden();
        }

        Result<Void, FollowError> result = removeFollowEdgeUseCase.removeFollowEdge(edgeId);

        return result.isSuccess()
            ? ResponseEntity.ok(new RemovedResponse(edgeId.toString(), "unfollowed"))
            : toFollowErrorResponse(result.errorOrNull());
    }

    @GetMapping("/follows")
    @Operation(summary = "List follow edges", description = "Returns a page of follow edges, newest first")
    public ResponseEntity<PageResponse<FollowEdgeResponse>> getFollowEdges(
            @Parameter(description = "Pagination cursor from previous response")
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Number of edges to return (max 100)")
            @RequestParam(required = false) Integer limit) {

        int effectiveLimit = limit != null
            ? Math.max(1, Math.min(limit, MAX_PAGE_SIZE))
            : DEFAULT_PAGE_SIZE;

        Page<FollowEdge> page = getFollowEdgesUseCase.getFollowEdges(cursor, effectiveLimit);
        return ResponseEntity.ok(PageResponse.from(page, FollowEdgeResponse::from));
    }

    @GetMapping("/follows/{edgeId}/session")
    @Operation(summary = "Session status", description = "Current state of the sync session for a follow edge")
    public ResponseEntity<SessionResponse> getSession(
            @Parameter(description = "Follow edge ID", example = "01890a5d-ac96-774b-bcce-b302099a8057")
            @PathVariable UUID edgeId) {
        SessionSnapshot snapshot = getSessionStatusUseCase.getSession(edgeId)
            .orElseThrow(() -> new EdgeNotFoundException(edgeId.toString()));
        return ResponseEntity.ok(SessionResponse.from(snapshot));
    }

    private boolean isOwner() {
        return localNode.publicKey().equals(RequestContext.getActorKey());
    }

    private ResponseEntity<ErrorResponse> toFollowErrorResponse(FollowError error) {
        HttpStatus status;
        if (error instanceof FollowError.AlreadyFollowing) {
            status = HttpStatus.CONFLICT;
        } else if (error instanceof FollowError.NotFollowing) {
            status = HttpStatus.NOT_FOUND;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ErrorResponse.of(status, error.code(), error.message());
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        return ErrorResponse.of(HttpStatus.BAD_REQUEST, error.code(), error.message());
    }

    public record AddFollowRequest(
        @NotBlank String targetAddress,
        String name,
        Boolean recursive,
        List<String> followChain
    ) {}

    public record RemovedResponse(String edgeId, String status) {}

    public record FollowEdgeResponse(
        UUID id,
        String targetAddress,
        String name,
        boolean recursive,
        List<String> followChain,
        Instant createdAt
    ) {
        public static FollowEdgeResponse from(FollowEdge edge) {
            return new FollowEdgeResponse(
                edge.id(),
                edge.targetAddress().value(),
                edge.displayName(),
                edge.recursive(),
                edge.followChain().stream().map(SiteAddress::value).toList(),
                edge.createdAt()
            );
        }
    }

    public record SessionResponse(
        UUID edgeId,
        String targetAddress,
        String status,
        Instant lastActivity,
        int reconnectAttempts,
        String transport
    ) {
        public static SessionResponse from(SessionSnapshot snapshot) {
            return new SessionResponse(
                snapshot.edgeId(),
                snapshot.targetAddress().value(),
                snapshot.status().name(),
                snapshot.lastActivity(),
                snapshot.reconnectAttempts(),
                snapshot.transport().name()
            );
        }
    }
}
