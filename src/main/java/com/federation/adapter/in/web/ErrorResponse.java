package com.federation.adapter.in.web;

import com.federation.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error envelope shared by every endpoint.
 */
public record ErrorResponse(
    String error,
    String message,
    String requestId
) {

    static ResponseEntity<ErrorResponse> of(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error, message, RequestContext.getRequestId()));
    }

    static ResponseEntity<ErrorResponse> forbidden() {
        return of(HttpStatus.FORBIDDEN, "FORBIDDEN", "Only this site's own key may change its follows or content");
    }
}
