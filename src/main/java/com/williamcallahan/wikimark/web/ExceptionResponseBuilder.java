package com.williamcallahan.wikimark.web;

import com.williamcallahan.wikimark.domain.markdown.MarkdownErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error bodies returned by the markdown endpoints.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with a message only.
     *
     * @param status HTTP status code
     * @param message error message
     * @return JSON error response
     */
    public ResponseEntity<MarkdownErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new MarkdownErrorResponse(message, null));
    }

    /**
     * Builds an error response carrying the exception message as details.
     *
     * @param status HTTP status code
     * @param message error message
     * @param exception exception that occurred
     * @return JSON error response
     */
    public ResponseEntity<MarkdownErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new MarkdownErrorResponse(message, exception.getMessage()));
    }
}
