package org.listingwatch.tracker.api.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes returned in the response envelope, with the HTTP status each maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    UNKNOWN_SOURCE(HttpStatus.BAD_REQUEST),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NORMALIZATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_STATE(HttpStatus.UNPROCESSABLE_ENTITY),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;
}
