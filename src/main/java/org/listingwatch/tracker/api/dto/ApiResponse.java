package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.api.exception.ErrorCode;
import org.slf4j.MDC;

/**
 * Response envelope for every endpoint. Successful calls carry {@code data}, failed ones
 * {@code error}; {@code correlationId} echoes the request's id when one is in scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private T data;
    private ErrorBody error;
    private String correlationId;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .data(data)
                .correlationId(MDC.get("correlationId"))
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorCode code, String message) {
        return error(code, message, null);
    }

    public static <T> ApiResponse<T> error(ErrorCode code, String message, Object details) {
        return ApiResponse.<T>builder()
                .error(new ErrorBody(code.name(), message, details))
                .correlationId(MDC.get("correlationId"))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private String code;
        private String message;
        private Object details;
    }
}
