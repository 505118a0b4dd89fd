package com.tradestager.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradestager.exception.ErrorCode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope: {@code {success: false, error: {code, message, reasons, details, ...}}}.
 *
 * <p>{@code reasons} carries every violated rule or limit for staging rejections, so clients
 * never have to parse the message. {@code retryable} tells the client whether the same call may
 * succeed later (concurrency conflicts, backend outages).
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode,
            String message,
            List<String> reasons,
            boolean retryable,
            Map<String, Object> details,
            String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .reasons(reasons)
                .retryable(retryable)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final List<String> reasons;
        private final boolean retryable;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
