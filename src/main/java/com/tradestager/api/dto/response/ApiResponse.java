package com.tradestager.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;

/** Success envelope: {@code {success: true, data, path, timestamp}}. Applied by ApiResponseAdvice. */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path, Instant timestamp) {
        this.data = data;
        this.path = path;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, String path) {
        return new ApiResponse<>(data, path, Instant.now());
    }
}
