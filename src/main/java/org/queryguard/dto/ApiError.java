package org.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

// Body for requests that fail before admission; rejected queries never produce one
public final class ApiError {
    public final int code;
    public final String message;
    public final String detail;

    @JsonCreator
    public ApiError(@JsonProperty("code") int code,
                    @JsonProperty("message") String message,
                    @JsonProperty("detail") String detail) {
        this.code = code;
        this.message = message;
        this.detail = detail;
    }

    public static ApiError badRequest(String detail) {
        return new ApiError(400, "invalid request", detail);
    }
}
