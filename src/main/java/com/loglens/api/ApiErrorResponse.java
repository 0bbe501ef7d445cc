package com.loglens.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the search API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    @JsonProperty("error")
    private final String error;

    @JsonProperty("code")
    private final String code;

    @JsonProperty("stage")
    private final Integer stage;

    @JsonProperty("message")
    private final String message;

    public ApiErrorResponse(String error, String code, Integer stage, String message) {
        this.error = error;
        this.code = code;
        this.stage = stage;
        this.message = message;
    }

    public String getError() {
        return error;
    }

    public String getCode() {
        return code;
    }

    public Integer getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }
}
