package com.flagship.currency_gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Map;

/**
 * Failure body shared by every endpoint. {@code details} carries per-field
 * validation messages and is omitted otherwise.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("error")
    String error;

    @JsonProperty("code")
    String code;

    @JsonProperty("details")
    Map<String, String> details;

    public static ErrorResponse of(String error, String code) {
        return new ErrorResponse(false, error, code, null);
    }

    public static ErrorResponse of(String error, String code, Map<String, String> details) {
        return new ErrorResponse(false, error, code, details);
    }
}
