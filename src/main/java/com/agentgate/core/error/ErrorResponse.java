package com.agentgate.core.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * OpenAI error envelope: {@code {"error":{"message","type","param","code"}}}.
 * {@code param} and {@code code} are always present, null when unknown.
 */
public record ErrorResponse(Body error) {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Body(String message, String type, String param, String code) {}

    public static ErrorResponse of(String message, String type, String param, String code) {
        return new ErrorResponse(new Body(message, type, param, code));
    }
}
