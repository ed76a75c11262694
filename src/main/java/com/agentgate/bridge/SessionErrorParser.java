package com.agentgate.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Flattens the {@code error} object of a {@code session.error} event into one line.
 *
 * <p>Provider failures arrive with the provider's own JSON response serialized into
 * {@code data.message}, e.g. {@code {"error":{"type":"authentication_error","message":"invalid x-api-key"}}},
 * which renders as {@code [authentication_error] invalid x-api-key}. Anything that is
 * not JSON is returned verbatim.
 */
public final class SessionErrorParser {

    static final String UNKNOWN = "Unknown session error";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SessionErrorParser() {}

    public static String parse(JsonNode error) {
        if (error == null || !error.isObject()) {
            return UNKNOWN;
        }

        String dataMessage = text(error.path("data").path("message"));
        if (dataMessage != null) {
            try {
                JsonNode parsed = MAPPER.readTree(dataMessage);
                JsonNode nested = parsed.path("error");
                String nestedMessage = text(nested.path("message"));
                if (nestedMessage != null) {
                    String code = text(nested.path("code"));
                    if (code == null) {
                        code = text(nested.path("type"));
                    }
                    return code != null ? "[" + code + "] " + nestedMessage : nestedMessage;
                }
                String message = text(parsed.path("message"));
                if (message != null) {
                    return message;
                }
            } catch (JsonProcessingException e) {
                return dataMessage;
            }
        }

        String message = text(error.path("message"));
        return message != null ? message : error.toString();
    }

    private static String text(JsonNode node) {
        return node.isTextual() && !node.asText().isEmpty() ? node.asText() : null;
    }
}
