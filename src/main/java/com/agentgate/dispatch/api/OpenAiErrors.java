package com.agentgate.dispatch.api;

import com.agentgate.core.error.ErrorResponse;
import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds OpenAI error envelopes from exceptions.
 */
final class OpenAiErrors {

    private static final Pattern CODE = Pattern.compile("\"code\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern TYPE = Pattern.compile("\"type\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern PARAM = Pattern.compile("^([a-z_]+):", Pattern.CASE_INSENSITIVE);

    static final String DEFAULT_MESSAGE = "An unexpected error occurred";

    private OpenAiErrors() {}

    static String errorType(HttpStatus status) {
        return switch (status) {
            case BAD_REQUEST -> "invalid_request_error";
            case UNAUTHORIZED -> "authentication_error";
            case FORBIDDEN -> "permission_error";
            case NOT_FOUND -> "not_found_error";
            case TOO_MANY_REQUESTS -> "rate_limit_error";
            default -> "server_error";
        };
    }

    static HttpStatus statusOf(Throwable error) {
        return error instanceof GatewayException gateway ? gateway.getStatus() : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ErrorResponse envelope(HttpStatus status, String message) {
        return envelope(errorType(status), message);
    }

    /** Gateway exceptions name their own {@code error.type}; anything else is a server error. */
    static ErrorResponse envelope(Throwable error) {
        if (error instanceof GatewayException gateway) {
            return envelope(gateway.getErrorType(), gateway.getMessage());
        }
        return envelope(HttpStatus.INTERNAL_SERVER_ERROR, error.getMessage());
    }

    private static ErrorResponse envelope(String type, String message) {
        String text = message == null || message.isBlank() ? DEFAULT_MESSAGE : message;
        return ErrorResponse.of(text, type, extractParam(text), extractCode(text));
    }

    /** Code embedded in an upstream message as {@code "code":"..."}, else {@code "type":"..."}. */
    static String extractCode(String message) {
        Matcher code = CODE.matcher(message);
        if (code.find()) {
            return code.group(1);
        }
        Matcher type = TYPE.matcher(message);
        return type.find() ? type.group(1) : null;
    }

    /** Parameter named by a {@code field: problem} validation message. */
    static String extractParam(String message) {
        Matcher matcher = PARAM.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }
}
