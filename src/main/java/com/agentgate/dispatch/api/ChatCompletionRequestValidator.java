package com.agentgate.dispatch.api;

import com.agentgate.core.error.InvalidRequestException;
import com.agentgate.core.model.ChatMessage;

import java.util.Set;

/**
 * Checks a completion request before any runtime work starts. Messages use the
 * {@code field: problem} form so the error envelope can report the offending param.
 */
final class ChatCompletionRequestValidator {

    private static final Set<String> ROLES = Set.of("system", "user", "assistant", "tool");

    private ChatCompletionRequestValidator() {}

    static void validate(ChatCompletionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("body: is required");
        }
        if (request.model() == null || request.model().isBlank()) {
            throw new InvalidRequestException("model: is required");
        }
        if (request.messages() == null || request.messages().isEmpty()) {
            throw new InvalidRequestException("messages: array must not be empty");
        }
        for (ChatMessage message : request.messages()) {
            if (message == null || !ROLES.contains(message.role())) {
                throw new InvalidRequestException(
                        "messages: role must be one of system, user, assistant, tool");
            }
        }
        if (request.temperature() != null && (request.temperature() < 0 || request.temperature() > 2)) {
            throw new InvalidRequestException("temperature: must be between 0 and 2");
        }
        if (request.topP() != null && (request.topP() < 0 || request.topP() > 1)) {
            throw new InvalidRequestException("top_p: must be between 0 and 1");
        }
        if (request.maxTokens() != null && request.maxTokens() <= 0) {
            throw new InvalidRequestException("max_tokens: must be a positive integer");
        }
    }
}
