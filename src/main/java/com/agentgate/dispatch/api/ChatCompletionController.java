package com.agentgate.dispatch.api;

import com.agentgate.core.error.UnauthorizedException;
import com.agentgate.core.security.TenantAuthFilter;
import com.agentgate.core.tenant.TenantConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI-compatible chat completions.
 */
@RestController
@RequestMapping("/v1/chat")
public class ChatCompletionController {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionController.class);

    static final String SESSION_HEADER = "x-session-id";

    private final ChatCompletionService completionService;
    private final CompletionStreamingService streamingService;

    public ChatCompletionController(ChatCompletionService completionService,
                                    CompletionStreamingService streamingService) {
        this.completionService = completionService;
        this.streamingService = streamingService;
    }

    /**
     * POST /v1/chat/completions: returns a {@link ChatCompletionResponse} as JSON, or an
     * {@code SseEmitter} of chunks when {@code stream} is true. MVC picks the return
     * value handler from the runtime type, hence {@code Object}.
     */
    @PostMapping("/completions")
    public Object completions(
            @RequestAttribute(name = TenantAuthFilter.TENANT_ATTRIBUTE, required = false) TenantConfig tenant,
            @RequestHeader(name = SESSION_HEADER, required = false) String sessionId,
            @RequestBody ChatCompletionRequest request) {
        if (tenant == null) {
            throw new UnauthorizedException("Invalid or missing token");
        }
        ChatCompletionRequestValidator.validate(request);

        log.info("Chat completion for tenant {} (model={}, messages={}, stream={})",
                tenant.id(), request.model(), request.messages().size(), request.streaming());

        if (request.streaming()) {
            return streamingService.stream(tenant.id(), request, sessionId);
        }
        return completionService.complete(tenant.id(), request, sessionId);
    }
}
