package com.agentgate.core.llm;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static catalog of the models advertised on {@code /v1/models}, per provider.
 * Providers missing here (openrouter, custom endpoints) advertise nothing but
 * still accept any model id at completion time.
 */
public final class ModelCatalog {

    private ModelCatalog() {}

    public record ModelInfo(String id, String provider) {

        /** Id in the {@code provider/model} form requests use. */
        public String qualifiedId() {
            return provider + "/" + id;
        }
    }

    public static final List<ModelInfo> ANTHROPIC_MODELS = models("anthropic",
            "claude-sonnet-4-20250514",
            "claude-opus-4-20250514",
            "claude-3-5-sonnet-20241022",
            "claude-3-5-haiku-20241022");

    public static final List<ModelInfo> OPENAI_MODELS = models("openai",
            "gpt-4o",
            "gpt-4o-mini",
            "gpt-4-turbo",
            "o1",
            "o1-mini");

    public static final List<ModelInfo> GOOGLE_MODELS = models("google",
            "gemini-2.0-flash",
            "gemini-1.5-pro",
            "gemini-1.5-flash");

    public static final List<ModelInfo> GROQ_MODELS = models("groq",
            "llama-3.3-70b-versatile",
            "llama-3.1-8b-instant",
            "mixtral-8x7b-32768");

    public static final Map<String, List<ModelInfo>> ALL_MODELS;

    static {
        var all = new LinkedHashMap<String, List<ModelInfo>>();
        all.put("anthropic", ANTHROPIC_MODELS);
        all.put("openai", OPENAI_MODELS);
        all.put("google", GOOGLE_MODELS);
        all.put("groq", GROQ_MODELS);
        ALL_MODELS = Collections.unmodifiableMap(all);
    }

    /** Models of one provider, empty for providers without a catalog entry. */
    public static List<ModelInfo> modelsFor(String provider) {
        return ALL_MODELS.getOrDefault(provider, List.of());
    }

    public static ModelInfo findModel(String provider, String modelId) {
        return modelsFor(provider).stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .orElse(null);
    }

    private static List<ModelInfo> models(String provider, String... ids) {
        return Arrays.stream(ids).map(id -> new ModelInfo(id, provider)).toList();
    }
}
