package io.turnstile.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.turnstile.core.config.model.AgentDefaults;
import io.turnstile.core.config.model.AgentsConfig;
import io.turnstile.core.config.model.ProviderConfig;
import io.turnstile.core.config.model.ProvidersConfig;
import io.turnstile.core.config.model.TurnstileConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the config file with defaults filled in for every key it leaves out. A missing file
     * yields the defaults.
     */
    public TurnstileConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return TurnstileConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(TurnstileConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, TurnstileConfig.class);
    }

    /**
     * Overrides API keys, model and provider from environment variables. Blank variables are
     * ignored.
     */
    public TurnstileConfig applyEnvironment(TurnstileConfig config, Map<String, String> env) {
        ProvidersConfig providers = config.providers();
        providers = new ProvidersConfig(
            withKey(providers.anthropic(), env.get("ANTHROPIC_API_KEY")),
            withKey(providers.openai(), env.get("OPENAI_API_KEY")),
            withKey(providers.openrouter(), env.get("OPENROUTER_API_KEY"))
        );

        AgentDefaults defaults = config.agents().defaults();
        String model = firstNonBlank(env.get("TURNSTILE_MODEL"), env.get("MODEL"), defaults.model());
        String provider = firstNonBlank(env.get("TURNSTILE_PROVIDER"), defaults.provider());
        if (!Objects.equals(model, defaults.model()) || !Objects.equals(provider, defaults.provider())) {
            LOG.debug("Environment selects provider '{}' and model '{}'", provider, model);
        }
        AgentDefaults overridden = new AgentDefaults(
            provider,
            model,
            defaults.systemPrompt(),
            defaults.maxHistoryMessages(),
            defaults.toolTimeoutSeconds(),
            defaults.maxConcurrentTools(),
            defaults.streamChunkSize(),
            defaults.streamBufferSize()
        );
        return new TurnstileConfig(new AgentsConfig(overridden), providers, config.gateway());
    }

    public void save(Path configPath, TurnstileConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        TurnstileConfig config;
        if (created || overwrite) {
            config = TurnstileConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new OnboardResult(configPath, created, overwritten);
    }

    public String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private ProviderConfig withKey(ProviderConfig config, String apiKey) {
        ProviderConfig base = config == null ? ProviderConfig.defaults() : config;
        if (apiKey == null || apiKey.isBlank()) {
            return base;
        }
        return new ProviderConfig(apiKey.trim(), base.apiBase(), base.extraHeaders());
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
