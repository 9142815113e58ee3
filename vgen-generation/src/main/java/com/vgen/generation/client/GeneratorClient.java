package com.vgen.generation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vgen.config.PipelineConfig;
import com.vgen.config.settings.GenerationSettings;
import com.vgen.config.settings.ProviderSettings;
import com.vgen.config.settings.RateLimitSettings;
import com.vgen.generation.prompt.GenerationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Sends a {@link GenerationPrompt} to the configured backend and returns candidate variants.
 * <p>
 * In mock mode ({@code provider.mock} or {@code io.dry_run}) no request is made and deterministic
 * placeholder variants are returned. In live mode the request body is shaped by the
 * {@link ProviderProfile}; requests are paced per {@code rate_limit.rpm}, failures are retried
 * {@code rate_limit.retry_count} times with a fixed backoff, and a 400/422 response naming a sampling
 * parameter drops that parameter and resends without consuming an attempt.
 */
public final class GeneratorClient {

    private static final Logger log = LoggerFactory.getLogger(GeneratorClient.class);

    /** Request fields that may be dropped when the backend rejects them, in the order they are checked. */
    static final List<String> DOWNGRADABLE_PARAMS = List.of("response_format", "temperature", "top_p", "n");

    private static final Map<String, Pattern> PARAM_MENTIONS = paramMentions();

    private static final String OPTIONS = "options";

    private final PipelineConfig config;
    private final GenerationTransport transport;
    private final Function<String, String> environment;
    private final Sleeper sleeper;
    private final RequestPacer pacer;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponseParser responseParser = new ResponseParser(mapper);

    public GeneratorClient(PipelineConfig config, GenerationTransport transport,
                           Function<String, String> environment, Sleeper sleeper, LongSupplier clock) {
        this.config = config;
        this.transport = transport;
        this.environment = environment;
        this.sleeper = sleeper;
        this.pacer = new RequestPacer(config.getRateLimit().minIntervalMs(), clock, sleeper);
    }

    public GeneratorClient(PipelineConfig config) {
        this(config, defaultTransport(config.getProvider()), System::getenv, Sleeper.SYSTEM,
                System::currentTimeMillis);
    }

    static HttpClientTransport defaultTransport(ProviderSettings provider) {
        return new HttpClientTransport(Duration.ofMillis(provider.getTimeoutMs()));
    }

    public GenerationResult generate(GenerationPrompt prompt) {
        if (config.isMockGeneration()) {
            return mock(prompt);
        }
        ProviderSettings provider = config.getProvider();
        ProviderProfile profile = ProviderProfile.fromValue(provider.getName());
        Map<String, String> headers = headers(profile, provider);
        ObjectNode body = requestBody(profile, prompt);
        URI uri = endpoint(provider);
        Duration timeout = Duration.ofMillis(provider.getTimeoutMs());
        return send(uri, headers, body, timeout);
    }

    private GenerationResult mock(GenerationPrompt prompt) {
        int n = config.getGen().getNumVariants();
        List<String> variants = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            variants.add("[" + prompt.getContentKey() + "] Variant " + i + " ||| Second bubble (optional)");
        }
        ObjectNode raw = mapper.createObjectNode();
        raw.put("mock", true);
        raw.put("model", config.getProvider().getModel());
        log.debug("Mock generation for {}: {} variants", prompt.getContentKey(), n);
        return new GenerationResult(variants, null, raw, true);
    }

    private GenerationResult send(URI uri, Map<String, String> headers, ObjectNode body, Duration timeout) {
        RateLimitSettings rateLimit = config.getRateLimit();
        int attempt = 0;
        while (true) {
            String payload;
            try {
                payload = mapper.writeValueAsString(body);
            } catch (JsonProcessingException e) {
                throw new GenerationException("Failed to serialize request body", e);
            }
            try {
                pacer.await();
                TransportResponse response = transport.post(uri, headers, payload, timeout);
                if (response.isSuccess()) {
                    JsonNode root = mapper.readTree(response.body());
                    List<String> variants = responseParser.variants(root);
                    log.info("Received {} candidate variants from {}", variants.size(), uri);
                    return new GenerationResult(variants, body.deepCopy(), root, false);
                }
                if (response.statusCode() == 400 || response.statusCode() == 422) {
                    String rejected = rejectedParam(body, response.body());
                    if (rejected != null) {
                        log.warn("Backend rejected parameter '{}' (HTTP {}); retrying without it",
                                rejected, response.statusCode());
                        removeParam(body, rejected);
                        continue;
                    }
                }
                throw new GenerationException("Generation backend returned HTTP " + response.statusCode()
                        + ": " + abbreviate(response.body()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException("Interrupted while waiting for the generation backend", e);
            } catch (IOException | RuntimeException e) {
                if (attempt >= rateLimit.getRetryCount()) {
                    if (e instanceof GenerationException) {
                        throw (GenerationException) e;
                    }
                    throw new GenerationException("Generation failed after " + (attempt + 1) + " attempt(s): "
                            + e.getMessage(), e);
                }
                attempt++;
                log.warn("Generation attempt {} failed ({}); retrying in {} ms", attempt, e.getMessage(),
                        rateLimit.getRetryBackoffMs());
                try {
                    sleeper.sleep(rateLimit.getRetryBackoffMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new GenerationException("Interrupted during retry backoff", ie);
                }
            }
        }
    }

    ObjectNode requestBody(ProviderProfile profile, GenerationPrompt prompt) {
        GenerationSettings gen = config.getGen();
        ObjectNode body = mapper.createObjectNode();
        body.put("model", config.getProvider().getModel());
        switch (profile) {
            case GENERIC_JSON -> {
                body.put("temperature", gen.getTemperature());
                body.put("top_p", gen.getTopP());
                body.put("n", gen.getNumVariants());
                body.set("prompt", mapper.valueToTree(prompt));
            }
            case OPENAI_CHAT -> {
                body.put("temperature", gen.getTemperature());
                body.put("top_p", gen.getTopP());
                body.put("n", 1);
                body.putObject("response_format").put("type", "json_object");
                body.set("messages", messages(prompt));
            }
            case OLLAMA_CHAT -> {
                body.put("stream", false);
                body.put("format", "json");
                ObjectNode options = body.putObject(OPTIONS);
                options.put("temperature", gen.getTemperature());
                options.put("top_p", gen.getTopP());
                body.set("messages", messages(prompt));
            }
        }
        return body;
    }

    private ArrayNode messages(GenerationPrompt prompt) {
        ArrayNode messages = mapper.createArrayNode();
        messages.addObject().put("role", "system").put("content", prompt.getSystem());
        String user;
        try {
            user = mapper.writeValueAsString(prompt);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to serialize prompt", e);
        }
        messages.addObject().put("role", "user").put("content", user);
        return messages;
    }

    private Map<String, String> headers(ProviderProfile profile, ProviderSettings provider) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        String envName = provider.getApiKeyEnv();
        String key = envName.isBlank() ? null : environment.apply(envName);
        if (key != null && !key.isBlank()) {
            headers.put("Authorization", "Bearer " + key.trim());
        } else if (profile.isCredentialRequired()) {
            throw new GenerationException("Missing API key: environment variable '" + envName + "' is not set");
        }
        return headers;
    }

    private static URI endpoint(ProviderSettings provider) {
        String baseUrl = provider.getBaseUrl().trim();
        if (baseUrl.isEmpty()) {
            throw new GenerationException("provider.base_url is not set");
        }
        try {
            return URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new GenerationException("Invalid provider.base_url '" + baseUrl + "'", e);
        }
    }

    /**
     * First downgradable parameter still present in {@code body}, at the top level or under
     * {@code options}, that the error text mentions.
     */
    static String rejectedParam(ObjectNode body, String errorBody) {
        if (errorBody == null || errorBody.isBlank()) {
            return null;
        }
        for (String param : DOWNGRADABLE_PARAMS) {
            boolean present = body.has(param) || body.path(OPTIONS).has(param);
            if (present && PARAM_MENTIONS.get(param).matcher(errorBody).find()) {
                return param;
            }
        }
        return null;
    }

    static void removeParam(ObjectNode body, String param) {
        body.remove(param);
        JsonNode options = body.path(OPTIONS);
        if (options.isObject()) {
            ((ObjectNode) options).remove(param);
        }
    }

    private static Map<String, Pattern> paramMentions() {
        Map<String, Pattern> out = new LinkedHashMap<>();
        for (String param : DOWNGRADABLE_PARAMS) {
            // a bare "n" is too common in prose; only quoted mentions count
            String regex = param.length() == 1
                    ? "[\"'`]" + param + "[\"'`]"
                    : "(?<![A-Za-z0-9_])" + Pattern.quote(param) + "(?![A-Za-z0-9_])";
            out.put(param, Pattern.compile(regex));
        }
        return out;
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
