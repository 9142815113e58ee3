package com.vgen.config;

import com.vgen.config.settings.ContextSettings;
import com.vgen.config.settings.GenerationSettings;
import com.vgen.config.settings.IoSettings;
import com.vgen.config.settings.ProviderSettings;
import com.vgen.config.settings.RateLimitSettings;
import com.vgen.config.settings.SafetySettings;
import com.vgen.config.settings.StyleSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed pipeline configuration. Every field has a default; a missing or non-map section is
 * replaced by its defaults with a warning.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private final ProviderSettings provider;
    private final GenerationSettings gen;
    private final ContextSettings context;
    private final StyleSettings style;
    private final IoSettings io;
    private final RateLimitSettings rateLimit;
    private final SafetySettings safety;

    public PipelineConfig(ProviderSettings provider, GenerationSettings gen, ContextSettings context,
                          StyleSettings style, IoSettings io, RateLimitSettings rateLimit, SafetySettings safety) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.gen = Objects.requireNonNull(gen, "gen");
        this.context = Objects.requireNonNull(context, "context");
        this.style = Objects.requireNonNull(style, "style");
        this.io = Objects.requireNonNull(io, "io");
        this.rateLimit = Objects.requireNonNull(rateLimit, "rateLimit");
        this.safety = Objects.requireNonNull(safety, "safety");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(ProviderSettings.DEFAULTS, GenerationSettings.DEFAULTS, ContextSettings.DEFAULTS,
                StyleSettings.DEFAULTS, IoSettings.DEFAULTS, RateLimitSettings.DEFAULTS, SafetySettings.DEFAULTS);
    }

    public static PipelineConfig from(ConfigValue root) {
        return new PipelineConfig(
                ProviderSettings.from(section(root, "provider")),
                GenerationSettings.from(section(root, "gen")),
                ContextSettings.from(section(root, "context")),
                StyleSettings.from(section(root, "style")),
                IoSettings.from(section(root, "io")),
                RateLimitSettings.from(section(root, "rate_limit")),
                SafetySettings.from(section(root, "safety")));
    }

    private static ConfigValue section(ConfigValue root, String name) {
        ConfigValue value = root.get(name);
        if (value.kind() != ConfigValue.Kind.MAP) {
            log.warn("Config section '{}' missing or not a map; using defaults", name);
            return ConfigValue.NULL;
        }
        return value;
    }

    public ProviderSettings getProvider() {
        return provider;
    }

    public GenerationSettings getGen() {
        return gen;
    }

    public ContextSettings getContext() {
        return context;
    }

    public StyleSettings getStyle() {
        return style;
    }

    public IoSettings getIo() {
        return io;
    }

    public RateLimitSettings getRateLimit() {
        return rateLimit;
    }

    public SafetySettings getSafety() {
        return safety;
    }

    /** Whether generation runs without network calls ({@code provider.mock} or {@code io.dry_run}). */
    public boolean isMockGeneration() {
        return provider.isMock() || io.isDryRun();
    }

    /** Plain-map snapshot with the original key names, embedded in archive records. */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("provider", provider.toSnapshot());
        m.put("gen", gen.toSnapshot());
        m.put("context", context.toSnapshot());
        m.put("style", style.toSnapshot());
        m.put("io", io.toSnapshot());
        m.put("rate_limit", rateLimit.toSnapshot());
        m.put("safety", safety.toSnapshot());
        return m;
    }
}
