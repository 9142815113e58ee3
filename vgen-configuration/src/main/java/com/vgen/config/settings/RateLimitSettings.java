package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Map;

public final class RateLimitSettings {

    public static final RateLimitSettings DEFAULTS = new RateLimitSettings(30, 2, 1000);

    private final int rpm;
    private final int retryCount;
    private final long retryBackoffMs;

    public RateLimitSettings(int rpm, int retryCount, long retryBackoffMs) {
        this.rpm = rpm;
        this.retryCount = Math.max(0, retryCount);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
    }

    public static RateLimitSettings from(ConfigValue section) {
        return new RateLimitSettings(
                section.get("rpm").asInt(DEFAULTS.rpm),
                section.get("retry_count").asInt(DEFAULTS.retryCount),
                section.get("retry_backoff_ms").asLong(DEFAULTS.retryBackoffMs));
    }

    /** Requests per minute; zero or negative disables pacing. */
    public int getRpm() {
        return rpm;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    /** Minimum spacing between two live requests, {@code 60000 / rpm}; 0 when pacing is off. */
    public long minIntervalMs() {
        return rpm > 0 ? 60_000L / rpm : 0L;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("rpm", rpm);
        m.put("retry_count", retryCount);
        m.put("retry_backoff_ms", retryBackoffMs);
        return m;
    }
}
