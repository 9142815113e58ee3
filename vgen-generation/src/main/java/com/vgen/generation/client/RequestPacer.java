package com.vgen.generation.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Spaces live requests at least {@code minIntervalMs} apart (derived from {@code rate_limit.rpm}).
 */
public final class RequestPacer {

    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    private final long minIntervalMs;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long lastRequestAt = -1;

    public RequestPacer(long minIntervalMs, LongSupplier clock, Sleeper sleeper) {
        this.minIntervalMs = Math.max(0, minIntervalMs);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /** Blocks until the next request may be sent, then records it as sent. */
    public void await() throws InterruptedException {
        if (minIntervalMs > 0 && lastRequestAt >= 0) {
            long wait = lastRequestAt + minIntervalMs - clock.getAsLong();
            if (wait > 0) {
                log.debug("Pacing: waiting {} ms before next request", wait);
                sleeper.sleep(wait);
            }
        }
        lastRequestAt = clock.getAsLong();
    }
}
