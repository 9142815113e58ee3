package com.vgen.generation.client;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Request/response channel to the generation backend. Implementations enforce {@code timeout} and
 * report non-2xx responses as a {@link TransportResponse}, not an exception.
 */
public interface GenerationTransport {

    TransportResponse post(URI uri, Map<String, String> headers, String body, Duration timeout)
            throws IOException, InterruptedException;
}
