package com.vgen.generation.client;

/** Status code and body of one HTTP exchange. */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
