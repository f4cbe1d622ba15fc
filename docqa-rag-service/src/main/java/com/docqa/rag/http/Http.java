package com.docqa.rag.http;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Shared, thread-safe HttpClient used by every provider client.
 * Calls are synchronous; request timeouts are set per request.
 */
public final class Http {
    public static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    private Http() {}
}
