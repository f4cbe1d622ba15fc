package com.docqa.rag.llm;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/**
 * Maps transport outcomes of provider HTTP calls to {@link ProviderFailureKind}s.
 */
final class ProviderResponses {

    static void requireSuccess(String provider, HttpResponse<String> resp) {
        int status = resp.statusCode();
        if (status / 100 == 2) return;

        String message = provider + " HTTP " + status + ": " + abbreviate(resp.body());
        ProviderFailureKind kind = switch (status) {
            case 401, 403 -> ProviderFailureKind.AUTHENTICATION;
            case 429 -> ProviderFailureKind.RATE_LIMITED;
            case 408, 504 -> ProviderFailureKind.TIMEOUT;
            default -> ProviderFailureKind.UNAVAILABLE;
        };
        throw new ProviderException(kind, message);
    }

    static ProviderException fromTransport(String provider, Exception e) {
        if (e instanceof ProviderException) {
            return (ProviderException) e;
        }
        if (e instanceof HttpTimeoutException) {
            return new ProviderException(ProviderFailureKind.TIMEOUT, provider + " timed out", e);
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new ProviderException(ProviderFailureKind.TIMEOUT, provider + " call interrupted", e);
        }
        if (e instanceof JsonProcessingException) {
            return new ProviderException(ProviderFailureKind.MALFORMED_RESPONSE,
                    provider + " returned invalid JSON", e);
        }
        if (e instanceof IOException) {
            return new ProviderException(ProviderFailureKind.UNAVAILABLE,
                    provider + " unreachable: " + e.getMessage(), e);
        }
        return new ProviderException(ProviderFailureKind.MALFORMED_RESPONSE,
                provider + " returned an unusable response: " + e.getMessage(), e);
    }

    static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }

    private ProviderResponses() {}
}
