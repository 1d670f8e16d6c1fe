package com.zzf.simon.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Connection settings for {@link SimonApiClient}. The token supplier is asked on every request so a
 * refreshed credential is picked up without rebuilding the client.
 */
@Value
@Builder
public class SimonClientConfig {
    String baseUrl;
    Supplier<String> tokenSupplier;
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);
    /** Upper bound for one chat stream; the server closes its side after five minutes. */
    @Builder.Default
    Duration streamTimeout = Duration.ofMinutes(6);
    @Builder.Default
    int streamConnectAttempts = 3;
    @Builder.Default
    Duration streamRetryDelay = Duration.ofSeconds(2);
    @Builder.Default
    int recordWriteAttempts = 3;
    @Builder.Default
    Duration recordRetryBase = Duration.ofSeconds(1);

    String normalizedBaseUrl() {
        String url = baseUrl == null ? "" : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
