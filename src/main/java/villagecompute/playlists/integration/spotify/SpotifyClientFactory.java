/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.playlists.config.SpotifyConfig;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds per-run {@link PlaylistApi} instances. The underlying {@link HttpClient} is shared; token state is not.
 */
@ApplicationScoped
public class SpotifyClientFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SpotifyConfig config;
    private final MeterRegistry meterRegistry;

    Sleeper sleeper = Sleeper.SYSTEM;

    @Inject
    public SpotifyClientFactory(ObjectMapper objectMapper, SpotifyConfig config, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(5)).build();
    }

    public PlaylistApi create(AccessTokenProvider tokenProvider) {
        SpotifyHttpClient client = new SpotifyHttpClient(httpClient, objectMapper, tokenProvider, sleeper,
                meterRegistry, config.apiBaseUrl(), config.maxRetries(), config.baseDelay(), config.maxDelay(),
                config.requestTimeout());
        return new SpotifyApi(client, config.batchSize());
    }
}
