/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.SpotifyTokenResponseType;
import villagecompute.playlists.config.SpotifyConfig;
import villagecompute.playlists.exceptions.CredentialException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Refresh-token grant against the Spotify accounts service.
 *
 * <p>
 * Any non-200 response, network failure or unreadable body becomes a {@link CredentialException}: the run cannot
 * continue and the user has to reconnect their account.
 */
@ApplicationScoped
public class SpotifyAuthClient {

    private static final Logger LOG = Logger.getLogger(SpotifyAuthClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SpotifyConfig config;

    @Inject
    public SpotifyAuthClient(ObjectMapper objectMapper, SpotifyConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @param refreshToken
     *            plaintext refresh token
     * @return token response; {@code refreshToken} is null unless Spotify rotated it
     * @throws CredentialException
     *             if the grant is rejected or the accounts service is unreachable
     */
    public SpotifyTokenResponseType refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new CredentialException("No refresh token available");
        }

        String form = "grant_type=refresh_token&refresh_token="
                + URLEncoder.encode(refreshToken, StandardCharsets.UTF_8);
        String basic = Base64.getEncoder()
                .encodeToString((config.clientId() + ":" + config.clientSecret()).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(config.accountsUrl()))
                .timeout(config.requestTimeout()).header("Authorization", "Basic " + basic)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form)).build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.errorf(e, "Token refresh request failed");
            throw new CredentialException("Token refresh request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialException("Interrupted during token refresh", e);
        }

        if (response.statusCode() != 200) {
            String reason = describeError(response.body());
            LOG.warnf("Token refresh rejected with HTTP %d: %s", response.statusCode(), reason);
            throw new CredentialException("Token refresh failed (HTTP " + response.statusCode() + "): " + reason);
        }

        SpotifyTokenResponseType token;
        try {
            token = objectMapper.readValue(response.body(), SpotifyTokenResponseType.class);
        } catch (IOException e) {
            throw new CredentialException("Unreadable token refresh response", e);
        }
        if (token.accessToken() == null || token.accessToken().isBlank()) {
            throw new CredentialException("Token refresh response did not include an access token");
        }
        return token;
    }

    private String describeError(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            var node = objectMapper.readTree(body);
            String error = node.path("error").asText("");
            String description = node.path("error_description").asText("");
            if (!error.isEmpty()) {
                return description.isEmpty() ? error : error + ": " + description;
            }
        } catch (IOException e) {
            LOG.debug("Token error body is not JSON");
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
