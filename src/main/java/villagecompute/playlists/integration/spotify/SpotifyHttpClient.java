/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;
import villagecompute.playlists.exceptions.PlaylistNotFoundException;
import villagecompute.playlists.exceptions.RateLimitException;
import villagecompute.playlists.exceptions.SpotifyApiException;
import villagecompute.playlists.exceptions.TransientApiException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resilient request envelope around the Spotify Web API for one user.
 *
 * <p>
 * Every call goes through {@link #execute}:
 * <ul>
 * <li>401: refresh the access token once via the {@link AccessTokenProvider} and retry; a second 401 fails</li>
 * <li>404: {@link PlaylistNotFoundException}, never retried</li>
 * <li>429: wait {@code max(Retry-After, backoff)} and retry; after the budget, {@link RateLimitException}</li>
 * <li>5xx and network errors: wait the backoff and retry; after the budget, {@link TransientApiException}</li>
 * <li>Other 4xx: {@link SpotifyApiException} with the server's error message, never retried</li>
 * </ul>
 *
 * <p>
 * Backoff is {@code baseDelay * 2^attempt}, capped at {@code maxDelay}. Sleeps block the calling worker thread. One
 * instance serves one job run and is not shared across threads.
 */
public class SpotifyHttpClient {

    private static final Logger LOG = Logger.getLogger(SpotifyHttpClient.class);

    static final long DEFAULT_RETRY_AFTER_SECONDS = 1;
    static final long EXHAUSTED_RETRY_AFTER_SECONDS = 60;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AccessTokenProvider tokenProvider;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;
    private final String baseUrl;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration requestTimeout;

    public SpotifyHttpClient(HttpClient httpClient, ObjectMapper objectMapper, AccessTokenProvider tokenProvider,
            Sleeper sleeper, MeterRegistry meterRegistry, String baseUrl, int maxRetries, Duration baseDelay,
            Duration maxDelay, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.tokenProvider = tokenProvider;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
        this.baseUrl = baseUrl;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.requestTimeout = requestTimeout;
    }

    public JsonNode get(String path) {
        return execute("GET", path, null);
    }

    public JsonNode post(String path, Object body) {
        return execute("POST", path, body);
    }

    public JsonNode put(String path, Object body) {
        return execute("PUT", path, body);
    }

    public JsonNode delete(String path, Object body) {
        return execute("DELETE", path, body);
    }

    /**
     * Follows the {@code next} cursor of a paged list endpoint until exhausted and concatenates the {@code items}.
     *
     * @param path
     *            first page, relative to the API base or absolute
     * @return every item across all pages, in order
     */
    public List<JsonNode> getAllPages(String path) {
        List<JsonNode> items = new ArrayList<>();
        String next = path;
        int pages = 0;
        while (next != null) {
            JsonNode page = get(next);
            pages++;
            for (JsonNode item : page.path("items")) {
                items.add(item);
            }
            JsonNode nextNode = page.path("next");
            next = nextNode.isTextual() && !nextNode.asText().isBlank() ? nextNode.asText() : null;
        }
        LOG.debugf("Fetched %d items across %d pages from %s", items.size(), pages, path);
        return items;
    }

    /**
     * Sends one logical request through the retry envelope.
     *
     * @param method
     *            HTTP method
     * @param path
     *            path relative to the API base, or an absolute URL (pagination cursors)
     * @param body
     *            JSON body, or null
     * @return parsed response body; an empty body yields a missing node
     */
    public JsonNode execute(String method, String path, Object body) {
        if (tokenProvider.isExpired()) {
            tokenProvider.refresh();
        }

        String payload = serialize(body);
        boolean refreshedAfter401 = false;
        int attempt = 0;

        while (true) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(buildRequest(method, path, payload), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (attempt >= maxRetries) {
                    LOG.errorf("Spotify %s %s failed after %d retries: %s", method, path, maxRetries, e.toString());
                    throw new TransientApiException(
                            "Spotify API request failed after " + maxRetries + " retries: " + e.getMessage(), e);
                }
                Duration delay = backoff(attempt);
                LOG.warnf("Network error on %s %s (attempt %d/%d), retrying in %dms: %s", method, path, attempt + 1,
                        maxRetries, delay.toMillis(), e.toString());
                recordRetry("network");
                pause(delay);
                attempt++;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SpotifyApiException("Interrupted during Spotify API request", e);
            }

            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return parse(response.body());
            }

            if (status == 401) {
                if (refreshedAfter401) {
                    throw new SpotifyApiException("Spotify API rejected the refreshed access token: "
                            + errorMessage(response.body(), status), status);
                }
                LOG.infof("Access token rejected on %s %s, refreshing once", method, path);
                tokenProvider.refresh();
                refreshedAfter401 = true;
                continue;
            }

            if (status == 404) {
                throw new PlaylistNotFoundException("Resource not found: " + errorMessage(response.body(), status));
            }

            if (status == 429) {
                OptionalLong retryAfter = retryAfterSeconds(response);
                if (attempt >= maxRetries) {
                    long surfaced = retryAfter.orElse(EXHAUSTED_RETRY_AFTER_SECONDS);
                    LOG.errorf("Spotify rate limit persisted after %d retries on %s %s", maxRetries, method, path);
                    throw new RateLimitException(
                            "Spotify rate limit exceeded after " + maxRetries + " retries", surfaced);
                }
                Duration waitFor = Duration.ofSeconds(retryAfter.orElse(DEFAULT_RETRY_AFTER_SECONDS));
                Duration delay = waitFor.compareTo(backoff(attempt)) > 0 ? waitFor : backoff(attempt);
                LOG.warnf("Rate limited on %s %s (attempt %d/%d), retrying in %dms", method, path, attempt + 1,
                        maxRetries, delay.toMillis());
                recordRetry("rate_limit");
                pause(delay);
                attempt++;
                continue;
            }

            if (status >= 500) {
                if (attempt >= maxRetries) {
                    LOG.errorf("Spotify %s %s returned %d after %d retries", method, path, status, maxRetries);
                    throw new TransientApiException("Spotify API error (HTTP " + status + ") after " + maxRetries
                            + " retries: " + errorMessage(response.body(), status), status);
                }
                Duration delay = backoff(attempt);
                LOG.warnf("Server error %d on %s %s (attempt %d/%d), retrying in %dms", status, method, path,
                        attempt + 1, maxRetries, delay.toMillis());
                recordRetry("server_error");
                pause(delay);
                attempt++;
                continue;
            }

            throw new SpotifyApiException(errorMessage(response.body(), status), status);
        }
    }

    /**
     * Delay before retry number {@code attempt + 1}.
     */
    Duration backoff(int attempt) {
        long millis = baseDelay.toMillis() << Math.min(attempt, 30);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    private HttpRequest buildRequest(String method, String path, String payload) {
        HttpRequest.BodyPublisher publisher = payload == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(payload);
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(resolve(path)).timeout(requestTimeout)
                .header("Authorization", "Bearer " + tokenProvider.currentAccessToken())
                .header("Accept", "application/json").method(method, publisher);
        if (payload != null) {
            builder.header("Content-Type", "application/json");
        }
        return builder.build();
    }

    private URI resolve(String path) {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return URI.create(path);
        }
        return URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path));
    }

    private String serialize(Object body) {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new SpotifyApiException("Failed to serialize request body", e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SpotifyApiException("Failed to parse Spotify API response", e);
        }
    }

    /**
     * Extracts {@code error.message} from a Spotify error body, falling back to the raw body or the status.
     */
    String errorMessage(String body, int status) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                if (error.isTextual()) {
                    return error.asText();
                }
                JsonNode message = error.path("message");
                if (message.isTextual()) {
                    return message.asText();
                }
            } catch (JsonProcessingException e) {
                LOG.debugf("Non-JSON error body for HTTP %d", status);
            }
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
        return "HTTP " + status;
    }

    private static OptionalLong retryAfterSeconds(HttpResponse<String> response) {
        Optional<String> header = response.headers().firstValue("Retry-After");
        if (header.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(header.get().trim()));
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric Retry-After header '%s'", header.get());
            return OptionalLong.empty();
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpotifyApiException("Interrupted while backing off", e);
        }
    }

    private void recordRetry(String reason) {
        if (meterRegistry != null) {
            meterRegistry.counter("spotify.api.retries", "reason", reason).increment();
        }
    }
}
