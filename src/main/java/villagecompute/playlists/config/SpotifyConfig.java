package villagecompute.playlists.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Spotify Web API endpoints, app credentials and the retry budget shared by every background client.
 *
 * <p>
 * <b>Configuration (application.properties):</b>
 * <ul>
 * <li>{@code playlistjobs.spotify.api-base-url} - Web API root</li>
 * <li>{@code playlistjobs.spotify.accounts-url} - token endpoint for the refresh-token grant</li>
 * <li>{@code playlistjobs.spotify.client-id} / {@code client-secret} - app credentials (env in production)</li>
 * <li>{@code playlistjobs.spotify.max-retries} - retries after the first attempt for 429, 5xx and network errors</li>
 * <li>{@code playlistjobs.spotify.base-delay-ms} / {@code max-delay-ms} - exponential backoff base and cap</li>
 * </ul>
 */
@ApplicationScoped
public class SpotifyConfig {

    private static final Logger LOG = Logger.getLogger(SpotifyConfig.class);

    @ConfigProperty(
            name = "playlistjobs.spotify.api-base-url",
            defaultValue = "https://api.spotify.com/v1")
    String apiBaseUrl;

    @ConfigProperty(
            name = "playlistjobs.spotify.accounts-url",
            defaultValue = "https://accounts.spotify.com/api/token")
    String accountsUrl;

    @ConfigProperty(
            name = "playlistjobs.spotify.client-id")
    Optional<String> clientId;

    @ConfigProperty(
            name = "playlistjobs.spotify.client-secret")
    Optional<String> clientSecret;

    @ConfigProperty(
            name = "playlistjobs.spotify.max-retries",
            defaultValue = "4")
    int maxRetries;

    @ConfigProperty(
            name = "playlistjobs.spotify.base-delay-ms",
            defaultValue = "2000")
    long baseDelayMs;

    @ConfigProperty(
            name = "playlistjobs.spotify.max-delay-ms",
            defaultValue = "16000")
    long maxDelayMs;

    @ConfigProperty(
            name = "playlistjobs.spotify.request-timeout-seconds",
            defaultValue = "30")
    int requestTimeoutSeconds;

    @ConfigProperty(
            name = "playlistjobs.jobs.batch-size",
            defaultValue = "100")
    int batchSize;

    @PostConstruct
    void logConfiguration() {
        if (clientId.isEmpty() || clientSecret.isEmpty()) {
            LOG.warn("Spotify client credentials are not configured; scheduled jobs will fail at token refresh");
        }
        LOG.infof("Spotify API %s (maxRetries=%d, backoff=%d..%dms, timeout=%ds)", apiBaseUrl, maxRetries,
                baseDelayMs, maxDelayMs, requestTimeoutSeconds);
    }

    public String apiBaseUrl() {
        return stripTrailingSlash(apiBaseUrl);
    }

    public String accountsUrl() {
        return accountsUrl;
    }

    public String clientId() {
        return clientId.orElse("");
    }

    public String clientSecret() {
        return clientSecret.orElse("");
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration baseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration maxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public int batchSize() {
        return batchSize;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
