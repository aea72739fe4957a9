package villagecompute.playlists.services;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.SpotifyTokenResponseType;
import villagecompute.playlists.data.models.User;
import villagecompute.playlists.exceptions.CredentialException;
import villagecompute.playlists.integration.spotify.AccessTokenProvider;
import villagecompute.playlists.integration.spotify.PlaylistApi;
import villagecompute.playlists.integration.spotify.SpotifyAuthClient;
import villagecompute.playlists.integration.spotify.SpotifyClientFactory;
import villagecompute.playlists.integration.spotify.TokenInfo;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds authenticated Spotify clients for background runs and keeps the stored refresh token current.
 *
 * <p>
 * A background client starts with an expired access token, so its first request refreshes. When Spotify answers a
 * refresh with a different refresh token, the new one is encrypted and committed before the request continues. A
 * response without a refresh token keeps the old one.
 *
 * <p>
 * <b>Concurrency:</b> refresh-and-persist is serialized per user. Two schedules of the same user running at once would
 * otherwise both refresh with the same token and one rotated token would be lost. A thread that waited on the lock
 * re-reads the stored token first, so it refreshes with whatever the previous holder committed.
 */
@ApplicationScoped
public class SpotifyCredentialService {

    private static final Logger LOG = Logger.getLogger(SpotifyCredentialService.class);

    @Inject
    TokenService tokenService;

    @Inject
    SpotifyAuthClient authClient;

    @Inject
    SpotifyClientFactory clientFactory;

    @Inject
    UserCredentialStore credentialStore;

    @Inject
    MeterRegistry meterRegistry;

    private final ConcurrentMap<Long, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    /**
     * Creates a playlist client acting as {@code user}.
     *
     * @throws CredentialException
     *             if the user has no stored token or it cannot be decrypted
     */
    public PlaylistApi buildClientForUser(User user) {
        if (user.encryptedRefreshToken == null || user.encryptedRefreshToken.isBlank()) {
            throw new CredentialException("User " + user.spotifyId
                    + " has no stored refresh token. User must log in to enable scheduled operations.");
        }

        String refreshToken;
        try {
            refreshToken = tokenService.decrypt(user.encryptedRefreshToken);
        } catch (CredentialException e) {
            throw new CredentialException(
                    "Failed to decrypt refresh token for user " + user.spotifyId + ": " + e.getMessage(), e);
        }

        return clientFactory.create(new UserTokenProvider(user.id, user.spotifyId, TokenInfo.expired(refreshToken)));
    }

    /**
     * Refreshes the access token for one user and persists a rotated refresh token.
     *
     * @param current
     *            token state held by the calling client
     * @return new token state
     */
    TokenInfo refreshAndPersist(Long userId, String spotifyId, TokenInfo current) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            String refreshToken = latestRefreshToken(userId, current.refreshToken());

            SpotifyTokenResponseType response;
            try {
                response = authClient.refresh(refreshToken);
            } catch (CredentialException e) {
                meterRegistry.counter("spotify.token.refresh", "result", "failure").increment();
                throw new CredentialException(
                        "Failed to refresh Spotify token for user " + spotifyId + ": " + e.getMessage(), e);
            }

            String issued = response.refreshToken();
            boolean rotated = issued != null && !issued.isBlank() && !issued.equals(refreshToken);
            String effective = rotated ? issued : refreshToken;
            if (rotated) {
                credentialStore.storeEncryptedRefreshToken(userId, tokenService.encrypt(issued));
                LOG.infof("Updated rotated refresh token for user %s", spotifyId);
            }
            meterRegistry.counter("spotify.token.refresh", "result", rotated ? "rotated" : "success").increment();

            String tokenType = response.tokenType() == null ? "Bearer" : response.tokenType();
            return new TokenInfo(response.accessToken(), tokenType, Instant.now().plusSeconds(response.expiresIn()),
                    effective);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The stored token wins over the in-memory one when they differ: another run for this user rotated it.
     */
    private String latestRefreshToken(Long userId, String inMemory) {
        Optional<String> stored = credentialStore.loadEncryptedRefreshToken(userId);
        if (stored.isEmpty() || stored.get().isBlank()) {
            return inMemory;
        }
        String decrypted = tokenService.decrypt(stored.get());
        if (!decrypted.equals(inMemory)) {
            LOG.debugf("Refresh token for user %d was rotated by another run, using stored token", userId);
        }
        return decrypted;
    }

    private final class UserTokenProvider implements AccessTokenProvider {

        private final Long userId;
        private final String spotifyId;
        private volatile TokenInfo token;

        UserTokenProvider(Long userId, String spotifyId, TokenInfo token) {
            this.userId = userId;
            this.spotifyId = spotifyId;
            this.token = token;
        }

        @Override
        public boolean isExpired() {
            return token.isExpired(Instant.now());
        }

        @Override
        public String currentAccessToken() {
            return token.accessToken();
        }

        @Override
        public String refresh() {
            token = refreshAndPersist(userId, spotifyId, token);
            return token.accessToken();
        }
    }
}
