/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import java.time.Duration;
import java.time.Instant;

/**
 * Access token state for one user's client.
 *
 * @param accessToken
 *            bearer token sent on every API call
 * @param tokenType
 *            always {@code Bearer} in practice
 * @param expiresAt
 *            instant after which the token must be refreshed before use
 * @param refreshToken
 *            long-lived refresh token, plaintext, held only in memory
 */
public record TokenInfo(String accessToken, String tokenType, Instant expiresAt, String refreshToken) {

    /**
     * Refresh this long before the real expiry so a request never races the deadline.
     */
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    /**
     * Token state for a background run: no usable access token, so the first request refreshes.
     */
    public static TokenInfo expired(String refreshToken) {
        return new TokenInfo("", "Bearer", Instant.EPOCH, refreshToken);
    }

    public boolean isExpired(Instant now) {
        return accessToken == null || accessToken.isEmpty() || !now.plus(EXPIRY_MARGIN).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "TokenInfo[tokenType=" + tokenType + ", expiresAt=" + expiresAt + "]";
    }
}
