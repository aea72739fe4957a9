/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

/**
 * Source of bearer tokens for a {@link SpotifyHttpClient}. Implementations own the refresh flow and whatever
 * persistence it implies.
 */
public interface AccessTokenProvider {

    /**
     * Whether the current access token should be refreshed before the next request.
     */
    boolean isExpired();

    String currentAccessToken();

    /**
     * Exchanges the refresh token for a new access token.
     *
     * @return the new access token
     * @throws villagecompute.playlists.exceptions.CredentialException
     *             if the refresh is rejected or cannot be completed
     */
    String refresh();
}
