/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import villagecompute.playlists.api.types.PlaylistType;
import villagecompute.playlists.api.types.TrackType;

import java.util.List;

/**
 * Playlist operations the job handlers need from the remote API.
 *
 * <p>
 * Every method may throw the {@link villagecompute.playlists.exceptions.SpotifyApiException} family:
 * {@link villagecompute.playlists.exceptions.PlaylistNotFoundException} for a missing playlist,
 * {@link villagecompute.playlists.exceptions.RateLimitException} and
 * {@link villagecompute.playlists.exceptions.TransientApiException} once retries are exhausted.
 */
public interface PlaylistApi {

    /**
     * All tracks of a playlist in playlist order. Entries without a URI are dropped.
     */
    List<TrackType> getPlaylistTracks(String playlistId);

    /**
     * Replaces the full track list, in order. An empty list clears the playlist.
     */
    void replacePlaylistTracks(String playlistId, List<String> uris);

    /**
     * Appends tracks in batches. An empty list is a no-op.
     */
    void addTracks(String playlistId, List<String> uris);

    /**
     * Removes every occurrence of the given URIs, in batches. An empty list is a no-op.
     */
    void removeTracks(String playlistId, List<String> uris);

    List<PlaylistType> getUserPlaylists();

    PlaylistType createPlaylist(String name, String description, boolean isPublic);

    String getCurrentUserId();
}
