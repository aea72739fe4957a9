/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.playlists.integration.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import villagecompute.playlists.api.types.PlaylistType;
import villagecompute.playlists.api.types.TrackType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PlaylistApi} over the Spotify Web API playlist endpoints.
 *
 * <h2>Endpoints</h2>
 * <ul>
 * <li>{@code GET /playlists/{id}/items} - paged; each entry's track sits under {@code item} (older responses use
 * {@code track})</li>
 * <li>{@code PUT /playlists/{id}/items} - replace, first batch only</li>
 * <li>{@code POST /playlists/{id}/items} - append</li>
 * <li>{@code DELETE /playlists/{id}/items} - remove, body {@code {"tracks":[{"uri":...}]}}</li>
 * <li>{@code GET /me/playlists}, {@code GET /me}, {@code POST /users/{id}/playlists}</li>
 * </ul>
 *
 * <p>
 * Write endpoints accept at most {@code batchSize} (100) URIs per request. Calls are sequential.
 */
public class SpotifyApi implements PlaylistApi {

    private static final Logger LOG = Logger.getLogger(SpotifyApi.class);

    private static final int PAGE_LIMIT = 100;
    private static final int PLAYLIST_PAGE_LIMIT = 50;

    private final SpotifyHttpClient client;
    private final int batchSize;

    public SpotifyApi(SpotifyHttpClient client, int batchSize) {
        this.client = client;
        this.batchSize = batchSize;
    }

    @Override
    public List<TrackType> getPlaylistTracks(String playlistId) {
        List<JsonNode> items = client.getAllPages("/playlists/" + playlistId + "/items?limit=" + PAGE_LIMIT);
        List<TrackType> tracks = new ArrayList<>(items.size());
        int dropped = 0;
        for (JsonNode item : items) {
            TrackType track = parseTrack(item);
            if (track == null || !track.hasUri()) {
                dropped++;
                continue;
            }
            tracks.add(track);
        }
        if (dropped > 0) {
            LOG.debugf("Dropped %d entries without a URI from playlist %s", dropped, playlistId);
        }
        return tracks;
    }

    @Override
    public void replacePlaylistTracks(String playlistId, List<String> uris) {
        List<List<String>> batches = partition(uris);
        List<String> first = batches.isEmpty() ? List.of() : batches.get(0);
        client.put("/playlists/" + playlistId + "/items", Map.of("uris", first));
        for (int i = 1; i < batches.size(); i++) {
            client.post("/playlists/" + playlistId + "/items", Map.of("uris", batches.get(i)));
        }
        LOG.debugf("Replaced playlist %s with %d tracks in %d requests", playlistId, uris.size(),
                Math.max(1, batches.size()));
    }

    @Override
    public void addTracks(String playlistId, List<String> uris) {
        for (List<String> batch : partition(uris)) {
            client.post("/playlists/" + playlistId + "/items", Map.of("uris", batch));
        }
    }

    @Override
    public void removeTracks(String playlistId, List<String> uris) {
        for (List<String> batch : partition(uris)) {
            List<Map<String, String>> tracks = new ArrayList<>(batch.size());
            for (String uri : batch) {
                tracks.add(Map.of("uri", uri));
            }
            client.delete("/playlists/" + playlistId + "/items", Map.of("tracks", tracks));
        }
    }

    @Override
    public List<PlaylistType> getUserPlaylists() {
        List<PlaylistType> playlists = new ArrayList<>();
        for (JsonNode node : client.getAllPages("/me/playlists?limit=" + PLAYLIST_PAGE_LIMIT)) {
            if (node == null || node.isNull()) {
                continue;
            }
            playlists.add(parsePlaylist(node));
        }
        return playlists;
    }

    @Override
    public PlaylistType createPlaylist(String name, String description, boolean isPublic) {
        String userId = getCurrentUserId();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("description", description == null ? "" : description);
        body.put("public", isPublic);
        JsonNode created = client.post("/users/" + userId + "/playlists", body);
        PlaylistType playlist = parsePlaylist(created);
        LOG.infof("Created playlist %s (%s) for Spotify user %s", playlist.id(), name, userId);
        return playlist;
    }

    @Override
    public String getCurrentUserId() {
        return client.get("/me").path("id").asText();
    }

    static TrackType parseTrack(JsonNode item) {
        JsonNode track = item.path("item");
        if (!track.isObject()) {
            track = item.path("track");
        }
        if (!track.isObject()) {
            return null;
        }
        List<String> artists = new ArrayList<>();
        for (JsonNode artist : track.path("artists")) {
            String name = artist.path("name").asText(null);
            if (name != null) {
                artists.add(name);
            }
        }
        return new TrackType(track.path("id").asText(null), track.path("uri").asText(null),
                track.path("name").asText(null), artists, track.path("album").path("name").asText(null),
                track.path("duration_ms").asLong(0L), item.path("added_at").asText(null));
    }

    private static PlaylistType parsePlaylist(JsonNode node) {
        JsonNode counts = node.path("items").isObject() ? node.path("items") : node.path("tracks");
        return new PlaylistType(node.path("id").asText(null), node.path("name").asText(null),
                node.path("owner").path("id").asText(null), counts.path("total").asInt(0),
                node.path("public").asBoolean(false));
    }

    private List<List<String>> partition(List<String> uris) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < uris.size(); start += batchSize) {
            batches.add(uris.subList(start, Math.min(start + batchSize, uris.size())));
        }
        return batches;
    }
}
