package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Track entry as read from a playlist. Local files and unavailable entries can come back without a {@code uri}.
 *
 * @param id
 *            Spotify track id (null for local files)
 * @param uri
 *            {@code spotify:track:...} URI
 * @param name
 *            track title
 * @param artists
 *            artist names in credit order
 * @param albumName
 *            album title
 * @param durationMs
 *            track length in milliseconds
 * @param addedAt
 *            ISO 8601 timestamp the track was added to the playlist (may be null)
 */
public record TrackType(String id, String uri, String name, List<String> artists,
        @JsonProperty("album_name") String albumName, @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("added_at") String addedAt) {

    public TrackType {
        artists = artists == null ? List.of() : List.copyOf(artists);
    }

    /**
     * Minimal track carrying only a URI, used where the playlist order is all that matters.
     */
    public static TrackType ofUri(String uri) {
        return new TrackType(null, uri, null, List.of(), null, 0L, null);
    }

    public boolean hasUri() {
        return uri != null && !uri.isBlank();
    }
}
