package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Playlist summary as returned by the playlist listing and creation endpoints.
 */
public record PlaylistType(String id, String name, @JsonProperty("owner_id") String ownerId,
        @JsonProperty("track_count") int trackCount, @JsonProperty("is_public") boolean isPublic) {
}
