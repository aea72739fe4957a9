package villagecompute.playlists.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.playlists.data.models.PlaylistPair;

import java.util.Optional;

/**
 * Read access to production/archive pairings for rotation jobs.
 */
@ApplicationScoped
public class PlaylistPairService {

    @Transactional
    public Optional<PlaylistPair> findPairForPlaylist(Long userId, String productionPlaylistId) {
        return PlaylistPair.findByProduction(userId, productionPlaylistId);
    }
}
