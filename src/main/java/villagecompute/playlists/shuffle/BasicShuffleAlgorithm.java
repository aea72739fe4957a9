package villagecompute.playlists.shuffle;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.playlists.api.types.TrackType;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Uniform random shuffle that can pin the first {@code keep_first} tracks in place.
 */
@ApplicationScoped
public class BasicShuffleAlgorithm implements ShuffleAlgorithm {

    public static final String NAME = "BasicShuffle";
    public static final String PARAM_KEEP_FIRST = "keep_first";

    Random random = new SecureRandom();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Randomly shuffle your playlist while optionally keeping tracks in place at the top.";
    }

    @Override
    public List<String> shuffle(List<TrackType> tracks, Map<String, Object> params) {
        List<String> uris = new ArrayList<>(tracks.size());
        for (TrackType track : tracks) {
            if (track.hasUri()) {
                uris.add(track.uri());
            }
        }
        int keepFirst = keepFirst(params);
        if (uris.size() <= 1 || keepFirst >= uris.size()) {
            return uris;
        }
        Collections.shuffle(uris.subList(keepFirst, uris.size()), random);
        return uris;
    }

    static int keepFirst(Map<String, Object> params) {
        Object raw = params == null ? null : params.get(PARAM_KEEP_FIRST);
        if (raw instanceof Number) {
            return Math.max(0, ((Number) raw).intValue());
        }
        if (raw instanceof String) {
            try {
                return Math.max(0, Integer.parseInt(((String) raw).trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
