package villagecompute.playlists.shuffle;

import villagecompute.playlists.api.types.TrackType;

import java.util.List;
import java.util.Map;

/**
 * Contract for playlist ordering strategies used by shuffle jobs.
 *
 * <p>
 * Implementations must be CDI-managed beans. {@code ShuffleAlgorithmRegistry} discovers them at startup and looks them
 * up by {@link #name()}, which is the value stored in {@code schedules.algorithm_name}.
 */
public interface ShuffleAlgorithm {

    /**
     * Registry key, stable across releases.
     */
    String name();

    String description();

    /**
     * Returns the new playlist order as track URIs. Tracks without a URI are omitted.
     *
     * @param tracks
     *            current playlist order
     * @param params
     *            the schedule's algorithm parameters; unknown keys are ignored
     */
    List<String> shuffle(List<TrackType> tracks, Map<String, Object> params);
}
