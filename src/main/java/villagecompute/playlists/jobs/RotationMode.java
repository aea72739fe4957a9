package villagecompute.playlists.jobs;

import java.util.Optional;

/**
 * Rotation strategies between a production playlist and its archive, read from the schedule's
 * {@code rotation_mode} parameter.
 */
public enum RotationMode {

    /**
     * Move the oldest production tracks to the archive.
     */
    ARCHIVE_OLDEST("archive_oldest"),

    /**
     * Replace the oldest production tracks with the most recently archived tracks not already in production.
     */
    REFRESH("refresh"),

    /**
     * Exchange the oldest production tracks with eligible archive tracks, one for one.
     */
    SWAP("swap");

    public static final String PARAM_MODE = "rotation_mode";
    public static final String PARAM_COUNT = "rotation_count";
    public static final int DEFAULT_COUNT = 5;

    private final String value;

    RotationMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<RotationMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RotationMode mode : values()) {
            if (mode.value.equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
