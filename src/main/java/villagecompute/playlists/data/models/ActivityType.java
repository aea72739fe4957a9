package villagecompute.playlists.data.models;

/**
 * Event kinds recorded in {@link ActivityLog}.
 */
public enum ActivityType {
    SCHEDULE_CREATE, SCHEDULE_UPDATE, SCHEDULE_DELETE, SCHEDULE_TOGGLE, SCHEDULE_RUN
}
