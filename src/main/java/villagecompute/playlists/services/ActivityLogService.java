package villagecompute.playlists.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.playlists.data.models.ActivityLog;
import villagecompute.playlists.data.models.ActivityType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fire-and-forget writer for the user activity feed.
 */
@ApplicationScoped
public class ActivityLogService {

    private static final Logger LOG = Logger.getLogger(ActivityLogService.class);

    private static final int MAX_DESCRIPTION_LENGTH = 500;

    /**
     * Records an activity in its own transaction. Never throws; a failed write is logged and reported as
     * {@code false}.
     */
    public boolean log(Long userId, ActivityType type, String description, String playlistId, String playlistName,
            Map<String, Object> metadata) {
        ActivityLog entry = new ActivityLog();
        entry.userId = userId;
        entry.activityType = type;
        entry.description = description.length() > MAX_DESCRIPTION_LENGTH
                ? description.substring(0, MAX_DESCRIPTION_LENGTH)
                : description;
        entry.playlistId = playlistId;
        entry.playlistName = playlistName;
        entry.metadata = metadata;
        entry.createdAt = Instant.now();
        try {
            QuarkusTransaction.requiringNew().run(() -> entry.persist());
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to log %s activity for user %d", type, userId);
            return false;
        }
    }

    @Transactional
    public List<ActivityLog> recentActivity(Long userId, int limit) {
        return ActivityLog.findRecentByUser(userId, limit);
    }
}
