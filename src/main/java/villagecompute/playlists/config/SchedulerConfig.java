package villagecompute.playlists.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings for the playlist job scheduler.
 *
 * <p>
 * {@code max-instances} is fixed at 1 and {@code coalesce} at true. The properties exist so operators see the policy in
 * config, but any other value is logged and ignored.
 */
@ApplicationScoped
public class SchedulerConfig {

    private static final Logger LOG = Logger.getLogger(SchedulerConfig.class);

    public static final int MAX_INSTANCES = 1;

    @ConfigProperty(
            name = "playlistjobs.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "playlistjobs.scheduler.pool-size",
            defaultValue = "3")
    int poolSize;

    @ConfigProperty(
            name = "playlistjobs.scheduler.misfire-grace-seconds",
            defaultValue = "3600")
    long misfireGraceSeconds;

    @ConfigProperty(
            name = "playlistjobs.scheduler.coalesce",
            defaultValue = "true")
    boolean coalesce;

    @ConfigProperty(
            name = "playlistjobs.scheduler.max-instances",
            defaultValue = "1")
    int maxInstances;

    @ConfigProperty(
            name = "playlistjobs.scheduler.timezone",
            defaultValue = "UTC")
    String timezone;

    @PostConstruct
    void validate() {
        if (maxInstances != MAX_INSTANCES) {
            LOG.warnf("playlistjobs.scheduler.max-instances=%d ignored; schedules never run concurrently",
                    maxInstances);
        }
        if (!coalesce) {
            LOG.warn("playlistjobs.scheduler.coalesce=false ignored; missed fires always collapse into one run");
            coalesce = true;
        }
        if (poolSize < 1) {
            LOG.warnf("playlistjobs.scheduler.pool-size=%d is invalid, using 1", poolSize);
            poolSize = 1;
        }
    }

    public boolean enabled() {
        return enabled;
    }

    public int poolSize() {
        return poolSize;
    }

    public Duration misfireGrace() {
        return Duration.ofSeconds(misfireGraceSeconds);
    }

    public boolean coalesce() {
        return coalesce;
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }
}
