package villagecompute.playlists.jobs;

import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import villagecompute.playlists.observability.LoggingConfig;
import villagecompute.playlists.services.JobExecutorService;

/**
 * Quartz job for one schedule fire. Instances are created per fire by {@link PlaylistJobScheduler}'s job factory.
 *
 * <p>
 * Sets the context result to {@code false} when the fire was skipped because the schedule was still running.
 */
public class ScheduledPlaylistJob implements Job {

    static final String SCHEDULE_ID = "scheduleId";

    private final JobExecutorService executor;
    private final SchedulerEventListener listener;

    public ScheduledPlaylistJob(JobExecutorService executor, SchedulerEventListener listener) {
        this.executor = executor;
        this.listener = listener;
    }

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        long scheduleId = context.getMergedJobDataMap().getLong(SCHEDULE_ID);
        try {
            boolean ran = executor.runIfIdle(scheduleId, LoggingConfig.ORIGIN_SCHEDULER);
            if (!ran) {
                listener.jobSkipped(scheduleId, context.getScheduledFireTime());
            }
            context.setResult(ran);
        } catch (RuntimeException e) {
            throw new JobExecutionException(e, false);
        }
    }
}
