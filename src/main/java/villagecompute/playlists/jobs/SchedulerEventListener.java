package villagecompute.playlists.jobs;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobListener;
import org.quartz.Trigger;
import org.quartz.TriggerListener;

import java.time.Instant;
import java.util.Date;

/**
 * Logs and counts scheduler events. Never vetoes a fire or alters scheduling state.
 *
 * <p>
 * Events, tagged on {@code playlist.scheduler.events{event}}:
 * <ul>
 * <li>{@code executed} - a fire ran the executor</li>
 * <li>{@code error} - the job threw out of the executor</li>
 * <li>{@code missed} - a fire was dropped past the misfire grace period</li>
 * <li>{@code skipped} - a fire found the previous run of the same schedule still in flight</li>
 * </ul>
 */
@ApplicationScoped
public class SchedulerEventListener implements JobListener, TriggerListener {

    private static final Logger LOG = Logger.getLogger(SchedulerEventListener.class);

    static final String NAME = "playlist-job-events";

    private final MeterRegistry meterRegistry;

    @Inject
    public SchedulerEventListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
        LOG.debugf("Firing %s (scheduled %s)", context.getJobDetail().getKey(), context.getScheduledFireTime());
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
        LOG.debugf("Fire of %s vetoed", context.getJobDetail().getKey());
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        String job = context.getJobDetail().getKey().getName();
        if (jobException != null) {
            LOG.errorf(jobException, "Scheduled job %s raised an error", job);
            count("error");
            return;
        }
        if (Boolean.FALSE.equals(context.getResult())) {
            // already reported through jobSkipped
            return;
        }
        LOG.infof("Scheduled job %s executed in %d ms", job, context.getJobRunTime());
        count("executed");
    }

    @Override
    public void triggerFired(Trigger trigger, JobExecutionContext context) {
    }

    @Override
    public boolean vetoJobExecution(Trigger trigger, JobExecutionContext context) {
        return false;
    }

    @Override
    public void triggerMisfired(Trigger trigger) {
        LOG.warnf("Scheduled job %s missed its fire time, next fire %s", trigger.getJobKey().getName(),
                trigger.getNextFireTime());
        count("missed");
    }

    @Override
    public void triggerComplete(Trigger trigger, JobExecutionContext context,
            Trigger.CompletedExecutionInstruction triggerInstructionCode) {
    }

    /**
     * A fire found its schedule still running and was dropped.
     */
    public void jobSkipped(Long scheduleId, Date scheduledFireTime) {
        LOG.warnf("Schedule %d fire at %s skipped: previous run still in progress", scheduleId, scheduledFireTime);
        count("skipped");
    }

    /**
     * A fire that came due while the process was down, older than the misfire grace period, was dropped at startup.
     */
    public void scheduleMissed(Long scheduleId, Instant nominalFireTime) {
        LOG.warnf("Schedule %d missed its fire at %s (beyond misfire grace), waiting for next fire", scheduleId,
                nominalFireTime);
        count("missed");
    }

    private void count(String event) {
        if (meterRegistry != null) {
            meterRegistry.counter("playlist.scheduler.events", "event", event).increment();
        }
    }
}
