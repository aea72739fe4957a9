package villagecompute.playlists.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.StdSchedulerFactory;
import org.quartz.impl.matchers.GroupMatcher;
import villagecompute.playlists.config.SchedulerConfig;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.services.JobExecutorService;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the process's trigger registry: one Quartz job per enabled schedule, keyed {@code schedule_<id>}.
 *
 * <p>
 * <b>Lifecycle:</b> Stopped → Running → Stopped. The scheduler starts on {@link StartupEvent} when
 * {@code playlistjobs.scheduler.enabled} is true, loads every enabled schedule and registers it. {@link #start()} is
 * guarded; a second call while running is a logged no-op.
 *
 * <p>
 * <b>Registration:</b> {@link #addSchedule(Schedule)} replaces any existing job for the schedule, so callers may call
 * it on every create and update. {@link #removeSchedule(Long)} of an unknown id is a no-op. Scheduler errors are logged
 * and reported as {@code false}, never thrown.
 *
 * <p>
 * <b>Fire policy:</b>
 * <ul>
 * <li>Runs execute on a fixed worker pool ({@code pool-size})</li>
 * <li>A fire that finds its schedule still running is skipped, not queued</li>
 * <li>Fires late by more than the misfire grace are dropped; cron triggers wait for their next time, interval
 * triggers continue from now</li>
 * <li>At startup, interval schedules keep their cadence from the last run (or creation), not from the restart</li>
 * <li>Fires missed while the process was down collapse into at most one catch-up run, scheduled at startup when the
 * latest missed fire is within the grace period</li>
 * </ul>
 */
@ApplicationScoped
public class PlaylistJobScheduler {

    private static final Logger LOG = Logger.getLogger(PlaylistJobScheduler.class);

    static final String GROUP = "playlist-schedules";

    @Inject
    SchedulerConfig config;

    @Inject
    JobExecutorService executor;

    @Inject
    SchedulerEventListener listener;

    private final AtomicBoolean started = new AtomicBoolean(false);

    volatile Scheduler scheduler;

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.info("Playlist job scheduler disabled by configuration");
            return;
        }
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Starts the scheduler and registers every enabled schedule. Failures are logged; the process keeps running
     * without background jobs.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("Playlist job scheduler already started, ignoring start request");
            return;
        }
        try {
            startScheduler();
            List<Schedule> enabled = QuarkusTransaction.requiringNew().call(Schedule::findEnabled);
            bootstrap(enabled, Instant.now());
        } catch (SchedulerException | RuntimeException e) {
            LOG.errorf(e, "Failed to start playlist job scheduler");
        }
    }

    void startScheduler() throws SchedulerException {
        Properties props = new Properties();
        props.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, "playlist-jobs-" + UUID.randomUUID());
        props.setProperty(StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
        props.setProperty("org.quartz.threadPool.threadCount", String.valueOf(config.poolSize()));
        props.setProperty("org.quartz.threadPool.threadNamePrefix", "playlist-job-worker");
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
        props.setProperty("org.quartz.jobStore.misfireThreshold", String.valueOf(config.misfireGrace().toMillis()));

        Scheduler created = new StdSchedulerFactory(props).getScheduler();
        created.setJobFactory((bundle, owner) -> new ScheduledPlaylistJob(executor, listener));
        created.getListenerManager().addJobListener(listener, GroupMatcher.jobGroupEquals(GROUP));
        created.getListenerManager().addTriggerListener(listener, GroupMatcher.triggerGroupEquals(GROUP));
        created.start();
        scheduler = created;

        LOG.infof("Playlist job scheduler started (pool size %d, misfire grace %s, zone %s)", config.poolSize(),
                config.misfireGrace(), config.zone());
    }

    /**
     * Registers {@code schedules} and schedules one catch-up run for each whose latest missed fire is within the
     * misfire grace period.
     */
    void bootstrap(List<Schedule> schedules, Instant now) {
        Duration grace = config.misfireGrace();
        int registered = 0;
        int catchUps = 0;
        int missed = 0;

        for (Schedule schedule : schedules) {
            try {
                Instant anchor = schedule.lastRunAt != null ? schedule.lastRunAt : schedule.createdAt;
                if (!register(schedule, anchor, now)) {
                    continue;
                }
                registered++;
                if (schedule.lastRunAt == null) {
                    continue;
                }
                TriggerSpec spec = TriggerTranslator.translate(schedule.scheduleType, schedule.scheduleValue);
                Instant due = latestDueFire(spec, schedule.lastRunAt, now, grace, config.zone());
                if (due == null) {
                    continue;
                }
                if (!due.isBefore(now.minus(grace))) {
                    scheduleCatchUp(schedule.id);
                    catchUps++;
                } else {
                    listener.scheduleMissed(schedule.id, due);
                    missed++;
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to bootstrap schedule %d", schedule.id);
            }
        }

        LOG.infof("Scheduler bootstrap: %d schedules registered, %d catch-up runs, %d missed beyond grace",
                registered, catchUps, missed);
    }

    /**
     * Registers or re-registers a schedule. A disabled schedule is removed instead. Interval schedules first fire one
     * interval from now.
     *
     * @return true if a job for the schedule is now registered
     */
    public boolean addSchedule(Schedule schedule) {
        return register(schedule, null, Instant.now());
    }

    /**
     * @param anchor
     *            instant interval fires are counted from; the first fire is the first {@code anchor + k * interval}
     *            after {@code now}. Null anchors on {@code now}.
     */
    synchronized boolean register(Schedule schedule, Instant anchor, Instant now) {
        if (scheduler == null) {
            LOG.debugf("Scheduler not running, schedule %d not registered", schedule.id);
            return false;
        }
        if (!schedule.enabled) {
            removeSchedule(schedule.id);
            return false;
        }

        TriggerSpec spec = TriggerTranslator.translate(schedule.scheduleType, schedule.scheduleValue);
        JobKey key = jobKey(schedule.id);
        try {
            if (scheduler.checkExists(key)) {
                scheduler.deleteJob(key);
            }
            JobDetail job = JobBuilder.newJob(ScheduledPlaylistJob.class).withIdentity(key)
                    .usingJobData(ScheduledPlaylistJob.SCHEDULE_ID, schedule.id).build();
            Date firstFire = scheduler.scheduleJob(job, buildTrigger(schedule.id, spec, anchor, now));
            LOG.infof("Registered schedule %d (%s) with %s, first fire %s", schedule.id, schedule.jobType,
                    spec.describe(), firstFire);
            return true;
        } catch (SchedulerException | RuntimeException e) {
            LOG.errorf(e, "Failed to register schedule %d", schedule.id);
            return false;
        }
    }

    /**
     * Removes a schedule's job and triggers.
     *
     * @return true if a job was removed
     */
    public synchronized boolean removeSchedule(Long scheduleId) {
        if (scheduler == null) {
            return false;
        }
        try {
            boolean removed = scheduler.deleteJob(jobKey(scheduleId));
            if (removed) {
                LOG.infof("Removed schedule %d from scheduler", scheduleId);
            }
            return removed;
        } catch (SchedulerException e) {
            LOG.errorf(e, "Failed to remove schedule %d", scheduleId);
            return false;
        }
    }

    /**
     * Registers or removes a schedule according to its enabled flag.
     */
    public boolean toggle(Schedule schedule) {
        if (schedule.enabled) {
            return addSchedule(schedule);
        }
        removeSchedule(schedule.id);
        return false;
    }

    public boolean isRegistered(Long scheduleId) {
        if (scheduler == null) {
            return false;
        }
        try {
            return scheduler.checkExists(jobKey(scheduleId));
        } catch (SchedulerException e) {
            LOG.warnf(e, "Failed to look up schedule %d", scheduleId);
            return false;
        }
    }

    /**
     * Earliest upcoming fire of any trigger for the schedule, including a pending catch-up.
     */
    public Optional<Instant> getNextFireTime(Long scheduleId) {
        if (scheduler == null) {
            return Optional.empty();
        }
        try {
            return scheduler.getTriggersOfJob(jobKey(scheduleId)).stream().map(Trigger::getNextFireTime)
                    .filter(next -> next != null).map(Date::toInstant).min(Instant::compareTo);
        } catch (SchedulerException e) {
            LOG.warnf(e, "Failed to read next fire time for schedule %d", scheduleId);
            return Optional.empty();
        }
    }

    public boolean isRunning() {
        return scheduler != null;
    }

    /**
     * Shuts the scheduler down without waiting for in-flight runs. The scheduler can be started again afterwards.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        try {
            scheduler.shutdown(false);
            LOG.info("Playlist job scheduler stopped");
        } catch (SchedulerException e) {
            LOG.errorf(e, "Failed to stop playlist job scheduler");
        } finally {
            scheduler = null;
            started.set(false);
        }
    }

    private void scheduleCatchUp(Long scheduleId) {
        Trigger catchUp = TriggerBuilder.newTrigger().withIdentity(catchUpTriggerKey(scheduleId))
                .forJob(jobKey(scheduleId)).startNow()
                .withSchedule(SimpleScheduleBuilder.simpleSchedule().withMisfireHandlingInstructionFireNow()).build();
        try {
            scheduler.scheduleJob(catchUp);
            LOG.infof("Scheduled catch-up run for schedule %d", scheduleId);
        } catch (SchedulerException e) {
            LOG.errorf(e, "Failed to schedule catch-up run for schedule %d", scheduleId);
        }
    }

    private Trigger buildTrigger(Long scheduleId, TriggerSpec spec, Instant anchor, Instant now) {
        TriggerBuilder<Trigger> builder = TriggerBuilder.newTrigger().withIdentity(triggerKey(scheduleId));
        if (spec.getKind() == TriggerSpec.Kind.INTERVAL) {
            Duration interval = spec.getInterval();
            return builder.startAt(Date.from(nextIntervalFire(interval, anchor, now)))
                    .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                            .withIntervalInMilliseconds(interval.toMillis()).repeatForever()
                            .withMisfireHandlingInstructionNextWithRemainingCount())
                    .build();
        }
        return builder.startAt(Date.from(now))
                .withSchedule(CronScheduleBuilder.cronSchedule(spec.toQuartzCronExpression())
                        .inTimeZone(TimeZone.getTimeZone(config.zone())).withMisfireHandlingInstructionDoNothing())
                .build();
    }

    /**
     * First {@code anchor + k * interval} strictly after {@code now}, k &ge; 1.
     */
    static Instant nextIntervalFire(Duration interval, Instant anchor, Instant now) {
        if (anchor == null || anchor.isAfter(now)) {
            return now.plus(interval);
        }
        long intervalMillis = interval.toMillis();
        long periods = Duration.between(anchor, now).toMillis() / intervalMillis + 1;
        return anchor.plusMillis(periods * intervalMillis);
    }

    /**
     * Most recent nominal fire in {@code (lastRunAt, now]}, or null if none came due. Interval fires are anchored on
     * {@code lastRunAt}. For cron triggers, a due fire older than the grace window is returned as the first one after
     * {@code lastRunAt}; only its age matters to the caller.
     */
    static Instant latestDueFire(TriggerSpec spec, Instant lastRunAt, Instant now, Duration grace, ZoneId zone) {
        if (spec.getKind() == TriggerSpec.Kind.INTERVAL) {
            long intervalMillis = spec.getInterval().toMillis();
            long elapsed = Duration.between(lastRunAt, now).toMillis();
            if (elapsed < intervalMillis) {
                return null;
            }
            return lastRunAt.plusMillis((elapsed / intervalMillis) * intervalMillis);
        }

        Instant first = spec.nextFireAfter(lastRunAt, zone);
        if (first == null || first.isAfter(now)) {
            return null;
        }
        Instant windowStart = now.minus(grace).minusMillis(1);
        Instant cursor = windowStart.isAfter(lastRunAt) ? windowStart : lastRunAt;
        Instant latest = null;
        Instant next = spec.nextFireAfter(cursor, zone);
        while (next != null && !next.isAfter(now)) {
            latest = next;
            next = spec.nextFireAfter(next, zone);
        }
        return latest != null ? latest : first;
    }

    static JobKey jobKey(Long scheduleId) {
        return JobKey.jobKey("schedule_" + scheduleId, GROUP);
    }

    static TriggerKey triggerKey(Long scheduleId) {
        return TriggerKey.triggerKey("schedule_" + scheduleId, GROUP);
    }

    static TriggerKey catchUpTriggerKey(Long scheduleId) {
        return TriggerKey.triggerKey("schedule_" + scheduleId + "_catchup", GROUP);
    }
}
