package villagecompute.playlists.jobs;

import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.integration.spotify.PlaylistApi;

/**
 * Contract for playlist job handlers.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped}. The
 * {@link villagecompute.playlists.services.JobExecutorService} routes each run to the handler for the schedule's
 * {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers run on scheduler worker threads, or on the caller's thread for run-now requests</li>
 * <li>All remote calls within one run are sequential</li>
 * <li>Handlers hold no database transaction; persistence goes through transactional services</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> {@link #execute} may be called concurrently for different schedules and must keep no per-run
 * state in fields.
 */
public interface PlaylistJobHandler {

    /**
     * Returns the job type this handler processes.
     */
    JobType handlesType();

    /**
     * Runs the job against the schedule's target playlist.
     *
     * @param schedule
     *            detached schedule row; handlers must not modify it
     * @param api
     *            client authenticated as the schedule's owner
     * @return tracks added and the target's resulting size
     * @throws villagecompute.playlists.exceptions.JobExecutionException
     *             when the run fails with a user-facing reason
     */
    JobResult execute(Schedule schedule, PlaylistApi api);
}
