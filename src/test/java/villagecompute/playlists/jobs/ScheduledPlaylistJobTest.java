package villagecompute.playlists.jobs;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Date;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;

import villagecompute.playlists.observability.LoggingConfig;
import villagecompute.playlists.services.JobExecutorService;

/**
 * Unit tests for {@link ScheduledPlaylistJob}.
 */
class ScheduledPlaylistJobTest {

    @Mock
    JobExecutorService executor;

    @Mock
    SchedulerEventListener listener;

    private JobExecutionContext context;

    private final Date fireTime = new Date();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        JobDataMap data = new JobDataMap();
        data.put(ScheduledPlaylistJob.SCHEDULE_ID, 42L);
        context = mock(JobExecutionContext.class);
        when(context.getMergedJobDataMap()).thenReturn(data);
        when(context.getScheduledFireTime()).thenReturn(fireTime);
    }

    @Test
    void testExecute_runsScheduleThroughExecutor() throws Exception {
        when(executor.runIfIdle(42L, LoggingConfig.ORIGIN_SCHEDULER)).thenReturn(true);

        new ScheduledPlaylistJob(executor, listener).execute(context);

        verify(executor).runIfIdle(42L, LoggingConfig.ORIGIN_SCHEDULER);
        verify(context).setResult(true);
        verify(listener, never()).jobSkipped(anyLong(), any());
    }

    @Test
    void testExecute_reportsSkipWhenStillRunning() throws Exception {
        when(executor.runIfIdle(42L, LoggingConfig.ORIGIN_SCHEDULER)).thenReturn(false);

        new ScheduledPlaylistJob(executor, listener).execute(context);

        verify(listener).jobSkipped(42L, fireTime);
        verify(context).setResult(false);
    }

    @Test
    void testExecute_wrapsUnexpectedErrors() {
        when(executor.runIfIdle(anyLong(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThrows(JobExecutionException.class, () -> new ScheduledPlaylistJob(executor, listener).execute(context));
    }
}
