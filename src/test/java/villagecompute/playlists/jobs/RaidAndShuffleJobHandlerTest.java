package villagecompute.playlists.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.playlists.api.types.JobResult;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.exceptions.JobExecutionException;
import villagecompute.playlists.integration.spotify.PlaylistApi;

/**
 * Unit tests for {@link RaidAndShuffleJobHandler}.
 */
class RaidAndShuffleJobHandlerTest {

    @Mock
    RaidJobHandler raidHandler;

    @Mock
    ShuffleJobHandler shuffleHandler;

    @Mock
    PlaylistApi api;

    @InjectMocks
    RaidAndShuffleJobHandler handler;

    private Schedule schedule;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        schedule = new Schedule();
        schedule.id = 4L;
        schedule.jobType = JobType.RAID_AND_SHUFFLE;
    }

    @Test
    void testExecute_reportsRaidAddedAndShuffleTotal() {
        when(raidHandler.execute(schedule, api)).thenReturn(new JobResult(3, 10));
        when(shuffleHandler.execute(schedule, api)).thenReturn(new JobResult(0, 9));

        assertEquals(new JobResult(3, 9), handler.execute(schedule, api));
    }

    @Test
    void testExecute_raidFailureSkipsShuffle() {
        when(raidHandler.execute(schedule, api)).thenThrow(new JobExecutionException("raid failed"));

        assertThrows(JobExecutionException.class, () -> handler.execute(schedule, api));
        verify(shuffleHandler, never()).execute(schedule, api);
    }

    @Test
    void testExecute_shuffleFailureFailsRun() {
        when(raidHandler.execute(schedule, api)).thenReturn(new JobResult(1, 2));
        when(shuffleHandler.execute(schedule, api)).thenThrow(new JobExecutionException("shuffle failed"));

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> handler.execute(schedule, api));
        assertEquals("shuffle failed", e.getMessage());
    }
}
