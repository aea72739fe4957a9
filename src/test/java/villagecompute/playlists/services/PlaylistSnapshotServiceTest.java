package villagecompute.playlists.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import villagecompute.playlists.data.models.PlaylistPair;
import villagecompute.playlists.data.models.PlaylistSnapshot;
import villagecompute.playlists.data.models.Schedule;
import villagecompute.playlists.data.models.SnapshotType;
import villagecompute.playlists.data.models.UserSettings;

/**
 * Persistence tests for pre-run snapshots and pair lookup.
 */
@QuarkusTest
class PlaylistSnapshotServiceTest {

    private static long nextUserId = 5000;

    @Inject
    PlaylistSnapshotService snapshotService;

    @Inject
    PlaylistPairService pairService;

    private Schedule schedule;

    @BeforeEach
    void setUp() {
        schedule = new Schedule();
        schedule.id = 1L;
        schedule.userId = nextUserId++;
        schedule.targetPlaylistId = "target";
        schedule.targetPlaylistName = "Morning Mix";
    }

    private List<PlaylistSnapshot> snapshots() {
        return QuarkusTransaction.requiringNew()
                .call(() -> PlaylistSnapshot.findByPlaylist(schedule.userId, "target"));
    }

    private void saveSettings(boolean autoSnapshot, int maxSnapshots) {
        QuarkusTransaction.requiringNew().run(() -> {
            UserSettings settings = new UserSettings();
            settings.userId = schedule.userId;
            settings.autoSnapshotEnabled = autoSnapshot;
            settings.maxSnapshotsPerPlaylist = maxSnapshots;
            settings.updatedAt = Instant.now();
            settings.persist();
        });
    }

    @Test
    void testAutoSnapshot_enabledByDefault() {
        assertTrue(snapshotService.autoSnapshot(schedule, List.of("u1", "u2"), SnapshotType.AUTO_PRE_RAID,
                "Before scheduled raid"));

        List<PlaylistSnapshot> snapshots = snapshots();
        assertEquals(1, snapshots.size());
        assertEquals(List.of("u1", "u2"), snapshots.get(0).trackUris);
        assertEquals(2, snapshots.get(0).trackCount);
        assertEquals(SnapshotType.AUTO_PRE_RAID, snapshots.get(0).snapshotType);
        assertEquals("Morning Mix", snapshots.get(0).playlistName);
    }

    @Test
    void testAutoSnapshot_emptyPlaylistIsSkipped() {
        assertFalse(snapshotService.autoSnapshot(schedule, List.of(), SnapshotType.AUTO_PRE_RAID, "Before raid"));
        assertTrue(snapshots().isEmpty());
    }

    @Test
    void testAutoSnapshot_respectsUserSetting() {
        saveSettings(false, 10);

        assertFalse(snapshotService.autoSnapshot(schedule, List.of("u1"), SnapshotType.SCHEDULED_PRE_EXECUTION,
                "Before scheduled BasicShuffle"));
        assertTrue(snapshots().isEmpty());
    }

    @Test
    void testCreateSnapshot_prunesPastLimit() {
        saveSettings(true, 2);

        for (int i = 1; i <= 4; i++) {
            snapshotService.autoSnapshot(schedule, List.of("u" + i), SnapshotType.AUTO_PRE_ROTATE, "run " + i);
        }

        List<PlaylistSnapshot> snapshots = snapshots();
        assertEquals(2, snapshots.size());
        assertEquals("run 4", snapshots.get(0).triggerDescription);
        assertEquals("run 3", snapshots.get(1).triggerDescription);
    }

    @Test
    void testFindPairForPlaylist() {
        QuarkusTransaction.requiringNew().run(() -> {
            PlaylistPair pair = new PlaylistPair();
            pair.userId = schedule.userId;
            pair.productionPlaylistId = "target";
            pair.archivePlaylistId = "archive";
            pair.createdAt = Instant.now();
            pair.persist();
        });

        assertEquals("archive",
                pairService.findPairForPlaylist(schedule.userId, "target").orElseThrow().archivePlaylistId);
        assertTrue(pairService.findPairForPlaylist(schedule.userId, "other").isEmpty());
        assertTrue(pairService.findPairForPlaylist(schedule.userId + 1, "target").isEmpty());
    }
}
