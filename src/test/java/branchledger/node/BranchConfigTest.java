package branchledger.node;

import branchledger.common.Types.RecoveryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class BranchConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("branch");
        System.clearProperty("port");
        System.clearProperty("twoPcRecoveryPolicy");
        System.clearProperty("twoPcCoordPrepareTimeoutMs");
    }

    @Test
    void defaultsFromSystemProperties() {
        BranchConfig cfg = BranchConfig.fromSystemProperties();
        assertEquals("Mumbai", cfg.getBranchName());
        assertEquals(50051, cfg.getPort());
        assertEquals(1200L, cfg.getRpcTimeoutMs());
        assertEquals(2500L, cfg.getCoordPrepareTimeoutMs());
        assertEquals(8, cfg.getDecideMaxAttempts());
        assertEquals(100L, cfg.getDecideBackoffMs());
        assertEquals(30000L, cfg.getParticipantDeadlineMs());
        assertEquals(200L, cfg.getSweepIntervalMs());
        assertEquals(3_600_000L, cfg.getRetentionMs());
        assertEquals(RecoveryPolicy.ABORT, cfg.getRecoveryPolicy());
        assertTrue(cfg.isPersistDBOnDisk());
        assertEquals(Paths.get("data", "branch-Mumbai.db"), cfg.databaseFile());
    }

    @Test
    void overridesFromSystemProperties() {
        System.setProperty("branch", "Delhi");
        System.setProperty("port", "50099");
        System.setProperty("twoPcRecoveryPolicy", "resume");
        System.setProperty("twoPcCoordPrepareTimeoutMs", "900");
        BranchConfig cfg = BranchConfig.fromSystemProperties();
        assertEquals("Delhi", cfg.getBranchName());
        assertEquals(50099, cfg.getPort());
        assertEquals(RecoveryPolicy.RESUME, cfg.getRecoveryPolicy());
        assertEquals(900L, cfg.getCoordPrepareTimeoutMs());
    }

    @Test
    void builderValidates() {
        assertThrows(IllegalArgumentException.class, () -> BranchConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> BranchConfig.builder().branchName("x").port(70000).build());
        BranchConfig cfg = BranchConfig.builder().branchName("x").build();
        assertEquals(cfg.getBranchName(), cfg.toBuilder().port(5).build().getBranchName());
    }

    @Test
    void retentionMustSpanSeveralParticipantDeadlines() {
        BranchConfig.Builder b = BranchConfig.builder().branchName("x").participantDeadlineMs(30_000L);
        assertThrows(IllegalArgumentException.class, () -> b.retentionMs(60_000L).build());
        assertEquals(120_000L, b.retentionMs(120_000L).build().getRetentionMs());
    }
}
