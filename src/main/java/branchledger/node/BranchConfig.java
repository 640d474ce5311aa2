package branchledger.node;

import branchledger.common.Types.RecoveryPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings of one branch process. Production reads JVM system properties
 * ({@code -Dbranch=Mumbai -Dport=50051 ...}); tests use the builder.
 */
public final class BranchConfig {

    static final int MIN_RETENTION_DEADLINES = 4;

    private final String branchName;
    private final String host;
    private final int port;
    private final Path dataDir;
    private final boolean persistDBOnDisk;
    private final boolean mmap;
    private final boolean preload;
    private final long rpcTimeoutMs;
    private final long coordPrepareTimeoutMs;
    private final int decideMaxAttempts;
    private final long decideBackoffMs;
    private final long participantDeadlineMs;
    private final long sweepIntervalMs;
    private final long retentionMs;
    private final RecoveryPolicy recoveryPolicy;

    private BranchConfig(Builder b) {
        if (b.branchName == null || b.branchName.isBlank()) {
            throw new IllegalArgumentException("branch name is required");
        }
        if (b.port < 0 || b.port > 65535) {
            throw new IllegalArgumentException("port out of range: " + b.port);
        }
        if (b.retentionMs < MIN_RETENTION_DEADLINES * b.participantDeadlineMs) {
            throw new IllegalArgumentException("retention of " + b.retentionMs + " ms must be at least "
                    + MIN_RETENTION_DEADLINES + " participant deadlines (" + b.participantDeadlineMs + " ms)");
        }
        this.branchName = b.branchName.trim();
        this.host = b.host;
        this.port = b.port;
        this.dataDir = b.dataDir;
        this.persistDBOnDisk = b.persistDBOnDisk;
        this.mmap = b.mmap;
        this.preload = b.preload;
        this.rpcTimeoutMs = b.rpcTimeoutMs;
        this.coordPrepareTimeoutMs = b.coordPrepareTimeoutMs;
        this.decideMaxAttempts = b.decideMaxAttempts;
        this.decideBackoffMs = b.decideBackoffMs;
        this.participantDeadlineMs = b.participantDeadlineMs;
        this.sweepIntervalMs = b.sweepIntervalMs;
        this.retentionMs = b.retentionMs;
        this.recoveryPolicy = b.recoveryPolicy;
    }

    public static BranchConfig fromSystemProperties() {
        return builder()
                .branchName(System.getProperty("branch", "Mumbai"))
                .host(System.getProperty("host", "localhost"))
                .port(Integer.getInteger("port", 50051))
                .dataDir(Paths.get(System.getProperty("dataDir", "data")))
                .persistDBOnDisk(Boolean.parseBoolean(System.getProperty("persistDBOnDisk", "true")))
                .mmap(Boolean.parseBoolean(System.getProperty("mmap", "true")))
                .preload(Boolean.parseBoolean(System.getProperty("preload", "true")))
                .rpcTimeoutMs(Long.getLong("twoPcRpcTimeoutMs", 1200L))
                .coordPrepareTimeoutMs(Long.getLong("twoPcCoordPrepareTimeoutMs", 2500L))
                .decideMaxAttempts(Integer.getInteger("twoPcDecideMaxAttempts", 8))
                .decideBackoffMs(Long.getLong("twoPcDecideBackoffMs", 100L))
                .participantDeadlineMs(Long.getLong("twoPcParticipantDeadlineMs", 30000L))
                .sweepIntervalMs(Long.getLong("twoPcSweepIntervalMs", 200L))
                .retentionMs(Long.getLong("twoPcRetentionMs", 3_600_000L))
                .recoveryPolicy(RecoveryPolicy.valueOf(
                        System.getProperty("twoPcRecoveryPolicy", "ABORT").trim().toUpperCase()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .branchName(branchName).host(host).port(port).dataDir(dataDir)
                .persistDBOnDisk(persistDBOnDisk).mmap(mmap).preload(preload)
                .rpcTimeoutMs(rpcTimeoutMs)
                .coordPrepareTimeoutMs(coordPrepareTimeoutMs)
                .decideMaxAttempts(decideMaxAttempts).decideBackoffMs(decideBackoffMs)
                .participantDeadlineMs(participantDeadlineMs).sweepIntervalMs(sweepIntervalMs)
                .retentionMs(retentionMs)
                .recoveryPolicy(recoveryPolicy);
    }

    public String getBranchName() { return branchName; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public Path getDataDir() { return dataDir; }
    public boolean isPersistDBOnDisk() { return persistDBOnDisk; }
    public boolean isMmap() { return mmap; }
    public boolean isPreload() { return preload; }
    public long getRpcTimeoutMs() { return rpcTimeoutMs; }
    public long getCoordPrepareTimeoutMs() { return coordPrepareTimeoutMs; }
    public int getDecideMaxAttempts() { return decideMaxAttempts; }
    public long getDecideBackoffMs() { return decideBackoffMs; }
    public long getParticipantDeadlineMs() { return participantDeadlineMs; }
    public long getSweepIntervalMs() { return sweepIntervalMs; }
    /** How long resolved 2PC records are kept to answer replays before they are purged. */
    public long getRetentionMs() { return retentionMs; }
    public RecoveryPolicy getRecoveryPolicy() { return recoveryPolicy; }

    public Path databaseFile() {
        return dataDir.resolve("branch-" + branchName + ".db");
    }

    @Override
    public String toString() {
        return "BranchConfig{" + branchName + " @ " + host + ":" + port
                + (persistDBOnDisk ? " db=" + databaseFile() : " db=<memory>")
                + " prepareTimeout=" + coordPrepareTimeoutMs + "ms deadline=" + participantDeadlineMs
                + "ms recovery=" + recoveryPolicy + "}";
    }

    public static final class Builder {
        private String branchName;
        private String host = "localhost";
        private int port = 0;
        private Path dataDir = Paths.get("data");
        private boolean persistDBOnDisk = false;
        private boolean mmap = false;
        private boolean preload = false;
        private long rpcTimeoutMs = 1200L;
        private long coordPrepareTimeoutMs = 2500L;
        private int decideMaxAttempts = 8;
        private long decideBackoffMs = 100L;
        private long participantDeadlineMs = 30000L;
        private long sweepIntervalMs = 200L;
        private long retentionMs = 3_600_000L;
        private RecoveryPolicy recoveryPolicy = RecoveryPolicy.ABORT;

        private Builder() {}

        public Builder branchName(String v) { this.branchName = v; return this; }
        public Builder host(String v) { this.host = v; return this; }
        public Builder port(int v) { this.port = v; return this; }
        public Builder dataDir(Path v) { this.dataDir = v; return this; }
        public Builder persistDBOnDisk(boolean v) { this.persistDBOnDisk = v; return this; }
        public Builder mmap(boolean v) { this.mmap = v; return this; }
        public Builder preload(boolean v) { this.preload = v; return this; }
        public Builder rpcTimeoutMs(long v) { this.rpcTimeoutMs = v; return this; }
        public Builder coordPrepareTimeoutMs(long v) { this.coordPrepareTimeoutMs = v; return this; }
        public Builder decideMaxAttempts(int v) { this.decideMaxAttempts = v; return this; }
        public Builder decideBackoffMs(long v) { this.decideBackoffMs = v; return this; }
        public Builder participantDeadlineMs(long v) { this.participantDeadlineMs = v; return this; }
        public Builder sweepIntervalMs(long v) { this.sweepIntervalMs = v; return this; }
        public Builder retentionMs(long v) { this.retentionMs = v; return this; }
        public Builder recoveryPolicy(RecoveryPolicy v) { this.recoveryPolicy = v; return this; }

        public BranchConfig build() {
            return new BranchConfig(this);
        }
    }
}
