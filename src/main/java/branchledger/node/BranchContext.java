package branchledger.node;

import branchledger.engine.TransactionEngine;
import branchledger.ledger.LedgerDatabase;
import branchledger.ledger.LedgerStore;
import branchledger.rpc.PeerChannels;
import branchledger.twopc.BranchAddress;
import branchledger.twopc.Participant;
import branchledger.twopc.TransferCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Everything one branch process owns, built once at start and closed on shutdown. Opening
 * runs restart recovery before the listener accepts anything.
 */
public final class BranchContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BranchContext.class);

    private final BranchConfig config;
    private final LedgerDatabase database;
    private final LedgerStore store;
    private final TransactionEngine engine;
    private final Participant participant;
    private final PeerChannels peers;
    private final ExecutorService twoPcPool;
    private final TransferCoordinator coordinator;
    private final ScheduledExecutorService twoPcTimer;

    private BranchContext(BranchConfig config, LedgerDatabase database, Supplier<BranchAddress> self) {
        this.config = config;
        String name = config.getBranchName();
        this.database = database;
        this.store = new LedgerStore(database);
        this.engine = new TransactionEngine(store);
        this.participant = new Participant(name, store, config.getParticipantDeadlineMs());
        this.peers = new PeerChannels(config.getRpcTimeoutMs());
        AtomicInteger threadNo = new AtomicInteger();
        this.twoPcPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "2pc-" + name + "-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.coordinator = new TransferCoordinator(name, store, engine, participant, peers, self, twoPcPool,
                config.getCoordPrepareTimeoutMs(), config.getDecideMaxAttempts(), config.getDecideBackoffMs());
        this.twoPcTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "2pc-timers-" + name);
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thr, ex) -> log.error("2PC timer thread died on {}", name, ex));
            return t;
        });
    }

    /** Opens the ledger, recovers 2PC state and starts the deadline sweeper. */
    public static BranchContext open(BranchConfig config, Supplier<BranchAddress> self) {
        LedgerDatabase database = config.isPersistDBOnDisk()
                ? LedgerDatabase.open(config.databaseFile(), config.isMmap())
                : LedgerDatabase.inMemory();
        BranchContext ctx;
        try {
            ctx = new BranchContext(config, database, self);
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
        try {
            ctx.start();
        } catch (RuntimeException e) {
            ctx.close();
            throw e;
        }
        return ctx;
    }

    private void start() {
        String name = config.getBranchName();
        if (config.isPreload()) {
            engine.preload(name);
        }
        int aborted = participant.recover(config.getRecoveryPolicy(), coordinator.pendingCommitTxIds());
        int redriven = coordinator.resumePending();
        log.info("[{}] ledger {} opened: {} accounts, log seq {}, {} prepared aborted on restart, {} decisions re-driven",
                name, database.describe(), store.list().size(), database.lastLogSeq(), aborted, redriven);
        long every = Math.max(10L, config.getSweepIntervalMs());
        twoPcTimer.scheduleAtFixedRate(this::sweep, every, every, TimeUnit.MILLISECONDS);
    }

    private void sweep() {
        try {
            List<String> expired = participant.sweepExpired(coordinator.pendingCommitTxIds());
            if (!expired.isEmpty()) {
                log.debug("[{}] sweep aborted {}", config.getBranchName(), expired);
            }
            coordinator.purgeResolved(config.getRetentionMs());
            participant.purgeResolved(config.getRetentionMs(), coordinator.openTxIds());
        } catch (RuntimeException e) {
            // keep the schedule alive; the next tick retries
            log.error("[{}] deadline sweep failed", config.getBranchName(), e);
        }
    }

    public String getBranchName() { return config.getBranchName(); }
    public TransactionEngine getEngine() { return engine; }
    public Participant getParticipant() { return participant; }
    public TransferCoordinator getCoordinator() { return coordinator; }

    @Override
    public void close() {
        twoPcTimer.shutdownNow();
        twoPcPool.shutdownNow();
        try {
            twoPcPool.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        peers.close();
        database.close();
        log.info("[{}] branch context closed", config.getBranchName());
    }
}
