package branchledger.twopc;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types;
import branchledger.common.Types.CoordinatorPhase;
import branchledger.common.Types.Side;
import branchledger.engine.TransactionEngine;
import branchledger.ledger.LedgerStore;
import branchledger.twopc.CoordinatorRecord.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Drives an inter-branch transfer: debit prepare here, credit prepare on the destination,
 * one durable decision, then commit/abort delivered to both sides with retries.
 * Never touches a ledger row itself.
 */
public class TransferCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransferCoordinator.class);

    private final String branchName;
    private final LedgerStore store;
    private final TransactionEngine engine;
    private final TwoPcParticipant local;
    private final ParticipantDirectory directory;
    private final Supplier<BranchAddress> self;
    private final ExecutorService executor;
    private final long prepareTimeoutMs;
    private final int decideMaxAttempts;
    private final long decideBackoffMs;
    private final LongSupplier clock;

    private final ConcurrentMap<String, CoordinatorRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> resolvedAt = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public TransferCoordinator(String branchName,
                               LedgerStore store,
                               TransactionEngine engine,
                               TwoPcParticipant local,
                               ParticipantDirectory directory,
                               Supplier<BranchAddress> self,
                               ExecutorService executor,
                               long prepareTimeoutMs,
                               int decideMaxAttempts,
                               long decideBackoffMs) {
        this(branchName, store, engine, local, directory, self, executor, prepareTimeoutMs, decideMaxAttempts,
                decideBackoffMs, System::currentTimeMillis);
    }

    public TransferCoordinator(String branchName,
                               LedgerStore store,
                               TransactionEngine engine,
                               TwoPcParticipant local,
                               ParticipantDirectory directory,
                               Supplier<BranchAddress> self,
                               ExecutorService executor,
                               long prepareTimeoutMs,
                               int decideMaxAttempts,
                               long decideBackoffMs,
                               LongSupplier clock) {
        this.branchName = branchName;
        this.store = store;
        this.engine = engine;
        this.local = local;
        this.directory = directory;
        this.self = self;
        this.executor = executor;
        this.prepareTimeoutMs = prepareTimeoutMs;
        this.decideMaxAttempts = Math.max(1, decideMaxAttempts);
        this.decideBackoffMs = decideBackoffMs;
        this.clock = clock;
        long loadedAt = clock.getAsLong();
        for (Map.Entry<String, String> e : store.getDatabase().coordinatorRecords().entrySet()) {
            CoordinatorRecord rec = CoordinatorRecord.decode(e.getKey(), e.getValue());
            records.put(e.getKey(), rec);
            if (rec.getPhase().isFinal()) {
                resolvedAt.put(e.getKey(), loadedAt);
            }
        }
    }

    public TransferResult transfer(TransferRequest request) {
        if (request.getDestination() == null) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "destination branch is required");
        }
        Types.requireAccountNo(request.getSrcAccount());
        Types.requireAccountNo(request.getDstAccount());
        Types.requirePositiveAmount(request.getAmount());
        String txId = request.getTxId() == null || request.getTxId().isEmpty()
                ? Types.newTxId(branchName)
                : Types.requireValidTxId(request.getTxId());
        TransferRequest req = request.withTxId(txId);

        if (req.getDestination().isSameEndpoint(self.get())) {
            return transferWithinBranch(req);
        }

        if (!inFlight.add(txId)) {
            throw new BranchException(ErrorKind.TX_CONFLICT, "transaction " + txId + " is already in progress");
        }
        try {
            CoordinatorRecord existing = records.get(txId);
            if (existing != null) {
                return replay(existing, req);
            }
            log.debug("[{}] 2PC BEGIN {}", branchName, req);
            CoordinatorRecord rec = CoordinatorRecord.preparing(req);
            persist(rec);
            return finish(prepareBoth(rec));
        } finally {
            inFlight.remove(txId);
        }
    }

    private TransferResult transferWithinBranch(TransferRequest req) {
        if (req.getSrcAccount() == req.getDstAccount()) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "source and destination are the same account");
        }
        log.debug("[{}] destination {} is this branch; running {} as a local transfer",
                branchName, req.getDestination(), req.getTxId());
        try {
            engine.transferLocal(req.getSrcAccount(), req.getDstAccount(), req.getAmount());
            return TransferResult.committed(req.getTxId());
        } catch (BranchException e) {
            if (e.getKind() == ErrorKind.INVALID_ARGUMENT) {
                throw e;
            }
            return TransferResult.aborted(req.getTxId(), e.getKind() + ": " + e.getMessage());
        }
    }

    private TransferResult replay(CoordinatorRecord existing, TransferRequest req) {
        if (!existing.matches(req)) {
            throw new BranchException(ErrorKind.TX_CONFLICT,
                    "transaction " + req.getTxId() + " already exists with different parameters");
        }
        if (existing.getPhase().isFinal() || existing.getPhase() == CoordinatorPhase.UNRESOLVED) {
            return existing.toResult();
        }
        throw new BranchException(ErrorKind.TX_CONFLICT,
                "transaction " + req.getTxId() + " is being recovered (" + existing.getPhase() + ")");
    }

    /** Phase one. Returns the record with its durable decision. */
    private CoordinatorRecord prepareBoth(CoordinatorRecord rec) {
        String txId = rec.getTxId();
        TwoPcParticipant remote = directory.participantAt(rec.getDestination());

        CompletableFuture<Vote> localVote = CompletableFuture.supplyAsync(
                () -> safePrepare(local, txId, rec.getSrcAccount(), rec.getAmount(), Side.DEBIT), executor);
        CompletableFuture<Vote> remoteVote = CompletableFuture.supplyAsync(
                () -> safePrepare(remote, txId, rec.getDstAccount(), rec.getAmount(), Side.CREDIT), executor);

        CompletableFuture<Void> firstRefusal = new CompletableFuture<>();
        localVote.thenAccept(v -> { if (!v.isPrepared()) firstRefusal.complete(null); });
        remoteVote.thenAccept(v -> { if (!v.isPrepared()) firstRefusal.complete(null); });

        String timeoutReason = null;
        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(localVote, remoteVote), firstRefusal)
                    .get(prepareTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            timeoutReason = "prepare timed out after " + prepareTimeoutMs + " ms";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timeoutReason = "coordinator interrupted during prepare";
        } catch (ExecutionException e) {
            timeoutReason = "prepare failed: " + e.getCause();
        }

        Vote lv = localVote.getNow(null);
        Vote rv = remoteVote.getNow(null);
        log.debug("[{}] 2PC VOTES {} local={} remote={}", branchName, txId, lv, rv);

        boolean commit = lv != null && rv != null && lv.isPrepared() && rv.isPrepared();
        CoordinatorRecord decided;
        if (commit) {
            decided = rec.decided(Decision.COMMIT, true, "");
        } else {
            String reason;
            if (lv != null && !lv.isPrepared()) {
                reason = "source not prepared: " + lv.getReasonKind() + " " + lv.getReason();
            } else if (rv != null && !rv.isPrepared()) {
                reason = "destination not prepared: " + rv.getReasonKind() + " " + rv.getReason();
            } else {
                reason = timeoutReason != null ? timeoutReason : "prepare did not complete";
            }
            // an unanswered remote prepare may still land, so it is treated as prepared
            boolean remoteMaybePrepared = rv == null || rv.isPrepared();
            decided = rec.decided(Decision.ABORT, remoteMaybePrepared, reason);
        }
        persist(decided);
        log.debug("[{}] 2PC DECIDE {} {}", branchName, txId, decided.getDecision());
        return decided;
    }

    /** Phase two for a record that already carries its decision. */
    private TransferResult finish(CoordinatorRecord decided) {
        String txId = decided.getTxId();
        boolean commit = decided.getDecision() == Decision.COMMIT;
        TwoPcParticipant remote = directory.participantAt(decided.getDestination());

        CompletableFuture<Delivery> toLocal = CompletableFuture.supplyAsync(
                () -> deliver(local, txId, commit), executor);
        CompletableFuture<Delivery> toRemote;
        if (commit || decided.isRemotePrepared()) {
            toRemote = CompletableFuture.supplyAsync(() -> deliver(remote, txId, commit), executor);
        } else {
            // the destination never reserved anything; its deadline covers a lost abort
            executor.execute(() -> {
                Delivery d = deliver(remote, txId, false);
                if (!d.ok) {
                    log.warn("[{}] best-effort abort of {} to {} failed: {}",
                            branchName, txId, remote.describe(), d.failure);
                }
            });
            toRemote = CompletableFuture.completedFuture(Delivery.OK);
        }

        Delivery l = toLocal.join();
        Delivery r = toRemote.join();
        if (l.ok && r.ok) {
            CoordinatorRecord done = decided.inPhase(commit ? CoordinatorPhase.COMMITTED : CoordinatorPhase.ABORTED, null);
            persist(done);
            log.debug("[{}] 2PC END {} {}", branchName, txId, done.getPhase());
            return done.toResult();
        }
        StringBuilder why = new StringBuilder(commit ? "commit" : "abort").append(" not acknowledged by");
        if (!l.ok) why.append(" local (").append(l.failure).append(")");
        if (!r.ok) why.append(" ").append(remote.describe()).append(" (").append(r.failure).append(")");
        CoordinatorRecord stuck = decided.inPhase(CoordinatorPhase.UNRESOLVED, why.toString());
        persist(stuck);
        log.warn("[{}] 2PC UNRESOLVED {}: {}", branchName, txId, stuck.getReason());
        return stuck.toResult();
    }

    private Vote safePrepare(TwoPcParticipant p, String txId, long accountNo, long amount, Side side) {
        try {
            return p.prepare(txId, accountNo, amount, side);
        } catch (BranchException e) {
            return Vote.no(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[{}] prepare {} on {} failed", branchName, txId, p.describe(), e);
            return Vote.no(ErrorKind.INTERNAL, e.toString());
        }
    }

    /**
     * Sends the decision until acknowledged. Transport failures are retried with
     * {@code base * min(attempt, 10)} backoff clamped to [10, 1000] ms; a refusal is final.
     */
    private Delivery deliver(TwoPcParticipant p, String txId, boolean commit) {
        String lastFailure = "no attempt made";
        for (int attempt = 1; attempt <= decideMaxAttempts; attempt++) {
            try {
                boolean ok = commit ? p.commit(txId) : p.abort(txId);
                if (ok) {
                    return Delivery.OK;
                }
                lastFailure = "participant answered false";
            } catch (BranchException e) {
                if (!e.getKind().isTransport() && e.getKind() != ErrorKind.STORAGE_FAILURE) {
                    return Delivery.failed(e.getKind() + ": " + e.getMessage());
                }
                lastFailure = e.getKind() + ": " + e.getMessage();
            } catch (RuntimeException e) {
                lastFailure = e.toString();
            }
            log.debug("[{}] 2PC {} {} to {} attempt={} failed: {}",
                    branchName, commit ? "COMMIT" : "ABORT", txId, p.describe(), attempt, lastFailure);
            if (attempt < decideMaxAttempts && decideBackoffMs > 0L) {
                long sleepMs = decideBackoffMs * (long) Math.min(attempt, 10);
                sleepMs = Math.max(10L, Math.min(sleepMs, 1000L));
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Delivery.failed("interrupted after " + attempt + " attempts: " + lastFailure);
                }
            }
        }
        return Delivery.failed("gave up after " + decideMaxAttempts + " attempts: " + lastFailure);
    }

    /** Tx ids whose logged decision is commit and not yet fully delivered. */
    public Set<String> pendingCommitTxIds() {
        Set<String> out = new HashSet<>();
        for (CoordinatorRecord r : records.values()) {
            if (r.getDecision() == Decision.COMMIT && !r.getPhase().isFinal()) {
                out.add(r.getTxId());
            }
        }
        return out;
    }

    /**
     * Startup: PREPARING records never logged a decision and become aborts; every
     * COMMITTING/ABORTING record is re-driven in the background. UNRESOLVED ones wait for
     * {@link #reconcile(String)}.
     */
    public int resumePending() {
        int count = 0;
        for (CoordinatorRecord r : new ArrayList<>(records.values())) {
            CoordinatorRecord toDrive;
            switch (r.getPhase()) {
                case PREPARING:
                    toDrive = r.decided(Decision.ABORT, true, "coordinator restarted before a decision");
                    persist(toDrive);
                    break;
                case COMMITTING:
                case ABORTING:
                    toDrive = r;
                    break;
                default:
                    continue;
            }
            if (!inFlight.add(toDrive.getTxId())) {
                continue;
            }
            count++;
            log.info("[{}] re-driving {} ({})", branchName, toDrive.getTxId(), toDrive.getDecision());
            final CoordinatorRecord rec = toDrive;
            executor.execute(() -> {
                try {
                    finish(rec);
                } catch (RuntimeException e) {
                    log.error("[{}] re-drive of {} failed", branchName, rec.getTxId(), e);
                } finally {
                    inFlight.remove(rec.getTxId());
                }
            });
        }
        return count;
    }

    /** Tx ids of every record not yet COMMITTED or ABORTED, whatever its decision. */
    public Set<String> openTxIds() {
        Set<String> out = new HashSet<>();
        for (CoordinatorRecord r : records.values()) {
            if (!r.getPhase().isFinal()) {
                out.add(r.getTxId());
            }
        }
        return out;
    }

    /**
     * Forgets COMMITTED and ABORTED records resolved at least {@code retentionMs} ago. A replay
     * of a purged tx id is treated as a new transfer.
     */
    public int purgeResolved(long retentionMs) {
        long cutoff = clock.getAsLong() - retentionMs;
        int purged = 0;
        for (Map.Entry<String, Long> e : resolvedAt.entrySet()) {
            String txId = e.getKey();
            if (e.getValue() > cutoff || !inFlight.add(txId)) {
                continue;
            }
            try {
                CoordinatorRecord rec = records.get(txId);
                if (rec != null && rec.getPhase().isFinal()) {
                    store.write(b -> b.removeCoordinator(txId));
                    records.remove(txId);
                    purged++;
                }
                resolvedAt.remove(txId);
            } finally {
                inFlight.remove(txId);
            }
        }
        if (purged > 0) {
            log.debug("[{}] purged {} resolved coordinator records", branchName, purged);
        }
        return purged;
    }

    public List<CoordinatorRecord> listUnresolved() {
        List<CoordinatorRecord> out = new ArrayList<>();
        for (CoordinatorRecord r : records.values()) {
            if (r.getPhase() == CoordinatorPhase.UNRESOLVED) out.add(r);
        }
        out.sort(Comparator.comparing(CoordinatorRecord::getTxId));
        return out;
    }

    /** Re-delivers the logged decision of an UNRESOLVED (or stalled) transaction. */
    public TransferResult reconcile(String rawTxId) {
        String txId = Types.requireValidTxId(rawTxId);
        CoordinatorRecord rec = records.get(txId);
        if (rec == null) {
            throw new BranchException(ErrorKind.NOT_FOUND, "no coordinator record for " + txId);
        }
        if (rec.getPhase().isFinal()) {
            return rec.toResult();
        }
        if (!inFlight.add(txId)) {
            throw new BranchException(ErrorKind.TX_CONFLICT, "transaction " + txId + " is already in progress");
        }
        try {
            CoordinatorRecord current = records.get(txId);
            if (current.getPhase() == CoordinatorPhase.PREPARING) {
                current = current.decided(Decision.ABORT, true, "reconciled without a decision");
                persist(current);
            }
            log.info("[{}] reconciling {} ({})", branchName, txId, current.getDecision());
            return finish(current);
        } finally {
            inFlight.remove(txId);
        }
    }

    public Optional<CoordinatorRecord> find(String txId) {
        return Optional.ofNullable(records.get(txId));
    }

    private void persist(CoordinatorRecord rec) {
        store.write(b -> b.putCoordinator(rec.getTxId(), rec.encode()));
        records.put(rec.getTxId(), rec);
        if (rec.getPhase().isFinal()) {
            resolvedAt.put(rec.getTxId(), clock.getAsLong());
        }
    }

    private static final class Delivery {
        static final Delivery OK = new Delivery(true, null);

        final boolean ok;
        final String failure;

        private Delivery(boolean ok, String failure) {
            this.ok = ok;
            this.failure = failure;
        }

        static Delivery failed(String why) {
            return new Delivery(false, why);
        }
    }
}
