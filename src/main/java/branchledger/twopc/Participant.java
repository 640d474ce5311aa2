package branchledger.twopc;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.KeyedLocks;
import branchledger.common.Types;
import branchledger.common.Types.OperationKind;
import branchledger.common.Types.RecoveryPolicy;
import branchledger.common.Types.Side;
import branchledger.common.Types.TxState;
import branchledger.ledger.Account;
import branchledger.ledger.LedgerDatabase;
import branchledger.ledger.LedgerStore;
import branchledger.ledger.ReserveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Branch-local half of 2PC. Every transition is written durably together with its ledger
 * effect and op-log entry, so PREPARED state and reserved amounts survive a restart.
 * Terminal records are kept to answer replayed commit/abort.
 */
public class Participant implements TwoPcParticipant {

    private static final Logger log = LoggerFactory.getLogger(Participant.class);

    private final String branchName;
    private final LedgerStore store;
    private final long deadlineMs;
    private final LongSupplier clock;
    private static final int TX_LOCK_STRIPES = 256;

    private final ConcurrentMap<String, ParticipantRecord> records = new ConcurrentHashMap<>();
    // resolution time of COMMITTED/ABORTED records, for purgeResolved
    private final ConcurrentMap<String, Long> resolvedAt = new ConcurrentHashMap<>();
    private final KeyedLocks<Integer> txLocks = new KeyedLocks<>();
    private final KeyedLocks<Long> creditLocks = new KeyedLocks<>();

    public Participant(String branchName, LedgerStore store, long deadlineMs) {
        this(branchName, store, deadlineMs, System::currentTimeMillis);
    }

    public Participant(String branchName, LedgerStore store, long deadlineMs, LongSupplier clock) {
        this.branchName = branchName;
        this.store = store;
        this.deadlineMs = deadlineMs;
        this.clock = clock;
        long loadedAt = clock.getAsLong();
        for (Map.Entry<String, String> e : store.getDatabase().participantRecords().entrySet()) {
            ParticipantRecord rec = ParticipantRecord.decode(e.getKey(), e.getValue());
            records.put(e.getKey(), rec);
            if (rec.getState() != TxState.PREPARED) {
                resolvedAt.put(e.getKey(), loadedAt);
            }
        }
        long prepared = records.values().stream().filter(r -> r.getState() == TxState.PREPARED).count();
        if (prepared > 0) {
            log.info("[{}] loaded {} participant records, {} still PREPARED", branchName, records.size(), prepared);
        }
    }

    @Override
    public Vote prepare(String rawTxId, long accountNo, long amount, Side side) {
        final String txId;
        try {
            txId = Types.requireValidTxId(rawTxId);
            Types.requirePositiveAmount(amount);
        } catch (BranchException e) {
            return Vote.no(e.getKind(), e.getMessage());
        }
        if (side == null) {
            return Vote.no(ErrorKind.PROTOCOL_VIOLATION, "prepare without side");
        }
        try (KeyedLocks.Held ignored = lockTx(txId)) {
            ParticipantRecord existing = records.get(txId);
            if (existing != null) {
                return replayPrepare(existing, accountNo, amount, side);
            }
            ParticipantRecord rec = new ParticipantRecord(txId, side, accountNo, amount, TxState.PREPARED,
                    clock.getAsLong() + deadlineMs);
            Consumer<LedgerDatabase.Batch> hook = b -> b
                    .appendLog(OperationKind.TRANSFER_PREPARE, accountNo, amount, 0L, txId)
                    .putParticipant(txId, rec.encode());

            if (side == Side.DEBIT) {
                ReserveResult r = store.reserve(accountNo, amount, txId, hook);
                switch (r) {
                    case OK:
                        break;
                    case NOT_FOUND:
                        return refuse(txId, ErrorKind.NOT_FOUND, "account " + accountNo + " not found");
                    case INSUFFICIENT_FUNDS:
                        return refuse(txId, ErrorKind.INSUFFICIENT_FUNDS, "insufficient funds on " + accountNo);
                    case ALREADY_RESERVED:
                        return refuse(txId, ErrorKind.TX_CONFLICT, "account " + accountNo + " has a pending reservation");
                    default:
                        throw new IllegalStateException("unexpected reserve result " + r);
                }
                records.put(txId, rec);
            } else {
                try (KeyedLocks.Held credit = creditLocks.lock(accountNo)) {
                    Optional<Account> dst = store.find(accountNo);
                    if (dst.isEmpty()) {
                        return refuse(txId, ErrorKind.NOT_FOUND, "destination account " + accountNo + " not found");
                    }
                    // prepared credits on the same account must all fit together
                    long pending = pendingCredits(accountNo);
                    if (!dst.get().canCredit(amount) || pending > Long.MAX_VALUE - dst.get().getBalance() - amount) {
                        return refuse(txId, ErrorKind.INVALID_ARGUMENT,
                                "credit of " + amount + " would overflow the balance of account " + accountNo);
                    }
                    store.write(hook);
                    records.put(txId, rec);
                }
            }
            log.debug("[{}] PREPARED {}", branchName, rec);
            return Vote.yes();
        } catch (BranchException e) {
            return refuse(txId, e.getKind(), e.getMessage());
        }
    }

    @Override
    public boolean commit(String rawTxId) {
        String txId = Types.requireValidTxId(rawTxId);
        try (KeyedLocks.Held ignored = lockTx(txId)) {
            ParticipantRecord rec = records.get(txId);
            if (rec == null) {
                throw new BranchException(ErrorKind.PROTOCOL_VIOLATION, "commit for unknown transaction " + txId);
            }
            switch (rec.getState()) {
                case COMMITTED:
                    log.debug("[{}] COMMIT replay {}", branchName, txId);
                    return true;
                case ABORTED:
                    throw new BranchException(ErrorKind.PROTOCOL_VIOLATION, "transaction " + txId + " was already aborted");
                case PREPARED:
                    break;
                default:
                    throw new IllegalStateException("unexpected state " + rec.getState());
            }
            ParticipantRecord committed = rec.withState(TxState.COMMITTED);
            Consumer<LedgerDatabase.Batch> hook = b -> b
                    .appendLog(OperationKind.TRANSFER_COMMIT, rec.getAccountNo(), rec.getAmount(), 0L, txId)
                    .putParticipant(txId, committed.encode());
            if (rec.getSide() == Side.DEBIT) {
                store.applyDebit(rec.getAccountNo(), rec.getAmount(), txId, hook);
            } else {
                store.applyCredit(rec.getAccountNo(), rec.getAmount(), txId, hook);
            }
            records.put(txId, committed);
            resolvedAt.put(txId, clock.getAsLong());
            log.debug("[{}] COMMITTED {}", branchName, committed);
            return true;
        }
    }

    @Override
    public boolean abort(String rawTxId) {
        String txId = Types.requireValidTxId(rawTxId);
        try (KeyedLocks.Held ignored = lockTx(txId)) {
            ParticipantRecord rec = records.get(txId);
            if (rec == null) {
                ParticipantRecord tomb = ParticipantRecord.tombstone(txId);
                store.write(b -> b.putParticipant(txId, tomb.encode()));
                records.put(txId, tomb);
                resolvedAt.put(txId, clock.getAsLong());
                log.debug("[{}] ABORT before prepare for {}; tombstoned", branchName, txId);
                return true;
            }
            switch (rec.getState()) {
                case ABORTED:
                    return true;
                case COMMITTED:
                    throw new BranchException(ErrorKind.PROTOCOL_VIOLATION, "transaction " + txId + " was already committed");
                case PREPARED:
                    break;
                default:
                    throw new IllegalStateException("unexpected state " + rec.getState());
            }
            ParticipantRecord aborted = rec.withState(TxState.ABORTED);
            Consumer<LedgerDatabase.Batch> hook = b -> b
                    .appendLog(OperationKind.TRANSFER_ABORT, rec.getAccountNo(), rec.getAmount(), 0L, txId)
                    .putParticipant(txId, aborted.encode());
            if (rec.getSide() == Side.DEBIT) {
                store.release(rec.getAccountNo(), txId, hook);
            } else {
                store.write(hook);
            }
            records.put(txId, aborted);
            resolvedAt.put(txId, clock.getAsLong());
            log.debug("[{}] ABORTED {}", branchName, aborted);
            return true;
        }
    }

    /**
     * Aborts PREPARED records whose deadline has passed, except {@code held} ones (already
     * decided commit by this branch's coordinator). Returns the aborted tx ids.
     */
    public List<String> sweepExpired(Set<String> held) {
        long now = clock.getAsLong();
        List<String> aborted = new ArrayList<>();
        for (ParticipantRecord rec : records.values()) {
            if (rec.getState() != TxState.PREPARED || rec.getDeadlineMillis() > now || held.contains(rec.getTxId())) {
                continue;
            }
            try {
                if (isStillExpired(rec.getTxId(), now)) {
                    abort(rec.getTxId());
                    aborted.add(rec.getTxId());
                    log.warn("[{}] auto-aborted {} after prepare deadline ({} ms) without a decision",
                            branchName, rec.getTxId(), deadlineMs);
                }
            } catch (BranchException e) {
                log.warn("[{}] auto-abort of {} failed: {}", branchName, rec.getTxId(), e.toString());
            }
        }
        return aborted;
    }

    private boolean isStillExpired(String txId, long now) {
        try (KeyedLocks.Held ignored = lockTx(txId)) {
            ParticipantRecord cur = records.get(txId);
            return cur != null && cur.getState() == TxState.PREPARED && cur.getDeadlineMillis() <= now;
        }
    }

    /**
     * Startup handling of PREPARED records left by a previous run. {@code held} are the tx ids
     * this branch's own coordinator has already decided to commit; those stay PREPARED for it.
     */
    public int recover(RecoveryPolicy policy, Set<String> held) {
        if (policy == RecoveryPolicy.RESUME) {
            return 0;
        }
        int count = 0;
        for (ParticipantRecord rec : new ArrayList<>(records.values())) {
            if (rec.getState() != TxState.PREPARED || held.contains(rec.getTxId())) {
                continue;
            }
            abort(rec.getTxId());
            count++;
            log.warn("[{}] aborted leftover prepared transaction {} on restart", branchName, rec.getTxId());
        }
        return count;
    }

    /**
     * Forgets COMMITTED and ABORTED records (tombstones included) resolved at least
     * {@code retentionMs} ago, except {@code held} ones still open at this branch's coordinator.
     * Records loaded at startup count as resolved at load time.
     */
    public int purgeResolved(long retentionMs, Set<String> held) {
        long cutoff = clock.getAsLong() - retentionMs;
        int purged = 0;
        for (Map.Entry<String, Long> e : resolvedAt.entrySet()) {
            String txId = e.getKey();
            if (e.getValue() > cutoff || held.contains(txId)) {
                continue;
            }
            try (KeyedLocks.Held ignored = lockTx(txId)) {
                ParticipantRecord rec = records.get(txId);
                if (rec != null && rec.getState() != TxState.PREPARED) {
                    store.write(b -> b.removeParticipant(txId));
                    records.remove(txId);
                    purged++;
                }
                resolvedAt.remove(txId);
            }
        }
        if (purged > 0) {
            log.debug("[{}] purged {} resolved participant records", branchName, purged);
        }
        return purged;
    }

    public Optional<ParticipantRecord> find(String txId) {
        return Optional.ofNullable(records.get(txId));
    }

    public List<ParticipantRecord> prepared() {
        List<ParticipantRecord> out = new ArrayList<>();
        for (ParticipantRecord r : records.values()) {
            if (r.getState() == TxState.PREPARED) out.add(r);
        }
        return out;
    }

    @Override
    public String describe() {
        return "local:" + branchName;
    }

    private KeyedLocks.Held lockTx(String txId) {
        return txLocks.lock(Math.floorMod(txId.hashCode(), TX_LOCK_STRIPES));
    }

    private long pendingCredits(long accountNo) {
        long sum = 0L;
        for (ParticipantRecord r : records.values()) {
            if (r.getState() == TxState.PREPARED && r.getSide() == Side.CREDIT && r.getAccountNo() == accountNo) {
                sum += r.getAmount();
            }
        }
        return sum;
    }

    private Vote replayPrepare(ParticipantRecord existing, long accountNo, long amount, Side side) {
        if (existing.getState() == TxState.ABORTED) {
            return Vote.no(ErrorKind.PROTOCOL_VIOLATION, "transaction " + existing.getTxId() + " already aborted");
        }
        if (!existing.sameRequest(accountNo, amount, side)) {
            return Vote.no(ErrorKind.TX_CONFLICT, "transaction " + existing.getTxId() + " already prepared with different parameters");
        }
        return Vote.yes();
    }

    private Vote refuse(String txId, ErrorKind kind, String reason) {
        log.debug("[{}] NOT PREPARED {}: {} {}", branchName, txId, kind, reason);
        return Vote.no(kind, reason);
    }
}
