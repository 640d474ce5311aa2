package branchledger.ledger;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types.OperationKind;
import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * MapDB handle for one branch. All durable state lives in one transactional DB so that an
 * account change, its op-log entry and any 2PC record land in a single commit.
 */
public final class LedgerDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LedgerDatabase.class);

    private final Path dataPath;
    private final DB mapDb;
    private final HTreeMap<Long, String> accounts;
    private final BTreeMap<Long, String> oplog;
    private final HTreeMap<String, String> participant;
    private final HTreeMap<String, String> coordinator;
    private long nextLogSeq;

    private LedgerDatabase(Path dataPath, DB mapDb) {
        this.dataPath = dataPath;
        this.mapDb = mapDb;
        this.accounts = mapDb.hashMap("accounts", Serializer.LONG, Serializer.STRING).createOrOpen();
        this.oplog = mapDb.treeMap("oplog", Serializer.LONG, Serializer.STRING).createOrOpen();
        this.participant = mapDb.hashMap("participant", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.coordinator = mapDb.hashMap("coordinator", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.nextLogSeq = oplog.isEmpty() ? 1L : oplog.lastKey() + 1L;
    }

    public static LedgerDatabase inMemory() {
        DB db = DBMaker.memoryDB()
                .transactionEnable()
                .make();
        return new LedgerDatabase(null, db);
    }

    public static LedgerDatabase open(Path dataPath, boolean mmap) {
        if (dataPath == null) {
            return inMemory();
        }
        File file = dataPath.toFile();
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new LedgerCorruptedException("cannot create data directory " + parent);
        }
        try {
            DBMaker.Maker maker = DBMaker.fileDB(file).transactionEnable().closeOnJvmShutdown();
            if (mmap) {
                maker = maker.fileMmapEnableIfSupported();
            }
            return new LedgerDatabase(dataPath, maker.make());
        } catch (RuntimeException e) {
            throw new LedgerCorruptedException("cannot open ledger at " + dataPath + ": " + e.getMessage(), e);
        }
    }

    public Batch newBatch() {
        return new Batch();
    }

    /**
     * Writes the batch in one MapDB transaction. On failure everything is rolled back and the
     * caller must leave its in-memory view untouched.
     */
    public synchronized List<OperationLogEntry> commit(Batch batch) {
        long firstSeq = nextLogSeq;
        List<OperationLogEntry> written = new ArrayList<>(batch.logDrafts.size());
        try {
            long now = System.currentTimeMillis();
            long seq = firstSeq;
            for (LogDraft d : batch.logDrafts) {
                OperationLogEntry e = new OperationLogEntry(seq++, now, d.kind, d.accountNo, d.amount, d.counterparty, d.txId);
                oplog.put(e.getSeq(), Codec.encodeLogEntry(e));
                written.add(e);
            }
            for (Account a : batch.accountWrites.values()) {
                accounts.put(a.getAccountNo(), Codec.encodeAccount(a));
            }
            for (Map.Entry<String, String> e : batch.participantWrites.entrySet()) {
                participant.put(e.getKey(), e.getValue());
            }
            for (Map.Entry<String, String> e : batch.coordinatorWrites.entrySet()) {
                coordinator.put(e.getKey(), e.getValue());
            }
            for (String txId : batch.participantRemovals) {
                participant.remove(txId);
            }
            for (String txId : batch.coordinatorRemovals) {
                coordinator.remove(txId);
            }
            mapDb.commit();
            nextLogSeq = seq;
            return written;
        } catch (RuntimeException e) {
            log.error("Ledger commit failed at {}: {}", describe(), e.toString());
            try {
                mapDb.rollback();
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            nextLogSeq = firstSeq;
            throw new BranchException(ErrorKind.STORAGE_FAILURE, "ledger write failed: " + e.getMessage(), e);
        }
    }

    public synchronized Map<Long, Account> loadAccounts() {
        Map<Long, Account> out = new TreeMap<>();
        for (Map.Entry<Long, String> e : accounts.entrySet()) {
            out.put(e.getKey(), Codec.decodeAccount(e.getKey(), e.getValue()));
        }
        return out;
    }

    public synchronized Map<String, String> participantRecords() {
        return new LinkedHashMap<>(participant);
    }

    public synchronized Map<String, String> coordinatorRecords() {
        return new LinkedHashMap<>(coordinator);
    }

    public synchronized List<OperationLogEntry> readLog(long afterSeq, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<OperationLogEntry> out = new ArrayList<>(Math.min(limit, 256));
        for (Map.Entry<Long, String> e : oplog.tailMap(afterSeq, false).entrySet()) {
            out.add(Codec.decodeLogEntry(e.getKey(), e.getValue()));
            if (out.size() >= limit) break;
        }
        return out;
    }

    public synchronized long lastLogSeq() {
        return nextLogSeq - 1L;
    }

    // test hook: simulates on-disk damage
    synchronized void putRawAccount(long accountNo, String raw) {
        accounts.put(accountNo, raw);
        mapDb.commit();
    }

    public String describe() {
        return dataPath == null ? "<memory>" : dataPath.toString();
    }

    @Override
    public synchronized void close() {
        if (!mapDb.isClosed()) {
            mapDb.close();
        }
    }

    public final class Batch {
        private final List<LogDraft> logDrafts = new ArrayList<>(1);
        private final Map<Long, Account> accountWrites = new LinkedHashMap<>();
        private final Map<String, String> participantWrites = new LinkedHashMap<>();
        private final Map<String, String> coordinatorWrites = new LinkedHashMap<>();
        private final Set<String> participantRemovals = new LinkedHashSet<>();
        private final Set<String> coordinatorRemovals = new LinkedHashSet<>();

        private Batch() {}

        public Batch appendLog(OperationKind kind, long accountNo, long amount, long counterparty, String txId) {
            logDrafts.add(new LogDraft(kind, accountNo, amount, counterparty, txId));
            return this;
        }

        public Batch putAccount(Account account) {
            accountWrites.put(account.getAccountNo(), account);
            return this;
        }

        public Batch putParticipant(String txId, String encoded) {
            participantWrites.put(txId, encoded);
            return this;
        }

        public Batch putCoordinator(String txId, String encoded) {
            coordinatorWrites.put(txId, encoded);
            return this;
        }

        public Batch removeParticipant(String txId) {
            participantWrites.remove(txId);
            participantRemovals.add(txId);
            return this;
        }

        public Batch removeCoordinator(String txId) {
            coordinatorWrites.remove(txId);
            coordinatorRemovals.add(txId);
            return this;
        }

        public boolean isEmpty() {
            return logDrafts.isEmpty() && accountWrites.isEmpty() && participantWrites.isEmpty()
                    && coordinatorWrites.isEmpty() && participantRemovals.isEmpty() && coordinatorRemovals.isEmpty();
        }
    }

    private static final class LogDraft {
        final OperationKind kind;
        final long accountNo;
        final long amount;
        final long counterparty;
        final String txId;

        LogDraft(OperationKind kind, long accountNo, long amount, long counterparty, String txId) {
            this.kind = kind;
            this.accountNo = accountNo;
            this.amount = amount;
            this.counterparty = counterparty;
            this.txId = txId;
        }
    }

    /** Pipe-delimited row formats. Free text (the account name) always goes last. */
    static final class Codec {
        private Codec() {}

        static String encodeAccount(Account a) {
            return a.getBalance() + "|" + a.getReserved() + "|" + (a.getReservedBy() == null ? "" : a.getReservedBy())
                    + "|" + a.getVersion() + "|" + a.getName();
        }

        static Account decodeAccount(long accountNo, String raw) {
            if (raw == null) {
                throw new LedgerCorruptedException("null row for account " + accountNo);
            }
            String[] parts = raw.split("\\|", 5);
            if (parts.length != 5) {
                throw new LedgerCorruptedException("malformed row for account " + accountNo + ": " + raw);
            }
            try {
                long balance = Long.parseLong(parts[0]);
                long reserved = Long.parseLong(parts[1]);
                long version = Long.parseLong(parts[3]);
                if (balance < 0 || reserved < 0 || reserved > balance) {
                    throw new LedgerCorruptedException("account " + accountNo + " violates balance invariants: " + raw);
                }
                return new Account(accountNo, parts[4], balance, reserved, parts[2], version);
            } catch (NumberFormatException e) {
                throw new LedgerCorruptedException("malformed row for account " + accountNo + ": " + raw, e);
            }
        }

        static String encodeLogEntry(OperationLogEntry e) {
            return e.getTimestampMillis() + "|" + e.getKind().name() + "|" + e.getAccountNo() + "|" + e.getAmount()
                    + "|" + e.getCounterpartyAccount() + "|" + (e.getTxId() == null ? "" : e.getTxId());
        }

        static OperationLogEntry decodeLogEntry(long seq, String raw) {
            String[] parts = raw == null ? new String[0] : raw.split("\\|", 6);
            if (parts.length != 6) {
                throw new LedgerCorruptedException("malformed op-log entry " + seq + ": " + raw);
            }
            try {
                return new OperationLogEntry(seq,
                        Long.parseLong(parts[0]),
                        OperationKind.valueOf(parts[1]),
                        Long.parseLong(parts[2]),
                        Long.parseLong(parts[3]),
                        Long.parseLong(parts[4]),
                        parts[5]);
            } catch (IllegalArgumentException e) {
                throw new LedgerCorruptedException("malformed op-log entry " + seq + ": " + raw, e);
            }
        }
    }
}
