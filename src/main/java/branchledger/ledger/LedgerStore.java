package branchledger.ledger;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Per-branch account table. Each mutating call holds the lock of the account(s) it touches for
 * the duration of that call only, writes the new rows plus whatever the caller adds through
 * {@code hook} in one durable commit, and only then publishes the rows in memory.
 */
public final class LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

    private static final Consumer<LedgerDatabase.Batch> NO_HOOK = b -> { };

    private final LedgerDatabase database;
    private final ConcurrentMap<Long, Account> accounts = new ConcurrentHashMap<>();
    private final KeyedLocks<Long> locks = new KeyedLocks<>();

    public LedgerStore(LedgerDatabase database) {
        this.database = database;
        this.accounts.putAll(database.loadAccounts());
        log.info("Ledger loaded from {} with {} accounts", database.describe(), accounts.size());
    }

    public LedgerDatabase getDatabase() {
        return database;
    }

    public Optional<Account> find(long accountNo) {
        return Optional.ofNullable(accounts.get(accountNo));
    }

    public Account get(long accountNo) {
        Account a = accounts.get(accountNo);
        if (a == null) {
            throw notFound(accountNo);
        }
        return a;
    }

    public List<Account> list() {
        List<Account> out = new ArrayList<>(accounts.values());
        out.sort(Comparator.comparingLong(Account::getAccountNo));
        return out;
    }

    public boolean isEmpty() {
        return accounts.isEmpty();
    }

    public Account create(long accountNo, String name, long initialBalance, Consumer<LedgerDatabase.Batch> hook) {
        if (initialBalance < 0) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "initial balance must not be negative");
        }
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            if (accounts.containsKey(accountNo)) {
                throw new BranchException(ErrorKind.ALREADY_EXISTS, "account " + accountNo + " already exists");
            }
            Account created = Account.open(accountNo, name, initialBalance);
            persist(hook, created);
            return created;
        }
    }

    public ReserveResult reserve(long accountNo, long amount, String txId, Consumer<LedgerDatabase.Batch> hook) {
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            Account a = accounts.get(accountNo);
            if (a == null) {
                return ReserveResult.NOT_FOUND;
            }
            if (a.isReservedBy(txId)) {
                return ReserveResult.OK;
            }
            if (a.getReservedBy() != null) {
                return ReserveResult.ALREADY_RESERVED;
            }
            if (a.available() < amount) {
                return ReserveResult.INSUFFICIENT_FUNDS;
            }
            persist(hook, a.withReservation(txId, amount));
            return ReserveResult.OK;
        }
    }

    public Account release(long accountNo, String txId, Consumer<LedgerDatabase.Batch> hook) {
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            Account a = get(accountNo);
            if (a.getReservedBy() == null) {
                persist(hook);
                return a;
            }
            if (!a.isReservedBy(txId)) {
                throw new BranchException(ErrorKind.TX_CONFLICT,
                        "account " + accountNo + " is reserved by " + a.getReservedBy() + ", not " + txId);
            }
            Account released = a.withoutReservation();
            persist(hook, released);
            return released;
        }
    }

    public Account applyDebit(long accountNo, long amount, String txId, Consumer<LedgerDatabase.Batch> hook) {
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            Account a = get(accountNo);
            if (!a.isReservedBy(txId)) {
                throw new BranchException(ErrorKind.PROTOCOL_VIOLATION,
                        "no reservation for " + txId + " on account " + accountNo);
            }
            if (a.getReserved() != amount) {
                throw new BranchException(ErrorKind.PROTOCOL_VIOLATION,
                        "reservation for " + txId + " is " + a.getReserved() + ", debit asked for " + amount);
            }
            Account debited = a.debitReservation();
            persist(hook, debited);
            return debited;
        }
    }

    public Account applyCredit(long accountNo, long amount, String txId, Consumer<LedgerDatabase.Batch> hook) {
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            Account a = get(accountNo);
            requireCreditFits(a, amount);
            Account credited = a.credit(amount);
            persist(hook, credited);
            return credited;
        }
    }

    /**
     * Reserve-and-debit for a local withdrawal. Both halves happen under one held lock, so no
     * other caller ever sees the reservation.
     */
    public Account withdrawAvailable(long accountNo, long amount, Consumer<LedgerDatabase.Batch> hook) {
        try (KeyedLocks.Held ignored = locks.lock(accountNo)) {
            Account a = get(accountNo);
            if (a.available() < amount) {
                throw insufficient(accountNo, a, amount);
            }
            Account debited = a.debit(amount);
            persist(hook, debited);
            return debited;
        }
    }

    /** Atomic debit+credit on two accounts of this branch. Returns {src, dst}. */
    public Account[] transferLocal(long src, long dst, long amount, Consumer<LedgerDatabase.Batch> hook) {
        if (src == dst) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "source and destination are the same account");
        }
        try (KeyedLocks.Held ignored = locks.lockAll(Arrays.asList(src, dst))) {
            Account from = get(src);
            Account to = get(dst);
            if (from.available() < amount) {
                throw insufficient(src, from, amount);
            }
            requireCreditFits(to, amount);
            Account debited = from.debit(amount);
            Account credited = to.credit(amount);
            persist(hook, debited, credited);
            return new Account[] { debited, credited };
        }
    }

    /** Durable write that touches no account row (for example a credit-side prepare intent). */
    public void write(Consumer<LedgerDatabase.Batch> hook) {
        persist(hook);
    }

    private void persist(Consumer<LedgerDatabase.Batch> hook, Account... updated) {
        LedgerDatabase.Batch batch = database.newBatch();
        (hook == null ? NO_HOOK : hook).accept(batch);
        for (Account a : updated) {
            batch.putAccount(a);
        }
        if (batch.isEmpty()) {
            return;
        }
        database.commit(batch);
        for (Account a : updated) {
            accounts.put(a.getAccountNo(), a);
        }
    }

    private static void requireCreditFits(Account a, long amount) {
        if (!a.canCredit(amount)) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT,
                    "credit of " + amount + " would overflow the balance of account " + a.getAccountNo());
        }
    }

    private static BranchException notFound(long accountNo) {
        return new BranchException(ErrorKind.NOT_FOUND, "account " + accountNo + " not found");
    }

    private static BranchException insufficient(long accountNo, Account a, long amount) {
        return new BranchException(ErrorKind.INSUFFICIENT_FUNDS,
                "insufficient funds on " + accountNo + ": available " + a.available() + ", requested " + amount);
    }
}
