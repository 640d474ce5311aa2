package branchledger.engine;

import branchledger.common.Types;
import branchledger.common.Types.OperationKind;
import branchledger.ledger.Account;
import branchledger.ledger.LedgerStore;
import branchledger.ledger.OperationLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single-branch operations. Each one is a single store call whose op-log entry is written in
 * the same commit as the balance change; a failed append fails the operation.
 */
public class TransactionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransactionEngine.class);

    public static final int MAX_LOG_PAGE = 1000;

    private final LedgerStore store;

    public TransactionEngine(LedgerStore store) {
        this.store = store;
    }

    public Account balance(long accountNo) {
        return store.get(accountNo);
    }

    public List<Account> listAccounts() {
        return store.list();
    }

    public Account deposit(long accountNo, long amount) {
        Types.requirePositiveAmount(amount);
        Account after = store.applyCredit(accountNo, amount, null,
                b -> b.appendLog(OperationKind.DEPOSIT, accountNo, amount, 0L, null));
        log.debug("DEPOSIT acct={} amt={} -> {}", accountNo, amount, after.getBalance());
        return after;
    }

    public Account withdraw(long accountNo, long amount) {
        Types.requirePositiveAmount(amount);
        Account after = store.withdrawAvailable(accountNo, amount,
                b -> b.appendLog(OperationKind.WITHDRAW, accountNo, amount, 0L, null));
        log.debug("WITHDRAW acct={} amt={} -> {}", accountNo, amount, after.getBalance());
        return after;
    }

    /** Returns {src, dst} after the move. */
    public Account[] transferLocal(long src, long dst, long amount) {
        Types.requirePositiveAmount(amount);
        Account[] after = store.transferLocal(src, dst, amount,
                b -> b.appendLog(OperationKind.TRANSFER_LOCAL, src, amount, dst, null));
        log.debug("TRANSFER_LOCAL {}->{} amt={} -> src={} dst={}",
                src, dst, amount, after[0].getBalance(), after[1].getBalance());
        return after;
    }

    public Account createAccount(long accountNo, String name, long initialBalance) {
        Types.requireAccountNo(accountNo);
        Account created = store.create(accountNo, name, initialBalance,
                b -> b.appendLog(OperationKind.ACCOUNT_CREATED, accountNo, initialBalance, 0L, null));
        log.info("Account {} created ({}) with balance {}", accountNo, created.getName(), initialBalance);
        return created;
    }

    public List<OperationLogEntry> operationLog(long afterSeq, int limit) {
        int page = limit <= 0 ? 100 : Math.min(limit, MAX_LOG_PAGE);
        return store.getDatabase().readLog(Math.max(0L, afterSeq), page);
    }

    /** Seeds the two demo accounts on an empty ledger. */
    public void preload(String branchName) {
        if (!store.isEmpty()) {
            return;
        }
        for (int i = 1; i <= 2; i++) {
            createAccount(1000L + i, "User_" + branchName + "_" + i, 1000L);
        }
    }
}
