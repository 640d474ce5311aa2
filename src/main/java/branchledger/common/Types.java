package branchledger.common;

import java.util.concurrent.atomic.AtomicLong;

public final class Types {

    private Types() {}

    public enum Side { DEBIT, CREDIT }

    /** Participant-side state of one transaction. IDLE is the absence of a record. */
    public enum TxState { PREPARED, COMMITTED, ABORTED }

    public enum OperationKind {
        DEPOSIT,
        WITHDRAW,
        TRANSFER_LOCAL,
        TRANSFER_PREPARE,
        TRANSFER_COMMIT,
        TRANSFER_ABORT,
        ACCOUNT_CREATED
    }

    public enum CoordinatorPhase {
        PREPARING,
        COMMITTING,
        ABORTING,
        COMMITTED,
        ABORTED,
        UNRESOLVED;

        public boolean isFinal() {
            return this == COMMITTED || this == ABORTED;
        }
    }

    public enum Outcome { COMMITTED, ABORTED, UNRESOLVED }

    public enum RecoveryPolicy { ABORT, RESUME }

    private static final AtomicLong TX_COUNTER = new AtomicLong();

    public static String newTxId(String branchName) {
        String prefix = (branchName == null || branchName.isBlank()) ? "branch" : branchName.trim();
        return prefix + "-" + System.currentTimeMillis() + "-" + TX_COUNTER.incrementAndGet();
    }

    // '|' is the field separator of every persisted record
    public static String requireValidTxId(String txId) {
        if (txId == null || txId.isBlank()) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "missing tx_id");
        }
        String t = txId.trim();
        if (t.indexOf('|') >= 0) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "tx_id must not contain '|'");
        }
        return t;
    }

    public static long requirePositiveAmount(long amount) {
        if (amount <= 0) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "amount must be positive, got " + amount);
        }
        return amount;
    }

    public static long requireAccountNo(long accountNo) {
        if (accountNo <= 0) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, "invalid account_no " + accountNo);
        }
        return accountNo;
    }
}
