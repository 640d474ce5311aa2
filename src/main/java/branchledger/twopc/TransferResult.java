package branchledger.twopc;

import branchledger.common.Types.Outcome;

public final class TransferResult {
    private final Outcome outcome;
    private final String txId;
    private final String reason;

    private TransferResult(Outcome outcome, String txId, String reason) {
        this.outcome = outcome;
        this.txId = txId;
        this.reason = reason == null ? "" : reason;
    }

    public static TransferResult committed(String txId) {
        return new TransferResult(Outcome.COMMITTED, txId, "");
    }

    public static TransferResult aborted(String txId, String reason) {
        return new TransferResult(Outcome.ABORTED, txId, reason);
    }

    public static TransferResult unresolved(String txId, String reason) {
        return new TransferResult(Outcome.UNRESOLVED, txId, reason);
    }

    public Outcome getOutcome() { return outcome; }
    public String getTxId() { return txId; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return outcome + "(" + txId + (reason.isEmpty() ? "" : ": " + reason) + ")";
    }
}
