package branchledger.ledger;

import branchledger.common.Types.OperationKind;

public final class OperationLogEntry {
    private final long seq;
    private final long timestampMillis;
    private final OperationKind kind;
    private final long accountNo;
    private final long amount;
    private final long counterpartyAccount;
    private final String txId;

    public OperationLogEntry(long seq, long timestampMillis, OperationKind kind,
                             long accountNo, long amount, long counterpartyAccount, String txId) {
        this.seq = seq;
        this.timestampMillis = timestampMillis;
        this.kind = kind;
        this.accountNo = accountNo;
        this.amount = amount;
        this.counterpartyAccount = counterpartyAccount;
        this.txId = (txId == null || txId.isEmpty()) ? null : txId;
    }

    public long getSeq() { return seq; }
    public long getTimestampMillis() { return timestampMillis; }
    public OperationKind getKind() { return kind; }
    public long getAccountNo() { return accountNo; }
    public long getAmount() { return amount; }
    public long getCounterpartyAccount() { return counterpartyAccount; }
    public String getTxId() { return txId; }

    @Override
    public String toString() {
        return "#" + seq + " " + kind + " acct=" + accountNo + " amt=" + amount
                + (counterpartyAccount != 0 ? " cp=" + counterpartyAccount : "")
                + (txId != null ? " tx=" + txId : "");
    }
}
