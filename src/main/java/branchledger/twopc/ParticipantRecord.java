package branchledger.twopc;

import branchledger.common.Types.Side;
import branchledger.common.Types.TxState;
import branchledger.ledger.LedgerCorruptedException;

public final class ParticipantRecord {
    private final String txId;
    private final Side side;
    private final long accountNo;
    private final long amount;
    private final TxState state;
    private final long deadlineMillis;

    public ParticipantRecord(String txId, Side side, long accountNo, long amount, TxState state, long deadlineMillis) {
        this.txId = txId;
        this.side = side;
        this.accountNo = accountNo;
        this.amount = amount;
        this.state = state;
        this.deadlineMillis = deadlineMillis;
    }

    /** Abort that arrived before (or without) any prepare. */
    static ParticipantRecord tombstone(String txId) {
        return new ParticipantRecord(txId, null, 0L, 0L, TxState.ABORTED, 0L);
    }

    public String getTxId() { return txId; }
    public Side getSide() { return side; }
    public long getAccountNo() { return accountNo; }
    public long getAmount() { return amount; }
    public TxState getState() { return state; }
    public long getDeadlineMillis() { return deadlineMillis; }

    public boolean isTombstone() {
        return side == null;
    }

    boolean sameRequest(long accountNo, long amount, Side side) {
        return this.accountNo == accountNo && this.amount == amount && this.side == side;
    }

    ParticipantRecord withState(TxState next) {
        return new ParticipantRecord(txId, side, accountNo, amount, next, deadlineMillis);
    }

    String encode() {
        return (side == null ? "" : side.name()) + "|" + accountNo + "|" + amount + "|" + state.name() + "|" + deadlineMillis;
    }

    static ParticipantRecord decode(String txId, String raw) {
        String[] p = raw == null ? new String[0] : raw.split("\\|", -1);
        if (p.length != 5) {
            throw new LedgerCorruptedException("malformed participant record " + txId + ": " + raw);
        }
        try {
            Side side = p[0].isEmpty() ? null : Side.valueOf(p[0]);
            return new ParticipantRecord(txId, side, Long.parseLong(p[1]), Long.parseLong(p[2]),
                    TxState.valueOf(p[3]), Long.parseLong(p[4]));
        } catch (IllegalArgumentException e) {
            throw new LedgerCorruptedException("malformed participant record " + txId + ": " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "ParticipantRecord{" + txId + " " + side + " acct=" + accountNo + " amt=" + amount + " " + state + "}";
    }
}
