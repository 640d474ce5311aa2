package branchledger.twopc;

import branchledger.common.Types.CoordinatorPhase;
import branchledger.ledger.LedgerCorruptedException;

/**
 * Durable coordinator view of one inter-branch transfer. The decision is written before any
 * commit/abort is sent, so a restarted coordinator re-drives exactly what it promised.
 */
public final class CoordinatorRecord {

    public enum Decision { NONE, COMMIT, ABORT }

    private final String txId;
    private final long srcAccount;
    private final BranchAddress destination;
    private final long dstAccount;
    private final long amount;
    private final CoordinatorPhase phase;
    private final Decision decision;
    private final boolean remotePrepared;
    private final String reason;

    CoordinatorRecord(String txId, long srcAccount, BranchAddress destination, long dstAccount, long amount,
                      CoordinatorPhase phase, Decision decision, boolean remotePrepared, String reason) {
        this.txId = txId;
        this.srcAccount = srcAccount;
        this.destination = destination;
        this.dstAccount = dstAccount;
        this.amount = amount;
        this.phase = phase;
        this.decision = decision;
        this.remotePrepared = remotePrepared;
        this.reason = reason == null ? "" : reason;
    }

    static CoordinatorRecord preparing(TransferRequest req) {
        return new CoordinatorRecord(req.getTxId(), req.getSrcAccount(), req.getDestination(), req.getDstAccount(),
                req.getAmount(), CoordinatorPhase.PREPARING, Decision.NONE, false, "");
    }

    public String getTxId() { return txId; }
    public long getSrcAccount() { return srcAccount; }
    public BranchAddress getDestination() { return destination; }
    public long getDstAccount() { return dstAccount; }
    public long getAmount() { return amount; }
    public CoordinatorPhase getPhase() { return phase; }
    public Decision getDecision() { return decision; }
    public boolean isRemotePrepared() { return remotePrepared; }
    public String getReason() { return reason; }

    CoordinatorRecord decided(Decision d, boolean remoteYes, String why) {
        CoordinatorPhase next = d == Decision.COMMIT ? CoordinatorPhase.COMMITTING : CoordinatorPhase.ABORTING;
        return new CoordinatorRecord(txId, srcAccount, destination, dstAccount, amount, next, d, remoteYes, why);
    }

    CoordinatorRecord inPhase(CoordinatorPhase next, String why) {
        return new CoordinatorRecord(txId, srcAccount, destination, dstAccount, amount, next, decision, remotePrepared,
                why == null ? reason : why);
    }

    boolean matches(TransferRequest req) {
        return srcAccount == req.getSrcAccount() && dstAccount == req.getDstAccount() && amount == req.getAmount()
                && destination.isSameEndpoint(req.getDestination());
    }

    TransferResult toResult() {
        switch (phase) {
            case COMMITTED:
                return TransferResult.committed(txId);
            case ABORTED:
                return TransferResult.aborted(txId, reason);
            case UNRESOLVED:
                return TransferResult.unresolved(txId, reason);
            default:
                throw new IllegalStateException("transaction " + txId + " is still " + phase);
        }
    }

    String encode() {
        return srcAccount + "|" + destination.getHost() + "|" + destination.getPort() + "|" + dstAccount + "|" + amount
                + "|" + phase.name() + "|" + decision.name() + "|" + remotePrepared + "|" + reason;
    }

    static CoordinatorRecord decode(String txId, String raw) {
        String[] p = raw == null ? new String[0] : raw.split("\\|", 9);
        if (p.length != 9) {
            throw new LedgerCorruptedException("malformed coordinator record " + txId + ": " + raw);
        }
        try {
            return new CoordinatorRecord(txId, Long.parseLong(p[0]), new BranchAddress(p[1], Integer.parseInt(p[2])),
                    Long.parseLong(p[3]), Long.parseLong(p[4]), CoordinatorPhase.valueOf(p[5]),
                    Decision.valueOf(p[6]), Boolean.parseBoolean(p[7]), p[8]);
        } catch (IllegalArgumentException e) {
            throw new LedgerCorruptedException("malformed coordinator record " + txId + ": " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "CoordinatorRecord{" + txId + " " + srcAccount + " -> " + destination + "/" + dstAccount
                + " amt=" + amount + " " + phase + " decision=" + decision + (reason.isEmpty() ? "" : " reason=" + reason) + "}";
    }
}
