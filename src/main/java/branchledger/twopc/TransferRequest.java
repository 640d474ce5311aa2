package branchledger.twopc;

public final class TransferRequest {
    private final String txId;
    private final long srcAccount;
    private final BranchAddress destination;
    private final long dstAccount;
    private final long amount;

    public TransferRequest(String txId, long srcAccount, BranchAddress destination, long dstAccount, long amount) {
        this.txId = txId;
        this.srcAccount = srcAccount;
        this.destination = destination;
        this.dstAccount = dstAccount;
        this.amount = amount;
    }

    /** Empty or null when the coordinator should mint one. */
    public String getTxId() { return txId; }
    public long getSrcAccount() { return srcAccount; }
    public BranchAddress getDestination() { return destination; }
    public long getDstAccount() { return dstAccount; }
    public long getAmount() { return amount; }

    TransferRequest withTxId(String id) {
        return new TransferRequest(id, srcAccount, destination, dstAccount, amount);
    }

    @Override
    public String toString() {
        return "Transfer{" + txId + " " + srcAccount + " -> " + destination + "/" + dstAccount + " amt=" + amount + "}";
    }
}
