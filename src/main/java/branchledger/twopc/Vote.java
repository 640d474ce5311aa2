package branchledger.twopc;

import branchledger.common.ErrorKind;

/** A participant's answer to prepare. */
public final class Vote {
    private static final Vote YES = new Vote(true, null, "");

    private final boolean prepared;
    private final ErrorKind reasonKind;
    private final String reason;

    private Vote(boolean prepared, ErrorKind reasonKind, String reason) {
        this.prepared = prepared;
        this.reasonKind = reasonKind;
        this.reason = reason == null ? "" : reason;
    }

    public static Vote yes() {
        return YES;
    }

    public static Vote no(ErrorKind kind, String reason) {
        return new Vote(false, kind, reason);
    }

    public boolean isPrepared() { return prepared; }
    public ErrorKind getReasonKind() { return reasonKind; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return prepared ? "PREPARED" : "NOT_PREPARED(" + reasonKind + ": " + reason + ")";
    }
}
