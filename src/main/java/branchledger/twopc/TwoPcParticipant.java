package branchledger.twopc;

import branchledger.common.Types.Side;

/**
 * One side of a two-participant transfer, local or reached over the wire.
 * Commit and abort are idempotent and answer {@code true} once the outcome is applied; a
 * refusal or transport failure surfaces as {@link branchledger.common.BranchException}.
 */
public interface TwoPcParticipant {

    Vote prepare(String txId, long accountNo, long amount, Side side);

    boolean commit(String txId);

    boolean abort(String txId);

    String describe();
}
