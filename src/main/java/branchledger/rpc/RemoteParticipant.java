package branchledger.rpc;

import branchledger.common.Types.Side;
import branchledger.twopc.TwoPcParticipant;
import branchledger.twopc.Vote;

/** The participant of another branch, reached through its listener. */
public class RemoteParticipant implements TwoPcParticipant {

    private final BranchClient client;

    public RemoteParticipant(BranchClient client) {
        this.client = client;
    }

    @Override
    public Vote prepare(String txId, long accountNo, long amount, Side side) {
        return ProtoMapper.fromProto(client.prepare(txId, accountNo, amount, side));
    }

    @Override
    public boolean commit(String txId) {
        return client.commit(txId);
    }

    @Override
    public boolean abort(String txId) {
        return client.abort(txId);
    }

    @Override
    public String describe() {
        return "remote:" + client.getAddress();
    }
}
