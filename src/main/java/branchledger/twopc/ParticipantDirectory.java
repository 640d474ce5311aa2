package branchledger.twopc;

/** Resolves the participant that lives behind a remote branch address. */
@FunctionalInterface
public interface ParticipantDirectory {

    TwoPcParticipant participantAt(BranchAddress address);
}
