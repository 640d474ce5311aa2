package branchledger.common;

public enum ErrorKind {
    NOT_FOUND,
    INSUFFICIENT_FUNDS,
    TX_CONFLICT,
    TIMEOUT,
    PEER_UNREACHABLE,
    PROTOCOL_VIOLATION,
    UNRESOLVED,
    INVALID_ARGUMENT,
    ALREADY_EXISTS,
    STORAGE_FAILURE,
    INTERNAL;

    /** Failures of the transport rather than answers from the peer. */
    public boolean isTransport() {
        return this == TIMEOUT || this == PEER_UNREACHABLE;
    }
}
