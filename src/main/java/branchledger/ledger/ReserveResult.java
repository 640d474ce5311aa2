package branchledger.ledger;

public enum ReserveResult {
    OK,
    INSUFFICIENT_FUNDS,
    NOT_FOUND,
    ALREADY_RESERVED
}
