package branchledger.ledger;

/** Persisted branch state could not be read back. Fatal for the branch process. */
public class LedgerCorruptedException extends IllegalStateException {

    public LedgerCorruptedException(String message) {
        super(message);
    }

    public LedgerCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
