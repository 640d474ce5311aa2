package branchledger.common;

public class BranchException extends RuntimeException {

    private final ErrorKind kind;

    public BranchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BranchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
