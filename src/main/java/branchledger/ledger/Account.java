package branchledger.ledger;

import java.util.Objects;

/**
 * Immutable snapshot of one account row. Mutators return a copy with {@code version + 1}.
 */
public final class Account {
    private final long accountNo;
    private final String name;
    private final long balance;
    private final long reserved;
    private final String reservedBy;
    private final long version;

    public Account(long accountNo, String name, long balance, long reserved, String reservedBy, long version) {
        this.accountNo = accountNo;
        this.name = name == null ? "" : name;
        this.balance = balance;
        this.reserved = reserved;
        this.reservedBy = (reservedBy == null || reservedBy.isEmpty()) ? null : reservedBy;
        this.version = version;
    }

    public static Account open(long accountNo, String name, long initialBalance) {
        return new Account(accountNo, name, initialBalance, 0L, null, 1L);
    }

    public long getAccountNo() { return accountNo; }
    public String getName() { return name; }
    public long getBalance() { return balance; }
    public long getReserved() { return reserved; }
    public String getReservedBy() { return reservedBy; }
    public long getVersion() { return version; }

    public long available() {
        return balance - reserved;
    }

    /** Whether {@code balance + amount} still fits in a long. */
    public boolean canCredit(long amount) {
        return amount <= Long.MAX_VALUE - balance;
    }

    public boolean isReservedBy(String txId) {
        return reservedBy != null && reservedBy.equals(txId);
    }

    Account withReservation(String txId, long amount) {
        return new Account(accountNo, name, balance, amount, txId, version + 1);
    }

    Account withoutReservation() {
        return new Account(accountNo, name, balance, 0L, null, version + 1);
    }

    Account debitReservation() {
        return new Account(accountNo, name, balance - reserved, 0L, null, version + 1);
    }

    Account credit(long amount) {
        return new Account(accountNo, name, Math.addExact(balance, amount), reserved, reservedBy, version + 1);
    }

    Account debit(long amount) {
        return new Account(accountNo, name, balance - amount, reserved, reservedBy, version + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Account)) return false;
        Account other = (Account) o;
        return accountNo == other.accountNo && balance == other.balance && reserved == other.reserved
                && version == other.version && name.equals(other.name) && Objects.equals(reservedBy, other.reservedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountNo, name, balance, reserved, reservedBy, version);
    }

    @Override
    public String toString() {
        return "Account{" + accountNo + " bal=" + balance + " reserved=" + reserved
                + (reservedBy == null ? "" : " by=" + reservedBy) + " v=" + version + "}";
    }
}
