package branchledger.engine;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types.OperationKind;
import branchledger.ledger.Account;
import branchledger.ledger.LedgerDatabase;
import branchledger.ledger.LedgerStore;
import branchledger.ledger.OperationLogEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransactionEngineTest {

    private LedgerDatabase db;
    private TransactionEngine engine;

    @BeforeEach
    void setUp() {
        db = LedgerDatabase.inMemory();
        engine = new TransactionEngine(new LedgerStore(db));
        engine.createAccount(1001L, "User_Mumbai_1", 1000L);
        engine.createAccount(1002L, "User_Mumbai_2", 300L);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    @DisplayName("deposit 200 on 1000 gives 1200")
    void depositAddsToBalance() {
        assertEquals(1200L, engine.deposit(1001L, 200L).getBalance());
        assertEquals(1200L, engine.balance(1001L).getBalance());
    }

    @Test
    @DisplayName("withdraw 1500 on 1000 is rejected and leaves the balance")
    void overdraftIsRejected() {
        BranchException e = assertThrows(BranchException.class, () -> engine.withdraw(1001L, 1500L));
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        assertEquals(1000L, engine.balance(1001L).getBalance());
        assertTrue(engine.operationLog(0L, 100).stream().noneMatch(en -> en.getKind() == OperationKind.WITHDRAW));
    }

    @Test
    void localTransferMovesBothBalances() {
        Account[] after = engine.transferLocal(1001L, 1002L, 250L);
        assertEquals(750L, after[0].getBalance());
        assertEquals(550L, after[1].getBalance());
        OperationLogEntry last = engine.operationLog(0L, 100).get(2);
        assertEquals(OperationKind.TRANSFER_LOCAL, last.getKind());
        assertEquals(1001L, last.getAccountNo());
        assertEquals(1002L, last.getCounterpartyAccount());
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void nonPositiveAmounts() {
            assertEquals(ErrorKind.INVALID_ARGUMENT,
                    assertThrows(BranchException.class, () -> engine.deposit(1001L, 0L)).getKind());
            assertEquals(ErrorKind.INVALID_ARGUMENT,
                    assertThrows(BranchException.class, () -> engine.withdraw(1001L, -5L)).getKind());
            assertEquals(ErrorKind.INVALID_ARGUMENT,
                    assertThrows(BranchException.class, () -> engine.transferLocal(1001L, 1002L, 0L)).getKind());
        }

        @Test
        void transferToSelf() {
            BranchException e = assertThrows(BranchException.class, () -> engine.transferLocal(1001L, 1001L, 5L));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
        }

        @Test
        void unknownAccount() {
            assertEquals(ErrorKind.NOT_FOUND,
                    assertThrows(BranchException.class, () -> engine.deposit(77L, 5L)).getKind());
            assertEquals(ErrorKind.NOT_FOUND,
                    assertThrows(BranchException.class, () -> engine.transferLocal(1001L, 77L, 5L)).getKind());
            assertEquals(1000L, engine.balance(1001L).getBalance());
        }

        @Test
        void invalidAccountNumberOnCreate() {
            assertEquals(ErrorKind.INVALID_ARGUMENT,
                    assertThrows(BranchException.class, () -> engine.createAccount(0L, "x", 0L)).getKind());
        }
    }

    @Test
    @DisplayName("replaying the op-log reproduces every balance")
    void logReplayMatchesBalances() {
        engine.deposit(1001L, 200L);
        engine.withdraw(1002L, 100L);
        engine.transferLocal(1001L, 1002L, 700L);
        assertThrows(BranchException.class, () -> engine.withdraw(1001L, 10_000L));
        engine.deposit(1002L, 1L);

        Map<Long, Long> replayed = new HashMap<>();
        for (OperationLogEntry e : engine.operationLog(0L, 1000)) {
            switch (e.getKind()) {
                case ACCOUNT_CREATED:
                case DEPOSIT:
                    replayed.merge(e.getAccountNo(), e.getAmount(), Long::sum);
                    break;
                case WITHDRAW:
                    replayed.merge(e.getAccountNo(), -e.getAmount(), Long::sum);
                    break;
                case TRANSFER_LOCAL:
                    replayed.merge(e.getAccountNo(), -e.getAmount(), Long::sum);
                    replayed.merge(e.getCounterpartyAccount(), e.getAmount(), Long::sum);
                    break;
                default:
                    fail("unexpected entry " + e);
            }
        }
        for (Account a : engine.listAccounts()) {
            assertEquals(a.getBalance(), replayed.get(a.getAccountNo()), "account " + a.getAccountNo());
        }
    }

    @Test
    void operationLogPages() {
        for (int i = 0; i < 5; i++) {
            engine.deposit(1001L, 1L);
        }
        List<OperationLogEntry> first = engine.operationLog(0L, 3);
        assertEquals(3, first.size());
        assertEquals(1L, first.get(0).getSeq());
        List<OperationLogEntry> rest = engine.operationLog(first.get(2).getSeq(), 0);
        assertEquals(4, rest.size());
        assertEquals(4L, rest.get(0).getSeq());
    }

    @Test
    void preloadOnlySeedsEmptyLedger() {
        engine.preload("Mumbai");
        assertEquals(2, engine.listAccounts().size());
        assertEquals(1000L, engine.balance(1001L).getBalance());

        try (LedgerDatabase fresh = LedgerDatabase.inMemory()) {
            TransactionEngine other = new TransactionEngine(new LedgerStore(fresh));
            other.preload("Delhi");
            List<Account> seeded = other.listAccounts();
            assertEquals(2, seeded.size());
            assertEquals("User_Delhi_1", seeded.get(0).getName());
            assertEquals(1002L, seeded.get(1).getAccountNo());
            assertEquals(1000L, seeded.get(1).getBalance());
        }
    }
}
