package branchledger.ledger;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types.OperationKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LedgerStoreTest {

    private LedgerDatabase db;
    private LedgerStore store;

    @BeforeEach
    void setUp() {
        db = LedgerDatabase.inMemory();
        store = new LedgerStore(db);
        store.create(1001L, "alice", 1000L, null);
        store.create(1002L, "bob", 300L, null);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("accounts")
    class Accounts {

        @Test
        void createAndList() {
            List<Account> all = store.list();
            assertEquals(2, all.size());
            assertEquals(1001L, all.get(0).getAccountNo());
            assertEquals("bob", all.get(1).getName());
            assertEquals(1L, all.get(0).getVersion());
        }

        @Test
        void duplicateCreateIsRejected() {
            BranchException e = assertThrows(BranchException.class, () -> store.create(1001L, "again", 5L, null));
            assertEquals(ErrorKind.ALREADY_EXISTS, e.getKind());
            assertEquals(1000L, store.get(1001L).getBalance());
        }

        @Test
        void unknownAccountIsNotFound() {
            BranchException e = assertThrows(BranchException.class, () -> store.get(42L));
            assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        }
    }

    @Nested
    @DisplayName("reservations")
    class Reservations {

        @Test
        void reserveHoldsFundsAndBumpsVersion() {
            assertEquals(ReserveResult.OK, store.reserve(1001L, 400L, "tx-1", null));
            Account a = store.get(1001L);
            assertEquals(1000L, a.getBalance());
            assertEquals(400L, a.getReserved());
            assertEquals(600L, a.available());
            assertEquals("tx-1", a.getReservedBy());
            assertEquals(2L, a.getVersion());
        }

        @Test
        void reserveOutcomes() {
            assertEquals(ReserveResult.NOT_FOUND, store.reserve(9L, 1L, "tx-1", null));
            assertEquals(ReserveResult.INSUFFICIENT_FUNDS, store.reserve(1002L, 301L, "tx-1", null));
            assertEquals(ReserveResult.OK, store.reserve(1001L, 100L, "tx-1", null));
            assertEquals(ReserveResult.OK, store.reserve(1001L, 100L, "tx-1", null), "same tx is a no-op");
            assertEquals(ReserveResult.ALREADY_RESERVED, store.reserve(1001L, 1L, "tx-2", null));
            assertEquals(100L, store.get(1001L).getReserved());
        }

        @Test
        void releaseByAnotherTxConflicts() {
            store.reserve(1001L, 100L, "tx-1", null);
            BranchException e = assertThrows(BranchException.class, () -> store.release(1001L, "tx-2", null));
            assertEquals(ErrorKind.TX_CONFLICT, e.getKind());
            assertEquals(0L, store.release(1001L, "tx-1", null).getReserved());
        }

        @Test
        void releaseWithoutReservationIsNoop() {
            Account before = store.get(1001L);
            Account after = store.release(1001L, "tx-9", null);
            assertEquals(before, after);
        }

        @Test
        void debitRequiresMatchingReservation() {
            BranchException e = assertThrows(BranchException.class, () -> store.applyDebit(1001L, 100L, "tx-1", null));
            assertEquals(ErrorKind.PROTOCOL_VIOLATION, e.getKind());

            store.reserve(1001L, 100L, "tx-1", null);
            e = assertThrows(BranchException.class, () -> store.applyDebit(1001L, 50L, "tx-1", null));
            assertEquals(ErrorKind.PROTOCOL_VIOLATION, e.getKind());

            Account debited = store.applyDebit(1001L, 100L, "tx-1", null);
            assertEquals(900L, debited.getBalance());
            assertEquals(0L, debited.getReserved());
            assertNull(debited.getReservedBy());
        }

        @Test
        void creditThatWouldOverflowIsRejected() {
            long near = Long.MAX_VALUE - 300L + 1L;
            BranchException e = assertThrows(BranchException.class,
                    () -> store.applyCredit(1002L, near, "tx-big", null));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
            assertEquals(300L, store.get(1002L).getBalance());

            store.create(1003L, "rich", Long.MAX_VALUE - 5L, null);
            e = assertThrows(BranchException.class, () -> store.transferLocal(1003L, 1002L, Long.MAX_VALUE - 5L, null));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
            assertEquals(Long.MAX_VALUE - 5L, store.get(1003L).getBalance());
            assertEquals(300L, store.get(1002L).getBalance());

            assertEquals(Long.MAX_VALUE, store.applyCredit(1002L, Long.MAX_VALUE - 300L, "tx-fit", null).getBalance());
        }

        @Test
        void withdrawCannotTouchReservedFunds() {
            store.reserve(1001L, 600L, "tx-1", null);
            BranchException e = assertThrows(BranchException.class, () -> store.withdrawAvailable(1001L, 500L, null));
            assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
            assertEquals(600L, store.withdrawAvailable(1001L, 400L, null).getBalance());
        }
    }

    @Nested
    @DisplayName("durability")
    class Durability {

        @Test
        void failedCommitLeavesBalanceUntouched() {
            // a log entry without kind cannot be encoded, so the MapDB transaction is rolled back
            BranchException e = assertThrows(BranchException.class, () -> store.applyCredit(1001L, 50L, null,
                    b -> b.appendLog(null, 1001L, 50L, 0L, null)));
            assertEquals(ErrorKind.STORAGE_FAILURE, e.getKind());
            assertEquals(1000L, store.get(1001L).getBalance());
            assertEquals(1000L, new LedgerStore(db).get(1001L).getBalance());
            assertEquals(0L, db.lastLogSeq());
        }

        @Test
        void hookEntriesShareTheCommit() {
            store.applyCredit(1002L, 25L, null, b -> b.appendLog(OperationKind.DEPOSIT, 1002L, 25L, 0L, null));
            List<OperationLogEntry> log = db.readLog(0L, 10);
            assertEquals(1, log.size());
            assertEquals(OperationKind.DEPOSIT, log.get(0).getKind());
            assertEquals(1L, log.get(0).getSeq());
            assertEquals(325L, store.get(1002L).getBalance());
        }

        @Test
        void fileLedgerSurvivesReopen(@TempDir Path dir) {
            Path file = dir.resolve("branch-test.db");
            try (LedgerDatabase fileDb = LedgerDatabase.open(file, false)) {
                LedgerStore s = new LedgerStore(fileDb);
                s.create(7L, "carol", 500L, b -> b.appendLog(OperationKind.ACCOUNT_CREATED, 7L, 500L, 0L, null));
                s.reserve(7L, 200L, "tx-7", null);
            }
            try (LedgerDatabase fileDb = LedgerDatabase.open(file, false)) {
                Account a = new LedgerStore(fileDb).get(7L);
                assertEquals(500L, a.getBalance());
                assertEquals(200L, a.getReserved());
                assertEquals("tx-7", a.getReservedBy());
                assertEquals("carol", a.getName());
                assertEquals(1L, fileDb.lastLogSeq());
            }
        }

        @Test
        void corruptedRowRefusesToLoad() {
            db.putRawAccount(1003L, "not|a|row");
            assertThrows(LedgerCorruptedException.class, () -> new LedgerStore(db));
        }

        @Test
        void rowBreakingInvariantsRefusesToLoad() {
            db.putRawAccount(1003L, "100|200||1|x");
            assertThrows(LedgerCorruptedException.class, () -> new LedgerStore(db));
        }
    }

    @Test
    @DisplayName("concurrent withdrawals serialize and never overdraw")
    void concurrentWithdrawals() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(pool.submit(() -> {
                go.await();
                try {
                    store.withdrawAvailable(1001L, 200L, null);
                    return true;
                } catch (BranchException e) {
                    assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
                    return false;
                }
            }));
        }
        go.countDown();
        int ok = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) ok++;
        }
        pool.shutdownNow();
        assertEquals(5, ok);
        assertEquals(0L, store.get(1001L).getBalance());
        assertEquals(6L, store.get(1001L).getVersion(), "one version bump per successful withdrawal");
    }
}
