package branchledger.node;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types.RecoveryPolicy;
import branchledger.common.Types.Side;
import branchledger.common.Types.TxState;
import branchledger.ledger.LedgerCorruptedException;
import branchledger.ledger.LedgerDatabase;
import branchledger.ledger.LedgerStore;
import branchledger.proto.BranchProto;
import branchledger.proto.BranchProto.BranchRequest;
import branchledger.rpc.BranchClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/** A branch on a file ledger, stopped and started again on the same directory. */
class BranchServerRestartTest {

    @TempDir
    Path dataDir;

    private BranchServer server;

    private BranchConfig config(RecoveryPolicy policy) {
        return BranchConfig.builder()
                .branchName("Mumbai")
                .port(0)
                .dataDir(dataDir)
                .persistDBOnDisk(true)
                .mmap(false)
                .preload(true)
                .recoveryPolicy(policy)
                .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private void prepareDebitAndStop(String txId, long amount) throws IOException {
        server = new BranchServer(config(RecoveryPolicy.ABORT)).start();
        try (BranchClient c = BranchClient.connect(server.getAddress(), 2000L, 10_000L)) {
            assertEquals(1000L, c.balance(1001L).getBalance(), "preloaded");
            assertTrue(c.prepare(txId, 1001L, amount, Side.DEBIT).getPrepared());
        }
        server.stop();
        server = null;
    }

    @Test
    @DisplayName("leftover prepared transactions are aborted on restart")
    void abortPolicyReleasesReservation() throws IOException {
        prepareDebitAndStop("tx-left", 400L);

        server = new BranchServer(config(RecoveryPolicy.ABORT)).start();
        assertEquals(TxState.ABORTED,
                server.getContext().getParticipant().find("tx-left").orElseThrow().getState());
        try (BranchClient c = BranchClient.connect(server.getAddress(), 2000L, 10_000L)) {
            assertEquals(0L, c.balance(1001L).getReserved());
            assertEquals(1000L, c.balance(1001L).getBalance());
            assertTrue(c.abort("tx-left"));
            BranchException e = assertThrows(BranchException.class, () -> c.commit("tx-left"));
            assertEquals(ErrorKind.PROTOCOL_VIOLATION, e.getKind());
            assertEquals(2, c.listAccounts().getAccountsCount(), "preload does not run twice");
        }
    }

    @Test
    @DisplayName("resume policy keeps the reservation for a later decision")
    void resumePolicyKeepsPrepared() throws IOException {
        prepareDebitAndStop("tx-keep", 400L);

        server = new BranchServer(config(RecoveryPolicy.RESUME)).start();
        try (BranchClient c = BranchClient.connect(server.getAddress(), 2000L, 10_000L)) {
            assertEquals(400L, c.balance(1001L).getReserved());
            assertTrue(c.commit("tx-keep"));
            assertEquals(600L, c.balance(1001L).getBalance());
        }
    }

    @Test
    @DisplayName("a destination host with a record separator is refused and the ledger still reopens")
    void separatorInDestinationHost() throws IOException {
        server = new BranchServer(config(RecoveryPolicy.ABORT)).start();
        try (BranchClient c = BranchClient.connect(server.getAddress(), 2000L, 10_000L)) {
            BranchRequest req = BranchRequest.newBuilder()
                    .setInterBranchTransfer(BranchProto.InterBranchTransferRequest.newBuilder()
                            .setTxId("tx-pipe").setSrcAccount(1001L).setDstHost("bad|host").setDstPort(50052)
                            .setDstAccount(1002L).setAmount(10L))
                    .build();
            BranchException e = assertThrows(BranchException.class, () -> c.execute(req));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
        }
        assertTrue(server.getContext().getCoordinator().find("tx-pipe").isEmpty());
        server.stop();

        server = new BranchServer(config(RecoveryPolicy.ABORT)).start();
        try (BranchClient c = BranchClient.connect(server.getAddress(), 2000L, 10_000L)) {
            assertEquals(1000L, c.balance(1001L).getBalance());
        }
    }

    @Test
    @DisplayName("an unreadable ledger refuses to start")
    void corruptedLedger() {
        BranchConfig cfg = config(RecoveryPolicy.ABORT);
        try (LedgerDatabase db = LedgerDatabase.open(cfg.databaseFile(), false)) {
            new LedgerStore(db).write(b -> b.putParticipant("tx-bad", "garbage"));
        }
        BranchServer broken = new BranchServer(cfg);
        assertThrows(LedgerCorruptedException.class, broken::start);

        // the failed start released the file, so a repaired ledger opens again
        try (LedgerDatabase db = LedgerDatabase.open(cfg.databaseFile(), false)) {
            assertNotNull(db.participantRecords().get("tx-bad"));
        }
    }
}
