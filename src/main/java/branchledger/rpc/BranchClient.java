package branchledger.rpc;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.common.Types.Side;
import branchledger.proto.BranchProto;
import branchledger.proto.BranchProto.BranchRequest;
import branchledger.proto.BranchProto.BranchResponse;
import branchledger.proto.BranchServiceGrpc;
import branchledger.twopc.BranchAddress;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.util.concurrent.TimeUnit;

/**
 * Blocking client for one branch. ERROR responses and gRPC failures both surface as
 * {@link BranchException}: DEADLINE_EXCEEDED is TIMEOUT, UNAVAILABLE is PEER_UNREACHABLE.
 */
public class BranchClient implements AutoCloseable {

    private final BranchAddress address;
    private final ManagedChannel channel;
    private final boolean ownsChannel;
    private final BranchServiceGrpc.BranchServiceBlockingStub stub;
    private final long rpcTimeoutMs;
    private final long transferTimeoutMs;

    public BranchClient(BranchAddress address, ManagedChannel channel, long rpcTimeoutMs, long transferTimeoutMs) {
        this(address, channel, false, rpcTimeoutMs, transferTimeoutMs);
    }

    private BranchClient(BranchAddress address, ManagedChannel channel, boolean ownsChannel,
                         long rpcTimeoutMs, long transferTimeoutMs) {
        this.address = address;
        this.channel = channel;
        this.ownsChannel = ownsChannel;
        this.stub = BranchServiceGrpc.newBlockingStub(channel);
        this.rpcTimeoutMs = rpcTimeoutMs;
        this.transferTimeoutMs = transferTimeoutMs;
    }

    /** A client with its own plaintext channel, closed with the client. */
    public static BranchClient connect(BranchAddress address, long rpcTimeoutMs, long transferTimeoutMs) {
        ManagedChannel ch = ManagedChannelBuilder.forAddress(address.getHost(), address.getPort()).usePlaintext().build();
        return new BranchClient(address, ch, true, rpcTimeoutMs, transferTimeoutMs);
    }

    public BranchAddress getAddress() {
        return address;
    }

    public long getRpcTimeoutMs() {
        return rpcTimeoutMs;
    }

    public long getTransferTimeoutMs() {
        return transferTimeoutMs;
    }

    public BranchResponse execute(BranchRequest req) {
        return call(req, rpcTimeoutMs);
    }

    public BranchProto.AccountSummary balance(long accountNo) {
        return call(BranchRequest.newBuilder()
                .setBalance(BranchProto.BalanceRequest.newBuilder().setAccountNo(accountNo)), rpcTimeoutMs)
                .getAccount();
    }

    public BranchProto.BalanceUpdate deposit(long accountNo, long amount) {
        return call(BranchRequest.newBuilder()
                .setDeposit(BranchProto.DepositRequest.newBuilder().setAccountNo(accountNo).setAmount(amount)), rpcTimeoutMs)
                .getBalanceUpdate();
    }

    public BranchProto.BalanceUpdate withdraw(long accountNo, long amount) {
        return call(BranchRequest.newBuilder()
                .setWithdraw(BranchProto.WithdrawRequest.newBuilder().setAccountNo(accountNo).setAmount(amount)), rpcTimeoutMs)
                .getBalanceUpdate();
    }

    public BranchProto.TransferLocalResult transferLocal(long src, long dst, long amount) {
        return call(BranchRequest.newBuilder()
                .setTransferLocal(BranchProto.TransferLocalRequest.newBuilder()
                        .setSrcAccount(src).setDstAccount(dst).setAmount(amount)), rpcTimeoutMs)
                .getTransferLocal();
    }

    public BranchProto.PrepareResult prepare(String txId, long accountNo, long amount, Side side) {
        return call(BranchRequest.newBuilder()
                .setPrepare(BranchProto.PrepareRequest.newBuilder()
                        .setTxId(txId).setAccountNo(accountNo).setAmount(amount).setSide(ProtoMapper.toProto(side))),
                rpcTimeoutMs)
                .getPrepare();
    }

    public boolean commit(String txId) {
        return call(BranchRequest.newBuilder()
                .setCommit(BranchProto.CommitRequest.newBuilder().setTxId(txId)), rpcTimeoutMs)
                .getCommit().getCommitted();
    }

    public boolean abort(String txId) {
        return call(BranchRequest.newBuilder()
                .setAbort(BranchProto.AbortRequest.newBuilder().setTxId(txId)), rpcTimeoutMs)
                .getAbort().getAborted();
    }

    /** Runs a whole 2PC round on this branch as coordinator, hence the long deadline. */
    public BranchProto.TransferOutcome interBranchTransfer(String txId, long src, BranchAddress dst, long dstAccount, long amount) {
        return call(BranchRequest.newBuilder()
                .setInterBranchTransfer(BranchProto.InterBranchTransferRequest.newBuilder()
                        .setTxId(txId == null ? "" : txId)
                        .setSrcAccount(src)
                        .setDstHost(dst.getHost())
                        .setDstPort(dst.getPort())
                        .setDstAccount(dstAccount)
                        .setAmount(amount)), transferTimeoutMs)
                .getTransfer();
    }

    public BranchProto.AccountList listAccounts() {
        return call(BranchRequest.newBuilder()
                .setListAccounts(BranchProto.ListAccountsRequest.getDefaultInstance()), rpcTimeoutMs)
                .getAccounts();
    }

    public BranchProto.AccountSummary createAccount(long accountNo, String name, long initialBalance) {
        return call(BranchRequest.newBuilder()
                .setCreateAccount(BranchProto.CreateAccountRequest.newBuilder()
                        .setAccountNo(accountNo).setName(name == null ? "" : name).setInitialBalance(initialBalance)),
                rpcTimeoutMs)
                .getAccount();
    }

    public BranchProto.OperationLog operationLog(long afterSeq, int limit) {
        return call(BranchRequest.newBuilder()
                .setOperationLog(BranchProto.OperationLogRequest.newBuilder().setAfterSeq(afterSeq).setLimit(limit)),
                rpcTimeoutMs)
                .getOperationLog();
    }

    public BranchProto.UnresolvedList listUnresolved() {
        return call(BranchRequest.newBuilder()
                .setListUnresolved(BranchProto.ListUnresolvedRequest.getDefaultInstance()), rpcTimeoutMs)
                .getUnresolved();
    }

    public BranchProto.TransferOutcome reconcile(String txId) {
        return call(BranchRequest.newBuilder()
                .setReconcile(BranchProto.ReconcileRequest.newBuilder().setTxId(txId)), transferTimeoutMs)
                .getTransfer();
    }

    private BranchResponse call(BranchRequest.Builder req, long timeoutMs) {
        return call(req.build(), timeoutMs);
    }

    private BranchResponse call(BranchRequest req, long timeoutMs) {
        BranchResponse resp;
        try {
            resp = stub.withDeadlineAfter(timeoutMs, TimeUnit.MILLISECONDS).execute(req);
        } catch (StatusRuntimeException e) {
            throw mapStatus(e);
        }
        if (resp.getStatus() != BranchProto.Status.STATUS_OK) {
            throw new BranchException(ProtoMapper.fromProto(resp.getErrorKind()), resp.getMessage());
        }
        return resp;
    }

    private BranchException mapStatus(StatusRuntimeException e) {
        Status.Code code = e.getStatus().getCode();
        switch (code) {
            case DEADLINE_EXCEEDED:
                return new BranchException(ErrorKind.TIMEOUT, "no answer from " + address + " in time", e);
            case UNAVAILABLE:
            case CANCELLED:
                return new BranchException(ErrorKind.PEER_UNREACHABLE, "branch " + address + " unreachable: "
                        + e.getStatus().getDescription(), e);
            default:
                return new BranchException(ErrorKind.INTERNAL, "call to " + address + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public void close() {
        if (!ownsChannel) {
            return;
        }
        channel.shutdown();
        try {
            if (!channel.awaitTermination(2, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
        }
    }
}
