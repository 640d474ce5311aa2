package branchledger.rpc;

import branchledger.common.BranchException;
import branchledger.common.ErrorKind;
import branchledger.engine.TransactionEngine;
import branchledger.ledger.Account;
import branchledger.ledger.OperationLogEntry;
import branchledger.node.BranchContext;
import branchledger.proto.BranchProto;
import branchledger.proto.BranchProto.BranchRequest;
import branchledger.proto.BranchProto.BranchResponse;
import branchledger.proto.BranchServiceGrpc;
import branchledger.twopc.BranchAddress;
import branchledger.twopc.CoordinatorRecord;
import branchledger.twopc.TransferRequest;
import branchledger.twopc.TransferResult;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The branch listener. Every operation arrives as one variant of {@code BranchRequest.operation}
 * and is answered with OK or ERROR plus an {@link ErrorKind}; nothing escapes as a gRPC status.
 */
public class BranchGrpcService extends BranchServiceGrpc.BranchServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(BranchGrpcService.class);

    private final BranchContext ctx;

    public BranchGrpcService(BranchContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void execute(BranchRequest req, StreamObserver<BranchResponse> resp) {
        resp.onNext(handle(req));
        resp.onCompleted();
    }

    BranchResponse handle(BranchRequest req) {
        try {
            return dispatch(req);
        } catch (BranchException e) {
            log.debug("[{}] {} -> {} {}", ctx.getBranchName(), req.getOperationCase(), e.getKind(), e.getMessage());
            return ProtoMapper.error(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] {} failed", ctx.getBranchName(), req.getOperationCase(), e);
            return ProtoMapper.error(ErrorKind.INTERNAL, e.toString());
        }
    }

    private BranchResponse dispatch(BranchRequest req) {
        TransactionEngine engine = ctx.getEngine();
        switch (req.getOperationCase()) {
            case BALANCE:
                return ProtoMapper.ok()
                        .setAccount(ProtoMapper.toProto(engine.balance(req.getBalance().getAccountNo())))
                        .build();
            case DEPOSIT: {
                BranchProto.DepositRequest r = req.getDeposit();
                return ProtoMapper.ok()
                        .setBalanceUpdate(ProtoMapper.balanceUpdate(engine.deposit(r.getAccountNo(), r.getAmount())))
                        .build();
            }
            case WITHDRAW: {
                BranchProto.WithdrawRequest r = req.getWithdraw();
                return ProtoMapper.ok()
                        .setBalanceUpdate(ProtoMapper.balanceUpdate(engine.withdraw(r.getAccountNo(), r.getAmount())))
                        .build();
            }
            case TRANSFER_LOCAL: {
                BranchProto.TransferLocalRequest r = req.getTransferLocal();
                Account[] after = engine.transferLocal(r.getSrcAccount(), r.getDstAccount(), r.getAmount());
                return ProtoMapper.ok()
                        .setTransferLocal(BranchProto.TransferLocalResult.newBuilder()
                                .setSrc(ProtoMapper.balanceUpdate(after[0]))
                                .setDst(ProtoMapper.balanceUpdate(after[1])))
                        .build();
            }
            case PREPARE: {
                BranchProto.PrepareRequest r = req.getPrepare();
                return ProtoMapper.ok()
                        .setPrepare(ProtoMapper.toProto(ctx.getParticipant().prepare(
                                r.getTxId(), r.getAccountNo(), r.getAmount(), ProtoMapper.fromProto(r.getSide()))))
                        .build();
            }
            case COMMIT:
                return ProtoMapper.ok()
                        .setCommit(BranchProto.CommitResult.newBuilder()
                                .setCommitted(ctx.getParticipant().commit(req.getCommit().getTxId())))
                        .build();
            case ABORT:
                return ProtoMapper.ok()
                        .setAbort(BranchProto.AbortResult.newBuilder()
                                .setAborted(ctx.getParticipant().abort(req.getAbort().getTxId())))
                        .build();
            case INTER_BRANCH_TRANSFER:
                return ProtoMapper.ok()
                        .setTransfer(ProtoMapper.toProto(interBranchTransfer(req.getInterBranchTransfer())))
                        .build();
            case LIST_ACCOUNTS: {
                BranchProto.AccountList.Builder list = BranchProto.AccountList.newBuilder();
                for (Account a : engine.listAccounts()) {
                    list.addAccounts(ProtoMapper.toProto(a));
                }
                return ProtoMapper.ok().setAccounts(list).build();
            }
            case CREATE_ACCOUNT: {
                BranchProto.CreateAccountRequest r = req.getCreateAccount();
                return ProtoMapper.ok()
                        .setAccount(ProtoMapper.toProto(
                                engine.createAccount(r.getAccountNo(), r.getName(), r.getInitialBalance())))
                        .build();
            }
            case OPERATION_LOG: {
                BranchProto.OperationLogRequest r = req.getOperationLog();
                BranchProto.OperationLog.Builder page = BranchProto.OperationLog.newBuilder();
                for (OperationLogEntry e : engine.operationLog(r.getAfterSeq(), r.getLimit())) {
                    page.addEntries(ProtoMapper.toProto(e));
                }
                return ProtoMapper.ok().setOperationLog(page).build();
            }
            case LIST_UNRESOLVED: {
                BranchProto.UnresolvedList.Builder list = BranchProto.UnresolvedList.newBuilder();
                for (CoordinatorRecord r : ctx.getCoordinator().listUnresolved()) {
                    list.addTransactions(ProtoMapper.toProto(r));
                }
                return ProtoMapper.ok().setUnresolved(list).build();
            }
            case RECONCILE:
                return ProtoMapper.ok()
                        .setTransfer(ProtoMapper.toProto(ctx.getCoordinator().reconcile(req.getReconcile().getTxId())))
                        .build();
            case OPERATION_NOT_SET:
                throw new BranchException(ErrorKind.PROTOCOL_VIOLATION, "request carries no operation");
            default:
                throw new BranchException(ErrorKind.PROTOCOL_VIOLATION, "unsupported operation " + req.getOperationCase());
        }
    }

    private TransferResult interBranchTransfer(BranchProto.InterBranchTransferRequest r) {
        BranchAddress dst;
        try {
            dst = new BranchAddress(r.getDstHost(), r.getDstPort());
        } catch (IllegalArgumentException e) {
            throw new BranchException(ErrorKind.INVALID_ARGUMENT, e.getMessage());
        }
        TransferResult result = ctx.getCoordinator().transfer(
                new TransferRequest(r.getTxId(), r.getSrcAccount(), dst, r.getDstAccount(), r.getAmount()));
        log.info("[{}] inter_branch_transfer {} -> {}/{} amt={}: {}",
                ctx.getBranchName(), r.getSrcAccount(), dst, r.getDstAccount(), r.getAmount(), result);
        return result;
    }
}
