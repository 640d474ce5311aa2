package branchledger.rpc;

import branchledger.common.ErrorKind;
import branchledger.common.Types.Outcome;
import branchledger.common.Types.Side;
import branchledger.ledger.Account;
import branchledger.ledger.OperationLogEntry;
import branchledger.proto.BranchProto;
import branchledger.proto.BranchProto.BranchResponse;
import branchledger.twopc.CoordinatorRecord;
import branchledger.twopc.TransferResult;
import branchledger.twopc.Vote;

/** Conversions between ledger/2PC types and their wire messages. */
public final class ProtoMapper {

    private ProtoMapper() {}

    public static BranchProto.ErrorKind toProto(ErrorKind kind) {
        return BranchProto.ErrorKind.valueOf(kind.name());
    }

    public static ErrorKind fromProto(BranchProto.ErrorKind kind) {
        switch (kind) {
            case ERROR_KIND_UNSPECIFIED:
            case UNRECOGNIZED:
                return ErrorKind.INTERNAL;
            default:
                return ErrorKind.valueOf(kind.name());
        }
    }

    public static BranchProto.Side toProto(Side side) {
        return side == Side.DEBIT ? BranchProto.Side.SIDE_DEBIT : BranchProto.Side.SIDE_CREDIT;
    }

    /** Null for an unset side; the participant refuses it. */
    public static Side fromProto(BranchProto.Side side) {
        switch (side) {
            case SIDE_DEBIT:
                return Side.DEBIT;
            case SIDE_CREDIT:
                return Side.CREDIT;
            default:
                return null;
        }
    }

    public static BranchProto.Outcome toProto(Outcome outcome) {
        return BranchProto.Outcome.valueOf("OUTCOME_" + outcome.name());
    }

    public static BranchProto.AccountSummary toProto(Account a) {
        return BranchProto.AccountSummary.newBuilder()
                .setAccountNo(a.getAccountNo())
                .setName(a.getName())
                .setBalance(a.getBalance())
                .setReserved(a.getReserved())
                .setVersion(a.getVersion())
                .build();
    }

    public static BranchProto.BalanceUpdate balanceUpdate(Account a) {
        return BranchProto.BalanceUpdate.newBuilder()
                .setAccountNo(a.getAccountNo())
                .setNewBalance(a.getBalance())
                .build();
    }

    public static BranchProto.LogEntry toProto(OperationLogEntry e) {
        return BranchProto.LogEntry.newBuilder()
                .setSeq(e.getSeq())
                .setTimestampMillis(e.getTimestampMillis())
                .setKind(BranchProto.OperationKind.valueOf("OP_" + e.getKind().name()))
                .setAccountNo(e.getAccountNo())
                .setAmount(e.getAmount())
                .setCounterpartyAccount(e.getCounterpartyAccount())
                .setTxId(e.getTxId() == null ? "" : e.getTxId())
                .build();
    }

    public static BranchProto.PrepareResult toProto(Vote v) {
        BranchProto.PrepareResult.Builder b = BranchProto.PrepareResult.newBuilder()
                .setPrepared(v.isPrepared())
                .setReason(v.getReason());
        if (v.getReasonKind() != null) {
            b.setReasonKind(toProto(v.getReasonKind()));
        }
        return b.build();
    }

    public static Vote fromProto(BranchProto.PrepareResult r) {
        return r.getPrepared() ? Vote.yes() : Vote.no(fromProto(r.getReasonKind()), r.getReason());
    }

    public static BranchProto.TransferOutcome toProto(TransferResult r) {
        return BranchProto.TransferOutcome.newBuilder()
                .setOutcome(toProto(r.getOutcome()))
                .setTxId(r.getTxId())
                .setReason(r.getReason())
                .build();
    }

    public static BranchProto.UnresolvedTransaction toProto(CoordinatorRecord r) {
        return BranchProto.UnresolvedTransaction.newBuilder()
                .setTxId(r.getTxId())
                .setSrcAccount(r.getSrcAccount())
                .setDstHost(r.getDestination().getHost())
                .setDstPort(r.getDestination().getPort())
                .setDstAccount(r.getDstAccount())
                .setAmount(r.getAmount())
                .setDecision(r.getDecision().name())
                .setReason(r.getReason())
                .build();
    }

    public static BranchResponse.Builder ok() {
        return BranchResponse.newBuilder().setStatus(BranchProto.Status.STATUS_OK);
    }

    public static BranchResponse error(ErrorKind kind, String message) {
        return BranchResponse.newBuilder()
                .setStatus(BranchProto.Status.STATUS_ERROR)
                .setErrorKind(toProto(kind))
                .setMessage(message == null ? "" : message)
                .build();
    }
}
