package branchledger.client;

import branchledger.common.BranchException;
import branchledger.common.Types.Side;
import branchledger.rpc.BranchClient;
import branchledger.twopc.BranchAddress;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.TextFormat;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Scanner;

/**
 * Command-line client for one branch.
 * <pre>
 *   BranchCli localhost:50051 balance account_no=1001
 *   BranchCli localhost:50051 inter_branch_transfer src_account=1001 dst_host=localhost dst_port=50052 dst_account=1002 amount=500
 *   BranchCli localhost:50051            (interactive, one operation per line)
 * </pre>
 */
public class BranchCli {

    private static final long RPC_TIMEOUT = Long.getLong("twoPcRpcTimeoutMs", 1200L);
    private static final long CLIENT_TIMEOUT = Long.getLong("clientTimeoutMs", 60000L);

    private final BranchClient client;
    private final PrintStream out;

    public BranchCli(BranchClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("usage: BranchCli <host:port> [operation key=value ...]");
            System.exit(64);
            return;
        }
        int rc;
        try (BranchClient client = connect(args[0])) {
            BranchCli cli = new BranchCli(client, System.out);
            if (args.length == 1) {
                cli.interactive(new Scanner(System.in));
                rc = 0;
            } else {
                rc = cli.run(Arrays.copyOfRange(args, 1, args.length));
            }
        }
        System.exit(rc);
    }

    /** Plain calls use {@code twoPcRpcTimeoutMs}; calls that run a whole 2PC round use {@code clientTimeoutMs}. */
    static BranchClient connect(String hostPort) {
        return BranchClient.connect(BranchAddress.parse(hostPort), RPC_TIMEOUT, CLIENT_TIMEOUT);
    }

    void interactive(Scanner in) {
        out.println("connected to " + client.getAddress() + "; type 'help' or 'quit'");
        while (true) {
            out.print("> ");
            if (!in.hasNextLine()) {
                return;
            }
            String line = in.nextLine().trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equals("quit") || line.equals("exit")) {
                return;
            }
            run(line.split("\\s+"));
        }
    }

    /** Runs one operation and prints its result; returns a process exit code. */
    public int run(String[] words) {
        String op = words[0].toLowerCase(Locale.ROOT);
        try {
            Map<String, String> kv = parseArgs(words);
            MessageOrBuilder result;
            switch (op) {
                case "balance":
                    result = client.balance(num(kv, "account_no"));
                    break;
                case "deposit":
                    result = client.deposit(num(kv, "account_no"), num(kv, "amount"));
                    break;
                case "withdraw":
                    result = client.withdraw(num(kv, "account_no"), num(kv, "amount"));
                    break;
                case "transfer_local":
                    result = client.transferLocal(num(kv, "src_account"), num(kv, "dst_account"), num(kv, "amount"));
                    break;
                case "prepare":
                    result = client.prepare(str(kv, "tx_id"), num(kv, "account_no"), num(kv, "amount"),
                            Side.valueOf(str(kv, "side").toUpperCase(Locale.ROOT)));
                    break;
                case "commit":
                    out.println("committed: " + client.commit(str(kv, "tx_id")));
                    return 0;
                case "abort":
                    out.println("aborted: " + client.abort(str(kv, "tx_id")));
                    return 0;
                case "inter_branch_transfer":
                    result = client.interBranchTransfer(kv.getOrDefault("tx_id", ""), num(kv, "src_account"),
                            new BranchAddress(str(kv, "dst_host"), intNum(kv, "dst_port")),
                            num(kv, "dst_account"), num(kv, "amount"));
                    break;
                case "list_accounts":
                    result = client.listAccounts();
                    break;
                case "create_account":
                    result = client.createAccount(num(kv, "account_no"), kv.getOrDefault("name", ""),
                            kv.containsKey("initial_balance") ? num(kv, "initial_balance") : 0L);
                    break;
                case "operation_log":
                    result = client.operationLog(kv.containsKey("after_seq") ? num(kv, "after_seq") : 0L,
                            kv.containsKey("limit") ? intNum(kv, "limit") : 100);
                    break;
                case "list_unresolved":
                    result = client.listUnresolved();
                    break;
                case "reconcile":
                    result = client.reconcile(str(kv, "tx_id"));
                    break;
                case "help":
                    printHelp();
                    return 0;
                default:
                    out.println("unknown operation '" + op + "'; try 'help'");
                    return 64;
            }
            out.print(TextFormat.printer().printToString(result));
            return 0;
        } catch (BranchException e) {
            out.println("ERROR " + e.getKind() + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            out.println("bad arguments: " + e.getMessage());
            return 64;
        }
    }

    private void printHelp() {
        out.println("operations:");
        out.println("  balance account_no=N");
        out.println("  deposit|withdraw account_no=N amount=A");
        out.println("  transfer_local src_account=N dst_account=M amount=A");
        out.println("  inter_branch_transfer [tx_id=T] src_account=N dst_host=H dst_port=P dst_account=M amount=A");
        out.println("  prepare tx_id=T account_no=N amount=A side=debit|credit");
        out.println("  commit|abort|reconcile tx_id=T");
        out.println("  list_accounts | list_unresolved");
        out.println("  create_account account_no=N name=S [initial_balance=A]");
        out.println("  operation_log [after_seq=S] [limit=L]");
    }

    private static Map<String, String> parseArgs(String[] words) {
        Map<String, String> kv = new HashMap<>();
        for (int i = 1; i < words.length; i++) {
            int eq = words[i].indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("expected key=value, got '" + words[i] + "'");
            }
            kv.put(words[i].substring(0, eq), words[i].substring(eq + 1));
        }
        return kv;
    }

    private static String str(Map<String, String> kv, String key) {
        String v = kv.get(key);
        if (v == null || v.isEmpty()) {
            throw new IllegalArgumentException("missing " + key);
        }
        return v;
    }

    private static long num(Map<String, String> kv, String key) {
        return Long.parseLong(str(kv, key));
    }

    private static int intNum(Map<String, String> kv, String key) {
        long v = num(kv, key);
        try {
            return Math.toIntExact(v);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " out of range: " + v, e);
        }
    }
}
