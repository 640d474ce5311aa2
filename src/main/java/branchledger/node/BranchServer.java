package branchledger.node;

import branchledger.ledger.LedgerCorruptedException;
import branchledger.rpc.BranchGrpcService;
import branchledger.twopc.BranchAddress;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/** One branch process: context plus gRPC listener. Port 0 binds an ephemeral port. */
public class BranchServer {

    private static final Logger log = LoggerFactory.getLogger(BranchServer.class);

    private final BranchConfig config;
    private volatile BranchAddress address;
    private BranchContext context;
    private Server grpcServer;

    public BranchServer(BranchConfig config) {
        this.config = config;
    }

    public synchronized BranchServer start() throws IOException {
        if (grpcServer != null) {
            throw new IllegalStateException("already started");
        }
        context = BranchContext.open(config, () -> address);
        try {
            grpcServer = ServerBuilder.forPort(config.getPort())
                    .addService(new BranchGrpcService(context))
                    .build()
                    .start();
        } catch (IOException | RuntimeException e) {
            context.close();
            context = null;
            throw e;
        }
        address = new BranchAddress(config.getHost(), grpcServer.getPort());
        log.info("Branch {} up @ {} ({})", config.getBranchName(), address, config);
        return this;
    }

    public int getPort() {
        return grpcServer.getPort();
    }

    public BranchAddress getAddress() {
        return address;
    }

    public BranchContext getContext() {
        return context;
    }

    public synchronized void stop() {
        if (grpcServer != null) {
            grpcServer.shutdown();
            try {
                if (!grpcServer.awaitTermination(3, TimeUnit.SECONDS)) {
                    grpcServer.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                grpcServer.shutdownNow();
            }
            grpcServer = null;
        }
        if (context != null) {
            context.close();
            context = null;
        }
        log.info("Branch {} stopped", config.getBranchName());
    }

    public void blockUntilShutdown() throws InterruptedException {
        Server s = grpcServer;
        if (s != null) s.awaitTermination();
    }

    public static void main(String[] args) throws Exception {
        BranchConfig cfg = BranchConfig.fromSystemProperties();
        BranchServer server = new BranchServer(cfg);
        try {
            server.start();
        } catch (LedgerCorruptedException e) {
            log.error("Branch {} refuses to start: {}", cfg.getBranchName(), e.getMessage(), e);
            System.exit(2);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown-" + cfg.getBranchName()));
        server.blockUntilShutdown();
    }
}
