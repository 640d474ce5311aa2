package branchledger.rpc;

import branchledger.twopc.BranchAddress;
import branchledger.twopc.ParticipantDirectory;
import branchledger.twopc.TwoPcParticipant;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/** One lazily built plaintext channel per peer branch, shared by all transfers to it. */
public class PeerChannels implements ParticipantDirectory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeerChannels.class);

    private final long rpcTimeoutMs;
    private final ConcurrentMap<BranchAddress, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final ConcurrentMap<BranchAddress, RemoteParticipant> participants = new ConcurrentHashMap<>();

    public PeerChannels(long rpcTimeoutMs) {
        this.rpcTimeoutMs = rpcTimeoutMs;
    }

    @Override
    public TwoPcParticipant participantAt(BranchAddress address) {
        return participants.computeIfAbsent(address, a -> new RemoteParticipant(
                new BranchClient(a, channel(a), rpcTimeoutMs, rpcTimeoutMs)));
    }

    private ManagedChannel channel(BranchAddress a) {
        return channels.computeIfAbsent(a, addr -> {
            log.debug("opening channel to {}", addr);
            return ManagedChannelBuilder.forAddress(addr.getHost(), addr.getPort()).usePlaintext().build();
        });
    }

    @Override
    public void close() {
        participants.clear();
        for (ManagedChannel ch : channels.values()) {
            ch.shutdownNow();
        }
        for (ManagedChannel ch : channels.values()) {
            try {
                ch.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        channels.clear();
    }
}
