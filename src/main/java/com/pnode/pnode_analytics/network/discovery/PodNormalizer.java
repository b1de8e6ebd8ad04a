package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.core.model.PNode;
import com.pnode.pnode_analytics.network.model.RawPod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns a gossiped pod record into a {@link PNode}. Records without a pubkey yield
 * {@link Optional#empty()}; nothing here throws.
 */
public class PodNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PodNormalizer.class);

    private final NodeStatusResolver statusResolver;

    public PodNormalizer(NodeStatusResolver statusResolver) {
        this.statusResolver = statusResolver;
    }

    public Optional<PNode> normalize(RawPod pod) {
        if (pod == null) {
            return Optional.empty();
        }
        String pubkey = pod.getPubkey() == null ? null : pod.getPubkey().trim();
        if (pubkey == null || pubkey.isEmpty()) {
            log.debug("Dropping pod without pubkey (address={})", pod.getAddress());
            return Optional.empty();
        }

        String address = pod.getAddress() == null ? null : pod.getAddress().trim();
        HostPort hostPort = HostPort.parse(address);

        return Optional.of(PNode.builder()
                .pubkey(pubkey)
                .address(address)
                .ip(hostPort.host())
                .port(hostPort.port())
                .version(pod.getVersion())
                .lastSeenTimestamp(pod.getLastSeenTimestamp())
                .status(statusResolver.resolve(pod.getLastSeenTimestamp()))
                .storageUsed(nonNegative(pod.getStorageUsed()))
                .storageCommitted(nonNegative(pod.getStorageCommitted()))
                .storageUsagePercent(pod.getStorageUsagePercent())
                .uptime(nonNegative(pod.getUptime()))
                .isPublic(pod.getIsPublic())
                .rpcPort(pod.getRpcPort())
                .build());
    }

    private static Long nonNegative(Long value) {
        return value == null || value < 0 ? null : value;
    }
}
