package com.pnode.pnode_analytics.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A storage node discovered through gossip. {@code pubkey} is the only stable identity;
 * every other field may change between discovery runs.
 * <p>
 * {@code ramUsed}, {@code ramTotal} and {@code cpuPercent} are filled in by stats enrichment
 * and stay {@code null} until a warm stats entry exists for the node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PNode {
    private String pubkey;
    private String address; // host:port as gossiped
    private String ip;
    private Integer port;
    private String version;
    private NodeStatus status;
    private Long lastSeenTimestamp; // epoch seconds
    private Long storageUsed;
    private Long storageCommitted;
    private Double storageUsagePercent;
    private Long uptime; // seconds
    private Boolean isPublic;
    private Integer rpcPort;

    private Long ramUsed;
    private Long ramTotal;
    private Double cpuPercent;

    @JsonIgnore
    public boolean isOnline() {
        return status == NodeStatus.ONLINE;
    }

    @JsonIgnore
    public boolean hasResourceStats() {
        return ramUsed != null && ramTotal != null;
    }
}
