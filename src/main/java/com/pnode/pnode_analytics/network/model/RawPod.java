package com.pnode.pnode_analytics.network.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One pod record as gossiped by pRPC. Any field may be missing or malformed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RawPod {
    private String pubkey;
    private String address;
    private String version;
    private Long lastSeenTimestamp;
    private Boolean isPublic;
    private Integer rpcPort;
    private Long storageCommitted;
    private Long storageUsed;
    private Double storageUsagePercent;
    private Long uptime;
}
