package com.pnode.pnode_analytics.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapNode {
    private String pubkey;
    private double lat;
    private double lng;
    private String country;
    private String region;
    private NodeStatus status;
    private int healthScore;
    private double uptime24h;
    private double storageUtilization;
    private String version;
    private Long lastSeenTimestamp;
}
