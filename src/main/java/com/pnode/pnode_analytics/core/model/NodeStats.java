package com.pnode.pnode_analytics.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resource statistics reported by a single pNode through {@code get-stats}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeStats {
    private Double cpuPercent;
    private Long ramUsed;
    private Long ramTotal;
    private Long uptime;
    private Long packetsReceived;
    private Long packetsSent;
    private Integer activeStreams;
    private Long fileSize;
    private Long totalBytes;
    private Long totalPages;
    private Long currentIndex;
    private Long lastUpdated;
}
