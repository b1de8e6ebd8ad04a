package com.pnode.pnode_analytics.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class HealthResponse {
    private String status;
    private Instant timestamp;
    private String remoteCache; // "up" or "down"
}
