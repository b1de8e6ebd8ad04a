package com.pnode.pnode_analytics.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionCount {
    private String version;
    private int count;
    private double percentage;
}
