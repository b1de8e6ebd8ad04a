package com.pnode.pnode_analytics.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeoSummary {
    private List<Count> countries;
    private List<Count> regions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Count {
        private String name;
        private int count;
    }
}
