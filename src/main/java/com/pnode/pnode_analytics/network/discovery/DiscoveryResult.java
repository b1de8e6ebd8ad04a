package com.pnode.pnode_analytics.network.discovery;

import com.pnode.pnode_analytics.core.model.PNode;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
@AllArgsConstructor
public class DiscoveryResult {
    public static final String NO_SOURCE = "none";

    private final String source;
    private final List<PNode> nodes;

    public static DiscoveryResult empty() {
        return new DiscoveryResult(NO_SOURCE, Collections.emptyList());
    }
}
