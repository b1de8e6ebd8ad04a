package com.pnode.pnode_analytics.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeStatus {
    ONLINE("online"),
    OFFLINE("offline");

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
