package com.demo.thrift.model;

public enum GroupStatus {
    CREATED, ACTIVE, PAUSED, COMPLETED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
