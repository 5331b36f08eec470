package com.demo.thrift.model;

public enum ClaimStatus {
    SUBMITTED, APPROVED, REJECTED, PAID;

    public boolean isTerminal() {
        return this == REJECTED || this == PAID;
    }
}
