package com.demo.thrift.model;

import java.time.Instant;

/** Rotational pot credited to {@code recipient}; {@code executed} once the recipient claimed it. */
public record Payout(
        long groupId,
        int cycle,
        String recipient,
        long amount,
        long fee,
        boolean executed,
        Instant createdAt,
        Instant executedAt
) {
    public Payout markExecuted(Instant at) {
        return new Payout(groupId, cycle, recipient, amount, fee, true, createdAt, at);
    }
}
