package com.demo.thrift.service.dto;

/**
 * Contributed principal against what the escrow still holds for a group:
 * {@code contributed - returned - fees - penalties} must equal {@code principal + pending}.
 */
public record Reconciliation(
        long groupId,
        long totalContributed,
        long principalReturned,
        long feesPaid,
        long penaltiesForfeited,
        long principal,
        long pendingPayouts
) {
    public long discrepancy() {
        return (totalContributed - principalReturned - feesPaid - penaltiesForfeited) - (principal + pendingPayouts);
    }

    public boolean isBalanced() {
        return discrepancy() == 0;
    }
}
